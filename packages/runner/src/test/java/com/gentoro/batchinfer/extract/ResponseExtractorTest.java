package com.gentoro.batchinfer.extract;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.batchinfer.model.ParsedAnswer;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class ResponseExtractorTest {

  private final ResponseExtractor extractor = new ResponseExtractor();

  @Test
  @DisplayName("Extracts explanation, answer and confidence")
  void extractsAllFields() {
    ParsedAnswer parsed = extractor.extract("Explanation: x\nAnswer: y\nConfidence: 42%");

    assertEquals("x", parsed.explanation());
    assertEquals("y", parsed.answer());
    assertEquals(42, parsed.confidence());
  }

  @Test
  @DisplayName("Empty and null text yield empty fields")
  void emptyInput() {
    assertEquals(ParsedAnswer.EMPTY, extractor.extract(""));
    assertEquals(ParsedAnswer.EMPTY, extractor.extract(null));
    assertFalse(extractor.extract("").hasConfidence());
  }

  @Test
  @DisplayName("Exact Answer label is recognised")
  void exactAnswerLabel() {
    ParsedAnswer parsed =
        extractor.extract(
            "Explanation: The count follows from CRT.\nExact Answer: 100\nConfidence: 85%");

    assertEquals("The count follows from CRT.", parsed.explanation());
    assertEquals("100", parsed.answer());
    assertEquals(85, parsed.confidence());
  }

  @Test
  @DisplayName("Confidence of zero is distinct from a missing confidence")
  void zeroConfidenceIsNotMissing() {
    ParsedAnswer zero = extractor.extract("Answer: B\nConfidence: 0%");
    ParsedAnswer missing = extractor.extract("Answer: B\nConfidence: high");

    assertEquals(0, zero.confidence());
    assertTrue(zero.hasConfidence());
    assertNull(missing.confidence());
    assertFalse(missing.hasConfidence());
  }

  @Test
  @DisplayName("Missing labels yield empty strings, never an error")
  void missingLabels() {
    ParsedAnswer parsed = extractor.extract("I am not sure what the answer is.");

    assertEquals("", parsed.explanation());
    assertEquals("", parsed.answer());
    assertNull(parsed.confidence());
  }

  @Test
  @DisplayName("First occurrence wins and surrounding whitespace is stripped")
  void firstMatchStripped() {
    ParsedAnswer parsed =
        extractor.extract(
            "  Explanation:   first  \nAnswer: A \nExplanation: second\nAnswer: C\n"
                + "Confidence: 70%\nConfidence: 10%");

    assertEquals("first", parsed.explanation());
    assertEquals("A", parsed.answer());
    assertEquals(70, parsed.confidence());
  }

  @Test
  @DisplayName("Labels must start a line")
  void labelsAreLineAnchored() {
    ParsedAnswer parsed = extractor.extract("The Final Answer: 3 is wrong\nAnswer: 4");

    assertEquals("4", parsed.answer());
  }

  @Test
  @DisplayName("Values stop at the end of their line")
  void valueEndsAtLineBreak() {
    ParsedAnswer parsed = extractor.extract("Explanation: line one\nline two\nAnswer: D");

    assertEquals("line one", parsed.explanation());
    assertEquals("D", parsed.answer());
  }

  @Test
  @DisplayName("A confidence too large for an int is treated as missing")
  void overflowingConfidence() {
    assertNull(extractor.extract("Confidence: 99999999999999%").confidence());
  }

  @Test
  @DisplayName("A carriage return inside a value does not end it")
  void innerCarriageReturnKept() {
    ParsedAnswer parsed = extractor.extract("Explanation: a\rb\nAnswer: x\r\nConfidence: 5%");

    assertEquals("a\rb", parsed.explanation());
    assertEquals("x", parsed.answer());
    assertEquals(5, parsed.confidence());
  }

  @Test
  @DisplayName("Unicode line separators inside a value do not end it")
  void unicodeSeparatorsKept() {
    ParsedAnswer parsed =
        extractor.extract("Answer: x y\u0085z\nExplanation: p\u2028q\u2029r\nConfidence: 1%");

    assertEquals("x y\u0085z", parsed.answer());
    assertEquals("p\u2028q\u2029r", parsed.explanation());
  }

  @Test
  @DisplayName("A label after a carriage return alone does not start a line")
  void labelAfterBareCarriageReturn() {
    ParsedAnswer parsed = extractor.extract("Note: see below\rAnswer: 7\nAnswer: 8");

    assertEquals("8", parsed.answer());
  }
}
