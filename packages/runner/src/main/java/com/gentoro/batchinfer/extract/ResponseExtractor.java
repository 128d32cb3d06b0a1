package com.gentoro.batchinfer.extract;

import com.gentoro.batchinfer.model.ParsedAnswer;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls the labelled fields out of a free-text model response.
 *
 * <p>Each field is the first match over the whole text. Labels are case-sensitive and must start
 * a line (leading spaces or tabs allowed). Missing labels yield empty strings and a {@code null}
 * confidence, so {@link #extract(String)} never fails.
 */
public class ResponseExtractor {

  // Only '\n' ends a line; '\r', NEL and the Unicode separators stay part of the value.
  private static final int LINE_FLAGS = Pattern.MULTILINE | Pattern.UNIX_LINES;

  private static final Pattern EXPLANATION =
      Pattern.compile("^[ \\t]*Explanation:[ \\t]*(.*)$", LINE_FLAGS);

  private static final Pattern ANSWER =
      Pattern.compile("^[ \\t]*(?:Exact Answer|Answer):[ \\t]*(.*)$", LINE_FLAGS);

  private static final Pattern CONFIDENCE = Pattern.compile("Confidence:[ \\t]*(\\d+)%");

  public ParsedAnswer extract(String content) {
    if (content == null || content.isEmpty()) {
      return ParsedAnswer.EMPTY;
    }
    return new ParsedAnswer(
        firstGroup(EXPLANATION, content), firstGroup(ANSWER, content), confidence(content));
  }

  private static String firstGroup(Pattern pattern, String text) {
    Matcher m = pattern.matcher(text);
    return m.find() ? m.group(1).strip() : "";
  }

  private static Integer confidence(String text) {
    Matcher m = CONFIDENCE.matcher(text);
    if (!m.find()) {
      return null;
    }
    try {
      return Integer.valueOf(m.group(1));
    } catch (NumberFormatException e) {
      // More digits than an int holds; not a usable percentage.
      return null;
    }
  }
}
