package com.gentoro.batchinfer.prompt;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.batchinfer.exception.ConfigException;
import com.gentoro.batchinfer.inference.InferenceClient.Message;
import com.gentoro.batchinfer.inference.InferenceClient.Role;
import com.gentoro.batchinfer.model.AnswerType;
import com.gentoro.batchinfer.model.Job;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class PromptBuilderTest {

  @Test
  @DisplayName("Exact-match jobs ask for an Exact Answer")
  void exactMatchTemplate() {
    List<Message> messages =
        new PromptBuilder().build(new Job("q", "What is {x}?", AnswerType.EXACT_MATCH));

    assertEquals(1, messages.size());
    assertEquals(Role.USER, messages.get(0).role());
    String prompt = messages.get(0).content();
    assertTrue(prompt.contains("Exact Answer: {your succinct, final answer}"));
    assertTrue(prompt.endsWith("Question:\nWhat is {x}?"), prompt);
  }

  @Test
  @DisplayName("Multiple-choice jobs ask for an Answer")
  void multipleChoiceTemplate() {
    String prompt =
        new PromptBuilder()
            .build(new Job("q", "Pick one: A or B", AnswerType.MULTIPLE_CHOICE))
            .get(0)
            .content();

    assertTrue(prompt.contains("Answer: {your chosen answer}"));
    assertFalse(prompt.contains("Exact Answer"));
    assertFalse(prompt.contains(PromptBuilder.QUESTION_PLACEHOLDER));
  }

  @Test
  @DisplayName("Templates without the question placeholder are rejected")
  void rejectsTemplateWithoutPlaceholder() {
    Map<AnswerType, String> templates =
        Map.of(AnswerType.EXACT_MATCH, "Q: {question}", AnswerType.MULTIPLE_CHOICE, "nothing");

    assertThrows(ConfigException.class, () -> new PromptBuilder(templates));
  }
}
