package com.gentoro.batchinfer.prompt;

import com.gentoro.batchinfer.exception.ConfigException;
import com.gentoro.batchinfer.inference.InferenceClient.Message;
import com.gentoro.batchinfer.model.AnswerType;
import com.gentoro.batchinfer.model.Job;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a {@link Job} into the chat messages sent to the model. Templates are loaded once from
 * {@code prompts/<answer-type>.txt} on the classpath; {@value #QUESTION_PLACEHOLDER} is replaced
 * with the question text.
 */
public class PromptBuilder {
  public static final String QUESTION_PLACEHOLDER = "{question}";

  private final Map<AnswerType, String> templates;

  public PromptBuilder() {
    this(loadDefaults());
  }

  public PromptBuilder(Map<AnswerType, String> templates) {
    for (AnswerType type : AnswerType.values()) {
      String template = templates.get(type);
      if (template == null || !template.contains(QUESTION_PLACEHOLDER)) {
        throw new ConfigException(
            "Prompt template for " + type + " lacks the " + QUESTION_PLACEHOLDER + " placeholder");
      }
    }
    this.templates = new EnumMap<>(templates);
  }

  public List<Message> build(Job job) {
    String prompt = templates.get(job.answerType()).replace(QUESTION_PLACEHOLDER, job.question());
    return List.of(Message.user(prompt));
  }

  private static Map<AnswerType, String> loadDefaults() {
    Map<AnswerType, String> templates = new EnumMap<>(AnswerType.class);
    templates.put(AnswerType.EXACT_MATCH, load("prompts/exact_match.txt"));
    templates.put(AnswerType.MULTIPLE_CHOICE, load("prompts/multiple_choice.txt"));
    return templates;
  }

  private static String load(String resource) {
    try (InputStream in = PromptBuilder.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new ConfigException("Prompt template not found on classpath: " + resource);
      }
      return new String(in.readAllBytes(), StandardCharsets.UTF_8).stripTrailing();
    } catch (IOException e) {
      throw new ConfigException("Could not read prompt template " + resource, e);
    }
  }
}
