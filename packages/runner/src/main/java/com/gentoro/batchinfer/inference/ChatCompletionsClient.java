package com.gentoro.batchinfer.inference;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.gentoro.batchinfer.exception.TransportException;
import com.gentoro.batchinfer.stream.StreamParser;
import com.gentoro.batchinfer.stream.StreamState;
import com.gentoro.batchinfer.utility.JacksonUtility;
import java.io.BufferedReader;
import java.io.IOException;
import java.util.List;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.slf4j.Logger;

/**
 * {@link InferenceClient} for OpenAI-compatible servers such as vLLM. Posts to {@code
 * <base-url>/chat/completions} with {@code stream: true} and feeds the response body line by line
 * into a {@link StreamParser}.
 */
public class ChatCompletionsClient implements InferenceClient {
  private static final Logger log =
      com.gentoro.batchinfer.logging.LoggingService.getLogger(ChatCompletionsClient.class);

  private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
  private static final int MAX_ERROR_BODY = 1_000;

  private final OkHttpClient httpClient;
  private final HttpUrl endpoint;
  private final String model;
  private final double temperature;
  private final String apiKey;
  private final StreamParser parser;
  private final ObjectMapper mapper = JacksonUtility.getJsonMapper();

  public ChatCompletionsClient(
      OkHttpClient httpClient,
      HttpUrl baseUrl,
      String model,
      double temperature,
      String apiKey,
      StreamParser parser) {
    this.httpClient = httpClient;
    this.endpoint = baseUrl.newBuilder().addPathSegments("chat/completions").build();
    this.model = model;
    this.temperature = temperature;
    this.apiKey = apiKey;
    this.parser = parser;
  }

  public HttpUrl endpoint() {
    return endpoint;
  }

  @Override
  public StreamState streamChat(String jobId, List<Message> messages) {
    Request.Builder builder =
        new Request.Builder()
            .url(endpoint)
            .header("Accept", "text/event-stream")
            .post(RequestBody.create(payload(messages), JSON));
    if (apiKey != null && !apiKey.isBlank()) {
      builder.header("Authorization", "Bearer " + apiKey);
    }

    try (Response response = httpClient.newCall(builder.build()).execute()) {
      if (!response.isSuccessful()) {
        throw new TransportException(
            "HTTP %d from %s for job %s: %s"
                .formatted(response.code(), endpoint, jobId, errorSnippet(response)));
      }
      ResponseBody body = response.body();
      if (body == null) {
        throw new TransportException("Empty response body from " + endpoint + " for job " + jobId);
      }
      try (BufferedReader reader = new BufferedReader(body.charStream())) {
        return parser.consume(jobId, reader);
      }
    } catch (IOException e) {
      throw new TransportException(
          "Streaming request to " + endpoint + " failed for job " + jobId, e);
    }
  }

  byte[] payload(List<Message> messages) {
    ObjectNode root = mapper.createObjectNode();
    root.put("model", model);
    ArrayNode array = root.putArray("messages");
    for (Message message : messages) {
      array.addObject().put("role", message.role().wireName()).put("content", message.content());
    }
    root.put("temperature", temperature);
    root.put("stream", true);
    try {
      return mapper.writeValueAsBytes(root);
    } catch (IOException e) {
      throw new TransportException("Could not encode chat request", e);
    }
  }

  private static String errorSnippet(Response response) {
    try {
      String text = response.peekBody(MAX_ERROR_BODY).string().strip();
      return text.isEmpty() ? response.message() : text;
    } catch (IOException e) {
      log.debug("Could not read error body", e);
      return response.message();
    }
  }
}
