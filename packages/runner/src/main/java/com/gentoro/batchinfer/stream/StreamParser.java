package com.gentoro.batchinfer.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gentoro.batchinfer.exception.ChunkDecodeException;
import com.gentoro.batchinfer.utility.JacksonUtility;
import java.io.BufferedReader;
import java.io.IOException;
import org.slf4j.Logger;

/**
 * Rebuilds the content and reasoning text of a streamed chat completion from its newline-delimited
 * chunks.
 *
 * <p>Each line is either empty, the {@value #DONE_MARKER} terminator, or a JSON chunk optionally
 * framed with the server-sent-events {@value #DATA_PREFIX} prefix. Deltas are appended in arrival
 * order. A chunk that cannot be decoded is logged and dropped; it never aborts the stream.
 */
public class StreamParser {
  private static final Logger log =
      com.gentoro.batchinfer.logging.LoggingService.getLogger(StreamParser.class);

  public static final String DONE_MARKER = "[DONE]";
  public static final String DATA_PREFIX = "data:";

  private final ObjectMapper mapper;

  public StreamParser() {
    this(JacksonUtility.getJsonMapper());
  }

  public StreamParser(ObjectMapper mapper) {
    this.mapper = mapper;
  }

  /**
   * Consume lines until the terminator or end of input.
   *
   * @throws IOException if the underlying stream fails mid-read; the partial state is discarded
   */
  public StreamState consume(String jobId, BufferedReader lines) throws IOException {
    StreamState state = new StreamState();
    String line;
    while ((line = lines.readLine()) != null) {
      if (!accept(jobId, line, state)) {
        break;
      }
    }
    state.markDone();
    log.debug(
        "[{}] Stream complete: {} chunks, {} malformed, {} content chars, {} reasoning chars",
        jobId,
        state.chunks(),
        state.malformedChunks(),
        state.content().length(),
        state.reasoning().length());
    return state;
  }

  /**
   * Apply a single line to {@code state}.
   *
   * @return {@code false} once the terminator has been seen and no further lines should be read
   */
  public boolean accept(String jobId, String line, StreamState state) {
    if (line == null || line.isEmpty()) {
      return true;
    }
    if (DONE_MARKER.equals(line.strip())) {
      return false;
    }

    String payload = line;
    if (payload.startsWith(DATA_PREFIX)) {
      payload = payload.substring(DATA_PREFIX.length()).strip();
      if (DONE_MARKER.equals(payload)) {
        return false;
      }
    } else if (isSseControlLine(payload)) {
      return true;
    }
    if (payload.isBlank()) {
      return true;
    }

    try {
      apply(decode(jobId, payload), state);
    } catch (ChunkDecodeException e) {
      state.recordMalformedChunk();
      log.warn("[{}] Could not parse chunk: {}\nError: {}", jobId, payload, e.getMessage());
    }
    return true;
  }

  private JsonNode decode(String jobId, String payload) {
    JsonNode chunk;
    try {
      chunk = mapper.readTree(payload);
    } catch (JsonProcessingException e) {
      throw new ChunkDecodeException(
          "Malformed chunk for job " + jobId + ": " + e.getOriginalMessage(), e);
    }
    if (chunk == null || !chunk.isObject()) {
      throw new ChunkDecodeException("Chunk for job " + jobId + " is not a JSON object");
    }
    return chunk;
  }

  private static void apply(JsonNode chunk, StreamState state) {
    state.recordChunk();
    JsonNode choices = chunk.path("choices");
    if (!choices.isArray() || choices.isEmpty()) {
      return;
    }
    JsonNode delta = choices.get(0).path("delta");
    JsonNode content = delta.path("content");
    if (content.isTextual()) {
      state.appendContent(content.textValue());
    }
    JsonNode reasoning = delta.path("reasoning_content");
    if (reasoning.isTextual()) {
      state.appendReasoning(reasoning.textValue());
    }
  }

  // SSE comments and non-data fields carry no completion payload.
  private static boolean isSseControlLine(String line) {
    return line.startsWith(":")
        || line.startsWith("event:")
        || line.startsWith("id:")
        || line.startsWith("retry:");
  }
}
