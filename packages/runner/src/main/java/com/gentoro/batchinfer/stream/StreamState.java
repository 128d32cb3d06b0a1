package com.gentoro.batchinfer.stream;

/** Per-job accumulator for a streamed chat completion. Not thread-safe; one worker owns it. */
public final class StreamState {
  private final StringBuilder content = new StringBuilder();
  private final StringBuilder reasoning = new StringBuilder();
  private boolean done;
  private int chunks;
  private int malformedChunks;

  void appendContent(String delta) {
    content.append(delta);
  }

  void appendReasoning(String delta) {
    reasoning.append(delta);
  }

  void recordChunk() {
    chunks++;
  }

  void recordMalformedChunk() {
    malformedChunks++;
  }

  void markDone() {
    done = true;
  }

  public String content() {
    return content.toString();
  }

  public String reasoning() {
    return reasoning.toString();
  }

  public boolean isDone() {
    return done;
  }

  /** Number of successfully decoded chunks. */
  public int chunks() {
    return chunks;
  }

  public int malformedChunks() {
    return malformedChunks;
  }
}
