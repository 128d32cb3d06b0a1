package com.gentoro.batchinfer.stream;

import static org.junit.jupiter.api.Assertions.*;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class StreamParserTest {

  private final StreamParser parser = new StreamParser();

  private static String content(String text) {
    return "data: {\"choices\":[{\"delta\":{\"content\":\"" + text + "\"}}]}";
  }

  private static String reasoning(String text) {
    return "data: {\"choices\":[{\"delta\":{\"reasoning_content\":\"" + text + "\"}}]}";
  }

  private StreamState parse(String... lines) throws IOException {
    return parser.consume("job", new BufferedReader(new StringReader(String.join("\n", lines))));
  }

  @Test
  @DisplayName("Content and reasoning deltas are concatenated in arrival order")
  void concatenatesDeltasInOrder() throws Exception {
    StreamState state =
        parse(
            reasoning("Let me "),
            content("Expl"),
            reasoning("think."),
            content("anation: x"),
            "data: [DONE]");

    assertEquals("Explanation: x", state.content());
    assertEquals("Let me think.", state.reasoning());
    assertEquals(4, state.chunks());
    assertTrue(state.isDone());
  }

  @Test
  @DisplayName("A malformed line yields the same state as the stream without it")
  void malformedLineIsDropped() throws Exception {
    StreamState withGarbage = parse(content("a"), "data: {not json", content("b"), "[DONE]");
    StreamState clean = parse(content("a"), content("b"), "[DONE]");

    assertEquals(clean.content(), withGarbage.content());
    assertEquals(clean.reasoning(), withGarbage.reasoning());
    assertEquals(1, withGarbage.malformedChunks());
    assertEquals(0, clean.malformedChunks());
  }

  @Test
  @DisplayName("JSON that is not an object counts as malformed")
  void nonObjectChunkIsMalformed() throws Exception {
    StreamState state = parse("data: [1, 2]", "data: \"text\"", content("ok"));

    assertEquals("ok", state.content());
    assertEquals(2, state.malformedChunks());
  }

  @Test
  @DisplayName("Lines after the terminator are never read")
  void stopsAtDone() throws Exception {
    List<String> read = new ArrayList<>();
    String body = String.join("\n", content("a"), "data: [DONE]", content("b"), content("c"));
    BufferedReader reader =
        new BufferedReader(new StringReader(body)) {
          @Override
          public String readLine() throws IOException {
            String line = super.readLine();
            if (line != null) read.add(line);
            return line;
          }
        };

    StreamState state = parser.consume("job", reader);

    assertEquals("a", state.content());
    assertEquals(2, read.size());
  }

  @Test
  @DisplayName("A bare [DONE] line also terminates the stream")
  void bareDoneTerminates() throws Exception {
    StreamState state = parse(content("a"), "[DONE]", content("b"));
    assertEquals("a", state.content());
  }

  @Test
  @DisplayName("End of input without a terminator completes the stream")
  void endOfInputCompletes() throws Exception {
    StreamState state = parse(content("a"), content("b"));

    assertEquals("ab", state.content());
    assertTrue(state.isDone());
  }

  @Test
  @DisplayName("Chunks without the data: prefix are accepted")
  void acceptsUnprefixedChunks() throws Exception {
    StreamState state =
        parse("{\"choices\":[{\"delta\":{\"content\":\"plain\"}}]}", "", content(" sse"));

    assertEquals("plain sse", state.content());
  }

  @Test
  @DisplayName("Role-only, empty-choice and finish chunks change nothing")
  void noOpChunks() throws Exception {
    StreamState state =
        parse(
            "data: {\"choices\":[{\"delta\":{\"role\":\"assistant\"}}]}",
            "data: {\"choices\":[]}",
            "data: {\"choices\":[{\"delta\":{\"content\":null},\"finish_reason\":\"stop\"}]}",
            "data: {\"usage\":{\"total_tokens\":12}}",
            content("x"));

    assertEquals("x", state.content());
    assertEquals("", state.reasoning());
    assertEquals(0, state.malformedChunks());
    assertEquals(5, state.chunks());
  }

  @Test
  @DisplayName("SSE comments and non-data fields are ignored")
  void ignoresSseControlLines() throws Exception {
    StreamState state =
        parse(": keep-alive", "event: message", "id: 7", "retry: 1000", content("x"), "data:");

    assertEquals("x", state.content());
    assertEquals(0, state.malformedChunks());
  }

  @Test
  @DisplayName("A failing reader propagates its IOException")
  void propagatesReadFailure() {
    Reader failing =
        new Reader() {
          private boolean first = true;

          @Override
          public int read(char[] buf, int off, int len) throws IOException {
            if (first) {
              first = false;
              String line = content("a") + "\n";
              line.getChars(0, line.length(), buf, off);
              return line.length();
            }
            throw new IOException("connection reset");
          }

          @Override
          public void close() {}
        };

    IOException e =
        assertThrows(IOException.class, () -> parser.consume("job", new BufferedReader(failing)));
    assertEquals("connection reset", e.getMessage());
  }
}
