package com.gentoro.batchinfer.store;

import static org.junit.jupiter.api.Assertions.*;

import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.batchinfer.exception.PersistenceException;
import com.gentoro.batchinfer.model.ParsedAnswer;
import com.gentoro.batchinfer.model.Result;
import com.gentoro.batchinfer.utility.JacksonUtility;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;
import java.util.stream.Stream;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileResultStoreTest {

  @TempDir Path temp;

  private static Result result(String id, String answer) {
    return new Result(
        id,
        "What is 2+2?",
        "thinking",
        "Explanation: arithmetic\nAnswer: " + answer,
        new ParsedAnswer("arithmetic", answer, 90));
  }

  @Test
  @DisplayName("A stored result reads back and is listed as completed")
  void putThenRead() {
    FileResultStore store = new FileResultStore(temp.resolve("results"));

    store.put(result("q1", "4"));

    Optional<Result> read = store.read("q1");
    assertTrue(read.isPresent());
    assertEquals(result("q1", "4"), read.get());
    assertTrue(store.exists("q1"));
    assertTrue(store.completed().contains("q1"));
    assertTrue(Files.isRegularFile(temp.resolve("results").resolve("q1.json")));
  }

  @Test
  @DisplayName("Results are written with snake_case field names")
  void persistedLayout() throws Exception {
    FileResultStore store = new FileResultStore(temp);
    store.put(result("q1", "4"));

    JsonNode json = JacksonUtility.getJsonMapper().readTree(temp.resolve("q1.json").toFile());
    assertEquals("q1", json.get("id").asText());
    assertEquals("What is 2+2?", json.get("question").asText());
    assertEquals("thinking", json.get("reasoning").asText());
    assertTrue(json.get("raw_response").asText().endsWith("Answer: 4"));
    assertEquals("4", json.get("parsed").get("answer").asText());
    assertEquals(90, json.get("parsed").get("confidence").asInt());
  }

  @Test
  @DisplayName("Writing the same id twice keeps the last write")
  void lastWriteWins() {
    FileResultStore store = new FileResultStore(temp);

    store.put(result("q1", "4"));
    store.put(result("q1", "5"));

    assertEquals("5", store.read("q1").orElseThrow().parsed().answer());
    assertEquals(1, store.completed().size());
  }

  @Test
  @DisplayName("Existing results are found when the store is reopened")
  void reopenSeesExistingResults() {
    new FileResultStore(temp).put(result("q1", "4"));

    FileResultStore reopened = new FileResultStore(temp);

    assertTrue(reopened.exists("q1"));
    assertFalse(reopened.exists("q2"));
    assertEquals(1, reopened.completed().size());
  }

  @Test
  @DisplayName("Leftover temp files neither count as results nor survive reopening")
  void staleTempFilesAreIgnored() throws Exception {
    Path stale = temp.resolve("q9.json.12345.tmp");
    Files.writeString(stale, "{\"id\":\"q9\",\"que");
    Files.writeString(temp.resolve("notes.txt"), "unrelated");

    FileResultStore store = new FileResultStore(temp);

    assertFalse(store.exists("q9"));
    assertTrue(store.completed().isEmpty());
    assertFalse(Files.exists(stale));
    assertTrue(Files.exists(temp.resolve("notes.txt")));
  }

  @Test
  @DisplayName("No temp files remain after a successful write")
  void noTempFilesAfterPut() throws Exception {
    FileResultStore store = new FileResultStore(temp);
    store.put(result("q1", "4"));

    try (Stream<Path> files = Files.list(temp)) {
      assertEquals(1, files.count());
    }
  }

  @Test
  @DisplayName("The completed snapshot includes ids written through the same store")
  void completedIncludesWrites() {
    FileResultStore store = new FileResultStore(temp);
    CompletionSet before = store.completed();

    store.put(result("q1", "4"));

    assertFalse(before.contains("q1"));
    assertTrue(store.completed().contains("q1"));
  }

  @Test
  @DisplayName("Ids that are not plain file names are rejected")
  void rejectsUnsafeIds() {
    FileResultStore store = new FileResultStore(temp);

    assertThrows(PersistenceException.class, () -> store.put(result("../escape", "x")));
    assertThrows(PersistenceException.class, () -> store.put(result("a/b", "x")));
    assertThrows(PersistenceException.class, () -> store.put(result("..", "x")));
    assertThrows(PersistenceException.class, () -> store.read(" "));
  }

  @Test
  @DisplayName("Reading an unknown id returns empty")
  void readMissing() {
    assertTrue(new FileResultStore(temp).read("nope").isEmpty());
  }

  @Test
  @DisplayName("A results path that is a file cannot be opened")
  void resultsPathIsAFile() throws Exception {
    Path file = Files.writeString(temp.resolve("occupied"), "x");

    assertThrows(PersistenceException.class, () -> new FileResultStore(file));
  }

  @Test
  @DisplayName("A missing confidence is stored as null and reads back as null")
  void missingConfidenceStoredAsNull() throws Exception {
    FileResultStore store = new FileResultStore(temp);
    store.put(new Result("q1", "Q", "", "no labels here", new ParsedAnswer("", "", null)));

    JsonNode json = JacksonUtility.getJsonMapper().readTree(temp.resolve("q1.json").toFile());
    assertTrue(json.get("parsed").has("confidence"));
    assertTrue(json.get("parsed").get("confidence").isNull());

    Result read = new FileResultStore(temp).read("q1").orElseThrow();
    assertNull(read.parsed().confidence());
    assertFalse(read.parsed().hasConfidence());
  }

  @Test
  @DisplayName("A confidence of zero reads back as zero")
  void zeroConfidenceRoundTrips() throws Exception {
    FileResultStore store = new FileResultStore(temp);
    store.put(new Result("q1", "Q", "", "Confidence: 0%", new ParsedAnswer("", "", 0)));

    JsonNode json = JacksonUtility.getJsonMapper().readTree(temp.resolve("q1.json").toFile());
    assertEquals(0, json.get("parsed").get("confidence").asInt());
    assertTrue(json.get("parsed").get("confidence").isInt());
    assertEquals(0, new FileResultStore(temp).read("q1").orElseThrow().parsed().confidence());
  }

  @Test
  @DisplayName("An interrupted rewrite leaves the previous result intact")
  void interruptedRewriteKeepsPriorResult() throws Exception {
    new FileResultStore(temp).put(result("q", "4"));
    Path stale = temp.resolve("q.json.98765.tmp");
    Files.writeString(stale, "{\"id\":\"q\",\"question\":\"What is");

    FileResultStore reopened = new FileResultStore(temp);

    assertTrue(reopened.exists("q"));
    assertEquals(result("q", "4"), reopened.read("q").orElseThrow());
    assertFalse(Files.exists(stale));
    assertEquals(1, reopened.completed().size());
  }
}
