package com.gentoro.batchinfer.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.gentoro.batchinfer.exception.PersistenceException;
import com.gentoro.batchinfer.model.Result;
import com.gentoro.batchinfer.utility.JacksonUtility;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;

/**
 * {@link ResultStore} keeping one pretty-printed JSON file per job, named {@code <id>.json}.
 *
 * <p>Writes go to a uniquely named temp file in the same directory, are forced to disk and then
 * renamed over the target with {@link StandardCopyOption#ATOMIC_MOVE}. Only names ending in {@value
 * #RESULT_SUFFIX} count as results, so an interrupted write never shows up as a completed job.
 * Temp files left behind by a crash are removed when the store is opened.
 */
public class FileResultStore implements ResultStore {
  private static final Logger log =
      com.gentoro.batchinfer.logging.LoggingService.getLogger(FileResultStore.class);

  static final String RESULT_SUFFIX = ".json";
  static final String TEMP_SUFFIX = ".tmp";

  private final Path directory;
  private final ObjectMapper mapper;
  private final ObjectWriter writer;
  private final CompletionSet snapshot;
  private final Set<String> written = ConcurrentHashMap.newKeySet();

  public FileResultStore(Path directory) {
    this(directory, JacksonUtility.getJsonMapper());
  }

  public FileResultStore(Path directory, ObjectMapper mapper) {
    this.directory = directory.toAbsolutePath().normalize();
    this.mapper = mapper;
    this.writer = mapper.writerWithDefaultPrettyPrinter();
    try {
      Files.createDirectories(this.directory);
    } catch (IOException e) {
      throw new PersistenceException("Could not create results directory " + this.directory, e);
    }
    purgeStaleTempFiles();
    this.snapshot = scan();
    log.info("Result store at {} holds {} completed results", this.directory, snapshot.size());
  }

  @Override
  public CompletionSet completed() {
    if (written.isEmpty()) {
      return snapshot;
    }
    Set<String> ids = new HashSet<>(snapshot.ids());
    ids.addAll(written);
    return CompletionSet.of(ids);
  }

  @Override
  public boolean exists(String id) {
    return snapshot.contains(id) || (id != null && written.contains(id));
  }

  @Override
  public void put(Result result) {
    Path target = resolve(result.id());
    byte[] bytes;
    try {
      bytes = writer.writeValueAsBytes(result);
    } catch (IOException e) {
      throw new PersistenceException("Could not serialize result for " + result.id(), e);
    }

    Path temp = null;
    try {
      temp = Files.createTempFile(directory, result.id() + RESULT_SUFFIX + ".", TEMP_SUFFIX);
      try (FileChannel channel =
          FileChannel.open(temp, StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
        ByteBuffer buffer = ByteBuffer.wrap(bytes);
        while (buffer.hasRemaining()) {
          channel.write(buffer);
        }
        channel.force(true);
      }
      moveIntoPlace(temp, target);
      temp = null;
      written.add(result.id());
      log.debug("Persisted result {} ({} bytes)", result.id(), bytes.length);
    } catch (IOException e) {
      throw new PersistenceException("Could not persist result for " + result.id(), e);
    } finally {
      if (temp != null) {
        deleteTemp(temp);
      }
    }
  }

  @Override
  public Optional<Result> read(String id) {
    Path file = resolve(id);
    if (!Files.isRegularFile(file)) {
      return Optional.empty();
    }
    try {
      return Optional.of(mapper.readValue(file.toFile(), Result.class));
    } catch (IOException e) {
      throw new PersistenceException("Could not read result " + file, e);
    }
  }

  private static void moveIntoPlace(Path temp, Path target) throws IOException {
    try {
      Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException e) {
      log.debug("Atomic move not supported for {}, falling back to replace", target);
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private Path resolve(String id) {
    if (id == null
        || id.isBlank()
        || id.equals(".")
        || id.equals("..")
        || id.indexOf('/') >= 0
        || id.indexOf('\\') >= 0
        || id.indexOf('\0') >= 0) {
      throw new PersistenceException("Job id cannot be used as a file name: '" + id + "'");
    }
    Path file = directory.resolve(id + RESULT_SUFFIX).normalize();
    if (!directory.equals(file.getParent())) {
      throw new PersistenceException("Job id escapes the results directory: '" + id + "'");
    }
    return file;
  }

  private CompletionSet scan() {
    Set<String> ids = new HashSet<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory, "*" + RESULT_SUFFIX)) {
      for (Path file : stream) {
        if (Files.isRegularFile(file)) {
          String name = file.getFileName().toString();
          ids.add(name.substring(0, name.length() - RESULT_SUFFIX.length()));
        }
      }
    } catch (IOException e) {
      throw new PersistenceException("Could not list results directory " + directory, e);
    }
    return CompletionSet.of(ids);
  }

  private void purgeStaleTempFiles() {
    int purged = 0;
    try (DirectoryStream<Path> stream =
        Files.newDirectoryStream(directory, "*" + RESULT_SUFFIX + ".*" + TEMP_SUFFIX)) {
      for (Path file : stream) {
        Files.deleteIfExists(file);
        purged++;
      }
    } catch (IOException e) {
      throw new PersistenceException("Could not clean results directory " + directory, e);
    }
    if (purged > 0) {
      log.info("Removed {} incomplete result file(s) from {}", purged, directory);
    }
  }

  private static void deleteTemp(Path temp) {
    try {
      Files.deleteIfExists(temp);
    } catch (IOException e) {
      log.warn("Could not delete temp file {}: {}", temp, e.getMessage());
    }
  }
}
