package com.gentoro.batchinfer.store;

import com.gentoro.batchinfer.model.Result;
import java.util.Optional;

/** Durable, idempotent persistence of one {@link Result} per job id. */
public interface ResultStore {

  /**
   * Snapshot of the ids with a complete persisted result: those found when the store was opened
   * plus those written through this instance since. The returned set does not change afterwards.
   */
  CompletionSet completed();

  /** True iff a complete result exists for {@code id}. Answered from memory, not the disk. */
  boolean exists(String id);

  /**
   * Persist {@code result}. Readers never observe a partially written result; writing the same id
   * twice keeps the last write.
   *
   * @throws com.gentoro.batchinfer.exception.PersistenceException if the write fails
   */
  void put(Result result);

  Optional<Result> read(String id);
}
