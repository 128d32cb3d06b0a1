package com.gentoro.batchinfer.store;

import java.util.Collection;
import java.util.Set;

/**
 * Immutable snapshot of the job ids that already have a persisted result. Taken once before a run
 * starts and shared read-only by every worker.
 */
public final class CompletionSet {
  private static final CompletionSet EMPTY = new CompletionSet(Set.of());

  private final Set<String> ids;

  private CompletionSet(Set<String> ids) {
    this.ids = ids;
  }

  public static CompletionSet of(Collection<String> ids) {
    return ids == null || ids.isEmpty() ? EMPTY : new CompletionSet(Set.copyOf(ids));
  }

  public boolean contains(String id) {
    return id != null && ids.contains(id);
  }

  public int size() {
    return ids.size();
  }

  public boolean isEmpty() {
    return ids.isEmpty();
  }

  public Set<String> ids() {
    return ids;
  }

  @Override
  public String toString() {
    return "CompletionSet[" + ids.size() + " ids]";
  }
}
