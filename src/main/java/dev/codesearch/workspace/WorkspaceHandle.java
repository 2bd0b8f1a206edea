package dev.codesearch.workspace;

import dev.codesearch.index.IndexHandle;
import java.time.Instant;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.jspecify.annotations.Nullable;

/**
 * Table entry of the {@link WorkspaceIndexCache}: one open (or opening, or closing) index.
 *
 * <p>Reference count, state, stale flag and last access are guarded by {@link #lock} and only
 * mutated by the cache. {@link #indexLock} is held in read mode by queries and in write mode by
 * reindexing.
 */
public final class WorkspaceHandle {

  private final WorkspaceIdentity identity;
  private final long sequence;
  private final ReentrantReadWriteLock indexLock = new ReentrantReadWriteLock();

  final ReentrantLock lock = new ReentrantLock();
  final Condition settled = lock.newCondition();

  // guarded by lock
  HandleState state = HandleState.OPENING;
  int refCount;
  boolean stale;
  Instant lastAccess;
  boolean slotTransferred;
  @Nullable IndexHandle index;
  @Nullable Throwable openFailure;

  WorkspaceHandle(WorkspaceIdentity identity, long sequence, Instant createdAt) {
    this.identity = identity;
    this.sequence = sequence;
    this.lastAccess = createdAt;
  }

  public WorkspaceIdentity identity() {
    return identity;
  }

  /** Insertion order, the LRU tie-breaker. */
  public long sequence() {
    return sequence;
  }

  ReentrantReadWriteLock indexLock() {
    return indexLock;
  }

  IndexHandle requireIndex() {
    lock.lock();
    try {
      if (index == null || state == HandleState.CLOSED) {
        throw new IllegalStateException("Index of " + identity + " is not open");
      }
      return index;
    } finally {
      lock.unlock();
    }
  }

  /** Whether the entry may be closed right now: ready and unused. */
  boolean isEvictable() {
    return state == HandleState.READY && refCount == 0;
  }

  HandleSnapshot snapshot() {
    lock.lock();
    try {
      return new HandleSnapshot(
          identity.root().toString(), identity.key(), state, refCount, stale, lastAccess);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public String toString() {
    return "WorkspaceHandle[" + identity + ", seq=" + sequence + "]";
  }
}
