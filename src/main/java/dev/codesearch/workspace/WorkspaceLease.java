package dev.codesearch.workspace;

import dev.codesearch.index.IndexHandle;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.function.Function;
import org.jspecify.annotations.Nullable;
import org.slf4j.MDC;

/**
 * Scoped use of a workspace index. Obtained from {@link WorkspaceIndexCache#acquire(String)} and
 * meant for try-with-resources: {@link #close()} releases the handle exactly once.
 *
 * <p>While open, the MDC {@code workspace} key names this lease's workspace. Closing restores the
 * value it had when the lease was opened, so nested leases unwind correctly.
 */
public final class WorkspaceLease implements AutoCloseable {

  private final WorkspaceIndexCache cache;
  private final WorkspaceHandle handle;
  private final AtomicBoolean released = new AtomicBoolean();
  private final @Nullable String outerWorkspace;

  WorkspaceLease(WorkspaceIndexCache cache, WorkspaceHandle handle) {
    this.cache = cache;
    this.handle = handle;
    this.outerWorkspace = MDC.get(WorkspaceIndexCache.MDC_WORKSPACE);
    MDC.put(WorkspaceIndexCache.MDC_WORKSPACE, handle.identity().key());
  }

  public WorkspaceIdentity identity() {
    return handle.identity();
  }

  public WorkspaceHandle handle() {
    return handle;
  }

  /** Runs {@code action} against the index under the shared read lock. */
  public <T> T read(Function<? super IndexHandle, ? extends T> action) {
    return locked(handle.indexLock().readLock(), action);
  }

  /** Runs {@code action} against the index under the exclusive write lock. */
  public <T> T write(Function<? super IndexHandle, ? extends T> action) {
    return locked(handle.indexLock().writeLock(), action);
  }

  private <T> T locked(Lock lock, Function<? super IndexHandle, ? extends T> action) {
    if (released.get()) {
      throw new IllegalStateException("Lease on " + handle.identity() + " already released");
    }
    lock.lock();
    try {
      return action.apply(handle.requireIndex());
    } finally {
      lock.unlock();
    }
  }

  public boolean isReleased() {
    return released.get();
  }

  @Override
  public void close() {
    if (released.compareAndSet(false, true)) {
      try {
        cache.release(handle);
      } finally {
        if (outerWorkspace == null) {
          MDC.remove(WorkspaceIndexCache.MDC_WORKSPACE);
        } else {
          MDC.put(WorkspaceIndexCache.MDC_WORKSPACE, outerWorkspace);
        }
      }
    }
  }
}
