package dev.codesearch.workspace;

import dev.codesearch.index.IndexCapability;
import dev.codesearch.index.IndexHandle;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Bounded, reference-counted pool of open workspace indexes.
 *
 * <p>Each workspace has at most one {@link WorkspaceHandle} in the table at a time. A handle is
 * shared by every concurrent lease on its workspace and is closed only once its reference count
 * is zero: on LRU eviction when a slot is needed, by the idle sweep, on {@link #evict(String)}, or
 * at shutdown (where a bounded drain precedes a force-close).
 *
 * <h2>Locking</h2>
 *
 * <ul>
 *   <li>{@code poolLock} guards slot accounting, table insertion and removal, and the FIFO queue of
 *       acquirers waiting for a slot. It is never held during index I/O.
 *   <li>Each handle's own lock guards its reference count and state.
 *   <li>Lock order is always pool lock, then handle lock.
 * </ul>
 *
 * <p>An eviction victim is re-checked under its own lock and moved to {@link HandleState#CLOSING}
 * before its slot is handed over. It stays in the table until its close completes, so an acquirer
 * for the same workspace waits instead of opening a second physical index.
 */
@Component
public class WorkspaceIndexCache {

  private static final Logger log = LoggerFactory.getLogger(WorkspaceIndexCache.class);

  /** MDC key carrying the workspace hash while a lease is held. */
  public static final String MDC_WORKSPACE = "workspace";

  private final IndexCapability indexCapability;
  private final WorkspaceProperties properties;
  private final Clock clock;

  private final ConcurrentHashMap<String, WorkspaceHandle> handles = new ConcurrentHashMap<>();
  private final AtomicLong sequence = new AtomicLong();

  private final ReentrantLock poolLock = new ReentrantLock();
  private final Condition poolChanged = poolLock.newCondition();
  // guarded by poolLock
  private final Deque<Object> slotQueue = new ArrayDeque<>();
  private int occupiedSlots;

  private volatile boolean shuttingDown;
  private final ScheduledExecutorService sweeper;
  private final AtomicReference<ScheduledFuture<?>> sweepFuture = new AtomicReference<>();

  public WorkspaceIndexCache(
      IndexCapability indexCapability, WorkspaceProperties properties, Clock clock) {
    this.indexCapability = indexCapability;
    this.properties = properties;
    this.clock = clock;
    this.sweeper =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "codesearch-workspace-sweep");
              t.setDaemon(true);
              return t;
            });
  }

  /** Starts the periodic idle sweep. */
  @PostConstruct
  public void startSweeper() {
    long intervalMs = properties.sweepInterval().toMillis();
    sweepFuture.set(
        sweeper.scheduleWithFixedDelay(
            this::sweepQuietly, intervalMs, intervalMs, TimeUnit.MILLISECONDS));
    log.info(
        "Workspace cache started (capacity={}, idle-timeout={}, sweep-interval={})",
        properties.maxResidentHandles(),
        properties.idleTimeout(),
        properties.sweepInterval());
  }

  /**
   * Acquires the index of a workspace, opening it if it is not resident.
   *
   * @param workspacePath path of the workspace directory, in any spelling
   * @return a lease to close when done
   * @throws CapacityExceededException if no slot frees up within {@code acquire-timeout}, or the
   *     calling thread is interrupted while waiting
   * @throws IndexOpenException if the index cannot be opened
   * @throws WorkspaceException if the path is not a directory or the cache is shutting down
   */
  public WorkspaceLease acquire(String workspacePath) {
    WorkspaceIdentity identity = WorkspaceIdentity.of(workspacePath);
    long deadline = System.nanoTime() + properties.acquireTimeout().toNanos();

    while (true) {
      checkAcceptingAcquires();
      WorkspaceHandle existing = handles.get(identity.key());
      if (existing != null) {
        WorkspaceLease lease = tryRetain(existing, deadline);
        if (lease != null) {
          return lease;
        }
        continue;
      }

      Reservation reservation = reserveSlot(identity, deadline);
      if (reservation == null) {
        // the workspace became resident while waiting
        continue;
      }
      return open(reservation);
    }
  }

  /**
   * Releases one reference on a handle. Normally invoked through {@link WorkspaceLease#close()}.
   *
   * @throws IllegalStateException if the handle has no outstanding reference
   */
  public void release(WorkspaceHandle handle) {
    boolean closeNow = false;
    boolean unused;
    handle.lock.lock();
    try {
      if (handle.refCount <= 0) {
        throw new IllegalStateException("Handle released more often than acquired: " + handle);
      }
      handle.refCount--;
      handle.lastAccess = clock.instant();
      unused = handle.refCount == 0;
      if (unused && handle.stale && handle.state == HandleState.READY) {
        handle.state = HandleState.CLOSING;
        closeNow = true;
      }
    } finally {
      handle.lock.unlock();
    }

    if (closeNow) {
      log.info("Closing stale workspace {} after its last release", handle.identity());
      closeAndRemove(handle);
    } else if (unused) {
      signalPool();
    }
  }

  /**
   * Marks a workspace stale: its handle is closed now if unused, otherwise on its last release.
   *
   * @return {@code true} if the workspace was resident
   */
  public boolean evict(String workspacePath) {
    WorkspaceIdentity identity = WorkspaceIdentity.of(workspacePath);
    WorkspaceHandle handle = handles.get(identity.key());
    if (handle == null) {
      return false;
    }
    boolean closeNow = false;
    handle.lock.lock();
    try {
      if (handle.state == HandleState.CLOSING || handle.state == HandleState.CLOSED) {
        return true;
      }
      handle.stale = true;
      if (handle.isEvictable()) {
        handle.state = HandleState.CLOSING;
        closeNow = true;
      }
    } finally {
      handle.lock.unlock();
    }
    if (closeNow) {
      log.info("Evicting workspace {}", identity);
      closeAndRemove(handle);
    } else {
      log.info("Workspace {} marked stale, closing after active leases end", identity);
    }
    return true;
  }

  /**
   * Closes every unused handle idle for longer than {@code idle-timeout}.
   *
   * @return number of handles closed
   */
  public int sweepIdle() {
    Instant cutoff = clock.instant().minus(properties.idleTimeout());
    List<WorkspaceHandle> idle = new ArrayList<>();
    for (WorkspaceHandle handle : handles.values()) {
      handle.lock.lock();
      try {
        if (handle.isEvictable() && !handle.lastAccess.isAfter(cutoff)) {
          handle.state = HandleState.CLOSING;
          idle.add(handle);
        }
      } finally {
        handle.lock.unlock();
      }
    }
    for (WorkspaceHandle handle : idle) {
      closeAndRemove(handle);
    }
    if (!idle.isEmpty()) {
      log.info("Idle sweep closed {} workspace index(es)", idle.size());
    }
    return idle.size();
  }

  /** Resident handles in insertion order. */
  public List<HandleSnapshot> snapshot() {
    return handles.values().stream()
        .sorted(Comparator.comparingLong(WorkspaceHandle::sequence))
        .map(WorkspaceHandle::snapshot)
        .toList();
  }

  /** Number of occupied slots, including handles being opened. */
  public int residentCount() {
    poolLock.lock();
    try {
      return occupiedSlots;
    } finally {
      poolLock.unlock();
    }
  }

  public int capacity() {
    return properties.maxResidentHandles();
  }

  /**
   * Stops the sweep, rejects new acquisitions, closes unused handles, waits up to {@code
   * drain-timeout} for active leases and then force-closes whatever is left.
   */
  @PreDestroy
  public void shutdown() {
    if (shuttingDown) {
      return;
    }
    shuttingDown = true;
    ScheduledFuture<?> future = sweepFuture.getAndSet(null);
    if (future != null) {
      future.cancel(false);
    }
    sweeper.shutdownNow();
    signalPool();

    List<WorkspaceHandle> unused = new ArrayList<>();
    for (WorkspaceHandle handle : handles.values()) {
      handle.lock.lock();
      try {
        handle.stale = true;
        if (handle.isEvictable()) {
          handle.state = HandleState.CLOSING;
          unused.add(handle);
        }
      } finally {
        handle.lock.unlock();
      }
    }
    for (WorkspaceHandle handle : unused) {
      closeAndRemove(handle);
    }

    awaitDrain(properties.drainTimeout());

    for (WorkspaceHandle handle : handles.values()) {
      int activeLeases;
      handle.lock.lock();
      try {
        if (handle.state != HandleState.READY) {
          continue;
        }
        handle.state = HandleState.CLOSING;
        activeLeases = handle.refCount;
      } finally {
        handle.lock.unlock();
      }
      log.warn(
          "Force-closing workspace {} with {} active lease(s) after drain timeout",
          handle.identity(),
          activeLeases);
      closeAndRemove(handle);
    }
    log.info("Workspace cache shut down");
  }

  // ---------------------------------------------------------------------------
  // Acquire internals

  private record Reservation(WorkspaceHandle handle, @Nullable WorkspaceHandle victim) {}

  /**
   * Takes a reference on a resident handle, or waits for it to settle.
   *
   * @return a lease, or {@code null} if the caller should look the workspace up again
   */
  private @Nullable WorkspaceLease tryRetain(WorkspaceHandle handle, long deadline) {
    handle.lock.lock();
    try {
      boolean waited = false;
      while (true) {
        if (handle.state == HandleState.READY && !handle.stale) {
          handle.refCount++;
          handle.lastAccess = clock.instant();
          return newLease(handle);
        }
        if (handle.state == HandleState.CLOSED) {
          if (waited && handle.openFailure != null) {
            throw new IndexOpenException(
                handle.identity().root().toString(), handle.openFailure);
          }
          return null;
        }
        checkAcceptingAcquires();
        // opening, closing, or stale and waiting for its last release
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          throw new CapacityExceededException(
              handle.identity().root().toString(), properties.acquireTimeout());
        }
        try {
          handle.settled.awaitNanos(remaining);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new CapacityExceededException(handle.identity().root().toString(), e);
        }
        waited = true;
      }
    } finally {
      handle.lock.unlock();
    }
  }

  /**
   * Waits in FIFO order for a free slot or an evictable victim and inserts an opening handle.
   *
   * @return the reservation, or {@code null} if the workspace became resident meanwhile
   */
  private @Nullable Reservation reserveSlot(WorkspaceIdentity identity, long deadline) {
    Object ticket = new Object();
    poolLock.lock();
    try {
      slotQueue.addLast(ticket);
      while (true) {
        checkAcceptingAcquires();
        if (handles.containsKey(identity.key())) {
          return null;
        }
        if (slotQueue.peekFirst() == ticket) {
          if (occupiedSlots < properties.maxResidentHandles()) {
            occupiedSlots++;
            return new Reservation(insertOpening(identity), null);
          }
          WorkspaceHandle victim = claimVictim();
          if (victim != null) {
            return new Reservation(insertOpening(identity), victim);
          }
        }
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          log.warn(
              "No index slot for {} within {} ({} of {} in use)",
              identity,
              properties.acquireTimeout(),
              occupiedSlots,
              properties.maxResidentHandles());
          throw new CapacityExceededException(
              identity.root().toString(), properties.acquireTimeout());
        }
        try {
          poolChanged.awaitNanos(remaining);
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
          throw new CapacityExceededException(identity.root().toString(), e);
        }
      }
    } finally {
      slotQueue.remove(ticket);
      poolChanged.signalAll();
      poolLock.unlock();
    }
  }

  // caller holds poolLock
  private WorkspaceHandle insertOpening(WorkspaceIdentity identity) {
    WorkspaceHandle handle =
        new WorkspaceHandle(identity, sequence.incrementAndGet(), clock.instant());
    handles.put(identity.key(), handle);
    return handle;
  }

  /**
   * Picks the least recently used unused handle and moves it to CLOSING. Its slot passes to the
   * caller. Caller holds poolLock.
   */
  private @Nullable WorkspaceHandle claimVictim() {
    while (true) {
      WorkspaceHandle candidate = null;
      Instant candidateAccess = null;
      for (WorkspaceHandle handle : handles.values()) {
        Instant lastAccess;
        handle.lock.lock();
        try {
          if (!handle.isEvictable()) {
            continue;
          }
          lastAccess = handle.lastAccess;
        } finally {
          handle.lock.unlock();
        }
        if (candidate == null
            || lastAccess.isBefore(candidateAccess)
            || (lastAccess.equals(candidateAccess) && handle.sequence() < candidate.sequence())) {
          candidate = handle;
          candidateAccess = lastAccess;
        }
      }
      if (candidate == null) {
        return null;
      }
      candidate.lock.lock();
      try {
        if (candidate.isEvictable()) {
          candidate.state = HandleState.CLOSING;
          candidate.slotTransferred = true;
          return candidate;
        }
      } finally {
        candidate.lock.unlock();
      }
      // retained between scan and claim, look again
    }
  }

  private WorkspaceLease open(Reservation reservation) {
    WorkspaceHandle handle = reservation.handle();
    WorkspaceIdentity identity = handle.identity();
    if (reservation.victim() != null) {
      log.info(
          "Evicting least recently used workspace {} for {}",
          reservation.victim().identity(),
          identity);
      closeAndRemove(reservation.victim());
    }

    IndexHandle index;
    try {
      index = indexCapability.openOrCreate(identity.root(), identity.key());
    } catch (IOException | RuntimeException e) {
      log.warn("Failed to open index for {}: {}", identity, e.getMessage());
      failOpening(handle, e);
      throw new IndexOpenException(identity.root().toString(), e);
    }

    handle.lock.lock();
    try {
      handle.index = index;
      handle.state = HandleState.READY;
      handle.refCount = 1;
      handle.lastAccess = clock.instant();
      handle.settled.signalAll();
    } finally {
      handle.lock.unlock();
    }
    log.info("Opened workspace {} ({} of {} slots)", identity, residentCount(), capacity());
    return newLease(handle);
  }

  private void failOpening(WorkspaceHandle handle, Throwable failure) {
    poolLock.lock();
    try {
      handles.remove(handle.identity().key(), handle);
      occupiedSlots--;
      poolChanged.signalAll();
    } finally {
      poolLock.unlock();
    }
    handle.lock.lock();
    try {
      handle.state = HandleState.CLOSED;
      handle.openFailure = failure;
      handle.settled.signalAll();
    } finally {
      handle.lock.unlock();
    }
  }

  private WorkspaceLease newLease(WorkspaceHandle handle) {
    return new WorkspaceLease(this, handle);
  }

  // ---------------------------------------------------------------------------
  // Close internals

  /**
   * Closes a handle already in CLOSING state and removes it from the table. Close failures are
   * logged and the entry is removed regardless. The slot returns to the pool unless it was handed
   * to an acquirer.
   */
  private void closeAndRemove(WorkspaceHandle handle) {
    IndexHandle index;
    handle.lock.lock();
    try {
      index = handle.index;
    } finally {
      handle.lock.unlock();
    }
    if (index != null) {
      try {
        index.close();
      } catch (IOException | RuntimeException e) {
        log.warn("Failed to close index of {}: {}", handle.identity(), e.getMessage(), e);
      }
    }

    poolLock.lock();
    try {
      handles.remove(handle.identity().key(), handle);
      if (!handle.slotTransferred) {
        occupiedSlots--;
      }
      poolChanged.signalAll();
    } finally {
      poolLock.unlock();
    }

    handle.lock.lock();
    try {
      handle.state = HandleState.CLOSED;
      handle.index = null;
      handle.settled.signalAll();
    } finally {
      handle.lock.unlock();
    }
    log.debug("Closed workspace {}", handle.identity());
  }

  private void awaitDrain(Duration timeout) {
    long deadline = System.nanoTime() + timeout.toNanos();
    poolLock.lock();
    try {
      while (!handles.isEmpty()) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          return;
        }
        poolChanged.awaitNanos(remaining);
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    } finally {
      poolLock.unlock();
    }
  }

  private void signalPool() {
    poolLock.lock();
    try {
      poolChanged.signalAll();
    } finally {
      poolLock.unlock();
    }
  }

  private void checkAcceptingAcquires() {
    if (shuttingDown) {
      throw new WorkspaceException(
          ErrorKind.UNAVAILABLE,
          "Workspace cache is shutting down",
          false,
          "Restart the server",
          null);
    }
  }

  private void sweepQuietly() {
    try {
      sweepIdle();
    } catch (RuntimeException e) {
      log.warn("Idle sweep failed", e);
    }
  }
}
