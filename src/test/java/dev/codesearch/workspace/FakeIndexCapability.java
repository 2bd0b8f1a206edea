package dev.codesearch.workspace;

import dev.codesearch.index.IndexCapability;
import dev.codesearch.index.IndexHandle;
import dev.codesearch.index.IndexedDocument;
import dev.codesearch.index.RawResult;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/** In-memory index capability that records how many physical indexes are open at once. */
class FakeIndexCapability implements IndexCapability {

  final AtomicInteger opens = new AtomicInteger();
  final AtomicInteger closes = new AtomicInteger();
  final AtomicInteger openNow = new AtomicInteger();
  final AtomicInteger maxOpenNow = new AtomicInteger();
  final AtomicInteger maxOpenPerWorkspace = new AtomicInteger();
  final Map<String, AtomicInteger> openPerWorkspace = new ConcurrentHashMap<>();
  final Set<String> failOnce = ConcurrentHashMap.newKeySet();
  volatile long openDelayMs;

  @Override
  public IndexHandle openOrCreate(Path workspaceRoot, String workspaceKey) throws IOException {
    if (openDelayMs > 0) {
      try {
        TimeUnit.MILLISECONDS.sleep(openDelayMs);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new InterruptedIOException("interrupted while opening");
      }
    }
    if (failOnce.remove(workspaceRoot.getFileName().toString())) {
      throw new IOException("index is locked");
    }
    opens.incrementAndGet();
    maxOpenNow.accumulateAndGet(openNow.incrementAndGet(), Math::max);
    int perWorkspace =
        openPerWorkspace.computeIfAbsent(workspaceKey, k -> new AtomicInteger()).incrementAndGet();
    maxOpenPerWorkspace.accumulateAndGet(perWorkspace, Math::max);
    return new FakeIndex(workspaceRoot, workspaceKey);
  }

  int openCount(String workspaceKey) {
    AtomicInteger count = openPerWorkspace.get(workspaceKey);
    return count == null ? 0 : count.get();
  }

  final class FakeIndex implements IndexHandle {

    private final Path root;
    private final String key;
    private final AtomicLong generation = new AtomicLong(1);
    private volatile List<IndexedDocument> documents = List.of();
    private volatile boolean closed;

    FakeIndex(Path root, String key) {
      this.root = root;
      this.key = key;
    }

    @Override
    public Path workspaceRoot() {
      return root;
    }

    @Override
    public List<RawResult> query(String query, int maxResults) {
      return documents.stream()
          .filter(d -> d.content().contains(query))
          .limit(maxResults)
          .map(d -> new RawResult(d.path(), 1.0))
          .toList();
    }

    @Override
    public List<RawResult> findFiles(String pattern, int maxResults) {
      String needle = pattern.replace("*", "").toLowerCase(Locale.ROOT);
      return documents.stream()
          .filter(d -> d.path().toLowerCase(Locale.ROOT).contains(needle))
          .limit(maxResults)
          .map(d -> new RawResult(d.path(), 1.0))
          .toList();
    }

    @Override
    public void replaceDocuments(List<IndexedDocument> newDocuments) {
      documents = List.copyOf(newDocuments);
      generation.incrementAndGet();
    }

    @Override
    public long generation() {
      return generation.get();
    }

    @Override
    public int documentCount() {
      return documents.size();
    }

    @Override
    public void close() {
      if (!closed) {
        closed = true;
        closes.incrementAndGet();
        openNow.decrementAndGet();
        openPerWorkspace.get(key).decrementAndGet();
      }
    }
  }
}
