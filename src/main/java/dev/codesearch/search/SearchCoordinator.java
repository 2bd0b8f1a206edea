package dev.codesearch.search;

import dev.codesearch.cache.ResponseCache;
import dev.codesearch.index.IndexHandle;
import dev.codesearch.index.IndexedDocument;
import dev.codesearch.index.RawResult;
import dev.codesearch.index.WorkspaceIndexer;
import dev.codesearch.resource.ResourceLookup;
import dev.codesearch.resource.ResourceStore;
import dev.codesearch.response.BuiltResponse;
import dev.codesearch.response.ResponseBudget;
import dev.codesearch.response.ResponseBuilder;
import dev.codesearch.response.ResponseContext;
import dev.codesearch.response.ResponseMode;
import dev.codesearch.response.ResponseProperties;
import dev.codesearch.workspace.WorkspaceIndexCache;
import dev.codesearch.workspace.WorkspaceLease;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point of every workspace operation.
 *
 * <p>Search pipeline: acquire lease -> read generation and query under the index read lock ->
 * {@link ResponseBuilder} -> release. The lease is closed by try-with-resources, so the handle is
 * released on success, on failure and on interruption alike.
 */
@Service
public class SearchCoordinator {

  private static final Logger log = LoggerFactory.getLogger(SearchCoordinator.class);

  static final String SEARCH_TOOL = "text_search";
  static final String FILE_SEARCH_TOOL = "file_search";

  private final WorkspaceIndexCache workspaceCache;
  private final ResponseBuilder responseBuilder;
  private final ResourceStore resourceStore;
  private final ResponseCache<BuiltResponse> responseCache;
  private final WorkspaceIndexer indexer;
  private final ResponseProperties responseProperties;

  public SearchCoordinator(
      WorkspaceIndexCache workspaceCache,
      ResponseBuilder responseBuilder,
      ResourceStore resourceStore,
      ResponseCache<BuiltResponse> responseCache,
      WorkspaceIndexer indexer,
      ResponseProperties responseProperties) {
    this.workspaceCache = workspaceCache;
    this.responseBuilder = responseBuilder;
    this.resourceStore = resourceStore;
    this.responseCache = responseCache;
    this.indexer = indexer;
    this.responseProperties = responseProperties;
  }

  /**
   * Runs a search and returns a token-bounded response.
   *
   * @throws dev.codesearch.workspace.WorkspaceException if the workspace cannot be acquired
   * @throws dev.codesearch.index.IndexAccessException if the index cannot be read
   * @throws IllegalArgumentException if the response mode is unknown
   */
  public SearchOutcome search(SearchRequest request) {
    return run(request, SEARCH_TOOL, IndexHandle::query);
  }

  /**
   * Lists the files whose names match {@link SearchRequest#query()} as a pattern, through the same
   * budget and cache as {@link #search(SearchRequest)}.
   *
   * @see IndexHandle#findFiles(String, int)
   */
  public SearchOutcome fileSearch(SearchRequest request) {
    return run(request, FILE_SEARCH_TOOL, IndexHandle::findFiles);
  }

  private SearchOutcome run(SearchRequest request, String tool, Lookup lookup) {
    ResponseBudget budget =
        new ResponseBudget(
            request.maxTokens() != null
                ? request.maxTokens()
                : responseProperties.defaultTokenBudget(),
            ResponseMode.parse(request.mode()));
    int maxResults =
        request.maxResults() != null
            ? Math.min(request.maxResults(), responseProperties.maxResults())
            : responseProperties.maxResults();

    try (WorkspaceLease lease = workspaceCache.acquire(request.workspacePath())) {
      return lease.read(
          index -> {
            long generation = index.generation();
            ResponseContext context =
                new ResponseContext(
                    tool,
                    Map.of("query", request.query(), "maxResults", Integer.toString(maxResults)),
                    lease.identity().root().toString(),
                    generation,
                    request.query(),
                    request.diversify(),
                    request.preserveOverflow());
            AtomicBoolean queried = new AtomicBoolean();
            BuiltResponse response =
                responseBuilder.build(
                    () -> {
                      queried.set(true);
                      List<RawResult> hits = lookup.find(index, request.query(), maxResults);
                      log.debug("{} '{}' matched {} file(s)", tool, request.query(), hits.size());
                      return hits;
                    },
                    budget,
                    context);
            return new SearchOutcome(response, lease.identity(), generation, !queried.get());
          });
    }
  }

  @FunctionalInterface
  private interface Lookup {
    List<RawResult> find(IndexHandle index, String query, int maxResults);
  }

  /** Reads back a stored overflow resource. */
  public ResourceLookup getResource(String uri) {
    return resourceStore.get(uri);
  }

  /**
   * Rebuilds the index of a workspace from its files. Queries on the workspace wait for the write
   * to finish; the generation advances, so earlier cached responses no longer match.
   */
  public IndexingResult indexWorkspace(String workspacePath) {
    long started = System.nanoTime();
    try (WorkspaceLease lease = workspaceCache.acquire(workspacePath)) {
      List<IndexedDocument> documents = indexer.collect(lease.identity().root());
      long generation =
          lease.write(
              index -> {
                index.replaceDocuments(documents);
                return index.generation();
              });
      Duration elapsed = Duration.ofNanos(System.nanoTime() - started);
      log.info(
          "Indexed {} file(s) of {} in {} ms (generation {})",
          documents.size(),
          lease.identity(),
          elapsed.toMillis(),
          generation);
      return new IndexingResult(lease.identity(), documents.size(), generation, elapsed);
    }
  }

  /**
   * Closes the index of a workspace once it is unused.
   *
   * @return {@code true} if the workspace was resident
   */
  public boolean evictWorkspace(String workspacePath) {
    return workspaceCache.evict(workspacePath);
  }

  public ServiceStatus status() {
    return new ServiceStatus(
        workspaceCache.snapshot(),
        workspaceCache.capacity(),
        responseCache.stats(),
        resourceStore.size());
  }

  /** Drops every cached response. Overflow resources and open indexes are kept. */
  public void clearResponseCache() {
    responseCache.invalidateAll();
  }
}
