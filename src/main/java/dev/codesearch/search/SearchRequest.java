package dev.codesearch.search;

import org.jspecify.annotations.Nullable;

/**
 * A full-text search over one workspace.
 *
 * @param workspacePath workspace directory, in any spelling
 * @param query Lucene query syntax, invalid syntax being searched literally; for a file search,
 *     the file name pattern
 * @param maxTokens response budget, {@code null} for the configured default
 * @param mode {@code summary} or {@code full}, {@code null} for summary
 * @param maxResults cap on raw hits, {@code null} for the configured maximum
 * @param diversify spread kept results across directories when reducing
 * @param preserveOverflow keep the full result set as a resource when truncated
 */
public record SearchRequest(
    String workspacePath,
    String query,
    @Nullable Integer maxTokens,
    @Nullable String mode,
    @Nullable Integer maxResults,
    boolean diversify,
    boolean preserveOverflow) {

  public SearchRequest {
    if (workspacePath == null || workspacePath.isBlank()) {
      throw new IllegalArgumentException("Workspace path must not be blank");
    }
    if (query == null || query.isBlank()) {
      throw new IllegalArgumentException("Query must not be blank");
    }
    if (maxTokens != null && maxTokens < 1) {
      throw new IllegalArgumentException("maxTokens must be at least 1, got: " + maxTokens);
    }
    if (maxResults != null && maxResults < 1) {
      throw new IllegalArgumentException("maxResults must be at least 1, got: " + maxResults);
    }
  }

  /** Search with default budget, summary mode and overflow preservation. */
  public SearchRequest(String workspacePath, String query) {
    this(workspacePath, query, null, null, null, false, true);
  }
}
