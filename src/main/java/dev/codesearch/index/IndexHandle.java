package dev.codesearch.index;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * An open full-text index for one workspace.
 *
 * <p>Implementations are safe for concurrent queries. Callers serialize {@link
 * #replaceDocuments(List)} against queries themselves.
 */
public interface IndexHandle extends Closeable {

  /** Root directory of the indexed workspace. */
  Path workspaceRoot();

  /**
   * Runs a full-text query.
   *
   * @param query query text; invalid query syntax is searched literally
   * @param maxResults maximum number of hits to return
   * @return hits by descending score
   * @throws IndexAccessException if the index cannot be read
   */
  List<RawResult> query(String query, int maxResults);

  /**
   * Finds files by name, case-insensitively.
   *
   * <p>{@code *} and {@code ?} are wildcards. A pattern without wildcards matches any file name
   * containing it. A pattern containing {@code /} is matched against the workspace-relative path
   * instead of the file name.
   *
   * @param pattern file name pattern
   * @param maxResults maximum number of files to return
   * @return matching files without snippets, all scored equally
   * @throws IndexAccessException if the index cannot be read
   */
  List<RawResult> findFiles(String pattern, int maxResults);

  /**
   * Replaces the whole index content and commits, advancing {@link #generation()}.
   *
   * @throws IndexAccessException if the index cannot be written
   */
  void replaceDocuments(List<IndexedDocument> documents);

  /** Version of the last commit. Strictly increases with every commit. */
  long generation();

  /** Number of indexed documents. */
  int documentCount();

  /** Commits pending changes and releases every resource held by this index. */
  @Override
  void close() throws IOException;
}
