package dev.codesearch.search;

import dev.codesearch.workspace.WorkspaceIdentity;
import java.time.Duration;

/**
 * Result of a full reindex.
 *
 * @param workspace the reindexed workspace
 * @param documents number of indexed files
 * @param generation index generation after the commit
 * @param elapsed wall time of collection plus indexing
 */
public record IndexingResult(
    WorkspaceIdentity workspace, int documents, long generation, Duration elapsed) {}
