package dev.codesearch.search;

import dev.codesearch.response.BuiltResponse;
import dev.codesearch.workspace.WorkspaceIdentity;

/**
 * Result of {@link SearchCoordinator#search(SearchRequest)}.
 *
 * @param response the bounded response
 * @param workspace the workspace searched
 * @param generation index generation the response reflects
 * @param cached whether the response came from the response cache without querying the index
 */
public record SearchOutcome(
    BuiltResponse response, WorkspaceIdentity workspace, long generation, boolean cached) {}
