package dev.codesearch.response;

import dev.codesearch.index.RawResult;
import java.util.List;

/**
 * The complete result set of a truncated response, as stored in the resource store.
 *
 * @param query the query text
 * @param workspace canonical workspace identity
 * @param generation index generation the results come from
 * @param totalResults number of results
 * @param results every raw result, unshaped and in original order
 */
public record OverflowPayload(
    String query, String workspace, long generation, int totalResults, List<RawResult> results) {}
