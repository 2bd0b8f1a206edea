package dev.codesearch.response;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything about a request that shapes its response besides the raw results and the budget.
 *
 * @param tool tool name, part of the cache key
 * @param parameters normalized request parameters, part of the cache key
 * @param workspace canonical workspace identity, part of the cache key
 * @param generation index generation the results come from, part of the cache key
 * @param query the query text, echoed in insights and actions
 * @param diversify whether results should be spread across directories when reduced
 * @param preserveOverflow whether a truncated response should keep the full result set as a
 *     resource
 */
public record ResponseContext(
    String tool,
    Map<String, String> parameters,
    String workspace,
    long generation,
    String query,
    boolean diversify,
    boolean preserveOverflow) {

  public ResponseContext {
    parameters = Map.copyOf(new LinkedHashMap<>(parameters));
  }
}
