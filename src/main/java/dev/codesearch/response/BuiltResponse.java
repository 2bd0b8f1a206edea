package dev.codesearch.response;

import dev.codesearch.index.RawResult;
import java.util.List;
import org.jspecify.annotations.Nullable;

/**
 * A size-bounded response ready for serialization.
 *
 * <p>Either {@code estimatedTokens} fits the budget, or {@code truncated} is set. The only case in
 * which {@code estimatedTokens} exceeds the budget is a single mandatory first result that alone
 * is larger than the budget.
 *
 * @param items the kept results, in original order
 * @param truncated whether results were dropped
 * @param estimatedTokens estimated tokens of {@code items}
 * @param resourceUri URI of the full result set, present iff truncated and overflow was preserved
 * @param insights observations computed from the full result set
 * @param actions suggested follow-ups, by descending priority
 * @param totalResults size of the full result set
 * @param mode response mode the items were shaped for
 * @param strategy name of the reduction strategy applied, {@code none} when nothing was reduced
 */
public record BuiltResponse(
    List<RawResult> items,
    boolean truncated,
    int estimatedTokens,
    @Nullable String resourceUri,
    List<String> insights,
    List<ActionDescriptor> actions,
    int totalResults,
    ResponseMode mode,
    String strategy) {

  public BuiltResponse {
    items = List.copyOf(items);
    insights = List.copyOf(insights);
    actions = List.copyOf(actions);
  }

  public int returnedResults() {
    return items.size();
  }
}
