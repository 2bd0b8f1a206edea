package dev.codesearch.reduction;

import java.util.List;
import java.util.function.ToIntFunction;

/**
 * Shrinks an ordered sequence so that its summed cost fits a token budget.
 *
 * <p>All variants share one contract:
 *
 * <ul>
 *   <li>kept items appear in their original relative order
 *   <li>non-empty input never yields empty output; the first selected item is kept even when it
 *       alone exceeds the budget, and the result is then marked truncated
 *   <li>ties are broken by original index, so the outcome is fully deterministic
 * </ul>
 *
 * @param <T> the item type
 * @see ReductionStrategies#select(boolean, boolean)
 */
public sealed interface ReductionStrategy<T>
    permits StandardReduction, PriorityWeightedReduction, ClusteredReduction {

  /**
   * Reduces {@code items} to fit {@code budget}.
   *
   * @param items the full ordered sequence
   * @param cost per-item token cost
   * @param budget maximum summed cost of the kept items
   * @return the kept items with truncation metadata
   */
  Reduction<T> reduce(List<T> items, ToIntFunction<? super T> cost, int budget);

  /** Short name used in logs and response metadata. */
  String name();
}
