package dev.codesearch.reduction;

import java.util.List;
import java.util.function.ToIntFunction;

/**
 * Greedy prefix accumulation in original order, stopping before the first item that would exceed
 * the budget.
 *
 * @param <T> the item type
 */
public record StandardReduction<T>() implements ReductionStrategy<T> {

  @Override
  public Reduction<T> reduce(List<T> items, ToIntFunction<? super T> cost, int budget) {
    return GreedySelection.select(items, GreedySelection.identityOrder(items.size()), cost, budget);
  }

  @Override
  public String name() {
    return "standard";
  }
}
