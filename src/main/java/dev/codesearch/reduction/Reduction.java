package dev.codesearch.reduction;

import java.util.List;

/**
 * Outcome of a {@link ReductionStrategy}.
 *
 * @param kept the kept items in original relative order
 * @param truncated whether any item was dropped
 * @param keptTokens summed cost of the kept items
 * @param overBudget whether the kept set exceeds the budget (only possible when the mandatory
 *     first item alone is larger than the budget)
 * @param <T> the item type
 */
public record Reduction<T>(List<T> kept, boolean truncated, int keptTokens, boolean overBudget) {

  public Reduction {
    kept = List.copyOf(kept);
  }

  static <T> Reduction<T> empty() {
    return new Reduction<>(List.of(), false, 0, false);
  }
}
