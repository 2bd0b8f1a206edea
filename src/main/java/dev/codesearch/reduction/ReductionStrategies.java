package dev.codesearch.reduction;

import dev.codesearch.index.RawResult;

/** Pure selection of the reduction strategy for a build context. */
public final class ReductionStrategies {

  private ReductionStrategies() {
    // utility class
  }

  /**
   * Picks the strategy for a result set: diversity wins over relevance, and Standard is the
   * default.
   *
   * @param hasRelevance whether the results carry meaningful relevance scores
   * @param diversityRequested whether the caller asked for results spread across directories
   * @return the strategy to apply
   */
  public static ReductionStrategy<RawResult> select(
      boolean hasRelevance, boolean diversityRequested) {
    if (diversityRequested) {
      return new ClusteredReduction<>(RawResult::directory);
    }
    if (hasRelevance) {
      return new PriorityWeightedReduction<>(RawResult::score);
    }
    return new StandardReduction<>();
  }
}
