package dev.codesearch.reduction;

import java.util.Comparator;
import java.util.List;
import java.util.function.ToDoubleFunction;
import java.util.function.ToIntFunction;
import java.util.stream.IntStream;

/**
 * Selects items by descending priority until the budget is exhausted, then presents the kept items
 * in their original order. Equal priorities are visited in original index order.
 *
 * @param priority priority of an item; higher is more valuable
 * @param <T> the item type
 */
public record PriorityWeightedReduction<T>(ToDoubleFunction<? super T> priority)
    implements ReductionStrategy<T> {

  @Override
  public Reduction<T> reduce(List<T> items, ToIntFunction<? super T> cost, int budget) {
    double[] priorities = new double[items.size()];
    for (int i = 0; i < priorities.length; i++) {
      priorities[i] = priority.applyAsDouble(items.get(i));
    }
    int[] order =
        IntStream.range(0, items.size())
            .boxed()
            .sorted(
                Comparator.<Integer>comparingDouble(i -> priorities[i])
                    .reversed()
                    .thenComparingInt(i -> i))
            .mapToInt(Integer::intValue)
            .toArray();
    return GreedySelection.select(items, order, cost, budget);
  }

  @Override
  public String name() {
    return "priority";
  }
}
