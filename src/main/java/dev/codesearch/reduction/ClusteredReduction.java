package dev.codesearch.reduction;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.function.ToIntFunction;
import org.jspecify.annotations.Nullable;

/**
 * Diversity-preserving reduction: items are partitioned by a clustering key and picked round-robin,
 * one per cluster per round, so that a budget-limited response spans as many clusters as possible.
 *
 * <p>Clusters are visited in order of their first appearance and each cluster yields its items in
 * original order. Items without a key form their own trailing cluster. When no item has a key the
 * reduction is exactly {@link StandardReduction}.
 *
 * @param clusterKey diversity key of an item (e.g. parent directory), or {@code null}
 * @param <T> the item type
 */
public record ClusteredReduction<T>(Function<? super T, @Nullable String> clusterKey)
    implements ReductionStrategy<T> {

  @Override
  public Reduction<T> reduce(List<T> items, ToIntFunction<? super T> cost, int budget) {
    Map<String, List<Integer>> clusters = new LinkedHashMap<>();
    List<Integer> unkeyed = new ArrayList<>();
    for (int i = 0; i < items.size(); i++) {
      String key = clusterKey.apply(items.get(i));
      if (key == null) {
        unkeyed.add(i);
      } else {
        clusters.computeIfAbsent(key, k -> new ArrayList<>()).add(i);
      }
    }
    if (clusters.isEmpty()) {
      return new StandardReduction<T>().reduce(items, cost, budget);
    }

    List<List<Integer>> queues = new ArrayList<>(clusters.values());
    if (!unkeyed.isEmpty()) {
      queues.add(unkeyed);
    }
    return GreedySelection.select(items, roundRobin(queues, items.size()), cost, budget);
  }

  @Override
  public String name() {
    return "clustered";
  }

  private static int[] roundRobin(List<List<Integer>> queues, int size) {
    int[] order = new int[size];
    int[] cursors = new int[queues.size()];
    int written = 0;
    while (written < size) {
      for (int q = 0; q < queues.size(); q++) {
        List<Integer> queue = queues.get(q);
        if (cursors[q] < queue.size()) {
          order[written++] = queue.get(cursors[q]++);
        }
      }
    }
    return order;
  }
}
