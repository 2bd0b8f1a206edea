package dev.codesearch.reduction;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.ToIntFunction;

/** Budget accumulation over a visiting order of item indices, shared by all strategies. */
final class GreedySelection {

  private GreedySelection() {
    // utility class
  }

  /**
   * Visits {@code order} and accumulates items until the next one would exceed the budget. The
   * first visited item is always taken. Kept items are returned in ascending index order.
   */
  static <T> Reduction<T> select(
      List<T> items, int[] order, ToIntFunction<? super T> cost, int budget) {
    if (items.isEmpty()) {
      return Reduction.empty();
    }
    int[] taken = new int[order.length];
    int takenCount = 0;
    long used = 0;
    boolean overBudget = false;

    for (int index : order) {
      int itemCost = Math.max(0, cost.applyAsInt(items.get(index)));
      if (takenCount == 0) {
        taken[takenCount++] = index;
        used = itemCost;
        overBudget = itemCost > budget;
        continue;
      }
      if (used + itemCost > budget) {
        break;
      }
      taken[takenCount++] = index;
      used += itemCost;
    }

    int[] keptIndices = Arrays.copyOf(taken, takenCount);
    Arrays.sort(keptIndices);
    List<T> kept = new ArrayList<>(takenCount);
    for (int index : keptIndices) {
      kept.add(items.get(index));
    }
    boolean truncated = takenCount < items.size() || overBudget;
    return new Reduction<>(kept, truncated, (int) Math.min(Integer.MAX_VALUE, used), overBudget);
  }

  static int[] identityOrder(int size) {
    int[] order = new int[size];
    for (int i = 0; i < size; i++) {
      order[i] = i;
    }
    return order;
  }
}
