package dev.codesearch.response;

import dev.codesearch.index.RawResult;
import dev.codesearch.token.TokenEstimator;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.jspecify.annotations.Nullable;

/**
 * Derives insights and suggested actions from a result set.
 *
 * <p>Always fed the full raw result set, never the reduced one, so counts and distributions stay
 * accurate when the response is truncated.
 */
final class InsightGenerator {

  static final int LARGE_RESULT_SET = 100;
  static final int REFINE_THRESHOLD = 50;
  static final int FEW_RESULTS = 5;
  static final double HIGH_RELEVANCE = 0.8;
  static final double LOW_RELEVANCE = 0.3;

  static final String TEXT_SEARCH = "text_search";
  static final String FILE_SEARCH = "file_search";
  static final String GET_RESOURCE = "get_resource";

  private final TokenEstimator estimator;

  InsightGenerator(TokenEstimator estimator) {
    this.estimator = estimator;
  }

  List<String> insights(
      List<RawResult> all,
      int returned,
      ResponseBudget budget,
      @Nullable String resourceUri,
      int firstItemTokens,
      boolean budgetUnsatisfiable) {
    List<String> insights = new ArrayList<>();
    int total = all.size();

    if (total == 0) {
      insights.add("No results found. Try broadening your search criteria.");
      insights.add("Check if the workspace is properly indexed.");
      return insights;
    }

    if (total == 1) {
      insights.add("Found exactly one match.");
    } else if (total > LARGE_RESULT_SET) {
      insights.add(
          "Large result set (%d matches). Consider refining your search.".formatted(total));
    } else if (total < FEW_RESULTS) {
      insights.add("Found %d matches. Consider broadening search if needed.".formatted(total));
    } else {
      insights.add("Found %d matches across the codebase.".formatted(total));
    }

    Map.Entry<String, Integer> topExtension = topExtension(all);
    if (topExtension != null) {
      insights.add(
          "Most matches in %s files (%d matches)."
              .formatted(topExtension.getKey(), topExtension.getValue()));
    }

    double topScore = all.stream().mapToDouble(RawResult::score).max().orElse(0.0);
    double avgScore = all.stream().mapToDouble(RawResult::score).average().orElse(0.0);
    if (topScore > HIGH_RELEVANCE) {
      insights.add("Found highly relevant matches (score > 0.8).");
    } else if (avgScore < LOW_RELEVANCE) {
      insights.add("Match relevance is low. Consider more specific search terms.");
    }

    if (returned < total) {
      String where =
          resourceUri != null
              ? " Full result set available at " + resourceUri + "."
              : " Narrow the query or raise the token budget to see more.";
      insights.add(
          "Showing %d of %d results to stay within %d tokens.%s"
              .formatted(returned, total, budget.maxTokens(), where));
    }

    if (budgetUnsatisfiable) {
      insights.add(
          ("The top result alone needs about %d tokens, more than the budget of %d. "
                  + "Returning it by itself.")
              .formatted(firstItemTokens, budget.maxTokens()));
    }

    if (budget.mode() == ResponseMode.SUMMARY) {
      insights.add("Showing summary view. Use 'full' mode for complete content.");
    }
    return insights;
  }

  List<ActionDescriptor> actions(
      List<RawResult> all,
      ResponseContext context,
      ResponseBudget budget,
      @Nullable String resourceUri) {
    List<ActionDescriptor> actions = new ArrayList<>();
    int total = all.size();
    String query = context.query();
    boolean fileSearch = FILE_SEARCH.equals(context.tool());

    if (total == 0) {
      actions.add(
          fileSearch
              ? new ActionDescriptor(
                  "search_contents",
                  "Search file contents for '%s' instead".formatted(bare(query)),
                  TEXT_SEARCH,
                  parameters(context, "query", simplifyQuery(bare(query))),
                  budget.maxTokens(),
                  10)
              : new ActionDescriptor(
                  "broaden_search",
                  "Try a broader search term",
                  TEXT_SEARCH,
                  parameters(context, "query", simplifyQuery(query)),
                  budget.maxTokens(),
                  10));
    } else if (total > REFINE_THRESHOLD) {
      Map.Entry<String, Integer> extension = topExtension(all);
      if (!fileSearch) {
        actions.add(
            new ActionDescriptor(
                "refine_search",
                "Refine search with more specific terms",
                TEXT_SEARCH,
                parameters(context, "query", query + " AND specific_term"),
                budget.maxTokens(),
                10));
      } else if (extension != null) {
        actions.add(
            new ActionDescriptor(
                "refine_search",
                "Only list %s files".formatted(extension.getKey()),
                FILE_SEARCH,
                parameters(context, "pattern", "*" + bare(query) + "*" + extension.getKey()),
                budget.maxTokens(),
                10));
      }
    }

    if (resourceUri != null) {
      actions.add(
          new ActionDescriptor(
              "load_full_results",
              "Load the complete result set (%d results)".formatted(total),
              GET_RESOURCE,
              Map.of("uri", resourceUri),
              estimator.estimateCollection(all),
              9));
    }

    if (!fileSearch && !query.isBlank() && total > 0) {
      String term = simplifyQuery(query);
      actions.add(
          new ActionDescriptor(
              "file_search",
              "Find files with names matching '%s'".formatted(term),
              FILE_SEARCH,
              parameters(context, "pattern", "*" + term + "*"),
              Math.min(budget.maxTokens(), 500),
              6));
    }

    actions.sort(Comparator.comparingInt(ActionDescriptor::priority).reversed());
    return actions;
  }

  private static Map<String, String> parameters(
      ResponseContext context, String argument, String value) {
    return Map.of("workspacePath", context.workspace(), argument, value);
  }

  /** A file name pattern without its wildcards. */
  static String bare(String pattern) {
    String stripped = pattern.replace("*", "").replace("?", "").strip();
    return stripped.isEmpty() ? "*" : stripped;
  }

  private static Map.@Nullable Entry<String, Integer> topExtension(List<RawResult> all) {
    Map<String, Integer> counts = new LinkedHashMap<>();
    for (RawResult result : all) {
      String extension = result.extension();
      if (extension != null) {
        counts.merge(extension, 1, Integer::sum);
      }
    }
    Map.Entry<String, Integer> best = null;
    for (Map.Entry<String, Integer> entry : counts.entrySet()) {
      if (best == null || entry.getValue() > best.getValue()) {
        best = entry;
      }
    }
    return best;
  }

  static String simplifyQuery(@Nullable String query) {
    if (query == null || query.isBlank()) {
      return "*";
    }
    String simplified =
        query.replace(" AND ", " ").replace(" OR ", " ").replace(" NOT ", " ").trim();
    String first = simplified.split("\\s+")[0];
    return first.isEmpty() ? "*" : first;
  }

}
