package dev.codesearch.mcp;

import com.fasterxml.jackson.annotation.JsonInclude;
import dev.codesearch.index.RawResult;
import dev.codesearch.response.ActionDescriptor;
import dev.codesearch.response.BuiltResponse;
import dev.codesearch.search.SearchOutcome;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.jspecify.annotations.Nullable;

/** JSON body of a successful {@code text_search} call. */
public record SearchEnvelope(
    boolean success,
    String query,
    String workspace,
    Summary summary,
    List<Item> results,
    ResultsSummary resultsSummary,
    Distribution distribution,
    List<String> insights,
    List<ActionDescriptor> actions,
    Meta meta) {

  static final int DISTRIBUTION_ENTRIES = 10;

  public record Summary(int totalHits, int returned, long filesMatched) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Item(
      String file,
      String path,
      double score,
      @Nullable String snippet,
      Map<String, String> fields) {}

  public record ResultsSummary(int included, int total, boolean hasMore) {}

  /** Counts of returned results per extension and per directory, largest first. */
  public record Distribution(Map<String, Long> byExtension, Map<String, Long> byDirectory) {}

  @JsonInclude(JsonInclude.Include.NON_NULL)
  public record Meta(
      String mode,
      boolean truncated,
      int tokens,
      String strategy,
      long generation,
      boolean cached,
      @Nullable String resourceUri) {}

  static SearchEnvelope from(String query, SearchOutcome outcome) {
    BuiltResponse response = outcome.response();
    List<RawResult> items = response.items();
    return new SearchEnvelope(
        true,
        query,
        outcome.workspace().root().toString(),
        new Summary(
            response.totalResults(),
            response.returnedResults(),
            items.stream().map(RawResult::path).distinct().count()),
        items.stream().map(SearchEnvelope::item).toList(),
        new ResultsSummary(
            response.returnedResults(),
            response.totalResults(),
            response.totalResults() > response.returnedResults()),
        new Distribution(
            countBy(items, r -> r.extension() == null ? "(none)" : r.extension()),
            countBy(items, RawResult::directory)),
        response.insights(),
        response.actions(),
        new Meta(
            response.mode().value(),
            response.truncated(),
            response.estimatedTokens(),
            response.strategy(),
            outcome.generation(),
            outcome.cached(),
            response.resourceUri()));
  }

  private static Item item(RawResult result) {
    String path = result.path();
    return new Item(
        path.substring(path.lastIndexOf('/') + 1),
        path,
        Math.round(result.score() * 100) / 100.0,
        result.snippet(),
        result.fields());
  }

  private static Map<String, Long> countBy(
      List<RawResult> items, Function<RawResult, String> key) {
    Map<String, Long> counts =
        items.stream()
            .collect(Collectors.groupingBy(key, LinkedHashMap::new, Collectors.counting()));
    return counts.entrySet().stream()
        .sorted(Map.Entry.<String, Long>comparingByValue(Comparator.reverseOrder()))
        .limit(DISTRIBUTION_ENTRIES)
        .collect(
            Collectors.toMap(
                Map.Entry::getKey, Map.Entry::getValue, (a, b) -> a, LinkedHashMap::new));
  }
}
