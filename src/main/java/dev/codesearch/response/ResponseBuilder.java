package dev.codesearch.response;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.codesearch.cache.ResponseCache;
import dev.codesearch.cache.ResponseFingerprint;
import dev.codesearch.index.RawResult;
import dev.codesearch.reduction.Reduction;
import dev.codesearch.reduction.ReductionStrategies;
import dev.codesearch.reduction.ReductionStrategy;
import dev.codesearch.resource.ResourceStore;
import dev.codesearch.token.TokenEstimator;
import java.time.Duration;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns an unbounded raw result set into a token-bounded, cacheable response.
 *
 * <p>Pipeline: fingerprint and cache lookup -> shape results for the response mode -> estimate ->
 * reduce when over budget -> preserve the full set as a resource when truncated -> insights and
 * actions from the full set -> cache write.
 *
 * <p>A cache hit returns before the raw results are even materialized, so neither the query nor
 * any estimation or reduction runs again.
 *
 * @see ReductionStrategies
 * @see ResponseFingerprint
 */
@Component
public class ResponseBuilder {

  private static final Logger log = LoggerFactory.getLogger(ResponseBuilder.class);

  /** Snippet length cap in {@link ResponseMode#SUMMARY}. */
  static final int SUMMARY_SNIPPET_CHARS = 500;

  private final TokenEstimator estimator;
  private final ResponseCache<BuiltResponse> responseCache;
  private final ResourceStore resourceStore;
  private final ObjectMapper objectMapper;
  private final ResponseProperties properties;
  private final InsightGenerator insightGenerator;

  public ResponseBuilder(
      TokenEstimator estimator,
      ResponseCache<BuiltResponse> responseCache,
      ResourceStore resourceStore,
      ObjectMapper objectMapper,
      ResponseProperties properties) {
    this.estimator = estimator;
    this.responseCache = responseCache;
    this.resourceStore = resourceStore;
    this.objectMapper = objectMapper;
    this.properties = properties;
    this.insightGenerator = new InsightGenerator(estimator);
  }

  /** Builds a response from an already materialized result list. */
  public BuiltResponse build(
      List<RawResult> rawResults, ResponseBudget budget, ResponseContext context) {
    return build(() -> rawResults, budget, context);
  }

  /**
   * Builds a bounded response.
   *
   * @param rawResults supplier of the full raw result set, only invoked on a cache miss
   * @param budget the token budget and response mode
   * @param context request identity and shaping options
   * @return the bounded response
   */
  public BuiltResponse build(
      Supplier<? extends List<RawResult>> rawResults,
      ResponseBudget budget,
      ResponseContext context) {
    String key = fingerprint(budget, context);
    Optional<BuiltResponse> cached = responseCache.get(key);
    if (cached.isPresent()) {
      if (overflowStillAvailable(cached.get())) {
        log.debug("Response cache hit for {} on {}", context.tool(), context.workspace());
        return cached.get();
      }
      log.debug(
          "Cached {} response on {} lost its overflow resource, rebuilding",
          context.tool(),
          context.workspace());
      responseCache.invalidate(key);
    }

    List<RawResult> all = List.copyOf(rawResults.get());
    List<RawResult> shaped = shape(all, budget.mode());

    Map<RawResult, Integer> costs = new IdentityHashMap<>();
    long totalTokens = 0;
    for (RawResult result : shaped) {
      int cost = estimator.estimate(result);
      costs.put(result, cost);
      totalTokens += cost;
    }

    List<RawResult> kept;
    boolean truncated;
    boolean overBudget;
    int keptTokens;
    String strategyName;
    if (totalTokens <= budget.maxTokens()) {
      kept = shaped;
      truncated = false;
      overBudget = false;
      keptTokens = (int) totalTokens;
      strategyName = "none";
    } else {
      ReductionStrategy<RawResult> strategy =
          ReductionStrategies.select(hasRelevance(shaped), context.diversify());
      Reduction<RawResult> reduction =
          strategy.reduce(shaped, r -> costs.get(r), budget.maxTokens());
      kept = reduction.kept();
      truncated = reduction.truncated();
      overBudget = reduction.overBudget();
      keptTokens = reduction.keptTokens();
      strategyName = strategy.name();
    }

    String resourceUri = null;
    if (truncated && context.preserveOverflow() && properties.preserveOverflow()) {
      resourceUri = storeOverflow(all, context);
    }

    int firstKeptTokens = kept.isEmpty() ? 0 : costs.get(kept.get(0));
    BuiltResponse response =
        new BuiltResponse(
            kept,
            truncated,
            keptTokens,
            resourceUri,
            insightGenerator.insights(
                all, kept.size(), budget, resourceUri, firstKeptTokens, overBudget),
            insightGenerator.actions(all, context, budget, resourceUri),
            all.size(),
            budget.mode(),
            strategyName);

    responseCache.put(key, response, cacheTtl(resourceUri), keptTokens);
    log.info(
        "Built {} response: {}/{} results, {} tokens (budget {}), strategy {}",
        context.tool(),
        kept.size(),
        all.size(),
        keptTokens,
        budget.maxTokens(),
        strategyName);
    return response;
  }

  /**
   * Cache key of a build: the context's identity plus everything in the budget that changes the
   * output.
   */
  public String fingerprint(ResponseBudget budget, ResponseContext context) {
    Map<String, String> parameters = new LinkedHashMap<>(context.parameters());
    parameters.put("_maxTokens", Integer.toString(budget.maxTokens()));
    parameters.put("_mode", budget.mode().value());
    parameters.put("_diversify", Boolean.toString(context.diversify()));
    parameters.put("_preserveOverflow", Boolean.toString(context.preserveOverflow()));
    return ResponseFingerprint.of(
        context.tool(), parameters, context.workspace(), context.generation());
  }

  private @Nullable String storeOverflow(List<RawResult> all, ResponseContext context) {
    OverflowPayload payload =
        new OverflowPayload(
            context.query(), context.workspace(), context.generation(), all.size(), all);
    try {
      return resourceStore.put(objectMapper.writeValueAsString(payload), properties.overflowTtl());
    } catch (JsonProcessingException e) {
      log.warn(
          "Could not preserve {} overflow results for {}: {}",
          all.size(),
          context.workspace(),
          e.getOriginalMessage());
      return null;
    }
  }

  private boolean overflowStillAvailable(BuiltResponse response) {
    String uri = response.resourceUri();
    return uri == null || resourceStore.get(uri).isFound();
  }

  private Duration cacheTtl(@Nullable String resourceUri) {
    Duration ttl = properties.cacheTtl();
    if (resourceUri == null) {
      return ttl;
    }
    // never outlive the resource the response points to
    Duration resourceTtl = resourceStore.effectiveTtl(properties.overflowTtl());
    return resourceTtl.compareTo(ttl) < 0 ? resourceTtl : ttl;
  }

  static List<RawResult> shape(List<RawResult> results, ResponseMode mode) {
    if (mode == ResponseMode.FULL) {
      return results;
    }
    return results.stream().map(r -> r.withSnippet(truncateSnippet(r.snippet()))).toList();
  }

  static @Nullable String truncateSnippet(@Nullable String snippet) {
    if (snippet == null || snippet.length() <= SUMMARY_SNIPPET_CHARS) {
      return snippet;
    }
    String truncated = snippet.substring(0, SUMMARY_SNIPPET_CHARS);
    int lastSpace = truncated.lastIndexOf(' ');
    if (lastSpace > SUMMARY_SNIPPET_CHARS * 0.8) {
      truncated = truncated.substring(0, lastSpace);
    }
    return truncated + "...";
  }

  private static boolean hasRelevance(List<RawResult> results) {
    if (results.isEmpty()) {
      return false;
    }
    double first = results.get(0).score();
    return results.stream().anyMatch(r -> r.score() > 0 && r.score() != first);
  }
}
