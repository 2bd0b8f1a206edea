package dev.codesearch.response;

import static dev.codesearch.fixture.RawResultBuilder.aResult;
import static dev.codesearch.fixture.RawResultBuilder.uniformResults;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.clearInvocations;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.verifyNoInteractions;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.codesearch.cache.ResponseCache;
import dev.codesearch.fixture.MutableClock;
import dev.codesearch.index.RawResult;
import dev.codesearch.resource.ResourceLookup;
import dev.codesearch.resource.ResourceProperties;
import dev.codesearch.resource.ResourceStore;
import dev.codesearch.token.TokenEstimator;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ResponseBuilderTest {

  private final ObjectMapper objectMapper = new ObjectMapper();
  private MutableClock clock;
  private TokenEstimator estimator;
  private ResponseCache<BuiltResponse> cache;
  private ResourceStore resourceStore;
  private ResponseBuilder builder;

  @BeforeEach
  void setUp() {
    clock = new MutableClock();
    estimator = spy(new TokenEstimator(objectMapper));
    cache = new ResponseCache<>(BuiltResponse.class, objectMapper, clock, 100);
    resourceStore = new ResourceStore(clock, ResourceProperties.defaults());
    builder =
        new ResponseBuilder(
            estimator, cache, resourceStore, objectMapper, ResponseProperties.defaults());
  }

  private static ResponseContext context(long generation) {
    return new ResponseContext(
        "text_search", Map.of("query", "foo"), "/ws", generation, "foo", false, true);
  }

  @Test
  void largeResultSetIsReducedToBudgetWithOverflowResource() {
    List<RawResult> results = uniformResults(500, 112);
    int perItem = estimator.estimate(results.get(0));
    assertThat(perItem).isBetween(45, 55);

    BuiltResponse response = builder.build(results, ResponseBudget.of(1000), context(1));

    assertThat(response.items()).hasSizeBetween(18, 22);
    assertThat(response.truncated()).isTrue();
    assertThat(response.estimatedTokens()).isLessThanOrEqualTo(1000);
    assertThat(response.resourceUri()).startsWith("codesearch-search://");
    assertThat(response.totalResults()).isEqualTo(500);
    assertThat(response.strategy()).isEqualTo("priority");
    assertThat(response.items()).isEqualTo(results.subList(0, response.items().size()));
  }

  @Test
  void overflowResourceHoldsTheCompleteResultSet() throws Exception {
    List<RawResult> results = uniformResults(500, 112);

    BuiltResponse response = builder.build(results, ResponseBudget.of(1000), context(1));

    ResourceLookup lookup = resourceStore.get(response.resourceUri());
    assertThat(lookup.isFound()).isTrue();
    JsonNode payload = objectMapper.readTree(lookup.payload());
    assertThat(payload.get("totalResults").asInt()).isEqualTo(500);
    assertThat(payload.get("results")).hasSize(500);
    assertThat(payload.get("query").asText()).isEqualTo("foo");
    assertThat(response.actions())
        .extracting(ActionDescriptor::id)
        .contains("load_full_results", "refine_search");
  }

  @Test
  void resultsWithinBudgetAreReturnedWhole() {
    List<RawResult> results = uniformResults(5, 20);

    BuiltResponse response = builder.build(results, ResponseBudget.of(5000), context(1));

    assertThat(response.items()).isEqualTo(results);
    assertThat(response.truncated()).isFalse();
    assertThat(response.resourceUri()).isNull();
    assertThat(response.strategy()).isEqualTo("none");
  }

  @Test
  void identicalRequestIsServedFromCacheWithoutRecomputation() {
    List<RawResult> results = uniformResults(200, 112);
    AtomicInteger queries = new AtomicInteger();
    Supplier<List<RawResult>> query =
        () -> {
          queries.incrementAndGet();
          return results;
        };

    BuiltResponse first = builder.build(query, ResponseBudget.of(1000), context(7));
    clearInvocations(estimator);
    BuiltResponse second = builder.build(query, ResponseBudget.of(1000), context(7));

    assertThat(second).isEqualTo(first);
    assertThat(queries).hasValue(1);
    verifyNoInteractions(estimator);
  }

  @Test
  void newIndexGenerationMissesTheCache() {
    List<RawResult> results = uniformResults(50, 20);
    AtomicInteger queries = new AtomicInteger();
    Supplier<List<RawResult>> query =
        () -> {
          queries.incrementAndGet();
          return results;
        };

    builder.build(query, ResponseBudget.of(1000), context(1));
    builder.build(query, ResponseBudget.of(1000), context(2));

    assertThat(queries).hasValue(2);
  }

  @Test
  void differentBudgetMissesTheCache() {
    List<RawResult> results = uniformResults(200, 112);

    BuiltResponse small = builder.build(results, ResponseBudget.of(500), context(1));
    BuiltResponse large = builder.build(results, ResponseBudget.of(2000), context(1));

    assertThat(large.items().size()).isGreaterThan(small.items().size());
    assertThat(builder.fingerprint(ResponseBudget.of(500), context(1)))
        .isNotEqualTo(builder.fingerprint(ResponseBudget.of(2000), context(1)));
  }

  @Test
  void oversizedFirstResultIsReturnedAloneWithInsight() {
    List<RawResult> results =
        List.of(
            aResult().path("big.txt").snippet("y".repeat(10_000)).build(),
            aResult().path("small.txt").snippet("z").build());

    BuiltResponse response =
        builder.build(results, new ResponseBudget(100, ResponseMode.FULL), context(1));

    assertThat(response.items()).extracting(RawResult::path).containsExactly("big.txt");
    assertThat(response.truncated()).isTrue();
    assertThat(response.estimatedTokens()).isGreaterThan(100);
    assertThat(response.insights()).anyMatch(i -> i.contains("alone needs about"));
  }

  @Test
  void summaryModeCapsSnippetsOnWordBoundary() {
    String snippet = "word ".repeat(400);
    List<RawResult> results = List.of(aResult().snippet(snippet).build());

    BuiltResponse response = builder.build(results, ResponseBudget.of(5000), context(1));

    String shaped = response.items().get(0).snippet();
    assertThat(shaped).endsWith("...");
    assertThat(shaped.length()).isLessThanOrEqualTo(ResponseBuilder.SUMMARY_SNIPPET_CHARS + 3);
    assertThat(shaped).doesNotEndWith(" ...");
  }

  @Test
  void fullModeKeepsSnippetsIntact() {
    String snippet = "word ".repeat(400);
    List<RawResult> results = List.of(aResult().snippet(snippet).build());

    BuiltResponse response =
        builder.build(results, new ResponseBudget(5000, ResponseMode.FULL), context(1));

    assertThat(response.items().get(0).snippet()).isEqualTo(snippet);
    assertThat(response.mode()).isEqualTo(ResponseMode.FULL);
  }

  @Test
  void truncateSnippetFallsBackToHardCutWithoutSpaces() {
    String truncated = ResponseBuilder.truncateSnippet("x".repeat(800));

    assertThat(truncated).hasSize(ResponseBuilder.SUMMARY_SNIPPET_CHARS + 3);
    assertThat(ResponseBuilder.truncateSnippet("short")).isEqualTo("short");
    assertThat(ResponseBuilder.truncateSnippet(null)).isNull();
  }

  @Test
  void disabledOverflowLeavesNoResource() {
    ResponseContext context =
        new ResponseContext("text_search", Map.of("query", "foo"), "/ws", 1, "foo", false, false);

    BuiltResponse response =
        builder.build(uniformResults(500, 112), ResponseBudget.of(1000), context);

    assertThat(response.truncated()).isTrue();
    assertThat(response.resourceUri()).isNull();
    assertThat(resourceStore.size()).isZero();
  }

  @Test
  void diversifyUsesClusteredReduction() {
    ResponseContext context =
        new ResponseContext("text_search", Map.of("query", "foo"), "/ws", 1, "foo", true, true);

    BuiltResponse response =
        builder.build(uniformResults(100, 112), ResponseBudget.of(500), context);

    assertThat(response.strategy()).isEqualTo("clustered");
    assertThat(response.items()).extracting(RawResult::directory).doesNotHaveDuplicates();
  }

  @Test
  void uniformScoresUseStandardReduction() {
    List<RawResult> results =
        uniformResults(100, 112).stream()
            .map(r -> new RawResult(r.path(), 1.0, r.fields(), r.snippet()))
            .toList();

    BuiltResponse response = builder.build(results, ResponseBudget.of(500), context(1));

    assertThat(response.strategy()).isEqualTo("standard");
  }

  @Test
  void emptyResultsSuggestBroaderSearch() {
    BuiltResponse response = builder.build(List.of(), ResponseBudget.of(1000), context(1));

    assertThat(response.items()).isEmpty();
    assertThat(response.truncated()).isFalse();
    assertThat(response.insights()).first().asString().startsWith("No results found");
    assertThat(response.actions())
        .extracting(ActionDescriptor::id)
        .containsExactly("broaden_search");
  }

  @Test
  void cachedResponseDoesNotOutliveItsResource() {
    List<RawResult> results = uniformResults(500, 112);
    ResponseProperties properties =
        new ResponseProperties(0, 0, Duration.ofHours(2), Duration.ofMinutes(10), null, 0);
    builder = new ResponseBuilder(estimator, cache, resourceStore, objectMapper, properties);
    AtomicInteger queries = new AtomicInteger();
    Supplier<List<RawResult>> query =
        () -> {
          queries.incrementAndGet();
          return results;
        };

    builder.build(query, ResponseBudget.of(1000), context(1));
    clock.advance(Duration.ofMinutes(11));
    BuiltResponse rebuilt = builder.build(query, ResponseBudget.of(1000), context(1));

    assertThat(queries).hasValue(2);
    assertThat(resourceStore.get(rebuilt.resourceUri()).isFound()).isTrue();
  }

  @Test
  void cachedResponseWhoseResourceWasDroppedIsRebuilt() {
    resourceStore = new ResourceStore(clock, new ResourceProperties(null, null, 1));
    builder =
        new ResponseBuilder(
            estimator, cache, resourceStore, objectMapper, ResponseProperties.defaults());
    List<RawResult> results = uniformResults(500, 112);
    ResponseContext first =
        new ResponseContext("text_search", Map.of("query", "a"), "/ws", 1, "a", false, true);
    ResponseContext second =
        new ResponseContext("text_search", Map.of("query", "b"), "/ws", 1, "b", false, true);
    AtomicInteger queries = new AtomicInteger();
    Supplier<List<RawResult>> query =
        () -> {
          queries.incrementAndGet();
          return results;
        };

    BuiltResponse original = builder.build(query, ResponseBudget.of(1000), first);
    builder.build(query, ResponseBudget.of(1000), second);
    BuiltResponse again = builder.build(query, ResponseBudget.of(1000), first);

    assertThat(resourceStore.get(original.resourceUri()).isFound()).isFalse();
    assertThat(queries).hasValue(3);
    assertThat(again.truncated()).isTrue();
    assertThat(resourceStore.get(again.resourceUri()).isFound()).isTrue();
  }

  @Test
  void cacheLifetimeFollowsTheClampedResourceLifetime() {
    resourceStore =
        new ResourceStore(clock, new ResourceProperties(Duration.ofMinutes(5), null, 0));
    builder =
        new ResponseBuilder(
            estimator, cache, resourceStore, objectMapper, ResponseProperties.defaults());
    ResponseBudget budget = ResponseBudget.of(1000);

    BuiltResponse response = builder.build(uniformResults(500, 112), budget, context(1));
    clock.advance(Duration.ofMinutes(6));

    assertThat(response.resourceUri()).isNotNull();
    assertThat(cache.get(builder.fingerprint(budget, context(1)))).isEmpty();
  }
}
