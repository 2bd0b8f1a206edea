package dev.codesearch.mcp;

import static dev.codesearch.fixture.RawResultBuilder.aResult;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;
import static org.mockito.Mockito.never;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.codesearch.cache.CacheStats;
import dev.codesearch.index.IndexAccessException;
import dev.codesearch.resource.ResourceLookup;
import dev.codesearch.response.ActionDescriptor;
import dev.codesearch.response.BuiltResponse;
import dev.codesearch.response.ResponseMode;
import dev.codesearch.search.IndexingResult;
import dev.codesearch.search.SearchCoordinator;
import dev.codesearch.search.SearchOutcome;
import dev.codesearch.search.SearchRequest;
import dev.codesearch.search.ServiceStatus;
import dev.codesearch.workspace.CapacityExceededException;
import dev.codesearch.workspace.HandleSnapshot;
import dev.codesearch.workspace.HandleState;
import dev.codesearch.workspace.WorkspaceIdentity;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class McpToolServiceTest {

  private static final WorkspaceIdentity WORKSPACE =
      new WorkspaceIdentity(Path.of("/work/shop"), "0123456789abcdef");

  @Mock SearchCoordinator coordinator;

  @Captor ArgumentCaptor<SearchRequest> requestCaptor;

  private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
  private McpToolService service;

  @BeforeEach
  void setUp() {
    service = new McpToolService(coordinator, objectMapper);
  }

  private JsonNode json(String body) throws IOException {
    return objectMapper.readTree(body);
  }

  private static BuiltResponse truncatedResponse() {
    return new BuiltResponse(
        List.of(
            aResult().path("src/cart/Cart.java").score(0.91234).snippet("class Cart").build(),
            aResult().path("src/cart/Item.java").score(0.5).build(),
            aResult().path("README").score(0.25).build()),
        true,
        180,
        "codesearch-search://abc",
        List.of("Found 40 matches across the codebase."),
        List.of(
            new ActionDescriptor(
                "load_full_results",
                "Load the complete result set (40 results)",
                "get_resource",
                Map.of("uri", "codesearch-search://abc"),
                2000,
                9)),
        40,
        ResponseMode.SUMMARY,
        "priority");
  }

  // --- text_search ---

  @Test
  void textSearchReturnsEnvelopeWithMetaAndDistribution() throws IOException {
    given(coordinator.search(any()))
        .willReturn(new SearchOutcome(truncatedResponse(), WORKSPACE, 7, true));

    JsonNode body = json(service.textSearch("/work/shop", "cart", 200, null, null, null, null));

    assertThat(body.get("success").asBoolean()).isTrue();
    assertThat(body.get("query").asText()).isEqualTo("cart");
    assertThat(body.get("workspace").asText()).isEqualTo(Path.of("/work/shop").toString());
    assertThat(body.at("/summary/totalHits").asInt()).isEqualTo(40);
    assertThat(body.at("/summary/returned").asInt()).isEqualTo(3);
    assertThat(body.at("/resultsSummary/hasMore").asBoolean()).isTrue();
    assertThat(body.at("/results/0/file").asText()).isEqualTo("Cart.java");
    assertThat(body.at("/results/0/score").asDouble()).isEqualTo(0.91);
    assertThat(body.at("/results/1").has("snippet")).isFalse();
    assertThat(body.at("/distribution/byExtension/.java").asInt()).isEqualTo(2);
    assertThat(body.at("/distribution/byExtension/(none)").asInt()).isEqualTo(1);
    assertThat(body.at("/distribution/byDirectory/src~1cart").asInt()).isEqualTo(2);
    assertThat(body.at("/actions/0/id").asText()).isEqualTo("load_full_results");
    assertThat(body.at("/meta/mode").asText()).isEqualTo("summary");
    assertThat(body.at("/meta/truncated").asBoolean()).isTrue();
    assertThat(body.at("/meta/tokens").asInt()).isEqualTo(180);
    assertThat(body.at("/meta/strategy").asText()).isEqualTo("priority");
    assertThat(body.at("/meta/generation").asLong()).isEqualTo(7);
    assertThat(body.at("/meta/cached").asBoolean()).isTrue();
    assertThat(body.at("/meta/resourceUri").asText()).isEqualTo("codesearch-search://abc");
  }

  @Test
  void textSearchAppliesArgumentDefaults() {
    given(coordinator.search(any()))
        .willReturn(new SearchOutcome(truncatedResponse(), WORKSPACE, 1, false));

    service.textSearch("/work/shop", "cart", null, "full", 20, null, null);

    then(coordinator).should().search(requestCaptor.capture());
    SearchRequest request = requestCaptor.getValue();
    assertThat(request.maxTokens()).isNull();
    assertThat(request.mode()).isEqualTo("full");
    assertThat(request.maxResults()).isEqualTo(20);
    assertThat(request.diversify()).isFalse();
    assertThat(request.preserveOverflow()).isTrue();
  }

  // --- file_search ---

  @Test
  void fileSearchRunsThroughTheCoordinatorWithThePatternAsQuery() throws IOException {
    given(coordinator.fileSearch(any()))
        .willReturn(new SearchOutcome(truncatedResponse(), WORKSPACE, 3, false));

    JsonNode body = json(service.fileSearch("/work/shop", "*Cart*", 100, null));

    then(coordinator).should().fileSearch(requestCaptor.capture());
    then(coordinator).should(never()).search(any());
    assertThat(requestCaptor.getValue().query()).isEqualTo("*Cart*");
    assertThat(requestCaptor.getValue().maxTokens()).isEqualTo(100);
    assertThat(body.get("success").asBoolean()).isTrue();
    assertThat(body.get("query").asText()).isEqualTo("*Cart*");
    assertThat(body.at("/meta/generation").asLong()).isEqualTo(3);
  }

  @Test
  void fileSearchRejectsBlankPattern() throws IOException {
    JsonNode body = json(service.fileSearch("/work/shop", "", null, null));

    assertThat(body.get("success").asBoolean()).isFalse();
    assertThat(body.at("/error/kind").asText()).isEqualTo(McpToolService.INVALID_ARGUMENT);
    then(coordinator).should(never()).fileSearch(any());
  }

  @Test
  void textSearchRejectsBlankQueryWithoutCallingCoordinator() throws IOException {
    JsonNode body = json(service.textSearch("/work/shop", " ", null, null, null, null, null));

    assertThat(body.get("success").asBoolean()).isFalse();
    assertThat(body.at("/error/kind").asText()).isEqualTo(McpToolService.INVALID_ARGUMENT);
    assertThat(body.at("/error/retryable").asBoolean()).isFalse();
    then(coordinator).should(never()).search(any());
  }

  @Test
  void invalidBudgetBecomesInvalidArgument() throws IOException {
    JsonNode body = json(service.textSearch("/work/shop", "cart", 0, null, null, null, null));

    assertThat(body.at("/error/kind").asText()).isEqualTo(McpToolService.INVALID_ARGUMENT);
    assertThat(body.at("/error/message").asText()).contains("maxTokens");
  }

  @Test
  void capacityExceededIsReportedAsRetryable() throws IOException {
    given(coordinator.search(any()))
        .willThrow(new CapacityExceededException("/work/shop", Duration.ofSeconds(10)));

    JsonNode body = json(service.textSearch("/work/shop", "cart", null, null, null, null, null));

    assertThat(body.get("success").asBoolean()).isFalse();
    assertThat(body.at("/error/kind").asText()).isEqualTo("CAPACITY_EXCEEDED");
    assertThat(body.at("/error/retryable").asBoolean()).isTrue();
    assertThat(body.at("/error/remediation").asText()).isNotBlank();
  }

  @Test
  void indexFailuresAreMappedToErrorKinds() throws IOException {
    given(coordinator.search(any()))
        .willThrow(new IndexAccessException("segment missing", new IOException("gone")))
        .willThrow(new UncheckedIOException(new IOException("disk")))
        .willThrow(new IllegalStateException("boom"));

    JsonNode index = json(service.textSearch("/w", "q", null, null, null, null, null));
    JsonNode io = json(service.textSearch("/w", "q", null, null, null, null, null));
    JsonNode internal = json(service.textSearch("/w", "q", null, null, null, null, null));

    assertThat(index.at("/error/kind").asText()).isEqualTo(McpToolService.INDEX_ACCESS);
    assertThat(io.at("/error/kind").asText()).isEqualTo(McpToolService.IO_ERROR);
    assertThat(internal.at("/error/kind").asText()).isEqualTo(McpToolService.INTERNAL_ERROR);
    assertThat(internal.at("/error/message").asText()).contains("text_search").contains("boom");
  }

  // --- get_resource ---

  @Test
  void getResourceReturnsParsedPayload() throws IOException {
    given(coordinator.getResource("codesearch-search://abc"))
        .willReturn(
            new ResourceLookup(
                "codesearch-search://abc",
                ResourceLookup.Status.FOUND,
                "{\"totalResults\":40,\"results\":[]}"));

    JsonNode body = json(service.getResource("codesearch-search://abc"));

    assertThat(body.get("success").asBoolean()).isTrue();
    assertThat(body.at("/content/totalResults").asInt()).isEqualTo(40);
  }

  @Test
  void expiredAndMissingResourcesAreDistinguished() throws IOException {
    given(coordinator.getResource("codesearch-search://old"))
        .willReturn(
            new ResourceLookup("codesearch-search://old", ResourceLookup.Status.EXPIRED, null));
    given(coordinator.getResource("codesearch-search://nope"))
        .willReturn(
            new ResourceLookup("codesearch-search://nope", ResourceLookup.Status.NOT_FOUND, null));

    JsonNode expired = json(service.getResource("codesearch-search://old"));
    JsonNode missing = json(service.getResource("codesearch-search://nope"));

    assertThat(expired.at("/error/kind").asText()).isEqualTo(McpToolService.RESOURCE_EXPIRED);
    assertThat(missing.at("/error/kind").asText()).isEqualTo(McpToolService.RESOURCE_NOT_FOUND);
  }

  // --- index_workspace, evict_workspace ---

  @Test
  void indexWorkspaceReportsDocumentsAndGeneration() throws IOException {
    given(coordinator.indexWorkspace("/work/shop"))
        .willReturn(new IndexingResult(WORKSPACE, 42, 9, Duration.ofMillis(350)));

    JsonNode body = json(service.indexWorkspace("/work/shop"));

    assertThat(body.get("documents").asInt()).isEqualTo(42);
    assertThat(body.get("generation").asLong()).isEqualTo(9);
    assertThat(body.get("elapsedMs").asLong()).isEqualTo(350);
  }

  @Test
  void evictWorkspaceReportsWhetherItWasResident() throws IOException {
    given(coordinator.evictWorkspace("/work/shop")).willReturn(false);

    JsonNode body = json(service.evictWorkspace("/work/shop"));

    assertThat(body.get("success").asBoolean()).isTrue();
    assertThat(body.get("evicted").asBoolean()).isFalse();
  }

  @Test
  void blankWorkspacePathIsRejected() throws IOException {
    assertThat(json(service.indexWorkspace("")).at("/error/kind").asText())
        .isEqualTo(McpToolService.INVALID_ARGUMENT);
    assertThat(json(service.evictWorkspace(null)).at("/error/kind").asText())
        .isEqualTo(McpToolService.INVALID_ARGUMENT);
  }

  // --- cache_status, clear_cache ---

  @Test
  void cacheStatusListsWorkspacesAndStatistics() throws IOException {
    given(coordinator.status())
        .willReturn(
            new ServiceStatus(
                List.of(
                    new HandleSnapshot(
                        "/work/shop",
                        "0123456789abcdef",
                        HandleState.READY,
                        1,
                        false,
                        Instant.parse("2026-01-15T10:00:00Z"))),
                8,
                new CacheStats(3, 500, 6, 2, 0, 0),
                1));

    JsonNode body = json(service.cacheStatus());

    assertThat(body.at("/workspaces/0/state").asText()).isEqualTo("READY");
    assertThat(body.at("/workspaces/0/refCount").asInt()).isEqualTo(1);
    assertThat(body.get("workspaceCapacity").asInt()).isEqualTo(8);
    assertThat(body.at("/responseCache/hits").asLong()).isEqualTo(6);
    assertThat(body.get("hitRatio").asDouble()).isEqualTo(0.75);
    assertThat(body.get("resources").asInt()).isEqualTo(1);
  }

  @Test
  void clearCacheDelegatesToCoordinator() throws IOException {
    JsonNode body = json(service.clearCache());

    assertThat(body.get("cleared").asBoolean()).isTrue();
    then(coordinator).should().clearResponseCache();
  }
}
