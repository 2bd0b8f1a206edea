package dev.codesearch.mcp;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.codesearch.index.IndexAccessException;
import dev.codesearch.resource.ResourceLookup;
import dev.codesearch.search.IndexingResult;
import dev.codesearch.search.SearchCoordinator;
import dev.codesearch.search.SearchOutcome;
import dev.codesearch.search.SearchRequest;
import dev.codesearch.search.ServiceStatus;
import dev.codesearch.workspace.WorkspaceException;
import java.io.UncheckedIOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Supplier;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Service;

/**
 * MCP adapter exposing code search as tool methods.
 *
 * <p>Each method is annotated with {@code @Tool} and registered via {@link McpToolConfig}. Tool
 * methods follow the structured error pattern: every exception is caught and returned as an {@link
 * ErrorEnvelope} JSON string, never thrown.
 *
 * <p>Tools: {@code text_search}, {@code file_search}, {@code get_resource}, {@code
 * index_workspace}, {@code evict_workspace}, {@code cache_status}, {@code clear_cache}.
 *
 * @see SearchCoordinator
 */
@Service
public class McpToolService {

  private static final Logger log = LoggerFactory.getLogger(McpToolService.class);

  static final String INVALID_ARGUMENT = "INVALID_ARGUMENT";
  static final String RESOURCE_NOT_FOUND = "RESOURCE_NOT_FOUND";
  static final String RESOURCE_EXPIRED = "RESOURCE_EXPIRED";
  static final String INDEX_ACCESS = "INDEX_ACCESS";
  static final String IO_ERROR = "IO_ERROR";
  static final String INTERNAL_ERROR = "INTERNAL_ERROR";

  private final SearchCoordinator coordinator;
  private final ObjectMapper objectMapper;

  public McpToolService(SearchCoordinator coordinator, ObjectMapper objectMapper) {
    this.coordinator = coordinator;
    this.objectMapper = objectMapper;
  }

  /** Full-text search over one workspace, bounded to a token budget. */
  @Tool(
      name = "text_search",
      description =
          "Search file contents of a workspace with Lucene query syntax. "
              + "The response is bounded to a token budget; when results are truncated, "
              + "meta.resourceUri points to the complete result set (read it with get_resource).")
  public String textSearch(
      @ToolParam(description = "Absolute path of the workspace directory") @Nullable
          String workspacePath,
      @ToolParam(description = "Search query (Lucene syntax, e.g. 'cache AND evict')") @Nullable
          String query,
      @ToolParam(description = "Token budget for the response (default 5000)", required = false)
          @Nullable Integer maxTokens,
      @ToolParam(
              description = "Response mode: 'summary' (snippets capped) or 'full'",
              required = false)
          @Nullable String mode,
      @ToolParam(description = "Maximum number of raw hits (default 500)", required = false)
          @Nullable Integer maxResults,
      @ToolParam(
              description = "Spread results across directories when truncating",
              required = false)
          @Nullable Boolean diversify,
      @ToolParam(
              description = "Keep the full result set as a resource when truncated (default true)",
              required = false)
          @Nullable Boolean preserveOverflow) {
    return respond(
        "text_search",
        () -> {
          if (workspacePath == null || workspacePath.isBlank()) {
            return invalidArgument("workspacePath must not be empty. Provide a directory path.");
          }
          if (query == null || query.isBlank()) {
            return invalidArgument("query must not be empty. Provide a search query string.");
          }
          SearchOutcome outcome =
              coordinator.search(
                  new SearchRequest(
                      workspacePath,
                      query,
                      maxTokens,
                      mode,
                      maxResults,
                      Boolean.TRUE.equals(diversify),
                      !Boolean.FALSE.equals(preserveOverflow)));
          return SearchEnvelope.from(query, outcome);
        });
  }

  /** Lists files whose names match a pattern, bounded to a token budget. */
  @Tool(
      name = "file_search",
      description =
          "Find files of a workspace by name. '*' and '?' are wildcards; a pattern without "
              + "wildcards matches names containing it, a pattern with '/' matches the path. "
              + "Matching ignores case. "
              + "The response is bounded to a token budget like text_search.")
  public String fileSearch(
      @ToolParam(description = "Absolute path of the workspace directory") @Nullable
          String workspacePath,
      @ToolParam(description = "File name pattern, e.g. '*Cache*.java'") @Nullable String pattern,
      @ToolParam(description = "Token budget for the response (default 5000)", required = false)
          @Nullable Integer maxTokens,
      @ToolParam(description = "Maximum number of files (default 500)", required = false)
          @Nullable Integer maxResults) {
    return respond(
        "file_search",
        () -> {
          if (workspacePath == null || workspacePath.isBlank()) {
            return invalidArgument("workspacePath must not be empty. Provide a directory path.");
          }
          if (pattern == null || pattern.isBlank()) {
            return invalidArgument("pattern must not be empty. Provide a file name pattern.");
          }
          SearchOutcome outcome =
              coordinator.fileSearch(
                  new SearchRequest(
                      workspacePath, pattern, maxTokens, null, maxResults, true, true));
          return SearchEnvelope.from(pattern, outcome);
        });
  }

  /** Reads back the complete result set of a truncated search. */
  @Tool(
      name = "get_resource",
      description =
          "Read a stored resource by URI (codesearch-search://...), "
              + "such as the complete results of a truncated search.")
  public String getResource(
      @ToolParam(description = "Resource URI from meta.resourceUri") @Nullable String uri) {
    return respond(
        "get_resource",
        () -> {
          if (uri == null || uri.isBlank()) {
            return invalidArgument("uri must not be empty. Provide a resource URI.");
          }
          ResourceLookup lookup = coordinator.getResource(uri);
          return switch (lookup.status()) {
            case FOUND -> {
              Map<String, Object> body = new LinkedHashMap<>();
              body.put("success", true);
              body.put("uri", uri);
              body.put("content", readPayload(lookup.payload()));
              yield body;
            }
            case EXPIRED ->
                ErrorEnvelope.of(
                    RESOURCE_EXPIRED,
                    "Resource has expired: " + uri,
                    false,
                    "Re-run the search to regenerate the complete results");
            case NOT_FOUND ->
                ErrorEnvelope.of(
                    RESOURCE_NOT_FOUND,
                    "No resource found for: " + uri,
                    false,
                    "Check the URI, or re-run the search");
          };
        });
  }

  /** Rebuilds the index of a workspace. */
  @Tool(
      name = "index_workspace",
      description =
          "Index (or fully re-index) all text files of a workspace. "
              + "Skips .git, build output, IDE folders, binary files "
              + "and files over the size limit.")
  public String indexWorkspace(
      @ToolParam(description = "Absolute path of the workspace directory") @Nullable
          String workspacePath) {
    return respond(
        "index_workspace",
        () -> {
          if (workspacePath == null || workspacePath.isBlank()) {
            return invalidArgument("workspacePath must not be empty. Provide a directory path.");
          }
          IndexingResult result = coordinator.indexWorkspace(workspacePath);
          Map<String, Object> body = new LinkedHashMap<>();
          body.put("success", true);
          body.put("workspace", result.workspace().root().toString());
          body.put("documents", result.documents());
          body.put("generation", result.generation());
          body.put("elapsedMs", result.elapsed().toMillis());
          return body;
        });
  }

  /** Closes the index of a workspace once no search uses it. */
  @Tool(
      name = "evict_workspace",
      description =
          "Close the open index of a workspace to free resources. "
              + "Active searches finish first; the index reopens on the next search.")
  public String evictWorkspace(
      @ToolParam(description = "Absolute path of the workspace directory") @Nullable
          String workspacePath) {
    return respond(
        "evict_workspace",
        () -> {
          if (workspacePath == null || workspacePath.isBlank()) {
            return invalidArgument("workspacePath must not be empty. Provide a directory path.");
          }
          boolean resident = coordinator.evictWorkspace(workspacePath);
          Map<String, Object> body = new LinkedHashMap<>();
          body.put("success", true);
          body.put("workspace", workspacePath);
          body.put("evicted", resident);
          return body;
        });
  }

  /** Reports open workspaces, response cache statistics and stored resources. */
  @Tool(
      name = "cache_status",
      description =
          "Show open workspace indexes, response cache statistics and stored resource count.")
  public String cacheStatus() {
    return respond(
        "cache_status",
        () -> {
          ServiceStatus status = coordinator.status();
          Map<String, Object> body = new LinkedHashMap<>();
          body.put("success", true);
          body.put("workspaces", status.workspaces());
          body.put("workspaceCapacity", status.workspaceCapacity());
          body.put("responseCache", status.responseCache());
          body.put("hitRatio", status.responseCache().hitRatio());
          body.put("resources", status.resources());
          return body;
        });
  }

  /** Drops every cached response. */
  @Tool(
      name = "clear_cache",
      description = "Clear the response cache. Open indexes and stored resources are kept.")
  public String clearCache() {
    return respond(
        "clear_cache",
        () -> {
          coordinator.clearResponseCache();
          Map<String, Object> body = new LinkedHashMap<>();
          body.put("success", true);
          body.put("cleared", true);
          return body;
        });
  }

  private String respond(String tool, Supplier<Object> action) {
    Object body;
    try {
      body = action.get();
    } catch (WorkspaceException e) {
      log.debug("{} failed: {}", tool, e.getMessage());
      body = ErrorEnvelope.of(e.kind().name(), e.getMessage(), e.retryable(), e.remediation());
    } catch (IllegalArgumentException e) {
      body = invalidArgument(e.getMessage());
    } catch (IndexAccessException e) {
      log.warn("{} failed: {}", tool, e.getMessage(), e);
      body =
          ErrorEnvelope.of(
              INDEX_ACCESS,
              e.getMessage(),
              true,
              "Retry; if the problem persists rebuild with index_workspace");
    } catch (UncheckedIOException e) {
      log.warn("{} failed: {}", tool, e.getMessage(), e);
      body = ErrorEnvelope.of(IO_ERROR, e.getMessage(), true, "Check the workspace files");
    } catch (Exception e) {
      log.error("{} failed unexpectedly", tool, e);
      body =
          ErrorEnvelope.of(
              INTERNAL_ERROR, "Error in " + tool + ": " + e.getMessage(), false, "Report a bug");
    }
    return write(body);
  }

  private JsonNode readPayload(@Nullable String payload) {
    if (payload == null) {
      return objectMapper.getNodeFactory().nullNode();
    }
    try {
      return objectMapper.readTree(payload);
    } catch (JsonProcessingException e) {
      return objectMapper.getNodeFactory().textNode(payload);
    }
  }

  private String write(Object body) {
    try {
      return objectMapper.writeValueAsString(body);
    } catch (JsonProcessingException e) {
      log.error("Failed to serialize tool response", e);
      return "{\"success\":false,\"error\":{\"kind\":\""
          + INTERNAL_ERROR
          + "\",\"message\":\"Failed to serialize response\",\"retryable\":false,"
          + "\"remediation\":\"Report a bug\"}}";
    }
  }

  private static ErrorEnvelope invalidArgument(@Nullable String message) {
    return ErrorEnvelope.of(
        INVALID_ARGUMENT,
        message == null ? "Invalid argument" : message,
        false,
        "Correct the arguments and call again");
  }
}
