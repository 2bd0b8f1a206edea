package dev.codesearch.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.codesearch.cache.ResponseCache;
import dev.codesearch.index.IndexCapability;
import dev.codesearch.index.LuceneIndexCapability;
import dev.codesearch.response.BuiltResponse;
import dev.codesearch.response.ResponseProperties;
import dev.codesearch.workspace.WorkspaceProperties;
import java.time.Clock;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the process-wide caches: one response cache and one index capability, shared by every
 * request handler for the lifetime of the application.
 */
@Configuration
public class ServiceConfig {

  @Bean
  public ResponseCache<BuiltResponse> responseCache(
      ObjectMapper objectMapper, Clock clock, ResponseProperties properties) {
    return new ResponseCache<>(
        BuiltResponse.class, objectMapper, clock, properties.cacheCapacity());
  }

  @Bean
  public IndexCapability indexCapability(WorkspaceProperties properties) {
    return new LuceneIndexCapability(properties.indexRoot());
  }
}
