package dev.codesearch.response;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the response pipeline, bound from {@code codesearch.response.*}.
 *
 * @param defaultTokenBudget budget applied when a request names none
 * @param cacheCapacity maximum number of cached responses
 * @param cacheTtl lifetime of a cached response
 * @param overflowTtl lifetime of a preserved full result set
 * @param preserveOverflow whether truncated responses keep their full result set as a resource
 * @param maxResults upper bound on raw results fetched from the index per query
 */
@ConfigurationProperties(prefix = "codesearch.response")
public record ResponseProperties(
    int defaultTokenBudget,
    int cacheCapacity,
    Duration cacheTtl,
    Duration overflowTtl,
    Boolean preserveOverflow,
    int maxResults) {

  public ResponseProperties {
    if (defaultTokenBudget == 0) {
      defaultTokenBudget = 5000;
    }
    if (cacheCapacity == 0) {
      cacheCapacity = 500;
    }
    if (cacheTtl == null) {
      cacheTtl = Duration.ofMinutes(15);
    }
    if (overflowTtl == null) {
      overflowTtl = Duration.ofMinutes(30);
    }
    if (preserveOverflow == null) {
      preserveOverflow = Boolean.TRUE;
    }
    if (maxResults == 0) {
      maxResults = 500;
    }
    if (defaultTokenBudget < 100) {
      throw new IllegalStateException(
          "codesearch.response.default-token-budget must be at least 100, got: "
              + defaultTokenBudget);
    }
    if (cacheCapacity < 1) {
      throw new IllegalStateException(
          "codesearch.response.cache-capacity must be at least 1, got: " + cacheCapacity);
    }
    if (overflowTtl.isNegative() || overflowTtl.isZero()) {
      throw new IllegalStateException(
          "codesearch.response.overflow-ttl must be positive, got: " + overflowTtl);
    }
    if (maxResults < 1 || maxResults > 10_000) {
      throw new IllegalStateException(
          "codesearch.response.max-results must be in [1, 10000], got: " + maxResults);
    }
  }

  /** Defaults used when nothing is configured. */
  public static ResponseProperties defaults() {
    return new ResponseProperties(0, 0, null, null, null, 0);
  }
}
