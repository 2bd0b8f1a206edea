package dev.codesearch.resource;

import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the overflow {@link ResourceStore}, bound from {@code codesearch.resource.*}.
 *
 * @param maxTtl upper bound applied to every requested TTL
 * @param purgeInterval period of the background purge of expired records
 * @param maxRecords maximum number of live records; the oldest are dropped first
 */
@ConfigurationProperties(prefix = "codesearch.resource")
public record ResourceProperties(Duration maxTtl, Duration purgeInterval, int maxRecords) {

  public ResourceProperties {
    if (maxTtl == null) {
      maxTtl = Duration.ofHours(24);
    }
    if (purgeInterval == null) {
      purgeInterval = Duration.ofMinutes(5);
    }
    if (maxRecords == 0) {
      maxRecords = 1000;
    }
    if (maxTtl.isNegative() || maxTtl.isZero()) {
      throw new IllegalStateException(
          "codesearch.resource.max-ttl must be positive, got: " + maxTtl);
    }
    if (purgeInterval.isNegative() || purgeInterval.isZero()) {
      throw new IllegalStateException(
          "codesearch.resource.purge-interval must be positive, got: " + purgeInterval);
    }
    if (maxRecords < 1) {
      throw new IllegalStateException(
          "codesearch.resource.max-records must be at least 1, got: " + maxRecords);
    }
  }

  /** Defaults used when nothing is configured. */
  public static ResourceProperties defaults() {
    return new ResourceProperties(null, null, 0);
  }
}
