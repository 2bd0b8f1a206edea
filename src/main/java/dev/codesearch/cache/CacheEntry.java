package dev.codesearch.cache;

import java.time.Duration;
import java.time.Instant;

/**
 * A serialized cache value with its bookkeeping. Entries are replaced by key, never mutated.
 *
 * @param payload the value serialized as JSON
 * @param insertedAt when the entry was written
 * @param ttl time-to-live measured from {@code insertedAt}
 * @param sizeWeight estimated token weight of the value, reported in statistics
 */
record CacheEntry(String payload, Instant insertedAt, Duration ttl, int sizeWeight) {

  Instant expiresAt() {
    return insertedAt.plus(ttl);
  }
}
