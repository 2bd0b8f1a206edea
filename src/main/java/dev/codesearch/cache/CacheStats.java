package dev.codesearch.cache;

/**
 * Point-in-time statistics of a {@link ResponseCache}.
 *
 * @param size approximate number of live entries
 * @param capacity configured maximum number of entries
 * @param hits lookups served from the cache
 * @param misses lookups that found nothing usable
 * @param evictions entries removed by size or expiry
 * @param corruptions entries dropped because they could not be deserialized
 */
public record CacheStats(
    long size, long capacity, long hits, long misses, long evictions, long corruptions) {

  public double hitRatio() {
    long total = hits + misses;
    return total == 0 ? 0.0 : (double) hits / total;
  }
}
