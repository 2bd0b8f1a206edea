package dev.codesearch.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Expiry;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Capacity-bounded cache of fully built responses, keyed by {@link ResponseFingerprint}.
 *
 * <p>Backed by Caffeine with {@code maximumSize} eviction and a per-entry TTL. Values are stored in
 * serialized form so that a cached response can never be mutated through a shared reference; each
 * hit yields a fresh, equal copy. An entry that fails to deserialize is treated as a miss and
 * invalidated.
 *
 * <p>When full, Caffeine's W-TinyLFU policy picks the victim by recency and frequency of use, not
 * strictly least-recently-used and not earliest-expiry-first. It may also reject a newly written
 * entry in favour of a frequently read one, so a put is not guaranteed to be retrievable. Size
 * never exceeds the capacity.
 *
 * <p>All operations are non-blocking. Cache maintenance runs on the calling thread, which keeps
 * eviction deterministic and away from any other background work.
 *
 * @param <V> the cached value type
 */
public class ResponseCache<V> {

  private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

  private final Cache<String, CacheEntry> cache;
  private final ObjectMapper objectMapper;
  private final Class<V> valueType;
  private final Clock clock;
  private final long capacity;
  private final AtomicLong corruptions = new AtomicLong();

  public ResponseCache(Class<V> valueType, ObjectMapper objectMapper, Clock clock, long capacity) {
    if (capacity < 1) {
      throw new IllegalArgumentException("Cache capacity must be at least 1, got: " + capacity);
    }
    this.valueType = valueType;
    this.objectMapper = objectMapper;
    this.clock = clock;
    this.capacity = capacity;
    this.cache =
        Caffeine.newBuilder()
            .maximumSize(capacity)
            .expireAfter(new EntryTtl())
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .executor(Runnable::run)
            .recordStats()
            .build();
  }

  /**
   * Looks up a value.
   *
   * @param key the fingerprint
   * @return the cached value, or empty on a miss (including expired and corrupted entries)
   */
  public Optional<V> get(String key) {
    CacheEntry entry = cache.getIfPresent(key);
    if (entry == null) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(entry.payload(), valueType));
    } catch (JsonProcessingException e) {
      corruptions.incrementAndGet();
      cache.asMap().remove(key, entry);
      log.warn("Dropping unreadable cache entry {}: {}", key, e.getOriginalMessage());
      return Optional.empty();
    }
  }

  /**
   * Stores a value, replacing any previous value under the same key.
   *
   * @param key the fingerprint
   * @param value the value to cache
   * @param ttl time-to-live; non-positive values skip caching
   * @param sizeWeight estimated weight of the value, for statistics
   */
  public void put(String key, V value, Duration ttl, int sizeWeight) {
    if (ttl == null || ttl.isZero() || ttl.isNegative()) {
      return;
    }
    String payload;
    try {
      payload = objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      log.warn("Response for {} is not cacheable: {}", key, e.getOriginalMessage());
      return;
    }
    cache.put(key, new CacheEntry(payload, clock.instant(), ttl, sizeWeight));
  }

  /** Stores an already serialized payload as-is, bypassing serialization. */
  void putRaw(String key, String payload, Duration ttl) {
    cache.put(key, new CacheEntry(payload, clock.instant(), ttl, 0));
  }

  public void invalidate(String key) {
    cache.invalidate(key);
  }

  public void invalidateAll() {
    long before = cache.estimatedSize();
    cache.invalidateAll();
    log.info("Response cache cleared ({} entries)", before);
  }

  /** Forces pending size and expiry maintenance. */
  public void cleanUp() {
    cache.cleanUp();
  }

  public CacheStats stats() {
    com.github.benmanes.caffeine.cache.stats.CacheStats stats = cache.stats();
    return new CacheStats(
        cache.estimatedSize(),
        capacity,
        stats.hitCount() - corruptions.get(),
        stats.missCount() + corruptions.get(),
        stats.evictionCount(),
        corruptions.get());
  }

  private static final class EntryTtl implements Expiry<String, CacheEntry> {

    @Override
    public long expireAfterCreate(String key, CacheEntry entry, long currentTime) {
      return entry.ttl().toNanos();
    }

    @Override
    public long expireAfterUpdate(
        String key, CacheEntry entry, long currentTime, long currentDuration) {
      return entry.ttl().toNanos();
    }

    @Override
    public long expireAfterRead(
        String key, CacheEntry entry, long currentTime, long currentDuration) {
      return currentDuration;
    }
  }
}
