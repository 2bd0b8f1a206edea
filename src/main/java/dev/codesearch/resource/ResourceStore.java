package dev.codesearch.resource;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory, URI-addressed store for overflow payloads: the full result set of a search whose
 * response had to be truncated.
 *
 * <p>Records are immutable and live until their TTL elapses. A lookup at or after {@code
 * expiresAt} reports {@link ResourceLookup.Status#EXPIRED} and drops the record, so stale payload
 * is never served even between purge runs. A background task purges expired records every {@code
 * purge-interval}.
 *
 * <p>URIs have the form {@code codesearch-search://<uuid>} and are never reused.
 */
@Component
public class ResourceStore {

  private static final Logger log = LoggerFactory.getLogger(ResourceStore.class);

  public static final String SCHEME = "codesearch-search";
  static final String URI_PREFIX = SCHEME + "://";

  private final ConcurrentHashMap<String, ResourceRecord> records = new ConcurrentHashMap<>();
  private final AtomicLong sequence = new AtomicLong();
  private final Clock clock;
  private final ResourceProperties properties;
  private final ScheduledExecutorService purgeScheduler;

  public ResourceStore(Clock clock, ResourceProperties properties) {
    this.clock = clock;
    this.properties = properties;
    this.purgeScheduler =
        Executors.newSingleThreadScheduledExecutor(
            r -> {
              Thread t = new Thread(r, "codesearch-resource-purge");
              t.setDaemon(true);
              return t;
            });
  }

  @PostConstruct
  void startPurging() {
    long periodMs = properties.purgeInterval().toMillis();
    purgeScheduler.scheduleWithFixedDelay(
        this::purgeQuietly, periodMs, periodMs, TimeUnit.MILLISECONDS);
    log.info(
        "Resource store started (max-ttl={}, purge-interval={}, max-records={})",
        properties.maxTtl(),
        properties.purgeInterval(),
        properties.maxRecords());
  }

  @PreDestroy
  void stopPurging() {
    purgeScheduler.shutdownNow();
  }

  /**
   * Stores a payload.
   *
   * @param payload serialized content
   * @param ttl requested time-to-live, clamped to {@code max-ttl}
   * @return the URI under which the payload can be read back
   */
  public String put(String payload, Duration ttl) {
    Duration effectiveTtl = effectiveTtl(ttl);
    Instant now = clock.instant();
    String uri = URI_PREFIX + UUID.randomUUID();
    records.put(
        uri,
        new ResourceRecord(
            uri, payload, now, now.plus(effectiveTtl), sequence.incrementAndGet()));
    enforceCapacity();
    log.debug("Stored resource {} ({} chars, ttl {})", uri, payload.length(), effectiveTtl);
    return uri;
  }

  /**
   * Reads a payload back.
   *
   * @param uri the resource URI
   * @return the typed lookup outcome
   */
  public ResourceLookup get(String uri) {
    ResourceRecord record = records.get(uri);
    if (record == null) {
      return ResourceLookup.notFound(uri);
    }
    if (record.isExpired(clock.instant())) {
      records.remove(uri, record);
      return ResourceLookup.expired(uri);
    }
    return ResourceLookup.found(uri, record.payload());
  }

  /**
   * Removes all expired records.
   *
   * @return number of records removed
   */
  public int purgeExpired() {
    Instant now = clock.instant();
    int removed = 0;
    for (ResourceRecord record : records.values()) {
      if (record.isExpired(now) && records.remove(record.uri(), record)) {
        removed++;
      }
    }
    if (removed > 0) {
      log.info("Purged {} expired resources", removed);
    }
    return removed;
  }

  /** Live records, oldest first. Payloads are included; callers should not log them. */
  public List<ResourceRecord> list() {
    Instant now = clock.instant();
    return records.values().stream()
        .filter(r -> !r.isExpired(now))
        .sorted(Comparator.comparingLong(ResourceRecord::sequence))
        .toList();
  }

  public int size() {
    return records.size();
  }

  public static boolean isResourceUri(String uri) {
    return uri != null && uri.startsWith(URI_PREFIX);
  }

  /**
   * The lifetime a record stored with {@code ttl} actually gets.
   *
   * @throws IllegalArgumentException if {@code ttl} is not positive
   */
  public Duration effectiveTtl(Duration ttl) {
    if (ttl == null || ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("Resource TTL must be positive, got: " + ttl);
    }
    return ttl.compareTo(properties.maxTtl()) > 0 ? properties.maxTtl() : ttl;
  }

  private void enforceCapacity() {
    int overflow = records.size() - properties.maxRecords();
    if (overflow <= 0) {
      return;
    }
    records.values().stream()
        .sorted(Comparator.comparingLong(ResourceRecord::sequence))
        .limit(overflow)
        .forEach(r -> records.remove(r.uri(), r));
    log.debug("Dropped {} oldest resources to stay within {}", overflow, properties.maxRecords());
  }

  private void purgeQuietly() {
    try {
      purgeExpired();
    } catch (RuntimeException e) {
      log.warn("Resource purge failed: {}", e.getMessage(), e);
    }
  }
}
