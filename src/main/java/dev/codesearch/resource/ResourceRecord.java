package dev.codesearch.resource;

import java.time.Instant;

/**
 * An immutable overflow payload stored under a unique URI.
 *
 * @param uri unique resource URI, never reused
 * @param payload serialized content (JSON)
 * @param createdAt when the record was stored
 * @param expiresAt instant from which lookups report the record as expired
 * @param sequence insertion order, used to drop the oldest records first
 */
public record ResourceRecord(
    String uri, String payload, Instant createdAt, Instant expiresAt, long sequence) {

  boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }
}
