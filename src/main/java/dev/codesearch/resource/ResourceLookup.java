package dev.codesearch.resource;

import org.jspecify.annotations.Nullable;

/**
 * Typed result of a {@link ResourceStore} lookup. Missing and expired resources are ordinary
 * outcomes, not exceptions.
 *
 * @param uri the requested URI
 * @param status lookup outcome
 * @param payload the stored payload when {@code status} is {@link Status#FOUND}
 */
public record ResourceLookup(String uri, Status status, @Nullable String payload) {

  /** Outcome of a lookup. */
  public enum Status {
    FOUND,
    EXPIRED,
    NOT_FOUND
  }

  static ResourceLookup found(String uri, String payload) {
    return new ResourceLookup(uri, Status.FOUND, payload);
  }

  static ResourceLookup expired(String uri) {
    return new ResourceLookup(uri, Status.EXPIRED, null);
  }

  static ResourceLookup notFound(String uri) {
    return new ResourceLookup(uri, Status.NOT_FOUND, null);
  }

  public boolean isFound() {
    return status == Status.FOUND;
  }
}
