package dev.codesearch.workspace;

import java.nio.file.Path;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings of the {@link WorkspaceIndexCache}, bound from {@code codesearch.workspace.*}.
 *
 * @param maxResidentHandles maximum number of open indexes
 * @param idleTimeout unused handles idle longer than this are closed by the sweep
 * @param sweepInterval period of the idle sweep
 * @param acquireTimeout how long an acquire waits for a free slot
 * @param drainTimeout how long shutdown waits for active leases before force-closing
 * @param basePath root directory for indexes and logs
 */
@ConfigurationProperties(prefix = "codesearch.workspace")
public record WorkspaceProperties(
    int maxResidentHandles,
    Duration idleTimeout,
    Duration sweepInterval,
    Duration acquireTimeout,
    Duration drainTimeout,
    Path basePath) {

  public WorkspaceProperties {
    if (maxResidentHandles == 0) {
      maxResidentHandles = 8;
    }
    if (idleTimeout == null) {
      idleTimeout = Duration.ofMinutes(30);
    }
    if (sweepInterval == null) {
      sweepInterval = Duration.ofMinutes(1);
    }
    if (acquireTimeout == null) {
      acquireTimeout = Duration.ofSeconds(10);
    }
    if (drainTimeout == null) {
      drainTimeout = Duration.ofSeconds(5);
    }
    if (basePath == null) {
      basePath = Path.of(System.getProperty("user.home"), ".codesearch");
    }
    if (maxResidentHandles < 1) {
      throw new IllegalStateException(
          "codesearch.workspace.max-resident-handles must be at least 1, got: "
              + maxResidentHandles);
    }
    requirePositive("idle-timeout", idleTimeout);
    requirePositive("sweep-interval", sweepInterval);
    if (acquireTimeout.isNegative() || drainTimeout.isNegative()) {
      throw new IllegalStateException(
          "codesearch.workspace acquire-timeout and drain-timeout must not be negative");
    }
  }

  private static void requirePositive(String name, Duration value) {
    if (value.isNegative() || value.isZero()) {
      throw new IllegalStateException(
          "codesearch.workspace." + name + " must be positive, got: " + value);
    }
  }

  /** Directory holding one index directory per workspace key. */
  public Path indexRoot() {
    return basePath.resolve("indexes");
  }
}
