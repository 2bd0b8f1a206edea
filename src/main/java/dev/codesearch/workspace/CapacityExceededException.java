package dev.codesearch.workspace;

import java.time.Duration;

/** No handle slot became available within the acquire timeout. */
public class CapacityExceededException extends WorkspaceException {

  public CapacityExceededException(String workspace, Duration waited) {
    super(
        ErrorKind.CAPACITY_EXCEEDED,
        "No index slot available for " + workspace + " after " + waited.toMillis() + " ms",
        true,
        "Retry later, or evict an idle workspace with evict_workspace",
        null);
  }

  CapacityExceededException(String workspace, InterruptedException cause) {
    super(
        ErrorKind.CAPACITY_EXCEEDED,
        "Interrupted while waiting for an index slot for " + workspace,
        true,
        "Retry later",
        cause);
  }
}
