package dev.codesearch.workspace;

import org.jspecify.annotations.Nullable;

/**
 * Base of all failures raised by the {@link WorkspaceIndexCache}.
 *
 * <p>Carries what a client needs to react: a {@link ErrorKind}, whether the same call may succeed
 * later, and a short remediation hint.
 */
public class WorkspaceException extends RuntimeException {

  private final ErrorKind kind;
  private final boolean retryable;
  private final String remediation;

  public WorkspaceException(
      ErrorKind kind,
      String message,
      boolean retryable,
      String remediation,
      @Nullable Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.retryable = retryable;
    this.remediation = remediation;
  }

  public ErrorKind kind() {
    return kind;
  }

  public boolean retryable() {
    return retryable;
  }

  public String remediation() {
    return remediation;
  }
}
