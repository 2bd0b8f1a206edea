package dev.codesearch.mcp;

/**
 * Tool failure as returned to the client.
 *
 * @param success always {@code false}
 * @param error what went wrong and what to do about it
 */
public record ErrorEnvelope(boolean success, Detail error) {

  /**
   * @param kind stable machine-readable failure class
   * @param message human-readable description
   * @param retryable whether the same call may succeed later
   * @param remediation suggested next step
   */
  public record Detail(String kind, String message, boolean retryable, String remediation) {}

  public static ErrorEnvelope of(
      String kind, String message, boolean retryable, String remediation) {
    return new ErrorEnvelope(false, new Detail(kind, message, retryable, remediation));
  }
}
