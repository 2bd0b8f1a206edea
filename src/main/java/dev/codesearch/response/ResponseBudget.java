package dev.codesearch.response;

/**
 * Size budget for one response build.
 *
 * @param maxTokens maximum estimated tokens of the returned results
 * @param mode response mode
 */
public record ResponseBudget(int maxTokens, ResponseMode mode) {

  public ResponseBudget {
    if (maxTokens < 1) {
      throw new IllegalArgumentException("maxTokens must be at least 1, got: " + maxTokens);
    }
    if (mode == null) {
      mode = ResponseMode.SUMMARY;
    }
  }

  public static ResponseBudget of(int maxTokens) {
    return new ResponseBudget(maxTokens, ResponseMode.SUMMARY);
  }
}
