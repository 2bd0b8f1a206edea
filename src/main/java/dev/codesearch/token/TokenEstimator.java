package dev.codesearch.token;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.Collection;
import org.jspecify.annotations.Nullable;
import org.springframework.stereotype.Component;

/**
 * Estimates the token cost of response fragments.
 *
 * <p>Uses character-based estimation (chars / 4, rounded up) over the JSON form of the value, the
 * usual approximation for English text and source code. Strings are measured directly; every other
 * value is serialized with the shared {@link ObjectMapper} first, so the estimate tracks what the
 * client actually receives.
 *
 * <p>The estimate is deterministic and monotonic: a longer serialized form never costs less. Exact
 * protocol-level accuracy is not a goal.
 */
@Component
public class TokenEstimator {

  static final double CHARS_PER_TOKEN = 4.0;

  private final ObjectMapper objectMapper;

  public TokenEstimator(ObjectMapper objectMapper) {
    this.objectMapper = objectMapper;
  }

  /**
   * Estimates the cost of a single value.
   *
   * @param item the value to estimate; {@code null} costs nothing
   * @return estimated tokens, at least 1 for any non-null value
   */
  public int estimate(@Nullable Object item) {
    if (item == null) {
      return 0;
    }
    if (item instanceof CharSequence text) {
      return estimateChars(text.length());
    }
    return estimateChars(serializedLength(item));
  }

  /**
   * Estimates the cost of a collection as the sum of its items.
   *
   * @param items the values to estimate
   * @return total estimated tokens
   */
  public int estimateCollection(@Nullable Collection<?> items) {
    if (items == null || items.isEmpty()) {
      return 0;
    }
    long total = 0;
    for (Object item : items) {
      total += estimate(item);
    }
    return (int) Math.min(Integer.MAX_VALUE, total);
  }

  int estimateChars(int chars) {
    return Math.max(1, (int) Math.ceil(chars / CHARS_PER_TOKEN));
  }

  private int serializedLength(Object item) {
    try {
      return objectMapper.writeValueAsString(item).length();
    } catch (JsonProcessingException e) {
      // Unserializable values fall back to their string form
      return String.valueOf(item).length();
    }
  }
}
