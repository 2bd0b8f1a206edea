package dev.codesearch.response;

import java.util.Locale;
import org.jspecify.annotations.Nullable;

/** How much of each result a response carries. */
public enum ResponseMode {
  /** Snippets capped at a fixed length; the default. */
  SUMMARY,
  /** Snippets as stored in the index. */
  FULL;

  /**
   * Parses a mode name case-insensitively.
   *
   * @param value the mode name; {@code null} or blank means {@link #SUMMARY}
   * @return the parsed mode
   * @throws IllegalArgumentException for unknown names
   */
  public static ResponseMode parse(@Nullable String value) {
    if (value == null || value.isBlank()) {
      return SUMMARY;
    }
    for (ResponseMode mode : values()) {
      if (mode.name().equalsIgnoreCase(value.trim())) {
        return mode;
      }
    }
    throw new IllegalArgumentException(
        "Unknown response mode '" + value + "'. Use 'summary' or 'full'.");
  }

  public String value() {
    return name().toLowerCase(Locale.ROOT);
  }
}
