package dev.codesearch.index;

import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;

/**
 * One query match as returned by an {@link IndexCapability}.
 *
 * <p>Opaque to the response pipeline apart from its path, score and estimated cost. Fields are kept
 * in a sorted map so that serialization, and therefore token estimation and fingerprints, is
 * stable.
 *
 * @param path workspace-relative file path, using forward slashes
 * @param score relevance score from the index (higher is better)
 * @param fields stored metadata such as {@code extension}, {@code size}, {@code modified}
 * @param snippet optional excerpt of the matched content
 */
public record RawResult(
    String path, double score, Map<String, String> fields, @Nullable String snippet) {

  public RawResult {
    fields = fields == null ? Map.of() : Collections.unmodifiableMap(new TreeMap<>(fields));
  }

  /** Convenience constructor for a result without metadata or snippet. */
  public RawResult(String path, double score) {
    this(path, score, Map.of(), null);
  }

  /**
   * Parent directory of {@link #path()}, used as the diversity key for clustered reduction.
   *
   * @return the directory part, {@code "."} for top-level files
   */
  public String directory() {
    int slash = path.lastIndexOf('/');
    return slash <= 0 ? "." : path.substring(0, slash);
  }

  /**
   * File extension including the leading dot, lower-cased.
   *
   * @return the extension, or {@code null} when the file name has none
   */
  public @Nullable String extension() {
    String name = path.substring(path.lastIndexOf('/') + 1);
    int dot = name.lastIndexOf('.');
    if (dot <= 0 || dot == name.length() - 1) {
      return null;
    }
    return name.substring(dot).toLowerCase(Locale.ROOT);
  }

  /** Copy of this result with a different snippet. */
  public RawResult withSnippet(@Nullable String newSnippet) {
    return new RawResult(path, score, fields, newSnippet);
  }
}
