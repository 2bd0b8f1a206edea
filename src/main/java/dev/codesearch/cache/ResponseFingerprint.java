package dev.codesearch.cache;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic cache key for a built response.
 *
 * <p>The key covers the tool name, the normalized request parameters, the workspace identity and
 * the index generation. Normalization lower-cases and sorts parameter names, trims values and drops
 * {@code null} values, so two requests that differ only in parameter order or surrounding
 * whitespace share a key. Because the generation is part of the key, a write to the index makes
 * every earlier response unreachable.
 */
public final class ResponseFingerprint {

  private ResponseFingerprint() {
    // utility class
  }

  /**
   * Computes the fingerprint.
   *
   * @param tool tool name, e.g. {@code text_search}
   * @param parameters request parameters; {@code null} values are ignored
   * @param workspace canonical workspace identity
   * @param generation index generation the response was computed from
   * @return lowercase hex SHA-256 of the canonical form
   */
  public static String of(
      String tool, Map<String, ?> parameters, String workspace, long generation) {
    return sha256(canonicalForm(tool, parameters, workspace, generation));
  }

  static String canonicalForm(
      String tool, Map<String, ?> parameters, String workspace, long generation) {
    TreeMap<String, String> normalized = new TreeMap<>();
    parameters.forEach(
        (key, value) -> {
          if (key != null && value != null) {
            normalized.put(key.trim().toLowerCase(Locale.ROOT), value.toString().trim());
          }
        });
    StringBuilder sb = new StringBuilder();
    sb.append("tool=").append(tool).append('\n');
    sb.append("workspace=").append(workspace).append('\n');
    sb.append("generation=").append(generation).append('\n');
    normalized.forEach(
        (key, value) ->
            sb.append(key)
                .append('=')
                .append(value.length())
                .append(':')
                .append(value)
                .append('\n'));
    return sb.toString();
  }

  private static String sha256(String content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(content.getBytes(StandardCharsets.UTF_8)));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 algorithm not available", e);
    }
  }
}
