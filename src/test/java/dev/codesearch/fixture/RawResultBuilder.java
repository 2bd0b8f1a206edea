package dev.codesearch.fixture;

import dev.codesearch.index.RawResult;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Builder for {@link RawResult} test instances with sensible defaults. */
public final class RawResultBuilder {

  private String path = "src/Main.java";
  private double score = 1.0;
  private final Map<String, String> fields = new LinkedHashMap<>();
  private String snippet;

  public static RawResultBuilder aResult() {
    return new RawResultBuilder();
  }

  public RawResultBuilder path(String path) {
    this.path = path;
    return this;
  }

  public RawResultBuilder score(double score) {
    this.score = score;
    return this;
  }

  public RawResultBuilder field(String name, String value) {
    this.fields.put(name, value);
    return this;
  }

  public RawResultBuilder snippet(String snippet) {
    this.snippet = snippet;
    return this;
  }

  public RawResult build() {
    return new RawResult(path, score, fields, snippet);
  }

  /**
   * Results whose serialized form is roughly the same size, with descending scores, spread over
   * ten directories.
   */
  public static List<RawResult> uniformResults(int count, int snippetChars) {
    List<RawResult> results = new ArrayList<>(count);
    for (int i = 0; i < count; i++) {
      results.add(
          aResult()
              .path("module%d/src/File%04d.java".formatted(i % 10, i))
              .score(1.0 - i / (double) (count + 1))
              .snippet("x".repeat(snippetChars))
              .build());
    }
    return results;
  }
}
