package dev.codesearch.index;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.util.unit.DataSize;

/**
 * Indexing settings, bound from {@code codesearch.index.*}.
 *
 * @param maxFileSize files larger than this are not indexed
 */
@ConfigurationProperties(prefix = "codesearch.index")
public record IndexProperties(DataSize maxFileSize) {

  public IndexProperties {
    if (maxFileSize == null) {
      maxFileSize = DataSize.ofMegabytes(1);
    }
    if (maxFileSize.toBytes() < 1) {
      throw new IllegalStateException(
          "codesearch.index.max-file-size must be positive, got: " + maxFileSize);
    }
  }

  public static IndexProperties defaults() {
    return new IndexProperties(null);
  }
}
