package dev.codesearch.index;

/** Unchecked wrapper for an I/O failure while querying or writing an open index. */
public class IndexAccessException extends RuntimeException {

  public IndexAccessException(String message, Throwable cause) {
    super(message, cause);
  }
}
