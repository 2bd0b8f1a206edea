package dev.codesearch.workspace;

/** Classification of workspace failures, reported to clients as-is. */
public enum ErrorKind {
  /** The pool is full and nothing became evictable in time. Retryable. */
  CAPACITY_EXCEEDED,
  /** The index of a workspace could not be opened or created. Not retryable. */
  OPEN_FAILURE,
  /** The path does not denote a workspace directory. */
  INVALID_WORKSPACE,
  /** The cache is shutting down and accepts no new acquisitions. */
  UNAVAILABLE
}
