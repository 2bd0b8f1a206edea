package dev.codesearch.workspace;

/** The index of a workspace could not be opened. Failures are not cached. */
public class IndexOpenException extends WorkspaceException {

  private final String workspace;

  public IndexOpenException(String workspace, Throwable cause) {
    super(
        ErrorKind.OPEN_FAILURE,
        "Failed to open index for " + workspace + ": " + cause.getMessage(),
        false,
        "Rebuild the index with index_workspace, or check permissions on the index directory",
        cause);
    this.workspace = workspace;
  }

  public String workspace() {
    return workspace;
  }
}
