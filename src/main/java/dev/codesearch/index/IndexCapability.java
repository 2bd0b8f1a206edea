package dev.codesearch.index;

import java.io.IOException;
import java.nio.file.Path;

/** Opens workspace indexes. The seam between the workspace cache and the full-text engine. */
@FunctionalInterface
public interface IndexCapability {

  /**
   * Opens the index of a workspace, creating an empty one when none exists yet.
   *
   * @param workspaceRoot canonical workspace directory
   * @param workspaceKey stable identifier of the workspace, used to locate the index on disk
   * @return the open index
   * @throws IOException if the index cannot be opened or created
   */
  IndexHandle openOrCreate(Path workspaceRoot, String workspaceKey) throws IOException;
}
