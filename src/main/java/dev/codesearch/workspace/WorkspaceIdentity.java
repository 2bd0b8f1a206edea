package dev.codesearch.workspace;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import org.jspecify.annotations.Nullable;

/**
 * Canonical identity of a workspace: its real path plus a short stable hash used as the table key
 * and as the on-disk index directory name.
 *
 * <p>Different spellings of one directory (relative, with {@code ..}, through a symlink) map to
 * the same identity. The hash is taken over the real path as returned by the file system, so on a
 * case-sensitive file system two directories differing only in case stay distinct, while a
 * case-insensitive one has already folded the spelling to the stored name.
 *
 * @param root canonical workspace directory
 * @param key first 16 hex characters of the SHA-256 of the canonical path
 */
public record WorkspaceIdentity(Path root, String key) {

  static final int KEY_LENGTH = 16;

  /**
   * Resolves a workspace path.
   *
   * @throws WorkspaceException with {@link ErrorKind#INVALID_WORKSPACE} if the path is not an
   *     existing directory
   */
  public static WorkspaceIdentity of(String workspacePath) {
    if (workspacePath == null || workspacePath.isBlank()) {
      throw invalid(String.valueOf(workspacePath), "workspace path is required", null);
    }
    Path root;
    try {
      root = Path.of(workspacePath.strip()).toAbsolutePath().normalize();
    } catch (InvalidPathException e) {
      throw invalid(workspacePath, "invalid path", e);
    }
    if (!Files.isDirectory(root)) {
      throw invalid(workspacePath, "not a directory", null);
    }
    try {
      root = root.toRealPath();
    } catch (IOException e) {
      throw invalid(workspacePath, e.getMessage(), e);
    }
    return new WorkspaceIdentity(root, hash(root.toString()));
  }

  static String hash(String canonicalPath) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      byte[] bytes =
          digest.digest(canonicalPath.getBytes(StandardCharsets.UTF_8));
      return HexFormat.of().formatHex(bytes).substring(0, KEY_LENGTH);
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  private static WorkspaceException invalid(
      String path, @Nullable String reason, @Nullable Throwable cause) {
    return new WorkspaceException(
        ErrorKind.INVALID_WORKSPACE,
        "Invalid workspace '" + path + "': " + reason,
        false,
        "Pass the absolute path of an existing directory",
        cause);
  }

  @Override
  public String toString() {
    return root + " [" + key + "]";
  }
}
