package dev.codesearch.index;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Collects the indexable files of a workspace.
 *
 * <p>Skips version-control, build-output and IDE directories, files larger than {@code
 * codesearch.index.max-file-size}, and binary files (any NUL byte). Unreadable files are logged
 * and skipped.
 */
@Component
public class WorkspaceIndexer {

  private static final Logger log = LoggerFactory.getLogger(WorkspaceIndexer.class);

  static final Set<String> EXCLUDED_DIRECTORIES =
      Set.of(".git", "target", "build", "node_modules", "bin", "obj", ".idea", ".vscode");

  private final IndexProperties properties;

  public WorkspaceIndexer(IndexProperties properties) {
    this.properties = properties;
  }

  /**
   * Walks {@code workspaceRoot} and reads every indexable file.
   *
   * @param workspaceRoot canonical workspace directory
   * @return documents in walk order, with workspace-relative forward-slash paths
   * @throws UncheckedIOException if the workspace cannot be walked
   */
  public List<IndexedDocument> collect(Path workspaceRoot) {
    List<IndexedDocument> documents = new ArrayList<>();
    long maxBytes = properties.maxFileSize().toBytes();
    int[] skipped = {0};
    try {
      Files.walkFileTree(
          workspaceRoot,
          new SimpleFileVisitor<>() {
            @Override
            public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) {
              if (!dir.equals(workspaceRoot)
                  && EXCLUDED_DIRECTORIES.contains(dir.getFileName().toString())) {
                return FileVisitResult.SKIP_SUBTREE;
              }
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
              if (!attrs.isRegularFile() || attrs.size() > maxBytes) {
                skipped[0]++;
                return FileVisitResult.CONTINUE;
              }
              IndexedDocument document = read(workspaceRoot, file, attrs);
              if (document == null) {
                skipped[0]++;
              } else {
                documents.add(document);
              }
              return FileVisitResult.CONTINUE;
            }

            @Override
            public FileVisitResult visitFileFailed(Path file, IOException exc) throws IOException {
              if (file.equals(workspaceRoot)) {
                throw exc;
              }
              log.warn("Cannot access {}: {}", file, exc.getMessage());
              skipped[0]++;
              return FileVisitResult.CONTINUE;
            }
          });
    } catch (IOException e) {
      throw new UncheckedIOException("Failed to walk workspace " + workspaceRoot, e);
    }
    log.info(
        "Collected {} files from {} ({} skipped)", documents.size(), workspaceRoot, skipped[0]);
    return documents;
  }

  private static @Nullable IndexedDocument read(Path root, Path file, BasicFileAttributes attrs) {
    byte[] bytes;
    try {
      bytes = Files.readAllBytes(file);
    } catch (IOException e) {
      log.warn("Cannot read {}: {}", file, e.getMessage());
      return null;
    }
    for (byte b : bytes) {
      if (b == 0) {
        return null;
      }
    }
    String relative = root.relativize(file).toString().replace('\\', '/');
    return new IndexedDocument(
        relative,
        new String(bytes, StandardCharsets.UTF_8),
        attrs.size(),
        attrs.lastModifiedTime().toInstant());
  }
}
