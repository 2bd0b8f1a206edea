package dev.codesearch.index;

import java.time.Instant;

/**
 * A workspace file as fed to the index.
 *
 * @param path workspace-relative path with forward slashes
 * @param content full text content
 * @param size file size in bytes
 * @param modified last modification time
 */
public record IndexedDocument(String path, String content, long size, Instant modified) {}
