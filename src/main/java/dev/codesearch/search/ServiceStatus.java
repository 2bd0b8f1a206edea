package dev.codesearch.search;

import dev.codesearch.cache.CacheStats;
import dev.codesearch.workspace.HandleSnapshot;
import java.util.List;

/**
 * Occupancy of the service caches.
 *
 * @param workspaces resident workspace handles
 * @param workspaceCapacity maximum resident handles
 * @param responseCache response cache statistics
 * @param resources live overflow resources
 */
public record ServiceStatus(
    List<HandleSnapshot> workspaces,
    int workspaceCapacity,
    CacheStats responseCache,
    int resources) {}
