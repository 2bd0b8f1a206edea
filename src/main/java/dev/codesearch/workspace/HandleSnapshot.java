package dev.codesearch.workspace;

import java.time.Instant;

/**
 * Point-in-time view of a resident handle.
 *
 * @param workspace canonical workspace path
 * @param key workspace hash
 * @param state lifecycle state
 * @param refCount active leases
 * @param stale whether the handle will close on its last release
 * @param lastAccess last acquire or release
 */
public record HandleSnapshot(
    String workspace,
    String key,
    HandleState state,
    int refCount,
    boolean stale,
    Instant lastAccess) {}
