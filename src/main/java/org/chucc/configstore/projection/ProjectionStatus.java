package org.chucc.configstore.projection;

import java.time.Instant;

/**
 * Point-in-time view of the projection's health.
 *
 * @param entries number of visible keys
 * @param lastRebuiltAt when the current read model was built, {@code null} before the first rebuild
 * @param rebuildCount number of completed rebuilds since startup
 * @param appliedSinceRebuild number of events applied incrementally since the last rebuild
 */
public record ProjectionStatus(
    int entries,
    Instant lastRebuiltAt,
    long rebuildCount,
    long appliedSinceRebuild) {
}
