package org.chucc.configstore.projection;

import java.time.Duration;
import java.time.Instant;

/**
 * Statistics of a completed projection rebuild.
 *
 * @param eventsReplayed number of configuration events folded into the new read model
 * @param entries number of visible keys after the rebuild
 * @param duration wall time of the rebuild
 * @param completedAt when the new read model was swapped in
 */
public record RebuildResult(
    int eventsReplayed,
    int entries,
    Duration duration,
    Instant completedAt) {
}
