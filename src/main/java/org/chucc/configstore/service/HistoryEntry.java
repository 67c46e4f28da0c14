package org.chucc.configstore.service;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One entry of a key's audit history, as recorded by the event log.
 *
 * @param eventType the event discriminator ({@code ConfigValueSet} or {@code ConfigValueDeleted})
 * @param data the event fields keyed by their serialized names
 * @param metadata the metadata the log stored with the event
 * @param recordedAt the time the log recorded the event
 * @param streamVersion the event's position within the key's stream
 */
public record HistoryEntry(
    String eventType,
    Map<String, Object> data,
    Map<String, String> metadata,
    Instant recordedAt,
    long streamVersion) {

  /**
   * Creates a history entry with defensive copies.
   * Null values inside {@code data} are allowed ({@code previous_value} on a first write).
   */
  public HistoryEntry {
    Objects.requireNonNull(eventType, "Event type cannot be null");
    Objects.requireNonNull(recordedAt, "Recorded timestamp cannot be null");
    data = data == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(data));
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }
}
