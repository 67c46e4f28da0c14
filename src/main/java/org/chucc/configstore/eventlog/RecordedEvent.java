package org.chucc.configstore.eventlog;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import org.chucc.configstore.event.ConfigEvent;

/**
 * Envelope returned by the event log for each stored event.
 *
 * @param streamId the stream the event belongs to
 * @param streamVersion the 1-based position of the event within its stream
 * @param globalPosition the 1-based position of the event across all streams
 * @param event the domain event
 * @param metadata backend metadata (aggregate id and type)
 * @param recordedAt when the log stored the event (UTC)
 */
public record RecordedEvent(
    String streamId,
    long streamVersion,
    long globalPosition,
    ConfigEvent event,
    Map<String, String> metadata,
    Instant recordedAt) {

  /**
   * Creates a RecordedEvent with validation.
   *
   * @throws IllegalArgumentException if a position is not positive
   */
  public RecordedEvent {
    Objects.requireNonNull(streamId, "Stream ID cannot be null");
    Objects.requireNonNull(event, "Event cannot be null");
    Objects.requireNonNull(recordedAt, "Recorded timestamp cannot be null");
    if (streamVersion < 1) {
      throw new IllegalArgumentException("Stream version must be positive: " + streamVersion);
    }
    if (globalPosition < 1) {
      throw new IllegalArgumentException("Global position must be positive: " + globalPosition);
    }
    metadata = metadata == null ? Map.of() : Map.copyOf(metadata);
  }

  /**
   * Gets the event type name of the wrapped event.
   *
   * @return the event type
   */
  public String eventType() {
    return event.eventType();
  }
}
