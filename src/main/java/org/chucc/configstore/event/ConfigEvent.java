package org.chucc.configstore.event;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import java.time.Instant;

/**
 * Base interface for all configuration events.
 * Events are immutable and represent state transitions of a single configuration key.
 * All events include a UTC timestamp for ordering and audit purposes.
 *
 * <p>The set of event kinds is closed: adding a new kind means extending the
 * {@code permits} clause, which forces every transition function to handle it.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "eventType")
@JsonSubTypes({
    @JsonSubTypes.Type(value = ConfigValueSetEvent.class, name = ConfigValueSetEvent.TYPE),
    @JsonSubTypes.Type(value = ConfigValueDeletedEvent.class, name = ConfigValueDeletedEvent.TYPE)
})
public sealed interface ConfigEvent permits ConfigValueSetEvent, ConfigValueDeletedEvent {

  /**
   * Returns the globally unique event ID.
   * Used for deduplication by the live projection updater, which receives
   * events with at-least-once delivery.
   *
   * @return the event ID (UUIDv7 format)
   */
  String eventId();

  /**
   * Gets the configuration key this event applies to.
   *
   * @return the configuration key
   */
  String key();

  /**
   * Gets the timestamp when this event was created.
   *
   * @return the event timestamp (UTC)
   */
  Instant timestamp();

  /**
   * Gets the stable type name used as discriminator in the serialized payload.
   *
   * @return the event type name
   */
  String eventType();
}
