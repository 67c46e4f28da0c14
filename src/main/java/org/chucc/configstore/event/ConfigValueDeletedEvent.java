package org.chucc.configstore.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.f4b6a3.uuid.UuidCreator;
import java.time.Instant;
import java.util.Objects;

/**
 * Event representing the deletion of a configuration key.
 * Carries the deleted value so the audit trail stays complete.
 *
 * @param eventId the globally unique event ID
 * @param key the configuration key
 * @param deletedValue the value held by the key when it was deleted
 * @param timestamp the event timestamp (UTC)
 */
public record ConfigValueDeletedEvent(
    @JsonProperty("event_id") String eventId,
    @JsonProperty("config_name") String key,
    @JsonProperty("deleted_value") @JsonInclude(JsonInclude.Include.ALWAYS) String deletedValue,
    @JsonProperty("timestamp") Instant timestamp)
    implements ConfigEvent {

  /** Discriminator used in serialized payloads and history entries. */
  public static final String TYPE = "ConfigValueDeleted";

  /**
   * Creates a new ConfigValueDeletedEvent with validation.
   * If eventId is null, a UUIDv7 will be auto-generated.
   *
   * @throws IllegalArgumentException if any validation fails
   */
  public ConfigValueDeletedEvent {
    eventId = (eventId == null) ? UuidCreator.getTimeOrderedEpoch().toString() : eventId;

    Objects.requireNonNull(key, "Key cannot be null");
    Objects.requireNonNull(timestamp, "Timestamp cannot be null");

    EventValidation.requireNonBlank(key, "Key");
  }

  /**
   * Convenience constructor that auto-generates eventId.
   *
   * @param key the configuration key
   * @param deletedValue the deleted value
   * @param timestamp the event timestamp
   */
  public ConfigValueDeletedEvent(String key, String deletedValue, Instant timestamp) {
    this(null, key, deletedValue, timestamp);
  }

  @Override
  public String eventType() {
    return TYPE;
  }
}
