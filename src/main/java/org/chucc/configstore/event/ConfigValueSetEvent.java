package org.chucc.configstore.event;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.github.f4b6a3.uuid.UuidCreator;
import java.time.Instant;
import java.util.Objects;

/**
 * Event representing a value being written to a configuration key.
 *
 * @param eventId the globally unique event ID
 * @param key the configuration key
 * @param value the new value
 * @param previousValue the value retained before this write, {@code null} on first write
 * @param timestamp the event timestamp (UTC)
 */
public record ConfigValueSetEvent(
    @JsonProperty("event_id") String eventId,
    @JsonProperty("config_name") String key,
    @JsonProperty("value") String value,
    @JsonProperty("previous_value") @JsonInclude(JsonInclude.Include.ALWAYS) String previousValue,
    @JsonProperty("timestamp") Instant timestamp)
    implements ConfigEvent {

  /** Discriminator used in serialized payloads and history entries. */
  public static final String TYPE = "ConfigValueSet";

  /**
   * Creates a new ConfigValueSetEvent with validation.
   * If eventId is null, a UUIDv7 will be auto-generated.
   *
   * @throws IllegalArgumentException if any validation fails
   */
  public ConfigValueSetEvent {
    eventId = (eventId == null) ? UuidCreator.getTimeOrderedEpoch().toString() : eventId;

    Objects.requireNonNull(key, "Key cannot be null");
    Objects.requireNonNull(value, "Value cannot be null");
    Objects.requireNonNull(timestamp, "Timestamp cannot be null");

    EventValidation.requireNonBlank(key, "Key");
  }

  /**
   * Convenience constructor that auto-generates eventId.
   *
   * @param key the configuration key
   * @param value the new value
   * @param previousValue the previous value, or null
   * @param timestamp the event timestamp
   */
  public ConfigValueSetEvent(String key, String value, String previousValue, Instant timestamp) {
    this(null, key, value, previousValue, timestamp);
  }

  @Override
  public String eventType() {
    return TYPE;
  }
}
