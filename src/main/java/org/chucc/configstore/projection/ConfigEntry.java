package org.chucc.configstore.projection;

import java.time.Instant;
import java.util.Objects;

/**
 * Read-model entry for a configuration key that currently holds a value.
 *
 * @param key the configuration key
 * @param value the current value
 * @param version the stream version that produced this value
 * @param updatedAt the timestamp of the event that produced this value
 */
public record ConfigEntry(String key, String value, long version, Instant updatedAt) {

  /**
   * Creates a ConfigEntry with validation.
   */
  public ConfigEntry {
    Objects.requireNonNull(key, "Key cannot be null");
    Objects.requireNonNull(value, "Value cannot be null");
    Objects.requireNonNull(updatedAt, "Updated timestamp cannot be null");
  }
}
