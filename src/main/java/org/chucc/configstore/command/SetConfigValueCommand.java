package org.chucc.configstore.command;

import java.util.Objects;

/**
 * Command to write a value to a configuration key.
 *
 * @param key the configuration key
 * @param value the value to store
 */
public record SetConfigValueCommand(String key, String value) implements Command {

  /**
   * Creates a new SetConfigValueCommand with validation.
   *
   * @throws IllegalArgumentException if any validation fails
   */
  public SetConfigValueCommand {
    Objects.requireNonNull(key, "Key cannot be null");
    Objects.requireNonNull(value, "Value cannot be null");

    if (key.isBlank()) {
      throw new IllegalArgumentException("Key cannot be blank");
    }
  }
}
