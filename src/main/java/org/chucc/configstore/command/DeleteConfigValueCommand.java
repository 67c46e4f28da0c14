package org.chucc.configstore.command;

import java.util.Objects;

/**
 * Command to delete a configuration key.
 *
 * @param key the configuration key
 */
public record DeleteConfigValueCommand(String key) implements Command {

  /**
   * Creates a new DeleteConfigValueCommand with validation.
   *
   * @throws IllegalArgumentException if the key is null or blank
   */
  public DeleteConfigValueCommand {
    Objects.requireNonNull(key, "Key cannot be null");

    if (key.isBlank()) {
      throw new IllegalArgumentException("Key cannot be blank");
    }
  }
}
