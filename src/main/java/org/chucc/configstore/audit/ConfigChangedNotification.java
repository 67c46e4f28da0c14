package org.chucc.configstore.audit;

import java.time.Instant;
import java.util.Objects;
import org.chucc.configstore.event.ConfigEvent;
import org.chucc.configstore.event.ConfigValueDeletedEvent;
import org.chucc.configstore.event.ConfigValueSetEvent;
import org.chucc.configstore.exception.InvariantViolationException;

/**
 * Application event published after a configuration change was appended to the log.
 *
 * @param key the configuration key
 * @param changeType whether the key was written or deleted
 * @param oldValue the value before the change, or null
 * @param newValue the value after the change, null on delete
 * @param timestamp the time of the change
 */
public record ConfigChangedNotification(
    String key,
    ChangeType changeType,
    String oldValue,
    String newValue,
    Instant timestamp) {

  /**
   * Kind of change.
   */
  public enum ChangeType {
    UPDATED,
    DELETED
  }

  /**
   * Creates a notification with validation.
   */
  public ConfigChangedNotification {
    Objects.requireNonNull(key, "Key cannot be null");
    Objects.requireNonNull(changeType, "Change type cannot be null");
    Objects.requireNonNull(timestamp, "Timestamp cannot be null");
  }

  /**
   * Builds the notification describing an appended event.
   *
   * @param event the event that was appended
   * @return the notification
   */
  public static ConfigChangedNotification of(ConfigEvent event) {
    if (event instanceof ConfigValueSetEvent set) {
      return new ConfigChangedNotification(
          set.key(), ChangeType.UPDATED, set.previousValue(), set.value(), set.timestamp());
    }
    if (event instanceof ConfigValueDeletedEvent deleted) {
      return new ConfigChangedNotification(
          deleted.key(), ChangeType.DELETED, deleted.deletedValue(), null, deleted.timestamp());
    }
    throw new InvariantViolationException(
        "Unknown event type for notification: " + event.getClass().getName());
  }
}
