package org.chucc.configstore.domain;

import java.time.Clock;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.chucc.configstore.event.ConfigEvent;
import org.chucc.configstore.event.ConfigValueDeletedEvent;
import org.chucc.configstore.event.ConfigValueSetEvent;
import org.chucc.configstore.exception.InvariantViolationException;

/**
 * Aggregate root for one configuration key.
 *
 * <p>Instances are immutable and never persisted. State is rebuilt by replaying
 * the key's stream from version 0, and {@link #apply(ConfigEvent)} is the only
 * transition function, used both for replay and for command processing.
 *
 * <p>Deletion leaves a tombstone: the key and last value are kept, so a later
 * {@link #setValue} resurrects the key with correct audit lineage.
 *
 * @param key the configuration key, {@code null} before the first event
 * @param value the last value written, retained after deletion
 * @param version the number of events applied
 * @param deleted whether the key is currently tombstoned
 */
public record ConfigValueAggregate(String key, String value, long version, boolean deleted) {

  private static final ConfigValueAggregate EMPTY = new ConfigValueAggregate(null, null, 0, false);

  /**
   * Creates an aggregate state with validation.
   *
   * @throws InvariantViolationException if the version is negative
   */
  public ConfigValueAggregate {
    if (version < 0) {
      throw new InvariantViolationException("Aggregate version cannot be negative: " + version);
    }
  }

  /**
   * Returns the aggregate of a key with no history.
   *
   * @return the empty aggregate (version 0, not deleted)
   */
  public static ConfigValueAggregate empty() {
    return EMPTY;
  }

  /**
   * Rebuilds aggregate state by folding events in the order the event log returned them.
   *
   * @param events the stream's events, in stream order
   * @return the aggregate after applying every event
   */
  public static ConfigValueAggregate replay(List<ConfigEvent> events) {
    ConfigValueAggregate aggregate = EMPTY;
    for (ConfigEvent event : events) {
      aggregate = aggregate.apply(event);
    }
    return aggregate;
  }

  /**
   * Handles a set command. Always accepted for well-formed input, including on a
   * tombstoned key.
   *
   * @param newKey the configuration key
   * @param newValue the value to store
   * @param clock the clock stamping the event
   * @return an {@link Decision.Accepted} carrying a {@link ConfigValueSetEvent}
   * @throws IllegalArgumentException if the key is blank or belongs to another aggregate
   */
  public Decision setValue(String newKey, String newValue, Clock clock) {
    Objects.requireNonNull(newKey, "Key cannot be null");
    Objects.requireNonNull(newValue, "Value cannot be null");
    if (newKey.isBlank()) {
      throw new IllegalArgumentException("Key cannot be blank");
    }
    if (key != null && !key.equals(newKey)) {
      throw new IllegalArgumentException(
          "Aggregate of key " + key + " cannot accept a write for key " + newKey);
    }

    ConfigEvent event = new ConfigValueSetEvent(newKey, newValue, value, clock.instant());
    return new Decision.Accepted(event, apply(event));
  }

  /**
   * Handles a delete command.
   *
   * @param clock the clock stamping the event
   * @return {@link Rejection#NOT_FOUND} if the key was never set,
   *     {@link Rejection#ALREADY_DELETED} if it is tombstoned,
   *     otherwise an {@link Decision.Accepted} carrying a {@link ConfigValueDeletedEvent}
   */
  public Decision deleteValue(Clock clock) {
    if (version == 0) {
      return new Decision.Rejected(Rejection.NOT_FOUND);
    }
    if (deleted) {
      return new Decision.Rejected(Rejection.ALREADY_DELETED);
    }

    ConfigEvent event = new ConfigValueDeletedEvent(key, value, clock.instant());
    return new Decision.Accepted(event, apply(event));
  }

  /**
   * Applies an event and returns the resulting state.
   *
   * @param event the event to apply
   * @return the new aggregate state
   * @throws InvariantViolationException if the event belongs to another key
   */
  public ConfigValueAggregate apply(ConfigEvent event) {
    Objects.requireNonNull(event, "Event cannot be null");
    if (key != null && !key.equals(event.key())) {
      throw new InvariantViolationException(
          "Event " + event.eventId() + " for key " + event.key()
              + " replayed into aggregate of key " + key);
    }

    if (event instanceof ConfigValueSetEvent set) {
      return new ConfigValueAggregate(set.key(), set.value(), version + 1, false);
    }
    if (event instanceof ConfigValueDeletedEvent deletedEvent) {
      return new ConfigValueAggregate(deletedEvent.key(), value, version + 1, true);
    }
    throw new InvariantViolationException(
        "Unknown event type during replay: " + event.getClass().getName());
  }

  /**
   * Gets the visible value of the key.
   *
   * @return the value, or empty if the key was never set or is deleted
   */
  public Optional<String> currentValue() {
    return exists() ? Optional.of(value) : Optional.empty();
  }

  /**
   * Checks whether the key currently holds a value.
   *
   * @return false if the key was never set or is deleted
   */
  public boolean exists() {
    return version > 0 && !deleted;
  }
}
