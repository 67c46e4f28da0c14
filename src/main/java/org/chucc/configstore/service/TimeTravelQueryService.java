package org.chucc.configstore.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;
import org.chucc.configstore.domain.ConfigValueAggregate;
import org.chucc.configstore.event.ConfigEvent;
import org.chucc.configstore.eventlog.RecordedEvent;
import org.chucc.configstore.exception.InvalidTimestampException;
import org.chucc.configstore.exception.InvariantViolationException;
import org.chucc.configstore.repository.ConfigValueRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Service for point-in-time reads of a configuration key.
 * Replays the key's stream up to a timestamp instead of consulting the projection.
 */
@Service
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class TimeTravelQueryService {
  private static final Logger logger = LoggerFactory.getLogger(TimeTravelQueryService.class);

  private final ConfigValueRepository repository;

  /**
   * Constructor for TimeTravelQueryService.
   *
   * @param repository the aggregate repository
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Spring-managed beans are intentionally shared references"
  )
  public TimeTravelQueryService(ConfigValueRepository repository) {
    this.repository = repository;
  }

  /**
   * Resolves the value a key held at a point in time.
   *
   * @param key the configuration key
   * @param asOf RFC 3339 timestamp string
   * @return the value visible at {@code asOf}, or empty if the key did not exist or was deleted
   * @throws InvalidTimestampException if the timestamp is malformed
   */
  public Optional<String> valueAt(String key, String asOf) {
    Instant timestamp = parseRfc3339(asOf);
    return valueAt(key, timestamp);
  }

  /**
   * Resolves the value a key held at a point in time.
   * Events recorded exactly at {@code timestamp} are included.
   *
   * @param key the configuration key
   * @param timestamp the point in time
   * @return the value visible at {@code timestamp}, or empty
   * @throws InvariantViolationException if the stream cannot be replayed
   */
  public Optional<String> valueAt(String key, Instant timestamp) {
    List<ConfigEvent> events = repository.history(key).stream()
        .filter(recorded -> !recorded.recordedAt().isAfter(timestamp))
        .map(RecordedEvent::event)
        .toList();

    ConfigValueAggregate aggregate;
    try {
      aggregate = ConfigValueAggregate.replay(events);
    } catch (InvariantViolationException ex) {
      logger.error("Failed to replay stream of key: {} as of {}", key, timestamp, ex);
      throw ex;
    }
    logger.debug("Resolved key: {} as of {} to version {} of its stream",
        key, timestamp, aggregate.version());
    return aggregate.currentValue();
  }

  /**
   * Parses an RFC 3339 timestamp. UTC offsets other than {@code Z} are accepted.
   *
   * @param timestamp the timestamp string
   * @return the parsed instant
   * @throws InvalidTimestampException if the timestamp is null or malformed
   */
  static Instant parseRfc3339(String timestamp) {
    if (timestamp == null) {
      throw new InvalidTimestampException(null, null);
    }
    try {
      return Instant.parse(timestamp);
    } catch (DateTimeParseException e) {
      throw new InvalidTimestampException(timestamp, e);
    }
  }
}
