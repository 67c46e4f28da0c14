package org.chucc.configstore.repository;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.List;
import org.chucc.configstore.domain.ConfigValueAggregate;
import org.chucc.configstore.event.ConfigEvent;
import org.chucc.configstore.eventlog.AppendResult;
import org.chucc.configstore.eventlog.ConfigStreams;
import org.chucc.configstore.eventlog.EventLog;
import org.chucc.configstore.eventlog.ExpectedVersion;
import org.chucc.configstore.eventlog.RecordedEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

/**
 * Event-sourced repository for configuration aggregates.
 * Loads an aggregate by replaying its stream and saves new events with an
 * optimistic concurrency check against the replayed version.
 */
@Repository
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class ConfigValueRepository {
  private static final Logger logger = LoggerFactory.getLogger(ConfigValueRepository.class);

  private final EventLog eventLog;

  /**
   * Constructs a ConfigValueRepository.
   *
   * @param eventLog the event log
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "EventLog is a Spring-managed bean and is intentionally shared")
  public ConfigValueRepository(EventLog eventLog) {
    this.eventLog = eventLog;
  }

  /**
   * Reads the recorded history of a key.
   *
   * @param key the configuration key
   * @return the recorded events in stream order, empty if the key was never written
   */
  public List<RecordedEvent> history(String key) {
    return eventLog.readForward(ConfigStreams.streamId(key)).orElse(List.of());
  }

  /**
   * Loads the aggregate of a key by replaying its full stream.
   *
   * @param key the configuration key
   * @return the replayed aggregate, {@link ConfigValueAggregate#empty()} for an unknown key
   */
  public ConfigValueAggregate load(String key) {
    List<ConfigEvent> events = history(key).stream()
        .map(RecordedEvent::event)
        .toList();
    ConfigValueAggregate aggregate = ConfigValueAggregate.replay(events);
    logger.debug("Loaded aggregate for key: {} at version {}", key, aggregate.version());
    return aggregate;
  }

  /**
   * Appends one event to a key's stream.
   *
   * @param key the configuration key
   * @param expectedVersion the aggregate version the event was decided on
   * @param event the event to append
   * @return the recorded event
   * @throws org.chucc.configstore.exception.WrongExpectedVersionException if another
   *     writer appended first
   */
  public RecordedEvent save(String key, long expectedVersion, ConfigEvent event) {
    String streamId = ConfigStreams.streamId(key);
    AppendResult result = eventLog.append(
        streamId, ExpectedVersion.exact(expectedVersion), List.of(event));
    logger.info("Appended {} to stream {} at version {}",
        event.eventType(), streamId, result.newVersion());
    return result.recorded().get(0);
  }
}
