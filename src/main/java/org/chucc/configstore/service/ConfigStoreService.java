package org.chucc.configstore.service;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.annotation.Timed;
import java.util.List;
import java.util.Optional;
import org.chucc.configstore.audit.ConfigChangeNotifier;
import org.chucc.configstore.command.DeleteConfigValueCommand;
import org.chucc.configstore.command.DeleteConfigValueCommandHandler;
import org.chucc.configstore.command.SetConfigValueCommand;
import org.chucc.configstore.command.SetConfigValueCommandHandler;
import org.chucc.configstore.config.ProjectionProperties;
import org.chucc.configstore.eventlog.RecordedEvent;
import org.chucc.configstore.projection.ApplyOutcome;
import org.chucc.configstore.projection.ConfigEntry;
import org.chucc.configstore.projection.ConfigStateProjection;
import org.chucc.configstore.projection.ConsistencyMode;
import org.chucc.configstore.projection.RebuildResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point of the configuration store.
 *
 * <p>Writes go through the command handlers and the event log. Current-state
 * reads are served by the {@link ConfigStateProjection}. History and
 * point-in-time reads always go to the event log.
 *
 * <p>In {@link ConsistencyMode#LIVE} a successful write is applied to the
 * projection before the call returns, so a caller reads its own writes. In
 * {@link ConsistencyMode#RESTART_ONLY} writes become visible on the next rebuild.
 */
@Service
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class ConfigStoreService {
  private static final Logger logger = LoggerFactory.getLogger(ConfigStoreService.class);

  private final SetConfigValueCommandHandler setHandler;
  private final DeleteConfigValueCommandHandler deleteHandler;
  private final ConfigStateProjection projection;
  private final HistoryService historyService;
  private final TimeTravelQueryService timeTravelQueryService;
  private final ConfigChangeNotifier notifier;
  private final ProjectionProperties projectionProperties;

  /**
   * Constructs a ConfigStoreService.
   *
   * @param setHandler handler for writes
   * @param deleteHandler handler for deletes
   * @param projection the current-state read model
   * @param historyService the history reader
   * @param timeTravelQueryService the point-in-time reader
   * @param notifier the change notifier
   * @param projectionProperties the projection configuration
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Dependencies are Spring-managed beans and are intentionally shared")
  public ConfigStoreService(
      SetConfigValueCommandHandler setHandler,
      DeleteConfigValueCommandHandler deleteHandler,
      ConfigStateProjection projection,
      HistoryService historyService,
      TimeTravelQueryService timeTravelQueryService,
      ConfigChangeNotifier notifier,
      ProjectionProperties projectionProperties) {
    this.setHandler = setHandler;
    this.deleteHandler = deleteHandler;
    this.projection = projection;
    this.historyService = historyService;
    this.timeTravelQueryService = timeTravelQueryService;
    this.notifier = notifier;
    this.projectionProperties = projectionProperties;
  }

  /**
   * Writes a value. Writing to a deleted key brings it back.
   *
   * @param key the configuration key
   * @param value the value
   * @return the stored value
   * @throws org.chucc.configstore.exception.ConcurrentWriteConflictException if the write
   *     still conflicts after one retry
   * @throws org.chucc.configstore.exception.EventLogUnavailableException if the log is down
   */
  @Timed(
      value = "config.put",
      description = "Configuration write time"
  )
  public String put(String key, String value) {
    RecordedEvent recorded = setHandler.handle(new SetConfigValueCommand(key, value));
    afterAppend(recorded);
    return value;
  }

  /**
   * Deletes a key.
   *
   * @param key the configuration key
   * @throws org.chucc.configstore.exception.ConfigNotFoundException if the key was never set
   * @throws org.chucc.configstore.exception.ConfigAlreadyDeletedException if the key is
   *     already deleted
   * @throws org.chucc.configstore.exception.ConcurrentWriteConflictException if the delete
   *     still conflicts after one retry
   */
  @Timed(
      value = "config.delete",
      description = "Configuration delete time"
  )
  public void delete(String key) {
    RecordedEvent recorded = deleteHandler.handle(new DeleteConfigValueCommand(key));
    afterAppend(recorded);
  }

  /**
   * Gets the current value of a key from the projection.
   *
   * @param key the configuration key
   * @return the value, or empty if absent or deleted
   */
  public Optional<String> get(String key) {
    return projection.get(key);
  }

  /**
   * Lists every visible key from the projection.
   *
   * @return the entries, sorted by key
   */
  public List<ConfigEntry> all() {
    return projection.listAll();
  }

  /**
   * Lists the recorded history of a key.
   *
   * @param key the configuration key
   * @return the history, oldest first; empty for an unknown key
   */
  public List<HistoryEntry> history(String key) {
    return historyService.history(key);
  }

  /**
   * Gets the value a key held at a point in time.
   *
   * @param key the configuration key
   * @param rfc3339Timestamp the point in time
   * @return the value, or empty if the key did not exist or was deleted at that time
   * @throws org.chucc.configstore.exception.InvalidTimestampException if the timestamp is
   *     malformed
   */
  public Optional<String> at(String key, String rfc3339Timestamp) {
    return timeTravelQueryService.valueAt(key, rfc3339Timestamp);
  }

  /**
   * Gets the active consistency mode.
   *
   * @return the consistency mode
   */
  public ConsistencyMode consistencyMode() {
    return projectionProperties.getMode();
  }

  /**
   * Rebuilds the projection from the full event log.
   *
   * @return rebuild statistics
   */
  public RebuildResult rebuildProjection() {
    return projection.rebuild();
  }

  private void afterAppend(RecordedEvent recorded) {
    if (projectionProperties.isLive()) {
      ApplyOutcome outcome = projection.apply(recorded);
      if (outcome == ApplyOutcome.GAP) {
        // A concurrent writer's event is not projected yet.
        logger.debug("Catching up key: {} before returning v{}",
            recorded.event().key(), recorded.streamVersion());
        projection.catchUp(recorded.event().key());
      }
    }
    notifier.notifyChanged(recorded);
  }
}
