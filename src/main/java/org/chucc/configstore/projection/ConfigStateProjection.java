package org.chucc.configstore.projection;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import org.chucc.configstore.event.ConfigEvent;
import org.chucc.configstore.event.ConfigValueDeletedEvent;
import org.chucc.configstore.event.ConfigValueSetEvent;
import org.chucc.configstore.eventlog.ConfigStreams;
import org.chucc.configstore.eventlog.EventLog;
import org.chucc.configstore.eventlog.RecordedEvent;
import org.chucc.configstore.exception.InvariantViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Read model of the current value of every configuration key.
 *
 * <p>The projection is a cache over the event log, never a source of truth.
 * Its content always equals the result of applying every configuration event
 * in stream order, restricted to keys that are not deleted.
 *
 * <h2>Concurrency</h2>
 * <ul>
 *   <li>Reads go to the current map without locking and never block.</li>
 *   <li>{@link #apply(RecordedEvent)} updates one key atomically with
 *       {@link ConcurrentHashMap#compute}, so readers never see a half-applied event.</li>
 *   <li>{@link #rebuild()} folds the full log into a fresh map and swaps it in
 *       atomically. Incremental applies wait for the swap, so none of them is
 *       lost on the discarded map.</li>
 * </ul>
 *
 * <p>Each key remembers the last stream version applied to it, tombstones
 * included. Redelivered events are therefore idempotent and missing events are
 * reported as {@link ApplyOutcome#GAP} instead of being patched over.
 *
 * <p>Metrics are recorded for rebuild operations:
 * <ul>
 *   <li>{@code config.projection.rebuild.total} - Counter (tag {@code outcome})</li>
 *   <li>{@code config.projection.rebuild.duration} - Timer</li>
 * </ul>
 */
@Service
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public class ConfigStateProjection {
  private static final Logger logger = LoggerFactory.getLogger(ConfigStateProjection.class);

  private final EventLog eventLog;
  private final MeterRegistry meterRegistry;
  private final Clock clock;

  private final ReentrantReadWriteLock swapLock = new ReentrantReadWriteLock();
  private final AtomicReference<ReadModel> current = new AtomicReference<>(ReadModel.initial());
  private final AtomicLong rebuildCount = new AtomicLong();

  /**
   * Constructs a ConfigStateProjection.
   *
   * @param eventLog the event log replayed on rebuild
   * @param meterRegistry the meter registry
   * @param clock the clock stamping rebuilds
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Dependencies are Spring-managed beans and are intentionally shared")
  public ConfigStateProjection(EventLog eventLog, MeterRegistry meterRegistry, Clock clock) {
    this.eventLog = eventLog;
    this.meterRegistry = meterRegistry;
    this.clock = clock;
  }

  /**
   * Gets the current value of a key.
   *
   * @param key the configuration key
   * @return the value, or empty if the key is absent or deleted
   */
  public Optional<String> get(String key) {
    return getEntry(key).map(ConfigEntry::value);
  }

  /**
   * Gets the read-model entry of a key, including its version and update time.
   *
   * @param key the configuration key
   * @return the entry, or empty if the key is absent or deleted
   */
  public Optional<ConfigEntry> getEntry(String key) {
    Slot slot = current.get().slots().get(key);
    return slot == null ? Optional.empty() : Optional.ofNullable(slot.entry());
  }

  /**
   * Lists every visible key.
   *
   * @return a snapshot of all entries, sorted by key
   */
  public List<ConfigEntry> listAll() {
    return current.get().slots().values().stream()
        .map(Slot::entry)
        .filter(Objects::nonNull)
        .sorted(Comparator.comparing(ConfigEntry::key))
        .toList();
  }

  /**
   * Applies one recorded event to the read model.
   *
   * @param recorded the recorded event
   * @return whether the event was applied, already present, out of sequence, or untracked
   */
  public ApplyOutcome apply(RecordedEvent recorded) {
    Objects.requireNonNull(recorded, "Recorded event cannot be null");
    if (!ConfigStreams.isConfigStream(recorded.streamId())) {
      return ApplyOutcome.IGNORED;
    }

    swapLock.readLock().lock();
    try {
      ReadModel model = current.get();
      ApplyOutcome outcome = applyTo(model.slots(), recorded);
      switch (outcome) {
        case APPLIED -> {
          model.appliedSinceRebuild().incrementAndGet();
          logger.debug("Projected {} v{} for key: {}",
              recorded.eventType(), recorded.streamVersion(), recorded.event().key());
        }
        case DUPLICATE -> logger.debug("Skipping already projected {} v{} for key: {}",
            recorded.eventType(), recorded.streamVersion(), recorded.event().key());
        case GAP -> logger.warn("Gap before {} v{} for key: {} (last projected v{})",
            recorded.eventType(), recorded.streamVersion(), recorded.event().key(),
            lastVersion(model.slots(), recorded.event().key()));
        default -> {
          // IGNORED is handled before locking
        }
      }
      return outcome;
    } finally {
      swapLock.readLock().unlock();
    }
  }

  /**
   * Applies every event of one key's stream that the read model has not seen yet.
   * Used when an apply reported {@link ApplyOutcome#GAP} for that key.
   *
   * @param key the configuration key
   * @return the number of events applied
   */
  public int catchUp(String key) {
    List<RecordedEvent> stream = eventLog.readForward(ConfigStreams.streamId(key))
        .orElse(List.of());
    int applied = 0;
    for (RecordedEvent recorded : stream) {
      if (apply(recorded) == ApplyOutcome.APPLIED) {
        applied++;
      }
    }
    return applied;
  }

  /**
   * Discards the read model and rebuilds it from the full event log.
   * The previous read model stays in place if reading the log fails.
   *
   * @return rebuild statistics
   * @throws org.chucc.configstore.exception.EventLogUnavailableException if the log
   *     cannot be read
   * @throws InvariantViolationException if the log returns a stream out of sequence
   */
  @SuppressFBWarnings(
      value = "REC_CATCH_EXCEPTION",
      justification = "Catch all exceptions to record metrics")
  public RebuildResult rebuild() {
    logger.info("Rebuilding configuration projection from event log");
    Timer.Sample sample = Timer.start(meterRegistry);
    long started = System.nanoTime();

    swapLock.writeLock().lock();
    try {
      List<RecordedEvent> events = eventLog.readAllForward();
      Map<String, Slot> slots = new ConcurrentHashMap<>();
      int replayed = 0;
      for (RecordedEvent recorded : events) {
        if (!ConfigStreams.isConfigStream(recorded.streamId())) {
          continue;
        }
        ApplyOutcome outcome = applyTo(slots, recorded);
        if (outcome != ApplyOutcome.APPLIED) {
          throw new InvariantViolationException(
              "Event log returned " + recorded.streamId() + " v" + recorded.streamVersion()
                  + " out of sequence (" + outcome + ")");
        }
        replayed++;
      }

      Instant completedAt = clock.instant();
      ReadModel rebuilt = new ReadModel(slots, completedAt, new AtomicLong());
      current.set(rebuilt);
      rebuildCount.incrementAndGet();

      Duration duration = Duration.ofNanos(System.nanoTime() - started);
      RebuildResult result = new RebuildResult(
          replayed, (int) rebuilt.visibleCount(), duration, completedAt);

      sample.stop(meterRegistry.timer("config.projection.rebuild.duration"));
      meterRegistry.counter("config.projection.rebuild.total", "outcome", "success")
          .increment();

      logger.info("Projection rebuild complete: {} events replayed, {} configurations restored"
          + " in {} ms", result.eventsReplayed(), result.entries(), duration.toMillis());
      return result;
    } catch (InvariantViolationException ex) {
      meterRegistry.counter("config.projection.rebuild.total", "outcome", "failure").increment();
      logger.error("Projection rebuild aborted, keeping previous read model: {}",
          ex.getMessage(), ex);
      throw ex;
    } catch (RuntimeException ex) {
      meterRegistry.counter("config.projection.rebuild.total", "outcome", "failure").increment();
      logger.error("Projection rebuild failed, keeping previous read model: {}",
          ex.getMessage());
      throw ex;
    } finally {
      swapLock.writeLock().unlock();
    }
  }

  /**
   * Reports the current state of the read model.
   *
   * @return the projection status
   */
  public ProjectionStatus status() {
    ReadModel model = current.get();
    return new ProjectionStatus(
        (int) model.visibleCount(),
        model.rebuiltAt(),
        rebuildCount.get(),
        model.appliedSinceRebuild().get());
  }

  private static ApplyOutcome applyTo(Map<String, Slot> slots, RecordedEvent recorded) {
    ConfigEvent event = recorded.event();
    ApplyOutcome[] outcome = new ApplyOutcome[1];
    slots.compute(event.key(), (key, slot) -> {
      long last = slot == null ? 0 : slot.streamVersion();
      long version = recorded.streamVersion();
      if (version <= last) {
        outcome[0] = ApplyOutcome.DUPLICATE;
        return slot;
      }
      if (version > last + 1) {
        outcome[0] = ApplyOutcome.GAP;
        return slot;
      }
      outcome[0] = ApplyOutcome.APPLIED;
      return transition(key, version, event);
    });
    return outcome[0];
  }

  private static Slot transition(String key, long version, ConfigEvent event) {
    if (event instanceof ConfigValueSetEvent set) {
      return new Slot(version, new ConfigEntry(key, set.value(), version, set.timestamp()));
    }
    if (event instanceof ConfigValueDeletedEvent) {
      return new Slot(version, null);
    }
    throw new InvariantViolationException(
        "Unknown event type during projection: " + event.getClass().getName());
  }

  private static long lastVersion(Map<String, Slot> slots, String key) {
    Slot slot = slots.get(key);
    return slot == null ? 0 : slot.streamVersion();
  }

  /**
   * Per-key projection state. A {@code null} entry marks a deleted key whose
   * stream version must still be remembered.
   */
  private record Slot(long streamVersion, ConfigEntry entry) {
  }

  /**
   * One generation of the read model, replaced wholesale on rebuild.
   */
  private record ReadModel(
      Map<String, Slot> slots,
      Instant rebuiltAt,
      AtomicLong appliedSinceRebuild) {

    static ReadModel initial() {
      return new ReadModel(new ConcurrentHashMap<>(), null, new AtomicLong());
    }

    long visibleCount() {
      return slots.values().stream().filter(slot -> slot.entry() != null).count();
    }
  }
}
