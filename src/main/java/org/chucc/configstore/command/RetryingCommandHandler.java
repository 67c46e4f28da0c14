package org.chucc.configstore.command;

import io.micrometer.core.instrument.MeterRegistry;
import java.util.Locale;
import org.chucc.configstore.domain.ConfigValueAggregate;
import org.chucc.configstore.domain.Decision;
import org.chucc.configstore.eventlog.RecordedEvent;
import org.chucc.configstore.exception.ConcurrentWriteConflictException;
import org.chucc.configstore.exception.ConfigAlreadyDeletedException;
import org.chucc.configstore.exception.ConfigNotFoundException;
import org.chucc.configstore.exception.ConfigStoreException;
import org.chucc.configstore.exception.InvariantViolationException;
import org.chucc.configstore.exception.WrongExpectedVersionException;
import org.chucc.configstore.repository.ConfigValueRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryContext;
import org.springframework.retry.support.RetryTemplate;

/**
 * Base class for handlers that run the load, replay, decide, append cycle.
 *
 * <p>No lock is taken around the cycle. If another writer appends to the same
 * stream between load and append, the event log rejects the append and the whole
 * cycle runs once more on fresh state. A second conflict is surfaced as
 * {@link ConcurrentWriteConflictException}. Only {@link WrongExpectedVersionException}
 * is retried, and without backoff.
 *
 * <p>Metrics are recorded per command:
 * {@code config.commands} - Counter (tags {@code command}, {@code outcome})
 *
 * @param <C> the command type
 */
@SuppressWarnings("PMD.GuardLogStatement") // SLF4J parameterized logging is efficient
public abstract class RetryingCommandHandler<C extends Command> implements CommandHandler<C> {
  private static final Logger logger = LoggerFactory.getLogger(RetryingCommandHandler.class);

  static final int MAX_ATTEMPTS = 2;

  private final ConfigValueRepository repository;
  private final MeterRegistry meterRegistry;
  private final RetryTemplate retryTemplate;

  /**
   * Constructs the handler.
   *
   * @param repository the aggregate repository
   * @param meterRegistry the meter registry
   */
  protected RetryingCommandHandler(ConfigValueRepository repository, MeterRegistry meterRegistry) {
    this.repository = repository;
    this.meterRegistry = meterRegistry;
    this.retryTemplate = RetryTemplate.builder()
        .maxAttempts(MAX_ATTEMPTS)
        .retryOn(WrongExpectedVersionException.class)
        .noBackoff()
        .build();
  }

  @Override
  public RecordedEvent handle(C command) {
    try {
      return retryTemplate.execute(
          context -> attempt(command, context),
          context -> recover(command, context));
    } catch (InvariantViolationException ex) {
      logger.error("Internal error while handling {} for key: {}",
          commandName(), command.key(), ex);
      throw ex;
    }
  }

  private RecordedEvent attempt(C command, RetryContext context) {
    int attempt = context.getRetryCount() + 1;
    ConfigValueAggregate aggregate = repository.load(command.key());
    Decision decision = decide(aggregate, command);

    if (decision instanceof Decision.Rejected rejected) {
      countOutcome(rejected.reason().name().toLowerCase(Locale.ROOT));
      throw toException(command, rejected);
    }

    Decision.Accepted accepted = (Decision.Accepted) decision;
    try {
      RecordedEvent recorded = repository.save(
          command.key(), aggregate.version(), accepted.event());
      countOutcome(attempt == 1 ? "success" : "success_after_retry");
      return recorded;
    } catch (WrongExpectedVersionException ex) {
      logger.info("Version conflict on attempt {} for key: {} (expected v{}, actual v{})",
          attempt, command.key(), ex.getExpectedVersion(), ex.getActualVersion());
      throw ex;
    }
  }

  // Stateless templates also recover from non-retryable failures; those pass through.
  private RecordedEvent recover(C command, RetryContext context) {
    Throwable last = context.getLastThrowable();
    if (last instanceof WrongExpectedVersionException conflict) {
      countOutcome("conflict");
      throw new ConcurrentWriteConflictException(
          "Concurrent write to key " + command.key() + " still conflicting after retry",
          conflict);
    }
    if (last instanceof RuntimeException runtime) {
      throw runtime;
    }
    if (last instanceof Error error) {
      throw error;
    }
    throw new IllegalStateException("Command failed for key " + command.key(), last);
  }

  /**
   * Runs the command against the replayed aggregate.
   *
   * @param aggregate the aggregate replayed from the key's stream
   * @param command the command
   * @return the aggregate's decision
   */
  protected abstract Decision decide(ConfigValueAggregate aggregate, C command);

  /**
   * Gets the command name used in metric tags.
   *
   * @return the command name
   */
  protected abstract String commandName();

  private ConfigStoreException toException(C command, Decision.Rejected rejected) {
    logger.debug("{} rejected for key: {} ({})",
        commandName(), command.key(), rejected.reason());
    return switch (rejected.reason()) {
      case NOT_FOUND -> new ConfigNotFoundException(command.key());
      case ALREADY_DELETED -> new ConfigAlreadyDeletedException(command.key());
    };
  }

  private void countOutcome(String outcome) {
    meterRegistry.counter("config.commands", "command", commandName(), "outcome", outcome)
        .increment();
  }
}
