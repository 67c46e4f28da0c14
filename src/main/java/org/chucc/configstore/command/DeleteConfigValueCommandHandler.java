package org.chucc.configstore.command;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.chucc.configstore.domain.ConfigValueAggregate;
import org.chucc.configstore.domain.Decision;
import org.chucc.configstore.repository.ConfigValueRepository;
import org.springframework.stereotype.Component;

/**
 * Handles DeleteConfigValueCommand by producing a ConfigValueDeletedEvent.
 * Refused for keys that were never set or are already deleted.
 */
@Component
public class DeleteConfigValueCommandHandler
    extends RetryingCommandHandler<DeleteConfigValueCommand> {

  private final Clock clock;

  /**
   * Constructs a DeleteConfigValueCommandHandler.
   *
   * @param repository the aggregate repository
   * @param meterRegistry the meter registry
   * @param clock the clock stamping events
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Dependencies are Spring-managed beans and are intentionally shared")
  public DeleteConfigValueCommandHandler(
      ConfigValueRepository repository,
      MeterRegistry meterRegistry,
      Clock clock) {
    super(repository, meterRegistry);
    this.clock = clock;
  }

  @Override
  protected Decision decide(ConfigValueAggregate aggregate, DeleteConfigValueCommand command) {
    return aggregate.deleteValue(clock);
  }

  @Override
  protected String commandName() {
    return "delete";
  }
}
