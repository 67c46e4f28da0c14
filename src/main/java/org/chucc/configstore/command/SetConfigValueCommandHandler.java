package org.chucc.configstore.command;

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import io.micrometer.core.instrument.MeterRegistry;
import java.time.Clock;
import org.chucc.configstore.domain.ConfigValueAggregate;
import org.chucc.configstore.domain.Decision;
import org.chucc.configstore.repository.ConfigValueRepository;
import org.springframework.stereotype.Component;

/**
 * Handles SetConfigValueCommand by producing a ConfigValueSetEvent.
 * Writing to a deleted key resurrects it.
 */
@Component
public class SetConfigValueCommandHandler extends RetryingCommandHandler<SetConfigValueCommand> {

  private final Clock clock;

  /**
   * Constructs a SetConfigValueCommandHandler.
   *
   * @param repository the aggregate repository
   * @param meterRegistry the meter registry
   * @param clock the clock stamping events
   */
  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "Dependencies are Spring-managed beans and are intentionally shared")
  public SetConfigValueCommandHandler(
      ConfigValueRepository repository,
      MeterRegistry meterRegistry,
      Clock clock) {
    super(repository, meterRegistry);
    this.clock = clock;
  }

  @Override
  protected Decision decide(ConfigValueAggregate aggregate, SetConfigValueCommand command) {
    return aggregate.setValue(command.key(), command.value(), clock);
  }

  @Override
  protected String commandName() {
    return "set";
  }
}
