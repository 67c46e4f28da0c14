package org.chucc.configstore.domain;

import java.util.Objects;
import org.chucc.configstore.event.ConfigEvent;

/**
 * Outcome of running a command against a {@link ConfigValueAggregate}.
 * Expected refusals are values, not exceptions.
 */
public sealed interface Decision permits Decision.Accepted, Decision.Rejected {

  /**
   * The command was accepted and produced one event.
   *
   * @param event the event to append
   * @param aggregate the aggregate state after applying the event
   */
  record Accepted(ConfigEvent event, ConfigValueAggregate aggregate) implements Decision {
    /**
     * Creates an Accepted decision with validation.
     */
    public Accepted {
      Objects.requireNonNull(event, "Event cannot be null");
      Objects.requireNonNull(aggregate, "Aggregate cannot be null");
    }
  }

  /**
   * The command was refused; the aggregate is unchanged.
   *
   * @param reason why the command was refused
   */
  record Rejected(Rejection reason) implements Decision {
    /**
     * Creates a Rejected decision with validation.
     */
    public Rejected {
      Objects.requireNonNull(reason, "Reason cannot be null");
    }
  }
}
