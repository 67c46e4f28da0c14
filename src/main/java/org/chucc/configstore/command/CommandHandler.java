package org.chucc.configstore.command;

import org.chucc.configstore.eventlog.RecordedEvent;

/**
 * Interface for command handlers in the CQRS pattern.
 * Handlers validate a command against the replayed aggregate and append the
 * resulting event; they never touch the read model.
 *
 * @param <C> the command type
 */
public interface CommandHandler<C extends Command> {
  /**
   * Handles a command and appends the event it produces.
   *
   * @param command the command to handle
   * @return the recorded event
   * @throws org.chucc.configstore.exception.ConfigStoreException if the command is
   *     refused or cannot be stored
   */
  RecordedEvent handle(C command);
}
