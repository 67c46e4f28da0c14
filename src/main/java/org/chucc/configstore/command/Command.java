package org.chucc.configstore.command;

/**
 * Marker interface for all CQRS commands.
 * Commands represent intent to change the system state and produce events.
 */
public interface Command {
  /**
   * Gets the configuration key this command applies to.
   *
   * @return the configuration key
   */
  String key();
}
