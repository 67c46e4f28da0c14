package org.chucc.configstore.projection;

/**
 * How the read model follows the event log. Chosen by the operator via
 * {@code projection.mode}.
 */
public enum ConsistencyMode {
  /**
   * The projection consumes the live event feed and the facade applies each
   * successful write synchronously. Reads trail writes by a small, bounded lag.
   */
  LIVE,

  /**
   * The projection changes only when it is rebuilt: at startup, on the optional
   * scheduled rebuild, or on demand. Writes are durable at once but not readable
   * until the next rebuild.
   */
  RESTART_ONLY
}
