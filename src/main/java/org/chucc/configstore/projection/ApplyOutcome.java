package org.chucc.configstore.projection;

/**
 * Result of applying one recorded event to the projection.
 */
public enum ApplyOutcome {
  /** The event was the next one for its stream and is now reflected. */
  APPLIED,
  /** The event was already reflected; nothing changed. */
  DUPLICATE,
  /** Earlier events of the stream are missing; nothing changed. */
  GAP,
  /** The event belongs to a stream the projection does not track. */
  IGNORED
}
