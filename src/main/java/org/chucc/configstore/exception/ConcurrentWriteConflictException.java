package org.chucc.configstore.exception;

/**
 * Thrown when a write still loses the optimistic concurrency race after its retry.
 * Error code: concurrent_write_conflict
 */
public class ConcurrentWriteConflictException extends ConfigStoreException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructs a new ConcurrentWriteConflictException with the specified message and cause.
   *
   * @param message the detail message
   * @param cause the last version conflict reported by the event log
   */
  public ConcurrentWriteConflictException(String message, Throwable cause) {
    super(message, "concurrent_write_conflict", cause);
  }
}
