package org.chucc.configstore.exception;

/**
 * Thrown when an internal invariant is broken, for example an event replayed into
 * the aggregate of a different key. Always a bug; never expected at runtime.
 * Error code: internal_error
 */
public class InvariantViolationException extends ConfigStoreException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructor with message.
   *
   * @param message description of the broken invariant
   */
  public InvariantViolationException(String message) {
    super(message, "internal_error");
  }
}
