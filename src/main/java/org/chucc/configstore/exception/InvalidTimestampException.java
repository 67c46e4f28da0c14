package org.chucc.configstore.exception;

/**
 * Exception thrown when a time-travel query carries a malformed RFC 3339 timestamp.
 * Error code: invalid_timestamp
 */
public class InvalidTimestampException extends ConfigStoreException {

  private static final long serialVersionUID = 1L;

  /**
   * Constructor with the rejected input and parse failure.
   *
   * @param timestamp the rejected timestamp string
   * @param cause the parse failure
   */
  public InvalidTimestampException(String timestamp, Throwable cause) {
    super("Invalid RFC 3339 timestamp: " + timestamp, "invalid_timestamp", cause);
  }
}
