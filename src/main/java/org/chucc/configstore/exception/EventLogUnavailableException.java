package org.chucc.configstore.exception;

/**
 * Thrown when the event log cannot be reached, times out, or fails an I/O operation.
 * Never retried by the core.
 * Error code: event_log_unavailable
 */
public class EventLogUnavailableException extends ConfigStoreException {

  private static final long serialVersionUID = 1L;

  private static final String ERROR_CODE = "event_log_unavailable";

  /**
   * Constructor with message.
   *
   * @param message the detail message
   */
  public EventLogUnavailableException(String message) {
    super(message, ERROR_CODE);
  }

  /**
   * Constructor with message and cause.
   *
   * @param message the detail message
   * @param cause the underlying I/O failure
   */
  public EventLogUnavailableException(String message, Throwable cause) {
    super(message, ERROR_CODE, cause);
  }
}
