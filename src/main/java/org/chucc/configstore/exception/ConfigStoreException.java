package org.chucc.configstore.exception;

/**
 * Base exception for config store errors.
 * Carries a canonical error code that the transport layer maps to its own status codes.
 */
public class ConfigStoreException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  private final String code;

  /**
   * Constructor with message and code.
   *
   * @param message error message
   * @param code canonical error code
   */
  public ConfigStoreException(String message, String code) {
    super(message);
    this.code = code;
  }

  /**
   * Constructor with message, code, and cause.
   *
   * @param message error message
   * @param code canonical error code
   * @param cause the cause
   */
  public ConfigStoreException(String message, String code, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public String getCode() {
    return code;
  }
}
