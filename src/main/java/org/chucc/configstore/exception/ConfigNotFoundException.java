package org.chucc.configstore.exception;

/**
 * Exception thrown when a command targets a configuration key that was never set.
 * Error code: config_not_found
 */
public class ConfigNotFoundException extends ConfigStoreException {

  private static final long serialVersionUID = 1L;

  private static final String ERROR_CODE = "config_not_found";

  /**
   * Constructor with key.
   *
   * @param key the configuration key that was not found
   */
  public ConfigNotFoundException(String key) {
    super("Config not found: " + key, ERROR_CODE);
  }
}
