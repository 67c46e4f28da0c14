package org.chucc.configstore.exception;

/**
 * Exception thrown when deleting a configuration key that is already tombstoned.
 * Error code: config_already_deleted
 */
public class ConfigAlreadyDeletedException extends ConfigStoreException {

  private static final long serialVersionUID = 1L;

  private static final String ERROR_CODE = "config_already_deleted";

  /**
   * Constructor with key.
   *
   * @param key the configuration key
   */
  public ConfigAlreadyDeletedException(String key) {
    super("Config already deleted: " + key, ERROR_CODE);
  }
}
