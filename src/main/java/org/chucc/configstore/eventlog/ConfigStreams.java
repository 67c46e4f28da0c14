package org.chucc.configstore.eventlog;

import java.util.Map;

/**
 * Naming and metadata conventions for configuration streams.
 * One stream per configuration key.
 */
public final class ConfigStreams {

  /** Prefix shared by every configuration stream. */
  public static final String STREAM_PREFIX = "config-";

  /** Aggregate type recorded in event metadata. */
  public static final String AGGREGATE_TYPE = "ConfigValue";

  /** Metadata key holding the aggregate ID. */
  public static final String AGGREGATE_ID = "aggregate_id";

  /** Metadata key holding the aggregate type. */
  public static final String AGGREGATE_TYPE_KEY = "aggregate_type";

  private ConfigStreams() {
    // Utility class - prevent instantiation
  }

  /**
   * Gets the stream ID for a configuration key.
   *
   * @param key the configuration key
   * @return the stream ID
   */
  public static String streamId(String key) {
    return STREAM_PREFIX + key;
  }

  /**
   * Checks whether a stream holds configuration events.
   *
   * @param streamId the stream ID
   * @return true for configuration streams
   */
  public static boolean isConfigStream(String streamId) {
    return streamId.startsWith(STREAM_PREFIX);
  }

  /**
   * Builds the metadata recorded alongside each event of a key.
   *
   * @param key the configuration key
   * @return the event metadata
   */
  public static Map<String, String> metadata(String key) {
    return Map.of(AGGREGATE_ID, key, AGGREGATE_TYPE_KEY, AGGREGATE_TYPE);
  }
}
