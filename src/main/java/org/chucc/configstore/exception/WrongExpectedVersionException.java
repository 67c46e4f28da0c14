package org.chucc.configstore.exception;

/**
 * Thrown by the event log when an append names an expected version that does not
 * match the stream's current version.
 * Error code: wrong_expected_version
 */
public class WrongExpectedVersionException extends ConfigStoreException {

  private static final long serialVersionUID = 1L;

  private final String streamId;
  private final long expectedVersion;
  private final long actualVersion;

  /**
   * Constructs a new WrongExpectedVersionException.
   *
   * @param streamId the stream that was appended to
   * @param expectedVersion the version the writer expected
   * @param actualVersion the version the stream actually had
   */
  public WrongExpectedVersionException(String streamId, long expectedVersion, long actualVersion) {
    super("Wrong expected version for stream " + streamId
        + ": expected " + expectedVersion + " but was " + actualVersion,
        "wrong_expected_version");
    this.streamId = streamId;
    this.expectedVersion = expectedVersion;
    this.actualVersion = actualVersion;
  }

  public String getStreamId() {
    return streamId;
  }

  public long getExpectedVersion() {
    return expectedVersion;
  }

  public long getActualVersion() {
    return actualVersion;
  }
}
