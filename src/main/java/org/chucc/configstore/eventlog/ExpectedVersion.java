package org.chucc.configstore.eventlog;

/**
 * The stream version a writer assumes when appending.
 * The event log rejects the append if the stream moved on since the writer read it.
 *
 * @param version the exact expected version, or {@code -1} for {@link #ANY}
 */
public record ExpectedVersion(long version) {

  private static final long ANY_VERSION = -1L;

  /** Skips the concurrency check entirely. */
  public static final ExpectedVersion ANY = new ExpectedVersion(ANY_VERSION);

  /**
   * Creates an ExpectedVersion with validation.
   *
   * @throws IllegalArgumentException if the version is below -1
   */
  public ExpectedVersion {
    if (version < ANY_VERSION) {
      throw new IllegalArgumentException("Expected version cannot be negative: " + version);
    }
  }

  /**
   * Expects the stream to be at exactly the given version.
   *
   * @param version the stream version observed by the writer
   * @return the expected version
   */
  public static ExpectedVersion exact(long version) {
    if (version < 0) {
      throw new IllegalArgumentException("Expected version cannot be negative: " + version);
    }
    return new ExpectedVersion(version);
  }

  /**
   * Checks whether this expectation accepts any stream version.
   *
   * @return true for {@link #ANY}
   */
  public boolean isAny() {
    return version == ANY_VERSION;
  }

  /**
   * Checks whether a stream at the given version satisfies this expectation.
   *
   * @param currentVersion the stream's current version
   * @return true if the append may proceed
   */
  public boolean matches(long currentVersion) {
    return isAny() || version == currentVersion;
  }

  @Override
  public String toString() {
    return isAny() ? "ANY" : Long.toString(version);
  }
}
