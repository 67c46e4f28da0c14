package org.chucc.configstore.testutil;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

/**
 * UTC clock that stands still until a test moves it.
 */
public final class MutableClock extends Clock {

  private volatile Instant now;

  /**
   * Creates a clock showing the given instant.
   *
   * @param start the initial instant
   */
  public MutableClock(Instant start) {
    this.now = start;
  }

  /**
   * Creates a clock showing the given RFC 3339 instant.
   *
   * @param start the initial instant
   * @return the clock
   */
  public static MutableClock at(String start) {
    return new MutableClock(Instant.parse(start));
  }

  /**
   * Moves the clock forward.
   *
   * @param duration how far to move
   */
  public void advance(Duration duration) {
    now = now.plus(duration);
  }

  /**
   * Sets the clock to an instant.
   *
   * @param instant the new instant
   */
  public void set(Instant instant) {
    now = instant;
  }

  @Override
  public ZoneId getZone() {
    return ZoneOffset.UTC;
  }

  @Override
  public Clock withZone(ZoneId zone) {
    return Clock.fixed(now, zone);
  }

  @Override
  public Instant instant() {
    return now;
  }
}
