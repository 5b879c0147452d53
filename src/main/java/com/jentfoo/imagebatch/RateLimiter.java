package com.jentfoo.imagebatch;

import org.threadly.util.Clock;

/**
 * Token bucket with a burst of one, limiting how many conversions start per second across all 
 * workers.  Callers block until their token is due.
 */
public class RateLimiter {
  private static final long MAX_SLEEP_INTERVAL_IN_MILLIS = 50;

  private final double millisPerPermit;
  private final Object lock = new Object();
  private double nextFreeTime;

  public RateLimiter(double permitsPerSecond) {
    if (permitsPerSecond <= 0) {
      throw new IllegalArgumentException("Permits per second must be positive: " + permitsPerSecond);
    }

    millisPerPermit = 1000d / permitsPerSecond;
    nextFreeTime = 0;
  }

  /**
   * Reserves the next token and returns how long the caller must wait before using it.
   */
  protected long reserve() {
    long now = Clock.accurateForwardProgressingMillis();
    synchronized (lock) {
      double tokenTime = Math.max(now, nextFreeTime);
      nextFreeTime = tokenTime + millisPerPermit;

      return (long)Math.ceil(tokenTime - now);
    }
  }

  /**
   * Blocks until a token is available.
   * 
   * @return {@code false} if the signal was cancelled (or the thread interrupted) before the 
   *           token was due
   */
  public boolean acquire(CancellationSignal signal) {
    long readyTime = Clock.accurateForwardProgressingMillis() + reserve();
    while (true) {
      if (signal.isCancelled()) {
        return false;
      }
      long remaining = readyTime - Clock.accurateForwardProgressingMillis();
      if (remaining <= 0) {
        return true;
      }

      try {
        Thread.sleep(Math.min(remaining, MAX_SLEEP_INTERVAL_IN_MILLIS));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        return false;
      }
    }
  }
}
