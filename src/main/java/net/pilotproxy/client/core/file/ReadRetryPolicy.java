package net.pilotproxy.client.core.file;

import java.util.concurrent.TimeUnit;

/** Bound and pause of the stability-checked read loop. */
public final class ReadRetryPolicy {
  public static final int DEFAULT_MAX_ATTEMPTS = 10;
  public static final long DEFAULT_PAUSE_MICROS = 500L;

  public static final ReadRetryPolicy DEFAULT =
      new ReadRetryPolicy(DEFAULT_MAX_ATTEMPTS, DEFAULT_PAUSE_MICROS);

  private final int maxAttempts;
  private final long pauseMicros;

  public ReadRetryPolicy(int maxAttempts, long pauseMicros) {
    if (maxAttempts < 1) {
      throw new IllegalArgumentException("maxAttempts must be positive: " + maxAttempts);
    }
    if (pauseMicros < 0) {
      throw new IllegalArgumentException("pauseMicros must not be negative: " + pauseMicros);
    }
    this.maxAttempts = maxAttempts;
    this.pauseMicros = pauseMicros;
  }

  public int getMaxAttempts() {
    return maxAttempts;
  }

  public long getPauseMicros() {
    return pauseMicros;
  }

  void pause() throws InterruptedException {
    TimeUnit.MICROSECONDS.sleep(pauseMicros);
  }

  @Override
  public String toString() {
    return "ReadRetryPolicy{maxAttempts=" + maxAttempts + ", pauseMicros=" + pauseMicros + '}';
  }
}
