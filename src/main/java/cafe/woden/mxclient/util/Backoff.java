package cafe.woden.mxclient.util;

import java.util.concurrent.ThreadLocalRandom;

/** Jittered exponential backoff shared by the sync loop and the reconnect scheduler. */
public final class Backoff {

  /** Never retry sooner than this, whatever the jitter rolled. */
  public static final long MIN_DELAY_MS = 250;

  private Backoff() {}

  /**
   * Delay before retry number {@code attempt} (1-based): {@code initial * multiplier^(attempt-1)},
   * capped at {@code maxDelayMs}, then scaled by a random factor in {@code 1 ± jitterPct}.
   */
  public static long delayMs(
      long initialDelayMs, long maxDelayMs, double multiplier, double jitterPct, long attempt) {
    double mult = Math.pow(multiplier, Math.max(0, attempt - 1));
    double raw = initialDelayMs * mult;
    long capped = (long) Math.min(raw, (double) maxDelayMs);

    if (jitterPct <= 0) return capped;

    double factor = 1.0 + ThreadLocalRandom.current().nextDouble(-jitterPct, jitterPct);
    long withJitter = (long) Math.max(0, capped * factor);
    return Math.max(MIN_DELAY_MS, withJitter);
  }
}
