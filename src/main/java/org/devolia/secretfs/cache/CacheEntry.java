package org.devolia.secretfs.cache;

import org.devolia.secretfs.model.Secret;

/**
 * A cached secret together with the time it was last observed.
 *
 * <p>The timestamp comes from the cache's ticker and is only meaningful relative to other reads of
 * the same ticker.
 *
 * @author Devolia
 * @since 1.0.0
 */
final class CacheEntry {

  private final Secret secret;
  private final long observedAtNanos;

  CacheEntry(Secret secret, long observedAtNanos) {
    this.secret = secret;
    this.observedAtNanos = observedAtNanos;
  }

  Secret getSecret() {
    return secret;
  }

  /**
   * Checks if the entry may be served without asking the backend.
   *
   * @param nowNanos current ticker value
   * @param freshThresholdNanos trust window in nanoseconds
   * @return true if the entry is younger than the threshold
   */
  boolean isFresh(long nowNanos, long freshThresholdNanos) {
    return nowNanos - observedAtNanos < freshThresholdNanos;
  }
}
