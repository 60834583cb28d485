package org.devolia.secretfs.cache;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Timing policy of a {@link SecretCache}.
 *
 * <ul>
 *   <li><strong>freshThreshold</strong> - how long a cached entry is served without asking the
 *       backend again. Zero disables the shortcut.
 *   <li><strong>secretFetchTimeout</strong> - longest wait for a single secret from the backend
 *   <li><strong>secretListFetchTimeout</strong> - longest wait for the secret list
 * </ul>
 *
 * @author Devolia
 * @since 1.0.0
 */
public class Timeouts {

  private static final Logger logger = LoggerFactory.getLogger(Timeouts.class);

  private final Duration freshThreshold;
  private final Duration secretFetchTimeout;
  private final Duration secretListFetchTimeout;

  /**
   * Constructor with configuration values.
   *
   * @param freshThreshold time an entry is trusted without a backend call
   * @param secretFetchTimeout deadline for fetching one secret
   * @param secretListFetchTimeout deadline for fetching the secret list
   */
  public Timeouts(
      Duration freshThreshold, Duration secretFetchTimeout, Duration secretListFetchTimeout) {
    this.freshThreshold = freshThreshold;
    this.secretFetchTimeout = secretFetchTimeout;
    this.secretListFetchTimeout = secretListFetchTimeout;
  }

  /**
   * Creates timeouts from millisecond values.
   *
   * @param freshThresholdMs fresh threshold in milliseconds
   * @param secretFetchTimeoutMs secret fetch deadline in milliseconds
   * @param secretListFetchTimeoutMs secret list fetch deadline in milliseconds
   * @return the timeouts
   */
  public static Timeouts ofMillis(
      long freshThresholdMs, long secretFetchTimeoutMs, long secretListFetchTimeoutMs) {
    return new Timeouts(
        Duration.ofMillis(freshThresholdMs),
        Duration.ofMillis(secretFetchTimeoutMs),
        Duration.ofMillis(secretListFetchTimeoutMs));
  }

  public Duration getFreshThreshold() {
    return freshThreshold;
  }

  public Duration getSecretFetchTimeout() {
    return secretFetchTimeout;
  }

  public Duration getSecretListFetchTimeout() {
    return secretListFetchTimeout;
  }

  /**
   * Validates the timeouts.
   *
   * @throws IllegalArgumentException if any duration is missing or negative
   */
  public void validate() {
    requireNonNegative("Fresh threshold", freshThreshold);
    requireNonNegative("Secret fetch timeout", secretFetchTimeout);
    requireNonNegative("Secret list fetch timeout", secretListFetchTimeout);
    logger.debug("Timeouts validation passed");
  }

  private static void requireNonNegative(String what, Duration value) {
    if (value == null) {
      throw new IllegalArgumentException(what + " cannot be null");
    }
    if (value.isNegative()) {
      throw new IllegalArgumentException(what + " cannot be negative: " + value);
    }
  }

  @Override
  public String toString() {
    return "Timeouts{freshThreshold="
        + freshThreshold
        + ", secretFetchTimeout="
        + secretFetchTimeout
        + ", secretListFetchTimeout="
        + secretListFetchTimeout
        + "}";
  }
}
