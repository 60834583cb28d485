package org.devolia.secretfs.resilience;

import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for the retry and circuit breaker wrapped around secret client calls.
 *
 * <p>Retries happen inside a single backend call, so they are still cut short by the cache's
 * fetch deadline. Keep {@code retryMaxAttempts * retryBaseDelay} well below the secret fetch
 * timeout or the later attempts will never be awaited.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class ResilienceConfig {

  private static final Logger logger = LoggerFactory.getLogger(ResilienceConfig.class);

  // Default values
  public static final int DEFAULT_RETRY_MAX_ATTEMPTS = 3;
  public static final long DEFAULT_RETRY_BASE_DELAY_MS = 100;
  public static final boolean DEFAULT_CIRCUIT_BREAKER_ENABLED = true;
  public static final float DEFAULT_CIRCUIT_BREAKER_FAILURE_RATE_THRESHOLD = 50.0f;
  public static final long DEFAULT_CIRCUIT_BREAKER_RECOVERY_TIMEOUT_MS = 30000;

  private final int retryMaxAttempts;
  private final Duration retryBaseDelay;
  private final boolean circuitBreakerEnabled;
  private final float circuitBreakerFailureRateThreshold;
  private final Duration circuitBreakerRecoveryTimeout;

  /**
   * Constructor with configuration values.
   *
   * @param retryMaxAttempts maximum attempts including the first call (default: 3)
   * @param retryBaseDelayMs initial backoff delay in milliseconds, doubled per attempt (default:
   *     100)
   * @param circuitBreakerEnabled whether the circuit breaker is enabled (default: true)
   * @param circuitBreakerFailureRateThreshold failure percentage that opens the circuit (default:
   *     50)
   * @param circuitBreakerRecoveryTimeoutMs time spent open before probing again, in milliseconds
   *     (default: 30000)
   */
  public ResilienceConfig(
      int retryMaxAttempts,
      long retryBaseDelayMs,
      boolean circuitBreakerEnabled,
      float circuitBreakerFailureRateThreshold,
      long circuitBreakerRecoveryTimeoutMs) {

    this.retryMaxAttempts = retryMaxAttempts;
    this.retryBaseDelay = Duration.ofMillis(retryBaseDelayMs);
    this.circuitBreakerEnabled = circuitBreakerEnabled;
    this.circuitBreakerFailureRateThreshold = circuitBreakerFailureRateThreshold;
    this.circuitBreakerRecoveryTimeout = Duration.ofMillis(circuitBreakerRecoveryTimeoutMs);

    logger.debug(
        "Resilience configuration initialized - Retry: max={}, baseDelay={}ms; "
            + "CircuitBreaker: enabled={}, failureRate={}%, recovery={}ms",
        retryMaxAttempts,
        retryBaseDelayMs,
        circuitBreakerEnabled,
        circuitBreakerFailureRateThreshold,
        circuitBreakerRecoveryTimeoutMs);
  }

  /**
   * Creates configuration with default values.
   *
   * @return default resilience configuration
   */
  public static ResilienceConfig defaultConfig() {
    return new ResilienceConfig(
        DEFAULT_RETRY_MAX_ATTEMPTS,
        DEFAULT_RETRY_BASE_DELAY_MS,
        DEFAULT_CIRCUIT_BREAKER_ENABLED,
        DEFAULT_CIRCUIT_BREAKER_FAILURE_RATE_THRESHOLD,
        DEFAULT_CIRCUIT_BREAKER_RECOVERY_TIMEOUT_MS);
  }

  public int getRetryMaxAttempts() {
    return retryMaxAttempts;
  }

  public Duration getRetryBaseDelay() {
    return retryBaseDelay;
  }

  public boolean isCircuitBreakerEnabled() {
    return circuitBreakerEnabled;
  }

  public float getCircuitBreakerFailureRateThreshold() {
    return circuitBreakerFailureRateThreshold;
  }

  public Duration getCircuitBreakerRecoveryTimeout() {
    return circuitBreakerRecoveryTimeout;
  }

  /**
   * Validates the resilience configuration.
   *
   * @throws IllegalArgumentException if configuration is invalid
   */
  public void validate() {
    if (retryMaxAttempts < 1) {
      throw new IllegalArgumentException(
          "Retry max attempts must be at least 1: " + retryMaxAttempts);
    }

    if (retryBaseDelay.isNegative() || retryBaseDelay.isZero()) {
      throw new IllegalArgumentException("Retry base delay must be positive: " + retryBaseDelay);
    }

    if (circuitBreakerFailureRateThreshold <= 0 || circuitBreakerFailureRateThreshold > 100) {
      throw new IllegalArgumentException(
          "Circuit breaker failure rate threshold must be in (0, 100]: "
              + circuitBreakerFailureRateThreshold);
    }

    if (circuitBreakerRecoveryTimeout.isNegative() || circuitBreakerRecoveryTimeout.isZero()) {
      throw new IllegalArgumentException(
          "Circuit breaker recovery timeout must be positive: " + circuitBreakerRecoveryTimeout);
    }

    logger.debug("Resilience configuration validation passed");
  }
}
