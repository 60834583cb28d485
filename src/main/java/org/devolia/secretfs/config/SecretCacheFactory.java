package org.devolia.secretfs.config;

import com.github.benmanes.caffeine.cache.Ticker;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;
import org.devolia.secretfs.backend.ClientBackend;
import org.devolia.secretfs.backend.SecretBackend;
import org.devolia.secretfs.backend.SecretClient;
import org.devolia.secretfs.cache.SecretCache;
import org.devolia.secretfs.cache.Timeouts;
import org.devolia.secretfs.log.LogConfig;
import org.devolia.secretfs.metrics.SecretCacheMetrics;
import org.devolia.secretfs.resilience.ResilienceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory for creating {@link SecretCache} instances from configuration properties.
 *
 * <p>This factory is responsible for:
 *
 * <ul>
 *   <li>Reading and validating configuration parameters
 *   <li>Building timeouts, logging, resilience and metrics components
 *   <li>Wiring a cache to either a ready-made backend or a raw secret client
 * </ul>
 *
 * <p>Recognized properties:
 *
 * <pre>
 * secretfs.mountpoint=/secrets                          # Mountpoint label for logs and metrics
 * secretfs.debug=false                                  # Emit debug-level cache logs
 * secretfs.cache.fresh-threshold-ms=200                 # Trust window for cached entries
 * secretfs.cache.secret-timeout-ms=500                  # Deadline for one secret
 * secretfs.cache.secret-list-timeout-ms=5000            # Deadline for the secret list
 * secretfs.retry.max-attempts=3                         # Client attempts per backend call
 * secretfs.retry.base-delay-ms=100                      # First retry backoff
 * secretfs.circuit-breaker.enabled=true                 # Enable the client circuit breaker
 * secretfs.circuit-breaker.failure-rate-threshold=50    # Failure percentage that opens it
 * secretfs.circuit-breaker.recovery-timeout-ms=30000    # Time spent open before probing
 * </pre>
 *
 * @author Devolia
 * @since 1.0.0
 */
public class SecretCacheFactory {

  private static final Logger logger = LoggerFactory.getLogger(SecretCacheFactory.class);

  // Configuration keys
  public static final String CONFIG_MOUNTPOINT = "secretfs.mountpoint";
  public static final String CONFIG_DEBUG = "secretfs.debug";
  public static final String CONFIG_FRESH_THRESHOLD = "secretfs.cache.fresh-threshold-ms";
  public static final String CONFIG_SECRET_TIMEOUT = "secretfs.cache.secret-timeout-ms";
  public static final String CONFIG_SECRET_LIST_TIMEOUT = "secretfs.cache.secret-list-timeout-ms";
  public static final String CONFIG_RETRY_MAX_ATTEMPTS = "secretfs.retry.max-attempts";
  public static final String CONFIG_RETRY_BASE_DELAY = "secretfs.retry.base-delay-ms";
  public static final String CONFIG_CIRCUIT_BREAKER_ENABLED = "secretfs.circuit-breaker.enabled";
  public static final String CONFIG_CIRCUIT_BREAKER_FAILURE_RATE =
      "secretfs.circuit-breaker.failure-rate-threshold";
  public static final String CONFIG_CIRCUIT_BREAKER_RECOVERY =
      "secretfs.circuit-breaker.recovery-timeout-ms";

  // Default values
  public static final String DEFAULT_MOUNTPOINT = "/secrets";
  public static final long DEFAULT_FRESH_THRESHOLD_MS = 200;
  public static final long DEFAULT_SECRET_TIMEOUT_MS = 500;
  public static final long DEFAULT_SECRET_LIST_TIMEOUT_MS = 5000;

  private final Properties properties;
  private final MeterRegistry meterRegistry;

  /**
   * Constructor with configuration properties and a meter registry.
   *
   * @param properties the configuration properties
   * @param meterRegistry registry for cache and backend metrics
   */
  public SecretCacheFactory(Properties properties, MeterRegistry meterRegistry) {
    this.properties = Objects.requireNonNull(properties, "properties cannot be null");
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry cannot be null");

    logger.debug(
        "Configuration - Mountpoint: {}, Debug: {}, Timeouts: {}",
        getLogConfig().getMountpoint(),
        getLogConfig().isDebug(),
        getTimeouts());

    validateConfiguration();
  }

  /**
   * Constructor with configuration properties and a private {@link SimpleMeterRegistry}.
   *
   * @param properties the configuration properties
   */
  public SecretCacheFactory(Properties properties) {
    this(properties, new SimpleMeterRegistry());
  }

  /**
   * Creates a factory from a properties file on the classpath.
   *
   * @param resource the resource path, e.g. {@code "secretfs.properties"}
   * @return the factory
   * @throws IOException if the resource is missing or unreadable
   */
  public static SecretCacheFactory fromClasspath(String resource) throws IOException {
    Properties properties = new Properties();
    try (InputStream in = SecretCacheFactory.class.getClassLoader().getResourceAsStream(resource)) {
      if (in == null) {
        throw new IOException("Configuration resource not found: " + resource);
      }
      properties.load(in);
    }
    logger.info("Loaded secret cache configuration from {}", resource);
    return new SecretCacheFactory(properties);
  }

  /**
   * Creates a cache around a ready-made backend.
   *
   * @param backend the secret backend
   * @return a new cache
   */
  public SecretCache create(SecretBackend backend) {
    LogConfig logConfig = getLogConfig();
    logger.info("Creating secret cache for mountpoint: {}", logConfig.getMountpoint());
    return new SecretCache(
        backend,
        getTimeouts(),
        logConfig,
        createMetrics(logConfig),
        Ticker.systemTicker(),
        null);
  }

  /**
   * Creates a cache around a secret client, adding retries and circuit breaking.
   *
   * @param client the transport client
   * @return a new cache
   */
  public SecretCache create(SecretClient client) {
    LogConfig logConfig = getLogConfig();
    SecretCacheMetrics metrics = createMetrics(logConfig);
    ClientBackend backend =
        new ClientBackend(client, getResilienceConfig(), metrics, logConfig.getMountpoint());

    logger.info("Creating client-backed secret cache for mountpoint: {}", logConfig.getMountpoint());
    return new SecretCache(
        backend,
        getTimeouts(),
        logConfig,
        metrics,
        Ticker.systemTicker(),
        null);
  }

  /**
   * Gets the timeouts from configuration.
   *
   * @return the timeouts
   */
  public Timeouts getTimeouts() {
    return Timeouts.ofMillis(
        getLong(CONFIG_FRESH_THRESHOLD, DEFAULT_FRESH_THRESHOLD_MS),
        getLong(CONFIG_SECRET_TIMEOUT, DEFAULT_SECRET_TIMEOUT_MS),
        getLong(CONFIG_SECRET_LIST_TIMEOUT, DEFAULT_SECRET_LIST_TIMEOUT_MS));
  }

  /**
   * Gets the logging options from configuration.
   *
   * @return the logging options
   */
  public LogConfig getLogConfig() {
    return new LogConfig(
        getBoolean(CONFIG_DEBUG, false),
        properties.getProperty(CONFIG_MOUNTPOINT, DEFAULT_MOUNTPOINT));
  }

  /**
   * Gets the resilience settings from configuration.
   *
   * @return the resilience settings
   */
  public ResilienceConfig getResilienceConfig() {
    return new ResilienceConfig(
        (int) getLong(CONFIG_RETRY_MAX_ATTEMPTS, ResilienceConfig.DEFAULT_RETRY_MAX_ATTEMPTS),
        getLong(CONFIG_RETRY_BASE_DELAY, ResilienceConfig.DEFAULT_RETRY_BASE_DELAY_MS),
        getBoolean(
            CONFIG_CIRCUIT_BREAKER_ENABLED, ResilienceConfig.DEFAULT_CIRCUIT_BREAKER_ENABLED),
        getFloat(
            CONFIG_CIRCUIT_BREAKER_FAILURE_RATE,
            ResilienceConfig.DEFAULT_CIRCUIT_BREAKER_FAILURE_RATE_THRESHOLD),
        getLong(
            CONFIG_CIRCUIT_BREAKER_RECOVERY,
            ResilienceConfig.DEFAULT_CIRCUIT_BREAKER_RECOVERY_TIMEOUT_MS));
  }

  private SecretCacheMetrics createMetrics(LogConfig logConfig) {
    logger.debug("Creating SecretCacheMetrics for mountpoint: {}", logConfig.getMountpoint());
    return new SecretCacheMetrics(meterRegistry, logConfig.getMountpoint());
  }

  /** Validates the configuration, failing fast on malformed or out-of-range values. */
  private void validateConfiguration() {
    try {
      getTimeouts().validate();
      getResilienceConfig().validate();
    } catch (IllegalArgumentException e) {
      logger.error("Invalid secret cache configuration: {}", e.getMessage());
      throw new IllegalStateException("Invalid secret cache configuration: " + e.getMessage(), e);
    }

    logger.info(
        "Secret cache configured successfully for mountpoint: {}", getLogConfig().getMountpoint());
  }

  private long getLong(String key, long defaultValue) {
    String value = properties.getProperty(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalStateException(
          "Invalid value for '" + key + "': " + value + " is not a number", e);
    }
  }

  private float getFloat(String key, float defaultValue) {
    String value = properties.getProperty(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    try {
      return Float.parseFloat(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalStateException(
          "Invalid value for '" + key + "': " + value + " is not a number", e);
    }
  }

  private boolean getBoolean(String key, boolean defaultValue) {
    String value = properties.getProperty(key);
    if (value == null || value.isBlank()) {
      return defaultValue;
    }
    String trimmed = value.trim();
    if (!"true".equalsIgnoreCase(trimmed) && !"false".equalsIgnoreCase(trimmed)) {
      throw new IllegalStateException(
          "Invalid value for '" + key + "': " + value + " is not a boolean");
    }
    return Boolean.parseBoolean(trimmed);
  }
}
