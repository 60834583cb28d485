package org.devolia.secretfs.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.IntSupplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics collector for the secret cache and its backend.
 *
 * <p>This class provides Micrometer-based metrics:
 *
 * <ul>
 *   <li><strong>secretfs_cache_lookups_total</strong> - Counter of single-secret lookups by result
 *   <li><strong>secretfs_cache_list_total</strong> - Counter of list requests by result
 *   <li><strong>secretfs_backend_requests_total</strong> - Counter of backend calls by operation
 *       and status
 *   <li><strong>secretfs_backend_latency_seconds</strong> - Timer of backend calls by operation
 *   <li><strong>secretfs_backend_retry_attempts_total</strong> - Counter of client retries
 *   <li><strong>secretfs_backend_circuit_breaker_state</strong> - Gauge of the breaker state
 *   <li><strong>secretfs_cache_entries</strong> - Gauge of the number of cached secrets
 * </ul>
 *
 * <p>All metrics are tagged with <code>mountpoint</code>.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class SecretCacheMetrics {

  private static final Logger logger = LoggerFactory.getLogger(SecretCacheMetrics.class);

  // Metric names
  private static final String LOOKUPS_TOTAL = "secretfs_cache_lookups_total";
  private static final String LIST_TOTAL = "secretfs_cache_list_total";
  private static final String BACKEND_REQUESTS_TOTAL = "secretfs_backend_requests_total";
  private static final String BACKEND_LATENCY_SECONDS = "secretfs_backend_latency_seconds";
  private static final String RETRY_ATTEMPTS_TOTAL = "secretfs_backend_retry_attempts_total";
  private static final String CIRCUIT_BREAKER_STATE = "secretfs_backend_circuit_breaker_state";
  private static final String CACHE_ENTRIES = "secretfs_cache_entries";

  // Lookup results
  public static final String RESULT_FRESH_HIT = "fresh_hit";
  public static final String RESULT_BACKEND = "backend";
  public static final String RESULT_FALLBACK_HIT = "fallback_hit";
  public static final String RESULT_MISS = "miss";
  public static final String RESULT_FALLBACK = "fallback";

  // Backend statuses
  public static final String STATUS_SUCCESS = "success";
  public static final String STATUS_FAILURE = "failure";
  public static final String STATUS_TIMEOUT = "timeout";
  public static final String STATUS_ERROR = "error";

  // Backend operations
  public static final String OPERATION_SECRET = "secret";
  public static final String OPERATION_SECRET_LIST = "secret_list";

  private final MeterRegistry meterRegistry;
  private final String mountpoint;

  private final Counter freshHitCounter;
  private final Counter backendHitCounter;
  private final Counter fallbackHitCounter;
  private final Counter missCounter;
  private final Counter listBackendCounter;
  private final Counter listFallbackCounter;

  private final Map<String, Timer> backendTimers = new ConcurrentHashMap<>();
  private final AtomicReference<String> circuitBreakerState = new AtomicReference<>("closed");
  private final Gauge circuitBreakerGauge;
  private volatile Gauge cacheSizeGauge;

  /**
   * Constructor.
   *
   * @param meterRegistry the Micrometer meter registry
   * @param mountpoint the mountpoint for tagging metrics
   */
  public SecretCacheMetrics(MeterRegistry meterRegistry, String mountpoint) {
    this.meterRegistry = Objects.requireNonNull(meterRegistry, "meterRegistry cannot be null");
    this.mountpoint = mountpoint != null ? mountpoint : "unknown";

    this.freshHitCounter = lookupCounter(RESULT_FRESH_HIT);
    this.backendHitCounter = lookupCounter(RESULT_BACKEND);
    this.fallbackHitCounter = lookupCounter(RESULT_FALLBACK_HIT);
    this.missCounter = lookupCounter(RESULT_MISS);

    this.listBackendCounter = listCounter(RESULT_BACKEND);
    this.listFallbackCounter = listCounter(RESULT_FALLBACK);

    this.circuitBreakerGauge =
        Gauge.builder(CIRCUIT_BREAKER_STATE, circuitBreakerState, ref -> stateValue(ref.get()))
            .description("Circuit breaker state (0 closed, 0.5 half open, 1 open)")
            .tag("mountpoint", this.mountpoint)
            .register(meterRegistry);

    logger.debug("Initialized secret cache metrics for mountpoint: {}", this.mountpoint);
  }

  /**
   * Creates metrics backed by a private {@link SimpleMeterRegistry}.
   *
   * @param mountpoint the mountpoint for tagging metrics
   * @return a new metrics collector
   */
  public static SecretCacheMetrics inMemory(String mountpoint) {
    return new SecretCacheMetrics(new SimpleMeterRegistry(), mountpoint);
  }

  /** Records a lookup answered from a fresh cache entry. */
  public void incrementFreshHit() {
    freshHitCounter.increment();
  }

  /** Records a lookup answered by the backend. */
  public void incrementBackendHit() {
    backendHitCounter.increment();
  }

  /** Records a lookup answered from a cached entry after the backend failed. */
  public void incrementFallbackHit() {
    fallbackHitCounter.increment();
  }

  /** Records a lookup that found nothing. */
  public void incrementMiss() {
    missCounter.increment();
  }

  /**
   * Records the outcome of a list request.
   *
   * @param fromBackend true if the backend answered, false if cached contents were returned
   */
  public void recordList(boolean fromBackend) {
    if (fromBackend) {
      listBackendCounter.increment();
    } else {
      listFallbackCounter.increment();
    }
  }

  /**
   * Records a backend call.
   *
   * @param operation {@link #OPERATION_SECRET} or {@link #OPERATION_SECRET_LIST}
   * @param status one of the {@code STATUS_*} constants
   * @param latencyNanos time spent waiting for the call in nanoseconds
   */
  public void recordBackendCall(String operation, String status, long latencyNanos) {
    Counter.builder(BACKEND_REQUESTS_TOTAL)
        .description("Total number of secret backend requests")
        .tag("operation", operation)
        .tag("status", status)
        .tag("mountpoint", mountpoint)
        .register(meterRegistry)
        .increment();

    backendTimers
        .computeIfAbsent(
            operation,
            op ->
                Timer.builder(BACKEND_LATENCY_SECONDS)
                    .description("Latency of secret backend requests")
                    .tag("operation", op)
                    .tag("mountpoint", mountpoint)
                    .register(meterRegistry))
        .record(Duration.ofNanos(latencyNanos));

    logger.debug(
        "Recorded backend {} request - status: {}, latency: {}ms",
        operation,
        status,
        latencyNanos / 1_000_000);
  }

  /**
   * Records a client retry attempt.
   *
   * @param attemptNumber the attempt number (1, 2, 3, etc.)
   * @param errorCategory the error category that triggered the retry
   */
  public void recordRetryAttempt(int attemptNumber, String errorCategory) {
    Counter.builder(RETRY_ATTEMPTS_TOTAL)
        .description("Total number of secret client retry attempts")
        .tag("attempt", String.valueOf(attemptNumber))
        .tag("error_category", errorCategory != null ? errorCategory : "unknown")
        .tag("mountpoint", mountpoint)
        .register(meterRegistry)
        .increment();
  }

  /**
   * Records a circuit breaker state change.
   *
   * @param state the new state ("closed", "open", "half_open")
   */
  public void recordCircuitBreakerState(String state) {
    circuitBreakerState.set(state);
    logger.debug("Recorded circuit breaker state change: {}", state);
  }

  /**
   * Binds the cache entry gauge to a size supplier.
   *
   * @param size supplier of the current number of cached secrets
   */
  public void bindCacheSize(IntSupplier size) {
    this.cacheSizeGauge =
        Gauge.builder(CACHE_ENTRIES, size, IntSupplier::getAsInt)
            .description("Number of cached secrets")
            .tag("mountpoint", mountpoint)
            .strongReference(true)
            .register(meterRegistry);
  }

  /**
   * Removes the gauges from the registry so a later cache on the same mountpoint can register its
   * own. Counters and timers stay registered.
   */
  public void close() {
    Gauge sizeGauge = cacheSizeGauge;
    if (sizeGauge != null) {
      meterRegistry.remove(sizeGauge);
      cacheSizeGauge = null;
    }
    meterRegistry.remove(circuitBreakerGauge);
    logger.debug("Removed secret cache gauges for mountpoint: {}", mountpoint);
  }

  public double getFreshHitCount() {
    return freshHitCounter.count();
  }

  public double getBackendHitCount() {
    return backendHitCounter.count();
  }

  public double getFallbackHitCount() {
    return fallbackHitCounter.count();
  }

  public double getMissCount() {
    return missCounter.count();
  }

  public double getListBackendCount() {
    return listBackendCounter.count();
  }

  public double getListFallbackCount() {
    return listFallbackCounter.count();
  }

  /**
   * Gets the number of backend calls with the given operation and status.
   *
   * @param operation the operation tag
   * @param status the status tag
   * @return call count, 0 if none were recorded
   */
  public double getBackendCallCount(String operation, String status) {
    Counter counter =
        meterRegistry
            .find(BACKEND_REQUESTS_TOTAL)
            .tags(Tags.of("operation", operation, "status", status, "mountpoint", mountpoint))
            .counter();
    return counter != null ? counter.count() : 0.0;
  }

  /**
   * Gets the mean backend latency for an operation in milliseconds.
   *
   * @param operation the operation tag
   * @return mean latency, 0 if no calls were recorded
   */
  public double getMeanBackendLatencyMs(String operation) {
    Timer timer = backendTimers.get(operation);
    return timer != null ? timer.mean(TimeUnit.MILLISECONDS) : 0.0;
  }

  public String getCircuitBreakerState() {
    return circuitBreakerState.get();
  }

  /**
   * Gets the share of lookups answered without a backend round-trip.
   *
   * @return fresh hit ratio (0.0 to 1.0)
   */
  public double getFreshHitRatio() {
    double fresh = getFreshHitCount();
    double total = fresh + getBackendHitCount() + getFallbackHitCount() + getMissCount();
    return total > 0 ? fresh / total : 0.0;
  }

  public MeterRegistry getMeterRegistry() {
    return meterRegistry;
  }

  private Counter lookupCounter(String result) {
    return Counter.builder(LOOKUPS_TOTAL)
        .description("Total number of secret lookups")
        .tag("result", result)
        .tag("mountpoint", mountpoint)
        .register(meterRegistry);
  }

  private Counter listCounter(String result) {
    return Counter.builder(LIST_TOTAL)
        .description("Total number of secret list requests")
        .tag("result", result)
        .tag("mountpoint", mountpoint)
        .register(meterRegistry);
  }

  private static double stateValue(String state) {
    return switch (state) {
      case "closed" -> 0.0;
      case "half_open" -> 0.5;
      case "open" -> 1.0;
      default -> -1.0;
    };
  }
}
