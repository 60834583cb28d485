package org.devolia.secretfs.backend;

import io.github.resilience4j.circuitbreaker.CircuitBreaker;
import io.github.resilience4j.circuitbreaker.CircuitBreakerConfig;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Supplier;
import org.devolia.secretfs.log.CacheLogger;
import org.devolia.secretfs.metrics.SecretCacheMetrics;
import org.devolia.secretfs.model.Secret;
import org.devolia.secretfs.resilience.ExceptionClassifier;
import org.devolia.secretfs.resilience.ResilienceConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SecretBackend} on top of a {@link SecretClient}, with retries and a circuit breaker.
 *
 * <p>Resilience patterns applied to every client call:
 *
 * <ul>
 *   <li>Retry with exponential backoff, for transient failures only
 *   <li>Optional circuit breaker so a dead service is not hammered by every lookup
 * </ul>
 *
 * <p>All failures, whatever their category, collapse into an empty result. A missing secret is
 * logged at debug level, anything else as a warning with its error category.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class ClientBackend implements SecretBackend {

  private static final Logger logger = LoggerFactory.getLogger(ClientBackend.class);

  private final SecretClient client;
  private final SecretCacheMetrics metrics;
  private final Retry retry;
  private final CircuitBreaker circuitBreaker;

  /**
   * Constructor.
   *
   * @param client the transport client
   * @param resilienceConfig retry and circuit breaker settings
   * @param metrics metrics collector for retries and breaker state
   * @param name name used for the retry and circuit breaker instances
   */
  public ClientBackend(
      SecretClient client,
      ResilienceConfig resilienceConfig,
      SecretCacheMetrics metrics,
      String name) {
    this.client = Objects.requireNonNull(client, "client cannot be null");
    this.metrics = Objects.requireNonNull(metrics, "metrics cannot be null");
    resilienceConfig.validate();

    RetryConfig retryConfig =
        RetryConfig.custom()
            .maxAttempts(resilienceConfig.getRetryMaxAttempts())
            .intervalFunction(
                IntervalFunction.ofExponentialBackoff(resilienceConfig.getRetryBaseDelay(), 2.0))
            .retryOnException(ExceptionClassifier::isTransientFailure)
            .build();

    this.retry = Retry.of("secretfs-" + name, retryConfig);

    retry
        .getEventPublisher()
        .onRetry(
            event -> {
              String errorCategory = ExceptionClassifier.getErrorCategory(event.getLastThrowable());
              metrics.recordRetryAttempt(event.getNumberOfRetryAttempts(), errorCategory);
              logger.debug(
                  "Retry attempt {} for secret client call, error: {}",
                  event.getNumberOfRetryAttempts(),
                  errorCategory);
            });

    if (resilienceConfig.isCircuitBreakerEnabled()) {
      CircuitBreakerConfig circuitBreakerConfig =
          CircuitBreakerConfig.custom()
              .failureRateThreshold(resilienceConfig.getCircuitBreakerFailureRateThreshold())
              .waitDurationInOpenState(resilienceConfig.getCircuitBreakerRecoveryTimeout())
              .recordException(ExceptionClassifier::isCircuitBreakerFailure)
              .slidingWindowSize(10)
              .minimumNumberOfCalls(5)
              .build();

      this.circuitBreaker = CircuitBreaker.of("secretfs-" + name, circuitBreakerConfig);

      circuitBreaker
          .getEventPublisher()
          .onStateTransition(
              event -> {
                String fromState = event.getStateTransition().getFromState().name().toLowerCase();
                String toState = event.getStateTransition().getToState().name().toLowerCase();
                metrics.recordCircuitBreakerState(toState);
                logger.info(
                    "Circuit breaker state transition: {} -> {} for backend: {}",
                    fromState,
                    toState,
                    name);
              });
    } else {
      this.circuitBreaker = null;
      logger.debug("Circuit breaker disabled for backend: {}", name);
    }

    logger.debug(
        "Initialized client backend {} - Retry: max={}, baseDelay={}ms; CircuitBreaker: enabled={}",
        name,
        resilienceConfig.getRetryMaxAttempts(),
        resilienceConfig.getRetryBaseDelay().toMillis(),
        resilienceConfig.isCircuitBreakerEnabled());
  }

  @Override
  public Optional<Secret> fetchSecret(String name) {
    try {
      Secret secret = execute(() -> client.getSecret(name));
      if (secret == null) {
        logger.warn("Secret client returned null for: {}", CacheLogger.mask(name));
        return Optional.empty();
      }
      return Optional.of(secret);
    } catch (RuntimeException e) {
      handleFailure("secret " + CacheLogger.mask(name), e);
      return Optional.empty();
    }
  }

  @Override
  public Optional<List<Secret>> fetchSecretList() {
    try {
      List<Secret> secrets = execute(client::listSecrets);
      if (secrets == null) {
        logger.warn("Secret client returned null secret list");
        return Optional.empty();
      }
      return Optional.of(List.copyOf(secrets));
    } catch (RuntimeException e) {
      handleFailure("secret list", e);
      return Optional.empty();
    }
  }

  /** Gets the circuit breaker, or null when disabled. */
  CircuitBreaker getCircuitBreaker() {
    return circuitBreaker;
  }

  private <T> T execute(Supplier<T> operation) {
    Supplier<T> decorated = operation;
    if (circuitBreaker != null) {
      decorated = CircuitBreaker.decorateSupplier(circuitBreaker, decorated);
    }
    decorated = Retry.decorateSupplier(retry, decorated);
    return decorated.get();
  }

  private void handleFailure(String what, RuntimeException e) {
    String errorCategory = ExceptionClassifier.getErrorCategory(e);
    if ("not_found".equals(errorCategory)) {
      logger.debug("Secret client reports not found: {}", what);
      return;
    }
    logger.warn("Failed to fetch {} from secret client (category: {})", what, errorCategory, e);
  }
}
