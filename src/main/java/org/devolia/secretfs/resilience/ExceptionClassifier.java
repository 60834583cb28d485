package org.devolia.secretfs.resilience;

import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import java.net.ConnectException;
import java.net.SocketTimeoutException;
import java.net.UnknownHostException;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLException;
import org.devolia.secretfs.backend.SecretClientException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class for classifying secret client failures for retries and circuit breaking.
 *
 * <p>This class helps determine whether an exception should trigger:
 *
 * <ul>
 *   <li>Retry logic (transient failures)
 *   <li>Circuit breaker response (repeated failures)
 *   <li>Immediate failure (permanent errors)
 * </ul>
 *
 * @author Devolia
 * @since 1.0.0
 */
public class ExceptionClassifier {

  private static final Logger logger = LoggerFactory.getLogger(ExceptionClassifier.class);

  private ExceptionClassifier() {}

  /**
   * Determines if an exception represents a transient failure that should be retried.
   *
   * <p>Transient failures include:
   *
   * <ul>
   *   <li>Network timeouts, refused connections and unresolvable hosts
   *   <li>TLS handshake failures
   *   <li>HTTP 429 (Too Many Requests) and any 5xx response
   * </ul>
   *
   * @param exception the exception to classify
   * @return true if the exception represents a transient failure
   */
  public static boolean isTransientFailure(Throwable exception) {
    if (exception == null) {
      return false;
    }

    if (exception instanceof SocketTimeoutException
        || exception instanceof TimeoutException
        || exception instanceof ConnectException
        || exception instanceof UnknownHostException
        || exception instanceof SSLException) {
      logger.debug("Classified as transient failure: {}", exception.getClass().getSimpleName());
      return true;
    }

    if (exception instanceof SecretClientException clientException
        && clientException.hasStatus()) {
      int statusCode = clientException.getStatusCode();
      boolean isTransient = statusCode == 429 || statusCode >= 500;
      logger.debug(
          "Client exception classified as {}: status={}",
          isTransient ? "transient" : "permanent",
          statusCode);
      return isTransient;
    }

    Throwable cause = exception.getCause();
    if (cause != null && cause != exception) {
      return isTransientFailure(cause);
    }

    logger.debug("Classified as permanent failure: {}", exception.getClass().getSimpleName());
    return false;
  }

  /**
   * Determines if an exception represents a permanent failure that should not be retried.
   *
   * <p>Permanent failures are bad requests (400), rejected client certificates (401, 403) and
   * missing secrets (404).
   *
   * @param exception the exception to classify
   * @return true if the exception represents a permanent failure
   */
  public static boolean isPermanentFailure(Throwable exception) {
    if (exception == null) {
      return false;
    }

    if (exception instanceof SecretClientException clientException
        && clientException.hasStatus()) {
      int statusCode = clientException.getStatusCode();
      return statusCode == 400 || statusCode == 401 || statusCode == 403 || statusCode == 404;
    }

    Throwable cause = exception.getCause();
    if (cause != null && cause != exception) {
      return isPermanentFailure(cause);
    }

    return false;
  }

  /**
   * Determines if an exception should be recorded by the circuit breaker as a failure.
   *
   * <p>Missing secrets and rejected credentials say nothing about the health of the service, so
   * 401, 403 and 404 are not counted.
   *
   * @param exception the exception to classify
   * @return true if the exception should count as a circuit breaker failure
   */
  public static boolean isCircuitBreakerFailure(Throwable exception) {
    if (exception == null) {
      return false;
    }

    if (exception instanceof SecretClientException clientException
        && clientException.hasStatus()) {
      int statusCode = clientException.getStatusCode();
      return statusCode != 404 && statusCode != 401 && statusCode != 403;
    }

    return true;
  }

  /**
   * Gets a human-readable error category for logging and metrics.
   *
   * @param exception the exception to categorize
   * @return error category string
   */
  public static String getErrorCategory(Throwable exception) {
    if (exception == null) {
      return "unknown";
    }

    if (exception instanceof CallNotPermittedException) {
      return "circuit_open";
    }

    if (exception instanceof SecretClientException clientException
        && clientException.hasStatus()) {
      int statusCode = clientException.getStatusCode();
      return switch (statusCode) {
        case 400 -> "bad_request";
        case 401 -> "unauthorized";
        case 403 -> "forbidden";
        case 404 -> "not_found";
        case 429 -> "rate_limited";
        case 503 -> "service_unavailable";
        default -> statusCode >= 500 ? "server_error" : "client_error";
      };
    }

    if (exception instanceof SocketTimeoutException || exception instanceof TimeoutException) {
      return "timeout";
    }

    if (exception instanceof UnknownHostException || exception instanceof ConnectException) {
      return "network";
    }

    if (exception instanceof SSLException) {
      return "ssl";
    }

    Throwable cause = exception.getCause();
    if (cause != null && cause != exception) {
      return getErrorCategory(cause);
    }

    return "unknown";
  }
}
