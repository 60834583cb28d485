package org.devolia.secretfs.backend;

/**
 * Failure reported by a {@link SecretClient}.
 *
 * <p>The status code follows HTTP semantics (404 for a missing secret, 401/403 for rejected client
 * certificates, 5xx for server trouble). Failures that never produced a response, such as
 * connection resets or socket timeouts, use {@link #NO_STATUS} and carry the underlying cause.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class SecretClientException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Status code for failures without a server response. */
  public static final int NO_STATUS = 0;

  private final int statusCode;

  /**
   * Constructor for a failure with a server response.
   *
   * @param message the detail message
   * @param statusCode the response status code
   */
  public SecretClientException(String message, int statusCode) {
    super(message);
    this.statusCode = statusCode;
  }

  /**
   * Constructor for a transport failure without a server response.
   *
   * @param message the detail message
   * @param cause the underlying failure
   */
  public SecretClientException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = NO_STATUS;
  }

  /**
   * Gets the response status code.
   *
   * @return the status code, or {@link #NO_STATUS} if there was no response
   */
  public int getStatusCode() {
    return statusCode;
  }

  /**
   * Checks whether the server answered at all.
   *
   * @return true if a status code is available
   */
  public boolean hasStatus() {
    return statusCode != NO_STATUS;
  }
}
