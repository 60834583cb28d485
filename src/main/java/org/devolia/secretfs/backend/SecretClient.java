package org.devolia.secretfs.backend;

import java.util.List;
import org.devolia.secretfs.model.Secret;

/**
 * Transport-level client for the remote secrets service.
 *
 * <p>Unlike {@link SecretBackend}, failures are reported as {@link SecretClientException} so that
 * they can be classified for retries and circuit breaking. {@link ClientBackend} turns a client
 * into a backend.
 *
 * @author Devolia
 * @since 1.0.0
 */
public interface SecretClient {

  /**
   * Retrieves a secret with its content.
   *
   * @param name the secret name
   * @return the secret, never null
   * @throws SecretClientException if the request fails or the secret does not exist
   */
  Secret getSecret(String name);

  /**
   * Lists the secrets available to this client.
   *
   * @return the secrets, never null
   * @throws SecretClientException if the request fails
   */
  List<Secret> listSecrets();
}
