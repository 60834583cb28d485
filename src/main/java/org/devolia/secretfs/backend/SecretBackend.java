package org.devolia.secretfs.backend;

import java.util.List;
import java.util.Optional;
import org.devolia.secretfs.model.Secret;

/**
 * Source of live secret data for the cache.
 *
 * <p>An empty result means "no usable answer" and covers not-found, transport and authentication
 * failures alike. Implementations may block for as long as their transport does; bounding the wait
 * is the caller's job.
 *
 * @author Devolia
 * @since 1.0.0
 */
public interface SecretBackend {

  /**
   * Fetches one secret by name.
   *
   * @param name the secret name
   * @return the secret, or empty if the backend has no usable answer
   */
  Optional<Secret> fetchSecret(String name);

  /**
   * Fetches every secret currently available to this client.
   *
   * @return the secrets, or empty if the backend has no usable answer
   */
  Optional<List<Secret>> fetchSecretList();
}
