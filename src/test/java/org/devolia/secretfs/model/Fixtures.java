package org.devolia.secretfs.model;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;

/**
 * Loads JSON fixtures from {@code src/test/resources/fixtures}.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class Fixtures {

  private Fixtures() {}

  public static byte[] bytes(String name) {
    try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
      if (in == null) {
        throw new IllegalArgumentException("Missing fixture: " + name);
      }
      return in.readAllBytes();
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }

  public static Secret secret(String name) {
    try {
      return SecretParser.parseSecret(bytes(name));
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}
