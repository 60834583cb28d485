package org.devolia.secretfs.model;

import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.Objects;

/**
 * A named secret as delivered by the secrets backend.
 *
 * <p>Only {@link #getName()} is meaningful to the cache. The content and the remaining metadata
 * (ownership, mode, creation date) are carried verbatim for the filesystem layer. Instances are
 * immutable: the content is copied on the way in and on the way out, so a secret handed out by
 * the cache can never change underneath another reader.
 *
 * @author Devolia
 * @since 1.0.0
 */
public final class Secret {

  /** Permission bits used when no mode is given or the given mode cannot be parsed. */
  public static final int DEFAULT_MODE = 0440;

  private final String name;
  private final byte[] content;
  private final long length;
  private final OffsetDateTime createdAt;
  private final boolean versioned;
  private final String mode;
  private final String owner;
  private final String group;

  /**
   * Constructor with all secret fields.
   *
   * @param name the unique secret name
   * @param content the decoded secret content (null is treated as empty)
   * @param length the advertised content length
   * @param createdAt creation timestamp, or null if unknown
   * @param versioned whether the secret is versioned in the backend
   * @param mode octal file mode string such as "0400", or null
   * @param owner owning user name, or null
   * @param group owning group name, or null
   */
  public Secret(
      String name,
      byte[] content,
      long length,
      OffsetDateTime createdAt,
      boolean versioned,
      String mode,
      String owner,
      String group) {
    if (name == null || name.isEmpty()) {
      throw new IllegalArgumentException("Secret name cannot be null or empty");
    }
    this.name = name;
    this.content = content != null ? content.clone() : new byte[0];
    this.length = length;
    this.createdAt = createdAt;
    this.versioned = versioned;
    this.mode = mode;
    this.owner = owner;
    this.group = group;
  }

  /**
   * Creates a secret with content only and no metadata.
   *
   * @param name the unique secret name
   * @param content the secret content
   * @return a new secret
   */
  public static Secret of(String name, byte[] content) {
    return new Secret(
        name, content, content != null ? content.length : 0, null, false, null, null, null);
  }

  /**
   * Returns a copy of this secret under a different name.
   *
   * @param newName the name of the copy
   * @return a secret equal to this one except for its name
   */
  public Secret withName(String newName) {
    return new Secret(newName, content, length, createdAt, versioned, mode, owner, group);
  }

  public String getName() {
    return name;
  }

  /**
   * Gets the secret content.
   *
   * @return a copy of the content bytes
   */
  public byte[] getContent() {
    return content.clone();
  }

  public long getLength() {
    return length;
  }

  public OffsetDateTime getCreatedAt() {
    return createdAt;
  }

  public boolean isVersioned() {
    return versioned;
  }

  public String getMode() {
    return mode;
  }

  public String getOwner() {
    return owner;
  }

  public String getGroup() {
    return group;
  }

  /**
   * Parses {@link #getMode()} as octal permission bits.
   *
   * @return permission bits masked to 0777, or {@link #DEFAULT_MODE} if absent or unparsable
   */
  public int getModeValue() {
    if (mode == null || mode.isBlank()) {
      return DEFAULT_MODE;
    }
    try {
      return Integer.parseInt(mode.trim(), 8) & 0777;
    } catch (NumberFormatException e) {
      return DEFAULT_MODE;
    }
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Secret other)) {
      return false;
    }
    return length == other.length
        && versioned == other.versioned
        && name.equals(other.name)
        && Arrays.equals(content, other.content)
        && Objects.equals(createdAt, other.createdAt)
        && Objects.equals(mode, other.mode)
        && Objects.equals(owner, other.owner)
        && Objects.equals(group, other.group);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(name, length, createdAt, versioned, mode, owner, group);
    return 31 * result + Arrays.hashCode(content);
  }

  // Content deliberately left out.
  @Override
  public String toString() {
    return "Secret{name="
        + name
        + ", length="
        + length
        + ", createdAt="
        + createdAt
        + ", versioned="
        + versioned
        + ", mode="
        + mode
        + ", owner="
        + owner
        + ", group="
        + group
        + "}";
  }
}
