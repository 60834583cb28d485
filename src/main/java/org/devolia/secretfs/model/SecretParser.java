package org.devolia.secretfs.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Base64;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses secrets from the JSON documents returned by the secrets backend.
 *
 * <p>A single secret looks like:
 *
 * <pre>
 * {
 *   "name": "General_Password..0be68f903f8b7d86",
 *   "secret": "YXNkZGFz",
 *   "secretLength": 6,
 *   "creationDate": "2011-09-29T15:46:00.232Z",
 *   "isVersioned": false,
 *   "mode": "0400",
 *   "owner": "root",
 *   "group": "root"
 * }
 * </pre>
 *
 * <p>The secret list endpoint returns a JSON array of the same objects, usually without the
 * {@code secret} content field.
 *
 * @author Devolia
 * @since 1.0.0
 */
public class SecretParser {

  private static final Logger logger = LoggerFactory.getLogger(SecretParser.class);

  private static final ObjectMapper MAPPER = new ObjectMapper();

  private SecretParser() {}

  /**
   * Parses one secret.
   *
   * @param json the JSON document
   * @return the parsed secret
   * @throws IOException if the document is malformed or lacks a name
   */
  public static Secret parseSecret(byte[] json) throws IOException {
    JsonNode root = MAPPER.readTree(json);
    if (root == null || !root.isObject()) {
      throw new IOException("Expected a JSON object for secret");
    }
    return fromNode(root);
  }

  /**
   * Parses a list of secrets.
   *
   * @param json the JSON document, an array of secret objects
   * @return the parsed secrets in document order
   * @throws IOException if the document is malformed or any element is invalid
   */
  public static List<Secret> parseSecretList(byte[] json) throws IOException {
    JsonNode root = MAPPER.readTree(json);
    if (root == null || !root.isArray()) {
      throw new IOException("Expected a JSON array for secret list");
    }

    List<Secret> secrets = new ArrayList<>(root.size());
    for (JsonNode node : root) {
      if (!node.isObject()) {
        throw new IOException("Expected a JSON object in secret list, got: " + node.getNodeType());
      }
      secrets.add(fromNode(node));
    }
    logger.debug("Parsed secret list with {} entries", secrets.size());
    return secrets;
  }

  private static Secret fromNode(JsonNode node) throws IOException {
    String name = text(node, "name");
    if (name == null || name.isEmpty()) {
      throw new IOException("Secret is missing required field 'name'");
    }

    byte[] content;
    try {
      String encoded = text(node, "secret");
      content = encoded != null ? Base64.getDecoder().decode(encoded) : new byte[0];
    } catch (IllegalArgumentException e) {
      throw new IOException("Secret '" + name + "' has invalid base64 content", e);
    }

    long length =
        node.hasNonNull("secretLength") ? node.get("secretLength").asLong() : content.length;

    OffsetDateTime createdAt = null;
    String creationDate = text(node, "creationDate");
    if (creationDate != null) {
      try {
        createdAt = OffsetDateTime.parse(creationDate);
      } catch (DateTimeParseException e) {
        throw new IOException("Secret '" + name + "' has invalid creationDate: " + creationDate, e);
      }
    }

    return new Secret(
        name,
        content,
        length,
        createdAt,
        node.path("isVersioned").asBoolean(false),
        text(node, "mode"),
        text(node, "owner"),
        text(node, "group"));
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value != null && !value.isNull() ? value.asText() : null;
  }
}
