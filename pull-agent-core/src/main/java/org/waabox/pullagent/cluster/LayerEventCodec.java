package org.waabox.pullagent.cluster;

import java.nio.charset.StandardCharsets;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Static utility class for serializing and deserializing
 * {@link LayerEvent} payloads.
 *
 * <p>The payload is a UTF-8 JSON object with exactly three fields:
 * <pre>
 * {"status": 1, "digest": "/v2/library/busybox/blobs/sha256:...",
 *  "address": "10.0.0.12"}
 * </pre>
 * where {@code status} is {@code 1} for started and {@code 0} for ended.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class LayerEventCodec {

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Private constructor to prevent instantiation. */
  private LayerEventCodec() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Serializes a {@link LayerEvent} into its UTF-8 JSON payload.
   *
   * @param event the event to serialize, never null.
   * @return the payload bytes, never null.
   */
  public static byte[] serialize(final LayerEvent event) {
    Objects.requireNonNull(event, "event cannot be null");

    final ObjectNode node = MAPPER.createObjectNode();
    node.put("status", event.status().code());
    node.put("digest", event.digest());
    node.put("address", event.address());

    return node.toString().getBytes(StandardCharsets.UTF_8);
  }

  /**
   * Deserializes a UTF-8 JSON payload into a {@link LayerEvent}.
   *
   * @param payload the payload bytes, never null.
   * @return the parsed event, never null.
   * @throws IllegalArgumentException if the payload is not JSON, misses a
   *     field, or carries an unknown status.
   */
  public static LayerEvent deserialize(final byte[] payload) {
    Objects.requireNonNull(payload, "payload cannot be null");

    final String json = new String(payload, StandardCharsets.UTF_8);
    try {
      final JsonNode node = MAPPER.readTree(json);
      if (node == null || !node.isObject()) {
        throw new IllegalArgumentException(
            "Layer event payload is not a JSON object: " + json);
      }

      final JsonNode status = requireField(node, "status");
      if (!status.canConvertToInt()) {
        throw new IllegalArgumentException(
            "Field status is not an integer in JSON: " + json);
      }

      return new LayerEvent(
          LayerStatus.fromCode(status.asInt()),
          requireText(node, "digest"),
          requireText(node, "address"));
    } catch (final IllegalArgumentException e) {
      throw e;
    } catch (final Exception e) {
      throw new IllegalArgumentException(
          "Failed to deserialize LayerEvent from JSON: " + json, e);
    }
  }

  /** Returns the field node for the given key or throws if missing.
   *
   * @param node the parent JSON node.
   * @param field the field name to look up.
   * @return the field node, never null.
   * @throws IllegalArgumentException if the field is missing.
   */
  private static JsonNode requireField(final JsonNode node,
      final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException(
          "Missing field: " + field + " in JSON: " + node);
    }
    return value;
  }

  /** Returns the text of a string field, rejecting numbers and booleans.
   *
   * @param node the parent JSON node.
   * @param field the field name to look up.
   * @return the field text, never null.
   * @throws IllegalArgumentException if the field is missing or not a
   *     JSON string.
   */
  private static String requireText(final JsonNode node, final String field) {
    final JsonNode value = requireField(node, field);
    if (!value.isTextual()) {
      throw new IllegalArgumentException(
          "Field " + field + " is not a string in JSON: " + node);
    }
    return value.asText();
  }
}
