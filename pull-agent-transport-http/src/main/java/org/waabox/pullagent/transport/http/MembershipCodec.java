package org.waabox.pullagent.transport.http;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import org.waabox.pullagent.cluster.ClusterEvent;

/**
 * JSON codec for the messages exchanged by {@link HttpMembershipTransport}.
 *
 * <p>Three shapes travel on the wire:
 * <pre>
 * {"member": "10.0.0.1:7946"}                  join, member, leave
 * {"members": ["10.0.0.1:7946", ...]}          join response
 * {"name": "START_LAYER", "payload": "eyJ..."} user event, base64 payload
 * </pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class MembershipCodec {

  /** Shared Jackson mapper; thread-safe once configured. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** Utility class. */
  private MembershipCodec() {
  }

  static byte[] member(final String member) {
    final ObjectNode node = MAPPER.createObjectNode();
    node.put("member", member);
    return write(node);
  }

  static String readMember(final byte[] json) throws IOException {
    return requireText(read(json), "member");
  }

  static byte[] members(final Collection<String> members) {
    final ObjectNode node = MAPPER.createObjectNode();
    final ArrayNode array = node.putArray("members");
    members.forEach(array::add);
    return write(node);
  }

  static List<String> readMembers(final byte[] json) throws IOException {
    final JsonNode members = read(json).get("members");
    if (members == null || !members.isArray()) {
      throw new IOException("Missing members array");
    }
    final List<String> result = new ArrayList<>(members.size());
    for (final JsonNode member : members) {
      result.add(member.asText());
    }
    return result;
  }

  static byte[] event(final String name, final byte[] payload) {
    final ObjectNode node = MAPPER.createObjectNode();
    node.put("name", name);
    node.put("payload", payload);
    return write(node);
  }

  static ClusterEvent readEvent(final byte[] json) throws IOException {
    final JsonNode node = read(json);
    final String name = requireText(node, "name");
    final JsonNode payload = node.get("payload");
    if (payload == null || payload.isNull()) {
      throw new IOException("Missing payload");
    }
    return ClusterEvent.user(name, payload.binaryValue());
  }

  private static JsonNode read(final byte[] json) throws IOException {
    final JsonNode node = MAPPER.readTree(json);
    if (node == null || !node.isObject()) {
      throw new IOException("Expected a JSON object");
    }
    return node;
  }

  private static String requireText(final JsonNode node, final String field)
      throws IOException {
    final JsonNode value = node.get(field);
    if (value == null || !value.isTextual()) {
      throw new IOException("Missing field: " + field);
    }
    return value.asText();
  }

  private static byte[] write(final ObjectNode node) {
    try {
      return MAPPER.writeValueAsBytes(node);
    } catch (final IOException e) {
      throw new IllegalStateException("Failed to serialize " + node, e);
    }
  }
}
