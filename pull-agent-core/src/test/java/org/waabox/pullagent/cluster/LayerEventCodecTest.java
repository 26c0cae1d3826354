package org.waabox.pullagent.cluster;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link LayerEventCodec} and {@link LayerEvent}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class LayerEventCodecTest {

  private static byte[] json(final String value) {
    return value.getBytes(StandardCharsets.UTF_8);
  }

  @Test
  void whenSerializing_givenStartedEvent_shouldWriteNumericStatus() {
    final LayerEvent event = new LayerEvent(LayerStatus.STARTED,
        "/v2/busybox/blobs/sha256:abc", "10.0.0.1");

    final String json = new String(LayerEventCodec.serialize(event),
        StandardCharsets.UTF_8);

    assertTrue(json.contains("\"status\":1"));
    assertTrue(json.contains("\"digest\":\"/v2/busybox/blobs/sha256:abc\""));
    assertTrue(json.contains("\"address\":\"10.0.0.1\""));
  }

  @Test
  void whenDeserializing_givenEndedJson_shouldParseEvent() {
    final LayerEvent event = LayerEventCodec.deserialize(json(
        "{\"status\":0,\"digest\":\"/v2/a/blobs/sha256:1\","
            + "\"address\":\"10.0.0.2\"}"));

    assertEquals(LayerStatus.ENDED, event.status());
    assertEquals("/v2/a/blobs/sha256:1", event.digest());
    assertEquals("10.0.0.2", event.address());
    assertEquals(LayerEvent.END_LAYER, event.eventName());
  }

  @Test
  void whenDeserializing_givenUnknownFields_shouldIgnoreThem() {
    final LayerEvent event = LayerEventCodec.deserialize(json(
        "{\"status\":1,\"digest\":\"/d\",\"address\":\"a\",\"extra\":true}"));

    assertEquals(LayerStatus.STARTED, event.status());
  }

  @Test
  void whenDeserializing_givenGarbage_shouldThrowIllegalArgument() {
    assertThrows(IllegalArgumentException.class,
        () -> LayerEventCodec.deserialize(json("not json at all {")));
  }

  @Test
  void whenDeserializing_givenJsonArray_shouldThrowIllegalArgument() {
    assertThrows(IllegalArgumentException.class,
        () -> LayerEventCodec.deserialize(json("[1, 2]")));
  }

  @Test
  void whenDeserializing_givenMissingDigest_shouldThrowIllegalArgument() {
    assertThrows(IllegalArgumentException.class,
        () -> LayerEventCodec.deserialize(json(
            "{\"status\":1,\"address\":\"10.0.0.1\"}")));
  }

  @Test
  void whenDeserializing_givenUnknownStatus_shouldThrowIllegalArgument() {
    assertThrows(IllegalArgumentException.class,
        () -> LayerEventCodec.deserialize(json(
            "{\"status\":7,\"digest\":\"/d\",\"address\":\"a\"}")));
  }

  @Test
  void whenDeserializing_givenTextStatus_shouldThrowIllegalArgument() {
    assertThrows(IllegalArgumentException.class,
        () -> LayerEventCodec.deserialize(json(
            "{\"status\":\"started\",\"digest\":\"/d\",\"address\":\"a\"}")));
  }

  @Test
  void whenDeserializing_givenNumericDigest_shouldThrowIllegalArgument() {
    assertThrows(IllegalArgumentException.class,
        () -> LayerEventCodec.deserialize(json(
            "{\"status\":1,\"digest\":42,\"address\":\"a\"}")));
  }

  @Test
  void whenDeserializing_givenBooleanAddress_shouldThrowIllegalArgument() {
    assertThrows(IllegalArgumentException.class,
        () -> LayerEventCodec.deserialize(json(
            "{\"status\":1,\"digest\":\"/d\",\"address\":true}")));
  }

  @Test
  void whenCheckingEventName_givenLayerAndOtherNames_shouldTellThemApart() {
    assertTrue(LayerEvent.isLayerEventName("START_LAYER"));
    assertTrue(LayerEvent.isLayerEventName("END_LAYER"));
    assertFalse(LayerEvent.isLayerEventName("member-join"));
    assertFalse(LayerEvent.isLayerEventName(null));
  }
}
