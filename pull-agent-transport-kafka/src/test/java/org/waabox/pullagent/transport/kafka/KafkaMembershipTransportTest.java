package org.waabox.pullagent.transport.kafka;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTimeoutPreemptively;

import java.nio.charset.StandardCharsets;
import java.time.Duration;

import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.junit.jupiter.api.Test;
import org.waabox.pullagent.cluster.ClusterEvent;

/** Unit tests for {@link KafkaMembershipTransport} and
 * {@link KafkaTransportConfig}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class KafkaMembershipTransportTest {

  @Test
  void whenCreatingConfig_givenDefaults_shouldHaveCorrectValues() {
    final KafkaTransportConfig config = KafkaTransportConfig.create(
        "localhost:9092");

    assertEquals("localhost:9092", config.bootstrapServers());
    assertEquals("pull-agent-layers", config.topic());
    assertEquals("pull-agent-", config.consumerGroupPrefix());
    assertNull(config.advertiseAddress());
    assertEquals(Duration.ofSeconds(10), config.joinTimeout());
  }

  @Test
  void whenCreatingConfig_givenCustomValues_shouldHaveCustomValues() {
    final KafkaTransportConfig config = KafkaTransportConfig.create(
        "broker1:9092,broker2:9092", "custom-topic", "custom-prefix-",
        "10.0.0.7", Duration.ofSeconds(3));

    assertEquals("broker1:9092,broker2:9092", config.bootstrapServers());
    assertEquals("custom-topic", config.topic());
    assertEquals("custom-prefix-", config.consumerGroupPrefix());
    assertEquals("10.0.0.7", config.advertiseAddress());
    assertEquals(Duration.ofSeconds(3), config.joinTimeout());
  }

  @Test
  void whenCreating_givenExplicitAdvertiseAddress_shouldExposeIt() {
    final KafkaMembershipTransport transport = new KafkaMembershipTransport(
        KafkaTransportConfig.create("localhost:9092", "layers", "10.0.0.7"));

    assertEquals("10.0.0.7", transport.advertiseAddress());
  }

  @Test
  void whenHandlingRecord_givenLayerEvent_shouldQueueItAsUserEvent() {
    final KafkaMembershipTransport transport = new KafkaMembershipTransport(
        KafkaTransportConfig.create("localhost:9092", "layers", "10.0.0.7"));
    final String json = "{\"status\":1,\"digest\":\"/d\","
        + "\"address\":\"10.0.0.1\"}";

    transport.handleRecord(new ConsumerRecord<>("layers", 0, 42L,
        "START_LAYER", json));

    final ClusterEvent event = assertTimeoutPreemptively(
        Duration.ofSeconds(5), transport::takeEvent);
    transport.close();

    assertEquals(ClusterEvent.Type.USER, event.type());
    assertEquals("START_LAYER", event.name());
    assertArrayEquals(json.getBytes(StandardCharsets.UTF_8), event.payload());
  }

  @Test
  void whenBroadcasting_givenClosedTransport_shouldThrow() {
    final KafkaMembershipTransport transport = new KafkaMembershipTransport(
        KafkaTransportConfig.create("localhost:9092", "layers", "10.0.0.7"));
    transport.close();

    assertThrows(IllegalStateException.class,
        () -> transport.broadcast("END_LAYER", new byte[0]));
  }
}
