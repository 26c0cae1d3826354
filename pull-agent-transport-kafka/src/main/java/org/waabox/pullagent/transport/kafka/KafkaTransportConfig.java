package org.waabox.pullagent.transport.kafka;

import java.time.Duration;
import java.util.Objects;

/** Configuration holder for the Kafka membership transport.
 *
 * <p>Every node consumes the layer topic with its own consumer group
 * (formed by {@code consumerGroupPrefix + UUID}), so every instance receives
 * every event, its own included.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class KafkaTransportConfig {

  /** Default Kafka topic for layer events. */
  private static final String DEFAULT_TOPIC = "pull-agent-layers";

  /** Default consumer group prefix. */
  private static final String DEFAULT_CONSUMER_GROUP_PREFIX = "pull-agent-";

  /** Default time to wait for the topic metadata on join. */
  private static final Duration DEFAULT_JOIN_TIMEOUT = Duration.ofSeconds(10);

  /** The Kafka bootstrap servers connection string, never null. */
  private final String bootstrapServers;

  /** The Kafka topic layer events travel on, never null. */
  private final String topic;

  /** The prefix for generating unique consumer groups, never null. */
  private final String consumerGroupPrefix;

  /** The address advertised to peers, null to detect it. */
  private final String advertiseAddress;

  /** The time to wait for the topic metadata on join, never null. */
  private final Duration joinTimeout;

  /** Creates a new KafkaTransportConfig. */
  private KafkaTransportConfig(final String theBootstrapServers,
      final String theTopic, final String theConsumerGroupPrefix,
      final String theAdvertiseAddress, final Duration theJoinTimeout) {
    bootstrapServers = Objects.requireNonNull(theBootstrapServers,
        "bootstrapServers must not be null");
    topic = Objects.requireNonNull(theTopic, "topic must not be null");
    consumerGroupPrefix = Objects.requireNonNull(theConsumerGroupPrefix,
        "consumerGroupPrefix must not be null");
    advertiseAddress = theAdvertiseAddress;
    joinTimeout = Objects.requireNonNull(theJoinTimeout,
        "joinTimeout must not be null");
  }

  /** Creates a configuration with the given bootstrap servers and default
   * topic, consumer group prefix and join timeout, detecting the advertise
   * address.
   *
   * @param bootstrapServers the Kafka bootstrap servers (e.g.
   *        "localhost:9092"), never null
   *
   * @return a new KafkaTransportConfig with default values, never null
   */
  public static KafkaTransportConfig create(final String bootstrapServers) {
    return new KafkaTransportConfig(bootstrapServers, DEFAULT_TOPIC,
        DEFAULT_CONSUMER_GROUP_PREFIX, null, DEFAULT_JOIN_TIMEOUT);
  }

  /** Creates a configuration with a custom topic and advertise address.
   *
   * @param bootstrapServers the Kafka bootstrap servers, never null
   * @param topic the topic name for layer events, never null
   * @param advertiseAddress the address announced to peers, null to
   *        detect it
   *
   * @return a new KafkaTransportConfig, never null
   */
  public static KafkaTransportConfig create(final String bootstrapServers,
      final String topic, final String advertiseAddress) {
    return new KafkaTransportConfig(bootstrapServers, topic,
        DEFAULT_CONSUMER_GROUP_PREFIX, advertiseAddress, DEFAULT_JOIN_TIMEOUT);
  }

  /** Creates a configuration with every setting explicit.
   *
   * @param bootstrapServers the Kafka bootstrap servers, never null
   * @param topic the topic name for layer events, never null
   * @param consumerGroupPrefix the prefix for generating unique consumer
   *        groups, never null
   * @param advertiseAddress the address announced to peers, null to
   *        detect it
   * @param joinTimeout the time to wait for the topic metadata on join,
   *        never null
   *
   * @return a new KafkaTransportConfig, never null
   */
  public static KafkaTransportConfig create(final String bootstrapServers,
      final String topic, final String consumerGroupPrefix,
      final String advertiseAddress, final Duration joinTimeout) {
    return new KafkaTransportConfig(bootstrapServers, topic,
        consumerGroupPrefix, advertiseAddress, joinTimeout);
  }

  /** Returns the Kafka bootstrap servers used when no seed is given.
   *
   * @return the bootstrap servers, never null
   */
  public String bootstrapServers() {
    return bootstrapServers;
  }

  /** Returns the Kafka topic layer events are published to and consumed
   * from.
   *
   * @return the topic name, never null
   */
  public String topic() {
    return topic;
  }

  /** Returns the prefix used to generate unique consumer group IDs.
   *
   * @return the consumer group prefix, never null
   */
  public String consumerGroupPrefix() {
    return consumerGroupPrefix;
  }

  /** Returns the configured advertise address.
   *
   * @return the address, null when it should be detected
   */
  public String advertiseAddress() {
    return advertiseAddress;
  }

  /** Returns how long a join waits for the topic metadata.
   *
   * @return the join timeout, never null
   */
  public Duration joinTimeout() {
    return joinTimeout;
  }
}
