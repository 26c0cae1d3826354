package org.waabox.pullagent.transport.kafka;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Collections;
import java.util.Objects;
import java.util.Properties;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;

import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.apache.kafka.clients.producer.KafkaProducer;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.clients.producer.ProducerRecord;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.errors.WakeupException;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.pullagent.cluster.AdvertiseAddresses;
import org.waabox.pullagent.cluster.ClusterEvent;
import org.waabox.pullagent.cluster.MembershipTransport;

/** Kafka-based implementation of {@link MembershipTransport}.
 *
 * <p>The cluster is the set of nodes consuming the layer topic. Each node
 * uses a unique consumer group (broadcast pattern) so that every node,
 * including the publisher, receives every event. A record's key is the
 * event name and its value the UTF-8 payload.
 *
 * <p>{@link #join(String)} treats the seed as the bootstrap servers to
 * connect to. A node that never joins connects lazily to the configured
 * bootstrap servers on first use.
 *
 * <p>Typical usage:
 * <pre>
 *   KafkaTransportConfig config = KafkaTransportConfig.create(
 *       "localhost:9092");
 *   KafkaMembershipTransport transport =
 *       new KafkaMembershipTransport(config);
 *   transport.join("broker1:9092");
 *   transport.broadcast("START_LAYER", payload);
 *   // ... on shutdown ...
 *   transport.close();
 * </pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class KafkaMembershipTransport implements MembershipTransport {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      KafkaMembershipTransport.class);

  /** Poll timeout for the Kafka consumer loop. */
  private static final Duration POLL_TIMEOUT = Duration.ofMillis(500);

  /** The Kafka configuration, never null. */
  private final KafkaTransportConfig config;

  /** The address advertised to peers, never null, may be empty. */
  private final String advertiseAddress;

  /** The inbound events, consumed by {@link #nextEvent()}. */
  private final BlockingQueue<ClusterEvent> inbound =
      new LinkedBlockingQueue<>();

  /** Flag indicating whether the poll loop is running. */
  private final AtomicBoolean running = new AtomicBoolean(false);

  /** Flag indicating whether the transport was closed for good. */
  private final AtomicBoolean closed = new AtomicBoolean(false);

  /** The Kafka producer, created on connect. */
  private volatile KafkaProducer<String, String> producer;

  /** The Kafka consumer, created on connect. */
  private volatile KafkaConsumer<String, String> consumer;

  /** The daemon thread running the consumer poll loop. */
  private volatile Thread pollThread;

  /** Creates a new KafkaMembershipTransport with the given configuration.
   *
   * @param theConfig the Kafka transport configuration, never null
   */
  public KafkaMembershipTransport(final KafkaTransportConfig theConfig) {
    config = Objects.requireNonNull(theConfig, "config must not be null");
    advertiseAddress = config.advertiseAddress() != null
        ? config.advertiseAddress()
        : AdvertiseAddresses.resolve();
  }

  /** {@inheritDoc}
   *
   * <p>Connects to the given bootstrap servers, or to the configured ones
   * when the seed is blank, and checks the topic is reachable.
   */
  @Override
  public int join(final String seedAddress) throws IOException {
    Objects.requireNonNull(seedAddress, "seedAddress must not be null");
    final String servers = seedAddress.isBlank()
        ? config.bootstrapServers()
        : seedAddress;
    try {
      connect(servers);
      final int partitions = producer.partitionsFor(config.topic()).size();
      log.info("Joined through '{}', topic '{}' has {} partitions", servers,
          config.topic(), partitions);
      return 1;
    } catch (final KafkaException e) {
      throw new IOException("Failed to join through " + servers, e);
    }
  }

  /** {@inheritDoc} */
  @Override
  public String advertiseAddress() {
    return advertiseAddress;
  }

  /** {@inheritDoc} */
  @Override
  public void broadcast(final String eventName, final byte[] payload) {
    Objects.requireNonNull(eventName, "eventName must not be null");
    Objects.requireNonNull(payload, "payload must not be null");

    connect(config.bootstrapServers());
    final ProducerRecord<String, String> record = new ProducerRecord<>(
        config.topic(), eventName,
        new String(payload, StandardCharsets.UTF_8));

    producer.send(record, (metadata, exception) -> {
      if (exception != null) {
        log.error("Failed to publish {} event: {}", eventName,
            exception.getMessage(), exception);
      } else {
        log.debug("Published {} event to partition {} offset {}", eventName,
            metadata.partition(), metadata.offset());
      }
    });
  }

  /** {@inheritDoc} */
  @Override
  public ClusterEvent nextEvent() throws InterruptedException {
    connect(config.bootstrapServers());
    return takeEvent();
  }

  /** {@inheritDoc} */
  @Override
  public void close() {
    closed.set(true);
    if (!running.getAndSet(false)) {
      return;
    }

    log.info("Stopping KafkaMembershipTransport...");

    final KafkaConsumer<String, String> theConsumer = consumer;
    if (theConsumer != null) {
      theConsumer.wakeup();
    }

    final Thread thread = pollThread;
    if (thread != null) {
      try {
        thread.join(5_000);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while waiting for poll thread to stop");
      }
    }

    closeQuietly(producer, "producer");
    closeQuietly(theConsumer, "consumer");

    producer = null;
    consumer = null;
    pollThread = null;

    log.info("KafkaMembershipTransport stopped");
  }

  /** Queues the event carried by a consumed record.
   *
   * <p>Package-private for testability.
   *
   * @param record the consumed record, never null
   */
  void handleRecord(final ConsumerRecord<String, String> record) {
    if (record.key() == null || record.value() == null) {
      log.warn("Skipping record without key or value at partition {} "
          + "offset {}", record.partition(), record.offset());
      return;
    }
    inbound.add(ClusterEvent.user(record.key(),
        record.value().getBytes(StandardCharsets.UTF_8)));
  }

  /** Takes the next queued event, without connecting.
   *
   * <p>Package-private for testability.
   *
   * @return the next event, never null
   *
   * @throws InterruptedException if the waiting thread is interrupted
   */
  ClusterEvent takeEvent() throws InterruptedException {
    return inbound.take();
  }

  /** Creates the clients and starts the poll loop, once.
   *
   * @param bootstrapServers the servers to connect to, never null
   *
   * @throws IllegalStateException if the transport was closed
   */
  private synchronized void connect(final String bootstrapServers) {
    if (closed.get()) {
      throw new IllegalStateException("Transport already closed");
    }
    if (running.get()) {
      return;
    }

    producer = createProducer(bootstrapServers);
    consumer = createConsumer(bootstrapServers);
    consumer.subscribe(Collections.singletonList(config.topic()));
    running.set(true);

    pollThread = new Thread(this::pollLoop, "pull-agent-kafka-poll");
    pollThread.setDaemon(true);
    pollThread.start();

    log.info("KafkaMembershipTransport started on topic '{}' with bootstrap "
        + "servers '{}'", config.topic(), bootstrapServers);
  }

  /** The main consumer poll loop. Runs in a daemon thread until
   * {@link #close()} is called.
   */
  private void pollLoop() {
    try {
      while (running.get()) {
        final ConsumerRecords<String, String> records =
            consumer.poll(POLL_TIMEOUT);
        for (final ConsumerRecord<String, String> record : records) {
          handleRecord(record);
        }
      }
    } catch (final WakeupException e) {
      if (running.get()) {
        throw e;
      }
      // Expected on shutdown, ignore.
    }
  }

  /** Creates a new Kafka producer configured with string serializers.
   *
   * @param bootstrapServers the servers to connect to, never null
   *
   * @return the Kafka producer, never null
   */
  private KafkaProducer<String, String> createProducer(
      final String bootstrapServers) {
    final Properties props = new Properties();
    props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG,
        StringSerializer.class.getName());
    props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG,
        StringSerializer.class.getName());
    props.put(ProducerConfig.ACKS_CONFIG, "1");
    props.put(ProducerConfig.MAX_BLOCK_MS_CONFIG,
        (int) config.joinTimeout().toMillis());
    return new KafkaProducer<>(props);
  }

  /** Creates a new Kafka consumer configured with string deserializers
   * and a unique consumer group for broadcast semantics.
   *
   * @param bootstrapServers the servers to connect to, never null
   *
   * @return the Kafka consumer, never null
   */
  private KafkaConsumer<String, String> createConsumer(
      final String bootstrapServers) {
    final String groupId = config.consumerGroupPrefix() + UUID.randomUUID();

    final Properties props = new Properties();
    props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
    props.put(ConsumerConfig.GROUP_ID_CONFIG, groupId);
    props.put(ConsumerConfig.KEY_DESERIALIZER_CLASS_CONFIG,
        StringDeserializer.class.getName());
    props.put(ConsumerConfig.VALUE_DESERIALIZER_CLASS_CONFIG,
        StringDeserializer.class.getName());
    props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "latest");
    props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, "true");
    return new KafkaConsumer<>(props);
  }

  /** Closes an AutoCloseable resource quietly, logging any errors.
   *
   * @param closeable the resource to close, may be null
   * @param name the name for logging purposes, never null
   */
  private static void closeQuietly(final AutoCloseable closeable,
      final String name) {
    if (closeable != null) {
      try {
        closeable.close();
      } catch (final Exception e) {
        log.warn("Error closing {}: {}", name, e.getMessage(), e);
      }
    }
  }
}
