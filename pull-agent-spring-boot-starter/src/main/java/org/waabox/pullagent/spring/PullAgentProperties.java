package org.waabox.pullagent.spring;

import java.nio.file.Path;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Configuration properties for the pull-agent, mapped from the
 * {@code pull-agent.*} prefix in application.yml or application.properties.
 *
 * <p>Supports:
 * <ul>
 *   <li>{@code pull-agent.bind-address} - the proxy listen address.</li>
 *   <li>{@code pull-agent.port} - the proxy port, also the port peers are
 *       relayed from.</li>
 *   <li>{@code pull-agent.peer} - the member to join through; empty founds
 *       a new cluster.</li>
 *   <li>{@code pull-agent.local-dir} - where cached layers are written.</li>
 *   <li>{@code pull-agent.advertise-address} - the address announced to
 *       peers; empty detects it from the network interfaces.</li>
 *   <li>{@code pull-agent.chunk-size}, {@code poll-interval},
 *       {@code stall-timeout}, {@code connect-timeout} - streaming
 *       tuning.</li>
 *   <li>{@code pull-agent.transport.*} - the membership transport.</li>
 * </ul>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
@ConfigurationProperties(prefix = "pull-agent")
public class PullAgentProperties {

  /** The proxy listen address. */
  private String bindAddress = "0.0.0.0";

  /** The proxy port. */
  private int port = 5000;

  /** The member to join through, empty to found a cluster. */
  private String peer = "";

  /** The layer cache directory. */
  private Path localDir = Path.of("/tmp/pull-agent");

  /** The advertised address, empty to detect it. */
  private String advertiseAddress = "";

  /** The read/write chunk size in bytes. */
  private int chunkSize = 1024 * 1024;

  /** The wait between reads of an in-progress file. */
  private Duration pollInterval = Duration.ofMillis(300);

  /** The time without progress before a local read gives up. */
  private Duration stallTimeout = Duration.ofMinutes(5);

  /** The connect timeout towards peers and origins. */
  private Duration connectTimeout = Duration.ofSeconds(10);

  /** The membership transport settings. */
  private final Transport transport = new Transport();

  public String getBindAddress() {
    return bindAddress;
  }

  public void setBindAddress(final String bindAddress) {
    this.bindAddress = bindAddress;
  }

  public int getPort() {
    return port;
  }

  public void setPort(final int port) {
    this.port = port;
  }

  public String getPeer() {
    return peer;
  }

  public void setPeer(final String peer) {
    this.peer = peer;
  }

  public Path getLocalDir() {
    return localDir;
  }

  public void setLocalDir(final Path localDir) {
    this.localDir = localDir;
  }

  /**
   * Returns the configured advertise address.
   *
   * @return the address, empty when it should be detected, never null
   */
  public String getAdvertiseAddress() {
    return advertiseAddress;
  }

  public void setAdvertiseAddress(final String advertiseAddress) {
    this.advertiseAddress = advertiseAddress == null ? "" : advertiseAddress;
  }

  public int getChunkSize() {
    return chunkSize;
  }

  public void setChunkSize(final int chunkSize) {
    this.chunkSize = chunkSize;
  }

  public Duration getPollInterval() {
    return pollInterval;
  }

  public void setPollInterval(final Duration pollInterval) {
    this.pollInterval = pollInterval;
  }

  public Duration getStallTimeout() {
    return stallTimeout;
  }

  public void setStallTimeout(final Duration stallTimeout) {
    this.stallTimeout = stallTimeout;
  }

  public Duration getConnectTimeout() {
    return connectTimeout;
  }

  public void setConnectTimeout(final Duration connectTimeout) {
    this.connectTimeout = connectTimeout;
  }

  public Transport getTransport() {
    return transport;
  }

  /** Settings of the membership transport, {@code pull-agent.transport}. */
  public static class Transport {

    /** Which transport to use, {@code http} or {@code kafka}. */
    private String type = "http";

    /** The port of the HTTP membership transport. */
    private int port = 7946;

    /** The Kafka transport settings. */
    private final Kafka kafka = new Kafka();

    public String getType() {
      return type;
    }

    public void setType(final String type) {
      this.type = type;
    }

    public int getPort() {
      return port;
    }

    public void setPort(final int port) {
      this.port = port;
    }

    public Kafka getKafka() {
      return kafka;
    }
  }

  /** Settings of the Kafka transport, {@code pull-agent.transport.kafka}. */
  public static class Kafka {

    /** The bootstrap servers used when no peer is given. */
    private String bootstrapServers = "localhost:9092";

    /** The topic layer events travel on. */
    private String topic = "pull-agent-layers";

    public String getBootstrapServers() {
      return bootstrapServers;
    }

    public void setBootstrapServers(final String bootstrapServers) {
      this.bootstrapServers = bootstrapServers;
    }

    public String getTopic() {
      return topic;
    }

    public void setTopic(final String topic) {
      this.topic = topic;
    }
  }
}
