package org.waabox.pullagent.proxy;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration holder for the {@link RelayProxy}.
 *
 * <p>Instances are created through {@link #builder()}. Defaults:
 * <ul>
 *   <li>bindAddress: {@value #DEFAULT_BIND_ADDRESS}</li>
 *   <li>port: {@value #DEFAULT_PORT}</li>
 *   <li>localDir: {@code /tmp/pull-agent}</li>
 *   <li>chunkSize: 1 MiB</li>
 *   <li>pollInterval: 300 milliseconds</li>
 *   <li>stallTimeout: 5 minutes</li>
 *   <li>connectTimeout: 10 seconds</li>
 * </ul>
 *
 * <p>This class is immutable and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class ProxyConfig {

  /** The default address the proxy listens on. */
  private static final String DEFAULT_BIND_ADDRESS = "0.0.0.0";

  /** The default port the proxy listens on. */
  private static final int DEFAULT_PORT = 5000;

  /** The default directory for cached layers. */
  private static final Path DEFAULT_LOCAL_DIR = Path.of("/tmp/pull-agent");

  /** The default read/write chunk size. */
  private static final int DEFAULT_CHUNK_SIZE = 1024 * 1024;

  /** The default wait between reads of an in-progress file. */
  private static final Duration DEFAULT_POLL_INTERVAL =
      Duration.ofMillis(300);

  /** The default time without progress before a local read gives up. */
  private static final Duration DEFAULT_STALL_TIMEOUT = Duration.ofMinutes(5);

  /** The default connect timeout towards peers and origins. */
  private static final Duration DEFAULT_CONNECT_TIMEOUT =
      Duration.ofSeconds(10);

  /** The address the proxy listens on, never null. */
  private final String bindAddress;

  /** The port the proxy listens on, and the port peers are relayed to. */
  private final int port;

  /** The directory cached layers are written to, never null. */
  private final Path localDir;

  /** The read/write chunk size in bytes. */
  private final int chunkSize;

  /** The wait between reads of an in-progress file, never null. */
  private final Duration pollInterval;

  /** The time without progress before a local read gives up, never null. */
  private final Duration stallTimeout;

  /** The connect timeout towards peers and origins, never null. */
  private final Duration connectTimeout;

  /** Creates a new configuration from the given builder.
   *
   * @param builder the builder, never null
   */
  private ProxyConfig(final Builder builder) {
    bindAddress = builder.bindAddress;
    port = builder.port;
    localDir = builder.localDir;
    chunkSize = builder.chunkSize;
    pollInterval = builder.pollInterval;
    stallTimeout = builder.stallTimeout;
    connectTimeout = builder.connectTimeout;
  }

  /**
   * Creates a new builder initialized with the defaults.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Returns the address the proxy listens on.
   *
   * @return the bind address, never null
   */
  public String bindAddress() {
    return bindAddress;
  }

  /**
   * Returns the port the proxy listens on. Peers are assumed to listen on
   * the same port when their address does not carry one.
   *
   * @return the port, zero means an ephemeral port
   */
  public int port() {
    return port;
  }

  /**
   * Returns the directory cached layers are written to.
   *
   * @return the local directory, never null
   */
  public Path localDir() {
    return localDir;
  }

  /**
   * Returns the read/write chunk size.
   *
   * @return the chunk size in bytes, always positive
   */
  public int chunkSize() {
    return chunkSize;
  }

  /**
   * Returns the wait between reads of a file that is still being written.
   *
   * @return the poll interval, never null
   */
  public Duration pollInterval() {
    return pollInterval;
  }

  /**
   * Returns how long a local read waits without progress before giving up.
   *
   * @return the stall timeout, never null
   */
  public Duration stallTimeout() {
    return stallTimeout;
  }

  /**
   * Returns the connect timeout used towards peers and origins.
   *
   * @return the connect timeout, never null
   */
  public Duration connectTimeout() {
    return connectTimeout;
  }

  /** A fluent builder for {@link ProxyConfig}. */
  public static final class Builder {

    /** The bind address. */
    private String bindAddress = DEFAULT_BIND_ADDRESS;

    /** The port. */
    private int port = DEFAULT_PORT;

    /** The local directory. */
    private Path localDir = DEFAULT_LOCAL_DIR;

    /** The chunk size. */
    private int chunkSize = DEFAULT_CHUNK_SIZE;

    /** The poll interval. */
    private Duration pollInterval = DEFAULT_POLL_INTERVAL;

    /** The stall timeout. */
    private Duration stallTimeout = DEFAULT_STALL_TIMEOUT;

    /** The connect timeout. */
    private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the address the proxy listens on.
     *
     * @param theBindAddress the bind address, never null
     * @return this builder for chaining, never null
     */
    public Builder bindAddress(final String theBindAddress) {
      bindAddress = Objects.requireNonNull(theBindAddress,
          "bindAddress must not be null");
      return this;
    }

    /**
     * Sets the port the proxy listens on.
     *
     * @param thePort the port, between 0 and 65535
     * @return this builder for chaining, never null
     * @throws IllegalArgumentException if the port is out of range
     */
    public Builder port(final int thePort) {
      if (thePort < 0 || thePort > 65535) {
        throw new IllegalArgumentException("Invalid port: " + thePort);
      }
      port = thePort;
      return this;
    }

    /**
     * Sets the directory cached layers are written to.
     *
     * @param theLocalDir the directory, never null
     * @return this builder for chaining, never null
     */
    public Builder localDir(final Path theLocalDir) {
      localDir = Objects.requireNonNull(theLocalDir,
          "localDir must not be null");
      return this;
    }

    /**
     * Sets the read/write chunk size.
     *
     * @param theChunkSize the chunk size in bytes, must be positive
     * @return this builder for chaining, never null
     * @throws IllegalArgumentException if the size is not positive
     */
    public Builder chunkSize(final int theChunkSize) {
      if (theChunkSize <= 0) {
        throw new IllegalArgumentException(
            "chunkSize must be greater than 0, got: " + theChunkSize);
      }
      chunkSize = theChunkSize;
      return this;
    }

    /**
     * Sets the wait between reads of an in-progress file.
     *
     * @param thePollInterval the poll interval, never null
     * @return this builder for chaining, never null
     */
    public Builder pollInterval(final Duration thePollInterval) {
      pollInterval = Objects.requireNonNull(thePollInterval,
          "pollInterval must not be null");
      return this;
    }

    /**
     * Sets how long a local read waits without progress.
     *
     * @param theStallTimeout the stall timeout, never null
     * @return this builder for chaining, never null
     */
    public Builder stallTimeout(final Duration theStallTimeout) {
      stallTimeout = Objects.requireNonNull(theStallTimeout,
          "stallTimeout must not be null");
      return this;
    }

    /**
     * Sets the connect timeout towards peers and origins.
     *
     * @param theConnectTimeout the connect timeout, never null
     * @return this builder for chaining, never null
     */
    public Builder connectTimeout(final Duration theConnectTimeout) {
      connectTimeout = Objects.requireNonNull(theConnectTimeout,
          "connectTimeout must not be null");
      return this;
    }

    /**
     * Builds the configuration.
     *
     * @return a new configuration, never null
     */
    public ProxyConfig build() {
      return new ProxyConfig(this);
    }
  }
}
