package org.waabox.pullagent.transport.http;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration holder for the HTTP membership transport.
 *
 * <p>Holds the address and port the transport listens on, the address it
 * advertises to its peers, and the timeout applied to requests towards
 * them.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class HttpTransportConfig {

  /** The default address to listen on. */
  private static final String DEFAULT_BIND_ADDRESS = "0.0.0.0";

  /** The default timeout for requests towards peers. */
  private static final Duration DEFAULT_REQUEST_TIMEOUT =
      Duration.ofSeconds(5);

  /** The address to listen on. */
  private final String bindAddress;

  /** The port to listen on, zero for an ephemeral port. */
  private final int port;

  /** The advertised address, null to detect it. */
  private final String advertiseAddress;

  /** The timeout for requests towards peers. */
  private final Duration requestTimeout;

  /** Private constructor; use the static factory methods instead. */
  private HttpTransportConfig(final String bindAddress, final int port,
      final String advertiseAddress, final Duration requestTimeout) {
    if (port < 0 || port > 65535) {
      throw new IllegalArgumentException("Invalid port: " + port);
    }
    this.bindAddress = Objects.requireNonNull(bindAddress,
        "bindAddress cannot be null");
    this.port = port;
    this.advertiseAddress = advertiseAddress;
    this.requestTimeout = Objects.requireNonNull(requestTimeout,
        "requestTimeout cannot be null");
  }

  /**
   * Creates a configuration listening on all interfaces at the given port,
   * with a detected advertise address.
   *
   * @param port the port to listen on
   * @return a new {@link HttpTransportConfig} instance, never null
   */
  public static HttpTransportConfig create(final int port) {
    return new HttpTransportConfig(DEFAULT_BIND_ADDRESS, port, null,
        DEFAULT_REQUEST_TIMEOUT);
  }

  /**
   * Creates a configuration with an explicit advertise address.
   *
   * @param bindAddress      the address to listen on, never null
   * @param port             the port to listen on
   * @param advertiseAddress the address peers reach this node at, null to
   *     detect it
   * @return a new {@link HttpTransportConfig} instance, never null
   */
  public static HttpTransportConfig create(final String bindAddress,
      final int port, final String advertiseAddress) {
    return new HttpTransportConfig(bindAddress, port, advertiseAddress,
        DEFAULT_REQUEST_TIMEOUT);
  }

  /**
   * Creates a configuration with every setting explicit.
   *
   * @param bindAddress      the address to listen on, never null
   * @param port             the port to listen on
   * @param advertiseAddress the address peers reach this node at, null to
   *     detect it
   * @param requestTimeout   the timeout for requests to peers, never null
   * @return a new {@link HttpTransportConfig} instance, never null
   */
  public static HttpTransportConfig create(final String bindAddress,
      final int port, final String advertiseAddress,
      final Duration requestTimeout) {
    return new HttpTransportConfig(bindAddress, port, advertiseAddress,
        requestTimeout);
  }

  /**
   * Returns the address to listen on.
   *
   * @return the bind address, never null
   */
  public String bindAddress() {
    return bindAddress;
  }

  /**
   * Returns the port to listen on.
   *
   * @return the port, zero for an ephemeral one
   */
  public int port() {
    return port;
  }

  /**
   * Returns the configured advertise address.
   *
   * @return the address, null when it should be detected
   */
  public String advertiseAddress() {
    return advertiseAddress;
  }

  /**
   * Returns the timeout for requests towards peers.
   *
   * @return the timeout, never null
   */
  public Duration requestTimeout() {
    return requestTimeout;
  }
}
