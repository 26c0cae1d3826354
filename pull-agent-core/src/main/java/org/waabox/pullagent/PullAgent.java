package org.waabox.pullagent;

import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import org.waabox.pullagent.cluster.GossipLayerCluster;
import org.waabox.pullagent.cluster.MembershipTransport;
import org.waabox.pullagent.metrics.NoopPullAgentMetrics;
import org.waabox.pullagent.metrics.PullAgentMetrics;
import org.waabox.pullagent.proxy.ProxyConfig;
import org.waabox.pullagent.proxy.RelayProxy;
import org.waabox.pullagent.registry.DigestRegistry;

/**
 * One pull-agent node: the cluster membership, the digest registry and the
 * relay proxy, started and stopped together.
 *
 * <p>Instances are created through the {@link Builder}:
 * <pre>{@code
 * PullAgent agent = PullAgent.builder()
 *     .transport(new HttpMembershipTransport(transportConfig))
 *     .seed("10.0.0.2:7946")
 *     .proxyConfig(ProxyConfig.builder().port(5000).build())
 *     .build();
 * agent.start();
 * // ... on shutdown
 * agent.stop();
 * }</pre>
 *
 * <p>Startup order is: resolve the advertise address, join the cluster and
 * start consuming layer events, then open the proxy port. A failure in any
 * step is fatal and surfaces as a {@link PullAgentException}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PullAgent {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(PullAgent.class);

  /** The membership transport, never null. */
  private final MembershipTransport transport;

  /** The seed to join through, never null, blank to found a cluster. */
  private final String seed;

  /** The advertise address override, may be null. */
  private final String advertiseAddress;

  /** The proxy configuration, never null. */
  private final ProxyConfig proxyConfig;

  /** The metrics sink, never null. */
  private final PullAgentMetrics metrics;

  /** The registry of active downloaders, never null. */
  private final DigestRegistry registry = new DigestRegistry();

  /** The cluster coordinator, null until started. */
  private GossipLayerCluster cluster;

  /** The relay proxy, null until started. */
  private RelayProxy proxy;

  /** The resolved node address, null until started. */
  private String nodeAddress;

  /** Creates a new agent from the given builder.
   *
   * @param builder the builder, never null
   */
  private PullAgent(final Builder builder) {
    transport = builder.transport;
    seed = builder.seed;
    advertiseAddress = builder.advertiseAddress;
    proxyConfig = builder.proxyConfig;
    metrics = builder.metrics;
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts the node.
   *
   * @throws PullAgentException if no advertise address can be found, the
   *     join fails, or the proxy port cannot be bound
   * @throws IllegalStateException if already started
   */
  public synchronized void start() {
    if (cluster != null) {
      throw new IllegalStateException("PullAgent already started");
    }

    final String address = advertiseAddress != null
        ? advertiseAddress
        : transport.advertiseAddress();
    if (address.isBlank()) {
      throw new PullAgentException("No advertise address found, set one"
          + " explicitly on hosts without a non-loopback IPv4 interface");
    }

    final GossipLayerCluster theCluster = new GossipLayerCluster(transport,
        registry, address, seed);
    theCluster.start();

    final RelayProxy theProxy = new RelayProxy(proxyConfig, theCluster,
        metrics);
    try {
      theProxy.start();
    } catch (final PullAgentException e) {
      theCluster.stop();
      throw e;
    }

    nodeAddress = address;
    cluster = theCluster;
    proxy = theProxy;
    log.info("PullAgent node '{}' started, proxy on port {}", address,
        theProxy.port());
  }

  /** Stops the proxy, the event loop, and closes the transport. */
  public synchronized void stop() {
    if (proxy != null) {
      proxy.stop();
      proxy = null;
    }
    if (cluster != null) {
      cluster.stop();
      cluster = null;
    }
    try {
      transport.close();
    } catch (final RuntimeException e) {
      log.warn("Failed to close transport: {}", e.getMessage(), e);
    }
    log.info("PullAgent node '{}' stopped", nodeAddress);
  }

  /**
   * Returns the registry of active downloaders known to this node.
   *
   * @return the registry, never null
   */
  public DigestRegistry registry() {
    return registry;
  }

  /**
   * Returns the port the proxy is bound to.
   *
   * @return the proxy port
   * @throws IllegalStateException if the node is not started
   */
  public synchronized int port() {
    if (proxy == null) {
      throw new IllegalStateException("PullAgent not started");
    }
    return proxy.port();
  }

  /**
   * Returns the address this node announces in its layer events.
   *
   * @return the node address, null until started
   */
  public String nodeAddress() {
    return nodeAddress;
  }

  /** A fluent builder for {@link PullAgent}. */
  public static final class Builder {

    /** The membership transport. */
    private MembershipTransport transport;

    /** The seed member. */
    private String seed = "";

    /** The advertise address override. */
    private String advertiseAddress;

    /** The proxy configuration. */
    private ProxyConfig proxyConfig = ProxyConfig.builder().build();

    /** The metrics sink. */
    private PullAgentMetrics metrics = new NoopPullAgentMetrics();

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the membership transport. Required.
     *
     * @param theTransport the transport, never null
     * @return this builder for chaining, never null
     */
    public Builder transport(final MembershipTransport theTransport) {
      transport = Objects.requireNonNull(theTransport,
          "transport must not be null");
      return this;
    }

    /**
     * Sets the seed member to join through.
     *
     * <p>When blank, or not set, this node founds a new cluster.
     *
     * @param theSeed the seed address, may be null
     * @return this builder for chaining, never null
     */
    public Builder seed(final String theSeed) {
      seed = theSeed == null ? "" : theSeed;
      return this;
    }

    /**
     * Overrides the address announced in this node's layer events.
     *
     * <p>When not set, the transport's advertise address is used.
     *
     * @param theAdvertiseAddress the address, never null or blank
     * @return this builder for chaining, never null
     */
    public Builder advertiseAddress(final String theAdvertiseAddress) {
      Objects.requireNonNull(theAdvertiseAddress,
          "advertiseAddress must not be null");
      if (theAdvertiseAddress.isBlank()) {
        throw new IllegalArgumentException(
            "advertiseAddress must not be blank");
      }
      advertiseAddress = theAdvertiseAddress;
      return this;
    }

    /**
     * Sets the proxy configuration.
     *
     * @param theProxyConfig the configuration, never null
     * @return this builder for chaining, never null
     */
    public Builder proxyConfig(final ProxyConfig theProxyConfig) {
      proxyConfig = Objects.requireNonNull(theProxyConfig,
          "proxyConfig must not be null");
      return this;
    }

    /**
     * Sets the metrics sink. Defaults to a no-op implementation.
     *
     * @param theMetrics the metrics sink, never null
     * @return this builder for chaining, never null
     */
    public Builder metrics(final PullAgentMetrics theMetrics) {
      metrics = Objects.requireNonNull(theMetrics,
          "metrics must not be null");
      return this;
    }

    /**
     * Builds the agent.
     *
     * @return a new, not yet started agent, never null
     * @throws IllegalStateException if no transport was set
     */
    public PullAgent build() {
      if (transport == null) {
        throw new IllegalStateException("transport is required");
      }
      return new PullAgent(this);
    }
  }
}
