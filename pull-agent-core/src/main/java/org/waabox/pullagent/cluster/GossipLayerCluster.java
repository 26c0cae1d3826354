package org.waabox.pullagent.cluster;

import java.io.IOException;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.pullagent.PullAgentException;
import org.waabox.pullagent.registry.DigestRegistry;

/**
 * {@link LayerCluster} implementation on top of a gossip
 * {@link MembershipTransport}.
 *
 * <p>Outbound, {@link #startLayer(String)} and {@link #endLayer(String)}
 * broadcast {@link LayerEvent}s carrying this node's address. Inbound, a
 * single daemon thread drains the transport's event stream and folds every
 * layer event into the {@link DigestRegistry}; that thread is the only
 * writer of the registry.
 *
 * <p>Typical usage:
 * <pre>{@code
 * DigestRegistry registry = new DigestRegistry();
 * GossipLayerCluster cluster = new GossipLayerCluster(transport, registry,
 *     "10.0.0.1", "10.0.0.2:7946");
 * cluster.start();   // joins, then consumes events in the background
 * cluster.startLayer("/v2/busybox/blobs/sha256:abc");
 * // ... on shutdown
 * cluster.stop();
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class GossipLayerCluster implements LayerCluster {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      GossipLayerCluster.class);

  /** The transport used to join, broadcast and receive, never null. */
  private final MembershipTransport transport;

  /** The registry of active downloaders, never null. */
  private final DigestRegistry registry;

  /** The address announced in this node's events, never null. */
  private final String address;

  /** The seed member to join through, never null, may be blank. */
  private final String seed;

  /** Whether the consumption loop is running. */
  private final AtomicBoolean running = new AtomicBoolean(false);

  /** The thread running the consumption loop. */
  private volatile Thread loopThread;

  /**
   * Creates a new cluster coordinator.
   *
   * @param theTransport the membership transport, never null
   * @param theRegistry  the registry to fold events into, never null
   * @param theAddress   the address announced by this node, never null
   * @param theSeed      the seed member to join through; blank means this
   *                     node founds a new cluster, never null
   */
  public GossipLayerCluster(final MembershipTransport theTransport,
      final DigestRegistry theRegistry, final String theAddress,
      final String theSeed) {
    transport = Objects.requireNonNull(theTransport,
        "transport must not be null");
    registry = Objects.requireNonNull(theRegistry,
        "registry must not be null");
    address = Objects.requireNonNull(theAddress, "address must not be null");
    seed = Objects.requireNonNull(theSeed, "seed must not be null");
  }

  /**
   * Joins the cluster and starts the event consumption loop.
   *
   * <p>A join that does not contact exactly one seed, or that fails, is
   * fatal: an agent that cannot see its peers is useless.
   *
   * @throws PullAgentException if the join fails
   * @throws IllegalStateException if already started
   */
  public void start() {
    if (running.getAndSet(true)) {
      throw new IllegalStateException("Cluster already started");
    }

    try {
      join();
    } catch (final PullAgentException e) {
      running.set(false);
      throw e;
    }

    final Thread thread = new Thread(this::consumeEvents,
        "pull-agent-event-loop");
    thread.setDaemon(true);
    loopThread = thread;
    thread.start();

    log.info("Cluster started, announcing as '{}'", address);
  }

  /**
   * Stops the event consumption loop.
   *
   * <p>The transport itself is not closed; its owner closes it.
   */
  public void stop() {
    if (!running.getAndSet(false)) {
      return;
    }
    final Thread thread = loopThread;
    if (thread != null) {
      thread.interrupt();
      try {
        thread.join(5_000);
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while waiting for the event loop to stop");
      }
    }
    loopThread = null;
    log.info("Cluster stopped");
  }

  /** {@inheritDoc} */
  @Override
  public void startLayer(final String digest) {
    announce(new LayerEvent(LayerStatus.STARTED, digest, address));
  }

  /** {@inheritDoc} */
  @Override
  public void endLayer(final String digest) {
    announce(new LayerEvent(LayerStatus.ENDED, digest, address));
  }

  /** {@inheritDoc} */
  @Override
  public List<String> endpoints(final String digest) {
    return registry.listEndpoints(digest);
  }

  /** {@inheritDoc} */
  @Override
  public String localAddress() {
    return address;
  }

  /**
   * Folds a single inbound event into the registry.
   *
   * <p>Non-user events and user events other than the layer events are
   * ignored. Undecodable payloads are logged and discarded. This method
   * never throws.
   *
   * <p>Package-private for testability.
   *
   * @param event the inbound event, never null
   */
  void handle(final ClusterEvent event) {
    log.debug("Received {}", event);

    if (event.type() != ClusterEvent.Type.USER
        || !LayerEvent.isLayerEventName(event.name())) {
      return;
    }

    final LayerEvent layerEvent;
    try {
      layerEvent = LayerEventCodec.deserialize(event.payload());
    } catch (final IllegalArgumentException e) {
      log.warn("Discarding undecodable {} event: {}", event.name(),
          e.getMessage());
      return;
    }

    switch (layerEvent.status()) {
      case STARTED -> {
        log.debug("Add layer {} from {}", layerEvent.digest(),
            layerEvent.address());
        registry.recordStart(layerEvent.digest(), layerEvent.address());
      }
      case ENDED -> {
        log.debug("Remove layer {} from {}", layerEvent.digest(),
            layerEvent.address());
        registry.recordEnd(layerEvent.digest(), layerEvent.address());
      }
      default -> log.warn("Ignoring layer event with status {}",
          layerEvent.status());
    }
  }

  /** Joins through the seed, unless this node founds the cluster.
   *
   * @throws PullAgentException if the join fails
   */
  private void join() {
    if (seed.isBlank()) {
      log.info("No seed configured, founding a new cluster");
      return;
    }

    final int contacted;
    try {
      contacted = transport.join(seed);
    } catch (final IOException e) {
      throw new PullAgentException("Failed to join cluster through "
          + seed, e);
    }
    if (contacted != 1) {
      throw new PullAgentException("Failed to contact " + seed);
    }
    log.info("Joined cluster through {}", seed);
  }

  /** Broadcasts a layer event, logging instead of throwing on failure.
   *
   * @param event the event to broadcast, never null
   */
  private void announce(final LayerEvent event) {
    try {
      transport.broadcast(event.eventName(),
          LayerEventCodec.serialize(event));
    } catch (final RuntimeException e) {
      log.error("Failed to broadcast {} for {}: {}", event.eventName(),
          event.digest(), e.getMessage(), e);
    }
  }

  /** The consumption loop. Runs until {@link #stop()} or interruption. */
  private void consumeEvents() {
    while (running.get()) {
      final ClusterEvent event;
      try {
        event = transport.nextEvent();
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        return;
      } catch (final RuntimeException e) {
        log.error("Event stream failed, no more layer events will be"
            + " received: {}", e.getMessage(), e);
        return;
      }
      try {
        handle(event);
      } catch (final RuntimeException e) {
        log.error("Unexpected failure handling {}: {}", event,
            e.getMessage(), e);
      }
    }
  }
}
