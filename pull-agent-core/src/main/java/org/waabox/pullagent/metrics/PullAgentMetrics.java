package org.waabox.pullagent.metrics;

/**
 * An abstraction for recording operational metrics of the relay proxy.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer or Prometheus. Use {@link NoopPullAgentMetrics} when metrics
 * collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface PullAgentMetrics {

  /**
   * Records a layer served from this node's local file.
   *
   * @param digest the layer identifier, never null
   * @param bytes  the number of bytes written to the caller
   */
  void localServed(String digest, long bytes);

  /**
   * Records a layer relayed through a peer.
   *
   * @param digest the layer identifier, never null
   * @param peer   the peer address the request was relayed to, never null
   */
  void peerRelayed(String digest, String peer);

  /**
   * Records a completed fetch from the origin.
   *
   * @param digest the layer identifier, never null
   * @param bytes  the number of bytes fetched
   */
  void originFetched(String digest, long bytes);

  /**
   * Records a failed or truncated fetch, from a peer or the origin.
   *
   * @param digest the layer identifier, never null
   * @param cause  the failure cause, never null
   */
  void fetchFailed(String digest, Throwable cause);
}
