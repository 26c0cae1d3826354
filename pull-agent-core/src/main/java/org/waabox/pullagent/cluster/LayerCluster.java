package org.waabox.pullagent.cluster;

import java.util.List;

/**
 * The cluster operations the relay proxy depends on.
 *
 * <p>Implementations announce this node's downloads to the cluster and
 * answer which nodes are currently downloading a layer, from the state
 * folded out of the events other nodes announce.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface LayerCluster {

  /**
   * Broadcasts that this node started downloading the layer and can relay
   * it.
   *
   * @param digest the layer identifier, never null
   */
  void startLayer(String digest);

  /**
   * Broadcasts that this node no longer downloads the layer.
   *
   * @param digest the layer identifier, never null
   */
  void endLayer(String digest);

  /**
   * Returns the nodes that can currently relay the layer.
   *
   * @param digest the layer identifier, never null
   *
   * @return a snapshot of the relay candidates, never null
   */
  List<String> endpoints(String digest);

  /**
   * Returns the address this node announces in its own events.
   *
   * @return the local node address, never null
   */
  String localAddress();
}
