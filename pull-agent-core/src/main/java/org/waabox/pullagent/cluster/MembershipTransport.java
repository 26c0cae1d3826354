package org.waabox.pullagent.cluster;

import java.io.IOException;

/**
 * The gossip / membership layer the agent coordinates through.
 *
 * <p>A transport maintains cluster membership, knows the address this node
 * is reachable at, broadcasts user events to every member (including this
 * node), and exposes the inbound event stream as a blocking receive.
 *
 * <p>Typical lifecycle:
 * <ol>
 *   <li>{@link #join(String)} through a seed member</li>
 *   <li>{@link #nextEvent()} in a single consumer loop</li>
 *   <li>{@link #broadcast(String, byte[])} from any thread</li>
 *   <li>{@link #close()} on shutdown</li>
 * </ol>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface MembershipTransport extends AutoCloseable {

  /**
   * Joins the cluster through the given seed member.
   *
   * @param seedAddress the address of a known member, never null
   *
   * @return the number of seeds successfully contacted; a successful join
   *     returns exactly 1
   *
   * @throws IOException if the seed cannot be contacted
   */
  int join(String seedAddress) throws IOException;

  /**
   * Returns the address this node is reachable at by its peers.
   *
   * @return the advertise address, empty if none could be determined,
   *     never null
   */
  String advertiseAddress();

  /**
   * Broadcasts a user event to the whole cluster, fire and forget.
   *
   * <p>Delivery failures are logged by the implementation, never thrown.
   *
   * @param eventName the event name, never null
   * @param payload   the payload, never null
   */
  void broadcast(String eventName, byte[] payload);

  /**
   * Blocks until the next inbound event is available.
   *
   * @return the next event, never null
   *
   * @throws InterruptedException if the waiting thread is interrupted
   */
  ClusterEvent nextEvent() throws InterruptedException;

  /** Leaves the cluster and releases the transport resources. */
  @Override
  void close();
}
