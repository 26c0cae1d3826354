package org.waabox.pullagent.cluster;

/**
 * A layer download event broadcast across the cluster.
 *
 * <p>When a node starts fetching a layer from its origin it broadcasts a
 * {@link LayerStatus#STARTED} event so other nodes can relay through it
 * instead of hitting the origin. When the fetch completes or aborts it
 * broadcasts {@link LayerStatus#ENDED}. Events carry no sequence number.
 *
 * @param status  the download status, never null
 * @param digest  the layer identifier (the request path), never null
 * @param address the advertise address of the downloading node, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record LayerEvent(
    LayerStatus status,
    String digest,
    String address
) {

  /** The user event name for {@link LayerStatus#STARTED} events. */
  public static final String START_LAYER = "START_LAYER";

  /** The user event name for {@link LayerStatus#ENDED} events. */
  public static final String END_LAYER = "END_LAYER";

  /**
   * Returns the user event name this event is broadcast under.
   *
   * @return {@link #START_LAYER} or {@link #END_LAYER}, never null
   */
  public String eventName() {
    return status == LayerStatus.STARTED ? START_LAYER : END_LAYER;
  }

  /**
   * Checks whether the given user event name is a layer event.
   *
   * @param name the user event name, may be null
   *
   * @return true if it is {@link #START_LAYER} or {@link #END_LAYER}
   */
  public static boolean isLayerEventName(final String name) {
    return START_LAYER.equals(name) || END_LAYER.equals(name);
  }
}
