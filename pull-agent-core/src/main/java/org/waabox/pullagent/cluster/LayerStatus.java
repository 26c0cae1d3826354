package org.waabox.pullagent.cluster;

/**
 * The download status carried by a {@link LayerEvent}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum LayerStatus {

  /** The node finished (or aborted) downloading the layer. */
  ENDED(0),

  /** The node started downloading the layer and can relay it. */
  STARTED(1);

  /** The numeric code used on the wire. */
  private final int code;

  LayerStatus(final int theCode) {
    code = theCode;
  }

  /**
   * Returns the numeric code used in the JSON payload.
   *
   * @return the wire code
   */
  public int code() {
    return code;
  }

  /**
   * Resolves a status from its wire code.
   *
   * @param code the numeric code
   *
   * @return the matching status, never null
   *
   * @throws IllegalArgumentException if the code is unknown
   */
  public static LayerStatus fromCode(final int code) {
    for (final LayerStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown layer status: " + code);
  }
}
