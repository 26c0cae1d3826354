package org.waabox.pullagent.cluster;

import java.util.Objects;

/**
 * An event delivered by a {@link MembershipTransport}.
 *
 * <p>User events carry a name and an opaque payload published through
 * {@link MembershipTransport#broadcast(String, byte[])}. Member events
 * report cluster churn (a node joined or left); their payload is the
 * member address in UTF-8.
 *
 * @param type    the kind of event, never null
 * @param name    the event name, never null
 * @param payload the raw payload, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ClusterEvent(Type type, String name, byte[] payload) {

  /** The kinds of events a transport delivers. */
  public enum Type {
    /** An application event broadcast by some member. */
    USER,
    /** A membership change. */
    MEMBER
  }

  /**
   * Canonical constructor, validates its arguments.
   *
   * @param type    the kind of event, never null
   * @param name    the event name, never null
   * @param payload the raw payload, never null
   */
  public ClusterEvent {
    Objects.requireNonNull(type, "type must not be null");
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(payload, "payload must not be null");
  }

  /**
   * Creates a user event.
   *
   * @param name    the event name, never null
   * @param payload the payload, never null
   * @return the event, never null
   */
  public static ClusterEvent user(final String name, final byte[] payload) {
    return new ClusterEvent(Type.USER, name, payload);
  }

  /**
   * Creates a member event.
   *
   * @param name    the membership change name (e.g. "member-join"),
   *                never null
   * @param payload the member address bytes, never null
   * @return the event, never null
   */
  public static ClusterEvent member(final String name, final byte[] payload) {
    return new ClusterEvent(Type.MEMBER, name, payload);
  }

  /** {@inheritDoc} */
  @Override
  public String toString() {
    return "ClusterEvent[" + type + " " + name + ", "
        + payload.length + " bytes]";
  }
}
