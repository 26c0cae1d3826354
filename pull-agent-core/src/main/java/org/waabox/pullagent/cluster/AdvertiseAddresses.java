package org.waabox.pullagent.cluster;

import java.net.Inet4Address;
import java.net.InetAddress;
import java.net.NetworkInterface;
import java.net.SocketException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the address a node advertises to its peers.
 *
 * <p>Loopback addresses are never advertised. Among the remaining IPv4
 * addresses an address in {@code 10.0.0.0/8} is preferred, since local-only
 * bridge networks (e.g. a docker bridge on {@code 172.x}) are not reachable
 * from other hosts.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class AdvertiseAddresses {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      AdvertiseAddresses.class);

  /** Private constructor to prevent instantiation. */
  private AdvertiseAddresses() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Resolves the advertise address from the host's network interfaces.
   *
   * @return the chosen address, or an empty string if no non-loopback IPv4
   *     address exists, never null
   */
  public static String resolve() {
    final List<InetAddress> candidates = new ArrayList<>();
    try {
      for (final NetworkInterface nic
          : Collections.list(NetworkInterface.getNetworkInterfaces())) {
        candidates.addAll(Collections.list(nic.getInetAddresses()));
      }
    } catch (final SocketException e) {
      log.warn("Failed to list network interfaces: {}", e.getMessage());
      return "";
    }
    final String address = select(candidates);
    if (address.isEmpty()) {
      log.warn("Failed to find a non loopback address");
    }
    return address;
  }

  /**
   * Picks the advertise address among the given candidates.
   *
   * <p>Returns the first {@code 10.} address if any; otherwise the last
   * non-loopback IPv4 address; otherwise an empty string.
   *
   * @param candidates the interface addresses, never null
   *
   * @return the chosen address, never null
   */
  public static String select(final List<InetAddress> candidates) {
    String chosen = "";
    for (final InetAddress candidate : candidates) {
      if (candidate.isLoopbackAddress()
          || !(candidate instanceof Inet4Address)) {
        continue;
      }
      chosen = candidate.getHostAddress();
      if (chosen.startsWith("10.")) {
        break;
      }
    }
    return chosen;
  }
}
