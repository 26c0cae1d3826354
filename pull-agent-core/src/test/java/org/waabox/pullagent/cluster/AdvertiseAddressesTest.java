package org.waabox.pullagent.cluster;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;

import java.net.InetAddress;
import java.util.List;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link AdvertiseAddresses}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class AdvertiseAddressesTest {

  private static InetAddress ip(final int a, final int b, final int c,
      final int d) throws Exception {
    return InetAddress.getByAddress(
        new byte[] {(byte) a, (byte) b, (byte) c, (byte) d});
  }

  @Test
  void whenSelecting_givenTenAddress_shouldPreferIt() throws Exception {
    final String selected = AdvertiseAddresses.select(List.of(
        ip(192, 168, 1, 5), ip(10, 1, 2, 3), ip(172, 16, 0, 1)));

    assertEquals("10.1.2.3", selected);
  }

  @Test
  void whenSelecting_givenNoTenAddress_shouldTakeLastIpv4()
      throws Exception {
    final String selected = AdvertiseAddresses.select(List.of(
        ip(192, 168, 1, 5), ip(172, 16, 0, 1)));

    assertEquals("172.16.0.1", selected);
  }

  @Test
  void whenSelecting_givenLoopbackAndIpv6Only_shouldReturnEmpty()
      throws Exception {
    final String selected = AdvertiseAddresses.select(List.of(
        ip(127, 0, 0, 1), InetAddress.getByName("::1"),
        InetAddress.getByName("fe80::1")));

    assertEquals("", selected);
  }

  @Test
  void whenSelecting_givenNoCandidates_shouldReturnEmpty() {
    assertEquals("", AdvertiseAddresses.select(List.of()));
  }

  @Test
  void whenResolving_givenThisHost_shouldNeverReturnNull() {
    assertNotNull(AdvertiseAddresses.resolve());
  }
}
