package org.waabox.pullagent;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import com.sun.net.httpserver.HttpServer;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.waabox.pullagent.cluster.InMemoryMembershipHub;
import org.waabox.pullagent.proxy.ProxyConfig;

/**
 * Tests for {@link PullAgent}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class PullAgentTest {

  private static final String DIGEST = "/v2/alpine/blobs/sha256:f00d";

  private static final byte[] LAYER = ("a layer that is streamed in two"
      + " halves, the second one only once the test says so")
      .getBytes(StandardCharsets.UTF_8);

  @TempDir
  Path dir;

  private static int freePort() throws IOException {
    try (ServerSocket socket = new ServerSocket(0)) {
      return socket.getLocalPort();
    }
  }

  private static void waitUntil(final BooleanSupplier condition)
      throws InterruptedException {
    final long deadline = System.currentTimeMillis() + 5_000;
    while (!condition.getAsBoolean()) {
      if (System.currentTimeMillis() > deadline) {
        throw new AssertionError("Condition not met within 5 seconds");
      }
      Thread.sleep(10);
    }
  }

  private ProxyConfig proxyConfig(final int port, final Path localDir) {
    return ProxyConfig.builder()
        .bindAddress("127.0.0.1")
        .port(port)
        .localDir(localDir)
        .chunkSize(16)
        .pollInterval(Duration.ofMillis(20))
        .build();
  }

  @Test
  void whenBuilding_givenNoTransport_shouldThrow() {
    assertThrows(IllegalStateException.class,
        () -> PullAgent.builder().build());
  }

  @Test
  void whenStarting_givenNoAdvertiseAddress_shouldFail() {
    final InMemoryMembershipHub hub = new InMemoryMembershipHub();
    final PullAgent agent = PullAgent.builder()
        .transport(hub.transport(""))
        .proxyConfig(proxyConfig(0, dir))
        .build();

    assertThrows(PullAgentException.class, agent::start);
  }

  @Test
  void whenStarting_givenUnknownSeed_shouldFail() {
    final InMemoryMembershipHub hub = new InMemoryMembershipHub();
    final PullAgent agent = PullAgent.builder()
        .transport(hub.transport("127.0.0.1:1"))
        .seed("127.0.0.1:2")
        .proxyConfig(proxyConfig(0, dir))
        .build();

    assertThrows(PullAgentException.class, agent::start);
  }

  @Test
  void whenStarting_givenProxyPortInUse_shouldFail() throws Exception {
    final InMemoryMembershipHub hub = new InMemoryMembershipHub();
    try (ServerSocket taken = new ServerSocket(0, 1,
        java.net.InetAddress.getByName("127.0.0.1"))) {
      final PullAgent agent = PullAgent.builder()
          .transport(hub.transport("127.0.0.1:1"))
          .proxyConfig(proxyConfig(taken.getLocalPort(), dir))
          .build();

      assertThrows(PullAgentException.class, agent::start);
    }
  }

  @Test
  void whenFetchingOnOneNode_givenSecondNodeAsked_shouldRelayBetweenThem()
      throws Exception {
    // Arrange: an origin that holds the second half until released.
    final CountDownLatch release = new CountDownLatch(1);
    final HttpServer origin = HttpServer.create(
        new InetSocketAddress("127.0.0.1", 0), 0);
    origin.createContext("/", exchange -> {
      try {
        exchange.sendResponseHeaders(200, LAYER.length);
        final OutputStream os = exchange.getResponseBody();
        os.write(LAYER, 0, LAYER.length / 2);
        os.flush();
        release.await(5, TimeUnit.SECONDS);
        os.write(LAYER, LAYER.length / 2, LAYER.length - LAYER.length / 2);
        os.close();
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
      } finally {
        exchange.close();
      }
    });
    origin.start();

    final int portA = freePort();
    final int portB = freePort();
    final String addressA = "127.0.0.1:" + portA;
    final String addressB = "127.0.0.1:" + portB;
    final Path dirA = Files.createDirectory(dir.resolve("a"));
    final Path dirB = Files.createDirectory(dir.resolve("b"));

    final InMemoryMembershipHub hub = new InMemoryMembershipHub();
    final PullAgent nodeA = PullAgent.builder()
        .transport(hub.transport(addressA))
        .proxyConfig(proxyConfig(portA, dirA))
        .build();
    final PullAgent nodeB = PullAgent.builder()
        .transport(hub.transport(addressB))
        .seed(addressA)
        .proxyConfig(proxyConfig(portB, dirB))
        .build();
    nodeA.start();
    nodeB.start();

    final HttpClient client = HttpClient.newHttpClient();
    try {
      final String source = "http://127.0.0.1:"
          + origin.getAddress().getPort() + DIGEST;

      // Act: node A becomes the authoritative fetcher.
      final CompletableFuture<HttpResponse<byte[]>> fromA = client.sendAsync(
          HttpRequest.newBuilder(URI.create("http://" + addressA + DIGEST
              + "?len=" + LAYER.length + "&source="
              + URLEncoder.encode(source, StandardCharsets.UTF_8)))
              .GET().build(),
          HttpResponse.BodyHandlers.ofByteArray());

      waitUntil(() -> nodeB.registry().listEndpoints(DIGEST)
          .contains(addressA));

      // Node B has no source, it can only relay from A.
      final CompletableFuture<HttpResponse<byte[]>> fromB = client.sendAsync(
          HttpRequest.newBuilder(URI.create("http://" + addressB + DIGEST
              + "?len=" + LAYER.length)).GET().build(),
          HttpResponse.BodyHandlers.ofByteArray());

      Thread.sleep(100);
      release.countDown();

      // Assert
      assertArrayEquals(LAYER, fromA.get(5, TimeUnit.SECONDS).body());
      assertArrayEquals(LAYER, fromB.get(5, TimeUnit.SECONDS).body());
      assertArrayEquals(LAYER,
          Files.readAllBytes(Path.of(dirA.toString() + DIGEST)));
      assertFalse(Files.exists(Path.of(dirB.toString() + DIGEST)));

      waitUntil(() -> nodeA.registry().size() == 0
          && nodeB.registry().size() == 0);
      assertTrue(nodeB.registry().listEndpoints(DIGEST).isEmpty());
      assertEquals(addressA, nodeA.nodeAddress());
    } finally {
      nodeB.stop();
      nodeA.stop();
      origin.stop(0);
    }
  }
}
