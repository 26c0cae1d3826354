package org.waabox.pullagent.registry;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link DigestRegistry}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class DigestRegistryTest {

  private static final String DIGEST = "/v2/busybox/blobs/sha256:abc";

  @Test
  void whenRecordingStart_givenSameNodeTwice_shouldListItOnce() {
    final DigestRegistry registry = new DigestRegistry();

    registry.recordStart(DIGEST, "10.0.0.1");
    registry.recordStart(DIGEST, "10.0.0.1");

    assertEquals(List.of("10.0.0.1"), registry.listEndpoints(DIGEST));
  }

  @Test
  void whenRecordingStart_givenSeveralNodes_shouldKeepArrivalOrder() {
    final DigestRegistry registry = new DigestRegistry();

    registry.recordStart(DIGEST, "10.0.0.2");
    registry.recordStart(DIGEST, "10.0.0.1");
    registry.recordStart(DIGEST, "10.0.0.3");

    assertEquals(List.of("10.0.0.2", "10.0.0.1", "10.0.0.3"),
        registry.listEndpoints(DIGEST));
  }

  @Test
  void whenRecordingEnd_givenLastNode_shouldDropTheDigest() {
    final DigestRegistry registry = new DigestRegistry();
    registry.recordStart(DIGEST, "10.0.0.1");

    registry.recordEnd(DIGEST, "10.0.0.1");

    assertTrue(registry.listEndpoints(DIGEST).isEmpty());
    assertEquals(0, registry.size());
  }

  @Test
  void whenRecordingEnd_givenUnknownNodeOrDigest_shouldBeNoOp() {
    final DigestRegistry registry = new DigestRegistry();
    registry.recordStart(DIGEST, "10.0.0.1");

    registry.recordEnd(DIGEST, "10.0.0.9");
    registry.recordEnd("/v2/other/blobs/sha256:def", "10.0.0.1");

    assertEquals(List.of("10.0.0.1"), registry.listEndpoints(DIGEST));
    assertEquals(1, registry.size());
  }

  @Test
  void whenRecordingEnd_givenOneOfSeveralNodes_shouldKeepTheOthers() {
    final DigestRegistry registry = new DigestRegistry();
    registry.recordStart(DIGEST, "10.0.0.1");
    registry.recordStart(DIGEST, "10.0.0.2");

    registry.recordEnd(DIGEST, "10.0.0.1");

    assertEquals(List.of("10.0.0.2"), registry.listEndpoints(DIGEST));
  }

  @Test
  void whenListing_givenMutatedSnapshot_shouldNotAffectRegistry() {
    final DigestRegistry registry = new DigestRegistry();
    registry.recordStart(DIGEST, "10.0.0.1");

    final List<String> snapshot = registry.listEndpoints(DIGEST);
    snapshot.add("10.0.0.99");
    snapshot.remove("10.0.0.1");

    assertEquals(List.of("10.0.0.1"), registry.listEndpoints(DIGEST));
  }

  @Test
  void whenListing_givenLaterChanges_shouldKeepSnapshotUnchanged() {
    final DigestRegistry registry = new DigestRegistry();
    registry.recordStart(DIGEST, "10.0.0.1");

    final List<String> snapshot = registry.listEndpoints(DIGEST);
    registry.recordStart(DIGEST, "10.0.0.2");
    registry.recordEnd(DIGEST, "10.0.0.1");

    assertEquals(List.of("10.0.0.1"), snapshot);
  }

  @Test
  void whenListing_givenUnknownDigest_shouldReturnEmptyList() {
    final DigestRegistry registry = new DigestRegistry();

    assertTrue(registry.listEndpoints(DIGEST).isEmpty());
  }

  @Test
  void whenRecording_givenStartAndEndForEveryNode_shouldEndEmpty()
      throws Exception {
    final DigestRegistry registry = new DigestRegistry();
    final ExecutorService executor = Executors.newFixedThreadPool(8);
    final CountDownLatch done = new CountDownLatch(8);
    final List<String> nodes = new ArrayList<>();
    for (int i = 0; i < 8; i++) {
      nodes.add("10.0.0." + i);
    }

    for (final String node : nodes) {
      executor.submit(() -> {
        for (int i = 0; i < 500; i++) {
          registry.recordStart(DIGEST, node);
          registry.listEndpoints(DIGEST);
          registry.recordEnd(DIGEST, node);
        }
        done.countDown();
      });
    }

    assertTrue(done.await(10, TimeUnit.SECONDS));
    executor.shutdownNow();

    assertTrue(registry.listEndpoints(DIGEST).isEmpty());
    assertEquals(0, registry.size());
  }
}
