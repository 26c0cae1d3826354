package org.waabox.pullagent.registry;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory index of which nodes are currently downloading which layers.
 *
 * <p>The registry is a fold over the STARTED / ENDED events received from
 * the cluster: a STARTED adds the node to the set of the digest, an ENDED
 * removes it. Both operations are idempotent and commute for distinct
 * nodes, so duplicated or reordered delivery is tolerated. The last event
 * to arrive locally for a given (digest, node) pair wins.
 *
 * <p>A single lock guards every read and write. The lock is only held for
 * the map operation itself, never across network or disk I/O.
 *
 * <p>Inputs are stored as given; validating digests and addresses is the
 * responsibility of the event decoding layer.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class DigestRegistry {

  /** The nodes downloading each digest, keyed by digest. */
  private final Map<String, List<String>> byDigest = new HashMap<>();

  /** Guards {@link #byDigest}. */
  private final Object lock = new Object();

  /**
   * Marks the given node as an active downloader of the digest.
   *
   * <p>Adding a node that is already listed is a no-op.
   *
   * @param digest the layer digest, never null
   * @param node   the node address, never null
   */
  public void recordStart(final String digest, final String node) {
    synchronized (lock) {
      final List<String> nodes = byDigest.computeIfAbsent(digest,
          key -> new ArrayList<>());
      if (!nodes.contains(node)) {
        nodes.add(node);
      }
    }
  }

  /**
   * Removes the given node from the active downloaders of the digest.
   *
   * <p>Removing a node that is not listed is a no-op.
   *
   * @param digest the layer digest, never null
   * @param node   the node address, never null
   */
  public void recordEnd(final String digest, final String node) {
    synchronized (lock) {
      final List<String> nodes = byDigest.get(digest);
      if (nodes == null) {
        return;
      }
      nodes.remove(node);
      if (nodes.isEmpty()) {
        byDigest.remove(digest);
      }
    }
  }

  /**
   * Returns the nodes currently known to be downloading the digest.
   *
   * <p>The result is a copy taken under the lock; mutating it does not
   * affect the registry.
   *
   * @param digest the layer digest, never null
   *
   * @return a snapshot of the downloaders, in arrival order, never null
   */
  public List<String> listEndpoints(final String digest) {
    synchronized (lock) {
      final List<String> nodes = byDigest.get(digest);
      if (nodes == null) {
        return new ArrayList<>();
      }
      return new ArrayList<>(nodes);
    }
  }

  /**
   * Returns the number of digests with at least one active downloader.
   *
   * @return the number of tracked digests
   */
  public int size() {
    synchronized (lock) {
      return byDigest.size();
    }
  }
}
