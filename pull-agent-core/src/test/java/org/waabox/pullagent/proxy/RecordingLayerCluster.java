package org.waabox.pullagent.proxy;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import org.waabox.pullagent.cluster.LayerCluster;

/**
 * A {@link LayerCluster} that answers lookups from a fixed table and
 * records the announcements it is asked to make.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class RecordingLayerCluster implements LayerCluster {

  private final String localAddress;

  private final Map<String, List<String>> endpoints =
      new ConcurrentHashMap<>();

  private final List<String> announcements = new ArrayList<>();

  private final CountDownLatch ended = new CountDownLatch(1);

  RecordingLayerCluster(final String theLocalAddress) {
    localAddress = theLocalAddress;
  }

  void holders(final String digest, final List<String> nodes) {
    endpoints.put(digest, nodes);
  }

  synchronized List<String> announcements() {
    return new ArrayList<>(announcements);
  }

  boolean awaitEnded() throws InterruptedException {
    return ended.await(5, TimeUnit.SECONDS);
  }

  @Override
  public synchronized void startLayer(final String digest) {
    announcements.add("START " + digest);
  }

  @Override
  public void endLayer(final String digest) {
    synchronized (this) {
      announcements.add("END " + digest);
    }
    ended.countDown();
  }

  @Override
  public List<String> endpoints(final String digest) {
    return new ArrayList<>(endpoints.getOrDefault(digest, List.of()));
  }

  @Override
  public String localAddress() {
    return localAddress;
  }
}
