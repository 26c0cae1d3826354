package org.waabox.pullagent.metrics;

/**
 * A no-operation implementation of {@link PullAgentMetrics}.
 *
 * <p>All methods in this class are intentionally empty.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopPullAgentMetrics implements PullAgentMetrics {

  /** {@inheritDoc} */
  @Override
  public void localServed(final String digest, final long bytes) {
  }

  /** {@inheritDoc} */
  @Override
  public void peerRelayed(final String digest, final String peer) {
  }

  /** {@inheritDoc} */
  @Override
  public void originFetched(final String digest, final long bytes) {
  }

  /** {@inheritDoc} */
  @Override
  public void fetchFailed(final String digest, final Throwable cause) {
  }
}
