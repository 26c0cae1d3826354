package org.waabox.pullagent.proxy;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Forwards every write to the layer cache file and to the HTTP response.
 *
 * <p>The two sinks fail independently. A failed sink is logged once and
 * skipped from then on, while the other keeps receiving bytes: a caller
 * that disconnected does not stop the cache from being populated, and a
 * cache write failure does not stop the caller from being served. Writes
 * only fail once both sinks have failed.
 *
 * <p>Closing this stream flushes the live sinks but does not close them;
 * they belong to the caller.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class TeeOutputStream extends OutputStream {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      TeeOutputStream.class);

  /** The cache file sink. */
  private final Sink cache;

  /** The response sink. */
  private final Sink response;

  /**
   * Creates a tee over the two sinks.
   *
   * @param theCache    the cache file stream, never null
   * @param theResponse the response body stream, never null
   */
  TeeOutputStream(final OutputStream theCache,
      final OutputStream theResponse) {
    cache = new Sink("cache", theCache);
    response = new Sink("response", theResponse);
  }

  /** {@inheritDoc} */
  @Override
  public void write(final int b) throws IOException {
    write(new byte[] {(byte) b}, 0, 1);
  }

  /** {@inheritDoc} */
  @Override
  public void write(final byte[] data, final int offset, final int length)
      throws IOException {
    cache.write(data, offset, length);
    response.write(data, offset, length);
    requireLiveSink();
  }

  /** {@inheritDoc} */
  @Override
  public void flush() throws IOException {
    cache.flush();
    response.flush();
    requireLiveSink();
  }

  /** Flushes the live sinks, without closing them. */
  @Override
  public void close() {
    cache.flush();
    response.flush();
  }

  /**
   * Returns whether writing to the cache file failed.
   *
   * @return true if the cache file is incomplete
   */
  boolean cacheFailed() {
    return cache.failed;
  }

  /**
   * Returns whether writing to the response failed.
   *
   * @return true if the caller stopped receiving bytes
   */
  boolean responseFailed() {
    return response.failed;
  }

  /** Fails once no sink is left to write to.
   *
   * @throws IOException if both sinks failed
   */
  private void requireLiveSink() throws IOException {
    if (cache.failed && response.failed) {
      throw new IOException("Both cache and response writes failed");
    }
  }

  /** One destination of the tee with its own failure state. */
  private static final class Sink {

    /** The sink name, for logging. */
    private final String name;

    /** The wrapped stream. */
    private final OutputStream out;

    /** Whether a write to this sink failed. */
    private boolean failed;

    /** Creates a sink.
     *
     * @param theName the sink name, never null
     * @param theOut  the wrapped stream, never null
     */
    private Sink(final String theName, final OutputStream theOut) {
      name = theName;
      out = Objects.requireNonNull(theOut, name + " must not be null");
    }

    /** Writes to the wrapped stream unless it already failed.
     *
     * @param data   the buffer
     * @param offset the start offset
     * @param length the number of bytes
     */
    private void write(final byte[] data, final int offset,
        final int length) {
      if (failed) {
        return;
      }
      try {
        out.write(data, offset, length);
      } catch (final IOException e) {
        fail(e);
      }
    }

    /** Flushes the wrapped stream unless it already failed. */
    private void flush() {
      if (failed) {
        return;
      }
      try {
        out.flush();
      } catch (final IOException e) {
        fail(e);
      }
    }

    /** Marks the sink as failed.
     *
     * @param e the failure
     */
    private void fail(final IOException e) {
      failed = true;
      log.warn("Failed to write to {}, skipping it from now on: {}", name,
          e.getMessage());
    }
  }
}
