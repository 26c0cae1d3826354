package org.waabox.pullagent.proxy;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Streams a cached layer file that may still be growing.
 *
 * <p>The file is read with positional reads, chunk by chunk, starting at
 * offset zero. A read that returns nothing (or fails) means the writer has
 * not caught up yet: the reader sleeps for the poll interval and tries the
 * same offset again. It keeps doing so while the offset is below
 * {@code length - 1}, then issues one last read for whatever remains
 * without waiting. No more than {@code length} bytes are ever emitted.
 *
 * <p>The transfer stops early when the file disappears from its path, when
 * no byte arrived for the stall timeout, when the thread is interrupted, or
 * when writing to the output fails (the latter is thrown).
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class PartialFileReader {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      PartialFileReader.class);

  /** The maximum read size, in bytes. */
  private final int chunkSize;

  /** The wait between reads that returned nothing, never null. */
  private final Duration pollInterval;

  /** The time without progress before giving up, never null. */
  private final Duration stallTimeout;

  /**
   * Creates a reader.
   *
   * @param theChunkSize    the maximum read size, must be positive
   * @param thePollInterval the wait between empty reads, never null
   * @param theStallTimeout the time without progress before giving up,
   *     never null
   */
  public PartialFileReader(final int theChunkSize,
      final Duration thePollInterval, final Duration theStallTimeout) {
    if (theChunkSize <= 0) {
      throw new IllegalArgumentException(
          "chunkSize must be greater than 0, got: " + theChunkSize);
    }
    chunkSize = theChunkSize;
    pollInterval = Objects.requireNonNull(thePollInterval,
        "pollInterval must not be null");
    stallTimeout = Objects.requireNonNull(theStallTimeout,
        "stallTimeout must not be null");
  }

  /**
   * Copies up to {@code length} bytes of the file to the output.
   *
   * @param channel the channel open on the file, never null
   * @param path    the path the file lives at, checked to detect removal,
   *     never null
   * @param length  the declared length of the layer
   * @param out     the destination, never null
   *
   * @return the number of bytes written to the output
   *
   * @throws IOException if writing to the output fails
   */
  public long transfer(final FileChannel channel, final Path path,
      final long length, final OutputStream out) throws IOException {
    final ByteBuffer buffer = ByteBuffer.allocate(
        (int) Math.max(1, Math.min(chunkSize, length)));
    long offset = 0;
    long lastProgress = System.nanoTime();

    while (offset < length - 1) {
      final int read = readAt(channel, buffer, offset, length, path);
      if (read > 0) {
        out.write(buffer.array(), 0, read);
        offset += read;
        lastProgress = System.nanoTime();
        continue;
      }
      if (!Files.exists(path)) {
        log.warn("{} was removed after {} of {} bytes, giving up", path,
            offset, length);
        return offset;
      }
      if (System.nanoTime() - lastProgress > stallTimeout.toNanos()) {
        log.warn("{} made no progress for {}, giving up at {} of {} bytes",
            path, stallTimeout, offset, length);
        return offset;
      }
      if (!pause()) {
        log.warn("Interrupted while waiting for {} at {} of {} bytes", path,
            offset, length);
        return offset;
      }
    }

    if (offset < length) {
      final int read = readAt(channel, buffer, offset, length, path);
      if (read > 0) {
        out.write(buffer.array(), 0, read);
        offset += read;
      }
    }
    out.flush();
    return offset;
  }

  /** Reads from the given offset without crossing the declared length.
   *
   * @return the bytes read into the buffer, zero on end of file or error
   */
  private int readAt(final FileChannel channel, final ByteBuffer buffer,
      final long offset, final long length, final Path path) {
    buffer.clear();
    buffer.limit((int) Math.min(buffer.capacity(), length - offset));
    try {
      return Math.max(channel.read(buffer, offset), 0);
    } catch (final IOException e) {
      log.warn("Failed to read {} at offset {}: {}", path, offset,
          e.getMessage());
      return 0;
    }
  }

  /** Sleeps for the poll interval.
   *
   * @return false if the thread was interrupted
   */
  private boolean pause() {
    try {
      Thread.sleep(pollInterval.toMillis());
      return true;
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }
}
