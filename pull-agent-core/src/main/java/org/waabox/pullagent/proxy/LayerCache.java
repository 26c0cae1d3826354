package org.waabox.pullagent.proxy;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The on-disk layer cache.
 *
 * <p>Each layer is one file whose name is the local directory followed by
 * the layer path, e.g. {@code /tmp/pull-agent/v2/busybox/blobs/sha256:ab}.
 * There is no manifest or index: the presence of the file is the only
 * record of a cached layer.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class LayerCache {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(LayerCache.class);

  /** The cache directory, never null. */
  private final Path localDir;

  /**
   * Creates a cache rooted at the given directory.
   *
   * @param theLocalDir the cache directory, never null
   */
  LayerCache(final Path theLocalDir) {
    localDir = Objects.requireNonNull(theLocalDir,
        "localDir must not be null");
  }

  /**
   * Returns the file holding the given layer.
   *
   * @param digest the layer path, starting with a slash, never null
   * @return the file path, never null
   */
  Path pathFor(final String digest) {
    return Path.of(localDir.toString() + digest);
  }

  /**
   * Creates (or truncates) the file of the layer for writing.
   *
   * @param digest the layer path, never null
   * @return the stream to write the layer to, never null
   * @throws IOException if the file or its parent directories cannot be
   *     created
   */
  OutputStream create(final String digest) throws IOException {
    final Path file = pathFor(digest);
    final Path parent = file.getParent();
    if (parent != null) {
      Files.createDirectories(parent);
    }
    return Files.newOutputStream(file, StandardOpenOption.CREATE,
        StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
  }

  /**
   * Opens the file of the layer for positional reads.
   *
   * @param digest the layer path, never null
   * @return the open channel, never null
   * @throws IOException if the file does not exist or cannot be opened
   */
  FileChannel open(final String digest) throws IOException {
    return FileChannel.open(pathFor(digest), StandardOpenOption.READ);
  }

  /**
   * Removes the file of the layer, if present. Failures are logged.
   *
   * @param digest the layer path, never null
   */
  void delete(final String digest) {
    final Path file = pathFor(digest);
    try {
      if (Files.deleteIfExists(file)) {
        log.info("Removed incomplete layer file {}", file);
      }
    } catch (final IOException e) {
      log.error("Failed to remove incomplete layer file {}: {}", file,
          e.getMessage(), e);
    }
  }
}
