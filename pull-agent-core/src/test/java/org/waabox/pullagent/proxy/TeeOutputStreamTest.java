package org.waabox.pullagent.proxy;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link TeeOutputStream}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class TeeOutputStreamTest {

  private static final byte[] CHUNK = "layer-bytes".getBytes();

  /** A sink that fails every write. */
  private static final class BrokenStream extends OutputStream {

    private int writes;

    @Override
    public void write(final int b) throws IOException {
      write(new byte[] {(byte) b}, 0, 1);
    }

    @Override
    public void write(final byte[] b, final int off, final int len)
        throws IOException {
      writes++;
      throw new IOException("broken pipe");
    }
  }

  @Test
  void whenWriting_givenHealthySinks_shouldForwardToBoth() throws Exception {
    final ByteArrayOutputStream cache = new ByteArrayOutputStream();
    final ByteArrayOutputStream response = new ByteArrayOutputStream();

    try (TeeOutputStream tee = new TeeOutputStream(cache, response)) {
      tee.write(CHUNK, 0, CHUNK.length);
      assertFalse(tee.cacheFailed());
      assertFalse(tee.responseFailed());
    }

    assertArrayEquals(CHUNK, cache.toByteArray());
    assertArrayEquals(CHUNK, response.toByteArray());
  }

  @Test
  void whenWriting_givenFailingResponse_shouldKeepFillingTheCache()
      throws Exception {
    final ByteArrayOutputStream cache = new ByteArrayOutputStream();
    final BrokenStream response = new BrokenStream();
    final TeeOutputStream tee = new TeeOutputStream(cache, response);

    tee.write(CHUNK, 0, 5);
    tee.write(CHUNK, 5, CHUNK.length - 5);

    assertArrayEquals(CHUNK, cache.toByteArray());
    assertTrue(tee.responseFailed());
    assertFalse(tee.cacheFailed());
    // The failed sink is not written again.
    assertEquals(1, response.writes);
  }

  @Test
  void whenWriting_givenFailingCache_shouldKeepServingTheResponse()
      throws Exception {
    final ByteArrayOutputStream response = new ByteArrayOutputStream();
    final TeeOutputStream tee = new TeeOutputStream(new BrokenStream(),
        response);

    tee.write(CHUNK, 0, CHUNK.length);

    assertArrayEquals(CHUNK, response.toByteArray());
    assertTrue(tee.cacheFailed());
  }

  @Test
  void whenWriting_givenBothSinksFailing_shouldThrow() {
    final TeeOutputStream tee = new TeeOutputStream(new BrokenStream(),
        new BrokenStream());

    assertThrows(IOException.class, () -> tee.write(CHUNK, 0, CHUNK.length));
  }
}
