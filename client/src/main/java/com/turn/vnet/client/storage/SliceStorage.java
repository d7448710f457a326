package com.turn.vnet.client.storage;

import java.io.Closeable;
import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Byte storage of a single slice.
 *
 * <p>
 * Reads and writes are positioned, absolute to the start of the slice, and
 * must stay within {@link #size()}.
 * </p>
 */
public interface SliceStorage extends Closeable {

  long size();

  /**
   * Fills the remaining bytes of the buffer with slice data from {@code position}.
   *
   * @return number of bytes read
   * @throws IllegalArgumentException if the range ends past the slice
   */
  int read(ByteBuffer buffer, long position) throws IOException;

  /**
   * Writes the remaining bytes of the buffer at {@code position}.
   *
   * @return number of bytes written
   * @throws IllegalArgumentException if the range ends past the slice
   */
  int write(ByteBuffer buffer, long position) throws IOException;

  /**
   * Makes written data durable and the storage read-only from here on.
   */
  void finish() throws IOException;

  boolean isFinished();
}
