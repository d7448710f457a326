package com.turn.vnet.client.storage;

import com.turn.vnet.client.SliceTransport;
import com.turn.vnet.common.Slice;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * {@link SliceTransport} keeping slice bytes in {@link SliceStorage}.
 * Subclasses say where the nodes and the storage of each slice are.
 */
public abstract class StorageSliceTransport implements SliceTransport {

  /**
   * @return the storage of the slice, never null
   * @throws IOException if the storage could not be opened
   */
  protected abstract SliceStorage getStorage(Slice slice) throws IOException;

  @Override
  public void storeSliceData(Slice slice, ByteBuffer data, long offset, int length) throws IOException {
    if (data.remaining() < length) {
      throw new IllegalArgumentException("Buffer holds " + data.remaining() + " bytes, " + length + " expected");
    }
    ByteBuffer range = data.duplicate();
    range.limit(range.position() + length);
    getStorage(slice).write(range, offset);
  }

  @Override
  public int getSliceData(Slice slice, ByteBuffer out) throws IOException {
    SliceStorage storage = getStorage(slice);
    int length = (int) Math.min(out.remaining(), storage.size());
    ByteBuffer range = out.duplicate();
    range.limit(range.position() + length);
    int read = storage.read(range, 0);
    out.position(out.position() + read);
    return read;
  }
}
