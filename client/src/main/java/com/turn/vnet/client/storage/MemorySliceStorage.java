package com.turn.vnet.client.storage;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Slice held in a byte array, for slices small enough to keep in memory.
 */
public class MemorySliceStorage implements SliceStorage {

  private final byte[] myData;
  private volatile boolean myFinished = false;
  private volatile boolean myClosed = false;

  public MemorySliceStorage(int size) {
    this(new byte[size]);
  }

  /**
   * Wraps existing slice data, without copying it.
   */
  public MemorySliceStorage(byte[] data) {
    myData = data;
  }

  @Override
  public long size() {
    return myData.length;
  }

  @Override
  public synchronized int read(ByteBuffer buffer, long position) throws IOException {
    checkOpen();
    int length = buffer.remaining();
    checkRange(position, length);
    buffer.put(myData, (int) position, length);
    return length;
  }

  @Override
  public synchronized int write(ByteBuffer buffer, long position) throws IOException {
    checkOpen();
    if (myFinished) {
      throw new IOException("Slice storage is finished");
    }
    int length = buffer.remaining();
    checkRange(position, length);
    buffer.get(myData, (int) position, length);
    return length;
  }

  @Override
  public void finish() {
    myFinished = true;
  }

  @Override
  public boolean isFinished() {
    return myFinished;
  }

  @Override
  public void close() {
    myClosed = true;
  }

  /**
   * @return a copy of the slice data
   */
  public synchronized byte[] getData() {
    return myData.clone();
  }

  private void checkOpen() throws IOException {
    if (myClosed) {
      throw new IOException("Slice storage is closed");
    }
  }

  private void checkRange(long position, int length) {
    if (position < 0 || position + length > myData.length) {
      throw new IllegalArgumentException("Range [" + position + "+" + length + "] is outside of the "
              + myData.length + " bytes slice");
    }
  }
}
