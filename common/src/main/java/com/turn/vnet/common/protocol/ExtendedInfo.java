package com.turn.vnet.common.protocol;

import java.nio.ByteBuffer;

/**
 * Out-of-band status record appended to a FILE_FEED response.
 *
 * <code>&lt;id:uint8&gt;&lt;size:netlong&gt;&lt;data&gt;</code>
 */
public final class ExtendedInfo {

  public static final int NODE_BUSY_ID = 1;
  public static final int NODE_BUSY_DATA_SIZE = 4;
  public static final int NO_SLICE_AVAILABLE_ID = 128;

  /** Size of the id and size fields preceding the record data. */
  public static final int RECORD_HEADER_SIZE = 5;

  private final int id;
  private final ByteBuffer data;

  public ExtendedInfo(int id, ByteBuffer data) {
    if (id < 0 || id > 0xFF) {
      throw new IllegalArgumentException("Extended info id " + id + " does not fit in a byte");
    }
    this.id = id;
    this.data = data.asReadOnlyBuffer();
  }

  /**
   * @param hint opaque value the busy node attaches to its refusal
   */
  public static ExtendedInfo nodeBusy(int hint) {
    ByteBuffer data = ByteBuffer.allocate(NODE_BUSY_DATA_SIZE);
    data.putInt(hint);
    data.flip();
    return new ExtendedInfo(NODE_BUSY_ID, data);
  }

  public static ExtendedInfo noSliceAvailable() {
    return new ExtendedInfo(NO_SLICE_AVAILABLE_ID, ByteBuffer.allocate(0));
  }

  public int getId() {
    return id;
  }

  public ByteBuffer getData() {
    return data.duplicate();
  }

  public int getEncodedSize() {
    return RECORD_HEADER_SIZE + data.remaining();
  }

  public boolean isNodeBusy() {
    return id == NODE_BUSY_ID;
  }

  public boolean isNoSliceAvailable() {
    return id == NO_SLICE_AVAILABLE_ID;
  }

  void writeTo(ByteBuffer buffer) {
    buffer.put((byte) id);
    buffer.putInt(data.remaining());
    buffer.put(data.duplicate());
  }

  @Override
  public String toString() {
    if (isNodeBusy() && data.remaining() == NODE_BUSY_DATA_SIZE) {
      return "NODE_BUSY(" + data.getInt(data.position()) + ")";
    }
    if (isNoSliceAvailable()) {
      return "NO_SLICE_AVAILABLE";
    }
    return "EXTENDED_INFO#" + id + "[" + data.remaining() + "]";
  }
}
