package com.turn.vnet.client;

import com.turn.vnet.common.NodeId;
import com.turn.vnet.common.Slice;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.List;

/**
 * The content a slice belongs to, as the download sees it: where to ask for
 * the slice and where to put its bytes.
 */
public interface SliceTransport {

  /**
   * @return the 136 character content identifier
   */
  String getContentId();

  /**
   * @return the nodes normally serving the slice, in preference order
   */
  List<NodeId> getNodeList(Slice slice);

  /**
   * @return the nodes to fall back to when the regular ones are too slow
   */
  List<NodeId> getFallbackNodeList(Slice slice);

  /**
   * Writes downloaded bytes of the slice.
   *
   * @param data   buffer holding {@code length} bytes from its position
   * @param offset offset in the slice of the first byte
   */
  void storeSliceData(Slice slice, ByteBuffer data, long offset, int length) throws IOException;

  /**
   * Reads the stored slice from its start into the buffer.
   *
   * @return number of bytes read
   */
  int getSliceData(Slice slice, ByteBuffer out) throws IOException;
}
