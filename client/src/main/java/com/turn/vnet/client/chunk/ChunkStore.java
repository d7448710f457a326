package com.turn.vnet.client.chunk;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Destination of downloaded chunk bytes.
 */
public interface ChunkStore {

  /**
   * Writes the chunk data at the chunk's offset in slice storage.
   *
   * @throws IOException if the data could not be stored
   */
  void store(Chunk chunk, ByteBuffer data) throws IOException;
}
