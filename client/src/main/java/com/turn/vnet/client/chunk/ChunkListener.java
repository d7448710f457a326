package com.turn.vnet.client.chunk;

/**
 * Receives the chunk transitions that matter to the whole slice download.
 */
public interface ChunkListener {

  void chunkStored(Chunk chunk);

  void chunkFailed(Chunk chunk);

  /**
   * invoked when the regular tier can't be relied on for a chunk any more:
   * too many busy peers in a row, or no regular candidate left for it
   */
  void escalationRequested(Chunk chunk, String reason);
}
