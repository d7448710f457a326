package com.turn.vnet.client.chunk;

import com.google.common.collect.ImmutableList;
import com.google.common.math.LongMath;

import java.math.RoundingMode;
import java.util.List;

/**
 * Splits a slice into the chunks requested from peers.
 */
public final class ChunkPlanner {

  private ChunkPlanner() {
  }

  /**
   * Cuts {@code [0, sliceSize)} into contiguous chunks of {@code maxChunkSize}
   * bytes, the last one possibly shorter.
   *
   * @throws IllegalArgumentException if either size is not positive
   */
  public static List<Chunk> plan(long sliceSize, int maxChunkSize) {
    if (sliceSize <= 0) {
      throw new IllegalArgumentException("Slice size must be positive, got " + sliceSize);
    }
    if (maxChunkSize <= 0) {
      throw new IllegalArgumentException("Chunk size must be positive, got " + maxChunkSize);
    }
    long count = LongMath.divide(sliceSize, maxChunkSize, RoundingMode.CEILING);
    if (count > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("Slice of " + sliceSize + " bytes needs too many chunks of " + maxChunkSize);
    }
    ImmutableList.Builder<Chunk> chunks = ImmutableList.builder();
    long offset = 0;
    for (int index = 0; index < count; index++) {
      int length = (int) Math.min(maxChunkSize, sliceSize - offset);
      chunks.add(new Chunk(index, offset, length));
      offset += length;
    }
    return chunks.build();
  }
}
