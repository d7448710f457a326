package com.turn.vnet.client.chunk;

import org.testng.annotations.Test;

import java.util.List;

import static org.testng.Assert.*;

@Test
public class ChunkPlannerTest {

  public void testTenMegabyteSlice() {
    List<Chunk> chunks = ChunkPlanner.plan(10000000, 51200);

    assertEquals(chunks.size(), 196);
    assertEquals(chunks.get(195).getOffset(), 195L * 51200);
    assertEquals(chunks.get(195).getLength(), 19200);
    assertEquals(chunks.get(195).getEnd(), 10000000);
  }

  public void testChunksTileTheSlice() {
    for (long size : new long[]{1, 99, 100, 101, 1000, 4 * 1024 * 1024 + 3}) {
      List<Chunk> chunks = ChunkPlanner.plan(size, 100);
      long expectedOffset = 0;
      for (int i = 0; i < chunks.size(); i++) {
        Chunk chunk = chunks.get(i);
        assertEquals(chunk.getIndex(), i);
        assertEquals(chunk.getOffset(), expectedOffset);
        assertTrue(chunk.getLength() > 0 && chunk.getLength() <= 100, chunk.toString());
        assertEquals(chunk.getState(), ChunkState.PENDING);
        expectedOffset = chunk.getEnd();
      }
      assertEquals(expectedOffset, size);
    }
  }

  public void testExactMultipleHasNoShortChunk() {
    List<Chunk> chunks = ChunkPlanner.plan(3 * 51200, 51200);

    assertEquals(chunks.size(), 3);
    assertEquals(chunks.get(2).getLength(), 51200);
  }

  public void testSliceAtUnsignedLimit() {
    List<Chunk> chunks = ChunkPlanner.plan(0xFFFFFFFFL, 51200);

    assertEquals(chunks.get(chunks.size() - 1).getEnd(), 0xFFFFFFFFL);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testEmptySliceIsRejected() {
    ChunkPlanner.plan(0, 51200);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testZeroChunkSizeIsRejected() {
    ChunkPlanner.plan(100, 0);
  }
}
