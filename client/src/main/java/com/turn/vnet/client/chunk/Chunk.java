package com.turn.vnet.client.chunk;

import com.turn.vnet.network.Handle;

import java.util.ArrayList;
import java.util.List;

/**
 * A request-sized range of a slice: {@code [offset, offset + length)}.
 *
 * <p>
 * The range is immutable. The download state is owned by the job the chunk
 * belongs to and only changed by the {@link ChunkScheduler}.
 * </p>
 */
public class Chunk {

  private final int myIndex;
  private final long myOffset;
  private final int myLength;

  private ChunkState myState = ChunkState.PENDING;
  private int myRetries = 0;
  private int myConsecutiveBusy = 0;
  private final List<Handle> myLiveAttempts = new ArrayList<Handle>(1);

  public Chunk(int index, long offset, int length) {
    if (index < 0 || offset < 0 || length <= 0) {
      throw new IllegalArgumentException("Invalid chunk #" + index + " [" + offset + "+" + length + "]");
    }
    myIndex = index;
    myOffset = offset;
    myLength = length;
  }

  public int getIndex() {
    return myIndex;
  }

  public long getOffset() {
    return myOffset;
  }

  public int getLength() {
    return myLength;
  }

  public long getEnd() {
    return myOffset + myLength;
  }

  public ChunkState getState() {
    return myState;
  }

  /**
   * @return how many attempts of this chunk failed so far
   */
  public int getRetries() {
    return myRetries;
  }

  public int getConsecutiveBusy() {
    return myConsecutiveBusy;
  }

  void setState(ChunkState state) {
    myState = state;
  }

  void incrementRetries() {
    myRetries++;
  }

  int incrementConsecutiveBusy() {
    return ++myConsecutiveBusy;
  }

  void resetConsecutiveBusy() {
    myConsecutiveBusy = 0;
  }

  List<Handle> getLiveAttempts() {
    return myLiveAttempts;
  }

  @Override
  public String toString() {
    return "chunk #" + myIndex + " [" + myOffset + "+" + myLength + "] " + myState;
  }
}
