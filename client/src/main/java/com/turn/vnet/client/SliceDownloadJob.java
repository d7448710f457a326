package com.turn.vnet.client;

import com.turn.vnet.client.chunk.Chunk;
import com.turn.vnet.client.chunk.ChunkState;
import com.turn.vnet.common.Slice;
import org.jetbrains.annotations.Nullable;

import java.util.List;

/**
 * One slice download: what is downloaded, its chunks and its outcome.
 */
public class SliceDownloadJob {

  private final SliceTransport myTransport;
  private final Slice mySlice;
  private final SliceDownloadListener myListener;
  private final List<Chunk> myChunks;
  private final long myDeadlineMillis;
  private final long myStartTime;
  @Nullable
  private DownloadResult myResult;
  private long myFinishTime = -1;

  SliceDownloadJob(SliceTransport transport, Slice slice, SliceDownloadListener listener,
                   List<Chunk> chunks, long deadlineMillis, long startTime) {
    myTransport = transport;
    mySlice = slice;
    myListener = listener;
    myChunks = chunks;
    myDeadlineMillis = deadlineMillis;
    myStartTime = startTime;
  }

  public SliceTransport getTransport() {
    return myTransport;
  }

  public Slice getSlice() {
    return mySlice;
  }

  SliceDownloadListener getListener() {
    return myListener;
  }

  public List<Chunk> getChunks() {
    return myChunks;
  }

  public long getDeadlineMillis() {
    return myDeadlineMillis;
  }

  public long getStartTime() {
    return myStartTime;
  }

  public int countChunks(ChunkState state) {
    int count = 0;
    for (Chunk chunk : myChunks) {
      if (chunk.getState() == state) count++;
    }
    return count;
  }

  public boolean isFinished() {
    return myResult != null;
  }

  /**
   * @return the outcome, null while the download runs
   */
  @Nullable
  public DownloadResult getResult() {
    return myResult;
  }

  /**
   * @return time the outcome was set at, -1 while the download runs
   */
  public long getFinishTime() {
    return myFinishTime;
  }

  /**
   * Sets the outcome.
   *
   * @return false if an outcome was already set
   */
  boolean finish(DownloadResult result, long now) {
    if (myResult != null) {
      return false;
    }
    myResult = result;
    myFinishTime = now;
    return true;
  }

  @Override
  public String toString() {
    return "SliceDownloadJob{" +
            "slice=" + mySlice +
            ", chunks=" + myChunks.size() +
            ", deadline=" + myDeadlineMillis +
            ", result=" + myResult +
            '}';
  }
}
