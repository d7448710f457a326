/*
 * Copyright 2000-2018 JetBrains s.r.o.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.turn.vnet.client;

import com.turn.vnet.client.chunk.Chunk;
import com.turn.vnet.client.chunk.ChunkListener;
import com.turn.vnet.client.chunk.ChunkScheduler;
import com.turn.vnet.client.chunk.ChunkState;
import com.turn.vnet.client.network.SliceConnectionManager;
import com.turn.vnet.client.peer.PeerPool;
import com.turn.vnet.common.LoggerUtils;
import com.turn.vnet.common.TimeService;
import com.turn.vnet.common.VnetLoggerFactory;
import org.slf4j.Logger;

/**
 * Drives one {@link SliceDownloadJob} from start to its single outcome.
 *
 * <p>
 * The coordinator seeds every chunk on the regular tier, reacts to the
 * escalation and expiry signals of the {@link DeadlineMonitor} and counts
 * stored and failed chunks. Whatever ends the download first wins; the
 * outcome is set once, the listener is notified once and every connection
 * of the download is released afterwards.
 * </p>
 */
class SliceCoordinator implements ChunkListener, DeadlineListener {

  private static final Logger logger = VnetLoggerFactory.getLogger(SliceCoordinator.class);

  private final SliceDownloadJob myJob;
  private final SliceDownloadConfig myConfig;
  private final PeerPool myPeerPool;
  private final SliceConnectionManager myConnections;
  private final TimeService myTimeService;
  private ChunkScheduler myScheduler;
  private DeadlineMonitor myMonitor;
  private int myStoredCount = 0;
  private int myFailedCount = 0;

  SliceCoordinator(SliceDownloadJob job,
                   SliceDownloadConfig config,
                   PeerPool peerPool,
                   SliceConnectionManager connections,
                   TimeService timeService) {
    myJob = job;
    myConfig = config;
    myPeerPool = peerPool;
    myConnections = connections;
    myTimeService = timeService;
  }

  void setScheduler(ChunkScheduler scheduler) {
    myScheduler = scheduler;
  }

  void setMonitor(DeadlineMonitor monitor) {
    myMonitor = monitor;
  }

  /**
   * Starts the deadline and assigns every chunk. The download may be
   * finished when this returns, if no node could be asked for some chunk.
   */
  void start() {
    myMonitor.start();
    int regular = myPeerPool.loadRegular();
    logger.debug("downloading {} in {} chunks from {} regular nodes",
            new Object[]{myJob.getSlice(), myJob.getChunks().size(), regular});
    if (regular == 0) {
      logger.debug("no regular node for {}, escalating right away", myJob.getSlice());
      myMonitor.escalateNow();
    }
    for (Chunk chunk : myJob.getChunks()) {
      if (myJob.isFinished()) break;
      myScheduler.schedule(chunk);
    }
  }

  @Override
  public void escalate() {
    if (myJob.isFinished()) return;
    int fallback = myPeerPool.activateFallback();
    logger.info("escalating download of {} after {} ms: {} fallback nodes, {}/{} chunks stored",
            new Object[]{myJob.getSlice(), myTimeService.now() - myJob.getStartTime(), fallback,
                    myStoredCount, myJob.getChunks().size()});
    int reassigned = myScheduler.reassignStale(myJob.getChunks(), myConfig.getAttemptSoftTimeoutMillis());
    if (reassigned > 0) {
      logger.debug("{} stale chunks also asked from the fallback tier", reassigned);
    }
    for (Chunk chunk : myJob.getChunks()) {
      if (myJob.isFinished()) break;
      if (chunk.getState() == ChunkState.PENDING) {
        myScheduler.schedule(chunk);
      }
    }
  }

  @Override
  public void expire() {
    logger.info("deadline of {} ms exceeded for {}, {}/{} chunks stored",
            new Object[]{myJob.getDeadlineMillis(), myJob.getSlice(), myStoredCount, myJob.getChunks().size()});
    finish(DownloadResult.DEADLINE_EXCEEDED);
  }

  @Override
  public void chunkStored(Chunk chunk) {
    myStoredCount++;
    if (myStoredCount == myJob.getChunks().size()) {
      finish(DownloadResult.SUCCESS);
    } else {
      checkExhausted();
    }
  }

  @Override
  public void chunkFailed(Chunk chunk) {
    myFailedCount++;
    logger.warn("{} of {} failed on every node", chunk, myJob.getSlice());
    checkExhausted();
  }

  @Override
  public void escalationRequested(Chunk chunk, String reason) {
    if (myJob.isFinished()) return;
    if (!myMonitor.isEscalated()) {
      logger.debug("escalation requested: {}", reason);
    }
    myMonitor.escalateNow();
  }

  private void checkExhausted() {
    if (myFailedCount == 0 || myStoredCount + myFailedCount < myJob.getChunks().size()) {
      return;
    }
    finish(myPeerPool.hasOffered() ? DownloadResult.TRANSPORT_FAILURE : DownloadResult.NO_NODES_AVAILABLE);
  }

  private void finish(DownloadResult result) {
    if (!myJob.finish(result, myTimeService.now())) {
      return;
    }
    myMonitor.cancel();
    myScheduler.close();
    logger.debug("download of {} finished with {} after {} ms",
            new Object[]{myJob.getSlice(), result, myJob.getFinishTime() - myJob.getStartTime()});
    try {
      myJob.getListener().downloadComplete(result, myJob.getTransport(), myJob.getSlice());
    } catch (Throwable e) {
      LoggerUtils.errorAndDebugDetails(logger, "listener of {} threw on completion", myJob.getSlice(), e);
    } finally {
      myConnections.releaseAll();
    }
  }
}
