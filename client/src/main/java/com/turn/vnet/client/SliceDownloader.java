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

import com.google.common.base.Preconditions;
import com.turn.vnet.client.chunk.Chunk;
import com.turn.vnet.client.chunk.ChunkPlanner;
import com.turn.vnet.client.chunk.ChunkScheduler;
import com.turn.vnet.client.chunk.ChunkStore;
import com.turn.vnet.client.network.SliceConnectionManager;
import com.turn.vnet.client.peer.NodeListSource;
import com.turn.vnet.client.peer.PeerPool;
import com.turn.vnet.common.NodeId;
import com.turn.vnet.common.Slice;
import com.turn.vnet.common.SystemTimeService;
import com.turn.vnet.common.TimeService;
import com.turn.vnet.common.VnetLoggerFactory;
import com.turn.vnet.common.protocol.FileFeedMessage;
import com.turn.vnet.network.ConnectionFramework;
import com.turn.vnet.network.TimerService;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.util.List;

/**
 * Downloads slices from the nodes of the network, chunk by chunk, within a
 * deadline.
 *
 * <p>
 * Each call of {@link #downloadSlice} starts an independent download with
 * its own connections and deadline timer. Downloads never block: progress is
 * made from the callbacks of the connection framework and of the timers,
 * which must all run on the same event thread as the call itself.
 * </p>
 */
public class SliceDownloader {

  private static final Logger logger = VnetLoggerFactory.getLogger(SliceDownloader.class);

  private final ConnectionFramework myFramework;
  private final TimerService myTimerService;
  private final TimeService myTimeService;
  private final SliceDownloadConfig myConfig;

  public SliceDownloader(@NotNull ConnectionFramework framework, @NotNull TimerService timerService) {
    this(framework, timerService, new SystemTimeService());
  }

  public SliceDownloader(@NotNull ConnectionFramework framework,
                         @NotNull TimerService timerService,
                         @NotNull TimeService timeService) {
    this(framework, timerService, timeService, SliceDownloadConfig.defaults());
  }

  public SliceDownloader(@NotNull ConnectionFramework framework,
                         @NotNull TimerService timerService,
                         @NotNull TimeService timeService,
                         @NotNull SliceDownloadConfig config) {
    myFramework = Preconditions.checkNotNull(framework, "framework");
    myTimerService = Preconditions.checkNotNull(timerService, "timerService");
    myTimeService = Preconditions.checkNotNull(timeService, "timeService");
    myConfig = Preconditions.checkNotNull(config, "config");
  }

  /**
   * Starts downloading the slice. The listener is invoked exactly once, when
   * every chunk is stored, when the deadline passes or when some chunk could
   * not be obtained from any node. If no node can be asked at all it is
   * invoked before this method returns.
   *
   * @param relativeDeadlineMillis time the download may take, from now
   * @return the running download
   * @throws NullPointerException     if an argument is null
   * @throws IllegalArgumentException if the slice is empty, the deadline not positive
   *                                  or the content id of the transport invalid
   * @throws IllegalStateException    if the deadline timer could not be started
   */
  public SliceDownloadJob downloadSlice(@NotNull final SliceTransport transport,
                                        @NotNull final Slice slice,
                                        @NotNull SliceDownloadListener listener,
                                        int relativeDeadlineMillis) {
    Preconditions.checkNotNull(transport, "transport");
    Preconditions.checkNotNull(slice, "slice");
    Preconditions.checkNotNull(listener, "listener");
    Preconditions.checkArgument(slice.getSliceSize() > 0, "%s is empty", slice);
    Preconditions.checkArgument(relativeDeadlineMillis > 0, "deadline %s is not positive", relativeDeadlineMillis);
    String contentId = transport.getContentId();
    Preconditions.checkArgument(FileFeedMessage.isValidContentId(contentId), "invalid content id %s", contentId);

    List<Chunk> chunks = ChunkPlanner.plan(slice.getSliceSize(), myConfig.getMaxChunkSize());
    SliceDownloadJob job = new SliceDownloadJob(transport, slice, listener, chunks,
            relativeDeadlineMillis, myTimeService.now());

    PeerPool peerPool = new PeerPool(new NodeListSource() {
      @Override
      public List<NodeId> getNodeList() {
        return transport.getNodeList(slice);
      }
    }, new NodeListSource() {
      @Override
      public List<NodeId> getNodeList() {
        return transport.getFallbackNodeList(slice);
      }
    });
    SliceConnectionManager connections = new SliceConnectionManager(myFramework, job);
    SliceCoordinator coordinator = new SliceCoordinator(job, myConfig, peerPool, connections, myTimeService);
    ChunkStore store = new ChunkStore() {
      @Override
      public void store(Chunk chunk, ByteBuffer data) throws IOException {
        transport.storeSliceData(slice, data, chunk.getOffset(), chunk.getLength());
      }
    };
    coordinator.setScheduler(new ChunkScheduler(contentId, slice.getSliceId(), peerPool, connections, store,
            coordinator, myTimeService, myConfig.getBusyEscalationThreshold()));
    coordinator.setMonitor(new DeadlineMonitor(myTimerService, myTimeService, coordinator,
            relativeDeadlineMillis, myConfig.getEscalationPercent()));

    logger.debug("starting download of {} with {}", slice, myConfig);
    coordinator.start();
    return job;
  }

  public SliceDownloadConfig getConfig() {
    return myConfig;
  }
}
