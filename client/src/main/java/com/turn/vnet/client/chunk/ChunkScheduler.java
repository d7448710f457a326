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

package com.turn.vnet.client.chunk;

import com.turn.vnet.Constants;
import com.turn.vnet.client.network.ConnectionSlot;
import com.turn.vnet.client.network.SliceConnectionManager;
import com.turn.vnet.client.network.SlotRequest;
import com.turn.vnet.client.peer.PeerCandidate;
import com.turn.vnet.client.peer.PeerPool;
import com.turn.vnet.client.peer.PeerTier;
import com.turn.vnet.common.LoggerUtils;
import com.turn.vnet.common.TimeService;
import com.turn.vnet.common.VnetLoggerFactory;
import com.turn.vnet.common.protocol.FileFeedMessage;
import com.turn.vnet.network.ConnectionError;
import com.turn.vnet.network.ConnectionException;
import com.turn.vnet.network.Handle;
import com.turn.vnet.network.HandleArena;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.text.ParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Moves the chunks of one slice download through their states.
 *
 * <p>
 * {@link #schedule(Chunk)} assigns a pending chunk to the next candidate of
 * the peer pool and queues its request on the connection of that peer. The
 * answer either stores the chunk or sends it back to pending, from where it
 * is assigned again:
 * </p>
 * <ul>
 * <li>busy or "no slice" refusals and connection errors exclude the peer
 * for that chunk. Refusals from consecutive regular peers also count
 * towards escalation;</li>
 * <li>a failure of the local storage retries the chunk without blaming the
 * peer.</li>
 * </ul>
 *
 * <p>
 * Outstanding attempts are kept in a {@link HandleArena}. Requests carry the
 * handle of their attempt, so an answer arriving after its attempt was
 * dropped resolves to nothing and is ignored.
 * </p>
 */
public class ChunkScheduler {

  private static final Logger logger = VnetLoggerFactory.getLogger(ChunkScheduler.class);

  private final String myContentId;
  private final int mySliceId;
  private final PeerPool myPeerPool;
  private final SliceConnectionManager myConnections;
  private final ChunkStore myStore;
  private final ChunkListener myListener;
  private final TimeService myTimeService;
  private final int myBusyEscalationThreshold;
  private final HandleArena<Attempt> myAttempts = new HandleArena<Attempt>();
  private boolean myClosed = false;

  public ChunkScheduler(@NotNull String contentId,
                        int sliceId,
                        @NotNull PeerPool peerPool,
                        @NotNull SliceConnectionManager connections,
                        @NotNull ChunkStore store,
                        @NotNull ChunkListener listener,
                        @NotNull TimeService timeService,
                        int busyEscalationThreshold) {
    if (busyEscalationThreshold < 1) {
      throw new IllegalArgumentException("Busy escalation threshold must be at least 1, got " + busyEscalationThreshold);
    }
    myContentId = contentId;
    mySliceId = sliceId;
    myPeerPool = peerPool;
    myConnections = connections;
    myStore = store;
    myListener = listener;
    myTimeService = timeService;
    myBusyEscalationThreshold = busyEscalationThreshold;
  }

  /**
   * Assigns a pending chunk to a peer and queues its request.
   *
   * <p>
   * Before escalation only regular peers are considered. Running out of them
   * asks the listener to escalate, after which fallback peers are preferred
   * and the remaining regular peers tried last. A chunk with no candidate
   * left in either tier becomes {@link ChunkState#FAILED}.
   * </p>
   */
  public void schedule(@NotNull Chunk chunk) {
    while (!myClosed && chunk.getState() == ChunkState.PENDING) {
      PeerCandidate candidate = pickCandidate(chunk);
      if (candidate == null) {
        if (!myPeerPool.isFallbackActive()) {
          myListener.escalationRequested(chunk, "no regular node left for " + chunk);
          if (!myPeerPool.isFallbackActive()) {
            // escalation refused, the chunk waits for it
            return;
          }
          continue;
        }
        logger.debug("no node of either tier left for {}", chunk);
        chunk.setState(ChunkState.FAILED);
        myListener.chunkFailed(chunk);
        return;
      }
      ConnectionSlot slot;
      try {
        slot = myConnections.acquire(candidate.getNodeId());
      } catch (ConnectionException e) {
        LoggerUtils.warnWithMessageAndDebugDetails(logger, "unable to connect to {}", candidate.getNodeId(), e);
        chunk.incrementRetries();
        myPeerPool.markFailed(chunk, candidate.getNodeId());
        continue;
      }
      assign(chunk, candidate, slot);
    }
  }

  /**
   * Starts a second, fallback attempt for every in flight chunk whose
   * regular attempt was assigned at least {@code softTimeoutMillis} ago.
   * The first answer of either attempt stores the chunk. Errors of the
   * superseded attempt are ignored.
   *
   * @return the number of chunks reassigned
   */
  public int reassignStale(@NotNull Collection<Chunk> chunks, long softTimeoutMillis) {
    if (myClosed || !myPeerPool.isFallbackActive()) {
      return 0;
    }
    long now = myTimeService.now();
    int reassigned = 0;
    for (Chunk chunk : chunks) {
      if (myClosed) break;
      if (chunk.getState() != ChunkState.IN_FLIGHT) continue;
      Handle currentHandle = currentAttempt(chunk);
      Attempt current = myAttempts.get(currentHandle);
      if (current == null || current.getCandidate().getTier() != PeerTier.REGULAR) continue;
      if (now - current.getAssignedAt() < softTimeoutMillis) continue;

      PeerCandidate candidate = myPeerPool.nextCandidate(chunk, PeerTier.FALLBACK);
      if (candidate == null || candidate.getNodeId().equals(current.getCandidate().getNodeId())) continue;
      ConnectionSlot slot;
      try {
        slot = myConnections.acquire(candidate.getNodeId());
      } catch (ConnectionException e) {
        LoggerUtils.warnWithMessageAndDebugDetails(logger, "unable to connect to {}", candidate.getNodeId(), e);
        myPeerPool.markFailed(chunk, candidate.getNodeId());
        continue;
      }
      current.setSuperseded();
      if (current.getSlotRequest().cancel()) {
        // never left the queue, nothing to wait for
        dropAttempt(currentHandle);
      }
      logger.debug("{} is stale after {} ms, also asking {}", current, now - current.getAssignedAt(), candidate);
      assign(chunk, candidate, slot);
      reassigned++;
    }
    return reassigned;
  }

  /**
   * Stops all processing. Answers arriving afterwards are ignored.
   */
  public void close() {
    myClosed = true;
    for (Handle handle : myAttempts.handles()) {
      Attempt attempt = myAttempts.remove(handle);
      if (attempt != null) {
        attempt.getSlotRequest().cancel();
        attempt.getChunk().getLiveAttempts().clear();
      }
    }
  }

  public boolean isClosed() {
    return myClosed;
  }

  public int getOutstandingAttemptCount() {
    return myAttempts.size();
  }

  @Nullable
  public Attempt getAttempt(@Nullable Handle handle) {
    return myAttempts.get(handle);
  }

  @Nullable
  private PeerCandidate pickCandidate(Chunk chunk) {
    if (!myPeerPool.isFallbackActive()) {
      return myPeerPool.nextCandidate(chunk, PeerTier.REGULAR);
    }
    PeerCandidate candidate = myPeerPool.nextCandidate(chunk, PeerTier.FALLBACK);
    if (candidate == null) {
      candidate = myPeerPool.nextCandidate(chunk, PeerTier.REGULAR);
    }
    return candidate;
  }

  private void assign(Chunk chunk, PeerCandidate candidate, ConnectionSlot slot) {
    FileFeedMessage.RequestMessage request = FileFeedMessage.RequestMessage.craft(
            myContentId, mySliceId, chunk.getOffset(), chunk.getLength());
    Attempt attempt = new Attempt(chunk, candidate, slot, request, myTimeService.now());
    Handle handle = myAttempts.insert(attempt);
    attempt.setSlotRequest(new ChunkRequest(handle, request.getData()));
    chunk.getLiveAttempts().add(handle);
    chunk.setState(ChunkState.IN_FLIGHT);
    logger.trace("assigned {} to {}", chunk, candidate);
    myConnections.send(slot, attempt.getSlotRequest());
  }

  @Nullable
  private Handle currentAttempt(Chunk chunk) {
    List<Handle> live = chunk.getLiveAttempts();
    for (int i = live.size() - 1; i >= 0; i--) {
      Attempt attempt = myAttempts.get(live.get(i));
      if (attempt != null && !attempt.isSuperseded()) {
        return live.get(i);
      }
    }
    return null;
  }

  @Nullable
  private Attempt dropAttempt(Handle handle) {
    Attempt attempt = myAttempts.remove(handle);
    if (attempt != null) {
      attempt.getChunk().getLiveAttempts().remove(handle);
    }
    return attempt;
  }

  private void onResponse(Handle handle, ByteBuffer payload) {
    if (myClosed) return;
    Attempt attempt = myAttempts.get(handle);
    if (attempt == null) {
      logger.trace("ignoring answer of a dropped attempt");
      return;
    }
    Chunk chunk = attempt.getChunk();
    if (chunk.getState() == ChunkState.STORED) {
      dropAttempt(handle);
      return;
    }

    FileFeedMessage.ResponseMessage response;
    try {
      response = FileFeedMessage.ResponseMessage.parse(payload);
    } catch (ParseException e) {
      LoggerUtils.warnWithMessageAndDebugDetails(logger, "malformed answer from {}",
              attempt.getCandidate().getNodeId(), e);
      onFailure(handle, Failure.PEER);
      return;
    }

    if (response.isNodeBusy()) {
      logger.debug("{} is busy, {}", attempt.getCandidate(), chunk);
      onFailure(handle, Failure.SOFT);
      return;
    }
    if (response.isNoSliceAvailable()) {
      logger.debug("{} does not have the slice, {}", attempt.getCandidate(), chunk);
      onFailure(handle, Failure.SOFT);
      return;
    }
    if (!response.answers(attempt.getRequest())) {
      logger.warn("{} answered {} with {}", new Object[]{attempt.getCandidate(), chunk, response});
      onFailure(handle, Failure.PEER);
      return;
    }

    try {
      myStore.store(chunk, response.getChunkData());
    } catch (IOException e) {
      LoggerUtils.warnWithMessageAndDebugDetails(logger, "unable to store {}", chunk, e);
      onFailure(handle, Failure.STORAGE);
      return;
    } catch (RuntimeException e) {
      LoggerUtils.errorAndDebugDetails(logger, "storing {} threw " + e, chunk, e);
      onFailure(handle, Failure.STORAGE);
      return;
    }
    if (myClosed) return;

    chunk.setState(ChunkState.STORED);
    for (Handle live : new ArrayList<Handle>(chunk.getLiveAttempts())) {
      Attempt other = dropAttempt(live);
      if (other != null && other != attempt) {
        other.getSlotRequest().cancel();
      }
    }
    myPeerPool.forget(chunk);
    logger.trace("stored {} from {}", chunk, attempt.getCandidate());
    myListener.chunkStored(chunk);
  }

  private void onFailure(Handle handle, Failure failure) {
    if (myClosed) return;
    Attempt attempt = dropAttempt(handle);
    if (attempt == null) {
      return;
    }
    Chunk chunk = attempt.getChunk();
    if (attempt.isSuperseded()) {
      logger.trace("ignoring {} failure of {}", failure, attempt);
      return;
    }
    if (chunk.getState() != ChunkState.IN_FLIGHT) {
      return;
    }
    chunk.incrementRetries();
    boolean escalate = false;
    switch (failure) {
      case SOFT:
        myPeerPool.markFailed(chunk, attempt.getCandidate().getNodeId());
        if (attempt.getCandidate().getTier() == PeerTier.REGULAR
                && chunk.incrementConsecutiveBusy() >= myBusyEscalationThreshold) {
          escalate = !myPeerPool.isFallbackActive();
        }
        break;
      case PEER:
        myPeerPool.markFailed(chunk, attempt.getCandidate().getNodeId());
        chunk.resetConsecutiveBusy();
        break;
      case STORAGE:
        break;
    }
    chunk.setState(ChunkState.PENDING);
    if (escalate) {
      myListener.escalationRequested(chunk, chunk.getConsecutiveBusy() + " regular nodes in a row refused " + chunk);
    }
    schedule(chunk);
  }

  private enum Failure {
    SOFT,
    PEER,
    STORAGE
  }

  private class ChunkRequest extends SlotRequest {

    private final Handle myAttempt;

    ChunkRequest(Handle attempt, ByteBuffer payload) {
      super(Constants.FILE_FEED_REQUEST, payload);
      myAttempt = attempt;
    }

    @Override
    protected void onResponse(ByteBuffer payload) {
      ChunkScheduler.this.onResponse(myAttempt, payload);
    }

    @Override
    protected void onFailure(ConnectionError error) {
      logger.debug("request of {} failed with {}", myAttempts.get(myAttempt), error);
      ChunkScheduler.this.onFailure(myAttempt, Failure.PEER);
    }
  }
}
