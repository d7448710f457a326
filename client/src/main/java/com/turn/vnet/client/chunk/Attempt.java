package com.turn.vnet.client.chunk;

import com.turn.vnet.client.network.ConnectionSlot;
import com.turn.vnet.client.network.SlotRequest;
import com.turn.vnet.client.peer.PeerCandidate;
import com.turn.vnet.common.protocol.FileFeedMessage;

/**
 * One request of a chunk to one peer.
 */
public class Attempt {

  private final Chunk myChunk;
  private final PeerCandidate myCandidate;
  private final ConnectionSlot mySlot;
  private final FileFeedMessage.RequestMessage myRequest;
  private final long myAssignedAt;
  private final int myPriorRetries;
  private SlotRequest mySlotRequest;
  private boolean mySuperseded = false;

  Attempt(Chunk chunk, PeerCandidate candidate, ConnectionSlot slot,
          FileFeedMessage.RequestMessage request, long assignedAt) {
    myChunk = chunk;
    myCandidate = candidate;
    mySlot = slot;
    myRequest = request;
    myAssignedAt = assignedAt;
    myPriorRetries = chunk.getRetries();
  }

  public Chunk getChunk() {
    return myChunk;
  }

  public PeerCandidate getCandidate() {
    return myCandidate;
  }

  public ConnectionSlot getSlot() {
    return mySlot;
  }

  public FileFeedMessage.RequestMessage getRequest() {
    return myRequest;
  }

  public long getAssignedAt() {
    return myAssignedAt;
  }

  public int getPriorRetries() {
    return myPriorRetries;
  }

  /**
   * @return true once another attempt of the same chunk was started on the fallback tier
   */
  public boolean isSuperseded() {
    return mySuperseded;
  }

  void setSuperseded() {
    mySuperseded = true;
  }

  SlotRequest getSlotRequest() {
    return mySlotRequest;
  }

  void setSlotRequest(SlotRequest slotRequest) {
    mySlotRequest = slotRequest;
  }

  @Override
  public String toString() {
    return "attempt of chunk #" + myChunk.getIndex() + " on " + myCandidate +
            (mySuperseded ? " (superseded)" : "");
  }
}
