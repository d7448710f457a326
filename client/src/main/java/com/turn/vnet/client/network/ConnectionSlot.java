package com.turn.vnet.client.network;

import com.turn.vnet.common.NodeId;
import com.turn.vnet.network.Handle;
import com.turn.vnet.network.Message;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * One connection of a download to one node, with its request queue.
 * At most one message is outstanding on a slot at any time.
 */
public class ConnectionSlot {

  private final NodeId myNodeId;
  private final Handle myConnection;
  private final Deque<SlotRequest> myQueue = new ArrayDeque<SlotRequest>();
  @Nullable
  private Message myInFlight;
  private boolean myDispatching = false;
  private boolean myClosed = false;
  private int mySentCount = 0;

  ConnectionSlot(NodeId nodeId, Handle connection) {
    myNodeId = nodeId;
    myConnection = connection;
  }

  public NodeId getNodeId() {
    return myNodeId;
  }

  public Handle getConnection() {
    return myConnection;
  }

  public boolean isBusy() {
    return myInFlight != null;
  }

  public int getQueueSize() {
    return myQueue.size();
  }

  public boolean isClosed() {
    return myClosed;
  }

  /**
   * @return how many messages were handed to the framework on this slot
   */
  public int getSentCount() {
    return mySentCount;
  }

  Deque<SlotRequest> getQueue() {
    return myQueue;
  }

  @Nullable
  Message getInFlight() {
    return myInFlight;
  }

  void setInFlight(@Nullable Message inFlight) {
    myInFlight = inFlight;
    if (inFlight != null) {
      mySentCount++;
    }
  }

  boolean isDispatching() {
    return myDispatching;
  }

  void setDispatching(boolean dispatching) {
    myDispatching = dispatching;
  }

  void close() {
    myClosed = true;
    myInFlight = null;
    myQueue.clear();
  }

  @Override
  public String toString() {
    return "ConnectionSlot{" +
            "node=" + myNodeId +
            ", busy=" + isBusy() +
            ", queued=" + myQueue.size() +
            '}';
  }
}
