package com.turn.vnet.client.peer;

import com.turn.vnet.common.NodeId;

public final class PeerCandidate {

  private final NodeId myNodeId;
  private final PeerTier myTier;

  public PeerCandidate(NodeId nodeId, PeerTier tier) {
    myNodeId = nodeId;
    myTier = tier;
  }

  public NodeId getNodeId() {
    return myNodeId;
  }

  public PeerTier getTier() {
    return myTier;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    PeerCandidate that = (PeerCandidate) o;

    if (!myNodeId.equals(that.myNodeId)) return false;
    return myTier == that.myTier;
  }

  @Override
  public int hashCode() {
    return 31 * myNodeId.hashCode() + myTier.hashCode();
  }

  @Override
  public String toString() {
    return myNodeId + "/" + myTier;
  }
}
