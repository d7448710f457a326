package com.turn.vnet.common;

import com.google.common.base.Preconditions;
import org.jetbrains.annotations.NotNull;

/**
 * Identifies a node in the Vnet network. Node lists handed out by a transport
 * are made of these; the connection framework resolves them to actual peers.
 */
public final class NodeId {

  @NotNull
  private final String myId;

  public NodeId(@NotNull String id) {
    Preconditions.checkNotNull(id, "node id");
    Preconditions.checkArgument(!id.isEmpty(), "node id must not be empty");
    myId = id;
  }

  @NotNull
  public String getId() {
    return myId;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    NodeId nodeId = (NodeId) o;
    return myId.equals(nodeId.myId);
  }

  @Override
  public int hashCode() {
    return myId.hashCode();
  }

  @Override
  public String toString() {
    return "NodeId{" + myId + '}';
  }
}
