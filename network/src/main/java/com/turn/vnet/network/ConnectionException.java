package com.turn.vnet.network;

import com.turn.vnet.common.NodeId;

import java.io.IOException;

/**
 * Thrown when the framework could not establish a connection to a node.
 */
public class ConnectionException extends IOException {

  private static final long serialVersionUID = -1;

  private final NodeId nodeId;
  private final ConnectionError error;

  public ConnectionException(NodeId nodeId, ConnectionError error) {
    super("Unable to connect to " + nodeId + ": " + error);
    this.nodeId = nodeId;
    this.error = error;
  }

  public ConnectionException(NodeId nodeId, ConnectionError error, Throwable cause) {
    super("Unable to connect to " + nodeId + ": " + error, cause);
    this.nodeId = nodeId;
    this.error = error;
  }

  public NodeId getNodeId() {
    return nodeId;
  }

  public ConnectionError getError() {
    return error;
  }
}
