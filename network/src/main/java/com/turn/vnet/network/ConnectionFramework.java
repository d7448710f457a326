package com.turn.vnet.network;

import com.turn.vnet.common.NodeId;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

/**
 * The node's connection framework, as seen by modules.
 *
 * <p>
 * To talk to a node a module creates a connection and sends messages on it;
 * responses and errors come back through the {@link MessageListener} of each
 * message. A connection carries at most one outstanding message at a time: a
 * second send before the first one completed is refused. The module that
 * created a connection destroys it.
 * </p>
 */
public interface ConnectionFramework {

  /**
   * Creates a connection and establishes it with the given node.
   *
   * @param nodeId node to connect to
   * @param param  state kept with the connection, see {@link #getParam(Handle)}
   * @return handle of the new connection
   * @throws ConnectionException if the node can't be connected
   */
  @NotNull
  Handle createConnection(@NotNull NodeId nodeId, @Nullable Object param) throws ConnectionException;

  /**
   * Closes the connection. Messages still outstanding on it are abandoned.
   */
  ConnectionStatus destroyConnection(@NotNull Handle connection);

  /**
   * Sends a message on a connection. Completion is reported later through the
   * message's listener, never from inside this call.
   */
  ConnectionStatus sendMessage(@NotNull Handle connection, @NotNull Message message);

  boolean isValid(@Nullable Handle connection);

  @Nullable
  NodeId getPeerNodeId(@NotNull Handle connection);

  @Nullable
  Object getParam(@NotNull Handle connection);
}
