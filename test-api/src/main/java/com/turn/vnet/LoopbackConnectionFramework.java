package com.turn.vnet;

import com.turn.vnet.common.NodeId;
import com.turn.vnet.network.ConnectionError;
import com.turn.vnet.network.ConnectionException;
import com.turn.vnet.network.ConnectionFramework;
import com.turn.vnet.network.ConnectionStatus;
import com.turn.vnet.network.Handle;
import com.turn.vnet.network.HandleArena;
import com.turn.vnet.network.Message;
import com.turn.vnet.network.RequestHandlers;
import com.turn.vnet.network.Responder;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * In-process {@link ConnectionFramework} whose nodes are simulated peers.
 *
 * <p>
 * Each simulated node serves requests through its own {@link RequestHandlers}
 * table. Requests reach the node after the node's latency and answers travel
 * back on the next turn of the {@link ManualEventLoop}. Like the real
 * framework it refuses a second message on a connection that still has one
 * outstanding, and counts such refusals so tests can assert there were none.
 * </p>
 */
public class LoopbackConnectionFramework implements ConnectionFramework {

  private final ManualEventLoop myLoop;
  private final Map<NodeId, SimulatedNode> myNodes = new HashMap<NodeId, SimulatedNode>();
  private final HandleArena<LoopbackConnection> myConnections = new HandleArena<LoopbackConnection>();
  private final List<SentRequest> mySentRequests = new ArrayList<SentRequest>();
  private int myCreatedConnections = 0;
  private int myConcurrentSendRefusals = 0;

  public LoopbackConnectionFramework(ManualEventLoop loop) {
    myLoop = loop;
  }

  public SimulatedNode addNode(NodeId nodeId, RequestHandlers handlers, long latencyMillis) {
    SimulatedNode node = new SimulatedNode(nodeId, handlers, latencyMillis);
    myNodes.put(nodeId, node);
    return node;
  }

  @Nullable
  public SimulatedNode getNode(NodeId nodeId) {
    return myNodes.get(nodeId);
  }

  @NotNull
  @Override
  public Handle createConnection(@NotNull NodeId nodeId, @Nullable Object param) throws ConnectionException {
    SimulatedNode node = myNodes.get(nodeId);
    if (node == null || node.unreachable) {
      throw new ConnectionException(nodeId, ConnectionError.CANTCONNECT);
    }
    myCreatedConnections++;
    return myConnections.insert(new LoopbackConnection(node, param));
  }

  @Override
  public ConnectionStatus destroyConnection(@NotNull final Handle connection) {
    final LoopbackConnection removed = myConnections.remove(connection);
    if (removed == null) {
      return ConnectionStatus.INVALID_HANDLE;
    }
    final Message abandoned = removed.outstanding;
    removed.outstanding = null;
    if (abandoned != null) {
      myLoop.post(new Runnable() {
        @Override
        public void run() {
          abandoned.getListener().onError(abandoned, connection, ConnectionError.DESTROY);
        }
      });
    }
    return ConnectionStatus.SUCCESS;
  }

  @Override
  public ConnectionStatus sendMessage(@NotNull final Handle connection, @NotNull final Message message) {
    final LoopbackConnection conn = myConnections.get(connection);
    if (conn == null) {
      return ConnectionStatus.INVALID_HANDLE;
    }
    if (conn.outstanding != null) {
      myConcurrentSendRefusals++;
      return ConnectionStatus.FAILURE;
    }
    if (!message.markSent()) {
      return ConnectionStatus.FAILURE;
    }
    conn.outstanding = message;
    final SimulatedNode node = conn.node;
    mySentRequests.add(new SentRequest(node.nodeId, message, myLoop.now()));
    myLoop.schedule(node.latencyMillis, new Runnable() {
      @Override
      public void run() {
        if (conn.outstanding != message) {
          return;
        }
        node.requestCount++;
        if (node.failure != null) {
          complete(connection, conn, message, null, node.failure);
          return;
        }
        if (node.silent) {
          return;
        }
        node.handlers.dispatch(message.getType(), message.getPayload(), new Responder() {
          @Override
          public void respond(int type, ByteBuffer payload) {
            complete(connection, conn, message, payload, null);
          }

          @Override
          public void reject(ConnectionError error) {
            complete(connection, conn, message, null, error);
          }
        });
      }
    });
    return ConnectionStatus.SUCCESS;
  }

  @Override
  public boolean isValid(@Nullable Handle connection) {
    return myConnections.contains(connection);
  }

  @Nullable
  @Override
  public NodeId getPeerNodeId(@NotNull Handle connection) {
    LoopbackConnection conn = myConnections.get(connection);
    return conn == null ? null : conn.node.nodeId;
  }

  @Nullable
  @Override
  public Object getParam(@NotNull Handle connection) {
    LoopbackConnection conn = myConnections.get(connection);
    return conn == null ? null : conn.param;
  }

  public int getOpenConnectionCount() {
    return myConnections.size();
  }

  public int getCreatedConnectionCount() {
    return myCreatedConnections;
  }

  /**
   * @return how many sends were refused because the connection already had a message outstanding
   */
  public int getConcurrentSendRefusals() {
    return myConcurrentSendRefusals;
  }

  public List<SentRequest> getSentRequests() {
    return Collections.unmodifiableList(mySentRequests);
  }

  public List<SentRequest> getSentRequests(NodeId nodeId) {
    List<SentRequest> result = new ArrayList<SentRequest>();
    for (SentRequest request : mySentRequests) {
      if (request.getNodeId().equals(nodeId)) {
        result.add(request);
      }
    }
    return result;
  }

  private void complete(final Handle connection, final LoopbackConnection conn, final Message message,
                        @Nullable final ByteBuffer payload, @Nullable final ConnectionError error) {
    myLoop.post(new Runnable() {
      @Override
      public void run() {
        if (conn.outstanding != message || !myConnections.contains(connection)) {
          return;
        }
        conn.outstanding = null;
        if (error != null) {
          message.getListener().onError(message, connection, error);
        } else {
          message.getListener().onResponse(message, payload, connection);
        }
      }
    });
  }

  public static final class SimulatedNode {
    private final NodeId nodeId;
    private final RequestHandlers handlers;
    private volatile long latencyMillis;
    private volatile boolean unreachable;
    private volatile boolean silent;
    @Nullable
    private volatile ConnectionError failure;
    private int requestCount;

    private SimulatedNode(NodeId nodeId, RequestHandlers handlers, long latencyMillis) {
      this.nodeId = nodeId;
      this.handlers = handlers;
      this.latencyMillis = latencyMillis;
    }

    public NodeId getNodeId() {
      return nodeId;
    }

    public void setLatency(long latencyMillis) {
      this.latencyMillis = latencyMillis;
    }

    /**
     * New connections to an unreachable node fail with {@link ConnectionError#CANTCONNECT}.
     */
    public void setUnreachable(boolean unreachable) {
      this.unreachable = unreachable;
    }

    /**
     * A silent node accepts requests and never answers them.
     */
    public void setSilent(boolean silent) {
      this.silent = silent;
    }

    /**
     * Requests reaching the node fail with the given error, null to serve them again.
     */
    public void setFailure(@Nullable ConnectionError failure) {
      this.failure = failure;
    }

    public int getRequestCount() {
      return requestCount;
    }
  }

  public static final class SentRequest {
    private final NodeId nodeId;
    private final Message message;
    private final long time;

    private SentRequest(NodeId nodeId, Message message, long time) {
      this.nodeId = nodeId;
      this.message = message;
      this.time = time;
    }

    public NodeId getNodeId() {
      return nodeId;
    }

    public Message getMessage() {
      return message;
    }

    public long getTime() {
      return time;
    }
  }

  private static final class LoopbackConnection {
    private final SimulatedNode node;
    @Nullable
    private final Object param;
    @Nullable
    private Message outstanding;

    private LoopbackConnection(SimulatedNode node, @Nullable Object param) {
      this.node = node;
      this.param = param;
    }
  }
}
