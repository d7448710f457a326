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

package com.turn.vnet.client.network;

import com.turn.vnet.common.LoggerUtils;
import com.turn.vnet.common.NodeId;
import com.turn.vnet.common.VnetLoggerFactory;
import com.turn.vnet.network.ConnectionError;
import com.turn.vnet.network.ConnectionException;
import com.turn.vnet.network.ConnectionFramework;
import com.turn.vnet.network.ConnectionStatus;
import com.turn.vnet.network.Handle;
import com.turn.vnet.network.Message;
import com.turn.vnet.network.MessageListener;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Owns the connections of a single slice download, one per node.
 *
 * <p>
 * The framework accepts a single outstanding message per connection, so
 * requests for a node are queued on its slot and sent one after the other:
 * the next queued request goes out as soon as the previous one is answered
 * or failed. Every callback is expected on the thread driving the download.
 * </p>
 */
public class SliceConnectionManager {

  private static final Logger logger = VnetLoggerFactory.getLogger(SliceConnectionManager.class);

  private final ConnectionFramework myFramework;
  @Nullable
  private final Object myConnectionParam;
  private final Map<NodeId, ConnectionSlot> mySlots = new HashMap<NodeId, ConnectionSlot>();

  public SliceConnectionManager(@NotNull ConnectionFramework framework) {
    this(framework, null);
  }

  /**
   * @param connectionParam value attached to every connection this manager creates
   */
  public SliceConnectionManager(@NotNull ConnectionFramework framework, @Nullable Object connectionParam) {
    myFramework = framework;
    myConnectionParam = connectionParam;
  }

  /**
   * Returns the slot of the node, connecting to it if there is none yet.
   * A slot whose connection the framework dropped is replaced once it has
   * nothing queued.
   *
   * @throws ConnectionException if the framework could not connect to the node
   */
  @NotNull
  public ConnectionSlot acquire(@NotNull NodeId nodeId) throws ConnectionException {
    ConnectionSlot slot = mySlots.get(nodeId);
    if (slot != null) {
      boolean idle = !slot.isBusy() && slot.getQueue().isEmpty();
      if (myFramework.isValid(slot.getConnection()) || !idle) {
        return slot;
      }
      logger.debug("connection to {} is gone, reconnecting", nodeId);
      slot.close();
      mySlots.remove(nodeId);
    }
    Handle connection = myFramework.createConnection(nodeId, myConnectionParam);
    slot = new ConnectionSlot(nodeId, connection);
    mySlots.put(nodeId, slot);
    logger.debug("connected to {}", nodeId);
    return slot;
  }

  /**
   * Queues the request on the slot, sending it right away if the slot is idle.
   * A synchronous refusal of the framework is reported to the request as a
   * failure before this method returns.
   */
  public void send(@NotNull ConnectionSlot slot, @NotNull SlotRequest request) {
    if (slot.isClosed()) {
      throw new IllegalStateException("Slot of " + slot.getNodeId() + " is released");
    }
    slot.getQueue().addLast(request);
    dispatch(slot);
  }

  /**
   * Destroys the connection of the slot. Queued requests are dropped without
   * notification and the answer to an outstanding one is ignored.
   */
  public void release(@NotNull ConnectionSlot slot) {
    if (slot.isClosed()) {
      return;
    }
    slot.close();
    mySlots.remove(slot.getNodeId());
    ConnectionStatus status = myFramework.destroyConnection(slot.getConnection());
    if (status != ConnectionStatus.SUCCESS) {
      logger.debug("destroying connection to {} returned {}", slot.getNodeId(), status);
    }
  }

  public void releaseAll() {
    for (ConnectionSlot slot : new ArrayList<ConnectionSlot>(mySlots.values())) {
      release(slot);
    }
  }

  public Collection<ConnectionSlot> getSlots() {
    return Collections.unmodifiableCollection(mySlots.values());
  }

  public int getOpenSlotCount() {
    return mySlots.size();
  }

  private void dispatch(ConnectionSlot slot) {
    if (slot.isDispatching()) {
      return;
    }
    slot.setDispatching(true);
    try {
      while (!slot.isClosed() && !slot.isBusy()) {
        SlotRequest request = slot.getQueue().pollFirst();
        if (request == null) {
          break;
        }
        if (request.isCancelled()) {
          continue;
        }
        request.markDispatched();
        Message message = Message.create(request.getType(), request.getPayload(), new SlotMessageListener(slot));
        message.setParam(request);
        slot.setInFlight(message);
        ConnectionStatus status = myFramework.sendMessage(slot.getConnection(), message);
        if (status != ConnectionStatus.SUCCESS) {
          slot.setInFlight(null);
          logger.debug("{} refused a request to {}", status, slot.getNodeId());
          notifyFailure(request, ConnectionError.fromStatus(status));
        }
      }
    } finally {
      slot.setDispatching(false);
    }
  }

  private void notifyFailure(SlotRequest request, ConnectionError error) {
    try {
      request.onFailure(error);
    } catch (RuntimeException e) {
      LoggerUtils.errorAndDebugDetails(logger, "failure handler of request threw: {}", e.toString(), e);
    }
  }

  private class SlotMessageListener implements MessageListener {

    private final ConnectionSlot mySlot;

    SlotMessageListener(ConnectionSlot slot) {
      mySlot = slot;
    }

    @Override
    public void onResponse(@NotNull Message request, @NotNull ByteBuffer payload, @NotNull Handle connection) {
      if (!complete(request)) {
        return;
      }
      try {
        ((SlotRequest) request.getParam()).onResponse(payload);
      } catch (RuntimeException e) {
        LoggerUtils.errorAndDebugDetails(logger, "response handler of request to {} threw", mySlot.getNodeId(), e);
      }
      dispatch(mySlot);
    }

    @Override
    public void onError(@NotNull Message request, @NotNull Handle connection, @NotNull ConnectionError error) {
      if (!complete(request)) {
        return;
      }
      logger.debug("request to {} failed: {}", mySlot.getNodeId(), error);
      notifyFailure((SlotRequest) request.getParam(), error);
      dispatch(mySlot);
    }

    private boolean complete(Message request) {
      if (mySlot.isClosed() || mySlot.getInFlight() != request) {
        logger.trace("ignoring late callback for {} from {}", request, mySlot.getNodeId());
        return false;
      }
      mySlot.setInFlight(null);
      return true;
    }
  }
}
