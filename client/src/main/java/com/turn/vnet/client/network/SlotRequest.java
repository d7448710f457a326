package com.turn.vnet.client.network;

import com.turn.vnet.network.ConnectionError;

import java.nio.ByteBuffer;

/**
 * A request waiting for its turn on a {@link ConnectionSlot}.
 *
 * <p>
 * The framework message is only created when the request is dispatched, so a
 * request cancelled while queued never becomes a message.
 * </p>
 */
public abstract class SlotRequest {

  private final int myType;
  private final ByteBuffer myPayload;
  private boolean myCancelled = false;
  private boolean myDispatched = false;

  protected SlotRequest(int type, ByteBuffer payload) {
    myType = type;
    myPayload = payload.asReadOnlyBuffer();
  }

  public int getType() {
    return myType;
  }

  public ByteBuffer getPayload() {
    return myPayload.duplicate();
  }

  /**
   * Keeps a queued request from being sent. Has no effect once dispatched.
   *
   * @return true if the request will not be sent
   */
  public boolean cancel() {
    if (myDispatched) {
      return false;
    }
    myCancelled = true;
    return true;
  }

  public boolean isCancelled() {
    return myCancelled;
  }

  public boolean isDispatched() {
    return myDispatched;
  }

  void markDispatched() {
    myDispatched = true;
  }

  /**
   * The peer answered the request.
   */
  protected abstract void onResponse(ByteBuffer payload);

  /**
   * The request was refused by the framework or failed on the connection.
   */
  protected abstract void onFailure(ConnectionError error);
}
