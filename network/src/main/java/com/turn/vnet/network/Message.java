package com.turn.vnet.network;

import com.google.common.base.Preconditions;
import com.turn.vnet.Constants;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.nio.ByteBuffer;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * A message between two nodes, at module level.
 *
 * <p>
 * A message is single use: it is handed to the framework exactly once and
 * dropped after its response or error has been delivered. {@link #markSent()}
 * is how framework implementations enforce that.
 * </p>
 */
public final class Message {

  private final int myType;
  private final ByteBuffer myPayload;
  private final MessageListener myListener;
  private final AtomicBoolean mySent = new AtomicBoolean(false);
  @Nullable
  private volatile Object myParam;

  private Message(int type, ByteBuffer payload, MessageListener listener) {
    myType = type;
    myPayload = payload;
    myListener = listener;
  }

  public static Message create(int type, @NotNull ByteBuffer payload, @NotNull MessageListener listener) {
    Preconditions.checkArgument(type >= 0 && type <= 0xFFFF, "message type %s does not fit in 16 bits", type);
    Preconditions.checkNotNull(listener, "listener");
    Preconditions.checkArgument(payload.remaining() <= Constants.MAX_PAYLOAD_SIZE,
            "payload of %s bytes exceeds the %s bytes limit", payload.remaining(), Constants.MAX_PAYLOAD_SIZE);
    return new Message(type, payload.asReadOnlyBuffer(), listener);
  }

  public int getType() {
    return myType;
  }

  public int getPayloadSize() {
    return myPayload.remaining();
  }

  /**
   * @return a read-only view of the payload, positioned at its start
   */
  public ByteBuffer getPayload() {
    return myPayload.duplicate();
  }

  public MessageListener getListener() {
    return myListener;
  }

  @Nullable
  public Object getParam() {
    return myParam;
  }

  public void setParam(@Nullable Object param) {
    myParam = param;
  }

  /**
   * @return true the first time it is called, false afterwards
   */
  public boolean markSent() {
    return mySent.compareAndSet(false, true);
  }

  public boolean isSent() {
    return mySent.get();
  }

  @Override
  public String toString() {
    return "Message{" +
            "type=0x" + Integer.toHexString(myType) +
            ", size=" + myPayload.remaining() +
            '}';
  }
}
