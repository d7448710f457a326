package com.turn.vnet.network;

import java.nio.ByteBuffer;

/**
 * Receives the outcome of a sent {@link Message}. Exactly one of the methods is
 * invoked per sent message, on the framework's event thread.
 */
public interface MessageListener {

  /**
   * invoked when the remote node answered the message
   *
   * @param request    the message that was sent
   * @param payload    payload of the response message
   * @param connection connection the exchange happened on
   */
  void onResponse(Message request, ByteBuffer payload, Handle connection);

  /**
   * invoked when the message could not be delivered or answered
   *
   * @param request    the message that was sent
   * @param connection connection the message was sent on
   * @param error      reason of the failure
   */
  void onError(Message request, Handle connection, ConnectionError error);
}
