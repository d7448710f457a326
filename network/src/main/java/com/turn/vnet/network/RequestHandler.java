package com.turn.vnet.network;

import java.nio.ByteBuffer;

public interface RequestHandler {

  /**
   * invoked when a request of a type this handler is registered for arrives
   *
   * @param type      message type of the request
   * @param payload   payload of the request
   * @param responder way back to the requesting node
   */
  void onRequest(int type, ByteBuffer payload, Responder responder);
}
