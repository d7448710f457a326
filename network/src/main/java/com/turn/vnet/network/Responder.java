package com.turn.vnet.network;

import java.nio.ByteBuffer;

/**
 * Answers one incoming request. Exactly one of the methods should be called.
 */
public interface Responder {

  void respond(int type, ByteBuffer payload);

  void reject(ConnectionError error);
}
