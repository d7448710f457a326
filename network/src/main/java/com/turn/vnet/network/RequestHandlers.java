package com.turn.vnet.network;

import com.turn.vnet.common.VnetLoggerFactory;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;

import java.nio.ByteBuffer;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Dispatch table from message type to the handler serving requests of that
 * type. Each node (or test) builds its own table and hands it to the component
 * that receives requests, so registrations never leak between instances.
 */
public class RequestHandlers {

  private static final Logger logger = VnetLoggerFactory.getLogger(RequestHandlers.class);

  private final Map<Integer, RequestHandler> myHandlers = new ConcurrentHashMap<Integer, RequestHandler>();

  /**
   * @return the handler previously registered for the type, if any
   */
  @Nullable
  public RequestHandler register(int type, @NotNull RequestHandler handler) {
    return myHandlers.put(type, handler);
  }

  @Nullable
  public RequestHandler unregister(int type) {
    return myHandlers.remove(type);
  }

  @Nullable
  public RequestHandler get(int type) {
    return myHandlers.get(type);
  }

  /**
   * Routes a request to its handler. Requests of an unregistered type are
   * rejected with {@link ConnectionError#PROTOCOL}.
   *
   * @return true if a handler took the request
   */
  public boolean dispatch(int type, ByteBuffer payload, Responder responder) {
    RequestHandler handler = myHandlers.get(type);
    if (handler == null) {
      logger.debug("no handler for request type 0x{}", Integer.toHexString(type));
      responder.reject(ConnectionError.PROTOCOL);
      return false;
    }
    handler.onRequest(type, payload, responder);
    return true;
  }
}
