package com.turn.vnet.network;

import org.testng.annotations.Test;

import java.nio.ByteBuffer;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.Mockito.*;
import static org.testng.Assert.*;

@Test
public class RequestHandlersTest {

  public void testDispatchToRegisteredHandler() {
    RequestHandlers handlers = new RequestHandlers();
    RequestHandler handler = mock(RequestHandler.class);
    Responder responder = mock(Responder.class);
    ByteBuffer payload = ByteBuffer.allocate(3);

    assertNull(handlers.register(0x4036, handler));

    assertTrue(handlers.dispatch(0x4036, payload, responder));
    verify(handler).onRequest(0x4036, payload, responder);
    verifyNoInteractions(responder);
  }

  public void testUnknownTypeIsRejected() {
    RequestHandlers handlers = new RequestHandlers();
    Responder responder = mock(Responder.class);

    assertFalse(handlers.dispatch(0x1234, ByteBuffer.allocate(0), responder));

    verify(responder).reject(ConnectionError.PROTOCOL);
    verify(responder, never()).respond(anyInt(), any(ByteBuffer.class));
  }

  public void testTablesAreIndependent() {
    RequestHandlers first = new RequestHandlers();
    RequestHandlers second = new RequestHandlers();
    RequestHandler handler = mock(RequestHandler.class);

    first.register(1, handler);

    assertSame(first.get(1), handler);
    assertNull(second.get(1));
    assertSame(first.unregister(1), handler);
    assertNull(first.get(1));
    verifyNoInteractions(handler);
  }

  public void testErrorCodes() {
    assertEquals(ConnectionError.fromCode(1), ConnectionError.TIMEOUT);
    assertEquals(ConnectionError.fromCode(8), ConnectionError.CANTCONNECT);
    assertEquals(ConnectionError.fromStatus(ConnectionStatus.INVALID_HANDLE), ConnectionError.BADF);
  }
}
