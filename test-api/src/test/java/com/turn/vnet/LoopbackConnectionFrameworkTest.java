package com.turn.vnet;

import com.turn.vnet.common.NodeId;
import com.turn.vnet.network.ConnectionError;
import com.turn.vnet.network.ConnectionException;
import com.turn.vnet.network.ConnectionStatus;
import com.turn.vnet.network.Handle;
import com.turn.vnet.network.Message;
import com.turn.vnet.network.MessageListener;
import com.turn.vnet.network.RequestHandler;
import com.turn.vnet.network.RequestHandlers;
import com.turn.vnet.network.Responder;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.nio.ByteBuffer;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.testng.Assert.*;

@Test
public class LoopbackConnectionFrameworkTest {

  private static final NodeId NODE = new NodeId("node");

  private ManualEventLoop myLoop;
  private LoopbackConnectionFramework myFramework;
  private MessageListener myListener;

  @BeforeMethod
  public void setUp() {
    myLoop = new ManualEventLoop();
    myFramework = new LoopbackConnectionFramework(myLoop);
    RequestHandlers handlers = new RequestHandlers();
    handlers.register(1, new RequestHandler() {
      @Override
      public void onRequest(int type, ByteBuffer payload, Responder responder) {
        responder.respond(2, payload);
      }
    });
    myFramework.addNode(NODE, handlers, 10);
    myListener = mock(MessageListener.class);
  }

  public void testAnswerArrivesAfterLatency() throws ConnectionException {
    Handle connection = myFramework.createConnection(NODE, "param");
    Message message = Message.create(1, ByteBuffer.wrap(new byte[]{1}), myListener);

    assertEquals(myFramework.sendMessage(connection, message), ConnectionStatus.SUCCESS);
    myLoop.advance(9);
    verifyNoInteractions(myListener);
    myLoop.advance(1);

    verify(myListener).onResponse(eq(message), any(ByteBuffer.class), eq(connection));
    assertEquals(myFramework.getParam(connection), "param");
    assertEquals(myFramework.getPeerNodeId(connection), NODE);
  }

  public void testSecondOutstandingMessageIsRefused() throws ConnectionException {
    Handle connection = myFramework.createConnection(NODE, null);

    myFramework.sendMessage(connection, Message.create(1, ByteBuffer.allocate(0), myListener));
    ConnectionStatus status = myFramework.sendMessage(connection, Message.create(1, ByteBuffer.allocate(0), myListener));

    assertEquals(status, ConnectionStatus.FAILURE);
    assertEquals(myFramework.getConcurrentSendRefusals(), 1);
  }

  public void testMessageIsSingleUse() throws ConnectionException {
    Handle connection = myFramework.createConnection(NODE, null);
    Message message = Message.create(1, ByteBuffer.allocate(0), myListener);

    myFramework.sendMessage(connection, message);
    myLoop.advance(10);

    assertEquals(myFramework.sendMessage(connection, message), ConnectionStatus.FAILURE);
    assertEquals(myFramework.getConcurrentSendRefusals(), 0);
  }

  public void testDestroyAbandonsOutstandingMessage() throws ConnectionException {
    Handle connection = myFramework.createConnection(NODE, null);
    Message message = Message.create(1, ByteBuffer.allocate(0), myListener);
    myFramework.sendMessage(connection, message);

    assertEquals(myFramework.destroyConnection(connection), ConnectionStatus.SUCCESS);
    myLoop.advance(100);

    verify(myListener).onError(message, connection, ConnectionError.DESTROY);
    verify(myListener, never()).onResponse(any(Message.class), any(ByteBuffer.class), any(Handle.class));
    assertFalse(myFramework.isValid(connection));
    assertEquals(myFramework.sendMessage(connection, Message.create(1, ByteBuffer.allocate(0), myListener)),
            ConnectionStatus.INVALID_HANDLE);
  }

  @Test(expectedExceptions = ConnectionException.class)
  public void testUnknownNodeCannotBeReached() throws ConnectionException {
    myFramework.createConnection(new NodeId("nobody"), null);
  }

  public void testEventLoopRunsTasksInTimeOrder() {
    final StringBuilder order = new StringBuilder();
    myLoop.schedule(20, new Runnable() {
      @Override
      public void run() {
        order.append('b');
      }
    });
    myLoop.schedule(10, new Runnable() {
      @Override
      public void run() {
        order.append('a');
        myLoop.post(new Runnable() {
          @Override
          public void run() {
            order.append('c');
          }
        });
      }
    });

    myLoop.advance(15);
    assertEquals(order.toString(), "ac");
    assertEquals(myLoop.now(), 15);
    myLoop.advance(5);
    assertEquals(order.toString(), "acb");
    assertEquals(myLoop.queued(), 0);
  }
}
