package com.turn.vnet.client.network;

import com.turn.vnet.LoopbackConnectionFramework;
import com.turn.vnet.ManualEventLoop;
import com.turn.vnet.common.NodeId;
import com.turn.vnet.network.ConnectionError;
import com.turn.vnet.network.ConnectionException;
import com.turn.vnet.network.ConnectionFramework;
import com.turn.vnet.network.ConnectionStatus;
import com.turn.vnet.network.Handle;
import com.turn.vnet.network.HandleArena;
import com.turn.vnet.network.Message;
import com.turn.vnet.network.RequestHandler;
import com.turn.vnet.network.RequestHandlers;
import com.turn.vnet.network.Responder;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.nio.ByteBuffer;
import java.util.ArrayList;
import java.util.List;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;
import static org.testng.Assert.*;

@Test
public class SliceConnectionManagerTest {

  private static final int ECHO = 0x10;
  private static final NodeId NODE = new NodeId("node");

  private ManualEventLoop myLoop;
  private LoopbackConnectionFramework myFramework;
  private LoopbackConnectionFramework.SimulatedNode myNode;
  private SliceConnectionManager myManager;
  private List<String> myEvents;

  @BeforeMethod
  public void setUp() {
    myLoop = new ManualEventLoop();
    myFramework = new LoopbackConnectionFramework(myLoop);
    RequestHandlers handlers = new RequestHandlers();
    handlers.register(ECHO, new RequestHandler() {
      @Override
      public void onRequest(int type, ByteBuffer payload, Responder responder) {
        responder.respond(ECHO, payload);
      }
    });
    myNode = myFramework.addNode(NODE, handlers, 10);
    myManager = new SliceConnectionManager(myFramework);
    myEvents = new ArrayList<String>();
  }

  private SlotRequest request(final String name) {
    return new SlotRequest(ECHO, ByteBuffer.wrap(name.getBytes())) {
      @Override
      protected void onResponse(ByteBuffer payload) {
        byte[] bytes = new byte[payload.remaining()];
        payload.get(bytes);
        myEvents.add(myLoop.now() + ":" + new String(bytes));
      }

      @Override
      protected void onFailure(ConnectionError error) {
        myEvents.add(myLoop.now() + ":" + name + ":" + error);
      }
    };
  }

  public void testRequestsAreSentOneAtATime() throws ConnectionException {
    ConnectionSlot slot = myManager.acquire(NODE);

    myManager.send(slot, request("a"));
    myManager.send(slot, request("b"));
    myManager.send(slot, request("c"));
    assertTrue(slot.isBusy());
    assertEquals(slot.getQueueSize(), 2);

    myLoop.advance(100);

    assertEquals(myEvents.toString(), "[10:a, 20:b, 30:c]");
    assertEquals(myFramework.getConcurrentSendRefusals(), 0);
    assertEquals(slot.getSentCount(), 3);
    assertFalse(slot.isBusy());
  }

  public void testSlotIsReusedPerNode() throws ConnectionException {
    myFramework.addNode(new NodeId("other"), new RequestHandlers(), 10);

    ConnectionSlot first = myManager.acquire(NODE);
    assertSame(myManager.acquire(NODE), first);
    assertNotSame(myManager.acquire(new NodeId("other")), first);

    assertEquals(myManager.getOpenSlotCount(), 2);
    assertEquals(myFramework.getCreatedConnectionCount(), 2);
  }

  public void testUnreachableNode() {
    myNode.setUnreachable(true);
    try {
      myManager.acquire(NODE);
      fail("connected to an unreachable node");
    } catch (ConnectionException e) {
      assertEquals(e.getError(), ConnectionError.CANTCONNECT);
      assertEquals(e.getNodeId(), NODE);
    }
    assertEquals(myManager.getOpenSlotCount(), 0);
  }

  public void testSendFromCallbackIsQueued() throws ConnectionException {
    final ConnectionSlot slot = myManager.acquire(NODE);
    myManager.send(slot, new SlotRequest(ECHO, ByteBuffer.wrap("first".getBytes())) {
      @Override
      protected void onResponse(ByteBuffer payload) {
        myEvents.add(myLoop.now() + ":first");
        myManager.send(slot, request("second"));
      }

      @Override
      protected void onFailure(ConnectionError error) {
        fail("first request failed: " + error);
      }
    });
    myManager.send(slot, request("queued"));

    myLoop.advance(100);

    assertEquals(myEvents.toString(), "[10:first, 20:queued, 30:second]");
    assertEquals(myFramework.getConcurrentSendRefusals(), 0);
  }

  public void testErrorIsReportedAndQueueGoesOn() throws ConnectionException {
    ConnectionSlot slot = myManager.acquire(NODE);
    myNode.setFailure(ConnectionError.TIMEOUT);

    myManager.send(slot, request("a"));
    myManager.send(slot, request("b"));
    myLoop.advance(10);
    myNode.setFailure(null);
    myLoop.advance(100);

    assertEquals(myEvents.toString(), "[10:a:TIMEOUT, 20:b]");
  }

  public void testCancelledRequestIsSkipped() throws ConnectionException {
    ConnectionSlot slot = myManager.acquire(NODE);
    SlotRequest cancelled = request("b");

    myManager.send(slot, request("a"));
    myManager.send(slot, cancelled);
    myManager.send(slot, request("c"));
    assertTrue(cancelled.cancel());
    myLoop.advance(100);

    assertEquals(myEvents.toString(), "[10:a, 20:c]");
    assertFalse(cancelled.isDispatched());
    assertEquals(myFramework.getSentRequests().size(), 2);
  }

  public void testDispatchedRequestCannotBeCancelled() throws ConnectionException {
    SlotRequest request = request("a");

    myManager.send(myManager.acquire(NODE), request);

    assertTrue(request.isDispatched());
    assertFalse(request.cancel());
  }

  public void testReleaseIgnoresLateAnswers() throws ConnectionException {
    ConnectionSlot slot = myManager.acquire(NODE);
    myManager.send(slot, request("a"));
    myManager.send(slot, request("b"));

    myManager.releaseAll();
    myLoop.advance(100);

    assertTrue(myEvents.isEmpty());
    assertTrue(slot.isClosed());
    assertEquals(myFramework.getOpenConnectionCount(), 0);
    assertEquals(myManager.getOpenSlotCount(), 0);
    try {
      myManager.send(slot, request("c"));
      fail("sent on a released slot");
    } catch (IllegalStateException expected) {
    }
  }

  public void testSynchronousRefusalIsTypedFailure() throws ConnectionException {
    ConnectionFramework framework = mock(ConnectionFramework.class);
    Handle handle = new HandleArena<Object>().insert(new Object());
    when(framework.createConnection(eq(NODE), any())).thenReturn(handle);
    when(framework.sendMessage(eq(handle), any(Message.class)))
            .thenReturn(ConnectionStatus.OUT_OF_RESOURCE)
            .thenReturn(ConnectionStatus.SUCCESS);
    SliceConnectionManager manager = new SliceConnectionManager(framework);
    ConnectionSlot slot = manager.acquire(NODE);

    manager.send(slot, request("a"));
    manager.send(slot, request("b"));

    assertEquals(myEvents.toString(), "[0:a:RESET]");
    assertTrue(slot.isBusy());
    verify(framework, times(2)).sendMessage(eq(handle), any(Message.class));
  }

  public void testDroppedConnectionIsReplacedWhenIdle() throws ConnectionException {
    ConnectionFramework framework = mock(ConnectionFramework.class);
    HandleArena<Object> arena = new HandleArena<Object>();
    Handle first = arena.insert(new Object());
    Handle second = arena.insert(new Object());
    when(framework.createConnection(eq(NODE), any())).thenReturn(first).thenReturn(second);
    when(framework.isValid(first)).thenReturn(false);
    SliceConnectionManager manager = new SliceConnectionManager(framework, "param");

    ConnectionSlot slot = manager.acquire(NODE);
    ConnectionSlot replaced = manager.acquire(NODE);

    assertNotSame(replaced, slot);
    assertEquals(replaced.getConnection(), second);
    verify(framework, times(2)).createConnection(NODE, "param");
  }
}
