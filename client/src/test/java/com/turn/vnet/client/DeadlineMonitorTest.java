package com.turn.vnet.client;

import com.turn.vnet.ManualEventLoop;
import com.turn.vnet.ManualTimerService;
import org.mockito.InOrder;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import static org.mockito.Mockito.*;
import static org.testng.Assert.*;

@Test
public class DeadlineMonitorTest {

  private ManualEventLoop myLoop;
  private ManualTimerService myTimers;
  private DeadlineListener myListener;

  @BeforeMethod
  public void setUp() {
    myLoop = new ManualEventLoop();
    myTimers = new ManualTimerService(myLoop);
    myListener = mock(DeadlineListener.class);
  }

  public void testEscalatesAtSixtyPercentThenExpires() {
    DeadlineMonitor monitor = new DeadlineMonitor(myTimers, myLoop, myListener, 5000, 60);
    monitor.start();
    assertEquals(monitor.getEscalationDelayMillis(), 3000);

    myLoop.advance(2999);
    verifyNoInteractions(myListener);

    myLoop.advance(1);
    verify(myListener).escalate();
    assertTrue(monitor.isEscalated());
    assertFalse(monitor.isExpired());

    myLoop.advance(1999);
    verify(myListener, never()).expire();

    myLoop.advance(1);
    InOrder order = inOrder(myListener);
    order.verify(myListener).escalate();
    order.verify(myListener).expire();
    assertTrue(monitor.isExpired());

    myLoop.advance(10000);
    verifyNoMoreInteractions(myListener);
    assertEquals(myTimers.liveTimers(), 1);
  }

  public void testSingleTimerIsRearmed() {
    DeadlineMonitor monitor = new DeadlineMonitor(myTimers, myLoop, myListener, 1000, 50);
    monitor.start();

    myLoop.advance(1000);

    assertEquals(myTimers.liveTimers(), 1);
    assertEquals(myTimers.getStartCount(), 2);
    verify(myListener).expire();
  }

  public void testEarlyEscalationIsRaisedOnce() {
    DeadlineMonitor monitor = new DeadlineMonitor(myTimers, myLoop, myListener, 5000, 60);
    monitor.start();

    myLoop.advance(100);
    monitor.escalateNow();
    monitor.escalateNow();
    verify(myListener, times(1)).escalate();

    myLoop.advance(3000);
    verify(myListener, times(1)).escalate();
    verify(myListener, never()).expire();

    myLoop.advance(2000);
    verify(myListener).expire();
  }

  public void testCancelSilencesTheMonitor() {
    DeadlineMonitor monitor = new DeadlineMonitor(myTimers, myLoop, myListener, 5000, 60);
    monitor.start();

    monitor.cancel();
    monitor.escalateNow();
    myLoop.advance(10000);

    verifyNoInteractions(myListener);
    assertEquals(myTimers.liveTimers(), 0);
  }

  public void testCancelFromEscalationSkipsRearm() {
    final DeadlineMonitor[] monitor = new DeadlineMonitor[1];
    DeadlineListener listener = new DeadlineListener() {
      @Override
      public void escalate() {
        monitor[0].cancel();
      }

      @Override
      public void expire() {
        fail("cancelled monitor expired");
      }
    };
    monitor[0] = new DeadlineMonitor(myTimers, myLoop, listener, 5000, 60);
    monitor[0].start();

    myLoop.advance(10000);

    assertTrue(monitor[0].isEscalated());
    assertEquals(myTimers.liveTimers(), 0);
    assertEquals(myTimers.getStartCount(), 1);
  }

  @Test(expectedExceptions = IllegalArgumentException.class)
  public void testEscalationPercentMustLeaveRoomBeforeExpiry() {
    new DeadlineMonitor(myTimers, myLoop, myListener, 5000, 100);
  }
}
