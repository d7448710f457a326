package com.turn.vnet.network;

import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.testng.Assert.*;

@Test
public class ScheduledTimerServiceTest {

  private ScheduledExecutorService myExecutor;
  private ScheduledTimerService myTimerService;

  @BeforeMethod
  public void setUp() {
    myExecutor = Executors.newSingleThreadScheduledExecutor();
    myTimerService = new ScheduledTimerService(myExecutor);
  }

  @AfterMethod
  public void tearDown() {
    myExecutor.shutdownNow();
  }

  public void testOneShotTimerFiresOnce() throws InterruptedException {
    final Semaphore semaphore = new Semaphore(0);
    final AtomicInteger fired = new AtomicInteger();
    Handle timer = myTimerService.createTimer(new TimerListener() {
      @Override
      public void onTimerExpired(Handle timer) {
        fired.incrementAndGet();
        semaphore.release();
      }
    }, 10, false);

    assertEquals(myTimerService.start(timer), TimerStatus.SUCCESS);

    tryAcquireOrFail(semaphore);
    Thread.sleep(50);
    assertEquals(fired.get(), 1);
    assertTrue(myTimerService.isValid(timer));
  }

  public void testStoppedTimerDoesNotFire() throws InterruptedException {
    final AtomicInteger fired = new AtomicInteger();
    Handle timer = myTimerService.createTimer(new TimerListener() {
      @Override
      public void onTimerExpired(Handle timer) {
        fired.incrementAndGet();
      }
    }, 50, false);

    myTimerService.start(timer);
    assertEquals(myTimerService.stop(timer), TimerStatus.SUCCESS);

    Thread.sleep(150);
    assertEquals(fired.get(), 0);
  }

  public void testRestartWithNewTime() throws InterruptedException {
    final Semaphore semaphore = new Semaphore(0);
    Handle timer = myTimerService.createTimer(new TimerListener() {
      @Override
      public void onTimerExpired(Handle timer) {
        semaphore.release();
      }
    }, 60000, false);

    myTimerService.start(timer);
    myTimerService.stop(timer);
    assertEquals(myTimerService.setTime(timer, 5), TimerStatus.SUCCESS);
    myTimerService.start(timer);

    tryAcquireOrFail(semaphore);
  }

  public void testDestroyedTimerIsInvalid() {
    Handle timer = myTimerService.createTimer(new TimerListener() {
      @Override
      public void onTimerExpired(Handle timer) {
        fail("destroyed timer fired");
      }
    }, 10, false);

    assertEquals(myTimerService.destroy(timer), TimerStatus.SUCCESS);

    assertFalse(myTimerService.isValid(timer));
    assertEquals(myTimerService.start(timer), TimerStatus.INVALID_HANDLE);
    assertEquals(myTimerService.destroy(timer), TimerStatus.INVALID_HANDLE);
  }

  private void tryAcquireOrFail(Semaphore semaphore) throws InterruptedException {
    if (!semaphore.tryAcquire(5, TimeUnit.SECONDS)) {
      fail("don't get signal from timer in 5 seconds");
    }
  }
}
