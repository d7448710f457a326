package com.turn.vnet;

import com.turn.vnet.common.TimeService;

import java.util.PriorityQueue;

/**
 * Single threaded, manually driven event loop with its own clock.
 *
 * <p>
 * Nothing runs until the test drives the loop: {@link #runPending()} runs every
 * task due at the current time (tasks posted meanwhile included), and
 * {@link #advance(long)} moves the clock forward, running due tasks in time
 * order on the way.
 * </p>
 */
public class ManualEventLoop implements TimeService {

  private static final int MAX_TASKS_PER_STEP = 1000000;

  private final PriorityQueue<Task> myQueue = new PriorityQueue<Task>();
  private long myNow = 0;
  private long mySequence = 0;

  @Override
  public long now() {
    return myNow;
  }

  public Task schedule(long delayMillis, Runnable runnable) {
    if (delayMillis < 0) {
      throw new IllegalArgumentException("negative delay " + delayMillis);
    }
    Task task = new Task(myNow + delayMillis, mySequence++, runnable);
    myQueue.add(task);
    return task;
  }

  public Task post(Runnable runnable) {
    return schedule(0, runnable);
  }

  /**
   * Runs every task due at the current time.
   *
   * @return number of tasks run
   */
  public int runPending() {
    int count = 0;
    while (true) {
      Task head = myQueue.peek();
      if (head == null || head.time > myNow) {
        return count;
      }
      myQueue.poll();
      if (head.cancelled) continue;
      head.runnable.run();
      if (++count > MAX_TASKS_PER_STEP) {
        throw new IllegalStateException("event loop does not settle at " + myNow);
      }
    }
  }

  public void advance(long millis) {
    advanceTo(myNow + millis);
  }

  public void advanceTo(long time) {
    if (time < myNow) {
      throw new IllegalArgumentException("time can't go back from " + myNow + " to " + time);
    }
    runPending();
    while (true) {
      Task head = myQueue.peek();
      if (head == null || head.time > time) {
        break;
      }
      myNow = head.time;
      runPending();
    }
    myNow = time;
    runPending();
  }

  /**
   * @return number of tasks waiting, cancelled ones excluded
   */
  public int queued() {
    int count = 0;
    for (Task task : myQueue) {
      if (!task.cancelled) count++;
    }
    return count;
  }

  public static final class Task implements Comparable<Task> {
    private final long time;
    private final long sequence;
    private final Runnable runnable;
    private boolean cancelled;

    private Task(long time, long sequence, Runnable runnable) {
      this.time = time;
      this.sequence = sequence;
      this.runnable = runnable;
    }

    public void cancel() {
      cancelled = true;
    }

    public long getTime() {
      return time;
    }

    @Override
    public int compareTo(Task o) {
      if (time != o.time) return time < o.time ? -1 : 1;
      return sequence < o.sequence ? -1 : (sequence == o.sequence ? 0 : 1);
    }
  }
}
