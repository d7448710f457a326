package com.turn.vnet;

import com.turn.vnet.network.Handle;
import com.turn.vnet.network.HandleArena;
import com.turn.vnet.network.TimerListener;
import com.turn.vnet.network.TimerService;
import com.turn.vnet.network.TimerStatus;
import org.jetbrains.annotations.NotNull;

/**
 * {@link TimerService} firing on a {@link ManualEventLoop}.
 */
public class ManualTimerService implements TimerService {

  private final ManualEventLoop myLoop;
  private final HandleArena<TimerEntry> myTimers = new HandleArena<TimerEntry>();
  private int myStarts = 0;

  public ManualTimerService(ManualEventLoop loop) {
    myLoop = loop;
  }

  @NotNull
  @Override
  public Handle createTimer(@NotNull TimerListener listener, long delayMillis, boolean periodic) {
    return myTimers.insert(new TimerEntry(listener, delayMillis, periodic));
  }

  @Override
  public TimerStatus start(@NotNull Handle timer) {
    TimerEntry entry = myTimers.get(timer);
    if (entry == null) return TimerStatus.INVALID_HANDLE;
    cancel(entry);
    schedule(timer, entry);
    myStarts++;
    return TimerStatus.SUCCESS;
  }

  @Override
  public TimerStatus stop(@NotNull Handle timer) {
    TimerEntry entry = myTimers.get(timer);
    if (entry == null) return TimerStatus.INVALID_HANDLE;
    cancel(entry);
    return TimerStatus.SUCCESS;
  }

  @Override
  public TimerStatus setTime(@NotNull Handle timer, long delayMillis) {
    TimerEntry entry = myTimers.get(timer);
    if (entry == null) return TimerStatus.INVALID_HANDLE;
    if (delayMillis < 0) return TimerStatus.FAILURE;
    entry.delayMillis = delayMillis;
    return TimerStatus.SUCCESS;
  }

  @Override
  public TimerStatus destroy(@NotNull Handle timer) {
    TimerEntry entry = myTimers.remove(timer);
    if (entry == null) return TimerStatus.INVALID_HANDLE;
    cancel(entry);
    return TimerStatus.SUCCESS;
  }

  @Override
  public boolean isValid(@NotNull Handle timer) {
    return myTimers.contains(timer);
  }

  public int liveTimers() {
    return myTimers.size();
  }

  public int getStartCount() {
    return myStarts;
  }

  private void schedule(final Handle timer, final TimerEntry entry) {
    entry.task = myLoop.schedule(entry.delayMillis, new Runnable() {
      @Override
      public void run() {
        entry.task = null;
        if (!myTimers.contains(timer)) return;
        if (entry.periodic) {
          schedule(timer, entry);
        }
        entry.listener.onTimerExpired(timer);
      }
    });
  }

  private static void cancel(TimerEntry entry) {
    if (entry.task != null) {
      entry.task.cancel();
      entry.task = null;
    }
  }

  private static final class TimerEntry {
    private final TimerListener listener;
    private final boolean periodic;
    private long delayMillis;
    private ManualEventLoop.Task task;

    private TimerEntry(TimerListener listener, long delayMillis, boolean periodic) {
      this.listener = listener;
      this.delayMillis = delayMillis;
      this.periodic = periodic;
    }
  }
}
