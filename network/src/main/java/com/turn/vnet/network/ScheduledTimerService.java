/*
 * Copyright 2000-2018 JetBrains s.r.o.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.turn.vnet.network;

import com.turn.vnet.common.LoggerUtils;
import com.turn.vnet.common.VnetLoggerFactory;
import org.jetbrains.annotations.NotNull;
import org.slf4j.Logger;

import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * {@link TimerService} running timer callbacks on a scheduled executor.
 *
 * <p>
 * Give it a single threaded executor and that thread is the event loop the
 * callbacks of a download run on. A timer stopped or destroyed while its task
 * is already queued never reaches its listener.
 * </p>
 */
public class ScheduledTimerService implements TimerService {

  private static final Logger logger = VnetLoggerFactory.getLogger(ScheduledTimerService.class);

  private final ScheduledExecutorService myExecutor;
  private final HandleArena<TimerEntry> myTimers = new HandleArena<TimerEntry>();
  private final Object myLock = new Object();

  public ScheduledTimerService(ScheduledExecutorService executor) {
    myExecutor = executor;
  }

  @NotNull
  @Override
  public Handle createTimer(@NotNull TimerListener listener, long delayMillis, boolean periodic) {
    if (delayMillis < 0) {
      throw new IllegalArgumentException("negative timer delay " + delayMillis);
    }
    synchronized (myLock) {
      return myTimers.insert(new TimerEntry(listener, delayMillis, periodic));
    }
  }

  @Override
  public TimerStatus start(@NotNull final Handle timer) {
    synchronized (myLock) {
      final TimerEntry entry = myTimers.get(timer);
      if (entry == null) return TimerStatus.INVALID_HANDLE;
      cancel(entry);
      final long run = ++entry.run;
      Runnable task = new Runnable() {
        @Override
        public void run() {
          fire(timer, entry, run);
        }
      };
      try {
        if (entry.periodic) {
          long period = Math.max(1, entry.delayMillis);
          entry.future = myExecutor.scheduleAtFixedRate(task, entry.delayMillis, period, TimeUnit.MILLISECONDS);
        } else {
          entry.future = myExecutor.schedule(task, entry.delayMillis, TimeUnit.MILLISECONDS);
        }
      } catch (RuntimeException e) {
        LoggerUtils.warnAndDebugDetails(logger, "unable to schedule timer {}", timer, e);
        return TimerStatus.OUT_OF_RESOURCE;
      }
      return TimerStatus.SUCCESS;
    }
  }

  @Override
  public TimerStatus stop(@NotNull Handle timer) {
    synchronized (myLock) {
      TimerEntry entry = myTimers.get(timer);
      if (entry == null) return TimerStatus.INVALID_HANDLE;
      cancel(entry);
      entry.run++;
      return TimerStatus.SUCCESS;
    }
  }

  @Override
  public TimerStatus setTime(@NotNull Handle timer, long delayMillis) {
    if (delayMillis < 0) return TimerStatus.FAILURE;
    synchronized (myLock) {
      TimerEntry entry = myTimers.get(timer);
      if (entry == null) return TimerStatus.INVALID_HANDLE;
      entry.delayMillis = delayMillis;
      return TimerStatus.SUCCESS;
    }
  }

  @Override
  public TimerStatus destroy(@NotNull Handle timer) {
    synchronized (myLock) {
      TimerEntry entry = myTimers.remove(timer);
      if (entry == null) return TimerStatus.INVALID_HANDLE;
      cancel(entry);
      entry.run++;
      return TimerStatus.SUCCESS;
    }
  }

  @Override
  public boolean isValid(@NotNull Handle timer) {
    synchronized (myLock) {
      return myTimers.contains(timer);
    }
  }

  private void fire(Handle timer, TimerEntry entry, long run) {
    synchronized (myLock) {
      if (entry.run != run || !myTimers.contains(timer)) {
        return;
      }
    }
    try {
      entry.listener.onTimerExpired(timer);
    } catch (Throwable e) {
      LoggerUtils.errorAndDebugDetails(logger, "timer listener of {} failed", timer, e);
    }
  }

  private static void cancel(TimerEntry entry) {
    ScheduledFuture<?> future = entry.future;
    if (future != null) {
      future.cancel(false);
      entry.future = null;
    }
  }

  private static final class TimerEntry {
    private final TimerListener listener;
    private final boolean periodic;
    private long delayMillis;
    private long run;
    private ScheduledFuture<?> future;

    private TimerEntry(TimerListener listener, long delayMillis, boolean periodic) {
      this.listener = listener;
      this.delayMillis = delayMillis;
      this.periodic = periodic;
    }
  }
}
