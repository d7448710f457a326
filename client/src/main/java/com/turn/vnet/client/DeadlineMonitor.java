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

package com.turn.vnet.client;

import com.google.common.annotations.VisibleForTesting;
import com.turn.vnet.common.TimeService;
import com.turn.vnet.common.VnetLoggerFactory;
import com.turn.vnet.network.Handle;
import com.turn.vnet.network.TimerListener;
import com.turn.vnet.network.TimerService;
import com.turn.vnet.network.TimerStatus;
import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;

/**
 * Watches the deadline of one slice download with a single framework timer.
 *
 * <p>
 * The timer first fires at the escalation point, a percentage of the
 * deadline, and is then armed again for the rest of the deadline. Each of
 * the two signals of the {@link DeadlineListener} is raised at most once,
 * escalation always before expiry. {@link #escalateNow()} raises the
 * escalation signal ahead of the timer.
 * </p>
 */
public class DeadlineMonitor implements TimerListener {

  private static final Logger logger = VnetLoggerFactory.getLogger(DeadlineMonitor.class);

  private final TimerService myTimerService;
  private final TimeService myTimeService;
  private final DeadlineListener myListener;
  private final long myDeadlineMillis;
  private final long myEscalationDelayMillis;

  @Nullable
  private Handle myTimer;
  private long myStartTime;
  private boolean myEscalated = false;
  private boolean myExpired = false;
  private boolean myCancelled = false;

  public DeadlineMonitor(@NotNull TimerService timerService,
                         @NotNull TimeService timeService,
                         @NotNull DeadlineListener listener,
                         long deadlineMillis,
                         int escalationPercent) {
    if (deadlineMillis <= 0) {
      throw new IllegalArgumentException("Deadline must be positive, got " + deadlineMillis);
    }
    if (escalationPercent <= 0 || escalationPercent >= 100) {
      throw new IllegalArgumentException("Escalation percent must be in (0, 100), got " + escalationPercent);
    }
    myTimerService = timerService;
    myTimeService = timeService;
    myListener = listener;
    myDeadlineMillis = deadlineMillis;
    myEscalationDelayMillis = deadlineMillis * escalationPercent / 100;
  }

  /**
   * Arms the timer for the escalation point.
   *
   * @throws IllegalStateException if the timer could not be started
   */
  public void start() {
    if (myTimer != null) {
      throw new IllegalStateException("Deadline monitor is already started");
    }
    myStartTime = myTimeService.now();
    Handle timer = myTimerService.createTimer(this, myEscalationDelayMillis, false);
    TimerStatus status = myTimerService.start(timer);
    if (status != TimerStatus.SUCCESS) {
      myTimerService.destroy(timer);
      throw new IllegalStateException("Unable to start deadline timer: " + status);
    }
    myTimer = timer;
  }

  @Override
  public void onTimerExpired(Handle timer) {
    if (myCancelled || !timer.equals(myTimer)) {
      return;
    }
    long elapsed = myTimeService.now() - myStartTime;
    long remaining = myDeadlineMillis - elapsed;
    if (remaining > 0) {
      if (!myEscalated) {
        logger.debug("escalation point reached after {} ms", elapsed);
        raiseEscalation();
        if (myCancelled) return;
      }
      rearm(remaining);
      return;
    }
    if (!myEscalated) {
      raiseEscalation();
      if (myCancelled) return;
    }
    if (!myExpired) {
      myExpired = true;
      logger.debug("deadline of {} ms expired", myDeadlineMillis);
      myListener.expire();
    }
  }

  /**
   * Raises the escalation signal now, unless it was already raised.
   */
  public void escalateNow() {
    if (myCancelled || myEscalated) {
      return;
    }
    logger.debug("early escalation after {} ms", myTimeService.now() - myStartTime);
    raiseEscalation();
  }

  /**
   * Stops and destroys the timer. No signal is raised afterwards.
   */
  public void cancel() {
    if (myCancelled) {
      return;
    }
    myCancelled = true;
    Handle timer = myTimer;
    myTimer = null;
    if (timer != null) {
      myTimerService.stop(timer);
      myTimerService.destroy(timer);
    }
  }

  public boolean isEscalated() {
    return myEscalated;
  }

  public boolean isExpired() {
    return myExpired;
  }

  public long getDeadlineMillis() {
    return myDeadlineMillis;
  }

  @VisibleForTesting
  long getEscalationDelayMillis() {
    return myEscalationDelayMillis;
  }

  private void raiseEscalation() {
    myEscalated = true;
    myListener.escalate();
  }

  private void rearm(long delayMillis) {
    Handle timer = myTimer;
    if (timer == null) return;
    TimerStatus status = myTimerService.setTime(timer, delayMillis);
    if (status == TimerStatus.SUCCESS) {
      status = myTimerService.start(timer);
    }
    if (status != TimerStatus.SUCCESS) {
      // without the timer the download would never end
      logger.error("unable to re-arm deadline timer: {}, expiring now", status);
      myExpired = true;
      myListener.expire();
    }
  }
}
