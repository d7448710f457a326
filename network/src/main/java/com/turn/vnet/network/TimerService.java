package com.turn.vnet.network;

import org.jetbrains.annotations.NotNull;

/**
 * Timers of the connection framework. A created timer does nothing until it is
 * started; a stopped timer can be started again and counts its delay from the
 * new start. Destroying a timer invalidates its handle.
 */
public interface TimerService {

  @NotNull
  Handle createTimer(@NotNull TimerListener listener, long delayMillis, boolean periodic);

  TimerStatus start(@NotNull Handle timer);

  TimerStatus stop(@NotNull Handle timer);

  /**
   * Changes the delay used by the next {@link #start(Handle)}.
   */
  TimerStatus setTime(@NotNull Handle timer, long delayMillis);

  TimerStatus destroy(@NotNull Handle timer);

  boolean isValid(@NotNull Handle timer);
}
