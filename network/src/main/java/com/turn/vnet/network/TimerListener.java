package com.turn.vnet.network;

public interface TimerListener {

  /**
   * invoked on the event thread when the timer triggers
   *
   * @param timer handle of the timer that triggered
   */
  void onTimerExpired(Handle timer);
}
