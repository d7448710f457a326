package com.turn.vnet.client;

/**
 * Receives the two one-shot signals of a {@link DeadlineMonitor}.
 */
public interface DeadlineListener {

  /**
   * The download should start using the fallback tier.
   */
  void escalate();

  /**
   * The deadline passed.
   */
  void expire();
}
