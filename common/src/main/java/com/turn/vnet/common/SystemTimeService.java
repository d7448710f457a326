package com.turn.vnet.common;

import java.util.concurrent.TimeUnit;

public class SystemTimeService implements TimeService {

  @Override
  public long now() {
    return TimeUnit.NANOSECONDS.toMillis(System.nanoTime());
  }

}
