package com.turn.vnet.common;

import org.jetbrains.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands out slf4j loggers. When a static logger name is set every component logs
 * under that single name, which makes it easy for an embedding node to route the
 * downloader's output into one category.
 */
public final class VnetLoggerFactory {

  @Nullable
  private static volatile String staticLoggersName = null;

  private VnetLoggerFactory() {
  }

  public static Logger getLogger(Class<?> clazz) {
    String name = staticLoggersName;
    if (name == null) {
      name = clazz.getName();
    }
    return LoggerFactory.getLogger(name);
  }

  public static void setStaticLoggersName(@Nullable String staticLoggersName) {
    VnetLoggerFactory.staticLoggersName = staticLoggersName;
  }
}
