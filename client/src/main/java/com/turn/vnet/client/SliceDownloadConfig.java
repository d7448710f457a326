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

import com.google.common.base.Preconditions;
import com.turn.vnet.Constants;
import org.jetbrains.annotations.NotNull;

import java.util.Properties;

/**
 * Tunables of the slice downloader.
 *
 * <p>
 * Every value can be set through {@link Properties} keyed by
 * {@value Constants#PROPERTY_PREFIX} followed by the property name, for
 * instance {@code com.turn.vnet.escalationPercent=50}.
 * </p>
 */
public final class SliceDownloadConfig {

  public static final String MAX_CHUNK_SIZE = "maxChunkSize";
  public static final String ESCALATION_PERCENT = "escalationPercent";
  public static final String BUSY_ESCALATION_THRESHOLD = "busyEscalationThreshold";
  public static final String ATTEMPT_SOFT_TIMEOUT = "attemptSoftTimeoutMillis";

  private final int myMaxChunkSize;
  private final int myEscalationPercent;
  private final int myBusyEscalationThreshold;
  private final long myAttemptSoftTimeoutMillis;

  private SliceDownloadConfig(Builder builder) {
    myMaxChunkSize = builder.maxChunkSize;
    myEscalationPercent = builder.escalationPercent;
    myBusyEscalationThreshold = builder.busyEscalationThreshold;
    myAttemptSoftTimeoutMillis = builder.attemptSoftTimeoutMillis;
  }

  public static SliceDownloadConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  /**
   * Reads the configuration from the properties, using defaults for missing keys.
   *
   * @throws IllegalArgumentException if a value is not a number or out of range
   */
  public static SliceDownloadConfig fromProperties(@NotNull Properties properties) {
    Builder builder = builder();
    String value = property(properties, MAX_CHUNK_SIZE);
    if (value != null) builder.setMaxChunkSize(parseInt(MAX_CHUNK_SIZE, value));
    value = property(properties, ESCALATION_PERCENT);
    if (value != null) builder.setEscalationPercent(parseInt(ESCALATION_PERCENT, value));
    value = property(properties, BUSY_ESCALATION_THRESHOLD);
    if (value != null) builder.setBusyEscalationThreshold(parseInt(BUSY_ESCALATION_THRESHOLD, value));
    value = property(properties, ATTEMPT_SOFT_TIMEOUT);
    if (value != null) builder.setAttemptSoftTimeoutMillis(parseLong(ATTEMPT_SOFT_TIMEOUT, value));
    return builder.build();
  }

  public static SliceDownloadConfig fromSystemProperties() {
    return fromProperties(System.getProperties());
  }

  private static String property(Properties properties, String name) {
    String value = properties.getProperty(Constants.PROPERTY_PREFIX + name);
    return value == null ? null : value.trim();
  }

  private static int parseInt(String name, String value) {
    try {
      return Integer.parseInt(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value of " + Constants.PROPERTY_PREFIX + name + ": " + value, e);
    }
  }

  private static long parseLong(String name, String value) {
    try {
      return Long.parseLong(value);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid value of " + Constants.PROPERTY_PREFIX + name + ": " + value, e);
    }
  }

  /**
   * @return the largest number of bytes asked in one request
   */
  public int getMaxChunkSize() {
    return myMaxChunkSize;
  }

  /**
   * @return percentage of the deadline after which the fallback tier is used
   */
  public int getEscalationPercent() {
    return myEscalationPercent;
  }

  /**
   * @return number of refusals in a row from regular nodes, for one chunk, that escalate the download early
   */
  public int getBusyEscalationThreshold() {
    return myBusyEscalationThreshold;
  }

  /**
   * @return age after which a regular attempt is duplicated on the fallback tier at escalation
   */
  public long getAttemptSoftTimeoutMillis() {
    return myAttemptSoftTimeoutMillis;
  }

  @Override
  public String toString() {
    return "SliceDownloadConfig{" +
            "maxChunkSize=" + myMaxChunkSize +
            ", escalationPercent=" + myEscalationPercent +
            ", busyEscalationThreshold=" + myBusyEscalationThreshold +
            ", attemptSoftTimeoutMillis=" + myAttemptSoftTimeoutMillis +
            '}';
  }

  public static final class Builder {

    private int maxChunkSize = Constants.MAX_FILE_FEED_CHUNK_SIZE;
    private int escalationPercent = Constants.DEFAULT_ESCALATION_PERCENT;
    private int busyEscalationThreshold = Constants.DEFAULT_BUSY_ESCALATION_THRESHOLD;
    private long attemptSoftTimeoutMillis = Constants.DEFAULT_ATTEMPT_SOFT_TIMEOUT_MILLIS;

    private Builder() {
    }

    public Builder setMaxChunkSize(int maxChunkSize) {
      Preconditions.checkArgument(maxChunkSize > 0 && maxChunkSize <= Constants.MAX_FILE_FEED_CHUNK_SIZE,
              "max chunk size %s is not in [1, %s]", maxChunkSize, Constants.MAX_FILE_FEED_CHUNK_SIZE);
      this.maxChunkSize = maxChunkSize;
      return this;
    }

    public Builder setEscalationPercent(int escalationPercent) {
      Preconditions.checkArgument(escalationPercent > 0 && escalationPercent < 100,
              "escalation percent %s is not in [1, 99]", escalationPercent);
      this.escalationPercent = escalationPercent;
      return this;
    }

    public Builder setBusyEscalationThreshold(int busyEscalationThreshold) {
      Preconditions.checkArgument(busyEscalationThreshold > 0,
              "busy escalation threshold %s is not positive", busyEscalationThreshold);
      this.busyEscalationThreshold = busyEscalationThreshold;
      return this;
    }

    public Builder setAttemptSoftTimeoutMillis(long attemptSoftTimeoutMillis) {
      Preconditions.checkArgument(attemptSoftTimeoutMillis >= 0,
              "attempt soft timeout %s is negative", attemptSoftTimeoutMillis);
      this.attemptSoftTimeoutMillis = attemptSoftTimeoutMillis;
      return this;
    }

    public SliceDownloadConfig build() {
      return new SliceDownloadConfig(this);
    }
  }
}
