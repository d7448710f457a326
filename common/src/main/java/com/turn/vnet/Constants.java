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

package com.turn.vnet;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

public class Constants {

  /**
   * Largest payload the connection framework accepts for a single message.
   */
  public static final int MAX_PAYLOAD_SIZE = 65535;

  /**
   * Largest chunk of slice data a single FILE_FEED request may ask for.
   */
  public static final int MAX_FILE_FEED_CHUNK_SIZE = 51200;

  public static final int FILE_FEED_REQUEST = 0x4036;
  public static final int FILE_FEED_RESPONSE = 0x3938;

  /**
   * Fixed width of the ascii content identifier (crid) on the wire.
   */
  public static final int CONTENT_ID_LENGTH = 136;

  public static final int MAX_SLICE_ID = 0xFFFF;
  public static final long MAX_UNSIGNED_INT = 0xFFFFFFFFL;

  public static final int DEFAULT_ESCALATION_PERCENT = 60;
  public static final int DEFAULT_BUSY_ESCALATION_THRESHOLD = 3;
  public static final int DEFAULT_ATTEMPT_SOFT_TIMEOUT_MILLIS = 1000;
  public static final int DEFAULT_MAX_CONCURRENT_SERVES = 8;

  public static final Charset BYTE_ENCODING = StandardCharsets.US_ASCII;

  public static final String PROPERTY_PREFIX = "com.turn.vnet.";

}
