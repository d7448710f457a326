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

package com.turn.vnet.common;

import com.google.common.base.Preconditions;
import com.turn.vnet.Constants;

/**
 * A slice of a content item.
 *
 * <p>
 * Contents are divided into slices of roughly 4MB, each one stored on a subset
 * of the nodes in the network. The slice id is an unsigned 16 bit value and the
 * size an unsigned 32 bit value, as they travel on the wire.
 * </p>
 */
public final class Slice {

  private final int mySliceId;
  private final long mySliceSize;

  public Slice(int sliceId, long sliceSize) {
    Preconditions.checkArgument(sliceId >= 0 && sliceId <= Constants.MAX_SLICE_ID,
            "slice id %s is out of range", sliceId);
    Preconditions.checkArgument(sliceSize >= 0 && sliceSize <= Constants.MAX_UNSIGNED_INT,
            "slice size %s is out of range", sliceSize);
    mySliceId = sliceId;
    mySliceSize = sliceSize;
  }

  public int getSliceId() {
    return mySliceId;
  }

  public long getSliceSize() {
    return mySliceSize;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;

    Slice slice = (Slice) o;

    if (mySliceId != slice.mySliceId) return false;
    return mySliceSize == slice.mySliceSize;
  }

  @Override
  public int hashCode() {
    int result = mySliceId;
    result = 31 * result + (int) (mySliceSize ^ (mySliceSize >>> 32));
    return result;
  }

  @Override
  public String toString() {
    return "Slice{" +
            "id=" + mySliceId +
            ", size=" + mySliceSize +
            '}';
  }
}
