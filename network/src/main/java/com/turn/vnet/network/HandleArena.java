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

import org.jetbrains.annotations.NotNull;
import org.jetbrains.annotations.Nullable;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Storage of objects addressed through {@link Handle}s.
 *
 * <p>
 * Not thread safe: an arena is owned by one event loop, callers that share it
 * between threads synchronize on their own.
 * </p>
 *
 * @param <T> type of the stored objects
 */
public class HandleArena<T> {

  private static final AtomicInteger ourArenaIds = new AtomicInteger();

  private final int myArenaId = ourArenaIds.incrementAndGet();
  private final List<Entry<T>> myEntries = new ArrayList<Entry<T>>();
  private final Deque<Integer> myFreeIndexes = new ArrayDeque<Integer>();
  private int mySize = 0;

  @NotNull
  public Handle insert(@NotNull T value) {
    if (value == null) {
      throw new NullPointerException("arena values must not be null");
    }
    Integer free = myFreeIndexes.pollFirst();
    Entry<T> entry;
    int index;
    if (free == null) {
      index = myEntries.size();
      entry = new Entry<T>();
      myEntries.add(entry);
    } else {
      index = free;
      entry = myEntries.get(index);
    }
    entry.value = value;
    mySize++;
    return new Handle(myArenaId, index, entry.generation);
  }

  @Nullable
  public T get(@Nullable Handle handle) {
    Entry<T> entry = entryFor(handle);
    return entry == null ? null : entry.value;
  }

  public boolean contains(@Nullable Handle handle) {
    return entryFor(handle) != null;
  }

  /**
   * Removes the entry addressed by the handle and invalidates every copy of it.
   *
   * @return the removed value or null if the handle was already stale
   */
  @Nullable
  public T remove(@Nullable Handle handle) {
    Entry<T> entry = entryFor(handle);
    if (entry == null) {
      return null;
    }
    T value = entry.value;
    entry.value = null;
    entry.generation++;
    myFreeIndexes.addLast(handle.getIndex());
    mySize--;
    return value;
  }

  /**
   * @return snapshot of the live handles, in slot order
   */
  @NotNull
  public List<Handle> handles() {
    List<Handle> result = new ArrayList<Handle>(mySize);
    for (int i = 0; i < myEntries.size(); i++) {
      Entry<T> entry = myEntries.get(i);
      if (entry.value != null) {
        result.add(new Handle(myArenaId, i, entry.generation));
      }
    }
    return result;
  }

  public int size() {
    return mySize;
  }

  public boolean isEmpty() {
    return mySize == 0;
  }

  @Nullable
  private Entry<T> entryFor(@Nullable Handle handle) {
    if (handle == null || handle.getArenaId() != myArenaId) {
      return null;
    }
    int index = handle.getIndex();
    if (index < 0 || index >= myEntries.size()) {
      return null;
    }
    Entry<T> entry = myEntries.get(index);
    if (entry.value == null || entry.generation != handle.getGeneration()) {
      return null;
    }
    return entry;
  }

  private static final class Entry<T> {
    private int generation;
    private T value;
  }
}
