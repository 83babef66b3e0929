/*
 * Copyright (C) 2017-2019 Dremio Corporation
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package com.lithium.common.concurrent;

import com.google.common.base.Preconditions;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Double-ended queue guarded by a single {@link Lockable}.
 *
 * <p>The owning thread works on the front ({@link #popFront()}) while other threads take from the
 * back ({@link #steal()}), so the owner consumes oldest-first and thieves newest-first. Two
 * rotation primitives, {@link #rotateToFront(Object)} and {@link #copyFrontAndRotateToBack()},
 * allow the same structure to be used for round-robin bookkeeping.
 *
 * <p>Every operation holds the lock only for the structural change itself. Elements are never
 * inspected beyond {@link Object#equals(Object)}, so no caller code runs under the lock.
 *
 * @param <T> element type, never null
 */
public class OwnedQueue<T> {

  private final ArrayDeque<T> data = new ArrayDeque<>();
  private final AutoCloseableLock guard;

  public OwnedQueue() {
    this(new ExclusiveLock());
  }

  public OwnedQueue(Lockable lock) {
    this.guard = new AutoCloseableLock(lock);
  }

  public void pushBack(T value) {
    Preconditions.checkNotNull(value, "value");
    try (AutoCloseableLock ignored = guard.open()) {
      data.addLast(value);
    }
  }

  public void pushFront(T value) {
    Preconditions.checkNotNull(value, "value");
    try (AutoCloseableLock ignored = guard.open()) {
      data.addFirst(value);
    }
  }

  public Optional<T> popFront() {
    try (AutoCloseableLock ignored = guard.open()) {
      return Optional.ofNullable(data.pollFirst());
    }
  }

  public Optional<T> popBack() {
    try (AutoCloseableLock ignored = guard.open()) {
      return Optional.ofNullable(data.pollLast());
    }
  }

  /** Removes from the back on behalf of another thread. Same semantics as {@link #popBack()}. */
  public Optional<T> steal() {
    return popBack();
  }

  /**
   * Moves {@code value} to the front. The first element equal to it is removed if present, and
   * {@code value} is inserted at the front either way.
   */
  public void rotateToFront(T value) {
    Preconditions.checkNotNull(value, "value");
    try (AutoCloseableLock ignored = guard.open()) {
      data.removeFirstOccurrence(value);
      data.addFirst(value);
    }
  }

  /** Moves the front element to the back and returns it; empty if the queue is empty. */
  public Optional<T> copyFrontAndRotateToBack() {
    try (AutoCloseableLock ignored = guard.open()) {
      final T front = data.pollFirst();
      if (front == null) {
        return Optional.empty();
      }
      data.addLast(front);
      return Optional.of(front);
    }
  }

  /** Removes the first element equal to {@code value}. */
  public boolean remove(T value) {
    try (AutoCloseableLock ignored = guard.open()) {
      return data.removeFirstOccurrence(value);
    }
  }

  public boolean isEmpty() {
    try (AutoCloseableLock ignored = guard.open()) {
      return data.isEmpty();
    }
  }

  public int size() {
    try (AutoCloseableLock ignored = guard.open()) {
      return data.size();
    }
  }

  public void clear() {
    try (AutoCloseableLock ignored = guard.open()) {
      data.clear();
    }
  }

  /** Removes every element and returns them front to back. */
  public List<T> drain() {
    try (AutoCloseableLock ignored = guard.open()) {
      final List<T> drained = new ArrayList<>(data.size());
      for (Iterator<T> it = data.iterator(); it.hasNext(); ) {
        drained.add(it.next());
        it.remove();
      }
      return drained;
    }
  }

  /** Copy of the current contents, front to back. */
  public List<T> snapshot() {
    try (AutoCloseableLock ignored = guard.open()) {
      return new ArrayList<>(data);
    }
  }

  @Override
  public String toString() {
    return "OwnedQueue" + snapshot();
  }
}
