/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.coinduct.compile;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;
import net.hydromatic.coinduct.type.Obligation;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Obligations waiting to be expanded.
 *
 * <p>Obligations are removed in the reverse of the order they were added.
 * Adding an obligation that is equal to one that is already pending has no
 * effect; an obligation that has been removed may be added again.
 */
public class WorkList {
  private final Deque<Obligation> stack = new ArrayDeque<>();
  private final Set<Obligation> pending = new HashSet<>();

  /**
   * Adds an obligation, unless an equal obligation is pending. Returns whether
   * the obligation was added.
   */
  public boolean add(Obligation obligation) {
    if (!pending.add(obligation)) {
      return false;
    }
    stack.push(obligation);
    return true;
  }

  /** Removes the most recently added obligation, or returns null. */
  public @Nullable Obligation poll() {
    final Obligation obligation = stack.poll();
    if (obligation != null) {
      pending.remove(obligation);
    }
    return obligation;
  }

  /** Returns the number of pending obligations. */
  public int size() {
    return stack.size();
  }

  /** Returns whether there are no pending obligations. */
  public boolean isEmpty() {
    return stack.isEmpty();
  }

  @Override
  public String toString() {
    return stack.toString();
  }
}

// End WorkList.java
