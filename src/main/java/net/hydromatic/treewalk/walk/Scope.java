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
package net.hydromatic.treewalk.walk;

import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;
import net.hydromatic.treewalk.ast.Ast;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Names that are visible at a point in a walk.
 *
 * <p>{@link #push()} saves the current set of names, and {@link #pop()}
 * restores it, discarding everything added in between. Pushes and pops must
 * balance; the scope does not check that they do.
 *
 * <p>A scope belongs to one walk, and is not thread-safe.
 *
 * @param <V> Value associated with each name, for example the node that binds
 *     it
 */
public class Scope<V> {
  private Map<String, V> current = new HashMap<>();
  private final Deque<Map<String, V>> saved = new ArrayDeque<>();

  /** Saves the current names, to be restored by the matching {@link #pop}. */
  public void push() {
    saved.push(current);
    current = new HashMap<>(current);
  }

  /**
   * Restores the names as they were at the matching {@link #push}.
   *
   * @throws IllegalStateException if there was no matching push
   */
  public void pop() {
    if (saved.isEmpty()) {
      throw new IllegalStateException("pop without matching push");
    }
    current = saved.pop();
  }

  /** Makes a name visible, hiding any previous value of the same name. */
  public void add(String name, V value) {
    current.put(name, value);
  }

  /** Makes each identifier's name visible. */
  public void addAll(Iterable<Ast.Id> ids, V value) {
    for (Ast.Id id : ids) {
      add(id.name, value);
    }
  }

  public boolean contains(String name) {
    return current.containsKey(name);
  }

  /** Returns the value of a visible name, or null if it is not visible. */
  public @Nullable V get(String name) {
    return current.get(name);
  }

  /** Returns the number of pushes that have not been popped. */
  public int depth() {
    return saved.size();
  }

  /** Returns the visible names. */
  public ImmutableSet<String> names() {
    return ImmutableSet.copyOf(current.keySet());
  }

  @Override
  public String toString() {
    return "Scope{depth=" + depth() + ", names=" + current.keySet() + "}";
  }
}

// End Scope.java
