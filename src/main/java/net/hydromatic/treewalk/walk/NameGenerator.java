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
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Generates fresh names.
 *
 * <p>Keeps track of how many times each name has been used, so that each new
 * occurrence of a name can be given a fresh ordinal.
 *
 * <p>A generated name is never one of the reserved names, nor a name that the
 * generator has already returned.
 */
public class NameGenerator {
  private final String separator;
  private final Map<String, AtomicInteger> nameCounts = new HashMap<>();
  /** Reserved names, plus every name returned so far. */
  private final Set<String> taken;

  public NameGenerator(String separator) {
    this(separator, ImmutableSet.of());
  }

  public NameGenerator(String separator, Set<String> reserved) {
    this.separator = separator;
    this.taken = new HashSet<>(reserved);
  }

  /**
   * Returns the number of times that "name" has been used, and increments the
   * count.
   */
  public int inc(String name) {
    return nameCounts.computeIfAbsent(name, n -> new AtomicInteger(0))
        .getAndIncrement();
  }

  /**
   * Returns a fresh name derived from {@code name}; for example, "x$0" the
   * first time it is called for "x", "x$1" the second time. Skips ordinals
   * whose name is taken.
   */
  public String fresh(String name) {
    for (;;) {
      final String candidate = name + separator + inc(name);
      if (taken.add(candidate)) {
        return candidate;
      }
    }
  }
}

// End NameGenerator.java
