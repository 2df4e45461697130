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

import static java.util.Objects.requireNonNull;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * What a down-visitor wants the walker to do next.
 *
 * <p>A visitor may ask the walker to descend into the node's children (the
 * default), to cut (skip the children), and in either case may supply a
 * replacement for the node. The replacement is installed in the parent's
 * slot, and it is the replacement's children that are walked.
 *
 * @param <N> Node type
 */
public final class Visit<N> {
  @SuppressWarnings("rawtypes")
  private static final Visit DESCEND = new Visit<>(null, false);

  @SuppressWarnings("rawtypes")
  private static final Visit CUT = new Visit<>(null, true);

  private final @Nullable N replacement;
  private final boolean cut;

  private Visit(@Nullable N replacement, boolean cut) {
    this.replacement = replacement;
    this.cut = cut;
  }

  /** Walk the node's children. */
  @SuppressWarnings("unchecked")
  public static <N> Visit<N> descend() {
    return (Visit<N>) DESCEND;
  }

  /** Skip the node's children; the up-visitor is still called. */
  @SuppressWarnings("unchecked")
  public static <N> Visit<N> cut() {
    return (Visit<N>) CUT;
  }

  /** Replace the node, then walk the replacement's children. */
  public static <N> Visit<N> replace(N replacement) {
    return new Visit<>(requireNonNull(replacement), false);
  }

  /** Replace the node, and skip the replacement's children. */
  public static <N> Visit<N> replaceAndCut(N replacement) {
    return new Visit<>(requireNonNull(replacement), true);
  }

  /** Returns whether the walker should skip the node's children. */
  public boolean isCut() {
    return cut;
  }

  /** Returns the replacement, or null if the node is to be kept. */
  public @Nullable N replacement() {
    return replacement;
  }

  /** Returns the replacement, or the given node if there is none. */
  public N apply(N node) {
    return replacement != null ? replacement : node;
  }

  @Override
  public String toString() {
    return (cut ? "cut" : "descend")
        + (replacement == null ? "" : " replace " + replacement);
  }
}

// End Visit.java
