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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import net.hydromatic.treewalk.ast.Ast;
import net.hydromatic.treewalk.ast.AstNode;

/**
 * Finds the free identifiers of a tree, that is, the identifiers that are used
 * but not bound within it.
 *
 * <p>For example, in "{@code function(x) return x + y end}", "y" is free and
 * "x" is not.
 */
public class FreeFinder {
  private FreeFinder() {}

  /**
   * Returns the names of the free identifiers in a tree, in the order that
   * they first occur.
   */
  public static ImmutableSet<String> freeNames(AstNode node) {
    final ImmutableSet.Builder<String> names = ImmutableSet.builder();
    ScopedWalker.guess(
        WalkConfig.EMPTY.withFreeId((id, ancestors) -> names.add(id.name)),
        node);
    return names.build();
  }

  /** Returns every free identifier occurrence in a tree. */
  public static ImmutableList<Ast.Id> freeIds(AstNode node) {
    final ImmutableList.Builder<Ast.Id> ids = ImmutableList.builder();
    ScopedWalker.guess(
        WalkConfig.EMPTY.withFreeId((id, ancestors) -> ids.add(id)), node);
    return ids.build();
  }
}

// End FreeFinder.java
