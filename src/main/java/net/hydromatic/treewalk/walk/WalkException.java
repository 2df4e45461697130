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
import java.util.List;
import net.hydromatic.treewalk.ast.AstNode;
import net.hydromatic.treewalk.ast.Pos;

/**
 * A tree could not be walked because it is malformed: a node has a kind the
 * walker does not recognize, a binder has no identifiers, or the tree is
 * nested too deeply.
 *
 * <p>Exceptions thrown by visitors are not wrapped in this exception; they
 * reach the walk's caller unchanged.
 */
public class WalkException extends RuntimeException {
  private final AstNode node;
  private final ImmutableList<AstNode> ancestors;

  public WalkException(String message, AstNode node, List<AstNode> ancestors) {
    super(message);
    this.node = node;
    this.ancestors = ImmutableList.copyOf(ancestors);
  }

  @Override
  public String toString() {
    return super.toString() + " at " + node.pos;
  }

  /** Returns the node that could not be walked. */
  public AstNode node() {
    return node;
  }

  /** Returns the ancestors of the node, its parent first. */
  public List<AstNode> ancestors() {
    return ancestors;
  }

  public Pos pos() {
    return node.pos;
  }

  public StringBuilder describeTo(StringBuilder buf) {
    return node.pos.describeTo(buf).append(" Error: ").append(getMessage());
  }
}

// End WalkException.java
