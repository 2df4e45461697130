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
package net.hydromatic.treewalk.ast;

/**
 * The three groups of nodes that a walk distinguishes.
 *
 * @see Op#category
 */
public enum Category {
  /** Expression, such as an identifier, a literal or a function. */
  EXP,
  /** Statement, such as a local declaration, a loop or an assignment. */
  STAT,
  /** Sequence of statements. */
  BLOCK;

  /**
   * Returns the category of a node, deduced from its kind tag.
   *
   * <p>A call or method invocation can occur both as an expression and as a
   * statement; without knowing which slot it came from, it is treated as an
   * expression.
   */
  public static Category of(AstNode node) {
    return node.op.category;
  }
}

// End Category.java
