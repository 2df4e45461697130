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

import java.util.List;
import net.hydromatic.treewalk.ast.Ast;
import net.hydromatic.treewalk.ast.AstNode;

/**
 * Called on various events during a walk.
 *
 * @see Tracers
 */
public interface Tracer {
  /** Called when the walker arrives at a node, before its down-visitor. */
  void onDown(AstNode node, List<AstNode> ancestors);

  /** Called when a down-visitor replaces a node. */
  void onReplace(AstNode before, AstNode after);

  /** Called when a down-visitor cuts, and the node's children are skipped. */
  void onCut(AstNode node);

  /** Called when an identifier is bound, before the binder visitor. */
  void onBind(Ast.Id id, AstNode binder);

  /** Called when the walker leaves a node, after its up-visitor. */
  void onUp(AstNode node, List<AstNode> ancestors);
}

// End Tracer.java
