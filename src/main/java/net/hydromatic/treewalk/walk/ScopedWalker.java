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
import static net.hydromatic.treewalk.util.Static.plus;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import net.hydromatic.treewalk.ast.Ast;
import net.hydromatic.treewalk.ast.AstNode;

/**
 * Walker that knows which identifiers are in scope.
 *
 * <p>Wraps the visitors of a {@link WalkConfig} with visitors that maintain a
 * {@link Scope}. Each identifier in expression position is reported to the
 * configuration's {@link WalkConfig#boundId} visitor, with the node that binds
 * it, or to its {@link WalkConfig#freeId} visitor if no binder is in scope.
 *
 * <p>Blocks, functions and for loops each open a level of scope, which is
 * closed when the walker leaves them. The exception is a {@code repeat}
 * statement: its condition can see the locals of its body, so the repeat
 * owns a single level covering both, and walks them itself.
 *
 * <p>The configuration's own down-visitors run before the scope is updated.
 * If a down-visitor cuts, no level of scope is opened for that node.
 */
public class ScopedWalker {
  private final WalkConfig config;
  private final WalkConfig scopedConfig;
  private final Scope<AstNode> scope = new Scope<>();
  /** For each node being walked, whether it opened a level of scope. */
  private final Deque<Boolean> opened = new ArrayDeque<>();

  private ScopedWalker(WalkConfig config) {
    this.config = requireNonNull(config);
    this.scopedConfig =
        config.withExpDown(this::expDown)
            .withExpUp(this::expUp)
            .withStatDown(this::statDown)
            .withStatUp(this::statUp)
            .withBlockDown(this::blockDown)
            .withBlockUp(this::blockUp)
            .withBinder(this::binder);
  }

  /** Walks an expression, classifying its identifiers. */
  public static Ast.Exp walkExp(WalkConfig config, Ast.Exp exp) {
    return Walker.walkExp(new ScopedWalker(config).scopedConfig, exp);
  }

  /** Walks a statement, classifying its identifiers. */
  public static Ast.Stat walkStat(WalkConfig config, Ast.Stat stat) {
    return Walker.walkStat(new ScopedWalker(config).scopedConfig, stat);
  }

  /** Walks a block, classifying its identifiers. */
  public static Ast.Block walkBlock(WalkConfig config, Ast.Block block) {
    return Walker.walkBlock(new ScopedWalker(config).scopedConfig, block);
  }

  /** Walks a node of unknown category, classifying its identifiers. */
  public static AstNode guess(WalkConfig config, AstNode node) {
    return Walker.guess(new ScopedWalker(config).scopedConfig, node);
  }

  private Visit<Ast.Exp> expDown(Ast.Exp exp, List<AstNode> ancestors) {
    final Visit<Ast.Exp> visit = config.expDown.visit(exp, ancestors);
    final Ast.Exp exp2 = visit.apply(exp);
    switch (exp2.op) {
      case ID:
        final Ast.Id id = (Ast.Id) exp2;
        final AstNode binder = scope.get(id.name);
        if (binder != null) {
          config.boundId.visit(id, binder, ancestors);
        } else {
          config.freeId.visit(id, ancestors);
        }
        opened.push(false);
        break;

      case FUNCTION:
        open(!visit.isCut());
        break;

      default:
        opened.push(false);
    }
    return visit;
  }

  private void expUp(Ast.Exp exp, List<AstNode> ancestors) {
    close();
    config.expUp.visit(exp, ancestors);
  }

  private Visit<Ast.Stat> statDown(Ast.Stat stat, List<AstNode> ancestors) {
    final Visit<Ast.Stat> visit = config.statDown.visit(stat, ancestors);
    if (visit.isCut()) {
      opened.push(false);
      return visit;
    }
    final Ast.Stat stat2 = visit.apply(stat);
    switch (stat2.op()) {
      case FOR_NUM:
      case FOR_IN:
        open(true);
        return visit;

      case REPEAT:
        // The condition is walked in the same scope as the body.
        final Ast.Repeat repeat = (Ast.Repeat) stat2.node();
        final List<AstNode> inner = plus(repeat, ancestors);
        scope.push();
        final Ast.Block body =
            Walker.walkBlock(scopedConfig, repeat.body, inner);
        final Ast.Exp condition =
            Walker.walkExp(scopedConfig, repeat.condition, inner);
        scope.pop();
        opened.push(false);
        return Visit.replaceAndCut(repeat.copy(body, condition));

      default:
        opened.push(false);
        return visit;
    }
  }

  private void statUp(Ast.Stat stat, List<AstNode> ancestors) {
    close();
    config.statUp.visit(stat, ancestors);
  }

  private Visit<Ast.Block> blockDown(Ast.Block block,
      List<AstNode> ancestors) {
    final Visit<Ast.Block> visit = config.blockDown.visit(block, ancestors);
    open(!visit.isCut() && !isRepeatBody(block, ancestors));
    return visit;
  }

  private void blockUp(Ast.Block block, List<AstNode> ancestors) {
    close();
    config.blockUp.visit(block, ancestors);
  }

  private void binder(Ast.Id id, AstNode binder, List<AstNode> ancestors) {
    scope.add(id.name, binder);
    config.binder.visit(id, binder, ancestors);
  }

  /**
   * Returns whether a block is the body of a {@code repeat}, whose level of
   * scope has already been opened by the repeat.
   */
  private static boolean isRepeatBody(Ast.Block block,
      List<AstNode> ancestors) {
    if (ancestors.isEmpty()) {
      return false;
    }
    final AstNode parent = ancestors.get(0);
    return parent instanceof Ast.Repeat
        && ((Ast.Repeat) parent).body == block;
  }

  private void open(boolean b) {
    if (b) {
      scope.push();
    }
    opened.push(b);
  }

  private void close() {
    if (opened.pop()) {
      scope.pop();
    }
  }
}

// End ScopedWalker.java
