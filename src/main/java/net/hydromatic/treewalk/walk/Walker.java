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

import static net.hydromatic.treewalk.util.Static.skip;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.treewalk.ast.Ast;
import net.hydromatic.treewalk.ast.AstNode;
import net.hydromatic.treewalk.ast.Category;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Walks a syntax tree, calling the visitors of a {@link WalkConfig}.
 *
 * <p>For each node, the walker calls the down-visitor of the node's category,
 * walks the node's children left to right (unless the down-visitor cut), then
 * calls the up-visitor. If a down-visitor supplies a replacement, the
 * replacement takes the node's place in its parent, and it is the
 * replacement's children that are walked.
 *
 * <p>The category of a node is decided by the slot that holds it. In
 * particular, a {@link Ast.Call} or {@link Ast.Invoke} in a block is visited
 * as a statement, and one inside an expression is visited as an expression.
 *
 * <p>Identifiers in binder slots (the names of a local declaration, the
 * parameters of a function, the variables of a for loop) are not visited as
 * expressions; they go to the binder visitor. Bindings are reported at the
 * point where they become visible:
 *
 * <ul>
 *   <li>{@code local}: after the values;
 *   <li>{@code local function}: before the values;
 *   <li>numeric {@code for}: after the bounds, before the body;
 *   <li>generic {@code for}: after the iterated expressions, before the body;
 *   <li>{@code function}: before the body.
 * </ul>
 *
 * <p>A {@code repeat} statement is walked body then condition, like any other
 * statement. A visitor that tracks scopes needs the condition to see the
 * body's locals; it should cut the repeat and walk its parts itself, passing
 * the repeat's ancestors to {@link #walkBlock(WalkConfig, Ast.Block, List)}.
 */
public class Walker {
  private final WalkConfig config;
  private final int maxDepth;
  /** Nodes being walked, root first. */
  private final List<AstNode> stack = new ArrayList<>();
  /** View of {@link #stack}, parent first. */
  private final List<AstNode> ancestors = Lists.reverse(stack);

  private Walker(WalkConfig config, List<AstNode> ancestors) {
    this.config = config;
    this.maxDepth = Prop.MAX_DEPTH.intValue(config.props);
    this.stack.addAll(Lists.reverse(ancestors));
  }

  /** Walks an expression. Returns the expression, or its replacement. */
  public static Ast.Exp walkExp(WalkConfig config, Ast.Exp exp) {
    return walkExp(config, exp, ImmutableList.of());
  }

  /**
   * Walks an expression that has the given ancestors. Use this method to walk
   * part of a tree from inside a visitor.
   */
  public static Ast.Exp walkExp(WalkConfig config, Ast.Exp exp,
      List<AstNode> ancestors) {
    return new Walker(config, ancestors).exp(exp);
  }

  /** Walks a statement. Returns the statement, or its replacement. */
  public static Ast.Stat walkStat(WalkConfig config, Ast.Stat stat) {
    return walkStat(config, stat, ImmutableList.of());
  }

  /** Walks a statement that has the given ancestors. */
  public static Ast.Stat walkStat(WalkConfig config, Ast.Stat stat,
      List<AstNode> ancestors) {
    return new Walker(config, ancestors).stat(stat);
  }

  /** Walks a block. Returns the block, or its replacement. */
  public static Ast.Block walkBlock(WalkConfig config, Ast.Block block) {
    return walkBlock(config, block, ImmutableList.of());
  }

  /** Walks a block that has the given ancestors. */
  public static Ast.Block walkBlock(WalkConfig config, Ast.Block block,
      List<AstNode> ancestors) {
    return new Walker(config, ancestors).block(block);
  }

  /**
   * Walks a node whose category is not known, deducing the category from its
   * kind tag. A call is walked as an expression.
   */
  public static AstNode guess(WalkConfig config, AstNode node) {
    return guess(config, node, ImmutableList.of());
  }

  /** Walks a node of unknown category that has the given ancestors. */
  public static AstNode guess(WalkConfig config, AstNode node,
      List<AstNode> ancestors) {
    final Category category = Category.of(node);
    switch (category) {
      case EXP:
        return walkExp(config, (Ast.Exp) node, ancestors);
      case STAT:
        return walkStat(config, (Ast.Stat) node, ancestors).node();
      case BLOCK:
        return walkBlock(config, (Ast.Block) node, ancestors);
      default:
        throw new AssertionError("unknown category " + category);
    }
  }

  // expressions

  private Ast.Exp exp(Ast.Exp exp) {
    checkDepth(exp);
    config.tracer.onDown(exp, ancestors);
    final Visit<Ast.Exp> visit = config.expDown.visit(exp, ancestors);
    final Ast.Exp exp2 = replaced(exp, visit);
    final Ast.Exp exp3;
    if (visit.isCut()) {
      config.tracer.onCut(exp2);
      exp3 = exp2;
    } else {
      stack.add(exp2);
      exp3 = expChildren(exp2);
      stack.remove(stack.size() - 1);
    }
    config.expUp.visit(exp3, ancestors);
    config.tracer.onUp(exp3, ancestors);
    return exp3;
  }

  private Ast.Exp expChildren(Ast.Exp exp) {
    switch (exp.op) {
      case ID:
      case NIL_LITERAL:
      case BOOL_LITERAL:
      case NUMBER_LITERAL:
      case STRING_LITERAL:
      case DOTS:
        return exp;

      case FUNCTION:
        final Ast.Function function = (Ast.Function) exp;
        for (Ast.Id param : function.params) {
          bind(param, function);
        }
        return function.copy(function.params, block(function.body));

      case CALL:
        final Ast.Call call = (Ast.Call) exp;
        return call.copy(exp(call.fn), exps(call.args));

      case INVOKE:
        final Ast.Invoke invoke = (Ast.Invoke) exp;
        return invoke.copy(exp(invoke.receiver), exps(invoke.args));

      case INDEX:
        final Ast.Index index = (Ast.Index) exp;
        return index.copy(exp(index.table), exp(index.key));

      case TABLE:
        final Ast.Table table = (Ast.Table) exp;
        return table.copy(exps(table.items));

      case PAIR:
        final Ast.Pair pair = (Ast.Pair) exp;
        return pair.copy(exp(pair.key), exp(pair.value));

      case PAREN:
        final Ast.Paren paren = (Ast.Paren) exp;
        return paren.copy(exp(paren.exp));

      default:
        if (exp.op.isBinary() && exp instanceof Ast.InfixCall) {
          final Ast.InfixCall infixCall = (Ast.InfixCall) exp;
          return infixCall.copy(exp(infixCall.a0), exp(infixCall.a1));
        }
        if (exp.op.isUnary() && exp instanceof Ast.PrefixCall) {
          final Ast.PrefixCall prefixCall = (Ast.PrefixCall) exp;
          return prefixCall.copy(exp(prefixCall.a));
        }
        throw malformed("unknown expression kind " + exp.op, exp);
    }
  }

  private List<Ast.Exp> exps(List<Ast.Exp> exps) {
    final List<Ast.Exp> list = new ArrayList<>(exps.size());
    for (Ast.Exp exp : exps) {
      list.add(exp(exp));
    }
    return list;
  }

  // statements

  private Ast.Stat stat(Ast.Stat stat) {
    checkDepth(stat.node());
    config.tracer.onDown(stat.node(), ancestors);
    final Visit<Ast.Stat> visit = config.statDown.visit(stat, ancestors);
    final Ast.Stat stat2 = replaced(stat, visit);
    final Ast.Stat stat3;
    if (visit.isCut()) {
      config.tracer.onCut(stat2.node());
      stat3 = stat2;
    } else {
      stack.add(stat2.node());
      stat3 = statChildren(stat2.node());
      stack.remove(stack.size() - 1);
    }
    config.statUp.visit(stat3, ancestors);
    config.tracer.onUp(stat3.node(), ancestors);
    return stat3;
  }

  private Ast.Stat statChildren(AstNode node) {
    switch (node.op) {
      case CALL:
        final Ast.Call call = (Ast.Call) node;
        return call.copy(exp(call.fn), exps(call.args));

      case INVOKE:
        final Ast.Invoke invoke = (Ast.Invoke) node;
        return invoke.copy(exp(invoke.receiver), exps(invoke.args));

      case LOCAL:
        final Ast.Local local = (Ast.Local) node;
        checkNames(local.names, local);
        final List<Ast.Exp> values = exps(local.values);
        for (Ast.Id name : local.names) {
          bind(name, local);
        }
        return local.copy(local.names, values);

      case LOCAL_REC:
        final Ast.LocalRec localRec = (Ast.LocalRec) node;
        checkNames(localRec.names, localRec);
        for (Ast.Id name : localRec.names) {
          bind(name, localRec);
        }
        return localRec.copy(localRec.names, exps(localRec.values));

      case SET:
        final Ast.Set set = (Ast.Set) node;
        final List<Ast.Exp> targets = exps(set.targets);
        return set.copy(targets, exps(set.values));

      case FOR_NUM:
        final Ast.ForNum forNum = (Ast.ForNum) node;
        final Ast.Exp first = exp(forNum.first);
        final Ast.Exp last = exp(forNum.last);
        final Ast.@Nullable Exp step =
            forNum.step == null ? null : exp(forNum.step);
        bind(forNum.var, forNum);
        return forNum.copy(forNum.var, first, last, step, block(forNum.body));

      case FOR_IN:
        final Ast.ForIn forIn = (Ast.ForIn) node;
        checkNames(forIn.vars, forIn);
        final List<Ast.Exp> iterated = exps(forIn.exps);
        for (Ast.Id var : forIn.vars) {
          bind(var, forIn);
        }
        return forIn.copy(forIn.vars, iterated, block(forIn.body));

      case REPEAT:
        final Ast.Repeat repeat = (Ast.Repeat) node;
        final Ast.Block body = block(repeat.body);
        return repeat.copy(body, exp(repeat.condition));

      case WHILE:
        final Ast.While aWhile = (Ast.While) node;
        final Ast.Exp condition = exp(aWhile.condition);
        return aWhile.copy(condition, block(aWhile.body));

      case IF:
        final Ast.If anIf = (Ast.If) node;
        final List<Ast.Exp> conditions = new ArrayList<>();
        final List<Ast.Block> blocks = new ArrayList<>();
        for (int i = 0; i < anIf.conditions.size(); i++) {
          conditions.add(exp(anIf.conditions.get(i)));
          blocks.add(block(anIf.blocks.get(i)));
        }
        final Ast.@Nullable Block elseBlock = anIf.elseBlock();
        if (elseBlock != null) {
          blocks.add(block(elseBlock));
        }
        return anIf.copy(conditions, blocks);

      case DO:
        final Ast.Do aDo = (Ast.Do) node;
        return aDo.copy(block(aDo.body));

      case RETURN:
        final Ast.Return aReturn = (Ast.Return) node;
        return aReturn.copy(exps(aReturn.values));

      case BREAK:
        return (Ast.Break) node;

      default:
        throw malformed("unknown statement kind " + node.op, node);
    }
  }

  // blocks

  private Ast.Block block(Ast.Block block) {
    checkDepth(block);
    config.tracer.onDown(block, ancestors);
    final Visit<Ast.Block> visit = config.blockDown.visit(block, ancestors);
    final Ast.Block block2 = replaced(block, visit);
    final Ast.Block block3;
    if (visit.isCut()) {
      config.tracer.onCut(block2);
      block3 = block2;
    } else {
      stack.add(block2);
      final List<Ast.Stat> stats = new ArrayList<>(block2.stats.size());
      for (Ast.Stat stat : block2.stats) {
        stats.add(stat(stat));
      }
      block3 = block2.copy(stats);
      stack.remove(stack.size() - 1);
    }
    config.blockUp.visit(block3, ancestors);
    config.tracer.onUp(block3, ancestors);
    return block3;
  }

  // helpers

  private <N> N replaced(N node, Visit<N> visit) {
    final N node2 = visit.apply(node);
    if (node2 != node) {
      config.tracer.onReplace(asNode(node), asNode(node2));
    }
    return node2;
  }

  private static AstNode asNode(Object o) {
    return o instanceof Ast.Stat ? ((Ast.Stat) o).node() : (AstNode) o;
  }

  /**
   * Reports that an identifier has been bound. The binder is on top of the
   * stack.
   */
  private void bind(Ast.Id id, AstNode binder) {
    config.tracer.onBind(id, binder);
    config.binder.visit(id, binder, ancestors);
  }

  private void checkDepth(AstNode node) {
    if (stack.size() >= maxDepth) {
      throw new WalkException("maximum depth " + maxDepth + " exceeded", node,
          ancestors);
    }
  }

  private void checkNames(List<Ast.Id> names, AstNode binder) {
    if (names.isEmpty()) {
      throw malformed(binder.op + " binds no identifiers", binder);
    }
  }

  /** Creates an exception for a node that is on top of the stack. */
  private WalkException malformed(String message, AstNode node) {
    return new WalkException(message, node, skip(ancestors));
  }
}

// End Walker.java
