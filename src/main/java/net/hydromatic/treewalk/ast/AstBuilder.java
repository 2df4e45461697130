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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.math.BigDecimal;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Builds parse tree nodes.
 *
 * <p>This is the only way to create nodes. A parser (not part of this
 * library) or a visitor that wants to replace a node calls these methods.
 */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  // expressions

  public Ast.Id id(Pos pos, String name) {
    return new Ast.Id(pos, name);
  }

  /** Creates a {@code nil} literal. */
  public Ast.Literal nilLiteral(Pos pos) {
    return new Ast.Literal(pos, Op.NIL_LITERAL, null);
  }

  /** Creates a {@code boolean} literal. */
  public Ast.Literal boolLiteral(Pos pos, boolean b) {
    return new Ast.Literal(pos, Op.BOOL_LITERAL, b);
  }

  /** Creates a number literal. */
  public Ast.Literal numberLiteral(Pos pos, BigDecimal value) {
    return new Ast.Literal(pos, Op.NUMBER_LITERAL, value);
  }

  /** Creates a string literal. */
  public Ast.Literal stringLiteral(Pos pos, String value) {
    return new Ast.Literal(pos, Op.STRING_LITERAL, value);
  }

  public Ast.Dots dots(Pos pos) {
    return new Ast.Dots(pos);
  }

  public Ast.Function function(
      Pos pos, List<Ast.Id> params, boolean varargs, Ast.Block body) {
    return new Ast.Function(pos, ImmutableList.copyOf(params), varargs, body);
  }

  public Ast.Call call(Pos pos, Ast.Exp fn, List<Ast.Exp> args) {
    return new Ast.Call(pos, fn, ImmutableList.copyOf(args));
  }

  public Ast.Invoke invoke(
      Pos pos, Ast.Exp receiver, String method, List<Ast.Exp> args) {
    return new Ast.Invoke(pos, receiver, method, ImmutableList.copyOf(args));
  }

  public Ast.Index index(Pos pos, Ast.Exp table, Ast.Exp key) {
    return new Ast.Index(pos, table, key);
  }

  public Ast.Table table(Pos pos, List<Ast.Exp> items) {
    return new Ast.Table(pos, ImmutableList.copyOf(items));
  }

  public Ast.Pair pair(Pos pos, Ast.Exp key, Ast.Exp value) {
    return new Ast.Pair(pos, key, value);
  }

  public Ast.Paren paren(Pos pos, Ast.Exp exp) {
    return new Ast.Paren(pos, exp);
  }

  /** Creates a call to a binary operator, such as {@link Op#PLUS}. */
  public Ast.InfixCall infixCall(Pos pos, Op op, Ast.Exp a0, Ast.Exp a1) {
    checkArgument(op.isBinary(), "not a binary operator: %s", op);
    return new Ast.InfixCall(pos, op, a0, a1);
  }

  /** Creates a call to a unary operator, such as {@link Op#NOT}. */
  public Ast.PrefixCall prefixCall(Pos pos, Op op, Ast.Exp a) {
    checkArgument(op.isUnary(), "not a unary operator: %s", op);
    return new Ast.PrefixCall(pos, op, a);
  }

  // statements

  public Ast.Local local(Pos pos, List<Ast.Id> names, List<Ast.Exp> values) {
    return new Ast.Local(
        pos, ImmutableList.copyOf(names), ImmutableList.copyOf(values));
  }

  public Ast.LocalRec localRec(
      Pos pos, List<Ast.Id> names, List<Ast.Exp> values) {
    return new Ast.LocalRec(
        pos, ImmutableList.copyOf(names), ImmutableList.copyOf(values));
  }

  public Ast.Set set(Pos pos, List<Ast.Exp> targets, List<Ast.Exp> values) {
    return new Ast.Set(
        pos, ImmutableList.copyOf(targets), ImmutableList.copyOf(values));
  }

  public Ast.ForNum forNum(
      Pos pos,
      Ast.Id var,
      Ast.Exp first,
      Ast.Exp last,
      Ast.@Nullable Exp step,
      Ast.Block body) {
    return new Ast.ForNum(pos, var, first, last, step, body);
  }

  public Ast.ForIn forIn(
      Pos pos, List<Ast.Id> vars, List<Ast.Exp> exps, Ast.Block body) {
    return new Ast.ForIn(
        pos, ImmutableList.copyOf(vars), ImmutableList.copyOf(exps), body);
  }

  public Ast.Repeat repeat(Pos pos, Ast.Block body, Ast.Exp condition) {
    return new Ast.Repeat(pos, body, condition);
  }

  public Ast.While whileDo(Pos pos, Ast.Exp condition, Ast.Block body) {
    return new Ast.While(pos, condition, body);
  }

  /**
   * Creates an {@code if} statement. There is one block per condition, plus
   * an optional trailing {@code else} block.
   */
  public Ast.If ifThen(
      Pos pos, List<Ast.Exp> conditions, List<Ast.Block> blocks) {
    return new Ast.If(
        pos, ImmutableList.copyOf(conditions), ImmutableList.copyOf(blocks));
  }

  public Ast.Do doBlock(Pos pos, Ast.Block body) {
    return new Ast.Do(pos, body);
  }

  public Ast.Return returns(Pos pos, List<Ast.Exp> values) {
    return new Ast.Return(pos, ImmutableList.copyOf(values));
  }

  public Ast.Break breakStat(Pos pos) {
    return new Ast.Break(pos);
  }

  // blocks

  public Ast.Block block(Pos pos, List<? extends Ast.Stat> stats) {
    return new Ast.Block(pos, ImmutableList.copyOf(stats));
  }
}

// End AstBuilder.java
