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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Visits and transforms syntax trees.
 *
 * <p>Each method returns the node's replacement, which is the node itself
 * unless a child changed. Unlike {@link net.hydromatic.treewalk.walk.Walker},
 * a shuttle also visits the identifiers in binder slots.
 */
public class Shuttle {
  protected List<Ast.Exp> visitExps(List<Ast.Exp> exps) {
    final ImmutableList.Builder<Ast.Exp> list = ImmutableList.builder();
    for (Ast.Exp exp : exps) {
      list.add(exp.accept(this));
    }
    return list.build();
  }

  protected List<Ast.Id> visitIds(List<Ast.Id> ids) {
    final ImmutableList.Builder<Ast.Id> list = ImmutableList.builder();
    for (Ast.Id id : ids) {
      list.add(id.accept(this));
    }
    return list.build();
  }

  protected List<Ast.Block> visitBlocks(List<Ast.Block> blocks) {
    final ImmutableList.Builder<Ast.Block> list = ImmutableList.builder();
    for (Ast.Block block : blocks) {
      list.add(block.accept(this));
    }
    return list.build();
  }

  // expressions

  protected Ast.Id visit(Ast.Id id) {
    return id; // leaf
  }

  protected Ast.Exp visit(Ast.Literal literal) {
    return literal; // leaf
  }

  protected Ast.Exp visit(Ast.Dots dots) {
    return dots; // leaf
  }

  protected Ast.Exp visit(Ast.Function function) {
    return function.copy(
        visitIds(function.params), function.body.accept(this));
  }

  protected Ast.Call visit(Ast.Call call) {
    return call.copy(call.fn.accept(this), visitExps(call.args));
  }

  protected Ast.Invoke visit(Ast.Invoke invoke) {
    return invoke.copy(invoke.receiver.accept(this), visitExps(invoke.args));
  }

  protected Ast.Exp visit(Ast.Index index) {
    return index.copy(index.table.accept(this), index.key.accept(this));
  }

  protected Ast.Exp visit(Ast.Table table) {
    return table.copy(visitExps(table.items));
  }

  protected Ast.Exp visit(Ast.Pair pair) {
    return pair.copy(pair.key.accept(this), pair.value.accept(this));
  }

  protected Ast.Exp visit(Ast.Paren paren) {
    return paren.copy(paren.exp.accept(this));
  }

  protected Ast.Exp visit(Ast.InfixCall infixCall) {
    return infixCall.copy(infixCall.a0.accept(this), infixCall.a1.accept(this));
  }

  protected Ast.Exp visit(Ast.PrefixCall prefixCall) {
    return prefixCall.copy(prefixCall.a.accept(this));
  }

  // statements

  protected Ast.Stat visit(Ast.Local local) {
    return local.copy(visitIds(local.names), visitExps(local.values));
  }

  protected Ast.Stat visit(Ast.LocalRec localRec) {
    return localRec.copy(visitIds(localRec.names), visitExps(localRec.values));
  }

  protected Ast.Stat visit(Ast.Set set) {
    return set.copy(visitExps(set.targets), visitExps(set.values));
  }

  protected Ast.Stat visit(Ast.ForNum forNum) {
    return forNum.copy(
        forNum.var.accept(this),
        forNum.first.accept(this),
        forNum.last.accept(this),
        forNum.step == null ? null : forNum.step.accept(this),
        forNum.body.accept(this));
  }

  protected Ast.Stat visit(Ast.ForIn forIn) {
    return forIn.copy(
        visitIds(forIn.vars), visitExps(forIn.exps), forIn.body.accept(this));
  }

  protected Ast.Stat visit(Ast.Repeat repeat) {
    return repeat.copy(
        repeat.body.accept(this), repeat.condition.accept(this));
  }

  protected Ast.Stat visit(Ast.While aWhile) {
    return aWhile.copy(aWhile.condition.accept(this), aWhile.body.accept(this));
  }

  protected Ast.Stat visit(Ast.If anIf) {
    return anIf.copy(visitExps(anIf.conditions), visitBlocks(anIf.blocks));
  }

  protected Ast.Stat visit(Ast.Do aDo) {
    return aDo.copy(aDo.body.accept(this));
  }

  protected Ast.Stat visit(Ast.Return aReturn) {
    return aReturn.copy(visitExps(aReturn.values));
  }

  protected Ast.Stat visit(Ast.Break aBreak) {
    return aBreak; // leaf
  }

  // blocks

  protected Ast.Block visit(Ast.Block block) {
    final ImmutableList.Builder<Ast.Stat> list = ImmutableList.builder();
    for (Ast.Stat stat : block.stats) {
      list.add(stat.accept(this));
    }
    return block.copy(list.build());
  }
}

// End Shuttle.java
