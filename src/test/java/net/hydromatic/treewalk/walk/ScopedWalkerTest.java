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

import static net.hydromatic.treewalk.Trees.block;
import static net.hydromatic.treewalk.Trees.call;
import static net.hydromatic.treewalk.Trees.doBlock;
import static net.hydromatic.treewalk.Trees.forIn;
import static net.hydromatic.treewalk.Trees.forNum;
import static net.hydromatic.treewalk.Trees.function;
import static net.hydromatic.treewalk.Trees.id;
import static net.hydromatic.treewalk.Trees.ids;
import static net.hydromatic.treewalk.Trees.ifThen;
import static net.hydromatic.treewalk.Trees.infix;
import static net.hydromatic.treewalk.Trees.local;
import static net.hydromatic.treewalk.Trees.localFunction;
import static net.hydromatic.treewalk.Trees.num;
import static net.hydromatic.treewalk.Trees.plus;
import static net.hydromatic.treewalk.Trees.repeat;
import static net.hydromatic.treewalk.Trees.ret;
import static net.hydromatic.treewalk.Trees.set;
import static net.hydromatic.treewalk.Trees.whileDo;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.treewalk.ast.Ast;
import net.hydromatic.treewalk.ast.AstNode;
import net.hydromatic.treewalk.ast.Op;
import org.junit.jupiter.api.Test;

/** Tests for {@link ScopedWalker}. */
public class ScopedWalkerTest {
  /**
   * Returns a configuration that records each identifier occurrence as
   * "name:BINDER_KIND" if it is bound, or "name:free".
   */
  private static WalkConfig classifier(List<String> events) {
    return WalkConfig.EMPTY
        .withBoundId((id, binder, ancestors) ->
            events.add(id.name + ":" + binder.op))
        .withFreeId((id, ancestors) -> events.add(id.name + ":free"));
  }

  private static List<String> classify(Ast.Block block) {
    final List<String> events = new ArrayList<>();
    ScopedWalker.walkBlock(classifier(events), block);
    return events;
  }

  @Test
  void testFunction() {
    final List<String> events = new ArrayList<>();
    final Ast.Function f =
        function(ids("x"), ret(plus(id("x"), id("y"))));
    assertThat(ScopedWalker.walkExp(classifier(events), f), sameInstance(f));
    assertThat(events, hasToString("[x:FUNCTION, y:free]"));

    events.clear();
    ScopedWalker.walkExp(classifier(events),
        function(ids("x"),
            ret(function(ids("y"),
                ret(plus(plus(id("x"), id("y")), id("z")))))));
    assertThat(events, hasToString("[x:FUNCTION, y:FUNCTION, z:free]"));
  }

  /**
   * Tests that the names declared by a local are not visible in its values.
   */
  @Test
  void testLocal() {
    assertThat(classify(block(local("x", id("x")), ret(id("x")))),
        hasToString("[x:free, x:LOCAL]"));
  }

  @Test
  void testShadowing() {
    final Ast.Local local1 = local("x", num(1));
    final Ast.Local local2 = local("x", id("x"));
    final List<AstNode> binders = new ArrayList<>();
    ScopedWalker.walkBlock(
        WalkConfig.EMPTY.withBoundId((id, binder, ancestors) ->
            binders.add(binder)),
        block(local1, local2, ret(id("x"))));
    assertThat(binders, hasSize(2));
    assertThat(binders.get(0), sameInstance(local1));
    assertThat(binders.get(1), sameInstance(local2));
  }

  /**
   * Tests that the condition of a repeat can see the locals of its body, but
   * the statements after it cannot.
   */
  @Test
  void testRepeat() {
    final AtomicInteger repeatDowns = new AtomicInteger();
    final AtomicInteger repeatUps = new AtomicInteger();
    final AtomicInteger localDowns = new AtomicInteger();
    final List<String> events = new ArrayList<>();
    final List<Op> conditionAncestors = new ArrayList<>();
    final WalkConfig config =
        classifier(events)
            .withStatDown((stat, ancestors) -> {
              if (stat.op() == Op.REPEAT) {
                repeatDowns.incrementAndGet();
              }
              return Visit.descend();
            })
            .withStatUp((stat, ancestors) -> {
              if (stat.op() == Op.REPEAT) {
                repeatUps.incrementAndGet();
              }
            })
            .withExpDown((exp, ancestors) -> {
              if (exp.op == Op.ID && ((Ast.Id) exp).name.equals("a")
                  && ancestors.get(0).op == Op.GT) {
                ancestors.forEach(node -> conditionAncestors.add(node.op));
              }
              return Visit.descend();
            })
            .withTracer(
                Tracers.withOnDown(Tracers.empty(), (node, ancestors) -> {
                  if (node.op == Op.LOCAL) {
                    localDowns.incrementAndGet();
                  }
                }));
    final Ast.Block tree =
        block(
            repeat(infix(Op.GT, id("a"), num(3)), local("a", call("f"))),
            ret(id("a")));
    assertThat(ScopedWalker.walkBlock(config, tree), sameInstance(tree));
    assertThat(events, hasToString("[f:free, a:LOCAL, a:free]"));
    assertThat(conditionAncestors, hasToString("[GT, REPEAT, BLOCK]"));
    assertThat(repeatDowns.get(), is(1));
    assertThat(repeatUps.get(), is(1));
    assertThat(localDowns.get(), is(1));
  }

  @Test
  void testLoops() {
    assertThat(
        classify(
            block(forNum("i", id("i"), num(10), ret(id("i"))),
                ret(id("i")))),
        hasToString("[i:free, i:FOR_NUM, i:free]"));
    assertThat(
        classify(
            block(
                forIn(ids("k"), ImmutableList.of(id("k")), ret(id("k"))),
                ret(id("k")))),
        hasToString("[k:free, k:FOR_IN, k:free]"));
    assertThat(
        classify(
            block(whileDo(id("a"), local("a", num(1)), ret(id("a"))),
                ret(id("a")))),
        hasToString("[a:free, a:LOCAL, a:free]"));
  }

  @Test
  void testBlocks() {
    assertThat(classify(block(doBlock(local("x", num(1))), ret(id("x")))),
        hasToString("[x:free]"));
    assertThat(
        classify(
            block(
                ifThen(id("c"), block(local("x", num(1))),
                    block(ret(id("x")))))),
        hasToString("[c:free, x:free]"));
    assertThat(classify(block(local("x", num(1)), set(id("x"), num(2)))),
        hasToString("[x:LOCAL]"));
  }

  /** Tests that a recursive local function can see itself. */
  @Test
  void testLocalFunction() {
    assertThat(
        classify(
            block(
                localFunction("f",
                    function(ids("n"), ret(call("f", id("n"))))))),
        hasToString("[f:LOCAL_REC, n:FUNCTION]"));
  }

  /**
   * Tests that a node cut by the caller's down-visitor is not classified, and
   * does not disturb the scope of what follows.
   */
  @Test
  void testCut() {
    final List<String> events = new ArrayList<>();
    final WalkConfig config =
        classifier(events).withExpDown((exp, ancestors) ->
            exp.op == Op.FUNCTION ? Visit.cut() : Visit.descend());
    ScopedWalker.walkBlock(config,
        block(local("g", function(ids("z"), ret(id("z")))),
            ret(id("g")), ret(id("z"))));
    assertThat(events, hasToString("[g:LOCAL, z:free]"));

    events.clear();
    final WalkConfig config2 =
        classifier(events).withStatDown((stat, ancestors) ->
            stat.op() == Op.REPEAT ? Visit.cut() : Visit.descend());
    ScopedWalker.walkBlock(config2,
        block(repeat(id("a"), local("a", num(1))), ret(id("a"))));
    assertThat(events, hasToString("[a:free]"));
  }

  /**
   * Tests that an identifier is classified after the caller's down-visitor has
   * replaced it.
   */
  @Test
  void testReplace() {
    final List<String> events = new ArrayList<>();
    final WalkConfig config =
        classifier(events).withExpDown((exp, ancestors) ->
            exp.op == Op.ID && ((Ast.Id) exp).name.equals("old")
                ? Visit.replace(id("x"))
                : Visit.descend());
    final Ast.Block block =
        ScopedWalker.walkBlock(config,
            block(local("x", num(1)), ret(id("old"))));
    assertThat(block, hasToString("local x = 1; return x"));
    assertThat(events, hasToString("[x:LOCAL]"));
  }

  @Test
  void testGuess() {
    final List<String> events = new ArrayList<>();
    final Ast.Local local = local("x", plus(id("x"), id("y")));
    assertThat(ScopedWalker.guess(classifier(events), local),
        sameInstance(local));
    assertThat(events, hasToString("[x:free, y:free]"));

    events.clear();
    ScopedWalker.walkStat(classifier(events),
        forNum("i", num(1), num(2), ret(id("i"))));
    assertThat(events, hasToString("[i:FOR_NUM]"));
  }
}

// End ScopedWalkerTest.java
