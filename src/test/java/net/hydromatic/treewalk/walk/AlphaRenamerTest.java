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
import static net.hydromatic.treewalk.Trees.forNum;
import static net.hydromatic.treewalk.Trees.function;
import static net.hydromatic.treewalk.Trees.id;
import static net.hydromatic.treewalk.Trees.ids;
import static net.hydromatic.treewalk.Trees.infix;
import static net.hydromatic.treewalk.Trees.local;
import static net.hydromatic.treewalk.Trees.localFunction;
import static net.hydromatic.treewalk.Trees.num;
import static net.hydromatic.treewalk.Trees.plus;
import static net.hydromatic.treewalk.Trees.repeat;
import static net.hydromatic.treewalk.Trees.ret;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableSet;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.treewalk.ast.Ast;
import net.hydromatic.treewalk.ast.Op;
import org.junit.jupiter.api.Test;

/** Tests for {@link AlphaRenamer}. */
public class AlphaRenamerTest {
  @Test
  void testRename() {
    final Ast.Block block =
        block(local("x", num(1)), local("x", plus(id("x"), num(1))),
            ret(id("x")));
    assertThat(AlphaRenamer.rename(block),
        hasToString("local x$0 = 1; local x$1 = x$0 + 1; return x$1"));
    assertThat(block,
        hasToString("local x = 1; local x = x + 1; return x"));
  }

  /** Tests that a tree with no binders is returned unchanged. */
  @Test
  void testNothingBound() {
    final Ast.Block block = block(ret(plus(id("y"), num(1))));
    assertThat(AlphaRenamer.rename(block), sameInstance(block));
  }

  @Test
  void testRenameFunction() {
    final Ast.Block block =
        block(
            local("f",
                function(ids("x", "y"),
                    ret(plus(plus(id("x"), id("y")), id("z"))))),
            ret(call("f", num(1), num(2))));
    assertThat(AlphaRenamer.rename(block),
        hasToString("local f$0 = function(x$0, y$0) return x$0 + y$0 + z end; "
            + "return f$0(1, 2)"));
    assertThat(
        AlphaRenamer.rename(WalkConfig.EMPTY,
            function(ids("x"), ret(id("x")))),
        hasToString("function(x$0) return x$0 end"));
  }

  @Test
  void testRenameLocalFunction() {
    final Ast.Block block =
        block(
            localFunction("f",
                function(ids("n"), ret(call("f", id("n"))))));
    assertThat(AlphaRenamer.rename(block),
        hasToString("local function f$0(n$0) return f$0(n$0) end"));
  }

  @Test
  void testRenameRepeat() {
    final Ast.Block block =
        block(repeat(infix(Op.GT, id("a"), num(3)), local("a", call("f"))));
    assertThat(AlphaRenamer.rename(block),
        hasToString("repeat local a$0 = f() until a$0 > 3"));
  }

  /**
   * Tests that an inner declaration gets its own name, and the outer name is
   * used again after the inner block.
   */
  @Test
  void testRenameShadowed() {
    final Ast.Block block =
        block(local("x", num(1)),
            doBlock(local("x", num(2)), call("f", id("x"))),
            ret(id("x")));
    assertThat(AlphaRenamer.rename(block),
        hasToString("local x$0 = 1; do local x$1 = 2; f(x$1) end; "
            + "return x$0"));
  }

  @Test
  void testRenameForNum() {
    final Ast.Block block =
        block(forNum("i", num(1), id("i"), call("f", id("i"))));
    assertThat(AlphaRenamer.rename(block),
        hasToString("for i$0 = 1, i do f(i$0) end"));
  }

  @Test
  void testSeparator() {
    final WalkConfig config =
        WalkConfig.EMPTY.withProp(Prop.FRESH_NAME_SEPARATOR, "_");
    assertThat(
        AlphaRenamer.rename(config, block(local("x", num(1)), ret(id("x")))),
        hasToString("local x_0 = 1; return x_0"));
  }

  /**
   * Tests that renaming does not change the free names of a tree, and that the
   * renamer reports its walk to the tracer.
   */
  @Test
  void testFreeNamesPreserved() {
    final Ast.Block tree = WalkerTest.sampleTree();
    final String s = tree.toString();
    final List<String> binds = new ArrayList<>();
    final WalkConfig config =
        WalkConfig.EMPTY.withTracer(
            Tracers.withOnBind(Tracers.empty(),
                (id, binder) -> binds.add(id.name)));
    final Ast.Block renamed = AlphaRenamer.rename(config, tree);
    assertThat(FreeFinder.freeNames(renamed), is(FreeFinder.freeNames(tree)));
    assertThat(tree, hasToString(s));
    assertThat(binds, hasToString("[x, f, n, i, k, v]"));
    assertThat(renamed.toString().contains("local x$0 = 1"), is(true));
  }

  /**
   * Tests two distinct binders of the same name; each gets its own name, and
   * the free names are the same before and after.
   */
  @Test
  void testRenameTwoBindersSameName() {
    final Ast.Block block =
        block(local("x", num(1)),
            doBlock(local("x", plus(id("x"), id("y")))),
            ret(plus(id("x"), id("z"))));
    final Ast.Block renamed = AlphaRenamer.rename(block);
    assertThat(renamed,
        hasToString("local x$0 = 1; do local x$1 = x$0 + y end; "
            + "return x$0 + z"));
    assertThat(FreeFinder.freeNames(block), hasToString("[y, z]"));
    assertThat(FreeFinder.freeNames(renamed),
        is(FreeFinder.freeNames(block)));
  }

  /**
   * Tests that a fresh name skips names that already occur in the tree, so
   * that a free identifier that looks like a fresh name is not captured.
   */
  @Test
  void testFreshNameAvoidsExistingName() {
    final Ast.Block block =
        block(local("x", num(1)), ret(plus(id("x$0"), id("x"))));
    final Ast.Block renamed = AlphaRenamer.rename(block);
    assertThat(renamed, hasToString("local x$1 = 1; return x$0 + x$1"));
    assertThat(FreeFinder.freeNames(renamed), hasToString("[x$0]"));

    // Same, with a separator that produces a legal identifier
    final WalkConfig config =
        WalkConfig.EMPTY.withProp(Prop.FRESH_NAME_SEPARATOR, "_");
    final Ast.Block block2 =
        block(local("x", num(1)), local("x", id("x_1")),
            ret(plus(id("x_0"), id("x"))));
    assertThat(AlphaRenamer.rename(config, block2),
        hasToString("local x_2 = 1; local x_3 = x_1; return x_0 + x_3"));
    assertThat(FreeFinder.freeNames(AlphaRenamer.rename(config, block2)),
        is(FreeFinder.freeNames(block2)));
  }

  @Test
  void testNameGeneratorReserved() {
    final NameGenerator generator =
        new NameGenerator("$", ImmutableSet.of("x$0", "x$2"));
    assertThat(generator.fresh("x"), is("x$1"));
    assertThat(generator.fresh("x"), is("x$3"));
    assertThat(generator.fresh("y"), is("y$0"));
  }

  @Test
  void testNameGenerator() {
    final NameGenerator generator = new NameGenerator("$");
    assertThat(generator.inc("x"), is(0));
    assertThat(generator.inc("x"), is(1));
    assertThat(generator.inc("y"), is(0));
    assertThat(generator.fresh("x"), is("x$2"));
    assertThat(generator.fresh("z"), is("z$0"));
  }
}

// End AlphaRenamerTest.java
