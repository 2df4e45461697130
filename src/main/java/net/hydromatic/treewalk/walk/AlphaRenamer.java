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

import com.google.common.collect.HashBasedTable;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Maps;
import com.google.common.collect.Table;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import net.hydromatic.treewalk.ast.Ast;
import net.hydromatic.treewalk.ast.AstNode;

/**
 * Gives every bound identifier a unique name.
 *
 * <p>For example,
 *
 * <blockquote><pre>
 * local x = 1; local x = x + 1; return x
 * </pre></blockquote>
 *
 * <p>becomes
 *
 * <blockquote><pre>
 * local x$0 = 1; local x$1 = x$0 + 1; return x$1
 * </pre></blockquote>
 *
 * <p>Free identifiers keep their names. A fresh name is never a name that
 * already occurs in the tree, so renaming cannot capture a free identifier.
 *
 * <p>Renaming happens in two passes. The first pass walks the tree without
 * changing it, recording a fresh name for each (binder, name) pair and the
 * identifier nodes that must change. The second pass rebuilds the tree using
 * {@link Replacer}.
 */
public class AlphaRenamer {
  private final NameGenerator nameGenerator;
  /** Binder, old name, new name. */
  private final Table<AstNode, String, String> binders =
      HashBasedTable.create();
  private final List<Map.Entry<Ast.Id, String>> renames = new ArrayList<>();

  private AlphaRenamer(WalkConfig config, AstNode node) {
    this.nameGenerator =
        new NameGenerator(Prop.FRESH_NAME_SEPARATOR.stringValue(config.props),
            names(config, node));
  }

  /** Renames the bound identifiers in a block. */
  public static Ast.Block rename(Ast.Block block) {
    return rename(WalkConfig.EMPTY, block);
  }

  /**
   * Renames the bound identifiers in a block, using the tracer and properties
   * of a configuration. The configuration's visitors are ignored.
   */
  public static Ast.Block rename(WalkConfig config, Ast.Block block) {
    final AlphaRenamer renamer = new AlphaRenamer(config, block);
    ScopedWalker.walkBlock(renamer.config(config), block);
    return Replacer.substitute(renamer.renames, block);
  }

  /** Renames the bound identifiers in an expression. */
  public static Ast.Exp rename(WalkConfig config, Ast.Exp exp) {
    final AlphaRenamer renamer = new AlphaRenamer(config, exp);
    ScopedWalker.walkExp(renamer.config(config), exp);
    return Replacer.substitute(renamer.renames, exp);
  }

  /** Returns the name of every identifier in a tree, including binders. */
  private static ImmutableSet<String> names(WalkConfig config, AstNode node) {
    final ImmutableSet.Builder<String> names = ImmutableSet.builder();
    Walker.guess(
        WalkConfig.EMPTY
            .withProps(config.props)
            .withExpDown((exp, ancestors) -> {
              if (exp instanceof Ast.Id) {
                names.add(((Ast.Id) exp).name);
              }
              return Visit.descend();
            })
            .withBinder((id, binder, ancestors) -> names.add(id.name)),
        node);
    return names.build();
  }

  private WalkConfig config(WalkConfig config) {
    return WalkConfig.EMPTY
        .withTracer(config.tracer)
        .withProps(config.props)
        .withBinder(this::binder)
        .withBoundId(this::boundId);
  }

  private void binder(Ast.Id id, AstNode binder, List<AstNode> ancestors) {
    final String newName = nameGenerator.fresh(id.name);
    binders.put(binder, id.name, newName);
    renames.add(Maps.immutableEntry(id, newName));
  }

  private void boundId(Ast.Id id, AstNode binder, List<AstNode> ancestors) {
    final String newName =
        requireNonNull(binders.get(binder, id.name),
            () -> "no fresh name for " + id.name);
    renames.add(Maps.immutableEntry(id, newName));
  }
}

// End AlphaRenamer.java
