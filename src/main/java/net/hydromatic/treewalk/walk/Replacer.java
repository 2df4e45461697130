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
import static net.hydromatic.treewalk.ast.AstBuilder.ast;

import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.treewalk.ast.Ast;
import net.hydromatic.treewalk.ast.Shuttle;

/**
 * Renames identifier nodes.
 *
 * <p>Identifiers are matched by identity, not by name, so two occurrences of
 * the same name can be renamed differently.
 */
public class Replacer extends Shuttle {
  private final Map<Ast.Id, String> substitution;

  private Replacer(Map<Ast.Id, String> substitution) {
    this.substitution = requireNonNull(substitution);
  }

  /**
   * Applies a list of renames to a block.
   *
   * <p>If an identifier occurs more than once in the list, the last entry
   * wins.
   */
  public static Ast.Block substitute(
      List<Map.Entry<Ast.Id, String>> renames, Ast.Block block) {
    if (renames.isEmpty()) {
      return block;
    }
    return block.accept(new Replacer(toMap(renames)));
  }

  /** Applies a list of renames to an expression. */
  public static Ast.Exp substitute(
      List<Map.Entry<Ast.Id, String>> renames, Ast.Exp exp) {
    if (renames.isEmpty()) {
      return exp;
    }
    return exp.accept(new Replacer(toMap(renames)));
  }

  private static Map<Ast.Id, String> toMap(
      List<Map.Entry<Ast.Id, String>> renames) {
    final Map<Ast.Id, String> map = new IdentityHashMap<>();
    renames.forEach(e -> map.put(e.getKey(), e.getValue()));
    return map;
  }

  @Override
  protected Ast.Id visit(Ast.Id id) {
    final String name = substitution.get(id);
    return name == null || name.equals(id.name) ? id : ast.id(id.pos, name);
  }
}

// End Replacer.java
