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

import java.math.BigDecimal;
import java.util.List;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Context for writing an AST out as a string. */
public class AstWriter {
  private static final Pattern NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final StringBuilder b = new StringBuilder();

  /** Appends a string to the output. */
  public AstWriter append(String s) {
    b.append(s);
    return this;
  }

  /** Appends an identifier to the output. */
  public AstWriter id(String s) {
    return append(s);
  }

  /** Appends a literal to the output. */
  @SuppressWarnings("rawtypes")
  public AstWriter appendLiteral(Op op, @Nullable Comparable value) {
    switch (op) {
      case NIL_LITERAL:
        return append("nil");
      case NUMBER_LITERAL:
        return append(
            value instanceof BigDecimal
                ? ((BigDecimal) value).toPlainString()
                : String.valueOf(value));
      case STRING_LITERAL:
        final String s = (String) value;
        return append("\"")
            .append(s.replace("\\", "\\\\").replace("\"", "\\\""))
            .append("\"");
      default:
        return append(String.valueOf(value));
    }
  }

  /** Returns whether a node with a given operator needs parentheses. */
  public boolean needsParens(int left, Op op, int right) {
    return left > op.left || op.right < right;
  }

  /** Appends a call to an infix operator. */
  public AstWriter infix(int left, AstNode a0, Op op, AstNode a1, int right) {
    if (needsParens(left, op, right)) {
      return append("(").infix(0, a0, op, a1, 0).append(")");
    }
    a0.unparse(this, left, op.left);
    append(op.padded);
    a1.unparse(this, op.right, right);
    return this;
  }

  /** Appends a call to a prefix operator. */
  public AstWriter prefix(int left, Op op, AstNode a, int right) {
    if (needsParens(left, op, right)) {
      return append("(").prefix(0, op, a, 0).append(")");
    }
    append(op.padded);
    a.unparse(this, op.right, right);
    return this;
  }

  /**
   * Appends a function's parameters and body, preceded by a prefix such as
   * "function" or "local function f".
   */
  public AstWriter function(String prefix, Ast.Function function) {
    append(prefix).append("(").appendAll(function.params, ", ");
    if (function.varargs) {
      append(function.params.isEmpty() ? "..." : ", ...");
    }
    return append(")").body(function.body).append("end");
  }

  /**
   * Appends the body of a compound statement, surrounded by spaces. An empty
   * body becomes a single space.
   */
  public AstWriter body(Ast.Block block) {
    append(" ");
    if (!block.stats.isEmpty()) {
      block.unparse(this, 0, 0);
      append(" ");
    }
    return this;
  }

  /** Appends a list of nodes, separated by a given string. */
  public AstWriter appendAll(List<? extends AstNode> nodes, String sep) {
    for (int i = 0; i < nodes.size(); i++) {
      append(i == 0 ? "" : sep).append(nodes.get(i), 0, 0);
    }
    return this;
  }

  public AstWriter append(AstNode node, int left, int right) {
    return node.unparse(this, left, right);
  }

  public AstWriter append(Ast.Stat stat) {
    return stat.node().unparse(this, 0, 0);
  }

  @Override
  public String toString() {
    return b.toString();
  }

  /**
   * If an expression is a string literal that is a valid name, returns the
   * name; otherwise null. Such keys are written "{@code t.name}" rather than
   * "{@code t["name"]}".
   */
  static @Nullable String nameOpt(Ast.Exp key) {
    if (key.op == Op.STRING_LITERAL) {
      final String s = (String) ((Ast.Literal) key).value;
      if (s != null && NAME.matcher(s).matches()) {
        return s;
      }
    }
    return null;
  }
}

// End AstWriter.java
