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
import static java.util.Objects.requireNonNull;
import static net.hydromatic.treewalk.ast.AstBuilder.ast;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes. */
public class Ast {
  private Ast() {}

  /** Base class of expression ASTs. */
  public abstract static class Exp extends AstNode {
    Exp(Pos pos, Op op) {
      super(pos, op);
    }

    public abstract Exp accept(Shuttle shuttle);
  }

  /**
   * Node that can occur in statement position.
   *
   * <p>Implemented by the sub-classes of {@link Statement}, and also by {@link
   * Call} and {@link Invoke}, which are expressions that may be used as
   * statements. A walker reading a call from a statement slot treats it as a
   * statement, and never as an expression.
   */
  public interface Stat {
    /** Returns this statement as a node. */
    AstNode node();

    /** Returns the kind tag of this statement. */
    default Op op() {
      return node().op;
    }

    /** Returns the position of this statement. */
    default Pos pos() {
      return node().pos;
    }

    Stat accept(Shuttle shuttle);
  }

  /** Base class of statement ASTs (other than calls). */
  public abstract static class Statement extends AstNode implements Stat {
    Statement(Pos pos, Op op) {
      super(pos, op);
    }

    @Override
    public AstNode node() {
      return this;
    }
  }

  /** Sequence of statements. */
  public static class Block extends AstNode {
    public final List<Stat> stats;

    Block(Pos pos, ImmutableList<Stat> stats) {
      super(pos, Op.BLOCK);
      this.stats = requireNonNull(stats);
    }

    public Block accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      for (int i = 0; i < stats.size(); i++) {
        w.append(i == 0 ? "" : "; ").append(stats.get(i));
      }
      return w;
    }

    /**
     * Creates a copy of this {@code Block} with given contents, or {@code
     * this} if the contents are the same.
     */
    public Block copy(List<Stat> stats) {
      return this.stats.equals(stats) ? this : ast.block(pos, stats);
    }
  }

  // expressions

  /** Parse tree node of an identifier. */
  public static class Id extends Exp {
    public final String name;

    /** Creates an Id. */
    Id(Pos pos, String name) {
      super(pos, Op.ID);
      this.name = requireNonNull(name);
    }

    @Override
    public Id accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.id(name);
    }
  }

  /**
   * Parse tree node of a literal (constant).
   *
   * <p>The value is null for {@code nil}, a {@link Boolean}, a {@link
   * java.math.BigDecimal} or a {@link String}.
   */
  @SuppressWarnings("rawtypes")
  public static class Literal extends Exp {
    public final @Nullable Comparable value;

    /** Creates a Literal. */
    Literal(Pos pos, Op op, @Nullable Comparable value) {
      super(pos, op);
      this.value = value;
      checkArgument(
          op == Op.NIL_LITERAL
              ? value == null
              : (op == Op.BOOL_LITERAL
                      || op == Op.NUMBER_LITERAL
                      || op == Op.STRING_LITERAL)
                  && value != null,
          "bad literal %s %s",
          op,
          value);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendLiteral(op, value);
    }
  }

  /** Variable arguments, "{@code ...}", used as an expression. */
  public static class Dots extends Exp {
    Dots(Pos pos) {
      super(pos, Op.DOTS);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("...");
    }
  }

  /**
   * Function definition.
   *
   * <p>For example, "{@code function (x, ...) return x end}". Binds each of
   * its parameters in its body.
   */
  public static class Function extends Exp {
    public final List<Id> params;
    /** Whether the parameter list ends with "{@code ...}". */
    public final boolean varargs;

    public final Block body;

    Function(Pos pos, ImmutableList<Id> params, boolean varargs, Block body) {
      super(pos, Op.FUNCTION);
      this.params = requireNonNull(params);
      this.varargs = varargs;
      this.body = requireNonNull(body);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (w.needsParens(left, op, right)) {
        return w.append("(").append(this, 0, 0).append(")");
      }
      return w.function("function", this);
    }

    /**
     * Creates a copy of this {@code Function} with given contents, or {@code
     * this} if the contents are the same.
     */
    public Function copy(List<Id> params, Block body) {
      return this.params.equals(params) && this.body == body
          ? this
          : ast.function(pos, params, varargs, body);
    }
  }

  /**
   * Function call.
   *
   * <p>May occur as an expression, as in "{@code x = f(1)}", or as a
   * statement, as in "{@code f(1)}".
   */
  public static class Call extends Exp implements Stat {
    public final Exp fn;
    public final List<Exp> args;

    Call(Pos pos, Exp fn, ImmutableList<Exp> args) {
      super(pos, Op.CALL);
      this.fn = requireNonNull(fn);
      this.args = requireNonNull(args);
    }

    @Override
    public AstNode node() {
      return this;
    }

    @Override
    public Call accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(fn, left, op.left)
          .append("(")
          .appendAll(args, ", ")
          .append(")");
    }

    /**
     * Creates a copy of this {@code Call} with given contents, or {@code this}
     * if the contents are the same.
     */
    public Call copy(Exp fn, List<Exp> args) {
      return this.fn == fn && this.args.equals(args)
          ? this
          : ast.call(pos, fn, args);
    }
  }

  /**
   * Method invocation, "{@code receiver:method(args)}".
   *
   * <p>Like {@link Call}, may occur as an expression or as a statement.
   */
  public static class Invoke extends Exp implements Stat {
    public final Exp receiver;
    public final String method;
    public final List<Exp> args;

    Invoke(Pos pos, Exp receiver, String method, ImmutableList<Exp> args) {
      super(pos, Op.INVOKE);
      this.receiver = requireNonNull(receiver);
      this.method = requireNonNull(method);
      this.args = requireNonNull(args);
    }

    @Override
    public AstNode node() {
      return this;
    }

    @Override
    public Invoke accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(receiver, left, op.left)
          .append(":")
          .append(method)
          .append("(")
          .appendAll(args, ", ")
          .append(")");
    }

    /**
     * Creates a copy of this {@code Invoke} with given contents, or {@code
     * this} if the contents are the same.
     */
    public Invoke copy(Exp receiver, List<Exp> args) {
      return this.receiver == receiver && this.args.equals(args)
          ? this
          : ast.invoke(pos, receiver, method, args);
    }
  }

  /** Index expression, "{@code t[k]}" or "{@code t.name}". */
  public static class Index extends Exp {
    public final Exp table;
    public final Exp key;

    Index(Pos pos, Exp table, Exp key) {
      super(pos, Op.INDEX);
      this.table = requireNonNull(table);
      this.key = requireNonNull(key);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append(table, left, op.left);
      final String name = AstWriter.nameOpt(key);
      return name != null
          ? w.append(".").append(name)
          : w.append("[").append(key, 0, 0).append("]");
    }

    /**
     * Creates a copy of this {@code Index} with given contents, or {@code
     * this} if the contents are the same.
     */
    public Index copy(Exp table, Exp key) {
      return this.table == table && this.key == key
          ? this
          : ast.index(pos, table, key);
    }
  }

  /**
   * Table constructor, "<code>{1, 2, x = 3}</code>".
   *
   * <p>Positional items are expressions; keyed items are {@link Pair}s.
   */
  public static class Table extends Exp {
    public final List<Exp> items;

    Table(Pos pos, ImmutableList<Exp> items) {
      super(pos, Op.TABLE);
      this.items = requireNonNull(items);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("{").appendAll(items, ", ").append("}");
    }

    /**
     * Creates a copy of this {@code Table} with given contents, or {@code
     * this} if the contents are the same.
     */
    public Table copy(List<Exp> items) {
      return this.items.equals(items) ? this : ast.table(pos, items);
    }
  }

  /** Keyed item in a table constructor, "{@code [k] = v}". */
  public static class Pair extends Exp {
    public final Exp key;
    public final Exp value;

    Pair(Pos pos, Exp key, Exp value) {
      super(pos, Op.PAIR);
      this.key = requireNonNull(key);
      this.value = requireNonNull(value);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      final String name = AstWriter.nameOpt(key);
      if (name != null) {
        w.append(name);
      } else {
        w.append("[").append(key, 0, 0).append("]");
      }
      return w.append(" = ").append(value, 0, 0);
    }

    /**
     * Creates a copy of this {@code Pair} with given contents, or {@code this}
     * if the contents are the same.
     */
    public Pair copy(Exp key, Exp value) {
      return this.key == key && this.value == value
          ? this
          : ast.pair(pos, key, value);
    }
  }

  /** Parenthesized expression. */
  public static class Paren extends Exp {
    public final Exp exp;

    Paren(Pos pos, Exp exp) {
      super(pos, Op.PAREN);
      this.exp = requireNonNull(exp);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("(").append(exp, 0, 0).append(")");
    }

    /**
     * Creates a copy of this {@code Paren} with given contents, or {@code
     * this} if the contents are the same.
     */
    public Paren copy(Exp exp) {
      return this.exp == exp ? this : ast.paren(pos, exp);
    }
  }

  /** Call to an infix operator. */
  public static class InfixCall extends Exp {
    public final Exp a0;
    public final Exp a1;

    InfixCall(Pos pos, Op op, Exp a0, Exp a1) {
      super(pos, op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }

    /**
     * Creates a copy of this {@code InfixCall} with given contents and same
     * operator, or {@code this} if the contents are the same.
     */
    public InfixCall copy(Exp a0, Exp a1) {
      return this.a0 == a0 && this.a1 == a1
          ? this
          : ast.infixCall(pos, op, a0, a1);
    }
  }

  /** Call to a prefix operator. */
  public static class PrefixCall extends Exp {
    public final Exp a;

    PrefixCall(Pos pos, Op op, Exp a) {
      super(pos, op);
      this.a = requireNonNull(a);
    }

    @Override
    public Exp accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, a, right);
    }

    /**
     * Creates a copy of this {@code PrefixCall} with given contents and same
     * operator, or {@code this} if the contents are the same.
     */
    public PrefixCall copy(Exp a) {
      return this.a == a ? this : ast.prefixCall(pos, op, a);
    }
  }

  // statements

  /**
   * Local declaration, "{@code local x, y = 1, 2}".
   *
   * <p>The names are not visible in the values; they become visible after the
   * statement.
   */
  public static class Local extends Statement {
    public final List<Id> names;
    public final List<Exp> values;

    Local(Pos pos, ImmutableList<Id> names, ImmutableList<Exp> values) {
      super(pos, Op.LOCAL);
      this.names = requireNonNull(names);
      this.values = requireNonNull(values);
    }

    @Override
    public Stat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("local ").appendAll(names, ", ");
      if (!values.isEmpty()) {
        w.append(" = ").appendAll(values, ", ");
      }
      return w;
    }

    /**
     * Creates a copy of this {@code Local} with given contents, or {@code this}
     * if the contents are the same.
     */
    public Local copy(List<Id> names, List<Exp> values) {
      return this.names.equals(names) && this.values.equals(values)
          ? this
          : ast.local(pos, names, values);
    }
  }

  /**
   * Recursive local declaration, "{@code local function f() ... end}".
   *
   * <p>The names are visible in the values, so that a function can refer to
   * itself.
   */
  public static class LocalRec extends Statement {
    public final List<Id> names;
    public final List<Exp> values;

    LocalRec(Pos pos, ImmutableList<Id> names, ImmutableList<Exp> values) {
      super(pos, Op.LOCAL_REC);
      this.names = requireNonNull(names);
      this.values = requireNonNull(values);
    }

    @Override
    public Stat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      if (names.size() == 1
          && values.size() == 1
          && values.get(0) instanceof Function) {
        return w.function(
            "local function " + names.get(0).name, (Function) values.get(0));
      }
      return w.append("local rec ")
          .appendAll(names, ", ")
          .append(" = ")
          .appendAll(values, ", ");
    }

    /**
     * Creates a copy of this {@code LocalRec} with given contents, or {@code
     * this} if the contents are the same.
     */
    public LocalRec copy(List<Id> names, List<Exp> values) {
      return this.names.equals(names) && this.values.equals(values)
          ? this
          : ast.localRec(pos, names, values);
    }
  }

  /** Assignment, "{@code a, t.b = 1, 2}". */
  public static class Set extends Statement {
    public final List<Exp> targets;
    public final List<Exp> values;

    Set(Pos pos, ImmutableList<Exp> targets, ImmutableList<Exp> values) {
      super(pos, Op.SET);
      this.targets = requireNonNull(targets);
      this.values = requireNonNull(values);
    }

    @Override
    public Stat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.appendAll(targets, ", ").append(" = ").appendAll(values, ", ");
    }

    /**
     * Creates a copy of this {@code Set} with given contents, or {@code this}
     * if the contents are the same.
     */
    public Set copy(List<Exp> targets, List<Exp> values) {
      return this.targets.equals(targets) && this.values.equals(values)
          ? this
          : ast.set(pos, targets, values);
    }
  }

  /** Numeric for loop, "{@code for i = first, last, step do ... end}". */
  public static class ForNum extends Statement {
    public final Id var;
    public final Exp first;
    public final Exp last;
    public final @Nullable Exp step;
    public final Block body;

    ForNum(
        Pos pos, Id var, Exp first, Exp last, @Nullable Exp step, Block body) {
      super(pos, Op.FOR_NUM);
      this.var = requireNonNull(var);
      this.first = requireNonNull(first);
      this.last = requireNonNull(last);
      this.step = step;
      this.body = requireNonNull(body);
    }

    @Override
    public Stat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("for ")
          .append(var, 0, 0)
          .append(" = ")
          .append(first, 0, 0)
          .append(", ")
          .append(last, 0, 0);
      if (step != null) {
        w.append(", ").append(step, 0, 0);
      }
      return w.append(" do").body(body).append("end");
    }

    /**
     * Creates a copy of this {@code ForNum} with given contents, or {@code
     * this} if the contents are the same.
     */
    public ForNum copy(Id var, Exp first, Exp last, @Nullable Exp step,
        Block body) {
      return this.var == var
              && this.first == first
              && this.last == last
              && this.step == step
              && this.body == body
          ? this
          : ast.forNum(pos, var, first, last, step, body);
    }
  }

  /** Generic for loop, "{@code for k, v in pairs(t) do ... end}". */
  public static class ForIn extends Statement {
    public final List<Id> vars;
    public final List<Exp> exps;
    public final Block body;

    ForIn(Pos pos, ImmutableList<Id> vars, ImmutableList<Exp> exps,
        Block body) {
      super(pos, Op.FOR_IN);
      this.vars = requireNonNull(vars);
      this.exps = requireNonNull(exps);
      this.body = requireNonNull(body);
    }

    @Override
    public Stat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("for ")
          .appendAll(vars, ", ")
          .append(" in ")
          .appendAll(exps, ", ")
          .append(" do")
          .body(body)
          .append("end");
    }

    /**
     * Creates a copy of this {@code ForIn} with given contents, or {@code
     * this} if the contents are the same.
     */
    public ForIn copy(List<Id> vars, List<Exp> exps, Block body) {
      return this.vars.equals(vars)
              && this.exps.equals(exps)
              && this.body == body
          ? this
          : ast.forIn(pos, vars, exps, body);
    }
  }

  /**
   * Repeat loop, "{@code repeat ... until condition}".
   *
   * <p>Unlike other loops, the condition is evaluated in the scope of the
   * body, and can see its locals.
   */
  public static class Repeat extends Statement {
    public final Block body;
    public final Exp condition;

    Repeat(Pos pos, Block body, Exp condition) {
      super(pos, Op.REPEAT);
      this.body = requireNonNull(body);
      this.condition = requireNonNull(condition);
    }

    @Override
    public Stat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("repeat")
          .body(body)
          .append("until ")
          .append(condition, 0, 0);
    }

    /**
     * Creates a copy of this {@code Repeat} with given contents, or {@code
     * this} if the contents are the same.
     */
    public Repeat copy(Block body, Exp condition) {
      return this.body == body && this.condition == condition
          ? this
          : ast.repeat(pos, body, condition);
    }
  }

  /** While loop, "{@code while condition do ... end}". */
  public static class While extends Statement {
    public final Exp condition;
    public final Block body;

    While(Pos pos, Exp condition, Block body) {
      super(pos, Op.WHILE);
      this.condition = requireNonNull(condition);
      this.body = requireNonNull(body);
    }

    @Override
    public Stat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("while ")
          .append(condition, 0, 0)
          .append(" do")
          .body(body)
          .append("end");
    }

    /**
     * Creates a copy of this {@code While} with given contents, or {@code
     * this} if the contents are the same.
     */
    public While copy(Exp condition, Block body) {
      return this.condition == condition && this.body == body
          ? this
          : ast.whileDo(pos, condition, body);
    }
  }

  /**
   * Conditional, "{@code if c1 then b1 elseif c2 then b2 else b3 end}".
   *
   * <p>There is one block per condition, plus one more if there is an
   * {@code else} branch.
   */
  public static class If extends Statement {
    public final List<Exp> conditions;
    public final List<Block> blocks;

    If(Pos pos, ImmutableList<Exp> conditions, ImmutableList<Block> blocks) {
      super(pos, Op.IF);
      this.conditions = requireNonNull(conditions);
      this.blocks = requireNonNull(blocks);
      checkArgument(!conditions.isEmpty());
      checkArgument(
          blocks.size() == conditions.size()
              || blocks.size() == conditions.size() + 1,
          "expected %s or %s blocks, got %s",
          conditions.size(),
          conditions.size() + 1,
          blocks.size());
    }

    /** Returns the {@code else} block, or null if there is none. */
    public @Nullable Block elseBlock() {
      return blocks.size() > conditions.size() ? blocks.get(blocks.size() - 1)
          : null;
    }

    @Override
    public Stat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      for (int i = 0; i < conditions.size(); i++) {
        w.append(i == 0 ? "if " : "elseif ")
            .append(conditions.get(i), 0, 0)
            .append(" then")
            .body(blocks.get(i));
      }
      final Block elseBlock = elseBlock();
      if (elseBlock != null) {
        w.append("else").body(elseBlock);
      }
      return w.append("end");
    }

    /**
     * Creates a copy of this {@code If} with given contents, or {@code this}
     * if the contents are the same.
     */
    public If copy(List<Exp> conditions, List<Block> blocks) {
      return this.conditions.equals(conditions) && this.blocks.equals(blocks)
          ? this
          : ast.ifThen(pos, conditions, blocks);
    }
  }

  /** Nested block, "{@code do ... end}". */
  public static class Do extends Statement {
    public final Block body;

    Do(Pos pos, Block body) {
      super(pos, Op.DO);
      this.body = requireNonNull(body);
    }

    @Override
    public Stat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("do").body(body).append("end");
    }

    /**
     * Creates a copy of this {@code Do} with given contents, or {@code this}
     * if the contents are the same.
     */
    public Do copy(Block body) {
      return this.body == body ? this : ast.doBlock(pos, body);
    }
  }

  /** Return statement. */
  public static class Return extends Statement {
    public final List<Exp> values;

    Return(Pos pos, ImmutableList<Exp> values) {
      super(pos, Op.RETURN);
      this.values = requireNonNull(values);
    }

    @Override
    public Stat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      w.append("return");
      if (!values.isEmpty()) {
        w.append(" ").appendAll(values, ", ");
      }
      return w;
    }

    /**
     * Creates a copy of this {@code Return} with given contents, or {@code
     * this} if the contents are the same.
     */
    public Return copy(List<Exp> values) {
      return this.values.equals(values) ? this : ast.returns(pos, values);
    }
  }

  /** Break statement. */
  public static class Break extends Statement {
    Break(Pos pos) {
      super(pos, Op.BREAK);
    }

    @Override
    public Stat accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("break");
    }
  }
}

// End Ast.java
