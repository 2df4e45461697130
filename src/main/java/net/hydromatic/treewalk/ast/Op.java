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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Kind tags of {@link AstNode}.
 *
 * <p>The vocabulary is closed: every node carries one of these tags, and the
 * walkers reject any node they do not recognize.
 */
public enum Op {
  // identifiers and literals
  ID(Category.EXP, true),
  NIL_LITERAL(Category.EXP, true),
  BOOL_LITERAL(Category.EXP, true),
  NUMBER_LITERAL(Category.EXP, true),
  STRING_LITERAL(Category.EXP, true),
  /** Variable arguments, "{@code ...}". */
  DOTS(Category.EXP, true),

  // compound expressions
  FUNCTION(Category.EXP),
  CALL(Category.EXP, 10),
  INVOKE(Category.EXP, 10),
  INDEX(Category.EXP, 10),
  TABLE(Category.EXP, true),
  /** Keyed field of a table constructor, "{@code [k] = v}". */
  PAIR(Category.EXP),
  PAREN(Category.EXP, true),

  // binary operators
  OR(" or ", 1),
  AND(" and ", 2),
  LT(" < ", 3),
  LE(" <= ", 3),
  GT(" > ", 3),
  GE(" >= ", 3),
  EQ(" == ", 3),
  NE(" ~= ", 3),
  CONCAT(" .. ", 4, false),
  PLUS(" + ", 5),
  MINUS(" - ", 5),
  TIMES(" * ", 6),
  DIVIDE(" / ", 6),
  MOD(" % ", 6),
  POWER(" ^ ", 8, false),

  // unary operators
  NOT("not ", true, 7),
  LEN("#", true, 7),
  NEGATE("-", true, 7),

  // statements
  LOCAL(Category.STAT),
  LOCAL_REC(Category.STAT),
  SET(Category.STAT),
  FOR_NUM(Category.STAT),
  FOR_IN(Category.STAT),
  REPEAT(Category.STAT),
  WHILE(Category.STAT),
  IF(Category.STAT),
  DO(Category.STAT),
  RETURN(Category.STAT),
  BREAK(Category.STAT),

  // blocks
  BLOCK(Category.BLOCK);

  /** Category of nodes with this tag. */
  public final Category category;
  /** Padded name, e.g. " + ". Null if this is not an operator. */
  public final @Nullable String padded;
  /** Whether this is a prefix (unary) operator. */
  public final boolean prefix;
  /** Left precedence */
  public final int left;
  /** Right precedence */
  public final int right;

  Op(Category category) {
    this(category, null, false, 0, 1);
  }

  Op(Category category, boolean atom) {
    this(category, null, false, 198, 199);
    assert atom;
  }

  Op(Category category, int precedence) {
    this(category, null, false, precedence * 2, precedence * 2 + 1);
  }

  Op(String padded, int precedence) {
    this(padded, precedence, true);
  }

  Op(String padded, int precedence, boolean leftAssociative) {
    this(
        Category.EXP,
        padded,
        false,
        precedence * 2 + (leftAssociative ? 0 : 1),
        precedence * 2 + (leftAssociative ? 1 : 0));
  }

  Op(String padded, boolean prefix, int precedence) {
    this(Category.EXP, padded, prefix, precedence * 2, precedence * 2 + 1);
    assert prefix;
  }

  Op(
      Category category,
      @Nullable String padded,
      boolean prefix,
      int left,
      int right) {
    this.category = category;
    this.padded = padded;
    this.prefix = prefix;
    this.left = left;
    this.right = right;
  }

  /** Returns whether this is a binary operator. */
  public boolean isBinary() {
    return padded != null && !prefix;
  }

  /** Returns whether this is a unary operator. */
  public boolean isUnary() {
    return padded != null && prefix;
  }
}

// End Op.java
