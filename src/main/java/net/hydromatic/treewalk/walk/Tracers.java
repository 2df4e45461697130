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

import java.util.List;
import java.util.function.BiConsumer;
import java.util.function.Consumer;
import net.hydromatic.treewalk.ast.Ast;
import net.hydromatic.treewalk.ast.AstNode;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /**
   * Returns a tracer that performs the given action when the walker arrives at
   * a node, then calls the underlying tracer.
   */
  public static Tracer withOnDown(
      Tracer tracer, BiConsumer<AstNode, List<AstNode>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onDown(AstNode node, List<AstNode> ancestors) {
        consumer.accept(node, ancestors);
        super.onDown(node, ancestors);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action when a node is replaced,
   * then calls the underlying tracer.
   */
  public static Tracer withOnReplace(
      Tracer tracer, BiConsumer<AstNode, AstNode> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onReplace(AstNode before, AstNode after) {
        consumer.accept(before, after);
        super.onReplace(before, after);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action when a node's children
   * are cut, then calls the underlying tracer.
   */
  public static Tracer withOnCut(Tracer tracer, Consumer<AstNode> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onCut(AstNode node) {
        consumer.accept(node);
        super.onCut(node);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action when an identifier is
   * bound, then calls the underlying tracer.
   */
  public static Tracer withOnBind(
      Tracer tracer, BiConsumer<Ast.Id, AstNode> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onBind(Ast.Id id, AstNode binder) {
        consumer.accept(id, binder);
        super.onBind(id, binder);
      }
    };
  }

  /**
   * Returns a tracer that performs the given action when the walker leaves a
   * node, then calls the underlying tracer.
   */
  public static Tracer withOnUp(
      Tracer tracer, BiConsumer<AstNode, List<AstNode>> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onUp(AstNode node, List<AstNode> ancestors) {
        consumer.accept(node, ancestors);
        super.onUp(node, ancestors);
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onDown(AstNode node, List<AstNode> ancestors) {}

    @Override
    public void onReplace(AstNode before, AstNode after) {}

    @Override
    public void onCut(AstNode node) {}

    @Override
    public void onBind(Ast.Id id, AstNode binder) {}

    @Override
    public void onUp(AstNode node, List<AstNode> ancestors) {}
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onDown(AstNode node, List<AstNode> ancestors) {
      tracer.onDown(node, ancestors);
    }

    @Override
    public void onReplace(AstNode before, AstNode after) {
      tracer.onReplace(before, after);
    }

    @Override
    public void onCut(AstNode node) {
      tracer.onCut(node);
    }

    @Override
    public void onBind(Ast.Id id, AstNode binder) {
      tracer.onBind(id, binder);
    }

    @Override
    public void onUp(AstNode node, List<AstNode> ancestors) {
      tracer.onUp(node, ancestors);
    }
  }
}

// End Tracers.java
