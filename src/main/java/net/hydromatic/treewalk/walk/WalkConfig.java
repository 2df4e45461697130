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

import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.treewalk.ast.Ast;
import net.hydromatic.treewalk.ast.AstNode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Visitors and properties of a walk.
 *
 * <p>A configuration is immutable. Start from {@link #EMPTY}, whose visitors
 * do nothing, and call the {@code withXxx} methods to install visitors.
 *
 * <p>The visitors for bound and free identifiers are only called by {@link
 * ScopedWalker}; the plain {@link Walker} does not know which identifiers are
 * bound.
 */
public class WalkConfig {
  /** Configuration with no-op visitors and default property values. */
  public static final WalkConfig EMPTY =
      new WalkConfig(
          (e, a) -> Visit.descend(),
          (e, a) -> {},
          (s, a) -> Visit.descend(),
          (s, a) -> {},
          (b, a) -> Visit.descend(),
          (b, a) -> {},
          (id, binder, a) -> {},
          (id, binder, a) -> {},
          (id, a) -> {},
          Tracers.empty(),
          ImmutableMap.of());

  public final DownVisitor<Ast.Exp> expDown;
  public final UpVisitor<Ast.Exp> expUp;
  public final DownVisitor<Ast.Stat> statDown;
  public final UpVisitor<Ast.Stat> statUp;
  public final DownVisitor<Ast.Block> blockDown;
  public final UpVisitor<Ast.Block> blockUp;
  public final BinderVisitor binder;
  public final BoundIdVisitor boundId;
  public final FreeIdVisitor freeId;
  public final Tracer tracer;
  public final ImmutableMap<Prop, Object> props;

  private WalkConfig(
      DownVisitor<Ast.Exp> expDown,
      UpVisitor<Ast.Exp> expUp,
      DownVisitor<Ast.Stat> statDown,
      UpVisitor<Ast.Stat> statUp,
      DownVisitor<Ast.Block> blockDown,
      UpVisitor<Ast.Block> blockUp,
      BinderVisitor binder,
      BoundIdVisitor boundId,
      FreeIdVisitor freeId,
      Tracer tracer,
      ImmutableMap<Prop, Object> props) {
    this.expDown = requireNonNull(expDown);
    this.expUp = requireNonNull(expUp);
    this.statDown = requireNonNull(statDown);
    this.statUp = requireNonNull(statUp);
    this.blockDown = requireNonNull(blockDown);
    this.blockUp = requireNonNull(blockUp);
    this.binder = requireNonNull(binder);
    this.boundId = requireNonNull(boundId);
    this.freeId = requireNonNull(freeId);
    this.tracer = requireNonNull(tracer);
    this.props = requireNonNull(props);
  }

  public WalkConfig withExpDown(DownVisitor<Ast.Exp> expDown) {
    return new WalkConfig(expDown, expUp, statDown, statUp, blockDown, blockUp,
        binder, boundId, freeId, tracer, props);
  }

  public WalkConfig withExpUp(UpVisitor<Ast.Exp> expUp) {
    return new WalkConfig(expDown, expUp, statDown, statUp, blockDown, blockUp,
        binder, boundId, freeId, tracer, props);
  }

  public WalkConfig withStatDown(DownVisitor<Ast.Stat> statDown) {
    return new WalkConfig(expDown, expUp, statDown, statUp, blockDown, blockUp,
        binder, boundId, freeId, tracer, props);
  }

  public WalkConfig withStatUp(UpVisitor<Ast.Stat> statUp) {
    return new WalkConfig(expDown, expUp, statDown, statUp, blockDown, blockUp,
        binder, boundId, freeId, tracer, props);
  }

  public WalkConfig withBlockDown(DownVisitor<Ast.Block> blockDown) {
    return new WalkConfig(expDown, expUp, statDown, statUp, blockDown, blockUp,
        binder, boundId, freeId, tracer, props);
  }

  public WalkConfig withBlockUp(UpVisitor<Ast.Block> blockUp) {
    return new WalkConfig(expDown, expUp, statDown, statUp, blockDown, blockUp,
        binder, boundId, freeId, tracer, props);
  }

  public WalkConfig withBinder(BinderVisitor binder) {
    return new WalkConfig(expDown, expUp, statDown, statUp, blockDown, blockUp,
        binder, boundId, freeId, tracer, props);
  }

  public WalkConfig withBoundId(BoundIdVisitor boundId) {
    return new WalkConfig(expDown, expUp, statDown, statUp, blockDown, blockUp,
        binder, boundId, freeId, tracer, props);
  }

  public WalkConfig withFreeId(FreeIdVisitor freeId) {
    return new WalkConfig(expDown, expUp, statDown, statUp, blockDown, blockUp,
        binder, boundId, freeId, tracer, props);
  }

  public WalkConfig withTracer(Tracer tracer) {
    return new WalkConfig(expDown, expUp, statDown, statUp, blockDown, blockUp,
        binder, boundId, freeId, tracer, props);
  }

  /**
   * Returns a configuration with a given property value.
   *
   * @throws IllegalArgumentException if the value is of the wrong type, or is
   *     null and the property is required
   */
  public WalkConfig withProp(Prop prop, @Nullable Object value) {
    final Map<Prop, Object> map = new LinkedHashMap<>(props);
    prop.setLenient(map, value);
    return new WalkConfig(expDown, expUp, statDown, statUp, blockDown, blockUp,
        binder, boundId, freeId, tracer, ImmutableMap.copyOf(map));
  }

  /** Returns a configuration with the given property values. */
  public WalkConfig withProps(Map<Prop, Object> props) {
    final Map<Prop, Object> map = new LinkedHashMap<>(this.props);
    props.forEach((prop, value) -> prop.set(map, value));
    return new WalkConfig(expDown, expUp, statDown, statUp, blockDown, blockUp,
        binder, boundId, freeId, tracer, ImmutableMap.copyOf(map));
  }

  /**
   * Called when the walker arrives at a node.
   *
   * @param <N> Node type
   */
  @FunctionalInterface
  public interface DownVisitor<N> {
    /**
     * Visits a node before its children.
     *
     * @param node Node
     * @param ancestors Ancestors of the node, parent first; valid only
     *     during this call
     * @return What the walker should do next; never null
     */
    Visit<N> visit(N node, List<AstNode> ancestors);
  }

  /**
   * Called when the walker leaves a node, after its children (or after the
   * down-visitor, if the children were cut).
   *
   * @param <N> Node type
   */
  @FunctionalInterface
  public interface UpVisitor<N> {
    void visit(N node, List<AstNode> ancestors);
  }

  /** Called when a binder introduces an identifier. */
  @FunctionalInterface
  public interface BinderVisitor {
    /**
     * Visits an identifier in a binder slot.
     *
     * @param id Identifier being bound
     * @param binder Node that binds it
     * @param ancestors Ancestors, starting with the binder
     */
    void visit(Ast.Id id, AstNode binder, List<AstNode> ancestors);
  }

  /** Called for an identifier occurrence that refers to a binder in scope. */
  @FunctionalInterface
  public interface BoundIdVisitor {
    void visit(Ast.Id id, AstNode binder, List<AstNode> ancestors);
  }

  /** Called for an identifier occurrence that has no binder in scope. */
  @FunctionalInterface
  public interface FreeIdVisitor {
    void visit(Ast.Id id, List<AstNode> ancestors);
  }
}

// End WalkConfig.java
