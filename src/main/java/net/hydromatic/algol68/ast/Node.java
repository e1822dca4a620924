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
package net.hydromatic.algol68.ast;

import static java.util.Objects.requireNonNull;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import net.hydromatic.algol68.compile.Table;
import net.hydromatic.algol68.compile.Tag;
import net.hydromatic.algol68.type.Mode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Node of an Algol 68 syntax tree.
 *
 * <p>Unlike most trees in this code base, nodes are mutable: the mode checker
 * writes modes into them and turns a {@link Attribute#SPECIFICATION} into a
 * {@link Attribute#CALL} or {@link Attribute#SLICE}, and the coercion inserter
 * wraps units in coercion markers.
 */
public class Node {
  public final Pos pos;
  private Attribute attribute;
  private final List<Node> children = new ArrayList<>();
  private @Nullable String symbol;
  private int sizety;
  private @Nullable Mode mode;
  private @Nullable Mode requiredMode;
  private @Nullable Tag tag;
  private @Nullable Table table;

  /** Creates a Node. */
  public Node(Pos pos, Attribute attribute, @Nullable String symbol) {
    this.pos = requireNonNull(pos);
    this.attribute = requireNonNull(attribute);
    this.symbol = symbol;
  }

  public Attribute attribute() {
    return attribute;
  }

  /** Changes the kind of this node; used when a specification is resolved. */
  public void setAttribute(Attribute attribute) {
    this.attribute = requireNonNull(attribute);
  }

  public boolean is(Attribute attribute) {
    return this.attribute == attribute;
  }

  public @Nullable String symbol() {
    return symbol;
  }

  public int sizety() {
    return sizety;
  }

  public Node setSizety(int sizety) {
    this.sizety = sizety;
    return this;
  }

  /** Returns the mode of this node, following equivalences. */
  public @Nullable Mode mode() {
    return mode == null ? null : mode.resolve();
  }

  public Node setMode(@Nullable Mode mode) {
    this.mode = mode;
    return this;
  }

  /**
   * Returns the mode that the enclosing construct requires of this node, as
   * recorded by the mode checker for the coercion inserter. For example, the
   * primary of a call must become the procedure mode.
   */
  public @Nullable Mode requiredMode() {
    return requiredMode == null ? null : requiredMode.resolve();
  }

  public void setRequiredMode(@Nullable Mode requiredMode) {
    this.requiredMode = requiredMode;
  }

  public @Nullable Tag tag() {
    return tag;
  }

  public void setTag(@Nullable Tag tag) {
    this.tag = tag;
  }

  /** Returns the symbol table of the range that this node belongs to. */
  public @Nullable Table table() {
    return table;
  }

  public void setTable(@Nullable Table table) {
    this.table = table;
  }

  public List<Node> children() {
    return children;
  }

  public int size() {
    return children.size();
  }

  public Node child(int i) {
    return children.get(i);
  }

  public Node lastChild() {
    return children.get(children.size() - 1);
  }

  public Node add(Node child) {
    children.add(requireNonNull(child));
    return this;
  }

  /** Returns the first child of a given kind, or null. */
  public @Nullable Node find(Attribute attribute) {
    for (Node child : children) {
      if (child.attribute == attribute) {
        return child;
      }
    }
    return null;
  }

  /** Returns the children of a given kind. */
  public List<Node> findAll(Attribute attribute) {
    final List<Node> list = new ArrayList<>();
    for (Node child : children) {
      if (child.attribute == attribute) {
        list.add(child);
      }
    }
    return list;
  }

  /**
   * Wraps the contents of this node in a coercion.
   *
   * <p>This node keeps its identity (so that its parent need not change) but
   * becomes the coercion marker, with the given mode; its former contents move
   * into a new child node, which this method returns.
   */
  public Node wrap(Attribute coercion, Mode mode) {
    if (!coercion.isCoercion()) {
      throw new IllegalArgumentException("not a coercion: " + coercion);
    }
    final Node inner = new Node(pos, attribute, symbol);
    inner.children.addAll(children);
    inner.sizety = sizety;
    inner.mode = this.mode;
    inner.tag = tag;
    inner.table = table;
    children.clear();
    children.add(inner);
    this.attribute = coercion;
    this.symbol = null;
    this.sizety = 0;
    this.tag = null;
    this.mode = requireNonNull(mode);
    return inner;
  }

  /**
   * Replaces this coercion marker by the node it wraps, which takes the given
   * mode. The inverse of {@link #wrap}, used when a coercion is folded into a
   * denotation.
   */
  public void unwrap(Mode mode) {
    if (!attribute.isCoercion() || children.size() != 1) {
      throw new IllegalStateException("not a coercion: " + this);
    }
    final Node inner = children.get(0);
    children.clear();
    children.addAll(inner.children);
    this.attribute = inner.attribute;
    this.symbol = inner.symbol;
    this.sizety = inner.sizety;
    this.tag = inner.tag;
    this.table = inner.table;
    this.mode = requireNonNull(mode);
  }

  /** Calls an action on this node and all of its descendants, pre-order. */
  public void forEach(Consumer<Node> action) {
    action.accept(this);
    for (Node child : new ArrayList<>(children)) {
      child.forEach(action);
    }
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /**
   * Writes this node in a compact prefix form, for example
   * "(FORMULA (IDENTIFIER i) (OPERATOR +) (DENOTATION (INT_DENOTATION 1)))".
   */
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append('(').append(attribute);
    if (symbol != null) {
      buf.append(' ').append(symbol);
    }
    for (Node child : children) {
      buf.append(' ');
      child.describeTo(buf);
    }
    return buf.append(')');
  }
}

// End Node.java
