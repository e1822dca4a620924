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
package net.hydromatic.algol68.type;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.hydromatic.algol68.ast.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Mode (type) of Algol 68.
 *
 * <p>Modes live in a {@link ModeGraph}, which numbers them in order of
 * registration. A mode may be superseded by an equivalent mode; the accessors
 * of this class follow {@link #resolve()} so that callers see canonical modes.
 *
 * <p>Besides its structure (kind, rank, sub-mode, pack), a mode has derived
 * slots that {@link DerivedModes} fills in: the mode of a slice, the deflexed
 * mode, the name mode of a structure or row name, the multiple-selection mode,
 * the trimmed mode, and the rowed mode.
 */
public class Mode {
  private static final int MAX_CHAIN = 10_000;

  public final ModeKind kind;
  /** Rank of a row, or LONG count of a standard mode. */
  final int dim;
  /** Name of a standard mode. */
  final @Nullable String symbol;
  /** Declarer or defining indicant that gave rise to this mode. */
  final @Nullable Node node;
  @Nullable Mode sub;
  final List<PackEntry> pack;
  /** Name of a standard mode that this mode stands for, such as STRING. */
  @Nullable String alias;

  int number = -1;

  @Nullable Mode equivalent;
  @Nullable Mode slice;
  @Nullable Mode deflexed;
  @Nullable Mode name;
  @Nullable Mode multiple;
  @Nullable Mode trim;
  @Nullable Mode rowed;

  /** Whether this row was created, or already processed, by row synthesis. */
  boolean derivate;
  /** Set while the well-formedness checker is inside this indicant. */
  boolean use;
  boolean hasRows;

  Mode(ModeKind kind, int dim, @Nullable String symbol, @Nullable Node node,
      @Nullable Mode sub, List<PackEntry> pack) {
    this.kind = requireNonNull(kind);
    this.dim = dim;
    this.symbol = symbol;
    this.node = node;
    this.sub = sub;
    this.pack = new ArrayList<>(pack);
  }

  /** Returns the canonical mode that this mode is equivalent to. */
  public Mode resolve() {
    Mode m = this;
    for (int i = 0; m.equivalent != null && m.equivalent != m; i++) {
      if (i > MAX_CHAIN) {
        throw new InternalConsistencyException("equivalence chain of mode #"
            + number + " does not terminate");
      }
      m = m.equivalent;
    }
    return m;
  }

  /** Whether this mode is canonical, that is, has no equivalent. */
  public boolean isCanonical() {
    return equivalent == null || equivalent == this;
  }

  public boolean is(ModeKind kind) {
    return this.kind == kind;
  }

  /** Sequence number in the graph; lower numbers were registered first. */
  public int number() {
    return number;
  }

  /**
   * Returns the rank of a row, the LONG count of a standard mode, or the
   * number of entries in the pack of a structure, union, procedure or series.
   */
  public int dim() {
    return kind.hasPack() ? pack.size() : dim;
  }

  public @Nullable String symbol() {
    return symbol;
  }

  public @Nullable Node node() {
    return node;
  }

  /**
   * Returns the sub-mode: what a REF refers to, the element of a ROW, the row
   * of a FLEX, the result of a PROC.
   */
  public @Nullable Mode sub() {
    return sub == null ? null : sub.resolve();
  }

  public List<PackEntry> pack() {
    return Collections.unmodifiableList(pack);
  }

  /** Returns the modes in the pack, following equivalences. */
  public List<Mode> packModes() {
    final ImmutableList.Builder<Mode> b = ImmutableList.builder();
    for (PackEntry entry : pack) {
      b.add(entry.mode());
    }
    return b.build();
  }

  /** Returns the raw equivalence link; see also {@link #resolve()}. */
  public @Nullable Mode equivalent() {
    return equivalent;
  }

  /** Returns the mode of a slice of this row, or of a name of this row. */
  public @Nullable Mode slice() {
    final Mode m = resolve();
    return m.slice == null ? null : m.slice.resolve();
  }

  /** Returns this mode with FLEX removed, where a value cannot be flexible. */
  public Mode deflex() {
    final Mode m = resolve();
    return m.deflexed == null ? m : m.deflexed.resolve();
  }

  /** Returns the mode of a name of a field or element of this name. */
  public @Nullable Mode name() {
    final Mode m = resolve();
    return m.name == null ? null : m.name.resolve();
  }

  /** Returns the mode of a field selected from a row of structures. */
  public @Nullable Mode multiple() {
    final Mode m = resolve();
    return m.multiple == null ? null : m.multiple.resolve();
  }

  /** Returns the mode of a trimmed slice of this flexible row. */
  public @Nullable Mode trim() {
    final Mode m = resolve();
    return m.trim == null ? null : m.trim.resolve();
  }

  /** Returns the row of which this mode is a slice. */
  public @Nullable Mode rowed() {
    final Mode m = resolve();
    return m.rowed == null ? null : m.rowed.resolve();
  }

  /** Whether this mode contains a row, which affects storage management. */
  public boolean hasRows() {
    return resolve().hasRows;
  }

  @Override
  public String toString() {
    return ModeDescriber.describe(this);
  }
}

// End Mode.java
