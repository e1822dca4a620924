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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.algol68.ast.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Graph of all modes in use during one compilation.
 *
 * <p>The graph owns every mode, numbers modes in order of registration, and
 * interns them: asking for a mode that is structurally equivalent to one
 * already present returns the existing mode. It also owns the postulate stack
 * used by {@link Equivalence}. Create a fresh graph for each compilation.
 */
public class ModeGraph {
  private final List<Mode> modes = new ArrayList<>();
  private final Map<StandardMode, Mode> standardModes =
      new EnumMap<>(StandardMode.class);
  private final Postulates postulates = new Postulates();
  private final Equivalence equivalence = new Equivalence(this);
  private final Coercibility coercibility = new Coercibility(this);

  /** Number of modes belonging to the standard environment. */
  private final int standardCount;

  /** Creates a ModeGraph populated with the standard modes. */
  public ModeGraph() {
    for (StandardMode standardMode : StandardMode.values()) {
      final Mode mode;
      if (standardMode.isAtomic()) {
        final ModeKind kind =
            standardMode == StandardMode.VOID
                ? ModeKind.VOID
                : ModeKind.STANDARD;
        mode =
            add(new Mode(kind, standardMode.sizety, standardMode.symbol, null,
                null, ImmutableList.of()));
        if (standardMode.definition != null) {
          final Mode definition = standardMode.definition.apply(this);
          mode.equivalent = definition;
          if (definition.alias == null) {
            definition.alias = ModeDescriber.sizetyPrefix(standardMode.sizety)
                + standardMode.symbol;
          }
        }
      } else {
        mode = requireNonNull(standardMode.definition).apply(this);
      }
      standardModes.put(standardMode, mode);
    }
    standardCount = modes.size();
  }

  public Postulates postulates() {
    return postulates;
  }

  public Equivalence equivalence() {
    return equivalence;
  }

  public Coercibility coercibility() {
    return coercibility;
  }

  /** Returns all modes, in order of registration. */
  public List<Mode> modes() {
    return ImmutableList.copyOf(modes);
  }

  /** Returns the number of modes, including superseded ones. */
  public int size() {
    return modes.size();
  }

  /** Whether a mode was created for the standard environment. */
  public boolean isStandard(Mode mode) {
    return mode.number >= 0 && mode.number < standardCount;
  }

  /** Looks up a standard mode. Never returns null. */
  public Mode lookup(StandardMode standardMode) {
    final Mode mode = standardModes.get(standardMode);
    if (mode == null) {
      throw new InternalConsistencyException("standard mode " + standardMode
          + " is not yet defined");
    }
    return mode.resolve();
  }

  /** Whether {@code mode} is the given standard mode. */
  public boolean is(Mode mode, StandardMode standardMode) {
    return mode.resolve() == lookup(standardMode);
  }

  /**
   * Finds the standard mode that an indicant such as "INT", preceded by
   * {@code sizety} LONGs (or, if negative, SHORTs), denotes.
   *
   * <p>If there is no mode of that precision, moves towards the plain mode;
   * "LONG LONG LONG INT" is "LONG LONG INT" and "SHORT INT" is "INT". Returns
   * null if {@code symbol} is not the name of a standard mode.
   */
  public @Nullable Mode searchStandard(int sizety, String symbol) {
    final int step = sizety > 0 ? -1 : 1;
    for (int k = sizety; ; k += step) {
      for (StandardMode standardMode : StandardMode.values()) {
        if (standardMode.visible
            && standardMode.sizety == k
            && symbol.equals(standardMode.symbol)) {
          return lookup(standardMode);
        }
      }
      if (k == 0) {
        return null;
      }
    }
  }

  /**
   * Returns a mode with the given properties; either an existing equivalent
   * mode, or a new mode added to the graph.
   */
  public Mode intern(ModeKind kind, int dim, @Nullable Node node,
      @Nullable Mode sub, List<PackEntry> pack) {
    if (kind.needsSub() && sub == null) {
      throw new InternalConsistencyException("mode of kind " + kind
          + " must have a sub-mode");
    }
    checkArgument(kind != ModeKind.STANDARD && kind != ModeKind.VOID,
        "standard modes are created with the graph");
    return register(new Mode(kind, dim, null, node, sub, pack));
  }

  /**
   * Adds a mode to the graph unless an equivalent mode is already present, in
   * which case returns that mode.
   */
  Mode register(Mode candidate) {
    if (candidate.kind == ModeKind.INDICANT) {
      for (Mode mode : modes) {
        if (mode.kind == ModeKind.INDICANT && mode.node == candidate.node) {
          return mode.resolve();
        }
      }
    }
    for (Mode mode : modes) {
      if (mode.kind == candidate.kind && equivalence.prove(mode, candidate)) {
        return mode.resolve();
      }
    }
    return add(candidate);
  }

  private Mode add(Mode mode) {
    mode.number = modes.size();
    modes.add(mode);
    return mode;
  }

  /** Returns the mode of an applied mode indicant, given the defining
   * indicant. */
  public Mode indicant(Node definingIndicant) {
    return intern(ModeKind.INDICANT, 0, definingIndicant, null,
        ImmutableList.of());
  }

  /**
   * Makes an indicant stand for the mode given in its declaration. If the
   * declaration is not well formed, the caller should declare the indicant
   * as ERROR, so that resolving it terminates.
   */
  public void declare(Mode indicant, Mode declared) {
    checkArgument(indicant.kind == ModeKind.INDICANT,
        "not an indicant: %s", indicant.kind);
    indicant.equivalent = declared;
  }

  public Mode ref(Mode sub) {
    return intern(ModeKind.REF, 0, null, sub, ImmutableList.of());
  }

  public Mode flex(Mode sub) {
    return intern(ModeKind.FLEX, 0, null, sub, ImmutableList.of());
  }

  /** Returns a row of {@code dim} dimensions, with its slice modes. */
  public Mode row(int dim, Mode sub) {
    return addRow(dim, sub, null, false);
  }

  /** Returns a row declared by a given declarer. */
  public Mode row(int dim, Mode sub, @Nullable Node node) {
    return addRow(dim, sub, node, false);
  }

  /**
   * Returns a row of {@code dim} dimensions, and sets its slice to the row of
   * one fewer dimension (or the element mode).
   *
   * @param derivate Whether to mark the rows as created by row synthesis
   */
  Mode addRow(int dim, Mode sub, @Nullable Node node, boolean derivate) {
    checkArgument(dim > 0, "row must have at least one dimension");
    final Mode row =
        intern(ModeKind.ROW, dim, node, sub, ImmutableList.of());
    row.slice = dim > 1 ? addRow(dim - 1, sub, node, derivate) : sub;
    row.derivate |= derivate;
    return row;
  }

  public Mode struct(List<PackEntry> fields) {
    return intern(ModeKind.STRUCT, 0, null, null, fields);
  }

  /** Returns a structure; arguments alternate mode and field name. */
  public Mode struct(Object... modeNames) {
    checkArgument(modeNames.length % 2 == 0, "expected mode-name pairs");
    final List<PackEntry> fields = new ArrayList<>();
    for (int i = 0; i < modeNames.length; i += 2) {
      fields.add(
          PackEntry.of((Mode) modeNames[i], (String) modeNames[i + 1]));
    }
    return struct(fields);
  }

  Mode complexStruct(StandardMode realMode) {
    final Mode real = lookup(realMode);
    return struct(real, "re", real, "im");
  }

  public Mode union(List<Mode> members) {
    final List<PackEntry> pack = new ArrayList<>();
    members.forEach(m -> pack.add(PackEntry.of(m)));
    return intern(ModeKind.UNION, 0, null, null, pack);
  }

  public Mode union(Mode... members) {
    return union(Arrays.asList(members));
  }

  /** Returns a procedure mode. */
  public Mode proc(Mode result, List<Mode> parameters) {
    final List<PackEntry> pack = new ArrayList<>();
    parameters.forEach(m -> pack.add(PackEntry.of(m)));
    return intern(ModeKind.PROC, 0, null, result, pack);
  }

  public Mode proc(Mode result, Mode... parameters) {
    return proc(result, Arrays.asList(parameters));
  }

  /** Returns the series of the modes of the units of a clause. */
  public Mode series(List<PackEntry> pack) {
    return intern(ModeKind.SERIES, 0, null, null, pack);
  }

  /** Returns the modes of the units of a collateral display. */
  public Mode stowed(List<PackEntry> pack) {
    return intern(ModeKind.STOWED, 0, null, null, pack);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder();
    for (Mode mode : modes) {
      b.append('#').append(mode.number).append(' ').append(mode);
      if (!mode.isCanonical()) {
        b.append(" = #").append(mode.resolve().number);
      }
      b.append('\n');
    }
    return b.toString();
  }
}

// End ModeGraph.java
