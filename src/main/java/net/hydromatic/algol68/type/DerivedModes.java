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

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Synthesizes the modes that selections, slices and coercions need but that
 * the program does not write: deflexed modes, names of fields and elements,
 * multiple-selection modes, trimmed modes, and rows of one more dimension.
 *
 * <p>Each round may create modes that themselves need derived modes, and may
 * reveal new equivalences, so rounds repeat until the number of modes in the
 * graph is stable. Afterwards, checks structures and unions that could not be
 * checked while indicants were unresolved.
 */
public class DerivedModes {
  private final ModeGraph graph;
  private final int roundLimit;
  private final Listener listener;
  private final Set<Mode> deflexing =
      Collections.newSetFromMap(new IdentityHashMap<>());

  /** Creates a DerivedModes. */
  public DerivedModes(ModeGraph graph, int roundLimit, Listener listener) {
    this.graph = requireNonNull(graph);
    this.roundLimit = roundLimit;
    this.listener = requireNonNull(listener);
  }

  /** Computes derived modes until the graph is stable, then checks
   * structures and unions. */
  public void compute() {
    absorbUnions();
    contractUnions();
    int previous = -1;
    for (int round = 1; ; round++) {
      if (round > roundLimit) {
        throw new InternalConsistencyException("derived modes are not stable"
            + " after " + roundLimit + " rounds");
      }
      deriveRound();
      final int count = graph.size();
      listener.onRound(round, count);
      if (count == previous) {
        break;
      }
      previous = count;
    }
    if (graph.lookup(StandardMode.STRING)
        != graph.lookup(StandardMode.FLEX_ROW_CHAR)) {
      throw new InternalConsistencyException("STRING is not FLEX [] CHAR");
    }
    for (Mode z : canonicalModes()) {
      z.hasRows = hasRow(z);
    }
    check();
  }

  private void deriveRound() {
    for (Mode z : canonicalModes()) {
      deflex(z);
    }
    for (Mode z : canonicalModes()) {
      deriveNameAndMultiple(z);
    }
    for (Mode z : canonicalModes()) {
      if (z.trim == null && z.is(ModeKind.FLEX)) {
        z.trim = z.sub();
      }
      if (z.trim == null && isRefFlex(z)) {
        z.trim = graph.ref(requireNonNull(z.sub().sub()));
      }
    }
    for (Mode z : canonicalModes()) {
      deriveRows(z);
    }
    for (Mode z : canonicalModes()) {
      if (z.is(ModeKind.ROW) && z.slice() != null) {
        z.slice().rowed = z;
      }
      if (z.is(ModeKind.REF)) {
        final Mode y = z.sub();
        if (y.slice() != null
            && y.slice().is(ModeKind.ROW)
            && z.name() != null) {
          z.name().rowed = z;
        }
      }
    }
    transferSlots();
    // Resolving indicants may have made union members unions.
    absorbUnions();
    contractUnions();
    for (Mode z : canonicalModes()) {
      if (z.is(ModeKind.FLEX)) {
        final Mode row = z.sub();
        final Mode element = row.sub();
        if (element != null && element.is(ModeKind.STRUCT)) {
          z.multiple = flexMultipleStruct(element, row.dim());
        }
      }
    }
    graph.equivalence().findEquivalentModes();
    transferSlots();
  }

  private List<Mode> canonicalModes() {
    final List<Mode> list = new ArrayList<>();
    for (Mode mode : graph.modes()) {
      if (mode.isCanonical()) {
        list.add(mode);
      }
    }
    return list;
  }

  private static boolean isRefFlex(Mode z) {
    return z.is(ModeKind.REF) && z.sub().is(ModeKind.FLEX);
  }

  /**
   * Returns the mode with FLEX removed, memoizing it.
   *
   * <p>Names and procedures inside a row, structure or procedure result keep
   * their FLEX; a name of a flexible row must stay one.
   */
  Mode deflex(Mode mode) {
    final Mode z = mode.resolve();
    if (z.deflexed != null) {
      return z.deflexed.resolve();
    }
    if (!deflexing.add(z)) {
      return z;
    }
    try {
      final Mode d;
      switch (z.kind) {
        case FLEX:
          d = deflex(z.sub());
          break;
        case ROW:
          final Mode element = valueDeflex(z.sub());
          d = element == z.sub()
              ? z
              : graph.addRow(z.dim, element, null, false);
          break;
        case REF:
          final Mode referent = deflex(z.sub());
          d = referent == z.sub() ? z : graph.ref(referent);
          break;
        case PROC:
          if (!z.pack.isEmpty()) {
            d = z;
          } else {
            final Mode result = valueDeflex(z.sub());
            d = result == z.sub() ? z : graph.proc(result);
          }
          break;
        case STRUCT:
          d = deflexStruct(z);
          break;
        default:
          d = z;
          break;
      }
      z.deflexed = d;
      return d;
    } finally {
      deflexing.remove(z);
    }
  }

  private Mode valueDeflex(Mode m) {
    final Mode x = m.resolve();
    if (x.is(ModeKind.REF) || x.is(ModeKind.PROC)) {
      return x;
    }
    return deflex(x);
  }

  private Mode deflexStruct(Mode z) {
    boolean changed = false;
    final List<PackEntry> fields = new ArrayList<>();
    for (PackEntry entry : z.pack) {
      final Mode m = valueDeflex(entry.mode());
      changed |= m != entry.mode();
      fields.add(new PackEntry(m, entry.text, entry.node));
    }
    return changed ? graph.struct(fields) : z;
  }

  private void deriveNameAndMultiple(Mode z) {
    if (z.name == null && z.is(ModeKind.REF)) {
      final Mode s = z.sub();
      if (s.is(ModeKind.STRUCT)) {
        z.name = nameStruct(s);
      } else if (s.is(ModeKind.ROW)) {
        z.name = nameRow(s);
      } else if (s.is(ModeKind.FLEX) && s.sub() != null) {
        z.name = nameRow(s.sub());
      }
    }
    if (z.multiple == null) {
      if (z.is(ModeKind.REF)) {
        final Mode m = z.sub().multiple();
        if (m != null) {
          z.multiple = nameStruct(m);
        }
      } else if (z.is(ModeKind.ROW) && z.sub().is(ModeKind.STRUCT)) {
        z.multiple = multipleStruct(z.sub(), z.dim);
      }
    }
  }

  private void deriveRows(Mode z) {
    if (z.is(ModeKind.ROW) && z.dim > 0 && !z.derivate) {
      graph.addRow(z.dim + 1, z.sub(), z.node, true);
    } else if (z.is(ModeKind.REF)
        && z.sub().is(ModeKind.ROW)
        && !z.sub().derivate) {
      final Mode row = z.sub();
      final Mode x = graph.addRow(row.dim + 1, row.sub(), row.node, true);
      final Mode y = graph.ref(x);
      y.name = z;
    }
  }

  /** {@code REF STRUCT (A a, B b)} selects {@code STRUCT (REF A a, REF B b)}. */
  private Mode nameStruct(Mode struct) {
    final List<PackEntry> fields = new ArrayList<>();
    for (PackEntry entry : struct.pack) {
      fields.add(
          new PackEntry(graph.ref(entry.mode()), entry.text, entry.node));
    }
    return graph.struct(fields);
  }

  /** {@code REF [,] A} slices to {@code REF [] A}, {@code REF [] A} to
   * {@code REF A}. */
  private @Nullable Mode nameRow(Mode row) {
    if (row.slice() != null) {
      return graph.ref(row.slice());
    } else if (row.sub() != null) {
      return graph.ref(row.sub());
    } else {
      return null;
    }
  }

  /** {@code [] STRUCT (A a)} selects {@code STRUCT ([] A a)}. */
  private Mode multipleStruct(Mode struct, int dim) {
    final List<PackEntry> fields = new ArrayList<>();
    for (PackEntry entry : struct.pack) {
      fields.add(
          new PackEntry(graph.addRow(dim, entry.mode(), null, false),
              entry.text, entry.node));
    }
    return graph.struct(fields);
  }

  private Mode flexMultipleStruct(Mode struct, int dim) {
    final List<PackEntry> fields = new ArrayList<>();
    for (PackEntry entry : struct.pack) {
      final Mode row = graph.addRow(dim, entry.mode(), null, false);
      fields.add(new PackEntry(graph.flex(row), entry.text, entry.node));
    }
    return graph.struct(fields);
  }

  /** Copies derived slots from superseded modes to the modes that replaced
   * them. */
  private void transferSlots() {
    for (Mode m : graph.modes()) {
      if (m.isCanonical()) {
        continue;
      }
      final Mode c = m.resolve();
      c.slice = c.slice != null ? c.slice : m.slice;
      c.deflexed = c.deflexed != null ? c.deflexed : m.deflexed;
      c.name = c.name != null ? c.name : m.name;
      c.multiple = c.multiple != null ? c.multiple : m.multiple;
      c.trim = c.trim != null ? c.trim : m.trim;
      c.rowed = c.rowed != null ? c.rowed : m.rowed;
      c.derivate |= m.derivate;
    }
  }

  /** Replaces union members that are unions by their members. */
  void absorbUnions() {
    for (Mode z : canonicalModes()) {
      if (z.is(ModeKind.UNION)) {
        final List<PackEntry> pack = new ArrayList<>();
        absorb(z.pack, pack);
        z.pack.clear();
        z.pack.addAll(pack);
      }
    }
  }

  private static void absorb(List<PackEntry> entries, List<PackEntry> pack) {
    for (PackEntry entry : entries) {
      final Mode m = entry.mode();
      if (m.is(ModeKind.UNION)) {
        absorb(m.pack, pack);
      } else {
        pack.add(entry);
      }
    }
  }

  /** Removes duplicate members from unions. */
  void contractUnions() {
    for (Mode z : canonicalModes()) {
      if (z.is(ModeKind.UNION)) {
        final List<PackEntry> pack = new ArrayList<>();
        final Set<Mode> seen =
            Collections.newSetFromMap(new IdentityHashMap<>());
        for (PackEntry entry : z.pack) {
          if (seen.add(entry.mode())) {
            pack.add(entry);
          }
        }
        z.pack.clear();
        z.pack.addAll(pack);
      }
    }
  }

  private boolean hasRow(Mode m) {
    if (m.is(ModeKind.STRUCT) || m.is(ModeKind.UNION)) {
      boolean k = false;
      for (Mode member : m.packModes()) {
        member.hasRows = hasRow(member);
        k |= member.hasRows;
      }
      return k;
    }
    return m.hasRows || m.is(ModeKind.ROW) || m.is(ModeKind.FLEX);
  }

  private void check() {
    final Coercibility coercibility = graph.coercibility();
    for (Mode z : canonicalModes()) {
      switch (z.kind) {
        case FLEX:
          if (!z.sub().is(ModeKind.ROW)) {
            listener.onError(z, z + " does not specify a well formed mode");
          }
          break;
        case STRUCT:
          final Set<String> names = new HashSet<>();
          final Set<String> reported = new HashSet<>();
          for (PackEntry entry : z.pack) {
            if (entry.text != null
                && !names.add(entry.text)
                && reported.add(entry.text)) {
              listener.onError(z,
                  "multiple declaration of field " + entry.text);
            }
          }
          break;
        case UNION:
          final List<Mode> members = z.packModes();
          if (members.size() == 1) {
            listener.onError(z, z + " must have at least two components");
          }
          checkRelated:
          for (int i = 0; i < members.size(); i++) {
            for (int j = i + 1; j < members.size(); j++) {
              final Mode s = members.get(i);
              final Mode t = members.get(j);
              if (s != t && coercibility.isFirm(s, t)) {
                listener.onError(z, z + " has firmly related components");
                break checkRelated;
              }
            }
          }
          for (Mode member : members) {
            final Mode n = coercibility.deprefCompletely(member);
            if (n.is(ModeKind.UNION)
                && coercibility.isSubset(n, z, Deflexing.NO)) {
              listener.onError(z,
                  z + " has firmly related subset " + n);
            }
          }
          break;

        default:
          break;
      }
    }
  }

  /** Receives progress and errors from {@link DerivedModes}. */
  public interface Listener {
    /** Called after each round, with the number of modes in the graph. */
    void onRound(int round, int modeCount);

    /** Called when a mode is found to be invalid. */
    void onError(Mode mode, String message);
  }
}

// End DerivedModes.java
