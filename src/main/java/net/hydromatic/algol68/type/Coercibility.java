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

import static net.hydromatic.algol68.type.StandardMode.BITS;
import static net.hydromatic.algol68.type.StandardMode.BYTES;
import static net.hydromatic.algol68.type.StandardMode.COMPLEX;
import static net.hydromatic.algol68.type.StandardMode.ERROR;
import static net.hydromatic.algol68.type.StandardMode.FLEX_ROW_BOOL;
import static net.hydromatic.algol68.type.StandardMode.FLEX_ROW_CHAR;
import static net.hydromatic.algol68.type.StandardMode.HIP;
import static net.hydromatic.algol68.type.StandardMode.INT;
import static net.hydromatic.algol68.type.StandardMode.LONG_BITS;
import static net.hydromatic.algol68.type.StandardMode.LONG_BYTES;
import static net.hydromatic.algol68.type.StandardMode.LONG_COMPLEX;
import static net.hydromatic.algol68.type.StandardMode.LONG_INT;
import static net.hydromatic.algol68.type.StandardMode.LONG_LONG_BITS;
import static net.hydromatic.algol68.type.StandardMode.LONG_LONG_COMPLEX;
import static net.hydromatic.algol68.type.StandardMode.LONG_LONG_INT;
import static net.hydromatic.algol68.type.StandardMode.LONG_LONG_REAL;
import static net.hydromatic.algol68.type.StandardMode.LONG_REAL;
import static net.hydromatic.algol68.type.StandardMode.REAL;
import static net.hydromatic.algol68.type.StandardMode.ROWS;
import static net.hydromatic.algol68.type.StandardMode.ROW_BOOL;
import static net.hydromatic.algol68.type.StandardMode.ROW_CHAR;
import static net.hydromatic.algol68.type.StandardMode.UNDEFINED;
import static net.hydromatic.algol68.type.StandardMode.VACUUM;
import static net.hydromatic.algol68.type.StandardMode.VOID;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.algol68.ast.Attribute;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Predicates that decide whether a value of one mode can be coerced to
 * another, and the operations that find a common mode for the units of a
 * clause.
 *
 * <p>Call these only after {@link DerivedModes#compute()}; they rely on the
 * deflexed, name and slice modes.
 */
public class Coercibility {
  private final ModeGraph graph;

  Coercibility(ModeGraph graph) {
    this.graph = graph;
  }

  private Mode std(StandardMode standardMode) {
    return graph.lookup(standardMode);
  }

  private boolean is(Mode mode, StandardMode standardMode) {
    return graph.is(mode, standardMode);
  }

  private boolean isAny(Mode mode, StandardMode... standardModes) {
    for (StandardMode standardMode : standardModes) {
      if (is(mode, standardMode)) {
        return true;
      }
    }
    return false;
  }

  /** Whether a mode is ERROR or UNDEFINED. */
  public boolean isWell(@Nullable Mode mode) {
    return mode != null && !is(mode, ERROR) && !is(mode, UNDEFINED);
  }

  /** Whether a mode, or a member of its pack, is not well defined. */
  public boolean isNotWell(@Nullable Mode mode) {
    if (!isWell(mode)) {
      return true;
    }
    for (Mode m : mode.packModes()) {
      if (!isWell(m)) {
        return true;
      }
    }
    return false;
  }

  /** Whether two modes are the same, after FLEX is removed as
   * {@code deflex} allows. */
  public boolean isEqualModes(Mode p, Mode q, Deflexing deflex) {
    final Mode x = p.resolve();
    final Mode y = q.resolve();
    switch (deflex) {
      case FORCE:
        return x.deflex() == y.deflex();
      case ALIAS:
        if (x.is(ModeKind.REF) && y.is(ModeKind.REF)) {
          return x == y || x.deflex() == y;
        } else if (!x.is(ModeKind.REF) && !y.is(ModeKind.REF)) {
          return x.deflex() == y.deflex();
        }
        break;
      case SAFE:
        if (!x.is(ModeKind.REF) && !y.is(ModeKind.REF)) {
          return x.deflex() == y.deflex();
        }
        break;
      default:
        break;
    }
    return x == y;
  }

  /** Whether a mode can be dereferenced or deprocedured. */
  public boolean isDeprefable(Mode p) {
    final Mode x = p.resolve();
    return x.is(ModeKind.REF) || isParameterless(x);
  }

  private static boolean isParameterless(Mode x) {
    return x.is(ModeKind.PROC) && x.pack.isEmpty();
  }

  /** Dereferences or deprocedures a mode once; a name of a flexible row
   * yields the fixed row. */
  public @Nullable Mode deprefOnce(Mode p) {
    final Mode x = p.resolve();
    if (x.is(ModeKind.REF)) {
      final Mode sub = x.sub();
      if (sub != null && sub.is(ModeKind.FLEX)) {
        return sub.sub();
      }
      return sub;
    } else if (isParameterless(x)) {
      return x.sub();
    } else {
      return null;
    }
  }

  public Mode deprefCompletely(Mode p) {
    Mode x = p.resolve();
    while (isDeprefable(x)) {
      x = next(x);
    }
    return x;
  }

  public Mode deprocCompletely(Mode p) {
    Mode x = p.resolve();
    while (isParameterless(x)) {
      x = next(x);
    }
    return x;
  }

  private Mode next(Mode x) {
    final Mode m = deprefOnce(x);
    if (m == null) {
      throw new InternalConsistencyException("cannot dereference " + x);
    }
    return m;
  }

  /**
   * Returns the mode that a unit of mode {@code p} has after coercion to
   * {@code q}; that is {@code q}, unless {@code q} is ROWS, which stands for
   * the completely dereferenced {@code p}.
   */
  public Mode deprefRows(Mode p, Mode q) {
    return is(q, ROWS) ? deprefCompletely(p) : q.resolve();
  }

  /** Strips rows and FLEX from a mode. */
  public Mode derow(Mode p) {
    Mode x = p.resolve();
    while (x.is(ModeKind.ROW) || x.is(ModeKind.FLEX)) {
      x = x.sub();
    }
    return x;
  }

  /** Whether a mode is a row, or a union of rows. */
  public boolean isRowsType(Mode p) {
    final Mode x = p.resolve();
    switch (x.kind) {
      case ROW:
      case FLEX:
        return true;
      case UNION:
        for (Mode m : x.packModes()) {
          if (!isRowsType(m)) {
            return false;
          }
        }
        return true;
      default:
        return false;
    }
  }

  /** Whether a mode is a name of a structure. */
  public boolean isNameStruct(Mode p) {
    final Mode x = p.resolve();
    return x.name() != null
        && x.sub() != null
        && x.sub().deflex().is(ModeKind.STRUCT);
  }

  /** Whether a mode is a name of a row. */
  public boolean isRefRow(Mode p) {
    final Mode x = p.resolve();
    return x.name() != null
        && x.sub() != null
        && x.sub().deflex().is(ModeKind.ROW);
  }

  /**
   * Returns the member of union {@code u} that a value of mode {@code m}
   * unites to; an exact match is preferred over a match that differs only in
   * FLEX.
   */
  public @Nullable Mode unitesTo(Mode m, Mode u) {
    final Mode x = m.resolve();
    Mode v = null;
    for (Mode member : u.resolve().packModes()) {
      if (x == member) {
        v = member;
      } else if (v == null && x.deflex() == member.deflex()) {
        v = member;
      }
    }
    return v;
  }

  public boolean isModeInPack(Mode u, List<Mode> pack, Deflexing deflex) {
    for (Mode m : pack) {
      if (isEqualModes(u, m, deflex)) {
        return true;
      }
    }
    return false;
  }

  /** Whether every member of union {@code p} is a member of union
   * {@code q}. */
  public boolean isSubset(Mode p, Mode q, Deflexing deflex) {
    final List<Mode> qs = q.resolve().packModes();
    for (Mode m : p.resolve().packModes()) {
      if (!isModeInPack(m, qs, deflex)) {
        return false;
      }
    }
    return true;
  }

  /** Whether a value of mode {@code p} can be united to {@code q}. */
  public boolean isUnitable(Mode p, Mode q, Deflexing deflex) {
    final Mode x = p.resolve();
    final Mode y = q.resolve();
    if (!y.is(ModeKind.UNION)) {
      return false;
    }
    if (x.is(ModeKind.UNION)) {
      return isSubset(x, y, deflex);
    }
    return isModeInPack(x, y.packModes(), deflex);
  }

  /**
   * Investigates, for each member of {@code v}, whether some member of
   * {@code u} is firmly coercible to it.
   */
  public FirmRelations investigateFirmRelations(List<Mode> u, List<Mode> v) {
    boolean all = true;
    boolean some = false;
    for (Mode to : v) {
      boolean k = false;
      for (Mode from : u) {
        k |= isCoercible(from, to, Sort.FIRM, Deflexing.FORCE);
      }
      some |= k;
      all &= k;
    }
    return new FirmRelations(all, some);
  }

  public boolean isSoftlyCoercible(Mode p, Mode q, Deflexing deflex) {
    final Mode x = p.resolve();
    if (isEqualModes(x, q, deflex)) {
      return true;
    } else if (isParameterless(x)) {
      return isSoftlyCoercible(x.sub(), q, deflex);
    } else {
      return false;
    }
  }

  /** Weak coercion dereferences, but not the name of a row or a structure,
   * which slices and selections need. */
  public boolean isWeaklyCoercible(Mode p, Mode q, Deflexing deflex) {
    final Mode x = p.resolve();
    if (isEqualModes(x, q, deflex)) {
      return true;
    } else if (x.is(ModeKind.REF) && isStowed(x.sub().deflex())) {
      return false;
    } else if (isDeprefable(x)) {
      return isWeaklyCoercible(next(x), q, deflex);
    } else {
      return false;
    }
  }

  private static boolean isStowed(Mode x) {
    return x.is(ModeKind.STRUCT) || x.is(ModeKind.ROW);
  }

  public boolean isMeeklyCoercible(Mode p, Mode q, Deflexing deflex) {
    final Mode x = p.resolve();
    if (isEqualModes(x, q, deflex)) {
      return true;
    } else if (isDeprefable(x)) {
      return isMeeklyCoercible(next(x), q, deflex);
    } else {
      return false;
    }
  }

  public boolean isFirmlyCoercible(Mode p, Mode q, Deflexing deflex) {
    final Mode x = p.resolve();
    if (isEqualModes(x, q, deflex)) {
      return true;
    } else if (is(q, ROWS) && isRowsType(x)) {
      return true;
    } else if (isUnitable(x, q, deflex)) {
      return true;
    } else if (isDeprefable(x)) {
      return isFirmlyCoercible(next(x), q, deflex);
    } else {
      return false;
    }
  }

  /** Whether either mode is firmly coercible to the other; two such modes
   * cannot both be members of a union. */
  public boolean isFirm(Mode p, Mode q) {
    return isFirmlyCoercible(p, q, Deflexing.SAFE)
        || isFirmlyCoercible(q, p, Deflexing.SAFE);
  }

  /**
   * Returns the first step of widening {@code p} towards {@code q}, or null
   * if {@code p} does not widen to {@code q}.
   */
  public @Nullable Mode widensTo(Mode p, Mode q) {
    if (is(p, INT)) {
      if (isAny(q, LONG_INT, LONG_LONG_INT, LONG_REAL, LONG_LONG_REAL,
          LONG_COMPLEX, LONG_LONG_COMPLEX)) {
        return std(LONG_INT);
      } else if (isAny(q, REAL, COMPLEX)) {
        return std(REAL);
      }
    } else if (is(p, LONG_INT)) {
      if (is(q, LONG_LONG_INT)) {
        return std(LONG_LONG_INT);
      } else if (isAny(q, LONG_REAL, LONG_LONG_REAL, LONG_COMPLEX,
          LONG_LONG_COMPLEX)) {
        return std(LONG_REAL);
      }
    } else if (is(p, LONG_LONG_INT)) {
      if (isAny(q, LONG_LONG_REAL, LONG_LONG_COMPLEX)) {
        return std(LONG_LONG_REAL);
      }
    } else if (is(p, REAL)) {
      if (isAny(q, LONG_REAL, LONG_LONG_REAL, LONG_COMPLEX,
          LONG_LONG_COMPLEX)) {
        return std(LONG_REAL);
      } else if (is(q, COMPLEX)) {
        return std(COMPLEX);
      }
    } else if (is(p, COMPLEX)) {
      if (isAny(q, LONG_COMPLEX, LONG_LONG_COMPLEX)) {
        return std(LONG_COMPLEX);
      }
    } else if (is(p, LONG_REAL)) {
      if (isAny(q, LONG_LONG_REAL, LONG_LONG_COMPLEX)) {
        return std(LONG_LONG_REAL);
      } else if (is(q, LONG_COMPLEX)) {
        return std(LONG_COMPLEX);
      }
    } else if (is(p, LONG_COMPLEX)) {
      if (is(q, LONG_LONG_COMPLEX)) {
        return std(LONG_LONG_COMPLEX);
      }
    } else if (is(p, LONG_LONG_REAL)) {
      if (is(q, LONG_LONG_COMPLEX)) {
        return std(LONG_LONG_COMPLEX);
      }
    } else if (isAny(p, BITS, LONG_BITS, LONG_LONG_BITS)) {
      if (is(p, BITS) && isAny(q, LONG_BITS, LONG_LONG_BITS)) {
        return std(LONG_BITS);
      } else if (is(p, LONG_BITS) && is(q, LONG_LONG_BITS)) {
        return std(LONG_LONG_BITS);
      } else if (is(q, ROW_BOOL)) {
        return std(ROW_BOOL);
      } else if (is(q, FLEX_ROW_BOOL)) {
        return std(FLEX_ROW_BOOL);
      }
    } else if (isAny(p, BYTES, LONG_BYTES)) {
      if (is(q, ROW_CHAR)) {
        return std(ROW_CHAR);
      } else if (is(q, FLEX_ROW_CHAR)) {
        return std(FLEX_ROW_CHAR);
      }
    }
    return null;
  }

  /** Whether {@code p} widens, in one or more steps, to {@code q}. */
  public boolean isWidenable(Mode p, Mode q) {
    final Mode z = widensTo(p, q);
    if (z == null) {
      return false;
    }
    return z == q.resolve() || isWidenable(z, q);
  }

  /** Whether a name of mode {@code p} can be rowed to {@code q}. */
  public boolean isStrongName(Mode p, Mode q) {
    final Mode x = p.resolve();
    final Mode y = q.resolve();
    if (x == y) {
      return true;
    } else if (isRefRow(y)) {
      return isStrongName(x, y.name());
    } else {
      return false;
    }
  }

  /** Whether a value of mode {@code p} can be rowed to {@code q}. */
  public boolean isStrongSlice(Mode p, Mode q) {
    final Mode x = p.resolve();
    final Mode y = q.resolve();
    if (x == y || isWidenable(x, y)) {
      return true;
    } else if (y.slice() != null) {
      return isStrongSlice(x, y.slice());
    } else if (y.is(ModeKind.FLEX)) {
      return isStrongSlice(x, y.sub());
    } else if (isRefRow(y)) {
      return isStrongName(x, y);
    } else {
      return false;
    }
  }

  public boolean isStronglyCoercible(Mode p, Mode q, Deflexing deflex) {
    final Mode x = p.resolve();
    final Mode y = q.resolve();
    // The order of these tests matters.
    if (isEqualModes(x, y, deflex)) {
      return true;
    } else if (is(y, VOID)) {
      return true;
    } else if (is(y, ROWS) && isRowsType(x)) {
      return true;
    } else if (isUnitable(x, derow(y), deflex)) {
      return true;
    } else if (isRefRow(y) && isStrongName(x, y)) {
      return true;
    } else if (y.slice() != null && isStrongSlice(x, y)) {
      return true;
    } else if (y.is(ModeKind.FLEX) && isStrongSlice(x, y)) {
      return true;
    } else if (isWidenable(x, y)) {
      return true;
    } else if (isDeprefable(x)) {
      return isStronglyCoercible(next(x), y, deflex);
    } else {
      return false;
    }
  }

  /** Whether {@code p} can be coerced to {@code q} using only the coercions
   * of sort {@code sort}. */
  public boolean basicCoercions(Mode p, Mode q, Sort sort, Deflexing deflex) {
    if (isEqualModes(p, q, deflex)) {
      return true;
    }
    switch (sort) {
      case NO_SORT:
        return p.resolve() == q.resolve();
      case SOFT:
        return isSoftlyCoercible(p, q, deflex);
      case WEAK:
        return isWeaklyCoercible(p, q, deflex);
      case MEEK:
        return isMeeklyCoercible(p, q, deflex);
      case FIRM:
        return isFirmlyCoercible(p, q, deflex);
      case STRONG:
        return isStronglyCoercible(p, q, deflex);
      default:
        throw new AssertionError(sort);
    }
  }

  /** Whether a display, whose units have the modes in stowed mode
   * {@code p}, can be coerced to {@code q}. */
  public boolean isCoercibleStowed(Mode p, Mode q, Sort sort,
      Deflexing deflex) {
    final Mode y = q.resolve();
    if (sort != Sort.STRONG) {
      // A display is always in a strong position.
      return false;
    } else if (is(y, VOID)) {
      return true;
    } else if (y.is(ModeKind.FLEX)) {
      return allCoercible(p, y.sub().slice(), sort, deflex);
    } else if (y.is(ModeKind.ROW)) {
      return allCoercible(p, y.slice(), sort, deflex);
    } else if (y.is(ModeKind.PROC) || y.is(ModeKind.STRUCT)) {
      final List<Mode> us = p.resolve().packModes();
      final List<Mode> vs = y.packModes();
      if (us.size() != vs.size()) {
        return false;
      }
      for (int i = 0; i < us.size(); i++) {
        if (!isCoercible(us.get(i), vs.get(i), sort, deflex)) {
          return false;
        }
      }
      return true;
    } else {
      return false;
    }
  }

  private boolean allCoercible(Mode p, @Nullable Mode q, Sort sort,
      Deflexing deflex) {
    for (Mode m : p.resolve().packModes()) {
      if (!isCoercible(m, q, sort, deflex)) {
        return false;
      }
    }
    return true;
  }

  /** Whether every mode in series {@code p} can be coerced to {@code q}. */
  public boolean isCoercibleSeries(Mode p, Mode q, Sort sort,
      Deflexing deflex) {
    final Mode x = p.resolve();
    final Mode y = q.resolve();
    if (sort == Sort.NO_SORT) {
      return false;
    } else if (x.is(ModeKind.SERIES) && x.pack.isEmpty()) {
      return false;
    } else if (y.is(ModeKind.SERIES) && y.pack.isEmpty()) {
      return false;
    } else if (x.pack.isEmpty()) {
      return isCoercible(x, y, sort, deflex);
    }
    return allCoercible(x, y, sort, deflex);
  }

  /**
   * Whether a unit of mode {@code p} can be coerced to {@code q} in a context
   * of sort {@code sort}. Modes in error are coercible to and from
   * everything, so that one error does not cause others.
   */
  public boolean isCoercible(@Nullable Mode p, @Nullable Mode q, Sort sort,
      Deflexing deflex) {
    if (isNotWell(p) || isNotWell(q)) {
      return true;
    }
    final Mode x = p.resolve();
    final Mode y = q.resolve();
    if (isEqualModes(x, y, deflex)) {
      return true;
    } else if (is(x, HIP)) {
      return true;
    } else if (x.is(ModeKind.STOWED)) {
      return isCoercibleStowed(x, y, sort, deflex);
    } else if (x.is(ModeKind.SERIES)) {
      return isCoercibleSeries(x, y, sort, deflex);
    } else if (is(x, VACUUM) && y.deflex().is(ModeKind.ROW)) {
      return true;
    } else {
      return basicCoercions(x, y, sort, deflex);
    }
  }

  /**
   * Whether a value of mode {@code q} is a mode from which procedures have
   * been removed; such a value is voided directly, without calling it.
   */
  public boolean isNonproc(Mode p) {
    Mode x = p.resolve();
    while (x.is(ModeKind.REF)) {
      x = x.sub();
    }
    return !isParameterless(x);
  }

  /** Returns a series of two modes, flattening nested series. A series of
   * one mode is that mode. */
  public Mode makeSeries(Mode u, Mode v) {
    final List<PackEntry> pack = new ArrayList<>();
    flattenSeries(u.resolve(), pack);
    flattenSeries(v.resolve(), pack);
    if (pack.size() == 1) {
      return pack.get(0).mode();
    }
    return graph.series(pack);
  }

  private static void flattenSeries(Mode m, List<PackEntry> pack) {
    if (m.is(ModeKind.SERIES)) {
      for (Mode member : m.packModes()) {
        flattenSeries(member, pack);
      }
    } else {
      pack.add(PackEntry.of(m));
    }
  }

  /**
   * Returns the union of the modes in a series. Nested series and unions are
   * flattened and duplicates removed; a series of one union is that union,
   * and a union of one mode is that mode.
   */
  public Mode makeUnitedMode(@Nullable Mode m) {
    if (m == null) {
      return std(ERROR);
    }
    final Mode x = m.resolve();
    if (!x.is(ModeKind.SERIES)) {
      return x;
    }
    final List<Mode> members = x.packModes();
    if (members.size() == 1 && members.get(0).is(ModeKind.UNION)) {
      return members.get(0);
    }
    final List<Mode> list = new ArrayList<>();
    flattenUnion(x, list);
    if (list.size() == 1) {
      return list.get(0);
    }
    return graph.union(list);
  }

  private static void flattenUnion(Mode m, List<Mode> list) {
    if (m.is(ModeKind.SERIES) || m.is(ModeKind.UNION)) {
      for (Mode member : m.packModes()) {
        flattenUnion(member, list);
      }
    } else if (!containsIdentical(list, m)) {
      list.add(m);
    }
  }

  private static boolean containsIdentical(List<Mode> list, Mode m) {
    for (Mode mode : list) {
      if (mode == m) {
        return true;
      }
    }
    return false;
  }

  /**
   * Replaces members of a union that are, after dereferencing, unions
   * contained in it by their own members. For example, the invalid
   * {@code UNION (PROC REF UNION (A, B), A, B)} becomes {@code UNION (A, B)}.
   */
  public Mode absorbRelatedSubsets(Mode m) {
    Mode u = m.resolve();
    for (;;) {
      boolean modified = false;
      final List<Mode> list = new ArrayList<>();
      for (Mode member : u.packModes()) {
        final Mode n = deprefCompletely(member);
        if (n.is(ModeKind.UNION) && isSubset(n, u, Deflexing.SAFE)) {
          n.packModes().forEach(x -> flattenUnion(x, list));
          modified = true;
        } else {
          flattenUnion(member, list);
        }
      }
      if (!modified) {
        return u;
      }
      if (list.size() == 1) {
        return list.get(0);
      }
      u = graph.union(list);
    }
  }

  /**
   * Returns a member of union {@code m} to which all the other members can
   * be coerced, or {@code m} itself if there is none.
   *
   * <p>Tries increasing levels of dereferencing, so that the longest chain of
   * names is found, and prefers a flexible row.
   */
  public Mode getBalancedMode(Mode m, Sort sort, boolean returnDepreffed,
      Deflexing deflex) {
    final Mode u = m.resolve();
    if (isNotWell(u) || !u.is(ModeKind.UNION)) {
      return u;
    }
    final List<Mode> members = u.packModes();
    Mode common = null;
    boolean goOn = true;
    for (int level = 0; goOn; level++) {
      goOn = false;
      for (int i = 0; i < members.size(); i++) {
        final Mode member = members.get(i);
        if (is(member, HIP)) {
          continue;
        }
        Mode candidate = member;
        int k = level;
        for (; k > 0 && isDeprefable(candidate); k--) {
          candidate = next(candidate);
        }
        if (k > 0) {
          continue;
        }
        goOn = true;
        final Mode to =
            returnDepreffed ? deprefCompletely(candidate) : candidate;
        boolean allCoercible = true;
        for (int j = 0; j < members.size() && allCoercible; j++) {
          final Mode from = members.get(j);
          if (i != j && from != to) {
            allCoercible = isCoercible(from, to, sort, deflex);
          }
        }
        if (allCoercible) {
          final Mode mark = returnDepreffed ? member : candidate;
          if (common == null) {
            common = mark;
          } else if (candidate.is(ModeKind.FLEX)
              && candidate.deflex() == common) {
            common = mark;
          }
        }
      }
    }
    return common == null ? u : common;
  }

  /** Whether a clause of a given kind may balance the modes of its
   * units. */
  public static boolean clauseAllowsBalancing(@Nullable Attribute attribute) {
    if (attribute == null) {
      return false;
    }
    switch (attribute) {
      case CLOSED_CLAUSE:
      case CONDITIONAL_CLAUSE:
      case CASE_CLAUSE:
      case SERIAL_CLAUSE:
      case CONFORMITY_CLAUSE:
        return true;
      default:
        return false;
    }
  }

  /**
   * Returns the single mode that a construct yields; the union of the modes
   * of its units, balanced if the construct is a clause that allows it.
   */
  public Mode determineUniqueMode(@Nullable Mode mode,
      @Nullable Attribute attribute, Deflexing deflex) {
    if (isNotWell(mode)) {
      return std(ERROR);
    }
    final Mode x = makeUnitedMode(mode);
    if (clauseAllowsBalancing(attribute)) {
      return getBalancedMode(x, Sort.STRONG, false, deflex);
    }
    return x;
  }

  /** Result of {@link #investigateFirmRelations(List, List)}. */
  public static class FirmRelations {
    /** Whether every mode is firmly related to some other mode. */
    public final boolean all;
    /** Whether at least one mode is firmly related to some other mode. */
    public final boolean some;

    FirmRelations(boolean all, boolean some) {
      this.all = all;
      this.some = some;
    }
  }
}

// End Coercibility.java
