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
package net.hydromatic.algol68.compile;

import static java.util.Objects.requireNonNull;

import java.util.List;
import net.hydromatic.algol68.type.Coercibility;
import net.hydromatic.algol68.type.Deflexing;
import net.hydromatic.algol68.type.Mode;
import net.hydromatic.algol68.type.ModeKind;
import net.hydromatic.algol68.type.Sort;
import net.hydromatic.algol68.type.StandardMode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Finds the declaration of an operator that suits the modes of its operands.
 *
 * <p>Operands are coerced firmly. If no declaration in scope matches, the
 * standard environment is searched for one whose operands the given ones
 * can be widened to; this allows {@code 1 + 2.0} and {@code REF REAL +:=
 * INT}.
 */
class OperatorFinder {
  private static final List<StandardMode> CROSS_TERMS =
      List.of(StandardMode.REAL, StandardMode.LONG_REAL,
          StandardMode.LONG_LONG_REAL, StandardMode.COMPLEX,
          StandardMode.LONG_COMPLEX, StandardMode.LONG_LONG_COMPLEX);

  private final ModeContext context;
  private final Coercibility coercibility;

  OperatorFinder(ModeContext context) {
    this.context = requireNonNull(context);
    this.coercibility = context.coercibility();
  }

  /**
   * Returns the operator {@code symbol} that applies to operands of mode
   * {@code x} and {@code y} (or to a single operand of mode {@code x}, if
   * {@code y} is null); or the error tag if either mode is in error; or
   * null if there is no such operator.
   */
  @Nullable Tag find(Table table, String symbol, @Nullable Mode x,
      @Nullable Mode y) {
    if (x == null && y == null) {
      return null;
    }
    if (coercibility.isNotWell(x)
        || y != null && coercibility.isNotWell(y)) {
      return context.errorTag();
    }
    if (y == null) {
      return findMonadic(table, symbol, x);
    }
    return findDyadic(table, symbol, x, y);
  }

  private @Nullable Tag findMonadic(Table table, String symbol, Mode x) {
    final Tag tag = searchChain(table, symbol, x, null);
    if (tag != null) {
      return tag;
    }
    // Allows "- (0, 1)" and "ABS (1, long pi)".
    for (StandardMode complex : List.of(StandardMode.COMPLEX,
        StandardMode.LONG_COMPLEX, StandardMode.LONG_LONG_COMPLEX)) {
      final Mode m = context.mode(complex);
      if (coercibility.isCoercible(x, m, Sort.STRONG, Deflexing.SAFE)) {
        final Tag t = searchStandard(symbol, m, null);
        if (t != null) {
          return t;
        }
      }
    }
    return null;
  }

  private @Nullable Tag findDyadic(Table table, String symbol, Mode x,
      Mode y) {
    Tag tag = searchChain(table, symbol, x, y);
    if (tag != null) {
      return tag;
    }

    // Vector and matrix operands take INT or REAL scalars.
    final Mode u = coercibility.deprefCompletely(x);
    final Mode v = coercibility.deprefCompletely(y);
    if (isVector(u) || isVector(v)) {
      final Mode real = context.mode(StandardMode.REAL);
      final Mode complex = context.mode(StandardMode.COMPLEX);
      if (is(u, StandardMode.INT)) {
        tag = firstNonNull(searchStandard(symbol, real, y),
            searchStandard(symbol, complex, y));
      } else if (is(v, StandardMode.INT)) {
        tag = firstNonNull(searchStandard(symbol, x, real),
            searchStandard(symbol, x, complex));
      } else if (is(u, StandardMode.REAL)) {
        tag = searchStandard(symbol, complex, y);
      } else if (is(v, StandardMode.REAL)) {
        tag = searchStandard(symbol, x, complex);
      }
      if (tag != null) {
        return tag;
      }
    }

    // A cross-term in the standard environment, such as INT + REAL.
    final Mode united =
        coercibility.makeUnitedMode(coercibility.makeSeries(x, y));
    final Mode balanced =
        coercibility.getBalancedMode(united, Sort.STRONG, false,
            Deflexing.SAFE);
    tag = searchStandard(symbol, balanced, balanced);
    if (tag != null) {
      return tag;
    }
    final Mode series = coercibility.makeSeries(x, y);
    for (StandardMode standardMode : CROSS_TERMS) {
      final Mode m = context.mode(standardMode);
      if (coercibility.isCoercibleSeries(series, m, Sort.STRONG,
          Deflexing.SAFE)) {
        tag = searchStandard(symbol, m, m);
        if (tag != null) {
          return tag;
        }
      }
    }

    // Dereference, for "REF REAL +:= INT" and the like.
    final Mode depreffed =
        coercibility.getBalancedMode(united, Sort.STRONG, true,
            Deflexing.SAFE);
    return searchStandard(symbol, depreffed, depreffed);
  }

  private boolean is(Mode mode, StandardMode standardMode) {
    return context.graph().is(mode, standardMode);
  }

  private boolean isVector(Mode m) {
    return is(m, StandardMode.ROW_REAL)
        || is(m, StandardMode.ROW_ROW_REAL)
        || is(m, StandardMode.ROW_COMPLEX)
        || is(m, StandardMode.ROW_ROW_COMPLEX);
  }

  private static @Nullable Tag firstNonNull(@Nullable Tag t0,
      @Nullable Tag t1) {
    return t0 != null ? t0 : t1;
  }

  /** Searches a table and the tables that enclose it. */
  private @Nullable Tag searchChain(Table table, String symbol, Mode x,
      @Nullable Mode y) {
    for (Table t = table; t != null; t = t.parent()) {
      final Tag tag = search(t, symbol, x, y);
      if (tag != null) {
        return tag;
      }
    }
    return null;
  }

  private @Nullable Tag searchStandard(String symbol, Mode x,
      @Nullable Mode y) {
    return search(context.standardTable(), symbol, x, y);
  }

  /** Searches one table for an operator whose operands {@code x} and
   * {@code y} can be firmly coerced to. */
  private @Nullable Tag search(Table table, String symbol, Mode x,
      @Nullable Mode y) {
    if (coercibility.isNotWell(x) || y != null && coercibility.isNotWell(y)) {
      return context.errorTag();
    }
    for (Tag tag : table.tags(Tag.Kind.OPERATOR)) {
      final Mode mode = tag.mode();
      if (!tag.symbol.equals(symbol)
          || mode == null
          || !mode.is(ModeKind.PROC)) {
        continue;
      }
      final List<Mode> parameters = mode.packModes();
      if (parameters.isEmpty()
          || !coercibility.isCoercible(x, parameters.get(0), Sort.FIRM,
              Deflexing.ALIAS)) {
        continue;
      }
      if (parameters.size() == 1 && y == null) {
        return tag;
      }
      if (parameters.size() == 2
          && y != null
          && coercibility.isCoercible(y, parameters.get(1), Sort.FIRM,
              Deflexing.ALIAS)) {
        return tag;
      }
    }
    return null;
  }
}

// End OperatorFinder.java
