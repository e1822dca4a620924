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

import static net.hydromatic.algol68.type.StandardMode.BITS;
import static net.hydromatic.algol68.type.StandardMode.BOOL;
import static net.hydromatic.algol68.type.StandardMode.CHAR;
import static net.hydromatic.algol68.type.StandardMode.COMPLEX;
import static net.hydromatic.algol68.type.StandardMode.INT;
import static net.hydromatic.algol68.type.StandardMode.LONG_COMPLEX;
import static net.hydromatic.algol68.type.StandardMode.LONG_INT;
import static net.hydromatic.algol68.type.StandardMode.LONG_LONG_COMPLEX;
import static net.hydromatic.algol68.type.StandardMode.LONG_LONG_INT;
import static net.hydromatic.algol68.type.StandardMode.LONG_LONG_REAL;
import static net.hydromatic.algol68.type.StandardMode.LONG_REAL;
import static net.hydromatic.algol68.type.StandardMode.REAL;
import static net.hydromatic.algol68.type.StandardMode.REF_COMPLEX;
import static net.hydromatic.algol68.type.StandardMode.REF_INT;
import static net.hydromatic.algol68.type.StandardMode.REF_REAL;
import static net.hydromatic.algol68.type.StandardMode.ROWS;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Function;
import net.hydromatic.algol68.type.Mode;
import net.hydromatic.algol68.type.ModeGraph;
import net.hydromatic.algol68.type.StandardMode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Identifiers and operators of the standard environment.
 *
 * <p>An operator has a mode for each of its overloads; an identifier has one
 * mode.
 */
public enum BuiltIn {
  /** Constant "pi", of type REAL. */
  PI(Tag.Kind.IDENTIFIER, "pi", g -> list(g, REAL)),

  LONG_PI(Tag.Kind.IDENTIFIER, "long pi", g -> list(g, LONG_REAL)),

  /** Constant "max int", the largest INT. */
  MAX_INT(Tag.Kind.IDENTIFIER, "max int", g -> list(g, INT)),

  MAX_REAL(Tag.Kind.IDENTIFIER, "max real", g -> list(g, REAL)),

  /** Operator "+", dyadic over the numbers, also monadic. */
  OP_PLUS("+", g -> arithmetic(g, true)),

  /** Operator "-", dyadic over the numbers, also monadic negation. */
  OP_MINUS("-", g -> arithmetic(g, true)),

  OP_TIMES("*", g -> arithmetic(g, false)),

  /** Operator "/"; dividing two integers yields a REAL. */
  OP_DIVIDE("/", g ->
      ImmutableList.<Mode>builder()
          .add(dyadic(g, INT, INT, REAL))
          .add(dyadic(g, LONG_INT, LONG_INT, LONG_REAL))
          .add(dyadic(g, LONG_LONG_INT, LONG_LONG_INT, LONG_LONG_REAL))
          .addAll(sameDyadics(g, null, Operands.REALS))
          .addAll(sameDyadics(g, null, Operands.COMPLEXES))
          .build()),

  OP_EQ("=", g -> comparison(g, true)),
  OP_NE("/=", g -> comparison(g, true)),
  OP_LT("<", g -> comparison(g, false)),
  OP_LE("<=", g -> comparison(g, false)),
  OP_GT(">", g -> comparison(g, false)),
  OP_GE(">=", g -> comparison(g, false)),

  OP_AND("AND", g -> list(dyadic(g, BOOL, BOOL, BOOL),
      dyadic(g, BITS, BITS, BITS))),
  OP_OR("OR", g -> list(dyadic(g, BOOL, BOOL, BOOL),
      dyadic(g, BITS, BITS, BITS))),
  OP_NOT("NOT", g -> list(monadic(g, BOOL, BOOL), monadic(g, BITS, BITS))),

  /** Operator "ABS": magnitude of a number, or code of a character. */
  OP_ABS("ABS", g ->
      ImmutableList.<Mode>builder()
          .addAll(sameMonadics(g, Operands.INTS))
          .addAll(sameMonadics(g, Operands.REALS))
          .add(monadic(g, COMPLEX, REAL))
          .add(monadic(g, LONG_COMPLEX, LONG_REAL))
          .add(monadic(g, LONG_LONG_COMPLEX, LONG_LONG_REAL))
          .add(monadic(g, CHAR, INT))
          .add(monadic(g, BITS, INT))
          .add(monadic(g, BOOL, INT))
          .build()),

  OP_PLUS_AB("+:=", BuiltIn::updates),
  OP_MINUS_AB("-:=", BuiltIn::updates),
  OP_TIMES_AB("*:=", BuiltIn::updates),

  /** Operator "UPB", the upper bound of a row; dyadic form takes the
   * dimension. */
  OP_UPB("UPB", g -> list(monadic(g, ROWS, INT), dyadic(g, INT, ROWS, INT))),

  OP_LWB("LWB", g -> list(monadic(g, ROWS, INT), dyadic(g, INT, ROWS, INT))),

  /** Operator "ELEM", a bit of a BITS value. */
  OP_ELEM("ELEM", g -> list(dyadic(g, INT, BITS, BOOL)));

  public final Tag.Kind kind;
  public final String symbol;

  /** Computes the modes of this built-in, in a given mode graph. */
  private final Function<ModeGraph, List<Mode>> modeFunction;

  BuiltIn(Tag.Kind kind, String symbol,
      Function<ModeGraph, List<Mode>> modeFunction) {
    this.kind = kind;
    this.symbol = symbol;
    this.modeFunction = modeFunction;
  }

  BuiltIn(String symbol, Function<ModeGraph, List<Mode>> modeFunction) {
    this(Tag.Kind.OPERATOR, symbol, modeFunction);
  }

  /** Returns the modes of this built-in; an operator has one per
   * overload. */
  public List<Mode> modes(ModeGraph graph) {
    return modeFunction.apply(graph);
  }

  private static List<Mode> list(ModeGraph g, StandardMode mode) {
    return ImmutableList.of(g.lookup(mode));
  }

  private static List<Mode> list(Mode... modes) {
    return ImmutableList.copyOf(modes);
  }

  private static Mode monadic(ModeGraph g, StandardMode operand,
      StandardMode result) {
    return g.proc(g.lookup(result), g.lookup(operand));
  }

  private static Mode dyadic(ModeGraph g, StandardMode left,
      StandardMode right, StandardMode result) {
    return g.proc(g.lookup(result), g.lookup(left), g.lookup(right));
  }

  /** Returns "(m, m) result" for each {@code m}; if {@code result} is null,
   * "(m, m) m". */
  private static List<Mode> sameDyadics(ModeGraph g,
      @Nullable StandardMode result, StandardMode... operands) {
    final ImmutableList.Builder<Mode> b = ImmutableList.builder();
    for (StandardMode operand : operands) {
      b.add(dyadic(g, operand, operand, result == null ? operand : result));
    }
    return b.build();
  }

  private static List<Mode> sameMonadics(ModeGraph g,
      StandardMode... operands) {
    final ImmutableList.Builder<Mode> b = ImmutableList.builder();
    for (StandardMode operand : operands) {
      b.add(monadic(g, operand, operand));
    }
    return b.build();
  }

  private static List<Mode> arithmetic(ModeGraph g, boolean withMonadic) {
    final ImmutableList.Builder<Mode> b = ImmutableList.builder();
    b.addAll(sameDyadics(g, null, Operands.INTS))
        .addAll(sameDyadics(g, null, Operands.REALS))
        .addAll(sameDyadics(g, null, Operands.COMPLEXES))
        .add(dyadic(g, INT, REAL, REAL))
        .add(dyadic(g, REAL, INT, REAL))
        .add(dyadic(g, REAL, COMPLEX, COMPLEX))
        .add(dyadic(g, COMPLEX, REAL, COMPLEX));
    if (withMonadic) {
      b.addAll(sameMonadics(g, Operands.INTS))
          .addAll(sameMonadics(g, Operands.REALS))
          .addAll(sameMonadics(g, Operands.COMPLEXES));
    }
    return b.build();
  }

  private static List<Mode> comparison(ModeGraph g, boolean equality) {
    final ImmutableList.Builder<Mode> b = ImmutableList.builder();
    b.addAll(sameDyadics(g, BOOL, Operands.INTS))
        .addAll(sameDyadics(g, BOOL, Operands.REALS))
        .add(dyadic(g, CHAR, CHAR, BOOL));
    if (equality) {
      b.add(dyadic(g, BOOL, BOOL, BOOL));
    }
    return b.build();
  }

  private static List<Mode> updates(ModeGraph g) {
    return list(dyadic(g, REF_INT, INT, REF_INT),
        dyadic(g, REF_REAL, REAL, REF_REAL),
        dyadic(g, REF_COMPLEX, COMPLEX, REF_COMPLEX));
  }

  /** Groups of operand modes. */
  private static class Operands {
    static final StandardMode[] INTS = {INT, LONG_INT, LONG_LONG_INT};
    static final StandardMode[] REALS = {REAL, LONG_REAL, LONG_LONG_REAL};
    static final StandardMode[] COMPLEXES =
        {COMPLEX, LONG_COMPLEX, LONG_LONG_COMPLEX};
  }
}

// End BuiltIn.java
