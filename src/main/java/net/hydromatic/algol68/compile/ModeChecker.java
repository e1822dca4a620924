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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.algol68.compile.Diagnostics.describe;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.algol68.ast.Attribute;
import net.hydromatic.algol68.ast.Node;
import net.hydromatic.algol68.type.Coercibility;
import net.hydromatic.algol68.type.Deflexing;
import net.hydromatic.algol68.type.InternalConsistencyException;
import net.hydromatic.algol68.type.Mode;
import net.hydromatic.algol68.type.ModeGraph;
import net.hydromatic.algol68.type.ModeKind;
import net.hydromatic.algol68.type.PackEntry;
import net.hydromatic.algol68.type.Sort;
import net.hydromatic.algol68.type.StandardMode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Infers the mode of each unit of a program, and checks that it suits the
 * context the unit is in.
 *
 * <p>Each check passes down a {@link Soid} that says what the context
 * expects, and gets back a {@code Soid} that says what the construct yields.
 * The checker does not insert coercions; it records on the tree what the
 * {@link CoercionInserter} needs: the mode of each unit, the tag of each
 * applied identifier and operator, and the mode that a construct requires
 * of an operand (for example the procedure mode of the primary of a call).
 *
 * <p>A unit in error gets the ERROR mode, which is coercible to and from
 * every mode, so that one mistake produces one diagnostic.
 */
public class ModeChecker {
  private final ModeContext context;
  private final ModeGraph graph;
  private final Coercibility coercibility;
  private final Diagnostics diagnostics;
  private final OperatorFinder operators;
  private final boolean portcheck;
  /** Table of the range being checked. */
  private Table table;

  public ModeChecker(ModeContext context) {
    this.context = requireNonNull(context);
    this.graph = context.graph();
    this.coercibility = context.coercibility();
    this.diagnostics = context.diagnostics();
    this.operators = new OperatorFinder(context);
    this.portcheck = Prop.PORTCHECK.booleanValue(context.props());
    this.table = context.standardTable();
  }

  /** Checks a program. The program yields no value, so its clause is
   * checked in a strong void context. */
  public void check(Node program) {
    checkArgument(program.is(Attribute.PARTICULAR_PROGRAM),
        "not a program: %s", program.attribute());
    final Table saved = enter(program);
    try {
      final Soid y =
          unit(program.child(0), Soid.of(Sort.STRONG, mode(StandardMode.VOID)));
      program.setMode(y.mode);
    } finally {
      table = saved;
    }
  }

  private Mode mode(StandardMode standardMode) {
    return context.mode(standardMode);
  }

  private boolean is(@Nullable Mode m, StandardMode standardMode) {
    return m != null && graph.is(m, standardMode);
  }

  private static boolean same(@Nullable Mode m0, @Nullable Mode m1) {
    if (m0 == null || m1 == null) {
      return m0 == m1;
    }
    return m0.resolve() == m1.resolve();
  }

  /** Makes the table of a node, if it has one, the current table; returns
   * the previous table, which the caller must restore. */
  private Table enter(Node p) {
    final Table saved = table;
    if (p.table() != null) {
      table = p.table();
    }
    return saved;
  }

  private Soid error(Soid x) {
    return Soid.of(x.sort, mode(StandardMode.ERROR));
  }

  private Mode unique(Soid y) {
    return coercibility.determineUniqueMode(y.mode, y.attribute,
        Deflexing.SAFE);
  }

  /** Returns a series of the modes that the terminal units of a clause
   * yield. */
  private Mode series(List<Soid> list) {
    return graph.series(pack(list));
  }

  private Mode stowed(List<Soid> list) {
    return graph.stowed(pack(list));
  }

  private List<PackEntry> pack(List<Soid> list) {
    final List<PackEntry> pack = new ArrayList<>();
    for (Soid soid : list) {
      pack.add(
          PackEntry.of(soid.mode == null ? mode(StandardMode.ERROR)
              : soid.mode));
    }
    return pack;
  }

  private void checkCoercible(Node p, Soid y, Soid x, Sort sort,
      Deflexing deflex, @Nullable Attribute attribute) {
    if (!y.isCoercibleInContext(x, deflex, coercibility)) {
      diagnostics.cannotCoerce(p, modeOrError(y), modeOrError(x), sort,
          deflex, attribute);
    }
  }

  private Mode modeOrError(Soid soid) {
    return soid.mode == null ? mode(StandardMode.ERROR) : soid.mode;
  }

  // declarations

  private void declaration(Node p) {
    switch (p.attribute()) {
      case MODE_DECLARATION:
        for (Node d : p.findAll(Attribute.DEFINING_INDICANT)) {
          declarer(d.child(0));
        }
        break;
      case IDENTITY_DECLARATION:
        declarer(p.child(0));
        for (Node d : p.findAll(Attribute.DEFINING_IDENTIFIER)) {
          if (d.size() == 0) {
            continue;
          }
          final Node source = d.child(0);
          final Soid x = Soid.of(Sort.STRONG, d.mode());
          final Soid y = unit(source, x);
          if (!y.isCoercibleInContext(x, Deflexing.SAFE, coercibility)) {
            diagnostics.cannotCoerce(source, modeOrError(y), modeOrError(x),
                Sort.STRONG, Deflexing.SAFE, null);
          } else if (!same(x.mode, y.mode)) {
            // For example "REF INT i = LOC REF INT".
            pitfall(source, modeOrError(x), Attribute.IDENTITY_DECLARATION);
          }
        }
        break;
      case VARIABLE_DECLARATION:
        declarer(p.child(0));
        for (Node d : p.findAll(Attribute.DEFINING_IDENTIFIER)) {
          if (d.size() == 0) {
            continue;
          }
          final Node source = d.child(0);
          final Mode name = requireNonNull(d.mode(), "mode");
          final Soid x = Soid.of(Sort.STRONG, name.sub());
          final Soid y = unit(source, x);
          if (!y.isCoercibleInContext(x, Deflexing.FORCE, coercibility)) {
            diagnostics.cannotCoerce(d, modeOrError(y), modeOrError(x),
                Sort.STRONG, Deflexing.FORCE, null);
          } else if (x.mode == null || !same(x.mode.sub(), y.mode)) {
            pitfall(source, modeOrError(x), Attribute.VARIABLE_DECLARATION);
          }
        }
        break;
      case PROCEDURE_DECLARATION:
      case PROCEDURE_VARIABLE_DECLARATION:
        for (Node d : p.findAll(Attribute.DEFINING_IDENTIFIER)) {
          routineText(requireNonNull(d.find(Attribute.ROUTINE_TEXT)));
        }
        break;
      case BRIEF_OPERATOR_DECLARATION:
        for (Node d : p.findAll(Attribute.DEFINING_OPERATOR)) {
          final Node routine = requireNonNull(d.find(Attribute.ROUTINE_TEXT));
          final Mode routineMode = requireNonNull(routine.mode());
          final Mode operatorMode = requireNonNull(d.mode());
          if (!same(operatorMode, routineMode)) {
            diagnostics.cannotCoerce(routine, routineMode, operatorMode,
                Sort.STRONG, Deflexing.SKIP, Attribute.ROUTINE_TEXT);
          }
          routineText(routine);
        }
        break;
      case OPERATOR_DECLARATION:
        declarer(p.child(0));
        for (Node d : p.findAll(Attribute.DEFINING_OPERATOR)) {
          final Node source = d.child(0);
          final Soid x = Soid.of(Sort.STRONG, d.mode());
          final Soid y = unit(source, x);
          checkCoercible(source, y, x, Sort.STRONG, Deflexing.SAFE, null);
        }
        break;
      default:
        throw new InternalConsistencyException("not a declaration: "
            + p.attribute());
    }
  }

  /** Warns about a construct that is valid but probably not what was
   * meant, such as a generator whose mode differs from the declared
   * one. */
  private void pitfall(Node p, Mode m, Attribute declaration) {
    if (p.is(Attribute.GENERATOR)) {
      diagnostics.warning(p,
          "possibly unintended " + p.mode() + " " + describe(p.attribute())
              + " in " + m + " " + describe(declaration),
          requireNonNull(p.mode()), m);
    }
  }

  /** Checks the actual bounds in a declarer, which are strong INT. */
  private void declarer(Node p) {
    if (p.is(Attribute.BOUNDS)) {
      for (Node c : p.children()) {
        if (c.is(Attribute.BOUND)) {
          for (Node u : c.children()) {
            bound(u);
          }
        } else {
          declarer(c);
        }
      }
    } else {
      for (Node c : p.children()) {
        declarer(c);
      }
    }
  }

  private void bound(Node u) {
    final Soid x = Soid.of(Sort.STRONG, mode(StandardMode.INT));
    final Soid y = unit(u, x);
    checkCoercible(u, y, x, Sort.MEEK, Deflexing.SAFE, null);
  }

  private Soid routineText(Node p) {
    final Table saved = enter(p);
    try {
      final Node pack = p.find(Attribute.PARAMETER_PACK);
      if (pack != null) {
        for (Node parameter : pack.children()) {
          declarer(parameter.child(0));
        }
      }
      final Node result = requireNonNull(p.find(Attribute.DECLARER));
      declarer(result);
      final Node body = p.lastChild();
      final Soid w = Soid.of(Sort.STRONG, result.mode());
      final Soid y = unit(body, w);
      checkCoercible(body, y, w, Sort.STRONG, Deflexing.FORCE, null);
      return y;
    } finally {
      table = saved;
    }
  }

  // clauses

  /**
   * Checks the declarations and units of a serial clause, or of a part of a
   * clause that has the same shape. The last unit gets the context
   * {@code x} and its yield is added to {@code list}; the other units are
   * voided.
   */
  private void serial(List<Soid> list, Node p, Soid x) {
    final Table saved = enter(p);
    try {
      int last = -1;
      for (int i = 0; i < p.size(); i++) {
        if (p.child(i).attribute().isUnit()) {
          last = i;
        }
      }
      for (int i = 0; i < p.size(); i++) {
        final Node c = p.child(i);
        if (c.attribute().isDeclaration()) {
          declaration(c);
        } else if (i == last) {
          list.add(unit(c, x));
        } else if (c.attribute().isUnit()) {
          unit(c, Soid.of(Sort.STRONG, mode(StandardMode.VOID)));
        }
      }
    } finally {
      table = saved;
    }
  }

  /** Checks a serial clause, and returns the series of what its terminal
   * units yield. */
  private Soid serialUnits(Node p, Soid x) {
    final List<Soid> list = new ArrayList<>();
    serial(list, p, x);
    final Soid y;
    if (isBalanced(p, list, x.sort)) {
      y = Soid.of(x.sort, series(list), Attribute.SERIAL_CLAUSE);
    } else {
      y = Soid.of(x.sort,
          x.mode != null ? x.mode : mode(StandardMode.ERROR));
    }
    p.setMode(y.mode);
    return y;
  }

  /**
   * Whether the terminal units of a clause have a common mode. In a strong
   * context they are coerced to the mode the context requires; otherwise at
   * least one of them must not be a display.
   */
  private boolean isBalanced(Node p, List<Soid> list, Sort sort) {
    if (sort == Sort.STRONG) {
      return true;
    }
    for (Soid soid : list) {
      if (soid.mode == null || !soid.mode.is(ModeKind.STOWED)) {
        return true;
      }
    }
    diagnostics.error(p, "construct has no unique mode");
    return false;
  }

  /** Returns what a choice clause yields, given what its branches
   * yield. */
  private Soid balance(Node p, List<Soid> list, Soid x,
      Attribute attribute) {
    if (!isBalanced(p, list, x.sort)) {
      return x.mode != null
          ? Soid.of(x.sort, x.mode, attribute)
          : error(x);
    }
    return Soid.of(x.sort, series(list), attribute);
  }

  private void unitList(List<Soid> list, List<Node> units, Soid x) {
    for (Node u : units) {
      list.add(unit(u, x));
    }
  }

  private Soid enclosed(Node p, Soid x) {
    final Table saved = enter(p);
    try {
      final Soid y;
      switch (p.attribute()) {
        case CLOSED_CLAUSE:
          y = serialUnits(p.child(0), x);
          break;
        case COLLATERAL_CLAUSE:
          y = collateral(p, x);
          break;
        case CONDITIONAL_CLAUSE:
          final List<Soid> branches = new ArrayList<>();
          conditionalParts(branches, p, x);
          y = balance(p, branches, x, Attribute.CONDITIONAL_CLAUSE);
          break;
        case CASE_CLAUSE:
          final List<Soid> cases = new ArrayList<>();
          integerCaseParts(cases, p, x);
          y = balance(p, cases, x, Attribute.CASE_CLAUSE);
          break;
        case CONFORMITY_CLAUSE:
          final List<Soid> specified = new ArrayList<>();
          unitedCaseParts(specified, p, x);
          y = balance(p, specified, x, Attribute.CONFORMITY_CLAUSE);
          break;
        case LOOP_CLAUSE:
          loop(p);
          y = Soid.of(Sort.STRONG, mode(StandardMode.VOID));
          break;
        default:
          throw new InternalConsistencyException("not an enclosed clause: "
              + p.attribute());
      }
      p.setMode(y.mode);
      return y;
    } finally {
      table = saved;
    }
  }

  /** Checks a display. The context decides the modes of its units: the
   * element of a row, or the fields of a structure. */
  private Soid collateral(Node p, Soid x) {
    if (p.size() == 0) {
      if (x.sort != Sort.STRONG) {
        return Soid.of(Sort.STRONG, mode(StandardMode.UNDEFINED));
      }
      if (x.mode == null) {
        diagnostics.error(p, "this vacuum cannot have row elements "
            + "(use a REF MODE generator)");
        return Soid.of(Sort.STRONG, mode(StandardMode.ERROR));
      }
      return Soid.of(Sort.STRONG, mode(StandardMode.VACUUM));
    }
    final List<Soid> list = new ArrayList<>();
    final Mode m = x.mode == null ? null : x.mode.resolve();
    if (m != null && m.is(ModeKind.FLEX)) {
      unitList(list, p.children(),
          Soid.of(x.sort, requireNonNull(m.sub()).slice()));
    } else if (m != null && m.is(ModeKind.ROW)) {
      unitList(list, p.children(), Soid.of(x.sort, m.slice()));
    } else if (m != null && m.is(ModeKind.STRUCT)) {
      final List<Mode> fields = m.packModes();
      for (int i = 0; i < p.size(); i++) {
        final Mode field = i < fields.size() ? fields.get(i) : null;
        list.add(unit(p.child(i), Soid.of(Sort.STRONG, field)));
      }
    } else {
      unitList(list, p.children(), x);
    }
    return Soid.of(Sort.STRONG, stowed(list));
  }

  /** Checks an enquiry clause, which yields a value of mode
   * {@code required} in a meek context. */
  private void enquiry(Node owner, Node p, Sort sort, StandardMode required) {
    final Soid expected = Soid.of(sort, mode(required));
    final Soid y = serialUnits(p, expected);
    checkCoercible(owner, y, expected, Sort.MEEK, Deflexing.SAFE,
        Attribute.ENQUIRY_CLAUSE);
  }

  private void conditionalParts(List<Soid> list, Node p, Soid x) {
    enquiry(p, p.child(0), Sort.MEEK, StandardMode.BOOL);
    serial(list, p.child(1), x);
    if (p.size() > 2) {
      final Node q = p.child(2);
      if (q.is(Attribute.ELIF_PART)) {
        conditionalParts(list, q, x);
      } else {
        serial(list, q, x);
      }
    }
  }

  private void integerCaseParts(List<Soid> list, Node p, Soid x) {
    enquiry(p, p.child(0), Sort.MEEK, StandardMode.INT);
    unitList(list, p.child(1).children(), x);
    if (p.size() > 2) {
      final Node q = p.child(2);
      if (q.is(Attribute.OUSE_PART)) {
        integerCaseParts(list, q, x);
      } else {
        serial(list, q, x);
      }
    }
  }

  /**
   * Checks a conformity clause. The united mode that the enquiry is
   * coerced to comes from the enquiry and from the specifiers.
   */
  private void unitedCaseParts(List<Soid> list, Node p, Soid x) {
    final Node enquiry = p.child(0);
    final Soid y = serialUnits(enquiry, Soid.of(Sort.MEEK, null));
    final Mode u =
        coercibility.deprefCompletely(
            coercibility.makeUnitedMode(
                coercibility.deprefCompletely(modeOrError(y))));

    final Node inPart = p.child(1);
    final List<PackEntry> specified = new ArrayList<>();
    for (Node specifiedUnit : inPart.children()) {
      specified.add(PackEntry.of(specifierMode(specifiedUnit)));
    }
    final Mode v = coercibility.makeUnitedMode(graph.series(specified));

    final Mode w;
    if (is(u, StandardMode.HIP)) {
      w = v;
    } else if (u.is(ModeKind.UNION)) {
      final boolean uv =
          coercibility.investigateFirmRelations(u.packModes(), members(v)).all;
      final boolean vu =
          coercibility.investigateFirmRelations(members(v), u.packModes()).all;
      if (uv == vu) {
        // Either every component has a specifier, or the coercion inserter
        // will report the mismatch.
        w = u;
      } else {
        w = coercibility.absorbRelatedSubsets(u);
      }
    } else {
      diagnostics.error(enquiry, u + " is not a united mode", u);
      return;
    }
    enquiry.setRequiredMode(w);

    for (Node specifiedUnit : inPart.children()) {
      final Table saved = enter(specifiedUnit);
      try {
        final Node specifier = specifiedUnit.child(0);
        final Mode m = specifierMode(specifiedUnit);
        if (!coercibility.isUnitable(m, w, Deflexing.SAFE)) {
          diagnostics.error(specifier,
              m + " is neither component nor subset of " + w, m, w);
        }
        list.add(unit(specifiedUnit.child(1), x));
      } finally {
        table = saved;
      }
    }
    if (p.size() > 2) {
      final Node q = p.child(2);
      if (q.is(Attribute.CONFORMITY_OUSE_PART)) {
        unitedCaseParts(list, q, x);
      } else {
        serial(list, q, x);
      }
    }
  }

  private static Mode specifierMode(Node specifiedUnit) {
    final Node specifier = specifiedUnit.child(0);
    return requireNonNull(specifier.child(0).mode(), "specifier mode");
  }

  /** Returns the members of a union, or a singleton list of a mode that is
   * not a union. */
  private static List<Mode> members(Mode m) {
    return m.is(ModeKind.UNION) ? m.packModes() : List.of(m);
  }

  private void loop(Node p) {
    for (Node c : p.children()) {
      switch (c.attribute()) {
        case FOR_PART:
          break;
        case FROM_PART:
        case BY_PART:
        case TO_PART:
          final Soid ix = Soid.of(Sort.STRONG, mode(StandardMode.INT));
          final Soid iy = unit(c.child(0), ix);
          checkCoercible(c.child(0), iy, ix, Sort.MEEK, Deflexing.SAFE,
              Attribute.ENQUIRY_CLAUSE);
          break;
        case WHILE_PART:
          enquiry(c, c, Sort.MEEK, StandardMode.BOOL);
          break;
        case DO_PART:
          serial(new ArrayList<>(), c,
              Soid.of(Sort.STRONG, mode(StandardMode.VOID)));
          break;
        case UNTIL_PART:
          enquiry(c, c, Sort.STRONG, StandardMode.BOOL);
          break;
        default:
          throw new InternalConsistencyException("unexpected "
              + c.attribute() + " in loop clause");
      }
    }
  }

  // units

  /** Checks a unit in context {@code x}, and returns what it yields. */
  Soid unit(Node p, Soid x) {
    final Table saved = enter(p);
    try {
      final Soid y = unit2(p, x);
      p.setMode(y.mode);
      return y;
    } finally {
      table = saved;
    }
  }

  private Soid unit2(Node p, Soid x) {
    Soid y;
    switch (p.attribute()) {
      case CLOSED_CLAUSE:
      case COLLATERAL_CLAUSE:
      case CONDITIONAL_CLAUSE:
      case CASE_CLAUSE:
      case CONFORMITY_CLAUSE:
      case LOOP_CLAUSE:
        return enclosed(p, x);
      case SPECIFICATION:
        y = specification(p, x);
        warnForVoiding(p, x, y);
        return y;
      case CAST:
        y = cast(p, x);
        warnForVoiding(p, x, y);
        return y;
      case DENOTATION:
      case GENERATOR:
        if (p.is(Attribute.GENERATOR)) {
          declarer(p.child(0));
        }
        y = Soid.of(x.sort, requireNonNull(p.mode(), "mode"));
        warnForVoiding(p, x, y);
        return y;
      case IDENTIFIER:
        identifier(p);
        y = Soid.of(x.sort, p.mode());
        warnForVoiding(p, x, y);
        return y;
      case SELECTION:
        y = selection(p, x);
        warnForVoiding(p, x, y);
        return y;
      case NIHIL:
        return Soid.of(Sort.STRONG, mode(StandardMode.HIP));
      case FORMULA:
      case MONADIC_FORMULA:
        y = formula(p, x);
        if (y.mode == null || !y.mode.is(ModeKind.REF)) {
          warnForVoiding(p, x, y);
        }
        return y;
      case JUMP:
      case SKIP:
        if (x.sort != Sort.STRONG) {
          diagnostics.warning(p, describe(p.attribute())
              + " should not be in " + x.sort.description() + " context");
        }
        return Soid.of(x.sort, mode(StandardMode.HIP));
      case ASSIGNATION:
        return assignation(p, x);
      case IDENTITY_RELATION:
        y = identityRelation(p, x);
        warnForVoiding(p, x, y);
        return y;
      case ROUTINE_TEXT:
        routineText(p);
        y = Soid.of(x.sort, p.mode());
        warnForVoiding(p, x, y);
        return y;
      case ASSERTION:
        assertion(p);
        return Soid.of(Sort.STRONG, mode(StandardMode.VOID));
      case AND_FUNCTION:
      case OR_FUNCTION:
        y = boolFunction(p, x);
        warnForVoiding(p, x, y);
        return y;
      default:
        throw new InternalConsistencyException("cannot check "
            + p.attribute());
    }
  }

  /** Warns if a unit's value is discarded, unless the unit is in a cast or
   * is a procedure that will be called. */
  private void warnForVoiding(Node p, Soid x, Soid y) {
    if (!x.cast
        && is(x.mode, StandardMode.VOID)
        && y.mode != null
        && !is(y.mode, StandardMode.ERROR)
        && !is(y.mode, StandardMode.VOID)
        && coercibility.isNonproc(y.mode)) {
      diagnostics.warning(p, "value of " + y.mode + " "
          + describe(p.attribute()) + " will be voided", y.mode);
    }
  }

  /**
   * Gives an applied identifier the mode of its declaration. An identifier
   * that is not declared is reported, and declared in the current range
   * with the ERROR mode so that later uses are not reported again.
   */
  private void identifier(Node p) {
    if (p.mode() != null) {
      return;
    }
    final Tag bound = p.tag();
    if (bound != null) {
      p.setMode(bound.mode() != null ? bound.mode()
          : mode(StandardMode.ERROR));
      return;
    }
    final String symbol = requireNonNull(p.symbol());
    final Tag tag = table.firstGlobal(symbol);
    if (tag != null && tag.kind == Tag.Kind.IDENTIFIER) {
      p.setTag(tag);
      p.setMode(tag.mode() != null ? tag.mode() : mode(StandardMode.ERROR));
      return;
    }
    p.setTag(
        table.add(Tag.Kind.IDENTIFIER, symbol, p,
            mode(StandardMode.ERROR)));
    diagnostics.error(p, "tag " + symbol + " has not been declared properly");
    p.setMode(mode(StandardMode.ERROR));
  }

  private Soid cast(Node p, Soid x) {
    final Node declarer = p.child(0);
    declarer(declarer);
    final Mode m = requireNonNull(declarer.mode(), "cast mode");
    final Soid w = Soid.cast(m);
    final Soid y = unit(p.child(1), w);
    checkCoercible(p.child(1), y, w, Sort.STRONG, Deflexing.SAFE, null);
    return Soid.of(x.sort, m);
  }

  private void assertion(Node p) {
    final Soid w = Soid.of(Sort.STRONG, mode(StandardMode.BOOL));
    final Soid y = unit(p.child(0), w).withSort(w.sort);
    checkCoercible(p.child(0), y, w, Sort.MEEK, Deflexing.NO, null);
  }

  private Soid boolFunction(Node p, Soid x) {
    final Soid e = Soid.of(Sort.STRONG, mode(StandardMode.BOOL));
    for (Node operand : p.children()) {
      final Soid y = unit(operand, e);
      checkCoercible(operand, y, e, Sort.MEEK, Deflexing.SAFE, null);
    }
    return Soid.of(x.sort, mode(StandardMode.BOOL));
  }

  /** Checks an operand of a formula, which is firm, and returns its
   * unique mode. */
  private Mode operand(Node q, Soid x) {
    final Soid y;
    if (q.is(Attribute.FORMULA) || q.is(Attribute.MONADIC_FORMULA)) {
      final Table saved = enter(q);
      try {
        y = formula(q, x);
      } finally {
        table = saved;
      }
    } else {
      y = unit(q, Soid.of(Sort.FIRM, null));
    }
    final Mode u = unique(y);
    q.setMode(u);
    return u;
  }

  private Soid formula(Node p, Soid x) {
    if (p.is(Attribute.MONADIC_FORMULA)) {
      return monadicFormula(p, x);
    }
    final Node left = p.child(0);
    final Node operator = p.child(1);
    final Node right = p.child(2);
    final Mode u = operand(left, x);
    final Mode v = operand(right, x);
    if (coercibility.isNotWell(u) || coercibility.isNotWell(v)) {
      return error(x);
    }
    if (is(u, StandardMode.HIP)) {
      diagnostics.error(left, u + " construct is an invalid operand", u);
      return error(x);
    }
    if (is(v, StandardMode.HIP)) {
      diagnostics.error(right, v + " construct is an invalid operand", v);
      return error(x);
    }
    final String symbol = requireNonNull(operator.symbol());
    final Tag tag = operators.find(table, symbol, u, v);
    if (tag == null) {
      diagnostics.error(operator, "dyadic operator " + u + " " + symbol
          + " " + v + " has not been declared", u, v);
      operator.setMode(mode(StandardMode.ERROR));
      return error(x);
    }
    return applyOperator(operator, tag, x);
  }

  private Soid monadicFormula(Node p, Soid x) {
    final Node operator = p.child(0);
    final Node operand = p.child(1);
    final Mode u = operand(operand, Soid.of(Sort.FIRM, null));
    if (coercibility.isNotWell(u)) {
      return error(x);
    }
    if (is(u, StandardMode.HIP)) {
      diagnostics.error(operand, u + " construct is an invalid operand", u);
      return error(x);
    }
    final String symbol = requireNonNull(operator.symbol());
    final Tag tag = operators.find(table, symbol, u, null);
    if (tag == null) {
      diagnostics.error(operator, "monadic operator " + symbol + " " + u
          + " has not been declared", u);
      operator.setMode(mode(StandardMode.ERROR));
      return error(x);
    }
    return applyOperator(operator, tag, x);
  }

  /** Records the operator that a formula applies, and returns the mode it
   * yields. */
  private Soid applyOperator(Node operator, Tag tag, Soid x) {
    operator.setTag(tag);
    operator.setMode(tag.mode());
    if (tag == context.errorTag() || tag.mode() == null) {
      return error(x);
    }
    return Soid.of(x.sort, tag.mode().sub());
  }

  private Soid assignation(Node p, Soid x) {
    final Node destination = p.child(0);
    final Node source = p.child(1);
    final Soid tmp = unit(destination, Soid.of(Sort.SOFT, null));
    final Mode ori = unique(tmp);
    final Mode name = coercibility.deprocCompletely(ori);
    if (!name.is(ModeKind.REF)) {
      if (coercibility.isWell(name)) {
        diagnostics.error(p, ori + " " + describe(destination.attribute())
            + " does not yield a name", ori);
      }
      return error(x);
    }
    destination.setRequiredMode(name);
    final Soid expected = Soid.of(Sort.STRONG, name.sub());
    final Soid value = unit(source, expected);
    if (!value.isCoercibleInContext(expected, Deflexing.FORCE,
        coercibility)) {
      diagnostics.cannotCoerce(p, modeOrError(value), modeOrError(expected),
          Sort.STRONG, Deflexing.FORCE, null);
      return error(x);
    }
    return Soid.of(x.sort, name);
  }

  private Soid identityRelation(Node p, Soid x) {
    final Node ln = p.child(0);
    final Node rn = p.child(1);
    final Soid e = Soid.of(Sort.SOFT, null);
    final Mode oril = unique(unit(ln, e));
    final Mode orir = unique(unit(rn, e));
    Mode lhs = coercibility.deprocCompletely(oril);
    Mode rhs = coercibility.deprocCompletely(orir);
    lhs = checkName(ln, oril, lhs);
    rhs = checkName(rn, orir, rhs);
    if (is(lhs, StandardMode.HIP) && is(rhs, StandardMode.HIP)) {
      diagnostics.error(p, "construct has no unique mode");
    }
    if (coercibility.isCoercible(lhs, rhs, Sort.STRONG, Deflexing.SAFE)) {
      lhs = rhs;
    } else if (coercibility.isCoercible(rhs, lhs, Sort.STRONG,
        Deflexing.SAFE)) {
      rhs = lhs;
    } else {
      diagnostics.cannotCoerce(p, rhs, lhs, Sort.SOFT, Deflexing.SKIP,
          Attribute.IDENTITY_RELATION);
      lhs = rhs = mode(StandardMode.ERROR);
    }
    ln.setRequiredMode(lhs);
    rn.setRequiredMode(rhs);
    return Soid.of(x.sort, mode(StandardMode.BOOL));
  }

  /** Returns the mode of an operand of an identity relation, or ERROR if
   * it is not a name. */
  private Mode checkName(Node p, Mode ori, Mode m) {
    if (coercibility.isWell(m)
        && !is(m, StandardMode.HIP)
        && !m.is(ModeKind.REF)) {
      diagnostics.error(p, ori + " " + describe(p.attribute())
          + " does not yield a name", ori);
      return mode(StandardMode.ERROR);
    }
    return m;
  }

  /**
   * Checks a primary followed by a bracketed list, which is a call if the
   * primary yields a procedure, and a slice if it yields a row; turns the
   * node into a {@link Attribute#CALL} or {@link Attribute#SLICE}.
   */
  private Soid specification(Node p, Soid x) {
    final Node primary = p.child(0);
    final Soid d = unit(primary, Soid.of(Sort.WEAK, null));
    final Mode ori = unique(d);
    final Mode m = coercibility.deprefCompletely(ori);
    if (m.is(ModeKind.PROC)) {
      p.setAttribute(Attribute.CALL);
      return call(p, m, x);
    } else if (m.is(ModeKind.ROW) || m.is(ModeKind.FLEX)) {
      p.setAttribute(Attribute.SLICE);
      return slice(p, ori, x);
    }
    if (!is(m, StandardMode.ERROR)) {
      diagnostics.error(p,
          m + " construct must yield a routine, row or structured value", m);
    }
    return error(x);
  }

  /**
   * Checks a call. An argument list in which some arguments are omitted
   * (written as empty trimmers) is a partial parametrisation, and yields a
   * procedure of the omitted parameters.
   */
  private Soid call(Node p, Mode n, Soid x) {
    p.child(0).setRequiredMode(n);
    final Node arguments = p.child(1);
    final List<Mode> parameters = n.packModes();
    final List<Soid> list = new ArrayList<>();
    final List<Mode> omitted = new ArrayList<>();
    int i = 0;
    for (Node argument : arguments.children()) {
      final Mode parameter = i < parameters.size() ? parameters.get(i) : null;
      ++i;
      if (argument.is(Attribute.TRIMMER)) {
        if (argument.size() > 0) {
          diagnostics.error(argument, "trimmer is not an argument");
          list.add(Soid.of(Sort.STRONG, mode(StandardMode.ERROR)));
        } else {
          list.add(Soid.of(Sort.STRONG, parameter));
        }
        if (parameter != null) {
          omitted.add(parameter);
        }
      } else {
        list.add(unit(argument, Soid.of(Sort.STRONG, parameter)));
      }
    }
    final Mode result = requireNonNull(n.sub(), "result");
    if (arguments.size() != parameters.size()) {
      diagnostics.error(p, "incorrect number of arguments for " + n, n);
      return Soid.of(x.sort, result);
    }
    final Mode d = stowed(list);
    if (!coercibility.isCoercible(d, n, Sort.STRONG, Deflexing.ALIAS)) {
      diagnostics.cannotCoerce(p, d, n, Sort.STRONG, Deflexing.ALIAS,
          Attribute.ARGUMENT_LIST);
    }
    if (omitted.isEmpty()) {
      return Soid.of(x.sort, result);
    }
    if (portcheck) {
      diagnostics.warning(arguments,
          "partial parametrisation is an extension");
    }
    return Soid.of(x.sort, graph.proc(result, omitted));
  }

  /** Checks a slice; the primary is weakly dereferenced to a row or a name
   * of a row. */
  private Soid slice(Node p, Mode ori, Soid x) {
    final Node primary = p.child(0);
    Mode n = ori;
    while (n != null
        && (n.is(ModeKind.REF) && !coercibility.isRefRow(n)
            || n.is(ModeKind.PROC) && n.pack().isEmpty())) {
      n = coercibility.deprefOnce(n);
    }
    if (n == null
        || n.deflex().slice() == null && !coercibility.isRefRow(n)) {
      if (coercibility.isWell(n)) {
        diagnostics.error(p, n + " " + describe(primary.attribute())
            + " does not yield a row or procedure", n);
      }
      return error(x);
    }
    primary.setRequiredMode(n);

    int subscripts = 0;
    int trimmers = 0;
    for (Node indexer : p.child(1).children()) {
      if (indexer.is(Attribute.TRIMMER)) {
        ++trimmers;
        for (Node u : indexer.children()) {
          meekInt(u);
        }
      } else {
        ++subscripts;
        meekInt(indexer);
      }
    }
    final boolean isRef = coercibility.isRefRow(n);
    final int rank = isRef
        ? requireNonNull(n.sub()).deflex().dim()
        : n.deflex().dim();
    if (subscripts + trimmers != rank) {
      diagnostics.error(p, "incorrect number of indexers for " + n, n);
      return error(x);
    }
    Mode m = n;
    for (int k = 0; k < subscripts; k++) {
      final Mode next;
      if (isRef) {
        next = m.name();
      } else {
        next = (m.is(ModeKind.FLEX) ? requireNonNull(m.sub()) : m).slice();
      }
      if (next == null) {
        throw new InternalConsistencyException("mode " + m
            + " has no slice");
      }
      m = next;
    }
    // A trim is deflexed.
    if (trimmers > 0 && m.trim() != null) {
      return Soid.of(x.sort, m.trim());
    }
    return Soid.of(x.sort, m);
  }

  private void meekInt(Node p) {
    final Soid x = Soid.of(Sort.MEEK, mode(StandardMode.INT));
    final Soid y = unit(p, x);
    checkCoercible(p, y, x, Sort.MEEK, Deflexing.SAFE, null);
  }

  /**
   * Checks a selection. The secondary is weakly dereferenced to a
   * structure, a name of a structure, or a row of structures (in which case
   * the selection yields a row of fields).
   */
  private Soid selection(Node p, Soid x) {
    final Node secondary = p.child(0);
    final Soid d = unit(secondary, Soid.of(Sort.WEAK, null));
    final Mode ori = unique(d);
    Mode n = ori;
    List<PackEntry> fields = null;
    boolean multiple = false;
    for (boolean coerce = true; coerce;) {
      coerce = false;
      if (n.is(ModeKind.STRUCT)) {
        fields = n.pack();
      } else if (n.is(ModeKind.REF) && isRow(n.sub())
          && n.multiple() != null) {
        multiple = true;
        fields = n.multiple().pack();
      } else if (isRow(n) && n.multiple() != null) {
        multiple = true;
        fields = n.multiple().pack();
      } else if (n.is(ModeKind.REF) && coercibility.isNameStruct(n)) {
        fields = requireNonNull(n.name()).pack();
      } else if (coercibility.isDeprefable(n)) {
        coerce = true;
        n = requireNonNull(n.sub());
      }
    }
    if (fields == null) {
      if (coercibility.isWell(d.mode)) {
        diagnostics.error(secondary, ori + " "
            + describe(secondary.attribute())
            + " does not yield a structured value", ori);
      }
      return error(x);
    }
    secondary.setRequiredMode(n);
    final String field = requireNonNull(p.symbol());
    Mode str = n;
    while (str.is(ModeKind.REF)) {
      str = requireNonNull(str.sub());
    }
    if (str.is(ModeKind.FLEX)) {
      str = requireNonNull(str.sub());
    }
    if (str.is(ModeKind.ROW)) {
      str = requireNonNull(str.sub());
    }
    for (PackEntry entry : fields) {
      if (field.equals(entry.text)) {
        Mode m = entry.mode();
        if (multiple && m.trim() != null) {
          m = m.trim();
        }
        return Soid.of(x.sort, m);
      }
    }
    diagnostics.error(p, str + " has no field " + field, str);
    return error(x);
  }

  private static boolean isRow(@Nullable Mode m) {
    return m != null && (m.is(ModeKind.ROW) || m.is(ModeKind.FLEX));
  }
}

// End ModeChecker.java
