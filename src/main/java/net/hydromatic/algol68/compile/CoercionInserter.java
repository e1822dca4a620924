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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Sets;
import java.util.List;
import java.util.Set;
import net.hydromatic.algol68.ast.Attribute;
import net.hydromatic.algol68.ast.Node;
import net.hydromatic.algol68.type.Coercibility;
import net.hydromatic.algol68.type.Deflexing;
import net.hydromatic.algol68.type.InternalConsistencyException;
import net.hydromatic.algol68.type.Mode;
import net.hydromatic.algol68.type.ModeGraph;
import net.hydromatic.algol68.type.ModeKind;
import net.hydromatic.algol68.type.Sort;
import net.hydromatic.algol68.type.StandardMode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Makes every implicit coercion of a checked program explicit.
 *
 * <p>Walks the tree that {@link ModeChecker} has annotated, passing down the
 * mode that each context requires. Where a unit's mode differs from the
 * required mode, the unit is wrapped in a chain of coercion markers
 * ({@link Attribute#DEREFERENCING}, {@link Attribute#WIDENING} and so on),
 * innermost first; the original unit stays underneath, with its own mode.
 *
 * <p>Run it only on a program that checked without errors.
 */
public class CoercionInserter {
  private final ModeContext context;
  private final ModeGraph graph;
  private final Coercibility coercibility;
  private final Diagnostics diagnostics;
  private final Tracer tracer;
  private final boolean portcheck;
  private final boolean widenDenotations;
  /** Denotations that have absorbed a widening. */
  private final Set<Node> folded = Sets.newIdentityHashSet();

  public CoercionInserter(ModeContext context) {
    this.context = requireNonNull(context);
    this.graph = context.graph();
    this.coercibility = context.coercibility();
    this.diagnostics = context.diagnostics();
    this.tracer = context.tracer();
    this.portcheck = Prop.PORTCHECK.booleanValue(context.props());
    this.widenDenotations =
        Prop.WIDEN_DENOTATIONS.booleanValue(context.props());
  }

  /** Inserts coercions into a program, in place, and returns the program
   * with the diagnostics that arose. */
  public Result insert(Node program) {
    checkArgument(program.is(Attribute.PARTICULAR_PROGRAM),
        "not a program: %s", program.attribute());
    final int mark = diagnostics.size();
    unit(program.child(0), mode(StandardMode.VOID));
    if (widenDenotations) {
      widen(program);
    }
    return new Result(program, diagnostics.since(mark));
  }

  private Mode mode(StandardMode standardMode) {
    return context.mode(standardMode);
  }

  private boolean is(Mode m, StandardMode standardMode) {
    return graph.is(m, standardMode);
  }

  private static Mode modeOf(Node p) {
    return requireNonNull(p.mode(), () -> "mode of " + p.attribute());
  }

  // coercions

  /** Coerces a unit of mode {@code p} to mode {@code q}. */
  private void insertCoercions(Node n, Mode p, Mode q) {
    if (coercibility.isNotWell(p) || coercibility.isNotWell(q)) {
      return;
    }
    if (is(q, StandardMode.VOID) && !is(p, StandardMode.VOID)) {
      makeVoid(n, p);
    } else {
      makeDepreffing(n, p, q);
    }
  }

  /** Wraps a node in a coercion. */
  private void makeCoercion(Node n, Attribute coercion, Mode m) {
    final Mode yields = coercibility.deprefRows(modeOf(n), m);
    n.wrap(coercion, yields);
    tracer.onCoercion(n, coercion, yields);
  }

  /**
   * Voids a unit. A unit that yields a procedure, or a name of one, is
   * called first if it is one of the constructs that can deliver a routine
   * (an identifier, a call and so forth); other units are voided
   * directly.
   */
  private void makeVoid(Node p, Mode q) {
    switch (p.attribute()) {
      case SELECTION:
      case SLICE:
      case ROUTINE_TEXT:
      case FORMULA:
      case MONADIC_FORMULA:
      case CALL:
      case IDENTIFIER:
        if (!coercibility.isNonproc(q)) {
          Mode z = q.resolve();
          while (!coercibility.isNonproc(z)) {
            if (z.is(ModeKind.REF)) {
              makeCoercion(p, Attribute.DEREFERENCING, requireNonNull(z.sub()));
            } else if (z.is(ModeKind.PROC) && z.pack().isEmpty()) {
              makeCoercion(p, Attribute.DEPROCEDURING,
                  requireNonNull(z.sub()));
            }
            z = requireNonNull(z.sub());
          }
          if (!is(z, StandardMode.VOID)) {
            makeCoercion(p, Attribute.VOIDING, mode(StandardMode.VOID));
          }
          return;
        }
        break;
      default:
        break;
    }
    makeCoercion(p, Attribute.VOIDING, mode(StandardMode.VOID));
  }

  /**
   * Coerces a unit of mode {@code p} to {@code q}, dereferencing and
   * deproceduring until a uniting, widening or rowing gets there.
   */
  private void makeDepreffing(Node n, Mode p0, Mode q0) {
    final Mode p = p0.resolve();
    final Mode q = q0.resolve();
    if (p.deflex() == q.deflex()) {
      return;
    } else if (is(q, StandardMode.ROWS) && coercibility.isRowsType(p)) {
      makeCoercion(n, Attribute.UNITING, q);
      n.setMode(q);
    } else if (coercibility.isWidenable(p, q)) {
      makeWidening(n, p, q);
    } else if (coercibility.isUnitable(p, coercibility.derow(q),
        Deflexing.SAFE)) {
      makeUniting(n, q);
    } else if (coercibility.isRefRow(q) && coercibility.isStrongName(p, q)) {
      makeRefRowing(n, p, q);
    } else if (q.slice() != null && coercibility.isStrongSlice(p, q)) {
      makeRowing(n, p, q);
    } else if (q.is(ModeKind.FLEX) && coercibility.isStrongSlice(p, q)) {
      makeRowing(n, p, q);
    } else if (p.is(ModeKind.REF)) {
      final Mode r = requireNonNull(coercibility.deprefOnce(p));
      makeCoercion(n, Attribute.DEREFERENCING, r);
      makeDepreffing(n, r, q);
    } else if (p.is(ModeKind.PROC) && p.pack().isEmpty()) {
      final Mode r = requireNonNull(p.sub());
      makeCoercion(n, Attribute.DEPROCEDURING, r);
      makeDepreffing(n, r, q);
    } else if (p != q) {
      diagnostics.cannotCoerce(n, p, q, Sort.NO_SORT, Deflexing.SKIP, null);
    }
  }

  /** Widens in steps, for example INT to REAL to COMPLEX. */
  private void makeWidening(Node n, Mode p, Mode q) {
    final Mode z = coercibility.widensTo(p, q);
    if (z == null) {
      throw new InternalConsistencyException(p + " does not widen to " + q);
    }
    makeCoercion(n, Attribute.WIDENING, z);
    if (z != q.resolve()) {
      makeWidening(n, z, q);
    }
  }

  private void makeRefRowing(Node n, Mode p0, Mode q0) {
    final Mode p = p0.resolve();
    final Mode q = q0.resolve();
    if (p.deflex() != q.deflex()) {
      if (coercibility.isWidenable(p, q)) {
        makeWidening(n, p, q);
      } else if (coercibility.isRefRow(q)) {
        makeRefRowing(n, p, requireNonNull(q.name(), "name"));
        makeCoercion(n, Attribute.ROWING, q);
      }
    }
  }

  private void makeRowing(Node n, Mode p0, Mode q0) {
    final Mode p = p0.resolve();
    final Mode q = q0.resolve();
    if (p.deflex() != q.deflex()) {
      if (coercibility.isWidenable(p, q)) {
        makeWidening(n, p, q);
      } else if (q.slice() != null) {
        makeRowing(n, p, q.slice());
        makeCoercion(n, Attribute.ROWING, q);
      } else if (q.is(ModeKind.FLEX)) {
        makeRowing(n, p, requireNonNull(q.sub()));
      } else if (coercibility.isRefRow(q)) {
        makeRefRowing(n, p, q);
      }
    }
  }

  /** Unites to {@code q}, or to the element of {@code q} if it is a row of
   * unions, which is then rowed. */
  private void makeUniting(Node n, Mode q) {
    final Mode element = coercibility.derow(q);
    makeCoercion(n, Attribute.UNITING, element);
    if (q.is(ModeKind.ROW) || q.is(ModeKind.FLEX)) {
      makeRowing(n, element, q);
    }
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
      case OPERATOR_DECLARATION:
        declarer(p.child(0));
        for (Node d : p.children()) {
          if ((d.is(Attribute.DEFINING_IDENTIFIER)
              || d.is(Attribute.DEFINING_OPERATOR))
              && d.size() > 0) {
            unit(d.child(0), modeOf(d));
          }
        }
        break;
      case VARIABLE_DECLARATION:
        declarer(p.child(0));
        for (Node d : p.findAll(Attribute.DEFINING_IDENTIFIER)) {
          if (d.size() > 0) {
            unit(d.child(0), requireNonNull(modeOf(d).sub()));
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
          routineText(requireNonNull(d.find(Attribute.ROUTINE_TEXT)));
        }
        break;
      default:
        throw new InternalConsistencyException("not a declaration: "
            + p.attribute());
    }
  }

  /** Coerces the actual bounds in a declarer, which are meek INT. */
  private void declarer(Node p) {
    for (Node c : p.children()) {
      if (c.is(Attribute.BOUND)) {
        for (Node u : c.children()) {
          unit(u, mode(StandardMode.INT));
        }
      } else {
        declarer(c);
      }
    }
  }

  private void routineText(Node p) {
    final Node result = requireNonNull(p.find(Attribute.DECLARER));
    unit(p.lastChild(), modeOf(result));
  }

  // clauses

  /** Coerces the last unit of a serial clause to {@code q}, and voids the
   * others. */
  private void serial(Node p, Mode q) {
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
        unit(c, q);
      } else if (c.attribute().isUnit()) {
        unit(c, mode(StandardMode.VOID));
      }
    }
  }

  private void enclosed(Node p, Mode q) {
    switch (p.attribute()) {
      case CLOSED_CLAUSE:
        serial(p.child(0), q);
        break;
      case COLLATERAL_CLAUSE:
        collateral(p, q);
        break;
      case CONDITIONAL_CLAUSE:
        conditional(p, q);
        break;
      case CASE_CLAUSE:
        integerCase(p, q);
        break;
      case CONFORMITY_CLAUSE:
        unitedCase(p, q);
        break;
      case LOOP_CLAUSE:
        loop(p);
        break;
      default:
        throw new InternalConsistencyException("not an enclosed clause: "
            + p.attribute());
    }
    p.setMode(coercibility.deprefRows(modeOf(p), q));
  }

  private void collateral(Node p, Mode q0) {
    final Mode q = q0.resolve();
    if (q.is(ModeKind.STRUCT)) {
      final List<Mode> fields = q.packModes();
      for (int i = 0; i < p.size() && i < fields.size(); i++) {
        unit(p.child(i), fields.get(i));
      }
    } else if (q.is(ModeKind.FLEX)) {
      unitList(p.children(), requireNonNull(requireNonNull(q.sub()).slice()));
    } else if (q.is(ModeKind.ROW)) {
      unitList(p.children(), requireNonNull(q.slice()));
    } else {
      unitList(p.children(), q);
    }
  }

  private void unitList(List<Node> units, Mode q) {
    for (Node u : units) {
      unit(u, q);
    }
  }

  private void conditional(Node p, Mode q) {
    serial(p.child(0), mode(StandardMode.BOOL));
    serial(p.child(1), q);
    if (p.size() > 2) {
      final Node r = p.child(2);
      if (r.is(Attribute.ELIF_PART)) {
        conditional(r, q);
      } else {
        serial(r, q);
      }
    }
  }

  private void integerCase(Node p, Mode q) {
    serial(p.child(0), mode(StandardMode.INT));
    unitList(p.child(1).children(), q);
    if (p.size() > 2) {
      final Node r = p.child(2);
      if (r.is(Attribute.OUSE_PART)) {
        integerCase(r, q);
      } else {
        serial(r, q);
      }
    }
  }

  /** Coerces a conformity clause; the enquiry is coerced to the united mode
   * that the checker chose. */
  private void unitedCase(Node p, Mode q) {
    final Node enquiry = p.child(0);
    final Mode united = enquiry.requiredMode();
    if (united != null) {
      serial(enquiry, united);
    }
    for (Node specifiedUnit : p.child(1).children()) {
      unit(specifiedUnit.child(1), q);
    }
    if (p.size() > 2) {
      final Node r = p.child(2);
      if (r.is(Attribute.CONFORMITY_OUSE_PART)) {
        unitedCase(r, q);
      } else {
        serial(r, q);
      }
    }
  }

  private void loop(Node p) {
    for (Node c : p.children()) {
      switch (c.attribute()) {
        case FOR_PART:
          break;
        case FROM_PART:
        case BY_PART:
        case TO_PART:
          unit(c.child(0), mode(StandardMode.INT));
          break;
        case WHILE_PART:
        case UNTIL_PART:
          serial(c, mode(StandardMode.BOOL));
          break;
        case DO_PART:
          serial(c, mode(StandardMode.VOID));
          break;
        default:
          throw new InternalConsistencyException("unexpected "
              + c.attribute() + " in loop clause");
      }
    }
  }

  // units

  /** Coerces the parts of a unit, then the unit itself to {@code q}. */
  private void unit(Node p, Mode q) {
    switch (p.attribute()) {
      case CLOSED_CLAUSE:
      case COLLATERAL_CLAUSE:
      case CONDITIONAL_CLAUSE:
      case CASE_CLAUSE:
      case CONFORMITY_CLAUSE:
      case LOOP_CLAUSE:
        enclosed(p, q);
        return;
      case NIHIL:
        if (!q.resolve().is(ModeKind.REF) && !is(q, StandardMode.VOID)) {
          diagnostics.error(p, "context does not require a name");
        }
        p.setMode(coercibility.deprefRows(modeOf(p), q));
        return;
      case JUMP:
        if (is(q, StandardMode.PROC_VOID)) {
          p.wrap(Attribute.PROCEDURING, q.resolve());
          tracer.onCoercion(p, Attribute.PROCEDURING, q.resolve());
        }
        p.setMode(coercibility.deprefRows(modeOf(p), q));
        return;
      case SKIP:
        p.setMode(coercibility.deprefRows(modeOf(p), q));
        return;
      case CALL:
        call(p);
        break;
      case SLICE:
        slice(p);
        break;
      case CAST:
        declarer(p.child(0));
        unit(p.child(1), modeOf(p.child(0)));
        break;
      case GENERATOR:
        declarer(p.child(0));
        break;
      case DENOTATION:
      case IDENTIFIER:
        break;
      case SELECTION:
        unit(p.child(0), required(p.child(0)));
        break;
      case FORMULA:
      case MONADIC_FORMULA:
        formula(p);
        break;
      case ASSIGNATION:
        final Node destination = p.child(0);
        final Mode name = required(destination);
        unit(destination, name);
        unit(p.child(1), requireNonNull(name.sub()));
        break;
      case IDENTITY_RELATION:
        unit(p.child(0), required(p.child(0)));
        unit(p.child(1), required(p.child(1)));
        break;
      case ROUTINE_TEXT:
        routineText(p);
        break;
      case AND_FUNCTION:
      case OR_FUNCTION:
        unitList(p.children(), mode(StandardMode.BOOL));
        break;
      case ASSERTION:
        unit(p.child(0), mode(StandardMode.BOOL));
        break;
      default:
        throw new InternalConsistencyException("cannot coerce "
            + p.attribute());
    }
    insertCoercions(p, modeOf(p), q);
  }

  /** Returns the mode that the checker required of an operand. */
  private static Mode required(Node p) {
    return requireNonNull(p.requiredMode(),
        () -> "required mode of " + p.attribute());
  }

  private void call(Node p) {
    final Node primary = p.child(0);
    final Mode proc = required(primary);
    unit(primary, proc);
    final List<Mode> parameters = proc.packModes();
    final List<Node> arguments = p.child(1).children();
    for (int i = 0; i < arguments.size() && i < parameters.size(); i++) {
      if (!arguments.get(i).is(Attribute.TRIMMER)) {
        unit(arguments.get(i), parameters.get(i));
      }
    }
  }

  private void slice(Node p) {
    final Node primary = p.child(0);
    unit(primary, required(primary));
    for (Node indexer : p.child(1).children()) {
      if (indexer.is(Attribute.TRIMMER)) {
        unitList(indexer.children(), mode(StandardMode.INT));
      } else {
        unit(indexer, mode(StandardMode.INT));
      }
    }
  }

  /** Coerces the operands of a formula to the parameters of its
   * operator. */
  private void formula(Node p) {
    final Node operator;
    final List<Node> operands;
    if (p.is(Attribute.MONADIC_FORMULA)) {
      operator = p.child(0);
      operands = ImmutableList.of(p.child(1));
    } else {
      operator = p.child(1);
      operands = ImmutableList.of(p.child(0), p.child(2));
    }
    final Tag tag = operator.tag();
    if (tag == null || tag == context.errorTag()) {
      return;
    }
    final List<Mode> parameters = modeOf(operator).packModes();
    for (int i = 0; i < operands.size(); i++) {
      unit(operands.get(i), parameters.get(i));
    }
  }

  // denotations

  /**
   * Folds widenings of denotations, so that {@code LONG REAL x = 1} needs no
   * run-time conversion. Widening an {@code INT} to a {@code LONG INT}
   * denotation is not portable, and warns if portability checks are
   * enabled.
   */
  private void widen(Node p) {
    for (Node c : p.children()) {
      widen(c);
    }
    if (!p.is(Attribute.WIDENING)
        || !p.child(0).is(Attribute.DENOTATION)) {
      return;
    }
    final Mode to = modeOf(p);
    final Mode from = modeOf(p.child(0));
    final @Nullable Boolean portable = widenedDenotation(from, to);
    if (portable == null) {
      return;
    }
    if (!portable && portcheck && !folded.contains(p.child(0))) {
      diagnostics.warning(p, "implicit widening is not portable");
    }
    p.unwrap(to);
    folded.add(p);
  }

  /** Returns whether widening a denotation from one mode to another is
   * portable, or null if it cannot be folded. */
  private @Nullable Boolean widenedDenotation(Mode from, Mode to) {
    if (is(to, StandardMode.LONG_LONG_INT) && is(from, StandardMode.LONG_INT)
        || is(to, StandardMode.LONG_INT) && is(from, StandardMode.INT)
        || is(to, StandardMode.LONG_LONG_REAL)
            && is(from, StandardMode.LONG_REAL)
        || is(to, StandardMode.LONG_REAL) && is(from, StandardMode.REAL)
        || is(to, StandardMode.LONG_LONG_BITS)
            && is(from, StandardMode.LONG_BITS)
        || is(to, StandardMode.LONG_BITS) && is(from, StandardMode.BITS)) {
      return false;
    }
    if (is(to, StandardMode.LONG_REAL) && is(from, StandardMode.LONG_INT)
        || is(to, StandardMode.REAL) && is(from, StandardMode.INT)) {
      return true;
    }
    return null;
  }

  /** Result of inserting coercions. */
  public static class Result {
    /** The program, with coercion markers. */
    public final Node tree;
    public final List<CompileException> diagnostics;

    Result(Node tree, List<CompileException> diagnostics) {
      this.tree = requireNonNull(tree);
      this.diagnostics = ImmutableList.copyOf(diagnostics);
    }
  }
}

// End CoercionInserter.java
