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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.algol68.ast.Attribute;
import net.hydromatic.algol68.ast.Node;
import net.hydromatic.algol68.type.InternalConsistencyException;
import net.hydromatic.algol68.type.Mode;
import net.hydromatic.algol68.type.ModeGraph;
import net.hydromatic.algol68.type.ModeKind;
import net.hydromatic.algol68.type.PackEntry;
import net.hydromatic.algol68.type.StandardMode;
import net.hydromatic.algol68.type.WellFormedness;

/**
 * Collects the modes written in a program.
 *
 * <p>Gives a mode to each declarer, generator, routine text, denotation and
 * defining occurrence, and writes it to the tag of each defining occurrence.
 * Then connects each mode indicant to the mode of its declaration, and
 * checks that mode declarations are well formed.
 */
public class ModeCollector {
  private final ModeContext context;
  private final ModeGraph graph;
  /** Mode written in each mode declaration, before indicants are
   * connected. */
  private final Map<Node, Mode> declared = new IdentityHashMap<>();
  /** Table of the range being scanned. */
  private Table table;

  public ModeCollector(ModeContext context) {
    this.context = requireNonNull(context);
    this.graph = context.graph();
    this.table = context.standardTable();
  }

  /**
   * Collects the modes of a program, then checks them. Returns whether there
   * were no errors, in which case derived modes may be computed.
   */
  public boolean collect(Node program) {
    final int errorCount = context.diagnostics().errorCount();
    scan(program);
    context.tracer().onModesCollected(graph);
    makeModeList();
    return context.diagnostics().errorCount() == errorCount;
  }

  /** Gives modes to a node and its descendants. Children come first, so
   * that a declaration can use the modes of its declarer and its routine
   * texts. */
  void scan(Node p) {
    final Table saved = table;
    if (p.table() != null) {
      table = p.table();
    }
    try {
      scanNode(p);
    } finally {
      table = saved;
    }
  }

  private void scanNode(Node p) {
    if (p.is(Attribute.DECLARER)) {
      declarer(p);
    }
    for (Node child : p.children()) {
      scan(child);
    }
    switch (p.attribute()) {
      case DENOTATION:
        denotation(p);
        break;
      case GENERATOR:
        p.setMode(graph.ref(declarer(p.child(0))));
        break;
      case ROUTINE_TEXT:
        p.setMode(routineText(p));
        break;
      case MODE_DECLARATION:
        for (Node d : p.findAll(Attribute.DEFINING_INDICANT)) {
          final Mode mode = declarer(d.child(0));
          declared.put(d, mode);
          if (d.tag() != null) {
            d.tag().setMode(graph.indicant(d));
          }
        }
        break;
      case IDENTITY_DECLARATION:
        for (Node d : p.findAll(Attribute.DEFINING_IDENTIFIER)) {
          define(d, declarer(p.child(0)));
        }
        break;
      case VARIABLE_DECLARATION:
        for (Node d : p.findAll(Attribute.DEFINING_IDENTIFIER)) {
          define(d, graph.ref(declarer(p.child(0))));
        }
        break;
      case PROCEDURE_DECLARATION:
        for (Node d : p.findAll(Attribute.DEFINING_IDENTIFIER)) {
          define(d, routineMode(d));
        }
        break;
      case PROCEDURE_VARIABLE_DECLARATION:
        for (Node d : p.findAll(Attribute.DEFINING_IDENTIFIER)) {
          define(d, graph.ref(routineMode(d)));
        }
        break;
      case OPERATOR_DECLARATION:
        for (Node d : p.findAll(Attribute.DEFINING_OPERATOR)) {
          define(d, declarer(p.child(0)));
        }
        break;
      case BRIEF_OPERATOR_DECLARATION:
        for (Node d : p.findAll(Attribute.DEFINING_OPERATOR)) {
          define(d, routineMode(d));
        }
        break;
      case PARAMETER:
      case SPECIFIER:
        define(p, declarer(p.child(0)));
        break;
      case FOR_PART:
        define(p, context.mode(StandardMode.INT));
        break;
      default:
        break;
    }
  }

  /** Sets the mode of a defining occurrence, and of its tag. */
  private static void define(Node p, Mode mode) {
    p.setMode(mode);
    if (p.tag() != null) {
      p.tag().setMode(mode);
    }
  }

  /** Returns the mode of the routine text held by a defining identifier or
   * operator. */
  private Mode routineMode(Node d) {
    final Node routine = d.find(Attribute.ROUTINE_TEXT);
    if (routine == null || routine.mode() == null) {
      throw new InternalConsistencyException("routine text expected in "
          + d.symbol());
    }
    return routine.mode();
  }

  /** Returns the mode of a routine text: a procedure whose parameters are
   * given by the parameter pack. */
  private Mode routineText(Node p) {
    final List<PackEntry> parameters = new ArrayList<>();
    final Node pack = p.find(Attribute.PARAMETER_PACK);
    if (pack != null) {
      for (Node parameter : pack.children()) {
        parameters.add(
            new PackEntry(declarer(parameter.child(0)), null, parameter));
      }
    }
    final Mode result = declarer(requireNonNull(p.find(Attribute.DECLARER)));
    return graph.intern(ModeKind.PROC, 0, p, result, parameters);
  }

  private void denotation(Node p) {
    final Node leaf = p.child(0);
    final int sizety = p.sizety();
    final StandardMode mode;
    switch (leaf.attribute()) {
      case INT_DENOTATION:
        mode = bySizety(sizety, StandardMode.INT, StandardMode.LONG_INT,
            StandardMode.LONG_LONG_INT);
        break;
      case REAL_DENOTATION:
        mode = bySizety(sizety, StandardMode.REAL, StandardMode.LONG_REAL,
            StandardMode.LONG_LONG_REAL);
        break;
      case BITS_DENOTATION:
        mode = bySizety(sizety, StandardMode.BITS, StandardMode.LONG_BITS,
            StandardMode.LONG_LONG_BITS);
        break;
      case ROW_CHAR_DENOTATION:
        mode = leaf.symbol() != null && leaf.symbol().length() == 1
            ? StandardMode.CHAR
            : StandardMode.ROW_CHAR;
        break;
      case TRUE_SYMBOL:
      case FALSE_SYMBOL:
        mode = StandardMode.BOOL;
        break;
      case EMPTY_SYMBOL:
        mode = StandardMode.VOID;
        break;
      default:
        throw new AssertionError(leaf.attribute());
    }
    leaf.setMode(context.mode(mode));
    p.setMode(context.mode(mode));
  }

  /** Chooses a mode by LONG count; SHORT maps to the plain mode, and more
   * than two LONGs to the longest. */
  private static StandardMode bySizety(int sizety, StandardMode plain,
      StandardMode longMode, StandardMode longLongMode) {
    return sizety <= 0 ? plain : sizety == 1 ? longMode : longLongMode;
  }

  /** Returns the mode of a declarer, computing it the first time. */
  Mode declarer(Node p) {
    if (!p.is(Attribute.DECLARER)) {
      throw new InternalConsistencyException("declarer expected, got "
          + p.attribute());
    }
    Mode mode = p.mode();
    if (mode == null) {
      mode = declarerBody(p.child(0));
      p.setMode(mode);
    }
    return mode;
  }

  private Mode declarerBody(Node q) {
    final Mode mode;
    switch (q.attribute()) {
      case VOID_SYMBOL:
        mode = context.mode(StandardMode.VOID);
        break;
      case INDICANT:
        mode = indicant(q);
        break;
      case REF_SYMBOL:
        mode = graph.intern(ModeKind.REF, 0, q, declarer(q.child(0)),
            ImmutableList.of());
        break;
      case FLEX_SYMBOL:
        mode = graph.intern(ModeKind.FLEX, 0, q, declarer(q.child(0)),
            ImmutableList.of());
        break;
      case BOUNDS:
        final int dim = q.findAll(Attribute.BOUND).size();
        mode = graph.row(dim, declarer(q.lastChild()), q);
        break;
      case STRUCT_SYMBOL:
        final List<PackEntry> fields = new ArrayList<>();
        for (Node field : q.children()) {
          final Mode fieldMode = declarer(field.child(0));
          field.setMode(fieldMode);
          fields.add(new PackEntry(fieldMode, field.symbol(), field));
        }
        mode = graph.intern(ModeKind.STRUCT, 0, q, null, fields);
        break;
      case UNION_SYMBOL:
        final List<PackEntry> members = new ArrayList<>();
        for (Node member : q.children()) {
          members.add(new PackEntry(declarer(member), null, member));
        }
        mode = graph.intern(ModeKind.UNION, 0, q, null, members);
        break;
      case PROC_SYMBOL:
        final List<PackEntry> parameters = new ArrayList<>();
        for (int i = 0; i < q.size() - 1; i++) {
          final Node parameter = q.child(i);
          parameters.add(new PackEntry(declarer(parameter), null, parameter));
        }
        mode = graph.intern(ModeKind.PROC, 0, q, declarer(q.lastChild()),
            parameters);
        break;
      default:
        throw new InternalConsistencyException("unknown declarer "
            + q.attribute());
    }
    q.setMode(mode);
    return mode;
  }

  /** Returns the mode of an applied mode indicant: a standard mode, or the
   * indicant declared in an enclosing range. */
  private Mode indicant(Node q) {
    final String symbol = requireNonNull(q.symbol());
    final Mode standard = graph.searchStandard(q.sizety(), symbol);
    if (standard != null) {
      return standard;
    }
    final Tag tag = table.findGlobal(Tag.Kind.INDICANT, symbol);
    if (tag == null || tag.node == null) {
      context.diagnostics().error(q,
          "tag " + symbol + " has not been declared properly");
      return context.mode(StandardMode.ERROR);
    }
    return graph.indicant(tag.node);
  }

  /**
   * Connects each indicant to its declared mode, then checks that the
   * declarations of indicants, and the other modes written in the program,
   * are well formed.
   */
  void makeModeList() {
    final List<Mode> indicants = new ArrayList<>();
    for (Mode z : graph.modes()) {
      if (z.kind == ModeKind.INDICANT) {
        final Node definition = requireNonNull(z.node());
        final Mode mode = declared.get(definition);
        if (mode == null) {
          throw new InternalConsistencyException("indicant "
              + definition.symbol() + " has no declared mode");
        }
        graph.declare(z, mode);
        indicants.add(z);
      }
    }
    final List<Mode> malformed = new ArrayList<>();
    for (Mode z : indicants) {
      if (!WellFormedness.isWellFormed(z, z.equivalent(), false, false,
          true)) {
        malformed.add(z);
      }
    }
    for (Mode z : malformed) {
      context.diagnostics().error(requireNonNull(z.node()),
          z.node().symbol() + " does not specify a well formed mode", z);
    }
    for (Mode z : malformed) {
      graph.declare(z, context.mode(StandardMode.ERROR));
    }
    if (!malformed.isEmpty()) {
      return;
    }
    for (Mode z : graph.modes()) {
      if (z.kind != ModeKind.INDICANT
          && z.node() != null
          && !WellFormedness.isWellFormed(null, z, false, false, true)) {
        context.diagnostics().error(z.node(),
            z + " does not specify a well formed mode", z);
      }
    }
  }
}

// End ModeCollector.java
