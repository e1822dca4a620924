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
import java.util.EnumSet;
import java.util.Set;
import net.hydromatic.algol68.ast.Attribute;
import net.hydromatic.algol68.ast.Node;

/**
 * Enters declarations into symbol tables, for tests.
 *
 * <p>A parser would normally do this. Each range (a program, a serial clause
 * or a part of a choice clause, a routine text, a loop, a specified unit) gets
 * a {@link Table}; each defining occurrence gets a {@link Tag} in the table
 * of its range. Tags are entered before the range is descended into, so that
 * a mode indicant may be used before its declaration.
 */
public class Scoper {
  private static final Set<Attribute> RANGES =
      EnumSet.of(Attribute.PARTICULAR_PROGRAM, Attribute.SERIAL_CLAUSE,
          Attribute.ENQUIRY_CLAUSE, Attribute.THEN_PART, Attribute.ELSE_PART,
          Attribute.OUT_PART, Attribute.WHILE_PART, Attribute.DO_PART,
          Attribute.UNTIL_PART, Attribute.ROUTINE_TEXT, Attribute.LOOP_CLAUSE,
          Attribute.SPECIFIED_UNIT);

  private Scoper() {}

  /** Builds the tables of a program, nested in the standard table of a
   * context. */
  public static Node scope(ModeContext context, Node program) {
    scope(context.standardTable(), program);
    return program;
  }

  private static void scope(Table table, Node p) {
    Table current = table;
    if (RANGES.contains(p.attribute())) {
      current = new Table(table);
      p.setTable(current);
      declare(current, p);
    }
    for (Node child : p.children()) {
      scope(current, child);
    }
  }

  /** Enters the tags that a range declares. */
  private static void declare(Table table, Node p) {
    for (Node c : p.children()) {
      switch (c.attribute()) {
        case MODE_DECLARATION:
          enter(table, Tag.Kind.INDICANT,
              c.findAll(Attribute.DEFINING_INDICANT));
          break;
        case IDENTITY_DECLARATION:
        case VARIABLE_DECLARATION:
        case PROCEDURE_DECLARATION:
        case PROCEDURE_VARIABLE_DECLARATION:
          enter(table, Tag.Kind.IDENTIFIER,
              c.findAll(Attribute.DEFINING_IDENTIFIER));
          break;
        case OPERATOR_DECLARATION:
        case BRIEF_OPERATOR_DECLARATION:
          enter(table, Tag.Kind.OPERATOR,
              c.findAll(Attribute.DEFINING_OPERATOR));
          break;
        case PARAMETER_PACK:
          enter(table, Tag.Kind.IDENTIFIER, c.children());
          break;
        case SPECIFIER:
        case FOR_PART:
          if (c.symbol() != null) {
            enter(table, Tag.Kind.IDENTIFIER, ImmutableList.of(c));
          }
          break;
        default:
          break;
      }
    }
  }

  private static void enter(Table table, Tag.Kind kind,
      Iterable<Node> definitions) {
    for (Node d : definitions) {
      d.setTag(table.add(kind, requireNonNull(d.symbol()), d, null));
    }
  }
}

// End Scoper.java
