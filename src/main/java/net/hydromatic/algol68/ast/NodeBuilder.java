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
package net.hydromatic.algol68.ast;

import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds syntax-tree nodes. */
public enum NodeBuilder {
  /**
   * The singleton instance of the node builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  tree;

  private static Node node(Attribute attribute, @Nullable String symbol,
      Node... children) {
    final Node node = new Node(Pos.ZERO, attribute, symbol);
    for (Node child : children) {
      node.add(child);
    }
    return node;
  }

  private static Node node(Attribute attribute, @Nullable String symbol,
      List<Node> children) {
    return node(attribute, symbol, children.toArray(new Node[0]));
  }

  // program and clauses

  public Node program(Node enclosedClause) {
    return node(Attribute.PARTICULAR_PROGRAM, null, enclosedClause);
  }

  /** Creates "BEGIN phrase; ...; phrase END". */
  public Node closed(Node... phrases) {
    return node(Attribute.CLOSED_CLAUSE, null, serial(phrases));
  }

  public Node serial(Node... phrases) {
    return node(Attribute.SERIAL_CLAUSE, null, phrases);
  }

  /** Creates a display "(u1, u2, ...)", or a vacuum "()" if there are no
   * units. */
  public Node collateral(Node... units) {
    return node(Attribute.COLLATERAL_CLAUSE, null, units);
  }

  /**
   * Creates "IF enquiry THEN then ELSE otherwise FI". If {@code otherwise}
   * is an {@link Attribute#ELIF_PART} it is used as is; if it is null there
   * is no ELSE part.
   */
  public Node conditional(Node enquiry, Node then,
      @Nullable Node otherwise) {
    return choice(Attribute.CONDITIONAL_CLAUSE, enquiry, then, otherwise);
  }

  /** Creates "ELIF enquiry THEN then ELSE otherwise", to be the last
   * argument of {@link #conditional}. */
  public Node elif(Node enquiry, Node then, @Nullable Node otherwise) {
    return choice(Attribute.ELIF_PART, enquiry, then, otherwise);
  }

  private Node choice(Attribute attribute, Node enquiry, Node then,
      @Nullable Node otherwise) {
    final Node node =
        node(attribute, null, node(Attribute.ENQUIRY_CLAUSE, null, enquiry),
            node(Attribute.THEN_PART, null, then));
    if (otherwise != null) {
      node.add(otherwise.is(Attribute.ELIF_PART)
          ? otherwise
          : node(Attribute.ELSE_PART, null, otherwise));
    }
    return node;
  }

  /** Creates "CASE enquiry IN u1, u2, ... OUT out ESAC". */
  public Node caseClause(Node enquiry, List<Node> units,
      @Nullable Node out) {
    return cases(Attribute.CASE_CLAUSE, Attribute.OUSE_PART, enquiry, units,
        out);
  }

  /** Creates "OUSE enquiry IN u1, u2, ... OUT out", to be the last argument
   * of {@link #caseClause}. */
  public Node ouse(Node enquiry, List<Node> units, @Nullable Node out) {
    return cases(Attribute.OUSE_PART, Attribute.OUSE_PART, enquiry, units,
        out);
  }

  /** Creates a conformity clause "CASE enquiry IN (M x): u, ... OUT out
   * ESAC"; the units are made by {@link #specified}. */
  public Node conformity(Node enquiry, List<Node> specifiedUnits,
      @Nullable Node out) {
    return cases(Attribute.CONFORMITY_CLAUSE, Attribute.CONFORMITY_OUSE_PART,
        enquiry, specifiedUnits, out);
  }

  private Node cases(Attribute attribute, Attribute ouse, Node enquiry,
      List<Node> units, @Nullable Node out) {
    final Node node =
        node(attribute, null, node(Attribute.ENQUIRY_CLAUSE, null, enquiry),
            node(Attribute.IN_PART, null, units));
    if (out != null) {
      node.add(out.is(ouse) ? out : node(Attribute.OUT_PART, null, out));
    }
    return node;
  }

  /** Creates "(M x): unit" in a conformity clause; {@code identifier} may
   * be null. */
  public Node specified(Node declarer, @Nullable String identifier,
      Node unit) {
    return node(Attribute.SPECIFIED_UNIT, null,
        node(Attribute.SPECIFIER, identifier, declarer), unit);
  }

  /** Creates "FOR i FROM from BY by TO to WHILE condition DO body OD";
   * every argument but {@code body} may be null. */
  public Node loop(@Nullable String identifier, @Nullable Node from,
      @Nullable Node by, @Nullable Node to, @Nullable Node condition,
      Node body) {
    final Node node = node(Attribute.LOOP_CLAUSE, null);
    if (identifier != null) {
      node.add(node(Attribute.FOR_PART, identifier));
    }
    if (from != null) {
      node.add(node(Attribute.FROM_PART, null, from));
    }
    if (by != null) {
      node.add(node(Attribute.BY_PART, null, by));
    }
    if (to != null) {
      node.add(node(Attribute.TO_PART, null, to));
    }
    if (condition != null) {
      node.add(node(Attribute.WHILE_PART, null, condition));
    }
    return node.add(node(Attribute.DO_PART, null, body));
  }

  // denotations

  private static Node denotation(Attribute leaf, String symbol, int sizety) {
    return node(Attribute.DENOTATION, null, node(leaf, symbol))
        .setSizety(sizety);
  }

  public Node intLiteral(int value) {
    return denotation(Attribute.INT_DENOTATION, Integer.toString(value), 0);
  }

  /** Creates a denotation such as "LONG 1"; {@code sizety} is the number of
   * LONGs. */
  public Node intLiteral(int sizety, String digits) {
    return denotation(Attribute.INT_DENOTATION, digits, sizety);
  }

  public Node realLiteral(String digits) {
    return denotation(Attribute.REAL_DENOTATION, digits, 0);
  }

  public Node realLiteral(int sizety, String digits) {
    return denotation(Attribute.REAL_DENOTATION, digits, sizety);
  }

  public Node bitsLiteral(String digits) {
    return denotation(Attribute.BITS_DENOTATION, digits, 0);
  }

  /** Creates a string denotation; a string of one character denotes a
   * CHAR. */
  public Node stringLiteral(String s) {
    return denotation(Attribute.ROW_CHAR_DENOTATION, s, 0);
  }

  public Node boolLiteral(boolean b) {
    return b
        ? denotation(Attribute.TRUE_SYMBOL, "TRUE", 0)
        : denotation(Attribute.FALSE_SYMBOL, "FALSE", 0);
  }

  public Node empty() {
    return denotation(Attribute.EMPTY_SYMBOL, "EMPTY", 0);
  }

  // units

  public Node id(String name) {
    return node(Attribute.IDENTIFIER, name);
  }

  public Node formula(Node left, String operator, Node right) {
    return node(Attribute.FORMULA, null, left,
        node(Attribute.OPERATOR, operator), right);
  }

  public Node monadic(String operator, Node operand) {
    return node(Attribute.MONADIC_FORMULA, null,
        node(Attribute.OPERATOR, operator), operand);
  }

  public Node assign(Node destination, Node source) {
    return node(Attribute.ASSIGNATION, null, destination, source);
  }

  /** Creates "a :=: b", or "a :/=: b" if {@code equal} is false. */
  public Node identityRelation(Node left, boolean equal, Node right) {
    return node(Attribute.IDENTITY_RELATION, equal ? ":=:" : ":/=:", left,
        right);
  }

  public Node andf(Node left, Node right) {
    return node(Attribute.AND_FUNCTION, null, left, right);
  }

  public Node orf(Node left, Node right) {
    return node(Attribute.OR_FUNCTION, null, left, right);
  }

  /** Creates "field OF secondary". */
  public Node select(String field, Node secondary) {
    return node(Attribute.SELECTION, field, secondary);
  }

  /** Creates "primary(a, ...)" or "primary[a, ...]", which the mode checker
   * resolves to a call or a slice. */
  public Node apply(Node primary, Node... arguments) {
    return node(Attribute.SPECIFICATION, null, primary,
        node(Attribute.ARGUMENT_LIST, null, arguments));
  }

  /** Creates a trimmer "l : u"; with no units, an omitted argument. */
  public Node trimmer(Node... units) {
    return node(Attribute.TRIMMER, null, units);
  }

  public Node cast(Node declarer, Node enclosedClause) {
    return node(Attribute.CAST, null, declarer, enclosedClause);
  }

  public Node loc(Node declarer) {
    return node(Attribute.GENERATOR, "LOC", declarer);
  }

  public Node heap(Node declarer) {
    return node(Attribute.GENERATOR, "HEAP", declarer);
  }

  /** Creates a routine text "(parameters) result: body"; the parameters are
   * made by {@link #parameter}. */
  public Node routine(List<Node> parameters, Node result, Node body) {
    final Node node = node(Attribute.ROUTINE_TEXT, null);
    if (!parameters.isEmpty()) {
      node.add(node(Attribute.PARAMETER_PACK, null, parameters));
    }
    return node.add(result).add(body);
  }

  public Node parameter(Node declarer, String name) {
    return node(Attribute.PARAMETER, name, declarer);
  }

  public Node nil() {
    return node(Attribute.NIHIL, "NIL");
  }

  public Node skip() {
    return node(Attribute.SKIP, "SKIP");
  }

  public Node jump(String label) {
    return node(Attribute.JUMP, label);
  }

  public Node assertion(Node enclosedClause) {
    return node(Attribute.ASSERTION, null, enclosedClause);
  }

  // declarations

  /** Creates "MODE indicant = declarer". */
  public Node modeDecl(String indicant, Node declarer) {
    return node(Attribute.MODE_DECLARATION, null,
        node(Attribute.DEFINING_INDICANT, indicant, declarer));
  }

  /** Creates "declarer identifier = source". */
  public Node identityDecl(Node declarer, String identifier, Node source) {
    return node(Attribute.IDENTITY_DECLARATION, null, declarer,
        node(Attribute.DEFINING_IDENTIFIER, identifier, source));
  }

  /** Creates "declarer identifier := source", or "declarer identifier" if
   * {@code source} is null. */
  public Node variableDecl(Node declarer, String identifier,
      @Nullable Node source) {
    final Node defining = node(Attribute.DEFINING_IDENTIFIER, identifier);
    if (source != null) {
      defining.add(source);
    }
    return node(Attribute.VARIABLE_DECLARATION, null, declarer, defining);
  }

  /** Creates "PROC identifier = routine". */
  public Node procedureDecl(String identifier, Node routine) {
    return node(Attribute.PROCEDURE_DECLARATION, null,
        node(Attribute.DEFINING_IDENTIFIER, identifier, routine));
  }

  /** Creates "PROC identifier := routine". */
  public Node procedureVariableDecl(String identifier, Node routine) {
    return node(Attribute.PROCEDURE_VARIABLE_DECLARATION, null,
        node(Attribute.DEFINING_IDENTIFIER, identifier, routine));
  }

  /** Creates "OP plan operator = source". */
  public Node operatorDecl(Node plan, String operator, Node source) {
    return node(Attribute.OPERATOR_DECLARATION, null, plan,
        node(Attribute.DEFINING_OPERATOR, operator, source));
  }

  /** Creates "OP operator = routine". */
  public Node briefOperatorDecl(String operator, Node routine) {
    return node(Attribute.BRIEF_OPERATOR_DECLARATION, null,
        node(Attribute.DEFINING_OPERATOR, operator, routine));
  }

  // declarers

  private static Node declarer(Node body) {
    return node(Attribute.DECLARER, null, body);
  }

  /** Creates a declarer that applies a mode indicant, such as "INT" or
   * "NODE". */
  public Node indicant(String symbol) {
    return indicant(0, symbol);
  }

  /** Creates a declarer such as "LONG REAL"; {@code sizety} is the number of
   * LONGs. */
  public Node indicant(int sizety, String symbol) {
    return declarer(node(Attribute.INDICANT, symbol).setSizety(sizety));
  }

  public Node voidDeclarer() {
    return declarer(node(Attribute.VOID_SYMBOL, "VOID"));
  }

  public Node ref(Node declarer) {
    return declarer(node(Attribute.REF_SYMBOL, "REF", declarer));
  }

  public Node flex(Node declarer) {
    return declarer(node(Attribute.FLEX_SYMBOL, "FLEX", declarer));
  }

  /** Creates a row declarer of {@code dim} dimensions with formal bounds,
   * such as "[,] REAL". */
  public Node row(int dim, Node element) {
    final Node bounds = node(Attribute.BOUNDS, null);
    for (int i = 0; i < dim; i++) {
      bounds.add(node(Attribute.BOUND, null));
    }
    return declarer(bounds.add(element));
  }

  /** Creates a row declarer with actual bounds, such as "[1 : n] INT"; the
   * bounds are made by {@link #bound}. */
  public Node row(List<Node> bounds, Node element) {
    return declarer(node(Attribute.BOUNDS, null, bounds).add(element));
  }

  /** Creates an actual bound "lower : upper", or "upper" if given one
   * unit. */
  public Node bound(Node... units) {
    return node(Attribute.BOUND, null, units);
  }

  /** Creates "STRUCT (...)"; the fields are made by {@link #field}. */
  public Node struct(Node... fields) {
    return declarer(node(Attribute.STRUCT_SYMBOL, "STRUCT", fields));
  }

  public Node field(Node declarer, String name) {
    return node(Attribute.FIELD, name, declarer);
  }

  public Node union(Node... declarers) {
    return declarer(node(Attribute.UNION_SYMBOL, "UNION", declarers));
  }

  /** Creates "PROC (parameters) result". */
  public Node proc(Node result, Node... parameters) {
    final Node body = node(Attribute.PROC_SYMBOL, "PROC", parameters);
    return declarer(body.add(result));
  }
}

// End NodeBuilder.java
