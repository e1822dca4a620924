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

/**
 * Kinds of {@link Node}.
 *
 * <p>The shape of each kind of node (which children it has, in which order) is
 * described on the constant. Units are the phrases that yield a value and may
 * be coerced; coercions are the markers that the coercion inserter wraps
 * around units.
 */
public enum Attribute {
  // program and enclosed clauses

  /** Program; one child, an enclosed clause. */
  PARTICULAR_PROGRAM(Category.OTHER),
  /** "( serial )"; one child, a {@link #SERIAL_CLAUSE}. */
  CLOSED_CLAUSE(Category.UNIT),
  /** Declarations and units; the last unit yields the value. */
  SERIAL_CLAUSE(Category.OTHER),
  /** "(u1, u2, ...)"; children are units; no children is a vacuum. */
  COLLATERAL_CLAUSE(Category.UNIT),
  /**
   * "IF e THEN s [ELSE s | ELIF ...] FI"; children are {@link #ENQUIRY_CLAUSE},
   * {@link #THEN_PART}, and optionally {@link #ELSE_PART} or {@link
   * #ELIF_PART}.
   */
  CONDITIONAL_CLAUSE(Category.UNIT),
  /** Same children as {@link #CONDITIONAL_CLAUSE}. */
  ELIF_PART(Category.OTHER),
  /**
   * "CASE e IN u1, u2 [OUT s | OUSE ...] ESAC"; children are {@link
   * #ENQUIRY_CLAUSE}, {@link #IN_PART}, and optionally {@link #OUT_PART} or
   * {@link #OUSE_PART}.
   */
  CASE_CLAUSE(Category.UNIT),
  /** Same children as {@link #CASE_CLAUSE}. */
  OUSE_PART(Category.OTHER),
  /**
   * "CASE e IN (M x): u, ... ESAC"; like {@link #CASE_CLAUSE} but the {@link
   * #IN_PART} holds {@link #SPECIFIED_UNIT}s, and the optional {@link
   * #CONFORMITY_OUSE_PART} has the same children as this.
   */
  CONFORMITY_CLAUSE(Category.UNIT),
  CONFORMITY_OUSE_PART(Category.OTHER),
  /** Children are declarations and units, like {@link #SERIAL_CLAUSE}. */
  ENQUIRY_CLAUSE(Category.OTHER),
  THEN_PART(Category.OTHER),
  ELSE_PART(Category.OTHER),
  /** Children are units. */
  IN_PART(Category.OTHER),
  OUT_PART(Category.OTHER),
  /** Children are a {@link #SPECIFIER} and a unit. */
  SPECIFIED_UNIT(Category.OTHER),
  /** One child, a {@link #DECLARER}; symbol is the optional identifier. */
  SPECIFIER(Category.OTHER),
  /**
   * "FOR i FROM f BY b TO t WHILE w DO d UNTIL u OD"; every part but {@link
   * #DO_PART} is optional, and they occur in that order.
   */
  LOOP_CLAUSE(Category.UNIT),
  /** Symbol is the loop identifier. */
  FOR_PART(Category.OTHER),
  /** One child, a unit. */
  FROM_PART(Category.OTHER),
  BY_PART(Category.OTHER),
  TO_PART(Category.OTHER),
  /** Children are declarations and units. */
  WHILE_PART(Category.OTHER),
  DO_PART(Category.OTHER),
  UNTIL_PART(Category.OTHER),

  // units

  /** One child, a denotation leaf; sizety counts LONG (or SHORT, negative). */
  DENOTATION(Category.UNIT),
  INT_DENOTATION(Category.OTHER),
  REAL_DENOTATION(Category.OTHER),
  BITS_DENOTATION(Category.OTHER),
  ROW_CHAR_DENOTATION(Category.OTHER),
  TRUE_SYMBOL(Category.OTHER),
  FALSE_SYMBOL(Category.OTHER),
  EMPTY_SYMBOL(Category.OTHER),
  /** Applied identifier; symbol is the name. */
  IDENTIFIER(Category.UNIT),
  /** Children are operand, {@link #OPERATOR}, operand. */
  FORMULA(Category.UNIT),
  /** Children are {@link #OPERATOR}, operand. */
  MONADIC_FORMULA(Category.UNIT),
  /** Applied operator; symbol is the name. */
  OPERATOR(Category.OTHER),
  /** Children are destination and source. */
  ASSIGNATION(Category.UNIT),
  /** Children are two units; symbol is ":=:" or ":/=:". */
  IDENTITY_RELATION(Category.UNIT),
  /** "a ANDF b"; children are two units. */
  AND_FUNCTION(Category.UNIT),
  /** "a ORF b"; children are two units. */
  OR_FUNCTION(Category.UNIT),
  /** "f OF s"; symbol is the field, one child is the secondary. */
  SELECTION(Category.UNIT),
  /**
   * "p[...]" or "p(...)"; children are the primary and an {@link
   * #ARGUMENT_LIST}. The mode checker turns it into a {@link #CALL} or a
   * {@link #SLICE}.
   */
  SPECIFICATION(Category.UNIT),
  CALL(Category.UNIT),
  SLICE(Category.UNIT),
  /** Children are units or {@link #TRIMMER}s. */
  ARGUMENT_LIST(Category.OTHER),
  /**
   * "l : u @ a" in a slice, or an omitted argument in a call; children are the
   * units that are present.
   */
  TRIMMER(Category.OTHER),
  /** Children are a {@link #DECLARER} and an enclosed clause. */
  CAST(Category.UNIT),
  /** "LOC M" or "HEAP M"; one child, a {@link #DECLARER}. */
  GENERATOR(Category.UNIT),
  /**
   * Children are an optional {@link #PARAMETER_PACK}, the result {@link
   * #DECLARER}, and the body unit.
   */
  ROUTINE_TEXT(Category.UNIT),
  /** Children are {@link #PARAMETER}s. */
  PARAMETER_PACK(Category.OTHER),
  /** Symbol is the parameter name; one child, a {@link #DECLARER}. */
  PARAMETER(Category.OTHER),
  /** "NIL". */
  NIHIL(Category.UNIT),
  SKIP(Category.UNIT),
  /** "GOTO l"; symbol is the label. */
  JUMP(Category.UNIT),
  /** "ASSERT (b)"; one child, an enclosed clause. */
  ASSERTION(Category.UNIT),

  // declarations

  /** Children are {@link #DEFINING_INDICANT}s. */
  MODE_DECLARATION(Category.DECLARATION),
  /** Symbol is the indicant; one child, a {@link #DECLARER}. */
  DEFINING_INDICANT(Category.OTHER),
  /**
   * Children are a {@link #DECLARER} and {@link #DEFINING_IDENTIFIER}s, each
   * holding its source unit.
   */
  IDENTITY_DECLARATION(Category.DECLARATION),
  /**
   * Children are a {@link #DECLARER} and {@link #DEFINING_IDENTIFIER}s, each
   * holding an optional initial unit.
   */
  VARIABLE_DECLARATION(Category.DECLARATION),
  /** Children are {@link #DEFINING_IDENTIFIER}s holding a routine text. */
  PROCEDURE_DECLARATION(Category.DECLARATION),
  PROCEDURE_VARIABLE_DECLARATION(Category.DECLARATION),
  /**
   * Children are a {@link #DECLARER} (a PROC plan) and {@link
   * #DEFINING_OPERATOR}s, each holding its source unit.
   */
  OPERATOR_DECLARATION(Category.DECLARATION),
  /** Children are {@link #DEFINING_OPERATOR}s holding a routine text. */
  BRIEF_OPERATOR_DECLARATION(Category.DECLARATION),
  /** Symbol is the name; children are the optional source unit. */
  DEFINING_IDENTIFIER(Category.OTHER),
  DEFINING_OPERATOR(Category.OTHER),

  // declarers

  /** One child: one of the declarer kinds below. */
  DECLARER(Category.OTHER),
  /** Symbol is the mode indicant; sizety counts LONG. */
  INDICANT(Category.OTHER),
  VOID_SYMBOL(Category.OTHER),
  /** One child, a {@link #DECLARER}. */
  REF_SYMBOL(Category.OTHER),
  FLEX_SYMBOL(Category.OTHER),
  /** Children are {@link #BOUND}s followed by the element {@link #DECLARER}. */
  BOUNDS(Category.OTHER),
  /** Children are zero (formal), one or two units. */
  BOUND(Category.OTHER),
  /** Children are {@link #FIELD}s. */
  STRUCT_SYMBOL(Category.OTHER),
  /** Symbol is the field name; one child, a {@link #DECLARER}. */
  FIELD(Category.OTHER),
  /** Children are {@link #DECLARER}s. */
  UNION_SYMBOL(Category.OTHER),
  /** Children are parameter {@link #DECLARER}s then the result declarer. */
  PROC_SYMBOL(Category.OTHER),

  // coercions

  DEREFERENCING(Category.COERCION),
  DEPROCEDURING(Category.COERCION),
  UNITING(Category.COERCION),
  WIDENING(Category.COERCION),
  ROWING(Category.COERCION),
  VOIDING(Category.COERCION),
  PROCEDURING(Category.COERCION);

  private final Category category;

  Attribute(Category category) {
    this.category = category;
  }

  /** Whether this kind of node yields a value and may be coerced. */
  public boolean isUnit() {
    return category == Category.UNIT || category == Category.COERCION;
  }

  public boolean isDeclaration() {
    return category == Category.DECLARATION;
  }

  public boolean isCoercion() {
    return category == Category.COERCION;
  }

  /** Coarse classification of attributes. */
  private enum Category {
    UNIT,
    DECLARATION,
    COERCION,
    OTHER
  }
}

// End Attribute.java
