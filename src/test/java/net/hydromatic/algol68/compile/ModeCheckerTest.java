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

import static net.hydromatic.algol68.A68.a68;
import static net.hydromatic.algol68.ast.NodeBuilder.tree;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.algol68.A68;
import net.hydromatic.algol68.ast.Attribute;
import net.hydromatic.algol68.ast.Node;
import net.hydromatic.algol68.type.Mode;
import net.hydromatic.algol68.type.ModeGraph;
import net.hydromatic.algol68.type.StandardMode;
import org.junit.jupiter.api.Test;

/** Tests for {@link ModeCollector} and {@link ModeChecker}. */
public class ModeCheckerTest {
  private static Node program(Node... phrases) {
    return tree.program(tree.closed(phrases));
  }

  private static Node intDeclarer() {
    return tree.indicant("INT");
  }

  private static Node realDeclarer() {
    return tree.indicant("REAL");
  }

  @Test
  void testValidDeclarations() {
    final Node program =
        program(tree.identityDecl(realDeclarer(), "x", tree.intLiteral(1)),
            tree.variableDecl(intDeclarer(), "i", tree.intLiteral(2)),
            tree.identityDecl(intDeclarer(), "j", tree.id("i")),
            tree.skip());
    a68(program)
        .assertNoErrors()
        .assertWarnings()
        .withNode(n -> n.is(Attribute.DEFINING_IDENTIFIER)
                && "i".equals(n.symbol()),
            n -> assertThat(n.mode().toString(), is("REF INT")));
  }

  @Test
  void testUndeclaredIdentifier() {
    // The second use of "y" is not reported again.
    a68(program(tree.id("y"), tree.id("y"), tree.skip()))
        .assertErrors("tag y has not been declared properly")
        .assertValid(false);
  }

  @Test
  void testUndeclaredOperand() {
    // "y + 1" reports the identifier only, and the formula yields ERROR.
    final A68 a68 =
        a68(program(tree.formula(tree.id("y"), "+", tree.intLiteral(1)),
            tree.skip()))
            .assertErrors("tag y has not been declared properly")
            .assertValid(false);
    final Mode error = a68.context().mode(StandardMode.ERROR);
    a68.withNode(n -> n.is(Attribute.FORMULA),
        n -> assertThat(n.mode(), sameInstance(error)));
  }

  @Test
  void testUndeclaredIndicant() {
    a68(program(tree.identityDecl(tree.indicant("FOO"), "f", tree.skip()),
            tree.skip()))
        .assertErrors("tag FOO has not been declared properly")
        .assertValid(false);
  }

  @Test
  void testModeDeclarations() {
    // MODE LIST = STRUCT (INT i, REF LIST next); LIST l; SKIP
    final Node list =
        program(
            tree.modeDecl("LIST",
                tree.struct(tree.field(intDeclarer(), "i"),
                    tree.field(tree.ref(tree.indicant("LIST")), "next"))),
            tree.variableDecl(tree.indicant("LIST"), "l", null),
            tree.skip());
    a68(list).assertNoErrors();

    // MODE A = STRUCT (INT i, A a) contains itself
    final Node a =
        program(
            tree.modeDecl("A",
                tree.struct(tree.field(intDeclarer(), "i"),
                    tree.field(tree.indicant("A"), "a"))),
            tree.skip());
    a68(a).assertErrors("A does not specify a well formed mode")
        .assertValid(false);

    // MODE A = A
    a68(program(tree.modeDecl("A", tree.indicant("A")), tree.skip()))
        .assertErrors("A does not specify a well formed mode")
        .assertValid(false);
  }

  /** A mode reached through two indicants is equivalent to the same mode
   * written out. */
  @Test
  void testModeThroughIndicants() {
    // MODE CPLX = STRUCT (REAL re, im); MODE REFCPLX = REF CPLX;
    // REF STRUCT (REAL re, REAL im) z = LOC CPLX
    final Node program =
        program(
            tree.modeDecl("CPLX",
                tree.struct(tree.field(realDeclarer(), "re"),
                    tree.field(realDeclarer(), "im"))),
            tree.modeDecl("REFCPLX", tree.ref(tree.indicant("CPLX"))),
            tree.identityDecl(
                tree.ref(
                    tree.struct(tree.field(realDeclarer(), "re"),
                        tree.field(realDeclarer(), "im"))),
                "z", tree.loc(tree.indicant("CPLX"))),
            tree.skip());
    final A68 a68 = a68(program).assertNoErrors();
    final ModeGraph graph = a68.context().graph();
    final List<Mode> modes = new ArrayList<>();
    a68.withNode(n -> n.is(Attribute.DEFINING_INDICANT)
            && "REFCPLX".equals(n.symbol()),
        n -> modes.add(n.child(0).mode()));
    a68.withNode(n -> n.is(Attribute.IDENTITY_DECLARATION),
        n -> modes.add(n.child(0).mode()));
    assertThat(modes, hasSize(2));
    assertThat(graph.equivalence().prove(modes.get(0), modes.get(1)),
        is(true));
    assertThat(modes.get(0).resolve(), sameInstance(modes.get(1).resolve()));
    assertThat(modes.get(0).resolve(),
        sameInstance(graph.lookup(StandardMode.REF_COMPLEX)));
  }

  @Test
  void testUnionOfOneMode() {
    final Node program =
        program(
            tree.identityDecl(tree.union(intDeclarer(), intDeclarer()), "u",
                tree.intLiteral(1)),
            tree.skip());
    a68(program)
        .assertErrors("UNION (INT) must have at least two components")
        .assertValid(false);
  }

  @Test
  void testCannotCoerce() {
    a68(program(tree.identityDecl(intDeclarer(), "i", tree.realLiteral("2.0")),
            tree.skip()))
        .assertErrors("REAL cannot be coerced to INT in strong context");

    a68(program(tree.variableDecl(intDeclarer(), "i", null),
            tree.assign(tree.id("i"), tree.realLiteral("2.0")),
            tree.skip()))
        .assertErrors("REAL cannot be coerced to INT in strong context");
  }

  @Test
  void testEnquiryMustBeBool() {
    a68(program(tree.conditional(tree.intLiteral(1), tree.skip(), null)))
        .assertErrors("INT cannot be coerced to BOOL in meek-enquiry clause");
  }

  @Test
  void testVoiding() {
    a68(program(tree.intLiteral(1), tree.skip()))
        .assertNoErrors()
        .assertWarnings("value of INT denotation will be voided");
    a68(program(tree.identityDecl(realDeclarer(), "x", tree.intLiteral(1)),
            tree.id("x")))
        .assertNoErrors()
        .assertWarnings("value of REAL identifier will be voided");
    a68(program(tree.intLiteral(1), tree.skip()))
        .with(Prop.WARNINGS, false)
        .assertWarnings();
  }

  @Test
  void testFormula() {
    // REAL r = IF TRUE THEN 1 ELSE 2.0 FI + 1
    final Node program =
        program(
            tree.identityDecl(realDeclarer(), "r",
                tree.formula(
                    tree.conditional(tree.boolLiteral(true),
                        tree.intLiteral(1), tree.realLiteral("2.0")),
                    "+", tree.intLiteral(1))),
            tree.skip());
    a68(program)
        .assertNoErrors()
        .withNode(n -> n.is(Attribute.OPERATOR),
            n -> {
              assertThat(n.tag(), notNullValue());
              assertThat(n.mode().toString(), is("PROC (REAL, INT) REAL"));
            });
  }

  @Test
  void testOperatorNotDeclared() {
    a68(program(tree.formula(tree.boolLiteral(true), "+", tree.intLiteral(1)),
            tree.skip()))
        .assertErrors("dyadic operator BOOL + INT has not been declared");
    a68(program(tree.monadic("NOT", tree.intLiteral(1)), tree.skip()))
        .assertErrors("monadic operator NOT INT has not been declared");
  }

  @Test
  void testAssignationNeedsName() {
    a68(program(tree.assign(tree.intLiteral(1), tree.intLiteral(2)),
            tree.skip()))
        .assertErrors("INT denotation does not yield a name");
  }

  @Test
  void testIdentityRelation() {
    // REF INT ri = LOC INT; BOOL b = ri :=: NIL
    final Node program =
        program(
            tree.identityDecl(tree.ref(intDeclarer()), "ri",
                tree.loc(intDeclarer())),
            tree.identityDecl(tree.indicant("BOOL"), "b",
                tree.identityRelation(tree.id("ri"), true, tree.nil())),
            tree.skip());
    a68(program)
        .assertNoErrors()
        .withNode(n -> n.is(Attribute.NIHIL),
            n -> assertThat(n.requiredMode().toString(), is("REF INT")));

    a68(program(tree.identityRelation(tree.intLiteral(1), false,
                tree.intLiteral(2)),
            tree.skip()))
        .assertErrors("INT denotation does not yield a name",
            "INT denotation does not yield a name");
  }

  @Test
  void testCall() {
    // PROC f = (INT n) REAL: n; REAL y = f(1)
    final Node f =
        tree.procedureDecl("f",
            tree.routine(
                ImmutableList.of(tree.parameter(intDeclarer(), "n")),
                realDeclarer(), tree.id("n")));
    final Node program =
        program(f,
            tree.identityDecl(realDeclarer(), "y",
                tree.apply(tree.id("f"), tree.intLiteral(1))),
            tree.skip());
    a68(program)
        .assertNoErrors()
        .withNode(n -> n.is(Attribute.CALL),
            n -> assertThat(n.mode().toString(), is("REAL")));
  }

  @Test
  void testCallWithWrongArguments() {
    final Node program =
        program(
            tree.procedureDecl("f",
                tree.routine(
                    ImmutableList.of(tree.parameter(intDeclarer(), "n")),
                    realDeclarer(), tree.id("n"))),
            tree.identityDecl(realDeclarer(), "y",
                tree.apply(tree.id("f"), tree.intLiteral(1),
                    tree.intLiteral(2))),
            tree.skip());
    a68(program)
        .assertErrors("incorrect number of arguments for PROC (INT) REAL");
  }

  @Test
  void testSlice() {
    // [] INT a = (1, 2); INT e = a[1]
    final Node program =
        program(
            tree.identityDecl(tree.row(1, intDeclarer()), "a",
                tree.collateral(tree.intLiteral(1), tree.intLiteral(2))),
            tree.identityDecl(intDeclarer(), "e",
                tree.apply(tree.id("a"), tree.intLiteral(1))),
            tree.skip());
    a68(program)
        .assertNoErrors()
        .withNode(n -> n.is(Attribute.SLICE),
            n -> assertThat(n.mode().toString(), is("INT")));

    final Node wrong =
        program(
            tree.identityDecl(tree.row(1, intDeclarer()), "a",
                tree.collateral(tree.intLiteral(1), tree.intLiteral(2))),
            tree.identityDecl(intDeclarer(), "e",
                tree.apply(tree.id("a"), tree.intLiteral(1),
                    tree.intLiteral(2))),
            tree.skip());
    a68(wrong).assertErrors("incorrect number of indexers for [] INT");
  }

  @Test
  void testSliceOfName() {
    // [3] INT v; v[1] := 5
    final Node program =
        program(
            tree.variableDecl(
                tree.row(ImmutableList.of(tree.bound(tree.intLiteral(3))),
                    intDeclarer()),
                "v", null),
            tree.assign(tree.apply(tree.id("v"), tree.intLiteral(1)),
                tree.intLiteral(5)),
            tree.skip());
    a68(program)
        .assertNoErrors()
        .withNode(n -> n.is(Attribute.SLICE),
            n -> assertThat(n.mode().toString(), is("REF INT")));
  }

  @Test
  void testSelection() {
    // COMPLEX z; REAL r = re OF z
    final Node program =
        program(tree.variableDecl(tree.indicant("COMPLEX"), "z", null),
            tree.identityDecl(realDeclarer(), "r",
                tree.select("re", tree.id("z"))),
            tree.skip());
    a68(program)
        .assertNoErrors()
        .withNode(n -> n.is(Attribute.SELECTION),
            n -> assertThat(n.mode().toString(), is("REF REAL")));

    final Node wrong =
        program(tree.variableDecl(tree.indicant("COMPLEX"), "z", null),
            tree.identityDecl(realDeclarer(), "r",
                tree.select("rho", tree.id("z"))),
            tree.skip());
    a68(wrong).assertErrors("COMPLEX has no field rho");
  }

  @Test
  void testConformity() {
    // UNION (INT, REAL) u = 1;
    // INT k = CASE u IN (INT i): i, (REAL): 0 ESAC
    final Node program =
        program(
            tree.identityDecl(tree.union(intDeclarer(), realDeclarer()), "u",
                tree.intLiteral(1)),
            tree.identityDecl(intDeclarer(), "k",
                tree.conformity(tree.id("u"),
                    ImmutableList.of(
                        tree.specified(intDeclarer(), "i", tree.id("i")),
                        tree.specified(realDeclarer(), null,
                            tree.intLiteral(0))),
                    null)),
            tree.skip());
    final A68 a68 = a68(program).assertNoErrors();
    final ModeContext context = a68.context();
    a68.withNode(n -> n.is(Attribute.ENQUIRY_CLAUSE),
        n -> assertThat(n.requiredMode(),
            sameInstance(
                context.graph().union(context.mode(StandardMode.INT),
                    context.mode(StandardMode.REAL)))));
  }

  @Test
  void testConformityErrors() {
    final Node notMember =
        program(
            tree.identityDecl(tree.union(intDeclarer(), realDeclarer()), "u",
                tree.intLiteral(1)),
            tree.identityDecl(intDeclarer(), "k",
                tree.conformity(tree.id("u"),
                    ImmutableList.of(
                        tree.specified(intDeclarer(), "i", tree.id("i")),
                        tree.specified(tree.indicant("BOOL"), null,
                            tree.intLiteral(0))),
                    null)),
            tree.skip());
    a68(notMember)
        .assertErrors("BOOL is neither component nor subset of "
            + "UNION (INT, REAL)");

    final Node notUnited =
        program(
            tree.conformity(tree.intLiteral(1),
                ImmutableList.of(
                    tree.specified(intDeclarer(), "i", tree.skip())),
                null),
            tree.skip());
    a68(notUnited).assertErrors("INT is not a united mode");
  }

  @Test
  void testLoop() {
    // INT sum := 0; FOR i FROM 1 TO 10 DO sum := sum + i OD
    final Node program =
        program(tree.variableDecl(intDeclarer(), "sum", tree.intLiteral(0)),
            tree.loop("i", tree.intLiteral(1), null, tree.intLiteral(10),
                null,
                tree.assign(tree.id("sum"),
                    tree.formula(tree.id("sum"), "+", tree.id("i")))));
    a68(program).assertNoErrors().assertWarnings();
  }
}

// End ModeCheckerTest.java
