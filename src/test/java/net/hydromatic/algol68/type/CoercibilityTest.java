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

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import net.hydromatic.algol68.ast.Attribute;
import org.junit.jupiter.api.Test;

/** Tests for {@link Coercibility}. */
public class CoercibilityTest {
  private final ModeGraph graph = new ModeGraph();
  private final Coercibility coercibility = graph.coercibility();

  private Mode mode(StandardMode standardMode) {
    return graph.lookup(standardMode);
  }

  private boolean isCoercible(Mode p, Mode q, Sort sort) {
    return coercibility.isCoercible(p, q, sort, Deflexing.SAFE);
  }

  @Test
  void testWidening() {
    final Mode intMode = mode(StandardMode.INT);
    final Mode realMode = mode(StandardMode.REAL);
    final Mode complex = mode(StandardMode.COMPLEX);
    assertThat(coercibility.widensTo(intMode, realMode),
        sameInstance(realMode));
    // INT widens to COMPLEX via REAL
    assertThat(coercibility.widensTo(intMode, complex),
        sameInstance(realMode));
    assertThat(coercibility.isWidenable(intMode, complex), is(true));
    // INT widens to LONG REAL via LONG INT
    assertThat(coercibility.widensTo(intMode, mode(StandardMode.LONG_REAL)),
        sameInstance(mode(StandardMode.LONG_INT)));
    assertThat(
        coercibility.isWidenable(intMode, mode(StandardMode.LONG_REAL)),
        is(true));
    assertThat(coercibility.widensTo(realMode, intMode), nullValue());
    assertThat(coercibility.isWidenable(realMode, intMode), is(false));
    assertThat(
        coercibility.widensTo(mode(StandardMode.BITS),
            mode(StandardMode.ROW_BOOL)),
        sameInstance(mode(StandardMode.ROW_BOOL)));
    assertThat(
        coercibility.widensTo(mode(StandardMode.BYTES),
            mode(StandardMode.ROW_CHAR)),
        sameInstance(mode(StandardMode.ROW_CHAR)));
  }

  @Test
  void testSorts() {
    final Mode intMode = mode(StandardMode.INT);
    final Mode realMode = mode(StandardMode.REAL);
    final Mode refInt = mode(StandardMode.REF_INT);
    final Mode procInt = graph.proc(intMode);

    // Deproceduring is soft; dereferencing is weak.
    assertThat(isCoercible(procInt, intMode, Sort.SOFT), is(true));
    assertThat(isCoercible(refInt, intMode, Sort.SOFT), is(false));
    assertThat(isCoercible(refInt, intMode, Sort.WEAK), is(true));

    // A name of a row is not dereferenced in a weak context, because a
    // slice needs the name.
    final Mode refRowInt = graph.ref(mode(StandardMode.ROW_INT));
    assertThat(isCoercible(refRowInt, mode(StandardMode.ROW_INT), Sort.WEAK),
        is(false));
    assertThat(isCoercible(refRowInt, mode(StandardMode.ROW_INT), Sort.MEEK),
        is(true));

    // Uniting is firm; widening and rowing are strong.
    final Mode u = graph.union(intMode, mode(StandardMode.BOOL));
    assertThat(isCoercible(intMode, u, Sort.MEEK), is(false));
    assertThat(isCoercible(intMode, u, Sort.FIRM), is(true));
    assertThat(isCoercible(refInt, u, Sort.FIRM), is(true));
    assertThat(isCoercible(intMode, realMode, Sort.FIRM), is(false));
    assertThat(isCoercible(intMode, realMode, Sort.STRONG), is(true));
    assertThat(isCoercible(intMode, mode(StandardMode.ROW_INT), Sort.STRONG),
        is(true));
    assertThat(isCoercible(realMode, intMode, Sort.STRONG), is(false));

    // Anything can be voided in a strong context.
    assertThat(isCoercible(refInt, mode(StandardMode.VOID), Sort.STRONG),
        is(true));
    assertThat(isCoercible(refInt, mode(StandardMode.VOID), Sort.FIRM),
        is(false));
  }

  @Test
  void testSpecialModes() {
    final Mode refInt = mode(StandardMode.REF_INT);
    final Mode error = mode(StandardMode.ERROR);
    // A construct in error is coercible to and from anything, so that one
    // error does not cause another.
    assertThat(isCoercible(error, refInt, Sort.NO_SORT), is(true));
    assertThat(isCoercible(refInt, error, Sort.NO_SORT), is(true));
    assertThat(coercibility.isNotWell(error), is(true));
    assertThat(coercibility.isNotWell(graph.union(error, refInt)), is(true));
    assertThat(coercibility.isWell(refInt), is(true));

    // NIL and SKIP are coercible to anything.
    assertThat(isCoercible(mode(StandardMode.HIP), refInt, Sort.STRONG),
        is(true));
    // An empty display is coercible to any row.
    assertThat(
        isCoercible(mode(StandardMode.VACUUM), mode(StandardMode.ROW_INT),
            Sort.STRONG),
        is(true));
    assertThat(isCoercible(mode(StandardMode.VACUUM), refInt, Sort.STRONG),
        is(false));
  }

  @Test
  void testDepreffing() {
    final Mode intMode = mode(StandardMode.INT);
    final Mode refInt = mode(StandardMode.REF_INT);
    final Mode procRefInt = graph.proc(refInt);
    assertThat(coercibility.isDeprefable(procRefInt), is(true));
    assertThat(coercibility.deprefOnce(procRefInt), sameInstance(refInt));
    assertThat(coercibility.deprefCompletely(procRefInt),
        sameInstance(intMode));
    assertThat(coercibility.deprocCompletely(procRefInt),
        sameInstance(refInt));
    assertThat(coercibility.deprefOnce(intMode), nullValue());
    assertThat(coercibility.isNonproc(graph.ref(procRefInt)), is(false));
    assertThat(coercibility.isNonproc(refInt), is(true));

    // A name of a flexible row dereferences to the fixed row.
    final Mode refString = mode(StandardMode.REF_STRING);
    assertThat(coercibility.deprefOnce(refString),
        sameInstance(mode(StandardMode.ROW_CHAR)));

    assertThat(
        coercibility.derow(graph.row(2, mode(StandardMode.STRING))),
        sameInstance(mode(StandardMode.CHAR)));
    assertThat(
        coercibility.deprefRows(refInt, mode(StandardMode.ROWS)),
        sameInstance(intMode));
  }

  @Test
  void testFirm() {
    final Mode intMode = mode(StandardMode.INT);
    final Mode realMode = mode(StandardMode.REAL);
    assertThat(coercibility.isFirm(mode(StandardMode.REF_INT), intMode),
        is(true));
    assertThat(coercibility.isFirm(intMode, mode(StandardMode.REF_INT)),
        is(true));
    assertThat(coercibility.isFirm(intMode, realMode), is(false));
    assertThat(coercibility.isFirm(graph.proc(realMode), realMode),
        is(true));
  }

  @Test
  void testBalancing() {
    final Mode intMode = mode(StandardMode.INT);
    final Mode realMode = mode(StandardMode.REAL);
    final Mode series = coercibility.makeSeries(intMode, realMode);
    assertThat(series.is(ModeKind.SERIES), is(true));
    assertThat(series.toString(), is("(INT, REAL)"));

    final Mode united = coercibility.makeUnitedMode(series);
    assertThat(united, sameInstance(graph.union(intMode, realMode)));
    assertThat(coercibility.getBalancedMode(united, Sort.STRONG, false,
            Deflexing.SAFE),
        sameInstance(realMode));
    assertThat(
        coercibility.determineUniqueMode(series, Attribute.CONDITIONAL_CLAUSE,
            Deflexing.SAFE),
        sameInstance(realMode));
    // A collateral clause does not balance.
    assertThat(
        coercibility.determineUniqueMode(series,
            Attribute.COLLATERAL_CLAUSE, Deflexing.SAFE),
        sameInstance(united));

    // INT and BOOL have no common mode.
    final Mode boolMode = mode(StandardMode.BOOL);
    final Mode u = graph.union(intMode, boolMode);
    assertThat(
        coercibility.getBalancedMode(u, Sort.STRONG, false, Deflexing.SAFE),
        sameInstance(u));

    // A series whose modes are all the same unites to that mode.
    assertThat(
        coercibility.makeUnitedMode(
            coercibility.makeSeries(intMode, intMode)),
        sameInstance(intMode));
    assertThat(coercibility.isCoercibleSeries(series, realMode, Sort.STRONG,
            Deflexing.SAFE),
        is(true));
    assertThat(coercibility.isCoercibleSeries(series, intMode, Sort.STRONG,
            Deflexing.SAFE),
        is(false));
  }

  @Test
  void testUnion() {
    final Mode intMode = mode(StandardMode.INT);
    final Mode realMode = mode(StandardMode.REAL);
    final Mode boolMode = mode(StandardMode.BOOL);
    final Mode ir = graph.union(intMode, realMode);
    final Mode irb = graph.union(intMode, realMode, boolMode);
    assertThat(coercibility.isSubset(ir, irb, Deflexing.SAFE), is(true));
    assertThat(coercibility.isSubset(irb, ir, Deflexing.SAFE), is(false));
    assertThat(coercibility.isUnitable(ir, irb, Deflexing.SAFE), is(true));
    assertThat(coercibility.isUnitable(boolMode, ir, Deflexing.SAFE),
        is(false));
    assertThat(coercibility.unitesTo(realMode, irb), sameInstance(realMode));
    assertThat(coercibility.unitesTo(mode(StandardMode.CHAR), irb),
        nullValue());
  }
}

// End CoercibilityTest.java
