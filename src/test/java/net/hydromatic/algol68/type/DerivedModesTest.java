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
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsInAnyOrder;
import static org.hamcrest.Matchers.greaterThan;
import static org.hamcrest.Matchers.hasSize;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests for {@link DerivedModes}. */
public class DerivedModesTest {
  private final ModeGraph graph = new ModeGraph();
  private final List<Integer> counts = new ArrayList<>();
  private final List<String> errors = new ArrayList<>();

  private final DerivedModes.Listener listener = new DerivedModes.Listener() {
    @Override
    public void onRound(int round, int modeCount) {
      assertThat(round, is(counts.size() + 1));
      counts.add(modeCount);
    }

    @Override
    public void onError(Mode mode, String message) {
      errors.add(message);
    }
  };

  private Mode mode(StandardMode standardMode) {
    return graph.lookup(standardMode);
  }

  private void compute() {
    new DerivedModes(graph, 16, listener).compute();
  }

  @Test
  void testStandardModes() {
    compute();
    assertThat(errors, is(ImmutableList.of()));
    // The last round adds no modes.
    assertThat(counts.size(), greaterThan(1));
    assertThat(counts.get(counts.size() - 1),
        is(counts.get(counts.size() - 2)));
    assertThat(counts.get(counts.size() - 1), is(graph.size()));

    assertThat(mode(StandardMode.STRING).deflex(),
        sameInstance(mode(StandardMode.ROW_CHAR)));
    assertThat(mode(StandardMode.STRING).trim(),
        sameInstance(mode(StandardMode.ROW_CHAR)));
    assertThat(mode(StandardMode.REF_INT).deflex(),
        sameInstance(mode(StandardMode.REF_INT)));
  }

  @Test
  void testNames() {
    final Mode refRowInt = graph.ref(mode(StandardMode.ROW_INT));
    compute();
    // Slicing a name of a row gives a name of an element.
    assertThat(refRowInt.name(), sameInstance(mode(StandardMode.REF_INT)));
    // Selecting from a name of a structure gives names of fields.
    final Mode refReal = mode(StandardMode.REF_REAL);
    assertThat(mode(StandardMode.REF_COMPLEX).name(),
        sameInstance(graph.struct(refReal, "re", refReal, "im")));
    assertThat(mode(StandardMode.REF_COMPLEX).name().toString(),
        is("STRUCT (REF REAL re, REF REAL im)"));
    // A name of a flexible row trims to a name of the fixed row.
    assertThat(mode(StandardMode.REF_STRING).trim(),
        sameInstance(graph.ref(mode(StandardMode.ROW_CHAR))));
  }

  @Test
  void testMultiple() {
    compute();
    // Selecting a field from a row of structures gives a row of fields.
    final Mode rowReal = mode(StandardMode.ROW_REAL);
    assertThat(mode(StandardMode.ROW_COMPLEX).multiple(),
        sameInstance(graph.struct(rowReal, "re", rowReal, "im")));
  }

  @Test
  void testRows() {
    final Mode rowInt = mode(StandardMode.ROW_INT);
    compute();
    // Row synthesis adds a row of one more dimension.
    final Mode rowRowInt = rowInt.rowed();
    assertThat(rowRowInt.is(ModeKind.ROW), is(true));
    assertThat(rowRowInt.dim(), is(2));
    assertThat(rowRowInt.slice(), sameInstance(rowInt));
    assertThat(rowRowInt.toString(), is("[,] INT"));
  }

  @Test
  void testUnionOfOneMode() {
    final Mode intMode = mode(StandardMode.INT);
    graph.union(intMode, intMode);
    compute();
    assertThat(errors,
        is(ImmutableList.of("UNION (INT) must have at least two components")));
  }

  @Test
  void testUnionOfRelatedModes() {
    graph.union(mode(StandardMode.REF_INT), mode(StandardMode.INT));
    compute();
    assertThat(errors,
        is(ImmutableList.of("UNION (REF INT, INT) has firmly related "
            + "components")));
  }

  @Test
  void testNestedUnionIsAbsorbed() {
    final Mode intMode = mode(StandardMode.INT);
    final Mode realMode = mode(StandardMode.REAL);
    final Mode boolMode = mode(StandardMode.BOOL);
    final Mode u = graph.union(graph.union(intMode, realMode), boolMode);
    compute();
    assertThat(errors, is(ImmutableList.of()));
    assertThat(u.resolve().toString(), is("UNION (INT, REAL, BOOL)"));
  }

  /** A union that repeats a member, through a nested union, contracts to
   * two members; absorbing and contracting again changes nothing. */
  @Test
  void testUnionWithRepeatedMember() {
    final Mode intMode = mode(StandardMode.INT);
    final Mode realMode = mode(StandardMode.REAL);
    // UNION (INT, UNION (REAL, INT))
    final Mode u = graph.union(intMode, graph.union(realMode, intMode));
    final DerivedModes derivedModes = new DerivedModes(graph, 16, listener);
    derivedModes.compute();
    assertThat(errors, is(ImmutableList.of()));
    final Mode z = u.resolve();
    assertThat(z.packModes(), hasSize(2));
    assertThat(z.packModes(), containsInAnyOrder(intMode, realMode));

    final List<Mode> before = z.packModes();
    derivedModes.absorbUnions();
    derivedModes.contractUnions();
    assertThat(u.resolve(), sameInstance(z));
    assertThat(z.packModes(), is(before));
  }

  /** Deflexing a deflexed mode gives the same mode. */
  @Test
  void testDeflexIsIdempotent() {
    final Mode intMode = mode(StandardMode.INT);
    final Mode flexRowInt = graph.flex(graph.row(1, intMode));
    // STRUCT (FLEX [] INT a, REF FLEX [] INT b), and a name of it
    final Mode s =
        graph.struct(flexRowInt, "a", graph.ref(flexRowInt), "b");
    graph.ref(s);
    graph.row(1, flexRowInt);
    graph.proc(flexRowInt);
    compute();
    assertThat(errors, is(ImmutableList.of()));

    for (Mode m : graph.modes()) {
      final Mode d = m.deflex();
      assertThat(m.toString(), d.deflex(), sameInstance(d));
    }
    assertThat(flexRowInt.deflex(), sameInstance(mode(StandardMode.ROW_INT)));
  }

  @Test
  void testDuplicateField() {
    graph.struct(mode(StandardMode.INT), "a", mode(StandardMode.REAL), "a");
    compute();
    assertThat(errors,
        is(ImmutableList.of("multiple declaration of field a")));
  }

  @Test
  void testRoundLimit() {
    final DerivedModes derivedModes = new DerivedModes(graph, 1, listener);
    assertThrows(InternalConsistencyException.class, derivedModes::compute);
    assertThat(counts.size(), is(1));
  }
}

// End DerivedModesTest.java
