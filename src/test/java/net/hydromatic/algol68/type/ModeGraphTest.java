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
import static org.hamcrest.CoreMatchers.not;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;

import java.util.List;
import net.hydromatic.algol68.ast.Attribute;
import net.hydromatic.algol68.ast.Node;
import net.hydromatic.algol68.ast.Pos;
import org.junit.jupiter.api.Test;

/** Tests for {@link ModeGraph}, {@link Equivalence} and
 * {@link ModeDescriber}. */
public class ModeGraphTest {
  private final ModeGraph graph = new ModeGraph();
  private final Mode intMode = graph.lookup(StandardMode.INT);
  private final Mode realMode = graph.lookup(StandardMode.REAL);
  private final Mode boolMode = graph.lookup(StandardMode.BOOL);

  private static Node definingIndicant(String name) {
    return new Node(Pos.ZERO, Attribute.DEFINING_INDICANT, name);
  }

  @Test
  void testInternReturnsExistingMode() {
    final Mode refInt = graph.ref(intMode);
    assertThat(refInt, sameInstance(graph.lookup(StandardMode.REF_INT)));
    assertThat(graph.ref(intMode), sameInstance(refInt));

    final int size = graph.size();
    final Mode u = graph.union(intMode, boolMode);
    assertThat(graph.size(), is(size + 1));
    // Order of union members does not matter.
    assertThat(graph.union(boolMode, intMode), sameInstance(u));
    assertThat(graph.size(), is(size + 1));

    // Field names are significant.
    final Mode s1 = graph.struct(intMode, "i", boolMode, "b");
    final Mode s2 = graph.struct(intMode, "j", boolMode, "b");
    assertThat(s1, not(sameInstance(s2)));
    assertThat(graph.struct(intMode, "i", boolMode, "b"), sameInstance(s1));

    // Parameter order is significant.
    final Mode p1 = graph.proc(boolMode, intMode, realMode);
    final Mode p2 = graph.proc(boolMode, realMode, intMode);
    assertThat(p1, not(sameInstance(p2)));
  }

  @Test
  void testStandardModes() {
    final Mode complex = graph.struct(realMode, "re", realMode, "im");
    assertThat(complex, sameInstance(graph.lookup(StandardMode.COMPLEX)));
    assertThat(complex, sameInstance(graph.lookup(StandardMode.COMPL)));
    assertThat(graph.isStandard(complex), is(true));
    assertThat(complex.toString(), is("COMPLEX"));

    final Mode string = graph.flex(graph.row(1, graph.lookup(StandardMode.CHAR)));
    assertThat(string, sameInstance(graph.lookup(StandardMode.STRING)));
    assertThat(string.toString(), is("STRING"));
    assertThat(graph.is(string, StandardMode.FLEX_ROW_CHAR), is(true));

    assertThat(graph.searchStandard(0, "INT"), sameInstance(intMode));
    assertThat(graph.searchStandard(1, "REAL"),
        sameInstance(graph.lookup(StandardMode.LONG_REAL)));
    // There is no LONG LONG LONG INT, so the precision is reduced.
    assertThat(graph.searchStandard(3, "INT"),
        sameInstance(graph.lookup(StandardMode.LONG_LONG_INT)));
    assertThat(graph.searchStandard(-1, "INT"), sameInstance(intMode));
    assertThat(graph.searchStandard(1, "CHAR"), sameInstance(
        graph.lookup(StandardMode.CHAR)));
    assertThat(graph.searchStandard(0, "FOO"), nullValue());
    // Internal modes cannot be named.
    assertThat(graph.searchStandard(0, "HIP"), nullValue());
  }

  @Test
  void testDescribe() {
    assertThat(ModeDescriber.describe(graph.ref(intMode)), is("REF INT"));
    assertThat(graph.row(2, realMode).toString(), is("[,] REAL"));
    assertThat(graph.lookup(StandardMode.LONG_LONG_REAL).toString(),
        is("LONG LONG REAL"));
    assertThat(graph.lookup(StandardMode.LONG_COMPLEX).toString(),
        is("LONG COMPLEX"));
    assertThat(graph.struct(intMode, "i", boolMode, "b").toString(),
        is("STRUCT (INT i, BOOL b)"));
    assertThat(graph.union(intMode, realMode).toString(),
        is("UNION (INT, REAL)"));
    assertThat(graph.proc(boolMode, intMode).toString(), is("PROC (INT) BOOL"));
    assertThat(graph.lookup(StandardMode.PROC_VOID).toString(),
        is("PROC VOID"));
    assertThat(ModeDescriber.sizetyPrefix(2), is("LONG LONG "));
    assertThat(ModeDescriber.sizetyPrefix(-1), is("SHORT "));
  }

  /** Two recursive modes with the same structure are equivalent, although
   * they are declared by different indicants. */
  @Test
  void testRecursiveModesAreEquivalent() {
    final Mode a = graph.indicant(definingIndicant("A"));
    final Mode b = graph.indicant(definingIndicant("B"));
    assertThat(a, not(sameInstance(b)));

    final Mode sa = graph.struct(intMode, "i", graph.ref(a), "next");
    final Mode sb = graph.struct(intMode, "i", graph.ref(b), "next");
    assertThat(sa, not(sameInstance(sb)));
    graph.declare(a, sa);
    graph.declare(b, sb);
    assertThat(a.resolve(), sameInstance(sa));
    assertThat(sa.toString(), is("STRUCT (INT i, REF A next)"));

    final Equivalence equivalence = graph.equivalence();
    assertThat(equivalence.areEquivalent(a, b), is(true));
    assertThat(equivalence.prove(sa, sb), is(true));
    // A proof leaves no postulates behind.
    assertThat(graph.postulates().mark(), is(0));

    final Mode sc = graph.struct(boolMode, "i", graph.ref(a), "next");
    assertThat(equivalence.prove(sa, sc), is(false));

    assertThat(equivalence.proveAndMark(sb, sa), is(true));
    assertThat(sb.isCanonical(), is(false));
    assertThat(sb.resolve(), sameInstance(sa));
    assertThat(b.resolve(), sameInstance(sa));
  }

  /** Equivalence is reflexive and symmetric over every mode in the graph,
   * including a recursive structure and a union with a repeated member. */
  @Test
  void testEquivalenceIsReflexiveAndSymmetric() {
    // MODE LIST = STRUCT (INT i, REF LIST next)
    final Mode list = graph.indicant(definingIndicant("LIST"));
    graph.declare(list, graph.struct(intMode, "i", graph.ref(list), "next"));
    // MODE NODE = STRUCT (INT i, REF NODE next)
    final Mode node = graph.indicant(definingIndicant("NODE"));
    graph.declare(node, graph.struct(intMode, "i", graph.ref(node), "next"));
    graph.union(intMode, graph.union(realMode, intMode));
    graph.proc(graph.ref(list), intMode, boolMode);

    final Equivalence equivalence = graph.equivalence();
    final List<Mode> modes = graph.modes();
    for (Mode a : modes) {
      assertThat(a.toString(), equivalence.areEquivalent(a, a), is(true));
      for (Mode b : modes) {
        assertThat(a + " vs " + b, equivalence.prove(a, b),
            is(equivalence.prove(b, a)));
      }
    }
    assertThat(equivalence.prove(list, node), is(true));
    assertThat(graph.postulates().mark(), is(0));
  }

  @Test
  void testFindEquivalentModes() {
    final Mode a = graph.indicant(definingIndicant("A"));
    final Mode refA = graph.ref(a);
    final Mode refInt = graph.lookup(StandardMode.REF_INT);
    assertThat(refA, not(sameInstance(refInt)));
    graph.declare(a, intMode);
    assertThat(graph.equivalence().findEquivalentModes(), is(1));
    assertThat(refA.resolve(), sameInstance(refInt));
    assertThat(refInt.isCanonical(), is(true));
  }

  @Test
  void testPostulates() {
    final Postulates postulates = new Postulates();
    final Mode refInt = graph.ref(intMode);
    final int mark = postulates.mark();
    postulates.push(intMode, refInt);
    assertThat(postulates.isPostulatedPair(intMode, refInt), is(true));
    assertThat(postulates.isPostulatedPair(refInt, intMode), is(true));
    assertThat(postulates.isPostulatedPair(intMode, realMode), is(false));
    final boolean inner =
        postulates.withPostulate(realMode, boolMode,
            () -> postulates.isPostulatedPair(boolMode, realMode));
    assertThat(inner, is(true));
    assertThat(postulates.isPostulatedPair(boolMode, realMode), is(false));
    postulates.restore(mark);
    assertThat(postulates.isPostulatedPair(intMode, refInt), is(false));
    assertThat(postulates.mark(), is(mark));
  }

  @Test
  void testWellFormed() {
    // MODE LIST = STRUCT (INT i, REF LIST next)
    final Mode list = graph.indicant(definingIndicant("LIST"));
    final Mode listStruct =
        graph.struct(intMode, "i", graph.ref(list), "next");
    graph.declare(list, listStruct);
    assertThat(
        WellFormedness.isWellFormed(list, listStruct, false, false, false),
        is(true));

    // MODE A = STRUCT (INT i, A a) would contain itself
    final Mode a = graph.indicant(definingIndicant("A"));
    final Mode aStruct = graph.struct(intMode, "i", a, "a");
    assertThat(WellFormedness.isWellFormed(a, aStruct, false, false, false),
        is(false));

    // MODE B = REF B has no structure in the cycle
    final Mode b = graph.indicant(definingIndicant("B"));
    assertThat(
        WellFormedness.isWellFormed(b, graph.ref(b), false, false, false),
        is(false));

    // MODE C = D, D = C
    final Mode c = graph.indicant(definingIndicant("C"));
    final Mode d = graph.indicant(definingIndicant("D"));
    graph.declare(c, d);
    graph.declare(d, c);
    assertThat(WellFormedness.isWellFormed(c, d, false, false, false),
        is(false));

    // VOID is allowed as a union member and a procedure result, not as a
    // field.
    final Mode voidMode = graph.lookup(StandardMode.VOID);
    assertThat(
        WellFormedness.isWellFormed(null, graph.union(intMode, voidMode),
            false, false, false),
        is(true));
    assertThat(
        WellFormedness.isWellFormed(null, graph.proc(voidMode), false, false,
            false),
        is(true));
    assertThat(
        WellFormedness.isWellFormed(null,
            graph.struct(voidMode, "v", intMode, "i"), false, false, false),
        is(false));
  }
}

// End ModeGraphTest.java
