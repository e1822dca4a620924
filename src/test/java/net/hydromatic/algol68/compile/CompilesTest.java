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
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.algol68.A68;
import net.hydromatic.algol68.ast.Attribute;
import net.hydromatic.algol68.ast.Node;
import net.hydromatic.algol68.type.ModeGraph;
import org.junit.jupiter.api.Test;

/** Tests for {@link Compiles}, {@link Tracers} and {@link Prop}. */
public class CompilesTest {
  private static Node program() {
    // REAL x = 1; x
    return tree.program(
        tree.closed(
            tree.identityDecl(tree.indicant("REAL"), "x", tree.intLiteral(1)),
            tree.id("x")));
  }

  @Test
  void testTracer() {
    final List<ModeGraph> graphs = new ArrayList<>();
    final List<Integer> counts = new ArrayList<>();
    final List<Attribute> coercions = new ArrayList<>();
    final List<String> diagnostics = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnModesCollected(tracer, graphs::add);
    tracer = Tracers.withOnDerivationRound(tracer, counts::add);
    tracer = Tracers.withOnCoercion(tracer, n -> coercions.add(n.attribute()));
    tracer = Tracers.withOnDiagnostic(tracer,
        e -> diagnostics.add(e.getMessage()));

    final A68 a68 = a68(program()).withTracer(tracer).assertNoErrors();
    assertThat(graphs.size(), is(1));
    assertThat(graphs.get(0), sameInstance(a68.context().graph()));
    assertThat(counts.isEmpty(), is(false));
    // The last round adds no modes.
    assertThat(counts.get(counts.size() - 1),
        is(counts.size() > 1 ? counts.get(counts.size() - 2)
            : counts.get(0)));
    assertThat(coercions.toString(), is("[WIDENING, VOIDING]"));
    assertThat(diagnostics.toString(),
        is("[value of REAL identifier will be voided]"));
  }

  @Test
  void testErrorsStopThePipeline() {
    final List<Attribute> coercions = new ArrayList<>();
    final Tracer tracer =
        Tracers.withOnCoercion(Tracers.empty(),
            n -> coercions.add(n.attribute()));
    final Node program =
        tree.program(
            tree.closed(
                tree.identityDecl(tree.indicant("REAL"), "x",
                    tree.intLiteral(1)),
                tree.id("y"),
                tree.skip()));
    a68(program).withTracer(tracer)
        .assertErrors("tag y has not been declared properly")
        .assertValid(false);
    assertThat(coercions.isEmpty(), is(true));
  }

  @Test
  void testPropLookup() {
    assertThat(Prop.lookup("portcheck"), is(Prop.PORTCHECK));
    assertThat(Prop.lookup("WIDEN_DENOTATIONS"), is(Prop.WIDEN_DENOTATIONS));
    assertThat(Prop.lookup("derivationRoundLimit"),
        is(Prop.DERIVATION_ROUND_LIMIT));
    assertThrows(RuntimeException.class, () -> Prop.lookup("optimize"));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.DERIVATION_ROUND_LIMIT));
  }

  @Test
  void testPropValues() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.DERIVATION_ROUND_LIMIT.intValue(map), is(16));
    assertThat(Prop.PORTCHECK.booleanValue(map), is(false));
    assertThat(Prop.WARNINGS.booleanValue(map), is(true));
    assertThat(Prop.WIDEN_DENOTATIONS.booleanValue(map), is(false));

    Prop.PORTCHECK.set(map, true);
    assertThat(Prop.PORTCHECK.booleanValue(map), is(true));
    assertThrows(RuntimeException.class,
        () -> Prop.PORTCHECK.set(map, 1));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.PORTCHECK.intValue(map));
    assertThat((Boolean) Prop.PORTCHECK.remove(map), is(true));
    assertThat(Prop.PORTCHECK.booleanValue(map), is(false));
  }
}

// End CompilesTest.java
