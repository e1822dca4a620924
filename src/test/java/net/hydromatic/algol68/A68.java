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
package net.hydromatic.algol68;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.function.Predicate;
import net.hydromatic.algol68.ast.Node;
import net.hydromatic.algol68.compile.CompileException;
import net.hydromatic.algol68.compile.Compiles;
import net.hydromatic.algol68.compile.ModeContext;
import net.hydromatic.algol68.compile.Prop;
import net.hydromatic.algol68.compile.Scoper;
import net.hydromatic.algol68.compile.Tracer;
import net.hydromatic.algol68.compile.Tracers;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.hamcrest.Matcher;

/**
 * Fluent test helper for checking the modes of a program.
 *
 * <p>The program is checked the first time an assertion needs the result;
 * {@link #with} and {@link #withTracer} return a fresh helper, and must be
 * called before any assertion.
 */
public class A68 {
  private final Node program;
  private final ImmutableMap<Prop, Object> props;
  private final Tracer tracer;
  private @Nullable ModeContext context;
  private boolean valid;

  private A68(Node program, ImmutableMap<Prop, Object> props, Tracer tracer) {
    this.program = program;
    this.props = props;
    this.tracer = tracer;
  }

  /** Creates a helper for a program built with
   * {@link net.hydromatic.algol68.ast.NodeBuilder}. */
  public static A68 a68(Node program) {
    return new A68(program, ImmutableMap.of(), Tracers.empty());
  }

  public A68 with(Prop prop, Object value) {
    final ImmutableMap.Builder<Prop, Object> b = ImmutableMap.builder();
    props.forEach((k, v) -> {
      if (k != prop) {
        b.put(k, v);
      }
    });
    return new A68(program, b.put(prop, value).build(), tracer);
  }

  public A68 withTracer(Tracer tracer) {
    return new A68(program, props, tracer);
  }

  /** Checks the program, if it has not been checked already, and returns the
   * context. */
  public ModeContext context() {
    if (context == null) {
      final Map<Prop, Object> map = props;
      context = new ModeContext(tracer, map);
      Scoper.scope(context, program);
      valid = Compiles.checkModes(program, context);
    }
    return context;
  }

  public Node program() {
    context();
    return program;
  }

  public A68 assertValid(boolean expected) {
    context();
    assertThat(valid, is(expected));
    return this;
  }

  /** Asserts that there are no errors; there may be warnings. */
  public A68 assertNoErrors() {
    assertThat(messages(e -> !e.isWarning()), is(ImmutableList.of()));
    return assertValid(true);
  }

  /** Asserts the messages of the errors, in the order they were found. */
  public A68 assertErrors(String... messages) {
    assertThat(messages(e -> !e.isWarning()),
        is(ImmutableList.copyOf(messages)));
    return this;
  }

  public A68 assertWarnings(String... messages) {
    assertThat(messages(CompileException::isWarning),
        is(ImmutableList.copyOf(messages)));
    return this;
  }

  /** Asserts the prefix form of the program after coercions have been
   * inserted. */
  public A68 assertTree(String expected) {
    assertThat(program().toString(), is(expected));
    return this;
  }

  public A68 assertTree(Matcher<String> matcher) {
    assertThat(program().toString(), matcher);
    return this;
  }

  /** Finds the first node, in prefix order, that satisfies a predicate, and
   * applies an action to it. Fails if there is no such node. */
  public A68 withNode(Predicate<Node> predicate, Consumer<Node> action) {
    final Node node = find(program(), predicate);
    if (node == null) {
      throw new AssertionError("no matching node in " + program);
    }
    action.accept(node);
    return this;
  }

  private static @Nullable Node find(Node node, Predicate<Node> predicate) {
    if (predicate.test(node)) {
      return node;
    }
    for (Node child : node.children()) {
      final Node found = find(child, predicate);
      if (found != null) {
        return found;
      }
    }
    return null;
  }

  private List<String> messages(Predicate<CompileException> predicate) {
    final ImmutableList.Builder<String> b = ImmutableList.builder();
    for (CompileException e : context().diagnostics().list()) {
      if (predicate.test(e)) {
        b.add(e.getMessage());
      }
    }
    return b.build();
  }
}

// End A68.java
