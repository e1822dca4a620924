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

import com.google.common.collect.ImmutableMap;
import java.util.EnumMap;
import java.util.Map;
import net.hydromatic.algol68.type.Coercibility;
import net.hydromatic.algol68.type.Mode;
import net.hydromatic.algol68.type.ModeGraph;
import net.hydromatic.algol68.type.StandardMode;

/**
 * State of the mode checking of one program.
 *
 * <p>Owns the {@link ModeGraph}, the {@link Diagnostics}, and the table of
 * the standard environment. Create a new context for each compilation.
 */
public class ModeContext {
  private final ModeGraph graph;
  private final Tracer tracer;
  private final Map<Prop, Object> props;
  private final Diagnostics diagnostics;
  private final Table standardTable;
  /** Stands for an operator whose operands are in error; matching it gives
   * no further diagnostics. */
  private final Tag errorTag;

  public ModeContext(Tracer tracer, Map<Prop, Object> props) {
    this.tracer = requireNonNull(tracer);
    this.props = new EnumMap<>(Prop.class);
    this.props.putAll(props);
    this.graph = new ModeGraph();
    this.diagnostics =
        new Diagnostics(graph.coercibility(), tracer,
            Prop.WARNINGS.booleanValue(this.props));
    this.standardTable = StandardEnvironment.create(graph);
    this.errorTag =
        new Table(null).add(Tag.Kind.OPERATOR, "?", null,
            graph.lookup(StandardMode.ERROR));
  }

  /** Creates a context with no tracing and default properties. */
  public static ModeContext create() {
    return new ModeContext(Tracers.empty(), ImmutableMap.of());
  }

  public ModeGraph graph() {
    return graph;
  }

  public Coercibility coercibility() {
    return graph.coercibility();
  }

  public Diagnostics diagnostics() {
    return diagnostics;
  }

  public Tracer tracer() {
    return tracer;
  }

  public Map<Prop, Object> props() {
    return props;
  }

  /** Returns the table of the standard environment, which is the outermost
   * table of every program. */
  public Table standardTable() {
    return standardTable;
  }

  public Tag errorTag() {
    return errorTag;
  }

  /** Shorthand for looking up a standard mode. */
  public Mode mode(StandardMode standardMode) {
    return graph.lookup(standardMode);
  }
}

// End ModeContext.java
