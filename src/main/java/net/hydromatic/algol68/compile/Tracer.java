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

import net.hydromatic.algol68.ast.Attribute;
import net.hydromatic.algol68.ast.Node;
import net.hydromatic.algol68.type.Mode;
import net.hydromatic.algol68.type.ModeGraph;

/** Called on various events while checking the modes of a program. */
public interface Tracer {
  /** Called when the modes of all declarers have been collected. */
  void onModesCollected(ModeGraph graph);

  /** Called after each round of derived-mode synthesis. */
  void onDerivationRound(int round, int modeCount);

  /**
   * Called when a coercion is inserted; {@code node} is the coercion node,
   * and {@code mode} the mode it yields.
   */
  void onCoercion(Node node, Attribute coercion, Mode mode);

  /** Called when an error or warning is recorded. */
  void onDiagnostic(CompileException e);
}

// End Tracer.java
