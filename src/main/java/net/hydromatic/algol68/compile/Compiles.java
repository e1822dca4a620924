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

import net.hydromatic.algol68.ast.Node;
import net.hydromatic.algol68.ast.Pos;
import net.hydromatic.algol68.type.DerivedModes;
import net.hydromatic.algol68.type.Mode;

/** Runs the stages of mode checking over a program. */
public abstract class Compiles {
  private Compiles() {}

  /**
   * Checks the modes of a program, and if they are valid, inserts
   * coercions.
   *
   * <p>The stages are: collect the modes of declarers, and check that mode
   * declarations are well formed; derive the modes that rows, names and
   * flexible modes imply; check each unit against its context; insert
   * coercions. A stage that reports errors stops the pipeline, except for
   * mode checking, which reports all the errors it can find.
   *
   * <p>Diagnostics accumulate in {@link ModeContext#diagnostics()}.
   *
   * @return whether there were no errors
   */
  public static boolean checkModes(Node program, ModeContext context) {
    final Diagnostics diagnostics = context.diagnostics();
    if (!new ModeCollector(context).collect(program)) {
      return false;
    }
    deriveModes(context);
    if (diagnostics.hasErrors()) {
      return false;
    }
    new ModeChecker(context).check(program);
    if (diagnostics.hasErrors()) {
      return false;
    }
    new CoercionInserter(context).insert(program);
    return diagnostics.errorCount() == 0;
  }

  /** Derives the modes that the modes in the graph imply, reporting
   * progress to the context's tracer. */
  public static void deriveModes(ModeContext context) {
    final Diagnostics diagnostics = context.diagnostics();
    final DerivedModes.Listener listener = new DerivedModes.Listener() {
      @Override
      public void onRound(int round, int modeCount) {
        context.tracer().onDerivationRound(round, modeCount);
      }

      @Override
      public void onError(Mode mode, String message) {
        final Node node = mode.node();
        diagnostics.error(node == null ? Pos.ZERO : node.pos, message, mode);
      }
    };
    final int roundLimit =
        Prop.DERIVATION_ROUND_LIMIT.intValue(context.props());
    new DerivedModes(context.graph(), roundLimit, listener).compute();
  }
}

// End Compiles.java
