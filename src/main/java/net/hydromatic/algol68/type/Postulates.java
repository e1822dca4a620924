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

import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

/**
 * Stack of postulates: pairs of modes that are assumed to be equivalent while
 * a proof that they are equivalent is in progress.
 *
 * <p>Assuming the conclusion lets a proof over cyclic modes terminate; the
 * well-formedness rules ensure that every cycle passes through a mode that
 * does not contain the mode itself.
 */
public class Postulates {
  private final List<Mode[]> stack = new ArrayList<>();

  /** Returns the current height of the stack. */
  public int mark() {
    return stack.size();
  }

  /** Pops postulates until the stack has the given height. */
  public void restore(int mark) {
    while (stack.size() > mark) {
      stack.remove(stack.size() - 1);
    }
  }

  public void push(Mode a, Mode b) {
    stack.add(new Mode[] {a, b});
  }

  /**
   * Pushes the postulate that {@code a} is equivalent to {@code b}, evaluates
   * {@code body}, and restores the stack, whether or not {@code body} throws.
   */
  public boolean withPostulate(Mode a, Mode b, BooleanSupplier body) {
    final int mark = mark();
    push(a, b);
    try {
      return body.getAsBoolean();
    } finally {
      restore(mark);
    }
  }

  /** Whether {@code a} and {@code b} are postulated equivalent, in either
   * order. */
  public boolean isPostulatedPair(Mode a, Mode b) {
    for (Mode[] pair : stack) {
      if (pair[0] == a && pair[1] == b || pair[0] == b && pair[1] == a) {
        return true;
      }
    }
    return false;
  }
}

// End Postulates.java
