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

import java.util.List;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Decides whether two modes are structurally equivalent.
 *
 * <p>Modes may be cyclic, so a proof that two modes are equivalent first
 * postulates that they are, then compares their structure; meeting the same
 * pair again ends that branch of the proof successfully.
 */
public class Equivalence {
  private final ModeGraph graph;

  Equivalence(ModeGraph graph) {
    this.graph = graph;
  }

  /** Whether two modes are equivalent under the current postulates. */
  public boolean areEquivalent(@Nullable Mode a, @Nullable Mode b) {
    if (a == null || b == null) {
      return false;
    }
    final Mode x = a.resolve();
    final Mode y = b.resolve();
    if (x == y) {
      return true;
    }
    if (x.kind != y.kind) {
      return false;
    }
    if (x.kind != ModeKind.UNION && x.dim() != y.dim()) {
      return false;
    }
    if (x.kind == ModeKind.VOID || x.kind == ModeKind.STANDARD) {
      // Standard modes are unique.
      return false;
    }
    final Postulates postulates = graph.postulates();
    if (postulates.isPostulatedPair(x, y)) {
      return true;
    }
    switch (x.kind) {
      case INDICANT:
        // Unresolved indicants are equivalent only if they have the same
        // declaration.
        return x.node != null && x.node == y.node;
      case REF:
      case FLEX:
      case ROW:
        return postulates.withPostulate(x, y,
            () -> areEquivalent(x.sub, y.sub));
      case STRUCT:
        return postulates.withPostulate(x, y,
            () -> arePacksEquivalent(x.pack, y.pack, true));
      case UNION:
        return postulates.withPostulate(x, y,
            () -> isSubset(x, y) && isSubset(y, x));
      case PROC:
        return postulates.withPostulate(x, y,
            () -> areEquivalent(x.sub, y.sub)
                && arePacksEquivalent(x.pack, y.pack, false));
      case SERIES:
      case STOWED:
        return arePacksEquivalent(x.pack, y.pack, false);
      default:
        throw new AssertionError(x.kind);
    }
  }

  private boolean arePacksEquivalent(List<PackEntry> p, List<PackEntry> q,
      boolean compareNames) {
    if (p.size() != q.size()) {
      return false;
    }
    for (int i = 0; i < p.size(); i++) {
      final PackEntry e = p.get(i);
      final PackEntry f = q.get(i);
      if (compareNames && !Objects.equals(e.text, f.text)) {
        return false;
      }
      if (!areEquivalent(e.mode, f.mode)) {
        return false;
      }
    }
    return true;
  }

  /** Whether every member of union {@code u} is equivalent to a member of
   * union {@code v}. */
  private boolean isSubset(Mode u, Mode v) {
    for (PackEntry e : u.pack) {
      boolean found = false;
      for (PackEntry f : v.pack) {
        if (areEquivalent(e.mode, f.mode)) {
          found = true;
          break;
        }
      }
      if (!found) {
        return false;
      }
    }
    return true;
  }

  /**
   * Whether two modes are equivalent, starting from an empty set of
   * assumptions; the postulate stack is left as it was.
   */
  public boolean prove(Mode a, Mode b) {
    final Postulates postulates = graph.postulates();
    final int mark = postulates.mark();
    try {
      return areEquivalent(a, b);
    } finally {
      postulates.restore(mark);
    }
  }

  /**
   * Proves that two modes are equivalent and, if they are, makes the one
   * registered later point to the one registered earlier. Returns whether
   * they are equivalent.
   */
  public boolean proveAndMark(Mode a, Mode b) {
    final Mode x = a.resolve();
    final Mode y = b.resolve();
    if (x == y) {
      return true;
    }
    if (!prove(x, y)) {
      return false;
    }
    if (x.number < y.number) {
      y.equivalent = x;
    } else {
      x.equivalent = y;
    }
    return true;
  }

  /**
   * Finds canonical modes that are equivalent to an earlier canonical mode,
   * and makes them point to it. Returns the number of modes marked.
   */
  public int findEquivalentModes() {
    int count = 0;
    final List<Mode> modes = graph.modes();
    for (int i = 0; i < modes.size(); i++) {
      final Mode z = modes.get(i);
      if (!z.isCanonical() || z.kind == ModeKind.INDICANT) {
        continue;
      }
      for (int j = 0; j < i; j++) {
        final Mode v = modes.get(j);
        if (v.isCanonical()
            && v.kind == z.kind
            && v.kind != ModeKind.INDICANT
            && prove(v, z)) {
          z.equivalent = v;
          ++count;
          break;
        }
      }
    }
    return count;
  }
}

// End Equivalence.java
