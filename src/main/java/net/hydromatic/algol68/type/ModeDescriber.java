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

import com.google.common.base.Strings;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/** Converts modes to text in the notation of Algol 68. */
public class ModeDescriber {
  private final Set<Mode> active =
      Collections.newSetFromMap(new IdentityHashMap<>());

  private ModeDescriber() {}

  /** Describes a mode, for example "REF [] STRUCT (INT i, REF SELF next)". */
  public static String describe(Mode mode) {
    return new ModeDescriber().describeTo(new StringBuilder(), mode)
        .toString();
  }

  /** Returns "LONG LONG " for sizety 2, "SHORT " for -1, and so forth. */
  public static String sizetyPrefix(int sizety) {
    return sizety >= 0
        ? Strings.repeat("LONG ", sizety)
        : Strings.repeat("SHORT ", -sizety);
  }

  private StringBuilder describeTo(StringBuilder b, Mode mode) {
    if (mode.kind == ModeKind.INDICANT) {
      return b.append(mode.node == null ? "?" : mode.node.symbol());
    }
    final Mode m = mode.resolve();
    if (m.alias != null) {
      return b.append(m.alias);
    }
    switch (m.kind) {
      case VOID:
        return b.append("VOID");
      case STANDARD:
        return b.append(sizetyPrefix(m.dim)).append(m.symbol);
      case INDICANT:
        return describeTo(b, m);
      default:
        break;
    }
    if (!active.add(m)) {
      return b.append("SELF");
    }
    try {
      switch (m.kind) {
        case REF:
          return describeTo(b.append("REF "), m.sub);
        case FLEX:
          return describeTo(b.append("FLEX "), m.sub);
        case ROW:
          b.append('[').append(Strings.repeat(",", m.dim - 1)).append("] ");
          return describeTo(b, m.sub);
        case STRUCT:
          return describePack(b.append("STRUCT "), m.pack, true);
        case UNION:
          return describePack(b.append("UNION "), m.pack, false);
        case PROC:
          b.append("PROC ");
          if (!m.pack.isEmpty()) {
            describePack(b, m.pack, false).append(' ');
          }
          return describeTo(b, m.sub);
        case SERIES:
        case STOWED:
          return describePack(b, m.pack, false);
        default:
          throw new AssertionError(m.kind);
      }
    } finally {
      active.remove(m);
    }
  }

  private StringBuilder describePack(StringBuilder b, List<PackEntry> pack,
      boolean withNames) {
    b.append('(');
    for (int i = 0; i < pack.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      final PackEntry entry = pack.get(i);
      describeTo(b, entry.mode);
      if (withNames && entry.text != null) {
        b.append(' ').append(entry.text);
      }
    }
    return b.append(')');
  }
}

// End ModeDescriber.java
