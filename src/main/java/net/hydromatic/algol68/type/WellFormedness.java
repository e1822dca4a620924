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

import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Checks that mode declarations are well formed.
 *
 * <p>A mode declaration is not well formed if the mode it declares would
 * contain itself, for example {@code MODE A = STRUCT (INT i, A a)}, or would
 * be an indirect synonym of itself, for example {@code MODE A = B, B = A}. A
 * recursive mode is well formed only if every cycle passes through a REF
 * (flag "yin") and through a structure or a procedure (flag "yang").
 *
 * <p>Runs before indicants are resolved, so reads the raw sub-modes and packs.
 */
public class WellFormedness {
  private WellFormedness() {}

  /**
   * Returns whether mode {@code z}, reached while checking the declaration of
   * {@code def}, is well formed.
   *
   * @param def Indicant being declared, or null to check an applied mode
   * @param z Mode to check
   * @param yin Whether the path to {@code z} passed through a REF or PROC
   * @param yang Whether the path to {@code z} passed through a STRUCT or PROC
   * @param voidOk Whether {@code z} may be VOID
   */
  public static boolean isWellFormed(@Nullable Mode def, @Nullable Mode z,
      boolean yin, boolean yang, boolean voidOk) {
    if (z == null) {
      return false;
    }
    if (yin && yang) {
      return z.kind == ModeKind.VOID ? voidOk : true;
    }
    switch (z.kind) {
      case VOID:
        return voidOk;
      case STANDARD:
        return true;
      case INDICANT:
        if (def == null) {
          return isAppliedIndicantWellFormed(z, voidOk);
        }
        if (z == def || z.use) {
          return false;
        }
        z.use = true;
        try {
          return isWellFormed(def, z.equivalent, yin, yang, voidOk);
        } finally {
          z.use = false;
        }
      case REF:
        return isWellFormed(def, z.sub, true, yang, false);
      case PROC:
        return !z.pack.isEmpty() || isWellFormed(def, z.sub, true, yang, true);
      case ROW:
      case FLEX:
        return isWellFormed(def, z.sub, yin, yang, false);
      case STRUCT:
        for (PackEntry entry : z.pack) {
          if (!isWellFormed(def, entry.mode, yin, true, false)) {
            return false;
          }
        }
        return true;
      case UNION:
        for (PackEntry entry : z.pack) {
          if (!isWellFormed(def, entry.mode, yin, yang, true)) {
            return false;
          }
        }
        return true;
      default:
        return false;
    }
  }

  /** Checks whether an applied indicant stands, perhaps via other
   * indicants, for VOID where VOID is not allowed. */
  private static boolean isAppliedIndicantWellFormed(Mode z, boolean voidOk) {
    final Set<Mode> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    Mode m = z;
    while (m != null && m.kind == ModeKind.INDICANT) {
      if (!seen.add(m)) {
        // A cycle of synonyms; reported where they are declared.
        return true;
      }
      m = m.equivalent;
    }
    return m == null || m.kind != ModeKind.VOID || voidOk;
  }
}

// End WellFormedness.java
