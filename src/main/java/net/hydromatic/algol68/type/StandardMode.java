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

import java.util.function.Function;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Modes of the standard environment.
 *
 * <p>A {@link ModeGraph} creates these before any mode of the program, in the
 * order of declaration, so that they have the lowest numbers and are chosen as
 * the canonical member of any equivalence class they belong to.
 */
public enum StandardMode {
  VOID("VOID", 0),
  INT("INT", 0),
  LONG_INT("INT", 1),
  LONG_LONG_INT("INT", 2),
  REAL("REAL", 0),
  LONG_REAL("REAL", 1),
  LONG_LONG_REAL("REAL", 2),
  BITS("BITS", 0),
  LONG_BITS("BITS", 1),
  LONG_LONG_BITS("BITS", 2),
  BYTES("BYTES", 0),
  LONG_BYTES("BYTES", 1),
  BOOL("BOOL", 0),
  CHAR("CHAR", 0),
  FORMAT("FORMAT", 0),

  /** Mode of a construct in error; coercible to and from anything. */
  ERROR("ERROR"),
  /** Mode of NIL, SKIP and jumps; coercible to anything. */
  HIP("HIP"),
  /** Mode of an empty display "()". */
  VACUUM("VACUUM"),
  /** Mode of a construct whose mode is not yet known. */
  UNDEFINED("UNDEFINED"),
  /** Mode that stands for any row, as in the operand of UPB. */
  ROWS("ROWS"),

  COMPLEX("COMPLEX", 0, g -> g.complexStruct(StandardMode.REAL)),
  COMPL("COMPL", 0, g -> g.complexStruct(StandardMode.REAL)),
  LONG_COMPLEX("COMPLEX", 1, g -> g.complexStruct(StandardMode.LONG_REAL)),
  LONG_COMPL("COMPL", 1, g -> g.complexStruct(StandardMode.LONG_REAL)),
  LONG_LONG_COMPLEX("COMPLEX", 2,
      g -> g.complexStruct(StandardMode.LONG_LONG_REAL)),
  LONG_LONG_COMPL("COMPL", 2,
      g -> g.complexStruct(StandardMode.LONG_LONG_REAL)),
  STRING("STRING", 0,
      g -> g.flex(g.row(1, g.lookup(StandardMode.CHAR)))),

  REF_INT(g -> g.ref(g.lookup(StandardMode.INT))),
  REF_REAL(g -> g.ref(g.lookup(StandardMode.REAL))),
  REF_BOOL(g -> g.ref(g.lookup(StandardMode.BOOL))),
  REF_CHAR(g -> g.ref(g.lookup(StandardMode.CHAR))),
  REF_BITS(g -> g.ref(g.lookup(StandardMode.BITS))),
  REF_COMPLEX(g -> g.ref(g.lookup(StandardMode.COMPLEX))),
  REF_STRING(g -> g.ref(g.lookup(StandardMode.STRING))),
  ROW_INT(g -> g.row(1, g.lookup(StandardMode.INT))),
  ROW_REAL(g -> g.row(1, g.lookup(StandardMode.REAL))),
  ROW_ROW_REAL(g -> g.row(2, g.lookup(StandardMode.REAL))),
  ROW_COMPLEX(g -> g.row(1, g.lookup(StandardMode.COMPLEX))),
  ROW_ROW_COMPLEX(g -> g.row(2, g.lookup(StandardMode.COMPLEX))),
  ROW_BOOL(g -> g.row(1, g.lookup(StandardMode.BOOL))),
  FLEX_ROW_BOOL(g -> g.flex(g.lookup(StandardMode.ROW_BOOL))),
  ROW_CHAR(g -> g.row(1, g.lookup(StandardMode.CHAR))),
  FLEX_ROW_CHAR(g -> g.flex(g.lookup(StandardMode.ROW_CHAR))),
  ROW_STRING(g -> g.row(1, g.lookup(StandardMode.STRING))),
  PROC_VOID(g -> g.proc(g.lookup(StandardMode.VOID)));

  /** Name of an atomic mode, as written in a program; null for composites. */
  public final @Nullable String symbol;
  /** Number of LONGs. */
  public final int sizety;
  /** Whether a program may refer to this mode by name. */
  final boolean visible;
  /**
   * For an atomic mode, the mode it stands for (as STRING stands for FLEX []
   * CHAR); for a composite mode, how to build it.
   */
  final @Nullable Function<ModeGraph, Mode> definition;

  /** Creates a mode that a program can name. */
  StandardMode(String symbol, int sizety) {
    this(symbol, sizety, true, null);
  }

  /** Creates a mode that a program can name, and that stands for another. */
  StandardMode(String symbol, int sizety,
      Function<ModeGraph, Mode> definition) {
    this(symbol, sizety, true, definition);
  }

  /** Creates an internal mode. */
  StandardMode(String symbol) {
    this(symbol, 0, false, null);
  }

  /** Creates a composite mode. */
  StandardMode(Function<ModeGraph, Mode> definition) {
    this(null, 0, false, definition);
  }

  StandardMode(@Nullable String symbol, int sizety, boolean visible,
      @Nullable Function<ModeGraph, Mode> definition) {
    this.symbol = symbol;
    this.sizety = sizety;
    this.visible = visible;
    this.definition = definition;
  }

  /** Whether this is an atomic mode, which has a name, rather than a
   * composite such as REF INT. */
  public boolean isAtomic() {
    return symbol != null;
  }
}

// End StandardMode.java
