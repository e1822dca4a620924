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

/** Kind of a {@link Mode}. */
public enum ModeKind {
  VOID,
  /**
   * Mode of the standard environment, such as INT or LONG REAL; also the
   * internal modes ERROR, HIP, VACUUM, UNDEFINED and ROWS.
   */
  STANDARD,
  /** Applied occurrence of a mode indicant declared in the program. */
  INDICANT,
  REF,
  FLEX,
  /** Row of a given rank. */
  ROW,
  STRUCT,
  UNION,
  PROC,
  /** Modes of the units of a serial or enquiry clause, for balancing. */
  SERIES,
  /** Modes of the units of a collateral display. */
  STOWED;

  /** Whether modes of this kind have a pack (fields, members, parameters). */
  public boolean hasPack() {
    return this == STRUCT
        || this == UNION
        || this == PROC
        || this == SERIES
        || this == STOWED;
  }

  /** Whether modes of this kind must have a sub-mode. */
  public boolean needsSub() {
    return this == REF || this == FLEX || this == ROW;
  }
}

// End ModeKind.java
