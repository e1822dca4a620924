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

import net.hydromatic.algol68.ast.Attribute;
import net.hydromatic.algol68.type.Coercibility;
import net.hydromatic.algol68.type.Deflexing;
import net.hydromatic.algol68.type.Mode;
import net.hydromatic.algol68.type.Sort;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Sort and mode of a construct: what a context expects of a unit, or what a
 * unit yields.
 *
 * <p>Immutable.
 */
public class Soid {
  public final Sort sort;
  /** Mode, resolved; null if the context does not say which mode it
   * expects. */
  public final @Nullable Mode mode;
  /** Kind of clause that yielded the mode, which decides whether its units
   * may be balanced; or null. */
  public final @Nullable Attribute attribute;
  /** Whether the context is a cast; a cast does not warn about voiding. */
  public final boolean cast;

  private Soid(Sort sort, @Nullable Mode mode, @Nullable Attribute attribute,
      boolean cast) {
    this.sort = requireNonNull(sort);
    this.mode = mode == null ? null : mode.resolve();
    this.attribute = attribute;
    this.cast = cast;
  }

  public static Soid of(Sort sort, @Nullable Mode mode) {
    return new Soid(sort, mode, null, false);
  }

  public static Soid of(Sort sort, @Nullable Mode mode,
      @Nullable Attribute attribute) {
    return new Soid(sort, mode, attribute, false);
  }

  /** Returns the soid of a cast to a given mode. */
  public static Soid cast(Mode mode) {
    return new Soid(Sort.STRONG, mode, null, true);
  }

  /** Returns a copy of this soid with a different sort. */
  public Soid withSort(Sort sort) {
    return sort == this.sort ? this : new Soid(sort, mode, attribute, cast);
  }

  /**
   * Returns whether what a unit yields, this soid, suits a context {@code x}:
   * both must be of the same sort, and the mode must be coercible in that
   * sort.
   */
  public boolean isCoercibleInContext(Soid x, Deflexing deflex,
      Coercibility coercibility) {
    if (sort != x.sort) {
      return false;
    }
    if (mode == x.mode) {
      return true;
    }
    return coercibility.isCoercible(mode, x.mode, x.sort, deflex);
  }

  @Override
  public String toString() {
    return sort + " " + mode;
  }
}

// End Soid.java
