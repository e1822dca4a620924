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

import java.util.Locale;

/**
 * Strength of a syntactic position, which determines the coercions allowed
 * there. Each sort allows the coercions of the weaker sorts and more.
 */
public enum Sort {
  NO_SORT,
  /** Deproceduring only; the destination of an assignation. */
  SOFT,
  /** Dereferencing, but not of the last REF before a row or structure. */
  WEAK,
  /** Dereferencing and deproceduring. */
  MEEK,
  /** Meek coercions and uniting; operands. */
  FIRM,
  /** Firm coercions, widening, rowing and voiding. */
  STRONG;

  /** Returns the name of this sort as used in messages, e.g. "strong". */
  public String description() {
    return name().toLowerCase(Locale.ROOT);
  }
}

// End Sort.java
