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

import static java.util.Objects.requireNonNull;

import net.hydromatic.algol68.ast.Node;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Element of the pack of a {@link Mode}: a field of a structure, a member of a
 * union, a parameter of a procedure, or a unit of a series.
 */
public class PackEntry {
  Mode mode;
  /** Field name; null except for structures. */
  public final @Nullable String text;
  public final @Nullable Node node;

  public PackEntry(Mode mode, @Nullable String text, @Nullable Node node) {
    this.mode = requireNonNull(mode);
    this.text = text;
    this.node = node;
  }

  /** Creates an entry without a name. */
  public static PackEntry of(Mode mode) {
    return new PackEntry(mode, null, null);
  }

  /** Creates a named entry, such as a field of a structure. */
  public static PackEntry of(Mode mode, String text) {
    return new PackEntry(mode, text, null);
  }

  /** Returns the mode of this entry, following equivalences. */
  public Mode mode() {
    return mode.resolve();
  }

  @Override
  public String toString() {
    return text == null ? mode.toString() : mode + " " + text;
  }
}

// End PackEntry.java
