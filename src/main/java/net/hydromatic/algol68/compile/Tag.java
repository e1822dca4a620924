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

import net.hydromatic.algol68.ast.Node;
import net.hydromatic.algol68.type.Mode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Entry in a {@link Table}: an identifier, operator, mode indicant or label,
 * with the mode it has been given.
 */
public class Tag {
  public final Kind kind;
  public final String symbol;
  /** Defining occurrence; null for tags of the standard environment. */
  public final @Nullable Node node;
  private @Nullable Mode mode;
  /** Table that contains this tag. */
  public final Table table;

  Tag(Table table, Kind kind, String symbol, @Nullable Node node,
      @Nullable Mode mode) {
    this.table = requireNonNull(table);
    this.kind = requireNonNull(kind);
    this.symbol = requireNonNull(symbol);
    this.node = node;
    this.mode = mode;
  }

  /** Returns the mode of this tag, following equivalences. */
  public @Nullable Mode mode() {
    return mode == null ? null : mode.resolve();
  }

  public void setMode(@Nullable Mode mode) {
    this.mode = mode;
  }

  @Override
  public String toString() {
    return kind + " " + symbol;
  }

  /** What a tag declares. */
  public enum Kind {
    IDENTIFIER,
    OPERATOR,
    INDICANT,
    LABEL
  }
}

// End Tag.java
