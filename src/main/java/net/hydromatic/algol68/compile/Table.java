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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.algol68.ast.Node;
import net.hydromatic.algol68.type.Mode;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Symbol table of a range.
 *
 * <p>Tables nest; level 0 is the standard environment. The mode system reads
 * tables and writes modes into their tags, but does not decide scoping; tags
 * are entered by whoever builds the tree.
 */
public class Table {
  private final @Nullable Table parent;
  private final int level;
  private final Map<Tag.Kind, List<Tag>> tags = new EnumMap<>(Tag.Kind.class);

  /** Creates a Table nested in {@code parent}, or a root table if null. */
  public Table(@Nullable Table parent) {
    this.parent = parent;
    this.level = parent == null ? 0 : parent.level + 1;
    for (Tag.Kind kind : Tag.Kind.values()) {
      tags.put(kind, new ArrayList<>());
    }
  }

  public @Nullable Table parent() {
    return parent;
  }

  public int level() {
    return level;
  }

  /** Adds a tag to this table. */
  public Tag add(Tag.Kind kind, String symbol, @Nullable Node node,
      @Nullable Mode mode) {
    final Tag tag = new Tag(this, kind, symbol, node, mode);
    tags.get(kind).add(tag);
    return tag;
  }

  /** Returns the tags of a given kind declared in this table. */
  public List<Tag> tags(Tag.Kind kind) {
    return ImmutableList.copyOf(tags.get(kind));
  }

  /** Finds a tag in this table only. */
  public @Nullable Tag findLocal(Tag.Kind kind, String symbol) {
    for (Tag tag : tags.get(kind)) {
      if (tag.symbol.equals(symbol)) {
        return tag;
      }
    }
    return null;
  }

  /** Finds a tag in this table or an enclosing one. */
  public @Nullable Tag findGlobal(Tag.Kind kind, String symbol) {
    for (Table t = this; t != null; t = t.parent) {
      final Tag tag = t.findLocal(kind, symbol);
      if (tag != null) {
        return tag;
      }
    }
    return null;
  }

  /**
   * Finds the innermost tag with a given symbol, whatever its kind; identifiers
   * take precedence over indicants and labels in the same range.
   */
  public @Nullable Tag firstGlobal(String symbol) {
    for (Table t = this; t != null; t = t.parent) {
      for (Tag.Kind kind : Tag.Kind.values()) {
        if (kind == Tag.Kind.OPERATOR) {
          continue;
        }
        final Tag tag = t.findLocal(kind, symbol);
        if (tag != null) {
          return tag;
        }
      }
    }
    return null;
  }

  @Override
  public String toString() {
    return "Table{level=" + level + ", tags=" + tags + "}";
  }
}

// End Table.java
