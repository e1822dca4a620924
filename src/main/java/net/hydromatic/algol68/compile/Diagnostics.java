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

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import net.hydromatic.algol68.ast.Attribute;
import net.hydromatic.algol68.ast.Node;
import net.hydromatic.algol68.ast.Pos;
import net.hydromatic.algol68.type.Coercibility;
import net.hydromatic.algol68.type.Deflexing;
import net.hydromatic.algol68.type.Mode;
import net.hydromatic.algol68.type.ModeKind;
import net.hydromatic.algol68.type.Sort;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Collects the errors and warnings of a compilation, in the order they are
 * found.
 *
 * <p>Also composes the messages that several phases share, such as the one
 * that says that a mode cannot be coerced to another.
 */
public class Diagnostics {
  private final Coercibility coercibility;
  private final Tracer tracer;
  private final boolean warnings;
  private final List<CompileException> list = new ArrayList<>();
  private int errorCount;
  private int warningCount;

  public Diagnostics(Coercibility coercibility, Tracer tracer,
      boolean warnings) {
    this.coercibility = requireNonNull(coercibility);
    this.tracer = requireNonNull(tracer);
    this.warnings = warnings;
  }

  /** Records an error. */
  public CompileException error(Pos pos, String message, Mode... modes) {
    final CompileException e =
        new CompileException(message, pos, false, Arrays.asList(modes));
    ++errorCount;
    return record(e);
  }

  public CompileException error(Node node, String message, Mode... modes) {
    return error(node.pos, message, modes);
  }

  /** Records a warning, unless warnings are disabled, in which case returns
   * null. */
  public @Nullable CompileException warning(Node node, String message,
      Mode... modes) {
    if (!warnings) {
      return null;
    }
    final CompileException e =
        new CompileException(message, node.pos, true, Arrays.asList(modes));
    ++warningCount;
    return record(e);
  }

  private CompileException record(CompileException e) {
    list.add(e);
    tracer.onDiagnostic(e);
    return e;
  }

  /** Returns all diagnostics, errors and warnings, in order. */
  public List<CompileException> list() {
    return ImmutableList.copyOf(list);
  }

  /** Returns the diagnostics recorded since {@code mark}, a value
   * previously returned by {@link #size()}. */
  public List<CompileException> since(int mark) {
    return ImmutableList.copyOf(list.subList(mark, list.size()));
  }

  public int size() {
    return list.size();
  }

  public int errorCount() {
    return errorCount;
  }

  public int warningCount() {
    return warningCount;
  }

  public boolean hasErrors() {
    return errorCount > 0;
  }

  /** Returns how an attribute is named in a message, for example
   * "identity relation". */
  public static String describe(Attribute attribute) {
    return attribute.name().toLowerCase(Locale.ROOT).replace('_', ' ');
  }

  /**
   * Reports that a construct of mode {@code from} cannot be coerced to
   * {@code to}.
   *
   * <p>If {@code from} is the series of modes of the units of a clause, or
   * the modes of a display, says which of them are the culprits.
   */
  public CompileException cannotCoerce(Node node, Mode from, Mode to,
      Sort sort, Deflexing deflex, @Nullable Attribute attribute) {
    final String text = modeErrorText(from, to, sort, deflex);
    final String where = attribute == null
        ? " in " + sort.description() + " context"
        : " in " + sort.description() + "-" + describe(attribute);
    final String message = text.isEmpty()
        ? from + " cannot be coerced to " + to + where
        : text + where;
    return error(node, message, from, to);
  }

  /** Explains why a series or a display cannot be coerced; returns the
   * empty string for other modes. */
  String modeErrorText(Mode p, Mode q, Sort sort, Deflexing deflex) {
    final Mode x = p.resolve();
    final Mode y = q.resolve();
    if (x.is(ModeKind.SERIES)) {
      final List<String> culprits = new ArrayList<>();
      seriesCulprits(x, y, sort, deflex, culprits);
      return (culprits.isEmpty() ? "mode" : String.join(" and ", culprits))
          + " cannot be coerced to " + y;
    }
    if (!x.is(ModeKind.STOWED)) {
      return "";
    }
    if (x.pack().isEmpty()) {
      return "empty mode-list";
    }
    final Mode element;
    if (y.is(ModeKind.FLEX)) {
      element = y.sub().slice();
    } else if (y.is(ModeKind.ROW)) {
      element = y.slice();
    } else if (y.is(ModeKind.PROC) || y.is(ModeKind.STRUCT)) {
      final List<String> pairs = new ArrayList<>();
      final List<Mode> us = x.packModes();
      final List<Mode> vs = y.packModes();
      for (int i = 0; i < us.size() && i < vs.size(); i++) {
        if (!coercibility.isCoercible(us.get(i), vs.get(i), sort, deflex)) {
          pairs.add(us.get(i) + " cannot be coerced to " + vs.get(i));
        }
      }
      return String.join(" and ", pairs);
    } else {
      return "";
    }
    final List<String> culprits = new ArrayList<>();
    for (Mode u : x.packModes()) {
      if (!coercibility.isCoercible(u, element, sort, deflex)) {
        culprits.add(u.toString());
      }
    }
    return String.join(" and ", culprits) + " cannot be coerced to "
        + element;
  }

  private void seriesCulprits(Mode series, Mode q, Sort sort,
      Deflexing deflex, List<String> culprits) {
    for (Mode u : series.packModes()) {
      if (u.is(ModeKind.SERIES)) {
        seriesCulprits(u, q, sort, deflex, culprits);
      } else if (!coercibility.isCoercible(u, q, sort, deflex)) {
        culprits.add(u.toString());
      }
    }
  }
}

// End Diagnostics.java
