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
import java.util.List;
import net.hydromatic.algol68.ast.Pos;
import net.hydromatic.algol68.type.Mode;

/**
 * An error or warning found while checking the modes of a program.
 *
 * <p>These are collected by {@link Diagnostics} rather than thrown, so that
 * one pass can report several.
 */
public class CompileException extends RuntimeException {
  private final Pos pos;
  private final boolean warning;
  private final ImmutableList<Mode> modes;

  public CompileException(String message, Pos pos, boolean warning,
      List<Mode> modes) {
    super(message);
    this.pos = pos;
    this.warning = warning;
    this.modes = ImmutableList.copyOf(modes);
  }

  @Override
  public String toString() {
    return super.toString() + " at " + pos;
  }

  public Pos pos() {
    return pos;
  }

  public boolean isWarning() {
    return warning;
  }

  /** Returns the modes that the message mentions. */
  public List<Mode> modes() {
    return modes;
  }

  public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf)
        .append(warning ? " Warning: " : " Error: ")
        .append(getMessage());
  }
}

// End CompileException.java
