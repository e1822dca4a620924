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

import net.hydromatic.algol68.type.Mode;
import net.hydromatic.algol68.type.ModeGraph;

/** Builds the table of the standard environment, which encloses every
 * program. */
public class StandardEnvironment {
  private StandardEnvironment() {}

  /** Creates a level-0 table holding a tag for each mode of each
   * {@link BuiltIn}. */
  public static Table create(ModeGraph graph) {
    final Table table = new Table(null);
    for (BuiltIn builtIn : BuiltIn.values()) {
      for (Mode mode : builtIn.modes(graph)) {
        table.add(builtIn.kind, builtIn.symbol, null, mode);
      }
    }
    return table;
  }
}

// End StandardEnvironment.java
