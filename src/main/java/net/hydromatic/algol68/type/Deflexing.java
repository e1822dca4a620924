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

/**
 * How FLEX is treated when comparing modes.
 *
 * <p>A flexible row may be used where a fixed row is required, but a name of a
 * fixed row must not become a name of a flexible row.
 */
public enum Deflexing {
  /** Modes must be identical. */
  NO,
  /** Deflex values but not names. */
  SAFE,
  /** Deflex names too, for identity relations. */
  ALIAS,
  /** Deflex both sides completely. */
  FORCE,
  /** Ignore FLEX entirely; used only for diagnostics. */
  SKIP
}

// End Deflexing.java
