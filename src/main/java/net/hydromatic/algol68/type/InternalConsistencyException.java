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
 * Thrown when the mode system finds that its own invariants do not hold; for
 * example, a row mode without an element mode, or a derivation that does not
 * reach a fixed point.
 *
 * <p>Unlike a {@link net.hydromatic.algol68.compile.CompileException}, which
 * describes an error in the user's program and is collected, this aborts the
 * compilation.
 */
public class InternalConsistencyException extends RuntimeException {
  public InternalConsistencyException(String message) {
    super(message);
  }
}

// End InternalConsistencyException.java
