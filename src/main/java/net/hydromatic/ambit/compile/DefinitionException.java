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
package net.hydromatic.ambit.compile;

import static java.util.Objects.requireNonNull;

import net.hydromatic.ambit.ast.Pos;

/**
 * Error in a declaration, reported at the site of the declaration before any
 * call site is resolved.
 */
public class DefinitionException extends CompileException {
  public final Kind kind;

  public DefinitionException(Kind kind, String message, Pos pos) {
    super(message, pos);
    this.kind = requireNonNull(kind);
  }

  /** What is wrong with the declaration. */
  public enum Kind {
    /** The same receiver type occurs twice. */
    DUPLICATE_RECEIVER_TYPE,
    /** Two receiver types have the same simple name, so {@code this@Name}
     * would not identify a receiver. */
    RECEIVER_NAME_CLASH,
    /** The declaration has no receivers. */
    NO_RECEIVERS,
    /** A type name is not declared, or a type variable is not a parameter of
     * the declaration. */
    UNKNOWN_TYPE,
    /** A type has the wrong number of type arguments. */
    TYPE_ARITY,
    /** A type or type parameter is declared twice. */
    DUPLICATE_NAME
  }
}

// End DefinitionException.java
