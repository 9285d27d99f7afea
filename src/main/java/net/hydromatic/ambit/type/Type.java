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
package net.hydromatic.ambit.type;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Type.
 *
 * <p>Types are immutable. Two types are equal if they have the same structure;
 * for example, two separately constructed instances of "{@code List<Int>}" are
 * equal.
 */
public interface Type {
  /**
   * Simple name of the type, e.g. "{@code List}" for "{@code List<Int>}".
   *
   * <p>It is the name by which a receiver of this type is addressed in a
   * qualified {@code this@Name} expression. Type arguments are erased, so
   * "{@code List<Int>}" and "{@code List<String>}" have the same simple name.
   */
  String simpleName();

  /** Type arguments; empty for type variables and non-generic types. */
  List<Type> args();

  <R> R accept(TypeVisitor<R> typeVisitor);

  /**
   * Returns a copy of this type, specialized by substituting type parameters.
   */
  default Type substitute(Substitution substitution) {
    if (substitution.isEmpty()) {
      return this;
    }
    return accept(
        new TypeShuttle() {
          @Override
          public Type visit(TypeVar typeVar) {
            final Type type = substitution.get(typeVar);
            return type != null ? type : typeVar;
          }
        });
  }

  /** Returns whether this type contains no type variables. */
  default boolean isGround() {
    final AtomicInteger c = new AtomicInteger();
    accept(
        new TypeShuttle() {
          @Override
          public Type visit(TypeVar typeVar) {
            c.incrementAndGet();
            return typeVar;
          }
        });
    return c.get() == 0;
  }
}

// End Type.java
