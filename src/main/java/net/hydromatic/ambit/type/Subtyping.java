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

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Subtype predicate, plus matching of generic types.
 *
 * <p>The resolvers in {@link net.hydromatic.ambit.compile} rely on nothing but
 * this interface, so a host type checker can plug in its own rules. {@link
 * TypeSystem} is the implementation used by the shell and by tests.
 *
 * <p>Implementations must be safe to call from several threads at once.
 */
public interface Subtyping {
  /**
   * Returns whether {@code type} is a subtype of {@code superType}. Every type
   * is a subtype of itself.
   */
  boolean isSubtype(Type type, Type superType);

  /**
   * Finds an extension of a substitution under which a ground type is a
   * subtype of a declared type that may contain type variables.
   *
   * <p>For example, matching {@code ArrayList<Int>} against {@code List<T>}
   * with an empty substitution returns {@code [Int/T]}; matching the same type
   * against {@code List<T>} with {@code [String/T]} returns null.
   *
   * @param type Ground type, typically the type of a context
   * @param declaredType Declared receiver type
   * @param substitution Assignments made so far
   * @return Extended substitution, or null if there is no match
   */
  @Nullable Substitution match(
      Type type, Type declaredType, Substitution substitution);
}

// End Subtyping.java
