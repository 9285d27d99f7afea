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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableMap;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Immutable assignment of types to type variables.
 *
 * <p>Printed in the same style as a unifier's substitution: "{@code [Int/T,
 * String/U]}" means that {@code T} is {@code Int} and {@code U} is {@code
 * String}.
 */
public class Substitution {
  public static final Substitution EMPTY = new Substitution(ImmutableMap.of());

  private final ImmutableMap<TypeVar, Type> map;

  private Substitution(ImmutableMap<TypeVar, Type> map) {
    this.map = map;
  }

  /** Creates a substitution from a map. */
  public static Substitution of(Map<TypeVar, ? extends Type> map) {
    return map.isEmpty() ? EMPTY : new Substitution(ImmutableMap.copyOf(map));
  }

  /** Returns the type assigned to a variable, or null. */
  public @Nullable Type get(TypeVar typeVar) {
    return map.get(typeVar);
  }

  public boolean isEmpty() {
    return map.isEmpty();
  }

  /**
   * Returns a substitution that is this plus one more assignment. The variable
   * must not already be assigned.
   */
  public Substitution plus(TypeVar typeVar, Type type) {
    checkArgument(!map.containsKey(typeVar), "already bound: %s", typeVar);
    return new Substitution(
        ImmutableMap.<TypeVar, Type>builder()
            .putAll(map)
            .put(typeVar, type)
            .build());
  }

  /**
   * Extends this substitution so that two types become identical, or returns
   * null if no substitution can make them identical.
   *
   * <p>Both types may contain variables. For example, unifying {@code T} with
   * {@code Int} gives {@code [Int/T]}; unifying {@code Box<T>} with {@code T}
   * fails, because {@code T} would contain itself.
   */
  public @Nullable Substitution unify(Type type1, Type type2) {
    final Type t1 = walk(type1);
    final Type t2 = walk(type2);
    if (t1.equals(t2)) {
      return this;
    }
    if (t1 instanceof TypeVar) {
      return bind((TypeVar) t1, t2);
    }
    if (t2 instanceof TypeVar) {
      return bind((TypeVar) t2, t1);
    }
    final NamedType n1 = (NamedType) t1;
    final NamedType n2 = (NamedType) t2;
    if (!n1.name.equals(n2.name) || n1.args.size() != n2.args.size()) {
      return null;
    }
    @Nullable Substitution s = this;
    for (int i = 0; i < n1.args.size() && s != null; i++) {
      s = s.unify(n1.args.get(i), n2.args.get(i));
    }
    return s;
  }

  /** Follows assignments until the type is not an assigned variable. */
  private Type walk(Type type) {
    Type t = type;
    while (t instanceof TypeVar && map.containsKey(t)) {
      t = map.get(t);
    }
    return t;
  }

  private @Nullable Substitution bind(TypeVar typeVar, Type type) {
    return occurs(typeVar, type) ? null : plus(typeVar, type);
  }

  private boolean occurs(TypeVar typeVar, Type type) {
    final Type t = walk(type);
    if (t.equals(typeVar)) {
      return true;
    }
    for (Type arg : t.args()) {
      if (occurs(typeVar, arg)) {
        return true;
      }
    }
    return false;
  }

  @Override
  public int hashCode() {
    return map.hashCode();
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof Substitution && map.equals(((Substitution) obj).map);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder("[");
    map.forEach(
        (typeVar, type) -> {
          if (b.length() > 1) {
            b.append(", ");
          }
          b.append(type).append('/').append(typeVar);
        });
    return b.append(']').toString();
  }
}

// End Substitution.java
