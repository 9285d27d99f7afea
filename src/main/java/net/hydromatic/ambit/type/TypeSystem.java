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
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A nominal type hierarchy.
 *
 * <p>Each named type is declared once, with its type parameters and its direct
 * supertypes. Supertypes must already be declared, so the hierarchy has no
 * cycles. Type arguments are invariant: {@code List<Circle>} is not a subtype
 * of {@code List<Shape>}.
 *
 * <p>Every type is a subtype of {@link #ANY}, which is declared when the type
 * system is created.
 *
 * <p>Declaring types is not thread-safe; once all types are declared, the
 * {@link Subtyping} methods may be called from any thread.
 */
public class TypeSystem implements Subtyping {
  /** Name of the root type. */
  public static final String ANY = "Any";

  private final Map<String, TypeDef> typeDefs = new LinkedHashMap<>();

  public final NamedType anyType;

  public TypeSystem() {
    anyType = declare(ANY, ImmutableList.of(), ImmutableList.of());
  }

  /**
   * Declares a named type.
   *
   * @param name Name of the type; must not already be declared
   * @param parameters Type parameters
   * @param superTypes Direct supertypes; may reference {@code parameters};
   *     if empty, the supertype is {@link #ANY}
   * @return The type applied to its own parameters, e.g. {@code List<T>}
   */
  public NamedType declare(
      String name,
      List<TypeVar> parameters,
      List<? extends Type> superTypes) {
    checkArgument(!typeDefs.containsKey(name), "type %s already declared",
        name);
    checkArgument(
        new HashSet<>(parameters).size() == parameters.size(),
        "duplicate type parameter in %s",
        name);
    for (Type superType : superTypes) {
      checkArgument(
          superType instanceof NamedType,
          "supertype %s must be a named type",
          superType);
      checkArgument(
          typeDefs.containsKey(((NamedType) superType).name),
          "unknown supertype %s",
          superType);
      checkVariables(superType, parameters);
    }
    final TypeDef typeDef =
        new TypeDef(
            name, ImmutableList.copyOf(parameters),
            ImmutableList.copyOf(superTypes));
    typeDefs.put(name, typeDef);
    return new NamedType(name, parameters);
  }

  private static void checkVariables(Type type, List<TypeVar> parameters) {
    type.accept(
        new TypeShuttle() {
          @Override
          public Type visit(TypeVar typeVar) {
            checkArgument(
                parameters.contains(typeVar),
                "unknown type variable %s",
                typeVar);
            return typeVar;
          }
        });
  }

  /** Returns whether a type of the given name has been declared. */
  public boolean isDeclared(String name) {
    return typeDefs.containsKey(name);
  }

  /**
   * Returns the number of type parameters of a declared type, or -1 if the
   * type is not declared.
   */
  public int arity(String name) {
    final TypeDef typeDef = typeDefs.get(name);
    return typeDef == null ? -1 : typeDef.parameters.size();
  }

  /**
   * Creates an instance of a declared type. The number of arguments must match
   * the number of parameters.
   */
  public NamedType type(String name, Type... args) {
    return type(name, ImmutableList.copyOf(args));
  }

  /**
   * Creates an instance of a declared type. The number of arguments must match
   * the number of parameters.
   */
  public NamedType type(String name, List<? extends Type> args) {
    final TypeDef typeDef = typeDefs.get(name);
    checkArgument(typeDef != null, "unknown type %s", name);
    checkArgument(
        typeDef.parameters.size() == args.size(),
        "type %s expects %s argument(s), got %s",
        name,
        typeDef.parameters.size(),
        args.size());
    return new NamedType(name, args);
  }

  /** Returns the direct supertypes of a type, with arguments substituted. */
  public List<NamedType> directSuperTypes(NamedType type) {
    final TypeDef typeDef =
        requireNonNull(typeDefs.get(type.name), type.name);
    if (typeDef.superTypes.isEmpty()) {
      return type.name.equals(ANY)
          ? ImmutableList.of()
          : ImmutableList.of(anyType);
    }
    final Map<TypeVar, Type> map = new LinkedHashMap<>();
    for (int i = 0; i < typeDef.parameters.size(); i++) {
      map.put(typeDef.parameters.get(i), type.args.get(i));
    }
    final Substitution substitution = Substitution.of(map);
    final ImmutableList.Builder<NamedType> list = ImmutableList.builder();
    for (Type superType : typeDef.superTypes) {
      list.add((NamedType) superType.substitute(substitution));
    }
    return list.build();
  }

  /**
   * Returns a type and all of its supertypes, nearest first. Each type occurs
   * once.
   */
  public List<NamedType> superTypes(NamedType type) {
    final ImmutableList.Builder<NamedType> list = ImmutableList.builder();
    final Set<NamedType> seen = new HashSet<>();
    final Deque<NamedType> queue = new ArrayDeque<>();
    queue.add(type);
    while (!queue.isEmpty()) {
      final NamedType t = queue.remove();
      if (seen.add(t)) {
        list.add(t);
        queue.addAll(directSuperTypes(t));
      }
    }
    return list.build();
  }

  @Override
  public boolean isSubtype(Type type, Type superType) {
    if (type.equals(superType)) {
      return true;
    }
    if (type instanceof TypeVar) {
      return superType.equals(anyType);
    }
    if (!superType.isGround()) {
      return false;
    }
    return match(type, superType, Substitution.EMPTY) != null;
  }

  @Override
  public @Nullable Substitution match(
      Type type, Type declaredType, Substitution substitution) {
    if (declaredType instanceof TypeVar) {
      final TypeVar typeVar = (TypeVar) declaredType;
      final Type bound = substitution.get(typeVar);
      if (bound != null) {
        return isSubtype(type, bound) ? substitution : null;
      }
      return substitution.plus(typeVar, type);
    }
    final NamedType namedType = (NamedType) declaredType;
    if (!(type instanceof NamedType)) {
      // A type variable is only known to be a subtype of itself and of Any.
      return namedType.equals(anyType) ? substitution : null;
    }
    for (NamedType superType : superTypes((NamedType) type)) {
      if (superType.name.equals(namedType.name)) {
        final Substitution s = matchArgs(superType, namedType, substitution);
        if (s != null) {
          return s;
        }
      }
    }
    return null;
  }

  /** Matches type arguments; since arguments are invariant, requires
   * equality rather than subtyping. */
  private @Nullable Substitution matchArgs(
      NamedType type, NamedType declaredType, Substitution substitution) {
    Substitution s = substitution;
    for (int i = 0; i < type.args.size(); i++) {
      s = matchExact(type.args.get(i), declaredType.args.get(i), s);
      if (s == null) {
        return null;
      }
    }
    return s;
  }

  private @Nullable Substitution matchExact(
      Type type, Type declaredType, Substitution substitution) {
    if (declaredType instanceof TypeVar) {
      final TypeVar typeVar = (TypeVar) declaredType;
      final Type bound = substitution.get(typeVar);
      if (bound != null) {
        return bound.equals(type) ? substitution : null;
      }
      return substitution.plus(typeVar, type);
    }
    if (!(type instanceof NamedType)) {
      return null;
    }
    final NamedType namedType = (NamedType) type;
    final NamedType declaredNamedType = (NamedType) declaredType;
    if (!namedType.name.equals(declaredNamedType.name)
        || namedType.args.size() != declaredNamedType.args.size()) {
      return null;
    }
    return matchArgs(namedType, declaredNamedType, substitution);
  }

  /** Definition of a named type. */
  private static class TypeDef {
    final String name;
    final ImmutableList<TypeVar> parameters;
    final ImmutableList<Type> superTypes;

    TypeDef(
        String name,
        ImmutableList<TypeVar> parameters,
        ImmutableList<Type> superTypes) {
      this.name = name;
      this.parameters = parameters;
      this.superTypes = superTypes;
    }

    @Override
    public String toString() {
      return name + parameters + " <: " + superTypes;
    }
  }
}

// End TypeSystem.java
