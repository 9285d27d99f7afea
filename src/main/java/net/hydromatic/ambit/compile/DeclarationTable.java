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

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ListMultimap;
import com.google.common.collect.MultimapBuilder;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import net.hydromatic.ambit.ast.Declaration;
import net.hydromatic.ambit.type.Substitution;
import net.hydromatic.ambit.type.Type;
import net.hydromatic.ambit.type.TypeShuttle;
import net.hydromatic.ambit.type.TypeVar;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Declarations, grouped by name.
 *
 * <p>A declaration is checked when it is added; if it is invalid, it throws
 * {@link DefinitionException} and is not added, so the resolvers only ever
 * see valid declarations.
 *
 * <p>Adding is not thread-safe. Once declarations have been added, {@link
 * #overloads(String)} may be called from any thread.
 */
public class DeclarationTable {
  private final ListMultimap<String, Declaration> declarations =
      MultimapBuilder.linkedHashKeys().arrayListValues().build();
  private final Tracer tracer;

  public DeclarationTable(Tracer tracer) {
    this.tracer = requireNonNull(tracer);
  }

  public DeclarationTable() {
    this(Tracers.empty());
  }

  /** Checks a declaration and adds it. */
  public Declaration add(Declaration declaration) {
    validate(declaration);
    declarations.put(declaration.name, declaration);
    tracer.onDeclaration(declaration);
    return declaration;
  }

  /** Returns the declarations with a given name; empty if there are
   * none. */
  public OverloadSet overloads(String name) {
    return new OverloadSet(name, declarations.get(name));
  }

  /** Returns the names that have at least one declaration. */
  public Set<String> names() {
    return ImmutableSet.copyOf(declarations.keySet());
  }

  /**
   * Checks that a declaration has at least one receiver, that every type
   * variable it uses is one of its parameters, that no receiver type occurs
   * twice, and that no two receiver types have the same simple name.
   *
   * <p>For a generic declaration, two receiver types are also duplicates if
   * some assignment of the type parameters makes them identical; for
   * example, {@code T} and {@code Int} are identical when {@code T} is
   * {@code Int}.
   *
   * @throws DefinitionException if the declaration is invalid
   */
  public static void validate(Declaration declaration) {
    if (declaration.arity() == 0) {
      throw new DefinitionException(DefinitionException.Kind.NO_RECEIVERS,
          "declaration " + declaration + " has no receivers",
          declaration.pos);
    }
    for (Type type : declaration.receiverTypes) {
      type.accept(
          new TypeShuttle() {
            @Override
            public Type visit(TypeVar typeVar) {
              if (!declaration.typeParameters.contains(typeVar)) {
                throw new DefinitionException(
                    DefinitionException.Kind.UNKNOWN_TYPE,
                    "unknown type variable " + typeVar + " in declaration "
                        + declaration,
                    declaration.pos);
              }
              return typeVar;
            }
          });
    }
    final Map<Type, Integer> typeIndexes = new HashMap<>();
    final Map<String, Integer> nameIndexes = new HashMap<>();
    for (int i = 0; i < declaration.arity(); i++) {
      final Type type = declaration.receiverType(i);
      if (typeIndexes.putIfAbsent(type, i) != null) {
        throw new DefinitionException(
            DefinitionException.Kind.DUPLICATE_RECEIVER_TYPE,
            "duplicate receiver type " + type + " in declaration "
                + declaration,
            declaration.pos);
      }
      final Integer j = nameIndexes.putIfAbsent(type.simpleName(), i);
      if (j != null) {
        throw new DefinitionException(
            DefinitionException.Kind.RECEIVER_NAME_CLASH,
            "receiver types " + declaration.receiverType(j) + " and " + type
                + " of declaration " + declaration
                + " have the same simple name '" + type.simpleName() + "'",
            declaration.pos);
      }
    }
    if (declaration.isGeneric()) {
      for (int i = 0; i < declaration.arity(); i++) {
        for (int j = i + 1; j < declaration.arity(); j++) {
          final Type type1 = declaration.receiverType(i);
          final Type type2 = declaration.receiverType(j);
          final @Nullable Substitution s =
              Substitution.EMPTY.unify(type1, type2);
          if (s != null) {
            throw new DefinitionException(
                DefinitionException.Kind.DUPLICATE_RECEIVER_TYPE,
                "receiver types " + type1 + " and " + type2
                    + " of declaration " + declaration
                    + " are identical under substitution " + s,
                declaration.pos);
          }
        }
      }
    }
  }
}

// End DeclarationTable.java
