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
package net.hydromatic.ambit.ast;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Locale;
import net.hydromatic.ambit.type.Type;
import net.hydromatic.ambit.type.TypeVar;

/**
 * Declaration of a callable that has one or more receivers.
 *
 * <p>The receiver types {@code T[1] .. T[n]} are held in declared order. In
 * {@link Mode#ORDERED ordered} mode the last, {@code T[n]}, is the explicit
 * receiver (the target before the dot at a call site) and the others are
 * implicit. In {@link Mode#UNORDERED unordered} mode the order is only used to
 * make resolution deterministic.
 *
 * <p>A declaration is immutable. It is checked when it is added to a {@link
 * net.hydromatic.ambit.compile.DeclarationTable}, not here.
 */
public class Declaration {
  public final String name;
  public final Mode mode;
  public final ImmutableList<TypeVar> typeParameters;
  public final ImmutableList<Type> receiverTypes;
  public final Pos pos;

  private Declaration(
      String name,
      Mode mode,
      ImmutableList<TypeVar> typeParameters,
      ImmutableList<Type> receiverTypes,
      Pos pos) {
    this.name = requireNonNull(name);
    this.mode = requireNonNull(mode);
    this.typeParameters = requireNonNull(typeParameters);
    this.receiverTypes = requireNonNull(receiverTypes);
    this.pos = requireNonNull(pos);
  }

  /** Creates a declaration. */
  public static Declaration of(
      String name,
      Mode mode,
      List<TypeVar> typeParameters,
      List<? extends Type> receiverTypes,
      Pos pos) {
    return new Declaration(
        name,
        mode,
        ImmutableList.copyOf(typeParameters),
        ImmutableList.copyOf(receiverTypes),
        pos);
  }

  /** Creates a declaration with no type parameters and no position. */
  public static Declaration of(
      String name, Mode mode, List<? extends Type> receiverTypes) {
    return of(name, mode, ImmutableList.of(), receiverTypes, Pos.ZERO);
  }

  /** Number of receivers, {@code n}. */
  public int arity() {
    return receiverTypes.size();
  }

  /** Returns the declared type of the {@code i}th receiver (zero-based). */
  public Type receiverType(int i) {
    return receiverTypes.get(i);
  }

  /** The explicit receiver type, {@code T[n]}. */
  public Type explicitReceiverType() {
    return receiverTypes.get(receiverTypes.size() - 1);
  }

  /** Returns whether this declaration has type parameters. */
  public boolean isGeneric() {
    return !typeParameters.isEmpty();
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /**
   * Writes a description such as "{@code ordered <T> (List<T>, T).first}".
   */
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(mode.lowerName).append(' ');
    if (!typeParameters.isEmpty()) {
      buf.append('<');
      for (int i = 0; i < typeParameters.size(); i++) {
        buf.append(i > 0 ? ", " : "").append(typeParameters.get(i));
      }
      buf.append("> ");
    }
    buf.append('(');
    for (int i = 0; i < receiverTypes.size(); i++) {
      buf.append(i > 0 ? ", " : "").append(receiverTypes.get(i));
    }
    return buf.append(").").append(name);
  }

  /** How receivers are matched to contexts. */
  public enum Mode {
    /** Receivers bind to contexts in the same relative order as declared. */
    ORDERED,
    /** Each receiver binds to the closest matching context, independently. */
    UNORDERED;

    public final String lowerName = name().toLowerCase(Locale.ROOT);
  }
}

// End Declaration.java
