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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Type variable (e.g. {@code T}).
 *
 * <p>A type variable is a parameter of a declaration; it is scoped to that
 * declaration, and two declarations may each have a variable called {@code T}
 * without the variables being related.
 */
public class TypeVar implements Type {
  public final String name;

  public TypeVar(String name) {
    checkArgument(!name.isEmpty(), "empty type variable name");
    this.name = name;
  }

  @Override
  public int hashCode() {
    return name.hashCode() + 6563;
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof TypeVar && name.equals(((TypeVar) obj).name);
  }

  @Override
  public String toString() {
    return name;
  }

  @Override
  public String simpleName() {
    return name;
  }

  @Override
  public List<Type> args() {
    return ImmutableList.of();
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }

  @Override
  public Type substitute(Substitution substitution) {
    final Type type = substitution.get(this);
    return type != null ? type : this;
  }
}

// End TypeVar.java
