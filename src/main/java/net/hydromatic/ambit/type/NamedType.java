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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * Type that has a name and zero or more type arguments, e.g. "{@code Widget}",
 * "{@code List<Int>}", "{@code Map<String, T>}".
 *
 * <p>Instances are created by {@link TypeSystem#type}, which checks that the
 * name is declared and that the number of arguments matches.
 */
public class NamedType implements Type {
  public final String name;
  public final ImmutableList<Type> args;

  NamedType(String name, List<? extends Type> args) {
    this.name = requireNonNull(name);
    this.args = ImmutableList.copyOf(args);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, args);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof NamedType
            && name.equals(((NamedType) obj).name)
            && args.equals(((NamedType) obj).args);
  }

  @Override
  public String toString() {
    if (args.isEmpty()) {
      return name;
    }
    final StringBuilder b = new StringBuilder(name).append('<');
    for (int i = 0; i < args.size(); i++) {
      if (i > 0) {
        b.append(", ");
      }
      b.append(args.get(i));
    }
    return b.append('>').toString();
  }

  @Override
  public String simpleName() {
    return name;
  }

  @Override
  public List<Type> args() {
    return args;
  }

  @Override
  public <R> R accept(TypeVisitor<R> typeVisitor) {
    return typeVisitor.visit(this);
  }
}

// End NamedType.java
