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

import com.google.common.collect.ImmutableList;

/**
 * Visitor that copies a type, replacing component types.
 *
 * <p>If no component changes, returns the original type.
 */
public class TypeShuttle implements TypeVisitor<Type> {
  @Override
  public Type visit(NamedType namedType) {
    final ImmutableList.Builder<Type> args = ImmutableList.builder();
    boolean changed = false;
    for (Type arg : namedType.args) {
      final Type arg2 = arg.accept(this);
      changed |= arg2 != arg;
      args.add(arg2);
    }
    return changed ? new NamedType(namedType.name, args.build()) : namedType;
  }

  @Override
  public Type visit(TypeVar typeVar) {
    return typeVar;
  }
}

// End TypeShuttle.java
