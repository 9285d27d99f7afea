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
package net.hydromatic.ambit.eval;

import static java.util.Objects.requireNonNull;

import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.ambit.compile.DeclarationTable;
import net.hydromatic.ambit.compile.ReceiverStack;
import net.hydromatic.ambit.compile.Resolver;
import net.hydromatic.ambit.compile.Tracer;
import net.hydromatic.ambit.type.TypeSystem;

/**
 * State of a run of statements: property values, declared types and
 * callables, and the contexts currently in scope.
 */
public class Session {
  /** Property values. */
  public final Map<Prop, Object> map;

  public final TypeSystem typeSystem = new TypeSystem();
  public final DeclarationTable declarations;
  public final ReceiverStack stack;
  private final Tracer tracer;

  /** Creates a Session. */
  public Session(Map<Prop, Object> map, Tracer tracer) {
    this.map = new LinkedHashMap<>(map);
    this.tracer = requireNonNull(tracer);
    this.declarations = new DeclarationTable(tracer);
    this.stack = new ReceiverStack(tracer);
  }

  /** Creates a resolver that uses the current property values. */
  public Resolver resolver() {
    return Resolver.create(typeSystem, declarations,
        Prop.VERIFY_ORDERED_BINDING.booleanValue(map), tracer);
  }
}

// End Session.java
