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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.ambit.ast.CallSite;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Invocation built from a call site and the binding it resolved to.
 *
 * <p>The receivers are passed as positional arguments in declared order.
 * Inside the callable, each receiver is addressed as {@code this@Name},
 * where {@code Name} is the simple name of its declared type, and the
 * default receiver is addressed as plain {@code this}.
 */
public class BoundCall {
  public final CallSite callSite;
  public final ReceiverBinding binding;
  /** Values of the bound contexts, in declared order. */
  public final ImmutableList<Object> arguments;
  /** Bound contexts keyed by the simple name of the receiver type, in
   * declared order. */
  public final ImmutableMap<String, ContextFrame> receivers;
  /** Context that unqualified {@code this} refers to. */
  public final ContextFrame defaultReceiver;

  BoundCall(CallSite callSite, ReceiverBinding binding,
      ImmutableList<Object> arguments,
      ImmutableMap<String, ContextFrame> receivers,
      ContextFrame defaultReceiver) {
    this.callSite = requireNonNull(callSite);
    this.binding = requireNonNull(binding);
    this.arguments = requireNonNull(arguments);
    this.receivers = requireNonNull(receivers);
    this.defaultReceiver = requireNonNull(defaultReceiver);
  }

  /** Returns the context for {@code this@name}, or null. */
  public @Nullable ContextFrame qualifiedThis(String name) {
    return receivers.get(name);
  }

  @Override
  public String toString() {
    final StringBuilder b = new StringBuilder(callSite.name).append('(');
    for (int i = 0; i < binding.frames.size(); i++) {
      b.append(i > 0 ? ", " : "").append(binding.frame(i).label);
    }
    return b.append(')').toString();
  }
}

// End BoundCall.java
