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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import net.hydromatic.ambit.ast.CallSite;
import net.hydromatic.ambit.ast.Declaration;

/** Builds a {@link BoundCall} from a resolved binding. */
public abstract class CallBuilder {
  private CallBuilder() {}

  /**
   * Builds a call.
   *
   * <p>The default receiver is the explicit receiver if the call is
   * qualified; otherwise, for an ordered declaration, the context bound to
   * the last receiver; otherwise the innermost bound context, and if several
   * receivers share it, the first of them.
   */
  public static BoundCall build(CallSite callSite, ReceiverBinding binding) {
    final ImmutableList.Builder<Object> arguments = ImmutableList.builder();
    final ImmutableMap.Builder<String, ContextFrame> receivers =
        ImmutableMap.builder();
    final Declaration declaration = binding.declaration;
    ContextFrame defaultReceiver = binding.frame(0);
    for (int i = 0; i < declaration.arity(); i++) {
      final ContextFrame frame = binding.frame(i);
      arguments.add(frame.value);
      // Simple names are distinct; DeclarationTable checked.
      receivers.put(declaration.receiverType(i).simpleName(), frame);
      if (frame.ordinal > defaultReceiver.ordinal) {
        defaultReceiver = frame;
      }
    }
    if (declaration.mode == Declaration.Mode.ORDERED) {
      defaultReceiver = binding.frame(declaration.arity() - 1);
    }
    return new BoundCall(callSite, binding, arguments.build(),
        receivers.buildOrThrow(), defaultReceiver);
  }
}

// End CallBuilder.java
