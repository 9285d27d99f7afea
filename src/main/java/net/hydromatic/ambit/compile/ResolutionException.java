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
import java.util.List;
import net.hydromatic.ambit.ast.CallSite;

/** A call site that cannot be bound to a declaration. */
public class ResolutionException extends CompileException {
  public final Kind kind;
  public final CallSite callSite;
  /** Competing bindings; empty unless the kind is
   * {@link Kind#AMBIGUOUS_OVERLOAD}. */
  public final ImmutableList<ReceiverBinding> candidates;

  public ResolutionException(Kind kind, String message, CallSite callSite,
      List<ReceiverBinding> candidates) {
    super(message, callSite.pos);
    this.kind = requireNonNull(kind);
    this.callSite = callSite;
    this.candidates = ImmutableList.copyOf(candidates);
  }

  /** Why the call cannot be bound. */
  public enum Kind {
    /** No declaration of that name applies in the current contexts. */
    NO_VALID_BINDING,
    /** Several declarations apply and none is most specific. */
    AMBIGUOUS_OVERLOAD
  }
}

// End ResolutionException.java
