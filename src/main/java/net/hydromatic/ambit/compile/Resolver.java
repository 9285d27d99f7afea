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

import java.util.List;
import net.hydromatic.ambit.ast.CallSite;
import net.hydromatic.ambit.type.Subtyping;

/**
 * Resolves call sites against a table of declarations.
 *
 * <p>Holds no mutable state of its own; a single instance may resolve call
 * sites for several threads, each passing a snapshot of its own stack.
 */
public class Resolver {
  private final DeclarationTable table;
  private final OverloadResolver overloadResolver;

  public Resolver(DeclarationTable table, OverloadResolver overloadResolver) {
    this.table = requireNonNull(table);
    this.overloadResolver = requireNonNull(overloadResolver);
  }

  /** Creates a Resolver with the standard resolvers. */
  public static Resolver create(Subtyping subtyping, DeclarationTable table,
      boolean verifyOrdered, Tracer tracer) {
    return new Resolver(table,
        OverloadResolver.create(subtyping, verifyOrdered, tracer));
  }

  /**
   * Resolves a call site.
   *
   * @param contexts Contexts in scope, outermost first, as returned by
   *     {@link ReceiverStack#currentStack()}
   * @param callSite Call site
   */
  public Verdict resolve(List<ContextFrame> contexts, CallSite callSite) {
    for (int j = 0; j < contexts.size(); j++) {
      if (contexts.get(j).ordinal != j) {
        throw new IllegalArgumentException("context " + contexts.get(j)
            + " has ordinal " + contexts.get(j).ordinal + ", expected " + j);
      }
    }
    return overloadResolver.resolve(table.overloads(callSite.name), contexts,
        callSite);
  }

  /**
   * Resolves a call site and builds the call.
   *
   * @throws ResolutionException if no declaration applies, or if several
   *     apply and none is most specific
   */
  public BoundCall bind(List<ContextFrame> contexts, CallSite callSite) {
    final Verdict verdict = resolve(contexts, callSite);
    switch (verdict.kind) {
    case RESOLVED:
      return CallBuilder.build(callSite, verdict.binding());
    case NOT_APPLICABLE:
      throw new ResolutionException(
          ResolutionException.Kind.NO_VALID_BINDING,
          "no applicable declaration for " + callSite, callSite,
          verdict.bindings());
    case AMBIGUOUS:
      throw new ResolutionException(
          ResolutionException.Kind.AMBIGUOUS_OVERLOAD,
          "ambiguous call " + callSite + "; "
              + verdict.bindings().size()
              + " declarations apply and none is most specific",
          callSite, verdict.bindings());
    default:
      throw new AssertionError(verdict.kind);
    }
  }
}

// End Resolver.java
