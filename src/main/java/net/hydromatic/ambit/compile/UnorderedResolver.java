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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.ambit.ast.CallSite;
import net.hydromatic.ambit.ast.Declaration;
import net.hydromatic.ambit.type.Substitution;
import net.hydromatic.ambit.type.Subtyping;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Resolves declarations whose receivers form a set.
 *
 * <p>Each receiver, taken in declared order, binds to the closest context
 * whose type is a subtype of the receiver's type, scanning from the innermost
 * context outwards to the global contexts. Receivers are bound independently;
 * if one context satisfies two receivers, both bind to it.
 *
 * <p>If the call is qualified, the explicit receiver is treated as the
 * innermost context, and at least one receiver must bind to it. With a single
 * receiver, this is classic extension-function lookup.
 */
public class UnorderedResolver implements ReceiverResolver {
  private final Subtyping subtyping;

  public UnorderedResolver(Subtyping subtyping) {
    this.subtyping = requireNonNull(subtyping);
  }

  @Override
  public Verdict resolve(Declaration declaration, List<ContextFrame> contexts,
      CallSite callSite) {
    checkArgument(declaration.mode == Declaration.Mode.UNORDERED,
        "not unordered: %s", declaration);
    final List<ContextFrame> contextList;
    final @Nullable ContextFrame explicit;
    if (callSite.isQualified()) {
      explicit = ContextFrame.explicit(callSite, contexts.size());
      contextList =
          ImmutableList.<ContextFrame>builder()
              .addAll(contexts)
              .add(explicit)
              .build();
    } else {
      explicit = null;
      contextList = contexts;
    }

    final List<ContextFrame> frames = new ArrayList<>();
    Substitution substitution = Substitution.EMPTY;
    boolean explicitBound = false;
    for (int x = 0; x < declaration.arity(); x++) {
      @Nullable Substitution s = null;
      int y = contextList.size() - 1;
      for (; y >= 0; --y) {
        s = subtyping.match(contextList.get(y).type,
            declaration.receiverType(x), substitution);
        if (s != null) {
          break;
        }
      }
      if (s == null) {
        return Verdict.notApplicable();
      }
      final ContextFrame frame = contextList.get(y);
      explicitBound |= frame == explicit;
      frames.add(frame);
      substitution = s;
    }
    if (explicit != null && !explicitBound) {
      return Verdict.notApplicable();
    }
    return Verdict.resolved(
        new ReceiverBinding(declaration, frames, substitution));
  }
}

// End UnorderedResolver.java
