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

import java.util.Arrays;
import java.util.List;
import net.hydromatic.ambit.ast.CallSite;
import net.hydromatic.ambit.ast.Declaration;
import net.hydromatic.ambit.type.Substitution;
import net.hydromatic.ambit.type.Subtyping;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Resolves declarations whose receivers are positional.
 *
 * <p>Receiver {@code T[i]} must bind to a context {@code I[j(i)]} such that
 * {@code I[j(i)]} is a subtype of {@code T[i]} and {@code j(1) < j(2) < ... <
 * j(n)}. Of all such assignments, the canonical one binds each receiver, from
 * the last to the first, to the innermost context it can claim.
 *
 * <p>A greedy scan finds it in O(n &middot; m) steps: scan the contexts
 * inwards-out for {@code T[n]}, then continue outwards from just below that
 * match for {@code T[n-1]}, and so on. If a scan runs out of contexts, the
 * declaration does not apply.
 *
 * <p>If the call is qualified, {@code T[n]} binds to the explicit receiver,
 * which sits after the innermost context, and only {@code T[1] .. T[n-1]} are
 * scanned.
 *
 * <p>For a generic declaration, each match extends the substitution made by
 * earlier matches, and a context whose type is inconsistent with it is
 * skipped.
 */
public class OrderedResolver implements ReceiverResolver {
  private final Subtyping subtyping;
  private final boolean verify;

  /**
   * Creates an OrderedResolver.
   *
   * @param subtyping Subtype predicate
   * @param verify Whether to check each result against an exhaustive
   *     enumeration of assignments
   */
  public OrderedResolver(Subtyping subtyping, boolean verify) {
    this.subtyping = requireNonNull(subtyping);
    this.verify = verify;
  }

  @Override
  public Verdict resolve(Declaration declaration, List<ContextFrame> contexts,
      CallSite callSite) {
    checkArgument(declaration.mode == Declaration.Mode.ORDERED,
        "not ordered: %s", declaration);
    final Verdict verdict = scan(declaration, contexts, callSite);
    if (verify && !declaration.isGeneric()) {
      verify(declaration, contexts, callSite, verdict);
    }
    return verdict;
  }

  private Verdict scan(Declaration declaration, List<ContextFrame> contexts,
      CallSite callSite) {
    final int n = declaration.arity();
    final ContextFrame[] frames = new ContextFrame[n];
    Substitution substitution = Substitution.EMPTY;
    int i = n - 1;
    int upper = contexts.size();
    if (callSite.isQualified()) {
      final @Nullable Substitution s =
          subtyping.match(requireNonNull(callSite.receiverType),
              declaration.explicitReceiverType(), substitution);
      if (s == null) {
        return Verdict.notApplicable();
      }
      substitution = s;
      frames[i--] = ContextFrame.explicit(callSite, contexts.size());
    }
    for (; i >= 0; --i) {
      @Nullable Substitution s = null;
      int j = upper - 1;
      for (; j >= 0; --j) {
        s = subtyping.match(contexts.get(j).type,
            declaration.receiverType(i), substitution);
        if (s != null) {
          break;
        }
      }
      if (s == null) {
        return Verdict.notApplicable();
      }
      frames[i] = contexts.get(j);
      substitution = s;
      upper = j;
    }
    return Verdict.resolved(
        new ReceiverBinding(declaration, Arrays.asList(frames), substitution));
  }

  /** Checks that the greedy result is the lexicographically last of all
   * valid assignments. */
  private void verify(Declaration declaration, List<ContextFrame> contexts,
      CallSite callSite, Verdict verdict) {
    final List<ReceiverBinding> bindings =
        OrderedAssignments.all(subtyping, declaration, contexts, callSite);
    final @Nullable ReceiverBinding last = OrderedAssignments.last(bindings);
    if (last == null) {
      if (verdict.isResolved()) {
        throw new AmbiguousBindingException("greedy scan bound "
            + verdict.binding() + " but there is no valid assignment",
            verdict.bindings());
      }
      return;
    }
    if (!verdict.isResolved()) {
      throw new AmbiguousBindingException("greedy scan found no binding "
          + "for " + declaration + " but " + bindings.size()
          + " assignment(s) exist", bindings);
    }
    if (!last.equals(verdict.binding())) {
      throw new AmbiguousBindingException("greedy scan bound "
          + verdict.binding() + " but canonical assignment is " + last,
          Arrays.asList(verdict.binding(), last));
    }
  }
}

// End OrderedResolver.java
