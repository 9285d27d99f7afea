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
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.ambit.ast.CallSite;
import net.hydromatic.ambit.ast.Declaration;
import net.hydromatic.ambit.type.Subtyping;

/**
 * Chooses among the declarations of an overload set.
 *
 * <p>Each declaration is resolved on its own, by the resolver for its mode.
 * If more than one applies, the most specific wins. Binding {@code B1} is
 * more specific than {@code B2} if they have the same number of receivers,
 * each receiver type of {@code B1} is a subtype of the corresponding receiver
 * type of {@code B2}, and the converse does not hold. Receiver types are
 * compared after type parameters have been replaced.
 *
 * <p>If both declarations are ordered, receivers correspond by position. If
 * either is unordered, its receivers are a set, and they correspond by any
 * one-to-one pairing that makes each receiver type of {@code B1} a subtype
 * of its partner in {@code B2}.
 *
 * <p>If no binding is more specific than all the others, the verdict is
 * ambiguous, and lists the bindings that no other binding beats.
 */
public class OverloadResolver {
  private final Subtyping subtyping;
  private final ReceiverResolver orderedResolver;
  private final ReceiverResolver unorderedResolver;
  private final Tracer tracer;

  public OverloadResolver(Subtyping subtyping,
      ReceiverResolver orderedResolver, ReceiverResolver unorderedResolver,
      Tracer tracer) {
    this.subtyping = requireNonNull(subtyping);
    this.orderedResolver = requireNonNull(orderedResolver);
    this.unorderedResolver = requireNonNull(unorderedResolver);
    this.tracer = requireNonNull(tracer);
  }

  /** Creates an OverloadResolver with the standard resolvers. */
  public static OverloadResolver create(Subtyping subtyping,
      boolean verifyOrdered, Tracer tracer) {
    return new OverloadResolver(subtyping,
        new OrderedResolver(subtyping, verifyOrdered),
        new UnorderedResolver(subtyping), tracer);
  }

  /** Returns the resolver for a declaration's mode. */
  ReceiverResolver resolverFor(Declaration declaration) {
    switch (declaration.mode) {
    case ORDERED:
      return orderedResolver;
    case UNORDERED:
      return unorderedResolver;
    default:
      throw new AssertionError(declaration.mode);
    }
  }

  /** Resolves a call site against every declaration in an overload set. */
  public Verdict resolve(OverloadSet overloadSet, List<ContextFrame> contexts,
      CallSite callSite) {
    final List<ReceiverBinding> bindings = new ArrayList<>();
    for (Declaration declaration : overloadSet) {
      final Verdict verdict =
          resolverFor(declaration).resolve(declaration, contexts, callSite);
      tracer.onCandidate(callSite, declaration, verdict);
      if (verdict.isResolved()) {
        bindings.add(verdict.binding());
      }
    }
    final Verdict verdict = choose(bindings);
    tracer.onVerdict(callSite, verdict);
    return verdict;
  }

  /** Chooses the most specific of a list of bindings. */
  Verdict choose(List<ReceiverBinding> bindings) {
    switch (bindings.size()) {
    case 0:
      return Verdict.notApplicable();
    case 1:
      return Verdict.resolved(bindings.get(0));
    default:
      final ImmutableList.Builder<ReceiverBinding> maximal =
          ImmutableList.builder();
      for (ReceiverBinding binding : bindings) {
        if (bindings.stream()
            .noneMatch(other -> isMoreSpecific(other, binding))) {
          maximal.add(binding);
        }
      }
      final List<ReceiverBinding> list = maximal.build();
      // Specificity is a strict partial order, so a unique maximal binding
      // is more specific than every other.
      return list.size() == 1
          ? Verdict.resolved(list.get(0))
          : Verdict.ambiguous(list);
    }
  }

  /** Returns whether binding {@code b1} is more specific than {@code b2}. */
  public boolean isMoreSpecific(ReceiverBinding b1, ReceiverBinding b2) {
    if (b1.frames.size() != b2.frames.size()) {
      return false;
    }
    final boolean positional =
        b1.declaration.mode == Declaration.Mode.ORDERED
            && b2.declaration.mode == Declaration.Mode.ORDERED;
    return covers(b1, b2, positional) && !covers(b2, b1, positional);
  }

  /** Returns whether each bound type of {@code b1} is a subtype of a
   * distinct bound type of {@code b2}; if {@code positional}, of the bound
   * type at the same position. */
  private boolean covers(ReceiverBinding b1, ReceiverBinding b2,
      boolean positional) {
    if (positional) {
      for (int i = 0; i < b1.frames.size(); i++) {
        if (!subtyping.isSubtype(b1.boundType(i), b2.boundType(i))) {
          return false;
        }
      }
      return true;
    }
    return cover(b1, b2, 0, new boolean[b2.frames.size()]);
  }

  /** Pairs receiver {@code i} of {@code b1}, and those after it, with unused
   * receivers of {@code b2}, backtracking on failure. */
  private boolean cover(ReceiverBinding b1, ReceiverBinding b2, int i,
      boolean[] used) {
    if (i == b1.frames.size()) {
      return true;
    }
    for (int j = 0; j < used.length; j++) {
      if (!used[j]
          && subtyping.isSubtype(b1.boundType(i), b2.boundType(j))) {
        used[j] = true;
        if (cover(b1, b2, i + 1, used)) {
          return true;
        }
        used[j] = false;
      }
    }
    return false;
  }
}

// End OverloadResolver.java
