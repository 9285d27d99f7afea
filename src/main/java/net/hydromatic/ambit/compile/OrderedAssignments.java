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
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import net.hydromatic.ambit.ast.CallSite;
import net.hydromatic.ambit.ast.Declaration;
import net.hydromatic.ambit.type.Substitution;
import net.hydromatic.ambit.type.Subtyping;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Enumerates every order-preserving assignment of an ordered declaration's
 * receivers to contexts.
 *
 * <p>The number of assignments can be exponential in the number of
 * receivers, so this is only used to check {@link OrderedResolver}.
 */
public abstract class OrderedAssignments {
  private OrderedAssignments() {}

  /** Orders bindings by the position of the last receiver, then the
   * next-to-last, and so on. The canonical binding is the greatest. */
  public static final Comparator<ReceiverBinding> LEXICOGRAPHIC =
      (b1, b2) -> {
        for (int i = b1.frames.size() - 1; i >= 0; --i) {
          final int c = Integer.compare(b1.position(i), b2.position(i));
          if (c != 0) {
            return c;
          }
        }
        return 0;
      };

  /** Returns all valid assignments. */
  public static List<ReceiverBinding> all(Subtyping subtyping,
      Declaration declaration, List<ContextFrame> contexts,
      CallSite callSite) {
    final ImmutableList.Builder<ReceiverBinding> list =
        ImmutableList.builder();
    final int n = declaration.arity();
    final ContextFrame[] frames = new ContextFrame[n];
    if (callSite.isQualified()) {
      final @Nullable Substitution s =
          subtyping.match(requireNonNull(callSite.receiverType),
              declaration.explicitReceiverType(), Substitution.EMPTY);
      if (s != null) {
        frames[n - 1] = ContextFrame.explicit(callSite, contexts.size());
        enumerate(subtyping, declaration, contexts, frames, n - 2,
            contexts.size(), s, list);
      }
    } else {
      enumerate(subtyping, declaration, contexts, frames, n - 1,
          contexts.size(), Substitution.EMPTY, list);
    }
    return list.build();
  }

  private static void enumerate(Subtyping subtyping, Declaration declaration,
      List<ContextFrame> contexts, ContextFrame[] frames, int i, int upper,
      Substitution substitution, ImmutableList.Builder<ReceiverBinding> list) {
    if (i < 0) {
      list.add(
          new ReceiverBinding(declaration, Arrays.asList(frames.clone()),
              substitution));
      return;
    }
    for (int j = upper - 1; j >= 0; --j) {
      final @Nullable Substitution s =
          subtyping.match(contexts.get(j).type, declaration.receiverType(i),
              substitution);
      if (s != null) {
        frames[i] = contexts.get(j);
        enumerate(subtyping, declaration, contexts, frames, i - 1, j, s,
            list);
      }
    }
  }

  /** Returns the lexicographically last binding, or null if the list is
   * empty. */
  public static @Nullable ReceiverBinding last(
      List<ReceiverBinding> bindings) {
    return bindings.stream().max(LEXICOGRAPHIC).orElse(null);
  }
}

// End OrderedAssignments.java
