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
import java.util.List;
import java.util.Objects;
import net.hydromatic.ambit.ast.Declaration;
import net.hydromatic.ambit.type.Substitution;
import net.hydromatic.ambit.type.Type;

/**
 * Assignment of a context to each receiver of a declaration.
 *
 * <p>The {@code i}th frame is the context bound to the {@code i}th declared
 * receiver. In ordered mode, frame ordinals strictly increase with {@code i};
 * in unordered mode, two receivers may be bound to the same frame.
 */
public class ReceiverBinding {
  public final Declaration declaration;
  public final ImmutableList<ContextFrame> frames;
  /** Assignment of type parameters that made the receivers match. */
  public final Substitution substitution;

  ReceiverBinding(
      Declaration declaration,
      List<ContextFrame> frames,
      Substitution substitution) {
    this.declaration = requireNonNull(declaration);
    this.frames = ImmutableList.copyOf(frames);
    this.substitution = requireNonNull(substitution);
    checkArgument(this.frames.size() == declaration.arity(),
        "expected %s frames, got %s", declaration.arity(), frames.size());
  }

  /** Returns the context bound to the {@code i}th receiver. */
  public ContextFrame frame(int i) {
    return frames.get(i);
  }

  /** Returns the stack position of the context bound to the {@code i}th
   * receiver. */
  public int position(int i) {
    return frames.get(i).ordinal;
  }

  /** Returns the stack positions, in declared order. */
  public List<Integer> positions() {
    final ImmutableList.Builder<Integer> list = ImmutableList.builder();
    frames.forEach(frame -> list.add(frame.ordinal));
    return list.build();
  }

  /** Returns the declared type of the {@code i}th receiver, with type
   * parameters replaced by the types they were matched to. */
  public Type boundType(int i) {
    return declaration.receiverType(i).substitute(substitution);
  }

  /** Returns whether positions strictly increase in declared order. */
  public boolean isMonotonic() {
    for (int i = 1; i < frames.size(); i++) {
      if (position(i - 1) >= position(i)) {
        return false;
      }
    }
    return true;
  }

  @Override
  public int hashCode() {
    return Objects.hash(declaration, frames, substitution);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof ReceiverBinding
            && declaration == ((ReceiverBinding) obj).declaration
            && frames.equals(((ReceiverBinding) obj).frames)
            && substitution.equals(((ReceiverBinding) obj).substitution);
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /** Writes a description such as
   * "{@code ordered (Widget, Session).render: Widget = w, Session = s}". */
  public StringBuilder describeTo(StringBuilder buf) {
    declaration.describeTo(buf).append(':');
    for (int i = 0; i < frames.size(); i++) {
      buf.append(i > 0 ? ", " : " ")
          .append(boundType(i))
          .append(" = ")
          .append(frames.get(i).label);
    }
    return buf;
  }
}

// End ReceiverBinding.java
