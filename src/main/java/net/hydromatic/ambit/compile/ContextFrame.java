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

import java.util.Objects;
import net.hydromatic.ambit.ast.CallSite;
import net.hydromatic.ambit.type.Type;

/**
 * A context in scope at a call site: a value and its type.
 *
 * <p>The ordinal is the frame's position in the stack, zero being the
 * outermost. The explicit receiver of a qualified call is given the ordinal
 * one past the innermost frame.
 */
public class ContextFrame {
  public final Kind kind;
  public final Type type;
  public final Object value;
  public final String label;
  public final int ordinal;

  ContextFrame(Kind kind, Type type, Object value, String label, int ordinal) {
    this.kind = requireNonNull(kind);
    this.type = requireNonNull(type);
    this.value = requireNonNull(value);
    this.label = requireNonNull(label);
    this.ordinal = ordinal;
    checkArgument(ordinal >= 0);
    checkArgument(type.isGround(), "context type must be ground: %s", type);
  }

  /** Creates the frame that represents the explicit receiver of a qualified
   * call, positioned after {@code contextCount} contexts. */
  static ContextFrame explicit(CallSite callSite, int contextCount) {
    checkArgument(callSite.isQualified());
    return new ContextFrame(Kind.EXPLICIT,
        requireNonNull(callSite.receiverType),
        requireNonNull(callSite.receiverValue),
        requireNonNull(callSite.receiverLabel), contextCount);
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, type, value, label, ordinal);
  }

  @Override
  public boolean equals(Object obj) {
    return obj == this
        || obj instanceof ContextFrame
            && kind == ((ContextFrame) obj).kind
            && type.equals(((ContextFrame) obj).type)
            && value.equals(((ContextFrame) obj).value)
            && label.equals(((ContextFrame) obj).label)
            && ordinal == ((ContextFrame) obj).ordinal;
  }

  @Override
  public String toString() {
    return label + " : " + type;
  }

  /** Kind of frame. */
  public enum Kind {
    /** File or global context; at the bottom of the stack. */
    GLOBAL,
    /** Receiver introduced by a scope such as a {@code with} block. */
    RECEIVER,
    /** Explicit receiver of a qualified call; never on the stack. */
    EXPLICIT
  }
}

// End ContextFrame.java
