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

import static com.google.common.base.Preconditions.checkState;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import net.hydromatic.ambit.type.Type;

/**
 * The contexts in scope at the current point of a traversal, outermost first.
 *
 * <p>Frames are pushed when a scope that introduces a receiver begins, and
 * popped when it ends, in strict reverse order. The usual pattern is
 *
 * <blockquote><pre>
 * try (ReceiverStack.Scope scope = stack.push(type, value)) {
 *   ...
 * }</pre></blockquote>
 *
 * <p>which pops the frame on every exit path.
 *
 * <p>Global contexts are pushed first, by {@link #pushGlobal}, and form the
 * bottom of the stack.
 *
 * <p>Not thread-safe. Each traversal owns its own stack; resolvers work on the
 * immutable snapshot returned by {@link #currentStack()}.
 */
public class ReceiverStack {
  private final List<Scope> scopes = new ArrayList<>();
  private final Tracer tracer;

  public ReceiverStack(Tracer tracer) {
    this.tracer = requireNonNull(tracer);
  }

  public ReceiverStack() {
    this(Tracers.empty());
  }

  /** Pushes a receiver whose label is the string value of the receiver. */
  public Scope push(Type type, Object value) {
    return push(type, value, String.valueOf(value));
  }

  /** Pushes a receiver. */
  public Scope push(Type type, Object value, String label) {
    return push_(ContextFrame.Kind.RECEIVER, type, value, label);
  }

  /** Pushes a global context. Must be called before any receiver is
   * pushed. */
  public Scope pushGlobal(Type type, Object value, String label) {
    if (!scopes.isEmpty()
        && peek().frame.kind != ContextFrame.Kind.GLOBAL) {
      throw new StackDisciplineException("cannot push global context "
          + label + " inside receiver " + peek().frame.label);
    }
    return push_(ContextFrame.Kind.GLOBAL, type, value, label);
  }

  private Scope push_(ContextFrame.Kind kind, Type type, Object value,
      String label) {
    final ContextFrame frame =
        new ContextFrame(kind, type, value, label, scopes.size());
    final Scope scope = new Scope(frame);
    scopes.add(scope);
    tracer.onPush(frame);
    return scope;
  }

  /** Pops a frame. It must be the innermost frame of this stack, and must
   * not have been popped already. */
  public void pop(Scope scope) {
    requireNonNull(scope, "scope");
    if (scope.stack() != this) {
      throw new StackDisciplineException("frame " + scope.frame
          + " belongs to a different stack");
    }
    if (scope.popped) {
      throw new StackDisciplineException("frame " + scope.frame
          + " already popped");
    }
    if (scopes.isEmpty() || peek() != scope) {
      throw new StackDisciplineException("cannot pop frame " + scope.frame
          + " out of order; innermost frame is "
          + (scopes.isEmpty() ? "none" : peek().frame));
    }
    scopes.remove(scopes.size() - 1);
    scope.popped = true;
    tracer.onPop(scope.frame);
  }

  /** Returns the innermost scope; throws if the stack is empty. */
  public Scope peek() {
    checkState(!scopes.isEmpty(), "stack is empty");
    return scopes.get(scopes.size() - 1);
  }

  /** Returns the number of frames. */
  public int size() {
    return scopes.size();
  }

  public boolean isEmpty() {
    return scopes.isEmpty();
  }

  /** Returns an immutable snapshot of the frames, outermost first. */
  public ImmutableList<ContextFrame> currentStack() {
    final ImmutableList.Builder<ContextFrame> list = ImmutableList.builder();
    scopes.forEach(scope -> list.add(scope.frame));
    return list.build();
  }

  /** Evaluates a supplier with a receiver pushed, and pops the receiver
   * afterwards, even if the supplier throws.
   *
   * <p>If the supplier throws and the pop then fails, the supplier's
   * exception propagates, with the {@link StackDisciplineException} added
   * as a suppressed exception. */
  public <R> R with(Type type, Object value, Supplier<R> supplier) {
    try (Scope ignored = push(type, value)) {
      return supplier.get();
    }
  }

  /** Runs an action with a receiver pushed, and pops the receiver
   * afterwards, even if the action throws. Exceptions propagate as in
   * {@link #with(Type, Object, Supplier)}. */
  public void with(Type type, Object value, Runnable runnable) {
    try (Scope ignored = push(type, value)) {
      runnable.run();
    }
  }

  /** Handle to a pushed frame. Closing it pops the frame. */
  public class Scope implements AutoCloseable {
    public final ContextFrame frame;
    private boolean popped;

    private Scope(ContextFrame frame) {
      this.frame = frame;
    }

    ReceiverStack stack() {
      return ReceiverStack.this;
    }

    /** Returns whether this frame has been popped. */
    public boolean isPopped() {
      return popped;
    }

    @Override
    public void close() {
      pop(this);
    }

    @Override
    public String toString() {
      return frame.toString();
    }
  }
}

// End ReceiverStack.java
