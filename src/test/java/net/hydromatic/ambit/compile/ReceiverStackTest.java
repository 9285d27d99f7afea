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

import static org.hamcrest.CoreMatchers.instanceOf;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;
import net.hydromatic.ambit.type.NamedType;
import org.junit.jupiter.api.Test;

/** Tests for {@link ReceiverStack}. */
public class ReceiverStackTest {
  private final ResolverFixture f = new ResolverFixture();
  private final NamedType widget = f.type("Widget");
  private final NamedType session = f.type("Session");

  @Test void testPushPop() {
    final ReceiverStack stack = new ReceiverStack();
    assertThat(stack.isEmpty(), is(true));
    final ReceiverStack.Scope outer = stack.push(widget, "w");
    final ReceiverStack.Scope inner = stack.push(session, 42, "s");
    assertThat(stack.size(), is(2));
    assertThat(stack.currentStack().toString(),
        is("[w : Widget, s : Session]"));
    assertThat(outer.frame.ordinal, is(0));
    assertThat(inner.frame.ordinal, is(1));
    assertThat(inner.frame.value, is(42));
    assertThat(inner.frame.kind, is(ContextFrame.Kind.RECEIVER));
    assertThat(stack.peek(), is(inner));

    stack.pop(inner);
    assertThat(inner.isPopped(), is(true));
    assertThat(outer.isPopped(), is(false));
    stack.pop(outer);
    assertThat(stack.isEmpty(), is(true));
    assertThrows(IllegalArgumentException.class, stack::peek);
  }

  /** A snapshot does not change when the stack changes. */
  @Test void testSnapshot() {
    final ReceiverStack stack = new ReceiverStack();
    final ReceiverStack.Scope scope = stack.push(widget, "w");
    final List<ContextFrame> snapshot = stack.currentStack();
    stack.push(session, "s");
    assertThat(snapshot.size(), is(1));
    assertThat(stack.currentStack().size(), is(2));
    assertThat(stack.currentStack().get(0), is(scope.frame));
  }

  @Test void testPopOutOfOrder() {
    final ReceiverStack stack = new ReceiverStack();
    final ReceiverStack.Scope outer = stack.push(widget, "w");
    stack.push(session, "s");
    final StackDisciplineException e =
        assertThrows(StackDisciplineException.class, () -> stack.pop(outer));
    assertThat(e.getMessage(),
        is("cannot pop frame w : Widget out of order; "
            + "innermost frame is s : Session"));
    // The failed pop left the stack unchanged
    assertThat(stack.size(), is(2));
    assertThat(outer.isPopped(), is(false));
  }

  @Test void testPopTwice() {
    final ReceiverStack stack = new ReceiverStack();
    final ReceiverStack.Scope scope = stack.push(widget, "w");
    scope.close();
    final StackDisciplineException e =
        assertThrows(StackDisciplineException.class, scope::close);
    assertThat(e.getMessage(), is("frame w : Widget already popped"));
  }

  @Test void testPopOtherStack() {
    final ReceiverStack stack = new ReceiverStack();
    final ReceiverStack other = new ReceiverStack();
    final ReceiverStack.Scope scope = other.push(widget, "w");
    stack.push(widget, "w");
    final StackDisciplineException e =
        assertThrows(StackDisciplineException.class, () -> stack.pop(scope));
    assertThat(e.getMessage(),
        is("frame w : Widget belongs to a different stack"));
  }

  @Test void testGlobal() {
    final ReceiverStack stack = new ReceiverStack();
    stack.pushGlobal(widget, "g1", "g1");
    stack.pushGlobal(session, "g2", "g2");
    assertThat(stack.peek().frame.kind, is(ContextFrame.Kind.GLOBAL));
    stack.push(widget, "w");
    final StackDisciplineException e =
        assertThrows(StackDisciplineException.class, () ->
            stack.pushGlobal(session, "g3", "g3"));
    assertThat(e.getMessage(),
        is("cannot push global context g3 inside receiver w"));
    assertThat(stack.size(), is(3));
  }

  /** A try-with-resources block pops its frame on every exit path. */
  @Test void testScopeClosedOnException() {
    final ReceiverStack stack = new ReceiverStack();
    stack.push(widget, "w");
    assertThrows(IllegalStateException.class, () -> {
      try (ReceiverStack.Scope ignored = stack.push(session, "s")) {
        assertThat(stack.size(), is(2));
        throw new IllegalStateException("boom");
      }
    });
    assertThat(stack.size(), is(1));
    assertThat(stack.peek().frame.label, is("w"));
  }

  @Test void testWith() {
    final ReceiverStack stack = new ReceiverStack();
    final Supplier<Integer> innerSize = () ->
        stack.with(session, "s", (Supplier<Integer>) stack::size);
    final int size = stack.with(widget, "w", innerSize);
    assertThat(size, is(2));
    assertThat(stack.isEmpty(), is(true));

    final RuntimeException e =
        assertThrows(RuntimeException.class, () ->
            stack.with(widget, "w", (Runnable) () -> {
              throw new RuntimeException("inner failure");
            }));
    assertThat(e.getMessage(), is("inner failure"));
    assertThat(stack.isEmpty(), is(true));
  }

  /** If the body fails and then the frame cannot be popped, the body's
   * exception wins and the pop failure is attached to it. */
  @Test void testWithPopFails() {
    final ReceiverStack stack = new ReceiverStack();
    final RuntimeException e =
        assertThrows(RuntimeException.class, () ->
            stack.with(widget, "w", (Runnable) () -> {
              stack.pop(stack.peek());
              throw new RuntimeException("inner failure");
            }));
    assertThat(e.getMessage(), is("inner failure"));
    assertThat(e.getSuppressed().length, is(1));
    assertThat(e.getSuppressed()[0],
        instanceOf(StackDisciplineException.class));
    assertThat(e.getSuppressed()[0].getMessage(),
        is("frame w : Widget already popped"));

    // If the body succeeds, the pop failure propagates
    final StackDisciplineException e2 =
        assertThrows(StackDisciplineException.class, () ->
            stack.with(widget, "w",
                (Runnable) () -> stack.pop(stack.peek())));
    assertThat(e2.getMessage(), is("frame w : Widget already popped"));
    assertThat(stack.isEmpty(), is(true));
  }

  @Test void testPeekEmpty() {
    final ReceiverStack stack = new ReceiverStack();
    final IllegalStateException e =
        assertThrows(IllegalStateException.class, stack::peek);
    assertThat(e.getMessage(), is("stack is empty"));
  }

  @Test void testTracer() {
    final List<String> events = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnPush(tracer, frame -> events.add("push " + frame));
    tracer = Tracers.withOnPop(tracer, frame -> events.add("pop " + frame));
    final ReceiverStack stack = new ReceiverStack(tracer);
    try (ReceiverStack.Scope outer = stack.push(widget, "w")) {
      stack.with(session, "s", (Runnable) () -> events.add("body"));
    }
    assertThat(events.toString(),
        is("[push w : Widget, push s : Session, body, pop s : Session, "
            + "pop w : Widget]"));
  }
}

// End ReceiverStackTest.java
