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

import static net.hydromatic.ambit.compile.ResolverFixture.labels;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import net.hydromatic.ambit.ast.CallSite;
import net.hydromatic.ambit.ast.Declaration;
import net.hydromatic.ambit.ast.Pos;
import net.hydromatic.ambit.type.NamedType;
import net.hydromatic.ambit.type.Substitution;
import net.hydromatic.ambit.type.Subtyping;
import net.hydromatic.ambit.type.Type;
import net.hydromatic.ambit.type.TypeVar;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests for {@link OrderedResolver} and {@link OrderedAssignments}. */
public class OrderedResolverTest {
  private final ResolverFixture f = new ResolverFixture();
  private final NamedType widget = f.type("Widget");
  private final NamedType button = f.type("Button", widget);
  private final NamedType session = f.type("Session");
  private final NamedType logger = f.type("Logger");
  private final NamedType intType = f.type("Int");

  private Verdict resolve(Declaration declaration, CallSite callSite) {
    return new OrderedResolver(f.ts, true)
        .resolve(declaration, f.contexts(), callSite);
  }

  private Verdict resolve(Declaration declaration) {
    return resolve(declaration, CallSite.unqualified(declaration.name));
  }

  /** Receivers bind to contexts that were entered in the same order. */
  @Test void testInOrder() {
    final Declaration render = f.ordered("render", widget, session);
    final ContextFrame outer = f.push("outer", widget);
    final ContextFrame inner = f.push("inner", session);
    final Verdict verdict = resolve(render);
    assertThat(verdict.isResolved(), is(true));
    final ReceiverBinding binding = verdict.binding();
    assertThat(binding.frame(0), is(outer));
    assertThat(binding.frame(1), is(inner));
    assertThat(binding.positions(), is(ImmutableList.of(0, 1)));
    assertThat(binding.isMonotonic(), is(true));
    assertThat(binding.toString(),
        is("ordered (Widget, Session).render: Widget = outer, "
            + "Session = inner"));
  }

  /** With the contexts entered in the opposite order, there is no
   * order-preserving assignment. */
  @Test void testSwapped() {
    final Declaration render = f.ordered("render", widget, session);
    f.push("outer", session);
    f.push("inner", widget);
    assertThat(resolve(render), is(Verdict.notApplicable()));
  }

  /** The explicit receiver binds the last receiver and sits after the
   * innermost context, so the implicit receivers may use every context. */
  @Test void testQualified() {
    final Declaration render = f.ordered("render", widget, session);
    f.push("outer", session);
    f.push("inner", widget);
    final CallSite callSite =
        CallSite.qualified("render", session, "s");
    final Verdict verdict = resolve(render, callSite);
    assertThat(labels(verdict), is("[inner, s]"));
    final ContextFrame explicit = verdict.binding().frame(1);
    assertThat(explicit.kind, is(ContextFrame.Kind.EXPLICIT));
    assertThat(explicit.ordinal, is(2));

    // The explicit receiver must match the last receiver type
    assertThat(resolve(render, CallSite.qualified("render", logger, "log")),
        is(Verdict.notApplicable()));
    // ... and may be a subtype
    final Declaration click = f.ordered("click", session, widget);
    assertThat(labels(resolve(click, CallSite.qualified("click", button, "b"))),
        is("[outer, b]"));
  }

  /** A single receiver with an explicit receiver and no contexts. */
  @Test void testSingleReceiverNoContexts() {
    final Declaration inc = f.ordered("inc", intType);
    final Verdict verdict = resolve(inc, CallSite.qualified("inc", intType, 1));
    assertThat(labels(verdict), is("[1]"));
    assertThat(verdict.binding().frame(0).value, is(1));
    assertThat(resolve(inc), is(Verdict.notApplicable()));
  }

  /** Each receiver, from the last to the first, claims the innermost context
   * it can. */
  @Test void testInnermost() {
    final Declaration render = f.ordered("render", widget, session);
    f.push("w1", widget);
    f.push("w2", widget);
    f.push("s1", session);
    f.push("log", logger);
    f.push("s2", session);
    assertThat(labels(resolve(render)), is("[w2, s2]"));

    // A Button after the innermost Session cannot be used
    f.push("b", button);
    assertThat(labels(resolve(render)), is("[w2, s2]"));
  }

  /** The greedy scan passes over a context that is closer but would break
   * the order. */
  @Test void testSkipCloser() {
    final Declaration render = f.ordered("render", widget, session);
    f.push("w1", widget);
    f.push("s1", session);
    f.push("w2", widget);
    assertThat(labels(resolve(render)), is("[w1, s1]"));
  }

  @Test void testGlobal() {
    final Declaration log = f.ordered("log", logger, widget, session);
    f.pushGlobal("g", logger);
    f.push("w", button);
    f.push("s", session);
    assertThat(labels(resolve(log)), is("[g, w, s]"));
  }

  /** Type parameters are bound as receivers are matched, last first. */
  @Test void testGeneric() {
    final NamedType box = f.genericType("Box");
    final TypeVar t = new TypeVar("T");
    final Declaration put =
        f.table.add(
            Declaration.of("put", Declaration.Mode.ORDERED,
                ImmutableList.of(t),
                ImmutableList.of(f.ts.type("Box", t), t),
                Pos.ZERO));
    assertThat(box.toString(), is("Box<T>"));
    f.push("box", f.ts.type("Box", intType));
    f.push("n", intType);
    final Verdict verdict = resolve(put);
    assertThat(labels(verdict), is("[box, n]"));
    assertThat(verdict.binding().substitution.toString(), is("[Int/T]"));
    assertThat(verdict.binding().boundType(0).toString(), is("Box<Int>"));

    // The explicit receiver fixes T
    assertThat(labels(resolve(put, CallSite.qualified("put", intType, 7))),
        is("[box, 7]"));
    assertThat(resolve(put, CallSite.qualified("put", widget, "w")),
        is(Verdict.notApplicable()));
  }

  @Test void testWrongMode() {
    final Declaration draw = f.unordered("draw", widget);
    assertThrows(IllegalArgumentException.class, () -> resolve(draw));
  }

  /** Resolution reads the stack but never changes it. */
  @Test void testStackUnchanged() {
    final Declaration render = f.ordered("render", widget, session);
    f.push("outer", widget);
    f.push("inner", session);
    final List<ContextFrame> before = f.contexts();
    resolve(render);
    resolve(render, CallSite.qualified("render", session, "s"));
    assertThat(f.contexts(), is(before));
    assertThat(f.stack.size(), is(2));
  }

  @Test void testAllAssignments() {
    final Declaration render = f.ordered("render", widget, session);
    f.push("w1", widget);
    f.push("w2", widget);
    f.push("s1", session);
    f.push("s2", session);
    final List<ReceiverBinding> bindings =
        OrderedAssignments.all(f.ts, render, f.contexts(),
            CallSite.unqualified("render"));
    final List<String> list = new ArrayList<>();
    bindings.forEach(b -> list.add(b.positions().toString()));
    Collections.sort(list);
    assertThat(list.toString(),
        is("[[0, 2], [0, 3], [1, 2], [1, 3]]"));
    final ReceiverBinding last = OrderedAssignments.last(bindings);
    assertThat(last, notNullValue());
    assertThat(last.positions(), is(ImmutableList.of(1, 3)));
    assertThat(OrderedAssignments.last(ImmutableList.of()), nullValue());
  }

  /** Verification detects a greedy result that disagrees with the
   * exhaustive enumeration; here, because the subtype relation changes
   * between the two. */
  @Test void testVerifyDetectsMismatch() {
    final Declaration render = f.ordered("render", widget);
    f.push("w", widget);
    final AtomicInteger calls = new AtomicInteger();
    final Subtyping flaky = new Subtyping() {
      @Override public boolean isSubtype(Type type, Type superType) {
        return f.ts.isSubtype(type, superType);
      }

      @Override public @Nullable Substitution match(Type type,
          Type declaredType, Substitution substitution) {
        return calls.getAndIncrement() == 0
            ? f.ts.match(type, declaredType, substitution)
            : null;
      }
    };
    final AmbiguousBindingException e =
        assertThrows(AmbiguousBindingException.class, () ->
            new OrderedResolver(flaky, true)
                .resolve(render, f.contexts(), CallSite.unqualified("render")));
    assertThat(e.bindings.size(), is(1));

    // Without verification, the greedy result stands
    calls.set(0);
    assertThat(
        labels(new OrderedResolver(flaky, false)
            .resolve(render, f.contexts(), CallSite.unqualified("render"))),
        is("[w]"));
  }

  /** On random hierarchies, stacks and declarations, the greedy scan finds
   * a binding if and only if an order-preserving assignment exists, and the
   * binding is the canonical one. */
  @Test void testGreedyAgreesWithExhaustive() {
    final Random random = new Random(1234);
    for (int round = 0; round < 200; round++) {
      final ResolverFixture f2 = new ResolverFixture();
      final List<NamedType> types = f2.randomHierarchy(random, 6);
      f2.pushRandom(random, types, 7);
      final List<NamedType> shuffled = new ArrayList<>(types);
      Collections.shuffle(shuffled, random);
      final int n = 1 + random.nextInt(4);
      final Declaration declaration =
          Declaration.of("f", Declaration.Mode.ORDERED, shuffled.subList(0, n));
      final CallSite callSite = random.nextBoolean()
          ? CallSite.unqualified("f")
          : CallSite.qualified("f",
              types.get(random.nextInt(types.size())), "x");

      final Verdict verdict = new OrderedResolver(f2.ts, false)
          .resolve(declaration, f2.contexts(), callSite);
      final ReceiverBinding last =
          OrderedAssignments.last(
              OrderedAssignments.all(f2.ts, declaration, f2.contexts(),
                  callSite));
      if (last == null) {
        assertThat(verdict, is(Verdict.notApplicable()));
      } else {
        assertThat(verdict, is(Verdict.resolved(last)));
        final ReceiverBinding binding = verdict.binding();
        assertThat(binding.isMonotonic(), is(true));
        for (int i = 0; i < n; i++) {
          assertThat(f2.ts.isSubtype(binding.frame(i).type,
              declaration.receiverType(i)), is(true));
        }
      }
      // With verification on, resolution agrees and does not throw
      assertThat(new OrderedResolver(f2.ts, true)
          .resolve(declaration, f2.contexts(), callSite), is(verdict));
    }
  }

  /** With one receiver, resolution is classic extension-function lookup.
   * An unqualified call binds the innermost context whose type is a
   * subtype; a qualified call binds the explicit receiver if its type is a
   * subtype, and does not apply otherwise. */
  @Test void testSingleReceiverIsClassicLookup() {
    final Random random = new Random(5678);
    for (int round = 0; round < 200; round++) {
      final ResolverFixture f2 = new ResolverFixture();
      final List<NamedType> types = f2.randomHierarchy(random, 5);
      f2.pushRandom(random, types, 5);
      final NamedType type = types.get(random.nextInt(types.size()));
      final Declaration declaration =
          Declaration.of("f", Declaration.Mode.ORDERED,
              ImmutableList.of(type));
      final CallSite callSite = random.nextBoolean()
          ? CallSite.unqualified("f")
          : CallSite.qualified("f",
              types.get(random.nextInt(types.size())), "x");
      final @Nullable String expected = f2.classicLookup(type, callSite);
      final Verdict verdict = new OrderedResolver(f2.ts, true)
          .resolve(declaration, f2.contexts(), callSite);
      if (expected == null) {
        assertThat(verdict, is(Verdict.notApplicable()));
      } else {
        assertThat(labels(verdict), is("[" + expected + "]"));
      }
    }
  }

  /** Resolving the same call concurrently gives equal verdicts. */
  @Test void testDeterministic() throws Exception {
    final Declaration render = f.ordered("render", widget, session);
    f.push("w1", widget);
    f.push("s1", session);
    f.push("w2", button);
    f.push("s2", session);
    final List<ContextFrame> contexts = f.contexts();
    final OrderedResolver resolver = new OrderedResolver(f.ts, true);
    final Verdict expected =
        resolver.resolve(render, contexts, CallSite.unqualified("render"));
    final ExecutorService executor = Executors.newFixedThreadPool(4);
    try {
      final List<Future<Verdict>> futures = new ArrayList<>();
      for (int i = 0; i < 32; i++) {
        futures.add(
            executor.submit(() ->
                resolver.resolve(render, contexts,
                    CallSite.unqualified("render"))));
      }
      for (Future<Verdict> future : futures) {
        assertThat(future.get(), is(expected));
      }
    } finally {
      executor.shutdown();
      assertThat(executor.awaitTermination(10, TimeUnit.SECONDS), is(true));
    }
    assertThat(labels(expected), is("[w2, s2]"));
  }
}

// End OrderedResolverTest.java
