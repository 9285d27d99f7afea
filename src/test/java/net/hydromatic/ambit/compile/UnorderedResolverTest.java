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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import net.hydromatic.ambit.ast.CallSite;
import net.hydromatic.ambit.ast.Declaration;
import net.hydromatic.ambit.ast.Pos;
import net.hydromatic.ambit.type.NamedType;
import net.hydromatic.ambit.type.TypeVar;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.junit.jupiter.api.Test;

/** Tests for {@link UnorderedResolver}. */
public class UnorderedResolverTest {
  private final ResolverFixture f = new ResolverFixture();
  private final NamedType file = f.type("File");
  private final NamedType shape = f.type("Shape");
  private final NamedType drawable = f.type("Drawable");
  private final NamedType circle = f.type("Circle", shape, drawable);
  private final NamedType widget = f.type("Widget");
  private final NamedType session = f.type("Session");
  private final NamedType logger = f.type("Logger");

  private Verdict resolve(Declaration declaration, CallSite callSite) {
    return new UnorderedResolver(f.ts)
        .resolve(declaration, f.contexts(), callSite);
  }

  private Verdict resolve(Declaration declaration) {
    return resolve(declaration, CallSite.unqualified(declaration.name));
  }

  /** Of two contexts of the same type, the inner one is bound. */
  @Test void testInnermostOfSameType() {
    final Declaration area = f.unordered("area", shape);
    f.pushGlobal("g", file);
    f.push("outer", shape);
    f.push("inner", shape);
    final Verdict verdict = resolve(area);
    assertThat(labels(verdict), is("[inner]"));
    assertThat(verdict.binding().position(0), is(2));
  }

  /** Receivers may appear in any order relative to the contexts. */
  @Test void testAnyOrder() {
    final Declaration render = f.unordered("render", widget, session);
    f.push("s", session);
    f.push("w", widget);
    assertThat(labels(resolve(render)), is("[w, s]"));
    assertThat(resolve(render).binding().isMonotonic(), is(false));
  }

  /** Two receivers may share one context. */
  @Test void testShared() {
    final Declaration paint = f.unordered("paint", shape, drawable);
    f.push("c", circle);
    final Verdict verdict = resolve(paint);
    assertThat(labels(verdict), is("[c, c]"));
    assertThat(verdict.binding().boundType(0), is(shape));
    assertThat(verdict.binding().boundType(1), is(drawable));
  }

  @Test void testMissing() {
    final Declaration render = f.unordered("render", widget, session);
    f.push("w", widget);
    assertThat(resolve(render), is(Verdict.notApplicable()));
  }

  /** The explicit receiver counts as the innermost context, and at least
   * one receiver must bind to it. */
  @Test void testQualified() {
    final Declaration render = f.unordered("render", widget, session);
    f.push("w", widget);
    f.push("s", session);
    assertThat(
        labels(resolve(render, CallSite.qualified("render", widget, "w2"))),
        is("[w2, s]"));
    final Verdict verdict =
        resolve(render, CallSite.qualified("render", session, "s2"));
    assertThat(labels(verdict), is("[w, s2]"));
    assertThat(verdict.binding().frame(1).kind,
        is(ContextFrame.Kind.EXPLICIT));

    // A Logger is not a receiver of render, so nothing binds to it
    assertThat(resolve(render, CallSite.qualified("render", logger, "log")),
        is(Verdict.notApplicable()));
  }

  /** Receivers are matched in declared order, so the substitution made by an
   * earlier receiver constrains a later one. */
  @Test void testGeneric() {
    final NamedType box = f.genericType("Box");
    final NamedType intType = f.type("Int");
    final TypeVar t = new TypeVar("T");
    final Declaration put =
        f.table.add(
            Declaration.of("put", Declaration.Mode.UNORDERED,
                ImmutableList.of(t),
                ImmutableList.of(f.ts.type("Box", t), t),
                Pos.ZERO));
    assertThat(box.args.size(), is(1));
    f.push("n", intType);
    f.push("w", widget);
    f.push("box", f.ts.type("Box", intType));
    final Verdict verdict = resolve(put);
    // T is bound to Int by "box", so "w" cannot bind to T
    assertThat(labels(verdict), is("[box, n]"));
    assertThat(verdict.binding().substitution.toString(), is("[Int/T]"));
  }

  /** With one receiver, resolution is classic extension-function lookup,
   * the same as for an ordered declaration. */
  @Test void testSingleReceiverIsClassicLookup() {
    final Random random = new Random(4321);
    for (int round = 0; round < 200; round++) {
      final ResolverFixture f2 = new ResolverFixture();
      final List<NamedType> types = f2.randomHierarchy(random, 5);
      f2.pushRandom(random, types, 5);
      final NamedType type = types.get(random.nextInt(types.size()));
      final Declaration declaration =
          Declaration.of("f", Declaration.Mode.UNORDERED,
              ImmutableList.of(type));
      final CallSite callSite = random.nextBoolean()
          ? CallSite.unqualified("f")
          : CallSite.qualified("f",
              types.get(random.nextInt(types.size())), "x");
      final @Nullable String expected = f2.classicLookup(type, callSite);
      final Verdict verdict = new UnorderedResolver(f2.ts)
          .resolve(declaration, f2.contexts(), callSite);
      if (expected == null) {
        assertThat(verdict, is(Verdict.notApplicable()));
      } else {
        assertThat(labels(verdict), is("[" + expected + "]"));
      }
      assertThat(
          new OrderedResolver(f2.ts, false)
              .resolve(
                  Declaration.of("f", Declaration.Mode.ORDERED,
                      ImmutableList.of(type)),
                  f2.contexts(), callSite)
              .bindings().size(),
          is(verdict.bindings().size()));
    }
  }

  /** Without an explicit receiver, each of several receivers binds as if it
   * were looked up on its own. */
  @Test void testEachReceiverIsClassicLookup() {
    final Random random = new Random(8765);
    for (int round = 0; round < 200; round++) {
      final ResolverFixture f2 = new ResolverFixture();
      final List<NamedType> types = new ArrayList<>(
          f2.randomHierarchy(random, 6));
      f2.pushRandom(random, types, 6);
      Collections.shuffle(types, random);
      final int n = 1 + random.nextInt(3);
      final Declaration declaration =
          Declaration.of("f", Declaration.Mode.UNORDERED,
              types.subList(0, n));
      final CallSite callSite = CallSite.unqualified("f");
      final Verdict verdict = new UnorderedResolver(f2.ts)
          .resolve(declaration, f2.contexts(), callSite);
      boolean applicable = true;
      for (int i = 0; i < n; i++) {
        final @Nullable String expected =
            f2.classicLookup(declaration.receiverType(i), callSite);
        if (expected == null) {
          applicable = false;
        } else if (verdict.isResolved()) {
          assertThat(verdict.binding().frame(i).label, is(expected));
        }
      }
      assertThat(verdict.isResolved(), is(applicable));
    }
  }

  @Test void testWrongMode() {
    final Declaration render = f.ordered("render", widget);
    assertThrows(IllegalArgumentException.class, () -> resolve(render));
  }
}

// End UnorderedResolverTest.java
