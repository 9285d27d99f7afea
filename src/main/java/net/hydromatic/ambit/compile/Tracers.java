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

import java.util.function.Consumer;
import net.hydromatic.ambit.ast.CallSite;
import net.hydromatic.ambit.ast.Declaration;

/** Implementations of {@link Tracer}. */
public abstract class Tracers {
  private Tracers() {}

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action when a frame is
   * pushed, then calls the underlying tracer. */
  public static Tracer withOnPush(Tracer tracer,
      Consumer<ContextFrame> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onPush(ContextFrame frame) {
        consumer.accept(frame);
        super.onPush(frame);
      }
    };
  }

  /** Returns a tracer that performs the given action when a frame is
   * popped, then calls the underlying tracer. */
  public static Tracer withOnPop(Tracer tracer,
      Consumer<ContextFrame> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onPop(ContextFrame frame) {
        consumer.accept(frame);
        super.onPop(frame);
      }
    };
  }

  public static Tracer withOnDeclaration(Tracer tracer,
      Consumer<Declaration> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onDeclaration(Declaration declaration) {
        consumer.accept(declaration);
        super.onDeclaration(declaration);
      }
    };
  }

  /** Returns a tracer that performs the given action on the verdict for
   * each candidate, then calls the underlying tracer. */
  public static Tracer withOnCandidate(Tracer tracer,
      CandidateConsumer consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onCandidate(CallSite callSite, Declaration declaration,
          Verdict verdict) {
        consumer.accept(callSite, declaration, verdict);
        super.onCandidate(callSite, declaration, verdict);
      }
    };
  }

  /** Returns a tracer that performs the given action on the verdict for a
   * call site, then calls the underlying tracer. */
  public static Tracer withOnVerdict(Tracer tracer,
      Consumer<Verdict> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public void onVerdict(CallSite callSite, Verdict verdict) {
        consumer.accept(verdict);
        super.onVerdict(callSite, verdict);
      }
    };
  }

  /** Returns a tracer that handles compile exceptions by passing them to a
   * consumer. */
  public static Tracer withOnCompileException(Tracer tracer,
      Consumer<CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override
      public boolean handleCompileException(CompileException e) {
        consumer.accept(e);
        super.handleCompileException(e);
        return true;
      }
    };
  }

  /** Action on a candidate's verdict. */
  @FunctionalInterface
  public interface CandidateConsumer {
    void accept(CallSite callSite, Declaration declaration, Verdict verdict);
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override
    public void onPush(ContextFrame frame) {}

    @Override
    public void onPop(ContextFrame frame) {}

    @Override
    public void onDeclaration(Declaration declaration) {}

    @Override
    public void onCandidate(CallSite callSite, Declaration declaration,
        Verdict verdict) {}

    @Override
    public void onVerdict(CallSite callSite, Verdict verdict) {}

    @Override
    public boolean handleCompileException(CompileException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override
    public void onPush(ContextFrame frame) {
      tracer.onPush(frame);
    }

    @Override
    public void onPop(ContextFrame frame) {
      tracer.onPop(frame);
    }

    @Override
    public void onDeclaration(Declaration declaration) {
      tracer.onDeclaration(declaration);
    }

    @Override
    public void onCandidate(CallSite callSite, Declaration declaration,
        Verdict verdict) {
      tracer.onCandidate(callSite, declaration, verdict);
    }

    @Override
    public void onVerdict(CallSite callSite, Verdict verdict) {
      tracer.onVerdict(callSite, verdict);
    }

    @Override
    public boolean handleCompileException(CompileException e) {
      return tracer.handleCompileException(e);
    }
  }
}

// End Tracers.java
