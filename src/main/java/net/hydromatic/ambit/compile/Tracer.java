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

import net.hydromatic.ambit.ast.CallSite;
import net.hydromatic.ambit.ast.Declaration;

/**
 * Called at interesting points during declaration and resolution.
 *
 * <p>Use {@link Tracers} to create instances.
 */
public interface Tracer {
  /** Called when a frame is pushed onto a {@link ReceiverStack}. */
  void onPush(ContextFrame frame);

  /** Called when a frame is popped from a {@link ReceiverStack}. */
  void onPop(ContextFrame frame);

  /** Called when a declaration has been checked and added to a table. */
  void onDeclaration(Declaration declaration);

  /** Called after each candidate of an overload set is resolved. */
  void onCandidate(CallSite callSite, Declaration declaration,
      Verdict verdict);

  /** Called with the verdict for a call site, after overloads have been
   * compared. */
  void onVerdict(CallSite callSite, Verdict verdict);

  /**
   * Called with an error in a declaration or call site. Returns whether a
   * handler was found; if not, the caller rethrows.
   */
  boolean handleCompileException(CompileException e);
}

// End Tracer.java
