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

import java.util.List;
import net.hydromatic.ambit.ast.CallSite;
import net.hydromatic.ambit.ast.Declaration;

/**
 * Decides whether one declaration applies at a call site, and if so, which
 * context binds to each of its receivers.
 *
 * <p>Implementations are pure functions of their arguments and hold no
 * mutable state, so one instance may serve many threads.
 *
 * @see OrderedResolver
 * @see UnorderedResolver
 */
public interface ReceiverResolver {
  /**
   * Resolves a declaration.
   *
   * @param declaration Declaration
   * @param contexts Contexts in scope, outermost first; the frame at index
   *     {@code j} must have ordinal {@code j}
   * @param callSite Call site
   * @return {@link Verdict.Resolved} or {@link Verdict.NotApplicable}
   */
  Verdict resolve(Declaration declaration, List<ContextFrame> contexts,
      CallSite callSite);
}

// End ReceiverResolver.java
