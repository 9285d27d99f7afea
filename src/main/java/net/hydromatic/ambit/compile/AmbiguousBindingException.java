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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Thrown when a single declaration could be bound in more than one way and
 * the greedy scan did not pick the canonical binding.
 *
 * <p>The greedy rule of {@link OrderedResolver} exists to make such
 * ambiguity impossible, so this exception means the engine is broken, not
 * that user code is wrong.
 */
public class AmbiguousBindingException extends IllegalStateException {
  public final ImmutableList<ReceiverBinding> bindings;

  public AmbiguousBindingException(String message,
      List<ReceiverBinding> bindings) {
    super(message);
    this.bindings = ImmutableList.copyOf(bindings);
  }
}

// End AmbiguousBindingException.java
