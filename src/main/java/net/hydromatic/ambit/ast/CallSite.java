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
package net.hydromatic.ambit.ast;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import net.hydromatic.ambit.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Call of a callable by name.
 *
 * <p>A <em>qualified</em> call, such as {@code session.render()}, supplies an
 * explicit receiver. An <em>unqualified</em> call, such as {@code render()},
 * takes every receiver from the contexts in scope.
 */
public class CallSite {
  public final String name;
  public final @Nullable Type receiverType;
  public final @Nullable Object receiverValue;
  public final @Nullable String receiverLabel;
  public final Pos pos;

  private CallSite(
      String name,
      @Nullable Type receiverType,
      @Nullable Object receiverValue,
      @Nullable String receiverLabel,
      Pos pos) {
    this.name = requireNonNull(name);
    this.receiverType = receiverType;
    this.receiverValue = receiverValue;
    this.receiverLabel = receiverLabel;
    this.pos = requireNonNull(pos);
    checkArgument((receiverType == null) == (receiverValue == null),
        "receiver type and value must both be present or both be absent");
  }

  /** Creates an unqualified call site. */
  public static CallSite unqualified(String name, Pos pos) {
    return new CallSite(name, null, null, null, pos);
  }

  /** Creates an unqualified call site with no position. */
  public static CallSite unqualified(String name) {
    return unqualified(name, Pos.ZERO);
  }

  /** Creates a call site with an explicit receiver. */
  public static CallSite qualified(
      String name, Type receiverType, Object receiverValue, String label,
      Pos pos) {
    return new CallSite(name, requireNonNull(receiverType),
        requireNonNull(receiverValue), requireNonNull(label), pos);
  }

  /** Creates a call site with an explicit receiver whose label is the
   * string value of the receiver, and no position. */
  public static CallSite qualified(
      String name, Type receiverType, Object receiverValue) {
    return qualified(name, receiverType, receiverValue,
        String.valueOf(receiverValue), Pos.ZERO);
  }

  /** Returns whether this call has an explicit receiver. */
  public boolean isQualified() {
    return receiverType != null;
  }

  @Override
  public String toString() {
    return isQualified()
        ? receiverLabel + "." + name + "()"
        : name + "()";
  }
}

// End CallSite.java
