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

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Outcome of resolving a declaration, or an overload set, at a call site.
 *
 * <p>A verdict is definitive for the contexts it was computed against;
 * resolving again against the same contexts gives an equal verdict.
 */
public abstract class Verdict {
  public final Kind kind;

  private Verdict(Kind kind) {
    this.kind = kind;
  }

  /** Returns the verdict that no declaration applies. */
  public static Verdict notApplicable() {
    return NotApplicable.INSTANCE;
  }

  /** Creates a verdict that a call resolves to a binding. */
  public static Verdict resolved(ReceiverBinding binding) {
    return new Resolved(binding);
  }

  /** Creates a verdict that several bindings compete. */
  public static Verdict ambiguous(List<ReceiverBinding> bindings) {
    return new Ambiguous(bindings);
  }

  public boolean isResolved() {
    return kind == Kind.RESOLVED;
  }

  /** Returns the binding of a resolved verdict; throws otherwise. */
  public ReceiverBinding binding() {
    throw new IllegalStateException("not resolved: " + this);
  }

  /** Returns the competing bindings of an ambiguous verdict; the single
   * binding of a resolved verdict; or an empty list. */
  public abstract List<ReceiverBinding> bindings();

  /** Kind of verdict. */
  public enum Kind {
    RESOLVED,
    NOT_APPLICABLE,
    AMBIGUOUS
  }

  /** Verdict that a call resolves to exactly one binding. */
  public static class Resolved extends Verdict {
    private final ReceiverBinding binding;

    Resolved(ReceiverBinding binding) {
      super(Kind.RESOLVED);
      this.binding = requireNonNull(binding);
    }

    @Override
    public ReceiverBinding binding() {
      return binding;
    }

    @Override
    public List<ReceiverBinding> bindings() {
      return ImmutableList.of(binding);
    }

    @Override
    public int hashCode() {
      return binding.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Resolved
              && binding.equals(((Resolved) obj).binding);
    }

    @Override
    public String toString() {
      return "Resolved(" + binding + ")";
    }
  }

  /** Verdict that no declaration applies. Carries no data. */
  public static class NotApplicable extends Verdict {
    static final NotApplicable INSTANCE = new NotApplicable();

    private NotApplicable() {
      super(Kind.NOT_APPLICABLE);
    }

    @Override
    public List<ReceiverBinding> bindings() {
      return ImmutableList.of();
    }

    @Override
    public String toString() {
      return "NotApplicable";
    }
  }

  /** Verdict that two or more bindings apply and none is most specific. */
  public static class Ambiguous extends Verdict {
    private final ImmutableList<ReceiverBinding> bindings;

    Ambiguous(List<ReceiverBinding> bindings) {
      super(Kind.AMBIGUOUS);
      this.bindings = ImmutableList.copyOf(bindings);
      checkArgument(this.bindings.size() >= 2,
          "ambiguity requires at least two bindings");
    }

    @Override
    public List<ReceiverBinding> bindings() {
      return bindings;
    }

    @Override
    public int hashCode() {
      return bindings.hashCode();
    }

    @Override
    public boolean equals(Object obj) {
      return obj == this
          || obj instanceof Ambiguous
              && bindings.equals(((Ambiguous) obj).bindings);
    }

    @Override
    public String toString() {
      return "Ambiguous" + bindings;
    }
  }
}

// End Verdict.java
