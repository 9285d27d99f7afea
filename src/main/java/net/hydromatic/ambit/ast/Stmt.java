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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Statement of the script language read by {@link net.hydromatic.ambit.Main}
 * and {@link net.hydromatic.ambit.Shell}.
 *
 * <p>Statements refer to types by name; names are looked up when the
 * statement is executed.
 */
public abstract class Stmt {
  public final Pos pos;
  public final Op op;

  Stmt(Pos pos, Op op) {
    this.pos = requireNonNull(pos);
    this.op = requireNonNull(op);
  }

  public abstract <R> R accept(StmtVisitor<R> visitor);

  /** Kind of statement. */
  public enum Op {
    TYPE,
    FUN,
    GLOBAL,
    WITH,
    END,
    CALL,
    SET,
    SHOW
  }

  /** Type expression, such as {@code Map<String, T>}. */
  public static class TypeExp {
    public final String name;
    public final ImmutableList<TypeExp> args;

    public TypeExp(String name, List<TypeExp> args) {
      this.name = requireNonNull(name);
      this.args = ImmutableList.copyOf(args);
    }

    @Override
    public String toString() {
      if (args.isEmpty()) {
        return name;
      }
      final StringBuilder b = new StringBuilder(name).append('<');
      for (int i = 0; i < args.size(); i++) {
        b.append(i > 0 ? ", " : "").append(args.get(i));
      }
      return b.append('>').toString();
    }
  }

  /** {@code type Name<T> extends Super<T>;} */
  public static class TypeDecl extends Stmt {
    public final String name;
    public final ImmutableList<String> parameters;
    public final ImmutableList<TypeExp> superTypes;

    public TypeDecl(Pos pos, String name, List<String> parameters,
        List<TypeExp> superTypes) {
      super(pos, Op.TYPE);
      this.name = requireNonNull(name);
      this.parameters = ImmutableList.copyOf(parameters);
      this.superTypes = ImmutableList.copyOf(superTypes);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** {@code fun ordered <T> name(A, B<T>);} */
  public static class FunDecl extends Stmt {
    /** Mode, or null to use the session's default. */
    public final Declaration.@Nullable Mode mode;
    public final ImmutableList<String> typeParameters;
    public final String name;
    public final ImmutableList<TypeExp> receiverTypes;

    public FunDecl(Pos pos, Declaration.@Nullable Mode mode,
        List<String> typeParameters, String name,
        List<TypeExp> receiverTypes) {
      super(pos, Op.FUN);
      this.mode = mode;
      this.typeParameters = ImmutableList.copyOf(typeParameters);
      this.name = requireNonNull(name);
      this.receiverTypes = ImmutableList.copyOf(receiverTypes);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** {@code global Type label;} and {@code with Type label;}. */
  public static class Push extends Stmt {
    public final TypeExp type;
    public final String label;

    public Push(Pos pos, Op op, TypeExp type, String label) {
      super(pos, op);
      this.type = requireNonNull(type);
      this.label = requireNonNull(label);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** {@code end;} */
  public static class End extends Stmt {
    public End(Pos pos) {
      super(pos, Op.END);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** {@code call name;} or {@code call name on Type label;} */
  public static class Call extends Stmt {
    public final String name;
    public final @Nullable TypeExp receiverType;
    public final @Nullable String receiverLabel;

    public Call(Pos pos, String name, @Nullable TypeExp receiverType,
        @Nullable String receiverLabel) {
      super(pos, Op.CALL);
      this.name = requireNonNull(name);
      this.receiverType = receiverType;
      this.receiverLabel = receiverLabel;
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** {@code set propName value;} */
  public static class Set extends Stmt {
    public final String propName;
    public final String value;

    public Set(Pos pos, String propName, String value) {
      super(pos, Op.SET);
      this.propName = requireNonNull(propName);
      this.value = requireNonNull(value);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }

  /** {@code show stack;} or {@code show decls;} */
  public static class Show extends Stmt {
    public final String what;

    public Show(Pos pos, String what) {
      super(pos, Op.SHOW);
      this.what = requireNonNull(what);
    }

    @Override
    public <R> R accept(StmtVisitor<R> visitor) {
      return visitor.visit(this);
    }
  }
}

// End Stmt.java
