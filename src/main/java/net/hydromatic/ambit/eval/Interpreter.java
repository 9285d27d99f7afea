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
package net.hydromatic.ambit.eval;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.ambit.ast.CallSite;
import net.hydromatic.ambit.ast.Declaration;
import net.hydromatic.ambit.ast.Pos;
import net.hydromatic.ambit.ast.Stmt;
import net.hydromatic.ambit.ast.StmtVisitor;
import net.hydromatic.ambit.compile.BoundCall;
import net.hydromatic.ambit.compile.CompileException;
import net.hydromatic.ambit.compile.ContextFrame;
import net.hydromatic.ambit.compile.DefinitionException;
import net.hydromatic.ambit.compile.ReceiverBinding;
import net.hydromatic.ambit.compile.ReceiverStack;
import net.hydromatic.ambit.compile.ResolutionException;
import net.hydromatic.ambit.compile.Tracer;
import net.hydromatic.ambit.compile.Tracers;
import net.hydromatic.ambit.compile.Verdict;
import net.hydromatic.ambit.type.NamedType;
import net.hydromatic.ambit.type.Type;
import net.hydromatic.ambit.type.TypeVar;

/**
 * Executes script statements against a {@link Session}, writing the result
 * of each statement as lines of text.
 *
 * <p>Errors in the script, such as a call that cannot be resolved, are
 * written to the output and execution continues with the next statement.
 * Violations of the engine's internal invariants are thrown.
 */
public class Interpreter implements StmtVisitor<Void> {
  public final Session session;
  private final Consumer<String> outLines;
  private final Tracer tracer;

  /**
   * Creates an Interpreter.
   *
   * @param propMap Initial property values
   * @param outLines Receives each line of output
   */
  public Interpreter(Map<Prop, Object> propMap, Consumer<String> outLines) {
    this.outLines = requireNonNull(outLines);
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnCandidate(tracer, this::traceCandidate);
    tracer = Tracers.withOnCompileException(tracer, this::appendError);
    this.tracer = tracer;
    this.session = new Session(propMap, tracer);
  }

  /** Executes a statement. If the statement fails with a
   * {@link CompileException}, reports it and returns normally. */
  public void execute(Stmt stmt) {
    try {
      stmt.accept(this);
    } catch (CompileException e) {
      if (!tracer.handleCompileException(e)) {
        throw e;
      }
    }
  }

  /** Executes a list of statements. */
  public void executeAll(List<Stmt> stmts) {
    stmts.forEach(this::execute);
  }

  /** Reports a compile exception; called via the tracer. Also used by
   * callers to report a {@link net.hydromatic.ambit.parse.ParseException}. */
  public void appendError(CompileException e) {
    outLines.accept(e.describeTo(new StringBuilder()).toString());
    if (e instanceof ResolutionException) {
      for (ReceiverBinding binding : ((ResolutionException) e).candidates) {
        final StringBuilder b = new StringBuilder("  candidate ");
        binding.describeTo(b)
            .append(" (declared at line ")
            .append(binding.declaration.pos.startLine)
            .append(')');
        outLines.accept(b.toString());
      }
    }
  }

  private void traceCandidate(CallSite callSite, Declaration declaration,
      Verdict verdict) {
    if (!Prop.VERBOSE.booleanValue(session.map)) {
      return;
    }
    final StringBuilder b = new StringBuilder("  try ");
    declaration.describeTo(b).append(": ");
    switch (verdict.kind) {
    case RESOLVED:
      b.append("positions ").append(verdict.binding().positions());
      break;
    case NOT_APPLICABLE:
      b.append("not applicable");
      break;
    default:
      b.append(verdict.kind.name().toLowerCase(Locale.ROOT));
    }
    outLines.accept(b.toString());
  }

  @Override
  public Void visit(Stmt.TypeDecl typeDecl) {
    if (session.typeSystem.isDeclared(typeDecl.name)) {
      throw new DefinitionException(DefinitionException.Kind.DUPLICATE_NAME,
          "type " + typeDecl.name + " is already declared", typeDecl.pos);
    }
    final Map<String, TypeVar> variables =
        typeVariables(typeDecl.parameters, typeDecl.pos);
    final List<Type> superTypes = new ArrayList<>();
    for (Stmt.TypeExp superTypeExp : typeDecl.superTypes) {
      final Type superType = toType(superTypeExp, variables, typeDecl.pos);
      if (!(superType instanceof NamedType)) {
        throw new DefinitionException(DefinitionException.Kind.UNKNOWN_TYPE,
            "supertype " + superType + " of " + typeDecl.name
                + " must be a named type",
            typeDecl.pos);
      }
      superTypes.add(superType);
    }
    final NamedType type =
        session.typeSystem.declare(typeDecl.name,
            ImmutableList.copyOf(variables.values()), superTypes);
    final StringBuilder b = new StringBuilder("type ").append(type);
    final List<NamedType> directSuperTypes =
        session.typeSystem.directSuperTypes(type);
    b.append(" <: ");
    for (int i = 0; i < directSuperTypes.size(); i++) {
      b.append(i > 0 ? ", " : "").append(directSuperTypes.get(i));
    }
    outLines.accept(b.toString());
    return null;
  }

  @Override
  public Void visit(Stmt.FunDecl funDecl) {
    final Declaration.Mode mode =
        funDecl.mode != null
            ? funDecl.mode
            : Prop.DEFAULT_MODE.enumValue(session.map, Declaration.Mode.class);
    final Map<String, TypeVar> variables =
        typeVariables(funDecl.typeParameters, funDecl.pos);
    final List<Type> receiverTypes = new ArrayList<>();
    for (Stmt.TypeExp typeExp : funDecl.receiverTypes) {
      receiverTypes.add(toType(typeExp, variables, funDecl.pos));
    }
    final Declaration declaration =
        session.declarations.add(
            Declaration.of(funDecl.name, mode,
                ImmutableList.copyOf(variables.values()), receiverTypes,
                funDecl.pos));
    outLines.accept("fun " + declaration);
    return null;
  }

  @Override
  public Void visit(Stmt.Push push) {
    final ReceiverStack stack = session.stack;
    final Type type = toType(push.type, ImmutableMap.of(), push.pos);
    final ReceiverStack.Scope scope;
    if (push.op == Stmt.Op.GLOBAL) {
      if (!stack.isEmpty()
          && stack.peek().frame.kind != ContextFrame.Kind.GLOBAL) {
        throw new CompileException("global context " + push.label
            + " must be declared before any receiver", push.pos);
      }
      scope = stack.pushGlobal(type, push.label, push.label);
    } else {
      scope = stack.push(type, push.label, push.label);
    }
    outLines.accept(push.op.name().toLowerCase(Locale.ROOT) + " "
        + scope.frame + " [" + scope.frame.ordinal + "]");
    return null;
  }

  @Override
  public Void visit(Stmt.End end) {
    final ReceiverStack stack = session.stack;
    if (stack.isEmpty()
        || stack.peek().frame.kind == ContextFrame.Kind.GLOBAL) {
      throw new CompileException("no receiver to end", end.pos);
    }
    final ReceiverStack.Scope scope = stack.peek();
    scope.close();
    outLines.accept("end " + scope.frame.label);
    return null;
  }

  @Override
  public Void visit(Stmt.Call call) {
    final CallSite callSite;
    if (call.receiverType != null) {
      final Type type =
          toType(call.receiverType, ImmutableMap.of(), call.pos);
      final String label = requireNonNull(call.receiverLabel);
      callSite = CallSite.qualified(call.name, type, label, label, call.pos);
    } else {
      callSite = CallSite.unqualified(call.name, call.pos);
    }
    final BoundCall boundCall =
        session.resolver().bind(session.stack.currentStack(), callSite);
    final StringBuilder b = new StringBuilder(boundCall.toString())
        .append(" via ");
    boundCall.binding.declaration.describeTo(b);
    if (!boundCall.binding.substitution.isEmpty()) {
      b.append(' ').append(boundCall.binding.substitution);
    }
    b.append("; this = ").append(boundCall.defaultReceiver.label);
    outLines.accept(b.toString());
    return null;
  }

  @Override
  public Void visit(Stmt.Set set) {
    final Prop prop;
    try {
      prop = Prop.lookup(set.propName);
      prop.setLenient(session.map, set.value);
    } catch (IllegalArgumentException e) {
      throw new CompileException(e.getMessage(), set.pos);
    }
    outLines.accept("set " + prop.camelName + " = "
        + valueToString(prop.get(session.map)));
    return null;
  }

  @Override
  public Void visit(Stmt.Show show) {
    switch (show.what) {
    case "stack":
      final List<ContextFrame> frames = session.stack.currentStack();
      if (frames.isEmpty()) {
        outLines.accept("(empty)");
      }
      for (ContextFrame frame : frames) {
        outLines.accept("[" + frame.ordinal + "] " + frame
            + (frame.kind == ContextFrame.Kind.GLOBAL ? " (global)" : ""));
      }
      break;
    case "decls":
      final Set<String> names = session.declarations.names();
      if (names.isEmpty()) {
        outLines.accept("(none)");
      }
      for (String name : names) {
        for (Declaration declaration : session.declarations.overloads(name)) {
          outLines.accept("fun " + declaration);
        }
      }
      break;
    case "props":
      for (Prop prop : Prop.BY_CAMEL_NAME) {
        outLines.accept(prop.camelName + " = "
            + valueToString(prop.get(session.map)));
      }
      break;
    default:
      throw new CompileException("cannot show '" + show.what
          + "'; expected 'stack', 'decls' or 'props'", show.pos);
    }
    return null;
  }

  private static String valueToString(Object value) {
    return value instanceof Enum
        ? ((Enum<?>) value).name().toLowerCase(Locale.ROOT)
        : String.valueOf(value);
  }

  /** Creates type variables for a list of parameter names. */
  private static Map<String, TypeVar> typeVariables(List<String> names,
      Pos pos) {
    final Map<String, TypeVar> map = new LinkedHashMap<>();
    final Set<String> seen = new HashSet<>();
    for (String name : names) {
      if (!seen.add(name)) {
        throw new DefinitionException(DefinitionException.Kind.DUPLICATE_NAME,
            "duplicate type parameter " + name, pos);
      }
      map.put(name, new TypeVar(name));
    }
    return map;
  }

  /** Converts a type expression to a type. */
  private Type toType(Stmt.TypeExp typeExp, Map<String, TypeVar> variables,
      Pos pos) {
    final TypeVar typeVar = variables.get(typeExp.name);
    if (typeVar != null) {
      if (!typeExp.args.isEmpty()) {
        throw new DefinitionException(DefinitionException.Kind.TYPE_ARITY,
            "type parameter " + typeExp.name + " cannot have arguments", pos);
      }
      return typeVar;
    }
    final int arity = session.typeSystem.arity(typeExp.name);
    if (arity < 0) {
      throw new DefinitionException(DefinitionException.Kind.UNKNOWN_TYPE,
          "unknown type " + typeExp.name, pos);
    }
    if (arity != typeExp.args.size()) {
      throw new DefinitionException(DefinitionException.Kind.TYPE_ARITY,
          "type " + typeExp.name + " expects " + arity + " argument(s), got "
              + typeExp.args.size(),
          pos);
    }
    final List<Type> args = new ArrayList<>();
    for (Stmt.TypeExp arg : typeExp.args) {
      args.add(toType(arg, variables, pos));
    }
    return session.typeSystem.type(typeExp.name, args);
  }
}

// End Interpreter.java
