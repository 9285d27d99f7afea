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

/**
 * Visitor over {@link Stmt} objects.
 *
 * @param <R> Return type
 */
public interface StmtVisitor<R> {
  R visit(Stmt.TypeDecl typeDecl);

  R visit(Stmt.FunDecl funDecl);

  /** Visits a {@code global} or {@code with} statement. */
  R visit(Stmt.Push push);

  R visit(Stmt.End end);

  R visit(Stmt.Call call);

  R visit(Stmt.Set set);

  R visit(Stmt.Show show);
}

// End StmtVisitor.java
