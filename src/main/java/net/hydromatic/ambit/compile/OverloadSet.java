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

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.Iterator;
import java.util.List;
import net.hydromatic.ambit.ast.Declaration;

/** The declarations visible under one name, in the order declared. */
public class OverloadSet implements Iterable<Declaration> {
  public final String name;
  public final ImmutableList<Declaration> declarations;

  OverloadSet(String name, List<Declaration> declarations) {
    this.name = requireNonNull(name);
    this.declarations = ImmutableList.copyOf(declarations);
  }

  @Override
  public Iterator<Declaration> iterator() {
    return declarations.iterator();
  }

  public int size() {
    return declarations.size();
  }

  public boolean isEmpty() {
    return declarations.isEmpty();
  }

  @Override
  public String toString() {
    return name + declarations;
  }
}

// End OverloadSet.java
