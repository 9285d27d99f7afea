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

import java.util.Objects;

/** Position of a declaration, call site or statement in a source file. */
public class Pos {
  public static final Pos ZERO = new Pos("", 0, 0, 0, 0);

  public final String file;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;

  /** Creates a Pos. */
  public Pos(
      String file, int startLine, int startColumn, int endLine, int endColumn) {
    this.file = file;
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  /**
   * Creates a Pos from two offsets into a piece of text.
   *
   * @param text Text
   * @param file File name
   * @param firstLine Line number of the first line of {@code text}
   * @param startOffset Offset of the first character
   * @param endOffset Offset of the last character; the end column is
   *     inclusive
   */
  public static Pos of(
      String text, String file, int firstLine, int startOffset, int endOffset) {
    final int[] start = lineCol(text, startOffset);
    final int[] end = lineCol(text, endOffset);
    return new Pos(
        file,
        start[0] + firstLine - 1,
        start[1],
        end[0] + firstLine - 1,
        end[1]);
  }

  /** Converts an offset to a one-based {line, column} pair. */
  private static int[] lineCol(String text, int offset) {
    int line = 1;
    int lineStart = 0;
    final int n = Math.min(offset, text.length());
    for (int i = 0; i < n; i++) {
      if (text.charAt(i) == '\n') {
        ++line;
        lineStart = i + 1;
      }
    }
    return new int[] {line, offset - lineStart + 1};
  }

  @Override
  public int hashCode() {
    return Objects.hash(startLine, startColumn, endLine, endColumn);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Pos
            && this.startLine == ((Pos) o).startLine
            && this.startColumn == ((Pos) o).startColumn
            && this.endLine == ((Pos) o).endLine
            && this.endColumn == ((Pos) o).endColumn;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(file)
        .append(file.isEmpty() ? "" : ":")
        .append(startLine)
        .append('.')
        .append(startColumn);
    if (endColumn != startColumn || endLine != startLine) {
      buf.append('-').append(endLine).append('.').append(endColumn);
    }
    return buf;
  }
}

// End Pos.java
