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
package net.hydromatic.ambit;

import com.google.common.collect.ImmutableList;
import java.io.BufferedReader;
import java.io.File;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.incava.diff.Diff;
import org.incava.diff.Difference;

/** Utility methods for testing. */
class TestUtils {
  private TestUtils() {}

  /** Converts a path from native to Unix. */
  static String n2u(String s) {
    return File.separatorChar == '\\' ? s.replace('\\', '/') : s;
  }

  /** Converts a path from Unix to native. */
  static String u2n(String s) {
    return File.separatorChar == '\\' ? s.replace('/', '\\') : s;
  }

  /** Converts a "file:" URL to a file; returns null for other protocols. */
  static @Nullable File urlToFile(URL url) {
    if (!"file".equals(url.getProtocol())) {
      return null;
    }
    try {
      return Paths.get(url.toURI()).toFile();
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException(
          "Unable to convert URL " + url + " to URI", e);
    }
  }

  /** Creates a {@link PrintWriter} to a given file using UTF-8. */
  static PrintWriter printWriter(File file) throws IOException {
    return new PrintWriter(
        Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8));
  }

  /** Creates a {@link BufferedReader} for a given file using UTF-8. */
  static BufferedReader reader(File file) throws IOException {
    return Files.newBufferedReader(file.toPath(), StandardCharsets.UTF_8);
  }

  /**
   * Returns the difference between the contents of two files, in a format
   * similar to the UNIX 'diff' utility; empty if they are the same. A file
   * that does not exist is treated as empty.
   */
  static String diff(File file1, File file2) {
    return diffLines(fileLines(file1), fileLines(file2));
  }

  /** Returns the difference between two lists of lines. */
  static String diffLines(List<String> lines1, List<String> lines2) {
    final List<Difference> differences =
        new Diff<>(lines1, lines2).execute();
    final StringBuilder b = new StringBuilder();
    for (Difference d : differences) {
      final int ds = d.getDeletedStart() + 1;
      final int de = d.getDeletedEnd() + 1;
      final int as = d.getAddedStart() + 1;
      final int ae = d.getAddedEnd() + 1;
      final char op = ae == 0 ? 'd' : de == 0 ? 'a' : 'c';
      b.append(range(ds, de, op == 'a'))
          .append(op)
          .append(range(as, ae, op == 'd'))
          .append('\n');
      for (int i = ds - 1; i < de && op != 'a'; ++i) {
        b.append("< ").append(lines1.get(i)).append('\n');
      }
      if (op == 'c') {
        b.append("---\n");
      }
      for (int i = as - 1; i < ae && op != 'd'; ++i) {
        b.append("> ").append(lines2.get(i)).append('\n');
      }
    }
    return b.toString();
  }

  /** Formats a line range such as "3" or "3,5"; an empty range is printed
   * as the line it follows. */
  private static String range(int start, int end, boolean empty) {
    if (empty) {
      return String.valueOf(start - 1);
    }
    return end > start ? start + "," + end : String.valueOf(start);
  }

  /** Returns the lines of a file, or an empty list if the file does not
   * exist. */
  private static List<String> fileLines(File file) {
    if (!file.exists()) {
      return ImmutableList.of();
    }
    try {
      return Files.readAllLines(file.toPath(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
  }
}

// End TestUtils.java
