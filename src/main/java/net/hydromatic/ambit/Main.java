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
import java.io.BufferedWriter;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import net.hydromatic.ambit.ast.Stmt;
import net.hydromatic.ambit.eval.Interpreter;
import net.hydromatic.ambit.eval.Prop;
import net.hydromatic.ambit.parse.ParseException;
import net.hydromatic.ambit.parse.ScriptParser;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Runs a script of resolution statements, non-interactively. */
public class Main {
  private final BufferedReader in;
  private final PrintWriter out;
  private final boolean echo;
  private final Map<Prop, Object> propMap;
  final boolean idempotent;

  /**
   * Command-line entry point.
   *
   * <p>Arguments are {@code --echo}, property settings such as
   * {@code --verbose=true}, and an optional file name; if there is no file
   * name, reads from standard input.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final List<String> argList = ImmutableList.copyOf(args);
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    @Nullable String fileName = null;
    for (String arg : argList) {
      if (!arg.startsWith("--")) {
        fileName = arg;
      }
    }
    try (InputStream in =
        fileName == null ? System.in : new FileInputStream(fileName)) {
      final Main main = new Main(argList, in, System.out, propMap, false);
      main.run();
    } catch (Throwable e) {
      e.printStackTrace();
      System.exit(1);
    }
  }

  /** Creates a Main. */
  public Main(
      List<String> args,
      InputStream in,
      PrintStream out,
      Map<Prop, Object> propMap,
      boolean idempotent) {
    this(
        args,
        new InputStreamReader(in, StandardCharsets.UTF_8),
        new OutputStreamWriter(out, StandardCharsets.UTF_8),
        propMap,
        idempotent);
  }

  /** Creates a Main. */
  public Main(
      List<String> argList,
      Reader in,
      Writer out,
      Map<Prop, Object> propMap,
      boolean idempotent) {
    this.in = buffer(in);
    this.out = buffer(out);
    this.echo = argList.contains("--echo");
    this.propMap = new LinkedHashMap<>(propMap);
    this.idempotent = idempotent;
    for (String arg : argList) {
      final int i = arg.indexOf('=');
      if (arg.startsWith("--") && i > 0) {
        final Prop prop = Prop.lookup(arg.substring(2, i));
        prop.setLenient(this.propMap, arg.substring(i + 1));
      }
    }
  }

  private static PrintWriter buffer(Writer out) {
    if (out instanceof PrintWriter) {
      return (PrintWriter) out;
    } else {
      if (!(out instanceof BufferedWriter)) {
        out = new BufferedWriter(out);
      }
      return new PrintWriter(out);
    }
  }

  private static BufferedReader buffer(Reader in) {
    if (in instanceof BufferedReader) {
      return (BufferedReader) in;
    } else {
      return new BufferedReader(in);
    }
  }

  /** Reads and executes statements until the end of input. */
  public void run() {
    final Consumer<String> echoLines = out::println;
    final Consumer<String> outLines =
        idempotent ? x -> out.println(prefixLines(x)) : echoLines;
    final Interpreter interpreter = new Interpreter(propMap, outLines);
    final StringBuilder buf = new StringBuilder();
    int firstLine = 0;
    int lineNumber = 0;
    try {
      for (;;) {
        final String line = in.readLine();
        if (line == null) {
          break;
        }
        ++lineNumber;
        if (idempotent && isOutputLine(line)) {
          continue;
        }
        if (echo) {
          echoLines.accept(line);
        }
        final String code = stripComment(line).trim();
        if (buf.length() == 0) {
          if (code.isEmpty()) {
            continue;
          }
          firstLine = lineNumber;
        }
        buf.append(line).append('\n');
        if (code.endsWith(";")) {
          execute(interpreter, buf.toString(), firstLine);
          buf.setLength(0);
        }
      }
    } catch (IOException e) {
      throw new UncheckedIOException(e);
    }
    if (buf.length() > 0) {
      execute(interpreter, buf.toString(), firstLine);
    }
    out.flush();
  }

  /** Parses and executes one or more statements. */
  static void execute(Interpreter interpreter, String code, int firstLine) {
    final List<Stmt> statements;
    try {
      statements =
          new ScriptParser(code, "stdIn", firstLine).parseStatements();
    } catch (ParseException e) {
      interpreter.appendError(e);
      return;
    }
    interpreter.executeAll(statements);
  }

  /** Returns whether a line is output from a previous run. */
  private static boolean isOutputLine(String line) {
    return line.startsWith("> ") || line.equals(">");
  }

  /** Removes a comment, which starts with '#' and runs to the end of the
   * line. */
  static String stripComment(String line) {
    final int i = line.indexOf('#');
    return i < 0 ? line : line.substring(0, i);
  }

  /** Precedes every line in 'x' with a caret. */
  private static String prefixLines(String s) {
    String s2 = "> " + s.replace("\n", "\n> ");
    return s2.replace("> \n", ">\n");
  }
}

// End Main.java
