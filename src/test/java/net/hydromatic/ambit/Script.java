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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.ambit.TestUtils.n2u;
import static net.hydromatic.ambit.TestUtils.u2n;
import static net.hydromatic.ambit.TestUtils.urlToFile;
import static org.junit.jupiter.api.Assertions.fail;

import com.google.common.collect.ImmutableList;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.net.URL;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.ambit.eval.Prop;

/**
 * Runs an ".ambit" script and checks that its output is identical to its
 * input.
 *
 * <p>Lines of output begin with "&gt; ". When a script is run, the output
 * lines in the input file are ignored, and output is generated after each
 * statement. If the script is correct, the output file is identical to the
 * input file.
 *
 * <p>Powers {@link ScriptTest}, but may also be invoked via {@link
 * Script#main(String[])}, after which the output file can be copied over
 * the input file.
 */
public class Script {
  private final File inFile;
  private final File outFile;

  private Script(File inFile, File outFile) {
    this.inFile = requireNonNull(inFile, "inFile");
    this.outFile = requireNonNull(outFile, "outFile");
  }

  /**
   * Creates a Script from a path.
   *
   * <p>If the path is absolute, the output goes to a file of the same name
   * plus ".out"; otherwise the path is a resource on the class path, such as
   * "script/ordered.ambit", and the output goes to the "surefire"
   * directory beneath it.
   */
  public static Script create(String path) {
    final File f = new File(path);
    if (f.isAbsolute()) {
      return new Script(f, new File(path + ".out"));
    }
    final URL inUrl = ScriptTest.class.getResource("/" + n2u(path));
    checkArgument(inUrl != null, "path '%s' not found", path);
    final File inFile = urlToFile(inUrl);
    checkArgument(inFile != null, "file '%s' not found", inUrl);
    final File outFile =
        new File(inFile.getAbsoluteFile().getParent(),
            u2n("surefire/") + path);
    return new Script(inFile, outFile);
  }

  /** Runs scripts from the command line. Each argument is a path. */
  public static void main(String[] args) throws Exception {
    for (String arg : args) {
      create(arg).run();
    }
  }

  /** Runs the script and fails if the output differs from the input. */
  public void run() throws IOException {
    final File parent = outFile.getParentFile();
    if (!parent.isDirectory() && !parent.mkdirs()) {
      throw new IOException("cannot create directory " + parent);
    }
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    try (Reader reader = TestUtils.reader(inFile);
        Writer writer = TestUtils.printWriter(outFile)) {
      final List<String> argList = ImmutableList.of("--echo");
      new Main(argList, reader, writer, propMap, true).run();
    }
    final String diff = TestUtils.diff(inFile, outFile);
    if (!diff.isEmpty()) {
      fail(
          String.format(
              "Files differ: %s %s\n" //
                  + "%s",
              inFile, outFile, diff));
    }
  }
}

// End Script.java
