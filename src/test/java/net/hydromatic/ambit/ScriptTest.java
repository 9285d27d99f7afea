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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.ambit.TestUtils.n2u;
import static net.hydromatic.ambit.TestUtils.urlToFile;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.MatcherAssert.assertThat;

import com.google.common.io.PatternFilenameFilter;
import java.io.File;
import java.io.FilenameFilter;
import java.net.URL;
import java.util.Arrays;
import java.util.stream.Stream;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

/** Test that runs script files and checks the results. */
public class ScriptTest {
  /** For {@link ParameterizedTest} runner. */
  @SuppressWarnings("unused")
  static Stream<Arguments> data() {
    // Start with a test file we know exists, then find the directory and list
    // its files.
    final String first = "script/ordered.ambit";
    final URL inUrl = ScriptTest.class.getResource("/" + first);
    assertThat(inUrl, notNullValue());
    final File firstFile = requireNonNull(urlToFile(inUrl));
    final int commonPrefixLength =
        firstFile.getAbsolutePath().length() - first.length();
    final File dir = firstFile.getParentFile();
    final FilenameFilter filter = new PatternFilenameFilter(".*\\.ambit$");
    final File[] files = requireNonNull(dir.listFiles(filter));
    Arrays.sort(files);
    return Stream.of(files)
        .map(f ->
            Arguments.of(
                n2u(f.getAbsolutePath().substring(commonPrefixLength))));
  }

  @ParameterizedTest
  @MethodSource("data")
  void test(String path) throws Exception {
    Script.create(path).run();
  }
}

// End ScriptTest.java
