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
package net.hydromatic.souffle;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.startsWith;
import static org.hamcrest.core.Is.is;

import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.souffle.compile.IndexInference;
import net.hydromatic.souffle.config.Prop;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.condition.DisabledOnOs;
import org.junit.jupiter.api.condition.OS;
import org.junit.jupiter.api.io.TempDir;

/** Tests {@link Main}. */
public class MainTest {
  /** Runs the tool with the given property values and arguments. */
  private static Result run(Map<Prop, Object> propMap, String... args) {
    final StringWriter out = new StringWriter();
    final StringWriter err = new StringWriter();
    final int code = new Main(Arrays.asList(args), out, err, propMap).run();
    return new Result(code, out.toString(), err.toString());
  }

  private static Result run(String... args) {
    return run(new LinkedHashMap<>(), args);
  }

  private static String path(String name) {
    return Fixtures.file(name).getAbsolutePath();
  }

  @Test void testHelp() {
    final Result result = run("--help");
    assertThat(result.code, is(0));
    assertThat(result.out, is(Main.USAGE));
    assertThat(result.err, is(""));
  }

  @Test void testUsage() {
    final Result noCommand = run();
    assertThat(noCommand.code, is(2));
    assertThat(noCommand.err,
        is("souffle-tools: no command\n" + Main.USAGE));

    final Result unknown = run("frobnicate", path("path.ram"));
    assertThat(unknown.code, is(2));
    assertThat(unknown.err,
        startsWith("souffle-tools: unknown command 'frobnicate'\n"));

    final Result noFiles = run("relations");
    assertThat(noFiles.code, is(2));
    assertThat(noFiles.err, startsWith("souffle-tools: no files\n"));
    assertThat(noFiles.out, is(""));
  }

  @Test void testBadFlag() {
    final Result unknown = run("--colour=red", "relations", path("path.ram"));
    assertThat(unknown.code, is(2));
    assertThat(unknown.err,
        startsWith("souffle-tools: property colour not found\n"));

    final Result badValue = run("--indent=x", "explain", path("path.ram"));
    assertThat(badValue.code, is(2));
    assertThat(badValue.err,
        startsWith("souffle-tools: value for property indent must be an"
            + " integer: x\n"));
  }

  @Test void testRelations() {
    final Result result = run("relations", path("path.ram"));
    assertThat(result.code, is(0));
    assertThat(result.out,
        is("edge(x:number, y:number)\npath(x:number, y:number)\n"));
  }

  @Test void testIndexes() {
    final Result result = run("indexes", path("path.ram"));
    assertThat(result.code, is(0));
    assertThat(result.out,
        is(IndexInference.DISCLAIMER + "\nedge\n\tBTREE(x:number)\n"));
  }

  @Test void testExplain() {
    final Result result =
        run("--notation=logic", "--indent=2", "explain", path("path.ram"));
    assertThat(result.code, is(0));
    assertThat(result.out,
        startsWith("stratum_0:\n"
            + "  INPUT edge DELIM '\\t' FILE edge.facts\n"
            + "stratum_1:\n"
            + "  ∀ t0 ∈ edge:\n"
            + "    path ← path ∪ {(t0.x, t0.y)}\n"));

    final Result python = run("--no-simplify", "explain", path("path.ram"));
    assertThat(python.code, is(0));
    assertThat(python.out,
        startsWith("def stratum_0():\n"
            + "   input(edge, delim='\\t', filename='edge.facts')\n"));
  }

  @Test void testDirectory() {
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    Prop.DIRECTORY.set(propMap, Fixtures.file("path.ram").getParentFile());
    final Result result = run(propMap, "relations", "path.ram");
    assertThat(result.code, is(0));
    assertThat(result.out, startsWith("edge(x:number, y:number)\n"));
  }

  @Test void testParseFiles() {
    final Result ok = run("parse-files", path("path.ram"));
    assertThat(ok.code, is(0));
    assertThat(ok.out, is(""));
    assertThat(ok.err, is(""));

    // one bad file does not stop the others
    final Result bad =
        run("parse-files", path("bad.ram"), path("path.ram"));
    assertThat(bad.code, is(1));
    assertThat(bad.err,
        is(path("bad.ram") + ": bad.ram:5.7-5.12: expected operation,"
            + " got 'QUERY'\n"));
  }

  @Test void testMissingFile() {
    final String missing =
        new File(Fixtures.file("path.ram").getParentFile(), "missing.ram")
            .getAbsolutePath();
    final Result result = run("relations", missing);
    assertThat(result.code, is(1));
    assertThat(result.err, startsWith(missing + ": cannot read "));
  }

  @Test void testCompilerMissing() {
    final Result result =
        run("--souffle=/nonexistent/souffle", "relations", path("path.dl"));
    assertThat(result.code, is(1));
    assertThat(result.err,
        containsString("souffle failed on source file path.dl"));
    assertThat(result.out, is(""));
  }

  /** Runs the tool on a Datalog file, with a script standing in for the
   * compiler; the script prints "path.ram" when asked for the RAM program,
   * otherwise the source file. */
  @DisabledOnOs(OS.WINDOWS)
  @Test void testDatalog(@TempDir Path tempDir) throws IOException {
    final File dir = tempDir.toFile();
    Files.copy(Fixtures.file("path.dl"), new File(dir, "path.dl"));
    Files.copy(Fixtures.file("path.ram"), new File(dir, "path.ram"));
    final File script = new File(dir, "souffle.sh");
    Files.asCharSink(script, StandardCharsets.UTF_8)
        .write("#!/bin/sh\n"
            + "if [ \"$1\" = --show=transformed-ram ]; then\n"
            + "  cat path.ram\n"
            + "else\n"
            + "  cat \"$2\"\n"
            + "fi\n");
    assertThat(script.setExecutable(true), is(true));

    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    Prop.SOUFFLE.set(propMap, script.getAbsolutePath());
    Prop.DIRECTORY.set(propMap, dir);
    final Result relations = run(propMap, "relations", "path.dl");
    assertThat(relations.err, is(""));
    assertThat(relations.out,
        is("edge(x:number, y:number)\npath(x:number, y:number)\n"));

    final Result explain = run(propMap, "explain", "path.dl");
    assertThat(explain.code, is(0));
    assertThat(explain.out,
        is(run("explain", new File(dir, "path.ram").getAbsolutePath()).out));
    assertThat(explain.out,
        endsWith("   output(path, delim=',', filename='reachable.csv')\n"));

    final Result parse =
        run(propMap, "--use-transformed", "parse-files", "path.dl");
    assertThat(parse.code, is(0));
  }

  /** Exit code and output of a run. */
  private static class Result {
    final int code;
    final String out;
    final String err;

    Result(int code, String out, String err) {
      this.code = code;
      this.out = out;
      this.err = err;
    }
  }
}

// End MainTest.java
