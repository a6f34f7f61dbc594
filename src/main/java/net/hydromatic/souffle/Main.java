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

import com.google.common.base.CaseFormat;
import com.google.common.collect.ImmutableList;
import java.io.File;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.souffle.config.Prop;
import net.hydromatic.souffle.config.Session;
import net.hydromatic.souffle.util.SouffleException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Command-line tool that inspects the plans the Soufflé compiler makes. */
public class Main {
  private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

  static final String USAGE =
      "Usage: souffle-tools [--souffle=PATH] [--cpp=PATH] [--indent=N]"
          + " COMMAND FILE...\n"
          + "Commands:\n"
          + "  relations     list relations\n"
          + "  indexes       list B-tree indexes (conservative)\n"
          + "  explain       render the plan [--notation=python|logic]"
          + " [--no-simplify]\n"
          + "  parse-files   parse declarations only [--use-transformed]\n";

  private final List<String> args;
  private final PrintWriter out;
  private final PrintWriter err;
  final Session session;

  /**
   * Command-line entry point.
   *
   * @param args Command-line arguments
   */
  public static void main(String[] args) {
    final Map<Prop, Object> propMap = new LinkedHashMap<>();
    Prop.DIRECTORY.set(propMap, new File(System.getProperty("user.dir")));
    final Main main =
        new Main(ImmutableList.copyOf(args),
            new OutputStreamWriter(System.out, StandardCharsets.UTF_8),
            new OutputStreamWriter(System.err, StandardCharsets.UTF_8),
            propMap);
    System.exit(main.run());
  }

  /** Creates a Main. */
  public Main(List<String> args, Writer out, Writer err,
      Map<Prop, Object> propMap) {
    this.args = ImmutableList.copyOf(args);
    this.out = new PrintWriter(out);
    this.err = new PrintWriter(err);
    this.session = new Session(propMap);
  }

  /** Runs the command; returns 0 on success, 1 if any file failed, 2 if the
   * command line is invalid. */
  public int run() {
    try {
      return run2();
    } finally {
      out.flush();
      err.flush();
    }
  }

  private int run2() {
    final List<String> words = new ArrayList<>();
    for (String arg : args) {
      if (arg.equals("--help")) {
        out.print(USAGE);
        return 0;
      }
      if (arg.startsWith("--")) {
        try {
          flag(arg.substring("--".length()));
        } catch (IllegalArgumentException e) {
          return usage(e.getMessage());
        }
      } else {
        words.add(arg);
      }
    }
    if (words.isEmpty()) {
      return usage("no command");
    }
    final String command = words.get(0);
    final List<String> fileNames = words.subList(1, words.size());
    if (!ImmutableList.of("relations", "indexes", "explain", "parse-files")
        .contains(command)) {
      return usage("unknown command '" + command + "'");
    }
    if (fileNames.isEmpty()) {
      return usage("no files");
    }

    final Pipeline pipeline = new Pipeline(session);
    int failureCount = 0;
    for (String fileName : fileNames) {
      final File file = session.resolve(fileName);
      try {
        execute(pipeline, command, file);
      } catch (RuntimeException e) {
        ++failureCount;
        final StringBuilder buf = new StringBuilder(fileName).append(": ");
        if (e instanceof SouffleException) {
          ((SouffleException) e).describeTo(buf);
        } else {
          buf.append(e.getMessage());
        }
        LOGGER.debug("{} failed", fileName, e);
        err.println(buf);
      }
    }
    LOGGER.debug("{} of {} files failed", failureCount, fileNames.size());
    return failureCount == 0 ? 0 : 1;
  }

  /** Sets a property from a flag such as "indent=4" or "no-simplify". */
  private void flag(String flag) {
    final int i = flag.indexOf('=');
    final String name;
    final Object value;
    if (i >= 0) {
      name = flag.substring(0, i);
      value = flag.substring(i + 1);
    } else if (flag.startsWith("no-")) {
      name = flag.substring("no-".length());
      value = "false";
    } else {
      name = flag;
      value = "true";
    }
    final Prop prop =
        Prop.lookup(CaseFormat.LOWER_HYPHEN.to(CaseFormat.LOWER_CAMEL, name));
    prop.setLenient(session.map, value);
  }

  private void execute(Pipeline pipeline, String command, File file) {
    switch (command) {
      case "relations":
        pipeline.relations(file).forEach(out::println);
        break;
      case "indexes":
        pipeline.indexes(file).forEach(out::println);
        break;
      case "explain":
        out.print(pipeline.explain(file));
        break;
      case "parse-files":
        pipeline.parse(file);
        break;
      default:
        throw new AssertionError(command);
    }
  }

  private int usage(String message) {
    err.println("souffle-tools: " + message);
    err.print(USAGE);
    return 2;
  }
}

// End Main.java
