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
package net.hydromatic.souffle.exec;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.io.CharStreams;
import java.io.File;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Obtains the text of a Soufflé program at various stages of compilation by
 * running the {@code souffle} executable and the C preprocessor.
 *
 * <p>Each command runs in the directory that contains the source file, so
 * that the program's {@code #include} directives and input paths resolve as
 * they would for the compiler.
 */
public class SouffleCompiler {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(SouffleCompiler.class);

  private final String souffle;
  private final String cpp;

  /** Creates a SouffleCompiler.
   *
   * @param souffle Path of the {@code souffle} executable
   * @param cpp Path of the C preprocessor */
  public SouffleCompiler(String souffle, String cpp) {
    this.souffle = requireNonNull(souffle);
    this.cpp = requireNonNull(cpp);
  }

  /** Returns the RAM program that the compiler generates for a source file;
   * after the compiler's RAM transformations if {@code transformed},
   * otherwise as first translated.
   *
   * @throws CompilerInvocationException if the compiler fails */
  public String ram(File file, boolean transformed) {
    final String show = transformed ? "transformed-ram" : "initial-ram";
    return run(Tool.SOUFFLE, file,
        ImmutableList.of(souffle, "--show=" + show, file.getName()));
  }

  /** Returns the Datalog source of a program: after the compiler's
   * transformations if {@code transformed}, otherwise just preprocessed.
   *
   * @throws CompilerInvocationException if the compiler fails
   * @throws PreprocessingException if the preprocessor fails */
  public String datalog(File file, boolean transformed) {
    if (transformed) {
      return run(Tool.SOUFFLE, file,
          ImmutableList.of(souffle, "--show=transformed-datalog",
              file.getName()));
    }
    return run(Tool.CPP, file,
        ImmutableList.of(cpp, file.getName(), "-o", "-"));
  }

  private static String run(Tool tool, File file, List<String> command) {
    final File directory = file.getAbsoluteFile().getParentFile();
    final ProcessBuilder pb = new ProcessBuilder(command)
        .directory(directory)
        .redirectError(ProcessBuilder.Redirect.INHERIT);
    LOGGER.debug("start process {} in {}", command, directory);
    try {
      final Process process = pb.start();
      final String output;
      try (Reader reader =
               new InputStreamReader(process.getInputStream(),
                   StandardCharsets.UTF_8)) {
        output = CharStreams.toString(reader);
      }
      final int exitCode = process.waitFor();
      LOGGER.debug("process {} exited with {}", command.get(0), exitCode);
      if (exitCode != 0) {
        throw tool.failure(file.getName(), exitCode, null);
      }
      return output;
    } catch (IOException e) {
      throw tool.failure(file.getName(), -1, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw tool.failure(file.getName(), -1, e);
    }
  }

  /** External program, and how its failure is reported. */
  private enum Tool {
    SOUFFLE,
    CPP;

    RuntimeException failure(String fileName, int exitCode,
        @Nullable Throwable cause) {
      return this == SOUFFLE
          ? new CompilerInvocationException(fileName, exitCode, cause)
          : new PreprocessingException(fileName, exitCode, cause);
    }
  }
}

// End SouffleCompiler.java
