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

import net.hydromatic.souffle.util.SouffleException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Thrown when the C preprocessor fails, or cannot be run. */
public class PreprocessingException extends RuntimeException
    implements SouffleException {
  public final String fileName;
  /** Exit code of the process; -1 if it did not run to completion. */
  public final int exitCode;

  public PreprocessingException(String fileName, int exitCode) {
    this(fileName, exitCode, null);
  }

  public PreprocessingException(String fileName, int exitCode,
      @Nullable Throwable cause) {
    super("C preprocessor failed on source file " + fileName
        + (exitCode < 0 ? "" : ": exit code " + exitCode), cause);
    this.fileName = requireNonNull(fileName);
    this.exitCode = exitCode;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    buf.append(getMessage());
    if (getCause() != null) {
      buf.append(": ").append(getCause().getMessage());
    }
    return buf;
  }
}

// End PreprocessingException.java
