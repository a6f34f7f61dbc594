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
package net.hydromatic.souffle.config;

import static java.util.Objects.requireNonNull;

import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import java.io.File;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.souffle.exec.SouffleCompiler;
import net.hydromatic.souffle.plan.Notation;

/** Property values and services for one run of the tool. */
public class Session {
  /** Property values. */
  public final Map<Prop, Object> map;

  /** Compiler, created on first use, after all properties have been set. */
  private final Supplier<SouffleCompiler> compiler;

  /** Creates a Session.
   *
   * <p>The {@code map} parameter, that becomes the property map, is used as
   * is, not copied.
   *
   * @param map Map that contains property values */
  public Session(Map<Prop, Object> map) {
    this.map = requireNonNull(map);
    this.compiler =
        Suppliers.memoize(() ->
            new SouffleCompiler(Prop.SOUFFLE.stringValue(this.map),
                Prop.CPP.stringValue(this.map)));
  }

  /** Creates a Session with default property values. */
  public static Session create() {
    return new Session(new LinkedHashMap<>());
  }

  public SouffleCompiler compiler() {
    return compiler.get();
  }

  /** Returns the notation in which to render plans. */
  public Notation notation() {
    return Prop.NOTATION.enumValue(map, Prop.PlanNotation.class).notation;
  }

  /** Resolves a file name against the {@link Prop#DIRECTORY} property. */
  public File resolve(String fileName) {
    final File file = new File(fileName);
    if (file.isAbsolute()) {
      return file;
    }
    final File directory = Prop.DIRECTORY.fileValue(map);
    return directory.getPath().isEmpty() ? file : new File(directory, fileName);
  }
}

// End Session.java
