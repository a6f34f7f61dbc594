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

import static java.util.Objects.requireNonNull;

import com.google.common.io.Files;
import java.io.File;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.List;
import net.hydromatic.souffle.catalog.RelationSchema;
import net.hydromatic.souffle.catalog.SchemaCatalog;
import net.hydromatic.souffle.compile.IndexInference;
import net.hydromatic.souffle.compile.Simplifier;
import net.hydromatic.souffle.config.Prop;
import net.hydromatic.souffle.config.Session;
import net.hydromatic.souffle.parse.DeclarationParser;
import net.hydromatic.souffle.parse.RamParser;
import net.hydromatic.souffle.plan.PlanNode;
import net.hydromatic.souffle.plan.Plans;
import net.hydromatic.souffle.ram.Ram;
import net.hydromatic.souffle.util.Static;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the stages that each command applies to a source file.
 *
 * <p>A file whose name ends in ".ram" is read as a RAM program, and the
 * relations in its declaration block are its catalog. Any other file is a
 * Datalog program, and the {@code souffle} executable provides its RAM
 * program and its declarations.
 */
public class Pipeline {
  private static final Logger LOGGER = LoggerFactory.getLogger(Pipeline.class);

  private final Session session;

  public Pipeline(Session session) {
    this.session = requireNonNull(session);
  }

  private static boolean isRam(File file) {
    return file.getName().endsWith(".ram");
  }

  /** Returns the RAM program of a file. */
  public Ram.Program program(File file) {
    final String text = isRam(file)
        ? read(file)
        : session.compiler().ram(file, true);
    final Ram.Program program = RamParser.parse(text, file.getName());
    LOGGER.debug("{}: parsed {} subroutines", file.getName(),
        program.subroutines.size());
    return program;
  }

  /** Returns the relations declared in a file.
   *
   * @param program RAM program of the file, if it has already been parsed */
  public SchemaCatalog catalog(File file, Ram.@Nullable Program program) {
    if (isRam(file)) {
      return SchemaCatalog.of(program != null ? program : program(file));
    }
    final String text = session.compiler().datalog(file, true);
    return DeclarationParser.parse(text, file.getName());
  }

  /** Returns one line per relation, "name(attr:type, ...)". */
  public List<String> relations(File file) {
    return Static.transformEager(catalog(file, null).schemas(),
        RelationSchema::toString);
  }

  /** Returns the listing of the B-tree indexes that the compiler will
   * build. */
  public List<String> indexes(File file) {
    final Ram.Program program = program(file);
    final SchemaCatalog catalog = catalog(file, program);
    return IndexInference.listing(IndexInference.infer(program, catalog));
  }

  /** Returns the plan of a program, as text. */
  public String explain(File file) {
    final Ram.Program program = program(file);
    final SchemaCatalog catalog = catalog(file, program);
    final Ram.Program program2 =
        Prop.SIMPLIFY.booleanValue(session.map)
            ? Simplifier.simplify(program)
            : program;
    final List<PlanNode> nodes =
        Plans.render(program2, catalog, session.notation());
    return Plans.toText(nodes, Prop.INDENT.intValue(session.map));
  }

  /** Parses a file and discards the result; throws if it cannot be
   * parsed. */
  public void parse(File file) {
    if (isRam(file)) {
      program(file);
      return;
    }
    final boolean transformed = Prop.USE_TRANSFORMED.booleanValue(session.map);
    final SchemaCatalog catalog =
        DeclarationParser.parse(session.compiler().datalog(file, transformed),
            file.getName());
    LOGGER.debug("{}: parsed {} declarations", file.getName(),
        catalog.size());
  }

  private static String read(File file) {
    try {
      return Files.asCharSource(file, StandardCharsets.UTF_8).read();
    } catch (IOException e) {
      throw new UncheckedIOException("cannot read " + file, e);
    }
  }
}

// End Pipeline.java
