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
package net.hydromatic.souffle.plan;

import java.util.List;
import net.hydromatic.souffle.ram.Generation;
import net.hydromatic.souffle.ram.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Formats the constructs of a RAM program as plan text.
 *
 * <p>{@link PlanWriter} walks the tree, resolves column names and renders
 * sub-expressions; a notation decides how each construct looks. All
 * arguments are already-rendered text.
 *
 * @see PythonNotation
 * @see LogicNotation
 */
public interface Notation {
  /** Header line of a subroutine. */
  String subroutine(String name);

  /** Header line of a fixpoint loop. */
  String loop();

  /** Lines of commentary, typically a source rule, that precede the node
   * of the statement they describe. */
  List<String> comment(List<String> lines);

  String clear(String relation);

  String swap(String relation0, String relation1);

  String exit(String condition);

  /** Renders an input or output statement; {@code filename} is null if it
   * need not be shown. */
  String io(boolean input, String relation, String delimiter,
      @Nullable String filename);

  String call(String name);

  /** Header line of an aggregate. {@code expression} and
   * {@code condition} are null if absent. */
  String aggregate(String target, String aggregator, String variable,
      String relation, @Nullable String expression,
      @Nullable String condition);

  String scan(String variable, String relation,
      @Nullable String indexCondition);

  /** Header line of a filter; if {@code breaks}, the guard line that is
   * placed before the nested node. */
  String filter(String condition, @Nullable String indexCondition,
      boolean breaks);

  String unpack(String variable, String element);

  String insert(String tuple, String relation);

  String erase(String tuple, String relation);

  /** Name of a relation, marked with its generation. */
  String relation(Generation generation, String name);

  /** Keyword of {@link Op#AND} or {@link Op#OR}. */
  String junction(Op op);

  String not(String condition);

  String in(String tuple, String relation);

  String exists(String variable, String relation);

  String isEmpty(String relation);

  /** Symbol of a comparison operator. */
  String comparison(Op op);

  String undefined();

  /** Name under which a user-defined functor is called. */
  String userFunctor(String name);

  /** Separator between the members of a tuple, record or argument list. */
  String separator();
}

// End Notation.java
