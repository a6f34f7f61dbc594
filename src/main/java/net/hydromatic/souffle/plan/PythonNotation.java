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

import static net.hydromatic.souffle.util.Static.quote;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.souffle.ram.Generation;
import net.hydromatic.souffle.ram.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Notation that renders a plan as a Python-like program.
 *
 * <p>The program does not run, but reads well in an editor that highlights
 * Python. For example,
 *
 * <pre>{@code
 * def stratum_1():
 *    """
 *    path(x,y) :- edge(x,y).
 *    """
 *    for t0 in edge:
 *       path.add((t0.x,t0.y))
 * }</pre>
 */
public class PythonNotation implements Notation {
  public static final PythonNotation INSTANCE = new PythonNotation();

  private static final String DOC_QUOTE = "\"\"\"";

  private PythonNotation() {}

  @Override
  public String subroutine(String name) {
    return "def " + name + "():";
  }

  @Override
  public String loop() {
    return "while True:";
  }

  @Override
  public List<String> comment(List<String> lines) {
    return ImmutableList.<String>builder()
        .add(DOC_QUOTE)
        .addAll(lines)
        .add(DOC_QUOTE)
        .build();
  }

  @Override
  public String clear(String relation) {
    return relation + " = set()";
  }

  @Override
  public String swap(String relation0, String relation1) {
    return "swap(" + relation0 + ", " + relation1 + ")";
  }

  @Override
  public String exit(String condition) {
    return "if " + condition + ": break";
  }

  @Override
  public String io(boolean input, String relation, String delimiter,
      @Nullable String filename) {
    return (input ? "input(" : "output(")
        + relation
        + ", delim=" + quote(delimiter)
        + (filename == null ? "" : ", filename=" + quote(filename))
        + ")";
  }

  @Override
  public String call(String name) {
    return name + "()";
  }

  @Override
  public String aggregate(String target, String aggregator, String variable,
      String relation, @Nullable String expression,
      @Nullable String condition) {
    return target + " = " + aggregator + "("
        + (expression == null ? variable : expression)
        + " for " + variable + " in " + relation
        + (condition == null ? "" : " if " + condition)
        + ")";
  }

  @Override
  public String scan(String variable, String relation,
      @Nullable String indexCondition) {
    final String source = indexCondition == null
        ? relation
        : "index_scan(" + relation + ", lambda " + variable + ": "
            + indexCondition + ")";
    return "for " + variable + " in " + source + ":";
  }

  @Override
  public String filter(String condition, @Nullable String indexCondition,
      boolean breaks) {
    return "if " + condition
        + (indexCondition == null
            ? ""
            : " and index_cond(lambda : " + indexCondition + ")")
        + (breaks ? ": break" : ":");
  }

  @Override
  public String unpack(String variable, String element) {
    return variable + " = " + element;
  }

  @Override
  public String insert(String tuple, String relation) {
    return relation + ".add(" + tuple + ")";
  }

  @Override
  public String erase(String tuple, String relation) {
    return relation + ".remove(" + tuple + ")";
  }

  @Override
  public String relation(Generation generation, String name) {
    switch (generation) {
      case CURRENT:
        return "__delta_" + name;
      case NEXT:
        return "__new_" + name;
      case DELETE:
        return "__delete_" + name;
      case REJECT:
        return "__reject_" + name;
      default:
        return name;
    }
  }

  @Override
  public String junction(Op op) {
    return op == Op.AND ? "and" : "or";
  }

  @Override
  public String not(String condition) {
    return "not " + condition;
  }

  @Override
  public String in(String tuple, String relation) {
    return tuple + " in " + relation;
  }

  @Override
  public String exists(String variable, String relation) {
    return "exists(" + variable + " in " + relation + ")";
  }

  @Override
  public String isEmpty(String relation) {
    return relation + " == set()";
  }

  @Override
  public String comparison(Op op) {
    return op == Op.EQ ? "==" : op.opName;
  }

  @Override
  public String undefined() {
    return "_";
  }

  @Override
  public String userFunctor(String name) {
    return "__functor_" + name;
  }

  @Override
  public String separator() {
    return ",";
  }
}

// End PythonNotation.java
