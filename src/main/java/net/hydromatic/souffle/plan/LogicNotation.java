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
import static net.hydromatic.souffle.util.Static.transformEager;

import java.util.List;
import net.hydromatic.souffle.ram.Generation;
import net.hydromatic.souffle.ram.Op;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Notation that renders a plan in the language of sets and logic.
 *
 * <p>For example,
 *
 * <pre>{@code
 * stratum_1:
 *    FOR i : ℕ
 *       // path(x,z) :- path(x,y), edge(y,z).
 *       ∀ t0 ∈ path[i]:
 *          ∀ t1 ∈ edge USING INDEX t1.x = t0.y:
 *             ¬(t0.x, t1.y) ∈ path ⇒
 *                path[i+1] ← path[i+1] ∪ {(t0.x, t1.y)}
 * }</pre>
 */
public class LogicNotation implements Notation {
  public static final LogicNotation INSTANCE = new LogicNotation();

  private LogicNotation() {}

  @Override
  public String subroutine(String name) {
    return name + ":";
  }

  @Override
  public String loop() {
    return "FOR i : ℕ";
  }

  @Override
  public List<String> comment(List<String> lines) {
    return transformEager(lines, line -> "// " + line);
  }

  @Override
  public String clear(String relation) {
    return relation + " = ∅";
  }

  @Override
  public String swap(String relation0, String relation1) {
    return relation0 + ", " + relation1 + " = " + relation1 + ", "
        + relation0;
  }

  @Override
  public String exit(String condition) {
    return "BREAK IF " + condition;
  }

  @Override
  public String io(boolean input, String relation, String delimiter,
      @Nullable String filename) {
    return (input ? "INPUT " : "OUTPUT ")
        + relation
        + " DELIM " + quote(delimiter)
        + (filename == null ? "" : " FILE " + filename);
  }

  @Override
  public String call(String name) {
    return "CALL " + name;
  }

  @Override
  public String aggregate(String target, String aggregator, String variable,
      String relation, @Nullable String expression,
      @Nullable String condition) {
    return target + " = " + aggregator + "{"
        + (expression == null ? "" : expression + " | ")
        + variable + " ∈ " + relation
        + (condition == null ? "" : ", " + condition)
        + "}";
  }

  @Override
  public String scan(String variable, String relation,
      @Nullable String indexCondition) {
    return "∀ " + variable + " ∈ " + relation
        + (indexCondition == null ? "" : " USING INDEX " + indexCondition)
        + ":";
  }

  @Override
  public String filter(String condition, @Nullable String indexCondition,
      boolean breaks) {
    return condition
        + (indexCondition == null ? "" : " USING INDEX " + indexCondition)
        + (breaks ? " ⇒ BREAK" : " ⇒");
  }

  @Override
  public String unpack(String variable, String element) {
    return variable + " = " + element;
  }

  @Override
  public String insert(String tuple, String relation) {
    return relation + " ← " + relation + " ∪ {" + tuple + "}";
  }

  @Override
  public String erase(String tuple, String relation) {
    return relation + " ← " + relation + " ∖ {" + tuple + "}";
  }

  @Override
  public String relation(Generation generation, String name) {
    switch (generation) {
      case CURRENT:
        return name + "[i]";
      case NEXT:
        return name + "[i+1]";
      case DELETE:
        return name + "[del]";
      case REJECT:
        return name + "[rej]";
      default:
        return name;
    }
  }

  @Override
  public String junction(Op op) {
    return op == Op.AND ? "∧" : "∨";
  }

  @Override
  public String not(String condition) {
    return "¬" + condition;
  }

  @Override
  public String in(String tuple, String relation) {
    return tuple + " ∈ " + relation;
  }

  @Override
  public String exists(String variable, String relation) {
    return "∃ " + variable + " ∈ " + relation;
  }

  @Override
  public String isEmpty(String relation) {
    return relation + " = ∅";
  }

  @Override
  public String comparison(Op op) {
    switch (op) {
      case NE:
        return "≠";
      case LE:
        return "≤";
      case GE:
        return "≥";
      default:
        return op.opName;
    }
  }

  @Override
  public String undefined() {
    return "⊥";
  }

  @Override
  public String userFunctor(String name) {
    return "@" + name;
  }

  @Override
  public String separator() {
    return ", ";
  }
}

// End LogicNotation.java
