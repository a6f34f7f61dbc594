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
package net.hydromatic.souffle.ram;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.souffle.catalog.Attribute;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds RAM nodes. */
public enum RamBuilder {
  /**
   * The singleton instance of the RAM builder. The short name is convenient
   * for use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ram;

  public Ram.Program program(
      Pos pos,
      List<Ram.Declaration> declarations,
      List<Ram.Subroutine> subroutines,
      List<? extends Ram.Statement> main) {
    return new Ram.Program(
        pos,
        ImmutableList.copyOf(declarations),
        ImmutableList.copyOf(subroutines),
        ImmutableList.copyOf(main));
  }

  public Ram.Declaration declaration(
      Pos pos,
      Ram.RelationRef relation,
      List<Attribute> attributes,
      String representation) {
    return new Ram.Declaration(
        pos, relation, ImmutableList.copyOf(attributes), representation);
  }

  public Ram.Subroutine subroutine(
      Pos pos, String name, List<? extends Ram.Statement> statements) {
    return new Ram.Subroutine(pos, name, ImmutableList.copyOf(statements));
  }

  public Ram.RelationRef relation(
      Pos pos, Generation generation, String name) {
    return new Ram.RelationRef(pos, generation, name);
  }

  /** Creates a reference to a relation; the name may carry a generation
   * prefix, as in "@delta_path". */
  public Ram.RelationRef relation(Pos pos, String name) {
    for (Generation generation : Generation.values()) {
      if (generation != Generation.NONE
          && name.startsWith(generation.prefix)) {
        return relation(pos, generation,
            name.substring(generation.prefix.length()));
      }
    }
    return relation(pos, Generation.NONE, name);
  }

  // statements

  public Ram.Loop loop(Pos pos, List<? extends Ram.Statement> statements) {
    return new Ram.Loop(pos, ImmutableList.copyOf(statements));
  }

  public Ram.Query query(Pos pos, Ram.Operation operation) {
    return new Ram.Query(pos, operation);
  }

  public Ram.Debug debug(Pos pos, Value info, Ram.Statement statement) {
    return new Ram.Debug(pos, info, statement);
  }

  public Ram.Clear clear(Pos pos, Ram.RelationRef relation) {
    return new Ram.Clear(pos, relation);
  }

  public Ram.Swap swap(
      Pos pos, Ram.RelationRef relation0, Ram.RelationRef relation1) {
    return new Ram.Swap(pos, relation0, relation1);
  }

  public Ram.Exit exit(Pos pos, Ram.Condition condition) {
    return new Ram.Exit(pos, condition);
  }

  public Ram.Io io(
      Pos pos, Ram.RelationRef relation, Map<String, Value> options) {
    return new Ram.Io(pos, relation, ImmutableMap.copyOf(options));
  }

  public Ram.Call call(Pos pos, String name) {
    return new Ram.Call(pos, name);
  }

  // operations

  public Ram.Aggregate aggregate(
      Pos pos,
      Ram.Ref target,
      Ram.Aggregator aggregator,
      String variable,
      Ram.RelationRef relation,
      Ram.@Nullable Element expression,
      Ram.@Nullable Condition condition,
      Ram.Operation inner) {
    return new Ram.Aggregate(
        pos, target, aggregator, variable, relation, expression, condition,
        inner);
  }

  public Ram.Scan scan(
      Pos pos,
      String variable,
      Ram.RelationRef relation,
      Ram.@Nullable Condition indexCondition,
      Ram.Operation inner) {
    return new Ram.Scan(pos, variable, relation, indexCondition, inner);
  }

  public Ram.Filter filter(
      Pos pos,
      Ram.Condition condition,
      Ram.@Nullable Condition indexCondition,
      boolean breaks,
      Ram.Operation inner) {
    return new Ram.Filter(pos, condition, indexCondition, breaks, inner);
  }

  public Ram.Unpack unpack(
      Pos pos,
      String variable,
      int arity,
      Ram.Element element,
      Ram.Operation inner) {
    return new Ram.Unpack(pos, variable, arity, element, inner);
  }

  public Ram.Insert insert(
      Pos pos, Ram.Tuple tuple, Ram.RelationRef relation) {
    return new Ram.Insert(pos, tuple, relation);
  }

  public Ram.Erase erase(Pos pos, Ram.Tuple tuple, Ram.RelationRef relation) {
    return new Ram.Erase(pos, tuple, relation);
  }

  // conditions

  public Ram.Junction junction(
      Pos pos, Op op, List<? extends Ram.Condition> conditions) {
    return new Ram.Junction(pos, op, ImmutableList.copyOf(conditions));
  }

  public Ram.Junction and(Pos pos, List<? extends Ram.Condition> conditions) {
    return junction(pos, Op.AND, conditions);
  }

  public Ram.Junction or(Pos pos, List<? extends Ram.Condition> conditions) {
    return junction(pos, Op.OR, conditions);
  }

  public Ram.Not not(Pos pos, Ram.Condition condition) {
    return new Ram.Not(pos, condition);
  }

  public Ram.In in(Pos pos, Ram.Tuple tuple, Ram.RelationRef relation) {
    return new Ram.In(pos, tuple, relation);
  }

  public Ram.Exists exists(
      Pos pos, String variable, Ram.RelationRef relation) {
    return new Ram.Exists(pos, variable, relation);
  }

  public Ram.IsEmpty isEmpty(Pos pos, Ram.RelationRef relation) {
    return new Ram.IsEmpty(pos, relation);
  }

  public Ram.Compare compare(
      Pos pos, Op op, Ram.Element left, Ram.Element right) {
    return new Ram.Compare(pos, op, left, right);
  }

  public Ram.BracketedCond bracketedCond(Pos pos, Ram.Condition condition) {
    return new Ram.BracketedCond(pos, condition);
  }

  // elements

  public Ram.Literal literal(Pos pos, Ram.LiteralKind kind, String value) {
    return new Ram.Literal(pos, kind, value);
  }

  public Ram.Literal number(Pos pos, long value) {
    return literal(pos, Ram.LiteralKind.NUMBER, Long.toString(value));
  }

  public Ram.Ref ref(Pos pos, String variable, int column) {
    return new Ram.Ref(pos, variable, column);
  }

  public Ram.Arithmetic arithmetic(
      Pos pos, Op op, List<? extends Ram.Element> args) {
    return new Ram.Arithmetic(pos, op, ImmutableList.copyOf(args));
  }

  public Ram.Arithmetic add(Pos pos, List<? extends Ram.Element> args) {
    return arithmetic(pos, Op.ADD, args);
  }

  public Ram.Arithmetic sub(Pos pos, List<? extends Ram.Element> args) {
    return arithmetic(pos, Op.SUB, args);
  }

  public Ram.Undefined undefined(Pos pos) {
    return new Ram.Undefined(pos);
  }

  public Ram.FunctorCall functorCall(
      Pos pos,
      Ram.FunctorKind kind,
      String name,
      List<? extends Ram.Element> args) {
    return new Ram.FunctorCall(pos, kind, name, ImmutableList.copyOf(args));
  }

  public Ram.Bracketed bracketed(Pos pos, Ram.Element element) {
    return new Ram.Bracketed(pos, element);
  }

  public Ram.Record record(Pos pos, List<? extends Ram.Element> args) {
    return new Ram.Record(pos, ImmutableList.copyOf(args));
  }

  public Ram.Tuple tuple(Pos pos, List<? extends Ram.Element> args) {
    return new Ram.Tuple(pos, ImmutableList.copyOf(args));
  }
}

// End RamBuilder.java
