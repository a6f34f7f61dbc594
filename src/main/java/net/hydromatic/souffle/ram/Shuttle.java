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
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Visits and transforms RAM trees.
 *
 * <p>Each method returns its argument if nothing below it changed, so
 * unchanged subtrees keep their identity.
 */
public class Shuttle {
  protected <E extends RamNode> List<E> visitList(List<E> nodes) {
    final ImmutableList.Builder<E> list = ImmutableList.builder();
    for (E node : nodes) {
      //noinspection unchecked
      list.add((E) node.accept(this));
    }
    return list.build();
  }

  protected Ram.@Nullable Condition visitOptional(
      Ram.@Nullable Condition condition) {
    return condition == null ? null : condition.accept(this);
  }

  protected Ram.@Nullable Element visitOptional(
      Ram.@Nullable Element element) {
    return element == null ? null : element.accept(this);
  }

  // program structure

  protected Ram.Program visit(Ram.Program program) {
    return program.copy(
        visitList(program.declarations),
        visitList(program.subroutines),
        visitList(program.main));
  }

  protected Ram.Declaration visit(Ram.Declaration declaration) {
    return declaration; // leaf
  }

  protected Ram.Subroutine visit(Ram.Subroutine subroutine) {
    return subroutine.copy(visitList(subroutine.statements));
  }

  protected Ram.RelationRef visit(Ram.RelationRef relation) {
    return relation; // leaf
  }

  // statements

  protected Ram.Statement visit(Ram.Loop loop) {
    return loop.copy(visitList(loop.statements));
  }

  protected Ram.Statement visit(Ram.Query query) {
    return query.copy(query.operation.accept(this));
  }

  protected Ram.Statement visit(Ram.Debug debug) {
    return debug.copy(debug.statement.accept(this));
  }

  protected Ram.Statement visit(Ram.Clear clear) {
    return clear;
  }

  protected Ram.Statement visit(Ram.Swap swap) {
    return swap;
  }

  protected Ram.Statement visit(Ram.Exit exit) {
    return exit.copy(exit.condition.accept(this));
  }

  protected Ram.Statement visit(Ram.Io io) {
    return io;
  }

  protected Ram.Statement visit(Ram.Call call) {
    return call;
  }

  // operations

  protected Ram.Operation visit(Ram.Aggregate aggregate) {
    return aggregate.copy(
        visitOptional(aggregate.expression),
        visitOptional(aggregate.condition),
        aggregate.inner.accept(this));
  }

  protected Ram.Operation visit(Ram.Scan scan) {
    return scan.copy(
        visitOptional(scan.indexCondition), scan.inner.accept(this));
  }

  protected Ram.Operation visit(Ram.Filter filter) {
    return filter.copy(
        filter.condition.accept(this),
        visitOptional(filter.indexCondition),
        filter.inner.accept(this));
  }

  protected Ram.Operation visit(Ram.Unpack unpack) {
    return unpack.copy(unpack.element.accept(this), unpack.inner.accept(this));
  }

  protected Ram.Operation visit(Ram.Insert insert) {
    return insert.copy(insert.tuple.accept(this));
  }

  protected Ram.Operation visit(Ram.Erase erase) {
    return erase.copy(erase.tuple.accept(this));
  }

  // conditions

  protected Ram.Condition visit(Ram.Junction junction) {
    return junction.copy(visitList(junction.conditions));
  }

  protected Ram.Condition visit(Ram.Not not) {
    return not.copy(not.condition.accept(this));
  }

  protected Ram.Condition visit(Ram.In in) {
    return in.copy(in.tuple.accept(this));
  }

  protected Ram.Condition visit(Ram.Exists exists) {
    return exists;
  }

  protected Ram.Condition visit(Ram.IsEmpty isEmpty) {
    return isEmpty;
  }

  protected Ram.Condition visit(Ram.Compare compare) {
    return compare.copy(
        compare.left.accept(this), compare.right.accept(this));
  }

  protected Ram.Condition visit(Ram.BracketedCond bracketedCond) {
    return bracketedCond.copy(bracketedCond.condition.accept(this));
  }

  // elements

  protected Ram.Element visit(Ram.Literal literal) {
    return literal; // leaf
  }

  protected Ram.Ref visit(Ram.Ref ref) {
    return ref; // leaf
  }

  protected Ram.Element visit(Ram.Arithmetic arithmetic) {
    return arithmetic.copy(visitList(arithmetic.args));
  }

  protected Ram.Element visit(Ram.Undefined undefined) {
    return undefined; // leaf
  }

  protected Ram.Element visit(Ram.FunctorCall functorCall) {
    return functorCall.copy(visitList(functorCall.args));
  }

  protected Ram.Element visit(Ram.Bracketed bracketed) {
    return bracketed.copy(bracketed.element.accept(this));
  }

  protected Ram.Element visit(Ram.Record record) {
    return record.copy(visitList(record.args));
  }

  protected Ram.Tuple visit(Ram.Tuple tuple) {
    return tuple.copy(visitList(tuple.args));
  }
}

// End Shuttle.java
