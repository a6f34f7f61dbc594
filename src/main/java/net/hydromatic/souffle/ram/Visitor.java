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

/** Visits RAM trees. */
public class Visitor {

  /** For use as a method reference. */
  protected <E extends RamNode> void accept(E e) {
    e.accept(this);
  }

  // program structure

  protected void visit(Ram.Program program) {
    program.declarations.forEach(this::accept);
    program.subroutines.forEach(this::accept);
    program.main.forEach(this::accept);
  }

  protected void visit(Ram.Declaration declaration) {
    declaration.relation.accept(this);
  }

  protected void visit(Ram.Subroutine subroutine) {
    subroutine.statements.forEach(this::accept);
  }

  protected void visit(Ram.RelationRef relation) {}

  // statements

  protected void visit(Ram.Loop loop) {
    loop.statements.forEach(this::accept);
  }

  protected void visit(Ram.Query query) {
    query.operation.accept(this);
  }

  protected void visit(Ram.Debug debug) {
    debug.statement.accept(this);
  }

  protected void visit(Ram.Clear clear) {
    clear.relation.accept(this);
  }

  protected void visit(Ram.Swap swap) {
    swap.relation0.accept(this);
    swap.relation1.accept(this);
  }

  protected void visit(Ram.Exit exit) {
    exit.condition.accept(this);
  }

  protected void visit(Ram.Io io) {
    io.relation.accept(this);
  }

  protected void visit(Ram.Call call) {}

  // operations

  protected void visit(Ram.Aggregate aggregate) {
    aggregate.target.accept(this);
    aggregate.relation.accept(this);
    if (aggregate.expression != null) {
      aggregate.expression.accept(this);
    }
    if (aggregate.condition != null) {
      aggregate.condition.accept(this);
    }
    aggregate.inner.accept(this);
  }

  protected void visit(Ram.Scan scan) {
    scan.relation.accept(this);
    if (scan.indexCondition != null) {
      scan.indexCondition.accept(this);
    }
    scan.inner.accept(this);
  }

  protected void visit(Ram.Filter filter) {
    filter.condition.accept(this);
    if (filter.indexCondition != null) {
      filter.indexCondition.accept(this);
    }
    filter.inner.accept(this);
  }

  protected void visit(Ram.Unpack unpack) {
    unpack.element.accept(this);
    unpack.inner.accept(this);
  }

  protected void visit(Ram.Insert insert) {
    insert.tuple.accept(this);
    insert.relation.accept(this);
  }

  protected void visit(Ram.Erase erase) {
    erase.tuple.accept(this);
    erase.relation.accept(this);
  }

  // conditions

  protected void visit(Ram.Junction junction) {
    junction.conditions.forEach(this::accept);
  }

  protected void visit(Ram.Not not) {
    not.condition.accept(this);
  }

  protected void visit(Ram.In in) {
    in.tuple.accept(this);
    in.relation.accept(this);
  }

  protected void visit(Ram.Exists exists) {
    exists.relation.accept(this);
  }

  protected void visit(Ram.IsEmpty isEmpty) {
    isEmpty.relation.accept(this);
  }

  protected void visit(Ram.Compare compare) {
    compare.left.accept(this);
    compare.right.accept(this);
  }

  protected void visit(Ram.BracketedCond bracketedCond) {
    bracketedCond.condition.accept(this);
  }

  // elements

  protected void visit(Ram.Literal literal) {}

  protected void visit(Ram.Ref ref) {}

  protected void visit(Ram.Arithmetic arithmetic) {
    arithmetic.args.forEach(this::accept);
  }

  protected void visit(Ram.Undefined undefined) {}

  protected void visit(Ram.FunctorCall functorCall) {
    functorCall.args.forEach(this::accept);
  }

  protected void visit(Ram.Bracketed bracketed) {
    bracketed.element.accept(this);
  }

  protected void visit(Ram.Record record) {
    record.args.forEach(this::accept);
  }

  protected void visit(Ram.Tuple tuple) {
    tuple.args.forEach(this::accept);
  }
}

// End Visitor.java
