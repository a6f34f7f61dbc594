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
package net.hydromatic.souffle.compile;

import static net.hydromatic.souffle.ram.RamBuilder.ram;

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.souffle.ram.Op;
import net.hydromatic.souffle.ram.Ram;
import net.hydromatic.souffle.ram.Shuttle;

/**
 * Removes structural noise from a RAM program before it is rendered.
 *
 * <p>Rewrites, applied bottom-up:
 *
 * <ul>
 *   <li>{@code a AND (b AND c)} becomes {@code a AND b AND c}, likewise for
 *       {@code OR}; a junction of one condition becomes that condition;
 *   <li>{@code ((c))} becomes {@code (c)}, for conditions and elements;
 *   <li>an atomic element in parentheses, such as {@code (t0.1)}, loses its
 *       parentheses;
 *   <li>{@code ((a + b) + c)} becomes {@code (a + b + c)};
 *   <li>{@code NOT NOT c} becomes {@code c};
 *   <li>a {@code DEBUG} whose payload is empty or null is replaced by the
 *       statement it wraps;
 *   <li>{@code IF c1 IF c2 op} becomes {@code IF c1 AND c2 op} if neither
 *       filter breaks or has an index condition.
 * </ul>
 *
 * <p>None of these changes the statements, their order, or the index
 * conditions. Subtrees that do not change keep their identity, and
 * simplifying a simplified program returns an equal program.
 */
public class Simplifier extends Shuttle {
  private Simplifier() {}

  public static Ram.Program simplify(Ram.Program program) {
    return program.accept(new Simplifier());
  }

  @Override
  protected Ram.Statement visit(Ram.Debug debug) {
    final Ram.Statement statement = debug.statement.accept(this);
    return debug.info.isEmpty() ? statement : debug.copy(statement);
  }

  @Override
  protected Ram.Operation visit(Ram.Filter filter) {
    final Ram.Condition condition = filter.condition.accept(this);
    final Ram.Condition indexCondition = visitOptional(filter.indexCondition);
    final Ram.Operation inner = filter.inner.accept(this);
    if (!filter.breaks
        && indexCondition == null
        && inner.op == Op.FILTER) {
      final Ram.Filter innerFilter = (Ram.Filter) inner;
      if (!innerFilter.breaks && innerFilter.indexCondition == null) {
        final List<Ram.Condition> conditions = new ArrayList<>();
        flatten(Op.AND, condition, conditions);
        flatten(Op.AND, innerFilter.condition, conditions);
        return ram.filter(filter.pos, ram.and(filter.pos, conditions), null,
            false, innerFilter.inner);
      }
    }
    return filter.copy(condition, indexCondition, inner);
  }

  @Override
  protected Ram.Condition visit(Ram.Junction junction) {
    final List<Ram.Condition> conditions = new ArrayList<>();
    for (Ram.Condition condition : junction.conditions) {
      flatten(junction.op, condition.accept(this), conditions);
    }
    if (conditions.size() == 1) {
      return conditions.get(0);
    }
    return junction.copy(conditions);
  }

  /** Adds a condition to a list of operands of a junction; if the condition
   * is a junction of the same kind, possibly in parentheses, adds its
   * operands instead. */
  private static void flatten(Op op, Ram.Condition condition,
      List<Ram.Condition> conditions) {
    Ram.Condition c = condition;
    while (c.op == Op.BRACKETED_COND) {
      c = ((Ram.BracketedCond) c).condition;
    }
    if (c.op == op) {
      for (Ram.Condition c2 : ((Ram.Junction) c).conditions) {
        flatten(op, c2, conditions);
      }
    } else {
      conditions.add(condition);
    }
  }

  @Override
  protected Ram.Condition visit(Ram.Not not) {
    final Ram.Condition condition = not.condition.accept(this);
    Ram.Condition c = condition;
    while (c.op == Op.BRACKETED_COND) {
      c = ((Ram.BracketedCond) c).condition;
    }
    if (c.op == Op.NOT) {
      return ((Ram.Not) c).condition;
    }
    return not.copy(condition);
  }

  @Override
  protected Ram.Condition visit(Ram.BracketedCond bracketedCond) {
    final Ram.Condition condition = bracketedCond.condition.accept(this);
    if (condition.op == Op.BRACKETED_COND) {
      return condition;
    }
    return bracketedCond.copy(condition);
  }

  @Override
  protected Ram.Element visit(Ram.Bracketed bracketed) {
    final Ram.Element element = bracketed.element.accept(this);
    if (element.op == Op.BRACKETED || element.isAtomic()) {
      return element;
    }
    return bracketed.copy(element);
  }

  @Override
  protected Ram.Element visit(Ram.Arithmetic arithmetic) {
    final List<Ram.Element> args = visitList(arithmetic.args);
    if (arithmetic.op == Op.ADD) {
      Ram.Element first = args.get(0);
      while (first.op == Op.BRACKETED) {
        first = ((Ram.Bracketed) first).element;
      }
      if (first.op == Op.ADD) {
        final List<Ram.Element> flatArgs =
            new ArrayList<>(((Ram.Arithmetic) first).args);
        flatArgs.addAll(args.subList(1, args.size()));
        return arithmetic.copy(flatArgs);
      }
    }
    return arithmetic.copy(args);
  }
}

// End Simplifier.java
