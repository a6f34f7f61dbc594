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

import static java.util.Objects.requireNonNull;
import static net.hydromatic.souffle.util.Static.removeSuffix;
import static net.hydromatic.souffle.util.Static.transformEager;

import com.google.common.collect.ImmutableList;
import com.google.common.escape.Escaper;
import com.google.common.escape.Escapers;
import java.util.List;
import net.hydromatic.souffle.catalog.SchemaCatalog;
import net.hydromatic.souffle.compile.TupleEnvironment;
import net.hydromatic.souffle.ram.Op;
import net.hydromatic.souffle.ram.Ram;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Renders a RAM program as a tree of {@link PlanNode}s.
 *
 * <p>The writer resolves column references to attribute names, using a
 * {@link TupleEnvironment} that it owns; the {@link Notation} decides what
 * each construct looks like. Use a writer for one program only.
 */
public class PlanWriter {
  private static final Escaper SYMBOL_ESCAPER =
      Escapers.builder()
          .addEscape('"', "\\\"")
          .addEscape('\\', "\\\\")
          .build();

  private final Notation notation;
  private final TupleEnvironment env;

  public PlanWriter(SchemaCatalog catalog, Notation notation) {
    this.notation = requireNonNull(notation);
    this.env = new TupleEnvironment(catalog);
  }

  /** Renders each subroutine of a program, in stratum order. */
  public ImmutableList<PlanNode> program(Ram.Program program) {
    return transformEager(program.stratumOrder(), this::subroutine);
  }

  public PlanNode subroutine(Ram.Subroutine subroutine) {
    return PlanNode.of(notation.subroutine(subroutine.name),
        statements(subroutine.statements));
  }

  private List<PlanNode> statements(List<Ram.Statement> statements) {
    return transformEager(statements, this::statement);
  }

  public PlanNode statement(Ram.Statement statement) {
    switch (statement.op) {
      case LOOP:
        return PlanNode.of(notation.loop(),
            statements(((Ram.Loop) statement).statements));

      case QUERY:
        return operation(((Ram.Query) statement).operation);

      case DEBUG:
        final Ram.Debug debug = (Ram.Debug) statement;
        return statement(debug.statement)
            .prepend(notation.comment(debug.info.lines()));

      case CLEAR:
        return PlanNode.leaf(
            notation.clear(relation(((Ram.Clear) statement).relation)));

      case SWAP:
        final Ram.Swap swap = (Ram.Swap) statement;
        return PlanNode.leaf(
            notation.swap(relation(swap.relation0),
                relation(swap.relation1)));

      case EXIT:
        return PlanNode.leaf(
            notation.exit(condition(((Ram.Exit) statement).condition)));

      case IO:
        return io((Ram.Io) statement);

      case CALL:
        return PlanNode.leaf(notation.call(((Ram.Call) statement).name));

      default:
        throw new AssertionError("unknown statement " + statement.op);
    }
  }

  private PlanNode io(Ram.Io io) {
    final String operation = io.operation();
    final boolean input;
    if ("input".equals(operation)) {
      input = true;
    } else if ("output".equals(operation)) {
      input = false;
    } else {
      throw new UnrecognizedIoOperationException(io.relation.name, operation);
    }
    // The filename is noise if it is just the relation name
    String filename = io.filename();
    if (filename != null
        && removeSuffix(filename, ".dl").equals(io.relation.name)) {
      filename = null;
    }
    return PlanNode.leaf(
        notation.io(input, relation(io.relation), io.delimiter(), filename));
  }

  public PlanNode operation(Ram.Operation operation) {
    switch (operation.op) {
      case AGGREGATE:
        return aggregate((Ram.Aggregate) operation);

      case SCAN:
        final Ram.Scan scan = (Ram.Scan) operation;
        try (TupleEnvironment.Scope ignored = env.bind(scan)) {
          final String line =
              notation.scan(scan.variable, relation(scan.relation),
                  conditionOrNull(scan.indexCondition));
          return PlanNode.of(line, ImmutableList.of(operation(scan.inner)));
        }

      case FILTER:
        final Ram.Filter filter = (Ram.Filter) operation;
        final String line =
            notation.filter(condition(filter.condition),
                conditionOrNull(filter.indexCondition), filter.breaks);
        final PlanNode inner = operation(filter.inner);
        return filter.breaks
            ? inner.prepend(ImmutableList.of(line))
            : PlanNode.of(line, ImmutableList.of(inner));

      case UNPACK:
        final Ram.Unpack unpack = (Ram.Unpack) operation;
        final String element = element(unpack.element);
        try (TupleEnvironment.Scope ignored = env.bind(unpack)) {
          return operation(unpack.inner)
              .prepend(
                  ImmutableList.of(notation.unpack(unpack.variable, element)));
        }

      case INSERT:
        final Ram.Insert insert = (Ram.Insert) operation;
        return PlanNode.leaf(
            notation.insert(element(insert.tuple), relation(insert.relation)));

      case ERASE:
        final Ram.Erase erase = (Ram.Erase) operation;
        return PlanNode.leaf(
            notation.erase(element(erase.tuple), relation(erase.relation)));

      default:
        throw new AssertionError("unknown operation " + operation.op);
    }
  }

  private PlanNode aggregate(Ram.Aggregate aggregate) {
    final String relation = relation(aggregate.relation);
    final @Nullable String expression;
    final @Nullable String condition;
    try (TupleEnvironment.Scope ignored = env.bindSource(aggregate)) {
      expression =
          aggregate.expression == null ? null : element(aggregate.expression);
      condition = conditionOrNull(aggregate.condition);
    }
    try (TupleEnvironment.Scope ignored = env.bindTarget(aggregate)) {
      final String line =
          notation.aggregate(element(aggregate.target),
              aggregate.aggregator.lowerName(), aggregate.variable, relation,
              expression, condition);
      return PlanNode.of(line, ImmutableList.of(operation(aggregate.inner)));
    }
  }

  public String relation(Ram.RelationRef relation) {
    return notation.relation(relation.generation, relation.name);
  }

  private @Nullable String conditionOrNull(Ram.@Nullable Condition condition) {
    return condition == null ? null : condition(condition);
  }

  public String condition(Ram.Condition condition) {
    switch (condition.op) {
      case AND:
      case OR:
        final Ram.Junction junction = (Ram.Junction) condition;
        final StringBuilder buf = new StringBuilder();
        for (Ram.Condition c : junction.conditions) {
          if (buf.length() > 0) {
            buf.append(' ').append(notation.junction(junction.op)).append(' ');
          }
          buf.append(operand(c, junction.op));
        }
        return buf.toString();

      case NOT:
        return notation.not(operand(((Ram.Not) condition).condition, Op.NOT));

      case IN:
        final Ram.In in = (Ram.In) condition;
        return notation.in(element(in.tuple), relation(in.relation));

      case EXISTS:
        final Ram.Exists exists = (Ram.Exists) condition;
        return notation.exists(exists.variable, relation(exists.relation));

      case IS_EMPTY:
        return notation.isEmpty(relation(((Ram.IsEmpty) condition).relation));

      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
        final Ram.Compare compare = (Ram.Compare) condition;
        return element(compare.left) + " " + notation.comparison(compare.op)
            + " " + element(compare.right);

      case BRACKETED_COND:
        return "(" + condition(((Ram.BracketedCond) condition).condition)
            + ")";

      default:
        throw new AssertionError("unknown condition " + condition.op);
    }
  }

  /** Renders a condition that is an operand of {@code parentOp},
   * parenthesizing a junction whose operator binds differently. */
  private String operand(Ram.Condition condition, Op parentOp) {
    final String s = condition(condition);
    if ((condition.op == Op.AND || condition.op == Op.OR)
        && condition.op != parentOp) {
      return "(" + s + ")";
    }
    return s;
  }

  public String element(Ram.Element element) {
    switch (element.op) {
      case LITERAL:
        final Ram.Literal literal = (Ram.Literal) element;
        return literal.kind == Ram.LiteralKind.SYMBOL
            ? "\"" + SYMBOL_ESCAPER.escape(literal.value) + "\""
            : literal.value;

      case REF:
        final Ram.Ref ref = (Ram.Ref) element;
        return ref.variable + "." + env.label(ref.variable, ref.column);

      case ADD:
      case SUB:
        return join(((Ram.Arithmetic) element).args,
            " " + element.op.opName + " ");

      case UNDEFINED:
        return notation.undefined();

      case FUNCTOR_CALL:
        final Ram.FunctorCall call = (Ram.FunctorCall) element;
        switch (call.kind) {
          case OPERATOR:
            return join(call.args, " " + call.name + " ");
          case USER_DEFINED:
            return notation.userFunctor(call.name) + "("
                + join(call.args, notation.separator()) + ")";
          default:
            return call.name + "(" + join(call.args, notation.separator())
                + ")";
        }

      case BRACKETED:
        return "(" + element(((Ram.Bracketed) element).element) + ")";

      case RECORD:
        return "[" + join(((Ram.Record) element).args, notation.separator())
            + "]";

      case TUPLE:
        return "(" + join(((Ram.Tuple) element).args, notation.separator())
            + ")";

      default:
        throw new AssertionError("unknown element " + element.op);
    }
  }

  private String join(List<Ram.Element> elements, String separator) {
    final StringBuilder buf = new StringBuilder();
    for (Ram.Element element : elements) {
      if (buf.length() > 0) {
        buf.append(separator);
      }
      buf.append(element(element));
    }
    return buf.toString();
  }
}

// End PlanWriter.java
