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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;
import static net.hydromatic.souffle.ram.RamBuilder.ram;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import net.hydromatic.souffle.catalog.Attribute;
import net.hydromatic.souffle.parse.RamParseException;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of RAM nodes. */
public class Ram {
  private Ram() {}

  /** Aggregate function. */
  public enum Aggregator {
    COUNT,
    SUM,
    MIN,
    MAX,
    MEAN;

    /** Returns the aggregator with a given RAM keyword, or null. */
    public static @Nullable Aggregator of(String keyword) {
      for (Aggregator aggregator : values()) {
        if (aggregator.name().equals(keyword)) {
          return aggregator;
        }
      }
      return null;
    }

    /** Returns the name in lower case, e.g. "count". */
    public String lowerName() {
      return name().toLowerCase(Locale.ROOT);
    }
  }

  /** Type of literal. */
  public enum LiteralKind {
    NUMBER("number"),
    UNSIGNED("unsigned"),
    FLOAT("float"),
    SYMBOL("string");

    /** Keyword that introduces the literal in RAM text, e.g. "number(5)". */
    public final String keyword;

    LiteralKind(String keyword) {
      this.keyword = keyword;
    }

    /** Returns the kind with a given keyword, or null. */
    public static @Nullable LiteralKind of(String keyword) {
      for (LiteralKind kind : values()) {
        if (kind.keyword.equals(keyword)) {
          return kind;
        }
      }
      return null;
    }
  }

  /** Kind of functor. */
  public enum FunctorKind {
    /** Built-in function, such as "cat" or "strlen". */
    BUILTIN,
    /** Built-in infix operator, such as "*" or "band". */
    OPERATOR,
    /** User-defined functor, written "@name" in RAM text. */
    USER_DEFINED
  }

  /** Whole RAM program. */
  public static class Program extends RamNode {
    public final ImmutableList<Declaration> declarations;
    public final ImmutableList<Subroutine> subroutines;
    /** Statements of the main block, typically calls to subroutines. */
    public final ImmutableList<Statement> main;

    Program(
        Pos pos,
        ImmutableList<Declaration> declarations,
        ImmutableList<Subroutine> subroutines,
        ImmutableList<Statement> main) {
      super(pos, Op.PROGRAM);
      this.declarations = requireNonNull(declarations);
      this.subroutines = requireNonNull(subroutines);
      this.main = requireNonNull(main);
    }

    /**
     * Returns the subroutines sorted by stratum number. Subroutines with the
     * same stratum number stay in the order they were parsed.
     *
     * @throws RamParseException if a subroutine's name has no stratum number
     */
    public ImmutableList<Subroutine> stratumOrder() {
      // a list of one subroutine is never compared, so check names here
      subroutines.forEach(Subroutine::stratum);
      return ImmutableList.sortedCopyOf(
          Comparator.comparingInt(Subroutine::stratum), subroutines);
    }

    @Override
    public int hashCode() {
      return Objects.hash(declarations, subroutines, main);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Program
              && declarations.equals(((Program) o).declarations)
              && subroutines.equals(((Program) o).subroutines)
              && main.equals(((Program) o).main);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append("PROGRAM\n");
      if (!declarations.isEmpty()) {
        buf.append("DECLARATION\n");
        unparseList(buf, declarations, "\n");
        buf.append("\nEND DECLARATION\n");
      }
      for (Subroutine subroutine : subroutines) {
        subroutine.unparse(buf).append('\n');
      }
      if (!main.isEmpty()) {
        buf.append("BEGIN MAIN\n");
        unparseList(buf, main, "\n");
        buf.append("\nEND MAIN\n");
      }
      return buf.append("END PROGRAM");
    }

    @Override
    public Program accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /**
     * Creates a copy of this {@code Program} with given contents, or {@code
     * this} if the contents are the same.
     */
    public Program copy(
        List<Declaration> declarations,
        List<Subroutine> subroutines,
        List<Statement> main) {
      return this.declarations.equals(declarations)
              && this.subroutines.equals(subroutines)
              && this.main.equals(main)
          ? this
          : ram.program(pos, declarations, subroutines, main);
    }
  }

  /** Declaration of a relation in the program's {@code DECLARATION} block,
   * for example "edge(x:i:number,y:i:number) BTREE". */
  public static class Declaration extends RamNode {
    public final RelationRef relation;
    public final ImmutableList<Attribute> attributes;
    /** Data structure, e.g. "BTREE", "BRIE", "EQREL"; may be empty. */
    public final String representation;

    Declaration(
        Pos pos,
        RelationRef relation,
        ImmutableList<Attribute> attributes,
        String representation) {
      super(pos, Op.DECLARATION);
      this.relation = requireNonNull(relation);
      this.attributes = requireNonNull(attributes);
      this.representation = requireNonNull(representation);
    }

    @Override
    public int hashCode() {
      return Objects.hash(relation, attributes, representation);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Declaration
              && relation.equals(((Declaration) o).relation)
              && attributes.equals(((Declaration) o).attributes)
              && representation.equals(((Declaration) o).representation);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      relation.unparse(buf).append('(');
      for (int i = 0; i < attributes.size(); i++) {
        final Attribute attribute = attributes.get(i);
        if (i > 0) {
          buf.append(',');
        }
        buf.append(attribute.name)
            .append(':')
            .append(attribute.type.qualifier)
            .append(':')
            .append(attribute.typeName);
      }
      buf.append(')');
      if (!representation.isEmpty()) {
        buf.append(' ').append(representation);
      }
      return buf;
    }

    @Override
    public Declaration accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Named list of statements; the compiler creates one per stratum. */
  public static class Subroutine extends RamNode {
    public final String name;
    public final ImmutableList<Statement> statements;

    Subroutine(Pos pos, String name, ImmutableList<Statement> statements) {
      super(pos, Op.SUBROUTINE);
      this.name = requireNonNull(name);
      this.statements = requireNonNull(statements);
    }

    /**
     * Returns the stratum number, the integer in the second '_'-separated
     * segment of the name; for example, 3 for "stratum_3" and
     * "stratum_3_delete".
     *
     * @throws RamParseException if the name does not contain a number
     */
    public int stratum() {
      final String[] segments = name.split("_", -1);
      if (segments.length < 2 || !segments[1].matches("[0-9]+")) {
        throw new RamParseException(
            "subroutine name '" + name + "' does not contain a stratum number",
            pos);
      }
      try {
        return Integer.parseInt(segments[1]);
      } catch (NumberFormatException e) {
        throw new RamParseException(
            "stratum number of subroutine '" + name + "' is out of range", pos);
      }
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, statements);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Subroutine
              && name.equals(((Subroutine) o).name)
              && statements.equals(((Subroutine) o).statements);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append("SUBROUTINE ").append(name).append('\n');
      return unparseList(buf, statements, "\n").append("\nEND SUBROUTINE");
    }

    @Override
    public Subroutine accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /**
     * Creates a copy of this {@code Subroutine} with given statements, or
     * {@code this} if the statements are the same.
     */
    public Subroutine copy(List<Statement> statements) {
      return this.statements.equals(statements)
          ? this
          : ram.subroutine(pos, name, statements);
    }
  }

  /** Reference to a relation, possibly to one of its generations. */
  public static class RelationRef extends RamNode {
    public final Generation generation;
    /** Base name, qualified with '.'; never includes the generation
     * prefix. */
    public final String name;

    RelationRef(Pos pos, Generation generation, String name) {
      super(pos, Op.RELATION);
      this.generation = requireNonNull(generation);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return Objects.hash(generation, name);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof RelationRef
              && generation == ((RelationRef) o).generation
              && name.equals(((RelationRef) o).name);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append(generation.prefix).append(name);
    }

    @Override
    public RelationRef accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  // -- statements ------------------------------------------------------------

  /** Base class for statements, the contents of a subroutine. */
  public abstract static class Statement extends RamNode {
    Statement(Pos pos, Op op) {
      super(pos, op);
    }

    @Override
    public abstract Statement accept(Shuttle shuttle);
  }

  /** Loop that repeats its body until an {@link Exit} fires. */
  public static class Loop extends Statement {
    public final ImmutableList<Statement> statements;

    Loop(Pos pos, ImmutableList<Statement> statements) {
      super(pos, Op.LOOP);
      this.statements = requireNonNull(statements);
    }

    @Override
    public int hashCode() {
      return statements.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Loop && statements.equals(((Loop) o).statements);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append("LOOP\n");
      return unparseList(buf, statements, "\n").append("\nEND LOOP");
    }

    @Override
    public Statement accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Loop copy(List<Statement> statements) {
      return this.statements.equals(statements)
          ? this
          : ram.loop(pos, statements);
    }
  }

  /** Query, a nest of operations that ends in a mutation. */
  public static class Query extends Statement {
    public final Operation operation;

    Query(Pos pos, Operation operation) {
      super(pos, Op.QUERY);
      this.operation = requireNonNull(operation);
    }

    @Override
    public int hashCode() {
      return operation.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Query && operation.equals(((Query) o).operation);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append("QUERY\n");
      return operation.unparse(buf).append("\nEND QUERY");
    }

    @Override
    public Statement accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Query copy(Operation operation) {
      return this.operation.equals(operation)
          ? this
          : ram.query(pos, operation);
    }
  }

  /**
   * Statement with commentary from the compiler, usually the Datalog rule
   * that the statement evaluates.
   *
   * <p>The commentary does not change the meaning of {@link #statement}.
   */
  public static class Debug extends Statement {
    public final Value info;
    public final Statement statement;

    Debug(Pos pos, Value info, Statement statement) {
      super(pos, Op.DEBUG);
      this.info = requireNonNull(info);
      this.statement = requireNonNull(statement);
    }

    @Override
    public int hashCode() {
      return Objects.hash(info, statement);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Debug
              && info.equals(((Debug) o).info)
              && statement.equals(((Debug) o).statement);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      info.unparse(buf.append("DEBUG ")).append('\n');
      return statement.unparse(buf).append("\nEND DEBUG");
    }

    @Override
    public Statement accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Debug copy(Statement statement) {
      return this.statement.equals(statement)
          ? this
          : ram.debug(pos, info, statement);
    }
  }

  /** Statement that removes all tuples from a relation. */
  public static class Clear extends Statement {
    public final RelationRef relation;

    Clear(Pos pos, RelationRef relation) {
      super(pos, Op.CLEAR);
      this.relation = requireNonNull(relation);
    }

    @Override
    public int hashCode() {
      return relation.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Clear && relation.equals(((Clear) o).relation);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return relation.unparse(buf.append("CLEAR "));
    }

    @Override
    public Statement accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Statement that exchanges the contents of two relations. */
  public static class Swap extends Statement {
    public final RelationRef relation0;
    public final RelationRef relation1;

    Swap(Pos pos, RelationRef relation0, RelationRef relation1) {
      super(pos, Op.SWAP);
      this.relation0 = requireNonNull(relation0);
      this.relation1 = requireNonNull(relation1);
    }

    @Override
    public int hashCode() {
      return Objects.hash(relation0, relation1);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Swap
              && relation0.equals(((Swap) o).relation0)
              && relation1.equals(((Swap) o).relation1);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      relation0.unparse(buf.append("SWAP ("));
      return relation1.unparse(buf.append(", ")).append(')');
    }

    @Override
    public Statement accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Statement that leaves the enclosing {@link Loop} if a condition
   * holds. */
  public static class Exit extends Statement {
    public final Condition condition;

    Exit(Pos pos, Condition condition) {
      super(pos, Op.EXIT);
      this.condition = requireNonNull(condition);
    }

    @Override
    public int hashCode() {
      return condition.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Exit && condition.equals(((Exit) o).condition);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return condition.unparse(buf.append("EXIT "));
    }

    @Override
    public Statement accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Exit copy(Condition condition) {
      return this.condition.equals(condition)
          ? this
          : ram.exit(pos, condition);
    }
  }

  /** Statement that loads a relation from, or stores it to, a file. */
  public static class Io extends Statement {
    public static final String OPERATION = "operation";
    public static final String FILENAME = "filename";
    public static final String DELIMITER = "delimiter";

    public final RelationRef relation;
    public final ImmutableMap<String, Value> options;

    Io(Pos pos, RelationRef relation, ImmutableMap<String, Value> options) {
      super(pos, Op.IO);
      this.relation = requireNonNull(relation);
      this.options = requireNonNull(options);
    }

    /** Returns the "operation" option, usually "input" or "output". */
    public @Nullable String operation() {
      return option(OPERATION);
    }

    /** Returns the "filename" option, or null. */
    public @Nullable String filename() {
      return option(FILENAME);
    }

    /** Returns the "delimiter" option; a tab if absent. */
    public String delimiter() {
      final String delimiter = option(DELIMITER);
      return delimiter == null ? "\t" : delimiter;
    }

    private @Nullable String option(String key) {
      final Value value = options.get(key);
      return value == null || value.kind == Value.Kind.NULL
          ? null
          : value.text();
    }

    @Override
    public int hashCode() {
      return Objects.hash(relation, options);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Io
              && relation.equals(((Io) o).relation)
              && options.equals(((Io) o).options);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      relation.unparse(buf.append("IO ")).append(" (");
      int i = 0;
      for (Map.Entry<String, Value> entry : options.entrySet()) {
        if (i++ > 0) {
          buf.append(',');
        }
        buf.append(entry.getKey()).append('=');
        entry.getValue().unparse(buf);
      }
      return buf.append(')');
    }

    @Override
    public Statement accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Statement that calls a subroutine. */
  public static class Call extends Statement {
    public final String name;

    Call(Pos pos, String name) {
      super(pos, Op.CALL);
      this.name = requireNonNull(name);
    }

    @Override
    public int hashCode() {
      return name.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Call && name.equals(((Call) o).name);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append("CALL ").append(name);
    }

    @Override
    public Statement accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  // -- operations ------------------------------------------------------------

  /** Base class for operations, the contents of a {@link Query}. */
  public abstract static class Operation extends RamNode {
    Operation(Pos pos, Op op) {
      super(pos, op);
    }

    @Override
    public abstract Operation accept(Shuttle shuttle);
  }

  /**
   * Operation that computes an aggregate over a relation and binds the
   * result.
   *
   * <p>For example, "t1.0 = COUNT FOR ALL t1 IN path" binds the count of
   * {@code path} to column 0 of {@code t1}, then evaluates {@link #inner}.
   * While the {@link #expression} and {@link #condition} are evaluated,
   * {@link #variable} ranges over the tuples of {@link #relation}.
   */
  public static class Aggregate extends Operation {
    public final Ref target;
    public final Aggregator aggregator;
    public final String variable;
    public final RelationRef relation;
    public final @Nullable Element expression;
    public final @Nullable Condition condition;
    public final Operation inner;

    Aggregate(
        Pos pos,
        Ref target,
        Aggregator aggregator,
        String variable,
        RelationRef relation,
        @Nullable Element expression,
        @Nullable Condition condition,
        Operation inner) {
      super(pos, Op.AGGREGATE);
      this.target = requireNonNull(target);
      this.aggregator = requireNonNull(aggregator);
      this.variable = requireNonNull(variable);
      this.relation = requireNonNull(relation);
      this.expression = expression;
      this.condition = condition;
      this.inner = requireNonNull(inner);
    }

    @Override
    public int hashCode() {
      return Objects.hash(
          target, aggregator, variable, relation, expression, condition,
          inner);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Aggregate
              && target.equals(((Aggregate) o).target)
              && aggregator == ((Aggregate) o).aggregator
              && variable.equals(((Aggregate) o).variable)
              && relation.equals(((Aggregate) o).relation)
              && Objects.equals(expression, ((Aggregate) o).expression)
              && Objects.equals(condition, ((Aggregate) o).condition)
              && inner.equals(((Aggregate) o).inner);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      target.unparse(buf).append(" = ").append(aggregator.name());
      if (expression != null) {
        expression.unparse(buf.append(' '));
      }
      buf.append(" FOR ALL ").append(variable).append(" IN ");
      relation.unparse(buf);
      if (condition != null) {
        condition.unparse(buf.append(" WHERE "));
      }
      return inner.unparse(buf.append('\n'));
    }

    @Override
    public Operation accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Aggregate copy(
        @Nullable Element expression,
        @Nullable Condition condition,
        Operation inner) {
      return Objects.equals(this.expression, expression)
              && Objects.equals(this.condition, condition)
              && this.inner.equals(inner)
          ? this
          : ram.aggregate(
              pos, target, aggregator, variable, relation, expression,
              condition, inner);
    }
  }

  /** Operation that binds a variable to each tuple of a relation, for
   * example "FOR t0 IN edge". */
  public static class Scan extends Operation {
    public final String variable;
    public final RelationRef relation;
    /** Condition that an index seek satisfies, or null for a full scan. */
    public final @Nullable Condition indexCondition;
    public final Operation inner;

    Scan(
        Pos pos,
        String variable,
        RelationRef relation,
        @Nullable Condition indexCondition,
        Operation inner) {
      super(pos, Op.SCAN);
      this.variable = requireNonNull(variable);
      this.relation = requireNonNull(relation);
      this.indexCondition = indexCondition;
      this.inner = requireNonNull(inner);
    }

    @Override
    public int hashCode() {
      return Objects.hash(variable, relation, indexCondition, inner);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Scan
              && variable.equals(((Scan) o).variable)
              && relation.equals(((Scan) o).relation)
              && Objects.equals(indexCondition, ((Scan) o).indexCondition)
              && inner.equals(((Scan) o).inner);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append("FOR ").append(variable).append(" IN ");
      relation.unparse(buf);
      if (indexCondition != null) {
        indexCondition.unparse(buf.append(" ON INDEX "));
      }
      return inner.unparse(buf.append('\n'));
    }

    @Override
    public Operation accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Scan copy(@Nullable Condition indexCondition, Operation inner) {
      return Objects.equals(this.indexCondition, indexCondition)
              && this.inner.equals(inner)
          ? this
          : ram.scan(pos, variable, relation, indexCondition, inner);
    }
  }

  /**
   * Operation that evaluates {@link #inner} only if a condition holds.
   *
   * <p>If {@link #breaks}, it also leaves the enclosing {@link Loop} when the
   * condition holds.
   */
  public static class Filter extends Operation {
    public final Condition condition;
    public final @Nullable Condition indexCondition;
    public final boolean breaks;
    public final Operation inner;

    Filter(
        Pos pos,
        Condition condition,
        @Nullable Condition indexCondition,
        boolean breaks,
        Operation inner) {
      super(pos, Op.FILTER);
      this.condition = requireNonNull(condition);
      this.indexCondition = indexCondition;
      this.breaks = breaks;
      this.inner = requireNonNull(inner);
    }

    @Override
    public int hashCode() {
      return Objects.hash(condition, indexCondition, breaks, inner);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Filter
              && condition.equals(((Filter) o).condition)
              && Objects.equals(indexCondition, ((Filter) o).indexCondition)
              && breaks == ((Filter) o).breaks
              && inner.equals(((Filter) o).inner);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      condition.unparse(buf.append("IF "));
      if (indexCondition != null) {
        indexCondition.unparse(buf.append(" ON INDEX "));
      }
      if (breaks) {
        buf.append(" BREAK");
      }
      return inner.unparse(buf.append('\n'));
    }

    @Override
    public Operation accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Filter copy(
        Condition condition,
        @Nullable Condition indexCondition,
        Operation inner) {
      return this.condition.equals(condition)
              && Objects.equals(this.indexCondition, indexCondition)
              && this.inner.equals(inner)
          ? this
          : ram.filter(pos, condition, indexCondition, breaks, inner);
    }
  }

  /** Operation that destructures a record into a new tuple variable, for
   * example "UNPACK t1 ARITY 2 FROM t0.1". */
  public static class Unpack extends Operation {
    public final String variable;
    public final int arity;
    public final Element element;
    public final Operation inner;

    Unpack(
        Pos pos, String variable, int arity, Element element,
        Operation inner) {
      super(pos, Op.UNPACK);
      checkArgument(arity >= 0, "negative arity");
      this.variable = requireNonNull(variable);
      this.arity = arity;
      this.element = requireNonNull(element);
      this.inner = requireNonNull(inner);
    }

    @Override
    public int hashCode() {
      return Objects.hash(variable, arity, element, inner);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Unpack
              && variable.equals(((Unpack) o).variable)
              && arity == ((Unpack) o).arity
              && element.equals(((Unpack) o).element)
              && inner.equals(((Unpack) o).inner);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append("UNPACK ")
          .append(variable)
          .append(" ARITY ")
          .append(arity)
          .append(" FROM ");
      element.unparse(buf);
      return inner.unparse(buf.append('\n'));
    }

    @Override
    public Operation accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Unpack copy(Element element, Operation inner) {
      return this.element.equals(element) && this.inner.equals(inner)
          ? this
          : ram.unpack(pos, variable, arity, element, inner);
    }
  }

  /** Operation that adds a tuple to, or removes it from, a relation. It is
   * always the innermost operation of a query. */
  public abstract static class Mutation extends Operation {
    public final Tuple tuple;
    public final RelationRef relation;

    Mutation(Pos pos, Op op, Tuple tuple, RelationRef relation) {
      super(pos, op);
      this.tuple = requireNonNull(tuple);
      this.relation = requireNonNull(relation);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, tuple, relation);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Mutation
              && op == ((Mutation) o).op
              && tuple.equals(((Mutation) o).tuple)
              && relation.equals(((Mutation) o).relation);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append(op == Op.INSERT ? "INSERT " : "ERASE ");
      tuple.unparse(buf).append(op == Op.INSERT ? " INTO " : " FROM ");
      return relation.unparse(buf);
    }
  }

  /** Mutation that adds a tuple to a relation. */
  public static class Insert extends Mutation {
    Insert(Pos pos, Tuple tuple, RelationRef relation) {
      super(pos, Op.INSERT, tuple, relation);
    }

    @Override
    public Operation accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Insert copy(Tuple tuple) {
      return this.tuple.equals(tuple) ? this : ram.insert(pos, tuple, relation);
    }
  }

  /** Mutation that removes a tuple from a relation. */
  public static class Erase extends Mutation {
    Erase(Pos pos, Tuple tuple, RelationRef relation) {
      super(pos, Op.ERASE, tuple, relation);
    }

    @Override
    public Operation accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Erase copy(Tuple tuple) {
      return this.tuple.equals(tuple) ? this : ram.erase(pos, tuple, relation);
    }
  }

  // -- conditions ------------------------------------------------------------

  /** Base class for conditions. */
  public abstract static class Condition extends RamNode {
    Condition(Pos pos, Op op) {
      super(pos, op);
    }

    @Override
    public abstract Condition accept(Shuttle shuttle);
  }

  /** Conjunction ({@link Op#AND}) or disjunction ({@link Op#OR}) of
   * conditions. */
  public static class Junction extends Condition {
    public final ImmutableList<Condition> conditions;

    Junction(Pos pos, Op op, ImmutableList<Condition> conditions) {
      super(pos, op);
      checkArgument(op == Op.AND || op == Op.OR, "not a junction: %s", op);
      checkArgument(!conditions.isEmpty(), "empty %s", op);
      this.conditions = conditions;
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, conditions);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Junction
              && op == ((Junction) o).op
              && conditions.equals(((Junction) o).conditions);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return unparseList(buf, conditions, " " + op.opName + " ");
    }

    @Override
    public Condition accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Junction copy(List<Condition> conditions) {
      return this.conditions.equals(conditions)
          ? this
          : ram.junction(pos, op, conditions);
    }
  }

  /** Negation of a condition. */
  public static class Not extends Condition {
    public final Condition condition;

    Not(Pos pos, Condition condition) {
      super(pos, Op.NOT);
      this.condition = requireNonNull(condition);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, condition);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Not && condition.equals(((Not) o).condition);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return condition.unparse(buf.append("NOT "));
    }

    @Override
    public Condition accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Not copy(Condition condition) {
      return this.condition.equals(condition) ? this : ram.not(pos, condition);
    }
  }

  /** Condition that a tuple is in a relation, for example
   * "(t0.1,t0.0) IN edge". */
  public static class In extends Condition {
    public final Tuple tuple;
    public final RelationRef relation;

    In(Pos pos, Tuple tuple, RelationRef relation) {
      super(pos, Op.IN);
      this.tuple = requireNonNull(tuple);
      this.relation = requireNonNull(relation);
    }

    @Override
    public int hashCode() {
      return Objects.hash(tuple, relation);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof In
              && tuple.equals(((In) o).tuple)
              && relation.equals(((In) o).relation);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return relation.unparse(tuple.unparse(buf).append(" IN "));
    }

    @Override
    public Condition accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public In copy(Tuple tuple) {
      return this.tuple.equals(tuple) ? this : ram.in(pos, tuple, relation);
    }
  }

  /** Condition that a relation has a tuple, for example
   * "EXISTS t0 IN edge". */
  public static class Exists extends Condition {
    public final String variable;
    public final RelationRef relation;

    Exists(Pos pos, String variable, RelationRef relation) {
      super(pos, Op.EXISTS);
      this.variable = requireNonNull(variable);
      this.relation = requireNonNull(relation);
    }

    @Override
    public int hashCode() {
      return Objects.hash(variable, relation);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Exists
              && variable.equals(((Exists) o).variable)
              && relation.equals(((Exists) o).relation);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append("EXISTS ").append(variable).append(" IN ");
      return relation.unparse(buf);
    }

    @Override
    public Condition accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Condition that a relation is empty. */
  public static class IsEmpty extends Condition {
    public final RelationRef relation;

    IsEmpty(Pos pos, RelationRef relation) {
      super(pos, Op.IS_EMPTY);
      this.relation = requireNonNull(relation);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, relation);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof IsEmpty && relation.equals(((IsEmpty) o).relation);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return relation.unparse(buf.append("ISEMPTY(")).append(')');
    }

    @Override
    public Condition accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Comparison between two elements; {@link #op} is one of {@link Op#EQ},
   * {@link Op#NE}, {@link Op#LT}, {@link Op#LE}, {@link Op#GT},
   * {@link Op#GE}. */
  public static class Compare extends Condition {
    public final Element left;
    public final Element right;

    Compare(Pos pos, Op op, Element left, Element right) {
      super(pos, op);
      checkArgument(op.isComparison(), "not a comparison: %s", op);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, left, right);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Compare
              && op == ((Compare) o).op
              && left.equals(((Compare) o).left)
              && right.equals(((Compare) o).right);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      left.unparse(buf).append(' ').append(op.opName).append(' ');
      return right.unparse(buf);
    }

    @Override
    public Condition accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Compare copy(Element left, Element right) {
      return this.left.equals(left) && this.right.equals(right)
          ? this
          : ram.compare(pos, op, left, right);
    }
  }

  /** Condition in parentheses. */
  public static class BracketedCond extends Condition {
    public final Condition condition;

    BracketedCond(Pos pos, Condition condition) {
      super(pos, Op.BRACKETED_COND);
      this.condition = requireNonNull(condition);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, condition);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof BracketedCond
              && condition.equals(((BracketedCond) o).condition);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return condition.unparse(buf.append('(')).append(')');
    }

    @Override
    public Condition accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public BracketedCond copy(Condition condition) {
      return this.condition.equals(condition)
          ? this
          : ram.bracketedCond(pos, condition);
    }
  }

  // -- elements --------------------------------------------------------------

  /** Base class for tuple elements, the expressions of RAM. */
  public abstract static class Element extends RamNode {
    Element(Pos pos, Op op) {
      super(pos, op);
    }

    @Override
    public abstract Element accept(Shuttle shuttle);

    /** Returns whether this element is atomic: a reference, a literal or
     * undefined. */
    public boolean isAtomic() {
      return op == Op.REF || op == Op.LITERAL || op == Op.UNDEFINED;
    }
  }

  /** Literal value, for example "number(5)". */
  public static class Literal extends Element {
    public final LiteralKind kind;
    /** Text of the value; for a symbol, without quotes. */
    public final String value;

    Literal(Pos pos, LiteralKind kind, String value) {
      super(pos, Op.LITERAL);
      this.kind = requireNonNull(kind);
      this.value = requireNonNull(value);
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind, value);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Literal
              && kind == ((Literal) o).kind
              && value.equals(((Literal) o).value);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      buf.append(kind.keyword).append('(');
      if (kind == LiteralKind.SYMBOL) {
        Value.string(value).unparse(buf);
      } else {
        buf.append(value);
      }
      return buf.append(')');
    }

    @Override
    public Element accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Reference to a column of a tuple variable, for example "t0.1". */
  public static class Ref extends Element {
    public final String variable;
    public final int column;

    Ref(Pos pos, String variable, int column) {
      super(pos, Op.REF);
      checkArgument(column >= 0, "negative column");
      this.variable = requireNonNull(variable);
      this.column = column;
    }

    @Override
    public int hashCode() {
      return Objects.hash(variable, column);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Ref
              && variable.equals(((Ref) o).variable)
              && column == ((Ref) o).column;
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append(variable).append('.').append(column);
    }

    @Override
    public Ref accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Sum ({@link Op#ADD}) or difference ({@link Op#SUB}) of two or more
   * elements. */
  public static class Arithmetic extends Element {
    public final ImmutableList<Element> args;

    Arithmetic(Pos pos, Op op, ImmutableList<Element> args) {
      super(pos, op);
      checkArgument(op == Op.ADD || op == Op.SUB, "not arithmetic: %s", op);
      checkArgument(args.size() >= 2, "%s needs two or more arguments", op);
      this.args = args;
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Arithmetic
              && op == ((Arithmetic) o).op
              && args.equals(((Arithmetic) o).args);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return unparseList(buf, args, requireNonNull(op.opName));
    }

    @Override
    public Element accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Arithmetic copy(List<Element> args) {
      return this.args.equals(args) ? this : ram.arithmetic(pos, op, args);
    }
  }

  /** Undefined value, written "UNDEF"; a column that an index seek
   * ignores. */
  public static class Undefined extends Element {
    Undefined(Pos pos) {
      super(pos, Op.UNDEFINED);
    }

    @Override
    public int hashCode() {
      return op.hashCode();
    }

    @Override
    public boolean equals(Object o) {
      return o == this || o instanceof Undefined;
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return buf.append("UNDEF");
    }

    @Override
    public Element accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Call to a built-in function, built-in operator, or user-defined
   * functor. */
  public static class FunctorCall extends Element {
    public final FunctorKind kind;
    public final String name;
    public final ImmutableList<Element> args;

    FunctorCall(
        Pos pos, FunctorKind kind, String name, ImmutableList<Element> args) {
      super(pos, Op.FUNCTOR_CALL);
      checkArgument(kind != FunctorKind.OPERATOR || args.size() >= 2,
          "operator %s needs two or more arguments", name);
      this.kind = requireNonNull(kind);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(kind, name, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof FunctorCall
              && kind == ((FunctorCall) o).kind
              && name.equals(((FunctorCall) o).name)
              && args.equals(((FunctorCall) o).args);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      switch (kind) {
        case OPERATOR:
          return unparseList(buf, args, name);
        case USER_DEFINED:
          buf.append('@');
          // fall through
        default:
          buf.append(name).append('(');
          return unparseList(buf, args, ",").append(')');
      }
    }

    @Override
    public Element accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public FunctorCall copy(List<Element> args) {
      return this.args.equals(args)
          ? this
          : ram.functorCall(pos, kind, name, args);
    }
  }

  /** Element in parentheses. */
  public static class Bracketed extends Element {
    public final Element element;

    Bracketed(Pos pos, Element element) {
      super(pos, Op.BRACKETED);
      this.element = requireNonNull(element);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, element);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Bracketed
              && element.equals(((Bracketed) o).element);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return element.unparse(buf.append('(')).append(')');
    }

    @Override
    public Element accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Bracketed copy(Element element) {
      return this.element.equals(element)
          ? this
          : ram.bracketed(pos, element);
    }
  }

  /** Record constructor, for example "[t0.0,t0.1]". */
  public static class Record extends Element {
    public final ImmutableList<Element> args;

    Record(Pos pos, ImmutableList<Element> args) {
      super(pos, Op.RECORD);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Record && args.equals(((Record) o).args);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return unparseList(buf.append('['), args, ",").append(']');
    }

    @Override
    public Element accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Record copy(List<Element> args) {
      return this.args.equals(args) ? this : ram.record(pos, args);
    }
  }

  /** Tuple of elements, as inserted into, erased from, or tested for
   * membership in a relation. */
  public static class Tuple extends Element {
    public final ImmutableList<Element> args;

    Tuple(Pos pos, ImmutableList<Element> args) {
      super(pos, Op.TUPLE);
      this.args = requireNonNull(args);
    }

    @Override
    public int hashCode() {
      return Objects.hash(op, args);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Tuple && args.equals(((Tuple) o).args);
    }

    @Override
    StringBuilder unparse(StringBuilder buf) {
      return unparseList(buf.append('('), args, ",").append(')');
    }

    @Override
    public Tuple accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    public Tuple copy(List<Element> args) {
      return this.args.equals(args) ? this : ram.tuple(pos, args);
    }
  }
}

// End Ram.java
