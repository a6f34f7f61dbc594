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

import static java.util.Objects.requireNonNull;

import net.hydromatic.souffle.catalog.RelationSchema;
import net.hydromatic.souffle.ram.Ram;
import org.checkerframework.checker.nullness.qual.Nullable;

/** What a tuple variable is bound to in a {@link TupleEnvironment}. */
public class TupleBinding {
  public final Kind kind;
  /** Schema of the relation; non-null if kind is {@link Kind#RELATION}. */
  public final @Nullable RelationSchema schema;
  /** Number of fields; for an aggregate, 1. */
  public final int arity;
  /** Aggregate function; non-null if kind is {@link Kind#AGGREGATE}. */
  public final Ram.@Nullable Aggregator aggregator;

  private TupleBinding(Kind kind, @Nullable RelationSchema schema, int arity,
      Ram.@Nullable Aggregator aggregator) {
    this.kind = requireNonNull(kind);
    this.schema = schema;
    this.arity = arity;
    this.aggregator = aggregator;
  }

  /** Binding of a variable that ranges over the tuples of a relation. */
  public static TupleBinding relation(RelationSchema schema) {
    return new TupleBinding(Kind.RELATION, schema, schema.arity(), null);
  }

  /** Binding of a variable that holds the fields of an unpacked record. */
  public static TupleBinding record(int arity) {
    return new TupleBinding(Kind.RECORD, null, arity, null);
  }

  /** Binding of a variable that holds the result of an aggregate. */
  public static TupleBinding aggregate(Ram.Aggregator aggregator) {
    return new TupleBinding(Kind.AGGREGATE, null, 1, aggregator);
  }

  /**
   * Returns the label of a column.
   *
   * <p>For a relation, the attribute name; for the result of an aggregate,
   * the name of the aggregate function; otherwise "field_" followed by the
   * column number.
   *
   * @throws IndexOutOfBoundsException if this is a relation binding and the
   *     column is beyond the relation's arity
   */
  public String label(int column) {
    switch (kind) {
      case RELATION:
        return requireNonNull(schema).attribute(column).name;
      case AGGREGATE:
        if (column == 0) {
          return requireNonNull(aggregator).lowerName();
        }
        // fall through
      default:
        return fieldLabel(column);
    }
  }

  /** Returns the label of a positional field, "field_" + column. */
  public static String fieldLabel(int column) {
    return "field_" + column;
  }

  @Override
  public String toString() {
    switch (kind) {
      case RELATION:
        return requireNonNull(schema).toString();
      case AGGREGATE:
        return requireNonNull(aggregator).lowerName();
      default:
        return "record/" + arity;
    }
  }

  /** Kind of binding. */
  public enum Kind {
    RELATION,
    RECORD,
    AGGREGATE
  }
}

// End TupleBinding.java
