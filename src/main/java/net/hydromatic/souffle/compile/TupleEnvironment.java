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

import java.util.ArrayList;
import java.util.List;
import net.hydromatic.souffle.catalog.SchemaCatalog;
import net.hydromatic.souffle.ram.Ram;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Stack of the tuple variables that are in scope at a point in a traversal
 * of a RAM tree.
 *
 * <p>A traversal creates its own environment and discards it when done;
 * environments are never shared between traversals.
 *
 * <p>{@link #push} returns a {@link Scope}; use it in a try-with-resources
 * block so that the binding is removed however the block exits:
 *
 * <pre>{@code
 * try (TupleEnvironment.Scope ignored = env.bind(scan)) {
 *   ...
 * }
 * }</pre>
 *
 * <p>The {@code bind} methods define which construct binds which variable,
 * and are shared by every pass that resolves column references.
 */
public class TupleEnvironment {
  private final SchemaCatalog catalog;
  private final List<Frame> frames = new ArrayList<>();

  public TupleEnvironment(SchemaCatalog catalog) {
    this.catalog = requireNonNull(catalog);
  }

  /** Binds a variable, hiding any existing binding of the same name until
   * the returned scope is closed. */
  public Scope push(String name, TupleBinding binding) {
    final Frame frame = new Frame(frames.size(), name, binding);
    frames.add(frame);
    return new Scope(frame);
  }

  /**
   * Removes the innermost binding.
   *
   * @throws IllegalStateException if the innermost binding is not of the
   *     given variable
   */
  public void pop(String name) {
    if (frames.isEmpty()) {
      throw new IllegalStateException("cannot pop '" + name
          + "': environment is empty");
    }
    final Frame top = frames.get(frames.size() - 1);
    if (!top.name.equals(name)) {
      throw new IllegalStateException("cannot pop '" + name
          + "': innermost binding is '" + top.name + "'");
    }
    frames.remove(frames.size() - 1);
  }

  /** Returns the innermost binding of a variable, or null if it is not
   * bound. */
  public @Nullable TupleBinding lookup(String name) {
    for (int i = frames.size() - 1; i >= 0; i--) {
      final Frame frame = frames.get(i);
      if (frame.name.equals(name)) {
        return frame.binding;
      }
    }
    return null;
  }

  /** Returns the number of bindings, including hidden ones. */
  public int depth() {
    return frames.size();
  }

  /**
   * Returns the label of column {@code column} of a variable.
   *
   * <p>If the variable is not bound, the reference is to a field of a
   * record, and the label is "field_" followed by the column number.
   */
  public String label(String variable, int column) {
    final TupleBinding binding = lookup(variable);
    return binding == null
        ? TupleBinding.fieldLabel(column)
        : binding.label(column);
  }

  /** Binds the variable of a scan to the schema of its relation. */
  public Scope bind(Ram.Scan scan) {
    return push(scan.variable,
        TupleBinding.relation(catalog.get(scan.relation.name)));
  }

  /** Binds the variable of an aggregate to the schema of the relation it
   * ranges over; in scope for the aggregate's expression and condition. */
  public Scope bindSource(Ram.Aggregate aggregate) {
    return push(aggregate.variable,
        TupleBinding.relation(catalog.get(aggregate.relation.name)));
  }

  /** Binds the target of an aggregate to its result; in scope for the
   * aggregate's target and its inner operation. */
  public Scope bindTarget(Ram.Aggregate aggregate) {
    return push(aggregate.target.variable,
        TupleBinding.aggregate(aggregate.aggregator));
  }

  /** Binds the variable of an unpack to the fields of the record. */
  public Scope bind(Ram.Unpack unpack) {
    return push(unpack.variable, TupleBinding.record(unpack.arity));
  }

  /** Entry in the stack. */
  private static class Frame {
    final int index;
    final String name;
    final TupleBinding binding;

    Frame(int index, String name, TupleBinding binding) {
      this.index = index;
      this.name = name;
      this.binding = binding;
    }
  }

  /** Lifetime of a binding; closing it removes exactly that binding. */
  public class Scope implements AutoCloseable {
    private final Frame frame;
    private boolean closed;

    private Scope(Frame frame) {
      this.frame = frame;
    }

    /**
     * Removes the binding.
     *
     * @throws IllegalStateException if bindings pushed after this one are
     *     still in the environment
     */
    @Override
    public void close() {
      if (closed) {
        return;
      }
      if (frames.size() - 1 != frame.index
          || frames.get(frame.index) != frame) {
        throw new IllegalStateException("scope of '" + frame.name
            + "' closed out of order");
      }
      pop(frame.name);
      closed = true;
    }
  }
}

// End TupleEnvironment.java
