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
package net.hydromatic.souffle.catalog;

import static java.util.Objects.requireNonNull;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/** Name and ordered attributes of a relation. */
public class RelationSchema {
  private static final Joiner COMMA = Joiner.on(", ");

  /** Qualified name, with segments separated by '.', e.g. "a.b.edge". */
  public final String name;
  public final ImmutableList<Attribute> attributes;

  private RelationSchema(String name, ImmutableList<Attribute> attributes) {
    this.name = requireNonNull(name);
    this.attributes = requireNonNull(attributes);
  }

  public static RelationSchema of(String name, List<Attribute> attributes) {
    return new RelationSchema(name, ImmutableList.copyOf(attributes));
  }

  public int arity() {
    return attributes.size();
  }

  /** Returns the attribute at a given position.
   *
   * @throws IndexOutOfBoundsException if the column is beyond the arity */
  public Attribute attribute(int column) {
    return attributes.get(column);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, attributes);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof RelationSchema
        && name.equals(((RelationSchema) o).name)
        && attributes.equals(((RelationSchema) o).attributes);
  }

  /** Returns the relation listing form, "name(attr:type, attr:type)". */
  @Override
  public String toString() {
    return name + "(" + COMMA.join(attributes) + ")";
  }
}

// End RelationSchema.java
