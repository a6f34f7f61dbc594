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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;
import net.hydromatic.souffle.catalog.Attribute;

/** B-tree index that the compiler may build on a relation: its key is a list
 * of the relation's attributes in ascending column order. */
public class BTreeIndex {
  private static final Joiner COMMA = Joiner.on(", ");

  public final String relationName;
  public final ImmutableList<Attribute> attributes;

  private BTreeIndex(String relationName, ImmutableList<Attribute> attributes) {
    this.relationName = requireNonNull(relationName);
    this.attributes = requireNonNull(attributes);
  }

  public static BTreeIndex of(String relationName, List<Attribute> attributes) {
    return new BTreeIndex(relationName, ImmutableList.copyOf(attributes));
  }

  @Override
  public int hashCode() {
    return Objects.hash(relationName, attributes);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof BTreeIndex
            && relationName.equals(((BTreeIndex) o).relationName)
            && attributes.equals(((BTreeIndex) o).attributes);
  }

  /** Returns the index as it appears in a listing, for example
   * "BTREE(a:number, c:number)". */
  @Override
  public String toString() {
    return "BTREE(" + COMMA.join(attributes) + ")";
  }

  /** Returns a description that includes the relation, for example
   * "BTree index on r(a:number, c:number)". */
  public String describe() {
    return "BTree index on " + relationName + "(" + COMMA.join(attributes)
        + ")";
  }
}

// End BTreeIndex.java
