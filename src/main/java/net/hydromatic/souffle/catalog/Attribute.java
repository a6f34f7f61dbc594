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

import java.util.Objects;

/** Attribute (column) of a relation.
 *
 * <p>{@link #typeName} is the type as declared, which may be a user-defined
 * type such as "Node"; {@link #type} is the primitive type it resolves to. */
public class Attribute {
  public final String name;
  public final String typeName;
  public final AttributeType type;

  private Attribute(String name, String typeName, AttributeType type) {
    this.name = requireNonNull(name);
    this.typeName = requireNonNull(typeName);
    this.type = requireNonNull(type);
  }

  /** Creates an attribute whose type is resolved from its name. */
  public static Attribute of(String name, String typeName) {
    return new Attribute(name, typeName, AttributeType.of(typeName));
  }

  /** Creates an attribute of a user-defined type. */
  public static Attribute of(String name, String typeName,
      AttributeType type) {
    return new Attribute(name, typeName, type);
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, typeName, type);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Attribute
        && name.equals(((Attribute) o).name)
        && typeName.equals(((Attribute) o).typeName)
        && type == ((Attribute) o).type;
  }

  /** Returns "name:type", the form used in relation and index listings. */
  @Override
  public String toString() {
    return name + ":" + typeName;
  }
}

// End Attribute.java
