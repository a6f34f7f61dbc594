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

/** Primitive type of a relation attribute. */
public enum AttributeType {
  NUMBER('i'),
  SYMBOL('s'),
  UNSIGNED('u'),
  FLOAT('f'),
  /** Record, algebraic data type, or any type that is not primitive. */
  RECORD('r');

  /** Type qualifier in a RAM declaration, e.g. 'i' in "x:i:number". */
  public final char qualifier;

  AttributeType(char qualifier) {
    this.qualifier = qualifier;
  }

  /**
   * Returns the primitive type with a given Souffle name, or {@link #RECORD}
   * if the name is not primitive.
   */
  public static AttributeType of(String typeName) {
    switch (typeName) {
      case "number":
        return NUMBER;
      case "symbol":
        return SYMBOL;
      case "unsigned":
        return UNSIGNED;
      case "float":
        return FLOAT;
      default:
        return RECORD;
    }
  }

  /**
   * Returns the type with a given RAM qualifier. Qualifiers other than the
   * primitive ones ('+' for an ADT, for instance) are records.
   */
  public static AttributeType ofQualifier(char qualifier) {
    for (AttributeType type : values()) {
      if (type.qualifier == qualifier) {
        return type;
      }
    }
    return RECORD;
  }
}

// End AttributeType.java
