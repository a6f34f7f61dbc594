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

import org.checkerframework.checker.nullness.qual.Nullable;

/** Kind of RAM node. */
public enum Op {
  // program structure
  PROGRAM,
  DECLARATION,
  SUBROUTINE,
  RELATION,

  // statements
  LOOP,
  QUERY,
  DEBUG,
  CLEAR,
  SWAP,
  EXIT,
  IO,
  CALL,

  // operations
  AGGREGATE,
  SCAN,
  FILTER,
  UNPACK,
  INSERT,
  ERASE,

  // conditions
  OR("OR"),
  AND("AND"),
  NOT("NOT"),
  IN("IN"),
  EXISTS,
  IS_EMPTY,
  EQ("="),
  NE("!="),
  LT("<"),
  LE("<="),
  GT(">"),
  GE(">="),
  BRACKETED_COND,

  // elements
  LITERAL,
  REF,
  ADD("+"),
  SUB("-"),
  UNDEFINED,
  FUNCTOR_CALL,
  BRACKETED,
  RECORD,
  TUPLE;

  /** Symbol of this operator in RAM text, or null. */
  public final @Nullable String opName;

  Op() {
    this(null);
  }

  Op(@Nullable String opName) {
    this.opName = opName;
  }

  /** Returns whether this is a comparison operator ({@code =}, {@code <}
   * etc.). */
  public boolean isComparison() {
    switch (this) {
      case EQ:
      case NE:
      case LT:
      case LE:
      case GT:
      case GE:
        return true;
      default:
        return false;
    }
  }

  /** Returns the comparison operator with a given symbol, or null. */
  public static @Nullable Op comparison(String symbol) {
    for (Op op : values()) {
      if (op.isComparison() && symbol.equals(op.opName)) {
        return op;
      }
    }
    return null;
  }
}

// End Op.java
