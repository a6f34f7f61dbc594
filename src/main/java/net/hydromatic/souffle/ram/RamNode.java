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

import static java.util.Objects.requireNonNull;

import java.util.List;

/**
 * Node in a RAM program tree.
 *
 * <p>Nodes are immutable. Two nodes are equal if they have the same structure;
 * their positions are not compared.
 */
public abstract class RamNode {
  public final Pos pos;
  public final Op op;

  RamNode(Pos pos, Op op) {
    this.pos = requireNonNull(pos);
    this.op = requireNonNull(op);
  }

  /**
   * Converts this node into RAM text.
   *
   * <p>The text is for debugging, but {@link
   * net.hydromatic.souffle.parse.RamParser} can parse it back.
   */
  @Override
  public final String toString() {
    return unparse(new StringBuilder()).toString();
  }

  abstract StringBuilder unparse(StringBuilder buf);

  /**
   * Accepts a shuttle, calling the {@link Shuttle#visit} method appropriate to
   * the type of this node, and returning the result.
   */
  public abstract RamNode accept(Shuttle shuttle);

  /**
   * Accepts a visitor, calling the {@link Visitor#visit} method appropriate to
   * the type of this node.
   */
  public abstract void accept(Visitor visitor);

  static StringBuilder unparseList(
      StringBuilder buf, List<? extends RamNode> nodes, String separator) {
    for (int i = 0; i < nodes.size(); i++) {
      if (i > 0) {
        buf.append(separator);
      }
      nodes.get(i).unparse(buf);
    }
    return buf;
  }
}

// End RamNode.java
