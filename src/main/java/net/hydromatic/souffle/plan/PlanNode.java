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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.Objects;

/**
 * Node in a rendered plan: one or more header lines, followed by child nodes
 * that are printed one level deeper.
 */
public class PlanNode {
  public final ImmutableList<String> lines;
  public final ImmutableList<PlanNode> children;

  private PlanNode(ImmutableList<String> lines,
      ImmutableList<PlanNode> children) {
    checkArgument(!lines.isEmpty(), "node has no lines");
    this.lines = lines;
    this.children = children;
  }

  /** Creates a node with one line and no children. */
  public static PlanNode leaf(String line) {
    return new PlanNode(ImmutableList.of(line), ImmutableList.of());
  }

  /** Creates a node with one line and the given children. */
  public static PlanNode of(String line, List<PlanNode> children) {
    return new PlanNode(ImmutableList.of(line),
        ImmutableList.copyOf(children));
  }

  /** Returns a node with the given lines before this node's lines, and the
   * same children. */
  public PlanNode prepend(List<String> lines) {
    return new PlanNode(
        ImmutableList.<String>builder().addAll(lines).addAll(this.lines)
            .build(),
        children);
  }

  @Override
  public int hashCode() {
    return Objects.hash(lines, children);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof PlanNode
            && lines.equals(((PlanNode) o).lines)
            && children.equals(((PlanNode) o).children);
  }

  @Override
  public String toString() {
    return unparse(new StringBuilder(), 0, 3).toString();
  }

  /** Prints this node, each line preceded by {@code prefix} spaces, and its
   * children with {@code indent} more spaces. */
  public StringBuilder unparse(StringBuilder buf, int prefix, int indent) {
    for (String line : lines) {
      indent(buf, prefix);
      buf.append(line).append('\n');
    }
    for (PlanNode child : children) {
      child.unparse(buf, prefix + indent, indent);
    }
    return buf;
  }

  private static void indent(StringBuilder buf, int indent) {
    for (int i = 0; i < indent; i++) {
      buf.append(' ');
    }
  }
}

// End PlanNode.java
