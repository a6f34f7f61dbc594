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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.junit.jupiter.api.Test;

/** Tests {@link PlanNode}. */
public class PlanNodeTest {
  @Test void testUnparse() {
    final PlanNode node =
        PlanNode.of("a",
            ImmutableList.of(PlanNode.leaf("b"),
                PlanNode.of("c", ImmutableList.of(PlanNode.leaf("d")))));
    assertThat(node, hasToString("a\n   b\n   c\n      d\n"));
    assertThat(node.unparse(new StringBuilder(), 2, 1),
        hasToString("  a\n   b\n   c\n    d\n"));
    assertThat(Plans.toText(List.of(node, PlanNode.leaf("e")), 2),
        is("a\n  b\n  c\n    d\ne\n"));
  }

  @Test void testPrepend() {
    final PlanNode node =
        PlanNode.of("c", ImmutableList.of(PlanNode.leaf("d")));
    final PlanNode node2 = node.prepend(List.of("a", "b"));
    assertThat(node2.lines, is(List.of("a", "b", "c")));
    assertThat(node2.children, is(node.children));
    assertThat(node2, hasToString("a\nb\nc\n   d\n"));
    assertThat(node.prepend(List.of()), is(node));
  }
}

// End PlanNodeTest.java
