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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;
import net.hydromatic.souffle.catalog.Attribute;
import net.hydromatic.souffle.catalog.RelationSchema;
import net.hydromatic.souffle.catalog.SchemaCatalog;
import net.hydromatic.souffle.ram.Ram;
import org.junit.jupiter.api.Test;

/** Tests {@link TupleEnvironment} and {@link TupleBinding}. */
public class TupleEnvironmentTest {
  private static final RelationSchema EDGE =
      RelationSchema.of("edge",
          List.of(Attribute.of("x", "number"), Attribute.of("y", "number")));
  private static final RelationSchema NAME =
      RelationSchema.of("name", List.of(Attribute.of("s", "symbol")));

  private final TupleEnvironment env =
      new TupleEnvironment(SchemaCatalog.of(List.of(EDGE, NAME)));

  @Test void testPushPop() {
    assertThat(env.depth(), is(0));
    assertThat(env.lookup("t0"), nullValue());
    env.push("t0", TupleBinding.relation(EDGE));
    assertThat(env.depth(), is(1));
    assertThat(env.lookup("t0"), hasToString("edge(x:number, y:number)"));
    assertThat(env.label("t0", 1), is("y"));
    env.pop("t0");
    assertThat(env.depth(), is(0));
    assertThat(env.lookup("t0"), nullValue());
  }

  @Test void testShadowing() {
    try (TupleEnvironment.Scope outer =
             env.push("t0", TupleBinding.relation(EDGE))) {
      assertThat(env.label("t0", 0), is("x"));
      try (TupleEnvironment.Scope inner =
               env.push("t0", TupleBinding.relation(NAME))) {
        assertThat(env.label("t0", 0), is("s"));
        assertThat(env.depth(), is(2));
      }
      // the outer binding is visible again
      assertThat(env.label("t0", 0), is("x"));
    }
    assertThat(env.depth(), is(0));
  }

  @Test void testScopeClosedOnException() {
    assertThrows(IllegalArgumentException.class, () -> {
      try (TupleEnvironment.Scope ignored =
               env.push("t0", TupleBinding.record(2))) {
        throw new IllegalArgumentException("boom");
      }
    });
    assertThat(env.depth(), is(0));
  }

  @Test void testCloseTwice() {
    final TupleEnvironment.Scope scope =
        env.push("t0", TupleBinding.record(2));
    scope.close();
    scope.close();
    assertThat(env.depth(), is(0));
  }

  @Test void testMismatch() {
    final IllegalStateException e0 =
        assertThrows(IllegalStateException.class, () -> env.pop("t0"));
    assertThat(e0.getMessage(), is("cannot pop 't0': environment is empty"));

    final TupleEnvironment.Scope s0 =
        env.push("t0", TupleBinding.relation(EDGE));
    final TupleEnvironment.Scope s1 =
        env.push("t1", TupleBinding.relation(EDGE));
    final IllegalStateException e1 =
        assertThrows(IllegalStateException.class, () -> env.pop("t0"));
    assertThat(e1.getMessage(),
        is("cannot pop 't0': innermost binding is 't1'"));
    final IllegalStateException e2 =
        assertThrows(IllegalStateException.class, s0::close);
    assertThat(e2.getMessage(), is("scope of 't0' closed out of order"));
    s1.close();
    s0.close();
    assertThat(env.depth(), is(0));
  }

  @Test void testLabels() {
    // unbound variables are fields of a record
    assertThat(env.label("t9", 3), is("field_3"));
    env.push("t0", TupleBinding.record(3));
    assertThat(env.label("t0", 2), is("field_2"));
    env.push("t1", TupleBinding.aggregate(Ram.Aggregator.COUNT));
    assertThat(env.label("t1", 0), is("count"));
    assertThat(env.lookup("t1"), hasToString("count"));
    assertThat(env.lookup("t0"), hasToString("record/3"));
    env.push("t2", TupleBinding.relation(EDGE));
    assertThrows(IndexOutOfBoundsException.class, () -> env.label("t2", 2));
  }
}

// End TupleEnvironmentTest.java
