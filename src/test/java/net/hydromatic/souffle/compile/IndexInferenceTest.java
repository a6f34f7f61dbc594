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
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableListMultimap;
import java.util.List;
import net.hydromatic.souffle.Fixtures;
import net.hydromatic.souffle.catalog.SchemaCatalog;
import net.hydromatic.souffle.catalog.UnresolvedRelationException;
import net.hydromatic.souffle.parse.RamParser;
import net.hydromatic.souffle.ram.Ram;
import org.junit.jupiter.api.Test;

/** Tests {@link IndexInference}. */
public class IndexInferenceTest {
  private static final String DECLARATIONS = "PROGRAM\n"
      + " DECLARATION\n"
      + "  r(a:i:number,b:i:number,c:i:number) BTREE\n"
      + "  s(x:i:number) BTREE\n"
      + " END DECLARATION\n";

  /** Parses a program whose only subroutine contains the given queries. */
  private static ImmutableListMultimap<String, BTreeIndex> infer(
      String... queries) {
    final StringBuilder b = new StringBuilder(DECLARATIONS);
    b.append(" SUBROUTINE stratum_0\n");
    for (String query : queries) {
      b.append("  QUERY\n").append(query).append("\n  END QUERY\n");
    }
    b.append(" END SUBROUTINE\nEND PROGRAM\n");
    final Ram.Program program = RamParser.parse(b.toString(), "t.ram");
    return IndexInference.infer(program, SchemaCatalog.of(program));
  }

  @Test void testPath() {
    final Ram.Program program =
        RamParser.parse(Fixtures.text("path.ram"), "path.ram");
    final ImmutableListMultimap<String, BTreeIndex> indexes =
        IndexInference.infer(program, SchemaCatalog.of(program));
    assertThat(indexes.size(), is(1));
    assertThat(indexes.get("edge"), hasToString("[BTREE(x:number)]"));
    assertThat(indexes.get("edge").get(0).describe(),
        is("BTree index on edge(x:number)"));
    assertThat(IndexInference.listing(indexes),
        is(
            List.of(IndexInference.DISCLAIMER, "edge",
                "\tBTREE(x:number)")));
  }

  @Test void testColumnsAscending() {
    final ImmutableListMultimap<String, BTreeIndex> indexes =
        infer("FOR t0 IN s\n"
            + " FOR t1 IN r ON INDEX t1.2 = t0.0 AND t1.0 = t0.0\n"
            + "  INSERT (t1.1) INTO s");
    assertThat(indexes.get("r"), hasToString("[BTREE(a:number, c:number)]"));
    // the reference to t0 does not contribute columns of s
    assertThat(indexes.containsKey("s"), is(false));
  }

  @Test void testNestedScans() {
    final ImmutableListMultimap<String, BTreeIndex> indexes =
        infer("FOR t0 IN r ON INDEX t0.1 = number(1)\n"
            + " FOR t1 IN r ON INDEX t1.0 = t0.2 AND t1.2 = t0.0\n"
            + "  INSERT (t1.1) INTO s");
    assertThat(indexes.get("r"),
        hasToString("[BTREE(b:number), BTREE(a:number, c:number)]"));
  }

  /** Sibling scans of one relation, indexed on different columns, each
   * contribute their own index. */
  @Test void testSiblingScansDifferentColumns() {
    final ImmutableListMultimap<String, BTreeIndex> indexes =
        infer("FOR t0 IN r ON INDEX t0.0 = number(1)\n"
                + " INSERT (t0.0) INTO s",
            "FOR t0 IN r ON INDEX t0.2 = number(2) AND t0.1 = number(3)\n"
                + " INSERT (t0.0) INTO s");
    assertThat(indexes.get("r"),
        hasToString("[BTREE(a:number), BTREE(b:number, c:number)]"));
    assertThat(indexes.containsKey("s"), is(false));
  }

  @Test void testDuplicatesKept() {
    final ImmutableListMultimap<String, BTreeIndex> indexes =
        infer("FOR t0 IN s ON INDEX t0.0 = number(1)\n"
                + " INSERT (t0.0) INTO s",
            "FOR t0 IN @delta_r ON INDEX t0.1 = number(2)\n"
                + " INSERT (t0.0) INTO s",
            "FOR t0 IN s ON INDEX t0.0 = number(3)\n"
                + " INSERT (t0.0) INTO s");
    assertThat(indexes.get("s"), hasSize(2));
    assertThat(indexes.get("s").get(0), is(indexes.get("s").get(1)));
    assertThat(IndexInference.listing(indexes),
        is(
            List.of(IndexInference.DISCLAIMER, "s", "\tBTREE(x:number)",
                "\tBTREE(x:number)", "r", "\tBTREE(b:number)")));
  }

  @Test void testUnindexedScan() {
    final ImmutableListMultimap<String, BTreeIndex> indexes =
        infer("FOR t0 IN missing\n INSERT (t0.0) INTO s");
    assertThat(indexes.isEmpty(), is(true));
    assertThat(IndexInference.listing(indexes),
        is(List.of(IndexInference.DISCLAIMER)));
  }

  @Test void testUnresolvedRelation() {
    final UnresolvedRelationException e =
        assertThrows(UnresolvedRelationException.class,
            () -> infer("FOR t0 IN missing ON INDEX t0.0 = number(1)\n"
                + " INSERT (t0.0) INTO s"));
    assertThat(e.relationName, is("missing"));
  }
}

// End IndexInferenceTest.java
