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

import com.google.common.collect.ImmutableListMultimap;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;
import net.hydromatic.souffle.catalog.Attribute;
import net.hydromatic.souffle.catalog.RelationSchema;
import net.hydromatic.souffle.catalog.SchemaCatalog;
import net.hydromatic.souffle.ram.Ram;
import net.hydromatic.souffle.ram.Visitor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Infers the B-tree indexes that the compiler builds, from the scans in a RAM
 * program that carry an index condition.
 *
 * <p>For each scan "FOR t IN r ON INDEX c", the index key is the columns of
 * {@code t} that {@code c} references, in ascending order.
 *
 * <p>The result is conservative. It may contain indexes that the compiler
 * does not build, and omit indexes it builds for other reasons. It is a
 * multiset: two scans that need the same key each contribute an entry.
 */
public class IndexInference extends Visitor {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(IndexInference.class);

  /** First line of an index listing. */
  public static final String DISCLAIMER =
      "WARNING: This list is conservative. Some indexes may not be included.";

  private final SchemaCatalog catalog;
  private final ImmutableListMultimap.Builder<String, BTreeIndex> indexes =
      ImmutableListMultimap.builder();

  private IndexInference(SchemaCatalog catalog) {
    this.catalog = requireNonNull(catalog);
  }

  /**
   * Returns the indexes of each relation, keyed by relation name in the
   * order that relations are first seen.
   *
   * <p>Scans are visited in the order they occur in the program. Scans of a
   * relation's auxiliary generations ("@delta_path") count as scans of the
   * relation.
   *
   * @throws net.hydromatic.souffle.catalog.UnresolvedRelationException if an
   *     indexed scan is of a relation that is not in the catalog
   */
  public static ImmutableListMultimap<String, BTreeIndex> infer(
      Ram.Program program, SchemaCatalog catalog) {
    final IndexInference inference = new IndexInference(catalog);
    program.accept(inference);
    final ImmutableListMultimap<String, BTreeIndex> indexes =
        inference.indexes.build();
    LOGGER.debug("Inferred {} indexes on {} relations", indexes.size(),
        indexes.keySet().size());
    return indexes;
  }

  /** Returns the lines of an index listing: the disclaimer, then for each
   * relation its name followed by one tab-indented line per index. */
  public static List<String> listing(
      ImmutableListMultimap<String, BTreeIndex> indexes) {
    final List<String> lines = new ArrayList<>();
    lines.add(DISCLAIMER);
    for (Map.Entry<String, Collection<BTreeIndex>> entry
        : indexes.asMap().entrySet()) {
      lines.add(entry.getKey());
      for (BTreeIndex index : entry.getValue()) {
        lines.add("\t" + index);
      }
    }
    return lines;
  }

  @Override
  protected void visit(Ram.Scan scan) {
    if (scan.indexCondition != null) {
      final RelationSchema schema = catalog.get(scan.relation.name);
      final ColumnCollector collector = new ColumnCollector(scan.variable);
      scan.indexCondition.accept(collector);
      final List<Attribute> attributes = new ArrayList<>();
      for (int column : collector.columns) {
        attributes.add(schema.attribute(column));
      }
      final BTreeIndex index = BTreeIndex.of(schema.name, attributes);
      LOGGER.trace("Scan of {} needs {}", scan.relation, index.describe());
      indexes.put(schema.name, index);
    }
    super.visit(scan);
  }

  /** Collects the columns of one tuple variable that a condition
   * references. Each indexed scan uses a new collector. */
  private static class ColumnCollector extends Visitor {
    final String variable;
    final SortedSet<Integer> columns = new TreeSet<>();

    ColumnCollector(String variable) {
      this.variable = variable;
    }

    @Override
    protected void visit(Ram.Ref ref) {
      if (ref.variable.equals(variable)) {
        columns.add(ref.column);
      }
    }
  }
}

// End IndexInference.java
