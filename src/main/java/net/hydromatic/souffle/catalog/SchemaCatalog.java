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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.souffle.ram.Generation;
import net.hydromatic.souffle.ram.Ram;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Relations declared by a program, keyed by qualified name.
 *
 * <p>Immutable; iteration order is declaration order. */
public class SchemaCatalog {
  public static final SchemaCatalog EMPTY =
      new SchemaCatalog(ImmutableMap.of());

  private final ImmutableMap<String, RelationSchema> map;

  private SchemaCatalog(ImmutableMap<String, RelationSchema> map) {
    this.map = map;
  }

  /** Creates a catalog from a list of schemas. If a name occurs more than
   * once, the last declaration wins but keeps the first position. */
  public static SchemaCatalog of(Iterable<RelationSchema> schemas) {
    final Map<String, RelationSchema> map = new LinkedHashMap<>();
    for (RelationSchema schema : schemas) {
      map.put(schema.name, schema);
    }
    return new SchemaCatalog(ImmutableMap.copyOf(map));
  }

  /**
   * Creates a catalog from the {@code DECLARATION} block of a RAM program.
   *
   * <p>The auxiliary relations of semi-naive evaluation ("@delta_path",
   * "@new_path") have the schema of their base relation, so only untagged
   * declarations are included.
   */
  public static SchemaCatalog of(Ram.Program program) {
    final Map<String, RelationSchema> map = new LinkedHashMap<>();
    for (Ram.Declaration declaration : program.declarations) {
      if (declaration.relation.generation == Generation.NONE) {
        final String name = declaration.relation.name;
        map.put(name, RelationSchema.of(name, declaration.attributes));
      }
    }
    return new SchemaCatalog(ImmutableMap.copyOf(map));
  }

  /** Returns the schema of a relation, or null if it is not declared. */
  public @Nullable RelationSchema lookup(String name) {
    return map.get(name);
  }

  /** Returns the schema of a relation; never null.
   *
   * @throws UnresolvedRelationException if the relation is not declared */
  public RelationSchema get(String name) {
    final RelationSchema schema = map.get(name);
    if (schema == null) {
      throw new UnresolvedRelationException(name);
    }
    return schema;
  }

  public boolean contains(String name) {
    return map.containsKey(name);
  }

  /** Returns the schemas in declaration order. */
  public ImmutableList<RelationSchema> schemas() {
    return map.values().asList();
  }

  public int size() {
    return map.size();
  }

  @Override
  public String toString() {
    return map.values().toString();
  }
}

// End SchemaCatalog.java
