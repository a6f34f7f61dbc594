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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.Matchers.nullValue;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.souffle.Fixtures;
import net.hydromatic.souffle.parse.RamParser;
import net.hydromatic.souffle.ram.Ram;
import org.junit.jupiter.api.Test;

/** Tests {@link SchemaCatalog} and {@link RelationSchema}. */
public class SchemaCatalogTest {
  private static RelationSchema schema(String name, String... attributes) {
    final ImmutableList.Builder<Attribute> list = ImmutableList.builder();
    for (String attribute : attributes) {
      final String[] parts = attribute.split(":");
      list.add(Attribute.of(parts[0], parts[1]));
    }
    return RelationSchema.of(name, list.build());
  }

  @Test void testSchema() {
    final RelationSchema r = schema("a.b.r", "x:number", "s:symbol");
    assertThat(r.arity(), is(2));
    assertThat(r, hasToString("a.b.r(x:number, s:symbol)"));
    assertThat(r.attribute(1).type, is(AttributeType.SYMBOL));
    assertThrows(IndexOutOfBoundsException.class, () -> r.attribute(2));
    assertThat(schema("e"), hasToString("e()"));
  }

  @Test void testCatalog() {
    final SchemaCatalog catalog =
        SchemaCatalog.of(
            List.of(schema("b", "x:number"), schema("a", "y:float"),
                schema("b", "z:symbol")));
    // a redeclared relation keeps its position
    assertThat(catalog, hasToString("[b(z:symbol), a(y:float)]"));
    assertThat(catalog.size(), is(2));
    assertThat(catalog.contains("a"), is(true));
    assertThat(catalog.lookup("c"), nullValue());

    final UnresolvedRelationException e =
        assertThrows(UnresolvedRelationException.class,
            () -> catalog.get("c"));
    assertThat(e.relationName, is("c"));
    assertThat(e.describeTo(new StringBuilder()),
        hasToString("relation 'c' is not declared"));
    assertThat(SchemaCatalog.EMPTY.size(), is(0));
  }

  @Test void testCatalogFromProgram() {
    final Ram.Program program =
        RamParser.parse(Fixtures.text("path.ram"), "path.ram");
    final SchemaCatalog catalog = SchemaCatalog.of(program);
    // "@delta_path" and "@new_path" are not relations in their own right
    assertThat(catalog,
        hasToString("[edge(x:number, y:number), path(x:number, y:number)]"));
  }

  @Test void testAttributeType() {
    assertThat(AttributeType.of("unsigned"), is(AttributeType.UNSIGNED));
    assertThat(AttributeType.of("Node"), is(AttributeType.RECORD));
    assertThat(AttributeType.ofQualifier('f'), is(AttributeType.FLOAT));
    assertThat(AttributeType.ofQualifier('+'), is(AttributeType.RECORD));
  }
}

// End SchemaCatalogTest.java
