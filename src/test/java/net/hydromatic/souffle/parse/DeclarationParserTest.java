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
package net.hydromatic.souffle.parse;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import net.hydromatic.souffle.Fixtures;
import net.hydromatic.souffle.catalog.AttributeType;
import net.hydromatic.souffle.catalog.RelationSchema;
import net.hydromatic.souffle.catalog.SchemaCatalog;
import org.junit.jupiter.api.Test;

/** Tests {@link DeclarationParser}. */
public class DeclarationParserTest {
  @Test void testSimple() {
    final SchemaCatalog catalog =
        DeclarationParser.parse(Fixtures.text("path.dl"), "path.dl");
    assertThat(catalog.size(), is(2));
    assertThat(catalog.get("edge"), hasToString("edge(x:number, y:number)"));
    assertThat(catalog.get("path"), hasToString("path(x:number, y:number)"));
  }

  @Test void testTypes() {
    final String text = "/* types */\n"
        + ".type Node <: number\n"
        + ".type Name = symbol\n"
        + ".type Label <: Name\n"
        + ".type Pair = [a: Node, b: Node]\n"
        + ".type Shape = Circle {r: number} | Square {s: number}\n"
        + ".number_type Id\n"
        + ".decl r(n:Node, m:Label, p:Pair, id:Id, s:Shape) output\n"
        + "// .decl commented(x:number)\n"
        + ".decl comp.inner(x: unsigned, f: float)\n"
        + "r(1, \"a\", [1, 2], 3, $Circle(1)).\n";
    final SchemaCatalog catalog = DeclarationParser.parse(text, "t.dl");
    assertThat(catalog.size(), is(2));
    final RelationSchema r = catalog.get("r");
    assertThat(r, hasToString("r(n:Node, m:Label, p:Pair, id:Id, s:Shape)"));
    assertThat(r.attribute(0).type, is(AttributeType.NUMBER));
    assertThat(r.attribute(1).type, is(AttributeType.SYMBOL));
    assertThat(r.attribute(2).type, is(AttributeType.RECORD));
    assertThat(r.attribute(3).type, is(AttributeType.NUMBER));
    assertThat(r.attribute(4).type, is(AttributeType.RECORD));

    final RelationSchema inner = catalog.get("comp.inner");
    assertThat(inner.attribute(0).type, is(AttributeType.UNSIGNED));
    assertThat(inner.attribute(1).type, is(AttributeType.FLOAT));
  }

  @Test void testCyclicAlias() {
    final String text = ".type A = B\n"
        + ".type B = A\n"
        + ".decl r(a:A)\n";
    final SchemaCatalog catalog = DeclarationParser.parse(text, "c.dl");
    assertThat(catalog.get("r").attribute(0).type, is(AttributeType.RECORD));
  }

  @Test void testInvalid() {
    assertThrows(RamParseException.class,
        () -> DeclarationParser.parse(".decl r(x number)", "i.dl"));
  }
}

// End DeclarationParserTest.java
