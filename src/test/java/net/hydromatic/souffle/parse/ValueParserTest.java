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

import java.util.List;
import net.hydromatic.souffle.ram.Value;
import org.junit.jupiter.api.Test;

/** Tests {@link ValueParser}. */
public class ValueParserTest {
  @Test void testScalars() {
    assertThat(ValueParser.parse("\"a\\tb\"").stringValue(), is("a\tb"));
    assertThat(ValueParser.parse("42").numberValue(), is(42L));
    assertThat(ValueParser.parse("-3").numberValue(), is(-3L));
    assertThat(ValueParser.parse("1.5").numberValue(), is(1.5D));
    assertThat(ValueParser.parse("true").booleanValue(), is(true));
    assertThat(ValueParser.parse("false").booleanValue(), is(false));
    assertThat(ValueParser.parse("null").kind, is(Value.Kind.NULL));
  }

  @Test void testCompound() {
    final Value value =
        ValueParser.parse("{\"a\": [1, \"x\", null], b: {}}");
    assertThat(value.kind, is(Value.Kind.MAPPING));
    assertThat(value.mappingValue().keySet().asList(), is(List.of("a", "b")));
    final Value a = value.mappingValue().get("a");
    assertThat(a.arrayValue().size(), is(3));
    assertThat(a.arrayValue().get(1).stringValue(), is("x"));
    assertThat(value, hasToString("{\"a\": [1, \"x\", null], \"b\": {}}"));
  }

  @Test void testLines() {
    final Value value = ValueParser.parse("\"r(x) :-\\n   s(x).\"");
    assertThat(value.lines(), is(List.of("r(x) :-", "   s(x).")));
    assertThat(value.isEmpty(), is(false));
    assertThat(ValueParser.parse("\"\"").isEmpty(), is(true));
    assertThat(Value.NULL.isEmpty(), is(true));
  }

  @Test void testInvalid() {
    assertThrows(RamParseException.class, () -> ValueParser.parse("[1, 2"));
    assertThrows(RamParseException.class, () -> ValueParser.parse("1 2"));
    assertThrows(RamParseException.class, () -> ValueParser.parse("maybe"));
  }
}

// End ValueParserTest.java
