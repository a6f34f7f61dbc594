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
package net.hydromatic.souffle.config;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.util.LinkedHashMap;
import java.util.Map;
import net.hydromatic.souffle.plan.LogicNotation;
import net.hydromatic.souffle.plan.PythonNotation;
import org.junit.jupiter.api.Test;

/** Tests {@link Prop} and {@link Session}. */
public class PropTest {
  @Test void testDefaults() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    assertThat(Prop.SOUFFLE.stringValue(map), is("souffle"));
    assertThat(Prop.CPP.stringValue(map), is("cpp"));
    assertThat(Prop.INDENT.intValue(map), is(3));
    assertThat(Prop.SIMPLIFY.booleanValue(map), is(true));
    assertThat(Prop.USE_TRANSFORMED.booleanValue(map), is(false));
    assertThat(Prop.DIRECTORY.fileValue(map), is(new File("")));
    assertThat(Prop.NOTATION.enumValue(map, Prop.PlanNotation.class),
        is(Prop.PlanNotation.PYTHON));
  }

  @Test void testLookup() {
    assertThat(Prop.lookup("useTransformed"), is(Prop.USE_TRANSFORMED));
    assertThat(Prop.lookup("USE_TRANSFORMED"), is(Prop.USE_TRANSFORMED));
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.lookup("colour"));
    assertThat(e.getMessage(), is("property colour not found"));
  }

  @Test void testSetLenient() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    Prop.INDENT.setLenient(map, "2");
    assertThat(Prop.INDENT.intValue(map), is(2));
    Prop.SIMPLIFY.setLenient(map, "false");
    assertThat(Prop.SIMPLIFY.booleanValue(map), is(false));
    Prop.NOTATION.setLenient(map, "logic");
    assertThat(Prop.NOTATION.enumValue(map, Prop.PlanNotation.class),
        is(Prop.PlanNotation.LOGIC));
    Prop.DIRECTORY.setLenient(map, "/tmp");
    assertThat(Prop.DIRECTORY.fileValue(map), is(new File("/tmp")));
    Prop.SOUFFLE.setLenient(map, "/opt/souffle/bin/souffle");
    assertThat(Prop.SOUFFLE.stringValue(map), is("/opt/souffle/bin/souffle"));

    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.NOTATION.setLenient(map, "latex"));
    assertThat(e.getMessage(),
        is("value for property notation must be one of: 'python', 'logic'"));
    final IllegalArgumentException e2 =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.INDENT.setLenient(map, "three"));
    assertThat(e2.getMessage(),
        is("value for property indent must be an integer: three"));
    final IllegalArgumentException e3 =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.SIMPLIFY.setLenient(map, "yes"));
    assertThat(e3.getMessage(),
        is("value for property simplify must be true or false: yes"));
    // failed attempts leave the previous values
    assertThat(Prop.INDENT.intValue(map), is(2));
  }

  @Test void testSet() {
    final Map<Prop, Object> map = new LinkedHashMap<>();
    final IllegalArgumentException e =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.INDENT.set(map, "4"));
    assertThat(e.getMessage(),
        is("value for property indent must have type Integer"));
    final IllegalArgumentException e2 =
        assertThrows(IllegalArgumentException.class,
            () -> Prop.CPP.set(map, null));
    assertThat(e2.getMessage(), is("property cpp is required"));
    assertThrows(IllegalArgumentException.class,
        () -> Prop.INDENT.booleanValue(map));
  }

  @Test void testSession() {
    final Session session = Session.create();
    assertThat(session.notation(), sameInstance(PythonNotation.INSTANCE));
    Prop.NOTATION.set(session.map, Prop.PlanNotation.LOGIC);
    assertThat(session.notation(), sameInstance(LogicNotation.INSTANCE));
    assertThat(session.compiler(), sameInstance(session.compiler()));

    assertThat(session.resolve("a/b.ram"), is(new File("a/b.ram")));
    assertThat(session.resolve("/x/b.ram"), is(new File("/x/b.ram")));
    Prop.DIRECTORY.set(session.map, new File("/home/me"));
    assertThat(session.resolve("a/b.ram"), is(new File("/home/me/a/b.ram")));
  }
}

// End PropTest.java
