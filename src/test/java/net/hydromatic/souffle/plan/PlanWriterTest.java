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

import static net.hydromatic.souffle.ram.RamBuilder.ram;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.souffle.Fixtures;
import net.hydromatic.souffle.catalog.Attribute;
import net.hydromatic.souffle.catalog.RelationSchema;
import net.hydromatic.souffle.catalog.SchemaCatalog;
import net.hydromatic.souffle.parse.RamParser;
import net.hydromatic.souffle.ram.Pos;
import net.hydromatic.souffle.ram.Ram;
import net.hydromatic.souffle.util.SouffleException;
import org.junit.jupiter.api.Test;

/** Tests {@link PlanWriter}, {@link PythonNotation} and
 * {@link LogicNotation}. */
public class PlanWriterTest {
  private static final SchemaCatalog CATALOG =
      SchemaCatalog.of(
          List.of(
              RelationSchema.of("r",
                  List.of(Attribute.of("a", "number"),
                      Attribute.of("b", "number"),
                      Attribute.of("c", "symbol"))),
              RelationSchema.of("s", List.of(Attribute.of("x", "number")))));

  private static Ram.Program path() {
    return RamParser.parse(Fixtures.text("path.ram"), "path.ram");
  }

  private static String render(Ram.Program program, Notation notation) {
    return Plans.toText(
        Plans.render(program, SchemaCatalog.of(program), notation), 3);
  }

  private static String python(String operation) {
    return new PlanWriter(CATALOG, PythonNotation.INSTANCE)
        .operation(RamParser.parseOperation(operation)).toString();
  }

  private static String logic(String operation) {
    return new PlanWriter(CATALOG, LogicNotation.INSTANCE)
        .operation(RamParser.parseOperation(operation)).toString();
  }

  private static PlanNode statement(Notation notation, String statement) {
    final String text = "PROGRAM\n SUBROUTINE stratum_0\n" + statement
        + "\n END SUBROUTINE\nEND PROGRAM\n";
    final Ram.Program program = RamParser.parse(text, "t.ram");
    return new PlanWriter(CATALOG, notation)
        .statement(program.subroutines.get(0).statements.get(0));
  }

  @Test void testPathPython() {
    final String expected = "def stratum_0():\n"
        + "   input(edge, delim='\\t', filename='edge.facts')\n"
        + "def stratum_1():\n"
        + "   for t0 in edge:\n"
        + "      path.add((t0.x,t0.y))\n"
        + "   for t0 in path:\n"
        + "      __delta_path.add((t0.x,t0.y))\n"
        + "   while True:\n"
        + "      \"\"\"\n"
        + "      path(x,z) :-\n"
        + "         path(x,y),\n"
        + "         edge(y,z).\n"
        + "      in file path.dl [4:1-4:40]\n"
        + "      \"\"\"\n"
        + "      if (not edge == set() and not __delta_path == set()):\n"
        + "         for t0 in __delta_path:\n"
        + "            for t1 in index_scan(edge, lambda t1: t1.x == t0.y):\n"
        + "               if (not (t0.x,t1.y) in path):\n"
        + "                  __new_path.add((t0.x,t1.y))\n"
        + "      if __new_path == set(): break\n"
        + "      for t0 in __new_path:\n"
        + "         path.add((t0.x,t0.y))\n"
        + "      swap(__delta_path, __new_path)\n"
        + "      __new_path = set()\n"
        + "   output(path, delim=',', filename='reachable.csv')\n";
    assertThat(render(path(), PythonNotation.INSTANCE), is(expected));
  }

  @Test void testPathLogic() {
    final String expected = "stratum_0:\n"
        + "   INPUT edge DELIM '\\t' FILE edge.facts\n"
        + "stratum_1:\n"
        + "   ∀ t0 ∈ edge:\n"
        + "      path ← path ∪ {(t0.x, t0.y)}\n"
        + "   ∀ t0 ∈ path:\n"
        + "      path[i] ← path[i] ∪ {(t0.x, t0.y)}\n"
        + "   FOR i : ℕ\n"
        + "      // path(x,z) :-\n"
        + "      //    path(x,y),\n"
        + "      //    edge(y,z).\n"
        + "      // in file path.dl [4:1-4:40]\n"
        + "      (¬edge = ∅ ∧ ¬path[i] = ∅) ⇒\n"
        + "         ∀ t0 ∈ path[i]:\n"
        + "            ∀ t1 ∈ edge USING INDEX t1.x = t0.y:\n"
        + "               (¬(t0.x, t1.y) ∈ path) ⇒\n"
        + "                  path[i+1] ← path[i+1] ∪ {(t0.x, t1.y)}\n"
        + "      BREAK IF path[i+1] = ∅\n"
        + "      ∀ t0 ∈ path[i+1]:\n"
        + "         path ← path ∪ {(t0.x, t0.y)}\n"
        + "      path[i], path[i+1] = path[i+1], path[i]\n"
        + "      path[i+1] = ∅\n"
        + "   OUTPUT path DELIM ',' FILE reachable.csv\n";
    assertThat(render(path(), LogicNotation.INSTANCE), is(expected));
  }

  @Test void testIndent() {
    final List<PlanNode> nodes =
        Plans.render(path(), SchemaCatalog.of(path()),
            PythonNotation.INSTANCE);
    assertThat(nodes, hasSize(2));
    assertThat(Plans.toText(nodes.subList(0, 1), 2),
        is("def stratum_0():\n"
            + "  input(edge, delim='\\t', filename='edge.facts')\n"));
  }

  @Test void testBreak() {
    // a filter that breaks guards the operations that follow it, at the
    // same level
    final String operation = "FOR t0 IN r IF t0.0 = number(1) BREAK"
        + " INSERT (t0.0) INTO s";
    assertThat(python(operation),
        is("for t0 in r:\n"
            + "   if t0.a == 1: break\n"
            + "   s.add((t0.a))\n"));
    assertThat(logic(operation),
        is("∀ t0 ∈ r:\n"
            + "   t0.a = 1 ⇒ BREAK\n"
            + "   s ← s ∪ {(t0.a)}\n"));
  }

  @Test void testFilterWithIndex() {
    final String operation = "FOR t0 IN r IF t0.0 = number(1)"
        + " ON INDEX t0.1 = number(2) ERASE (t0.0) FROM s";
    assertThat(python(operation),
        is("for t0 in r:\n"
            + "   if t0.a == 1 and index_cond(lambda : t0.b == 2):\n"
            + "      s.remove((t0.a))\n"));
    assertThat(logic(operation),
        is("∀ t0 ∈ r:\n"
            + "   t0.a = 1 USING INDEX t0.b = 2 ⇒\n"
            + "      s ← s ∖ {(t0.a)}\n"));
  }

  @Test void testAggregate() {
    // inside the aggregate, t0 is a tuple of s; after it, of r again
    final String count = "FOR t0 IN r"
        + " t1.0 = COUNT FOR ALL t0 IN s WHERE t0.0 = number(1)"
        + " INSERT (t0.0, t1.0) INTO r";
    assertThat(python(count),
        is("for t0 in r:\n"
            + "   t1.count = count(t0 for t0 in s if t0.x == 1)\n"
            + "      r.add((t0.a,t1.count))\n"));
    assertThat(logic(count),
        is("∀ t0 ∈ r:\n"
            + "   t1.count = count{t0 ∈ s, t0.x = 1}\n"
            + "      r ← r ∪ {(t0.a, t1.count)}\n"));

    final String sum = "t1.0 = SUM t0.0 FOR ALL t0 IN @delta_s"
        + " INSERT (t1.0) INTO s";
    assertThat(python(sum),
        is("t1.sum = sum(t0.x for t0 in __delta_s)\n"
            + "   s.add((t1.sum))\n"));
    assertThat(logic(sum),
        is("t1.sum = sum{t0.x | t0 ∈ s[i]}\n"
            + "   s ← s ∪ {(t1.sum)}\n"));
  }

  @Test void testUnpack() {
    final String operation = "FOR t0 IN s UNPACK t1 ARITY 2 FROM t0.0"
        + " INSERT (t1.0, t1.1) INTO r";
    assertThat(python(operation),
        is("for t0 in s:\n"
            + "   t1 = t0.x\n"
            + "   r.add((t1.field_0,t1.field_1))\n"));
  }

  @Test void testShadowing() {
    final String operation = "FOR t0 IN r FOR t0 IN s"
        + " INSERT (t0.0) INTO s";
    assertThat(python(operation),
        is("for t0 in r:\n"
            + "   for t0 in s:\n"
            + "      s.add((t0.x))\n"));
  }

  @Test void testElements() {
    final String operation = "FOR t0 IN r INSERT (string(\"a\"), UNDEF,"
        + " @f(t0.0, number(2)), cat(t0.0, t0.1), [t0.0, t0.1],"
        + " (t0.0*t0.1), (t0.0+t0.1-number(1))) INTO r";
    assertThat(python(operation),
        is("for t0 in r:\n"
            + "   r.add((\"a\",_,__functor_f(t0.a,2),cat(t0.a,t0.b),"
            + "[t0.a,t0.b],(t0.a * t0.b),(t0.a + t0.b - 1)))\n"));
    assertThat(logic(operation),
        is("∀ t0 ∈ r:\n"
            + "   r ← r ∪ {(\"a\", ⊥, @f(t0.a, 2), cat(t0.a, t0.b),"
            + " [t0.a, t0.b], (t0.a * t0.b), (t0.a + t0.b - 1))}\n"));
  }

  /** Quotes and backslashes in a symbol are escaped. */
  @Test void testSymbolEscapes() {
    final String operation =
        "FOR t0 IN r INSERT (string(\"say \\\"hi\\\"\"),"
            + " string(\"c:\\\\tmp\")) INTO r";
    assertThat(python(operation),
        is("for t0 in r:\n"
            + "   r.add((\"say \\\"hi\\\"\",\"c:\\\\tmp\"))\n"));
    assertThat(logic(operation),
        is("∀ t0 ∈ r:\n"
            + "   r ← r ∪ {(\"say \\\"hi\\\"\", \"c:\\\\tmp\")}\n"));
  }

  @Test void testConditions() {
    final PlanWriter python = new PlanWriter(CATALOG, PythonNotation.INSTANCE);
    final PlanWriter logic = new PlanWriter(CATALOG, LogicNotation.INSTANCE);
    final Ram.Condition a = RamParser.parseCondition("ISEMPTY(a)");
    final Ram.Condition b = RamParser.parseCondition("EXISTS t0 IN r");
    final Ram.Condition c = RamParser.parseCondition("(t0.0) IN @new_s");

    // a junction inside a different junction is parenthesized
    final Ram.Condition mixed =
        ram.and(Pos.ZERO, ImmutableList.of(ram.or(Pos.ZERO, List.of(a, b)), c));
    assertThat(python.condition(mixed),
        is("(a == set() or exists(t0 in r)) and (t0.field_0) in __new_s"));
    assertThat(logic.condition(mixed),
        is("(a = ∅ ∨ ∃ t0 ∈ r) ∧ (t0.field_0) ∈ s[i+1]"));

    final Ram.Condition not =
        ram.not(Pos.ZERO, ram.and(Pos.ZERO, List.of(a, b)));
    assertThat(python.condition(not),
        is("not (a == set() and exists(t0 in r))"));
    assertThat(logic.condition(not), is("¬(a = ∅ ∧ ∃ t0 ∈ r)"));

    final Ram.Condition compare =
        RamParser.parseCondition("t0.0 != number(1) AND t0.0 <= number(2)"
            + " AND t0.0 >= number(3) AND t0.0 < float(0.5)");
    assertThat(python.condition(compare),
        is("t0.field_0 != 1 and t0.field_0 <= 2 and t0.field_0 >= 3"
            + " and t0.field_0 < 0.5"));
    assertThat(logic.condition(compare),
        is("t0.field_0 ≠ 1 ∧ t0.field_0 ≤ 2 ∧ t0.field_0 ≥ 3"
            + " ∧ t0.field_0 < 0.5"));
  }

  @Test void testIo() {
    // a filename that is just the relation name is omitted
    final PlanNode node =
        statement(PythonNotation.INSTANCE,
            "IO r (IO=\"file\",operation=\"output\",filename=\"r.dl\")");
    assertThat(node, hasToString("output(r, delim='\\t')\n"));
    final PlanNode node2 =
        statement(LogicNotation.INSTANCE,
            "IO r (IO=\"stdout\",operation=\"output\")");
    assertThat(node2, hasToString("OUTPUT r DELIM '\\t'\n"));
    final PlanNode node3 =
        statement(PythonNotation.INSTANCE,
            "IO s (operation=\"input\",delimiter=\",\",filename=\"s.csv\")");
    assertThat(node3, hasToString("input(s, delim=',', filename='s.csv')\n"));
  }

  @Test void testUnrecognizedIo() {
    final UnrecognizedIoOperationException e =
        assertThrows(UnrecognizedIoOperationException.class,
            () -> statement(PythonNotation.INSTANCE,
                "IO r (IO=\"file\",operation=\"printsize\")"));
    assertThat(e.relationName, is("r"));
    assertThat(e.operation, is("printsize"));
    assertThat(((SouffleException) e).describeTo(new StringBuilder()),
        hasToString("unrecognized IO operation 'printsize' for relation 'r'"));

    final UnrecognizedIoOperationException e2 =
        assertThrows(UnrecognizedIoOperationException.class,
            () -> statement(LogicNotation.INSTANCE, "IO r (IO=\"file\")"));
    assertThat(e2.getMessage(),
        is("unrecognized IO operation 'null' for relation 'r'"));
  }

  @Test void testDebug() {
    // commentary is prepended; the statement it wraps renders as without
    final String query = "QUERY\nFOR t0 IN r INSERT (t0.0) INTO s\nEND QUERY";
    final PlanNode plain = statement(PythonNotation.INSTANCE, query);
    final PlanNode debug =
        statement(PythonNotation.INSTANCE,
            "DEBUG \"s(a) :- r(a,_,_).\"\n" + query + "\nEND DEBUG");
    assertThat(debug.lines,
        is(List.of("\"\"\"", "s(a) :- r(a,_,_).", "\"\"\"", "for t0 in r:")));
    assertThat(debug.children, is(plain.children));

    final PlanNode logic =
        statement(LogicNotation.INSTANCE,
            "DEBUG \"s(a) :- r(a,_,_).\"\n" + query + "\nEND DEBUG");
    assertThat(logic,
        hasToString("// s(a) :- r(a,_,_).\n"
            + "∀ t0 ∈ r:\n"
            + "   s ← s ∪ {(t0.a)}\n"));
  }

  @Test void testStatements() {
    assertThat(statement(PythonNotation.INSTANCE, "CALL stratum_3"),
        hasToString("stratum_3()\n"));
    assertThat(statement(LogicNotation.INSTANCE, "CALL stratum_3"),
        hasToString("CALL stratum_3\n"));
    assertThat(statement(LogicNotation.INSTANCE, "CLEAR @delete_r"),
        hasToString("r[del] = ∅\n"));
    assertThat(statement(PythonNotation.INSTANCE, "CLEAR @reject_r"),
        hasToString("__reject_r = set()\n"));
    assertThat(statement(PythonNotation.INSTANCE, "LOOP\nEXIT ISEMPTY(r)\n"
            + "END LOOP"),
        hasToString("while True:\n   if r == set(): break\n"));
  }
}

// End PlanWriterTest.java
