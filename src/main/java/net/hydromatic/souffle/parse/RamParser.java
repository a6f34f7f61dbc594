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

import static net.hydromatic.souffle.ram.RamBuilder.ram;

import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.souffle.catalog.Attribute;
import net.hydromatic.souffle.catalog.AttributeType;
import net.hydromatic.souffle.ram.Op;
import net.hydromatic.souffle.ram.Pos;
import net.hydromatic.souffle.ram.Ram;
import net.hydromatic.souffle.ram.Value;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recursive-descent parser for the RAM text that the Souffle compiler prints
 * with {@code --show=transformed-ram}.
 *
 * <p>For example,
 *
 * <pre>{@code
 * PROGRAM
 *  DECLARATION
 *   edge(x:i:number,y:i:number) BTREE
 *  END DECLARATION
 *  SUBROUTINE stratum_0
 *   QUERY
 *    FOR t0 IN edge
 *     INSERT (t0.0,t0.1) INTO path
 *   END QUERY
 *  END SUBROUTINE
 * END PROGRAM
 * }</pre>
 *
 * <p>Line breaks and indentation are not significant.
 */
public class RamParser {
  private static final Logger LOGGER = LoggerFactory.getLogger(RamParser.class);

  private final TokenCursor cursor;
  private final ValueParser valueParser;

  public RamParser(TokenCursor cursor) {
    this.cursor = cursor;
    this.valueParser = new ValueParser(cursor);
  }

  /** Parses a whole RAM program. */
  public static Ram.Program parse(String text, String file) {
    final RamParser parser = new RamParser(TokenCursor.of(text, file));
    final Ram.Program program = parser.program();
    LOGGER.debug("Parsed {}: {} declarations, {} subroutines", file,
        program.declarations.size(), program.subroutines.size());
    return program;
  }

  /** Parses text that consists of exactly one condition. */
  public static Ram.Condition parseCondition(String text) {
    final RamParser parser = new RamParser(TokenCursor.of(text, ""));
    final Ram.Condition condition = parser.condition();
    parser.expectEnd();
    return condition;
  }

  /** Parses text that consists of exactly one operation. */
  public static Ram.Operation parseOperation(String text) {
    final RamParser parser = new RamParser(TokenCursor.of(text, ""));
    final Ram.Operation operation = parser.operation();
    parser.expectEnd();
    return operation;
  }

  private void expectEnd() {
    if (!cursor.atEnd()) {
      throw cursor.unexpected("end of input");
    }
  }

  public Ram.Program program() {
    final Pos pos = cursor.pos();
    cursor.expect("PROGRAM");
    final List<Ram.Declaration> declarations = new ArrayList<>();
    final List<Ram.Subroutine> subroutines = new ArrayList<>();
    final List<Ram.Statement> main = new ArrayList<>();
    if (cursor.accept("DECLARATION")) {
      while (!cursor.check("END")) {
        declarations.add(declaration());
      }
      cursor.expect("END");
      cursor.expect("DECLARATION");
    }
    while (cursor.check("SUBROUTINE")) {
      subroutines.add(subroutine());
    }
    if (cursor.accept("BEGIN")) {
      cursor.expect("MAIN");
      statements(main);
      cursor.expect("END");
      cursor.expect("MAIN");
    }
    cursor.expect("END");
    cursor.expect("PROGRAM");
    expectEnd();
    return ram.program(pos, declarations, subroutines, main);
  }

  /** Parses a relation declaration, "edge(x:i:number,y:i:number) BTREE". */
  private Ram.Declaration declaration() {
    final Pos pos = cursor.pos();
    final Ram.RelationRef relation = relation();
    final List<Attribute> attributes = new ArrayList<>();
    cursor.expectSymbol("(");
    if (!cursor.acceptSymbol(")")) {
      do {
        attributes.add(attribute());
      } while (cursor.acceptSymbol(","));
      cursor.expectSymbol(")");
    }
    String representation = "";
    if (cursor.check(Token.Kind.IDENTIFIER)
        && !cursor.peek(1).isSymbol("(")
        && !cursor.peek(1).isSymbol(".")
        && !cursor.check("END")) {
      representation = cursor.advance().text;
    }
    return ram.declaration(pos, relation, attributes, representation);
  }

  /** Parses "x:i:number", or the short form "x:number". */
  private Attribute attribute() {
    final String name =
        cursor.expect(Token.Kind.IDENTIFIER, "attribute name").text;
    cursor.expectSymbol(":");
    final Token token = cursor.advance();
    if (cursor.acceptSymbol(":")) {
      final String typeName = qualifiedName("type name");
      final AttributeType type = token.text.length() == 1
          ? AttributeType.ofQualifier(token.text.charAt(0))
          : AttributeType.of(typeName);
      return Attribute.of(name, typeName, type);
    }
    if (token.kind != Token.Kind.IDENTIFIER) {
      throw new RamParseException("expected type name, got " + token,
          token.pos(cursor.file));
    }
    return Attribute.of(name, token.text);
  }

  private Ram.Subroutine subroutine() {
    final Pos pos = cursor.pos();
    cursor.expect("SUBROUTINE");
    final String name =
        cursor.expect(Token.Kind.IDENTIFIER, "subroutine name").text;
    final List<Ram.Statement> statements = new ArrayList<>();
    statements(statements);
    cursor.expect("END");
    cursor.expect("SUBROUTINE");
    return ram.subroutine(pos, name, statements);
  }

  /** Parses statements until "END". */
  private void statements(List<Ram.Statement> statements) {
    while (!cursor.check("END")) {
      statements.add(statement());
    }
  }

  public Ram.Statement statement() {
    final Pos pos = cursor.pos();
    final Token token = cursor.peek();
    if (token.kind != Token.Kind.IDENTIFIER) {
      throw cursor.unexpected("statement");
    }
    switch (token.text) {
      case "LOOP":
        cursor.advance();
        final List<Ram.Statement> statements = new ArrayList<>();
        statements(statements);
        cursor.expect("END");
        cursor.expect("LOOP");
        return ram.loop(pos, statements);

      case "QUERY":
        cursor.advance();
        final Ram.Operation operation = operation();
        cursor.expect("END");
        cursor.expect("QUERY");
        return ram.query(pos, operation);

      case "DEBUG":
        cursor.advance();
        final Value info = valueParser.value();
        final Ram.Statement statement = statement();
        cursor.expect("END");
        cursor.expect("DEBUG");
        return ram.debug(pos, info, statement);

      case "CLEAR":
        cursor.advance();
        return ram.clear(pos, relation());

      case "SWAP":
        cursor.advance();
        cursor.expectSymbol("(");
        final Ram.RelationRef relation0 = relation();
        cursor.expectSymbol(",");
        final Ram.RelationRef relation1 = relation();
        cursor.expectSymbol(")");
        return ram.swap(pos, relation0, relation1);

      case "EXIT":
        cursor.advance();
        return ram.exit(pos, condition());

      case "IO":
        cursor.advance();
        final Ram.RelationRef relation = relation();
        final Map<String, Value> options = new LinkedHashMap<>();
        cursor.expectSymbol("(");
        if (!cursor.acceptSymbol(")")) {
          do {
            final String key = valueParser.key();
            cursor.expectSymbol("=");
            options.put(key, valueParser.value());
          } while (cursor.acceptSymbol(","));
          cursor.expectSymbol(")");
        }
        return ram.io(pos, relation, options);

      case "CALL":
        cursor.advance();
        return ram.call(pos,
            cursor.expect(Token.Kind.IDENTIFIER, "subroutine name").text);

      default:
        throw cursor.unexpected("statement");
    }
  }

  public Ram.Operation operation() {
    final Pos pos = cursor.pos();
    final Token token = cursor.peek();
    if (token.kind != Token.Kind.IDENTIFIER) {
      throw cursor.unexpected("operation");
    }
    switch (token.text) {
      case "FOR":
        cursor.advance();
        final String variable = variable();
        cursor.expect("IN");
        final Ram.RelationRef relation = relation();
        final Ram.Condition indexCondition = indexCondition();
        return ram.scan(pos, variable, relation, indexCondition, operation());

      case "IF":
        cursor.advance();
        final Ram.Condition condition = condition();
        final Ram.Condition indexCondition2 = indexCondition();
        final boolean breaks = cursor.accept("BREAK");
        return ram.filter(pos, condition, indexCondition2, breaks,
            operation());

      case "UNPACK":
        cursor.advance();
        final String variable2 = variable();
        cursor.expect("ARITY");
        final int arity = integer();
        cursor.expect("FROM");
        final Ram.Element element = element();
        return ram.unpack(pos, variable2, arity, element, operation());

      case "INSERT":
        cursor.advance();
        final Ram.Tuple tuple = tuple();
        cursor.expect("INTO");
        return ram.insert(pos, tuple, relation());

      case "ERASE":
        cursor.advance();
        final Ram.Tuple tuple2 = tuple();
        cursor.expect("FROM");
        return ram.erase(pos, tuple2, relation());

      default:
        if (cursor.peek(1).isSymbol(".")) {
          return aggregate(pos);
        }
        throw cursor.unexpected("operation");
    }
  }

  /** Parses "t1.0 = SUM t0.1 FOR ALL t0 IN r WHERE c" and the operation
   * that follows. */
  private Ram.Operation aggregate(Pos pos) {
    final Ram.Ref target = ref();
    cursor.expectSymbol("=");
    final Token token = cursor.peek();
    final Ram.Aggregator aggregator = Ram.Aggregator.of(token.text);
    if (token.kind != Token.Kind.IDENTIFIER || aggregator == null) {
      throw cursor.unexpected("aggregate function");
    }
    cursor.advance();
    Ram.Element expression = null;
    if (!(cursor.check("FOR") && cursor.peek(1).is("ALL"))) {
      expression = element();
    }
    cursor.expect("FOR");
    cursor.expect("ALL");
    final String variable = variable();
    cursor.expect("IN");
    final Ram.RelationRef relation = relation();
    Ram.Condition condition = null;
    if (cursor.accept("WHERE")) {
      condition = condition();
    }
    return ram.aggregate(pos, target, aggregator, variable, relation,
        expression, condition, operation());
  }

  private Ram.@Nullable Condition indexCondition() {
    if (cursor.check("ON") && cursor.peek(1).is("INDEX")) {
      cursor.advance();
      cursor.advance();
      return condition();
    }
    return null;
  }

  // conditions

  public Ram.Condition condition() {
    final Pos pos = cursor.pos();
    final Ram.Condition condition = conjunction();
    if (!cursor.check("OR")) {
      return condition;
    }
    final List<Ram.Condition> conditions = new ArrayList<>();
    conditions.add(condition);
    while (cursor.accept("OR")) {
      conditions.add(conjunction());
    }
    return ram.or(pos, conditions);
  }

  private Ram.Condition conjunction() {
    final Pos pos = cursor.pos();
    final Ram.Condition condition = unaryCondition();
    if (!cursor.check("AND")) {
      return condition;
    }
    final List<Ram.Condition> conditions = new ArrayList<>();
    conditions.add(condition);
    while (cursor.accept("AND")) {
      conditions.add(unaryCondition());
    }
    return ram.and(pos, conditions);
  }

  private Ram.Condition unaryCondition() {
    final Pos pos = cursor.pos();
    if (cursor.accept("NOT")) {
      return ram.not(pos, unaryCondition());
    }
    if (cursor.check("ISEMPTY") && cursor.peek(1).isSymbol("(")) {
      cursor.advance();
      cursor.advance();
      final Ram.RelationRef relation = relation();
      cursor.expectSymbol(")");
      return ram.isEmpty(pos, relation);
    }
    if (cursor.accept("EXISTS")) {
      final String variable = variable();
      cursor.expect("IN");
      return ram.exists(pos, variable, relation());
    }
    if (cursor.checkSymbol("(")) {
      // Either a condition in parentheses, or a tuple or element that
      // starts a comparison or membership test. Try the first.
      final int mark = cursor.mark();
      try {
        cursor.advance();
        final Ram.Condition condition = condition();
        cursor.expectSymbol(")");
        if (!isComparisonOrIn()) {
          return ram.bracketedCond(pos, condition);
        }
      } catch (RamParseException e) {
        LOGGER.trace("Not a bracketed condition at {}: {}", pos,
            e.getMessage());
      }
      cursor.reset(mark);
    }
    final Ram.Element left = elementOrTuple();
    if (cursor.accept("IN")) {
      return ram.in(pos, asTuple(left), relation());
    }
    final Op op = Op.comparison(cursor.peek().text);
    if (op == null || cursor.peek().kind != Token.Kind.SYMBOL) {
      throw cursor.unexpected("comparison or 'IN'");
    }
    cursor.advance();
    return ram.compare(pos, op, left, element());
  }

  private boolean isComparisonOrIn() {
    final Token token = cursor.peek();
    return token.is("IN")
        || token.kind == Token.Kind.SYMBOL && Op.comparison(token.text) != null;
  }

  /** Converts an element on the left of "IN" to a tuple: "(t0.0)" parses as
   * a bracketed element but means a tuple of one. */
  private static Ram.Tuple asTuple(Ram.Element element) {
    switch (element.op) {
      case TUPLE:
        return (Ram.Tuple) element;
      case BRACKETED:
        return ram.tuple(element.pos,
            ImmutableList.of(((Ram.Bracketed) element).element));
      default:
        return ram.tuple(element.pos, ImmutableList.of(element));
    }
  }

  // elements

  /** Parses "(e, e, ...)". */
  private Ram.Tuple tuple() {
    final Pos pos = cursor.pos();
    cursor.expectSymbol("(");
    final List<Ram.Element> args = elementList(")");
    return ram.tuple(pos, args);
  }

  /** Parses elements separated by commas, and the closing symbol. */
  private List<Ram.Element> elementList(String close) {
    final List<Ram.Element> args = new ArrayList<>();
    if (!cursor.acceptSymbol(close)) {
      do {
        args.add(element());
      } while (cursor.acceptSymbol(","));
      cursor.expectSymbol(close);
    }
    return args;
  }

  /** Parses an element; if it is in parentheses and contains commas, a
   * tuple. */
  private Ram.Element elementOrTuple() {
    if (!cursor.checkSymbol("(")) {
      return element();
    }
    final Pos pos = cursor.pos();
    cursor.advance();
    if (cursor.acceptSymbol(")")) {
      return ram.tuple(pos, ImmutableList.of());
    }
    final Ram.Element first = element();
    if (cursor.checkSymbol(",")) {
      final List<Ram.Element> args = new ArrayList<>();
      args.add(first);
      while (cursor.acceptSymbol(",")) {
        args.add(element());
      }
      cursor.expectSymbol(")");
      return ram.tuple(pos, args);
    }
    return parenthesized(pos, first);
  }

  public Ram.Element element() {
    final Pos pos = cursor.pos();
    final Token token = cursor.peek();
    switch (token.kind) {
      case NUMBER:
        cursor.advance();
        return ram.literal(pos, numberKind(token.text), token.text);

      case STRING:
        cursor.advance();
        return ram.literal(pos, Ram.LiteralKind.SYMBOL, token.text);

      case SYMBOL:
        if (cursor.acceptSymbol("-")) {
          final Token number = cursor.expect(Token.Kind.NUMBER, "number");
          return ram.literal(pos, numberKind(number.text), "-" + number.text);
        }
        if (cursor.acceptSymbol("[")) {
          return ram.record(pos, elementList("]"));
        }
        if (cursor.acceptSymbol("(")) {
          return parenthesized(pos, element());
        }
        throw cursor.unexpected("element");

      case IDENTIFIER:
        if (token.is("UNDEF")) {
          cursor.advance();
          return ram.undefined(pos);
        }
        if (cursor.peek(1).isSymbol(".")) {
          return ref();
        }
        if (cursor.peek(1).isSymbol("(")) {
          cursor.advance();
          cursor.advance();
          final Ram.LiteralKind kind = Ram.LiteralKind.of(token.text);
          if (kind != null) {
            return literal(pos, kind);
          }
          final List<Ram.Element> args = elementList(")");
          return token.text.startsWith("@")
              ? ram.functorCall(pos, Ram.FunctorKind.USER_DEFINED,
                  token.text.substring(1), args)
              : ram.functorCall(pos, Ram.FunctorKind.BUILTIN, token.text,
                  args);
        }
        throw cursor.unexpected("element");

      default:
        throw cursor.unexpected("element");
    }
  }

  /** Parses the rest of "number(5)", after the opening parenthesis. */
  private Ram.Literal literal(Pos pos, Ram.LiteralKind kind) {
    final String value;
    if (kind == Ram.LiteralKind.SYMBOL) {
      value = cursor.expect(Token.Kind.STRING, "string").text;
    } else if (cursor.acceptSymbol("-")) {
      value = "-" + cursor.expect(Token.Kind.NUMBER, "number").text;
    } else {
      value = cursor.expect(Token.Kind.NUMBER, "number").text;
    }
    cursor.expectSymbol(")");
    return ram.literal(pos, kind, value);
  }

  /**
   * Parses the rest of a parenthesized element, after its first operand.
   *
   * <p>"(a+b+c)" becomes an addition and "(a*b)" a call to the operator
   * "*"; operators of different kinds associate to the left.
   */
  private Ram.Element parenthesized(Pos pos, Ram.Element first) {
    final List<String> operators = new ArrayList<>();
    final List<Ram.Element> operands = new ArrayList<>();
    operands.add(first);
    while (!cursor.checkSymbol(")")) {
      final Token token = cursor.peek();
      if (token.kind != Token.Kind.SYMBOL && token.kind != Token.Kind.IDENTIFIER
          || token.isSymbol(",")) {
        throw cursor.unexpected("operator or ')'");
      }
      cursor.advance();
      operators.add(token.text);
      operands.add(element());
    }
    cursor.expectSymbol(")");
    if (operators.isEmpty()) {
      return ram.bracketed(pos, first);
    }
    if (operators.stream().distinct().count() == 1) {
      return ram.bracketed(pos, infix(pos, operators.get(0), operands));
    }
    Ram.Element e = first;
    for (int i = 0; i < operators.size(); i++) {
      e = infix(pos, operators.get(i),
          ImmutableList.of(e, operands.get(i + 1)));
    }
    return ram.bracketed(pos, e);
  }

  private static Ram.Element infix(Pos pos, String operator,
      List<Ram.Element> operands) {
    switch (operator) {
      case "+":
        return ram.add(pos, operands);
      case "-":
        return ram.sub(pos, operands);
      default:
        return ram.functorCall(pos, Ram.FunctorKind.OPERATOR, operator,
            operands);
    }
  }

  private Ram.Ref ref() {
    final Pos pos = cursor.pos();
    final String variable = variable();
    cursor.expectSymbol(".");
    return ram.ref(pos, variable, integer());
  }

  private static Ram.LiteralKind numberKind(String text) {
    return text.contains(".") ? Ram.LiteralKind.FLOAT
        : Ram.LiteralKind.NUMBER;
  }

  // names

  private String variable() {
    return cursor.expect(Token.Kind.IDENTIFIER, "tuple variable").text;
  }

  private int integer() {
    final Token token = cursor.expect(Token.Kind.NUMBER, "integer");
    try {
      return Integer.parseInt(token.text);
    } catch (NumberFormatException e) {
      throw new RamParseException("invalid integer " + token,
          token.pos(cursor.file));
    }
  }

  /** Parses a relation name, such as "edge", "@delta_a.b.path". */
  private Ram.RelationRef relation() {
    final Pos pos = cursor.pos();
    return ram.relation(pos, qualifiedName("relation name"));
  }

  private String qualifiedName(String description) {
    final StringBuilder b = new StringBuilder();
    b.append(cursor.expect(Token.Kind.IDENTIFIER, description).text);
    while (cursor.checkSymbol(".")
        && cursor.peek(1).kind == Token.Kind.IDENTIFIER) {
      cursor.advance();
      b.append('.').append(cursor.advance().text);
    }
    return b.toString();
  }
}

// End RamParser.java
