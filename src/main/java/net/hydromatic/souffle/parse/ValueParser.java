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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.souffle.ram.Value;

/**
 * Parses the literal values that the compiler embeds in RAM text: the
 * payload of {@code DEBUG} and the options of {@code IO}.
 *
 * <p>The format is JSON-like: strings, numbers, {@code true}, {@code false},
 * {@code null}, arrays {@code [v, ...]} and mappings {@code {"k": v, ...}}.
 * Text is never evaluated.
 */
public class ValueParser {
  private final TokenCursor cursor;

  public ValueParser(TokenCursor cursor) {
    this.cursor = cursor;
  }

  /** Parses a piece of text that consists of exactly one value. */
  public static Value parse(String text) {
    final TokenCursor cursor = TokenCursor.of(text, "");
    final Value value = new ValueParser(cursor).value();
    if (!cursor.atEnd()) {
      throw cursor.unexpected("end of value");
    }
    return value;
  }

  /** Parses a value at the cursor. */
  public Value value() {
    final Token token = cursor.peek();
    switch (token.kind) {
      case STRING:
        cursor.advance();
        return Value.string(token.text);
      case NUMBER:
        cursor.advance();
        return Value.number(number(token.text, false));
      case IDENTIFIER:
        switch (token.text) {
          case "true":
            cursor.advance();
            return Value.TRUE;
          case "false":
            cursor.advance();
            return Value.FALSE;
          case "null":
            cursor.advance();
            return Value.NULL;
          default:
            throw cursor.unexpected("value");
        }
      case SYMBOL:
        if (cursor.acceptSymbol("-")) {
          final Token number = cursor.expect(Token.Kind.NUMBER, "number");
          return Value.number(number(number.text, true));
        }
        if (cursor.acceptSymbol("[")) {
          return Value.array(array());
        }
        if (cursor.acceptSymbol("{")) {
          return Value.mapping(mapping());
        }
        throw cursor.unexpected("value");
      default:
        throw cursor.unexpected("value");
    }
  }

  private List<Value> array() {
    final List<Value> values = new ArrayList<>();
    if (!cursor.acceptSymbol("]")) {
      do {
        values.add(value());
      } while (cursor.acceptSymbol(","));
      cursor.expectSymbol("]");
    }
    return values;
  }

  private Map<String, Value> mapping() {
    final Map<String, Value> map = new LinkedHashMap<>();
    if (!cursor.acceptSymbol("}")) {
      do {
        final String key = key();
        cursor.expectSymbol(":");
        map.put(key, value());
      } while (cursor.acceptSymbol(","));
      cursor.expectSymbol("}");
    }
    return map;
  }

  /** Parses a key of a mapping or an option, quoted or not. An unquoted
   * key may contain hyphens, as in {@code fact-dir}. */
  String key() {
    Token token = cursor.peek();
    if (token.kind == Token.Kind.STRING) {
      cursor.advance();
      return token.text;
    }
    if (token.kind != Token.Kind.IDENTIFIER) {
      throw cursor.unexpected("key");
    }
    cursor.advance();
    final StringBuilder b = new StringBuilder(token.text);
    while (cursor.checkSymbol("-")
        && cursor.peek(1).kind == Token.Kind.IDENTIFIER
        && token.precedes(cursor.peek())
        && cursor.peek().precedes(cursor.peek(1))) {
      cursor.advance();
      token = cursor.advance();
      b.append('-').append(token.text);
    }
    return b.toString();
  }

  private Number number(String text, boolean negative) {
    final String s = negative ? "-" + text : text;
    try {
      if (s.matches("-?[0-9]+")) {
        return Long.parseLong(s);
      }
      return Double.parseDouble(s);
    } catch (NumberFormatException e) {
      throw new RamParseException("invalid number '" + s + "'",
          cursor.pos());
    }
  }
}

// End ValueParser.java
