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

import static java.util.Objects.requireNonNull;

import net.hydromatic.souffle.ram.Pos;

/** Token produced by {@link RamLexer}. */
public class Token {
  public final Kind kind;
  /** Text of the token; for a {@link Kind#STRING}, the unescaped contents
   * without quotes. */
  public final String text;
  public final int line;
  public final int column;
  /** Number of characters the token occupies in the source. */
  public final int length;

  Token(Kind kind, String text, int line, int column, int length) {
    this.kind = requireNonNull(kind);
    this.text = requireNonNull(text);
    this.line = line;
    this.column = column;
    this.length = length;
  }

  /** Returns whether this token is a given identifier, such as "FOR". */
  public boolean is(String keyword) {
    return kind == Kind.IDENTIFIER && text.equals(keyword);
  }

  /** Returns whether this token is a given symbol, such as "(". */
  public boolean isSymbol(String symbol) {
    return kind == Kind.SYMBOL && text.equals(symbol);
  }

  /** Returns whether a token starts immediately after this one, with no
   * white space between. */
  public boolean precedes(Token next) {
    return line == next.line && column + length == next.column;
  }

  /** Returns the position of this token within a file. */
  public Pos pos(String file) {
    return new Pos(file, line, column, line, column + Math.max(length, 1));
  }

  @Override
  public String toString() {
    switch (kind) {
      case EOF:
        return "end of input";
      case STRING:
        return "string \"" + text + "\"";
      default:
        return "'" + text + "'";
    }
  }

  /** Kind of token. */
  public enum Kind {
    /** Identifier or keyword; may start with '@', as in "@delta_path". */
    IDENTIFIER,
    NUMBER,
    STRING,
    /** Punctuation or operator, such as "(", "!=" or "+". */
    SYMBOL,
    EOF
  }
}

// End Token.java
