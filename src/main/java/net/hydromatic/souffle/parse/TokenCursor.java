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

import java.util.List;
import net.hydromatic.souffle.ram.Pos;

/**
 * Position within a list of tokens, with the helper methods of a
 * recursive-descent parser.
 *
 * <p>The list must end with a {@link Token.Kind#EOF} token.
 */
public class TokenCursor {
  private final List<Token> tokens;
  public final String file;
  private int position;

  public TokenCursor(List<Token> tokens, String file) {
    this.tokens = requireNonNull(tokens);
    this.file = requireNonNull(file);
  }

  /** Creates a cursor over the tokens of a piece of text. */
  public static TokenCursor of(String text, String file) {
    return new TokenCursor(new RamLexer(text, file).tokenize(), file);
  }

  public Token peek() {
    return peek(0);
  }

  /** Returns the token {@code offset} places ahead; the EOF token if that is
   * beyond the end. */
  public Token peek(int offset) {
    return tokens.get(Math.min(position + offset, tokens.size() - 1));
  }

  public Token advance() {
    final Token token = peek();
    if (position < tokens.size() - 1) {
      ++position;
    }
    return token;
  }

  public boolean atEnd() {
    return peek().kind == Token.Kind.EOF;
  }

  /** Returns whether the current token is a given keyword. */
  public boolean check(String keyword) {
    return peek().is(keyword);
  }

  public boolean checkSymbol(String symbol) {
    return peek().isSymbol(symbol);
  }

  public boolean check(Token.Kind kind) {
    return peek().kind == kind;
  }

  /** Consumes the current token if it is a given keyword. */
  public boolean accept(String keyword) {
    if (check(keyword)) {
      advance();
      return true;
    }
    return false;
  }

  public boolean acceptSymbol(String symbol) {
    if (checkSymbol(symbol)) {
      advance();
      return true;
    }
    return false;
  }

  public Token expect(String keyword) {
    if (!check(keyword)) {
      throw unexpected("'" + keyword + "'");
    }
    return advance();
  }

  public Token expectSymbol(String symbol) {
    if (!checkSymbol(symbol)) {
      throw unexpected("'" + symbol + "'");
    }
    return advance();
  }

  public Token expect(Token.Kind kind, String description) {
    if (!check(kind)) {
      throw unexpected(description);
    }
    return advance();
  }

  /** Returns the position of the current token. */
  public Pos pos() {
    return peek().pos(file);
  }

  /** Saves the current position, to be restored by {@link #reset}. */
  public int mark() {
    return position;
  }

  public void reset(int mark) {
    position = mark;
  }

  /** Creates an exception saying that something else was expected at the
   * current token. */
  public RamParseException unexpected(String expected) {
    return new RamParseException(
        "expected " + expected + ", got " + peek(), pos());
  }
}

// End TokenCursor.java
