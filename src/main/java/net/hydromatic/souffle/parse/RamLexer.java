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
import java.util.List;

/**
 * Converts RAM or Datalog text into a list of tokens.
 *
 * <p>Skips white space, comments ({@code //} to end of line, and
 * {@code /* ... *}{@code /}) and the line markers that the C preprocessor
 * writes ({@code #} at the start of a line).
 */
public class RamLexer {
  private static final String[] TWO_CHAR_SYMBOLS = {"!=", "<=", ">="};

  private final String input;
  private final String file;
  private int position;
  private int line = 1;
  private int lineStart;

  public RamLexer(String input, String file) {
    this.input = input;
    this.file = file;
  }

  /** Tokenizes the whole input. The last token is always
   * {@link Token.Kind#EOF}. */
  public List<Token> tokenize() {
    final List<Token> tokens = new ArrayList<>();
    for (;;) {
      skipIgnored();
      if (position >= input.length()) {
        tokens.add(token(Token.Kind.EOF, "", position, 0));
        return tokens;
      }
      tokens.add(nextToken());
    }
  }

  private void skipIgnored() {
    while (position < input.length()) {
      final char c = input.charAt(position);
      if (c == '\n') {
        ++position;
        ++line;
        lineStart = position;
      } else if (Character.isWhitespace(c)) {
        ++position;
      } else if (input.startsWith("//", position)
          || c == '#' && atLineStart()) {
        while (position < input.length() && input.charAt(position) != '\n') {
          ++position;
        }
      } else if (input.startsWith("/*", position)) {
        final int end = input.indexOf("*/", position + 2);
        if (end < 0) {
          throw error("unterminated comment", position);
        }
        advanceTo(end + 2);
      } else {
        return;
      }
    }
  }

  private boolean atLineStart() {
    for (int i = lineStart; i < position; i++) {
      if (!Character.isWhitespace(input.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private Token nextToken() {
    final int start = position;
    final char c = input.charAt(position);
    if (c == '"') {
      return readString();
    }
    if (Character.isDigit(c)) {
      return readNumber();
    }
    if (Character.isLetter(c) || c == '_' || c == '@') {
      ++position;
      while (position < input.length()
          && isIdentifierPart(input.charAt(position))) {
        ++position;
      }
      return token(Token.Kind.IDENTIFIER, input.substring(start, position),
          start, position - start);
    }
    for (String symbol : TWO_CHAR_SYMBOLS) {
      if (input.startsWith(symbol, position)) {
        position += 2;
        return token(Token.Kind.SYMBOL, symbol, start, 2);
      }
    }
    ++position;
    return token(Token.Kind.SYMBOL, String.valueOf(c), start, 1);
  }

  private static boolean isIdentifierPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }

  /** Reads a number: digits, optionally with a fraction, exponent, or a
   * radix prefix such as "0x". */
  private Token readNumber() {
    final int start = position;
    while (position < input.length()) {
      final char c = input.charAt(position);
      if (Character.isLetterOrDigit(c)) {
        ++position;
      } else if (c == '.'
          && position + 1 < input.length()
          && Character.isDigit(input.charAt(position + 1))
          && !input.substring(start, position).contains(".")) {
        ++position;
      } else {
        break;
      }
    }
    return token(Token.Kind.NUMBER, input.substring(start, position), start,
        position - start);
  }

  private Token readString() {
    final int start = position;
    final int startLine = line;
    final int startColumn = start - lineStart + 1;
    final StringBuilder b = new StringBuilder();
    ++position; // opening quote
    for (;;) {
      if (position >= input.length()) {
        throw error("unterminated string", start);
      }
      char c = input.charAt(position++);
      if (c == '"') {
        break;
      }
      if (c == '\n') {
        ++line;
        lineStart = position;
      }
      if (c == '\\' && position < input.length()) {
        c = input.charAt(position++);
        switch (c) {
          case 'n':
            b.append('\n');
            break;
          case 't':
            b.append('\t');
            break;
          case 'r':
            b.append('\r');
            break;
          case '"':
          case '\\':
          case '\'':
            b.append(c);
            break;
          default:
            b.append('\\').append(c);
        }
      } else {
        b.append(c);
      }
    }
    return new Token(Token.Kind.STRING, b.toString(), startLine, startColumn,
        position - start);
  }

  private void advanceTo(int end) {
    while (position < end) {
      if (input.charAt(position++) == '\n') {
        ++line;
        lineStart = position;
      }
    }
  }

  private Token token(Token.Kind kind, String text, int start, int length) {
    return new Token(kind, text, line, start - lineStart + 1, length);
  }

  private RamParseException error(String message, int offset) {
    final Token token = token(Token.Kind.EOF, "", offset, 1);
    return new RamParseException(message, token.pos(file));
  }
}

// End RamLexer.java
