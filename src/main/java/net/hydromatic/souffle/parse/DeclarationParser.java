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
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import net.hydromatic.souffle.catalog.Attribute;
import net.hydromatic.souffle.catalog.AttributeType;
import net.hydromatic.souffle.catalog.RelationSchema;
import net.hydromatic.souffle.catalog.SchemaCatalog;
import org.checkerframework.checker.nullness.qual.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts relation declarations from Datalog source.
 *
 * <p>Recognizes {@code .decl name(attr:type, ...)} and the type
 * declarations that define attribute types ({@code .type T <: number},
 * {@code .type T = symbol}, {@code .number_type T},
 * {@code .symbol_type T}). Everything else, including rules, facts,
 * directives and comments, is skipped.
 *
 * <p>Relations are only qualified in the compiler's transformed Datalog;
 * in raw source, relations declared inside components are missed or keep
 * their local names.
 */
public class DeclarationParser {
  private static final Logger LOGGER =
      LoggerFactory.getLogger(DeclarationParser.class);

  private final TokenCursor cursor;

  /** User-defined types; the value is the type it is an alias or subtype
   * of, or null for records, ADTs and unions. */
  private final Map<String, @Nullable String> types = new HashMap<>();

  /** Attribute names and declared type names, per relation. */
  private final List<Decl> decls = new ArrayList<>();

  private DeclarationParser(TokenCursor cursor) {
    this.cursor = cursor;
  }

  /** Parses Datalog source and returns the relations it declares. */
  public static SchemaCatalog parse(String text, String file) {
    final DeclarationParser parser =
        new DeclarationParser(TokenCursor.of(text, file));
    parser.scan();
    final SchemaCatalog catalog = parser.catalog();
    LOGGER.debug("Found {} relations and {} types in {}", catalog.size(),
        parser.types.size(), file);
    return catalog;
  }

  private void scan() {
    while (!cursor.atEnd()) {
      if (cursor.checkSymbol(".")
          && cursor.peek(1).kind == Token.Kind.IDENTIFIER
          && cursor.peek().precedes(cursor.peek(1))) {
        final String directive = cursor.peek(1).text;
        switch (directive) {
          case "decl":
            cursor.advance();
            cursor.advance();
            decl();
            continue;
          case "type":
            cursor.advance();
            cursor.advance();
            type();
            continue;
          case "number_type":
          case "symbol_type":
            cursor.advance();
            cursor.advance();
            types.put(qualifiedName("type name"),
                directive.equals("number_type") ? "number" : "symbol");
            continue;
          default:
            break;
        }
      }
      cursor.advance();
    }
  }

  /** Parses the rest of ".decl name(a:t, ...)". Qualifiers after the
   * closing parenthesis are skipped by the caller. */
  private void decl() {
    final String name = qualifiedName("relation name");
    final List<String[]> attributes = new ArrayList<>();
    cursor.expectSymbol("(");
    if (!cursor.acceptSymbol(")")) {
      do {
        final String attributeName =
            cursor.expect(Token.Kind.IDENTIFIER, "attribute name").text;
        cursor.expectSymbol(":");
        attributes.add(
            new String[] {attributeName, qualifiedName("type name")});
      } while (cursor.acceptSymbol(","));
      cursor.expectSymbol(")");
    }
    decls.add(new Decl(name, attributes));
  }

  /** Parses the rest of ".type T <: base", ".type T = base" or another
   * form of type declaration. */
  private void type() {
    final String name = qualifiedName("type name");
    if (cursor.acceptSymbol("<")) {
      cursor.expectSymbol(":");
      types.put(name, qualifiedName("type name"));
      return;
    }
    cursor.expectSymbol("=");
    if (cursor.check(Token.Kind.IDENTIFIER)) {
      final String base = qualifiedName("type name");
      types.put(name, cursor.checkSymbol("|") ? null : base);
    } else {
      types.put(name, null);
    }
  }

  private String qualifiedName(String description) {
    Token token = cursor.expect(Token.Kind.IDENTIFIER, description);
    final StringBuilder b = new StringBuilder(token.text);
    while (cursor.checkSymbol(".")
        && cursor.peek(1).kind == Token.Kind.IDENTIFIER
        && token.precedes(cursor.peek())
        && cursor.peek().precedes(cursor.peek(1))) {
      cursor.advance();
      token = cursor.advance();
      b.append('.').append(token.text);
    }
    return b.toString();
  }

  private SchemaCatalog catalog() {
    final List<RelationSchema> schemas = new ArrayList<>();
    for (Decl decl : decls) {
      final List<Attribute> attributes = new ArrayList<>();
      for (String[] attribute : decl.attributes) {
        attributes.add(
            Attribute.of(attribute[0], attribute[1], resolve(attribute[1])));
      }
      schemas.add(RelationSchema.of(decl.name, attributes));
    }
    return SchemaCatalog.of(schemas);
  }

  /** Resolves a type name to a primitive type, following aliases and
   * subtypes. */
  private AttributeType resolve(String typeName) {
    final Set<String> seen = new HashSet<>();
    String name = typeName;
    for (;;) {
      final AttributeType type = AttributeType.of(name);
      if (type != AttributeType.RECORD || !types.containsKey(name)) {
        return type;
      }
      final String base = types.get(name);
      if (base == null || !seen.add(name)) {
        return AttributeType.RECORD;
      }
      name = base;
    }
  }

  /** Relation declaration before its types are resolved. */
  private static class Decl {
    final String name;
    final List<String[]> attributes;

    Decl(String name, List<String[]> attributes) {
      this.name = name;
      this.attributes = attributes;
    }
  }
}

// End DeclarationParser.java
