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
package net.hydromatic.souffle.ram;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Literal value embedded in RAM text.
 *
 * <p>The compiler writes the payload of a {@code DEBUG} statement and the
 * options of an {@code IO} statement as literals in a JSON-like format; a
 * {@code Value} is the parsed form of one such literal.
 */
public class Value {
  public static final Value NULL = new Value(Kind.NULL, null);
  public static final Value TRUE = new Value(Kind.BOOLEAN, true);
  public static final Value FALSE = new Value(Kind.BOOLEAN, false);

  private static final Splitter LINE_SPLITTER = Splitter.on('\n');

  public final Kind kind;
  private final @Nullable Object value;

  private Value(Kind kind, @Nullable Object value) {
    this.kind = requireNonNull(kind);
    this.value = value;
  }

  public static Value string(String s) {
    return new Value(Kind.STRING, requireNonNull(s));
  }

  public static Value number(Number n) {
    return new Value(Kind.NUMBER, requireNonNull(n));
  }

  public static Value bool(boolean b) {
    return b ? TRUE : FALSE;
  }

  public static Value array(List<Value> values) {
    return new Value(Kind.ARRAY, ImmutableList.copyOf(values));
  }

  public static Value mapping(Map<String, Value> values) {
    return new Value(Kind.MAPPING, ImmutableMap.copyOf(values));
  }

  /** Returns the contents of a string value. */
  public String stringValue() {
    checkArgument(kind == Kind.STRING, "not a string: %s", this);
    return (String) requireNonNull(value);
  }

  /** Returns the contents of a number value. */
  public Number numberValue() {
    checkArgument(kind == Kind.NUMBER, "not a number: %s", this);
    return (Number) requireNonNull(value);
  }

  /** Returns the contents of a boolean value. */
  public boolean booleanValue() {
    checkArgument(kind == Kind.BOOLEAN, "not a boolean: %s", this);
    return (Boolean) requireNonNull(value);
  }

  /** Returns the elements of an array value. */
  @SuppressWarnings("unchecked")
  public ImmutableList<Value> arrayValue() {
    checkArgument(kind == Kind.ARRAY, "not an array: %s", this);
    return (ImmutableList<Value>) requireNonNull(value);
  }

  /** Returns the entries of a mapping value. */
  @SuppressWarnings("unchecked")
  public ImmutableMap<String, Value> mappingValue() {
    checkArgument(kind == Kind.MAPPING, "not a mapping: %s", this);
    return (ImmutableMap<String, Value>) requireNonNull(value);
  }

  /** Returns the contents of a string, or the literal form of any other
   * value. */
  public String text() {
    return kind == Kind.STRING ? (String) requireNonNull(value) : toString();
  }

  /** Returns the lines of the text of this value. */
  public List<String> lines() {
    return LINE_SPLITTER.splitToList(text());
  }

  /** Returns whether this value is null or the empty string. */
  public boolean isEmpty() {
    return kind == Kind.NULL
        || kind == Kind.STRING && ((String) requireNonNull(value)).isEmpty();
  }

  @Override
  public int hashCode() {
    return Objects.hash(kind, value);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Value
            && kind == ((Value) o).kind
            && Objects.equals(value, ((Value) o).value);
  }

  @Override
  public String toString() {
    return unparse(new StringBuilder()).toString();
  }

  /** Writes this value in the literal format it was parsed from. */
  public StringBuilder unparse(StringBuilder buf) {
    switch (kind) {
      case NULL:
        return buf.append("null");
      case BOOLEAN:
      case NUMBER:
        return buf.append(value);
      case STRING:
        return quote(buf, stringValue());
      case ARRAY:
        buf.append('[');
        final List<Value> values = arrayValue();
        for (int i = 0; i < values.size(); i++) {
          if (i > 0) {
            buf.append(", ");
          }
          values.get(i).unparse(buf);
        }
        return buf.append(']');
      case MAPPING:
        buf.append('{');
        int i = 0;
        for (Map.Entry<String, Value> entry : mappingValue().entrySet()) {
          if (i++ > 0) {
            buf.append(", ");
          }
          quote(buf, entry.getKey()).append(": ");
          entry.getValue().unparse(buf);
        }
        return buf.append('}');
      default:
        throw new AssertionError(kind);
    }
  }

  private static StringBuilder quote(StringBuilder buf, String s) {
    buf.append('"');
    for (int i = 0; i < s.length(); i++) {
      final char c = s.charAt(i);
      switch (c) {
        case '"':
          buf.append("\\\"");
          break;
        case '\\':
          buf.append("\\\\");
          break;
        case '\n':
          buf.append("\\n");
          break;
        case '\t':
          buf.append("\\t");
          break;
        case '\r':
          buf.append("\\r");
          break;
        default:
          buf.append(c);
      }
    }
    return buf.append('"');
  }

  /** Kind of value. */
  public enum Kind {
    STRING,
    NUMBER,
    BOOLEAN,
    NULL,
    ARRAY,
    MAPPING
  }
}

// End Value.java
