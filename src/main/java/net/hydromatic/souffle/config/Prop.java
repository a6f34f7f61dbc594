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

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import java.io.File;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import net.hydromatic.souffle.plan.LogicNotation;
import net.hydromatic.souffle.plan.Notation;
import net.hydromatic.souffle.plan.PythonNotation;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property.
 *
 * @see Session#map
 */
public enum Prop {
  /** String property "souffle" is the path of the Soufflé executable. Default
   * "souffle", which is looked up on the {@code PATH}. */
  SOUFFLE("souffle", String.class, true, "souffle"),

  /** String property "cpp" is the path of the C preprocessor. Default
   * "cpp". */
  CPP("cpp", String.class, true, "cpp"),

  /** File property "directory" is the directory against which relative file
   * names are resolved. The default value is the empty string, meaning the
   * current directory. */
  DIRECTORY("directory", File.class, true, new File("")),

  /** Integer property "indent" is the number of spaces by which each level
   * of a rendered plan is indented. Default 3. */
  INDENT("indent", Integer.class, true, 3),

  /** Enum property "notation" is the notation in which plans are rendered.
   * Default {@link PlanNotation#PYTHON}. */
  NOTATION("notation", PlanNotation.class, true, PlanNotation.PYTHON),

  /** Boolean property "simplify" controls whether a program is simplified
   * before its plan is rendered. Default true. */
  SIMPLIFY("simplify", Boolean.class, true, true),

  /** Boolean property "useTransformed" controls whether the "parse-files"
   * command reads declarations from the compiler's transformed Datalog
   * (true) or from the preprocessed source (false). Default false. */
  USE_TRANSFORMED("useTransformed", Boolean.class, true, false);

  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final @Nullable Object defaultValue;

  public static final ImmutableMap<String, Prop> BY_NAME;

  static {
    final Map<String, Prop> map = new LinkedHashMap<>();
    for (Prop value : values()) {
      map.put(value.name(), value);
      map.put(value.camelName, value);
    }
    BY_NAME = ImmutableMap.copyOf(map);
  }

  Prop(String camelName, Class<?> type, boolean required,
      @Nullable Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    if (defaultValue == null) {
      checkArgument(
          !required, "required property %s must have default value", camelName);
    } else {
      checkArgument(type.isInstance(defaultValue));
    }
  }

  /** Looks up a property by name. Throws if not found; never returns null. */
  public static Prop lookup(String propName) {
    Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /** Returns the value of a property. */
  public @Nullable Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  /** Throws if the requested type does not match this property's type. */
  private void checkType(Class<?> requestedType) {
    checkArgument(type == requestedType,
        "invalid type %s for property %s", type, camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return this.<Boolean>typeValue(map.get(this));
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return this.<Integer>typeValue(map.get(this));
  }

  /** Returns the value of a string property. */
  public String stringValue(Map<Prop, Object> map) {
    checkType(String.class);
    return this.typeValue(map.get(this));
  }

  /** Returns the value of a file property. */
  public File fileValue(Map<Prop, Object> map) {
    checkType(File.class);
    return this.typeValue(map.get(this));
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map,
      Class<E> type) {
    checkType(type);
    return this.typeValue(map.get(this));
  }

  @SuppressWarnings("unchecked")
  private <T> T typeValue(@Nullable Object o) {
    if (o == null) {
      if (defaultValue == null) {
        throw new IllegalStateException(
            "no value for property " + camelName + " and no default value");
      }
      return (T) defaultValue;
    }
    return (T) o;
  }

  /** Sets the value of a property, converting strings to the property's
   * type, as they arrive from the command line. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (value instanceof String && type != String.class) {
      final String s = (String) value;
      if (type.isEnum()) {
        Optional<Enum> optional =
            Enums.getIfPresent((Class<Enum>) type,
                s.toUpperCase(Locale.ROOT));
        if (!optional.isPresent()) {
          String values =
              Arrays.stream((Enum[]) type.getEnumConstants())
                  .map(e -> e.name().toLowerCase(Locale.ROOT))
                  .collect(Collectors.joining("', '", "'", "'"));
          throw new IllegalArgumentException("value for property "
              + camelName + " must be one of: " + values);
        }
        set(map, optional.get());
      } else if (type == Integer.class) {
        try {
          set(map, Integer.valueOf(s));
        } catch (NumberFormatException e) {
          throw new IllegalArgumentException("value for property "
              + camelName + " must be an integer: " + s, e);
        }
      } else if (type == Boolean.class) {
        if (!s.equals("true") && !s.equals("false")) {
          throw new IllegalArgumentException("value for property "
              + camelName + " must be true or false: " + s);
        }
        set(map, Boolean.valueOf(s));
      } else if (type == File.class) {
        set(map, new File(s));
      } else {
        set(map, value);
      }
      return;
    }
    set(map, value);
  }

  /** Sets the value of a property. Checks that its type is valid. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      if (required) {
        throw new IllegalArgumentException("property " + camelName
            + " is required");
      }
      map.remove(this);
    } else {
      if (!type.isInstance(value)) {
        throw new IllegalArgumentException("value for property " + camelName
            + " must have type " + type.getSimpleName());
      }
      map.put(this, value);
    }
  }

  /** Allowed values for the {@link #NOTATION} property. */
  public enum PlanNotation {
    /** A Python-like program. The default. */
    PYTHON(PythonNotation.INSTANCE),
    /** Sets and logic. */
    LOGIC(LogicNotation.INSTANCE);

    public final Notation notation;

    PlanNotation(Notation notation) {
      this.notation = notation;
    }
  }
}

// End Prop.java
