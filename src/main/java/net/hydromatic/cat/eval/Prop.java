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
package net.hydromatic.cat.eval;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.collect.ImmutableMap;
import java.io.File;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls how models are resolved, evaluated and checked.
 *
 * <p>Property values are held in a {@code Map<Prop, Object>}; a property
 * that is not in the map has its default value.
 */
public enum Prop {
  /**
   * File property "directory" is the directory in which to look for
   * included files when a model was not read from a file. The default is
   * the current directory.
   */
  DIRECTORY("directory", File.class, true, new File("")),

  /**
   * Boolean property "memoize" controls whether an evaluator caches the
   * values of sub-expressions. Default is true.
   */
  MEMOIZE("memoize", Boolean.class, true, true),

  /**
   * Property "closureAlgorithm" chooses how {@code ^+} and {@code ^*} are
   * computed. Default is {@link ClosureAlgorithm#WARSHALL}.
   */
  CLOSURE_ALGORITHM("closureAlgorithm", ClosureAlgorithm.class, true,
      ClosureAlgorithm.WARSHALL),

  /**
   * Integer property "fixpointLimit" is the maximum number of rounds
   * in the evaluation of a recursive definition. If not set, the limit is the
   * number of definitions in the group times the square of the number of
   * events, plus one.
   */
  FIXPOINT_LIMIT("fixpointLimit", Integer.class, false, null),

  /**
   * Boolean property "witness" controls whether the verdict of a violated
   * axiom includes a witness, such as a cycle. Default is true.
   */
  WITNESS("witness", Boolean.class, true, true);

  /** Name in lower camel case, e.g. "closureAlgorithm". */
  public final String camelName;
  private final Class<?> type;
  private final boolean required;
  private final @Nullable Object defaultValue;

  /** Properties keyed by both {@link #name()} and {@link #camelName}. */
  private static final ImmutableMap<String, Prop> BY_NAME;

  static {
    final ImmutableMap.Builder<String, Prop> b = ImmutableMap.builder();
    for (Prop prop : values()) {
      b.put(prop.name(), prop).put(prop.camelName, prop);
    }
    BY_NAME = b.build();
  }

  Prop(String camelName, Class<?> type, boolean required,
      @Nullable Object defaultValue) {
    checkArgument(CaseFormat.LOWER_CAMEL.to(CaseFormat.UPPER_UNDERSCORE,
        camelName).equals(name()), "bad camel name %s", camelName);
    checkArgument(defaultValue != null ? type.isInstance(defaultValue)
        : !required, "bad default for property %s", camelName);
    this.camelName = camelName;
    this.type = type;
    this.required = required;
    this.defaultValue = defaultValue;
  }

  /** Returns the property with a given name, in either upper case with
   * underscores or camel case; throws if there is none. */
  public static Prop lookup(String propName) {
    final @Nullable Prop prop = BY_NAME.get(propName);
    if (prop == null) {
      throw new IllegalArgumentException("property " + propName
          + " not found");
    }
    return prop;
  }

  /** Returns the value of this property in a map, or its default value, or
   * null if it has neither. */
  public @Nullable Object get(Map<Prop, Object> map) {
    return map.getOrDefault(this, defaultValue);
  }

  public boolean booleanValue(Map<Prop, Object> map) {
    return value(map, Boolean.class);
  }

  public int intValue(Map<Prop, Object> map) {
    return value(map, Integer.class);
  }

  public File fileValue(Map<Prop, Object> map) {
    return value(map, File.class);
  }

  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map,
      Class<E> enumClass) {
    return value(map, enumClass);
  }

  /** Returns the value of this property, which must exist and have a given
   * type. */
  private <T> T value(Map<Prop, Object> map, Class<T> requestedType) {
    checkArgument(type == requestedType,
        "property %s has type %s, not %s", camelName, type, requestedType);
    final @Nullable Object o = get(map);
    if (o == null) {
      throw new IllegalStateException("property " + camelName
          + " has no value and no default value");
    }
    return requestedType.cast(o);
  }

  /** Sets the value of this property, converting a string to the constant
   * of an enum property with that name, ignoring case. */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setLenient(Map<Prop, Object> map, @Nullable Object value) {
    if (type.isEnum() && value instanceof String) {
      final Class<Enum> enumClass = (Class<Enum>) type;
      final Optional<Enum> constant =
          Enums.getIfPresent(enumClass,
              ((String) value).toUpperCase(Locale.ROOT));
      if (!constant.isPresent()) {
        throw new IllegalArgumentException("value must be one of: "
            + Arrays.stream(enumClass.getEnumConstants())
                .map(e -> "'" + e.name() + "'")
                .collect(Collectors.joining(", ")));
      }
      set(map, constant.get());
    } else {
      set(map, value);
    }
  }

  /** Sets the value of this property, or removes it if the value is null.
   * Throws if the value has the wrong type, or is null for a property that
   * is required. */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      checkArgument(!required, "property %s is required", camelName);
      map.remove(this);
    } else {
      checkArgument(type.isInstance(value),
          "value for property %s must have type %s", camelName, type);
      map.put(this, value);
    }
  }

  /** Allowed values for {@link #CLOSURE_ALGORITHM} property. */
  public enum ClosureAlgorithm {
    /** Warshall's algorithm, one round per event. The default. */
    WARSHALL,
    /** Repeated squaring, {@code r := r | r;r} until nothing changes. */
    SQUARING
  }
}

// End Prop.java
