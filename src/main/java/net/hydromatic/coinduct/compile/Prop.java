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
package net.hydromatic.coinduct.compile;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.base.CaseFormat;
import com.google.common.base.Enums;
import com.google.common.base.Optional;
import com.google.common.primitives.Ints;
import java.util.Arrays;
import java.util.Locale;
import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Property that controls an invocation.
 *
 * <p>Values are held in a {@code Map<Prop, Object>}; a property that has no
 * entry in the map has its default value.
 */
public enum Prop {
  /**
   * Enum property "ambiguityPolicy" controls what happens when an obligation
   * is resolved both by a pattern and by a declaration. Default is {@link
   * AmbiguityPolicy#REJECT}.
   */
  AMBIGUITY_POLICY(
      "ambiguityPolicy", AmbiguityPolicy.class, AmbiguityPolicy.REJECT),

  /**
   * Boolean property "autoDetect" controls what happens if no capabilities
   * are tracked. If true (the default), every capability that is implemented
   * by one of the declarations is tracked. If false, nothing is tracked, and
   * declarations are returned unchanged.
   */
  AUTO_DETECT("autoDetect", Boolean.class, true),

  /**
   * Integer property "maxIterations" is the maximum number of obligations
   * that expansion may remove from the work list. Default is 0, which means
   * no limit; negative values are invalid.
   */
  MAX_ITERATIONS("maxIterations", Integer.class, 0);

  public final String camelName;
  private final Class<?> type;
  private final Object defaultValue;

  Prop(String camelName, Class<?> type, Object defaultValue) {
    this.camelName = camelName;
    this.type = type;
    this.defaultValue = defaultValue;
    checkArgument(
        CaseFormat.LOWER_CAMEL
            .to(CaseFormat.UPPER_UNDERSCORE, camelName)
            .equals(name()));
    checkArgument(type.isInstance(defaultValue));
  }

  /** Returns the value of a property, or its default if it is not set. */
  public Object get(Map<Prop, Object> map) {
    Object o = map.get(this);
    return o != null ? o : defaultValue;
  }

  private void checkType(Class<?> requestedType) {
    checkArgument(
        type == requestedType,
        "invalid type %s for property %s",
        type,
        camelName);
  }

  /** Returns the value of a boolean property. */
  public boolean booleanValue(Map<Prop, Object> map) {
    checkType(Boolean.class);
    return (Boolean) get(map);
  }

  /** Returns the value of an integer property. */
  public int intValue(Map<Prop, Object> map) {
    checkType(Integer.class);
    return (Integer) get(map);
  }

  /** Returns the value of an enum property. */
  public <E extends Enum<E>> E enumValue(Map<Prop, Object> map, Class<E> type) {
    checkType(type);
    return type.cast(get(map));
  }

  /**
   * Sets the value of a property from a string, such as a value read from a
   * configuration file. Enum names are case-insensitive.
   */
  @SuppressWarnings({"rawtypes", "unchecked"})
  public void setFromString(Map<Prop, Object> map, String value) {
    if (type == Boolean.class) {
      checkArgument(
          value.equalsIgnoreCase("true") || value.equalsIgnoreCase("false"),
          "value for property %s must be true or false, but was '%s'",
          camelName,
          value);
      set(map, Boolean.valueOf(value));
    } else if (type == Integer.class) {
      final Integer i = Ints.tryParse(value.trim());
      checkArgument(
          i != null,
          "value for property %s must be an integer, but was '%s'",
          camelName,
          value);
      set(map, i);
    } else {
      final Optional<Enum> optional =
          Enums.getIfPresent(
              (Class<Enum>) type, value.trim().toUpperCase(Locale.ROOT));
      if (!optional.isPresent()) {
        throw new IllegalArgumentException(
            "value for property " + camelName + " must be one of "
                + Arrays.toString(type.getEnumConstants())
                + ", but was '" + value + "'");
      }
      set(map, optional.get());
    }
  }

  /**
   * Sets the value of a property. Checks that its type is valid, and that an
   * integer value is not negative. A null value restores the default.
   */
  public void set(Map<Prop, Object> map, @Nullable Object value) {
    if (value == null) {
      map.remove(this);
      return;
    }
    checkArgument(
        type.isInstance(value),
        "value for property %s must have type %s",
        camelName,
        type.getSimpleName());
    if (value instanceof Integer) {
      checkArgument(
          (Integer) value >= 0,
          "value for property %s must not be negative, but was %s",
          camelName,
          value);
    }
    map.put(this, value);
  }

  /** Allowed values for {@link #AMBIGUITY_POLICY} property. */
  public enum AmbiguityPolicy {
    /**
     * An obligation that matches both a pattern and a declaration is an
     * error. The default.
     */
    REJECT,
    /** The pattern is used, and the declaration is ignored. */
    PATTERN_FIRST
  }
}

// End Prop.java
