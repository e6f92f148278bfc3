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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.core.Is.is;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test
  void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(
        Prop.AMBIGUITY_POLICY.enumValue(map, Prop.AmbiguityPolicy.class),
        is(Prop.AmbiguityPolicy.REJECT));
    assertThat(Prop.AUTO_DETECT.booleanValue(map), is(true));
    assertThat(Prop.MAX_ITERATIONS.intValue(map), is(0));
    assertThat(Prop.MAX_ITERATIONS.get(map), is(0));
  }

  @Test
  void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.MAX_ITERATIONS.set(map, 100);
    assertThat(Prop.MAX_ITERATIONS.intValue(map), is(100));
    Prop.AUTO_DETECT.set(map, false);
    assertThat(Prop.AUTO_DETECT.booleanValue(map), is(false));

    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> Prop.MAX_ITERATIONS.set(map, "100"));
    assertThat(
        e.getMessage(),
        is("value for property maxIterations must have type Integer"));

    // Asking for the wrong type is an error
    assertThrows(
        IllegalArgumentException.class,
        () -> Prop.MAX_ITERATIONS.booleanValue(map));
  }

  /** Setting a property to null restores its default value. */
  @Test
  void testSetNull() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.MAX_ITERATIONS.set(map, 100);
    Prop.AUTO_DETECT.set(map, false);
    Prop.MAX_ITERATIONS.set(map, null);
    Prop.AUTO_DETECT.set(map, null);
    assertThat(map.isEmpty(), is(true));
    assertThat(Prop.MAX_ITERATIONS.intValue(map), is(0));
    assertThat(Prop.AUTO_DETECT.booleanValue(map), is(true));
  }

  /** A negative iteration limit is rejected. */
  @Test
  void testSetNegative() {
    final Map<Prop, Object> map = new HashMap<>();
    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> Prop.MAX_ITERATIONS.set(map, -1));
    assertThat(
        e.getMessage(),
        is("value for property maxIterations must not be negative, "
            + "but was -1"));
    assertThat(map.containsKey(Prop.MAX_ITERATIONS), is(false));
    assertThrows(
        IllegalArgumentException.class,
        () -> Prop.MAX_ITERATIONS.setFromString(map, "-5"));
  }

  /** Properties may be set from strings; enum names ignore case. */
  @Test
  void testSetFromString() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.AMBIGUITY_POLICY.setFromString(map, "pattern_first");
    assertThat(
        Prop.AMBIGUITY_POLICY.enumValue(map, Prop.AmbiguityPolicy.class),
        is(Prop.AmbiguityPolicy.PATTERN_FIRST));
    Prop.MAX_ITERATIONS.setFromString(map, " 250 ");
    assertThat(Prop.MAX_ITERATIONS.intValue(map), is(250));
    Prop.AUTO_DETECT.setFromString(map, "FALSE");
    assertThat(Prop.AUTO_DETECT.booleanValue(map), is(false));

    final IllegalArgumentException e =
        assertThrows(
            IllegalArgumentException.class,
            () -> Prop.AMBIGUITY_POLICY.setFromString(map, "first"));
    assertThat(
        e.getMessage(),
        is("value for property ambiguityPolicy must be one of "
            + "[REJECT, PATTERN_FIRST], but was 'first'"));
    final IllegalArgumentException e2 =
        assertThrows(
            IllegalArgumentException.class,
            () -> Prop.MAX_ITERATIONS.setFromString(map, "many"));
    assertThat(
        e2.getMessage(),
        is("value for property maxIterations must be an integer, "
            + "but was 'many'"));
    assertThrows(
        IllegalArgumentException.class,
        () -> Prop.AUTO_DETECT.setFromString(map, "yes"));
  }
}

// End PropTest.java
