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
package net.hydromatic.lpdoc.analyze;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.HashMap;
import java.util.Map;
import org.junit.jupiter.api.Test;

/** Tests for {@link Prop}. */
public class PropTest {
  @Test
  void testLookup() {
    assertThat(Prop.lookup("looseLineMatch"), is(Prop.LOOSE_LINE_MATCH));
    assertThat(Prop.lookup("LOOSE_LINE_MATCH"), is(Prop.LOOSE_LINE_MATCH));
    assertThat(Prop.BY_CAMEL_NAME.get(0), is(Prop.EXTENSION));
    assertThrows(IllegalArgumentException.class, () -> Prop.lookup("xyz"));
  }

  @Test
  void testDefaults() {
    final Map<Prop, Object> map = new HashMap<>();
    assertThat(Prop.EXTENSION.stringValue(map), is(".lp"));
    assertThat(Prop.LOOSE_LINE_MATCH.booleanValue(map), is(true));
    assertThat(Prop.INCLUDE_EXTERNAL.booleanValue(map), is(true));
    assertThat(Prop.SECTION_KIND.stringValue(map), is("section"));
  }

  @Test
  void testSet() {
    final Map<Prop, Object> map = new HashMap<>();
    Prop.EXTENSION.set(map, ".pl");
    assertThat(Prop.EXTENSION.stringValue(map), is(".pl"));
    assertThat(Prop.EXTENSION.get(map), is((Object) ".pl"));
    assertThat(Prop.EXTENSION.remove(map), is((Object) ".pl"));
    assertThat(Prop.EXTENSION.remove(map), nullValue());
    assertThat(Prop.EXTENSION.stringValue(map), is(".lp"));

    // Wrong type
    assertThrows(IllegalArgumentException.class,
        () -> Prop.LOOSE_LINE_MATCH.set(map, "yes"));
    // Required properties cannot be unset
    assertThrows(IllegalArgumentException.class,
        () -> Prop.SECTION_KIND.set(map, null));
    // Asking for a value of the wrong type
    assertThrows(IllegalArgumentException.class,
        () -> Prop.EXTENSION.booleanValue(map));
  }
}

// End PropTest.java
