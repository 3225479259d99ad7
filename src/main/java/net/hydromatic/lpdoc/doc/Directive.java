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
package net.hydromatic.lpdoc.doc;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.lpdoc.ast.Located;
import net.hydromatic.lpdoc.ast.Pos;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Structured annotation found in a line comment.
 *
 * <p>For example, "{@code %@var X - a node of the graph}" is a directive of
 * kind "var" with parameters "X" and "a node of the graph".
 */
public class Directive implements Located {
  /** Kind of a directive that starts a section. */
  public static final String SECTION = "section";
  /** Kind of a directive that documents a predicate. */
  public static final String PREDICATE = "predicate";
  /** Kind of a directive that documents a variable. */
  public static final String VAR = "var";

  public final int lineNumber;
  public final String kind;
  public final List<String> parameters;
  public final Pos pos;

  public Directive(int lineNumber, String kind, List<String> parameters, Pos pos) {
    this.lineNumber = lineNumber;
    this.kind = requireNonNull(kind);
    this.parameters = ImmutableList.copyOf(parameters);
    this.pos = requireNonNull(pos);
  }

  @Override
  public Pos pos() {
    return pos;
  }

  /** Returns the first parameter, or null if there are no parameters. */
  public @Nullable String name() {
    return parameters.isEmpty() ? null : parameters.get(0);
  }

  /** Returns the second parameter, or null if there is none. */
  public @Nullable String description() {
    return parameters.size() < 2 ? null : parameters.get(1);
  }

  @Override
  public String toString() {
    return "%@" + kind + (parameters.isEmpty() ? "" : " ")
        + String.join(" - ", parameters);
  }
}

// End Directive.java
