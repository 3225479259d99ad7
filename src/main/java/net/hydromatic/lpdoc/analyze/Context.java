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

import static java.util.Objects.requireNonNull;

import java.util.Objects;
import net.hydromatic.lpdoc.ast.AstNode;
import net.hydromatic.lpdoc.ast.Field;
import net.hydromatic.lpdoc.ast.Op;

/**
 * Where in a statement a walk currently is.
 *
 * <p>Contexts are immutable; entering a node or field returns a new context.
 */
public class Context {
  /** Context at the root of a statement. */
  public static final Context ROOT = new Context(Place.NONE, false, false);

  public final Place place;
  /** Whether the walk is beneath a conditional literal. */
  public final boolean conditional;
  /** Whether the walk is beneath the condition of some node. */
  public final boolean condition;

  private Context(Place place, boolean conditional, boolean condition) {
    this.place = requireNonNull(place);
    this.conditional = conditional;
    this.condition = condition;
  }

  /** Returns the context beneath a field. */
  public Context enter(Field field) {
    Place place = this.place;
    if (place == Place.NONE) {
      if (field == Field.HEAD) {
        place = Place.HEAD;
      } else if (field == Field.BODY) {
        place = Place.BODY;
      }
    }
    return with(place, conditional, condition || field == Field.CONDITION);
  }

  /** Returns the context beneath a node. */
  public Context enter(AstNode node) {
    return with(place, conditional || node.op == Op.CONDITIONAL_LITERAL,
        condition);
  }

  private Context with(Place place, boolean conditional, boolean condition) {
    if (place == this.place
        && conditional == this.conditional
        && condition == this.condition) {
      return this;
    }
    return new Context(place, conditional, condition);
  }

  /** Returns the role of an atom reached in this context. */
  public Role role() {
    switch (place) {
    case HEAD:
      return conditional && condition ? Role.DEPENDENCY : Role.DEFINES;
    case BODY:
      return Role.DEPENDENCY;
    default:
      return Role.UNKNOWN;
    }
  }

  @Override
  public int hashCode() {
    return Objects.hash(place, conditional, condition);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Context
            && place == ((Context) o).place
            && conditional == ((Context) o).conditional
            && condition == ((Context) o).condition;
  }

  @Override
  public String toString() {
    return "{place: " + place
        + ", conditional: " + conditional
        + ", condition: " + condition + "}";
  }

  /** The first of "head" and "body" fields that a walk has entered. */
  public enum Place {
    NONE, HEAD, BODY
  }

  /** What a reference to an atom means for the statement that contains it. */
  public enum Role {
    /** The statement defines the atom. */
    DEFINES,
    /** The statement depends on the atom. */
    DEPENDENCY,
    /** The atom is neither in a head nor in a body. */
    UNKNOWN
  }
}

// End Context.java
