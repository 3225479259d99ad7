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

import net.hydromatic.lpdoc.ast.Ast;
import net.hydromatic.lpdoc.ast.Located;
import net.hydromatic.lpdoc.ast.Pos;
import net.hydromatic.lpdoc.doc.Directive;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Occurrence of a variable in a program, along with the "var" directive that
 * documents it, if any.
 *
 * <p>There is one Variable per occurrence; occurrences of the same name are
 * not merged.
 */
public class Variable implements Located {
  public final String name;
  public final Pos pos;
  public final Ast.Variable node;
  public final @Nullable Directive directive;

  Variable(Ast.Variable node, @Nullable Directive directive) {
    this.node = requireNonNull(node);
    this.name = node.name;
    this.pos = node.pos;
    this.directive = directive;
  }

  @Override
  public Pos pos() {
    return pos;
  }

  /** Returns the description from the directive, or null. */
  public @Nullable String description() {
    return directive == null ? null : directive.description();
  }

  @Override
  public String toString() {
    return name;
  }
}

// End Variable.java
