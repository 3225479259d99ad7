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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.lpdoc.ast.AstNode;
import net.hydromatic.lpdoc.ast.Located;
import net.hydromatic.lpdoc.ast.Pos;
import net.hydromatic.lpdoc.doc.Comment;
import net.hydromatic.lpdoc.doc.Directive;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Top-level statement of a program, classified and cross-referenced.
 *
 * <p>Create statements via {@link StatementFactory}.
 */
public class Statement implements Located {
  public final AstNode node;
  public final StatementKind kind;
  /** Symbols that this statement defines, in source order. */
  public final ImmutableSet<Symbol> defines;
  /** Symbols that this statement depends on, in source order. */
  public final ImmutableSet<Symbol> dependencies;
  public final String identifier;
  public final Pos pos;
  /** The section directive that precedes this statement, or null. */
  public final @Nullable Directive section;
  /** Comments that start on the same line as this statement. */
  public final ImmutableList<Comment> comments;
  /**
   * Qualifier derived from the file path relative to the source root, such
   * as "graph.nodes." for "graph/nodes.lp".
   */
  public final String prefix;

  Statement(
      AstNode node,
      StatementKind kind,
      Set<Symbol> defines,
      Set<Symbol> dependencies,
      String identifier,
      @Nullable Directive section,
      List<Comment> comments,
      String prefix) {
    this.node = requireNonNull(node);
    this.kind = requireNonNull(kind);
    this.defines = ImmutableSet.copyOf(defines);
    this.dependencies = ImmutableSet.copyOf(dependencies);
    this.identifier = requireNonNull(identifier);
    this.pos = node.pos;
    this.section = section;
    this.comments = ImmutableList.copyOf(comments);
    this.prefix = requireNonNull(prefix);
    checkArgument(!identifier.isEmpty(), "empty identifier");
    switch (kind) {
    case FACT:
      checkArgument(!this.defines.isEmpty() && this.dependencies.isEmpty(),
          "fact must define atoms and have no dependencies");
      break;
    case CONSTRAINT:
      checkArgument(this.defines.isEmpty() && !this.dependencies.isEmpty(),
          "constraint must have dependencies and define no atoms");
      break;
    case RULE:
      checkArgument(!this.defines.isEmpty() && !this.dependencies.isEmpty(),
          "rule must define atoms and have dependencies");
      break;
    default:
      break;
    }
  }

  @Override
  public Pos pos() {
    return pos;
  }

  /** Returns the file that contains this statement. */
  public String file() {
    return pos.file;
  }

  /** Returns the signatures of the defined symbols, in source order. */
  public ImmutableSet<Signature> defineSignatures() {
    return signatures(defines);
  }

  /** Returns the signatures of the dependencies, in source order. */
  public ImmutableSet<Signature> dependencySignatures() {
    return signatures(dependencies);
  }

  /** Returns whether this statement defines a predicate. */
  public boolean defines(Signature signature) {
    return defines.stream().anyMatch(s -> s.signature.equals(signature));
  }

  /** Returns whether this statement depends on a predicate. */
  public boolean dependsOn(Signature signature) {
    return dependencies.stream().anyMatch(s -> s.signature.equals(signature));
  }

  private static ImmutableSet<Signature> signatures(Set<Symbol> symbols) {
    final ImmutableSet.Builder<Signature> builder = ImmutableSet.builder();
    symbols.forEach(symbol -> builder.add(symbol.signature));
    return builder.build();
  }

  /** Returns the identifier qualified by its prefix. */
  public String qualifiedIdentifier() {
    return prefix + identifier;
  }

  @Override
  public String toString() {
    return kind + " " + identifier + " " + node;
  }
}

// End Statement.java
