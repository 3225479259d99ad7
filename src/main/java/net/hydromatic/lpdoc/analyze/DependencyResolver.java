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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.List;
import java.util.function.Function;
import net.hydromatic.lpdoc.ast.Ast;
import net.hydromatic.lpdoc.ast.AstNode;
import net.hydromatic.lpdoc.ast.Field;
import net.hydromatic.lpdoc.ast.FieldVisitor;
import net.hydromatic.lpdoc.ast.Op;

/**
 * Computes the atoms that a statement defines and the atoms that it depends
 * on.
 *
 * <p>An atom in the head of a rule is defined by the rule, unless it is in the
 * condition of a conditional literal; an atom in the body, or in the condition
 * of a conditional literal in the head, is a dependency. For example, in
 *
 * <blockquote><pre>p(X) : q(X) :- r(X).</pre></blockquote>
 *
 * <p>the rule defines {@code p/1} and depends on {@code q/1} and {@code r/1}.
 *
 * <p>Atoms that are neither in a head nor in a body are treated as defined,
 * and are also reported in {@link Resolution#gaps}.
 */
public class DependencyResolver {
  private final Function<Ast.SymbolicAtom, Symbol> symbolResolver;

  /**
   * Creates a DependencyResolver.
   *
   * @param symbolResolver Maps each atom to a symbol, typically via
   *     {@link Model#resolveSymbol(Ast.SymbolicAtom)}
   */
  public DependencyResolver(Function<Ast.SymbolicAtom, Symbol> symbolResolver) {
    this.symbolResolver = requireNonNull(symbolResolver);
  }

  /** Walks a statement and returns what it defines and depends on. */
  public Resolution resolve(AstNode statement) {
    final Resolution.Builder builder = new Resolution.Builder();
    walk(statement, Context.ROOT, builder);
    return builder.build();
  }

  private void walk(AstNode node, Context context, Resolution.Builder builder) {
    final Context nodeContext = context.enter(node);
    if (node.op == Op.SYMBOLIC_ATOM) {
      final Symbol symbol = symbolResolver.apply((Ast.SymbolicAtom) node);
      switch (nodeContext.role()) {
      case DEPENDENCY:
        builder.dependencies.add(symbol);
        break;
      case DEFINES:
        builder.defines.add(symbol);
        break;
      default:
        builder.defines.add(symbol);
        builder.gaps.add(symbol);
      }
      // The arguments of an atom are terms; they contain no further atoms.
      return;
    }
    node.forEachField(
        new FieldVisitor() {
          @Override
          public void field(Field field, AstNode child) {
            walk(child, nodeContext.enter(field), builder);
          }

          @Override
          public void sequence(Field field, List<? extends AstNode> children) {
            final Context fieldContext = nodeContext.enter(field);
            for (AstNode child : children) {
              walk(child, fieldContext, builder);
            }
          }
        });
  }

  /** Result of resolving a statement. */
  public static class Resolution {
    /** Symbols that the statement defines, in source order. */
    public final ImmutableSet<Symbol> defines;
    /** Symbols that the statement depends on, in source order. */
    public final ImmutableSet<Symbol> dependencies;
    /** Symbols found neither in a head nor in a body. */
    public final ImmutableList<Symbol> gaps;

    Resolution(
        ImmutableSet<Symbol> defines,
        ImmutableSet<Symbol> dependencies,
        ImmutableList<Symbol> gaps) {
      this.defines = defines;
      this.dependencies = dependencies;
      this.gaps = gaps;
    }

    /** Mutable builder for a Resolution. */
    static class Builder {
      final ImmutableSet.Builder<Symbol> defines = ImmutableSet.builder();
      final ImmutableSet.Builder<Symbol> dependencies = ImmutableSet.builder();
      final ImmutableList.Builder<Symbol> gaps = ImmutableList.builder();

      Resolution build() {
        return new Resolution(
            defines.build(), dependencies.build(), gaps.build());
      }
    }
  }
}

// End DependencyResolver.java
