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

import java.io.File;
import java.util.List;
import java.util.Set;
import java.util.function.Consumer;
import net.hydromatic.lpdoc.ast.Ast;
import net.hydromatic.lpdoc.ast.AstNode;
import net.hydromatic.lpdoc.ast.Op;
import net.hydromatic.lpdoc.doc.Comment;
import net.hydromatic.lpdoc.doc.Directive;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Classifies top-level nodes and creates {@link Statement statements}.
 *
 * <p>A factory is used for the construction of a single model. It numbers
 * constraints in the order they are created, starting from 0.
 */
public class StatementFactory {
  private final String sourceRoot;
  private final String extension;
  private final Consumer<AnalysisException> warningConsumer;
  private int constraintCount = 0;

  /**
   * Creates a StatementFactory.
   *
   * @param sourceRoot Directory that is removed from file paths when computing
   *     prefixes
   * @param extension File extension that is removed when computing prefixes
   * @param warningConsumer Receives a warning for each node that cannot be
   *     classified
   */
  public StatementFactory(
      String sourceRoot,
      String extension,
      Consumer<AnalysisException> warningConsumer) {
    this.sourceRoot = requireNonNull(sourceRoot);
    this.extension = requireNonNull(extension);
    this.warningConsumer = requireNonNull(warningConsumer);
  }

  /** Returns whether a node is of a kind that can become a statement. */
  public static boolean isHandled(AstNode node) {
    switch (node.op) {
    case RULE:
    case DEFINED:
    case DEFINITION:
    case SHOW_SIGNATURE:
    case SHOW_TERM:
      return true;
    default:
      return false;
    }
  }

  /**
   * Classifies a node and creates a statement.
   *
   * <p>Returns null, and reports a warning, if the node is a rule that neither
   * defines nor depends on any atom, or is a kind of node that has no
   * statement kind.
   */
  public @Nullable Statement classify(
      AstNode node,
      Set<Symbol> defines,
      Set<Symbol> dependencies,
      @Nullable Directive section,
      List<Comment> comments) {
    final StatementKind kind;
    switch (node.op) {
    case RULE:
      if (!defines.isEmpty()) {
        kind = dependencies.isEmpty() ? StatementKind.FACT : StatementKind.RULE;
      } else if (!dependencies.isEmpty()) {
        kind = StatementKind.CONSTRAINT;
      } else {
        warningConsumer.accept(
            new AnalysisException(AnalysisException.Kind.UNCLASSIFIABLE_STATEMENT,
                "statement defines no atoms and has no dependencies: " + node,
                node.pos));
        return null;
      }
      break;
    case DEFINED:
      kind = StatementKind.INPUT;
      break;
    case DEFINITION:
      kind = StatementKind.DEFINITION;
      break;
    case SHOW_SIGNATURE:
    case SHOW_TERM:
      kind = StatementKind.OUTPUT;
      break;
    default:
      warningConsumer.accept(
          new AnalysisException(AnalysisException.Kind.UNHANDLED_STATEMENT,
              "unhandled statement " + node.op + ": " + node, node.pos));
      return null;
    }
    return create(kind, node, defines, dependencies, section, comments);
  }

  /**
   * Creates a statement of a given kind.
   *
   * <p>Throws if the node is not compatible with the kind, or if the symbols
   * do not satisfy the kind's invariants.
   */
  public Statement create(
      StatementKind kind,
      AstNode node,
      Set<Symbol> defines,
      Set<Symbol> dependencies,
      @Nullable Directive section,
      List<Comment> comments) {
    final String identifier = identifier(kind, node, defines);
    return new Statement(node, kind, defines, dependencies, identifier,
        section, comments, prefix(node.pos.file, sourceRoot, extension));
  }

  private String identifier(StatementKind kind, AstNode node,
      Set<Symbol> defines) {
    switch (kind) {
    case RULE:
    case FACT:
      checkOp(kind, node, Op.RULE);
      checkArgument(!defines.isEmpty(), "%s must define atoms", kind);
      return defines.iterator().next().signature.toString();

    case CONSTRAINT:
      checkOp(kind, node, Op.RULE);
      return "Constraint#" + constraintCount++;

    case DEFINITION:
    case CONSTANT:
      checkOp(kind, node, Op.DEFINITION);
      return ((Ast.Definition) node).name;

    case INPUT:
      checkOp(kind, node, Op.DEFINED);
      final Ast.Defined defined = (Ast.Defined) node;
      return defined.name + "/" + defined.arity;

    case OUTPUT:
      if (node.op == Op.SHOW_SIGNATURE) {
        final Ast.ShowSignature show = (Ast.ShowSignature) node;
        return show.name + "/" + show.arity;
      }
      checkOp(kind, node, Op.SHOW_TERM);
      final AstNode term = ((Ast.ShowTerm) node).term;
      if (term.op == Op.FUNCTION) {
        final Ast.Function function = (Ast.Function) term;
        return function.name + "/" + function.arguments.size();
      }
      return term + "/0";

    default:
      throw new AssertionError(kind);
    }
  }

  private static void checkOp(StatementKind kind, AstNode node, Op op) {
    checkArgument(node.op == op, "%s statement requires %s node, got %s",
        kind, op, node.op);
  }

  /**
   * Derives the prefix of statements in a file.
   *
   * <p>For example, if {@code sourceRoot} is "src/lp" and extension is ".lp",
   * the prefix of "src/lp/graph/nodes.lp" is "graph.nodes.".
   */
  public static String prefix(String file, String sourceRoot,
      String extension) {
    String path = file;
    if (!sourceRoot.isEmpty() && path.startsWith(sourceRoot)) {
      path = path.substring(sourceRoot.length());
    }
    if (path.startsWith("/") || path.startsWith(File.separator)) {
      path = path.substring(1);
    }
    if (!extension.isEmpty() && path.endsWith(extension)) {
      path = path.substring(0, path.length() - extension.length());
    }
    return path.replace('/', '.').replace(File.separatorChar, '.') + ".";
  }
}

// End StatementFactory.java
