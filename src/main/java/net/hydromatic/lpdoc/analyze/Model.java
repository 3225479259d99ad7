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
import static net.hydromatic.lpdoc.util.Static.filterEager;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Multimaps;
import com.google.common.collect.Ordering;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.lpdoc.ast.Ast;
import net.hydromatic.lpdoc.ast.AstNode;
import net.hydromatic.lpdoc.ast.Located;
import net.hydromatic.lpdoc.doc.Comment;
import net.hydromatic.lpdoc.doc.Comments;
import net.hydromatic.lpdoc.doc.Directive;
import net.hydromatic.lpdoc.doc.Directives;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Analyzed program.
 *
 * <p>A model is built from the statements of a file (and of the files it
 * includes) and the lines of that file. It contains the classified statements,
 * the symbols and variables that occur in the file, and its documentation
 * comments and directives.
 *
 * <p>A model is immutable, and safe for use by concurrent readers.
 *
 * @see Models
 */
public class Model {
  /** Primary file. */
  public final String file;
  /** Statements of the primary file, in source order. */
  public final ImmutableList<Statement> statements;
  /** Statements of included files, in source order. */
  public final ImmutableList<Statement> externalStatements;
  public final ImmutableList<Symbol> symbols;
  public final ImmutableList<Variable> variables;
  public final ImmutableList<Comment> comments;
  public final ImmutableList<Directive> directives;

  private final ImmutableList<Statement> allStatements;
  private final ImmutableList<AnalysisException> warnings;
  private final ImmutableMap<Symbol.Key, Symbol> symbolIndex;
  private final ImmutableList<Directive> sortedSections;
  private final ImmutableListMultimap<String, Directive> directivesByKind;
  private final ImmutableListMultimap<Integer, Comment> commentsByLine;
  private final ImmutableMap<Prop, Object> props;

  private Model(
      String file,
      ImmutableList<Statement> allStatements,
      ImmutableList<Symbol> symbols,
      ImmutableList<Variable> variables,
      ImmutableList<Comment> comments,
      ImmutableList<Directive> directives,
      ImmutableList<AnalysisException> warnings,
      ImmutableMap<Symbol.Key, Symbol> symbolIndex,
      ImmutableList<Directive> sortedSections,
      ImmutableListMultimap<String, Directive> directivesByKind,
      ImmutableListMultimap<Integer, Comment> commentsByLine,
      ImmutableMap<Prop, Object> props) {
    this.file = requireNonNull(file);
    this.allStatements = allStatements;
    this.statements = filterEager(allStatements, s -> s.file().equals(file));
    this.externalStatements =
        filterEager(allStatements, s -> !s.file().equals(file));
    this.symbols = symbols;
    this.variables = variables;
    this.comments = comments;
    this.directives = directives;
    this.warnings = warnings;
    this.symbolIndex = symbolIndex;
    this.sortedSections = sortedSections;
    this.directivesByKind = directivesByKind;
    this.commentsByLine = commentsByLine;
    this.props = props;
  }

  /**
   * Builds a model.
   *
   * @param nodes Top-level nodes in source order, including those of included
   *     files
   * @param lines Lines of the primary file
   * @param file Name of the primary file, as recorded in node positions
   * @param sourceRoot Directory that is removed from file names when computing
   *     statement prefixes
   * @param props Properties
   * @param tracer Receives events during the build
   */
  public static Model create(
      List<AstNode> nodes,
      List<String> lines,
      String file,
      String sourceRoot,
      Map<Prop, Object> props,
      Tracer tracer) {
    final ImmutableList<Comment> comments = Comments.extract(lines, file);
    final ImmutableList<Directive> directives = Directives.extract(comments);
    final ImmutableListMultimap<String, Directive> directivesByKind =
        Multimaps.index(directives, d -> d.kind);
    final ImmutableListMultimap<Integer, Comment> commentsByLine =
        Multimaps.index(comments, c -> c.pos.startLine);

    final ImmutableList<Symbol> symbols =
        Symbols.extract(nodes, directivesByKind.get(Directive.PREDICATE), file);
    final ImmutableList<Variable> variables =
        Variables.extract(nodes, directivesByKind.get(Directive.VAR), file);
    final Map<Symbol.Key, Symbol> symbolMap = new LinkedHashMap<>();
    symbols.forEach(symbol -> symbolMap.put(symbol.key(), symbol));
    final ImmutableMap<Symbol.Key, Symbol> symbolIndex =
        ImmutableMap.copyOf(symbolMap);

    final String sectionKind = Prop.SECTION_KIND.stringValue(props);
    final ImmutableList<Directive> sortedSections =
        ImmutableList.copyOf(
            Ordering.<Integer>natural()
                .onResultOf((Directive d) -> d.lineNumber)
                .sortedCopy(directivesByKind.get(sectionKind)));

    final List<AnalysisException> warnings = new ArrayList<>();
    final StatementFactory factory =
        new StatementFactory(
            sourceRoot, Prop.EXTENSION.stringValue(props), warnings::add);
    final DependencyResolver resolver =
        new DependencyResolver(
            atom -> resolveSymbol(symbolIndex, file, atom));
    final ImmutableList.Builder<Statement> statements =
        ImmutableList.builder();
    for (AstNode node : nodes) {
      final Statement statement;
      if (StatementFactory.isHandled(node)) {
        final DependencyResolver.Resolution resolution =
            resolver.resolve(node);
        for (Symbol gap : resolution.gaps) {
          warnings.add(
              new AnalysisException(
                  AnalysisException.Kind.STRUCTURAL_TRAVERSAL_GAP,
                  "atom " + gap + " is neither in a head nor in a body",
                  gap.pos));
        }
        final boolean local = node.pos.file.equals(file);
        statement =
            factory.classify(
                node,
                resolution.defines,
                resolution.dependencies,
                local ? findSection(sortedSections, node) : null,
                local
                    ? commentsByLine.get(node.pos.startLine)
                    : ImmutableList.of());
      } else {
        statement =
            factory.classify(node, ImmutableSet.of(), ImmutableSet.of(), null,
                ImmutableList.of());
      }
      if (statement != null) {
        statements.add(statement);
        tracer.onStatement(statement);
      }
    }
    tracer.onWarnings(warnings);

    final Model model =
        new Model(
            file,
            statements.build(),
            symbols,
            variables,
            comments,
            directives,
            ImmutableList.copyOf(warnings),
            symbolIndex,
            sortedSections,
            directivesByKind,
            commentsByLine,
            ImmutableMap.copyOf(props));
    tracer.onModel(model);
    return model;
  }

  /** Returns the value of a boolean property of this model. */
  private boolean booleanProp(Prop prop) {
    return prop.booleanValue(props);
  }

  /** Returns the warnings produced while building this model. */
  public ImmutableList<AnalysisException> warnings() {
    return warnings;
  }

  /**
   * Returns statements in source order.
   *
   * @param includeExternal Whether to include statements of included files
   */
  public ImmutableList<Statement> getStatements(boolean includeExternal) {
    return includeExternal ? allStatements : statements;
  }

  /**
   * Returns statements of a given kind, in source order.
   *
   * @param kind Statement kind
   * @param includeExternal Whether to include statements of included files
   */
  public ImmutableList<Statement> getStatementsByKind(StatementKind kind,
      boolean includeExternal) {
    return filterEager(getStatements(includeExternal), s -> s.kind == kind);
  }

  /**
   * Returns statements of a given kind, in source order, including those of
   * included files unless {@link Prop#INCLUDE_EXTERNAL} is false.
   */
  public ImmutableList<Statement> getStatementsByKind(StatementKind kind) {
    return getStatementsByKind(kind, booleanProp(Prop.INCLUDE_EXTERNAL));
  }

  /**
   * Returns the section that contains an element, or null.
   *
   * <p>The section is the last section directive whose line number is less
   * than the line before the element; a directive on the line immediately
   * above an element documents that element, and does not start its section.
   * Elements of included files are in no section.
   */
  public @Nullable Directive getSection(Located located) {
    if (!located.pos().file.equals(file)) {
      return null;
    }
    return findSection(sortedSections, located);
  }

  private static @Nullable Directive findSection(
      List<Directive> sortedSections, Located located) {
    final int limit = located.pos().startLine - 1;
    int lo = 0;
    int hi = sortedSections.size();
    // Find the first section whose line number is not less than the limit
    while (lo < hi) {
      final int mid = (lo + hi) >>> 1;
      if (sortedSections.get(mid).lineNumber < limit) {
        lo = mid + 1;
      } else {
        hi = mid;
      }
    }
    return lo == 0 ? null : sortedSections.get(lo - 1);
  }

  /**
   * Returns the symbol for an atom.
   *
   * <p>If the atom is not in this model's index returns a detached symbol
   * with the same name, location and signature but no directive. The index
   * holds only atoms of the primary file, so an atom of an included file is
   * always detached, even if an atom of the primary file starts at the same
   * line and column.
   */
  public Symbol resolveSymbol(Ast.SymbolicAtom atom) {
    return resolveSymbol(symbolIndex, file, atom);
  }

  private static Symbol resolveSymbol(Map<Symbol.Key, Symbol> symbolIndex,
      String file, Ast.SymbolicAtom atom) {
    if (!atom.pos.file.equals(file)) {
      return Symbol.detached(atom);
    }
    final Symbol symbol = symbolIndex.get(Symbol.Key.of(atom));
    return symbol != null ? symbol : Symbol.detached(atom);
  }

  /** Returns the comments that start on the same line as an element. */
  public ImmutableList<Comment> getCommentsAt(Located located) {
    if (!located.pos().file.equals(file)) {
      return ImmutableList.of();
    }
    return commentsByLine.get(located.pos().startLine);
  }

  /**
   * Returns the directives, comments, variables and statements of the primary
   * file that start on a given line.
   *
   * <p>If {@link Prop#LOOSE_LINE_MATCH} is true (the default), also returns
   * those that start on the following line.
   */
  public ImmutableList<Located> getElementsAtLine(int line) {
    final boolean loose = booleanProp(Prop.LOOSE_LINE_MATCH);
    final ImmutableList.Builder<Located> elements = ImmutableList.builder();
    for (List<? extends Located> list
        : ImmutableList.<List<? extends Located>>of(
            directives, comments, variables, statements)) {
      for (Located element : list) {
        final int startLine = element.pos().startLine;
        if (startLine == line || loose && startLine == line + 1) {
          elements.add(element);
        }
      }
    }
    return elements.build();
  }

  /** Returns the directives of a given kind, in source order. */
  public ImmutableList<Directive> getDirectives(String kind) {
    return directivesByKind.get(kind);
  }

  /** Returns the occurrences of a variable, in source order. */
  public ImmutableList<Variable> getVariablesNamed(String name) {
    return filterEager(variables, v -> v.name.equals(name));
  }

  /** Returns the statements that define a predicate. */
  public ImmutableList<Statement> getDefiningStatements(Signature signature) {
    return filterEager(allStatements, s -> s.defines(signature));
  }

  /** Returns the statements that depend on a predicate. */
  public ImmutableList<Statement> getDependentStatements(Signature signature) {
    return filterEager(allStatements, s -> s.dependsOn(signature));
  }

  @Override
  public String toString() {
    return "Model{file: " + file
        + ", statements: " + statements.size()
        + ", externalStatements: " + externalStatements.size()
        + ", warnings: " + warnings.size() + "}";
  }
}

// End Model.java
