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
package net.hydromatic.lpdoc;

import static net.hydromatic.lpdoc.Lp.lp;
import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.notNullValue;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.CoreMatchers.sameInstance;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import net.hydromatic.lpdoc.analyze.AnalysisException;
import net.hydromatic.lpdoc.analyze.Model;
import net.hydromatic.lpdoc.analyze.Models;
import net.hydromatic.lpdoc.analyze.Prop;
import net.hydromatic.lpdoc.analyze.Signature;
import net.hydromatic.lpdoc.analyze.Statement;
import net.hydromatic.lpdoc.analyze.StatementKind;
import net.hydromatic.lpdoc.analyze.Symbol;
import net.hydromatic.lpdoc.analyze.Tracer;
import net.hydromatic.lpdoc.analyze.Tracers;
import net.hydromatic.lpdoc.analyze.Variable;
import net.hydromatic.lpdoc.ast.Ast;
import net.hydromatic.lpdoc.ast.Located;
import net.hydromatic.lpdoc.doc.Directive;
import net.hydromatic.lpdoc.parse.LpParseException;
import org.junit.jupiter.api.Test;

/** Tests for {@link Model}. */
public class ModelTest {
  private static final String SOURCE_ROOT = "src/test/resources/lp";
  private static final File MAIN = new File(SOURCE_ROOT, "graph/main.lp");

  private static Model graph() throws IOException {
    return Models.fromFile(MAIN, SOURCE_ROOT);
  }

  @Test
  void testRule() {
    lp("p(X) :- q(X), not r(X).")
        .assertStatements("RULE p/1")
        .assertWarnings()
        .withModel(model -> {
          final Statement rule = model.statements.get(0);
          assertThat(rule.defineSignatures(), hasToString("[p/1]"));
          assertThat(rule.dependencySignatures(), hasToString("[q/1, r/1]"));
          assertThat(rule.prefix, is("test."));
        });
  }

  @Test
  void testFactAndConstraint() {
    lp("a.").assertStatements("FACT a/0");
    lp(":- b, c.").assertStatements("CONSTRAINT Constraint#0");
    lp(":- b.\n:- c.\nd :- b.")
        .assertStatements("CONSTRAINT Constraint#0", "CONSTRAINT Constraint#1",
            "RULE d/0");
  }

  @Test
  void testConditionalHead() {
    lp("p(X) : q(X) :- r(X).")
        .assertStatements("RULE p/1")
        .withModel(model -> {
          final Statement rule = model.statements.get(0);
          assertThat(rule.dependencySignatures(), hasToString("[q/1, r/1]"));
        });
  }

  @Test
  void testDirectiveStatements() {
    lp("#const n = 3.\n#defined p/1.\n#show p/1.\n#show X : p(X).")
        .assertStatements("DEFINITION n", "INPUT p/1", "OUTPUT p/1",
            "OUTPUT X/0");
  }

  @Test
  void testEmptyModel() {
    lp("")
        .assertStatements()
        .assertWarnings()
        .withModel(model -> {
          assertThat(model.symbols.isEmpty(), is(true));
          assertThat(model.comments.isEmpty(), is(true));
          assertThat(model.getElementsAtLine(1).isEmpty(), is(true));
        });
    lp("% only a comment")
        .assertStatements()
        .withModel(model -> assertThat(model.comments, hasSize(1)));
  }

  /** Building a model twice gives the same statements, numbered the same. */
  @Test
  void testIdempotent() {
    final Lp fixture = lp("a.\n:- a, b.\nb :- a.\n:- b.");
    final List<String> first = describe(fixture.model());
    final List<String> second = describe(fixture.model());
    assertThat(second, is(first));
    assertThat(first.get(1), is("CONSTRAINT Constraint#0 [] [a/0, b/0]"));
    assertThat(first.get(3), is("CONSTRAINT Constraint#1 [] [b/0]"));
  }

  private static List<String> describe(Model model) {
    final List<String> list = new ArrayList<>();
    for (Statement s : model.getStatements(true)) {
      list.add(s.kind + " " + s.identifier + " " + s.defineSignatures()
          + " " + s.dependencySignatures());
    }
    return list;
  }

  @Test
  void testWarnings() {
    lp("#program base.\na.\n:- 1 < 2.\n#external e.")
        .assertStatements("FACT a/0")
        .assertWarnings(AnalysisException.Kind.UNHANDLED_STATEMENT,
            AnalysisException.Kind.UNCLASSIFIABLE_STATEMENT,
            AnalysisException.Kind.UNHANDLED_STATEMENT);
  }

  @Test
  void testSections() {
    final String[] lines = new String[22];
    for (int i = 0; i < lines.length; i++) {
      lines[i] = "";
    }
    lines[2] = "a.";
    lines[4] = "%@section First";
    lines[6] = "b.";
    lines[19] = "%@section Second";
    lines[20] = "c.";
    lines[21] = "d.";
    lp(String.join("\n", lines))
        .withModel(model -> {
          final List<Statement> statements = model.statements;
          assertThat(statements, hasSize(4));
          // Line 3 is before any section
          assertThat(statements.get(0).section, nullValue());
          assertThat(model.getSection(statements.get(0)), nullValue());
          // Line 7 is in the section at line 5
          assertThat(statements.get(1).section, hasToString("%@section First"));
          // A section directive on the line immediately above a statement
          // does not start that statement's section
          assertThat(statements.get(2).section, hasToString("%@section First"));
          // Line 22 is in the section at line 20
          final Directive section = model.getSection(statements.get(3));
          assertThat(section, notNullValue());
          assertThat(section.lineNumber, is(20));
          assertThat(section.name(), is("Second"));
          assertThat(statements.get(3).section, sameInstance(section));
        });
  }

  @Test
  void testSectionKindProp() {
    lp("%@chapter One\n\nx.")
        .withProp(Prop.SECTION_KIND, "chapter")
        .withModel(model ->
            assertThat(model.statements.get(0).section,
                hasToString("%@chapter One")));
    lp("%@chapter One\n\nx.")
        .withModel(model ->
            assertThat(model.statements.get(0).section, nullValue()));
  }

  @Test
  void testResolveSymbol() {
    lp("%@predicate q/1 - some q\np(X) :- q(X).")
        .withModel(model -> {
          assertThat(model.symbols, hasSize(2));
          for (Symbol symbol : model.symbols) {
            assertThat(model.resolveSymbol(symbol.atom), sameInstance(symbol));
            assertThat(symbol.detached, is(false));
          }
          final Symbol q = model.symbols.get(1);
          assertThat(q.signature, is(Signature.of("q", 1)));
          assertThat(q.description(), is("some q"));
          assertThat(model.symbols.get(0).directive, nullValue());

          // An atom that is not in the index resolves to a detached symbol
          final Ast.Rule other =
              (Ast.Rule) lp("\n\n\nq(Y) :- r(Y).").parse().get(0);
          final Ast.SymbolicAtom atom =
              (Ast.SymbolicAtom) ((Ast.Literal) other.head).atom;
          final Symbol detached = model.resolveSymbol(atom);
          assertThat(detached.detached, is(true));
          assertThat(detached.signature, is(Signature.of("q", 1)));
          assertThat(detached.directive, nullValue());
          assertThat(detached.pos.startLine, is(4));
        });
  }

  @Test
  void testVariables() {
    lp("%@var X - a node\n%@var X - the node\np(X) :- q(X, Y).")
        .withModel(model -> {
          assertThat(model.variables, hasSize(3));
          final List<Variable> xs = model.getVariablesNamed("X");
          assertThat(xs, hasSize(2));
          // The last directive for a variable wins
          assertThat(xs.get(0).description(), is("the node"));
          assertThat(xs.get(1).pos.startColumn, is(11));
          final Variable y = model.getVariablesNamed("Y").get(0);
          assertThat(y.directive, nullValue());
        });
  }

  @Test
  void testCommentsAndElementsAtLine() {
    final String text = "% about p\n"
        + "p(X) :- q(X). % trailing\n"
        + "\n"
        + "q(1).";
    lp(text).withModel(model -> {
      final Statement p = model.statements.get(0);
      assertThat(p.comments, hasSize(1));
      assertThat(p.comments.get(0).content, is("trailing"));
      assertThat(model.getCommentsAt(p), is(p.comments));

      // Line 1 has a comment; line 2 has a comment, two variables and a
      // statement
      final List<Located> elements = model.getElementsAtLine(1);
      assertThat(elements, hasSize(5));
      assertThat(elements.get(0), hasToString("about p"));
      assertThat(elements.get(4), sameInstance(p));
      assertThat(model.getElementsAtLine(3), hasSize(1));
    });
    lp(text)
        .withProp(Prop.LOOSE_LINE_MATCH, false)
        .withModel(model -> {
          assertThat(model.getElementsAtLine(1), hasSize(1));
          assertThat(model.getElementsAtLine(3).isEmpty(), is(true));
        });
  }

  @Test
  void testFromFile() throws IOException {
    final Model model = graph();
    assertThat(model.file, is(MAIN.getPath()));
    assertThat(model.warnings().isEmpty(), is(true));
    assertThat(describe(model).get(0), is("FACT node/1 [node/1] []"));
    final List<String> statements = new ArrayList<>();
    model.getStatements(true).forEach(s ->
        statements.add(s.kind + " " + s.qualifiedIdentifier()));
    assertThat(statements.toString(),
        is("[FACT graph.nodes.node/1, INPUT graph.nodes.color/1, "
            + "FACT graph.main.edge/2, FACT graph.main.edge/2, "
            + "RULE graph.main.reach/2, RULE graph.main.reach/2, "
            + "CONSTRAINT graph.main.Constraint#0, "
            + "OUTPUT graph.main.reach/2]"));

    // Statements from the included file are external
    assertThat(model.statements, hasSize(6));
    assertThat(model.externalStatements, hasSize(2));
    for (Statement s : model.externalStatements) {
      assertThat(s.file(), is(new File(MAIN.getParentFile(), "nodes.lp")
          .getPath()));
      assertThat(s.section, nullValue());
      assertThat(s.comments.isEmpty(), is(true));
    }
    // Atoms in included files have no symbols of their own
    final Statement node = model.externalStatements.get(0);
    assertThat(node.defines.iterator().next().detached, is(true));
  }

  @Test
  void testFromFileQueries() throws IOException {
    final Model model = graph();
    assertThat(model.getStatementsByKind(StatementKind.FACT), hasSize(3));
    assertThat(model.getStatementsByKind(StatementKind.FACT, false),
        hasSize(2));
    assertThat(model.getStatementsByKind(StatementKind.INPUT, false),
        hasSize(0));
    assertThat(model.getDirectives(Directive.SECTION), hasSize(2));
    assertThat(model.getDirectives(Directive.PREDICATE), hasSize(2));
    assertThat(model.getDirectives("nonexistent"), hasSize(0));

    final Signature reach = Signature.of("reach", 2);
    final Signature edge = Signature.of("edge", 2);
    assertThat(model.getDefiningStatements(reach), hasSize(2));
    assertThat(model.getDependentStatements(reach), hasSize(2));
    assertThat(model.getDependentStatements(edge), hasSize(2));
    assertThat(model.getDefiningStatements(Signature.of("node", 1)),
        hasSize(1));

    // Sections; the constraint at line 15 is just below the "Checks"
    // directive, so it is still in the "Graph" section
    final List<Statement> statements = model.statements;
    assertThat(statements.get(0).section.name(), is("Graph"));
    assertThat(statements.get(4).kind, is(StatementKind.CONSTRAINT));
    assertThat(statements.get(4).section.name(), is("Graph"));
    assertThat(statements.get(5).section.name(), is("Checks"));

    // Comments
    assertThat(model.getCommentsAt(statements.get(4)).get(0).content,
        is("no cycles"));
    assertThat(model.comments.get(1).block, is(true));

    // Symbols and their directives
    assertThat(model.symbols, hasSize(9));
    for (Symbol symbol : model.symbols) {
      assertThat(model.resolveSymbol(symbol.atom), sameInstance(symbol));
      if (symbol.name.equals("node")) {
        assertThat(symbol.directive, nullValue());
      } else {
        assertThat(symbol.directive, notNullValue());
      }
    }
    assertThat(model.symbols.get(0).description(),
        is("an edge between two nodes"));

    // Variables
    assertThat(model.variables, hasSize(13));
    for (Variable x : model.getVariablesNamed("X")) {
      assertThat(x.description(), is("the source node"));
    }
    assertThat(model.getVariablesNamed("X"), hasSize(7));

    // The "var" directive and its comment on line 10, and the variables and
    // statement on line 11
    assertThat(model.getElementsAtLine(10), hasSize(7));
  }

  @Test
  void testFromFileProps() throws IOException {
    final Model model =
        Models.fromFile(MAIN, SOURCE_ROOT,
            ImmutableMap.<Prop, Object>of(Prop.INCLUDE_EXTERNAL, false,
                Prop.LOOSE_LINE_MATCH, false),
            Tracers.empty());
    assertThat(model.getStatementsByKind(StatementKind.FACT), hasSize(2));
    assertThat(model.getElementsAtLine(10), hasSize(2));
  }

  @Test
  void testFromFileErrors() {
    final File missing = new File(SOURCE_ROOT, "missing.lp");
    assertThrows(IOException.class, () -> Models.fromFile(missing));
  }

  /** Atoms of an included file do not resolve to symbols of the primary
   * file, even if they start at the same line and column. */
  @Test
  void testIncludedFile() throws IOException {
    final Model model =
        Models.fromFile(new File(SOURCE_ROOT, "include/main.lp"), SOURCE_ROOT);
    assertThat(model.statements, hasSize(1));
    assertThat(model.externalStatements, hasSize(2));
    final Statement local = model.statements.get(0);
    assertThat(local.identifier, is("p/1"));
    assertThat(local.prefix, is("include.main."));

    // "p." in facts.lp starts at 2.1, as does "p(1)." in main.lp
    final Statement p = model.externalStatements.get(0);
    assertThat(p.kind, is(StatementKind.FACT));
    assertThat(p.identifier, is("p/0"));
    assertThat(p.prefix, is("include.facts."));
    final Symbol symbol = p.defines.iterator().next();
    assertThat(symbol.detached, is(true));
    assertThat(symbol.directive, nullValue());
    assertThat(symbol.pos.file, is(p.file()));
    assertThat(symbol.pos, hasToString(p.file() + ":2.1"));
    assertThat(model.getDefiningStatements(Signature.of("p", 0)),
        is(ImmutableList.of(p)));
    assertThat(model.getDefiningStatements(Signature.of("p", 1)),
        is(ImmutableList.of(local)));

    // Statements of included files are in no section, and have no comments
    final Statement q = model.externalStatements.get(1);
    assertThat(q.identifier, is("q/0"));
    assertThat(q.section, nullValue());
    assertThat(model.getSection(q), nullValue());
    assertThat(model.getCommentsAt(p), hasSize(0));
    assertThat(model.getDirectives("section"), hasSize(1));
  }

  /** A program that does not parse gives an error, not an empty model. */
  @Test
  void testParseError() {
    final LpParseException e =
        assertThrows(LpParseException.class,
            () -> Models.fromString("p :- .", "bad.lp", ""));
    assertThat(e.getMessage(), is("unexpected '.'"));
    assertThat(e.pos().file, is("bad.lp"));
  }

  @Test
  void testTracer() throws IOException {
    final List<Statement> statements = new ArrayList<>();
    final List<AnalysisException> warnings = new ArrayList<>();
    final List<Model> models = new ArrayList<>();
    Tracer tracer = Tracers.empty();
    tracer = Tracers.withOnStatement(tracer, statements::add);
    tracer = Tracers.withOnWarnings(tracer, warnings::addAll);
    tracer = Tracers.withOnModel(tracer, models::add);
    final Model model =
        Models.fromFile(MAIN, SOURCE_ROOT, ImmutableMap.of(), tracer);
    assertThat(model.getStatements(true), is(statements));
    assertThat(warnings.isEmpty(), is(true));
    assertThat(models, hasSize(1));
    assertThat(models.get(0), sameInstance(model));

    lp("#program base.")
        .withTracer(Tracers.withOnWarnings(Tracers.empty(), warnings::addAll))
        .model();
    assertThat(warnings, hasSize(1));
    assertThat(warnings.get(0).kind,
        is(AnalysisException.Kind.UNHANDLED_STATEMENT));
  }
}

// End ModelTest.java
