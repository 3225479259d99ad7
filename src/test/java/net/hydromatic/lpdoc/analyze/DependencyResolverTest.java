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
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.hasToString;

import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import net.hydromatic.lpdoc.ast.Ast;
import net.hydromatic.lpdoc.ast.AstNode;
import net.hydromatic.lpdoc.ast.Field;
import net.hydromatic.lpdoc.ast.Op;
import net.hydromatic.lpdoc.parse.Parsers;
import org.junit.jupiter.api.Test;

/** Tests for {@link DependencyResolver} and {@link Context}. */
public class DependencyResolverTest {
  private static DependencyResolver.Resolution resolve(String text) {
    final AstNode node = Parsers.parseString(text, "dep.lp").get(0);
    return new DependencyResolver(Symbol::detached).resolve(node);
  }

  /** Converts symbols to a string of their signatures, in order. */
  private static String signatures(Iterable<Symbol> symbols) {
    final StringBuilder b = new StringBuilder("[");
    for (Symbol symbol : symbols) {
      if (b.length() > 1) {
        b.append(", ");
      }
      b.append(symbol.signature);
    }
    return b.append("]").toString();
  }

  private static void assertResolves(String text, String defines,
      String dependencies) {
    final DependencyResolver.Resolution resolution = resolve(text);
    assertThat(signatures(resolution.defines), is(defines));
    assertThat(signatures(resolution.dependencies), is(dependencies));
    assertThat(resolution.gaps.isEmpty(), is(true));
  }

  @Test
  void testRule() {
    assertResolves("p(X) :- q(X), not r(X).", "[p/1]", "[q/1, r/1]");
    assertResolves("a.", "[a/0]", "[]");
    assertResolves(":- b, c.", "[]", "[b/0, c/0]");
    assertResolves("-p(X) :- q(X).", "[-p/1]", "[q/1]");
  }

  @Test
  void testHeadConditionIsDependency() {
    assertResolves("p(X) : q(X) :- r(X).", "[p/1]", "[q/1, r/1]");
    assertResolves("a ; b : c.", "[a/0, b/0]", "[c/0]");
    assertResolves("{ a; b : c } :- d.", "[a/0, b/0]", "[c/0, d/0]");
    assertResolves("1 { p(X) : q(X) } N :- n(N).", "[p/1]", "[q/1, n/1]");
  }

  @Test
  void testBodyAggregatesAndConditions() {
    assertResolves(":- #count { X : p(X) } > 2, q.", "[]", "[p/1, q/0]");
    assertResolves("all :- ok(X) : item(X).", "[all/0]", "[ok/1, item/1]");
    assertResolves("p :- X = 1, q(X).", "[p/0]", "[q/1]");
  }

  @Test
  void testShowTerm() {
    assertResolves("#show X : p(X), not q(X).", "[]", "[p/1, q/1]");
  }

  /** Each occurrence is a separate symbol, but signatures are merged. */
  @Test
  void testRepeatedAtom() {
    final DependencyResolver.Resolution resolution = resolve("p :- q, q.");
    assertThat(resolution.dependencies.size(), is(2));
    final Set<Signature> signatures =
        resolution.dependencies.stream()
            .map(s -> s.signature)
            .collect(Collectors.toSet());
    assertThat(signatures, hasToString("[q/0]"));
  }

  /** An atom outside any head or body is defined, and reported as a gap. */
  @Test
  void testGap() {
    final DependencyResolver.Resolution resolution =
        resolve("#external q(X) : r(X).");
    assertThat(signatures(resolution.defines), is("[q/1]"));
    assertThat(signatures(resolution.dependencies), is("[r/1]"));
    assertThat(signatures(resolution.gaps), is("[q/1]"));
  }

  /** The resolver maps each atom through the function it is given. */
  @Test
  void testSymbolResolver() {
    final AstNode node = Parsers.parseString("p :- q.", "dep.lp").get(0);
    final Function<Ast.SymbolicAtom, Symbol> resolver =
        atom -> Symbol.of(atom, null);
    final DependencyResolver.Resolution resolution =
        new DependencyResolver(resolver).resolve(node);
    assertThat(resolution.defines.iterator().next().detached, is(false));
    assertThat(resolution.dependencies.iterator().next().detached, is(false));
  }

  @Test
  void testContext() {
    final Context head = Context.ROOT.enter(Field.HEAD);
    assertThat(Context.ROOT.place, is(Context.Place.NONE));
    assertThat(Context.ROOT.role(), is(Context.Role.UNKNOWN));
    assertThat(head.place, is(Context.Place.HEAD));
    assertThat(head.role(), is(Context.Role.DEFINES));

    // The first of head and body wins
    assertThat(head.enter(Field.BODY).place, is(Context.Place.HEAD));
    assertThat(Context.ROOT.enter(Field.BODY).enter(Field.HEAD).place,
        is(Context.Place.BODY));
    assertThat(Context.ROOT.enter(Field.BODY).role(),
        is(Context.Role.DEPENDENCY));

    // A condition in the head is a dependency only beneath a conditional
    // literal
    final Context condition = head.enter(Field.CONDITION);
    assertThat(condition.condition, is(true));
    assertThat(condition.role(), is(Context.Role.DEFINES));
    final AstNode conditional =
        ((Ast.Disjunction)
                ((Ast.Rule) Parsers.parseString("a : b.", "c.lp").get(0))
                    .head)
            .elements.get(0);
    assertThat(conditional.op, is(Op.CONDITIONAL_LITERAL));
    final Context inConditional = head.enter(conditional);
    assertThat(inConditional.conditional, is(true));
    assertThat(inConditional.role(), is(Context.Role.DEFINES));
    assertThat(inConditional.enter(Field.CONDITION).role(),
        is(Context.Role.DEPENDENCY));

    // Contexts are values; entering an irrelevant field changes nothing
    assertThat(head.enter(Field.ARGUMENTS), is(head));
  }
}

// End DependencyResolverTest.java
