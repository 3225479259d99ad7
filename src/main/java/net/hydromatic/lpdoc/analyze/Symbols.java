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

import com.google.common.collect.ImmutableList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.lpdoc.ast.Ast;
import net.hydromatic.lpdoc.ast.AstNode;
import net.hydromatic.lpdoc.ast.Op;
import net.hydromatic.lpdoc.doc.Directive;

/** Extracts {@link Symbol symbols} from the statements of a program. */
public abstract class Symbols {
  private Symbols() {}

  /**
   * Creates a symbol for each symbolic atom in the statements that belong to
   * a given file.
   *
   * <p>A symbol is linked to the "predicate" directive whose first parameter
   * is the symbol's signature (such as "edge/2") or, failing that, its name.
   *
   * @param statements Statements, possibly including some from other files
   * @param predicateDirectives Directives of kind "predicate"
   * @param file File whose statements to scan
   * @return Symbols in source order
   */
  public static ImmutableList<Symbol> extract(
      List<AstNode> statements, List<Directive> predicateDirectives, String file) {
    final Map<String, Directive> directiveMap = new HashMap<>();
    for (Directive directive : predicateDirectives) {
      final String name = directive.name();
      if (name != null) {
        directiveMap.put(name, directive);
      }
    }
    final ImmutableList.Builder<Symbol> symbols = ImmutableList.builder();
    for (AstNode statement : statements) {
      if (statement.pos.file.equals(file)) {
        extract(statement, directiveMap, symbols);
      }
    }
    return symbols.build();
  }

  private static void extract(
      AstNode node,
      Map<String, Directive> directiveMap,
      ImmutableList.Builder<Symbol> symbols) {
    if (node.op == Op.SYMBOLIC_ATOM) {
      final Ast.SymbolicAtom atom = (Ast.SymbolicAtom) node;
      final Signature signature = Signature.of(atom.name(), atom.arity());
      Directive directive = directiveMap.get(signature.toString());
      if (directive == null) {
        directive = directiveMap.get(atom.name());
      }
      symbols.add(Symbol.of(atom, directive));
      return;
    }
    node.forEachChild(child -> extract(child, directiveMap, symbols));
  }
}

// End Symbols.java
