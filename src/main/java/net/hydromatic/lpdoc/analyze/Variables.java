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

/** Extracts {@link Variable variables} from the statements of a program. */
public abstract class Variables {
  private Variables() {}

  /**
   * Creates a variable for each variable occurrence in the statements that
   * belong to a given file.
   *
   * <p>Each occurrence is linked to the "var" directive whose first parameter
   * is the variable's name; if several directives name the same variable, the
   * last one wins.
   *
   * @param statements Statements, possibly including some from other files
   * @param varDirectives Directives of kind "var"
   * @param file File whose statements to scan
   * @return Variables in source order
   */
  public static ImmutableList<Variable> extract(
      List<AstNode> statements, List<Directive> varDirectives, String file) {
    final Map<String, Directive> directiveMap = new HashMap<>();
    for (Directive directive : varDirectives) {
      final String name = directive.name();
      if (name != null) {
        directiveMap.put(name, directive);
      }
    }
    final ImmutableList.Builder<Variable> variables = ImmutableList.builder();
    for (AstNode statement : statements) {
      if (statement.pos.file.equals(file)) {
        extract(statement, directiveMap, variables);
      }
    }
    return variables.build();
  }

  private static void extract(
      AstNode node,
      Map<String, Directive> directiveMap,
      ImmutableList.Builder<Variable> variables) {
    if (node.op == Op.VARIABLE) {
      final Ast.Variable variable = (Ast.Variable) node;
      variables.add(new Variable(variable, directiveMap.get(variable.name)));
      return;
    }
    node.forEachChild(child -> extract(child, directiveMap, variables));
  }
}

// End Variables.java
