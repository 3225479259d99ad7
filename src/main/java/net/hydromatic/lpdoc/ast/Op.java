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
package net.hydromatic.lpdoc.ast;

/** Sub-types of {@link AstNode}. */
public enum Op {
  // statements
  RULE,
  DEFINITION,
  DEFINED,
  SHOW_SIGNATURE,
  SHOW_TERM,
  PROGRAM,
  EXTERNAL,
  MINIMIZE,

  // literals and atoms
  LITERAL,
  SYMBOLIC_ATOM,
  BOOLEAN_CONSTANT,
  COMPARISON,
  CONDITIONAL_LITERAL,
  DISJUNCTION,
  AGGREGATE,
  BODY_AGGREGATE,
  BODY_AGGREGATE_ELEMENT,
  GUARD,

  // terms
  VARIABLE,
  SYMBOLIC_TERM,
  FUNCTION,
  UNARY_OPERATION,
  BINARY_OPERATION,
  INTERVAL;

  /** Whether this kind of node can occur as a top-level statement. */
  public boolean isStatement() {
    switch (this) {
      case RULE:
      case DEFINITION:
      case DEFINED:
      case SHOW_SIGNATURE:
      case SHOW_TERM:
      case PROGRAM:
      case EXTERNAL:
      case MINIMIZE:
        return true;
      default:
        return false;
    }
  }
}

// End Op.java
