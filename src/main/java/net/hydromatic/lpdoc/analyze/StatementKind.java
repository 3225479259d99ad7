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

/** Kind of {@link Statement}. */
public enum StatementKind {
  /** Rule that defines atoms in terms of other atoms, "{@code p :- q.}". */
  RULE,
  /** Rule with no head, "{@code :- p, q.}". */
  CONSTRAINT,
  /** Rule that defines atoms and depends on none, "{@code p.}". */
  FACT,
  /** Constant definition, "{@code #const n = 3.}". */
  DEFINITION,
  /** Declaration of a predicate supplied from outside, "{@code #defined p/1.}". */
  INPUT,
  /** Named constant. Never produced by classification. */
  CONSTANT,
  /** Show directive, "{@code #show p/1.}". */
  OUTPUT
}

// End StatementKind.java
