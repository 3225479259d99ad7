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

/**
 * Semantic analysis of answer set programs.
 *
 * <p>This package classifies the statements of a parsed program, works out
 * which predicates each statement defines and depends on, and links the
 * statements to the documentation written in the program's comments.
 *
 * <h2>Key Classes</h2>
 *
 * <ul>
 *   <li>{@link net.hydromatic.lpdoc.analyze.Models} - Main entry point. Reads
 *       and parses a file and the files it includes, and builds a model.
 *   <li>{@link net.hydromatic.lpdoc.analyze.Model} - The analyzed program, with
 *       queries by kind, line, section and predicate.
 *   <li>{@link net.hydromatic.lpdoc.analyze.DependencyResolver} - Walks a
 *       statement and decides, from the position of each atom, whether the
 *       statement defines it or depends on it.
 *   <li>{@link net.hydromatic.lpdoc.analyze.StatementFactory} - Assigns each
 *       statement a {@link net.hydromatic.lpdoc.analyze.StatementKind} and an
 *       identifier.
 * </ul>
 *
 * <h2>Example</h2>
 *
 * <pre>{@code
 * Model model = Models.fromFile(new File("src/lp/graph.lp"), "src/lp");
 * for (Statement s : model.getStatementsByKind(StatementKind.RULE)) {
 *   System.out.println(s.qualifiedIdentifier() + " " + s.dependencies);
 * }
 * }</pre>
 */
package net.hydromatic.lpdoc.analyze;
