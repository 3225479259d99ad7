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

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /**
   * The singleton instance of the AST builder. The short name is convenient for
   * use via 'import static', but checkstyle does not approve.
   */
  // CHECKSTYLE: IGNORE 1
  ast;

  // statements

  public Ast.Rule rule(Pos pos, @Nullable AstNode head, List<AstNode> body) {
    return new Ast.Rule(pos, head, body);
  }

  /** Creates a fact, a rule with an empty body. */
  public Ast.Rule fact(Pos pos, AstNode head) {
    return new Ast.Rule(pos, head, ImmutableList.of());
  }

  /** Creates a constraint, a rule without a head. */
  public Ast.Rule constraint(Pos pos, List<AstNode> body) {
    return new Ast.Rule(pos, null, body);
  }

  public Ast.Definition definition(
      Pos pos, String name, AstNode value, boolean isDefault) {
    return new Ast.Definition(pos, name, value, isDefault);
  }

  public Ast.Defined defined(Pos pos, String name, int arity, boolean positive) {
    return new Ast.Defined(pos, name, arity, positive);
  }

  public Ast.ShowSignature showSignature(
      Pos pos, String name, int arity, boolean positive) {
    return new Ast.ShowSignature(pos, name, arity, positive);
  }

  public Ast.ShowTerm showTerm(Pos pos, AstNode term, List<AstNode> body) {
    return new Ast.ShowTerm(pos, term, body);
  }

  public Ast.Program program(Pos pos, String name, List<String> parameters) {
    return new Ast.Program(pos, name, parameters);
  }

  public Ast.External external(
      Pos pos,
      Ast.SymbolicAtom atom,
      List<AstNode> body,
      @Nullable AstNode externalType) {
    return new Ast.External(pos, atom, body, externalType);
  }

  public Ast.Minimize minimize(
      Pos pos,
      AstNode weight,
      @Nullable AstNode priority,
      List<AstNode> terms,
      List<AstNode> body) {
    return new Ast.Minimize(pos, weight, priority, terms, body);
  }

  // literals and atoms

  public Ast.Literal literal(Pos pos, Ast.Sign sign, AstNode atom) {
    return new Ast.Literal(pos, sign, atom);
  }

  /** Creates a positive literal whose atom is a symbolic atom. */
  public Ast.Literal atomLiteral(Ast.SymbolicAtom atom) {
    return new Ast.Literal(atom.pos, Ast.Sign.NONE, atom);
  }

  public Ast.SymbolicAtom symbolicAtom(Ast.Function symbol) {
    return new Ast.SymbolicAtom(symbol.pos, symbol);
  }

  /** Creates a symbolic atom from a name and arguments. */
  public Ast.SymbolicAtom symbolicAtom(
      Pos pos, String name, List<AstNode> arguments) {
    return symbolicAtom(function(pos, name, arguments));
  }

  public Ast.BooleanConstant booleanConstant(Pos pos, boolean value) {
    return new Ast.BooleanConstant(pos, value);
  }

  public Ast.Comparison comparison(
      Pos pos, AstNode left, Ast.Relation relation, AstNode right) {
    return new Ast.Comparison(pos, left, relation, right);
  }

  public Ast.ConditionalLiteral conditionalLiteral(
      Pos pos, Ast.Literal literal, List<Ast.Literal> condition) {
    return new Ast.ConditionalLiteral(pos, literal, condition);
  }

  public Ast.Disjunction disjunction(
      Pos pos, List<Ast.ConditionalLiteral> elements) {
    return new Ast.Disjunction(pos, elements);
  }

  public Ast.Guard guard(Pos pos, Ast.Relation relation, AstNode term) {
    return new Ast.Guard(pos, relation, term);
  }

  public Ast.Aggregate aggregate(
      Pos pos,
      Ast.@Nullable Guard leftGuard,
      List<Ast.ConditionalLiteral> elements,
      Ast.@Nullable Guard rightGuard) {
    return new Ast.Aggregate(pos, leftGuard, elements, rightGuard);
  }

  public Ast.BodyAggregateElement bodyAggregateElement(
      Pos pos, List<AstNode> terms, List<Ast.Literal> condition) {
    return new Ast.BodyAggregateElement(pos, terms, condition);
  }

  public Ast.BodyAggregate bodyAggregate(
      Pos pos,
      Ast.@Nullable Guard leftGuard,
      Ast.AggregateFunction function,
      List<Ast.BodyAggregateElement> elements,
      Ast.@Nullable Guard rightGuard) {
    return new Ast.BodyAggregate(pos, leftGuard, function, elements, rightGuard);
  }

  // terms

  public Ast.Variable variable(Pos pos, String name) {
    return new Ast.Variable(pos, name);
  }

  public Ast.SymbolicTerm number(Pos pos, int value) {
    return new Ast.SymbolicTerm(pos, Ast.TermType.NUMBER, value);
  }

  public Ast.SymbolicTerm string(Pos pos, String value) {
    return new Ast.SymbolicTerm(pos, Ast.TermType.STRING, value);
  }

  public Ast.SymbolicTerm supremum(Pos pos) {
    return new Ast.SymbolicTerm(pos, Ast.TermType.SUPREMUM, "#sup");
  }

  public Ast.SymbolicTerm infimum(Pos pos) {
    return new Ast.SymbolicTerm(pos, Ast.TermType.INFIMUM, "#inf");
  }

  public Ast.Function function(Pos pos, String name, List<AstNode> arguments) {
    return new Ast.Function(pos, name, arguments);
  }

  /** Creates a constant term, a function with no arguments. */
  public Ast.Function constant(Pos pos, String name) {
    return new Ast.Function(pos, name, ImmutableList.of());
  }

  public Ast.Function tuple(Pos pos, List<AstNode> arguments) {
    return new Ast.Function(pos, "", arguments);
  }

  public Ast.UnaryOperation unaryOperation(
      Pos pos, Ast.UnaryOperator operator, AstNode argument) {
    return new Ast.UnaryOperation(pos, operator, argument);
  }

  public Ast.BinaryOperation binaryOperation(
      Pos pos, Ast.BinaryOperator operator, AstNode left, AstNode right) {
    return new Ast.BinaryOperation(pos, operator, left, right);
  }

  public Ast.Interval interval(Pos pos, AstNode left, AstNode right) {
    return new Ast.Interval(pos, left, right);
  }
}

// End AstBuilder.java
