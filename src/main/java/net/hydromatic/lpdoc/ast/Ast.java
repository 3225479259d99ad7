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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Various sub-classes of AST nodes for logic programs.
 *
 * <p>A program is a list of statements; see {@link Op#isStatement()}. Nodes
 * are created via {@link AstBuilder}.
 */
public class Ast {
  private Ast() {}

  /** Sign of a literal. */
  public enum Sign {
    NONE(""),
    NEGATION("not "),
    DOUBLE_NEGATION("not not ");

    public final String prefix;

    Sign(String prefix) {
      this.prefix = prefix;
    }
  }

  /** Comparison relation, used in comparisons and aggregate guards. */
  public enum Relation {
    EQ("="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">=");

    public final String symbol;

    Relation(String symbol) {
      this.symbol = symbol;
    }
  }

  /** Unary operator in a term. */
  public enum UnaryOperator {
    MINUS("-"),
    NEGATION("~");

    public final String symbol;

    UnaryOperator(String symbol) {
      this.symbol = symbol;
    }
  }

  /** Binary operator in a term. */
  public enum BinaryOperator {
    PLUS("+"),
    MINUS("-"),
    TIMES("*"),
    DIVIDE("/"),
    MODULO("\\"),
    POWER("**"),
    AND("&"),
    OR("?"),
    XOR("^");

    public final String symbol;

    BinaryOperator(String symbol) {
      this.symbol = symbol;
    }
  }

  /** Aggregate function in a body aggregate. */
  public enum AggregateFunction {
    COUNT("#count"),
    SUM("#sum"),
    SUMP("#sum+"),
    MIN("#min"),
    MAX("#max");

    public final String symbol;

    AggregateFunction(String symbol) {
      this.symbol = symbol;
    }
  }

  /** Kind of value held by a {@link SymbolicTerm}. */
  public enum TermType {
    NUMBER,
    STRING,
    SUPREMUM,
    INFIMUM
  }

  /**
   * Rule, fact or constraint.
   *
   * <p>For example, "{@code p(X) :- q(X), not r(X).}". A constraint has no
   * head; a fact has an empty body.
   */
  public static class Rule extends AstNode {
    public final @Nullable AstNode head;
    public final List<AstNode> body;

    Rule(Pos pos, @Nullable AstNode head, List<AstNode> body) {
      super(pos, Op.RULE);
      this.head = head;
      this.body = ImmutableList.copyOf(body);
      checkArgument(head != null || !body.isEmpty(), "empty rule");
    }

    @Override
    public void forEachField(FieldVisitor visitor) {
      visit(visitor, Field.HEAD, head);
      visitAll(visitor, Field.BODY, body);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      if (head != null) {
        w.append(head);
      }
      if (!body.isEmpty()) {
        w.append(head == null ? ":- " : " :- ").appendAll(body, ", ");
      }
      return w.append(".");
    }
  }

  /** Literal: an atom with an optional default negation. */
  public static class Literal extends AstNode {
    public final Sign sign;
    public final AstNode atom;

    Literal(Pos pos, Sign sign, AstNode atom) {
      super(pos, Op.LITERAL);
      this.sign = requireNonNull(sign);
      this.atom = requireNonNull(atom);
    }

    @Override
    public void forEachField(FieldVisitor visitor) {
      visit(visitor, Field.ATOM, atom);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(sign.prefix).append(atom);
    }
  }

  /**
   * Reference to an atomic proposition, such as "{@code p(X, 1)}" or "{@code
   * -q}".
   */
  public static class SymbolicAtom extends AstNode {
    public final Function symbol;

    SymbolicAtom(Pos pos, Function symbol) {
      super(pos, Op.SYMBOLIC_ATOM);
      this.symbol = requireNonNull(symbol);
    }

    /** Returns the name of the predicate, including any classical negation. */
    public String name() {
      return symbol.name;
    }

    public int arity() {
      return symbol.arguments.size();
    }

    @Override
    public void forEachField(FieldVisitor visitor) {
      visit(visitor, Field.SYMBOL, symbol);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(symbol);
    }
  }

  /** Boolean constant, "{@code #true}" or "{@code #false}". */
  public static class BooleanConstant extends AstNode {
    public final boolean value;

    BooleanConstant(Pos pos, boolean value) {
      super(pos, Op.BOOLEAN_CONSTANT);
      this.value = value;
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(value ? "#true" : "#false");
    }
  }

  /** Comparison between two terms, such as "{@code X < Y + 1}". */
  public static class Comparison extends AstNode {
    public final AstNode left;
    public final Relation relation;
    public final AstNode right;

    Comparison(Pos pos, AstNode left, Relation relation, AstNode right) {
      super(pos, Op.COMPARISON);
      this.left = requireNonNull(left);
      this.relation = requireNonNull(relation);
      this.right = requireNonNull(right);
    }

    @Override
    public void forEachField(FieldVisitor visitor) {
      visit(visitor, Field.LEFT, left);
      visit(visitor, Field.RIGHT, right);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(left)
          .append(" ")
          .append(relation.symbol)
          .append(" ")
          .append(right);
    }
  }

  /**
   * Conditional literal, such as "{@code p(X) : q(X), r(X)}".
   *
   * <p>The literal is the part before the colon; the condition is the list of
   * literals after it, and may be empty.
   */
  public static class ConditionalLiteral extends AstNode {
    public final Literal literal;
    public final List<Literal> condition;

    ConditionalLiteral(Pos pos, Literal literal, List<Literal> condition) {
      super(pos, Op.CONDITIONAL_LITERAL);
      this.literal = requireNonNull(literal);
      this.condition = ImmutableList.copyOf(condition);
    }

    @Override
    public void forEachField(FieldVisitor visitor) {
      visit(visitor, Field.LITERAL, literal);
      visitAll(visitor, Field.CONDITION, condition);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(literal).condition(" : ", condition);
    }
  }

  /** Disjunctive head, such as "{@code a ; b : c}". */
  public static class Disjunction extends AstNode {
    public final List<ConditionalLiteral> elements;

    Disjunction(Pos pos, List<ConditionalLiteral> elements) {
      super(pos, Op.DISJUNCTION);
      this.elements = ImmutableList.copyOf(elements);
    }

    @Override
    public void forEachField(FieldVisitor visitor) {
      visitAll(visitor, Field.ELEMENTS, elements);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.appendAll(elements, " ; ");
    }
  }

  /** Guard of an aggregate, such as "{@code 1 <=}" or "{@code < N}". */
  public static class Guard extends AstNode {
    public final Relation relation;
    public final AstNode term;

    Guard(Pos pos, Relation relation, AstNode term) {
      super(pos, Op.GUARD);
      this.relation = requireNonNull(relation);
      this.term = requireNonNull(term);
    }

    @Override
    public void forEachField(FieldVisitor visitor) {
      visit(visitor, Field.TERM, term);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(relation.symbol).append(" ").append(term);
    }
  }

  /** Choice aggregate, such as "{@code 1 { p(X) : q(X) } 2}". */
  public static class Aggregate extends AstNode {
    public final @Nullable Guard leftGuard;
    public final List<ConditionalLiteral> elements;
    public final @Nullable Guard rightGuard;

    Aggregate(
        Pos pos,
        @Nullable Guard leftGuard,
        List<ConditionalLiteral> elements,
        @Nullable Guard rightGuard) {
      super(pos, Op.AGGREGATE);
      this.leftGuard = leftGuard;
      this.elements = ImmutableList.copyOf(elements);
      this.rightGuard = rightGuard;
    }

    @Override
    public void forEachField(FieldVisitor visitor) {
      visit(visitor, Field.LEFT_GUARD, leftGuard);
      visitAll(visitor, Field.ELEMENTS, elements);
      visit(visitor, Field.RIGHT_GUARD, rightGuard);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      if (leftGuard != null) {
        w.append(leftGuard.term).append(" ").append(leftGuard.relation.symbol);
        w.append(" ");
      }
      w.append("{ ").appendAll(elements, "; ").append(" }");
      if (rightGuard != null) {
        w.append(" ").append(rightGuard);
      }
      return w;
    }
  }

  /** Element of a body aggregate, such as "{@code W, X : p(X, W)}". */
  public static class BodyAggregateElement extends AstNode {
    public final List<AstNode> terms;
    public final List<Literal> condition;

    BodyAggregateElement(Pos pos, List<AstNode> terms, List<Literal> condition) {
      super(pos, Op.BODY_AGGREGATE_ELEMENT);
      this.terms = ImmutableList.copyOf(terms);
      this.condition = ImmutableList.copyOf(condition);
    }

    @Override
    public void forEachField(FieldVisitor visitor) {
      visitAll(visitor, Field.TERMS, terms);
      visitAll(visitor, Field.CONDITION, condition);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.appendAll(terms, ", ").condition(" : ", condition);
    }
  }

  /** Body aggregate, such as "{@code #count { X : p(X) } > 2}". */
  public static class BodyAggregate extends AstNode {
    public final @Nullable Guard leftGuard;
    public final AggregateFunction function;
    public final List<BodyAggregateElement> elements;
    public final @Nullable Guard rightGuard;

    BodyAggregate(
        Pos pos,
        @Nullable Guard leftGuard,
        AggregateFunction function,
        List<BodyAggregateElement> elements,
        @Nullable Guard rightGuard) {
      super(pos, Op.BODY_AGGREGATE);
      this.leftGuard = leftGuard;
      this.function = requireNonNull(function);
      this.elements = ImmutableList.copyOf(elements);
      this.rightGuard = rightGuard;
    }

    @Override
    public void forEachField(FieldVisitor visitor) {
      visit(visitor, Field.LEFT_GUARD, leftGuard);
      visitAll(visitor, Field.ELEMENTS, elements);
      visit(visitor, Field.RIGHT_GUARD, rightGuard);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      if (leftGuard != null) {
        w.append(leftGuard.term).append(" ").append(leftGuard.relation.symbol);
        w.append(" ");
      }
      w.append(function.symbol)
          .append(" { ")
          .appendAll(elements, "; ")
          .append(" }");
      if (rightGuard != null) {
        w.append(" ").append(rightGuard);
      }
      return w;
    }
  }

  /** Variable, such as "{@code X}" or the anonymous "{@code _}". */
  public static class Variable extends AstNode {
    public final String name;

    Variable(Pos pos, String name) {
      super(pos, Op.VARIABLE);
      this.name = requireNonNull(name);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(name);
    }
  }

  /** Number, string, or one of the special terms {@code #sup} and {@code #inf}. */
  public static class SymbolicTerm extends AstNode {
    public final TermType type;
    public final Object value;

    SymbolicTerm(Pos pos, TermType type, Object value) {
      super(pos, Op.SYMBOLIC_TERM);
      this.type = requireNonNull(type);
      this.value = requireNonNull(value);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      switch (type) {
        case STRING:
          return w.append("\"").append(value.toString()).append("\"");
        case SUPREMUM:
          return w.append("#sup");
        case INFIMUM:
          return w.append("#inf");
        default:
          return w.append(value.toString());
      }
    }
  }

  /**
   * Function term, such as "{@code f(X, 1)}", a constant "{@code a}", or a
   * tuple "{@code (X, Y)}" (whose name is empty).
   */
  public static class Function extends AstNode {
    public final String name;
    public final List<AstNode> arguments;

    Function(Pos pos, String name, List<AstNode> arguments) {
      super(pos, Op.FUNCTION);
      this.name = requireNonNull(name);
      this.arguments = ImmutableList.copyOf(arguments);
    }

    public boolean isTuple() {
      return name.isEmpty();
    }

    @Override
    public void forEachField(FieldVisitor visitor) {
      visitAll(visitor, Field.ARGUMENTS, arguments);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      w.append(name);
      if (!arguments.isEmpty() || isTuple()) {
        w.append("(").appendAll(arguments, ",");
        if (isTuple() && arguments.size() == 1) {
          w.append(",");
        }
        w.append(")");
      }
      return w;
    }
  }

  /** Unary operation in a term, such as "{@code -X}". */
  public static class UnaryOperation extends AstNode {
    public final UnaryOperator operator;
    public final AstNode argument;

    UnaryOperation(Pos pos, UnaryOperator operator, AstNode argument) {
      super(pos, Op.UNARY_OPERATION);
      this.operator = requireNonNull(operator);
      this.argument = requireNonNull(argument);
    }

    @Override
    public void forEachField(FieldVisitor visitor) {
      visit(visitor, Field.ARGUMENT, argument);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(operator.symbol).append(argument);
    }
  }

  /** Binary operation in a term, such as "{@code N + 1}". */
  public static class BinaryOperation extends AstNode {
    public final BinaryOperator operator;
    public final AstNode left;
    public final AstNode right;

    BinaryOperation(
        Pos pos, BinaryOperator operator, AstNode left, AstNode right) {
      super(pos, Op.BINARY_OPERATION);
      this.operator = requireNonNull(operator);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    public void forEachField(FieldVisitor visitor) {
      visit(visitor, Field.LEFT, left);
      visit(visitor, Field.RIGHT, right);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("(")
          .append(left)
          .append(operator.symbol)
          .append(right)
          .append(")");
    }
  }

  /** Interval term, such as "{@code 1..N}". */
  public static class Interval extends AstNode {
    public final AstNode left;
    public final AstNode right;

    Interval(Pos pos, AstNode left, AstNode right) {
      super(pos, Op.INTERVAL);
      this.left = requireNonNull(left);
      this.right = requireNonNull(right);
    }

    @Override
    public void forEachField(FieldVisitor visitor) {
      visit(visitor, Field.LEFT, left);
      visit(visitor, Field.RIGHT, right);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append(left).append("..").append(right);
    }
  }

  /** Constant definition, such as "{@code #const n = 10.}". */
  public static class Definition extends AstNode {
    public final String name;
    public final AstNode value;
    public final boolean isDefault;

    Definition(Pos pos, String name, AstNode value, boolean isDefault) {
      super(pos, Op.DEFINITION);
      this.name = requireNonNull(name);
      this.value = requireNonNull(value);
      this.isDefault = isDefault;
    }

    @Override
    public void forEachField(FieldVisitor visitor) {
      visit(visitor, Field.VALUE, value);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      w.append("#const ").append(name).append(" = ").append(value).append(".");
      return isDefault ? w : w.append(" [override]");
    }
  }

  /** Declaration that a predicate is defined elsewhere, "{@code #defined p/1.}". */
  public static class Defined extends AstNode {
    public final String name;
    public final int arity;
    public final boolean positive;

    Defined(Pos pos, String name, int arity, boolean positive) {
      super(pos, Op.DEFINED);
      this.name = requireNonNull(name);
      this.arity = arity;
      this.positive = positive;
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("#defined ")
          .append(positive ? "" : "-")
          .append(name)
          .append("/")
          .append(Integer.toString(arity))
          .append(".");
    }
  }

  /**
   * Show directive by signature, such as "{@code #show p/2.}"; the bare
   * "{@code #show.}" has an empty name and arity 0.
   */
  public static class ShowSignature extends AstNode {
    public final String name;
    public final int arity;
    public final boolean positive;

    ShowSignature(Pos pos, String name, int arity, boolean positive) {
      super(pos, Op.SHOW_SIGNATURE);
      this.name = requireNonNull(name);
      this.arity = arity;
      this.positive = positive;
    }

    @Override
    AstWriter unparse(AstWriter w) {
      if (name.isEmpty()) {
        return w.append("#show.");
      }
      return w.append("#show ")
          .append(positive ? "" : "-")
          .append(name)
          .append("/")
          .append(Integer.toString(arity))
          .append(".");
    }
  }

  /** Show directive by term, such as "{@code #show X : p(X).}". */
  public static class ShowTerm extends AstNode {
    public final AstNode term;
    public final List<AstNode> body;

    ShowTerm(Pos pos, AstNode term, List<AstNode> body) {
      super(pos, Op.SHOW_TERM);
      this.term = requireNonNull(term);
      this.body = ImmutableList.copyOf(body);
    }

    @Override
    public void forEachField(FieldVisitor visitor) {
      visit(visitor, Field.TERM, term);
      visitAll(visitor, Field.BODY, body);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      return w.append("#show ")
          .append(term)
          .condition(" : ", body)
          .append(".");
    }
  }

  /** Program part, such as "{@code #program step(t).}". */
  public static class Program extends AstNode {
    public final String name;
    public final List<String> parameters;

    Program(Pos pos, String name, List<String> parameters) {
      super(pos, Op.PROGRAM);
      this.name = requireNonNull(name);
      this.parameters = ImmutableList.copyOf(parameters);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      w.append("#program ").append(name);
      if (!parameters.isEmpty()) {
        w.append("(").append(String.join(",", parameters)).append(")");
      }
      return w.append(".");
    }
  }

  /** External declaration, such as "{@code #external p(X) : q(X).}". */
  public static class External extends AstNode {
    public final SymbolicAtom atom;
    public final List<AstNode> body;
    public final @Nullable AstNode externalType;

    External(
        Pos pos,
        SymbolicAtom atom,
        List<AstNode> body,
        @Nullable AstNode externalType) {
      super(pos, Op.EXTERNAL);
      this.atom = requireNonNull(atom);
      this.body = ImmutableList.copyOf(body);
      this.externalType = externalType;
    }

    @Override
    public void forEachField(FieldVisitor visitor) {
      visit(visitor, Field.ATOM, atom);
      visitAll(visitor, Field.BODY, body);
      visit(visitor, Field.EXTERNAL_TYPE, externalType);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      w.append("#external ").append(atom).condition(" : ", body).append(".");
      if (externalType != null) {
        w.append(" [").append(externalType).append("]");
      }
      return w;
    }
  }

  /**
   * One element of an optimization statement, such as the element "{@code
   * W@1, X : cost(X, W)}" of "{@code #minimize { W@1, X : cost(X, W) }.}".
   *
   * <p>A {@code #maximize} element is represented with a negated weight.
   */
  public static class Minimize extends AstNode {
    public final AstNode weight;
    public final @Nullable AstNode priority;
    public final List<AstNode> terms;
    public final List<AstNode> body;

    Minimize(
        Pos pos,
        AstNode weight,
        @Nullable AstNode priority,
        List<AstNode> terms,
        List<AstNode> body) {
      super(pos, Op.MINIMIZE);
      this.weight = requireNonNull(weight);
      this.priority = priority;
      this.terms = ImmutableList.copyOf(terms);
      this.body = ImmutableList.copyOf(body);
    }

    @Override
    public void forEachField(FieldVisitor visitor) {
      visit(visitor, Field.WEIGHT, weight);
      visit(visitor, Field.PRIORITY, priority);
      visitAll(visitor, Field.TERMS, terms);
      visitAll(visitor, Field.BODY, body);
    }

    @Override
    AstWriter unparse(AstWriter w) {
      w.append("#minimize { ").append(weight);
      if (priority != null) {
        w.append("@").append(priority);
      }
      if (!terms.isEmpty()) {
        w.append(", ").appendAll(terms, ", ");
      }
      return w.condition(" : ", body).append(" }.");
    }
  }
}

// End Ast.java
