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

import java.util.Objects;
import net.hydromatic.lpdoc.ast.Ast;
import net.hydromatic.lpdoc.ast.Located;
import net.hydromatic.lpdoc.ast.Pos;
import net.hydromatic.lpdoc.doc.Directive;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Reference to an atomic proposition at a location in a program.
 *
 * <p>A symbol is identified by its {@link Key}: its name and the line and
 * column where it starts. Symbols in different statements that have the same
 * {@link #signature} refer to the same predicate.
 */
public class Symbol implements Located {
  public final String name;
  public final Pos pos;
  public final Signature signature;
  public final Ast.SymbolicAtom atom;
  /** The "predicate" directive that documents this symbol's predicate. */
  public final @Nullable Directive directive;
  /**
   * Whether this symbol was synthesized because an atom was not found in a
   * model's symbol index.
   */
  public final boolean detached;

  private Symbol(
      Ast.SymbolicAtom atom, @Nullable Directive directive, boolean detached) {
    this.atom = requireNonNull(atom);
    this.name = atom.symbol.name;
    this.pos = atom.symbol.pos;
    this.signature = Signature.of(atom.name(), atom.arity());
    this.directive = directive;
    this.detached = detached;
  }

  /** Creates a symbol for an atom, linked to an optional directive. */
  public static Symbol of(Ast.SymbolicAtom atom, @Nullable Directive directive) {
    return new Symbol(atom, directive, false);
  }

  /**
   * Creates a placeholder symbol for an atom that has no entry in an index. It
   * has the same key as the atom but no directive.
   */
  public static Symbol detached(Ast.SymbolicAtom atom) {
    return new Symbol(atom, null, true);
  }

  @Override
  public Pos pos() {
    return pos;
  }

  /** Returns the key by which this symbol is indexed. */
  public Key key() {
    return new Key(name, pos.startLine, pos.startColumn);
  }

  /** Returns the description from this symbol's directive, if any. */
  public @Nullable String description() {
    return directive == null ? null : directive.description();
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, pos.startLine, pos.startColumn);
  }

  @Override
  public boolean equals(Object o) {
    return o == this
        || o instanceof Symbol
            && name.equals(((Symbol) o).name)
            && pos.startLine == ((Symbol) o).pos.startLine
            && pos.startColumn == ((Symbol) o).pos.startColumn;
  }

  @Override
  public String toString() {
    return signature.toString();
  }

  /** Index key of a symbol: name, start line and start column. */
  public static class Key {
    public final String name;
    public final int line;
    public final int column;

    public Key(String name, int line, int column) {
      this.name = requireNonNull(name);
      this.line = line;
      this.column = column;
    }

    /** Returns the key of the symbol that an atom would have. */
    public static Key of(Ast.SymbolicAtom atom) {
      return new Key(
          atom.symbol.name,
          atom.symbol.pos.startLine,
          atom.symbol.pos.startColumn);
    }

    @Override
    public int hashCode() {
      return Objects.hash(name, line, column);
    }

    @Override
    public boolean equals(Object o) {
      return o == this
          || o instanceof Key
              && name.equals(((Key) o).name)
              && line == ((Key) o).line
              && column == ((Key) o).column;
    }

    @Override
    public String toString() {
      return name + "@" + line + ":" + column;
    }
  }
}

// End Symbol.java
