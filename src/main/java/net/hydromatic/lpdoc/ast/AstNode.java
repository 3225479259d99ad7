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

import static java.util.Objects.requireNonNull;

import java.util.List;
import java.util.function.Consumer;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Abstract syntax tree node. */
public abstract class AstNode implements Located {
  public final Pos pos;
  public final Op op;

  protected AstNode(Pos pos, Op op) {
    this.pos = requireNonNull(pos);
    this.op = requireNonNull(op);
  }

  @Override
  public Pos pos() {
    return pos;
  }

  /**
   * Converts this node into source text.
   *
   * <p>The purpose of this string is debugging and display; it is not
   * guaranteed to reproduce the original layout.
   */
  @Override
  public final String toString() {
    // Marked final because you should override unparse, not toString
    return unparse(new AstWriter()).toString();
  }

  abstract AstWriter unparse(AstWriter w);

  /**
   * Calls a visitor for each structural field of this node that is present
   * and non-empty. Terminal nodes have no fields.
   */
  public void forEachField(FieldVisitor visitor) {}

  /** Calls a consumer for each child of this node, ignoring field names. */
  public void forEachChild(Consumer<AstNode> consumer) {
    forEachField(
        new FieldVisitor() {
          @Override
          public void field(Field field, AstNode child) {
            consumer.accept(child);
          }

          @Override
          public void sequence(Field field, List<? extends AstNode> children) {
            children.forEach(consumer);
          }
        });
  }

  /** Helper for {@link #forEachField}; skips a null child. */
  static void visit(FieldVisitor visitor, Field field, @Nullable AstNode node) {
    if (node != null) {
      visitor.field(field, node);
    }
  }

  /** Helper for {@link #forEachField}; skips an empty sequence. */
  static void visitAll(
      FieldVisitor visitor, Field field, List<? extends AstNode> nodes) {
    if (!nodes.isEmpty()) {
      visitor.sequence(field, nodes);
    }
  }
}

// End AstNode.java
