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

import java.util.List;

/**
 * Receives the non-empty structural fields of an {@link AstNode}, in the
 * order in which they occur in the node.
 *
 * @see AstNode#forEachField(FieldVisitor)
 */
public interface FieldVisitor {
  /** Called for a field that holds a single child. */
  void field(Field field, AstNode child);

  /** Called for a field that holds a non-empty sequence of children. */
  void sequence(Field field, List<? extends AstNode> children);
}

// End FieldVisitor.java
