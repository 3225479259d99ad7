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
package net.hydromatic.lpdoc.doc;

import static java.util.Objects.requireNonNull;

import net.hydromatic.lpdoc.ast.Located;
import net.hydromatic.lpdoc.ast.Pos;

/**
 * Comment in a logic program.
 *
 * <p>A line comment starts with "{@code %}" and runs to the end of the line; a
 * block comment starts with "{@code %*}" and ends with "{@code *%}".
 */
public class Comment implements Located {
  public final Pos pos;
  public final boolean block;
  public final String content;

  public Comment(Pos pos, boolean block, String content) {
    this.pos = requireNonNull(pos);
    this.block = block;
    this.content = requireNonNull(content);
  }

  @Override
  public Pos pos() {
    return pos;
  }

  @Override
  public String toString() {
    return content;
  }
}

// End Comment.java
