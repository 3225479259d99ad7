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

import net.hydromatic.lpdoc.ast.Pos;
import net.hydromatic.lpdoc.util.LpException;

/**
 * A problem found while analyzing a program.
 *
 * <p>Analysis problems are not fatal. The model builder does not throw them;
 * it collects them into {@link Model#warnings()} and skips the statement (or
 * the part of a statement) that caused them.
 */
public class AnalysisException extends RuntimeException
    implements LpException {
  public final Kind kind;
  private final Pos pos;

  public AnalysisException(Kind kind, String message, Pos pos) {
    super(message);
    this.kind = requireNonNull(kind);
    this.pos = requireNonNull(pos);
  }

  @Override
  public String toString() {
    return super.toString() + " at " + pos;
  }

  @Override
  public Pos pos() {
    return pos;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf)
        .append(" Warning: ")
        .append(kind)
        .append(": ")
        .append(getMessage());
  }

  /** Kind of analysis problem. */
  public enum Kind {
    /** A rule that neither defines nor depends on any atom. */
    UNCLASSIFIABLE_STATEMENT,
    /** A statement, such as "#program" or "#external", that is not modeled. */
    UNHANDLED_STATEMENT,
    /** An atom reached outside both the head and the body of a statement. */
    STRUCTURAL_TRAVERSAL_GAP
  }
}

// End AnalysisException.java
