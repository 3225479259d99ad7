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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Extracts directives from the comments of a logic program. */
public abstract class Directives {
  /** "@kind rest", where kind is a word. */
  private static final Pattern DIRECTIVE =
      Pattern.compile("^@([A-Za-z_][A-Za-z0-9_]*)(?:\\s+(.*))?$");

  /** Separator between the parameters of a directive. */
  private static final String SEPARATOR = " - ";

  private Directives() {}

  /**
   * Extracts directives from line comments.
   *
   * <p>A line comment is a directive if its text starts with "{@code @}"
   * followed by a word, the directive's kind. The rest of the text is split
   * at the first "{@code  - }" into parameters.
   *
   * @param comments Comments, as returned by {@link Comments#extract}
   * @return Directives in source order
   */
  public static ImmutableList<Directive> extract(List<Comment> comments) {
    final ImmutableList.Builder<Directive> directives = ImmutableList.builder();
    for (Comment comment : comments) {
      if (comment.block) {
        continue;
      }
      final Matcher matcher = DIRECTIVE.matcher(comment.content);
      if (matcher.matches()) {
        directives.add(
            new Directive(
                comment.pos.startLine,
                matcher.group(1),
                parameters(matcher.group(2)),
                comment.pos));
      }
    }
    return directives.build();
  }

  /** Splits the text after a directive's kind into parameters. */
  static ImmutableList<String> parameters(@Nullable String rest) {
    if (rest == null || rest.trim().isEmpty()) {
      return ImmutableList.of();
    }
    final int i = rest.indexOf(SEPARATOR);
    if (i < 0) {
      return ImmutableList.of(rest.trim());
    }
    return ImmutableList.of(
        rest.substring(0, i).trim(),
        rest.substring(i + SEPARATOR.length()).trim());
  }
}

// End Directives.java
