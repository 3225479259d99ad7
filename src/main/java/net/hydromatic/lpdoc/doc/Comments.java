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
import net.hydromatic.lpdoc.ast.Pos;

/** Extracts comments from the lines of a logic program. */
public abstract class Comments {
  /** "%" neither preceded nor followed by "*", to the end of the line. */
  private static final Pattern LINE_COMMENT =
      Pattern.compile("(?<!\\*)%(?!\\*)(.*)$");

  /** "%*" to the end of the line. */
  private static final Pattern BLOCK_START = Pattern.compile("%\\*(.*)$");

  /** Start of the line to "*%". */
  private static final Pattern BLOCK_END = Pattern.compile("^(.*?)\\*%");

  /** String literal, possibly unterminated. */
  private static final Pattern STRING =
      Pattern.compile("\"(?:[^\"\\\\]|\\\\.)*\"?");

  private Comments() {}

  /**
   * Extracts the comments from the lines of a file.
   *
   * <p>Line numbers are one-based. The content of a line comment is trimmed;
   * the content of a block comment is kept as written, with line breaks. A
   * block comment that is never closed is ignored.
   *
   * @param lines Lines of the file, without line terminators
   * @param file File name to record in positions
   * @return Comments in order of their start position
   */
  public static ImmutableList<Comment> extract(List<String> lines, String file) {
    final ImmutableList.Builder<Comment> comments = ImmutableList.builder();
    boolean inBlock = false;
    Pos begin = Pos.ZERO;
    final StringBuilder content = new StringBuilder();
    for (int i = 0; i < lines.size(); i++) {
      final String line = lines.get(i);
      final int lineNumber = i + 1;
      if (!inBlock) {
        // Match against the line with its strings blanked out, then take
        // content from the line itself
        final String code = blankStrings(line);
        final Matcher lineMatcher = LINE_COMMENT.matcher(code);
        final Matcher startMatcher = BLOCK_START.matcher(code);
        final boolean lineComment = lineMatcher.find();
        final boolean blockComment = startMatcher.find();
        if (lineComment
            && (!blockComment || lineMatcher.start() < startMatcher.start())) {
          final int column = lineMatcher.start() + 1;
          comments.add(
              new Comment(
                  Pos.of(file, lineNumber, column, line.length() + 1),
                  false,
                  line.substring(lineMatcher.start(1)).trim()));
        } else if (blockComment) {
          final int column = startMatcher.start() + 1;
          begin = Pos.of(file, lineNumber, column, column + 2);
          final String rest = line.substring(startMatcher.start(1));
          final Matcher endMatcher = BLOCK_END.matcher(rest);
          if (endMatcher.find()) {
            // Block comment opens and closes on the same line
            final int endColumn = column + 2 + endMatcher.end();
            comments.add(
                new Comment(
                    new Pos(file, lineNumber, column, lineNumber, endColumn),
                    true,
                    endMatcher.group(1)));
          } else {
            content.setLength(0);
            content.append(rest).append('\n');
            inBlock = true;
          }
        }
      } else {
        final Matcher endMatcher = BLOCK_END.matcher(line);
        if (endMatcher.find()) {
          content.append(endMatcher.group(1));
          comments.add(
              new Comment(
                  new Pos(
                      file,
                      begin.startLine,
                      begin.startColumn,
                      lineNumber,
                      endMatcher.end() + 1),
                  true,
                  content.toString()));
          inBlock = false;
        } else {
          content.append(line).append('\n');
        }
      }
    }
    return comments.build();
  }

  /**
   * Replaces each string literal in a line with spaces, so that a "%" in a
   * string does not start a comment. The result has the same length as the
   * line.
   */
  static String blankStrings(String line) {
    if (line.indexOf('"') < 0) {
      return line;
    }
    final StringBuilder b = new StringBuilder(line);
    final Matcher matcher = STRING.matcher(line);
    while (matcher.find()) {
      for (int i = matcher.start(); i < matcher.end(); i++) {
        b.setCharAt(i, ' ');
      }
    }
    return b.toString();
  }
}

// End Comments.java
