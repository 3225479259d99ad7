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
package net.hydromatic.lpdoc.parse;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.collect.ImmutableList;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import net.hydromatic.lpdoc.ast.AstNode;
import net.hydromatic.lpdoc.ast.Pos;

/** Utilities for parsing. */
public final class Parsers {
  private Parsers() {}

  /**
   * Parses program text. The text must not contain {@code #include}
   * directives.
   *
   * @param text Program text
   * @param file File name to record in the position of each node
   * @return Statements in source order
   * @throws LpParseException if the text is not a valid program
   */
  public static List<AstNode> parseString(String text, String file) {
    final LpParserImpl parser =
        LpParserImpl.create(
            text,
            file,
            (include, pos) -> {
              throw new LpParseException(
                  "cannot include '" + include + "' when parsing a string",
                  pos);
            });
    return ImmutableList.copyOf(parser.parseProgram());
  }

  /**
   * Parses a program file, splicing in the statements of the files it
   * includes.
   *
   * <p>An included file is resolved relative to the directory of the file that
   * includes it. Statements keep the name of the file they come from in their
   * {@link Pos#file}. A file that has already been included is not included
   * again.
   *
   * @param file Program file
   * @return Statements in source order, including those of included files
   * @throws IOException if the file cannot be read
   * @throws LpParseException if the file, or a file it includes, is not a
   *     valid program or cannot be read
   */
  public static List<AstNode> parseFile(File file) throws IOException {
    final Set<String> visited = new HashSet<>();
    visited.add(file.getCanonicalPath());
    return ImmutableList.copyOf(parseFile(file, visited));
  }

  private static List<AstNode> parseFile(File file, Set<String> visited)
      throws IOException {
    final String text = new String(Files.readAllBytes(file.toPath()), UTF_8);
    final LpParserImpl parser =
        LpParserImpl.create(
            text,
            file.getPath(),
            (include, pos) -> include(file, include, pos, visited));
    return parser.parseProgram();
  }

  private static List<AstNode> include(
      File includer, String include, Pos pos, Set<String> visited) {
    final File includedFile =
        new File(include).isAbsolute()
            ? new File(include)
            : new File(includer.getParentFile(), include);
    try {
      if (!visited.add(includedFile.getCanonicalPath())) {
        return ImmutableList.of();
      }
      return parseFile(includedFile, visited);
    } catch (IOException e) {
      throw new LpParseException("cannot read '" + include + "'", pos, e);
    }
  }
}

// End Parsers.java
