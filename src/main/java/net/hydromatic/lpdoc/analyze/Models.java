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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableMap;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.util.List;
import java.util.Map;
import net.hydromatic.lpdoc.ast.AstNode;
import net.hydromatic.lpdoc.parse.LpParseException;
import net.hydromatic.lpdoc.parse.Parsers;

/** Creates {@link Model models}. */
public abstract class Models {
  private static final Splitter LINE_SPLITTER = Splitter.onPattern("\r?\n");

  private Models() {}

  /** Reads a file and builds a model, with no source root. */
  public static Model fromFile(File file) throws IOException {
    return fromFile(file, "");
  }

  /** Reads a file and builds a model, with default properties. */
  public static Model fromFile(File file, String sourceRoot)
      throws IOException {
    return fromFile(file, sourceRoot, ImmutableMap.of(), Tracers.empty());
  }

  /**
   * Reads a file, and the files it includes, and builds a model.
   *
   * @param file Program file
   * @param sourceRoot Directory that is removed from file names when computing
   *     statement prefixes
   * @param props Properties
   * @param tracer Receives events during the build
   * @return Model
   * @throws IOException if the file cannot be read
   * @throws LpParseException if the file, or a file it includes, is not a
   *     valid program
   */
  public static Model fromFile(File file, String sourceRoot,
      Map<Prop, Object> props, Tracer tracer) throws IOException {
    final List<AstNode> nodes = Parsers.parseFile(file);
    final List<String> lines = Files.readAllLines(file.toPath(), UTF_8);
    return Model.create(nodes, lines, file.getPath(), sourceRoot, props,
        tracer);
  }

  /** Parses program text and builds a model, with default properties. */
  public static Model fromString(String text, String file, String sourceRoot) {
    return fromString(text, file, sourceRoot, ImmutableMap.of(),
        Tracers.empty());
  }

  /**
   * Parses program text and builds a model. The text must not contain
   * {@code #include} directives.
   *
   * @throws LpParseException if the text is not a valid program
   */
  public static Model fromString(String text, String file, String sourceRoot,
      Map<Prop, Object> props, Tracer tracer) {
    final List<AstNode> nodes = Parsers.parseString(text, file);
    final List<String> lines = LINE_SPLITTER.splitToList(text);
    return Model.create(nodes, lines, file, sourceRoot, props, tracer);
  }
}

// End Models.java
