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
package net.hydromatic.lpdoc;

import static org.hamcrest.CoreMatchers.is;
import static org.hamcrest.CoreMatchers.nullValue;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.hasToString;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.lpdoc.doc.Comment;
import net.hydromatic.lpdoc.doc.Comments;
import net.hydromatic.lpdoc.doc.Directive;
import net.hydromatic.lpdoc.doc.Directives;
import org.junit.jupiter.api.Test;

/** Tests extraction of comments and directives. */
public class DocTest {
  private static List<Comment> comments(String... lines) {
    return Comments.extract(ImmutableList.copyOf(lines), "doc.lp");
  }

  @Test
  void testLineComments() {
    final List<Comment> comments =
        comments("a. %  trailing  ", "% 50% done", "b.");
    assertThat(comments, hasSize(2));
    assertThat(comments.get(0).content, is("trailing"));
    assertThat(comments.get(0).block, is(false));
    assertThat(comments.get(0).pos.startLine, is(1));
    assertThat(comments.get(0).pos.startColumn, is(4));
    assertThat(comments.get(1).content, is("50% done"));
    assertThat(comments.get(1).pos.startLine, is(2));
    assertThat(comments.get(1).pos.startColumn, is(1));
  }

  /** A "%" inside a string literal does not start a comment. */
  @Test
  void testPercentInString() {
    final List<Comment> comments =
        comments("a(\"50%\"). % real", "b(\"%*\", \"x\\\"%\").", "c(\"%\").");
    assertThat(comments, hasSize(1));
    assertThat(comments.get(0).content, is("real"));
    assertThat(comments.get(0).pos.startLine, is(1));
    assertThat(comments.get(0).pos.startColumn, is(11));
    assertThat(comments.get(0).block, is(false));
  }

  @Test
  void testBlockComments() {
    final List<Comment> comments =
        comments("%* first", "second", "third *%", "a. %* note *% b.");
    assertThat(comments, hasSize(2));
    final Comment block = comments.get(0);
    assertThat(block.block, is(true));
    assertThat(block.content, is(" first\nsecond\nthird "));
    assertThat(block.pos.startLine, is(1));
    assertThat(block.pos.endLine, is(3));
    final Comment inline = comments.get(1);
    assertThat(inline.block, is(true));
    assertThat(inline.content, is(" note "));
    assertThat(inline.pos.startLine, is(4));
    assertThat(inline.pos.startColumn, is(4));
  }

  @Test
  void testUnclosedBlockCommentIsIgnored() {
    assertThat(comments("a.", "%* never closed", "b."), hasSize(0));
  }

  @Test
  void testDirectives() {
    final List<Directive> directives =
        Directives.extract(
            comments(
                "%@section Graph",
                "%@var X - a node",
                "%@predicate edge/2 - an edge - directed",
                "% not @a directive",
                "%* @block *%",
                "%@flag",
                "p."));
    assertThat(directives, hasSize(4));

    final Directive section = directives.get(0);
    assertThat(section.kind, is(Directive.SECTION));
    assertThat(section.lineNumber, is(1));
    assertThat(section.parameters, contains("Graph"));
    assertThat(section.name(), is("Graph"));
    assertThat(section.description(), nullValue());

    final Directive var = directives.get(1);
    assertThat(var.kind, is(Directive.VAR));
    assertThat(var.lineNumber, is(2));
    assertThat(var.parameters, contains("X", "a node"));
    assertThat(var.description(), is("a node"));
    assertThat(var, hasToString("%@var X - a node"));

    // Split only at the first separator
    final Directive predicate = directives.get(2);
    assertThat(predicate.kind, is(Directive.PREDICATE));
    assertThat(predicate.parameters, contains("edge/2", "an edge - directed"));

    final Directive flag = directives.get(3);
    assertThat(flag.kind, is("flag"));
    assertThat(flag.lineNumber, is(6));
    assertThat(flag.parameters.isEmpty(), is(true));
    assertThat(flag.name(), nullValue());
  }
}

// End DocTest.java
