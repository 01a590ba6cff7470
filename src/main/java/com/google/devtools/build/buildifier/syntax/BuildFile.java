// Copyright 2024 The Bazel Authors. All rights reserved.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
//    http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.


package com.google.devtools.build.buildifier.syntax;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import javax.annotation.Nullable;

/**
 * Syntax tree for a BUILD file.
 *
 * <p>A BuildFile is created by {@link #parse}, may be mutated in place by rewrites, and is read by
 * the formatter and by the rule accessors. It owns all of its nodes.
 */
public final class BuildFile extends Node {

  private final ImmutableList<Statement> statements;
  private final ImmutableList<Comment> comments;
  private final int contentLength;
  private String path;

  private BuildFile(
      FileLocations locs,
      ImmutableList<Statement> statements,
      ImmutableList<Comment> comments,
      String path) {
    super(locs);
    this.statements = statements;
    this.comments = comments;
    this.contentLength = locs.size();
    this.path = path;
  }

  /**
   * Parses the input as a BUILD file. The file name of the input is the logical path of the result.
   *
   * @throws SyntaxError.Exception if the input is malformed; no tree is returned in that case.
   */
  public static BuildFile parse(ParserInput input) throws SyntaxError.Exception {
    Parser.ParseResult result = Parser.parseFile(input);
    return new BuildFile(result.locs, result.statements, result.comments, input.getFile());
  }

  /** Parses the UTF-8 encoded content of the BUILD file at the given logical path. */
  public static BuildFile parse(String path, byte[] content) throws SyntaxError.Exception {
    return parse(ParserInput.fromUTF8(content, path));
  }

  /** Returns an unmodifiable view of the list of statements in this BUILD file. */
  public ImmutableList<Statement> getStatements() {
    return statements;
  }

  /** Returns all the comments of the file as it was parsed, in source order. */
  public ImmutableList<Comment> getComments() {
    return comments;
  }

  /** Returns the length in chars of the parsed content. */
  public int getContentLength() {
    return contentLength;
  }

  /**
   * Returns the logical path of the file. Path-sensitive rewrites derive the package name from
   * it. The path may be empty, for example when the file was read from standard input.
   */
  public String getPath() {
    return path;
  }

  public void setPath(String path) {
    this.path = Preconditions.checkNotNull(path);
  }

  /**
   * Returns the top-level rules of the given kind in source order, or all rules if {@code kind} is
   * empty.
   */
  public ImmutableList<Rule> rules(String kind) {
    ImmutableList.Builder<Rule> rules = ImmutableList.builder();
    for (Statement stmt : statements) {
      Rule rule = Rule.of(stmt);
      if (rule != null && (kind.isEmpty() || rule.getKind().equals(kind))) {
        rules.add(rule);
      }
    }
    return rules.build();
  }

  /** Returns the first rule with the given name, or null if there is none. */
  @Nullable
  public Rule ruleNamed(String name) {
    for (Rule rule : rules("")) {
      if (rule.getName().equals(name)) {
        return rule;
      }
    }
    return null;
  }

  @Override
  public int getStartOffset() {
    return 0;
  }

  @Override
  public int getEndOffset() {
    return contentLength;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public String toString() {
    return "<BuildFile " + path + ">";
  }
}
