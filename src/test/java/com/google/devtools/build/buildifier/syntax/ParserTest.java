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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the BUILD file {@link Parser}, including comment attachment. */
@RunWith(JUnit4.class)
public class ParserTest {

  private static BuildFile parse(String... lines) throws SyntaxError.Exception {
    return BuildFile.parse(ParserInput.fromString(Joiner.on('\n').join(lines) + "\n", "BUILD"));
  }

  private static String parseError(String input) {
    SyntaxError.Exception ex =
        assertThrows(
            SyntaxError.Exception.class,
            () -> BuildFile.parse(ParserInput.fromString(input, "BUILD")));
    return ex.getMessage();
  }

  private static List<String> texts(ImmutableList<Comment> comments) {
    List<String> result = new ArrayList<>();
    for (Comment c : comments) {
      result.add(c.getText());
    }
    return result;
  }

  private static CallExpression call(Statement stmt) {
    return (CallExpression) ((ExpressionStatement) stmt).getExpression();
  }

  @Test
  public void testRuleCall() throws Exception {
    BuildFile file = parse("go_library(name = \"x\", srcs = [\"b.go\", \"a.go\"])");
    assertThat(file.getStatements()).hasSize(1);
    CallExpression call = call(file.getStatements().get(0));
    assertThat(((Identifier) call.getFunction()).getName()).isEqualTo("go_library");
    assertThat(call.getArguments()).hasSize(2);
    assertThat(call.getArguments().get(0).getName()).isEqualTo("name");
    ListExpression srcs = (ListExpression) call.getArguments().get(1).getValue();
    assertThat(srcs.isTuple()).isFalse();
    assertThat(srcs.getElements()).hasSize(2);
    assertThat(call.isForceMultiLine()).isFalse();
  }

  @Test
  public void testStatementKinds() throws Exception {
    BuildFile file =
        parse(
            "load(\":defs.bzl\", \"macro\", my_lib = \"lib\")",
            "X = [1, 2]",
            "X += [3]",
            "# standalone",
            "",
            "macro(name = \"m\")");
    List<Statement.Kind> kinds = new ArrayList<>();
    for (Statement stmt : file.getStatements()) {
      kinds.add(stmt.kind());
    }
    assertThat(kinds)
        .containsExactly(
            Statement.Kind.LOAD,
            Statement.Kind.ASSIGNMENT,
            Statement.Kind.ASSIGNMENT,
            Statement.Kind.COMMENT_BLOCK,
            Statement.Kind.EXPRESSION)
        .inOrder();
    AssignmentStatement augmented = (AssignmentStatement) file.getStatements().get(2);
    assertThat(augmented.isAugmented()).isTrue();
    assertThat(augmented.getOperator()).isEqualTo(TokenKind.PLUS);
    assertThat(file.getStatements().get(4).hasBlankLineBefore()).isTrue();
  }

  @Test
  public void testLoadBindings() throws Exception {
    LoadStatement load =
        (LoadStatement) parse("load(\":defs.bzl\", \"macro\", my_lib = \"lib\")").getStatements().get(0);
    assertThat(load.getImport().getValue()).isEqualTo(":defs.bzl");
    assertThat(load.getBindings()).hasSize(2);
    assertThat(load.getBindings().get(0).getLocal()).isNull();
    assertThat(load.getBindings().get(0).getLocalName()).isEqualTo("macro");
    assertThat(load.getBindings().get(1).getLocalName()).isEqualTo("my_lib");
    assertThat(load.getBindings().get(1).getOriginalName()).isEqualTo("lib");
  }

  @Test
  public void testOperatorPrecedence() throws Exception {
    AssignmentStatement stmt = (AssignmentStatement) parse("x = a + b * c").getStatements().get(0);
    BinaryOperatorExpression plus = (BinaryOperatorExpression) stmt.getRHS();
    assertThat(plus.getOperator()).isEqualTo(TokenKind.PLUS);
    assertThat(plus.getY().kind()).isEqualTo(Expression.Kind.BINARY_OPERATOR);
  }

  @Test
  public void testParenthesesAreNotKept() throws Exception {
    AssignmentStatement stmt = (AssignmentStatement) parse("x = (a)").getStatements().get(0);
    assertThat(stmt.getRHS().kind()).isEqualTo(Expression.Kind.IDENTIFIER);
  }

  @Test
  public void testTuples() throws Exception {
    AssignmentStatement stmt = (AssignmentStatement) parse("x = (1,)").getStatements().get(0);
    ListExpression tuple = (ListExpression) stmt.getRHS();
    assertThat(tuple.isTuple()).isTrue();
    assertThat(tuple.getElements()).hasSize(1);
  }

  @Test
  public void testSelectAndComprehension() throws Exception {
    BuildFile file =
        parse(
            "cc_library(",
            "    name = \"x\",",
            "    deps = [\":a\"] + select({\":c\": [\":b\"], \"//conditions:default\": []}),",
            "    srcs = [f for f in glob([\"*.cc\"]) if f != \"main.cc\"],",
            ")");
    CallExpression call = call(file.getStatements().get(0));
    assertThat(call.isForceMultiLine()).isTrue();
    assertThat(call.getArguments().get(1).getValue().kind())
        .isEqualTo(Expression.Kind.BINARY_OPERATOR);
    assertThat(call.getArguments().get(2).getValue().kind())
        .isEqualTo(Expression.Kind.COMPREHENSION);
  }

  @Test
  public void testCommentAttachment() throws Exception {
    BuildFile file =
        parse(
            "# leading",
            "cc_library(",
            "    # before name",
            "    name = \"x\",  # after name",
            "    srcs = [  # on bracket",
            "        \"a.cc\",",
            "        # trailing in list",
            "    ],",
            ")  # after rule");
    Statement stmt = file.getStatements().get(0);
    assertThat(texts(stmt.getBeforeComments())).containsExactly("# leading");
    assertThat(texts(stmt.getSuffixComments())).containsExactly("# after rule");

    CallExpression call = call(stmt);
    Argument name = call.getArguments().get(0);
    assertThat(texts(name.getBeforeComments())).containsExactly("# before name");
    assertThat(texts(name.getSuffixComments())).containsExactly("# after name");

    ListExpression srcs = (ListExpression) call.getArguments().get(1).getValue();
    assertThat(texts(srcs.getElements().get(0).getBeforeComments()))
        .containsExactly("# on bracket");
    assertThat(texts(srcs.getAfterComments())).containsExactly("# trailing in list");
    assertThat(file.getComments()).hasSize(6);
  }

  @Test
  public void testDetachedCommentsBecomeBlocks() throws Exception {
    BuildFile file = parse("# one", "", "# two", "x = 1", "", "# end");
    assertThat(file.getStatements()).hasSize(3);
    CommentBlock first = (CommentBlock) file.getStatements().get(0);
    assertThat(texts(first.getComments())).containsExactly("# one");
    assertThat(texts(file.getStatements().get(1).getBeforeComments())).containsExactly("# two");
    CommentBlock last = (CommentBlock) file.getStatements().get(2);
    assertThat(texts(last.getComments())).containsExactly("# end");
    assertThat(last.hasBlankLineBefore()).isTrue();
  }

  @Test
  public void testBlankLinesBetweenListElements() throws Exception {
    AssignmentStatement stmt =
        (AssignmentStatement) parse("x = [", "    \"a\",", "", "    \"b\",", "]").getStatements().get(0);
    ListExpression list = (ListExpression) stmt.getRHS();
    assertThat(list.getElements().get(0).hasBlankLineBefore()).isFalse();
    assertThat(list.getElements().get(1).hasBlankLineBefore()).isTrue();
    assertThat(list.isForceMultiLine()).isTrue();
  }

  @Test
  public void testDuplicateKeywordLastWins() throws Exception {
    BuildFile file = parse("r(", "    name = \"a\",  # first", "    name = \"b\",", ")");
    CallExpression call = call(file.getStatements().get(0));
    assertThat(call.getArguments()).hasSize(1);
    Argument name = call.getArguments().get(0);
    assertThat(((StringLiteral) name.getValue()).getValue()).isEqualTo("b");
    assertThat(texts(name.getBeforeComments())).containsExactly("# first");
  }

  @Test
  public void testTruncatedCall() {
    assertThat(parseError("go_library(name="))
        .isEqualTo("BUILD:1:17: unexpected end of input: unclosed '('");
  }

  @Test
  public void testMissingExpression() {
    assertThat(parseError("x = = 1\n"))
        .isEqualTo("BUILD:1:5: syntax error at '=': expected expression");
  }

  @Test
  public void testTwoExpressionsOnOneLine() {
    assertThat(parseError("x = 1 2\n"))
        .isEqualTo("BUILD:1:7: syntax error at '2': expected newline");
  }

  @Test
  public void testUnsupportedKeyword() {
    assertThat(parseError("import os\n"))
        .isEqualTo("BUILD:1:1: 'import' not supported, use 'load' instead");
  }

  @Test
  public void testImplicitConcatenationIsRejected() {
    assertThat(parseError("x = \"a\" \"b\"\n"))
        .isEqualTo("BUILD:1:9: Implicit string concatenation is forbidden, use the + operator");
  }

  @Test
  public void testTrailingCommaInUnparenthesizedTuple() {
    assertThat(parseError("x = 1,\n"))
        .isEqualTo("BUILD:1:7: Trailing comma is allowed only in parenthesized tuples.");
  }

  @Test
  public void testEmptyFile() throws Exception {
    assertThat(parse("").getStatements()).isEmpty();
  }

  @Test
  public void testCrlfLineEndings() throws Exception {
    BuildFile file = BuildFile.parse(ParserInput.fromString("x = 1\r\ny = 2\r\n", "BUILD"));
    assertThat(file.getStatements()).hasSize(2);
  }
}
