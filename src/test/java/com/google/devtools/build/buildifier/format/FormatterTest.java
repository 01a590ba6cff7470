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

package com.google.devtools.build.buildifier.format;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Joiner;
import com.google.devtools.build.buildifier.syntax.BuildFile;
import com.google.devtools.build.buildifier.syntax.ParserInput;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for the canonical BUILD file {@link Formatter}. */
@RunWith(JUnit4.class)
public class FormatterTest {

  private static String lines(String... lines) {
    return Joiner.on('\n').join(lines) + "\n";
  }

  private static String format(String input) throws Exception {
    return Formatter.formatToString(BuildFile.parse(ParserInput.fromString(input, "BUILD")));
  }

  /** Asserts that {@code input} formats to {@code want}, and that {@code want} is a fixed point. */
  private static void assertFormats(String input, String want) throws Exception {
    assertThat(format(input)).isEqualTo(want);
    assertThat(format(want)).isEqualTo(want);
  }

  private static void assertCanonical(String input) throws Exception {
    assertFormats(input, input);
  }

  @Test
  public void testRuleWithSeveralAttributes() throws Exception {
    assertFormats(
        "go_library(name=\"x\",srcs=[\"b.go\",\"a.go\"])",
        lines(
            "go_library(",
            "    name = \"x\",",
            "    srcs = [",
            "        \"b.go\",",
            "        \"a.go\",",
            "    ],",
            ")"));
  }

  @Test
  public void testSingleElementListStaysOnOneLine() throws Exception {
    assertFormats(
        "cc_library(name = \"x\", srcs = [\"a.cc\"])",
        lines("cc_library(", "    name = \"x\",", "    srcs = [\"a.cc\"],", ")"));
  }

  @Test
  public void testSingleArgumentRuleStaysOnOneLine() throws Exception {
    assertCanonical(lines("exports_files([\"a.txt\", \"b.txt\"])", "cc_library(name = \"x\")"));
  }

  @Test
  public void testMultiLineRulesAreSeparatedByBlankLines() throws Exception {
    assertFormats(
        lines("a(name = \"a\", x = 1)", "b(name = \"b\", x = 2)"),
        lines("a(", "    name = \"a\",", "    x = 1,", ")", "", "b(", "    name = \"b\",", "    x = 2,", ")"));
  }

  @Test
  public void testBlankLinesAreCollapsed() throws Exception {
    assertFormats("a = 1\nb = 2\n\n\n\nc = 3\n\n", lines("a = 1", "b = 2", "", "c = 3"));
  }

  @Test
  public void testEmptyFile() throws Exception {
    assertThat(format("")).isEmpty();
    assertThat(format("\n\n")).isEmpty();
  }

  @Test
  public void testFinalNewlineIsAdded() throws Exception {
    assertThat(format("x = 1")).isEqualTo("x = 1\n");
  }

  @Test
  public void testCommentsArePreserved() throws Exception {
    assertCanonical(
        lines(
            "# leading",
            "",
            "# attached",
            "cc_library(",
            "    name = \"x\",  # the name",
            "    srcs = [",
            "        # first",
            "        \"a.cc\",",
            "        \"b.cc\",",
            "        # last",
            "    ],",
            ")  # end",
            "",
            "# trailer"));
  }

  @Test
  public void testCommentForcesMultiLineList() throws Exception {
    assertFormats(
        lines("x = [\"a\",  # why", "]"), lines("x = [", "    \"a\",  # why", "]"));
  }

  @Test
  public void testBlankLineInsideListIsKept() throws Exception {
    assertCanonical(
        lines(
            "cc_library(",
            "    name = \"x\",",
            "    deps = [",
            "        \":a\",",
            "",
            "        \":b\",",
            "    ],",
            ")"));
  }

  @Test
  public void testShortContainersOutsideRules() throws Exception {
    assertFormats("X = [ 1,2 ]\nY = { 'a' : 1 }\n", lines("X = [1, 2]", "Y = {'a': 1}"));
  }

  @Test
  public void testMultiLineSourceContainerStaysMultiLine() throws Exception {
    assertFormats("X = [1,\n  2]\n", lines("X = [", "    1,", "    2,", "]"));
  }

  @Test
  public void testEmptyContainers() throws Exception {
    assertFormats("x = [\n]\ny = {\n}\nf(\n)\n", lines("x = []", "y = {}", "f()"));
  }

  @Test
  public void testPrecedence() throws Exception {
    assertFormats("x = (a + b) * c", lines("x = (a + b) * c"));
    assertFormats("x = a + (b * c)", lines("x = a + b * c"));
    assertFormats("x = a - (b - c)", lines("x = a - (b - c)"));
    assertFormats("x = (a - b) - c", lines("x = a - b - c"));
    assertFormats("x = not (a and b)", lines("x = not (a and b)"));
    assertFormats("x = (a if b else c) + d", lines("x = (a if b else c) + d"));
    assertFormats("x = -(a + b)", lines("x = -(a + b)"));
    assertFormats("x = (a == b) == c", lines("x = (a == b) == c"));
  }

  @Test
  public void testTuples() throws Exception {
    assertFormats("x = 1,2", lines("x = 1, 2"));
    assertFormats("x = (1,)", lines("x = (1,)"));
    assertFormats("f((1, 2))", lines("f((1, 2))"));
    assertFormats("x = ()", lines("x = ()"));
  }

  @Test
  public void testLoad() throws Exception {
    assertFormats(
        "load( ':defs.bzl' , 'a', b='c')", lines("load(':defs.bzl', 'a', b = 'c')"));
    assertCanonical(
        lines(
            "load(",
            "    \":defs.bzl\",",
            "    \"a\",  # why",
            "    \"b\",",
            ")"));
  }

  @Test
  public void testSelect() throws Exception {
    assertCanonical(
        lines(
            "cc_library(",
            "    name = \"x\",",
            "    deps = [\":base\"] + select({",
            "        \":opt\": [\":fast\"],",
            "        \"//conditions:default\": [],",
            "    }),",
            ")"));
  }

  @Test
  public void testCompactCallKeepsArgumentNextToParens() throws Exception {
    assertCanonical(
        lines(
            "cc_library(",
            "    name = \"x\",",
            "    srcs = glob([",
            "        \"*.cc\",",
            "        \"*.h\",",
            "    ]),",
            ")"));
    assertFormats(lines("f(", "    x)"), lines("f(", "    x,", ")"));
    assertFormats(
        lines("f(", "    x,", ")"), lines("f(", "    x,", ")"));
  }

  @Test
  public void testComprehension() throws Exception {
    assertFormats("x = [ f for f in y if f ]", lines("x = [f for f in y if f]"));
    assertCanonical(
        lines("x = [", "    f", "    for f in y", "    if f", "]"));
  }

  @Test
  public void testExpressions() throws Exception {
    assertCanonical(
        lines(
            "x = a.b[1:2] + c[::2]",
            "y = {\"k\": f(*args, **kwargs)}",
            "z = 1.5e3 if x in y else 0x10",
            "w = a not in b"));
  }

  @Test
  public void testAugmentedAssignment() throws Exception {
    assertFormats("x+=[1]", lines("x += [1]"));
  }

  @Test
  public void testLiteralSpellingIsKept() throws Exception {
    assertCanonical(lines("x = 'single'", "y = r\"raw\\d\"", "z = \"\"\"a", "b\"\"\""));
  }

  @Test
  public void testHexEscapesAreKept() throws Exception {
    assertCanonical(
        lines("cc_library(", "    name = \"x\",", "    srcs = [\"\\x41\\u00e9\"],", ")"));
  }

  @Test
  public void testByteOrderMarkIsDropped() throws Exception {
    byte[] input = "\uFEFFx=1\n".getBytes(UTF_8);
    BuildFile file = BuildFile.parse("BUILD", input);
    assertThat(new String(Formatter.format(file), UTF_8)).isEqualTo("x = 1\n");
  }

  @Test
  public void testFormatEncodesUtf8() throws Exception {
    BuildFile file = BuildFile.parse("BUILD", "x = \"é\"\n".getBytes(UTF_8));
    assertThat(new String(Formatter.format(file), UTF_8)).isEqualTo("x = \"é\"\n");
  }
}
