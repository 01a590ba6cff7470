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

package com.google.devtools.build.buildifier;

import static com.google.common.truth.Truth.assertThat;
import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableMap;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests of the {@link Buildifier} command line tool. */
@RunWith(JUnit4.class)
public class BuildifierTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private static final String UNSORTED = "go_library(name=\"x\",srcs=[\"b.go\",\"a.go\"])\n";

  private static final String FORMATTED_UNSORTED =
      lines(
          "go_library(",
          "    name = \"x\",",
          "    srcs = [",
          "        \"b.go\",",
          "        \"a.go\",",
          "    ],",
          ")");

  private static final String CANONICAL =
      lines(
          "go_library(",
          "    name = \"x\",",
          "    srcs = [",
          "        \"a.go\",",
          "        \"b.go\",",
          "    ],",
          ")");

  private final ByteArrayOutputStream stdout = new ByteArrayOutputStream();
  private final ByteArrayOutputStream stderr = new ByteArrayOutputStream();
  private Map<String, String> env = ImmutableMap.of();

  private static String lines(String... lines) {
    return Joiner.on('\n').join(lines) + "\n";
  }

  private int runWithStdin(String stdin, String... args) {
    stdout.reset();
    stderr.reset();
    return Buildifier.run(
        args,
        new ByteArrayInputStream(stdin.getBytes(UTF_8)),
        new PrintStream(stdout, true, UTF_8),
        new PrintStream(stderr, true, UTF_8),
        env);
  }

  private int run(String... args) {
    return runWithStdin("", args);
  }

  private String out() {
    return stdout.toString(UTF_8);
  }

  private String err() {
    return stderr.toString(UTF_8);
  }

  private String file(String name, String content) throws IOException {
    File file = new File(tmp.getRoot(), name);
    file.getParentFile().mkdirs();
    Files.write(file.toPath(), content.getBytes(UTF_8));
    return file.getPath();
  }

  private static String read(String path) throws IOException {
    return new String(Files.readAllBytes(new File(path).toPath()), UTF_8);
  }

  @Test
  public void testPipeFormatsStandardInput() {
    assertThat(runWithStdin(UNSORTED)).isEqualTo(0);
    assertThat(out()).isEqualTo(CANONICAL);
    assertThat(err()).isEmpty();
  }

  @Test
  public void testPipeWritesCanonicalInputUnchanged() {
    assertThat(runWithStdin(CANONICAL)).isEqualTo(0);
    assertThat(out()).isEqualTo(CANONICAL);
  }

  @Test
  public void testSyntaxErrorOnStandardInput() {
    assertThat(runWithStdin("go_library(name=")).isEqualTo(1);
    assertThat(out()).isEmpty();
    assertThat(err()).isEqualTo("buildifier: stdin:1:17: unexpected end of input: unclosed '('\n");
  }

  @Test
  public void testPathFlagEnablesLocalLabels() {
    String input = "cc_library(name = \"x\", deps = [\"//pkg:a\"])\n";
    assertThat(runWithStdin(input, "-path", "pkg/BUILD")).isEqualTo(0);
    assertThat(out()).contains("deps = [\":a\"]");
    assertThat(runWithStdin(input)).isEqualTo(0);
    assertThat(out()).contains("deps = [\"//pkg:a\"]");
  }

  @Test
  public void testDisableFlag() {
    assertThat(runWithStdin(UNSORTED, "-buildifier_disable", "listsort,dedup")).isEqualTo(0);
    assertThat(out()).isEqualTo(FORMATTED_UNSORTED);
  }

  @Test
  public void testUnknownDisableNameIsNotAnError() {
    assertThat(runWithStdin(UNSORTED, "-buildifier_disable", "nosuchpass")).isEqualTo(0);
    assertThat(out()).isEqualTo(CANONICAL);
  }

  @Test
  public void testAllowSortFlag() {
    String input = "genrule(name = \"g\", outs = [\"b\", \"a\"])\n";
    assertThat(runWithStdin(input, "-allowsort", "genrule.outs")).isEqualTo(0);
    assertThat(out()).contains("\"a\",\n        \"b\",");
  }

  @Test
  public void testFixRewritesFiles() throws Exception {
    String unsorted = file("a/BUILD", UNSORTED);
    String canonical = file("b/BUILD", CANONICAL);
    assertThat(run("-v", unsorted, canonical)).isEqualTo(0);
    assertThat(read(unsorted)).isEqualTo(CANONICAL);
    assertThat(read(canonical)).isEqualTo(CANONICAL);
    assertThat(out()).isEmpty();
    assertThat(err()).contains("fixed " + unsorted + "\n");
    assertThat(err()).doesNotContain("fixed " + canonical);
  }

  @Test
  public void testFixIsQuietWithoutVerboseFlag() throws Exception {
    String unsorted = file("BUILD", UNSORTED);
    assertThat(run(unsorted)).isEqualTo(0);
    assertThat(read(unsorted)).isEqualTo(CANONICAL);
    assertThat(err()).isEmpty();
  }

  @Test
  public void testCheckListsFilesThatNeedWork() throws Exception {
    String reformat = file("a/BUILD", UNSORTED);
    String sortOnly = file("b/BUILD", FORMATTED_UNSORTED);
    String canonical = file("c/BUILD", CANONICAL);
    String layoutOnly = file("d/BUILD", "x=1\n");
    assertThat(run("-mode", "check", reformat, sortOnly, canonical, layoutOnly)).isEqualTo(0);
    assertThat(out())
        .isEqualTo(
            lines(
                reformat + " # reformat listsort",
                sortOnly + " # listsort",
                layoutOnly + " # reformat "));
    assertThat(read(reformat)).isEqualTo(UNSORTED);
  }

  @Test
  public void testCheckShowLog() throws Exception {
    String path = file("BUILD", FORMATTED_UNSORTED);
    assertThat(run("-mode", "check", "-showlog", path)).isEqualTo(0);
    assertThat(out()).isEqualTo(path + " # listsort listsort go_library(x).srcs\n");
  }

  @Test
  public void testDiffRunsDiffProgram() throws Exception {
    env = ImmutableMap.of(Differ.ENV_VAR, "cat");
    String path = file("BUILD", UNSORTED);
    assertThat(run("-d", path)).isEqualTo(0);
    assertThat(out()).isEqualTo(UNSORTED + CANONICAL);
    assertThat(read(path)).isEqualTo(UNSORTED);
  }

  @Test
  public void testDiffSkipsCanonicalFiles() throws Exception {
    env = ImmutableMap.of(Differ.ENV_VAR, "cat");
    String path = file("BUILD", CANONICAL);
    assertThat(run("-mode", "diff", path)).isEqualTo(0);
    assertThat(out()).isEmpty();
  }

  @Test
  public void testSyntaxErrorInOneFileDoesNotStopOthers() throws Exception {
    String bad = file("a/BUILD", "cc_library(\n");
    String good = file("b/BUILD", UNSORTED);
    assertThat(run(bad, good)).isEqualTo(1);
    assertThat(err()).startsWith("buildifier: " + bad + ":");
    assertThat(read(good)).isEqualTo(CANONICAL);
    assertThat(read(bad)).isEqualTo("cc_library(\n");
  }

  @Test
  public void testMissingFile() throws Exception {
    String missing = new File(tmp.getRoot(), "nope/BUILD").getPath();
    String syntaxError = file("BUILD", "x = (\n");
    assertThat(run(missing, syntaxError)).isEqualTo(3);
    assertThat(err()).contains("buildifier: ");
    assertThat(err()).contains(missing);
  }

  @Test
  public void testUsageErrors() throws Exception {
    assertThat(run("-d", "-mode", "check")).isEqualTo(2);
    assertThat(err()).contains("cannot specify both -d and -mode flags");

    assertThat(run("-mode", "pipe")).isEqualTo(2);
    assertThat(run("-mode", "sideways")).isEqualTo(2);
    assertThat(err()).startsWith("buildifier: ");

    assertThat(run("-nosuchflag")).isEqualTo(2);
    assertThat(err()).contains("usage: buildifier");

    String a = file("a/BUILD", CANONICAL);
    String b = file("b/BUILD", CANONICAL);
    assertThat(run("-path", "pkg/BUILD", a, b)).isEqualTo(2);
    assertThat(err()).contains("can only format one file when using -path flag");
  }

  @Test
  public void testResultsAreReportedInInputOrder() throws Exception {
    List<String> args = new ArrayList<>();
    args.add("-mode");
    args.add("check");
    StringBuilder want = new StringBuilder();
    for (int i = 0; i < 40; i++) {
      String content = i % 2 == 0 ? UNSORTED : CANONICAL;
      String path = file("p" + i + "/BUILD", content);
      args.add(path);
      if (i % 2 == 0) {
        want.append(path).append(" # reformat listsort\n");
      }
    }
    String[] argv = args.toArray(new String[0]);
    assertThat(run(argv)).isEqualTo(0);
    String first = out();
    assertThat(first).isEqualTo(want.toString());
    assertThat(run(argv)).isEqualTo(0);
    assertThat(out()).isEqualTo(first);
  }
}
