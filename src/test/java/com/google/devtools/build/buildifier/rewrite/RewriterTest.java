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

package com.google.devtools.build.buildifier.rewrite;

import static com.google.common.truth.Truth.assertThat;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.devtools.build.buildifier.format.Formatter;
import com.google.devtools.build.buildifier.syntax.BuildFile;
import com.google.devtools.build.buildifier.syntax.ParserInput;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** End-to-end tests of the {@link Rewriter} pipeline: parse, rewrite, format. */
@RunWith(JUnit4.class)
public class RewriterTest {

  private RewriteInfo info;

  private static String lines(String... lines) {
    return Joiner.on('\n').join(lines) + "\n";
  }

  private String rewrite(String input, RewriteConfig config) throws Exception {
    BuildFile file = BuildFile.parse(ParserInput.fromString(input, "pkg/BUILD"));
    info = Rewriter.rewrite(file, config);
    return Formatter.formatToString(file);
  }

  private String rewrite(String input) throws Exception {
    return rewrite(input, RewriteConfig.DEFAULT);
  }

  @Test
  public void testPassNames() {
    assertThat(Rewriter.passNames())
        .containsExactly(
            "callsort", "stringconcat", "label", "stringquote", "listsort", "dedup", "loadsort")
        .inOrder();
  }

  @Test
  public void testSortsSources() throws Exception {
    assertThat(rewrite("go_library(name=\"x\",srcs=[\"b.go\",\"a.go\"])"))
        .isEqualTo(
            lines(
                "go_library(",
                "    name = \"x\",",
                "    srcs = [",
                "        \"a.go\",",
                "        \"b.go\",",
                "    ],",
                ")"));
    assertThat(info.summary()).isEqualTo("listsort");
    assertThat(info.getLog()).containsExactly("listsort go_library(x).srcs");
  }

  @Test
  public void testSortsAndRemovesDuplicates() throws Exception {
    assertThat(rewrite("cc_library(name = \"x\", deps = [\":a\", \":b\", \":a\"])"))
        .isEqualTo(
            lines(
                "cc_library(",
                "    name = \"x\",",
                "    deps = [",
                "        \":a\",",
                "        \":b\",",
                "    ],",
                ")"));
    assertThat(info.summary()).isEqualTo("listsort dedup");
    assertThat(info.getLog())
        .containsExactly("listsort cc_library(x).deps", "dedup cc_library(x).deps :a")
        .inOrder();
  }

  @Test
  public void testDedupStillRunsWithListSortDisabled() throws Exception {
    RewriteConfig config =
        RewriteConfig.builder().disabledRewrites(ImmutableList.of("listsort")).build();
    assertThat(rewrite("cc_library(name = \"x\", deps = [\":b\", \":a\", \":b\"])", config))
        .isEqualTo(
            lines(
                "cc_library(",
                "    name = \"x\",",
                "    deps = [",
                "        \":b\",",
                "        \":a\",",
                "    ],",
                ")"));
    assertThat(info.summary()).isEqualTo("dedup");
  }

  @Test
  public void testRewriteReachesFixedPoint() throws Exception {
    String input =
        lines(
            "load(':defs.bzl', 'z', 'a')",
            "X = 'a' + 'b'",
            "cc_library(",
            "    deps = ['//pkg:y', '//other/lib:lib'],",
            "    srcs = ['b.cc', 'a.cc', 'a.cc'],",
            "    name = 'x',",
            ")");
    String once = rewrite(input);
    assertThat(info.isEmpty()).isFalse();
    String twice = rewrite(once);
    assertThat(twice).isEqualTo(once);
    assertThat(info.isEmpty()).isTrue();
    assertThat(info.summary()).isEmpty();
  }

  @Test
  public void testAllPasses() throws Exception {
    String output =
        rewrite(
            lines(
                "load(\":defs.bzl\", \"z\", \"a\")",
                "X = 'a' + 'b'",
                "cc_library(",
                "    srcs = [\"b.cc\", \"a.cc\", \"a.cc\"],",
                "    name = \"x\",",
                "    deps = [\"//pkg:y\"],",
                ")"));
    assertThat(output)
        .isEqualTo(
            lines(
                "load(\":defs.bzl\", \"a\", \"z\")",
                "X = \"ab\"",
                "",
                "cc_library(",
                "    name = \"x\",",
                "    srcs = [",
                "        \"a.cc\",",
                "        \"b.cc\",",
                "    ],",
                "    deps = [\":y\"],",
                ")"));
    assertThat(info.summary())
        .isEqualTo("callsort stringconcat label stringquote listsort dedup loadsort");
    assertThat(info.count("stringquote")).isEqualTo(1);
    assertThat(info.count("callsort")).isEqualTo(1);
    assertThat(info.toString()).isEqualTo(info.summary());
  }

  @Test
  public void testCallSort() throws Exception {
    assertThat(
            rewrite(
                "java_library(deps = [], visibility = [], srcs = [], name = \"x\", testonly = 1)"))
        .isEqualTo(
            lines(
                "java_library(",
                "    name = \"x\",",
                "    testonly = 1,",
                "    srcs = [],",
                "    visibility = [],",
                "    deps = [],",
                ")"));
    assertThat(info.getLog()).containsExactly("callsort java_library(x)");
  }

  @Test
  public void testCallSortKeepsPositionalArgumentsFirst() throws Exception {
    assertThat(rewrite("package_group(\"p\", packages = [], name = \"x\")"))
        .isEqualTo(lines("package_group(", "    \"p\",", "    name = \"x\",", "    packages = [],", ")"));
  }

  @Test
  public void testCallSortSkipsStarArguments() throws Exception {
    rewrite("cc_library(deps = [], name = \"x\", **kwargs)");
    assertThat(info.count("callsort")).isEqualTo(0);
  }

  @Test
  public void testCallSortMovesCommentsWithAttributes() throws Exception {
    assertThat(
            rewrite(
                lines(
                    "cc_library(",
                    "    # the deps",
                    "    deps = [\":a\"],",
                    "    name = \"x\",  # the name",
                    ")")))
        .isEqualTo(
            lines(
                "cc_library(",
                "    name = \"x\",  # the name",
                "    # the deps",
                "    deps = [\":a\"],",
                ")"));
  }

  @Test
  public void testStringConcat() throws Exception {
    assertThat(rewrite("X = \"a\" + \"b\" + \"c\"\nY = \"a\" + Z\n"))
        .isEqualTo(lines("X = \"abc\"", "Y = \"a\" + Z"));
    assertThat(info.count("stringconcat")).isEqualTo(2);
    assertThat(info.getLog()).containsExactly("stringconcat line 1", "stringconcat line 1");
  }

  @Test
  public void testStringConcatLeavesRawStrings() throws Exception {
    assertThat(rewrite("X = r\"a\\d\" + \"b\"\n")).isEqualTo(lines("X = r\"a\\d\" + \"b\""));
    assertThat(info.isEmpty()).isTrue();
  }

  @Test
  public void testStringQuote() throws Exception {
    assertThat(rewrite("X = ['a', 'it\\'s', \"ok\", r'raw']\n"))
        .isEqualTo(lines("X = [\"a\", \"it's\", \"ok\", r'raw']"));
    assertThat(info.getLog())
        .containsExactly("stringquote line 1: 'a'", "stringquote line 1: 'it\\'s'")
        .inOrder();
  }

  @Test
  public void testStringQuoteDecodesEscapes() throws Exception {
    assertThat(rewrite("X = ['\\x41', \"\\u00e9\", \"\\a\"]\n"))
        .isEqualTo(lines("X = [\"A\", \"\u00e9\", \"\\007\"]"));
    assertThat(info.count("stringquote")).isEqualTo(3);
  }

  @Test
  public void testLabels() throws Exception {
    assertThat(
            rewrite(
                "cc_library(name = \"x\", deps = [\"//pkg:a\", \"//b/c:c\", \"@r//d:d\"],"
                    + " tags = [\"//pkg:t\"])"))
        .isEqualTo(
            lines(
                "cc_library(",
                "    name = \"x\",",
                "    tags = [\"//pkg:t\"],",
                "    deps = [",
                "        \":a\",",
                "        \"//b/c\",",
                "        \"@r//d\",",
                "    ],",
                ")"));
    assertThat(info.getLog())
        .containsAtLeast("label //pkg:a -> :a", "label //b/c:c -> //b/c", "label @r//d:d -> @r//d");
  }

  @Test
  public void testListSortOrder() throws Exception {
    assertThat(
            rewrite(
                "cc_library(name = \"x\", deps = [\"@r//a\", \"//b:x\", \"//a:z\", \":z\", \"y.cc\","
                    + " \":a\"])"))
        .isEqualTo(
            lines(
                "cc_library(",
                "    name = \"x\",",
                "    deps = [",
                "        \":a\",",
                "        \"y.cc\",",
                "        \":z\",",
                "        \"//a:z\",",
                "        \"//b:x\",",
                "        \"@r//a\",",
                "    ],",
                ")"));
  }

  @Test
  public void testListSortRespectsBlankLinesAndNonLiterals() throws Exception {
    assertThat(
            rewrite(
                lines(
                    "cc_library(",
                    "    name = \"x\",",
                    "    deps = [",
                    "        \":d\",",
                    "        \":c\",",
                    "",
                    "        \":b\",",
                    "        \":a\",",
                    "        DEP,",
                    "        \":f\",",
                    "        \":e\",",
                    "    ],",
                    ")")))
        .isEqualTo(
            lines(
                "cc_library(",
                "    name = \"x\",",
                "    deps = [",
                "        \":c\",",
                "        \":d\",",
                "",
                "        \":a\",",
                "        \":b\",",
                "        DEP,",
                "        \":e\",",
                "        \":f\",",
                "    ],",
                ")"));
  }

  @Test
  public void testListSortKeepsComments() throws Exception {
    assertThat(
            rewrite(
                lines(
                    "cc_library(",
                    "    name = \"x\",",
                    "    srcs = [",
                    "        \"b.cc\",  # bee",
                    "        # about a",
                    "        \"a.cc\",",
                    "    ],",
                    ")")))
        .isEqualTo(
            lines(
                "cc_library(",
                "    name = \"x\",",
                "    srcs = [",
                "        # about a",
                "        \"a.cc\",",
                "        \"b.cc\",  # bee",
                "    ],",
                ")"));
  }

  @Test
  public void testDoNotSortComment() throws Exception {
    String input =
        lines(
            "cc_library(",
            "    name = \"x\",",
            "    # Do not sort: link order matters.",
            "    deps = [",
            "        \":b\",",
            "        \":a\",",
            "    ],",
            ")");
    assertThat(rewrite(input)).isEqualTo(input);
    assertThat(info.isEmpty()).isTrue();

    String inside =
        lines(
            "cc_library(",
            "    name = \"x\",",
            "    deps = [",
            "        \":b\",  # do not sort",
            "        \":a\",",
            "    ],",
            ")");
    assertThat(rewrite(inside)).isEqualTo(inside);
  }

  @Test
  public void testUnsortableAttributes() throws Exception {
    String input =
        lines(
            "genrule(",
            "    name = \"g\",",
            "    srcs = [",
            "        \"b\",",
            "        \"a\",",
            "    ],",
            "    outs = [",
            "        \"d\",",
            "        \"c\",",
            "    ],",
            ")");
    assertThat(rewrite(input)).isEqualTo(input);
  }

  @Test
  public void testAllowSort() throws Exception {
    RewriteConfig config =
        RewriteConfig.builder().allowSort(ImmutableSet.of("genrule.outs")).build();
    assertThat(rewrite("genrule(name = \"g\", srcs = [\"b\", \"a\"], outs = [\"d\", \"c\"])", config))
        .isEqualTo(
            lines(
                "genrule(",
                "    name = \"g\",",
                "    srcs = [",
                "        \"b\",",
                "        \"a\",",
                "    ],",
                "    outs = [",
                "        \"c\",",
                "        \"d\",",
                "    ],",
                ")"));
    assertThat(info.getLog()).containsExactly("listsort genrule(g).outs");
  }

  @Test
  public void testSortsConcatenationsAndSelects() throws Exception {
    assertThat(
            rewrite(
                lines(
                    "cc_library(",
                    "    name = \"x\",",
                    "    deps = [\":b\", \":a\"] + select({",
                    "        \":opt\": [\":d\", \":c\"],",
                    "        \"//conditions:default\": [],",
                    "    }),",
                    ")")))
        .isEqualTo(
            lines(
                "cc_library(",
                "    name = \"x\",",
                "    deps = [",
                "        \":a\",",
                "        \":b\",",
                "    ] + select({",
                "        \":opt\": [\":c\", \":d\"],",
                "        \"//conditions:default\": [],",
                "    }),",
                ")"));
  }

  @Test
  public void testDedupKeepsCommentsOfRemovedElements() throws Exception {
    assertThat(
            rewrite(
                lines(
                    "cc_library(",
                    "    name = \"x\",",
                    "    deps = [",
                    "        \":a\",",
                    "        \":a\",  # again",
                    "    ],",
                    ")")))
        .isEqualTo(
            lines(
                "cc_library(",
                "    name = \"x\",",
                "    deps = [",
                "        # again",
                "        \":a\",",
                "    ],",
                ")"));
  }

  @Test
  public void testLoadSort() throws Exception {
    assertThat(rewrite("load(\":d.bzl\", \"b\", a2 = \"x\", \"a\", \"b\")\n"))
        .isEqualTo(lines("load(\":d.bzl\", \"a\", a2 = \"x\", \"b\")"));
    assertThat(info.getLog()).containsExactly("loadsort :d.bzl");
  }

  @Test
  public void testRulesInsideExpressionsAreNotRewritten() throws Exception {
    String input = lines("X = [cc_library(deps = [\":b\", \":a\"], name = \"x\")]");
    assertThat(rewrite(input)).isEqualTo(input);
  }

  private static String fix(String path, String input) throws Exception {
    BuildFile file = BuildFile.parse(ParserInput.fromString(input, path));
    Rewriter.rewrite(file, RewriteConfig.DEFAULT);
    return Formatter.formatToString(file);
  }

  @Test
  public void testConcurrentRunsMatchSequentialRuns() throws Exception {
    List<String> inputs = new ArrayList<>();
    for (int i = 0; i < 64; i++) {
      inputs.add(
          "load(':defs.bzl', 'z', 'a', 'a')\n"
              + "cc_library(deps = ['//p" + i + ":b', '//p" + i + ":a', ':a'], srcs = ['y.cc',"
              + " 'x' + '.cc', 'x.cc'], name = 'lib" + i + "')  # keep\n"
              + "X = {'k': [1, 2]}\n");
    }
    List<String> sequential = new ArrayList<>();
    for (int i = 0; i < inputs.size(); i++) {
      sequential.add(fix("p" + i + "/BUILD", inputs.get(i)));
    }

    ListeningExecutorService executor =
        MoreExecutors.listeningDecorator(Executors.newFixedThreadPool(8));
    try {
      List<ListenableFuture<String>> futures = new ArrayList<>();
      for (int i = 0; i < inputs.size(); i++) {
        String path = "p" + i + "/BUILD";
        String input = inputs.get(i);
        futures.add(executor.submit(() -> fix(path, input)));
      }
      assertThat(Futures.allAsList(futures).get()).containsExactlyElementsIn(sequential).inOrder();
    } finally {
      executor.shutdownNow();
    }
    assertThat(sequential.get(3)).contains("\":a\",\n        \":b\",");
  }
}
