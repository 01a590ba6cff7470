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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.devtools.build.buildifier.syntax.BuildFile;
import com.google.devtools.build.buildifier.syntax.ParserInput;
import com.google.devtools.build.buildifier.syntax.StringLiteral;
import java.util.ArrayList;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link RuleAttributes}. */
@RunWith(JUnit4.class)
public class RuleAttributesTest {

  @Test
  public void testLabelOrder() {
    List<String> labels =
        new ArrayList<>(
            ImmutableList.of(
                "@b//x:y", "//b:a", "//a/b:c", ":z", "@a//x", "b.cc", "//a:z", ":a", "//a", "a.h"));
    labels.sort(RuleAttributes.LABEL_ORDER);
    assertThat(labels)
        .containsExactly(
            ":a", "a.h", "b.cc", ":z", "//a", "//a:z", "//a/b:c", "//b:a", "@a//x", "@b//x:y")
        .inOrder();
  }

  @Test
  public void testIsSortable() {
    RewriteConfig config = RewriteConfig.DEFAULT;
    assertThat(RuleAttributes.isSortable("cc_library", "srcs", config)).isTrue();
    assertThat(RuleAttributes.isSortable("cc_library", "deps", config)).isTrue();
    assertThat(RuleAttributes.isSortable("cc_library", "copts", config)).isFalse();
    assertThat(RuleAttributes.isSortable("genrule", "srcs", config)).isFalse();
    assertThat(RuleAttributes.isSortable("sh_test", "srcs", config)).isFalse();
    assertThat(RuleAttributes.isSortable("sh_test", "data", config)).isTrue();
  }

  @Test
  public void testAllowSort() {
    RewriteConfig config =
        RewriteConfig.builder().allowSort(ImmutableSet.of("copts", "genrule.srcs")).build();
    assertThat(RuleAttributes.isSortable("cc_library", "copts", config)).isTrue();
    assertThat(RuleAttributes.isSortable("genrule", "srcs", config)).isTrue();
    assertThat(RuleAttributes.isSortable("sh_test", "srcs", config)).isFalse();
  }

  @Test
  public void testStringsAndLists() throws Exception {
    BuildFile file =
        BuildFile.parse(
            ParserInput.fromString(
                "cc_library(name = \"x\", deps = [\":a\"] + [\":b\", DEP] + select({\"c\":"
                    + " [\":c\"], \"d\": \":d\"}) + glob([\"e\"]), srcs = \"s.cc\", copts ="
                    + " [\"-O2\"])\n",
                "pkg/BUILD"));
    List<String> values = new ArrayList<>();
    for (StringLiteral str :
        RuleAttributes.strings(file.rules("").get(0).getAttr("deps"))) {
      values.add(str.getValue());
    }
    assertThat(values).containsExactly(":a", ":b", ":c", ":d").inOrder();
    assertThat(RuleAttributes.lists(file.rules("").get(0).getAttr("deps"))).hasSize(3);

    ImmutableList<RuleAttributes.AttributeList> sortable =
        RuleAttributes.sortableLists(file, RewriteConfig.DEFAULT);
    assertThat(sortable).hasSize(3);
    assertThat(sortable.get(0).describe()).isEqualTo("cc_library(x).deps");
  }

  @Test
  public void testDescribe() throws Exception {
    BuildFile file =
        BuildFile.parse(
            ParserInput.fromString("cc_library(name = \"x\")\nlicenses([\"notice\"])\n", "BUILD"));
    assertThat(RuleAttributes.describe(file.rules("").get(0))).isEqualTo("cc_library(x)");
    assertThat(RuleAttributes.describe(file.rules("").get(0), "srcs"))
        .isEqualTo("cc_library(x).srcs");
    assertThat(RuleAttributes.describe(file.rules("").get(1))).isEqualTo("licenses");
  }
}
