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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link BuildFileBuilder}. */
@RunWith(JUnit4.class)
public class BuildFileBuilderTest {

  @Test
  public void testBuildsParsableFile() {
    BuildFile file =
        BuildFileBuilder.create("foo/BUILD")
            .addRule(
                "go_library",
                ImmutableMap.of(
                    "name", "x", "srcs", ImmutableList.of("b.go", "a.go"), "cgo", true))
            .addRule("go_test", "x_test")
            .build();
    assertThat(file.getPath()).isEqualTo("foo/BUILD");
    assertThat(file.rules("")).hasSize(2);
    Rule lib = file.rules("go_library").get(0);
    assertThat(lib.getName()).isEqualTo("x");
    assertThat(lib.getAttrStrings("srcs")).containsExactly("b.go", "a.go").inOrder();
    assertThat(((Identifier) lib.getAttr("cgo")).getName()).isEqualTo("True");
    assertThat(file.rules("go_test").get(0).getName()).isEqualTo("x_test");
  }

  @Test
  public void testText() {
    BuildFileBuilder builder =
        BuildFileBuilder.create("BUILD")
            .addRule("cc_library", ImmutableMap.of("name", "a\"b", "linkstatic", 1));
    assertThat(builder.getText()).isEqualTo("cc_library(name = \"a\\\"b\", linkstatic = 1)\n");
    assertThat(builder.buildRules("cc_library").get(0).getName()).isEqualTo("a\"b");
  }

  @Test
  public void testRejectsInvalidNames() {
    BuildFileBuilder builder = BuildFileBuilder.create("BUILD");
    assertThrows(
        IllegalArgumentException.class, () -> builder.addRule("not-a-kind", ImmutableMap.of()));
    assertThrows(
        IllegalArgumentException.class,
        () -> builder.addRule("rule", ImmutableMap.of("bad attr", "x")));
    assertThrows(
        IllegalArgumentException.class,
        () -> builder.addRule("rule", ImmutableMap.of("x", 1.5)));
  }
}
