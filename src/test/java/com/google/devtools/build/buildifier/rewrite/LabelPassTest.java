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

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for the label shortening rules of {@link LabelPass}. */
@RunWith(JUnit4.class)
public class LabelPassTest {

  @Test
  public void testPackageOf() {
    assertThat(LabelPass.packageOf("BUILD")).isEmpty();
    assertThat(LabelPass.packageOf("pkg/BUILD")).isEqualTo("pkg");
    assertThat(LabelPass.packageOf("a/b/BUILD.bazel")).isEqualTo("a/b");
    assertThat(LabelPass.packageOf("pkg/defs.bzl")).isNull();
    assertThat(LabelPass.packageOf("stdin")).isNull();
  }

  @Test
  public void testLocalLabels() {
    assertThat(LabelPass.shorten("//pkg:foo", "pkg")).isEqualTo(":foo");
    assertThat(LabelPass.shorten("//:foo", "")).isEqualTo(":foo");
    assertThat(LabelPass.shorten("//pkg/x:x", "pkg/x")).isEqualTo(":x");
    assertThat(LabelPass.shorten("//pkg:foo", "other")).isEqualTo("//pkg:foo");
    assertThat(LabelPass.shorten("//pkg:foo", null)).isEqualTo("//pkg:foo");
  }

  @Test
  public void testTargetNamedAfterPackage() {
    assertThat(LabelPass.shorten("//a/b:b", null)).isEqualTo("//a/b");
    assertThat(LabelPass.shorten("//a/b:b", "c")).isEqualTo("//a/b");
    assertThat(LabelPass.shorten("@r//a:a", "a")).isEqualTo("@r//a");
    assertThat(LabelPass.shorten("//a/b:c", null)).isEqualTo("//a/b:c");
  }

  @Test
  public void testExternalLabelsAreNeverLocal() {
    assertThat(LabelPass.shorten("@r//a:b", "a")).isEqualTo("@r//a:b");
  }

  @Test
  public void testOtherStringsAreUnchanged() {
    assertThat(LabelPass.shorten(":foo", "pkg")).isEqualTo(":foo");
    assertThat(LabelPass.shorten("foo.cc", "pkg")).isEqualTo("foo.cc");
    assertThat(LabelPass.shorten("//pkg", "pkg")).isEqualTo("//pkg");
    assertThat(LabelPass.shorten("//pkg:", "pkg")).isEqualTo("//pkg:");
    assertThat(LabelPass.shorten("@r", null)).isEqualTo("@r");
    assertThat(LabelPass.shorten("", null)).isEmpty();
  }
}
