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
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableMap;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Tests for {@link Differ}. */
@RunWith(JUnit4.class)
public class DifferTest {

  @Rule public final TemporaryFolder tmp = new TemporaryFolder();

  private String file(String name, String content) throws IOException {
    File file = tmp.newFile(name);
    Files.write(file.toPath(), content.getBytes(UTF_8));
    return file.getPath();
  }

  @Test
  public void testDefaultCommand() {
    assertThat(Differ.find(ImmutableMap.of()).getCommand()).containsExactly("diff", "-u").inOrder();
    assertThat(Differ.find(ImmutableMap.of(Differ.ENV_VAR, "  ")).getCommand())
        .containsExactly("diff", "-u")
        .inOrder();
  }

  @Test
  public void testCommandFromEnvironment() {
    assertThat(Differ.find(ImmutableMap.of(Differ.ENV_VAR, "meld  --newtab")).getCommand())
        .containsExactly("meld", "--newtab")
        .inOrder();
  }

  @Test
  public void testShowCopiesProgramOutput() throws Exception {
    String oldFile = file("old", "a\n");
    String newFile = file("new", "b\n");
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    Differ.find(ImmutableMap.of(Differ.ENV_VAR, "cat")).show(oldFile, newFile, out);
    assertThat(out.toString(UTF_8)).isEqualTo("a\nb\n");
  }

  @Test
  public void testShowReportsMissingProgram() throws Exception {
    String oldFile = file("old", "a\n");
    String newFile = file("new", "b\n");
    Differ differ = Differ.find(ImmutableMap.of(Differ.ENV_VAR, "no-such-diff-program-xyz"));
    assertThrows(
        IOException.class, () -> differ.show(oldFile, newFile, new ByteArrayOutputStream()));
  }
}
