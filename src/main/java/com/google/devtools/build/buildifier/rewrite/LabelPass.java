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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.devtools.build.buildifier.syntax.Argument;
import com.google.devtools.build.buildifier.syntax.BuildFile;
import com.google.devtools.build.buildifier.syntax.Rule;
import com.google.devtools.build.buildifier.syntax.StringLiteral;
import javax.annotation.Nullable;

/**
 * Shortens labels in label-valued attributes.
 *
 * <p>{@code "//pkg/x:x"} becomes {@code "//pkg/x"}, and {@code "//pkg:t"} becomes {@code ":t"} in
 * the BUILD file of package {@code pkg}. The package is derived from the path of the file, which
 * must name a {@code BUILD} or {@code BUILD.bazel} file; without one, only the first form is
 * shortened.
 */
final class LabelPass implements RewritePass {

  @Override
  public String name() {
    return "label";
  }

  @Override
  public ImmutableList<String> apply(BuildFile file, RewriteConfig config) {
    String pkg = packageOf(file.getPath());
    ImmutableList.Builder<String> changes = ImmutableList.builder();
    for (Rule rule : file.rules("")) {
      for (Argument arg : rule.getCall().getArguments()) {
        if (arg.getName() == null || !RuleAttributes.LABELS.contains(arg.getName())) {
          continue;
        }
        for (StringLiteral str : RuleAttributes.strings(arg.getValue())) {
          if (!str.isPlain()) {
            continue;
          }
          String label = str.getValue();
          String shortened = shorten(label, pkg);
          if (!shortened.equals(label)) {
            str.setValue(shortened);
            changes.add(label + " -> " + shortened);
          }
        }
      }
    }
    return changes.build();
  }

  /**
   * Returns the package of a BUILD file given its path relative to the workspace root, or null if
   * the path does not name a BUILD file.
   */
  @VisibleForTesting
  @Nullable
  static String packageOf(String path) {
    int slash = path.lastIndexOf('/');
    String base = path.substring(slash + 1);
    if (!base.equals("BUILD") && !base.equals("BUILD.bazel")) {
      return null;
    }
    return slash < 0 ? "" : path.substring(0, slash);
  }

  /** Returns the shortest form of a label, as seen from the given package (if known). */
  @VisibleForTesting
  static String shorten(String label, @Nullable String pkg) {
    String repo = "";
    String rest = label;
    if (label.startsWith("@")) {
      int slashes = label.indexOf("//");
      if (slashes < 0) {
        return label;
      }
      repo = label.substring(0, slashes);
      rest = label.substring(slashes);
    }
    int colon = rest.indexOf(':');
    if (!rest.startsWith("//") || colon < 0 || colon == rest.length() - 1) {
      return label;
    }
    String labelPkg = rest.substring(2, colon);
    String name = rest.substring(colon + 1);
    if (repo.isEmpty() && labelPkg.equals(pkg)) {
      return ":" + name;
    }
    if (!labelPkg.isEmpty() && labelPkg.substring(labelPkg.lastIndexOf('/') + 1).equals(name)) {
      return repo + "//" + labelPkg;
    }
    return label;
  }
}
