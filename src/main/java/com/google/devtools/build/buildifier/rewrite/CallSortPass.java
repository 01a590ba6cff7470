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

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.devtools.build.buildifier.syntax.Argument;
import com.google.devtools.build.buildifier.syntax.BuildFile;
import com.google.devtools.build.buildifier.syntax.CallExpression;
import com.google.devtools.build.buildifier.syntax.Rule;
import java.util.Comparator;

/**
 * Orders the attributes of top-level rules: {@code name} first, then sources and outputs, then
 * other attributes, with dependencies last. Attributes of equal priority keep their order.
 * Positional arguments stay in front. Calls with {@code *args} or {@code **kwargs} are left alone,
 * since the attributes they supply are unknown.
 */
final class CallSortPass implements RewritePass {

  // Attributes not listed here have priority 0.
  private static final ImmutableMap<String, Integer> PRIORITY =
      ImmutableMap.<String, Integer>builder()
          .put("name", -99)
          .put("gwt_name", -98)
          .put("package_name", -97)
          .put("visible_node_name", -96)
          .put("size", -95)
          .put("timeout", -94)
          .put("testonly", -93)
          .put("src", -92)
          .put("srcdir", -91)
          .put("srcs", -80)
          .put("out", -79)
          .put("outs", -78)
          .put("hdrs", -77)
          .put("has_services", -76)
          .put("include", -75)
          .put("of", -74)
          .put("baseline", -73)
          .put("destdir", 1)
          .put("exports", 2)
          .put("runtime_deps", 3)
          .put("deps", 4)
          .put("implementation", 5)
          .put("implements", 6)
          .put("alwayslink", 7)
          .buildOrThrow();

  private static final Comparator<Argument> ORDER = Comparator.comparingInt(CallSortPass::priority);

  @Override
  public String name() {
    return "callsort";
  }

  @Override
  public ImmutableList<String> apply(BuildFile file, RewriteConfig config) {
    ImmutableList.Builder<String> changes = ImmutableList.builder();
    for (Rule rule : file.rules("")) {
      CallExpression call = rule.getCall();
      if (call.hasStarArguments()) {
        continue;
      }
      // sortedCopyOf is stable.
      ImmutableList<Argument> sorted = ImmutableList.sortedCopyOf(ORDER, call.getArguments());
      if (!sorted.equals(call.getArguments())) {
        call.setArguments(sorted);
        changes.add(RuleAttributes.describe(rule));
      }
    }
    return changes.build();
  }

  private static int priority(Argument arg) {
    String name = arg.getName();
    if (name == null) {
      return Integer.MIN_VALUE;
    }
    return PRIORITY.getOrDefault(name, 0);
  }
}
