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
import com.google.devtools.build.buildifier.syntax.BuildFile;
import com.google.devtools.build.buildifier.syntax.NodeVisitor;
import com.google.devtools.build.buildifier.syntax.StringLiteral;
import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites plain string literals in canonical form: double quotes, and only the escapes that are
 * needed. Raw and triple-quoted strings are left as written.
 */
final class StringQuotePass implements RewritePass {

  @Override
  public String name() {
    return "stringquote";
  }

  @Override
  public ImmutableList<String> apply(BuildFile file, RewriteConfig config) {
    List<StringLiteral> literals = new ArrayList<>();
    new NodeVisitor() {
      @Override
      public void visit(StringLiteral node) {
        literals.add(node);
      }
    }.visit(file);

    ImmutableList.Builder<String> changes = ImmutableList.builder();
    for (StringLiteral str : literals) {
      if (!str.isPlain()) {
        continue;
      }
      String canonical = StringLiteral.quote(str.getValue());
      if (!canonical.equals(str.getRaw())) {
        changes.add("line " + str.getStartLocation().line() + ": " + str.getRaw());
        str.setRaw(canonical);
      }
    }
    return changes.build();
  }
}
