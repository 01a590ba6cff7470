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
import com.google.devtools.build.buildifier.syntax.Expression;
import com.google.devtools.build.buildifier.syntax.ListExpression;
import com.google.devtools.build.buildifier.syntax.StringLiteral;
import java.util.HashMap;
import java.util.Map;

/**
 * Removes repeated string literals from the lists of order-insensitive attributes. The first
 * occurrence stays and takes over the comments of the ones removed.
 */
final class DedupPass implements RewritePass {

  @Override
  public String name() {
    return "dedup";
  }

  @Override
  public ImmutableList<String> apply(BuildFile file, RewriteConfig config) {
    ImmutableList.Builder<String> changes = ImmutableList.builder();
    for (RuleAttributes.AttributeList attrList : RuleAttributes.sortableLists(file, config)) {
      ListExpression list = attrList.list;
      Map<String, StringLiteral> seen = new HashMap<>();
      ImmutableList.Builder<Expression> kept = ImmutableList.builder();
      boolean changed = false;
      boolean blankLineBefore = false;
      for (Expression elem : list.getElements()) {
        if (elem instanceof StringLiteral str) {
          StringLiteral first = seen.get(str.getValue());
          if (first != null) {
            first.absorbComments(str);
            // A removed element's blank line still separates its neighbors.
            blankLineBefore |= str.hasBlankLineBefore();
            changed = true;
            changes.add(attrList.describe() + " " + str.getValue());
            continue;
          }
          seen.put(str.getValue(), str);
        }
        if (blankLineBefore) {
          elem.setBlankLineBefore(true);
          blankLineBefore = false;
        }
        kept.add(elem);
      }
      if (changed) {
        list.setElements(kept.build());
      }
    }
    return changes.build();
  }
}
