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
import com.google.devtools.build.buildifier.syntax.Comment;
import com.google.devtools.build.buildifier.syntax.Expression;
import com.google.devtools.build.buildifier.syntax.ListExpression;
import com.google.devtools.build.buildifier.syntax.Node;
import com.google.devtools.build.buildifier.syntax.StringLiteral;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;

/**
 * Sorts the string literals in the lists of order-insensitive attributes.
 *
 * <p>A list is sorted in runs: a blank line or an element that is not a string literal ends a run,
 * and each run is sorted separately. Comments stay with their elements. A list with a comment
 * containing "do not sort" is left alone.
 */
final class ListSortPass implements RewritePass {

  private static final Comparator<Expression> ORDER =
      Comparator.comparing(e -> ((StringLiteral) e).getValue(), RuleAttributes.LABEL_ORDER);

  @Override
  public String name() {
    return "listsort";
  }

  @Override
  public ImmutableList<String> apply(BuildFile file, RewriteConfig config) {
    ImmutableList.Builder<String> changes = ImmutableList.builder();
    for (RuleAttributes.AttributeList attrList : RuleAttributes.sortableLists(file, config)) {
      ListExpression list = attrList.list;
      if (hasDoNotSortComment(attrList.attr) || isMarkedUnsorted(list)) {
        continue;
      }
      List<Expression> elems = new ArrayList<>(list.getElements());
      boolean changed = false;
      int start = 0;
      while (start < elems.size()) {
        if (!(elems.get(start) instanceof StringLiteral)) {
          start++;
          continue;
        }
        int end = start + 1;
        while (end < elems.size()
            && elems.get(end) instanceof StringLiteral
            && !elems.get(end).hasBlankLineBefore()) {
          end++;
        }
        changed |= sortRun(elems.subList(start, end));
        start = end;
      }
      if (changed) {
        list.setElements(ImmutableList.copyOf(elems));
        changes.add(attrList.describe());
      }
    }
    return changes.build();
  }

  // Sorts a run of literals in place. The blank line before the run stays before the run.
  private static boolean sortRun(List<Expression> run) {
    List<Expression> sorted = new ArrayList<>(run);
    sorted.sort(ORDER);
    if (sorted.equals(run)) {
      return false;
    }
    boolean blankLineBefore = run.get(0).hasBlankLineBefore();
    run.get(0).setBlankLineBefore(false);
    sorted.get(0).setBlankLineBefore(blankLineBefore);
    for (int i = 0; i < sorted.size(); i++) {
      run.set(i, sorted.get(i));
    }
    return true;
  }

  private static boolean isMarkedUnsorted(ListExpression list) {
    if (hasDoNotSort(list.getAfterComments())) {
      return true;
    }
    for (Expression elem : list.getElements()) {
      if (hasDoNotSortComment(elem)) {
        return true;
      }
    }
    return false;
  }

  private static boolean hasDoNotSortComment(Node node) {
    return hasDoNotSort(node.getBeforeComments()) || hasDoNotSort(node.getSuffixComments());
  }

  private static boolean hasDoNotSort(List<Comment> comments) {
    for (Comment comment : comments) {
      if (comment.getText().toLowerCase(Locale.ROOT).contains("do not sort")) {
        return true;
      }
    }
    return false;
  }
}
