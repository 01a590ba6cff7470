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

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.devtools.build.buildifier.syntax.Argument;
import com.google.devtools.build.buildifier.syntax.BinaryOperatorExpression;
import com.google.devtools.build.buildifier.syntax.BuildFile;
import com.google.devtools.build.buildifier.syntax.CallExpression;
import com.google.devtools.build.buildifier.syntax.DictExpression;
import com.google.devtools.build.buildifier.syntax.Expression;
import com.google.devtools.build.buildifier.syntax.Identifier;
import com.google.devtools.build.buildifier.syntax.ListExpression;
import com.google.devtools.build.buildifier.syntax.Rule;
import com.google.devtools.build.buildifier.syntax.StringLiteral;
import com.google.devtools.build.buildifier.syntax.TokenKind;
import java.util.Comparator;
import java.util.List;
import javax.annotation.Nullable;

/** Knowledge about rule attributes shared by the passes, and helpers to find their values. */
final class RuleAttributes {

  private RuleAttributes() {}

  /** Attributes whose list values have set semantics, so their order may change. */
  static final ImmutableSet<String> SORTABLE =
      ImmutableSet.of(
          "constraints",
          "data",
          "deps",
          "exported_deps",
          "exported_plugins",
          "exports",
          "filegroups",
          "files",
          "hdrs",
          "implementation_deps",
          "plugins",
          "resources",
          "runtime_deps",
          "srcs",
          "tags",
          "textual_hdrs",
          "visibility");

  /** Rule-specific exceptions to {@link #SORTABLE}, as {@code "kind.attr"}. */
  static final ImmutableSet<String> NOT_SORTABLE =
      ImmutableSet.of("genrule.srcs", "sh_binary.srcs", "sh_library.srcs", "sh_test.srcs");

  /** Attributes whose string values are labels. */
  static final ImmutableSet<String> LABELS =
      ImmutableSet.of(
          "actual",
          "data",
          "deps",
          "exported_deps",
          "exported_plugins",
          "exports",
          "hdrs",
          "implementation_deps",
          "plugins",
          "resources",
          "runtime_deps",
          "src",
          "srcs",
          "textual_hdrs",
          "tools");

  /** Reports whether the lists of an attribute may be reordered. */
  static boolean isSortable(String kind, String attr, RewriteConfig config) {
    String context = kind + "." + attr;
    if (config.allowSort().contains(attr) || config.allowSort().contains(context)) {
      return true;
    }
    return SORTABLE.contains(attr) && !NOT_SORTABLE.contains(context);
  }

  /**
   * Orders labels and file names: local names ({@code ":x"} or {@code "x.cc"}) first, then labels
   * in the main repository, then labels in external repositories. Within a group, labels are
   * ordered by package, then by name.
   */
  static final Comparator<String> LABEL_ORDER =
      (a, b) ->
          ComparisonChain.start()
              .compare(phase(a), phase(b))
              .compare(packageOf(a), packageOf(b))
              .compare(nameOf(a), nameOf(b))
              .result();

  private static int phase(String label) {
    if (label.startsWith("//")) {
      return 1;
    }
    if (label.startsWith("@")) {
      return 2;
    }
    return 0;
  }

  private static String packageOf(String label) {
    int colon = label.indexOf(':');
    if (phase(label) == 0) {
      return "";
    }
    return colon < 0 ? label : label.substring(0, colon);
  }

  private static String nameOf(String label) {
    int colon = label.indexOf(':');
    if (phase(label) == 0) {
      return colon == 0 ? label.substring(1) : label;
    }
    return colon < 0 ? "" : label.substring(colon + 1);
  }

  /** Returns a short description of a rule attribute for the change log. */
  static String describe(Rule rule, String attr) {
    return describe(rule) + "." + attr;
  }

  static String describe(Rule rule) {
    String name = rule.getName();
    return name.isEmpty() ? rule.getKind() : rule.getKind() + "(" + name + ")";
  }

  /** A list in the value of a rule attribute. */
  static final class AttributeList {
    final Rule rule;
    final Argument.Keyword attr;
    final ListExpression list;

    AttributeList(Rule rule, Argument.Keyword attr, ListExpression list) {
      this.rule = rule;
      this.attr = attr;
      this.list = list;
    }

    String describe() {
      return RuleAttributes.describe(rule, attr.getName());
    }
  }

  /** Returns the lists in the sortable attributes of the top-level rules of the file. */
  static ImmutableList<AttributeList> sortableLists(BuildFile file, RewriteConfig config) {
    ImmutableList.Builder<AttributeList> result = ImmutableList.builder();
    for (Rule rule : file.rules("")) {
      for (Argument arg : rule.getCall().getArguments()) {
        if (arg instanceof Argument.Keyword keyword
            && isSortable(rule.getKind(), keyword.getName(), config)) {
          for (ListExpression list : lists(keyword.getValue())) {
            result.add(new AttributeList(rule, keyword, list));
          }
        }
      }
    }
    return result.build();
  }

  /**
   * Returns the lists that make up an attribute value: the value itself, the operands of {@code +},
   * and the branches of {@code select()}.
   */
  static ImmutableList<ListExpression> lists(Expression value) {
    ImmutableList.Builder<ListExpression> result = ImmutableList.builder();
    for (Expression part : parts(value)) {
      if (part instanceof ListExpression list) {
        result.add(list);
      }
    }
    return result.build();
  }

  /** Returns the string literals of an attribute value, including the elements of its lists. */
  static ImmutableList<StringLiteral> strings(Expression value) {
    ImmutableList.Builder<StringLiteral> result = ImmutableList.builder();
    for (Expression part : parts(value)) {
      if (part instanceof StringLiteral str) {
        result.add(str);
      } else {
        for (Expression elem : ((ListExpression) part).getElements()) {
          if (elem instanceof StringLiteral str) {
            result.add(str);
          }
        }
      }
    }
    return result.build();
  }

  // Returns the lists and string literals that an attribute value is built from.
  private static ImmutableList<Expression> parts(Expression value) {
    ImmutableList.Builder<Expression> parts = ImmutableList.builder();
    addParts(value, parts);
    return parts.build();
  }

  private static void addParts(Expression value, ImmutableList.Builder<Expression> parts) {
    switch (value.kind()) {
      case STRING_LITERAL -> parts.add(value);
      case LIST_EXPR -> {
        if (!((ListExpression) value).isTuple()) {
          parts.add(value);
        }
      }
      case BINARY_OPERATOR -> {
        BinaryOperatorExpression binop = (BinaryOperatorExpression) value;
        if (binop.getOperator() == TokenKind.PLUS) {
          addParts(binop.getX(), parts);
          addParts(binop.getY(), parts);
        }
      }
      case CALL -> {
        DictExpression branches = selectBranches((CallExpression) value);
        if (branches != null) {
          for (DictExpression.Entry entry : branches.getEntries()) {
            addParts(entry.getValue(), parts);
          }
        }
      }
      default -> {}
    }
  }

  // Returns the dict argument of a select() call, or null if the call is something else.
  @Nullable
  private static DictExpression selectBranches(CallExpression call) {
    List<Argument> args = call.getArguments();
    if (call.getFunction() instanceof Identifier fn
        && fn.getName().equals("select")
        && !args.isEmpty()
        && args.get(0) instanceof Argument.Positional
        && args.get(0).getValue() instanceof DictExpression dict) {
      return dict;
    }
    return null;
  }
}
