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

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import javax.annotation.Nullable;

/**
 * A Rule is a view of a top-level call statement whose callee is an identifier, such as {@code
 * go_library(name = "x", srcs = [...])}. The callee is the rule kind, and the keyword arguments are
 * the attributes of the rule.
 *
 * <p>Changes made through a Rule are changes to the underlying syntax tree.
 */
public final class Rule {

  private final ExpressionStatement statement;
  private final CallExpression call;

  private Rule(ExpressionStatement statement, CallExpression call) {
    this.statement = statement;
    this.call = call;
  }

  /** Returns a view of the statement as a rule, or null if it is not a rule invocation. */
  @Nullable
  static Rule of(Statement stmt) {
    if (stmt.kind() != Statement.Kind.EXPRESSION) {
      return null;
    }
    Expression expr = ((ExpressionStatement) stmt).getExpression();
    if (expr.kind() != Expression.Kind.CALL) {
      return null;
    }
    CallExpression call = (CallExpression) expr;
    if (call.getFunction().kind() != Expression.Kind.IDENTIFIER) {
      return null;
    }
    return new Rule((ExpressionStatement) stmt, call);
  }

  /** Returns the statement that holds the call. */
  public ExpressionStatement getStatement() {
    return statement;
  }

  public CallExpression getCall() {
    return call;
  }

  /** Returns the rule kind, the name of the called function. */
  public String getKind() {
    return ((Identifier) call.getFunction()).getName();
  }

  /** Returns the name of the rule, giving the {@code name} attribute precedence. */
  public String getName() {
    return getName(NamePolicy.KEYWORD_FIRST);
  }

  /**
   * Returns the name of the rule: the value of the {@code name} attribute, or the first positional
   * argument if it is a string literal, in the order given by the policy. Returns the empty string
   * if neither is present.
   */
  public String getName(NamePolicy policy) {
    String keyword = getAttrString("name");
    String positional = getPositionalName();
    String first = policy == NamePolicy.KEYWORD_FIRST ? keyword : positional;
    String second = policy == NamePolicy.KEYWORD_FIRST ? positional : keyword;
    if (first != null) {
      return first;
    }
    return second != null ? second : "";
  }

  @Nullable
  private String getPositionalName() {
    for (Argument arg : call.getArguments()) {
      if (arg instanceof Argument.Positional) {
        Expression value = arg.getValue();
        return value.kind() == Expression.Kind.STRING_LITERAL
            ? ((StringLiteral) value).getValue()
            : null;
      }
    }
    return null;
  }

  @Nullable
  private Argument.Keyword getKeyword(String key) {
    for (Argument arg : call.getArguments()) {
      if (key.equals(arg.getName())) {
        return (Argument.Keyword) arg;
      }
    }
    return null;
  }

  /** Returns the value of the attribute, or null if the rule has no such attribute. */
  @Nullable
  public Expression getAttr(String key) {
    Argument.Keyword arg = getKeyword(key);
    return arg == null ? null : arg.getValue();
  }

  public boolean hasAttr(String key) {
    return getKeyword(key) != null;
  }

  /** Returns the attribute names in their current order. */
  public ImmutableList<String> getAttrKeys() {
    ImmutableList.Builder<String> keys = ImmutableList.builder();
    for (Argument arg : call.getArguments()) {
      if (arg.getName() != null) {
        keys.add(arg.getName());
      }
    }
    return keys.build();
  }

  /** Returns the value of a string attribute, or null if it is absent or not a string literal. */
  @Nullable
  public String getAttrString(String key) {
    Expression value = getAttr(key);
    if (value == null || value.kind() != Expression.Kind.STRING_LITERAL) {
      return null;
    }
    return ((StringLiteral) value).getValue();
  }

  /**
   * Returns the values of an attribute that is a list of string literals, or null if it is absent
   * or not such a list.
   */
  @Nullable
  public ImmutableList<String> getAttrStrings(String key) {
    Expression value = getAttr(key);
    if (value == null || value.kind() != Expression.Kind.LIST_EXPR) {
      return null;
    }
    ImmutableList.Builder<String> strings = ImmutableList.builder();
    for (Expression elem : ((ListExpression) value).getElements()) {
      if (elem.kind() != Expression.Kind.STRING_LITERAL) {
        return null;
      }
      strings.add(((StringLiteral) elem).getValue());
    }
    return strings.build();
  }

  /** Sets the value of an attribute, adding it after the existing arguments if it is absent. */
  public void setAttr(String key, Expression value) {
    Preconditions.checkArgument(Identifier.isValid(key), "invalid attribute name: %s", key);
    Argument.Keyword existing = getKeyword(key);
    if (existing != null) {
      existing.setValue(value);
      return;
    }
    Identifier id = new Identifier(call.locs, key, call.getEndOffset() - 1);
    call.setArguments(
        ImmutableList.<Argument>builder()
            .addAll(call.getArguments())
            .add(new Argument.Keyword(call.locs, id, value))
            .build());
  }

  /**
   * Removes an attribute. Its comments are dropped along with it.
   *
   * @return whether the rule had the attribute
   */
  @CanIgnoreReturnValue
  public boolean delAttr(String key) {
    Argument.Keyword existing = getKeyword(key);
    if (existing == null) {
      return false;
    }
    ImmutableList.Builder<Argument> args = ImmutableList.builder();
    for (Argument arg : call.getArguments()) {
      if (arg != existing) {
        args.add(arg);
      }
    }
    call.setArguments(args.build());
    return true;
  }

  @Override
  public String toString() {
    return getKind() + "(name = " + StringLiteral.quote(getName()) + ")";
  }
}
