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

/** Syntax node for list and tuple expressions. */
public final class ListExpression extends Expression {

  private final boolean isTuple;
  private final boolean hasParens;
  private final int lbracketOffset; // -1 => unparenthesized non-empty tuple
  private ImmutableList<Expression> elements;
  private final int rbracketOffset; // -1 => unparenthesized non-empty tuple
  private boolean forceMultiLine;

  ListExpression(
      FileLocations locs,
      boolean isTuple,
      int lbracketOffset,
      ImmutableList<Expression> elements,
      int rbracketOffset) {
    super(locs, Kind.LIST_EXPR);
    // An unparenthesized tuple must be non-empty.
    Preconditions.checkArgument(
        !elements.isEmpty() || (lbracketOffset >= 0 && rbracketOffset >= 0));
    this.lbracketOffset = lbracketOffset;
    this.isTuple = isTuple;
    this.hasParens = lbracketOffset >= 0;
    this.elements = elements;
    this.rbracketOffset = rbracketOffset;
  }

  public ImmutableList<Expression> getElements() {
    return elements;
  }

  public void setElements(ImmutableList<Expression> elements) {
    Preconditions.checkArgument(!elements.isEmpty() || hasParens, "empty unparenthesized tuple");
    this.elements = elements;
  }

  /** Reports whether this is a tuple expression. */
  public boolean isTuple() {
    return isTuple;
  }

  /** Reports whether the expression was written between brackets or parentheses. */
  public boolean hasParens() {
    return hasParens;
  }

  /** Reports whether the closing bracket was on a later line than the opening one. */
  public boolean isForceMultiLine() {
    return forceMultiLine;
  }

  public void setForceMultiLine(boolean forceMultiLine) {
    this.forceMultiLine = forceMultiLine;
  }

  @Override
  public int getStartOffset() {
    return hasParens ? lbracketOffset : elements.get(0).getStartOffset();
  }

  @Override
  public int getEndOffset() {
    // Unlike Python, trailing commas are not allowed in unparenthesized tuples.
    return hasParens ? rbracketOffset + 1 : elements.get(elements.size() - 1).getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
