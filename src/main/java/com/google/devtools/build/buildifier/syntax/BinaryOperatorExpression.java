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

/** A BinaryExpression represents a binary operator expression 'x op y'. */
public final class BinaryOperatorExpression extends Expression {

  private Expression x;
  private final TokenKind op; // one of 'operators'
  private final int opOffset;
  private Expression y;

  /** Constructs a binary operator expression. */
  BinaryOperatorExpression(
      FileLocations locs, Expression x, TokenKind op, int opOffset, Expression y) {
    super(locs, Kind.BINARY_OPERATOR);
    this.x = Preconditions.checkNotNull(x);
    this.op = op;
    this.opOffset = opOffset;
    this.y = Preconditions.checkNotNull(y);
  }

  /** Returns the left operand. */
  public Expression getX() {
    return x;
  }

  public void setX(Expression x) {
    this.x = Preconditions.checkNotNull(x);
  }

  /** Returns the operator kind. */
  public TokenKind getOperator() {
    return op;
  }

  /** Returns the right operand. */
  public Expression getY() {
    return y;
  }

  public void setY(Expression y) {
    this.y = Preconditions.checkNotNull(y);
  }

  @Override
  public int getStartOffset() {
    return x.getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return y.getEndOffset();
  }

  public Location getOperatorLocation() {
    return locs.getLocation(opOffset);
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
