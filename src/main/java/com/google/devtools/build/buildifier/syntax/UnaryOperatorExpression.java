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

/** A UnaryOperatorExpression represents a unary operator expression, 'op x'. */
public final class UnaryOperatorExpression extends Expression {

  private final TokenKind op; // NOT, TILDE, MINUS or PLUS
  private final int opOffset;
  private Expression x;

  UnaryOperatorExpression(FileLocations locs, TokenKind op, int opOffset, Expression x) {
    super(locs, Kind.UNARY_OPERATOR);
    this.op = op;
    this.opOffset = opOffset;
    this.x = Preconditions.checkNotNull(x);
  }

  /** Returns the operator. */
  public TokenKind getOperator() {
    return op;
  }

  /** Returns the operand. */
  public Expression getX() {
    return x;
  }

  public void setX(Expression x) {
    this.x = Preconditions.checkNotNull(x);
  }

  @Override
  public int getStartOffset() {
    return opOffset;
  }

  @Override
  public int getEndOffset() {
    return x.getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
