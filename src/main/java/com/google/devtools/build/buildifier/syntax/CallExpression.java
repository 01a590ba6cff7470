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

/** Syntax node for a function call expression. */
public final class CallExpression extends Expression {

  private final Expression function;
  private final int lparenOffset;
  private ImmutableList<Argument> arguments;
  private final int rparenOffset;
  private boolean forceMultiLine;

  CallExpression(
      FileLocations locs,
      Expression function,
      int lparenOffset,
      ImmutableList<Argument> arguments,
      int rparenOffset) {
    super(locs, Kind.CALL);
    this.function = Preconditions.checkNotNull(function);
    this.lparenOffset = lparenOffset;
    this.arguments = arguments;
    this.rparenOffset = rparenOffset;
  }

  /** Returns the function that is called. */
  public Expression getFunction() {
    return this.function;
  }

  /** Returns the function arguments. */
  public ImmutableList<Argument> getArguments() {
    return arguments;
  }

  public void setArguments(ImmutableList<Argument> arguments) {
    this.arguments = Preconditions.checkNotNull(arguments);
  }

  /** Reports whether any argument has the form {@code *args} or {@code **kwargs}. */
  public boolean hasStarArguments() {
    for (Argument arg : arguments) {
      if (arg instanceof Argument.Star || arg instanceof Argument.StarStar) {
        return true;
      }
    }
    return false;
  }

  /** Reports whether the closing parenthesis was on a later line than the opening one. */
  public boolean isForceMultiLine() {
    return forceMultiLine;
  }

  public void setForceMultiLine(boolean forceMultiLine) {
    this.forceMultiLine = forceMultiLine;
  }

  @Override
  public int getStartOffset() {
    return function.getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return rparenOffset + 1;
  }

  /** Returns the location of the open-paren token. */
  public Location getLparenLocation() {
    return locs.getLocation(lparenOffset);
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
