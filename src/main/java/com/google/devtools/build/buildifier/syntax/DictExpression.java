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

/** Syntax node for dict expressions. */
public final class DictExpression extends Expression {

  /** A key/value pair in a dict expression or comprehension. */
  public static final class Entry extends Node {

    private Expression key;
    private Expression value;

    Entry(FileLocations locs, Expression key, Expression value) {
      super(locs);
      this.key = key;
      this.value = value;
    }

    public Expression getKey() {
      return key;
    }

    public void setKey(Expression key) {
      this.key = Preconditions.checkNotNull(key);
    }

    public Expression getValue() {
      return value;
    }

    public void setValue(Expression value) {
      this.value = Preconditions.checkNotNull(value);
    }

    @Override
    public int getStartOffset() {
      return key.getStartOffset();
    }

    @Override
    public int getEndOffset() {
      return value.getEndOffset();
    }

    @Override
    public void accept(NodeVisitor visitor) {
      visitor.visit(this);
    }
  }

  private final int lbraceOffset;
  private ImmutableList<Entry> entries;
  private final int rbraceOffset;
  private boolean forceMultiLine;

  DictExpression(
      FileLocations locs, int lbraceOffset, ImmutableList<Entry> entries, int rbraceOffset) {
    super(locs, Kind.DICT_EXPR);
    this.lbraceOffset = lbraceOffset;
    this.entries = entries;
    this.rbraceOffset = rbraceOffset;
  }

  public ImmutableList<Entry> getEntries() {
    return entries;
  }

  public void setEntries(ImmutableList<Entry> entries) {
    this.entries = Preconditions.checkNotNull(entries);
  }

  /** Reports whether the closing brace was on a later line than the opening one. */
  public boolean isForceMultiLine() {
    return forceMultiLine;
  }

  public void setForceMultiLine(boolean forceMultiLine) {
    this.forceMultiLine = forceMultiLine;
  }

  @Override
  public int getStartOffset() {
    return lbraceOffset;
  }

  @Override
  public int getEndOffset() {
    return rbraceOffset + 1;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }
}
