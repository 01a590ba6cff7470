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

/**
 * A run of whole-line comments at the top level of a file that is not attached to the following
 * statement, either because a blank line separates them or because no statement follows.
 */
public final class CommentBlock extends Statement {

  private final ImmutableList<Comment> comments;

  CommentBlock(FileLocations locs, ImmutableList<Comment> comments) {
    super(locs);
    Preconditions.checkArgument(!comments.isEmpty(), "empty comment block");
    this.comments = comments;
  }

  public ImmutableList<Comment> getComments() {
    return comments;
  }

  @Override
  public int getStartOffset() {
    return comments.get(0).getStartOffset();
  }

  @Override
  public int getEndOffset() {
    return comments.get(comments.size() - 1).getEndOffset();
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  @Override
  public Kind kind() {
    return Kind.COMMENT_BLOCK;
  }
}
