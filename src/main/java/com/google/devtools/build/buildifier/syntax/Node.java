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
 * A Node is a node in a BUILD file syntax tree.
 *
 * <p>Besides its syntax, every node carries the comments and blank-line layout ("trivia") that
 * surround it in the source, so that the formatter can reproduce them:
 *
 * <ul>
 *   <li>before comments: whole-line comments directly before the node;
 *   <li>suffix comments: the comment on the line where the node (and its comma) ends;
 *   <li>after comments: for containers, comments after the last element;
 *   <li>whether a blank line separated the node from its predecessor.
 * </ul>
 */
public abstract class Node {

  // The underlying file's table of line starting offsets.
  final FileLocations locs;

  private ImmutableList<Comment> beforeComments = ImmutableList.of();
  private ImmutableList<Comment> suffixComments = ImmutableList.of();
  private ImmutableList<Comment> afterComments = ImmutableList.of();
  private boolean blankLineBefore;

  Node(FileLocations locs) {
    this.locs = Preconditions.checkNotNull(locs);
  }

  /** Returns the offset of the start of this node within its file's buffer. */
  public abstract int getStartOffset();

  /** Returns the offset of the end of this node within its file's buffer. */
  public abstract int getEndOffset();

  /** Returns the location of the start of this node. */
  public final Location getStartLocation() {
    return locs.getLocation(getStartOffset());
  }

  /** Returns the location of the end of this node. */
  public Location getEndLocation() {
    return locs.getLocation(getEndOffset());
  }

  /** Returns the whole-line comments that precede this node. */
  public ImmutableList<Comment> getBeforeComments() {
    return beforeComments;
  }

  public void setBeforeComments(ImmutableList<Comment> comments) {
    this.beforeComments = Preconditions.checkNotNull(comments);
  }

  /** Returns the comments at the end of the last line of this node. */
  public ImmutableList<Comment> getSuffixComments() {
    return suffixComments;
  }

  public void setSuffixComments(ImmutableList<Comment> comments) {
    this.suffixComments = Preconditions.checkNotNull(comments);
  }

  /** Returns the comments between the last element of a container and its closing bracket. */
  public ImmutableList<Comment> getAfterComments() {
    return afterComments;
  }

  public void setAfterComments(ImmutableList<Comment> comments) {
    this.afterComments = Preconditions.checkNotNull(comments);
  }

  /** Reports whether any comment is attached to this node. */
  public boolean hasComments() {
    return !beforeComments.isEmpty() || !suffixComments.isEmpty() || !afterComments.isEmpty();
  }

  /** Moves the before and suffix comments of {@code other} in front of this node's comments. */
  public void absorbComments(Node other) {
    beforeComments =
        ImmutableList.<Comment>builder()
            .addAll(other.getBeforeComments())
            .addAll(other.getSuffixComments())
            .addAll(beforeComments)
            .build();
    other.setBeforeComments(ImmutableList.of());
    other.setSuffixComments(ImmutableList.of());
  }

  /** Reports whether one or more blank lines preceded this node in its container. */
  public boolean hasBlankLineBefore() {
    return blankLineBefore;
  }

  public void setBlankLineBefore(boolean blankLineBefore) {
    this.blankLineBefore = blankLineBefore;
  }

  /**
   * Implements the double dispatch by calling into the node specific <code>visit</code> method of
   * the {@link NodeVisitor}
   *
   * @param visitor the {@link NodeVisitor} instance to dispatch to.
   */
  public abstract void accept(NodeVisitor visitor);
}
