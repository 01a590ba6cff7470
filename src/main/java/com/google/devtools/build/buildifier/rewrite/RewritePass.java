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

/**
 * A RewritePass is one named, semantics-preserving transformation of a BUILD file.
 *
 * <p>A pass mutates the tree in place. Applying it a second time to its own output must change
 * nothing.
 */
public interface RewritePass {

  /** Returns the name by which the pass is disabled, such as {@code "listsort"}. */
  String name();

  /**
   * Applies the pass to the file.
   *
   * @return one human-readable description per changed node, in the order of the changes
   */
  ImmutableList<String> apply(BuildFile file, RewriteConfig config);
}
