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
import com.google.common.flogger.GoogleLogger;
import com.google.devtools.build.buildifier.syntax.BuildFile;

/**
 * Rewriter runs the fixed pipeline of rewrite passes over a BUILD file.
 *
 * <p>The passes run once each, in this order:
 *
 * <ol>
 *   <li>{@code callsort}: orders the attributes of rules;
 *   <li>{@code stringconcat}: joins concatenated string literals;
 *   <li>{@code label}: shortens labels;
 *   <li>{@code stringquote}: puts string literals in canonical quotes;
 *   <li>{@code listsort}: sorts the lists of order-insensitive attributes;
 *   <li>{@code dedup}: removes duplicates from those lists;
 *   <li>{@code loadsort}: sorts the symbols of load statements.
 * </ol>
 *
 * <p>No pass undoes the work of an earlier one, so a single run reaches a fixed point.
 */
public final class Rewriter {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** The passes, in the order they run. */
  public static final ImmutableList<RewritePass> PASSES =
      ImmutableList.of(
          new CallSortPass(),
          new StringConcatPass(),
          new LabelPass(),
          new StringQuotePass(),
          new ListSortPass(),
          new DedupPass(),
          new LoadSortPass());

  private Rewriter() {}

  /** Returns the names of all passes, in pipeline order. */
  public static ImmutableList<String> passNames() {
    return PASSES.stream().map(RewritePass::name).collect(ImmutableList.toImmutableList());
  }

  /** Applies the enabled passes to the file in place and returns the changes they made. */
  public static RewriteInfo rewrite(BuildFile file, RewriteConfig config) {
    RewriteInfo info = new RewriteInfo();
    for (RewritePass pass : PASSES) {
      if (config.isDisabled(pass.name())) {
        logger.atFine().log("%s: skipping disabled pass %s", file.getPath(), pass.name());
        continue;
      }
      for (String change : pass.apply(file, config)) {
        logger.atFine().log("%s: %s %s", file.getPath(), pass.name(), change);
        info.add(pass.name(), change);
      }
    }
    return info;
  }
}
