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

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.LinkedHashMultiset;
import com.google.common.collect.Multiset;
import java.util.ArrayList;
import java.util.List;

/**
 * RewriteInfo records the changes made by one {@link Rewriter#rewrite} call.
 *
 * <p>Each log entry has the form {@code "<pass> <description>"}. The summary lists the passes that
 * changed something, in pipeline order.
 */
public final class RewriteInfo {

  private final List<String> log = new ArrayList<>();
  private final Multiset<String> counts = LinkedHashMultiset.create();

  void add(String pass, String description) {
    log.add(pass + " " + description);
    counts.add(pass);
  }

  /** Returns the log entries in the order the changes were made. */
  public ImmutableList<String> getLog() {
    return ImmutableList.copyOf(log);
  }

  /** Returns the number of changes made by the named pass. */
  public int count(String pass) {
    return counts.count(pass);
  }

  /** Reports whether no pass changed anything. */
  public boolean isEmpty() {
    return log.isEmpty();
  }

  /** Returns the names of the passes that made changes, separated by spaces. */
  public String summary() {
    return Joiner.on(' ').join(counts.elementSet());
  }

  @Override
  public String toString() {
    return summary();
  }
}
