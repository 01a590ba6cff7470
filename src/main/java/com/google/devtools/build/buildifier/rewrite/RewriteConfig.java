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

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableSet;

/**
 * RewriteConfig holds the options of one {@link Rewriter#rewrite} call.
 *
 * <p>A configuration is an immutable value. It is passed explicitly to each call, so files may be
 * rewritten concurrently, and differently, within one process.
 */
@AutoValue
public abstract class RewriteConfig {

  /** The default configuration: all passes enabled, only the built-in sortable attributes. */
  public static final RewriteConfig DEFAULT = builder().build();

  /** The names of the passes to skip, such as {@code "listsort"}. */
  public abstract ImmutableSet<String> disabledRewrites();

  /**
   * Additional contexts in which lists may be reordered. Each entry is an attribute name such as
   * {@code "resources"}, which applies to all rule kinds, or {@code "kind.attr"} such as {@code
   * "java_library.exports"}, which applies to one.
   */
  public abstract ImmutableSet<String> allowSort();

  /** Reports whether the pass with the given name is disabled. */
  public boolean isDisabled(String passName) {
    return disabledRewrites().contains(passName);
  }

  public static Builder builder() {
    return new AutoValue_RewriteConfig.Builder()
        .disabledRewrites(ImmutableSet.of())
        .allowSort(ImmutableSet.of());
  }

  public abstract Builder toBuilder();

  /** Builder for {@link RewriteConfig}. */
  @AutoValue.Builder
  public abstract static class Builder {
    public abstract Builder disabledRewrites(Iterable<String> names);

    public abstract Builder allowSort(Iterable<String> contexts);

    public abstract RewriteConfig build();
  }
}
