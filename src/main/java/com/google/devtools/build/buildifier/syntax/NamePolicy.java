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

/** Decides which source wins when a rule has both a {@code name} and a positional name. */
public enum NamePolicy {
  /** The {@code name} keyword attribute wins over a positional string argument. */
  KEYWORD_FIRST,
  /** The first positional string argument wins over the {@code name} keyword attribute. */
  POSITIONAL_FIRST,
}
