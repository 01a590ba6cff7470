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


package com.google.devtools.build.buildifier;

/** What the command-line tool does with each file it formats. */
public enum Mode {
  /** Prints the names of the files that need reformatting, with the passes that would apply. */
  CHECK,
  /** Shows the changes as a diff against the original file. */
  DIFF,
  /** Rewrites the files that need reformatting in place. */
  FIX,
  /** Reads standard input and writes the result to standard output. Not selectable by flag. */
  PIPE
}
