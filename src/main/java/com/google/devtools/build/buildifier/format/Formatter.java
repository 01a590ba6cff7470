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


package com.google.devtools.build.buildifier.format;

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.devtools.build.buildifier.syntax.BuildFile;

/**
 * Formatter prints a {@link BuildFile} in canonical form.
 *
 * <p>The output uses four spaces of indentation per nesting level and ends every line, including
 * the last, with a single {@code '\n'}. Comments and blank lines recorded in the tree are kept;
 * runs of blank lines become one. Formatting is a pure function of the tree: parsing the output
 * and formatting it again yields the same text.
 */
public final class Formatter {

  private Formatter() {}

  /** Returns the canonical text of the file, encoded as UTF-8. */
  public static byte[] format(BuildFile file) {
    return formatToString(file).getBytes(UTF_8);
  }

  /** Returns the canonical text of the file. */
  public static String formatToString(BuildFile file) {
    Printer printer = new Printer();
    printer.printFile(file);
    return printer.toString();
  }
}
