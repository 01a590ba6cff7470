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

import static java.nio.charset.StandardCharsets.UTF_8;

import com.google.common.base.Joiner;

/**
 * The apparent name and contents of a source file, for consumption by the parser. The file name
 * appears in the locations of syntax trees and errors.
 */
public final class ParserInput {

  private static final String BYTE_ORDER_MARK = "\uFEFF";

  private final String file;
  private final char[] content;

  private ParserInput(char[] content, String file) {
    this.content = content;
    this.file = file;
  }

  /** Returns the content of the input source. Callers must not modify the result. */
  char[] getContent() {
    return content;
  }

  /** Returns the (non-null) file name of the input source. */
  public String getFile() {
    return file;
  }

  /**
   * Returns an input source that reads from a UTF-8 encoded byte array. A leading byte order mark
   * is not part of the content.
   */
  public static ParserInput fromUTF8(byte[] bytes, String file) {
    String content = new String(bytes, UTF_8);
    if (content.startsWith(BYTE_ORDER_MARK)) {
      content = content.substring(BYTE_ORDER_MARK.length());
    }
    return fromString(content, file);
  }

  /** Returns an input source that reads from the given string. */
  public static ParserInput fromString(String content, String file) {
    return new ParserInput(content.toCharArray(), file);
  }

  /** Returns an unnamed input source that reads from a list of lines. */
  public static ParserInput fromLines(String... lines) {
    return fromString(Joiner.on("\n").join(lines), "");
  }
}
