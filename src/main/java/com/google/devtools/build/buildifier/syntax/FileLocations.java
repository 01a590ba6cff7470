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
import java.util.Arrays;

/**
 * FileLocations maps each char offset of a file to a {@link Location}. It is shared by all the
 * nodes parsed from one file.
 */
final class FileLocations {

  private final int[] linestart; // linestart[i] is the offset of the start of line i+1
  private final String file;
  private final int size; // size of file in chars

  private FileLocations(int[] linestart, String file, int size) {
    this.linestart = linestart;
    this.file = file;
    this.size = size;
  }

  static FileLocations create(char[] buffer, String file) {
    return new FileLocations(computeLinestart(buffer), file, buffer.length);
  }

  private static int[] computeLinestart(char[] buffer) {
    // Compute the size.
    int size = 1;
    for (char c : buffer) {
      if (c == '\n') {
        size++;
      }
    }

    // Populate the array.
    int[] linestart = new int[size];
    int i = 0;
    linestart[i++] = 0;
    for (int pos = 0; pos < buffer.length; pos++) {
      if (buffer[pos] == '\n') {
        linestart[i++] = pos + 1;
      }
    }
    return linestart;
  }

  String file() {
    return file;
  }

  int size() {
    return size;
  }

  /** Returns the 1-based line number of the given offset. */
  int getLine(int offset) {
    Preconditions.checkArgument(offset >= 0, "negative offset %s", offset);
    // Binary search: find the greatest line start <= offset.
    int i = Arrays.binarySearch(linestart, offset);
    if (i < 0) {
      i = -i - 2; // insertion point - 1
    }
    return i + 1;
  }

  Location getLocation(int offset) {
    int line = getLine(offset);
    int column = offset - linestart[line - 1] + 1;
    return new Location(file, offset, line, column);
  }
}
