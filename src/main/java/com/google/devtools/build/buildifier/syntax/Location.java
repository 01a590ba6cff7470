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
import java.util.Objects;

/**
 * A Location denotes a position within a BUILD file: a file name, a char offset, and a 1-based line
 * and column number. Column zero means the column is unknown.
 */
public final class Location implements Comparable<Location> {

  private final String file;
  private final int offset;
  private final int line;
  private final int column;

  public Location(String file, int offset, int line, int column) {
    this.file = Preconditions.checkNotNull(file);
    this.offset = offset;
    this.line = line;
    this.column = column;
  }

  /** Returns the name of the file containing this location. */
  public String file() {
    return file;
  }

  /** Returns the char offset of this location from the start of the file. */
  public int offset() {
    return offset;
  }

  /** Returns the line number of this location. */
  public int line() {
    return line;
  }

  /** Returns the column number of this location. */
  public int column() {
    return column;
  }

  /**
   * Formats the location as {@code "file:line:col"}. If the file name is empty, it is omitted,
   * giving {@code "line:col"}.
   */
  @Override
  public String toString() {
    StringBuilder buf = new StringBuilder();
    if (!file.isEmpty()) {
      buf.append(file).append(':');
    }
    buf.append(line);
    if (column > 0) {
      buf.append(':').append(column);
    }
    return buf.toString();
  }

  @Override
  public int compareTo(Location that) {
    int cmp = this.file.compareTo(that.file);
    if (cmp != 0) {
      return cmp;
    }
    return Integer.compare(this.offset, that.offset);
  }

  @Override
  public boolean equals(Object that) {
    return this == that
        || (that instanceof Location loc
            && this.file.equals(loc.file)
            && this.offset == loc.offset
            && this.line == loc.line
            && this.column == loc.column);
  }

  @Override
  public int hashCode() {
    return Objects.hash(file, offset, line, column);
  }
}
