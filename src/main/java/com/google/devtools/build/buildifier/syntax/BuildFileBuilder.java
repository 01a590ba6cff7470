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
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import com.google.errorprone.annotations.CanIgnoreReturnValue;
import java.util.Map;

/**
 * Builds a BUILD file from rule kinds and attribute values. The rules are rendered as text and
 * parsed back, so the result is an ordinary {@link BuildFile}.
 *
 * <p>Attribute values may be strings, booleans, integers, or iterables of strings.
 */
public final class BuildFileBuilder {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final String path;
  private final StringBuilder text = new StringBuilder();

  private BuildFileBuilder(String path) {
    this.path = Preconditions.checkNotNull(path);
  }

  /** Returns a builder for a file with the given logical path. */
  public static BuildFileBuilder create(String path) {
    return new BuildFileBuilder(path);
  }

  /** Appends a rule whose attributes appear in the iteration order of {@code attrs}. */
  @CanIgnoreReturnValue
  public BuildFileBuilder addRule(String kind, Map<String, ?> attrs) {
    Preconditions.checkArgument(Identifier.isValid(kind), "invalid rule kind: %s", kind);
    text.append(kind).append('(');
    String sep = "";
    for (Map.Entry<String, ?> attr : attrs.entrySet()) {
      Preconditions.checkArgument(
          Identifier.isValid(attr.getKey()), "invalid attribute name: %s", attr.getKey());
      text.append(sep).append(attr.getKey()).append(" = ");
      appendValue(attr.getValue());
      sep = ", ";
    }
    text.append(")\n");
    return this;
  }

  /** Appends a rule with only a name. */
  @CanIgnoreReturnValue
  public BuildFileBuilder addRule(String kind, String name) {
    return addRule(kind, ImmutableMap.of("name", name));
  }

  private void appendValue(Object value) {
    if (value instanceof String) {
      text.append(StringLiteral.quote((String) value));
    } else if (value instanceof Boolean) {
      text.append((Boolean) value ? "True" : "False");
    } else if (value instanceof Integer || value instanceof Long) {
      text.append(value);
    } else if (value instanceof Iterable) {
      text.append('[');
      String sep = "";
      for (Object elem : (Iterable<?>) value) {
        Preconditions.checkArgument(elem instanceof String, "not a string: %s", elem);
        text.append(sep).append(StringLiteral.quote((String) elem));
        sep = ", ";
      }
      text.append(']');
    } else {
      throw new IllegalArgumentException("unsupported attribute value: " + value);
    }
  }

  /** Returns the rendered text of the rules added so far. */
  public String getText() {
    return text.toString();
  }

  /** Parses the rendered rules. */
  public BuildFile build() {
    logger.atFine().log("building %s from:\n%s", path, text);
    try {
      return BuildFile.parse(ParserInput.fromString(text.toString(), path));
    } catch (SyntaxError.Exception ex) {
      // Every value is quoted and every name is checked, so the text always parses.
      throw new IllegalStateException("generated BUILD text does not parse: " + ex.errors(), ex);
    }
  }

  /** Returns the rules of {@code kind} in a freshly built file. */
  public ImmutableList<Rule> buildRules(String kind) {
    return build().rules(kind);
  }
}
