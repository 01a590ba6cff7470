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
import java.util.ArrayList;

/**
 * Syntax node for a string literal.
 *
 * <p>A string literal remembers its source text, so that raw strings, triple-quoted strings and the
 * choice of quote character survive formatting. Rewrites may replace the text through {@link
 * #setValue} or {@link #setRaw}.
 */
public final class StringLiteral extends Expression {

  private final int startOffset;
  private final int endOffset;
  private String raw;
  private String value;

  StringLiteral(FileLocations locs, int startOffset, String raw, String value, int endOffset) {
    super(locs, Kind.STRING_LITERAL);
    this.startOffset = startOffset;
    this.raw = raw;
    this.value = value;
    this.endOffset = endOffset;
  }

  /** Returns the value denoted by the string literal */
  public String getValue() {
    return value;
  }

  /** Returns the source text of the literal, including prefix and quotes. */
  public String getRaw() {
    return raw;
  }

  /** Reports whether the literal has an {@code r} prefix. */
  public boolean isRawString() {
    return raw.startsWith("r");
  }

  /** Reports whether the literal is delimited by triple quotes. */
  public boolean isTripleQuoted() {
    String body = isRawString() ? raw.substring(1) : raw;
    char q = body.charAt(0);
    return body.length() >= 6 && body.charAt(1) == q && body.charAt(2) == q;
  }

  /** Returns the quote character, either {@code '"'} or {@code '\''}. */
  public char getQuoteChar() {
    return raw.charAt(isRawString() ? 1 : 0);
  }

  /** Reports whether the literal uses neither the {@code r} prefix nor triple quotes. */
  public boolean isPlain() {
    return !isRawString() && !isTripleQuoted();
  }

  /**
   * Replaces the value of the literal. A plain literal keeps its quote character; raw and
   * triple-quoted literals become plain double-quoted ones.
   */
  public void setValue(String value) {
    this.raw = quote(value, isPlain() ? getQuoteChar() : '"');
    this.value = value;
  }

  /**
   * Replaces the source text of the literal.
   *
   * @throws IllegalArgumentException if {@code raw} is not a valid string literal.
   */
  public void setRaw(String raw) {
    this.value = unquote(raw);
    this.raw = raw;
  }

  @Override
  public int getStartOffset() {
    return startOffset;
  }

  @Override
  public int getEndOffset() {
    return endOffset;
  }

  @Override
  public void accept(NodeVisitor visitor) {
    visitor.visit(this);
  }

  /** Returns the canonical double-quoted literal for {@code value}. */
  public static String quote(String value) {
    return quote(value, '"');
  }

  /**
   * Returns a literal delimited by {@code q} whose value is {@code value}.
   *
   * <p>Newlines, tabs, carriage returns, backslashes and the quote character are escaped, and other
   * control characters are written as octal escapes. A backslash that cannot be mistaken for the
   * start of an escape sequence is written bare, so that regular expressions such as {@code "\d"}
   * keep their usual spelling.
   */
  public static String quote(String value, char q) {
    Preconditions.checkArgument(q == '"' || q == '\'', "bad quote character: %s", q);
    StringBuilder buf = new StringBuilder(value.length() + 2);
    buf.append(q);
    for (int i = 0; i < value.length(); i++) {
      char c = value.charAt(i);
      switch (c) {
        case '\n':
          buf.append("\\n");
          break;
        case '\r':
          buf.append("\\r");
          break;
        case '\t':
          buf.append("\\t");
          break;
        case '\\':
          if (i + 1 < value.length() && !isEscapeChar(value.charAt(i + 1))) {
            buf.append('\\');
          } else {
            buf.append("\\\\");
          }
          break;
        default:
          if (c == q) {
            buf.append('\\').append(c);
          } else if (c < 0x20 || c == 0x7f) {
            buf.append(String.format("\\%03o", (int) c));
          } else {
            buf.append(c);
          }
          break;
      }
    }
    buf.append(q);
    return buf.toString();
  }

  // Reports whether a backslash followed by c would be read as (or rejected as) an escape.
  private static boolean isEscapeChar(char c) {
    switch (c) {
      case 'n': case 'r': case 't': case '\\': case '\'': case '"':
      case '0': case '1': case '2': case '3': case '4': case '5': case '6': case '7':
      case '\n': case '\r':
      case 'a': case 'b': case 'f': case 'u': case 'U': case 'v': case 'x':
        return true;
      default:
        return false;
    }
  }

  /**
   * Returns the value denoted by the string literal s.
   *
   * @throws IllegalArgumentException if s does not contain a valid string literal.
   */
  public static String unquote(String s) {
    ArrayList<SyntaxError> errors = new ArrayList<>();
    Lexer lexer = new Lexer(ParserInput.fromLines(s), errors);
    lexer.nextToken();
    if (!errors.isEmpty()) {
      throw new IllegalArgumentException(errors.get(0).message());
    }
    if (lexer.start != 0 || lexer.end != s.length() || lexer.kind != TokenKind.STRING) {
      throw new IllegalArgumentException("invalid syntax");
    }
    return (String) lexer.value;
  }
}
