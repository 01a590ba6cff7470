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
import java.util.List;

/**
 * A SyntaxError represents a lexical or syntactic error in a BUILD file. Scanner and parser errors
 * are both reported this way.
 */
public final class SyntaxError {

  private final Location location;
  private final String message;

  public SyntaxError(Location location, String message) {
    this.location = Preconditions.checkNotNull(location);
    this.message = Preconditions.checkNotNull(message);
  }

  /** Returns the location of the error. */
  public Location location() {
    return location;
  }

  /** Returns a description of the error. */
  public String message() {
    return message;
  }

  /** Returns a string of the form {@code "foo/BUILD:1:2: oops"}. */
  @Override
  public String toString() {
    return location + ": " + message;
  }

  /**
   * A SyntaxError.Exception is an exception holding one or more syntax errors.
   *
   * <p>SyntaxError.Exception messages consist only of the message of the first error.
   */
  public static final class Exception extends java.lang.Exception {

    private final ImmutableList<SyntaxError> errors;

    /** Construct a SyntaxError from a non-empty list of errors. */
    public Exception(List<SyntaxError> errors) {
      super(errors.isEmpty() ? "no errors" : errors.get(0).toString());
      Preconditions.checkArgument(!errors.isEmpty(), "empty error list");
      this.errors = ImmutableList.copyOf(errors);
    }

    /** Returns an immutable non-empty list of errors. */
    public ImmutableList<SyntaxError> errors() {
      return errors;
    }
  }
}
