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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.common.io.ByteStreams;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Map;

/**
 * Differ runs an external program to show the difference between two files.
 *
 * <p>The program is taken from the {@code BUILDIFIER_DIFF} environment variable, split at spaces,
 * and defaults to {@code diff -u}. The two file names are appended to the command.
 */
final class Differ {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  static final String ENV_VAR = "BUILDIFIER_DIFF";

  private final ImmutableList<String> command;

  Differ(ImmutableList<String> command) {
    this.command = command;
  }

  /** Returns the differ configured by the given environment. */
  static Differ find(Map<String, String> env) {
    String cmd = env.getOrDefault(ENV_VAR, "");
    if (cmd.isBlank()) {
      return new Differ(ImmutableList.of("diff", "-u"));
    }
    return new Differ(
        ImmutableList.copyOf(Splitter.on(' ').trimResults().omitEmptyStrings().split(cmd)));
  }

  ImmutableList<String> getCommand() {
    return command;
  }

  /**
   * Runs the diff program on the two files and copies its output to {@code out}.
   *
   * @throws IOException if the program cannot be run or reports trouble. Exit status 1 means only
   *     that the files differ.
   */
  void show(String oldFile, String newFile, OutputStream out)
      throws IOException, InterruptedException {
    ImmutableList<String> args =
        ImmutableList.<String>builder().addAll(command).add(oldFile, newFile).build();
    logger.atFine().log("running %s", args);
    Process process = new ProcessBuilder(args).redirectErrorStream(true).start();
    int status;
    try {
      try (InputStream in = process.getInputStream()) {
        ByteStreams.copy(in, out);
      }
      status = process.waitFor();
    } finally {
      process.destroy();
    }
    if (status > 1) {
      throw new IOException(String.format("%s exited with status %d", command.get(0), status));
    }
  }
}
