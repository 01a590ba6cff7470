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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.flogger.GoogleLogger;
import com.google.common.io.ByteStreams;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.devtools.build.buildifier.format.Formatter;
import com.google.devtools.build.buildifier.rewrite.RewriteConfig;
import com.google.devtools.build.buildifier.rewrite.RewriteInfo;
import com.google.devtools.build.buildifier.rewrite.Rewriter;
import com.google.devtools.build.buildifier.syntax.BuildFile;
import com.google.devtools.build.buildifier.syntax.SyntaxError;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.logging.ConsoleHandler;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.CmdLineException;
import org.kohsuke.args4j.CmdLineParser;
import org.kohsuke.args4j.Option;
import org.kohsuke.args4j.OptionDef;
import org.kohsuke.args4j.spi.Parameters;
import org.kohsuke.args4j.spi.Setter;

/**
 * Buildifier applies a standard formatting to the named BUILD files.
 *
 * <p>The mode flag selects the processing: check, diff, or fix. In check mode, buildifier prints a
 * list of files that need reformatting. In diff mode, it shows the diffs that it would make. In fix
 * mode, it updates the files that need reformatting and, with {@code -v}, prints their names to
 * standard error. The default mode is fix. {@code -d} is an alias for {@code -mode=diff}.
 *
 * <p>If no files are listed, buildifier reads a BUILD file from standard input and writes the
 * formatted file to standard output, even if no changes are necessary.
 *
 * <p>The exit status is 0 on success, 1 if some file has syntax errors, 2 on usage errors, and 3
 * on I/O errors or internal errors.
 */
public final class Buildifier {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  static final int EXIT_OK = 0;
  static final int EXIT_SYNTAX_ERROR = 1;
  static final int EXIT_USAGE = 2;
  static final int EXIT_ERROR = 3;

  // Held so that the level set by -v is not lost when the logger is collected.
  private static final Logger packageLogger =
      Logger.getLogger(Buildifier.class.getPackage().getName());

  /** Command line options. */
  public static class Options {
    @Option(name = "-mode", usage = "formatting mode: check, diff, or fix (default fix)")
    public Mode mode;

    @Option(name = "-d", handler = BooleanOptionHandler.class, usage = "alias for -mode=diff")
    public boolean diff;

    @Option(
        name = "-v",
        handler = BooleanOptionHandler.class,
        usage = "print verbose information on standard error")
    public boolean verbose;

    @Option(
        name = "-path",
        usage = "assume BUILD file has this path relative to the workspace directory")
    public String path = "";

    @Option(
        name = "-showlog",
        handler = BooleanOptionHandler.class,
        usage = "show the rewrite log in check mode")
    public boolean showLog;

    @Option(name = "-allowsort", usage = "additional sort contexts to treat as safe")
    public String allowSort = "";

    @Option(name = "-buildifier_disable", usage = "list of buildifier rewrites to disable")
    public String disable = "";

    @Argument(metaVar = "files", multiValued = true)
    public List<String> files = new ArrayList<>();
  }

  private final Options options;
  private final Mode mode;
  private final RewriteConfig config;
  private final Differ differ;
  private final PrintStream stdout;
  private final PrintStream stderr;

  private Buildifier(
      Options options, Mode mode, Differ differ, PrintStream stdout, PrintStream stderr) {
    this.options = options;
    this.mode = mode;
    this.config =
        RewriteConfig.builder()
            .disabledRewrites(splitList(options.disable))
            .allowSort(splitList(options.allowSort))
            .build();
    this.differ = differ;
    this.stdout = stdout;
    this.stderr = stderr;
  }

  public static void main(String[] args) {
    System.exit(run(args, System.in, System.out, System.err, System.getenv()));
  }

  /** Runs the tool with the given arguments and streams, and returns the exit status. */
  @VisibleForTesting
  static int run(
      String[] args,
      InputStream stdin,
      PrintStream stdout,
      PrintStream stderr,
      Map<String, String> env) {
    Options options = new Options();
    CmdLineParser parser = new CmdLineParser(options);
    try {
      parser.parseArgument(args);
    } catch (CmdLineException e) {
      stderr.println("buildifier: " + e.getMessage());
      printUsage(parser, stderr);
      return EXIT_USAGE;
    }

    Mode mode = options.mode;
    if (options.diff) {
      if (mode != null) {
        stderr.println("buildifier: cannot specify both -d and -mode flags");
        return EXIT_USAGE;
      }
      mode = Mode.DIFF;
    }
    if (mode == null) {
      mode = Mode.FIX;
    } else if (mode == Mode.PIPE) {
      stderr.println("buildifier: unrecognized mode pipe; valid modes are check, diff, fix");
      return EXIT_USAGE;
    }
    // It doesn't make sense for multiple files to have the same path.
    if (!options.path.isEmpty() && options.files.size() > 1) {
      stderr.println("buildifier: can only format one file when using -path flag");
      return EXIT_USAGE;
    }
    if (options.verbose) {
      enableVerboseLogging();
    }
    for (String name : splitList(options.disable)) {
      if (!Rewriter.passNames().contains(name)) {
        logger.atWarning().log("unknown rewrite %s in -buildifier_disable", name);
      }
    }

    if (options.files.isEmpty()) {
      // Read from stdin, write to stdout.
      if (mode == Mode.FIX) {
        mode = Mode.PIPE;
      }
      Buildifier buildifier = new Buildifier(options, mode, Differ.find(env), stdout, stderr);
      return buildifier.processStdin(stdin);
    }
    Buildifier buildifier = new Buildifier(options, mode, Differ.find(env), stdout, stderr);
    return buildifier.processFiles(ImmutableList.copyOf(options.files));
  }

  private static void printUsage(CmdLineParser parser, PrintStream stderr) {
    stderr.println("usage: buildifier [-d] [-v] [-mode=mode] [-path=path] [files...]");
    parser.printUsage(stderr);
  }

  private static void enableVerboseLogging() {
    packageLogger.setLevel(Level.FINE);
    ConsoleHandler handler = new ConsoleHandler();
    handler.setLevel(Level.FINE);
    packageLogger.addHandler(handler);
  }

  private static ImmutableList<String> splitList(String flag) {
    return ImmutableList.copyOf(Splitter.on(',').trimResults().omitEmptyStrings().split(flag));
  }

  // ==== Processing ====

  /** The outcome of formatting one file. */
  private static final class Result {
    final String filename;
    @Nullable final String error;
    final int exitCode;
    final byte[] original;
    final byte[] beforeRewrite;
    final byte[] formatted;
    @Nullable final RewriteInfo info;

    private Result(
        String filename,
        @Nullable String error,
        int exitCode,
        byte[] original,
        byte[] beforeRewrite,
        byte[] formatted,
        @Nullable RewriteInfo info) {
      this.filename = filename;
      this.error = error;
      this.exitCode = exitCode;
      this.original = original;
      this.beforeRewrite = beforeRewrite;
      this.formatted = formatted;
      this.info = info;
    }

    static Result failure(String filename, String error, int exitCode) {
      byte[] none = new byte[0];
      return new Result(filename, error, exitCode, none, none, none, null);
    }

    boolean changed() {
      return !Arrays.equals(original, formatted);
    }
  }

  private int processStdin(InputStream stdin) {
    Result result;
    try {
      result = format("stdin", ByteStreams.toByteArray(stdin));
    } catch (IOException e) {
      result = Result.failure("stdin", "reading stdin: " + e.getMessage(), EXIT_ERROR);
    }
    return report(ImmutableList.of(result));
  }

  private int processFiles(ImmutableList<String> files) {
    int threads = Runtime.getRuntime().availableProcessors();
    ListeningExecutorService pool =
        MoreExecutors.listeningDecorator(
            Executors.newFixedThreadPool(
                threads,
                new ThreadFactoryBuilder().setNameFormat("buildifier-%d").setDaemon(true).build()));
    try {
      List<ListenableFuture<Result>> futures = new ArrayList<>();
      for (String file : files) {
        futures.add(pool.submit(() -> processFile(file)));
      }
      List<Result> results;
      try {
        results = Futures.allAsList(futures).get();
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        stderr.println("buildifier: interrupted");
        return EXIT_ERROR;
      } catch (ExecutionException e) {
        stderr.println("buildifier: internal error: " + e.getCause());
        return EXIT_ERROR;
      }
      return report(results);
    } finally {
      pool.shutdownNow();
    }
  }

  // Runs on a worker thread. In fix mode, the file is rewritten here.
  private Result processFile(String filename) {
    Path path = Paths.get(filename);
    byte[] data;
    try {
      data = Files.readAllBytes(path);
    } catch (IOException e) {
      return Result.failure(filename, describe(filename, e), EXIT_ERROR);
    }
    Result result = format(filename, data);
    if (mode == Mode.FIX && result.error == null && result.changed()) {
      try {
        Files.write(path, result.formatted);
      } catch (IOException e) {
        return Result.failure(filename, describe(filename, e), EXIT_ERROR);
      }
    }
    return result;
  }

  private Result format(String filename, byte[] data) {
    logger.atFine().log("formatting %s", filename);
    BuildFile file;
    try {
      file = BuildFile.parse(filename, data);
    } catch (SyntaxError.Exception e) {
      return Result.failure(filename, e.getMessage(), EXIT_SYNTAX_ERROR);
    }
    if (!options.path.isEmpty()) {
      file.setPath(options.path);
    }
    byte[] beforeRewrite = Formatter.format(file);
    RewriteInfo info = Rewriter.rewrite(file, config);
    byte[] formatted = Formatter.format(file);
    return new Result(filename, null, EXIT_OK, data, beforeRewrite, formatted, info);
  }

  private static String describe(String filename, IOException e) {
    String message = e.getMessage();
    return message != null && message.contains(filename) ? message : filename + ": " + message;
  }

  // Reports the results in input order and returns the exit status.
  private int report(List<Result> results) {
    int exitCode = EXIT_OK;
    for (Result result : results) {
      if (result.error != null) {
        stderr.println("buildifier: " + result.error);
        exitCode = Math.max(exitCode, result.exitCode);
        continue;
      }
      try {
        reportResult(result);
      } catch (IOException e) {
        stderr.println("buildifier: " + describe(result.filename, e));
        exitCode = EXIT_ERROR;
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        stderr.println("buildifier: interrupted");
        return EXIT_ERROR;
      }
    }
    stdout.flush();
    return exitCode;
  }

  private void reportResult(Result result) throws IOException, InterruptedException {
    switch (mode) {
      case CHECK -> {
        if (result.changed()) {
          stdout.println(checkLine(result));
        }
      }
      case DIFF -> {
        if (result.changed()) {
          showDiff(result);
        }
      }
      case FIX -> {
        if (result.changed() && options.verbose) {
          stderr.println("fixed " + result.filename);
        }
      }
      case PIPE -> stdout.write(result.formatted);
    }
  }

  // Returns "<file> #[ reformat] <passes>[ <log entries>]".
  private String checkLine(Result result) {
    String reformat = Arrays.equals(result.original, result.beforeRewrite) ? "" : " reformat";
    String log = "";
    if (options.showLog && !result.info.isEmpty()) {
      log = " " + String.join(" ", ImmutableSortedSet.copyOf(result.info.getLog()));
    }
    return String.format("%s #%s %s%s", result.filename, reformat, result.info.summary(), log);
  }

  private void showDiff(Result result) throws IOException, InterruptedException {
    List<Path> temps = new ArrayList<>();
    try {
      Path newFile = writeTemp(result.formatted, temps);
      String oldFile =
          result.filename.equals("stdin")
              ? writeTemp(result.original, temps).toString()
              : result.filename;
      differ.show(oldFile, newFile.toString(), stdout);
    } finally {
      for (Path temp : temps) {
        Files.deleteIfExists(temp);
      }
    }
  }

  private static Path writeTemp(byte[] data, List<Path> temps) throws IOException {
    Path temp = Files.createTempFile("buildifier-tmp-", "");
    temps.add(temp);
    Files.write(temp, data);
    return temp;
  }

  /**
   * Option handler for booleans that accepts both "-foo" and "-foo=true". The default args4j
   * boolean handler only supports the former.
   */
  public static class BooleanOptionHandler extends org.kohsuke.args4j.spi.BooleanOptionHandler {
    public BooleanOptionHandler(
        CmdLineParser parser, OptionDef option, Setter<? super Boolean> setter) {
      super(parser, option, setter);
    }

    @Override
    public int parseArguments(Parameters params) throws CmdLineException {
      if (params.size() > 0) {
        String value = params.getParameter(0);
        if ("true".equalsIgnoreCase(value) || "false".equalsIgnoreCase(value)) {
          setter.addValue(Boolean.parseBoolean(value));
          return 1;
        }
      }
      return super.parseArguments(params);
    }
  }
}
