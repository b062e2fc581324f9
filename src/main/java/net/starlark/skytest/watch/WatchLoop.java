// Copyright 2026 The Bazel Authors. All rights reserved.
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
package net.starlark.skytest.watch;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.FileSystem;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import javax.annotation.Nullable;
import net.starlark.skytest.discovery.NoTestFilesFoundException;
import net.starlark.skytest.discovery.TestDiscovery;
import net.starlark.skytest.discovery.TestDiscovery.Selection;
import net.starlark.skytest.exec.TestSession;

/**
 * Runs the tests once, then again whenever a watched file changes, until {@link #stop} is called.
 *
 * <p>Signals are handled one at a time on the thread that called {@link #run}, so runs never
 * overlap. Watcher errors are printed and the loop carries on.
 */
public final class WatchLoop implements Watcher.Listener {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private enum Kind {
    CHANGE,
    ERROR,
    QUIT
  }

  private static final class Signal {
    final Kind kind;
    @Nullable final WatchEvent event;
    @Nullable final WatchException error;

    Signal(Kind kind, @Nullable WatchEvent event, @Nullable WatchException error) {
      this.kind = kind;
      this.event = event;
      this.error = error;
    }
  }

  private final TestSession session;
  private final FileSystem fileSystem;
  private final boolean affectedOnly;
  private final PrintWriter out;
  private final BlockingQueue<Signal> signals = new LinkedBlockingQueue<>();

  /**
   * @param affectedOnly re-run only the test files a change affects, rather than all of them
   */
  public WatchLoop(
      TestSession session, FileSystem fileSystem, boolean affectedOnly, PrintWriter out) {
    this.session = Preconditions.checkNotNull(session);
    this.fileSystem = fileSystem;
    this.affectedOnly = affectedOnly;
    this.out = out;
  }

  @Override
  public void onChange(WatchEvent event) {
    signals.add(new Signal(Kind.CHANGE, event, null));
  }

  @Override
  public void onError(WatchException error) {
    signals.add(new Signal(Kind.ERROR, null, error));
  }

  /** Makes {@link #run} return once the current run, if any, has finished. */
  public void stop() {
    signals.add(new Signal(Kind.QUIT, null, null));
  }

  /**
   * Expands {@code args}, runs the tests, and watches for changes until stopped.
   *
   * @return the exit code of the last run
   */
  public int run(List<String> args) throws IOException, InterruptedException {
    Selection selection = TestDiscovery.parseSelectors(args);
    ImmutableList<Path> files;
    try {
      files = session.getDiscovery().expandPaths(selection.paths());
    } catch (NoTestFilesFoundException e) {
      out.println("error: " + e.getMessage());
      out.flush();
      return TestSession.EXIT_ERROR;
    }
    try (Watcher watcher = new Watcher(fileSystem, this)) {
      for (Path file : files) {
        watcher.add(file);
      }
      watcher.start();
      int exitCode = session.execute(files, selection);
      printWaiting();
      while (true) {
        Signal signal = signals.take();
        switch (signal.kind) {
          case QUIT:
            return exitCode;
          case ERROR:
            out.println("watch error: " + signal.error.getMessage());
            out.flush();
            break;
          case CHANGE:
            Integer result = rerun(watcher, signal.event, files, selection);
            if (result != null) {
              exitCode = result;
            }
            break;
        }
      }
    }
  }

  @Nullable
  private Integer rerun(
      Watcher watcher, WatchEvent event, List<Path> allFiles, Selection selection)
      throws IOException, InterruptedException {
    List<Path> toRun = affectedOnly ? event.affectedTests() : allFiles;
    out.println();
    out.println("Change detected: " + event.file());
    if (toRun.isEmpty()) {
      out.println("No affected tests to run.");
      out.flush();
      return null;
    }
    watcher.refreshDependencies(event.file());
    logger.atFine().log("Re-running %d files after change to %s", toRun.size(), event.file());
    int exitCode = session.execute(toRun, selection);
    printWaiting();
    return exitCode;
  }

  private void printWaiting() {
    out.println();
    out.println("Watching for changes...");
    out.flush();
  }
}
