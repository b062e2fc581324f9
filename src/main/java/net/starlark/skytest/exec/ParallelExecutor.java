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
package net.starlark.skytest.exec;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.flogger.GoogleLogger;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import net.starlark.skytest.report.Reporter;
import net.starlark.skytest.runner.FileResult;
import net.starlark.skytest.runner.RunResult;
import net.starlark.skytest.runner.TestFileException;

/**
 * Runs files on a fixed pool of workers.
 *
 * <p>Each worker takes the next file index from a shared queue, runs it, and renders its report
 * into a private buffer. A file error, or under fail-fast a failing file, lowers a shared stop
 * index to its own index. Workers still run every index below the stop index and drain the ones
 * above it. Once every worker has exited, outcomes are read back in input order up to the first
 * index that was not run, so the result and the printed output do not depend on scheduling.
 */
public final class ParallelExecutor implements RunExecutor {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private final int workers;
  private final Reporter reporter;
  private final PrintWriter out;
  private final boolean failFast;

  public ParallelExecutor(int workers, Reporter reporter, PrintWriter out, boolean failFast) {
    Preconditions.checkArgument(workers > 0, "workers must be positive: %s", workers);
    this.workers = workers;
    this.reporter = reporter;
    this.out = out;
    this.failFast = failFast;
  }

  @Override
  public RunResult execute(List<Path> files, FileTask task)
      throws TestFileException, InterruptedException {
    Stopwatch stopwatch = Stopwatch.createStarted();
    Queue<Integer> queue = new ConcurrentLinkedQueue<>();
    for (int i = 0; i < files.size(); i++) {
      queue.add(i);
    }
    Map<Integer, FileOutcome> outcomes = new ConcurrentHashMap<>();
    StopIndex stop = new StopIndex();
    AtomicBoolean interrupted = new AtomicBoolean();

    int poolSize = Math.min(workers, Math.max(1, files.size()));
    logger.atInfo().log("Running %d files on %d workers", files.size(), poolSize);
    ExecutorService pool =
        Executors.newFixedThreadPool(
            poolSize,
            new ThreadFactoryBuilder().setNameFormat("skytest-worker-%d").setDaemon(true).build());
    CountDownLatch done = new CountDownLatch(poolSize);
    try {
      for (int w = 0; w < poolSize; w++) {
        pool.execute(
            () -> {
              try {
                work(files, task, queue, outcomes, stop, interrupted);
              } finally {
                done.countDown();
              }
            });
      }
      done.await();
    } finally {
      pool.shutdownNow();
    }
    if (interrupted.get()) {
      throw new InterruptedException("test worker interrupted");
    }

    List<FileResult> results = new ArrayList<>();
    for (int i = 0; i < files.size(); i++) {
      FileOutcome outcome = outcomes.get(i);
      if (outcome == null) {
        // Drained; only indices above the stop index are.
        break;
      }
      if (outcome.error() != null) {
        throw outcome.error();
      }
      results.add(outcome.result());
      if (reporter.supportsIncrementalOutput()) {
        out.print(outcome.output());
        out.flush();
      }
      if (failFast && outcome.result().hasFailures()) {
        break;
      }
    }
    return RunResult.create(results, stopwatch.elapsed());
  }

  private void work(
      List<Path> files,
      FileTask task,
      Queue<Integer> queue,
      Map<Integer, FileOutcome> outcomes,
      StopIndex stop,
      AtomicBoolean interrupted) {
    Integer index;
    while ((index = queue.poll()) != null) {
      if (stop.skips(index)) {
        continue;
      }
      Path file = files.get(index);
      try {
        FileResult result = task.run(file);
        String output = "";
        if (reporter.supportsIncrementalOutput()) {
          StringWriter buffer = new StringWriter();
          PrintWriter writer = new PrintWriter(buffer);
          reporter.reportFile(writer, result);
          writer.flush();
          output = buffer.toString();
        }
        outcomes.put(index, FileOutcome.success(file, result, output));
        if (failFast && result.hasFailures()) {
          logger.atFine().log("Stopping workers after %s: fail-fast", file);
          stop.stopAt(index);
        }
      } catch (TestFileException e) {
        outcomes.put(index, FileOutcome.failure(file, e));
        stop.stopAt(index);
      } catch (InterruptedException e) {
        interrupted.set(true);
        stop.stopAt(-1);
        return;
      }
    }
  }

  /**
   * The lowest index at which a worker asked to stop. Indices below it are always run, whatever
   * the order in which workers polled them.
   */
  static final class StopIndex {
    private final AtomicInteger index = new AtomicInteger(Integer.MAX_VALUE);

    void stopAt(int stopIndex) {
      index.accumulateAndGet(stopIndex, Math::min);
    }

    boolean skips(int fileIndex) {
      return fileIndex > index.get();
    }
  }
}
