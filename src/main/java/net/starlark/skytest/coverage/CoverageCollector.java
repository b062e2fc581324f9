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
package net.starlark.skytest.coverage;

import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import net.starlark.skytest.engine.CoverageRecorder;

/**
 * Accumulates line and function hits reported by the engine across every test of a run. One
 * collector is shared by all the contexts of a run, including those of parallel workers.
 */
public final class CoverageCollector implements CoverageRecorder {

  private static final class Counts {
    final Map<Integer, Long> lines = new TreeMap<>();
    final Map<String, Long> functions = new TreeMap<>();
  }

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, Counts> files = new HashMap<>();

  @Override
  public void recordLine(String filename, int line) {
    lock.writeLock().lock();
    try {
      counts(filename).lines.merge(line, 1L, Long::sum);
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Override
  public void recordFunctionEntry(String filename, String function, int line) {
    lock.writeLock().lock();
    try {
      counts(filename).functions.merge(function, 1L, Long::sum);
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Declares lines as executable, so that they count towards the total even if never executed.
   */
  public void registerLines(String filename, Iterable<Integer> lines) {
    lock.writeLock().lock();
    try {
      Counts counts = counts(filename);
      for (int line : lines) {
        counts.lines.putIfAbsent(line, 0L);
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  private Counts counts(String filename) {
    return files.computeIfAbsent(filename, f -> new Counts());
  }

  /** Returns a snapshot of the coverage collected so far. */
  public CoverageReport report() {
    lock.readLock().lock();
    try {
      Map<String, FileCoverage> report = new HashMap<>();
      files.forEach(
          (path, counts) ->
              report.put(path, FileCoverage.create(path, counts.lines, counts.functions)));
      return CoverageReport.of(report);
    } finally {
      lock.readLock().unlock();
    }
  }
}
