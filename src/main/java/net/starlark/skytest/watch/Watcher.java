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

import static java.nio.file.StandardWatchEventKinds.ENTRY_CREATE;
import static java.nio.file.StandardWatchEventKinds.ENTRY_MODIFY;
import static java.nio.file.StandardWatchEventKinds.OVERFLOW;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSortedSet;
import com.google.common.flogger.GoogleLogger;
import java.io.IOException;
import java.nio.file.ClosedWatchServiceException;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.WatchKey;
import java.nio.file.WatchService;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nullable;
import net.starlark.skytest.discovery.SourceScanner;
import net.starlark.skytest.engine.SyntaxException;

/**
 * Watches test files and everything they transitively {@code load()}, and reports which test files
 * a change affects.
 *
 * <p>For every watched dependency the watcher keeps the set of test files that reach it. A change
 * to a path affects the path itself, if it is a test file, and every test file that reaches it.
 * Load targets starting with {@code //} or {@code @} are build labels, not files, and are ignored;
 * other targets are resolved against the directory of the loading file and followed only if they
 * exist.
 *
 * <p>All maps are guarded by one lock. Listener callbacks are made without holding it.
 */
public final class Watcher implements AutoCloseable {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** Receives changes and errors. Called from the watcher's thread. */
  public interface Listener {
    void onChange(WatchEvent event);

    void onError(WatchException error);
  }

  private final Listener listener;
  private final WatchService watchService;
  private final ReentrantLock lock = new ReentrantLock();

  private final Set<Path> testFiles = new HashSet<>();
  // file -> the files it loads directly
  private final Map<Path, ImmutableList<Path>> loads = new HashMap<>();
  // dependency -> the test files that transitively load it
  private final Map<Path, Set<Path>> dependents = new HashMap<>();
  private final Set<Path> watchedFiles = new HashSet<>();
  private final Map<WatchKey, Path> watchedDirs = new HashMap<>();

  @Nullable private Thread thread;

  public Watcher(FileSystem fileSystem, Listener listener) throws IOException {
    this.listener = Preconditions.checkNotNull(listener);
    this.watchService = fileSystem.newWatchService();
  }

  /**
   * Starts watching a test file and its transitive dependencies. Dependencies that cannot be read
   * or scanned are reported to the listener and otherwise skipped.
   *
   * @throws IOException if the file's directory cannot be watched
   */
  public void add(Path file) throws IOException {
    Path path = file.toAbsolutePath().normalize();
    List<WatchException> errors = new ArrayList<>();
    lock.lock();
    try {
      if (!testFiles.add(path)) {
        return;
      }
      watch(path);
      addDependencies(path, path, new HashSet<>(), errors);
    } finally {
      lock.unlock();
    }
    errors.forEach(listener::onError);
  }

  /** Stops treating {@code file} as a test file. Its directory stays registered. */
  public void remove(Path file) {
    Path path = file.toAbsolutePath().normalize();
    lock.lock();
    try {
      testFiles.remove(path);
      removeDependent(path);
      logger.atFine().log("Removed %s", path);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Re-derives the dependencies of a test file after its contents changed, dropping the edges of
   * loads it no longer makes. Does nothing for files that are not test files.
   */
  public void refreshDependencies(Path file) throws IOException {
    Path path = file.toAbsolutePath().normalize();
    List<WatchException> errors = new ArrayList<>();
    lock.lock();
    try {
      if (!testFiles.contains(path)) {
        return;
      }
      removeDependent(path);
      addDependencies(path, path, new HashSet<>(), errors);
    } finally {
      lock.unlock();
    }
    errors.forEach(listener::onError);
  }

  /** Returns the test files affected by a change to {@code file}, sorted. */
  public ImmutableList<Path> affectedTestFiles(Path file) {
    Path path = file.toAbsolutePath().normalize();
    lock.lock();
    try {
      Set<Path> affected = new TreeSet<>();
      if (testFiles.contains(path)) {
        affected.add(path);
      }
      Set<Path> reaching = dependents.get(path);
      if (reaching != null) {
        affected.addAll(reaching);
      }
      return ImmutableList.copyOf(affected);
    } finally {
      lock.unlock();
    }
  }

  /** Returns every file being watched: test files and their dependencies. */
  public ImmutableSortedSet<Path> watchedFiles() {
    lock.lock();
    try {
      return ImmutableSortedSet.copyOf(watchedFiles);
    } finally {
      lock.unlock();
    }
  }

  /** Returns the files {@code file} loads directly, as last scanned. */
  public ImmutableList<Path> loadsOf(Path file) {
    lock.lock();
    try {
      return loads.getOrDefault(file.toAbsolutePath().normalize(), ImmutableList.of());
    } finally {
      lock.unlock();
    }
  }

  /** Turns a changed path into an event, or null if it affects no test file. */
  @Nullable
  WatchEvent handleChange(Path file) {
    ImmutableList<Path> affected = affectedTestFiles(file);
    if (affected.isEmpty()) {
      return null;
    }
    return WatchEvent.create(file.toAbsolutePath().normalize(), affected);
  }

  /** Starts delivering file system events to the listener on a background thread. */
  public synchronized void start() {
    Preconditions.checkState(thread == null, "watcher already started");
    thread = new Thread(this::pollEvents, "skytest-watcher");
    thread.setDaemon(true);
    thread.start();
  }

  @Override
  public synchronized void close() throws IOException {
    watchService.close();
    if (thread != null) {
      thread.interrupt();
    }
  }

  private void pollEvents() {
    while (true) {
      WatchKey key;
      try {
        key = watchService.take();
      } catch (InterruptedException | ClosedWatchServiceException e) {
        return;
      }
      Path dir;
      lock.lock();
      try {
        dir = watchedDirs.get(key);
      } finally {
        lock.unlock();
      }
      if (dir != null) {
        for (java.nio.file.WatchEvent<?> event : key.pollEvents()) {
          if (event.kind() == OVERFLOW) {
            listener.onError(new WatchException("file system events were lost", null));
            continue;
          }
          Path changed = dir.resolve((Path) event.context());
          if (!isWatched(changed)) {
            continue;
          }
          WatchEvent watchEvent = handleChange(changed);
          if (watchEvent != null) {
            listener.onChange(watchEvent);
          }
        }
      }
      key.reset();
    }
  }

  private boolean isWatched(Path file) {
    lock.lock();
    try {
      return watchedFiles.contains(file);
    } finally {
      lock.unlock();
    }
  }

  // Requires lock.
  private void watch(Path file) throws IOException {
    if (!watchedFiles.add(file)) {
      return;
    }
    Path dir = file.getParent();
    if (dir != null && !watchedDirs.containsValue(dir)) {
      watchedDirs.put(dir.register(watchService, ENTRY_CREATE, ENTRY_MODIFY), dir);
    }
  }

  // Requires lock.
  private void addDependencies(
      Path testFile, Path file, Set<Path> visited, List<WatchException> errors)
      throws IOException {
    if (!visited.add(file)) {
      return;
    }
    ImmutableList<Path> deps;
    try {
      deps = extractLoads(file);
    } catch (WatchException e) {
      logger.atWarning().withCause(e.getCause()).log("%s", e.getMessage());
      errors.add(e);
      return;
    }
    loads.put(file, deps);
    for (Path dep : deps) {
      watch(dep);
      dependents.computeIfAbsent(dep, k -> new LinkedHashSet<>()).add(testFile);
      logger.atFine().log("%s reaches %s", testFile, dep);
      addDependencies(testFile, dep, visited, errors);
    }
  }

  // Requires lock.
  private void removeDependent(Path testFile) {
    Iterator<Set<Path>> it = dependents.values().iterator();
    while (it.hasNext()) {
      Set<Path> reaching = it.next();
      reaching.remove(testFile);
      if (reaching.isEmpty()) {
        it.remove();
      }
    }
  }

  private static ImmutableList<Path> extractLoads(Path file) throws WatchException {
    SourceScanner.ScannedFile scanned;
    try {
      scanned = SourceScanner.scan(file.toString(), Files.readAllBytes(file));
    } catch (IOException | SyntaxException e) {
      throw new WatchException(
          String.format("reading dependencies of %s: %s", file, e.getMessage()), e);
    }
    Path dir = file.getParent();
    ImmutableList.Builder<Path> deps = ImmutableList.builder();
    for (String target : scanned.loads()) {
      if (target.startsWith("//") || target.startsWith("@") || dir == null) {
        continue;
      }
      Path dep = dir.resolve(target).normalize();
      if (Files.exists(dep)) {
        deps.add(dep);
      }
    }
    return deps.build();
  }
}
