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
package net.starlark.skytest.snapshot;

import com.google.common.base.CharMatcher;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import com.google.common.io.MoreFiles;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileSystem;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import javax.annotation.Nullable;
import net.starlark.skytest.engine.EvalException;

/**
 * Compares values against stored snapshots. The first comparison under a name writes the snapshot;
 * later ones compare against it, failing on a difference unless update mode is on, in which case
 * the file is rewritten.
 *
 * <p>Snapshots of test {@code t} in file {@code dir/f.star} live in {@code
 * dir/__snapshots__/f/t__<name>.snap}, with path separators and other unsafe characters in both
 * names replaced by {@code _}. The current file and test are set with {@link #setContext}
 * before each test runs.
 */
public final class SnapshotManager {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  public static final String SNAPSHOT_DIR = "__snapshots__";
  public static final String SNAPSHOT_EXTENSION = ".snap";

  private static final CharMatcher UNSAFE = CharMatcher.anyOf("/\\:*?\"<>|");

  private final FileSystem fileSystem;
  private final boolean updateMode;

  @Nullable private String testFile;
  @Nullable private String testName;
  private final List<String> created = new ArrayList<>();
  private final List<String> updated = new ArrayList<>();
  private final List<SnapshotMismatch> mismatches = new ArrayList<>();

  public SnapshotManager(FileSystem fileSystem, boolean updateMode) {
    this.fileSystem = Preconditions.checkNotNull(fileSystem);
    this.updateMode = updateMode;
  }

  public boolean isUpdateMode() {
    return updateMode;
  }

  /** Sets the test file and test whose snapshots subsequent comparisons use. */
  public synchronized void setContext(String testFile, String testName) {
    this.testFile = Preconditions.checkNotNull(testFile);
    this.testName = Preconditions.checkNotNull(testName);
  }

  /** Returns the path of the named snapshot for the current test. */
  public synchronized Path snapshotPath(String name) {
    Preconditions.checkState(testFile != null, "no test context set");
    Path file = fileSystem.getPath(testFile);
    String base = file.getFileName().toString();
    int dot = base.lastIndexOf('.');
    String stem = dot > 0 ? base.substring(0, dot) : base;
    Path dir = file.getParent();
    Path snapshots = (dir == null ? fileSystem.getPath(SNAPSHOT_DIR) : dir.resolve(SNAPSHOT_DIR));
    return snapshots
        .resolve(stem)
        .resolve(
            UNSAFE.replaceFrom(testName, '_')
                + "__"
                + UNSAFE.replaceFrom(name, '_')
                + SNAPSHOT_EXTENSION);
  }

  /**
   * Compares {@code value} with the snapshot called {@code name}.
   *
   * @throws SnapshotMismatchException if the snapshot differs and update mode is off
   * @throws EvalException if the snapshot file cannot be read or written
   */
  public void compare(Object value, String name) throws EvalException {
    String actual = SnapshotSerializer.serialize(value);
    Path path = snapshotPath(name);

    String expected;
    try {
      expected = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
    } catch (NoSuchFileException e) {
      write(path, actual, name, "create");
      logger.atFine().log("Created snapshot %s", path);
      record(created, name);
      return;
    } catch (IOException e) {
      throw new EvalException(
          String.format("failed to read snapshot \"%s\": %s", name, e.getMessage()), e);
    }

    if (expected.equals(actual)) {
      return;
    }
    if (updateMode) {
      write(path, actual, name, "update");
      logger.atFine().log("Updated snapshot %s", path);
      record(updated, name);
      return;
    }
    SnapshotMismatch mismatch = SnapshotMismatch.create(name, expected, actual);
    synchronized (this) {
      mismatches.add(mismatch);
    }
    throw new SnapshotMismatchException(mismatch);
  }

  private static void write(Path path, String content, String name, String verb)
      throws EvalException {
    try {
      MoreFiles.createParentDirectories(path);
      Files.write(path, content.getBytes(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new EvalException(
          String.format("failed to %s snapshot \"%s\": %s", verb, name, e.getMessage()), e);
    }
  }

  private synchronized void record(List<String> names, String name) {
    names.add(name);
  }

  /** Returns the names of the snapshots written for the first time. */
  public synchronized ImmutableList<String> created() {
    return ImmutableList.copyOf(created);
  }

  /** Returns the names of the snapshots rewritten in update mode. */
  public synchronized ImmutableList<String> updated() {
    return ImmutableList.copyOf(updated);
  }

  public synchronized ImmutableList<SnapshotMismatch> mismatches() {
    return ImmutableList.copyOf(mismatches);
  }
}
