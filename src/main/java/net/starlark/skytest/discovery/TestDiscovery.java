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
package net.starlark.skytest.discovery;

import com.google.auto.value.AutoValue;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableListMultimap;
import com.google.common.flogger.GoogleLogger;
import java.io.IOException;
import java.nio.file.FileSystem;
import java.nio.file.FileSystems;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import net.starlark.skytest.engine.SyntaxException;

/**
 * Locates test files from path arguments. An argument may name a file, a directory (searched for
 * files matching the test-name patterns, skipping hidden directories) or a glob.
 */
public final class TestDiscovery {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** The file-name patterns that identify a test file by default. */
  public static final ImmutableList<String> DEFAULT_PATTERNS =
      ImmutableList.of("*_test.star", "test_*.star");

  /** The default prefix of test function names. */
  public static final String DEFAULT_TEST_PREFIX = "test_";

  /** Separates a file path from a test name in a selector such as {@code a_test.star::test_x}. */
  public static final String SELECTOR_SEPARATOR = "::";

  /** How a path argument is interpreted. */
  public enum PathKind {
    FILE,
    DIRECTORY,
    GLOB
  }

  /** Path arguments with any {@code ::test} selectors split off. */
  @AutoValue
  public abstract static class Selection {
    /** The file, directory and glob arguments, in order, with selectors removed. */
    public abstract ImmutableList<String> paths();

    /** Explicitly selected test names, keyed by the file argument that selected them. */
    public abstract ImmutableListMultimap<String, String> testNames();

    /**
     * Returns the test names selected for a discovered file, comparing both the argument as
     * written and its absolute form. An empty list means all tests run.
     */
    public ImmutableList<String> testNamesFor(Path file) {
      Path absolute = file.toAbsolutePath().normalize();
      for (String arg : testNames().keySet()) {
        Path argPath = file.getFileSystem().getPath(arg);
        if (argPath.equals(file) || argPath.toAbsolutePath().normalize().equals(absolute)) {
          return testNames().get(arg);
        }
      }
      return ImmutableList.of();
    }
  }

  private final FileSystem fileSystem;
  private final ImmutableList<PathMatcher> matchers;
  private final boolean recursive;

  public TestDiscovery(FileSystem fileSystem, List<String> patterns, boolean recursive) {
    this.fileSystem = Preconditions.checkNotNull(fileSystem);
    ImmutableList.Builder<PathMatcher> builder = ImmutableList.builder();
    for (String pattern : patterns.isEmpty() ? DEFAULT_PATTERNS : patterns) {
      builder.add(fileSystem.getPathMatcher("glob:" + pattern));
    }
    this.matchers = builder.build();
    this.recursive = recursive;
  }

  /** Returns a recursive discovery over the default file system with the default patterns. */
  public static TestDiscovery create() {
    return new TestDiscovery(FileSystems.getDefault(), DEFAULT_PATTERNS, /* recursive= */ true);
  }

  /** Reports whether the file name matches one of the test-name patterns. */
  public boolean isTestFile(Path file) {
    Path name = file.getFileName();
    if (name == null) {
      return false;
    }
    for (PathMatcher matcher : matchers) {
      if (matcher.matches(name)) {
        return true;
      }
    }
    return false;
  }

  /** Classifies a path argument. Paths that do not exist are treated as files. */
  public PathKind classifyPath(String path) {
    if (path.indexOf('*') >= 0 || path.indexOf('?') >= 0 || path.indexOf('[') >= 0) {
      return PathKind.GLOB;
    }
    return Files.isDirectory(fileSystem.getPath(path)) ? PathKind.DIRECTORY : PathKind.FILE;
  }

  /**
   * Expands path arguments into a deduplicated list of test files. Files named explicitly are
   * kept even when they do not match the test-name patterns. Two arguments naming the same file,
   * such as {@code tests} and {@code ./tests/a_test.star}, yield it once, spelled as first seen.
   *
   * @throws NoTestFilesFoundException if the expansion is empty
   */
  public ImmutableList<Path> expandPaths(List<String> paths)
      throws IOException, NoTestFilesFoundException {
    Map<Path, Path> result = new LinkedHashMap<>();
    for (String path : paths) {
      switch (classifyPath(path)) {
        case GLOB:
          addAll(result, expandGlob(path));
          break;
        case DIRECTORY:
          addAll(result, discoverFiles(fileSystem.getPath(path)));
          break;
        case FILE:
          addAll(result, ImmutableList.of(fileSystem.getPath(path)));
          break;
      }
    }
    if (result.isEmpty()) {
      throw new NoTestFilesFoundException(paths);
    }
    logger.atFine().log("Expanded %s into %d test files", paths, result.size());
    return ImmutableList.copyOf(result.values());
  }

  private static void addAll(Map<Path, Path> result, List<Path> files) {
    for (Path file : files) {
      result.putIfAbsent(file.toAbsolutePath().normalize(), file);
    }
  }

  /** Returns the test files under a directory, in lexical order. */
  public ImmutableList<Path> discoverFiles(Path dir) throws IOException {
    List<Path> files = new ArrayList<>();
    Files.walkFileTree(
        dir,
        new SimpleFileVisitor<Path>() {
          @Override
          public FileVisitResult preVisitDirectory(Path d, BasicFileAttributes attrs) {
            if (d.equals(dir)) {
              return FileVisitResult.CONTINUE;
            }
            if (!recursive || isHidden(d)) {
              return FileVisitResult.SKIP_SUBTREE;
            }
            return FileVisitResult.CONTINUE;
          }

          @Override
          public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile() && isTestFile(file)) {
              files.add(file);
            }
            return FileVisitResult.CONTINUE;
          }
        });
    files.sort(null);
    return ImmutableList.copyOf(files);
  }

  private static boolean isHidden(Path dir) {
    Path name = dir.getFileName();
    return name != null && name.toString().startsWith(".");
  }

  private ImmutableList<Path> expandGlob(String pattern) throws IOException {
    Path patternPath = fileSystem.getPath(pattern);
    Path base = patternPath.isAbsolute() ? patternPath.getRoot() : fileSystem.getPath("");
    int literal = 0;
    for (Path part : patternPath) {
      String s = part.toString();
      if (s.indexOf('*') >= 0 || s.indexOf('?') >= 0 || s.indexOf('[') >= 0) {
        break;
      }
      base = base.resolve(s);
      literal++;
    }
    if (!Files.isDirectory(base)) {
      return ImmutableList.of();
    }
    int maxDepth =
        pattern.contains("**") ? Integer.MAX_VALUE : patternPath.getNameCount() - literal;
    PathMatcher matcher = fileSystem.getPathMatcher("glob:" + pattern);
    try (Stream<Path> stream = Files.walk(base, maxDepth)) {
      return stream.filter(matcher::matches).sorted().collect(ImmutableList.toImmutableList());
    }
  }

  /** Splits {@code file::test} selectors off the path arguments. */
  public static Selection parseSelectors(List<String> args) {
    ImmutableList.Builder<String> paths = ImmutableList.builder();
    ImmutableListMultimap.Builder<String, String> testNames = ImmutableListMultimap.builder();
    for (String arg : args) {
      int idx = arg.indexOf(SELECTOR_SEPARATOR);
      if (idx >= 0) {
        String file = arg.substring(0, idx);
        testNames.put(file, arg.substring(idx + SELECTOR_SEPARATOR.length()));
        paths.add(file);
      } else {
        paths.add(arg);
      }
    }
    return new AutoValue_TestDiscovery_Selection(paths.build(), testNames.build());
  }

  /**
   * Returns the names of the top-level functions in a file that start with {@code prefix}, in
   * sorted order, without executing the file.
   */
  public static ImmutableList<String> discoverTests(String filename, byte[] source, String prefix)
      throws SyntaxException {
    String effectivePrefix = prefix.isEmpty() ? DEFAULT_TEST_PREFIX : prefix;
    return SourceScanner.scan(filename, source).functions().stream()
        .filter(name -> name.startsWith(effectivePrefix))
        .sorted()
        .collect(ImmutableList.toImmutableList());
  }
}
