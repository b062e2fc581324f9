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
package net.starlark.skytest.fixtures;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.flogger.GoogleLogger;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import net.starlark.skytest.engine.EvalException;
import net.starlark.skytest.engine.Namespace;
import net.starlark.skytest.engine.StarlarkEngine;
import net.starlark.skytest.engine.SyntaxException;

/**
 * Loads the shared fixture definitions ({@code conftest.star} files) that apply to a test file.
 * They are looked up in the test file's directory and each of its ancestors, up to the file system
 * root or the first directory that is the root of a version-control checkout, and loaded from the
 * outermost inwards so that nearer definitions override farther ones.
 */
public final class ConftestLoader {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  public static final String CONFTEST_FILE = "conftest.star";

  private static final ImmutableList<String> VCS_MARKERS = ImmutableList.of(".git", ".hg");

  /** Signals that a shared definition file could not be read or executed. */
  public static final class ConftestException extends Exception {
    private final Path path;

    ConftestException(Path path, String message, Throwable cause) {
      super(message, cause);
      this.path = path;
    }

    public Path getPath() {
      return path;
    }
  }

  private final StarlarkEngine engine;

  public ConftestLoader(StarlarkEngine engine) {
    this.engine = Preconditions.checkNotNull(engine);
  }

  /** Returns the shared definition files for a test file, outermost first. */
  public static ImmutableList<Path> findConftestFiles(Path testFile) {
    List<Path> found = new ArrayList<>();
    Path dir = testFile.toAbsolutePath().normalize().getParent();
    while (dir != null) {
      Path candidate = dir.resolve(CONFTEST_FILE);
      if (Files.isRegularFile(candidate)) {
        found.add(candidate);
      }
      if (isCheckoutRoot(dir)) {
        break;
      }
      dir = dir.getParent();
    }
    return ImmutableList.copyOf(found).reverse();
  }

  private static boolean isCheckoutRoot(Path dir) {
    for (String marker : VCS_MARKERS) {
      if (Files.exists(dir.resolve(marker))) {
        return true;
      }
    }
    return false;
  }

  /**
   * Executes the shared definition files for a test file and returns the fixtures they define,
   * merged so that nearer files win.
   */
  public FixtureRegistry load(Path testFile, ImmutableMap<String, Object> predeclared)
      throws ConftestException, InterruptedException {
    List<FixtureRegistry> registries = new ArrayList<>();
    for (Path conftest : findConftestFiles(testFile)) {
      byte[] source;
      try {
        source = Files.readAllBytes(conftest);
      } catch (IOException e) {
        throw new ConftestException(
            conftest, String.format("reading conftest %s: %s", conftest, e.getMessage()), e);
      }
      Namespace globals;
      try {
        globals =
            engine.execFile(
                engine.newContext(conftest.toString()), conftest.toString(), source, predeclared);
      } catch (SyntaxException | EvalException e) {
        throw new ConftestException(
            conftest, String.format("executing conftest %s: %s", conftest, e.getMessage()), e);
      }
      FixtureRegistry registry = FixtureRegistry.fromNamespace(globals);
      logger.atFine().log(
          "Loaded %d fixtures from %s", registry.getFixtureNames().size(), conftest);
      registries.add(registry);
    }
    return FixtureRegistry.merge(registries);
  }
}
