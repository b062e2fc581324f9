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
import com.google.common.collect.ImmutableSet;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import javax.annotation.Nullable;
import net.starlark.skytest.engine.EvalException;
import net.starlark.skytest.engine.ExecutionContext;
import net.starlark.skytest.engine.Namespace;
import net.starlark.skytest.engine.StarlarkCallable;
import net.starlark.skytest.engine.StarlarkEngine;

/**
 * Maps fixture names to producers and caches their values according to scope. Built-in values
 * registered with {@link #registerBuiltin} are returned as is and shadow fixtures of the same name.
 *
 * <p>The registry is safe for concurrent use. Its lock guards map access only and is never held
 * while a producer runs.
 */
public final class FixtureRegistry {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  /** Functions whose names start with this prefix define fixtures. */
  public static final String FIXTURE_PREFIX = "fixture_";

  /** The global dict that maps fixture names to scope labels. */
  public static final String FIXTURE_CONFIG = "__fixture_config__";

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<String, Fixture> fixtures = new LinkedHashMap<>();
  private final Map<String, Object> builtins = new LinkedHashMap<>();
  private final Map<String, Object> fileCache = new HashMap<>();
  private final Map<String, Object> testCache = new HashMap<>();

  public void register(Fixture fixture) {
    lock.writeLock().lock();
    try {
      fixtures.put(fixture.name(), fixture);
    } finally {
      lock.writeLock().unlock();
    }
  }

  public void registerBuiltin(String name, Object value) {
    lock.writeLock().lock();
    try {
      builtins.put(name, Preconditions.checkNotNull(value));
    } finally {
      lock.writeLock().unlock();
    }
  }

  @Nullable
  public Fixture get(String name) {
    lock.readLock().lock();
    try {
      return fixtures.get(name);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Returns the names of the registered fixtures, in registration order. */
  public ImmutableSet<String> getFixtureNames() {
    lock.readLock().lock();
    try {
      return ImmutableSet.copyOf(fixtures.keySet());
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Drops the cached values of {@code test}-scoped fixtures. Called after every test. */
  public void clearTestCache() {
    lock.writeLock().lock();
    try {
      testCache.clear();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Drops every cached value. Called when the file is done. */
  public void clearAll() {
    lock.writeLock().lock();
    try {
      testCache.clear();
      fileCache.clear();
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Returns the value of the named fixture, computing it if it is not cached. The producer's own
   * parameters are resolved through this registry.
   *
   * @throws FixtureNotFoundException if neither a fixture nor a built-in has this name
   * @throws FixtureCycleException if the fixture depends on itself
   * @throws FixtureResolutionException if a producer fails
   */
  public Object getOrCompute(StarlarkEngine engine, ExecutionContext context, String name)
      throws FixtureException, InterruptedException {
    return compute(engine, context, name, new LinkedHashSet<>());
  }

  /**
   * Resolves the arguments of a test or fixture function by parameter name, ignoring the first
   * {@code skip} parameters.
   */
  public ImmutableList<Object> resolveArguments(
      StarlarkEngine engine, ExecutionContext context, StarlarkCallable fn, int skip)
      throws FixtureException, InterruptedException {
    return resolveArguments(engine, context, fn, skip, new LinkedHashSet<>());
  }

  private ImmutableList<Object> resolveArguments(
      StarlarkEngine engine,
      ExecutionContext context,
      StarlarkCallable fn,
      int skip,
      LinkedHashSet<String> inProgress)
      throws FixtureException, InterruptedException {
    ImmutableList<String> params = fn.getParameterNames();
    ImmutableList.Builder<Object> args = ImmutableList.builder();
    for (int i = skip; i < params.size(); i++) {
      args.add(compute(engine, context, params.get(i), inProgress));
    }
    return args.build();
  }

  private Object compute(
      StarlarkEngine engine,
      ExecutionContext context,
      String name,
      LinkedHashSet<String> inProgress)
      throws FixtureException, InterruptedException {
    Fixture fixture;
    lock.readLock().lock();
    try {
      Object builtin = builtins.get(name);
      if (builtin != null) {
        return builtin;
      }
      fixture = fixtures.get(name);
      if (fixture == null) {
        throw new FixtureNotFoundException(name);
      }
      Object cached = cacheFor(fixture.scope()).get(name);
      if (cached != null) {
        return cached;
      }
    } finally {
      lock.readLock().unlock();
    }

    if (!inProgress.add(name)) {
      List<String> cycle = new ArrayList<>();
      boolean onCycle = false;
      for (String n : inProgress) {
        onCycle |= n.equals(name);
        if (onCycle) {
          cycle.add(n);
        }
      }
      cycle.add(name);
      throw new FixtureCycleException(cycle);
    }

    Object value;
    try {
      ImmutableList<Object> args =
          resolveArguments(engine, context, fixture.function(), 0, inProgress);
      logger.atFine().log("Computing %s fixture %s", fixture.scope(), name);
      value = engine.call(context, fixture.function(), args, ImmutableMap.of());
    } catch (EvalException e) {
      throw new FixtureResolutionException(name, e);
    } finally {
      inProgress.remove(name);
    }

    lock.writeLock().lock();
    try {
      Object previous = cacheFor(fixture.scope()).putIfAbsent(name, value);
      return previous != null ? previous : value;
    } finally {
      lock.writeLock().unlock();
    }
  }

  private Map<String, Object> cacheFor(FixtureScope scope) {
    return scope == FixtureScope.FILE ? fileCache : testCache;
  }

  /**
   * Returns a registry holding the fixtures defined by a file's globals: every callable named
   * {@code fixture_<name>}, scoped by the optional {@code __fixture_config__} dict.
   */
  public static FixtureRegistry fromNamespace(Namespace globals) {
    FixtureRegistry registry = new FixtureRegistry();
    Map<?, ?> config = globals.getDict(FIXTURE_CONFIG);
    for (String global : globals.getNames()) {
      StarlarkCallable fn = globals.getCallable(global);
      if (fn == null || !global.startsWith(FIXTURE_PREFIX)) {
        continue;
      }
      String name = global.substring(FIXTURE_PREFIX.length());
      FixtureScope scope = FixtureScope.TEST;
      if (config != null && config.get(name) instanceof String) {
        FixtureScope configured = FixtureScope.fromLabel((String) config.get(name));
        if (configured != null) {
          scope = configured;
        }
      }
      registry.register(Fixture.create(name, fn, scope));
    }
    return registry;
  }

  /**
   * Merges registries into a new one. Fixtures and built-ins in later registries override those of
   * the same name in earlier ones; cached values are not carried over.
   */
  public static FixtureRegistry merge(List<FixtureRegistry> registries) {
    FixtureRegistry merged = new FixtureRegistry();
    for (FixtureRegistry registry : registries) {
      registry.lock.readLock().lock();
      try {
        merged.fixtures.putAll(registry.fixtures);
        merged.builtins.putAll(registry.builtins);
      } finally {
        registry.lock.readLock().unlock();
      }
    }
    return merged;
  }
}
