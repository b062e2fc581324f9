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
package net.starlark.skytest.mock;

import com.google.common.collect.ImmutableList;
import com.google.common.flogger.GoogleLogger;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import javax.annotation.Nullable;
import net.starlark.skytest.engine.EvalException;
import net.starlark.skytest.engine.Starlark;
import net.starlark.skytest.engine.StarlarkCallable;
import net.starlark.skytest.engine.Tuple;

/**
 * Owns every mock created during a test: the wrappers, their configured return values and their
 * call logs. Wrapping is deduplicated by the identity of the wrapped callable.
 *
 * <p>All state is guarded by one read-write lock, held only for map access.
 */
public final class MockManager {

  private static final GoogleLogger logger = GoogleLogger.forEnclosingClass();

  private static final class MockConfig {
    @Nullable Object defaultReturn;
    final Map<String, Object> returnsByArgs = new HashMap<>();
    final List<MockCall> calls = new ArrayList<>();
  }

  private final ReadWriteLock lock = new ReentrantReadWriteLock();
  private final Map<StarlarkCallable, MockWrapper> wrappers = new IdentityHashMap<>();
  private final Map<MockWrapper, MockConfig> configs = new IdentityHashMap<>();
  private int nextId;

  /**
   * Returns the wrapper for {@code fn}, creating it on first use.
   *
   * @throws EvalException if {@code fn} is not callable
   */
  public MockWrapper wrap(Object fn) throws EvalException {
    if (!(fn instanceof StarlarkCallable)) {
      throw Starlark.errorf("mock.wrap: expected callable, got %s", Starlark.type(fn));
    }
    StarlarkCallable callable = (StarlarkCallable) fn;
    lock.writeLock().lock();
    try {
      MockWrapper wrapper = wrappers.get(callable);
      if (wrapper == null) {
        wrapper = new MockWrapper(++nextId, callable, this);
        wrappers.put(callable, wrapper);
        configs.put(wrapper, new MockConfig());
        logger.atFine().log("Wrapped %s as mock #%d", callable.getName(), wrapper.getId());
      }
      return wrapper;
    } finally {
      lock.writeLock().unlock();
    }
  }

  /**
   * Clears every wrapper, configuration and call log. A wrapper still held by the caller, such as
   * one returned by a file-scoped fixture, starts over with an empty configuration the next time
   * it is configured or called.
   */
  public void reset() {
    lock.writeLock().lock();
    try {
      wrappers.clear();
      configs.clear();
      nextId = 0;
    } finally {
      lock.writeLock().unlock();
    }
  }

  void recordCall(MockWrapper wrapper, MockCall call) {
    lock.writeLock().lock();
    try {
      configFor(wrapper).calls.add(call);
    } finally {
      lock.writeLock().unlock();
    }
  }

  void setReturn(MockWrapper wrapper, @Nullable Tuple args, Object value) {
    lock.writeLock().lock();
    try {
      MockConfig config = configFor(wrapper);
      if (args == null) {
        config.defaultReturn = value;
      } else {
        config.returnsByArgs.put(argsKey(args), value);
      }
    } finally {
      lock.writeLock().unlock();
    }
  }

  /** Returns the config of {@code wrapper}, registering it again if a reset dropped it. */
  private MockConfig configFor(MockWrapper wrapper) {
    MockConfig config = configs.get(wrapper);
    if (config == null) {
      config = new MockConfig();
      configs.put(wrapper, config);
      wrappers.putIfAbsent(wrapper.getWrapped(), wrapper);
      nextId = Math.max(nextId, wrapper.getId());
      logger.atFine().log("Re-registered mock #%d after reset", wrapper.getId());
    }
    return config;
  }

  /**
   * Returns the value configured for a call with the given positional arguments: the value set
   * for exactly these arguments, else the default value, else nothing.
   */
  Optional<Object> getReturn(MockWrapper wrapper, Tuple args) {
    lock.readLock().lock();
    try {
      MockConfig config = configs.get(wrapper);
      if (config == null) {
        return Optional.empty();
      }
      Object value = config.returnsByArgs.get(argsKey(args));
      return Optional.ofNullable(value != null ? value : config.defaultReturn);
    } finally {
      lock.readLock().unlock();
    }
  }

  public boolean wasCalled(MockWrapper wrapper) {
    return callCount(wrapper) > 0;
  }

  public int callCount(MockWrapper wrapper) {
    lock.readLock().lock();
    try {
      MockConfig config = configs.get(wrapper);
      return config == null ? 0 : config.calls.size();
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Returns a copy of the call log of a mock. */
  public ImmutableList<MockCall> calls(MockWrapper wrapper) {
    lock.readLock().lock();
    try {
      MockConfig config = configs.get(wrapper);
      return config == null ? ImmutableList.of() : ImmutableList.copyOf(config.calls);
    } finally {
      lock.readLock().unlock();
    }
  }

  /** Returns the canonical key of a positional argument list. */
  static String argsKey(Tuple args) {
    return args.isEmpty() ? "()" : Starlark.repr(args);
  }
}
