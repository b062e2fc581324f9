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
package net.starlark.skytest.engine;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import javax.annotation.Nullable;

/**
 * An ExecutionContext is the per-computation state handed to the engine: one for executing a
 * file's top level, and a fresh one for each test. It carries the cancellation reason, the print
 * handler, typed thread-local values and an optional coverage recorder.
 *
 * <p>Cancellation is cooperative. {@link #cancel} may be called from any thread; the engine is
 * responsible for calling {@link #checkCancelled} at regular intervals.
 */
public final class ExecutionContext {

  /** A PrintHandler determines how a Starlark {@code print} statement is interpreted. */
  public interface PrintHandler {
    void print(ExecutionContext context, String msg);
  }

  private static final PrintHandler DISCARD = (context, msg) -> {};

  private final String name;
  private final Map<Class<?>, Object> threadLocals = new ConcurrentHashMap<>();
  @Nullable private volatile String cancelReason;
  private volatile PrintHandler printHandler = DISCARD;
  @Nullable private volatile CoverageRecorder coverageRecorder;

  public ExecutionContext(String name) {
    this.name = Preconditions.checkNotNull(name);
  }

  /** Returns the name of this context, typically the file or test being executed. */
  public String getName() {
    return name;
  }

  /**
   * Requests cancellation of the computation running in this context. Only the first reason is
   * kept.
   */
  public synchronized void cancel(String reason) {
    if (cancelReason == null) {
      cancelReason = Preconditions.checkNotNull(reason);
    }
  }

  public boolean isCancelled() {
    return cancelReason != null;
  }

  @Nullable
  public String getCancelReason() {
    return cancelReason;
  }

  /** Throws {@link CancelledException} if this context has been cancelled. */
  public void checkCancelled() throws CancelledException {
    String reason = cancelReason;
    if (reason != null) {
      throw new CancelledException(reason);
    }
  }

  public void setPrintHandler(PrintHandler handler) {
    this.printHandler = Preconditions.checkNotNull(handler);
  }

  /** Called by the engine for each Starlark {@code print} statement. */
  public void print(String msg) {
    printHandler.print(this, msg);
  }

  /** Associates a value with this context, keyed by its class. */
  public <T> void setThreadLocal(Class<T> key, T value) {
    threadLocals.put(key, Preconditions.checkNotNull(value));
  }

  /** Returns the value associated with the given key, or null if there is none. */
  @Nullable
  public <T> T getThreadLocal(Class<T> key) {
    return key.cast(threadLocals.get(key));
  }

  public void setCoverageRecorder(@Nullable CoverageRecorder recorder) {
    this.coverageRecorder = recorder;
  }

  @Nullable
  public CoverageRecorder getCoverageRecorder() {
    return coverageRecorder;
  }

  /** Records execution of a line; a no-op unless a coverage recorder is installed. */
  public void recordCoverage(String filename, int line) {
    CoverageRecorder recorder = coverageRecorder;
    if (recorder != null) {
      recorder.recordLine(filename, line);
    }
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("name", name)
        .add("cancelReason", cancelReason)
        .toString();
  }
}
