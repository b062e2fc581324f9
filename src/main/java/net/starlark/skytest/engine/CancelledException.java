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

/**
 * Raised by the engine when it observes that the {@link ExecutionContext} running the current
 * computation has been cancelled, for example because a per-test timeout expired.
 */
public final class CancelledException extends EvalException {
  private final String reason;

  public CancelledException(String reason) {
    super("Starlark computation cancelled: " + reason);
    this.reason = reason;
  }

  /** Returns the reason passed to {@link ExecutionContext#cancel}. */
  public String getReason() {
    return reason;
  }
}
