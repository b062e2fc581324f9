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

import net.starlark.skytest.engine.EvalException;

/** Raised by a snapshot comparison that does not match and may not update the stored file. */
public final class SnapshotMismatchException extends EvalException {
  private final SnapshotMismatch mismatch;

  public SnapshotMismatchException(SnapshotMismatch mismatch) {
    super(
        String.format(
            "snapshot \"%s\" does not match:\n%s", mismatch.name(), mismatch.diff()));
    this.mismatch = mismatch;
  }

  public SnapshotMismatch getMismatch() {
    return mismatch;
  }
}
