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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableList;
import java.util.ArrayList;
import java.util.List;

/** Produces a unified diff of two texts, line by line, with three lines of context. */
final class UnifiedDiff {

  private static final int CONTEXT = 3;

  private enum Op {
    EQUAL,
    DELETE,
    INSERT
  }

  /** One line of the edit script, with its 0-based positions in the old and new texts. */
  private static final class Edit {
    final Op op;
    final String line;
    final int oldIndex;
    final int newIndex;

    Edit(Op op, String line, int oldIndex, int newIndex) {
      this.op = op;
      this.line = line;
      this.oldIndex = oldIndex;
      this.newIndex = newIndex;
    }
  }

  private UnifiedDiff() {}

  /** Returns the diff from {@code expected} to {@code actual}, or the empty string if equal. */
  static String diff(String expected, String actual) {
    List<String> a = splitLines(expected);
    List<String> b = splitLines(actual);
    List<Edit> script = editScript(a, b);

    StringBuilder out = new StringBuilder();
    int i = 0;
    while (i < script.size()) {
      if (script.get(i).op == Op.EQUAL) {
        i++;
        continue;
      }
      int start = Math.max(0, i - CONTEXT);
      // Extend the hunk while the next change is within two context windows.
      int lastChange = i;
      for (int j = i; j < script.size(); j++) {
        if (script.get(j).op != Op.EQUAL) {
          if (j - lastChange > 2 * CONTEXT) {
            break;
          }
          lastChange = j;
        }
      }
      int end = Math.min(script.size(), lastChange + CONTEXT + 1);
      if (out.length() == 0) {
        out.append("--- Expected\n+++ Actual\n");
      }
      appendHunk(out, script.subList(start, end));
      i = end;
    }
    return out.toString();
  }

  private static void appendHunk(StringBuilder out, List<Edit> hunk) {
    int oldStart = -1;
    int newStart = -1;
    int oldLen = 0;
    int newLen = 0;
    for (Edit e : hunk) {
      if (e.op != Op.INSERT) {
        if (oldStart < 0) {
          oldStart = e.oldIndex;
        }
        oldLen++;
      }
      if (e.op != Op.DELETE) {
        if (newStart < 0) {
          newStart = e.newIndex;
        }
        newLen++;
      }
    }
    if (oldStart < 0) {
      oldStart = hunk.get(0).oldIndex;
    }
    if (newStart < 0) {
      newStart = hunk.get(0).newIndex;
    }
    out.append("@@ -")
        .append(range(oldStart, oldLen))
        .append(" +")
        .append(range(newStart, newLen))
        .append(" @@\n");
    for (Edit e : hunk) {
      char marker = e.op == Op.EQUAL ? ' ' : e.op == Op.DELETE ? '-' : '+';
      out.append(marker).append(e.line).append('\n');
    }
  }

  private static String range(int start, int length) {
    if (length == 1) {
      return Integer.toString(start + 1);
    }
    return (length == 0 ? start : start + 1) + "," + length;
  }

  private static List<String> splitLines(String text) {
    if (text.isEmpty()) {
      return ImmutableList.of();
    }
    List<String> lines = new ArrayList<>(Splitter.on('\n').splitToList(text));
    if (text.endsWith("\n")) {
      lines.remove(lines.size() - 1);
    }
    return lines;
  }

  /** Computes a shortest edit script from the longest common subsequence of the two texts. */
  private static List<Edit> editScript(List<String> a, List<String> b) {
    int n = a.size();
    int m = b.size();
    int[][] lcs = new int[n + 1][m + 1];
    for (int i = n - 1; i >= 0; i--) {
      for (int j = m - 1; j >= 0; j--) {
        lcs[i][j] =
            a.get(i).equals(b.get(j))
                ? lcs[i + 1][j + 1] + 1
                : Math.max(lcs[i + 1][j], lcs[i][j + 1]);
      }
    }
    List<Edit> script = new ArrayList<>();
    int i = 0;
    int j = 0;
    while (i < n || j < m) {
      if (i < n && j < m && a.get(i).equals(b.get(j))) {
        script.add(new Edit(Op.EQUAL, a.get(i), i++, j++));
      } else if (j < m && (i == n || lcs[i][j + 1] > lcs[i + 1][j])) {
        script.add(new Edit(Op.INSERT, b.get(j), i, j++));
      } else {
        script.add(new Edit(Op.DELETE, a.get(i), i++, j));
      }
    }
    return script;
  }
}
