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
import com.google.common.collect.ImmutableList;
import java.nio.charset.StandardCharsets;
import net.starlark.skytest.engine.SyntaxException;

/**
 * A lightweight scanner that extracts the top-level {@code load} targets and {@code def} names of
 * a Starlark file without executing it. It understands comments, string literals (including
 * triple-quoted and raw strings) and bracketed line continuations, which is all that is needed to
 * find statement starts; it is not a parser.
 */
public final class SourceScanner {

  /** The top-level facts found in one file. */
  @AutoValue
  public abstract static class ScannedFile {
    /** The first argument of each top-level {@code load} statement, in source order. */
    public abstract ImmutableList<String> loads();

    /** The names of the top-level function definitions, in source order. */
    public abstract ImmutableList<String> functions();
  }

  private final String filename;
  private final String src;
  private final int n;
  private int pos;
  private int line = 1;

  private SourceScanner(String filename, String src) {
    this.filename = filename;
    this.src = src;
    this.n = src.length();
  }

  public static ScannedFile scan(String filename, byte[] source) throws SyntaxException {
    return scan(filename, new String(source, StandardCharsets.UTF_8));
  }

  public static ScannedFile scan(String filename, String source) throws SyntaxException {
    return new SourceScanner(filename, source).run();
  }

  private ScannedFile run() throws SyntaxException {
    ImmutableList.Builder<String> loads = ImmutableList.builder();
    ImmutableList.Builder<String> functions = ImmutableList.builder();
    int depth = 0;
    boolean atLineStart = true;
    boolean indented = false;

    while (pos < n) {
      char c = src.charAt(pos);
      if (c == '\n') {
        line++;
        pos++;
        if (depth == 0) {
          atLineStart = true;
          indented = false;
        }
        continue;
      }
      if (c == ' ' || c == '\t' || c == '\r' || c == '\f') {
        if (atLineStart) {
          indented = true;
        }
        pos++;
        continue;
      }
      if (c == '\\' && pos + 1 < n && src.charAt(pos + 1) == '\n') {
        pos += 2;
        line++;
        continue;
      }
      if (c == '#') {
        skipComment();
        continue;
      }

      boolean statementStart = atLineStart && !indented && depth == 0;
      atLineStart = false;

      if (c == '"' || c == '\'') {
        readString(false);
      } else if (isIdentStart(c)) {
        String ident = readIdent();
        if (isStringPrefix(ident) && pos < n && isQuote(src.charAt(pos))) {
          readString(ident.indexOf('r') >= 0 || ident.indexOf('R') >= 0);
        } else if (statementStart && ident.equals("def")) {
          skipBlanks();
          if (pos < n && isIdentStart(src.charAt(pos))) {
            functions.add(readIdent());
          }
        } else if (statementStart && ident.equals("load")) {
          skipBlanks();
          if (pos < n && src.charAt(pos) == '(') {
            pos++;
            depth++;
            skipSpaceAndComments();
            if (pos < n && isQuote(src.charAt(pos))) {
              loads.add(readString(false));
            }
          }
        }
      } else {
        if (c == '(' || c == '[' || c == '{') {
          depth++;
        } else if ((c == ')' || c == ']' || c == '}') && depth > 0) {
          depth--;
        }
        pos++;
      }
    }
    return new AutoValue_SourceScanner_ScannedFile(loads.build(), functions.build());
  }

  private void skipComment() {
    while (pos < n && src.charAt(pos) != '\n') {
      pos++;
    }
  }

  private void skipBlanks() {
    while (pos < n && (src.charAt(pos) == ' ' || src.charAt(pos) == '\t')) {
      pos++;
    }
  }

  private void skipSpaceAndComments() {
    while (pos < n) {
      char c = src.charAt(pos);
      if (c == '#') {
        skipComment();
      } else if (Character.isWhitespace(c)) {
        if (c == '\n') {
          line++;
        }
        pos++;
      } else {
        return;
      }
    }
  }

  private String readIdent() {
    int start = pos;
    while (pos < n && isIdentPart(src.charAt(pos))) {
      pos++;
    }
    return src.substring(start, pos);
  }

  /** Reads the string literal starting at the current quote and returns its decoded value. */
  private String readString(boolean raw) throws SyntaxException {
    int startLine = line;
    char q = src.charAt(pos);
    boolean triple = pos + 2 < n && src.charAt(pos + 1) == q && src.charAt(pos + 2) == q;
    pos += triple ? 3 : 1;
    StringBuilder value = new StringBuilder();
    while (pos < n) {
      char c = src.charAt(pos);
      if (c == '\\' && pos + 1 < n) {
        char next = src.charAt(pos + 1);
        if (raw) {
          value.append(c).append(next);
        } else {
          value.append(unescape(next));
        }
        if (next == '\n') {
          line++;
        }
        pos += 2;
        continue;
      }
      if (c == q) {
        if (!triple) {
          pos++;
          return value.toString();
        }
        if (pos + 2 < n && src.charAt(pos + 1) == q && src.charAt(pos + 2) == q) {
          pos += 3;
          return value.toString();
        }
      } else if (c == '\n') {
        if (!triple) {
          break;
        }
        line++;
      }
      value.append(c);
      pos++;
    }
    throw new SyntaxException(
        filename,
        ImmutableList.of(
            String.format(
                "%s:%d: unterminated %sstring literal",
                filename, startLine, triple ? "triple-quoted " : "")));
  }

  private static char unescape(char c) {
    switch (c) {
      case 'n':
        return '\n';
      case 't':
        return '\t';
      case 'r':
        return '\r';
      default:
        return c;
    }
  }

  private static boolean isQuote(char c) {
    return c == '"' || c == '\'';
  }

  private static boolean isStringPrefix(String ident) {
    switch (ident) {
      case "r":
      case "R":
      case "b":
      case "B":
      case "rb":
      case "br":
      case "Rb":
      case "bR":
      case "RB":
      case "BR":
      case "rB":
      case "Br":
        return true;
      default:
        return false;
    }
  }

  private static boolean isIdentStart(char c) {
    return Character.isLetter(c) || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return Character.isLetterOrDigit(c) || c == '_';
  }
}
