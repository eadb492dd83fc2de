/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.cat.ast;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.Iterables;
import java.util.Map;
import java.util.Objects;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Region of a cat source file, from a start line and column to an end line
 * and column. Lines and columns are 1-based; the end column is one past the
 * last character.
 */
public class Pos {
  /** Position of something that does not come from source text. */
  public static final Pos ZERO = new Pos("", 0, 0, 0, 0);

  public final String file;
  public final int startLine;
  public final int startColumn;
  public final int endLine;
  public final int endColumn;

  public Pos(String file, int startLine, int startColumn, int endLine,
      int endColumn) {
    this.file = file;
    this.startLine = startLine;
    this.startColumn = startColumn;
    this.endLine = endLine;
    this.endColumn = endColumn;
  }

  /** Creates a position between two offsets into a string; the end offset
   * is exclusive. */
  public static Pos of(String text, String file, int startOffset,
      int endOffset) {
    final int[] start = lineColumn(text, startOffset);
    final int[] end = lineColumn(text, endOffset);
    return new Pos(file, start[0], start[1], end[0], end[1]);
  }

  /**
   * Removes the two occurrences of a marker character from a string, and
   * returns the remaining string and the position of the text that was
   * between the markers.
   *
   * <p>Used in tests; {@code split("let $x$ = 0", '$', "")} returns
   * {@code "let x = 0"} and position 1.5.
   */
  public static Map.Entry<String, Pos> split(String s, char marker,
      String file) {
    final int i = s.indexOf(marker);
    final int j = s.indexOf(marker, i + 1);
    checkArgument(i >= 0 && j > i && s.indexOf(marker, j + 1) < 0,
        "string must contain marker '%s' exactly twice", marker);
    final String s2 =
        s.substring(0, i) + s.substring(i + 1, j) + s.substring(j + 1);
    return Map.entry(s2, of(s2, file, i, j - 1));
  }

  /** Returns the smallest position that covers a non-empty collection of
   * positions. {@link #ZERO} elements are ignored. */
  public static Pos sum(Iterable<Pos> positions) {
    checkArgument(!Iterables.isEmpty(positions), "no positions");
    @Nullable Pos sum = null;
    for (Pos pos : positions) {
      if (pos.equals(ZERO)) {
        continue;
      }
      sum = sum == null ? pos : sum.plus(pos);
    }
    return sum == null ? ZERO : sum;
  }

  /** Returns the smallest position that covers this and another. */
  public Pos plus(Pos pos) {
    final boolean startsFirst = before(startLine, startColumn,
        pos.startLine, pos.startColumn);
    final boolean endsLast = !before(endLine, endColumn,
        pos.endLine, pos.endColumn);
    return new Pos(file,
        startsFirst ? startLine : pos.startLine,
        startsFirst ? startColumn : pos.startColumn,
        endsLast ? endLine : pos.endLine,
        endsLast ? endColumn : pos.endColumn);
  }

  private static boolean before(int line0, int column0, int line1,
      int column1) {
    return line0 < line1 || line0 == line1 && column0 <= column1;
  }

  @Override
  public int hashCode() {
    return Objects.hash(startLine, startColumn, endLine, endColumn);
  }

  /** {@inheritDoc}
   *
   * <p>The file name does not take part in the comparison. */
  @Override
  public boolean equals(Object o) {
    if (o == this) {
      return true;
    }
    if (!(o instanceof Pos)) {
      return false;
    }
    final Pos that = (Pos) o;
    return startLine == that.startLine
        && startColumn == that.startColumn
        && endLine == that.endLine
        && endColumn == that.endColumn;
  }

  @Override
  public String toString() {
    return describeTo(new StringBuilder()).toString();
  }

  /** Writes this position as "file:line.column", followed by
   * "-line.column" if the region is longer than one character. */
  public StringBuilder describeTo(StringBuilder buf) {
    if (!file.isEmpty()) {
      buf.append(file).append(':');
    }
    buf.append(startLine).append('.').append(startColumn);
    if (endLine != startLine || endColumn != startColumn + 1) {
      buf.append('-').append(endLine).append('.').append(endColumn);
    }
    return buf;
  }

  private static int[] lineColumn(String s, int offset) {
    checkArgument(offset <= s.length(), "offset %s beyond end", offset);
    int line = 1;
    int lineStart = 0;
    for (int i = 0; i < offset; i++) {
      if (s.charAt(i) == '\n') {
        ++line;
        lineStart = i + 1;
      }
    }
    return new int[] {line, offset - lineStart + 1};
  }
}

// End Pos.java
