/*
Copyright 2016 Luke Blanshard

Licensed under the Apache License, Version 2.0 (the "License");
you may not use this file except in compliance with the License.
You may obtain a copy of the License at

     http://www.apache.org/licenses/LICENSE-2.0

Unless required by applicable law or agreed to in writing, software
distributed under the License is distributed on an "AS IS" BASIS,
WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
See the License for the specific language governing permissions and
limitations under the License.
*/
package us.blanshard.minesweeper.core;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.common.collect.ComparisonChain;
import com.google.common.collect.ImmutableList;

import java.util.List;

import javax.annotation.concurrent.Immutable;

/**
 * A cell on a Minesweeper board, identified by zero-based row and column.
 * Cells are plain values: two cells with the same coordinates are equal no
 * matter where they came from.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Cell implements Comparable<Cell> {

  public final int row;
  public final int column;

  private Cell(int row, int column) {
    this.row = row;
    this.column = column;
  }

  public static Cell of(int row, int column) {
    checkArgument(row >= 0 && column >= 0, "Negative coordinates: (%s, %s)", row, column);
    return new Cell(row, column);
  }

  /** All cells of a board of the given size, in row-major order. */
  public static List<Cell> all(int height, int width) {
    checkDimensions(height, width);
    ImmutableList.Builder<Cell> builder = ImmutableList.builder();
    for (int r = 0; r < height; ++r)
      for (int c = 0; c < width; ++c)
        builder.add(new Cell(r, c));
    return builder.build();
  }

  /** Tells whether this cell lies on a board of the given size. */
  public boolean isWithin(int height, int width) {
    return row < height && column < width;
  }

  /**
   * The cells touching this one, including diagonally, that lie on a board of
   * the given size.  Never includes this cell.  Row-major order.
   */
  public List<Cell> neighbors(int height, int width) {
    ImmutableList.Builder<Cell> builder = ImmutableList.builder();
    for (int r = row - 1; r <= row + 1; ++r) {
      for (int c = column - 1; c <= column + 1; ++c) {
        if (r == row && c == column) continue;
        if (r >= 0 && c >= 0 && r < height && c < width)
          builder.add(new Cell(r, c));
      }
    }
    return builder.build();
  }

  public static void checkDimensions(int height, int width) {
    checkArgument(height > 0 && width > 0, "Bad board size: %s x %s", height, width);
  }

  @Override public int compareTo(Cell that) {
    return ComparisonChain.start()
        .compare(this.row, that.row)
        .compare(this.column, that.column)
        .result();
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Cell)) return false;
    Cell that = (Cell) o;
    return this.row == that.row && this.column == that.column;
  }

  @Override public int hashCode() {
    return row * 31 + column;
  }

  @Override public String toString() {
    return String.format("(%d, %d)", row, column);
  }
}
