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
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSortedSet;
import com.google.common.collect.Lists;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;

import javax.annotation.concurrent.Immutable;

/**
 * The ground truth of a Minesweeper game: where the mines are.  Answers the
 * questions a player is allowed to ask, and decides when the game is won.
 *
 * @author Luke Blanshard
 */
@Immutable
public final class Board {

  private final int height;
  private final int width;
  private final ImmutableSortedSet<Cell> mines;

  /**
   * Creates a board with the given number of mines, placed uniformly at random
   * using the given source of randomness.
   */
  public Board(int height, int width, int mineCount, Random random) {
    this(height, width, placeMines(height, width, mineCount, checkNotNull(random)));
  }

  private Board(int height, int width, Collection<Cell> mines) {
    Cell.checkDimensions(height, width);
    this.height = height;
    this.width = width;
    for (Cell mine : mines)
      checkArgument(mine.isWithin(height, width), "Mine %s is off the board", mine);
    this.mines = ImmutableSortedSet.copyOf(mines);
  }

  /** Creates a board with mines at exactly the given cells. */
  public static Board withMines(int height, int width, Collection<Cell> mines) {
    return new Board(height, width, mines);
  }

  /** Returns a random selection of distinct cells, {@code mineCount} of them. */
  private static List<Cell> placeMines(int height, int width, int mineCount, Random random) {
    Cell.checkDimensions(height, width);
    checkArgument(mineCount >= 0 && mineCount <= height * width,
        "Can't place %s mines on a %s x %s board", mineCount, height, width);
    List<Cell> cells = Lists.newArrayList(Cell.all(height, width));
    Collections.shuffle(cells, random);
    return cells.subList(0, mineCount);
  }

  public int getHeight() {
    return height;
  }

  public int getWidth() {
    return width;
  }

  public int getMineCount() {
    return mines.size();
  }

  public Set<Cell> getMines() {
    return mines;
  }

  public boolean isMine(Cell cell) {
    checkOnBoard(cell);
    return mines.contains(cell);
  }

  /**
   * Returns the number of mines touching the given cell, not counting the cell
   * itself.
   */
  public int nearbyMines(Cell cell) {
    checkOnBoard(cell);
    int count = 0;
    for (Cell neighbor : cell.neighbors(height, width)) {
      if (mines.contains(neighbor)) ++count;
    }
    return count;
  }

  /** Tells whether the given flags are exactly the mines. */
  public boolean won(Set<Cell> flagged) {
    return mines.equals(flagged);
  }

  private void checkOnBoard(Cell cell) {
    checkArgument(cell.isWithin(height, width), "%s is off the %s x %s board", cell, height, width);
  }

  @Override public String toString() {
    return height + "x" + width + " board with mines at " + mines;
  }
}
