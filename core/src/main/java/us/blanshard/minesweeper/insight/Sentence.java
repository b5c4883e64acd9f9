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
package us.blanshard.minesweeper.insight;

import com.google.common.base.Joiner;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Sets;

import us.blanshard.minesweeper.core.Cell;

import java.util.Collection;
import java.util.Collections;
import java.util.Set;
import java.util.SortedSet;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * A fact about a Minesweeper board: exactly {@link #getCount count} of the
 * {@link #getCells cells} are mines.
 *
 * <p> A sentence shrinks as its cells become known, but always keeps
 * {@code 0 <= count <= cells.size()}; anything else is a {@link Contradiction}.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Sentence {
  private final SortedSet<Cell> cells;
  private int count;

  public Sentence(Collection<Cell> cells, int count) {
    this.cells = Sets.newTreeSet(cells);
    this.count = count;
    checkCount();
  }

  /** Makes an independent copy of the given sentence. */
  public Sentence(Sentence that) {
    this(that.cells, that.count);
  }

  public Set<Cell> getCells() {
    return Collections.unmodifiableSet(cells);
  }

  public int getCount() {
    return count;
  }

  public int size() {
    return cells.size();
  }

  public boolean isEmpty() {
    return cells.isEmpty();
  }

  public boolean contains(Cell cell) {
    return cells.contains(cell);
  }

  /**
   * Returns the cells known to be mines: all of them when the count matches
   * the number of cells, otherwise none.
   */
  public Set<Cell> knownMines() {
    if (count != 0 && count == cells.size()) return ImmutableSet.copyOf(cells);
    return ImmutableSet.of();
  }

  /**
   * Returns the cells known to be safe: all of them when the count is zero,
   * otherwise none.
   */
  public Set<Cell> knownSafes() {
    if (count == 0) return ImmutableSet.copyOf(cells);
    return ImmutableSet.of();
  }

  /** Removes the given cell, now known to be a mine, from this sentence. */
  public void discardAsMine(Cell cell) {
    if (cells.remove(cell)) {
      --count;
      checkCount();
    }
  }

  /** Removes the given cell, now known to be safe, from this sentence. */
  public void discardAsSafe(Cell cell) {
    if (cells.remove(cell)) {
      checkCount();
    }
  }

  /** Tells whether this sentence's cells are all found in the other's. */
  public boolean isSubsetOf(Sentence that) {
    return that.cells.containsAll(this.cells);
  }

  /**
   * Returns the sentence about the cells of this one that aren't in the given
   * subset: if {@code subset} has k of its cells as mines, the rest of this
   * sentence's cells have {@code count - k}.
   */
  public Sentence subtract(Sentence subset) {
    return new Sentence(Sets.difference(this.cells, subset.cells), this.count - subset.count);
  }

  private void checkCount() {
    if (count < 0 || count > cells.size())
      throw new Contradiction("Impossible sentence: " + this);
  }

  @Override public boolean equals(Object o) {
    if (o == this) return true;
    if (!(o instanceof Sentence)) return false;
    Sentence that = (Sentence) o;
    return this.count == that.count && this.cells.equals(that.cells);
  }

  @Override public int hashCode() {
    return cells.hashCode() * 31 + count;
  }

  @Override public String toString() {
    return "{" + Joiner.on(", ").join(cells) + "} = " + count;
  }
}
