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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import us.blanshard.minesweeper.core.Cell;

import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.logging.Logger;

import javax.annotation.concurrent.NotThreadSafe;

/**
 * What a Minesweeper player knows about one game: the cells it has revealed,
 * the cells proven safe or proven mines, and a list of {@link Sentence}s
 * about the rest.
 *
 * <p> Every observation is followed by running inference to a fixpoint, so
 * after {@link #observe} returns the proven sets contain everything that the
 * safe/mine extraction and subset rules can deduce.  The proven sets only
 * ever grow, and never overlap.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class KnowledgeBase {
  private static final Logger logger = Logger.getLogger(KnowledgeBase.class.getName());

  /** The most mines a revealed cell can report. */
  public static final int MAX_COUNT = 8;

  private final int height;
  private final int width;
  private final SortedSet<Cell> movesMade = Sets.newTreeSet();
  private final SortedSet<Cell> safes = Sets.newTreeSet();
  private final SortedSet<Cell> mines = Sets.newTreeSet();
  private final List<Sentence> sentences = Lists.newArrayList();

  public KnowledgeBase(int height, int width) {
    Cell.checkDimensions(height, width);
    this.height = height;
    this.width = width;
  }

  public int getHeight() {
    return height;
  }

  public int getWidth() {
    return width;
  }

  /** The cells revealed so far. */
  public SortedSet<Cell> getMovesMade() {
    return Collections.unmodifiableSortedSet(movesMade);
  }

  /** The cells proven safe, revealed or not. */
  public SortedSet<Cell> getSafes() {
    return Collections.unmodifiableSortedSet(safes);
  }

  /** The cells proven to be mines. */
  public SortedSet<Cell> getMines() {
    return Collections.unmodifiableSortedSet(mines);
  }

  /** Returns copies of the current sentences, in the order they were added. */
  public List<Sentence> getSentences() {
    ImmutableList.Builder<Sentence> builder = ImmutableList.builder();
    for (Sentence sentence : sentences)
      builder.add(new Sentence(sentence));
    return builder.build();
  }

  public boolean hasMoved(Cell cell) {
    return movesMade.contains(cell);
  }

  public boolean isKnownSafe(Cell cell) {
    return safes.contains(cell);
  }

  public boolean isKnownMine(Cell cell) {
    return mines.contains(cell);
  }

  /**
   * Records that the given cell is a mine, and removes it from every sentence.
   *
   * @throws Contradiction if the cell is already known to be safe
   */
  public void declareMine(Cell cell) {
    checkOnBoard(cell);
    if (safes.contains(cell))
      throw new Contradiction(cell + " is known safe, can't be a mine");
    mines.add(cell);
    for (Sentence sentence : sentences)
      sentence.discardAsMine(cell);
  }

  /**
   * Records that the given cell is safe, and removes it from every sentence.
   *
   * @throws Contradiction if the cell is already known to be a mine
   */
  public void declareSafe(Cell cell) {
    checkOnBoard(cell);
    if (mines.contains(cell))
      throw new Contradiction(cell + " is known to be a mine, can't be safe");
    safes.add(cell);
    for (Sentence sentence : sentences)
      sentence.discardAsSafe(cell);
  }

  /**
   * Takes in the fact that the given cell was revealed and found to have
   * {@code count} mines around it, then infers everything that follows.
   * Nothing is changed if the arguments are rejected.
   *
   * @throws IllegalArgumentException if the cell is off the board or already
   *     revealed, or the count could never be reported
   * @throws Contradiction if the observation is inconsistent with what's
   *     already known
   */
  public void observe(Cell cell, int count) {
    checkOnBoard(cell);
    checkArgument(!movesMade.contains(cell), "%s has already been revealed", cell);
    checkArgument(count >= 0 && count <= MAX_COUNT, "Bad mine count %s for %s", count, cell);
    if (mines.contains(cell))
      throw new Contradiction(cell + " is known to be a mine, can't be revealed");

    SortedSet<Cell> unknown = Sets.newTreeSet();
    int remaining = count;
    for (Cell neighbor : cell.neighbors(height, width)) {
      if (mines.contains(neighbor)) --remaining;
      else if (!safes.contains(neighbor)) unknown.add(neighbor);
    }
    if (remaining < 0 || remaining > unknown.size())
      throw new Contradiction(
          cell + " reports " + count + " mines, leaving " + remaining + " among " + unknown);

    movesMade.add(cell);
    declareSafe(cell);
    if (!unknown.isEmpty()) {
      Sentence sentence = new Sentence(unknown, remaining);
      logger.fine("Observed " + sentence);
      sentences.add(sentence);
    }
    infer();
  }

  /**
   * Repeatedly pulls proven safes and mines out of the sentences and derives
   * new sentences from pairs where one's cells are a subset of the other's,
   * until a pass learns nothing.  Sentences derived in a pass are compared
   * with the others starting from the next pass.
   *
   * @return whether anything new was learned
   */
  public boolean infer() {
    boolean learned = false;
    int passes = 0;
    while (true) {
      ++passes;
      boolean changed = declareKnownCells();

      List<Sentence> derived = deriveSentences();
      sentences.addAll(derived);
      removeUninformative();
      if (!derived.isEmpty()) changed = true;

      if (!changed) break;
      learned = true;
    }
    logger.finer("Inference reached a fixpoint after " + passes + " passes");
    return learned;
  }

  /**
   * Declares every cell that some sentence proves safe or a mine and that
   * isn't already recorded as such.  Returns whether there were any.
   */
  private boolean declareKnownCells() {
    SortedSet<Cell> safesFound = Sets.newTreeSet();
    SortedSet<Cell> minesFound = Sets.newTreeSet();
    for (Sentence sentence : sentences) {
      safesFound.addAll(sentence.knownSafes());
      minesFound.addAll(sentence.knownMines());
    }

    boolean changed = false;
    for (Cell cell : safesFound) {
      if (!safes.contains(cell)) {
        logger.fine("Inferred safe " + cell);
        declareSafe(cell);
        changed = true;
      }
    }
    for (Cell cell : minesFound) {
      if (!mines.contains(cell)) {
        logger.fine("Inferred mine " + cell);
        declareMine(cell);
        changed = true;
      }
    }
    return changed;
  }

  /**
   * Applies the subset rule to every ordered pair of distinct sentences,
   * returning the new non-empty sentences it yields.
   */
  private List<Sentence> deriveSentences() {
    List<Sentence> derived = Lists.newArrayList();
    for (Sentence subset : sentences) {
      if (subset.isEmpty()) continue;
      for (Sentence superset : sentences) {
        if (subset.equals(superset) || !subset.isSubsetOf(superset)) continue;
        Sentence sentence = superset.subtract(subset);
        if (!sentence.isEmpty() && !sentences.contains(sentence) && !derived.contains(sentence)) {
          logger.fine("Derived " + sentence + " from " + superset + " minus " + subset);
          derived.add(sentence);
        }
      }
    }
    return derived;
  }

  /** Drops sentences that have no cells left, and repeats of earlier ones. */
  private void removeUninformative() {
    Set<Sentence> seen = Sets.newHashSet();
    for (Iterator<Sentence> it = sentences.iterator(); it.hasNext(); ) {
      Sentence sentence = it.next();
      if (sentence.isEmpty() || !seen.add(sentence)) it.remove();
    }
  }

  // For testing
  void addSentence(Sentence sentence) {
    sentences.add(new Sentence(sentence));
  }

  private void checkOnBoard(Cell cell) {
    checkNotNull(cell);
    checkArgument(cell.isWithin(height, width), "%s is off the %s x %s board", cell, height, width);
  }

  @Override public String toString() {
    return "safes=" + safes + " mines=" + mines + " sentences=" + sentences;
  }
}
