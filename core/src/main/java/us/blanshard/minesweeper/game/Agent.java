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
package us.blanshard.minesweeper.game;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.Objects;
import com.google.common.collect.Lists;

import us.blanshard.minesweeper.core.Cell;
import us.blanshard.minesweeper.insight.KnowledgeBase;

import java.util.List;
import java.util.Random;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import javax.annotation.concurrent.NotThreadSafe;

/**
 * A Minesweeper player.  Reveals cells proven safe when it has any, and
 * otherwise guesses among the cells not yet revealed and not proven to be
 * mines.
 *
 * @author Luke Blanshard
 */
@NotThreadSafe
public final class Agent {

  private final KnowledgeBase knowledge;
  private final Random random;

  public Agent(int height, int width, Random random) {
    this.knowledge = new KnowledgeBase(height, width);
    this.random = checkNotNull(random);
  }

  public KnowledgeBase getKnowledge() {
    return knowledge;
  }

  /** Tells the agent what the board reported for a cell it revealed. */
  public void observe(Cell cell, int count) {
    knowledge.observe(cell, count);
  }

  /**
   * Returns a cell proven safe that hasn't been revealed yet, the first such in
   * row-major order, or null if there isn't one.
   */
  @Nullable public Cell chooseSafeMove() {
    for (Cell cell : knowledge.getSafes()) {
      if (!knowledge.hasMoved(cell)) return cell;
    }
    return null;
  }

  /**
   * Returns a cell chosen uniformly at random from those neither revealed nor
   * known to be mines, or null if every cell is one or the other.
   */
  @Nullable public Cell chooseRandomMove() {
    List<Cell> choices = Lists.newArrayList();
    for (Cell cell : Cell.all(knowledge.getHeight(), knowledge.getWidth())) {
      if (!knowledge.hasMoved(cell) && !knowledge.isKnownMine(cell))
        choices.add(cell);
    }
    if (choices.isEmpty()) return null;
    return choices.get(random.nextInt(choices.size()));
  }

  /** Decides on the next move: a safe one if possible, else a guess. */
  public Decision chooseMove() {
    Cell cell = chooseSafeMove();
    if (cell != null) return new Decision(Decision.Kind.SAFE, cell);
    cell = chooseRandomMove();
    if (cell != null) return new Decision(Decision.Kind.RANDOM, cell);
    return Decision.STUCK;
  }

  /**
   * The agent's choice for a turn.
   */
  @Immutable
  public static final class Decision {
    public enum Kind {
      /** The cell is proven safe. */
      SAFE,
      /** The cell is a guess. */
      RANDOM,
      /** No cell is left to reveal. */
      STUCK;
    }

    static final Decision STUCK = new Decision(Kind.STUCK, null);

    public final Kind kind;
    @Nullable public final Cell cell;

    private Decision(Kind kind, @Nullable Cell cell) {
      this.kind = kind;
      this.cell = cell;
    }

    public boolean isStuck() {
      return kind == Kind.STUCK;
    }

    @Override public boolean equals(Object o) {
      if (o == this) return true;
      if (!(o instanceof Decision)) return false;
      Decision that = (Decision) o;
      return this.kind == that.kind && Objects.equal(this.cell, that.cell);
    }

    @Override public int hashCode() {
      return Objects.hashCode(kind, cell);
    }

    @Override public String toString() {
      return kind + (cell == null ? "" : " " + cell);
    }
  }
}
