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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Lists;
import com.google.common.collect.Sets;

import us.blanshard.minesweeper.core.Board;
import us.blanshard.minesweeper.core.Cell;

import java.util.Collections;
import java.util.LinkedList;
import java.util.List;
import java.util.Set;
import java.util.SortedSet;
import java.util.logging.Logger;

/**
 * Plays an {@link Agent} against a {@link Board}: the agent picks a cell, the
 * board reveals it, the agent learns from it and flags what it has proven to
 * be mines.  Not thread safe.
 *
 * @author Luke Blanshard
 */
public final class Game {
  private static final Logger logger = Logger.getLogger(Game.class.getName());

  public enum Outcome {
    IN_PROGRESS,
    /** Every mine is flagged. */
    WON,
    /** The agent revealed a mine. */
    LOST,
    /** The agent ran out of cells without flagging every mine. */
    STUCK;
  }

  private final Board board;
  private final Agent agent;
  private final Registry registry;
  private final SortedSet<Cell> flagged = Sets.newTreeSet();
  private final List<Agent.Decision> history = Lists.newArrayList();
  private Outcome outcome = Outcome.IN_PROGRESS;

  public Game(Board board, Agent agent) {
    this(board, agent, nullRegistry());
  }

  public Game(Board board, Agent agent, Registry registry) {
    this.board = checkNotNull(board);
    this.agent = checkNotNull(agent);
    this.registry = checkNotNull(registry);
    checkArgument(board.getHeight() == agent.getKnowledge().getHeight()
        && board.getWidth() == agent.getKnowledge().getWidth(),
        "Agent and board disagree about the size of the game");
  }

  public Board getBoard() {
    return board;
  }

  public Agent getAgent() {
    return agent;
  }

  public Registry getListenerRegistry() {
    return registry;
  }

  public Outcome getOutcome() {
    return outcome;
  }

  public boolean isOver() {
    return outcome != Outcome.IN_PROGRESS;
  }

  /** The cells flagged as mines so far. */
  public Set<Cell> getFlagged() {
    return Collections.unmodifiableSet(flagged);
  }

  /** The decisions the agent has made, in order. */
  public List<Agent.Decision> getMovesPlayed() {
    return Collections.unmodifiableList(history);
  }

  /** Plays until the game is over, returns how it ended. */
  public Outcome play() {
    while (!isOver()) step();
    return outcome;
  }

  /**
   * Plays a single turn.  Returns the agent's decision for the turn.
   */
  public Agent.Decision step() {
    checkState(!isOver(), "Game is already over: %s", outcome);
    Agent.Decision decision = agent.chooseMove();
    history.add(decision);
    if (decision.isStuck()) {
      finish(Outcome.STUCK);
      return decision;
    }

    Cell cell = decision.cell;
    logger.fine("Move " + history.size() + ": " + decision);
    if (board.isMine(cell)) {
      registry.asListener().moveMade(this, decision, -1);
      finish(Outcome.LOST);
      return decision;
    }

    int count = board.nearbyMines(cell);
    agent.observe(cell, count);
    registry.asListener().moveMade(this, decision, count);

    Set<Cell> newFlags = ImmutableSet.copyOf(
        Sets.difference(agent.getKnowledge().getMines(), flagged));
    if (!newFlags.isEmpty()) {
      flagged.addAll(newFlags);
      registry.asListener().minesFlagged(this, newFlags);
    }
    if (board.won(flagged)) finish(Outcome.WON);
    return decision;
  }

  private void finish(Outcome outcome) {
    this.outcome = outcome;
    logger.info("Game over after " + history.size() + " moves: " + outcome
        + ", flagged " + flagged.size() + " of " + board.getMineCount() + " mines");
    registry.asListener().gameOver(this, outcome);
  }

  /** Returns a listener registry that refuses to take listeners. */
  public static Registry nullRegistry() {
    return NULL_REGISTRY;
  }

  /** Creates a registry that does the normal thing. */
  public static Registry newRegistry() {
    return new NormalRegistry();
  }

  /**
   * A callback interface for interested parties to follow a game.
   */
  public interface Listener {
    /**
     * Called after the agent reveals a cell.  The count is the number of mines
     * around the cell, or -1 if the cell was itself a mine.
     */
    void moveMade(Game game, Agent.Decision decision, int count);

    /** Called when the agent has proven some more cells to be mines. */
    void minesFlagged(Game game, Set<Cell> mines);

    /** Called once, when the game ends. */
    void gameOver(Game game, Outcome outcome);
  }

  /**
   * A null implementation of {@link Listener} so you can have a listener
   * without having to implement every method.
   */
  public static class Adapter implements Listener {
    @Override public void moveMade(Game game, Agent.Decision decision, int count) {}
    @Override public void minesFlagged(Game game, Set<Cell> mines) {}
    @Override public void gameOver(Game game, Outcome outcome) {}
  }

  /**
   * Keeps track of the {@linkplain Listener listeners} on behalf of one or
   * more Games.
   */
  public abstract static class Registry {

    public abstract void addListener(Listener listener);

    public abstract void removeListener(Listener listener);

    /**
     * Exposes the registry as a listener itself, so the Game has a single
     * instance to address.
     */
    protected abstract Listener asListener();
  }

  private static final Listener NULL_LISTENER = new Adapter();
  private static final Registry NULL_REGISTRY = new NullRegistry();

  private static class NullRegistry extends Registry {
    @Override public void addListener(Listener listener) {
      throw new UnsupportedOperationException();
    }
    @Override public void removeListener(Listener listener) {
      throw new UnsupportedOperationException();
    }
    @Override protected Listener asListener() { return NULL_LISTENER; }
  }

  private static class NormalRegistry extends Registry implements Listener {
    private final List<Listener> listeners = new LinkedList<Listener>();

    @Override public void addListener(Listener listener) {
      listeners.add(listener);
    }

    @Override public void removeListener(Listener listener) {
      listeners.remove(listener);
    }

    @Override protected Listener asListener() {
      return this;
    }

    @Override public void moveMade(Game game, Agent.Decision decision, int count) {
      for (Listener listener : listeners)
        listener.moveMade(game, decision, count);
    }

    @Override public void minesFlagged(Game game, Set<Cell> mines) {
      for (Listener listener : listeners)
        listener.minesFlagged(game, mines);
    }

    @Override public void gameOver(Game game, Outcome outcome) {
      for (Listener listener : listeners)
        listener.gameOver(game, outcome);
    }
  }
}
