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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;

import us.blanshard.minesweeper.core.Board;
import us.blanshard.minesweeper.core.Cell;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnitRunner;

import java.util.List;
import java.util.Random;

@RunWith(MockitoJUnitRunner.class)
public class GameTest {
  @Mock Game.Listener listener;

  private static final Board lineOfThree = Board.withMines(1, 3, ImmutableList.of(Cell.of(0, 2)));

  // Always picks the last of the choices offered.
  private static Random lastChoice() {
    return new Random() {
      private static final long serialVersionUID = 1L;
      @Override public int nextInt(int bound) { return bound - 1; }
    };
  }

  private static Agent agentKnowingFirstCell() {
    Agent agent = new Agent(1, 3, new Random(1));
    agent.observe(Cell.of(0, 0), lineOfThree.nearbyMines(Cell.of(0, 0)));
    return agent;
  }

  @Test public void play_won() {
    Game game = new Game(lineOfThree, agentKnowingFirstCell());
    assertEquals(Game.Outcome.IN_PROGRESS, game.getOutcome());
    assertFalse(game.isOver());

    assertEquals(Game.Outcome.WON, game.play());
    assertTrue(game.isOver());
    assertThat(game.getFlagged()).containsExactly(Cell.of(0, 2));
    assertThat(game.getMovesPlayed()).hasSize(1);
    assertEquals(Agent.Decision.Kind.SAFE, game.getMovesPlayed().get(0).kind);
  }

  @Test public void play_lost() {
    Game game = new Game(lineOfThree, new Agent(1, 3, lastChoice()));
    assertEquals(Game.Outcome.LOST, game.play());
    assertThat(game.getFlagged()).isEmpty();
    Agent.Decision last = game.getMovesPlayed().get(0);
    assertEquals(Agent.Decision.Kind.RANDOM, last.kind);
    assertEquals(Cell.of(0, 2), last.cell);
  }

  @Test public void play_stuck() {
    Board board = Board.withMines(1, 1, ImmutableList.<Cell>of());
    Agent agent = new Agent(1, 1, new Random(1));
    agent.observe(Cell.of(0, 0), 0);
    Game game = new Game(board, agent);

    assertEquals(Game.Outcome.STUCK, game.play());
    assertTrue(game.getMovesPlayed().get(0).isStuck());
  }

  @Test(expected = IllegalStateException.class)
  public void step_afterGameOver() {
    Game game = new Game(lineOfThree, agentKnowingFirstCell());
    game.play();
    game.step();
  }

  @Test(expected = IllegalArgumentException.class)
  public void sizeMismatch() {
    new Game(lineOfThree, new Agent(3, 1, new Random(1)));
  }

  @Test(expected = UnsupportedOperationException.class)
  public void nullRegistry() {
    Game.nullRegistry().addListener(listener);
  }

  /**
   * Seeded games on a standard board: the agent only ever loses on a guess,
   * and a win means every mine is flagged.
   */
  @Test public void play_seededGames() {
    int won = 0;
    for (int seed = 0; seed < 25; ++seed) {
      Random random = new Random(seed);
      Board board = new Board(8, 8, 8, random);
      Game game = new Game(board, new Agent(8, 8, random));
      Game.Outcome outcome = game.play();

      List<Agent.Decision> moves = game.getMovesPlayed();
      if (outcome == Game.Outcome.WON) {
        ++won;
        assertEquals(board.getMines(), game.getFlagged());
      } else {
        assertEquals(Game.Outcome.LOST, outcome);
        assertEquals(Agent.Decision.Kind.RANDOM, moves.get(moves.size() - 1).kind);
      }
      assertTrue(board.getMines().containsAll(game.getFlagged()));
    }
    assertThat(won).isGreaterThan(0);
  }

  // Tests for listeners

  @Test public void shouldCallListenerThroughGame() {
    // given
    Game.Registry registry = Game.newRegistry();
    registry.addListener(listener);
    Game game = new Game(lineOfThree, agentKnowingFirstCell(), registry);

    // when
    game.play();

    // then
    ArgumentCaptor<Agent.Decision> decision = ArgumentCaptor.forClass(Agent.Decision.class);
    verify(listener).moveMade(eq(game), decision.capture(), eq(1));
    assertEquals(Cell.of(0, 1), decision.getValue().cell);
    verify(listener).minesFlagged(game, ImmutableSet.of(Cell.of(0, 2)));
    verify(listener).gameOver(game, Game.Outcome.WON);
    assertSame(registry, game.getListenerRegistry());
  }

  @Test public void shouldReportMineAsNegativeCount() {
    // given
    Game.Registry registry = Game.newRegistry();
    registry.addListener(listener);
    Game game = new Game(lineOfThree, new Agent(1, 3, lastChoice()), registry);

    // when
    game.play();

    // then
    verify(listener).moveMade(eq(game), any(Agent.Decision.class), eq(-1));
    verify(listener, never()).minesFlagged(any(Game.class), any());
    verify(listener).gameOver(game, Game.Outcome.LOST);
  }

  @Test public void shouldNotCallListenerAfterListenerRemoval() {
    // given
    Game.Registry registry = Game.newRegistry();
    registry.addListener(listener);
    registry.removeListener(listener);
    Game game = new Game(lineOfThree, agentKnowingFirstCell(), registry);

    // when
    game.play();

    // then
    verify(listener, never()).moveMade(any(Game.class), any(Agent.Decision.class), anyInt());
    verify(listener, never()).gameOver(any(Game.class), any(Game.Outcome.class));
  }
}
