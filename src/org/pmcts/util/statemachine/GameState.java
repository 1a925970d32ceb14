package org.pmcts.util.statemachine;

import java.util.List;
import java.util.Random;

/**
 * Interface for all game states that can be searched.
 *
 * Games are two-player, alternating, perfect-information and zero-sum.  Players are identified as
 * {@link #PLAYER_ONE} and {@link #PLAYER_TWO}.
 *
 * Moves must implement equals() and hashCode() because they are used as map keys when the statistics of several
 * search trees are merged.
 *
 * @param <M> - the move type.
 * @param <S> - the concrete state type (returned by {@link #copy()}).
 */
public interface GameState<M, S extends GameState<M, S>>
{
  /**
   * The first player to move.
   */
  public static final int PLAYER_ONE = 1;

  /**
   * The second player to move.
   */
  public static final int PLAYER_TWO = 2;

  /**
   * @return all the legal moves in this state, or an empty list if the game is over.
   */
  public List<M> getMoves();

  /**
   * Mutate this game state by playing the specified move.
   *
   * Only valid for legal moves.
   *
   * @param xiMove - the move to play.
   */
  public void doMove(M xiMove);

  /**
   * Mutate this game state by playing a legal move chosen uniformly at random.
   *
   * @param xiRandom - the source of randomness.
   *
   * @throws IllegalStateException if there are no legal moves.
   */
  public void doRandomMove(Random xiRandom);

  /**
   * @return whether the game is still in progress and there is at least one legal move.
   */
  public boolean hasMoves();

  /**
   * Only meaningful for terminal states.
   *
   * @return the score from the perspective of the specified player: 1.0 for a win, 0.0 for a loss and 0.5 for a draw.
   *
   * @param xiPlayer - the player from whose perspective to score the state.
   */
  public double getResult(int xiPlayer);

  /**
   * @return the player to play.
   */
  public int getPlayerToMove();

  /**
   * @return a deep copy of this state.
   */
  public S copy();

  /**
   * @return the opponent of the specified player.
   *
   * @param xiPlayer - the player.
   */
  public static int opponentOf(int xiPlayer)
  {
    return (PLAYER_ONE + PLAYER_TWO) - xiPlayer;
  }
}
