package org.pmcts.player.search;

import java.util.Arrays;
import java.util.List;
import java.util.Random;

import org.pmcts.util.statemachine.GameState;

/**
 * A state whose rollouts always fail.
 */
public class FailingRolloutState implements GameState<Integer, FailingRolloutState>
{
  public static final String FAILURE_MESSAGE = "Rollout failed";

  @Override
  public List<Integer> getMoves()
  {
    return Arrays.asList(1, 2);
  }

  @Override
  public void doMove(Integer xiMove)
  {
    // Position never changes.
  }

  @Override
  public void doRandomMove(Random xiRandom)
  {
    throw new IllegalStateException(FAILURE_MESSAGE);
  }

  @Override
  public boolean hasMoves()
  {
    return true;
  }

  @Override
  public double getResult(int xiPlayer)
  {
    return 0.5;
  }

  @Override
  public int getPlayerToMove()
  {
    return PLAYER_ONE;
  }

  @Override
  public FailingRolloutState copy()
  {
    return new FailingRolloutState();
  }
}
