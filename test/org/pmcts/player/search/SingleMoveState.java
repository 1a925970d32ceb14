package org.pmcts.player.search;

import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.pmcts.util.statemachine.GameState;

/**
 * A state with exactly one legal move, which fails if anything tries to search it.
 */
public class SingleMoveState implements GameState<String, SingleMoveState>
{
  public static final String ONLY_MOVE = "pass";

  @Override
  public List<String> getMoves()
  {
    return Collections.singletonList(ONLY_MOVE);
  }

  @Override
  public void doMove(String xiMove)
  {
    throw new AssertionError("doMove called");
  }

  @Override
  public void doRandomMove(Random xiRandom)
  {
    throw new AssertionError("doRandomMove called");
  }

  @Override
  public boolean hasMoves()
  {
    return true;
  }

  @Override
  public double getResult(int xiPlayer)
  {
    throw new AssertionError("getResult called");
  }

  @Override
  public int getPlayerToMove()
  {
    return PLAYER_ONE;
  }

  @Override
  public SingleMoveState copy()
  {
    throw new AssertionError("copy called");
  }
}
