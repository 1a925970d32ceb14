package org.pmcts.player.search;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.pmcts.util.statemachine.GameState;

/**
 * Nim with a single pile.  Each move takes between 1 and a fixed maximum number of stones.  The player who takes
 * the last stone wins.
 */
public class NimState implements GameState<Integer, NimState>
{
  private final int mMaxTake;
  private int       mPile;
  private int       mPlayerToMove = PLAYER_ONE;

  public NimState(int xiPile, int xiMaxTake)
  {
    mPile = xiPile;
    mMaxTake = xiMaxTake;
  }

  public int getPile()
  {
    return mPile;
  }

  @Override
  public List<Integer> getMoves()
  {
    List<Integer> lMoves = new ArrayList<>();
    for (int lTake = 1; lTake <= Math.min(mMaxTake, mPile); lTake++)
    {
      lMoves.add(lTake);
    }
    return lMoves;
  }

  @Override
  public void doMove(Integer xiMove)
  {
    mPile -= xiMove;
    mPlayerToMove = GameState.opponentOf(mPlayerToMove);
  }

  @Override
  public void doRandomMove(Random xiRandom)
  {
    List<Integer> lMoves = getMoves();
    if (lMoves.isEmpty())
    {
      throw new IllegalStateException("Pile is empty");
    }
    doMove(lMoves.get(xiRandom.nextInt(lMoves.size())));
  }

  @Override
  public boolean hasMoves()
  {
    return mPile > 0;
  }

  @Override
  public double getResult(int xiPlayer)
  {
    if (mPile > 0)
    {
      return 0.5;
    }

    // The player who took the last stone is the one not to move.
    return (xiPlayer == GameState.opponentOf(mPlayerToMove)) ? 1.0 : 0.0;
  }

  @Override
  public int getPlayerToMove()
  {
    return mPlayerToMove;
  }

  @Override
  public NimState copy()
  {
    NimState lCopy = new NimState(mPile, mMaxTake);
    lCopy.mPlayerToMove = mPlayerToMove;
    return lCopy;
  }
}
