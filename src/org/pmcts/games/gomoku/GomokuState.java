package org.pmcts.games.gomoku;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.pmcts.util.statemachine.GameState;

/**
 * Gomoku (five in a row, freestyle) on a square board.  The first player to get an unbroken line of five or more
 * stones horizontally, vertically or diagonally wins.  A full board without a line is a draw.
 */
public class GomokuState implements GameState<GomokuMove, GomokuState>
{
  public static final int DEFAULT_BOARD_SIZE = 15;
  public static final int WIN_LENGTH = 5;

  private static final int EMPTY = 0;
  private static final char[] MARKERS = {'.', 'X', 'O'};

  private final int              mSize;
  private final int[][]          mCell;
  private final List<GomokuMove> mEmptyCells;
  private int                    mPlayerToMove;
  private int                    mWinner = EMPTY;

  /**
   * Create an empty board of the default size.
   */
  public GomokuState()
  {
    this(DEFAULT_BOARD_SIZE);
  }

  /**
   * Create an empty board.
   *
   * @param xiSize - the number of rows (and columns).
   */
  public GomokuState(int xiSize)
  {
    if (xiSize < 1)
    {
      throw new IllegalArgumentException("Invalid board size: " + xiSize);
    }

    mSize = xiSize;
    mCell = new int[mSize][mSize];
    mEmptyCells = new ArrayList<>(mSize * mSize);
    for (int lRow = 0; lRow < mSize; lRow++)
    {
      for (int lCol = 0; lCol < mSize; lCol++)
      {
        mEmptyCells.add(new GomokuMove(lRow, lCol));
      }
    }
    mPlayerToMove = PLAYER_ONE;
  }

  private GomokuState(GomokuState xiOther)
  {
    mSize = xiOther.mSize;
    mCell = new int[mSize][];
    for (int lRow = 0; lRow < mSize; lRow++)
    {
      mCell[lRow] = xiOther.mCell[lRow].clone();
    }
    mEmptyCells = new ArrayList<>(xiOther.mEmptyCells);
    mPlayerToMove = xiOther.mPlayerToMove;
    mWinner = xiOther.mWinner;
  }

  public int getSize()
  {
    return mSize;
  }

  /**
   * @return the player whose stone is on the cell, or 0 if the cell is empty.
   *
   * @param xiRow - the row.
   * @param xiCol - the column.
   */
  public int getCell(int xiRow, int xiCol)
  {
    return mCell[xiRow][xiCol];
  }

  /**
   * @return the player with five in a row, or 0 if there isn't one.
   */
  public int getWinner()
  {
    return mWinner;
  }

  @Override
  public List<GomokuMove> getMoves()
  {
    if (mWinner != EMPTY)
    {
      return Collections.emptyList();
    }
    return new ArrayList<>(mEmptyCells);
  }

  @Override
  public void doMove(GomokuMove xiMove)
  {
    assert(mWinner == EMPTY) : "Move " + xiMove + " played after the game was won";
    assert(mCell[xiMove.getRow()][xiMove.getCol()] == EMPTY) : "Cell " + xiMove + " is occupied";

    mCell[xiMove.getRow()][xiMove.getCol()] = mPlayerToMove;
    mEmptyCells.remove(xiMove);

    if (makesLine(xiMove.getRow(), xiMove.getCol()))
    {
      mWinner = mPlayerToMove;
    }

    mPlayerToMove = GameState.opponentOf(mPlayerToMove);
  }

  @Override
  public void doRandomMove(Random xiRandom)
  {
    if (!hasMoves())
    {
      throw new IllegalStateException("No legal moves in terminal state");
    }
    doMove(mEmptyCells.get(xiRandom.nextInt(mEmptyCells.size())));
  }

  @Override
  public boolean hasMoves()
  {
    return (mWinner == EMPTY) && !mEmptyCells.isEmpty();
  }

  @Override
  public double getResult(int xiPlayer)
  {
    if (mWinner == EMPTY)
    {
      return 0.5;
    }
    return (mWinner == xiPlayer) ? 1.0 : 0.0;
  }

  @Override
  public int getPlayerToMove()
  {
    return mPlayerToMove;
  }

  @Override
  public GomokuState copy()
  {
    return new GomokuState(this);
  }

  /**
   * @return whether the stone just placed on the specified cell completes a line.  Only lines through that cell
   * need to be checked.
   */
  private boolean makesLine(int xiRow, int xiCol)
  {
    return (lineLength(xiRow, xiCol, 0, 1) >= WIN_LENGTH) ||
           (lineLength(xiRow, xiCol, 1, 0) >= WIN_LENGTH) ||
           (lineLength(xiRow, xiCol, 1, 1) >= WIN_LENGTH) ||
           (lineLength(xiRow, xiCol, 1, -1) >= WIN_LENGTH);
  }

  private int lineLength(int xiRow, int xiCol, int xiRowStep, int xiColStep)
  {
    int lPlayer = mCell[xiRow][xiCol];
    return 1 + countInDirection(lPlayer, xiRow, xiCol, xiRowStep, xiColStep) +
               countInDirection(lPlayer, xiRow, xiCol, -xiRowStep, -xiColStep);
  }

  private int countInDirection(int xiPlayer, int xiRow, int xiCol, int xiRowStep, int xiColStep)
  {
    int lCount = 0;
    int lRow = xiRow + xiRowStep;
    int lCol = xiCol + xiColStep;
    while ((lRow >= 0) && (lRow < mSize) && (lCol >= 0) && (lCol < mSize) && (mCell[lRow][lCol] == xiPlayer))
    {
      lCount++;
      lRow += xiRowStep;
      lCol += xiColStep;
    }
    return lCount;
  }

  @Override
  public String toString()
  {
    StringBuilder lBuffer = new StringBuilder();
    for (int lRow = 0; lRow < mSize; lRow++)
    {
      for (int lCol = 0; lCol < mSize; lCol++)
      {
        if (lCol > 0)
        {
          lBuffer.append(' ');
        }
        lBuffer.append(MARKERS[mCell[lRow][lCol]]);
      }
      lBuffer.append('\n');
    }
    lBuffer.append(MARKERS[mPlayerToMove]).append(" to move");
    return lBuffer.toString();
  }
}
