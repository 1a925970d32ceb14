package org.pmcts.games.gomoku;

/**
 * A Gomoku move: placing a stone on an empty cell.
 */
public final class GomokuMove implements Comparable<GomokuMove>
{
  private final int mRow;
  private final int mCol;

  public GomokuMove(int xiRow, int xiCol)
  {
    mRow = xiRow;
    mCol = xiCol;
  }

  public int getRow()
  {
    return mRow;
  }

  public int getCol()
  {
    return mCol;
  }

  @Override
  public int compareTo(GomokuMove xiOther)
  {
    if (mRow != xiOther.mRow)
    {
      return Integer.compare(mRow, xiOther.mRow);
    }
    return Integer.compare(mCol, xiOther.mCol);
  }

  @Override
  public boolean equals(Object xiOther)
  {
    if (this == xiOther)
    {
      return true;
    }
    if (!(xiOther instanceof GomokuMove))
    {
      return false;
    }
    GomokuMove lOther = (GomokuMove)xiOther;
    return (mRow == lOther.mRow) && (mCol == lOther.mCol);
  }

  @Override
  public int hashCode()
  {
    return 31 * mRow + mCol;
  }

  @Override
  public String toString()
  {
    return "[" + mRow + ", " + mCol + "]";
  }
}
