package org.pmcts.player.search;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.apache.logging.log4j.Logger;

/**
 * Statistics for the first-ply moves of one or more search trees, summed across the trees.
 *
 * Moves are held in the order in which they are first encountered (tree by tree, and in expansion order within a
 * tree), which is also the tie-break order when choosing the best move.
 *
 * @param <M> - the move type.
 */
public class RootMoveStatistics<M>
{
  /**
   * Summed statistics for a single move.
   *
   * @param <M> - the move type.
   */
  public static class MoveStatistics<M>
  {
    private final M mMove;
    private long    mVisits = 0;
    private double  mWins = 0;

    MoveStatistics(M xiMove)
    {
      mMove = xiMove;
    }

    public M getMove()
    {
      return mMove;
    }

    public long getVisits()
    {
      return mVisits;
    }

    public double getWins()
    {
      return mWins;
    }

    /**
     * @return the expected success rate of the move, assuming a uniform (Beta(1, 1)) prior.
     */
    public double getExpectedSuccessRate()
    {
      return (mWins + 1) / (mVisits + 2);
    }

    @Override
    public String toString()
    {
      return mMove + " (W/V: " + mWins + "/" + mVisits + ")";
    }
  }

  private final Map<M, MoveStatistics<M>> mStatistics = new LinkedHashMap<>();
  private long                            mGamesPlayed = 0;

  /**
   * @return the statistics of the root children of all the specified trees.
   *
   * @param xiRoots - the roots of the trees.
   */
  public static <M> RootMoveStatistics<M> merge(List<SearchTreeNode<M>> xiRoots)
  {
    RootMoveStatistics<M> lStatistics = new RootMoveStatistics<>();
    for (SearchTreeNode<M> lRoot : xiRoots)
    {
      lStatistics.addTree(lRoot);
    }
    return lStatistics;
  }

  /**
   * Add the root children of a tree.  Moves which the tree never expanded contribute nothing.
   *
   * @param xiRoot - the root of the tree.
   */
  public void addTree(SearchTreeNode<M> xiRoot)
  {
    mGamesPlayed += xiRoot.getVisits();
    for (SearchTreeNode<M> lChild : xiRoot.getChildren())
    {
      accumulate(lChild.getMove(), lChild.getVisits(), lChild.getWins());
    }
  }

  /**
   * Add statistics for a single move.
   *
   * @param xiMove - the move.
   * @param xiVisits - the number of visits to add.
   * @param xiWins - the reward to add.
   */
  public void accumulate(M xiMove, long xiVisits, double xiWins)
  {
    MoveStatistics<M> lMoveStats = mStatistics.get(xiMove);
    if (lMoveStats == null)
    {
      lMoveStats = new MoveStatistics<>(xiMove);
      mStatistics.put(xiMove, lMoveStats);
    }
    lMoveStats.mVisits += xiVisits;
    lMoveStats.mWins += xiWins;
  }

  /**
   * @return the statistics for the specified move, or null if no tree expanded it.
   *
   * @param xiMove - the move.
   */
  public MoveStatistics<M> get(M xiMove)
  {
    return mStatistics.get(xiMove);
  }

  /**
   * @return the statistics for all moves, in tie-break order.
   */
  public Collection<MoveStatistics<M>> getAll()
  {
    return Collections.unmodifiableCollection(mStatistics.values());
  }

  /**
   * @return the number of games played, summed over all trees.
   */
  public long getGamesPlayed()
  {
    return mGamesPlayed;
  }

  /**
   * @return the move with the highest expected success rate, or null if there are no moves.
   */
  public MoveStatistics<M> getBestMove()
  {
    double lBestScore = Double.NEGATIVE_INFINITY;
    MoveStatistics<M> lBest = null;
    for (MoveStatistics<M> lMoveStats : mStatistics.values())
    {
      double lScore = lMoveStats.getExpectedSuccessRate();
      if (lScore > lBestScore)
      {
        lBestScore = lScore;
        lBest = lMoveStats;
      }
    }
    return lBest;
  }

  /**
   * Log the visit share and win rate of every move, and the chosen move.
   *
   * @param xiLogger - the logger to write to.
   * @param xiBest - the chosen move.
   */
  public void dump(Logger xiLogger, MoveStatistics<M> xiBest)
  {
    for (MoveStatistics<M> lMoveStats : mStatistics.values())
    {
      xiLogger.info(String.format("Move: %s (%2d%% visits) (%2d%% wins)",
                                  lMoveStats.getMove(),
                                  Math.round(100.0 * lMoveStats.getVisits() / mGamesPlayed),
                                  Math.round(100.0 * lMoveStats.getWins() / lMoveStats.getVisits())));
    }

    xiLogger.info("----");
    xiLogger.info(String.format("Best: %s (%.2f%% visits) (%.2f%% wins)",
                                xiBest.getMove(),
                                100.0 * xiBest.getVisits() / mGamesPlayed,
                                100.0 * xiBest.getWins() / xiBest.getVisits()));
  }
}
