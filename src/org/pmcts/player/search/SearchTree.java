package org.pmcts.player.search;

import java.util.Random;
import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pmcts.player.search.exception.SearchConfigurationException;
import org.pmcts.util.statemachine.GameState;

import com.google.common.base.Ticker;

/**
 * A single Monte Carlo search tree, grown sequentially by one thread.
 *
 * @param <M> - the move type.
 * @param <S> - the state type.
 */
public class SearchTree<M, S extends GameState<M, S>>
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final long PROGRESS_INTERVAL_NANOS = TimeUnit.SECONDS.toNanos(1);

  private final S                   mRootState;
  private final SearchConfiguration mConfiguration;
  private final Random              mRandom;
  private final Ticker              mTicker;
  private final SearchTreeNode<M>   mRoot;

  private long                      mIterations = 0;
  private long                      mElapsedNanos = 0;

  /**
   * Create a search tree.
   *
   * @param xiRootState - the state at the root of the tree.  The tree takes ownership of the state and never
   *                      modifies it.
   * @param xiConfiguration - the search limits.
   * @param xiSeed - the seed for the tree's source of randomness.
   * @param xiTicker - the clock for time limits and progress reporting, or null if no clock is available.
   *
   * @throws SearchConfigurationException if a time limit is configured without a clock.
   */
  public SearchTree(S xiRootState, SearchConfiguration xiConfiguration, long xiSeed, Ticker xiTicker)
  {
    if (xiConfiguration.hasTimeLimit() && (xiTicker == null))
    {
      throw new SearchConfigurationException("A time limit of " + xiConfiguration.getMaxTime() +
                                             "s requires timing support");
    }

    mRootState = xiRootState;
    mConfiguration = xiConfiguration;
    mRandom = new Random(xiSeed);
    mTicker = xiTicker;
    mRoot = new SearchTreeNode<>(xiRootState);
  }

  /**
   * @return the root of the tree.
   */
  public SearchTreeNode<M> getRoot()
  {
    return mRoot;
  }

  /**
   * @return the number of playouts performed by {@link #grow()}.
   */
  public long getIterations()
  {
    return mIterations;
  }

  /**
   * @return the time spent in {@link #grow()}, or 0 if no clock is available.
   */
  public long getElapsedNanos()
  {
    return mElapsedNanos;
  }

  /**
   * Perform playouts until the iteration or time limit is reached.  Limits are only checked between playouts.
   *
   * With no limits at all, this continues until the thread is interrupted.
   *
   * @return the root of the tree.
   *
   * @throws InterruptedException if the thread is interrupted.
   */
  public SearchTreeNode<M> grow() throws InterruptedException
  {
    final int lMaxIterations = mConfiguration.getMaxIterations();
    final boolean lTimeLimited = mConfiguration.hasTimeLimit();
    final boolean lVerbose = mConfiguration.isVerbose();
    final boolean lUseClock = (mTicker != null) && (lTimeLimited || lVerbose);
    final long lMaxTimeNanos = lTimeLimited ? mConfiguration.getMaxTimeNanos() : 0;

    long lStartTime = (mTicker == null) ? 0 : mTicker.read();
    long lLastReportTime = lStartTime;

    for (long lIteration = 1; (lMaxIterations < 0) || (lIteration <= lMaxIterations); lIteration++)
    {
      playout();
      mIterations = lIteration;

      if (Thread.interrupted())
      {
        throw new InterruptedException("Interrupted after " + lIteration + " playouts");
      }

      if (lUseClock)
      {
        long lNow = mTicker.read();
        mElapsedNanos = lNow - lStartTime;

        if (lVerbose && ((lNow - lLastReportTime >= PROGRESS_INTERVAL_NANOS) || (lIteration == lMaxIterations)))
        {
          LOGGER.info(lIteration + " games played (" + perSecond(lIteration, mElapsedNanos) + " / second).");
          lLastReportTime = lNow;
        }

        if (lTimeLimited && (mElapsedNanos >= lMaxTimeNanos))
        {
          break;
        }
      }
    }

    if ((mTicker != null) && !lUseClock)
    {
      mElapsedNanos = mTicker.read() - lStartTime;
    }

    if (LOGGER.isTraceEnabled())
    {
      LOGGER.trace("Grown tree:\n" + mRoot.treeToString(1));
    }

    return mRoot;
  }

  /**
   * Perform a single MCTS iteration: select, expand, roll out and back-propagate.
   */
  void playout()
  {
    SearchTreeNode<M> lNode = mRoot;
    S lState = mRootState.copy();

    // SELECT
    while (!lNode.hasUntriedMoves() && lNode.hasChildren())
    {
      lNode = lNode.selectChildUCT();
      lState.doMove(lNode.getMove());
    }

    // EXPAND
    if (lNode.hasUntriedMoves())
    {
      M lMove = lNode.getUntriedMove(mRandom);
      lState.doMove(lMove);
      lNode = lNode.addChild(lMove, lState);
    }

    // ROLLOUT
    while (lState.hasMoves())
    {
      lState.doRandomMove(mRandom);
    }

    // UPDATE.  Each node scores the result for the player who moved into it, which alternates up the path.
    while (lNode != null)
    {
      lNode.update(lState.getResult(GameState.opponentOf(lNode.getPlayerToMove())));
      lNode = lNode.getParent();
    }
  }

  /**
   * @return the rate of an event, per second.
   *
   * @param xiCount - the number of events.
   * @param xiNanos - the period over which they occurred.
   */
  static double perSecond(long xiCount, long xiNanos)
  {
    if (xiNanos <= 0)
    {
      return 0;
    }
    return (double)xiCount * TimeUnit.SECONDS.toNanos(1) / xiNanos;
  }
}
