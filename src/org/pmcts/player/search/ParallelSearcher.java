package org.pmcts.player.search;

import java.security.SecureRandom;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.pmcts.player.search.RootMoveStatistics.MoveStatistics;
import org.pmcts.player.search.exception.SearchConfigurationException;
import org.pmcts.player.search.exception.SearchFailedException;
import org.pmcts.util.statemachine.GameState;

import com.google.common.base.Ticker;
import com.google.common.util.concurrent.Futures;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.ListeningExecutorService;
import com.google.common.util.concurrent.MoreExecutors;

/**
 * Chooses a move by growing several independent search trees in parallel and merging the statistics of their
 * first-ply moves.
 *
 * Every tree is grown on its own thread from its own copy of the root state.  Nothing is shared between the trees
 * (apart from the seed), so the trees need no locking.  The trees are merged once all of them are complete.
 */
public class ParallelSearcher
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final SecureRandom SEED_SOURCE = new SecureRandom();

  private final Ticker mTicker;

  /**
   * Create a searcher that uses the system clock.
   */
  public ParallelSearcher()
  {
    this(Ticker.systemTicker());
  }

  /**
   * Create a searcher.
   *
   * @param xiTicker - the clock for time limits and throughput reporting, or null if there's no clock available (in
   *                   which case time-limited searches are rejected).
   */
  public ParallelSearcher(Ticker xiTicker)
  {
    mTicker = xiTicker;
  }

  /**
   * Choose a move.
   *
   * @param xiRootState - the current state, which must have at least one legal move.  Not modified.
   * @param xiConfiguration - the search options.  On return, the statistics of the chosen move have been filled in.
   *
   * @return the chosen move.
   *
   * @throws SearchConfigurationException if the configuration is unusable.
   * @throws SearchFailedException if any of the search trees failed, or the search was interrupted.
   */
  public <M, S extends GameState<M, S>> M computeMove(S xiRootState,
                                                      SearchConfiguration xiConfiguration)
    throws SearchFailedException
  {
    xiConfiguration.validate(mTicker != null);

    List<M> lMoves = xiRootState.getMoves();
    if (lMoves.isEmpty())
    {
      throw new IllegalStateException("Can't search from a state with no legal moves");
    }

    if (lMoves.size() == 1)
    {
      LOGGER.debug("Only one legal move: " + lMoves.get(0));
      xiConfiguration.setSearchStatistics(0, 0, 0);
      return lMoves.get(0);
    }

    if (!xiConfiguration.hasTimeLimit() && (xiConfiguration.getMaxIterations() < 0))
    {
      LOGGER.warn("Search has no iteration or time limit - it will only stop if interrupted");
    }

    long lStartTime = (mTicker == null) ? 0 : mTicker.read();
    long lMasterSeed = (xiConfiguration.getSeed() != null) ? xiConfiguration.getSeed() : SEED_SOURCE.nextLong();

    List<SearchTreeNode<M>> lRoots = growTrees(xiRootState, xiConfiguration, lMasterSeed);

    RootMoveStatistics<M> lStatistics = RootMoveStatistics.merge(lRoots);
    MoveStatistics<M> lBest = lStatistics.getBestMove();
    if (lBest == null)
    {
      throw new IllegalStateException("No moves were expanded by any search tree");
    }
    xiConfiguration.setSearchStatistics(lBest.getWins(), lBest.getVisits(), lStatistics.getGamesPlayed());

    if (xiConfiguration.isVerbose())
    {
      lStatistics.dump(LOGGER, lBest);

      if (mTicker != null)
      {
        long lElapsedNanos = mTicker.read() - lStartTime;
        LOGGER.info(String.format("%d games played in %.3f s. (%.0f / second, %d parallel jobs).",
                                  lStatistics.getGamesPlayed(),
                                  lElapsedNanos / 1e9,
                                  SearchTree.perSecond(lStatistics.getGamesPlayed(), lElapsedNanos),
                                  xiConfiguration.getNumberOfThreads()));
      }
    }

    return lBest.getMove();
  }

  /**
   * Grow one tree per configured thread, in parallel, and wait for them all to complete.
   *
   * @param xiRootState - the root state.  Each tree gets its own copy.
   * @param xiConfiguration - the search options.
   * @param xiMasterSeed - the seed from which the trees' seeds are derived.
   *
   * @return the roots of the trees, in worker order.
   *
   * @throws SearchFailedException if any tree failed, or the calling thread was interrupted.
   */
  <M, S extends GameState<M, S>> List<SearchTreeNode<M>> growTrees(S xiRootState,
                                                                   SearchConfiguration xiConfiguration,
                                                                   long xiMasterSeed)
    throws SearchFailedException
  {
    final int lNumTrees = xiConfiguration.getNumberOfThreads();
    final SearchConfiguration lWorkerConfiguration = xiConfiguration.createWorkerCopy();
    final SeedPolicy lSeedPolicy = xiConfiguration.getSeedPolicy();
    final String lSearchID = ThreadControl.currentSearchID();

    LOGGER.debug("Growing " + lNumTrees + " trees with master seed " + xiMasterSeed + " (" + lSeedPolicy + ")");

    // All trees exist before any thread starts.
    List<SearchTree<M, S>> lTrees = new ArrayList<>(lNumTrees);
    for (int lii = 0; lii < lNumTrees; lii++)
    {
      lTrees.add(new SearchTree<>(xiRootState.copy(),
                                  lWorkerConfiguration,
                                  lSeedPolicy.seedFor(xiMasterSeed, lii),
                                  mTicker));
    }

    ListeningExecutorService lPool = MoreExecutors.listeningDecorator(
                       Executors.newFixedThreadPool(lNumTrees, ThreadControl.createSearchThreadFactory(lSearchID)));
    try
    {
      List<ListenableFuture<SearchTreeNode<M>>> lFutures = new ArrayList<>(lNumTrees);
      for (final SearchTree<M, S> lTree : lTrees)
      {
        lFutures.add(lPool.submit(new Callable<SearchTreeNode<M>>()
        {
          @Override
          public SearchTreeNode<M> call() throws InterruptedException
          {
            ThreadControl.registerSearchThread(lSearchID);
            try
            {
              return lTree.grow();
            }
            finally
            {
              LOGGER.debug("Tree complete after " + lTree.getIterations() + " playouts");
              ThreadControl.deregisterSearchThread();
            }
          }
        }));
      }

      // Completes when every tree is grown, or as soon as any tree fails.
      try
      {
        return Futures.allAsList(lFutures).get();
      }
      catch (ExecutionException lEx)
      {
        LOGGER.error("Search tree failed", lEx.getCause());
        throw new SearchFailedException("Search tree failed", lEx.getCause());
      }
    }
    catch (InterruptedException lEx)
    {
      LOGGER.warn("Interrupted whilst waiting for search trees");
      Thread.currentThread().interrupt();
      throw new SearchFailedException("Interrupted whilst waiting for search trees", lEx);
    }
    finally
    {
      // Stops any trees still running after a failure.
      lPool.shutdownNow();
    }
  }
}
