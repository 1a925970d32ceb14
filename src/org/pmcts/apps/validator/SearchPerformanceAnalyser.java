package org.pmcts.apps.validator;

import java.util.concurrent.TimeUnit;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;
import org.pmcts.games.gomoku.GomokuMove;
import org.pmcts.games.gomoku.GomokuState;
import org.pmcts.player.search.MachineSpecificConfiguration;
import org.pmcts.player.search.MachineSpecificConfiguration.CfgItem;
import org.pmcts.player.search.ParallelSearcher;
import org.pmcts.player.search.SearchConfiguration;
import org.pmcts.player.search.ThreadControl;
import org.pmcts.player.search.exception.SearchFailedException;

import com.google.common.base.Stopwatch;

/**
 * Simple app for measuring search performance.  Plays the opening moves of a Gomoku game, with the search choosing
 * the moves for both sides, and reports the search throughput.
 *
 * Usage: SearchPerformanceAnalyser [threads] [iterations] [boardSize] [moves]
 */
public class SearchPerformanceAnalyser
{
  private static final Logger LOGGER = LogManager.getLogger();

  private static final int DEFAULT_MOVES = 4;

  /**
   * @param xiArgs - optional thread count, iterations per tree, board size and number of moves to play.
   */
  public static void main(String[] xiArgs)
  {
    ThreadContext.put(ThreadControl.SEARCH_ID_KEY, "benchmark");
    MachineSpecificConfiguration.logConfig();

    SearchConfiguration lConfig = SearchConfiguration.fromMachineConfiguration();
    int lBoardSize = MachineSpecificConfiguration.getCfgInt(CfgItem.BOARD_SIZE);
    int lNumMoves = DEFAULT_MOVES;

    try
    {
      if (xiArgs.length > 0)
      {
        lConfig.setNumberOfThreads(ThreadControl.resolveThreadCount(Integer.parseInt(xiArgs[0])));
      }
      if (xiArgs.length > 1)
      {
        lConfig.setMaxIterations(Integer.parseInt(xiArgs[1]));
      }
      if (xiArgs.length > 2)
      {
        lBoardSize = Integer.parseInt(xiArgs[2]);
      }
      if (xiArgs.length > 3)
      {
        lNumMoves = Integer.parseInt(xiArgs[3]);
      }
    }
    catch (NumberFormatException lEx)
    {
      LOGGER.error("Usage: SearchPerformanceAnalyser [threads] [iterations] [boardSize] [moves]", lEx);
      System.exit(2);
    }

    LOGGER.info("Benchmarking with " + lConfig + " on a " + lBoardSize + "x" + lBoardSize + " board");

    try
    {
      runBenchmark(lConfig, new GomokuState(lBoardSize), lNumMoves);
    }
    catch (SearchFailedException lEx)
    {
      LOGGER.error("Benchmark failed", lEx);
      System.exit(1);
    }
  }

  /**
   * Play moves chosen by the search, logging the throughput of each search.
   *
   * @param xiConfig - the search configuration.
   * @param xiState - the starting position, which is updated as moves are played.
   * @param xiNumMoves - the maximum number of moves to play.
   *
   * @return the total number of games played by all searches.
   *
   * @throws SearchFailedException if a search fails.
   */
  static long runBenchmark(SearchConfiguration xiConfig, GomokuState xiState, int xiNumMoves)
    throws SearchFailedException
  {
    ParallelSearcher lSearcher = new ParallelSearcher();
    Stopwatch lTotalTime = Stopwatch.createStarted();
    long lTotalGames = 0;

    for (int lii = 0; (lii < xiNumMoves) && xiState.hasMoves(); lii++)
    {
      Stopwatch lMoveTime = Stopwatch.createStarted();
      GomokuMove lMove = lSearcher.computeMove(xiState, xiConfig);
      long lMillis = lMoveTime.elapsed(TimeUnit.MILLISECONDS);

      long lGames = xiConfig.getGamesPlayed();
      lTotalGames += lGames;

      LOGGER.info("Move " + (lii + 1) + ": " + lMove +
                  " (W/V: " + xiConfig.getBestWins() + "/" + xiConfig.getBestVisits() + ") in " + lMillis + "ms" +
                  ((lMillis > 0) ? " - " + (lGames * 1000 / lMillis) + " games / second" : ""));
      xiState.doMove(lMove);
    }

    LOGGER.info("Final position:\n" + xiState);
    LOGGER.info("Played " + lTotalGames + " games in " + lTotalTime);
    return lTotalGames;
  }
}
