package org.pmcts.player.search;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Utility class for controlling threading behaviour of searches.
 *
 * Each parallel search runs its trees on a fresh, fixed-size set of search threads.  Every search thread carries
 * the ID of the search that spawned it in its logging context, so that log lines from concurrent searches can be
 * told apart.
 */
public class ThreadControl
{
  private static final Logger LOGGER = LogManager.getLogger();

  /**
   * The number of vCPUs available on the system.  (For a hyper-threaded system, each hyper-thread counts as a CPU.)
   */
  public static final int NUM_CPUS = Runtime.getRuntime().availableProcessors();

  /**
   * Logging context key holding the search ID.
   */
  public static final String SEARCH_ID_KEY = "searchID";

  private static final AtomicInteger NEXT_SEARCH_ID = new AtomicInteger(1);

  private ThreadControl()
  {
    // Private default constructor.
  }

  /**
   * @return the number of search threads to use.
   *
   * @param xiConfiguredValue - the configured number, or -1 to use one per vCPU.
   */
  public static int resolveThreadCount(int xiConfiguredValue)
  {
    if (xiConfiguredValue == -1)
    {
      return NUM_CPUS;
    }
    return xiConfiguredValue;
  }

  /**
   * @return the search ID for the calling thread's logging context, allocating a new one if the caller hasn't set
   * one.
   */
  public static String currentSearchID()
  {
    String lSearchID = ThreadContext.get(SEARCH_ID_KEY);
    if (lSearchID == null)
    {
      lSearchID = "search-" + NEXT_SEARCH_ID.getAndIncrement();
    }
    return lSearchID;
  }

  /**
   * @return a thread factory for the search threads of a single search.
   *
   * @param xiSearchID - the ID of the search.
   */
  public static ThreadFactory createSearchThreadFactory(final String xiSearchID)
  {
    return new ThreadFactoryBuilder().setNameFormat("Search Tree " + xiSearchID + "-%d")
                                     .setDaemon(true)
                                     .setUncaughtExceptionHandler(new UncaughtExceptionHandler()
                                     {
                                       @Override
                                       public void uncaughtException(Thread xiThread, Throwable xiEx)
                                       {
                                         LOGGER.error("Uncaught exception in " + xiThread.getName(), xiEx);
                                       }
                                     })
                                     .build();
  }

  /**
   * Register a search thread.  Must be matched by a call to {@link #deregisterSearchThread()}.
   *
   * @param xiSearchID - the ID of the search that the thread is working for.
   */
  public static void registerSearchThread(String xiSearchID)
  {
    ThreadContext.put(SEARCH_ID_KEY, xiSearchID);
  }

  /**
   * Deregister a search thread (which may be re-used for another search).
   */
  public static void deregisterSearchThread()
  {
    ThreadContext.remove(SEARCH_ID_KEY);
  }
}
