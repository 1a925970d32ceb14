package org.pmcts.player.search;

import java.util.concurrent.TimeUnit;

import org.pmcts.player.search.MachineSpecificConfiguration.CfgItem;
import org.pmcts.player.search.exception.SearchConfigurationException;

/**
 * Options for a parallel search, plus statistics about the chosen move that are filled in when the search
 * completes.
 */
public class SearchConfiguration
{
  /**
   * Value of {@link #getMaxIterations()} and {@link #getMaxTime()} meaning "no limit".
   */
  public static final int UNLIMITED = -1;

  private int        mNumberOfThreads = 8;
  private int        mMaxIterations   = 10000;
  private double     mMaxTime         = UNLIMITED;
  private boolean    mVerbose         = false;
  private SeedPolicy mSeedPolicy      = SeedPolicy.SHARED;
  private Long       mSeed            = null;

  // Reporting only.
  private double     mBestWins        = 0;
  private long       mBestVisits      = 0;
  private long       mGamesPlayed     = 0;

  /**
   * Create a configuration with the built-in defaults.
   */
  public SearchConfiguration()
  {
    // Defaults set above.
  }

  /**
   * @return a configuration initialised from the machine-specific configuration.
   */
  public static SearchConfiguration fromMachineConfiguration()
  {
    SearchConfiguration lConfig = new SearchConfiguration();
    lConfig.mNumberOfThreads = ThreadControl.resolveThreadCount(
                                     MachineSpecificConfiguration.getCfgInt(CfgItem.NUMBER_OF_THREADS));
    lConfig.mMaxIterations = MachineSpecificConfiguration.getCfgInt(CfgItem.MAX_ITERATIONS);
    lConfig.mMaxTime = MachineSpecificConfiguration.getCfgDouble(CfgItem.MAX_TIME);
    lConfig.mVerbose = MachineSpecificConfiguration.getCfgBool(CfgItem.VERBOSE);
    lConfig.mSeedPolicy = SeedPolicy.valueOf(MachineSpecificConfiguration.getCfgStr(CfgItem.SEED_POLICY));

    String lSeed = MachineSpecificConfiguration.getCfgStr(CfgItem.SEED);
    if (lSeed != null)
    {
      lConfig.mSeed = Long.valueOf(lSeed);
    }
    return lConfig;
  }

  /**
   * @return a copy of this configuration for use by a single worker tree.  Workers never log progress.
   */
  public SearchConfiguration createWorkerCopy()
  {
    SearchConfiguration lCopy = new SearchConfiguration();
    lCopy.mNumberOfThreads = mNumberOfThreads;
    lCopy.mMaxIterations = mMaxIterations;
    lCopy.mMaxTime = mMaxTime;
    lCopy.mVerbose = false;
    lCopy.mSeedPolicy = mSeedPolicy;
    lCopy.mSeed = mSeed;
    return lCopy;
  }

  /**
   * Check that a search can be run with this configuration.
   *
   * @param xiTimingAvailable - whether a clock is available for time-limited searches.
   *
   * @throws SearchConfigurationException if the configuration is unusable.
   */
  public void validate(boolean xiTimingAvailable)
  {
    if (mNumberOfThreads < 1)
    {
      throw new SearchConfigurationException("Number of threads must be at least 1, not " + mNumberOfThreads);
    }

    if (mMaxIterations == 0)
    {
      throw new SearchConfigurationException("Maximum iterations must be positive or " + UNLIMITED);
    }

    if (hasTimeLimit() && !xiTimingAvailable)
    {
      throw new SearchConfigurationException("A time limit of " + mMaxTime + "s requires timing support");
    }
  }

  public int getNumberOfThreads()
  {
    return mNumberOfThreads;
  }

  public void setNumberOfThreads(int xiNumberOfThreads)
  {
    mNumberOfThreads = xiNumberOfThreads;
  }

  /**
   * @return the maximum number of playouts per tree, or {@link #UNLIMITED}.
   */
  public int getMaxIterations()
  {
    return mMaxIterations;
  }

  public void setMaxIterations(int xiMaxIterations)
  {
    mMaxIterations = xiMaxIterations;
  }

  /**
   * @return the maximum time per tree in seconds, or a negative value for no limit.
   */
  public double getMaxTime()
  {
    return mMaxTime;
  }

  public void setMaxTime(double xiMaxTime)
  {
    mMaxTime = xiMaxTime;
  }

  public boolean hasTimeLimit()
  {
    return mMaxTime >= 0;
  }

  /**
   * @return the time limit in nanoseconds.  Only valid if {@link #hasTimeLimit()}.
   */
  public long getMaxTimeNanos()
  {
    return (long)(mMaxTime * TimeUnit.SECONDS.toNanos(1));
  }

  public boolean isVerbose()
  {
    return mVerbose;
  }

  public void setVerbose(boolean xiVerbose)
  {
    mVerbose = xiVerbose;
  }

  public SeedPolicy getSeedPolicy()
  {
    return mSeedPolicy;
  }

  public void setSeedPolicy(SeedPolicy xiSeedPolicy)
  {
    mSeedPolicy = xiSeedPolicy;
  }

  /**
   * @return the fixed master seed, or null if every search picks a fresh seed.
   */
  public Long getSeed()
  {
    return mSeed;
  }

  public void setSeed(Long xiSeed)
  {
    mSeed = xiSeed;
  }

  /**
   * @return the total reward of the most recently chosen move, summed over all trees.
   */
  public double getBestWins()
  {
    return mBestWins;
  }

  /**
   * @return the total visits of the most recently chosen move, summed over all trees.
   */
  public long getBestVisits()
  {
    return mBestVisits;
  }

  /**
   * @return the number of games played by the most recent search, summed over all trees.  0 if the search wasn't
   * needed because there was only one legal move.
   */
  public long getGamesPlayed()
  {
    return mGamesPlayed;
  }

  void setSearchStatistics(double xiBestWins, long xiBestVisits, long xiGamesPlayed)
  {
    mBestWins = xiBestWins;
    mBestVisits = xiBestVisits;
    mGamesPlayed = xiGamesPlayed;
  }

  @Override
  public String toString()
  {
    return "SearchConfiguration [threads=" + mNumberOfThreads +
           ", maxIterations=" + mMaxIterations +
           ", maxTime=" + mMaxTime +
           ", verbose=" + mVerbose +
           ", seedPolicy=" + mSeedPolicy +
           ", seed=" + mSeed + "]";
  }
}
