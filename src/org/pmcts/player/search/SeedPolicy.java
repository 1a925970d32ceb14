package org.pmcts.player.search;

/**
 * How the worker trees of a parallel search are seeded from the search's master seed.
 */
public enum SeedPolicy
{
  /**
   * Every tree uses the master seed.  Given equal budgets the trees grow identically.
   */
  SHARED
  {
    @Override
    public long seedFor(long xiMasterSeed, int xiWorkerIndex)
    {
      return xiMasterSeed;
    }
  },

  /**
   * Every tree uses a distinct seed derived from the master seed, so the trees are independent samples.
   */
  PER_WORKER
  {
    @Override
    public long seedFor(long xiMasterSeed, int xiWorkerIndex)
    {
      // SplitMix64 is a bijection, so distinct worker indices always give distinct seeds.
      long z = xiMasterSeed + (xiWorkerIndex + 1) * 0x9E3779B97F4A7C15L;
      z = (z ^ (z >>> 30)) * 0xBF58476D1CE4E5B9L;
      z = (z ^ (z >>> 27)) * 0x94D049BB133111EBL;
      return z ^ (z >>> 31);
    }
  };

  /**
   * @return the seed for the specified worker tree.
   *
   * @param xiMasterSeed - the seed chosen for the whole search.
   * @param xiWorkerIndex - the index of the worker tree.
   */
  public abstract long seedFor(long xiMasterSeed, int xiWorkerIndex);
}
