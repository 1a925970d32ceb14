package org.pmcts.player.search;

import java.util.concurrent.TimeUnit;

import com.google.common.base.Ticker;

/**
 * A clock that advances by a fixed step every time it is read.
 */
public class SteppingTicker extends Ticker
{
  private final long mStepNanos;
  private long       mNow = 0;
  private int        mReads = 0;

  public SteppingTicker(long xiStep, TimeUnit xiUnit)
  {
    mStepNanos = xiUnit.toNanos(xiStep);
  }

  @Override
  public synchronized long read()
  {
    long lNow = mNow;
    mNow += mStepNanos;
    mReads++;
    return lNow;
  }

  public synchronized int getReads()
  {
    return mReads;
  }
}
