package org.pmcts.player.search.exception;

/**
 * Thrown when one of the search trees of a parallel search fails, or the search is interrupted.  No move is
 * chosen from the remaining trees.
 */
public class SearchFailedException extends Exception
{
  private static final long serialVersionUID = 1L;

  public SearchFailedException(String xiMessage, Throwable xiCause)
  {
    super(xiMessage, xiCause);
  }
}
