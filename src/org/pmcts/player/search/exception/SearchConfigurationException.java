package org.pmcts.player.search.exception;

/**
 * Thrown when a search is requested with a configuration that can't be honoured.  Always thrown before any search
 * work has started.
 */
public class SearchConfigurationException extends RuntimeException
{
  private static final long serialVersionUID = 1L;

  public SearchConfigurationException(String xiMessage)
  {
    super(xiMessage);
  }
}
