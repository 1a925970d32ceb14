package org.pmcts.player.search;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import org.junit.Assert;
import org.junit.Test;
import org.pmcts.games.gomoku.GomokuMove;
import org.pmcts.games.gomoku.GomokuState;
import org.pmcts.player.search.exception.SearchConfigurationException;

public class SearchTreeTests extends Assert
{
  private static final double EPSILON = 1e-9;

  private static SearchConfiguration iterations(int xiMaxIterations)
  {
    SearchConfiguration lConfig = new SearchConfiguration();
    lConfig.setMaxIterations(xiMaxIterations);
    return lConfig;
  }

  @Test
  public void testBackPropagationAlongForcedLine()
  {
    // Three forced moves: P1 takes, P2 takes, P1 takes the last stone and wins.
    SearchTree<Integer, NimState> lTree = new SearchTree<>(new NimState(3, 1), iterations(3), 1, null);
    lTree.playout();
    lTree.playout();
    lTree.playout();

    SearchTreeNode<Integer> lRoot = lTree.getRoot();
    SearchTreeNode<Integer> lA = lRoot.getChildren().get(0);
    SearchTreeNode<Integer> lB = lA.getChildren().get(0);
    SearchTreeNode<Integer> lC = lB.getChildren().get(0);

    // The root is scored for P2, the player who "moved into" it.
    assertEquals(3, lRoot.getVisits());
    assertEquals(0, lRoot.getWins(), EPSILON);

    // A and C were entered by P1, the winner.  B was entered by P2.
    assertEquals(3, lA.getVisits());
    assertEquals(3, lA.getWins(), EPSILON);
    assertEquals(2, lB.getVisits());
    assertEquals(0, lB.getWins(), EPSILON);
    assertEquals(1, lC.getVisits());
    assertEquals(1, lC.getWins(), EPSILON);
    assertFalse(lC.hasUntriedMoves());
    assertFalse(lC.hasChildren());

    // Once the whole line is expanded, a playout just re-scores the terminal node.
    lTree.playout();
    assertEquals(4, lRoot.getVisits());
    assertEquals(2, lC.getVisits());
    assertEquals(2, lC.getWins(), EPSILON);
    assertFalse(lC.hasChildren());
  }

  @Test
  public void testIterationLimit() throws Exception
  {
    SearchTree<Integer, NimState> lTree = new SearchTree<>(new NimState(21, 3), iterations(250), 99, null);
    SearchTreeNode<Integer> lRoot = lTree.grow();

    assertSame(lTree.getRoot(), lRoot);
    assertEquals(250, lTree.getIterations());
    assertEquals(250, lRoot.getVisits());
    assertEquals(0, lTree.getElapsedNanos());
  }

  @Test
  public void testNodeInvariantsAfterGrowth() throws Exception
  {
    GomokuState lState = new GomokuState(5);
    SearchTree<GomokuMove, GomokuState> lTree = new SearchTree<>(lState, iterations(500), 12345, null);
    SearchTreeNode<GomokuMove> lRoot = lTree.grow();

    assertEquals(500, lRoot.getVisits());
    checkNode(lRoot, lState);

    // The tree never modifies the root state.
    assertEquals(25, lState.getMoves().size());
    assertEquals(GomokuState.PLAYER_ONE, lState.getPlayerToMove());
  }

  private static void checkNode(SearchTreeNode<GomokuMove> xiNode, GomokuState xiState)
  {
    assertTrue(xiNode.getVisits() >= 1);
    assertTrue(xiNode.getWins() >= 0);
    assertTrue(xiNode.getWins() <= xiNode.getVisits());
    assertEquals(xiState.getPlayerToMove(), xiNode.getPlayerToMove());

    // The untried and expanded moves partition the legal moves.
    List<GomokuMove> lSeen = new ArrayList<>(xiNode.getUntriedMoves());
    int lChildVisits = 0;
    for (SearchTreeNode<GomokuMove> lChild : xiNode.getChildren())
    {
      assertSame(xiNode, lChild.getParent());
      lSeen.add(lChild.getMove());
      lChildVisits += lChild.getVisits();

      GomokuState lChildState = xiState.copy();
      lChildState.doMove(lChild.getMove());
      checkNode(lChild, lChildState);
    }
    Set<GomokuMove> lSeenSet = new HashSet<>(lSeen);
    assertEquals(lSeen.size(), lSeenSet.size());
    assertEquals(new HashSet<>(xiState.getMoves()), lSeenSet);

    // Every visit after the one that created a node is passed on to a child.
    if (xiNode.hasChildren())
    {
      assertTrue(lChildVisits >= xiNode.getVisits() - 1);
      assertTrue(lChildVisits <= xiNode.getVisits());
    }
  }

  @Test
  public void testSameSeedGrowsSameTree() throws Exception
  {
    SearchTreeNode<Integer> lFirst = new SearchTree<>(new NimState(30, 3), iterations(400), 7, null).grow();
    SearchTreeNode<Integer> lSecond = new SearchTree<>(new NimState(30, 3), iterations(400), 7, null).grow();

    assertEquals(lFirst.treeToString(3), lSecond.treeToString(3));
  }

  @Test
  public void testTimeLimit() throws Exception
  {
    SearchConfiguration lConfig = new SearchConfiguration();
    lConfig.setMaxIterations(SearchConfiguration.UNLIMITED);
    lConfig.setMaxTime(1.0);

    // The clock advances 100ms per read, so the limit is reached after 10 playouts.
    SteppingTicker lTicker = new SteppingTicker(100, TimeUnit.MILLISECONDS);
    SearchTree<Integer, NimState> lTree = new SearchTree<>(new NimState(21, 3), lConfig, 5, lTicker);
    lTree.grow();

    assertEquals(10, lTree.getIterations());
    assertEquals(10, lTree.getRoot().getVisits());
    assertEquals(TimeUnit.SECONDS.toNanos(1), lTree.getElapsedNanos());

    // One read at the start and one after each playout.
    assertEquals(11, lTicker.getReads());
  }

  @Test
  public void testVerboseProgressReporting() throws Exception
  {
    SearchConfiguration lConfig = iterations(25);
    lConfig.setVerbose(true);

    // Progress is reported after playouts 10 and 20 (each a second apart) and after the last playout.
    SteppingTicker lTicker = new SteppingTicker(100, TimeUnit.MILLISECONDS);
    SearchTree<Integer, NimState> lTree = new SearchTree<>(new NimState(21, 3), lConfig, 5, lTicker);
    lTree.grow();

    assertEquals(25, lTree.getIterations());
    assertEquals(26, lTicker.getReads());
    assertEquals(TimeUnit.MILLISECONDS.toNanos(2500), lTree.getElapsedNanos());
  }

  @Test
  public void testIterationLimitReachedBeforeTimeLimit() throws Exception
  {
    SearchConfiguration lConfig = iterations(5);
    lConfig.setMaxTime(1.0);

    SearchTree<Integer, NimState> lTree = new SearchTree<>(new NimState(21, 3),
                                                           lConfig,
                                                           5,
                                                           new SteppingTicker(100, TimeUnit.MILLISECONDS));
    lTree.grow();
    assertEquals(5, lTree.getIterations());
  }

  @Test(expected = SearchConfigurationException.class)
  public void testTimeLimitWithoutClock()
  {
    SearchConfiguration lConfig = new SearchConfiguration();
    lConfig.setMaxTime(0.5);
    new SearchTree<>(new NimState(21, 3), lConfig, 5, null);
  }

  @Test
  public void testUnlimitedSearchStopsWhenInterrupted() throws Exception
  {
    final SearchTree<Integer, NimState> lTree = new SearchTree<>(new NimState(21, 3),
                                                                 iterations(SearchConfiguration.UNLIMITED),
                                                                 5,
                                                                 null);
    final AtomicReference<Throwable> lFailure = new AtomicReference<>();
    Thread lThread = new Thread(new Runnable()
    {
      @Override
      public void run()
      {
        try
        {
          lTree.grow();
        }
        catch (Throwable lEx)
        {
          lFailure.set(lEx);
        }
      }
    });

    lThread.start();
    Thread.sleep(100);
    lThread.interrupt();
    lThread.join(5000);

    assertFalse(lThread.isAlive());
    assertTrue(lFailure.get() instanceof InterruptedException);
    assertTrue(lTree.getIterations() > 0);
  }

  @Test
  public void testPerSecond()
  {
    assertEquals(500, SearchTree.perSecond(1000, TimeUnit.SECONDS.toNanos(2)), EPSILON);
    assertEquals(0, SearchTree.perSecond(1000, 0), EPSILON);
  }
}
