package org.pmcts.player.search;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

import org.pmcts.util.statemachine.GameState;

/**
 * A node in a single MCTS tree.
 *
 * A node owns its children.  The parent reference is only used for back-propagation and is null for the root.
 *
 * The statistics are plain fields.  A tree is only ever grown by a single thread.
 *
 * @param <M> - the move type.
 */
public class SearchTreeNode<M>
{
  private final M                       mMove;
  private final SearchTreeNode<M>       mParent;
  private final int                     mPlayerToMove;

  private double                        mWins = 0;
  private int                           mVisits = 0;

  private final List<M>                 mUntriedMoves;
  private final List<SearchTreeNode<M>> mChildren = new ArrayList<>();

  /**
   * Create the root node of a tree.
   *
   * @param xiState - the state at the root of the tree.
   */
  public SearchTreeNode(GameState<M, ?> xiState)
  {
    this(xiState, null, null);
  }

  private SearchTreeNode(GameState<M, ?> xiState, M xiMove, SearchTreeNode<M> xiParent)
  {
    mMove = xiMove;
    mParent = xiParent;
    mPlayerToMove = xiState.getPlayerToMove();
    mUntriedMoves = new ArrayList<>(xiState.getMoves());
  }

  /**
   * @return the move that led to this node, or null for the root.
   */
  public M getMove()
  {
    return mMove;
  }

  /**
   * @return the parent node, or null for the root.
   */
  public SearchTreeNode<M> getParent()
  {
    return mParent;
  }

  /**
   * @return the player to move from this node.  (The player who made {@link #getMove()} is the opponent.)
   */
  public int getPlayerToMove()
  {
    return mPlayerToMove;
  }

  /**
   * @return the accumulated reward for the player who moved into this node.
   */
  public double getWins()
  {
    return mWins;
  }

  /**
   * @return the number of simulations that have passed through this node.
   */
  public int getVisits()
  {
    return mVisits;
  }

  /**
   * @return the children, in the order in which they were expanded.
   */
  public List<SearchTreeNode<M>> getChildren()
  {
    return Collections.unmodifiableList(mChildren);
  }

  /**
   * @return the legal moves that haven't yet been expanded.
   */
  public List<M> getUntriedMoves()
  {
    return Collections.unmodifiableList(mUntriedMoves);
  }

  public boolean hasUntriedMoves()
  {
    return !mUntriedMoves.isEmpty();
  }

  public boolean hasChildren()
  {
    return !mChildren.isEmpty();
  }

  /**
   * Pick one of the unexpanded moves, uniformly at random.  The set of unexpanded moves is unchanged.
   *
   * @param xiRandom - the source of randomness.
   *
   * @return the chosen move.
   */
  public M getUntriedMove(Random xiRandom)
  {
    if (mUntriedMoves.isEmpty())
    {
      throw new IllegalStateException("No untried moves in " + this);
    }
    return mUntriedMoves.get(xiRandom.nextInt(mUntriedMoves.size()));
  }

  /**
   * Expand an untried move into a new child node.
   *
   * @param xiMove - the move, which must be one of the untried moves.
   * @param xiState - the state after playing the move.
   *
   * @return the new child.
   */
  public SearchTreeNode<M> addChild(M xiMove, GameState<M, ?> xiState)
  {
    int lIndex = mUntriedMoves.indexOf(xiMove);
    if (lIndex < 0)
    {
      throw new IllegalStateException("Move " + xiMove + " is not an untried move of " + this);
    }

    SearchTreeNode<M> lChild = new SearchTreeNode<>(xiState, xiMove, this);
    mChildren.add(lChild);
    mUntriedMoves.remove(lIndex);
    return lChild;
  }

  /**
   * @return the child with the most visits.  Ties go to the earliest expanded child.
   */
  public SearchTreeNode<M> bestChild()
  {
    SearchTreeNode<M> lBestChild = null;
    for (SearchTreeNode<M> lChild : mChildren)
    {
      if ((lBestChild == null) || (lChild.mVisits > lBestChild.mVisits))
      {
        lBestChild = lChild;
      }
    }

    if (lBestChild == null)
    {
      throw new IllegalStateException("No children in " + this);
    }
    return lBestChild;
  }

  /**
   * Select a child using UCB1.  All children (and this node) must have been visited at least once.
   *
   * @return the child with the highest UCT score.  Ties go to the earliest expanded child.
   */
  public SearchTreeNode<M> selectChildUCT()
  {
    assert(mVisits > 0) : "Selecting from unvisited node " + this;

    double lBestScore = Double.NEGATIVE_INFINITY;
    SearchTreeNode<M> lBestChild = null;
    for (SearchTreeNode<M> lChild : mChildren)
    {
      double lScore = uctScore(lChild.mWins, lChild.mVisits, mVisits);
      if (lScore > lBestScore)
      {
        lBestScore = lScore;
        lBestChild = lChild;
      }
    }

    if (lBestChild == null)
    {
      throw new IllegalStateException("No children in " + this);
    }
    return lBestChild;
  }

  /**
   * Record the result of a simulation that passed through this node.
   *
   * @param xiResult - the result, from the perspective of the player who moved into this node.
   */
  public void update(double xiResult)
  {
    mVisits++;
    mWins += xiResult;
  }

  /**
   * @return the UCB1 score of a child.
   *
   * @param xiWins - the child's accumulated reward.
   * @param xiVisits - the child's visit count.
   * @param xiParentVisits - the parent's visit count.
   */
  static double uctScore(double xiWins, int xiVisits, int xiParentVisits)
  {
    return xiWins / xiVisits + Math.sqrt(2.0 * Math.log(xiParentVisits) / xiVisits);
  }

  /**
   * Render this node and its descendants, for debugging.
   *
   * @param xiMaxDepth - the number of levels below this node to include.
   *
   * @return the rendered tree, one node per line.
   */
  public String treeToString(int xiMaxDepth)
  {
    StringBuilder lBuffer = new StringBuilder();
    appendTree(lBuffer, 0, xiMaxDepth);
    return lBuffer.toString();
  }

  private void appendTree(StringBuilder xiBuffer, int xiIndent, int xiMaxDepth)
  {
    for (int lii = 0; lii < xiIndent; lii++)
    {
      xiBuffer.append("| ");
    }
    xiBuffer.append(this).append('\n');

    if (xiIndent < xiMaxDepth)
    {
      for (SearchTreeNode<M> lChild : mChildren)
      {
        lChild.appendTree(xiBuffer, xiIndent + 1, xiMaxDepth);
      }
    }
  }

  @Override
  public String toString()
  {
    return "[P" + GameState.opponentOf(mPlayerToMove) +
           " M:" + mMove +
           " W/V: " + mWins + "/" + mVisits +
           " U: " + mUntriedMoves.size() + "]";
  }
}
