package ai.gametree.search.expansion;

import ai.gametree.search.SearchTree;

/**
 * One unit of tree-growing work.
 *
 * <p>A step decides which unexpanded nodes to expand and hands each of them to
 * {@link SearchTree#expandNode(ai.gametree.search.SearchNode)}. Steps are never interrupted: budgets wrapped around a
 * strategy are checked only between steps.
 *
 * @param <S> game state type
 * @param <M> move type
 * @param <P> player identifier type
 */
public interface ExpansionStrategy<S, M, P> {

    /**
     * Called once before the steps of one decision. Stateful strategies reset here.
     *
     * @param tree the tree about to be expanded
     */
    default void begin(SearchTree<S, M, P> tree) {
    }

    /**
     * Performs one expansion step.
     *
     * @param tree the tree to grow
     * @return true if another step may usefully be run, false if there is no more work or a
     *         wrapping control wants expansion to stop
     */
    boolean step(SearchTree<S, M, P> tree);
}
