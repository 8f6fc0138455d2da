package ai.gametree.search.pruning;

import ai.gametree.search.SearchTree;

/**
 * Decides what the tree forgets after a move has been committed.
 *
 * @param <S> game state type
 * @param <M> move type
 * @param <P> player identifier type
 */
public interface PruningPolicy<S, M, P> {

    /**
     * Called right after the live position advanced.
     *
     * @param tree the tree whose current node just moved
     * @return the number of nodes removed
     */
    int prune(SearchTree<S, M, P> tree);
}
