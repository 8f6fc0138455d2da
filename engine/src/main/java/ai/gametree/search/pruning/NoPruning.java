package ai.gametree.search.pruning;

import ai.gametree.search.SearchTree;

/**
 * Keeps every node for the whole game.
 */
public class NoPruning<S, M, P> implements PruningPolicy<S, M, P> {

    @Override
    public int prune(SearchTree<S, M, P> tree) {
        return 0;
    }
}
