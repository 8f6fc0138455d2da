package ai.gametree.search.pruning;

import ai.gametree.search.SearchTree;

/**
 * Drops every node that can no longer be reached from the live position.
 *
 * <p>This bounds memory to the subtree still in play. It also discards information: positions
 * that were reachable only through moves that were not taken are forgotten and have to be
 * rebuilt if a transposition leads back to them.
 */
public class ReachabilityPruning<S, M, P> implements PruningPolicy<S, M, P> {

    @Override
    public int prune(SearchTree<S, M, P> tree) {
        return tree.getTable().retainReachableFrom(tree.getCurrent().getNodeKey());
    }
}
