package ai.gametree.search.expansion;

import ai.gametree.search.SearchTree;

/**
 * Expands only the live position, and only if it has not been expanded yet.
 *
 * <p>The laziest strategy: enough to know every legal move and its immediate outcome, nothing
 * beyond.
 */
public class CurrentNodeExpansion<S, M, P> implements ExpansionStrategy<S, M, P> {

    @Override
    public boolean step(SearchTree<S, M, P> tree) {
        if (tree.getCurrent().isExpanded()) {
            return false;
        }
        return tree.expandNode(tree.getCurrent());
    }
}
