package ai.gametree.search.expansion;

import ai.gametree.search.SearchNode;
import ai.gametree.search.SearchTree;
import java.util.List;

/**
 * Expands every node that is unexpanded when the step starts, once.
 *
 * <p>Not recursive: successors produced during the step stay unexpanded until the next step, so
 * each step grows the whole frontier by one ply.
 */
public class OneStepExpansion<S, M, P> implements ExpansionStrategy<S, M, P> {

    @Override
    public boolean step(SearchTree<S, M, P> tree) {
        boolean expanded = false;
        List<SearchNode<S, M, P>> frontier = tree.getTable().unexpandedNodes();
        for (SearchNode<S, M, P> node : frontier) {
            expanded = tree.expandNode(node) || expanded;
        }
        return expanded;
    }
}
