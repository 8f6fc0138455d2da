package ai.gametree.search.selection;

import ai.gametree.search.SearchTree;

/**
 * Plays the earliest move, in adapter order, among those with the best score. Deterministic.
 */
public class FirstBestMoveSelector<S, M, P> implements MoveSelector<S, M, P> {

    @Override
    public M select(SearchTree<S, M, P> tree) {
        return Selections.bestMoves(tree).get(0);
    }
}
