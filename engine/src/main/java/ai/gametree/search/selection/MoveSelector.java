package ai.gametree.search.selection;

import ai.gametree.search.SearchTree;

/**
 * Picks the move to play from the live position of a scored tree.
 *
 * @param <S> game state type
 * @param <M> move type
 * @param <P> player identifier type
 */
public interface MoveSelector<S, M, P> {

    /**
     * Chooses a move from {@code tree.getCurrent()}.
     *
     * @param tree a tree whose current node is expanded
     * @return a legal move
     * @throws ai.gametree.game.InvalidStateException if the current node has no moves
     */
    M select(SearchTree<S, M, P> tree);
}
