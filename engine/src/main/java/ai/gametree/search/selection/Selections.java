package ai.gametree.search.selection;

import ai.gametree.game.InvalidStateException;
import ai.gametree.search.SearchNode;
import ai.gametree.search.SearchTree;
import java.util.ArrayList;
import java.util.List;

/**
 * Candidate lists shared by the selectors.
 */
final class Selections {

    private Selections() {
    }

    static <S, M, P> List<M> bestMoves(SearchTree<S, M, P> tree) {
        SearchNode<S, M, P> current = requireMoves(tree);
        return tree.getTable().bestMoves(current);
    }

    static <S, M, P> List<M> allMoves(SearchTree<S, M, P> tree) {
        SearchNode<S, M, P> current = requireMoves(tree);
        return new ArrayList<>(current.getSuccessors().keySet());
    }

    private static <S, M, P> SearchNode<S, M, P> requireMoves(SearchTree<S, M, P> tree) {
        SearchNode<S, M, P> current = tree.getCurrent();
        if (!current.isExpanded()) {
            throw new InvalidStateException("Current node " + current.getNodeKey() + " is not expanded");
        }
        if (current.getSuccessors().isEmpty()) {
            throw new InvalidStateException("No moves available from " + current.getNodeKey());
        }
        return current;
    }
}
