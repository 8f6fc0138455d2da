package ai.gametree.search.scoring;

import ai.gametree.search.SearchNode;
import ai.gametree.search.TranspositionTable;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Computes node values from the values of their successors.
 *
 * <p>The {@link TranspositionTable} calls a scorer whenever a node is inserted, merged or
 * expanded, and again for every predecessor whose successor's value changed. Implementations
 * read successors through the table and must not mutate anything.
 *
 * @param <S> game state type
 * @param <M> move type
 * @param <P> player identifier type
 */
public interface Scorer<S, M, P> {

    /**
     * Computes a node's score vector.
     *
     * @param node  the node to score
     * @param table the table resolving successor keys
     * @return the score, or empty while the node has no defined value
     */
    Optional<Map<P, Double>> score(SearchNode<S, M, P> node, TranspositionTable<S, M, P> table);

    /**
     * Lists the moves that reach the best value for the node's active player, in adapter order.
     *
     * @param node  an expanded, non-terminal node
     * @param table the table resolving successor keys
     * @return the best moves; never empty for a node with at least one move
     */
    List<M> bestMoves(SearchNode<S, M, P> node, TranspositionTable<S, M, P> table);
}
