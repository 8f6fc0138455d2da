package ai.gametree.search.scoring;

import ai.gametree.search.SearchNode;
import ai.gametree.search.TranspositionTable;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Minimax backward propagation over score vectors.
 *
 * <ul>
 *   <li>Terminal node: the adapter's evaluation.</li>
 *   <li>Expanded live node: the whole vector of the successor that is best for the player to
 *       move. Successors without a value are skipped, so a partly explored node is valued by
 *       what is known below it.</li>
 *   <li>Anything else: undefined.</li>
 * </ul>
 *
 * <p>Under a bounded search a partly explored node's value is a heuristic, not a bound: one
 * known terminal successor can set it while better or worse lines stay unexplored.
 *
 * <p>Adopting the full vector keeps the values of every player consistent with the line the
 * active player would choose, which in a two-player zero-sum game is the classic minimax value.
 */
public class MinimaxScorer<S, M, P> implements Scorer<S, M, P> {

    @Override
    public Optional<Map<P, Double>> score(SearchNode<S, M, P> node, TranspositionTable<S, M, P> table) {
        if (node.isTerminal()) {
            return node.evaluate();
        }
        if (!node.isExpanded()) {
            return Optional.empty();
        }
        P active = node.getActivePlayer();
        Map<P, Double> best = null;
        double bestValue = Double.NEGATIVE_INFINITY;
        for (String key : node.getSuccessors().values()) {
            OptionalDouble value = successorValue(table, key, active);
            if (value.isPresent() && (best == null || value.getAsDouble() > bestValue)) {
                bestValue = value.getAsDouble();
                best = table.get(key).getScore().orElseThrow();
            }
        }
        return Optional.ofNullable(best);
    }

    @Override
    public List<M> bestMoves(SearchNode<S, M, P> node, TranspositionTable<S, M, P> table) {
        P active = node.getActivePlayer();
        List<M> best = new ArrayList<>();
        double bestValue = Double.NEGATIVE_INFINITY;
        for (Map.Entry<M, String> entry : node.getSuccessors().entrySet()) {
            OptionalDouble value = successorValue(table, entry.getValue(), active);
            if (value.isEmpty()) {
                continue;
            }
            if (value.getAsDouble() > bestValue) {
                bestValue = value.getAsDouble();
                best.clear();
                best.add(entry.getKey());
            } else if (value.getAsDouble() == bestValue) {
                best.add(entry.getKey());
            }
        }
        if (best.isEmpty()) {
            // Nothing below is scored yet, so no move is known to be worse than another.
            best.addAll(node.getSuccessors().keySet());
        }
        return best;
    }

    private OptionalDouble successorValue(TranspositionTable<S, M, P> table, String key, P player) {
        SearchNode<S, M, P> successor = table.get(key);
        if (successor == null || player == null) {
            return OptionalDouble.empty();
        }
        return successor.score(player);
    }
}
