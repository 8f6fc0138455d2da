package ai.gametree.search;

import ai.gametree.game.GameAdapter;
import ai.gametree.game.InvalidStateException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * One canonical game state in the search tree.
 *
 * <p>A node is identified by the canonical key of its state. It never holds references to other
 * nodes: successors are recorded as {@code move -> key} and resolved through the
 * {@link TranspositionTable} that owns every node. When two paths reach the same state the table
 * merges them into the one resident node, so a score computed along one path is visible along
 * all of them.
 *
 * <p><b>Lifecycle:</b>
 * <ul>
 *   <li>Created unexpanded, the first time its state is reached.</li>
 *   <li>{@link #expand()} runs exactly once and fills {@code successors} in adapter order.</li>
 *   <li>{@link #merge(SearchNode)} folds in another node for the same key.</li>
 *   <li>The score is recomputed by the table whenever the node or one of its successors changes;
 *       every rescore drops the cached best moves.</li>
 * </ul>
 *
 * @param <S> game state type
 * @param <M> move type
 * @param <P> player identifier type
 */
public class SearchNode<S, M, P> {

    private final GameAdapter<S, M, P> adapter;
    private final S state;
    private final String nodeKey;

    /** Monotonic: once true it never reverts. */
    private boolean expanded;

    /** Legal move to successor key, in the adapter's move order. */
    private final Map<M, String> successors = new LinkedHashMap<>();

    /** Current score vector, or {@code null} while the node has no defined value. */
    private Map<P, Double> score;

    /** Best moves for the active player; {@code null} when not computed since the last rescore. */
    private List<M> bestMoves;

    /**
     * Wraps a state. The node is not resident in any table until it is routed through
     * {@link TranspositionTable#addOrMerge(SearchNode)}.
     *
     * @param adapter rules of the game the state belongs to
     * @param state   the state to wrap
     */
    public SearchNode(GameAdapter<S, M, P> adapter, S state) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.state = Objects.requireNonNull(state, "state");
        this.nodeKey = adapter.nodeKey(state);
    }

    /**
     * Computes every successor of this node.
     *
     * <p>Each legal move is applied through the adapter and wrapped in a fresh node. The returned
     * nodes are not resident anywhere; the caller must route each of them through the table.
     *
     * @return fresh successor nodes keyed by the move that produces them, in adapter order
     * @throws InvalidStateException if the node was already expanded
     */
    public Map<M, SearchNode<S, M, P>> expand() {
        if (expanded) {
            throw new InvalidStateException("Node " + nodeKey + " is already expanded");
        }
        Map<M, SearchNode<S, M, P>> produced = new LinkedHashMap<>();
        for (M move : adapter.allLegalMoves(state)) {
            SearchNode<S, M, P> child = new SearchNode<>(adapter, adapter.makeMove(state, move));
            produced.put(move, child);
        }
        for (Map.Entry<M, SearchNode<S, M, P>> entry : produced.entrySet()) {
            successors.put(entry.getKey(), entry.getValue().getNodeKey());
        }
        expanded = true;
        return produced;
    }

    /**
     * Folds another node for the same state into this one.
     *
     * <p>The successor maps are unioned and an expansion known only to {@code other} is adopted.
     * Merging a node with itself, or with a node that knows nothing new, changes nothing.
     *
     * @param other a node with the same canonical key
     * @return true if this node learned anything
     * @throws InvalidStateException if the keys differ
     */
    public boolean merge(SearchNode<S, M, P> other) {
        if (!nodeKey.equals(other.nodeKey)) {
            throw new InvalidStateException(
                    "Cannot merge node " + other.nodeKey + " into node " + nodeKey);
        }
        if (other == this) {
            return false;
        }
        boolean changed = false;
        for (Map.Entry<M, String> entry : other.successors.entrySet()) {
            if (!successors.containsKey(entry.getKey())) {
                successors.put(entry.getKey(), entry.getValue());
                changed = true;
            }
        }
        if (other.expanded && !expanded) {
            expanded = true;
            changed = true;
        }
        return changed;
    }

    /**
     * Builds a fresh node for the state reached by {@code move}. Used to materialize successors
     * this node knows by key only.
     */
    SearchNode<S, M, P> successorNode(M move) {
        return new SearchNode<>(adapter, adapter.makeMove(state, move));
    }

    /**
     * Stores a recomputed score and drops the best-move cache.
     *
     * @param newScore the new score vector, or {@code null} for undefined
     * @return true if the score differs from the previous one
     */
    boolean updateScore(Map<P, Double> newScore) {
        bestMoves = null;
        if (Objects.equals(score, newScore)) {
            return false;
        }
        score = newScore == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(newScore));
        return true;
    }

    List<M> getCachedBestMoves() {
        return bestMoves;
    }

    void cacheBestMoves(List<M> moves) {
        this.bestMoves = Collections.unmodifiableList(moves);
    }

    public S getState() {
        return state;
    }

    public String getNodeKey() {
        return nodeKey;
    }

    public boolean isExpanded() {
        return expanded;
    }

    /**
     * Returns whether the wrapped state is a finished game.
     */
    public boolean isTerminal() {
        return adapter.isFinished(state);
    }

    /**
     * Returns the player to move, or {@code null} for a terminal state.
     */
    public P getActivePlayer() {
        return adapter.activePlayer(state);
    }

    /**
     * Returns the adapter's evaluation of the wrapped state.
     */
    public Optional<Map<P, Double>> evaluate() {
        return adapter.evaluate(state);
    }

    /**
     * Returns the successor keys by move, in adapter order. Empty until the node is expanded.
     */
    public Map<M, String> getSuccessors() {
        return Collections.unmodifiableMap(successors);
    }

    /**
     * Returns the key of the node a move leads to.
     *
     * @param move a move from this node
     * @return the successor key, or {@code null} if the move is unknown
     */
    public String getSuccessorKey(M move) {
        return successors.get(move);
    }

    /**
     * Returns the full score vector, empty while the value is undefined (unexpanded, non-terminal
     * nodes and expanded nodes without any scored successor).
     */
    public Optional<Map<P, Double>> getScore() {
        return Optional.ofNullable(score);
    }

    /**
     * Returns one player's score.
     *
     * @param player the player to read
     * @return the value, or empty while the node has no defined score
     */
    public OptionalDouble score(P player) {
        if (score == null) {
            return OptionalDouble.empty();
        }
        Double value = score.get(player);
        return value == null ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    @Override
    public String toString() {
        return "SearchNode{" + nodeKey + (expanded ? ", expanded" : "") + ", score=" + score + "}";
    }
}
