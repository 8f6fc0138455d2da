package ai.gametree.search;

import ai.gametree.game.GameAdapter;
import ai.gametree.game.IllegalMoveException;
import ai.gametree.search.scoring.Scorer;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The transposition table of one game session together with the node for the live position.
 *
 * <p>Expansion strategies work against this class: they pick nodes and hand them to
 * {@link #expandNode(SearchNode)}, which is the single place where successors are produced,
 * registered in the table and scored back into their parent.
 *
 * @param <S> game state type
 * @param <M> move type
 * @param <P> player identifier type
 */
public class SearchTree<S, M, P> {

    private static final Logger log = LoggerFactory.getLogger(SearchTree.class);

    private final GameAdapter<S, M, P> adapter;
    private final TranspositionTable<S, M, P> table;

    /** Node for the live position; always resident in {@link #table}. */
    private SearchNode<S, M, P> current;

    /**
     * Creates a tree rooted at the adapter's starting state.
     */
    public SearchTree(GameAdapter<S, M, P> adapter, Scorer<S, M, P> scorer) {
        this(adapter, scorer, adapter.startingState());
    }

    /**
     * Creates a tree rooted at an arbitrary position.
     *
     * @param adapter    rules of the game
     * @param scorer     scoring used by the table
     * @param startState the live position to start from
     */
    public SearchTree(GameAdapter<S, M, P> adapter, Scorer<S, M, P> scorer, S startState) {
        this.adapter = Objects.requireNonNull(adapter, "adapter");
        this.table = new TranspositionTable<>(scorer);
        SearchNode<S, M, P> root = new SearchNode<>(adapter, startState);
        table.addOrMerge(root);
        this.current = table.get(root.getNodeKey());
    }

    /**
     * Expands one resident node and registers all of its successors.
     *
     * @param node an unexpanded node resident in this tree's table
     * @return true if the node produced at least one successor
     * @throws ai.gametree.game.InvalidStateException if the node is already expanded
     */
    public boolean expandNode(SearchNode<S, M, P> node) {
        Map<M, SearchNode<S, M, P>> produced = node.expand();
        int inserted = table.registerExpansion(node, produced);
        if (log.isTraceEnabled()) {
            log.trace("Expanded {}: {} successors, {} new", node.getNodeKey(), produced.size(), inserted);
        }
        return !produced.isEmpty();
    }

    /**
     * Moves the live position along one successor edge, expanding the current node first if needed.
     *
     * <p>Legality is checked against the adapter before anything is touched, so a rejected move
     * leaves both the table and the current node exactly as they were.
     *
     * @param move a legal move from the current position
     * @throws IllegalMoveException if the move is not legal or the game is finished
     */
    public void advance(M move) {
        if (adapter.isFinished(current.getState())) {
            throw new IllegalMoveException("Game is finished, cannot play " + move);
        }
        if (!adapter.allLegalMoves(current.getState()).contains(move)) {
            throw new IllegalMoveException("Move " + move + " is not legal here");
        }
        if (!current.isExpanded()) {
            expandNode(current);
        }
        current = table.get(current.getSuccessorKey(move));
    }

    public SearchNode<S, M, P> getCurrent() {
        return current;
    }

    public TranspositionTable<S, M, P> getTable() {
        return table;
    }

    public GameAdapter<S, M, P> getAdapter() {
        return adapter;
    }

    /**
     * Returns the number of resident nodes.
     */
    public int size() {
        return table.size();
    }
}
