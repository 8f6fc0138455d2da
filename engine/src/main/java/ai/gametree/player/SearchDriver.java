package ai.gametree.player;

import ai.gametree.SearchReporter;
import ai.gametree.game.GameAdapter;
import ai.gametree.game.IllegalMoveException;
import ai.gametree.search.SearchNode;
import ai.gametree.search.SearchTree;
import ai.gametree.search.expansion.CurrentNodeExpansion;
import ai.gametree.search.expansion.ExpansionControl;
import ai.gametree.search.expansion.SingleStepExpansion;
import ai.gametree.search.pruning.PruningPolicy;
import ai.gametree.search.pruning.ReachabilityPruning;
import ai.gametree.search.scoring.MinimaxScorer;
import ai.gametree.search.scoring.Scorer;
import ai.gametree.search.selection.FirstBestMoveSelector;
import ai.gametree.search.selection.MoveSelector;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Plays one game session with a search tree.
 *
 * <p>Each decision runs the same cycle:
 * <ol>
 *   <li>Grow the tree with the configured {@link ExpansionControl}.</li>
 *   <li>Scores are already current: the table rescores on every insertion, merge and expansion.</li>
 *   <li>Pick a move with the {@link MoveSelector}.</li>
 *   <li>Commit it with {@link #makeMove(Object)}, which advances the live position and then lets
 *       the {@link PruningPolicy} clean up the table.</li>
 * </ol>
 *
 * <p>Everything is single-threaded and synchronous. The driver never catches: illegal moves and
 * contract violations reach the caller unchanged.
 *
 * @param <S> game state type
 * @param <M> move type
 * @param <P> player identifier type
 */
public class SearchDriver<S, M, P> {

    private static final Logger log = LoggerFactory.getLogger(SearchDriver.class);

    private final GameAdapter<S, M, P> adapter;
    private final SearchTree<S, M, P> tree;
    private final ExpansionControl<S, M, P> expansion;
    private final PruningPolicy<S, M, P> pruning;
    private final MoveSelector<S, M, P> selector;
    private final SearchReporter reporter;

    private int plies;

    private SearchDriver(Builder<S, M, P> builder) {
        this.adapter = builder.adapter;
        this.expansion = builder.expansion;
        this.pruning = builder.pruning;
        this.selector = builder.selector;
        this.reporter = builder.reporter;
        S start = builder.startState != null ? builder.startState : adapter.startingState();
        this.tree = new SearchTree<>(adapter, builder.scorer, start);
    }

    /**
     * Starts configuring a driver for a game.
     *
     * <p>Defaults: expand the current node once per decision, minimax scoring, reachability
     * pruning, first best move, no debug reporting.
     */
    public static <S, M, P> Builder<S, M, P> builder(GameAdapter<S, M, P> adapter) {
        return new Builder<>(adapter);
    }

    /**
     * Grows the tree for one decision and picks a move from the live position.
     *
     * @return the chosen move
     * @throws ai.gametree.game.InvalidStateException if the game is already finished
     */
    public M chooseMove() {
        expansion.expand(tree);
        SearchNode<S, M, P> current = tree.getCurrent();
        if (!current.isExpanded()) {
            tree.expandNode(current);
        }
        M move = selector.select(tree);
        if (log.isDebugEnabled()) {
            log.debug("Chose {} from {} (score {}, {} nodes)", move, current.getNodeKey(),
                    current.getScore().map(Object::toString).orElse("undefined"), tree.size());
        }
        return move;
    }

    /**
     * Commits a move: advances the live position and prunes the tree.
     *
     * @param move a legal move from the current position
     * @throws IllegalMoveException if the move is illegal or the game is over; the tree is left
     *                              untouched in that case
     */
    public void makeMove(M move) {
        tree.advance(move);
        plies++;
        int postMoveSize = tree.size();
        int removed = pruning.prune(tree);
        reporter.reportPruning(postMoveSize, removed, tree.size());
    }

    /**
     * Plays moves chosen by this driver until the game ends.
     *
     * @return the winner, the number of moves and the time taken
     */
    public PlayResult<P> play() {
        long startNanos = System.nanoTime();
        reporter.reportPosition(tree, plies, null);
        while (!isFinished()) {
            M move = chooseMove();
            makeMove(move);
            reporter.reportPosition(tree, plies, move);
        }
        long durationNanos = System.nanoTime() - startNanos;
        P winner = winner();
        if (log.isDebugEnabled()) {
            log.debug("Game over after {} plies: {}", plies, winner == null ? "draw" : winner + " wins");
        }
        return new PlayResult<>(winner, plies, durationNanos);
    }

    /**
     * Returns the player to move, or {@code null} once the game is over.
     */
    public P activePlayer() {
        return adapter.activePlayer(tree.getCurrent().getState());
    }

    public boolean isFinished() {
        return adapter.isFinished(tree.getCurrent().getState());
    }

    public List<M> allLegalMoves() {
        return adapter.allLegalMoves(tree.getCurrent().getState());
    }

    /**
     * Returns the winner of the finished game, or {@code null} for a draw.
     *
     * @throws ai.gametree.game.InvalidStateException if the game is still running
     */
    public P winner() {
        return adapter.winner(tree.getCurrent().getState());
    }

    /**
     * Returns the number of nodes in the table.
     */
    public int numStates() {
        return tree.size();
    }

    /**
     * Returns the score vector of the live position, empty while it is undefined.
     */
    public Optional<Map<P, Double>> currentScore() {
        return tree.getCurrent().getScore();
    }

    public S getCurrentState() {
        return tree.getCurrent().getState();
    }

    public int getPlies() {
        return plies;
    }

    public SearchTree<S, M, P> getTree() {
        return tree;
    }

    /**
     * Assembles a {@link SearchDriver} from interchangeable parts.
     */
    public static final class Builder<S, M, P> {
        private final GameAdapter<S, M, P> adapter;
        private S startState;
        private ExpansionControl<S, M, P> expansion = new SingleStepExpansion<>(new CurrentNodeExpansion<>());
        private Scorer<S, M, P> scorer = new MinimaxScorer<>();
        private PruningPolicy<S, M, P> pruning = new ReachabilityPruning<>();
        private MoveSelector<S, M, P> selector = new FirstBestMoveSelector<>();
        private SearchReporter reporter = new SearchReporter(false);

        private Builder(GameAdapter<S, M, P> adapter) {
            this.adapter = Objects.requireNonNull(adapter, "adapter");
        }

        /**
         * Starts from a given position instead of the adapter's starting state.
         */
        public Builder<S, M, P> startState(S startState) {
            this.startState = startState;
            return this;
        }

        public Builder<S, M, P> expansion(ExpansionControl<S, M, P> expansion) {
            this.expansion = Objects.requireNonNull(expansion, "expansion");
            return this;
        }

        public Builder<S, M, P> scorer(Scorer<S, M, P> scorer) {
            this.scorer = Objects.requireNonNull(scorer, "scorer");
            return this;
        }

        public Builder<S, M, P> pruning(PruningPolicy<S, M, P> pruning) {
            this.pruning = Objects.requireNonNull(pruning, "pruning");
            return this;
        }

        public Builder<S, M, P> selector(MoveSelector<S, M, P> selector) {
            this.selector = Objects.requireNonNull(selector, "selector");
            return this;
        }

        public Builder<S, M, P> reporter(SearchReporter reporter) {
            this.reporter = Objects.requireNonNull(reporter, "reporter");
            return this;
        }

        public SearchDriver<S, M, P> build() {
            return new SearchDriver<>(this);
        }
    }
}
