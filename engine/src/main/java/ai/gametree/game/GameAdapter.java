package ai.gametree.game;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Capability set the search engine needs from a concrete game.
 *
 * <p>The engine never looks inside a state. Everything it knows about a game flows through
 * this interface.
 *
 * <p><b>Contract for implementations:</b>
 * <ul>
 *   <li>States are immutable and value-comparable. {@link #makeMove(Object, Object)} returns a
 *       new state and never mutates its argument.</li>
 *   <li>{@link #nodeKey(Object)} is pure, deterministic and collision-free over every reachable
 *       state: two states share a key if and only if they are the same position with the same
 *       player to move. The transposition table relies on this for identity.</li>
 *   <li>{@link #evaluate(Object)} is zero-sum for finished games and empty for live ones.</li>
 * </ul>
 *
 * @param <S> game state type
 * @param <M> move type
 * @param <P> player identifier type
 */
public interface GameAdapter<S, M, P> {

    /**
     * Returns the position every game starts from.
     *
     * @return the starting state
     */
    S startingState();

    /**
     * Returns the player whose turn it is.
     *
     * @param state the state to inspect
     * @return the active player, or {@code null} if the state is terminal
     */
    P activePlayer(S state);

    /**
     * Returns whether no further moves can be made.
     *
     * @param state the state to inspect
     * @return true if the game is over
     */
    boolean isFinished(S state);

    /**
     * Lists every legal move in a stable order. The order is meaningful: selectors that break
     * ties deterministically pick the earliest move.
     *
     * @param state the state to inspect
     * @return legal moves, empty when the game is finished
     */
    List<M> allLegalMoves(S state);

    /**
     * Applies a move.
     *
     * @param state the state to move from
     * @param move  the move to apply
     * @return the resulting state
     * @throws IllegalMoveException if the move is not legal in {@code state}
     */
    S makeMove(S state, M move);

    /**
     * Returns the winner of a finished game.
     *
     * @param state a finished state
     * @return the winning player, or {@code null} for a draw
     * @throws InvalidStateException if the game is not finished
     */
    P winner(S state);

    /**
     * Scores a state for every player.
     *
     * <p>Finished games always produce a value per player and the values sum to zero. Live
     * positions have no result yet and produce an empty optional.
     *
     * @param state the state to score
     * @return per-player values, or empty if the game is still running
     */
    Optional<Map<P, Double>> evaluate(S state);

    /**
     * Returns the canonical identity of a state.
     *
     * @param state the state to identify
     * @return a key that is equal for two states exactly when they are the same position
     */
    String nodeKey(S state);

    /**
     * Renders a state for diagnostics.
     *
     * @param state the state to render
     * @return human-readable text
     */
    default String render(S state) {
        return String.valueOf(state);
    }
}
