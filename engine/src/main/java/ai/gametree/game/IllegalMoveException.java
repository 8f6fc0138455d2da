package ai.gametree.game;

/**
 * Thrown when a move is not legal for the state it is applied to, including any move made
 * after the game has finished.
 *
 * <p>Callers get the exception immediately. Nothing in the engine retries or silently skips
 * an illegal move.
 */
public class IllegalMoveException extends IllegalArgumentException {

    public IllegalMoveException(String message) {
        super(message);
    }
}
