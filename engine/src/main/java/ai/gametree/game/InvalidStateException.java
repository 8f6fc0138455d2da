package ai.gametree.game;

/**
 * Thrown when a caller breaks a structural contract of the engine or of a game adapter.
 *
 * <p>Examples: asking for the winner of a game that is still running, expanding a node twice,
 * merging nodes with different keys, or configuring a forward sweep with a non-positive depth.
 * These are programming errors and are not meant to be recovered from.
 */
public class InvalidStateException extends IllegalStateException {

    public InvalidStateException(String message) {
        super(message);
    }
}
