package ai.gametree.player;

/**
 * Summary of one game played to the end by a {@link SearchDriver}.
 *
 * @param winner        the winning player, or {@code null} for a draw
 * @param plies         number of moves played
 * @param durationNanos wall-clock time of the whole game
 * @param <P> player identifier type
 */
public record PlayResult<P>(P winner, int plies, long durationNanos) {

    public boolean isDraw() {
        return winner == null;
    }
}
