package ai.gametree.game.tictactoe;

/**
 * Renders a tic-tac-toe position for console and log output.
 *
 * <p>The board is drawn as three rows separated by rule lines, followed by a status line that
 * names either the player to move or the result:
 * <pre>
 *  X | O |
 * ---+---+---
 *    | X |
 * ---+---+---
 *    |   | O
 * Move: X
 * </pre>
 */
public class BoardFormatter {

    private static final String ROW_RULE = "---+---+---";

    private final TicTacToeState state;

    public BoardFormatter(TicTacToeState state) {
        this.state = state;
    }

    /**
     * Renders the board and its status line.
     *
     * @return a multi-line string without a trailing newline
     */
    public String format() {
        StringBuilder sb = new StringBuilder();
        for (int row = 0; row < Cell.SIZE; row++) {
            if (row > 0) {
                sb.append(ROW_RULE).append('\n');
            }
            for (int column = 0; column < Cell.SIZE; column++) {
                if (column > 0) {
                    sb.append('|');
                }
                sb.append(' ').append(symbol(state.get(new Cell(row, column)))).append(' ');
            }
            sb.append('\n');
        }
        sb.append(statusLine());
        return sb.toString();
    }

    private String statusLine() {
        if (state.getActivePlayer() != null) {
            return "Move: " + state.getActivePlayer().getSymbol();
        }
        Mark winner = TicTacToe.findWinner(state);
        return "Winner: " + (winner == null ? "draw" : String.valueOf(winner.getSymbol()));
    }

    static char symbol(Mark mark) {
        return mark == null ? ' ' : mark.getSymbol();
    }
}
