package ai.gametree.game.tictactoe;

/**
 * The two players of tic-tac-toe, identified by the mark they put on the board.
 */
public enum Mark {
    X('X'),
    O('O');

    private final char symbol;

    Mark(char symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the character drawn on the board for this mark.
     */
    public char getSymbol() {
        return symbol;
    }

    /**
     * Returns the opponent.
     */
    public Mark other() {
        return this == X ? O : X;
    }
}
