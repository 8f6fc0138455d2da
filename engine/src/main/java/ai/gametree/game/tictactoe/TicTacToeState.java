package ai.gametree.game.tictactoe;

import java.util.Arrays;
import java.util.Objects;

/**
 * Immutable tic-tac-toe position: the marks on the nine cells plus the player to move.
 *
 * <p>A {@code null} active player means the game is over. Two states are equal when their
 * boards and active players are equal.
 */
public final class TicTacToeState {

    private static final int CELLS = Cell.SIZE * Cell.SIZE;

    /** Row-major marks; {@code null} for an empty cell. */
    private final Mark[] board;

    /** Player to move, or {@code null} once the game is finished. */
    private final Mark activePlayer;

    TicTacToeState(Mark[] board, Mark activePlayer) {
        if (board.length != CELLS) {
            throw new IllegalArgumentException("Board must have " + CELLS + " cells");
        }
        this.board = board.clone();
        this.activePlayer = activePlayer;
    }

    /**
     * Returns the empty board with X to move.
     */
    public static TicTacToeState empty() {
        return new TicTacToeState(new Mark[CELLS], Mark.X);
    }

    /**
     * Returns the mark on a cell.
     *
     * @param cell the cell to read
     * @return the mark, or {@code null} if the cell is empty
     */
    public Mark get(Cell cell) {
        return board[cell.index()];
    }

    /**
     * Returns whether a cell is still empty.
     */
    public boolean isEmpty(Cell cell) {
        return board[cell.index()] == null;
    }

    /**
     * Returns the player to move, or {@code null} when the game is over.
     */
    public Mark getActivePlayer() {
        return activePlayer;
    }

    /**
     * Returns a copy with one more mark placed and the given player to move.
     */
    TicTacToeState with(Cell cell, Mark mark, Mark nextActive) {
        Mark[] next = board.clone();
        next[cell.index()] = mark;
        return new TicTacToeState(next, nextActive);
    }

    /**
     * Returns whether every cell carries a mark.
     */
    public boolean isFull() {
        for (Mark mark : board) {
            if (mark == null) {
                return false;
            }
        }
        return true;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof TicTacToeState)) {
            return false;
        }
        TicTacToeState other = (TicTacToeState) o;
        return activePlayer == other.activePlayer && Arrays.equals(board, other.board);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(board) + Objects.hashCode(activePlayer);
    }

    @Override
    public String toString() {
        return new BoardFormatter(this).format();
    }
}
