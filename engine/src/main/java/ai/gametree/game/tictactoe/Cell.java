package ai.gametree.game.tictactoe;

import ai.gametree.game.IllegalMoveException;

/**
 * A square on the 3x3 board, addressed by row and column (both 0..2, row 0 at the top).
 *
 * <p>Cells order row-major, which is also the order {@link TicTacToe#allLegalMoves} lists them.
 * Coordinates off the board are rejected at construction; they are never clamped.
 */
public record Cell(int row, int column) implements Comparable<Cell> {

    /** Board edge length. */
    public static final int SIZE = 3;

    public Cell {
        if (row < 0 || row >= SIZE || column < 0 || column >= SIZE) {
            throw new IllegalMoveException(
                    "Cell (" + row + "," + column + ") is off the board");
        }
    }

    /**
     * Returns the cell at the given row-major index (0..8).
     */
    public static Cell ofIndex(int index) {
        return new Cell(index / SIZE, index % SIZE);
    }

    /**
     * Returns this cell's row-major index (0..8).
     */
    public int index() {
        return row * SIZE + column;
    }

    @Override
    public int compareTo(Cell other) {
        return Integer.compare(index(), other.index());
    }

    @Override
    public String toString() {
        return "(" + row + "," + column + ")";
    }
}
