package ai.gametree.game.tictactoe;

import ai.gametree.game.GameAdapter;
import ai.gametree.game.IllegalMoveException;
import ai.gametree.game.InvalidStateException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.stereotype.Component;

/**
 * Tic-tac-toe rules exposed as a {@link GameAdapter}.
 *
 * <p>X moves first. A player wins with three marks in a row, column or diagonal; a full board
 * without a line is a draw. Finished games score +1 for the winner and -1 for the loser, and
 * 0 for both players on a draw.
 */
@Component
public class TicTacToe implements GameAdapter<TicTacToeState, Cell, Mark> {

    /** Every line of three cells that wins the game. */
    private static final List<Cell[]> LINES = buildLines();

    @Override
    public TicTacToeState startingState() {
        return TicTacToeState.empty();
    }

    @Override
    public Mark activePlayer(TicTacToeState state) {
        return state.getActivePlayer();
    }

    @Override
    public boolean isFinished(TicTacToeState state) {
        return findWinner(state) != null || state.isFull();
    }

    @Override
    public List<Cell> allLegalMoves(TicTacToeState state) {
        if (isFinished(state)) {
            return Collections.emptyList();
        }
        List<Cell> moves = new ArrayList<>();
        for (int i = 0; i < Cell.SIZE * Cell.SIZE; i++) {
            Cell cell = Cell.ofIndex(i);
            if (state.isEmpty(cell)) {
                moves.add(cell);
            }
        }
        return moves;
    }

    @Override
    public TicTacToeState makeMove(TicTacToeState state, Cell move) {
        if (move == null) {
            throw new IllegalMoveException("Move must name a cell");
        }
        if (isFinished(state)) {
            throw new IllegalMoveException("Game is already finished, cannot play " + move);
        }
        if (!state.isEmpty(move)) {
            throw new IllegalMoveException("Cell " + move + " is already occupied");
        }
        Mark mover = state.getActivePlayer();
        TicTacToeState placed = state.with(move, mover, null);
        if (isFinished(placed)) {
            return placed;
        }
        return state.with(move, mover, mover.other());
    }

    @Override
    public Mark winner(TicTacToeState state) {
        Mark winner = findWinner(state);
        if (winner != null) {
            return winner;
        }
        if (!state.isFull()) {
            throw new InvalidStateException("Game is not finished, there is no winner yet");
        }
        return null;
    }

    @Override
    public Optional<Map<Mark, Double>> evaluate(TicTacToeState state) {
        if (!isFinished(state)) {
            return Optional.empty();
        }
        Map<Mark, Double> values = new EnumMap<>(Mark.class);
        Mark winner = findWinner(state);
        for (Mark mark : Mark.values()) {
            if (winner == null) {
                values.put(mark, 0.0);
            } else {
                values.put(mark, mark == winner ? 1.0 : -1.0);
            }
        }
        return Optional.of(values);
    }

    /**
     * Nine row-major cell symbols followed by the player to move ({@code -} once finished).
     */
    @Override
    public String nodeKey(TicTacToeState state) {
        StringBuilder sb = new StringBuilder(Cell.SIZE * Cell.SIZE + 1);
        for (int i = 0; i < Cell.SIZE * Cell.SIZE; i++) {
            sb.append(BoardFormatter.symbol(state.get(Cell.ofIndex(i))));
        }
        Mark active = state.getActivePlayer();
        sb.append(active == null ? '-' : active.getSymbol());
        return sb.toString();
    }

    @Override
    public String render(TicTacToeState state) {
        return new BoardFormatter(state).format();
    }

    /**
     * Returns the player owning a complete line, if any.
     *
     * @param state the position to inspect
     * @return the winner, or {@code null} if nobody has three in a row
     */
    static Mark findWinner(TicTacToeState state) {
        for (Cell[] line : LINES) {
            Mark first = state.get(line[0]);
            if (first != null && first == state.get(line[1]) && first == state.get(line[2])) {
                return first;
            }
        }
        return null;
    }

    private static List<Cell[]> buildLines() {
        List<Cell[]> lines = new ArrayList<>();
        for (int i = 0; i < Cell.SIZE; i++) {
            lines.add(new Cell[] {new Cell(i, 0), new Cell(i, 1), new Cell(i, 2)});
            lines.add(new Cell[] {new Cell(0, i), new Cell(1, i), new Cell(2, i)});
        }
        lines.add(new Cell[] {new Cell(0, 0), new Cell(1, 1), new Cell(2, 2)});
        lines.add(new Cell[] {new Cell(0, 2), new Cell(1, 1), new Cell(2, 0)});
        return Collections.unmodifiableList(lines);
    }
}
