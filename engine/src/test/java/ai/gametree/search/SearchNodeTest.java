package ai.gametree.search;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.gametree.game.InvalidStateException;
import ai.gametree.game.tictactoe.Cell;
import ai.gametree.game.tictactoe.Mark;
import ai.gametree.game.tictactoe.TicTacToe;
import ai.gametree.game.tictactoe.TicTacToeState;
import ai.gametree.game.tictactoe.TicTacToeTestHelper;
import java.util.ArrayList;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for {@link SearchNode}: expansion, merging and score bookkeeping.
 */
class SearchNodeTest {

    private final TicTacToe game = new TicTacToe();

    private SearchNode<TicTacToeState, Cell, Mark> node(TicTacToeState state) {
        return new SearchNode<>(game, state);
    }

    @Nested
    @DisplayName("expand")
    class ExpandTests {

        @Test
        void producesOneSuccessorPerLegalMoveInAdapterOrder() {
            SearchNode<TicTacToeState, Cell, Mark> root = node(game.startingState());

            Map<Cell, SearchNode<TicTacToeState, Cell, Mark>> produced = root.expand();

            assertTrue(root.isExpanded());
            assertEquals(game.allLegalMoves(game.startingState()), new ArrayList<>(produced.keySet()));
            assertEquals(new ArrayList<>(root.getSuccessors().keySet()), new ArrayList<>(produced.keySet()));
            assertEquals(game.nodeKey(TicTacToeTestHelper.play(4)), root.getSuccessorKey(new Cell(1, 1)));
        }

        @Test
        void expandingTwiceFails() {
            SearchNode<TicTacToeState, Cell, Mark> root = node(game.startingState());
            root.expand();

            assertThrows(InvalidStateException.class, root::expand);
        }

        @Test
        void terminalNodeExpandsToNothing() {
            SearchNode<TicTacToeState, Cell, Mark> won = node(TicTacToeTestHelper.play(0, 3, 1, 4, 2));

            assertTrue(won.expand().isEmpty());
            assertTrue(won.isExpanded());
            assertTrue(won.isTerminal());
        }
    }

    @Nested
    @DisplayName("merge")
    class MergeTests {

        @Test
        void mergingAnExpandedTwinAdoptsItsSuccessors() {
            SearchNode<TicTacToeState, Cell, Mark> resident = node(game.startingState());
            SearchNode<TicTacToeState, Cell, Mark> expandedTwin = node(game.startingState());
            expandedTwin.expand();

            assertTrue(resident.merge(expandedTwin));

            assertTrue(resident.isExpanded());
            assertEquals(expandedTwin.getSuccessors(), resident.getSuccessors());
        }

        @Test
        void mergeIsIdempotent() {
            SearchNode<TicTacToeState, Cell, Mark> resident = node(game.startingState());
            SearchNode<TicTacToeState, Cell, Mark> expandedTwin = node(game.startingState());
            expandedTwin.expand();

            resident.merge(expandedTwin);
            Map<Cell, String> afterFirst = Map.copyOf(resident.getSuccessors());

            assertFalse(resident.merge(expandedTwin));
            assertEquals(afterFirst, Map.copyOf(resident.getSuccessors()));
        }

        @Test
        void mergingWithItselfChangesNothing() {
            SearchNode<TicTacToeState, Cell, Mark> root = node(game.startingState());
            root.expand();

            assertFalse(root.merge(root));
            assertEquals(9, root.getSuccessors().size());
        }

        @Test
        void mergingAnUnexpandedTwinIntoAnExpandedNodeKeepsEverything() {
            SearchNode<TicTacToeState, Cell, Mark> resident = node(game.startingState());
            resident.expand();

            assertFalse(resident.merge(node(game.startingState())));
            assertTrue(resident.isExpanded());
            assertEquals(9, resident.getSuccessors().size());
        }

        @Test
        void mergingDifferentKeysFails() {
            SearchNode<TicTacToeState, Cell, Mark> a = node(TicTacToeTestHelper.play(0));
            SearchNode<TicTacToeState, Cell, Mark> b = node(TicTacToeTestHelper.play(1));

            assertThrows(InvalidStateException.class, () -> a.merge(b));
        }
    }

    @Nested
    @DisplayName("score")
    class ScoreTests {

        @Test
        void freshNodeHasNoScore() {
            SearchNode<TicTacToeState, Cell, Mark> root = node(game.startingState());

            assertTrue(root.getScore().isEmpty());
            assertTrue(root.score(Mark.X).isEmpty());
        }

        @Test
        void updateReportsChangesOnly() {
            SearchNode<TicTacToeState, Cell, Mark> root = node(game.startingState());
            Map<Mark, Double> draw = Map.of(Mark.X, 0.0, Mark.O, 0.0);

            assertTrue(root.updateScore(draw));
            assertFalse(root.updateScore(draw));
            assertEquals(0.0, root.score(Mark.O).getAsDouble());
            assertTrue(root.updateScore(null));
            assertTrue(root.getScore().isEmpty());
        }

        @Test
        void rescoringDropsCachedBestMoves() {
            SearchNode<TicTacToeState, Cell, Mark> root = node(game.startingState());
            root.cacheBestMoves(new ArrayList<>(game.allLegalMoves(game.startingState())));

            root.updateScore(null);

            assertNull(root.getCachedBestMoves());
        }
    }
}
