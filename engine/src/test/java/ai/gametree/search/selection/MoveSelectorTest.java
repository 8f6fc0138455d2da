package ai.gametree.search.selection;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ai.gametree.game.InvalidStateException;
import ai.gametree.game.tictactoe.Cell;
import ai.gametree.game.tictactoe.Mark;
import ai.gametree.game.tictactoe.TicTacToe;
import ai.gametree.game.tictactoe.TicTacToeState;
import ai.gametree.game.tictactoe.TicTacToeTestHelper;
import ai.gametree.search.SearchTree;
import ai.gametree.search.scoring.MinimaxScorer;
import java.util.HashSet;
import java.util.Random;
import java.util.Set;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

class MoveSelectorTest {

    private final TicTacToe game = new TicTacToe();

    private SearchTree<TicTacToeState, Cell, Mark> expandedTreeAt(TicTacToeState state) {
        SearchTree<TicTacToeState, Cell, Mark> tree = new SearchTree<>(game, new MinimaxScorer<>(), state);
        tree.expandNode(tree.getCurrent());
        return tree;
    }

    @Nested
    @DisplayName("FirstBestMoveSelector")
    class FirstBestTests {

        @Test
        void takesTheWinningMove() {
            SearchTree<TicTacToeState, Cell, Mark> tree = expandedTreeAt(TicTacToeTestHelper.xToWinTopRow());

            assertEquals(new Cell(0, 2), new FirstBestMoveSelector<TicTacToeState, Cell, Mark>().select(tree));
        }

        @Test
        void fallsBackToTheFirstLegalMove() {
            SearchTree<TicTacToeState, Cell, Mark> tree = expandedTreeAt(game.startingState());

            assertEquals(new Cell(0, 0), new FirstBestMoveSelector<TicTacToeState, Cell, Mark>().select(tree));
        }
    }

    @Nested
    @DisplayName("RandomBestMoveSelector")
    class RandomBestTests {

        @Test
        void onlyEverPicksABestMove() {
            SearchTree<TicTacToeState, Cell, Mark> tree = expandedTreeAt(TicTacToeTestHelper.xToWinTopRow());
            RandomBestMoveSelector<TicTacToeState, Cell, Mark> selector = new RandomBestMoveSelector<>(new Random(7));

            for (int i = 0; i < 20; i++) {
                assertEquals(new Cell(0, 2), selector.select(tree));
            }
        }

        @Test
        void spreadsOverTiedMoves() {
            SearchTree<TicTacToeState, Cell, Mark> tree = expandedTreeAt(game.startingState());
            RandomBestMoveSelector<TicTacToeState, Cell, Mark> selector = new RandomBestMoveSelector<>(new Random(42));
            Set<Cell> picked = new HashSet<>();

            for (int i = 0; i < 200; i++) {
                picked.add(selector.select(tree));
            }

            assertTrue(picked.size() > 1);
        }
    }

    @Nested
    @DisplayName("UniformRandomMoveSelector")
    class UniformRandomTests {

        @Test
        void ignoresScores() {
            SearchTree<TicTacToeState, Cell, Mark> tree = expandedTreeAt(TicTacToeTestHelper.xToWinTopRow());
            UniformRandomMoveSelector<TicTacToeState, Cell, Mark> selector = new UniformRandomMoveSelector<>(new Random(3));
            Set<Cell> picked = new HashSet<>();

            for (int i = 0; i < 200; i++) {
                Cell move = selector.select(tree);
                assertTrue(game.allLegalMoves(tree.getCurrent().getState()).contains(move));
                picked.add(move);
            }

            assertEquals(5, picked.size());
        }

        @Test
        void sameSeedSameChoices() {
            SearchTree<TicTacToeState, Cell, Mark> tree = expandedTreeAt(game.startingState());
            UniformRandomMoveSelector<TicTacToeState, Cell, Mark> a = new UniformRandomMoveSelector<>(new Random(11));
            UniformRandomMoveSelector<TicTacToeState, Cell, Mark> b = new UniformRandomMoveSelector<>(new Random(11));

            for (int i = 0; i < 10; i++) {
                assertEquals(a.select(tree), b.select(tree));
            }
        }
    }

    @Nested
    @DisplayName("preconditions")
    class PreconditionTests {

        @Test
        void unexpandedCurrentNodeIsRejected() {
            SearchTree<TicTacToeState, Cell, Mark> tree = new SearchTree<>(game, new MinimaxScorer<>());

            assertThrows(InvalidStateException.class,
                    () -> new FirstBestMoveSelector<TicTacToeState, Cell, Mark>().select(tree));
        }

        @Test
        void finishedGameHasNothingToSelect() {
            SearchTree<TicTacToeState, Cell, Mark> tree = expandedTreeAt(TicTacToeTestHelper.play(0, 3, 1, 4, 2));

            assertThrows(InvalidStateException.class,
                    () -> new UniformRandomMoveSelector<TicTacToeState, Cell, Mark>().select(tree));
            assertThrows(InvalidStateException.class,
                    () -> new RandomBestMoveSelector<TicTacToeState, Cell, Mark>().select(tree));
        }
    }
}
