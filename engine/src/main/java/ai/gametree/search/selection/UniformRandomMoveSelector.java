package ai.gametree.search.selection;

import ai.gametree.search.SearchTree;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Plays any legal move with equal probability and ignores scores. Useful as a baseline opponent.
 */
public class UniformRandomMoveSelector<S, M, P> implements MoveSelector<S, M, P> {

    private final Random random;

    public UniformRandomMoveSelector() {
        this(new Random());
    }

    public UniformRandomMoveSelector(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public M select(SearchTree<S, M, P> tree) {
        List<M> moves = Selections.allMoves(tree);
        return moves.get(random.nextInt(moves.size()));
    }
}
