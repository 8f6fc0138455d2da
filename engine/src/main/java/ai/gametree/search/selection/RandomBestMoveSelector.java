package ai.gametree.search.selection;

import ai.gametree.search.SearchTree;
import java.util.List;
import java.util.Objects;
import java.util.Random;

/**
 * Plays a uniformly random move among those tied for the best score, so equal lines are not
 * always resolved the same predictable way.
 */
public class RandomBestMoveSelector<S, M, P> implements MoveSelector<S, M, P> {

    private final Random random;

    public RandomBestMoveSelector() {
        this(new Random());
    }

    public RandomBestMoveSelector(Random random) {
        this.random = Objects.requireNonNull(random, "random");
    }

    @Override
    public M select(SearchTree<S, M, P> tree) {
        List<M> best = Selections.bestMoves(tree);
        return best.get(random.nextInt(best.size()));
    }
}
