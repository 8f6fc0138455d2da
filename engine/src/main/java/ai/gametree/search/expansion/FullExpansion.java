package ai.gametree.search.expansion;

import ai.gametree.search.SearchTree;
import java.util.Objects;

/**
 * Repeats the wrapped strategy until every resident node is expanded.
 *
 * <p>The loop also ends when the wrapped strategy reports that it has no more work, which is how a
 * {@link BoundedExpansion} placed inside stops it. A strategy that can never reach the remaining
 * nodes (for example {@link CurrentNodeExpansion}) therefore ends the loop instead of spinning.
 *
 * <p>One {@link #step} is the whole loop. Wrapped in a {@link BoundedExpansion}, the budget is
 * only looked at after the tree is complete.
 */
public class FullExpansion<S, M, P> implements ExpansionControl<S, M, P> {

    private final ExpansionStrategy<S, M, P> inner;

    public FullExpansion(ExpansionStrategy<S, M, P> inner) {
        this.inner = Objects.requireNonNull(inner, "inner");
    }

    @Override
    public void begin(SearchTree<S, M, P> tree) {
        inner.begin(tree);
    }

    @Override
    public boolean step(SearchTree<S, M, P> tree) {
        boolean progressed = true;
        while (progressed && tree.getTable().hasUnexpandedNodes()) {
            progressed = inner.step(tree);
        }
        // Either the tree is complete or the inner strategy gave up; neither leaves work for a
        // further step.
        return false;
    }

    @Override
    public void expand(SearchTree<S, M, P> tree) {
        begin(tree);
        step(tree);
    }
}
