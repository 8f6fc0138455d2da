package ai.gametree.search.expansion;

import ai.gametree.search.SearchTree;
import java.util.Objects;

/**
 * Runs the wrapped strategy exactly once per decision.
 */
public class SingleStepExpansion<S, M, P> implements ExpansionControl<S, M, P> {

    private final ExpansionStrategy<S, M, P> inner;

    public SingleStepExpansion(ExpansionStrategy<S, M, P> inner) {
        this.inner = Objects.requireNonNull(inner, "inner");
    }

    @Override
    public void begin(SearchTree<S, M, P> tree) {
        inner.begin(tree);
    }

    @Override
    public boolean step(SearchTree<S, M, P> tree) {
        return inner.step(tree);
    }

    @Override
    public void expand(SearchTree<S, M, P> tree) {
        begin(tree);
        step(tree);
    }
}
