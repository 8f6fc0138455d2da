package ai.gametree.search.expansion;

import ai.gametree.search.SearchTree;

/**
 * Stopping policy wrapped around an {@link ExpansionStrategy}: decides how much expansion one
 * decision gets.
 *
 * <p>Controls are strategies themselves, so they stack as decorators. The order matters. A
 * {@link BoundedExpansion} wrapped <em>inside</em> a {@link FullExpansion} stops it when the
 * budget runs out; a {@link FullExpansion} wrapped inside a {@link BoundedExpansion} runs to
 * its own fixed point within a single step and makes the bound useless.
 *
 * @param <S> game state type
 * @param <M> move type
 * @param <P> player identifier type
 */
public interface ExpansionControl<S, M, P> extends ExpansionStrategy<S, M, P> {

    /**
     * Runs all expansion for one decision.
     *
     * @param tree the tree to grow
     */
    void expand(SearchTree<S, M, P> tree);
}
