package ai.gametree.config;

import ai.gametree.SearchReporter;
import ai.gametree.game.GameAdapter;
import ai.gametree.player.SearchDriver;
import ai.gametree.search.expansion.BoundedExpansion;
import ai.gametree.search.expansion.CurrentNodeExpansion;
import ai.gametree.search.expansion.ExpansionControl;
import ai.gametree.search.expansion.ExpansionStrategy;
import ai.gametree.search.expansion.ForwardSweepExpansion;
import ai.gametree.search.expansion.FullExpansion;
import ai.gametree.search.expansion.OneStepExpansion;
import ai.gametree.search.expansion.SingleStepExpansion;
import ai.gametree.search.pruning.NoPruning;
import ai.gametree.search.pruning.PruningPolicy;
import ai.gametree.search.pruning.ReachabilityPruning;
import ai.gametree.search.selection.FirstBestMoveSelector;
import ai.gametree.search.selection.MoveSelector;
import ai.gametree.search.selection.RandomBestMoveSelector;
import ai.gametree.search.selection.UniformRandomMoveSelector;
import java.util.Random;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Builds {@link SearchDriver}s from {@link SearchProperties}.
 *
 * <p>Budgets go directly around the unit that steps, so they are actually honored:
 * <ul>
 *   <li>{@code SINGLE_STEP}: exactly one step of the (bounded) strategy per decision.</li>
 *   <li>{@code FULL}: full expansion of a bounded strategy.</li>
 *   <li>{@code FORWARD_SWEEP}: bounded sweep.</li>
 * </ul>
 */
@Component
public class SearchDriverFactory {

    private static final Logger log = LoggerFactory.getLogger(SearchDriverFactory.class);

    private final SearchProperties properties;

    public SearchDriverFactory(SearchProperties properties) {
        this.properties = properties;
    }

    /**
     * Creates a driver for a fresh game of {@code adapter}.
     */
    public <S, M, P> SearchDriver<S, M, P> create(GameAdapter<S, M, P> adapter) {
        ExpansionControl<S, M, P> expansion = expansion();
        if (log.isDebugEnabled()) {
            log.debug("Search setup: expansion={}, strategy={}, selection={}, pruning={}, "
                            + "timeLimit={}s, nodeLimit={}, depth={}",
                    properties.getExpansion(), properties.getStrategy(), properties.getSelection(),
                    properties.isPruning(), properties.getTimeLimit(), properties.getNodeLimit(),
                    properties.getSearchDepth());
        }
        return SearchDriver.builder(adapter)
                .expansion(expansion)
                .pruning(this.<S, M, P>pruning())
                .selector(this.<S, M, P>selector())
                .reporter(new SearchReporter(properties.isDebug()))
                .build();
    }

    <S, M, P> ExpansionControl<S, M, P> expansion() {
        switch (properties.getExpansion()) {
            case FULL:
                return new FullExpansion<>(bounded(this.<S, M, P>strategy()));
            case FORWARD_SWEEP:
                ForwardSweepExpansion<S, M, P> sweep = new ForwardSweepExpansion<>(properties.getSearchDepth());
                return properties.isBounded() ? boundedControl(sweep) : sweep;
            case SINGLE_STEP:
            default:
                return new SingleStepExpansion<>(bounded(this.<S, M, P>strategy()));
        }
    }

    private <S, M, P> ExpansionStrategy<S, M, P> strategy() {
        if (properties.getStrategy() == SearchProperties.Strategy.CURRENT_NODE) {
            return new CurrentNodeExpansion<>();
        }
        return new OneStepExpansion<>();
    }

    private <S, M, P> ExpansionStrategy<S, M, P> bounded(ExpansionStrategy<S, M, P> inner) {
        return properties.isBounded() ? boundedControl(inner) : inner;
    }

    private <S, M, P> BoundedExpansion<S, M, P> boundedControl(ExpansionStrategy<S, M, P> inner) {
        return new BoundedExpansion<>(inner, properties.getTimeLimit(), properties.getNodeLimit());
    }

    private <S, M, P> PruningPolicy<S, M, P> pruning() {
        return properties.isPruning() ? new ReachabilityPruning<>() : new NoPruning<>();
    }

    private <S, M, P> MoveSelector<S, M, P> selector() {
        switch (properties.getSelection()) {
            case FIRST:
                return new FirstBestMoveSelector<>();
            case UNIFORM_RANDOM:
                return new UniformRandomMoveSelector<>(random());
            case RANDOM_BEST:
            default:
                return new RandomBestMoveSelector<>(random());
        }
    }

    private Random random() {
        return properties.getSeed() == null ? new Random() : new Random(properties.getSeed());
    }
}
