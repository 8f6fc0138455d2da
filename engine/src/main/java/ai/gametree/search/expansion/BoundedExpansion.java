package ai.gametree.search.expansion;

import ai.gametree.game.InvalidStateException;
import ai.gametree.search.SearchTree;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the wrapped strategy until a time or node budget is used up.
 *
 * <p>Both budgets are looked at only after each wrapped step: the wall-clock time since
 * {@link #begin} and the number of resident nodes. A step that expands many nodes can therefore
 * overshoot the node budget by however much it produced, and a slow step overshoots the time
 * budget. Pair this with a fine-grained strategy when the cap has to be tight.
 *
 * <p>Without pruning, the table keeps growing across moves; once it holds more nodes than the
 * node budget every later decision gets exactly one step.
 */
public class BoundedExpansion<S, M, P> implements ExpansionControl<S, M, P> {

    private static final Logger log = LoggerFactory.getLogger(BoundedExpansion.class);

    private final ExpansionStrategy<S, M, P> inner;

    /** Seconds; 0 disables the time budget. */
    private final double timeLimitSeconds;

    /** Nodes; 0 disables the node budget. */
    private final int nodeLimit;

    private long startNanos;

    /**
     * @param inner            the strategy to run
     * @param timeLimitSeconds wall-clock budget per decision in seconds, 0 for unlimited
     * @param nodeLimit        table size at which to stop, 0 for unlimited
     * @throws InvalidStateException if a budget is negative
     */
    public BoundedExpansion(ExpansionStrategy<S, M, P> inner, double timeLimitSeconds, int nodeLimit) {
        if (timeLimitSeconds < 0 || nodeLimit < 0) {
            throw new InvalidStateException(
                    "Budgets must not be negative: time=" + timeLimitSeconds + ", nodes=" + nodeLimit);
        }
        this.inner = Objects.requireNonNull(inner, "inner");
        this.timeLimitSeconds = timeLimitSeconds;
        this.nodeLimit = nodeLimit;
        this.startNanos = System.nanoTime();
    }

    @Override
    public void begin(SearchTree<S, M, P> tree) {
        startNanos = System.nanoTime();
        inner.begin(tree);
    }

    @Override
    public boolean step(SearchTree<S, M, P> tree) {
        boolean expansionHappened = inner.step(tree);
        double elapsedSeconds = (System.nanoTime() - startNanos) / 1_000_000_000.0;

        boolean limitExceeded = false;
        if (nodeLimit > 0 && tree.size() >= nodeLimit) {
            limitExceeded = true;
        }
        if (timeLimitSeconds > 0 && elapsedSeconds >= timeLimitSeconds) {
            limitExceeded = true;
        }
        if (limitExceeded && log.isDebugEnabled()) {
            log.debug("Expansion budget reached: {} nodes, {} s elapsed", tree.size(),
                    String.format("%.3f", elapsedSeconds));
        }
        return expansionHappened && !limitExceeded;
    }

    @Override
    public void expand(SearchTree<S, M, P> tree) {
        begin(tree);
        while (step(tree)) {
            // keep stepping until the inner strategy runs dry or a budget is hit
        }
    }

    public double getTimeLimitSeconds() {
        return timeLimitSeconds;
    }

    public int getNodeLimit() {
        return nodeLimit;
    }
}
