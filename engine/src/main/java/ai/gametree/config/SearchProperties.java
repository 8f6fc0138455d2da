package ai.gametree.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Spring Boot configuration properties for the search driver.
 *
 * <p>Bound from {@code application.properties}, system properties or command-line arguments, e.g.
 * {@code java -jar engine.jar --search.expansion=FULL --search.selection=FIRST}.
 *
 * <p>Limits use 0 for "unlimited". Whenever a time or node limit is set the factory wraps the
 * stepping part of the chosen expansion in a budget; see {@link SearchDriverFactory}.
 */
@Component
@ConfigurationProperties(prefix = "search")
public class SearchProperties {

    /** How much expansion one decision gets. */
    public enum Expansion {
        /** One step of {@link #getStrategy() the strategy} per decision. */
        SINGLE_STEP,
        /** Repeat the strategy until the whole reachable tree is expanded. */
        FULL,
        /** Layered sweep {@link #getSearchDepth() searchDepth} plies below the live position. */
        FORWARD_SWEEP
    }

    /** What one expansion step covers. */
    public enum Strategy {
        CURRENT_NODE,
        ONE_STEP
    }

    /** How ties and randomness are handled when picking a move. */
    public enum Selection {
        FIRST,
        UNIFORM_RANDOM,
        RANDOM_BEST
    }

    private double timeLimit = 0;
    private int nodeLimit = 100;
    private int searchDepth = 5;
    private boolean debug = false;
    private Expansion expansion = Expansion.FORWARD_SWEEP;
    private Strategy strategy = Strategy.ONE_STEP;
    private Selection selection = Selection.RANDOM_BEST;
    private boolean pruning = true;
    private Long seed;

    /**
     * Returns the wall-clock budget per decision in seconds; 0 means unlimited.
     */
    public double getTimeLimit() {
        return timeLimit;
    }

    public void setTimeLimit(double timeLimit) {
        this.timeLimit = timeLimit;
    }

    /**
     * Returns the table size at which expansion stops; 0 means unlimited.
     */
    public int getNodeLimit() {
        return nodeLimit;
    }

    public void setNodeLimit(int nodeLimit) {
        this.nodeLimit = nodeLimit;
    }

    /**
     * Returns the ply depth of a forward sweep; must be at least 1 in that mode.
     */
    public int getSearchDepth() {
        return searchDepth;
    }

    public void setSearchDepth(int searchDepth) {
        this.searchDepth = searchDepth;
    }

    /**
     * Returns whether every move is reported with the board and the tree size.
     */
    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    public Expansion getExpansion() {
        return expansion;
    }

    public void setExpansion(Expansion expansion) {
        this.expansion = expansion;
    }

    public Strategy getStrategy() {
        return strategy;
    }

    public void setStrategy(Strategy strategy) {
        this.strategy = strategy;
    }

    public Selection getSelection() {
        return selection;
    }

    public void setSelection(Selection selection) {
        this.selection = selection;
    }

    /**
     * Returns whether unreachable nodes are dropped after every move.
     */
    public boolean isPruning() {
        return pruning;
    }

    public void setPruning(boolean pruning) {
        this.pruning = pruning;
    }

    /**
     * Returns the seed for random move selection, or {@code null} for an unseeded generator.
     */
    public Long getSeed() {
        return seed;
    }

    public void setSeed(Long seed) {
        this.seed = seed;
    }

    /**
     * Returns whether any budget is configured.
     */
    public boolean isBounded() {
        return timeLimit > 0 || nodeLimit > 0;
    }
}
