package ai.gametree.search.expansion;

import ai.gametree.game.InvalidStateException;
import ai.gametree.search.SearchNode;
import ai.gametree.search.SearchTree;
import ai.gametree.search.TranspositionTable;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Breadth-first expansion of a fixed number of plies below the live position.
 *
 * <p>Every decision starts a new sweep: layer 0 is the current node, and each step expands every
 * node of the current layer (if needed) and makes the successors not yet seen in this sweep the
 * next layer. The sweep ends after {@code searchDepth} layers or as soon as a layer brings
 * nothing new.
 *
 * <p>Unlike iterative deepening there is no growing depth limit; the full sweep is paid again on
 * every move, although layers already expanded by an earlier sweep only cost a lookup.
 */
public class ForwardSweepExpansion<S, M, P> implements ExpansionControl<S, M, P> {

    private static final Logger log = LoggerFactory.getLogger(ForwardSweepExpansion.class);

    private final int searchDepth;

    private int layer;
    private Set<String> currentLayer = new LinkedHashSet<>();
    private Set<String> knownKeys = new HashSet<>();

    /**
     * @param searchDepth number of plies to sweep, at least 1
     * @throws InvalidStateException if {@code searchDepth} is not positive
     */
    public ForwardSweepExpansion(int searchDepth) {
        if (searchDepth <= 0) {
            throw new InvalidStateException("Search depth must be at least 1, got " + searchDepth);
        }
        this.searchDepth = searchDepth;
    }

    @Override
    public void begin(SearchTree<S, M, P> tree) {
        String root = tree.getCurrent().getNodeKey();
        layer = 0;
        currentLayer = new LinkedHashSet<>();
        currentLayer.add(root);
        knownKeys = new HashSet<>();
        knownKeys.add(root);
    }

    /**
     * Expands the current layer and advances to the next one.
     *
     * @return true if the next layer is non-empty and still within the configured depth
     */
    @Override
    public boolean step(SearchTree<S, M, P> tree) {
        if (layer >= searchDepth) {
            return false;
        }
        TranspositionTable<S, M, P> table = tree.getTable();
        Set<String> nextLayer = new LinkedHashSet<>();
        for (String key : currentLayer) {
            SearchNode<S, M, P> node = table.get(key);
            if (node == null) {
                continue;
            }
            if (!node.isExpanded()) {
                tree.expandNode(node);
            }
            for (String successor : node.getSuccessors().values()) {
                if (knownKeys.add(successor)) {
                    nextLayer.add(successor);
                }
            }
        }
        layer++;
        currentLayer = nextLayer;
        return !nextLayer.isEmpty() && layer < searchDepth;
    }

    @Override
    public void expand(SearchTree<S, M, P> tree) {
        begin(tree);
        while (step(tree)) {
            // one layer per step
        }
        if (log.isDebugEnabled()) {
            log.debug("{} plies expanded, {} nodes in the tree", layer, tree.size());
        }
    }

    public int getSearchDepth() {
        return searchDepth;
    }

    /**
     * Returns how many layers the most recent sweep expanded.
     */
    public int getLayersExpanded() {
        return layer;
    }
}
