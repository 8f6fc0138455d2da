package ai.gametree;

import ai.gametree.search.SearchNode;
import ai.gametree.search.SearchTree;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-move diagnostics for a running game: the board, the tree size and the current score.
 *
 * <p>With {@code debug} enabled every report is written at INFO so it shows up with the default
 * logging setup; otherwise the same lines go to DEBUG. Each report is a rendered board followed by
 * one structured line prefixed with {@code SEARCH_STEP} so tools can filter it out of mixed logs.
 */
public class SearchReporter {

    private static final Logger log = LoggerFactory.getLogger(SearchReporter.class);

    private final boolean debug;

    public SearchReporter(boolean debug) {
        this.debug = debug;
    }

    public boolean isDebug() {
        return debug;
    }

    /**
     * Reports the live position of a tree.
     *
     * @param tree      the tree to describe
     * @param ply       number of moves played so far
     * @param lastMove  the move that led here, or {@code null} at the start
     */
    public <S, M, P> void reportPosition(SearchTree<S, M, P> tree, int ply, M lastMove) {
        if (!debug && !log.isDebugEnabled()) {
            return;
        }
        SearchNode<S, M, P> current = tree.getCurrent();
        String board = tree.getAdapter().render(current.getState());
        String line = stepLine(current, tree.size(), ply, lastMove);
        if (debug) {
            log.info("\n{}", board);
            log.info("SEARCH_STEP {}", line);
        } else {
            log.debug("\n{}", board);
            log.debug("SEARCH_STEP {}", line);
        }
    }

    /**
     * Reports the table size before and after pruning.
     */
    public void reportPruning(int postMoveSize, int removed, int remaining) {
        if (debug) {
            log.info("Search tree size: {} (after move) - {} (pruned) = {}", postMoveSize, removed, remaining);
        } else if (log.isDebugEnabled()) {
            log.debug("Search tree size: {} (after move) - {} (pruned) = {}", postMoveSize, removed, remaining);
        }
    }

    private <S, M, P> String stepLine(SearchNode<S, M, P> node, int treeSize, int ply, M lastMove) {
        StringBuilder sb = new StringBuilder();
        sb.append("{\"ply\":").append(ply);
        sb.append(",\"key\":\"").append(node.getNodeKey()).append('"');
        sb.append(",\"tree_size\":").append(treeSize);
        if (lastMove != null) {
            sb.append(",\"move\":\"").append(lastMove).append('"');
        }
        sb.append(",\"expanded\":").append(node.isExpanded());
        sb.append(",\"score\":");
        if (node.getScore().isPresent()) {
            sb.append('{');
            boolean first = true;
            for (Map.Entry<P, Double> entry : node.getScore().get().entrySet()) {
                if (!first) {
                    sb.append(',');
                }
                sb.append('"').append(entry.getKey()).append("\":").append(entry.getValue());
                first = false;
            }
            sb.append('}');
        } else {
            sb.append("null");
        }
        sb.append('}');
        return sb.toString();
    }
}
