package ai.gametree.search;

/**
 * Outcome of routing a node through {@link TranspositionTable#addOrMerge(SearchNode)}.
 */
public enum InsertResult {
    /** The key was new; the node itself is now resident. */
    INSERTED,

    /** The key was already known; the incoming node was folded into the resident one. */
    MERGED
}
