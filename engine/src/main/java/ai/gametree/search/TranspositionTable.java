package ai.gametree.search;

import ai.gametree.search.scoring.Scorer;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Owner of every {@link SearchNode} in one game session, indexed by canonical key.
 *
 * <p><b>Invariants:</b>
 * <ul>
 *   <li>At most one node per key. Nodes only enter through {@link #addOrMerge(SearchNode)}, which
 *       merges a node for a known key into the resident one instead of inserting it.</li>
 *   <li>Nodes refer to each other by key only. The table additionally keeps the reverse relation
 *       ({@code key -> predecessor keys}) so that a changed score can be pushed up to every node
 *       that reaches it, whichever path first discovered it.</li>
 *   <li>Scores are kept current eagerly: inserting, merging or expanding a node rescores it, and a
 *       rescore that changes a value rescores the node's predecessors in turn.</li>
 * </ul>
 *
 * @param <S> game state type
 * @param <M> move type
 * @param <P> player identifier type
 */
public class TranspositionTable<S, M, P> {

    private static final Logger log = LoggerFactory.getLogger(TranspositionTable.class);

    /** Insertion-ordered so sweeps over the table are reproducible. */
    private final Map<String, SearchNode<S, M, P>> nodes = new LinkedHashMap<>();

    /** Reverse successor relation, by key. Never ownership. */
    private final Map<String, Set<String>> predecessors = new HashMap<>();

    private final Scorer<S, M, P> scorer;

    public TranspositionTable(Scorer<S, M, P> scorer) {
        this.scorer = Objects.requireNonNull(scorer, "scorer");
    }

    /**
     * Registers a node, or folds it into the resident node with the same key.
     *
     * <p>This is the only way into the table. A merged node that turns out to know successors the
     * table has never seen causes those successors to be created and registered as well.
     *
     * @param node the node to register
     * @return {@link InsertResult#INSERTED} for a new key, {@link InsertResult#MERGED} otherwise
     */
    public InsertResult addOrMerge(SearchNode<S, M, P> node) {
        String key = node.getNodeKey();
        SearchNode<S, M, P> resident = nodes.get(key);
        if (resident == null) {
            nodes.put(key, node);
            registerKnownSuccessors(node);
            rescore(key);
            return InsertResult.INSERTED;
        }
        if (resident.merge(node)) {
            if (log.isTraceEnabled()) {
                log.trace("Merged new information into {}", key);
            }
            registerKnownSuccessors(resident);
            rescore(key);
        }
        return InsertResult.MERGED;
    }

    /**
     * Registers freshly produced successors of an expanded node, links them to it and rescores it.
     *
     * @param parent   a resident node that has just been expanded
     * @param produced the nodes returned by {@link SearchNode#expand()}
     * @return how many of the successors were new to the table
     */
    int registerExpansion(SearchNode<S, M, P> parent, Map<M, SearchNode<S, M, P>> produced) {
        int inserted = 0;
        for (SearchNode<S, M, P> child : produced.values()) {
            if (addOrMerge(child) == InsertResult.INSERTED) {
                inserted++;
            }
            link(parent.getNodeKey(), child.getNodeKey());
        }
        rescore(parent.getNodeKey());
        return inserted;
    }

    /**
     * Records that {@code childKey} is a successor of {@code parentKey}.
     */
    public void link(String parentKey, String childKey) {
        predecessors.computeIfAbsent(childKey, k -> new HashSet<>()).add(parentKey);
    }

    /**
     * Returns the resident keys known to lead to {@code key}.
     */
    public Set<String> predecessorsOf(String key) {
        Set<String> known = predecessors.get(key);
        return known == null ? Collections.emptySet() : Collections.unmodifiableSet(known);
    }

    /**
     * Recomputes a node's score and propagates any change to its predecessors until values settle.
     *
     * @param key the node to start from; ignored if not resident
     */
    public void rescore(String key) {
        Deque<String> pending = new ArrayDeque<>();
        pending.add(key);
        while (!pending.isEmpty()) {
            String current = pending.poll();
            SearchNode<S, M, P> node = nodes.get(current);
            if (node == null) {
                continue;
            }
            if (node.updateScore(scorer.score(node, this).orElse(null))) {
                pending.addAll(predecessorsOf(current));
            }
        }
    }

    /**
     * Returns the best moves of a node for its active player, computing them at most once between
     * rescores.
     *
     * @param node a resident, expanded node
     * @return the best moves in adapter order
     */
    public List<M> bestMoves(SearchNode<S, M, P> node) {
        List<M> cached = node.getCachedBestMoves();
        if (cached == null) {
            node.cacheBestMoves(scorer.bestMoves(node, this));
            cached = node.getCachedBestMoves();
        }
        return cached;
    }

    /**
     * Deletes every node that cannot be reached from {@code rootKey} along successor edges.
     *
     * <p>Only forward reachability is known, so anything reachable solely through positions that
     * lie behind the root is forgotten and will be rebuilt if it shows up again.
     *
     * @param rootKey the key to keep everything reachable from
     * @return the number of nodes removed
     */
    public int retainReachableFrom(String rootKey) {
        Set<String> reachable = new HashSet<>();
        Deque<String> frontier = new ArrayDeque<>();
        if (nodes.containsKey(rootKey)) {
            frontier.add(rootKey);
            reachable.add(rootKey);
        }
        while (!frontier.isEmpty()) {
            SearchNode<S, M, P> node = nodes.get(frontier.poll());
            for (String successor : node.getSuccessors().values()) {
                if (nodes.containsKey(successor) && reachable.add(successor)) {
                    frontier.add(successor);
                }
            }
        }

        int before = nodes.size();
        nodes.keySet().retainAll(reachable);
        predecessors.keySet().retainAll(reachable);
        for (Set<String> known : predecessors.values()) {
            known.retainAll(reachable);
        }
        return before - nodes.size();
    }

    /**
     * Returns the resident node for a key.
     *
     * @param key a canonical key
     * @return the node, or {@code null} if the key is not resident
     */
    public SearchNode<S, M, P> get(String key) {
        return nodes.get(key);
    }

    public boolean contains(String key) {
        return nodes.containsKey(key);
    }

    public int size() {
        return nodes.size();
    }

    /**
     * Returns a read-only view of every resident node, in insertion order.
     */
    public Collection<SearchNode<S, M, P>> nodes() {
        return Collections.unmodifiableCollection(nodes.values());
    }

    /**
     * Returns a snapshot of the resident nodes that are not expanded yet.
     */
    public List<SearchNode<S, M, P>> unexpandedNodes() {
        List<SearchNode<S, M, P>> unexpanded = new ArrayList<>();
        for (SearchNode<S, M, P> node : nodes.values()) {
            if (!node.isExpanded()) {
                unexpanded.add(node);
            }
        }
        return unexpanded;
    }

    public boolean hasUnexpandedNodes() {
        for (SearchNode<S, M, P> node : nodes.values()) {
            if (!node.isExpanded()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Makes sure every successor a node knows by key is resident and linked back to it.
     */
    private void registerKnownSuccessors(SearchNode<S, M, P> node) {
        for (Map.Entry<M, String> entry : node.getSuccessors().entrySet()) {
            if (!nodes.containsKey(entry.getValue())) {
                addOrMerge(node.successorNode(entry.getKey()));
            }
            link(node.getNodeKey(), entry.getValue());
        }
    }
}
