package edu.uw.cse.typegraph.graph;

import java.util.*;

/**
 * Answers "can {@code finish} be reached walking backwards from {@code start}
 * without passing through a blocked node".
 *
 * The finish node is always traversable, even if it is in the blocked set.
 * The start node counts as blocked unless it is also the finish.
 *
 * With compression on, the search walks supernode chains segment by segment
 * and consults a per-blocked-set index of blocked positions instead of
 * visiting every node. Answers are memoized per (start, finish, blocked).
 * Callers must not mutate a blocked set after passing it in.
 */
public class Reachability {
    private final boolean compressed;
    private final boolean verify;
    private final Map<PathQuery, Boolean> queryCache = new HashMap<>();
    private final Map<Set<CfgNode>, BlockedIndex> blockedIndexCache = new HashMap<>();
    private final Map<PathQuery, CfgNode> stopCache = new HashMap<>();
    private long queries;
    private long cacheHits;

    public Reachability(boolean compressed, boolean verify) {
        this.compressed = compressed;
        this.verify = verify;
    }

    public boolean canReachBackwards(CfgNode start, CfgNode finish, Set<CfgNode> blocked) {
        queries++;
        PathQuery key = new PathQuery(start, finish, blocked);
        Boolean cached = queryCache.get(key);
        if (cached != null) {
            cacheHits++;
            return cached;
        }

        boolean result = compressed
            ? findWithSupernodes(start, finish, blocked)
            : findPlain(start, finish, blocked);
        if (verify) {
            boolean plain = findPlain(start, finish, blocked);
            if (plain != result) {
                throw new IllegalStateException("Compressed reachability disagrees with plain search: "
                    + start + " -> " + finish + " blocked " + blocked
                    + " (compressed=" + result + ", plain=" + plain + ")");
            }
        }
        queryCache.put(key, result);
        return result;
    }

    /**
     * Where a backward search from {@code start} has to stop on its way to
     * {@code finish}: the first node after {@code start} that carries a
     * condition and lies on every path between the two, or {@code finish}
     * when there is none. Only valid when
     * {@link #canReachBackwards canReachBackwards} holds for the same query.
     */
    public CfgNode nextStop(CfgNode start, CfgNode finish, Set<CfgNode> blocked) {
        PathQuery key = new PathQuery(start, finish, blocked);
        CfgNode cached = stopCache.get(key);
        if (cached != null) return cached;

        List<CfgNode> path = shortestPath(start, finish, blocked);
        if (path == null) {
            throw new IllegalArgumentException("No path from " + start + " back to " + finish);
        }
        // every node on all paths is on the shortest one. Walk it, jumping each
        // time to the furthest path node reachable without using the path.
        Set<CfgNode> seen = new HashSet<>(blocked);
        seen.addAll(path);
        Map<CfgNode, Integer> weights = new HashMap<>();
        for (int i = 0; i < path.size(); i++) {
            weights.put(path.get(i), i);
        }
        CfgNode node = start;
        CfgNode stop;
        while (true) {
            if (node != start && node.getCondition() != null) {
                stop = node;
                break;
            }
            if (node == finish) {
                stop = finish;
                break;
            }
            node = highestReachableWeight(node, seen, weights);
        }
        stopCache.put(key, stop);
        return stop;
    }

    /** Backward BFS path as [start, ..., finish], or null. Blocking as in {@link #findPlain}. */
    private static List<CfgNode> shortestPath(CfgNode start, CfgNode finish, Set<CfgNode> blocked) {
        Map<CfgNode, CfgNode> previous = new HashMap<>();
        Set<CfgNode> seen = new HashSet<>();
        Deque<CfgNode> queue = new ArrayDeque<>();
        previous.put(start, null);
        queue.add(start);
        boolean found = false;
        while (!queue.isEmpty()) {
            CfgNode node = queue.poll();
            if (node == finish) {
                found = true;
                break;
            }
            if (!seen.add(node) || blocked.contains(node)) continue;
            for (CfgNode pred : node.getIncoming()) {
                if (!previous.containsKey(pred)) {
                    previous.put(pred, node);
                    queue.add(pred);
                }
            }
        }
        if (!found) return null;
        LinkedList<CfgNode> path = new LinkedList<>();
        for (CfgNode node = finish; node != null; node = previous.get(node)) {
            path.addFirst(node);
        }
        return path;
    }

    /**
     * The path node with the highest weight reachable backwards from
     * {@code from} without traversing {@code seen}, which this call extends.
     */
    private static CfgNode highestReachableWeight(CfgNode from, Set<CfgNode> seen,
                                                  Map<CfgNode, Integer> weights) {
        Deque<CfgNode> stack = new ArrayDeque<>(from.getIncoming());
        int bestWeight = -1;
        CfgNode best = null;
        while (!stack.isEmpty()) {
            CfgNode node = stack.pop();
            if (node == from) continue;
            int weight = weights.getOrDefault(node, -1);
            if (weight > bestWeight) {
                bestWeight = weight;
                best = node;
            }
            if (!seen.add(node)) continue;
            for (CfgNode pred : node.getIncoming()) {
                stack.push(pred);
            }
        }
        return best;
    }

    public long getQueryCount() {
        return queries;
    }

    public long getCacheHits() {
        return cacheHits;
    }

    public int getCacheSize() {
        return queryCache.size();
    }

    /**
     * Node-level backward search. Used when compression is off and as the
     * reference answer when verification is on.
     */
    static boolean findPlain(CfgNode start, CfgNode finish, Set<CfgNode> blocked) {
        Deque<CfgNode> stack = new ArrayDeque<>();
        BitSet seen = new BitSet();
        stack.push(start);
        while (!stack.isEmpty()) {
            CfgNode node = stack.pop();
            if (node == finish) return true;
            if (seen.get(node.getId()) || blocked.contains(node)) continue;
            seen.set(node.getId());
            for (CfgNode pred : node.getIncoming()) {
                stack.push(pred);
            }
        }
        return false;
    }

    private boolean findWithSupernodes(CfgNode start, CfgNode finish, Set<CfgNode> blocked) {
        if (start == finish) return true;
        BlockedIndex index = blockedIndexCache.computeIfAbsent(blocked, BlockedIndex::new);
        Supernode target = finish.getSupernode();
        int finishPos = finish.getPosition();

        // same chain, finish below start: only the segment in between matters
        if (start.getSupernode() == target && finishPos <= start.getPosition()) {
            Integer b = index.highestBlockedAtOrBelow(target, start.getPosition());
            return b == null || b <= finishPos;
        }

        // highest position each chain has already been walked down from
        Map<Supernode, Integer> walked = new HashMap<>();
        Deque<CfgNode> entries = new ArrayDeque<>();
        entries.push(start);
        while (!entries.isEmpty()) {
            CfgNode entry = entries.pop();
            Supernode chain = entry.getSupernode();
            int top = entry.getPosition();
            Integer done = walked.get(chain);
            if (done != null && done >= top) continue;
            walked.put(chain, top);

            Integer b = index.highestBlockedAtOrBelow(chain, top);
            if (chain == target && finishPos <= top && (done == null || finishPos > done)) {
                if (b == null || b <= finishPos) return true;
                continue;
            }
            if (b != null && (done == null || b > done)) continue;
            // below here the chain was already explored
            if (done != null) continue;
            for (CfgNode pred : chain.getHead().getIncoming()) {
                entries.push(pred);
            }
        }
        return false;
    }

    private record PathQuery(CfgNode start, CfgNode finish, Set<CfgNode> blocked) {
    }

    /** Sorted blocked positions per supernode, for one blocked set. */
    private static final class BlockedIndex {
        private final Map<Supernode, TreeSet<Integer>> positions = new HashMap<>();

        BlockedIndex(Set<CfgNode> blocked) {
            for (CfgNode node : blocked) {
                if (node.getSupernode() == null) continue;
                positions.computeIfAbsent(node.getSupernode(), s -> new TreeSet<>())
                         .add(node.getPosition());
            }
        }

        Integer highestBlockedAtOrBelow(Supernode chain, int position) {
            TreeSet<Integer> set = positions.get(chain);
            return set == null ? null : set.floor(position);
        }
    }
}
