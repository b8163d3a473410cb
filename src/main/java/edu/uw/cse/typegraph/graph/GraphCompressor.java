package edu.uw.cse.typegraph.graph;

import java.util.*;

/**
 * Partitions a frozen CFG into supernode chains.
 *
 * Traversal is a depth-first walk from the entrypoint. A node extends its
 * predecessor's chain when it has exactly one incoming node, that predecessor
 * has exactly one outgoing node, and the predecessor is already placed.
 * Every other node starts a new chain at position 0, so the predecessors of
 * a chain head are always chain tails.
 */
public final class GraphCompressor {

    private GraphCompressor() {
    }

    /**
     * Assign every node reachable from {@code entrypoint} to a supernode.
     *
     * @return the supernodes, in creation order
     */
    public static List<Supernode> compress(CfgNode entrypoint, boolean debug) {
        List<Supernode> supernodes = new ArrayList<>();
        BitSet visited = new BitSet();
        Deque<CfgNode> stack = new ArrayDeque<>();
        stack.push(entrypoint);

        while (!stack.isEmpty()) {
            CfgNode node = stack.pop();
            if (visited.get(node.getId())) continue;
            visited.set(node.getId());

            CfgNode pred = node.getIncoming().size() == 1 ? node.getIncoming().get(0) : null;
            if (pred != null && pred != node && pred.getSupernode() != null
                    && pred.getOutgoing().size() == 1
                    && pred.getSupernode().getTail() == pred) {
                Supernode chain = pred.getSupernode();
                node.assignSupernode(chain, chain.append(node));
            } else {
                Supernode chain = new Supernode(supernodes.size());
                supernodes.add(chain);
                node.assignSupernode(chain, chain.append(node));
            }

            // push in reverse so successors are visited in insertion order
            List<CfgNode> successors = node.getOutgoing();
            for (int i = successors.size() - 1; i >= 0; i--) {
                if (!visited.get(successors.get(i).getId())) {
                    stack.push(successors.get(i));
                }
            }
        }

        if (debug) {
            int compressed = 0;
            for (Supernode s : supernodes) {
                if (s.size() > 1) compressed++;
            }
            System.out.println("Debug== [compress] " + visited.cardinality() + " nodes -> "
                + supernodes.size() + " supernodes (" + compressed + " chains longer than one)");
        }
        return supernodes;
    }
}
