package edu.uw.cse.typegraph.graph;

import java.util.*;

/**
 * A maximal chain of CFG nodes n0 -> n1 -> ... -> nk where every node after
 * the head has exactly one incoming edge, coming from its chain predecessor,
 * and every node before the tail has exactly one outgoing edge.
 */
public final class Supernode {
    private final int id;
    private final List<CfgNode> nodes = new ArrayList<>();

    Supernode(int id) {
        this.id = id;
    }

    public int getId() {
        return id;
    }

    public CfgNode getHead() {
        return nodes.get(0);
    }

    public CfgNode getTail() {
        return nodes.get(nodes.size() - 1);
    }

    public CfgNode get(int position) {
        return nodes.get(position);
    }

    public List<CfgNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int size() {
        return nodes.size();
    }

    /** Appends a node and returns its position in the chain. */
    int append(CfgNode node) {
        nodes.add(node);
        return nodes.size() - 1;
    }

    @Override
    public String toString() {
        return "S" + id + nodes;
    }
}
