package edu.uw.cse.typegraph.graph;

import edu.uw.cse.typegraph.solver.Solver;

import java.util.*;

/**
 * A node in the control flow graph of a Program.
 *
 * Besides its edges, every node carries the set of node ids that can reach it
 * (itself included). {@link Program#connect} keeps that set transitively closed,
 * so forward reachability is a single bit lookup.
 */
public class CfgNode {
    private final Program program;
    private final int id;
    private final String name;
    private final List<CfgNode> incoming = new ArrayList<>();
    private final List<CfgNode> outgoing = new ArrayList<>();
    private final Set<Binding> bindings = new LinkedHashSet<>();
    private Binding condition;
    final BitSet reachableSubset = new BitSet();

    // assigned once by GraphCompressor at freeze
    private Supernode supernode;
    private int position;

    CfgNode(Program program, int id, String name) {
        this.program = Objects.requireNonNull(program);
        this.id = id;
        this.name = name;
        reachableSubset.set(id);
    }

    public Program getProgram() {
        return program;
    }

    public int getId() {
        return id;
    }

    /** The user-facing name, or null when none was given. */
    public String getName() {
        return name;
    }

    public List<CfgNode> getIncoming() {
        return Collections.unmodifiableList(incoming);
    }

    public List<CfgNode> getOutgoing() {
        return Collections.unmodifiableList(outgoing);
    }

    /** Bindings that have an Origin at this node. */
    public Set<Binding> getBindings() {
        return Collections.unmodifiableSet(bindings);
    }

    /** The binding that must hold for execution to pass this node, or null. */
    public Binding getCondition() {
        return condition;
    }

    /** Replace the branch condition; null removes it. */
    public void setCondition(Binding condition) {
        program.checkMutable("set a node condition");
        if (condition != null) program.checkOwned(condition);
        this.condition = condition;
    }

    public CfgNode connectNew(String name) {
        return program.connectNew(this, name);
    }

    public CfgNode connectNew(String name, Binding condition) {
        return program.connectNew(this, name, condition);
    }

    public void connectTo(CfgNode node) {
        program.connect(this, node);
    }

    /**
     * True if {@code node} can reach this node along forward edges.
     * Every node reaches itself.
     */
    public boolean isReachableFrom(CfgNode node) {
        return reachableSubset.get(node.id);
    }

    /** A copy of the ids of all nodes that can reach this one. */
    public BitSet getReachableSubset() {
        return (BitSet) reachableSubset.clone();
    }

    public Supernode getSupernode() {
        return supernode;
    }

    /** Index of this node inside its supernode chain, 0 for the head. */
    public int getPosition() {
        return position;
    }

    /**
     * Quick necessary condition for {@link #hasCombination}: every goal has an
     * Origin at a node that can reach this one. Ignores blocking, so a true
     * answer does not mean the combination is actually possible.
     */
    public boolean canHaveCombination(Collection<Binding> goals) {
        for (Binding goal : goals) {
            boolean reachable = false;
            for (Origin origin : goal.getOrigins()) {
                if (isReachableFrom(origin.getWhere())) {
                    reachable = true;
                    break;
                }
            }
            if (!reachable) return false;
        }
        return true;
    }

    /**
     * Whether all goals can be simultaneously visible at this node.
     * Requires the Program to be frozen.
     */
    public boolean hasCombination(Collection<Binding> goals) {
        Solver solver = program.getSolver();
        return solver.hasCombination(goals, this);
    }

    /** Display label in the form {@code <id>name}. */
    public String label() {
        return "<" + id + ">" + (name != null ? name : "");
    }

    boolean addOutgoing(CfgNode node) {
        if (outgoing.contains(node)) return false;
        outgoing.add(node);
        node.incoming.add(this);
        return true;
    }

    /** Returns true if the subset grew. */
    boolean absorbReachable(BitSet other) {
        int before = reachableSubset.cardinality();
        reachableSubset.or(other);
        return reachableSubset.cardinality() != before;
    }

    void registerBinding(Binding binding) {
        bindings.add(binding);
    }

    void assignSupernode(Supernode supernode, int position) {
        this.supernode = supernode;
        this.position = position;
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return label();
    }
}
