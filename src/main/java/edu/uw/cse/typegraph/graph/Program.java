package edu.uw.cse.typegraph.graph;

import edu.uw.cse.typegraph.EngineConfig;
import edu.uw.cse.typegraph.solver.Explainer;
import edu.uw.cse.typegraph.solver.Explanation;
import edu.uw.cse.typegraph.solver.Solver;
import edu.uw.cse.typegraph.solver.SolverMetrics;

import java.util.*;

/**
 * Owns the CFG, all Variables and Bindings, and, once frozen, the Solver.
 *
 * A Program is built in two phases. While mutable, nodes, edges, variables,
 * bindings and origins may be added. {@link #freeze} then fixes the graph,
 * compresses it and creates the Solver; any later mutation throws.
 */
public class Program {
    private final EngineConfig config;
    private final List<CfgNode> nodes = new ArrayList<>();
    private final List<Variable> variables = new ArrayList<>();
    private int nextBindingId;
    private Object overflowData = new Overflow();

    private boolean frozen;
    private CfgNode entrypoint;
    private List<Supernode> supernodes = List.of();
    private Solver solver;

    public Program() {
        this(EngineConfig.defaults());
    }

    public Program(EngineConfig config) {
        this.config = Objects.requireNonNull(config);
    }

    public EngineConfig getConfig() {
        return config;
    }

    public CfgNode newNode() {
        return newNode(null);
    }

    public CfgNode newNode(String name) {
        return newNode(name, null);
    }

    /**
     * A node whose branch is only taken when {@code condition} holds. The
     * solver adds the condition to its goals whenever it passes the node.
     */
    public CfgNode newNode(String name, Binding condition) {
        checkMutable("add a node");
        CfgNode node = new CfgNode(this, nodes.size(), name);
        if (condition != null) node.setCondition(condition);
        nodes.add(node);
        return node;
    }

    public CfgNode connectNew(CfgNode from, String name) {
        return connectNew(from, name, null);
    }

    public CfgNode connectNew(CfgNode from, String name, Binding condition) {
        CfgNode node = newNode(name, condition);
        connect(from, node);
        return node;
    }

    /**
     * Add the edge {@code from -> to}. Duplicate edges are ignored.
     * The reachable subsets of {@code to} and everything after it are updated.
     */
    public void connect(CfgNode from, CfgNode to) {
        checkMutable("connect nodes");
        checkOwned(from);
        checkOwned(to);
        if (!from.addOutgoing(to)) return;

        Deque<CfgNode> worklist = new ArrayDeque<>();
        if (to.absorbReachable(from.reachableSubset)) worklist.push(to);
        while (!worklist.isEmpty()) {
            CfgNode node = worklist.pop();
            for (CfgNode succ : node.getOutgoing()) {
                if (succ.absorbReachable(node.reachableSubset)) worklist.push(succ);
            }
        }
    }

    /** Forward reachability: can execution flow from {@code src} to {@code dst}. */
    public boolean isReachable(CfgNode src, CfgNode dst) {
        checkOwned(src);
        checkOwned(dst);
        return dst.isReachableFrom(src);
    }

    public Variable newVariable() {
        return newVariable(null);
    }

    public Variable newVariable(String name) {
        checkMutable("add a variable");
        Variable variable = new Variable(this, variables.size(), name);
        variables.add(variable);
        return variable;
    }

    /**
     * Create a variable whose payloads all share one Origin at {@code where},
     * justified by {@code sourceSet}.
     */
    public Variable newVariable(String name, Collection<?> data,
                                Collection<Binding> sourceSet, CfgNode where) {
        if (!data.isEmpty() && (sourceSet == null || where == null)) {
            throw new IllegalArgumentException(
                "Initial data requires both a source set and a node");
        }
        Variable variable = newVariable(name);
        for (Object payload : data) {
            variable.addBinding(payload, sourceSet, where);
        }
        return variable;
    }

    /**
     * Fix the graph with {@code entrypoint} as its root. Every node must be
     * reachable from the entrypoint. Runs compression when enabled and
     * creates the Solver.
     */
    public void freeze(CfgNode entrypoint) {
        Objects.requireNonNull(entrypoint, "entrypoint");
        if (frozen) {
            throw new IllegalStateException("Program is already frozen");
        }
        checkOwned(entrypoint);

        List<String> unreachable = new ArrayList<>();
        for (CfgNode node : nodes) {
            if (!node.isReachableFrom(entrypoint)) unreachable.add(node.label());
        }
        if (!unreachable.isEmpty()) {
            throw new IllegalStateException("Nodes not reachable from entrypoint "
                + entrypoint.label() + ": " + unreachable);
        }

        this.entrypoint = entrypoint;
        if (config.compress) {
            supernodes = Collections.unmodifiableList(GraphCompressor.compress(entrypoint, config.debug));
        }
        frozen = true;
        solver = new Solver(this);

        if (config.debug) {
            System.out.println("Debug== [program] frozen at " + entrypoint.label() + ": "
                + nodes.size() + " nodes, " + variables.size() + " variables, "
                + nextBindingId + " bindings");
        }
    }

    public boolean isFrozen() {
        return frozen;
    }

    public CfgNode getEntrypoint() {
        return entrypoint;
    }

    public Solver getSolver() {
        checkFrozen("solve");
        return solver;
    }

    /** Supernodes computed at freeze; empty when compression is off. */
    public List<Supernode> getSupernodes() {
        return supernodes;
    }

    public List<CfgNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public List<Variable> getVariables() {
        return Collections.unmodifiableList(variables);
    }

    public int getBindingCount() {
        return nextBindingId;
    }

    public Object getOverflowData() {
        return overflowData;
    }

    public void setOverflowData(Object overflowData) {
        if (overflowData instanceof Variable) {
            throw new IllegalArgumentException("Overflow data cannot be a Variable");
        }
        checkMutable("change the overflow data");
        this.overflowData = overflowData;
    }

    /** Runs a separate, recording search; the Program's own Solver is untouched. */
    public Explanation explain(Collection<Binding> goals, CfgNode at) {
        checkFrozen("explain");
        return new Explainer(this).explain(goals, at);
    }

    public ProgramMetrics calculateMetrics() {
        List<ProgramMetrics.NodeMetrics> nodeMetrics = new ArrayList<>();
        for (CfgNode node : nodes) {
            nodeMetrics.add(new ProgramMetrics.NodeMetrics(
                node.getIncoming().size(), node.getOutgoing().size(), node.getCondition() != null));
        }
        List<ProgramMetrics.VariableMetrics> variableMetrics = new ArrayList<>();
        for (Variable variable : variables) {
            List<Integer> nodeIds = new ArrayList<>();
            for (CfgNode node : variable.getNodes()) {
                nodeIds.add(node.getId());
            }
            variableMetrics.add(new ProgramMetrics.VariableMetrics(variable.size(), nodeIds));
        }
        SolverMetrics solverMetrics = frozen ? solver.calculateMetrics() : SolverMetrics.EMPTY;
        return new ProgramMetrics(nextBindingId, nodeMetrics, variableMetrics, solverMetrics);
    }

    /** True if any node carries a branch condition. */
    public boolean hasConditions() {
        for (CfgNode node : nodes) {
            if (node.getCondition() != null) return true;
        }
        return false;
    }

    int nextBindingId() {
        return nextBindingId++;
    }

    void checkMutable(String action) {
        if (frozen) {
            throw new IllegalStateException("Cannot " + action + ": program is frozen");
        }
    }

    private void checkFrozen(String action) {
        if (!frozen) {
            throw new IllegalStateException("Cannot " + action + " before the program is frozen");
        }
    }

    void checkOwned(CfgNode node) {
        if (node.getProgram() != this) {
            throw new IllegalArgumentException("Node " + node.label() + " belongs to another program");
        }
    }

    void checkOwned(Binding binding) {
        if (binding.getProgram() != this) {
            throw new IllegalArgumentException("Binding " + binding + " belongs to another program");
        }
    }

    private static final class Overflow {
        @Override
        public String toString() {
            return "<overflow>";
        }
    }
}
