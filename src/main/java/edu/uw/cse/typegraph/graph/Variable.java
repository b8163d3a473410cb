package edu.uw.cse.typegraph.graph;

import java.util.*;

/**
 * A named holder of Bindings, one per distinct payload.
 *
 * Payloads are compared by identity. Once a Variable reaches its cap, new
 * payloads are replaced by the Program's overflow data, so a Variable never
 * holds more than {@code maxVariableSize} bindings.
 */
public class Variable {
    private final Program program;
    private final int id;
    private final String name;
    private final List<Binding> bindings = new ArrayList<>();
    private final Map<Object, Binding> dataToBinding = new IdentityHashMap<>();
    private final Map<CfgNode, Set<Binding>> nodeToBindings = new LinkedHashMap<>();

    Variable(Program program, int id, String name) {
        this.program = program;
        this.id = id;
        this.name = name;
    }

    public Program getProgram() {
        return program;
    }

    public int getId() {
        return id;
    }

    public String getName() {
        return name != null ? name : "v" + id;
    }

    /** A snapshot of the current bindings; later additions are not reflected. */
    public List<Binding> getBindings() {
        return List.copyOf(bindings);
    }

    public int size() {
        return bindings.size();
    }

    /** Nodes at which this variable is assigned. */
    public Set<CfgNode> getNodes() {
        return Collections.unmodifiableSet(nodeToBindings.keySet());
    }

    public Set<Binding> getBindingsAt(CfgNode node) {
        Set<Binding> result = nodeToBindings.get(node);
        return result != null ? Collections.unmodifiableSet(result) : Set.of();
    }

    public List<Object> data() {
        return payloads(bindings);
    }

    /**
     * Find or create the binding for {@code data}. The binding has no origin
     * until one is added.
     */
    public Binding addBinding(Object data) {
        if (data instanceof Variable) {
            throw new IllegalArgumentException("A Variable cannot hold another Variable: " + data);
        }
        program.checkMutable("add a binding");
        if (bindings.size() >= program.getConfig().maxVariableSize - 1
                && !dataToBinding.containsKey(data)) {
            data = program.getOverflowData();
        }
        Binding binding = dataToBinding.get(data);
        if (binding == null) {
            binding = new Binding(program, this, data, program.nextBindingId());
            bindings.add(binding);
            dataToBinding.put(data, binding);
        }
        return binding;
    }

    public Binding addBinding(Object data, Collection<Binding> sourceSet, CfgNode where) {
        Objects.requireNonNull(sourceSet, "sourceSet");
        Objects.requireNonNull(where, "where");
        // taken before the binding exists, in case sourceSet is a view of this variable
        SourceSet sources = SourceSet.of(sourceSet);
        Binding binding = addBinding(data);
        binding.addOrigin(where, sources);
        return binding;
    }

    /**
     * Bindings whose assignment can still be the latest one when execution
     * arrives at {@code viewpoint}: some origin reaches it without passing
     * through another assignment to this variable. Ignores source conditions.
     * A null viewpoint returns every binding.
     */
    public List<Binding> bindingsReachable(CfgNode viewpoint) {
        if (viewpoint == null) return getBindings();

        if (nodeToBindings.size() == 1) {
            Map.Entry<CfgNode, Set<Binding>> only = nodeToBindings.entrySet().iterator().next();
            if (!viewpoint.isReachableFrom(only.getKey())) return List.of();
            List<Binding> result = new ArrayList<>();
            for (Binding b : bindings) {
                if (only.getValue().contains(b)) result.add(b);
            }
            return result;
        }
        if (bindings.size() == 1) {
            Binding single = bindings.get(0);
            for (Origin origin : single.getOrigins()) {
                if (viewpoint.isReachableFrom(origin.getWhere())) return List.of(single);
            }
            return List.of();
        }

        Set<Binding> found = new HashSet<>();
        BitSet seen = new BitSet();
        Deque<CfgNode> stack = new ArrayDeque<>();
        stack.push(viewpoint);
        while (!stack.isEmpty()) {
            CfgNode node = stack.pop();
            if (seen.get(node.getId())) continue;
            seen.set(node.getId());
            Set<Binding> assigned = nodeToBindings.get(node);
            if (assigned != null) {
                found.addAll(assigned);
                continue;
            }
            for (CfgNode pred : node.getIncoming()) {
                stack.push(pred);
            }
        }

        List<Binding> result = new ArrayList<>();
        for (Binding b : bindings) {
            if (found.contains(b)) result.add(b);
        }
        return result;
    }

    /** Bindings the solver proves visible at {@code viewpoint}; null returns every binding. */
    public List<Binding> bindingsVisible(CfgNode viewpoint) {
        if (viewpoint == null) return getBindings();
        List<Binding> result = new ArrayList<>();
        for (Binding b : bindings) {
            if (b.isVisible(viewpoint)) result.add(b);
        }
        return result;
    }

    public List<Object> reachableData(CfgNode viewpoint) {
        return payloads(bindingsReachable(viewpoint));
    }

    public List<Object> visibleData(CfgNode viewpoint) {
        return payloads(bindingsVisible(viewpoint));
    }

    /** Paste every binding of {@code other} into this variable. */
    public void pasteVariable(Variable other, CfgNode where, SourceSet additionalSources) {
        for (Binding binding : new ArrayList<>(other.bindings)) {
            pasteBinding(binding, where, additionalSources);
        }
    }

    public void pasteVariable(Variable other, CfgNode where) {
        pasteVariable(other, where, SourceSet.EMPTY);
    }

    /**
     * Add {@code binding}'s payload to this variable. At {@code where} the new
     * binding is sourced by {@code binding}, except when every origin of
     * {@code binding} is already at {@code where}: then its source sets are
     * copied instead, keeping the two assignments independent at that node.
     * With {@code where == null} the origins are copied verbatim.
     */
    public Binding pasteBinding(Binding binding, CfgNode where, SourceSet additionalSources) {
        Binding pasted = addBinding(binding.getData());
        if (where == null) {
            pasted.copyOrigins(binding, null, additionalSources);
            return pasted;
        }
        for (Origin origin : binding.getOrigins()) {
            if (origin.getWhere() != where) {
                pasted.copyOrigins(binding, where, additionalSources);
                return pasted;
            }
        }
        pasted.copyOrigins(binding, null, additionalSources);
        return pasted;
    }

    public Binding pasteBinding(Binding binding, CfgNode where) {
        return pasteBinding(binding, where, SourceSet.EMPTY);
    }

    /** A new Variable with every payload of this one, each sourced by its binding here. */
    public Variable assignToNewVariable(String newName, CfgNode where) {
        Variable fresh = program.newVariable(newName);
        for (Binding binding : new ArrayList<>(bindings)) {
            Binding copy = fresh.addBinding(binding.getData());
            copy.copyOrigins(binding, where, SourceSet.EMPTY);
        }
        return fresh;
    }

    void registerBindingAt(Binding binding, CfgNode node) {
        nodeToBindings.computeIfAbsent(node, n -> new LinkedHashSet<>()).add(binding);
    }

    private static List<Object> payloads(List<Binding> bindings) {
        List<Object> result = new ArrayList<>(bindings.size());
        for (Binding b : bindings) {
            result.add(b.getData());
        }
        return result;
    }

    @Override
    public String toString() {
        return "<Variable " + getName() + ": " + bindings.size() + " choices>";
    }
}
