package edu.uw.cse.typegraph.graph;

import java.util.*;

/**
 * One possible payload of a Variable, together with every place and reason it
 * was assigned. Bindings are ordered by their Program-wide id.
 */
public class Binding implements Comparable<Binding> {
    private final Program program;
    private final Variable variable;
    private final Object data;
    private final int id;
    private final List<Origin> origins = new ArrayList<>();
    private final Map<CfgNode, Origin> nodeToOrigin = new HashMap<>();

    Binding(Program program, Variable variable, Object data, int id) {
        this.program = program;
        this.variable = variable;
        this.data = data;
        this.id = id;
    }

    public Program getProgram() {
        return program;
    }

    public Variable getVariable() {
        return variable;
    }

    public Object getData() {
        return data;
    }

    public int getId() {
        return id;
    }

    public List<Origin> getOrigins() {
        return Collections.unmodifiableList(origins);
    }

    public Origin findOrigin(CfgNode node) {
        return nodeToOrigin.get(node);
    }

    public Origin addOrigin(CfgNode where, Collection<Binding> sourceSet) {
        return addOrigin(where, SourceSet.of(sourceSet));
    }

    /**
     * Record that this binding is assigned at {@code where}, justified by
     * {@code sourceSet}. Repeated calls for the same node add alternative
     * SourceSets to the existing Origin.
     */
    public Origin addOrigin(CfgNode where, SourceSet sourceSet) {
        Objects.requireNonNull(where, "where");
        Objects.requireNonNull(sourceSet, "sourceSet");
        program.checkMutable("add an origin");
        program.checkOwned(where);
        for (Binding source : sourceSet) {
            program.checkOwned(source);
        }
        Origin origin = nodeToOrigin.get(where);
        if (origin == null) {
            origin = new Origin(where);
            origins.add(origin);
            nodeToOrigin.put(where, origin);
            variable.registerBindingAt(this, where);
            where.registerBinding(this);
        }
        origin.addSourceSet(sourceSet);
        return origin;
    }

    /**
     * Copy the origins of {@code other} onto this binding.
     *
     * With {@code where == null} every (node, SourceSet) pair of {@code other}
     * is copied, each SourceSet extended with {@code additionalSources}.
     * Otherwise a single Origin at {@code where} is added, sourced by
     * {@code other} plus {@code additionalSources}.
     */
    public void copyOrigins(Binding other, CfgNode where, SourceSet additionalSources) {
        SourceSet additional = additionalSources != null ? additionalSources : SourceSet.EMPTY;
        if (where == null) {
            // snapshot: other may be this binding
            for (Origin origin : new ArrayList<>(other.origins)) {
                for (SourceSet sourceSet : new ArrayList<>(origin.getSourceSets())) {
                    addOrigin(origin.getWhere(), sourceSet.union(additional));
                }
            }
        } else {
            addOrigin(where, additional.with(other));
        }
    }

    /** Create a Variable holding just this payload, sourced by this binding. */
    public Variable assignToNewVariable(String name, CfgNode where) {
        Variable fresh = program.newVariable(name);
        Binding copy = fresh.addBinding(data);
        copy.copyOrigins(this, where, SourceSet.EMPTY);
        return fresh;
    }

    /** True if {@code binding} appears anywhere in the transitive sources of this one. */
    public boolean hasSource(Binding binding) {
        if (binding == this) return true;
        Set<Binding> seen = new HashSet<>();
        Deque<Binding> stack = new ArrayDeque<>();
        stack.push(this);
        while (!stack.isEmpty()) {
            Binding current = stack.pop();
            if (!seen.add(current)) continue;
            for (Origin origin : current.origins) {
                for (SourceSet sourceSet : origin.getSourceSets()) {
                    for (Binding source : sourceSet) {
                        if (source == binding) return true;
                        stack.push(source);
                    }
                }
            }
        }
        return false;
    }

    /** Whether this binding can be the live value of its Variable at {@code viewpoint}. */
    public boolean isVisible(CfgNode viewpoint) {
        return program.getSolver().solve(List.of(this), viewpoint);
    }

    @Override
    public int compareTo(Binding o) {
        return Integer.compare(id, o.id);
    }

    @Override
    public int hashCode() {
        return id;
    }

    @Override
    public String toString() {
        return "<binding " + id + " " + variable.getName() + "=" + data + ">";
    }
}
