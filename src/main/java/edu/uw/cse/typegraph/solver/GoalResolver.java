package edu.uw.cse.typegraph.solver;

import edu.uw.cse.typegraph.graph.Binding;
import edu.uw.cse.typegraph.graph.CfgNode;
import edu.uw.cse.typegraph.graph.Origin;
import edu.uw.cse.typegraph.graph.SourceSet;
import edu.uw.cse.typegraph.graph.Variable;

import java.util.*;

/**
 * Goal bookkeeping shared by the Solver and the Explainer.
 */
public final class GoalResolver {

    private GoalResolver() {
    }

    /**
     * One way of discharging the goals that are assigned at a node:
     * {@code removed} were resolved here, {@code remaining} must be found
     * further back in the graph.
     */
    public record Resolution(Set<Binding> removed, Set<Binding> remaining) {
    }

    /**
     * Enumerate every way of replacing the goals that originate at
     * {@code position} with one of their SourceSets. Replacement is repeated
     * for source bindings that also originate there; each goal is expanded at
     * most once per branch, which stops cyclic sources.
     */
    public static List<Resolution> resolveAt(CfgNode position, Collection<Binding> goals) {
        Set<Binding> toRemove = new TreeSet<>();
        Set<Binding> remaining = new TreeSet<>();
        for (Binding goal : goals) {
            if (goal.findOrigin(position) != null) {
                toRemove.add(goal);
            } else {
                remaining.add(goal);
            }
        }

        List<Resolution> results = new ArrayList<>();
        Deque<Partial> queue = new ArrayDeque<>();
        queue.add(new Partial(toRemove, new HashSet<>(), new TreeSet<>(), remaining));
        while (!queue.isEmpty()) {
            Partial partial = queue.poll();
            if (partial.toRemove.isEmpty()) {
                results.add(new Resolution(Collections.unmodifiableSet(partial.removed),
                                           Collections.unmodifiableSet(partial.remaining)));
                continue;
            }
            Iterator<Binding> it = partial.toRemove.iterator();
            Binding goal = it.next();
            it.remove();
            if (!partial.seen.add(goal)) {
                queue.add(partial);
                continue;
            }
            Origin origin = goal.findOrigin(position);
            if (origin == null) {
                partial.remaining.add(goal);
                queue.add(partial);
                continue;
            }
            partial.removed.add(goal);
            for (SourceSet sourceSet : origin.getSourceSets()) {
                Set<Binding> nextToRemove = new TreeSet<>(partial.toRemove);
                for (Binding source : sourceSet) {
                    nextToRemove.add(source);
                }
                queue.add(new Partial(nextToRemove, new HashSet<>(partial.seen),
                                      new TreeSet<>(partial.removed), new TreeSet<>(partial.remaining)));
            }
        }
        return results;
    }

    /**
     * True if two goals require different bindings of the same variable.
     *
     * @throws IllegalStateException if two goals of one variable carry the
     *         same payload, which the binding dedup makes impossible
     */
    public static boolean goalsConflict(Collection<Binding> goals) {
        Map<Variable, Binding> byVariable = new HashMap<>();
        for (Binding goal : goals) {
            Binding existing = byVariable.putIfAbsent(goal.getVariable(), goal);
            if (existing == null || existing == goal) continue;
            if (existing.getData() == goal.getData()) {
                throw new IllegalStateException("Two bindings of " + goal.getVariable().getName()
                    + " share the payload " + goal.getData());
            }
            return true;
        }
        return false;
    }

    private record Partial(Set<Binding> toRemove, Set<Binding> seen,
                           Set<Binding> removed, Set<Binding> remaining) {
    }
}
