package edu.uw.cse.typegraph.solver;

import edu.uw.cse.typegraph.graph.Binding;
import edu.uw.cse.typegraph.graph.CfgNode;

import java.util.*;

/**
 * The recorded outcome of an explained combination query.
 */
public class Explanation {
    private final CfgNode viewpoint;
    private final List<Binding> goals;
    private final boolean solvable;
    private final Binding infeasibleGoal;
    private final List<SearchStep> steps;

    public Explanation(CfgNode viewpoint, List<Binding> goals, boolean solvable,
                       Binding infeasibleGoal, List<SearchStep> steps) {
        this.viewpoint = Objects.requireNonNull(viewpoint);
        this.goals = List.copyOf(goals);
        this.solvable = solvable;
        this.infeasibleGoal = infeasibleGoal;
        List<SearchStep> ordered = new ArrayList<>(steps);
        ordered.sort(Comparator.comparingInt(SearchStep::sequence));
        this.steps = Collections.unmodifiableList(ordered);
    }

    public CfgNode getViewpoint() {
        return viewpoint;
    }

    public List<Binding> getGoals() {
        return goals;
    }

    public boolean isSolvable() {
        return solvable;
    }

    /** Steps in the order the search entered them. */
    public List<SearchStep> getSteps() {
        return steps;
    }

    /** The first goal that cannot be visible even on its own, if any. */
    public Optional<Binding> getInfeasibleGoal() {
        return Optional.ofNullable(infeasibleGoal);
    }

    /**
     * The deepest step that failed for a reason of its own (not from the memo),
     * earliest first on ties. Empty when the combination is solvable.
     */
    public Optional<SearchStep> getBlame() {
        if (solvable) return Optional.empty();
        SearchStep blame = null;
        for (SearchStep step : steps) {
            if (!step.isFailure()) continue;
            if (blame == null || step.depth() > blame.depth()) blame = step;
        }
        return Optional.ofNullable(blame);
    }

    public String describe() {
        StringBuilder sb = new StringBuilder();
        sb.append("Goals ").append(goals).append(" at ").append(viewpoint.label())
          .append(solvable ? ": possible" : ": impossible").append('\n');
        if (infeasibleGoal != null) {
            sb.append("  ").append(infeasibleGoal).append(" is not visible at ")
              .append(viewpoint.label()).append(" on its own\n");
        }
        getBlame().ifPresent(step -> sb.append("  failed at ").append(step.position().label())
            .append(" with goals ").append(step.goals()).append(": ")
            .append(reason(step.outcome())).append('\n'));
        sb.append("  ").append(steps.size()).append(" search steps\n");
        return sb.toString();
    }

    private static String reason(Outcome outcome) {
        return switch (outcome) {
            case CONFLICTING_GOALS -> "two goals need different values of one variable";
            case CONFLICTING_SOURCES -> "every choice of sources needs conflicting values";
            case NO_REACHABLE_ORIGIN -> "no assignment of the goals reaches this node unshadowed";
            case EXHAUSTED -> "no predecessor state is solvable";
            case SOLVED, CACHED, CYCLE -> outcome.name().toLowerCase();
        };
    }

    @Override
    public String toString() {
        return describe();
    }
}
