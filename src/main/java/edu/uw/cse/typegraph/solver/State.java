package edu.uw.cse.typegraph.solver;

import edu.uw.cse.typegraph.graph.Binding;
import edu.uw.cse.typegraph.graph.CfgNode;

import java.util.*;

/**
 * A solver query: can all goals be simultaneously visible at the position.
 * Goals are stored sorted by binding id, so equal goal sets give equal states.
 */
public final class State {
    private final CfgNode position;
    private final Binding[] goals;
    private final int hash;

    public State(CfgNode position, Collection<Binding> goals) {
        this.position = Objects.requireNonNull(position);
        this.goals = new TreeSet<>(goals).toArray(new Binding[0]);
        this.hash = 31 * position.hashCode() + Arrays.hashCode(this.goals);
    }

    public CfgNode getPosition() {
        return position;
    }

    public List<Binding> getGoals() {
        return Collections.unmodifiableList(Arrays.asList(goals));
    }

    public boolean isDone() {
        return goals.length == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof State other)) return false;
        return position == other.position && Arrays.equals(goals, other.goals);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return position.label() + " " + Arrays.toString(goals);
    }
}
