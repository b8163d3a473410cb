package edu.uw.cse.typegraph.graph;

import java.util.*;

/**
 * Where and why a Binding was created: the node of the assignment and the
 * alternative SourceSets that each justify it on their own.
 */
public final class Origin {
    private final CfgNode where;
    private final Set<SourceSet> sourceSets = new LinkedHashSet<>();

    Origin(CfgNode where) {
        this.where = Objects.requireNonNull(where);
    }

    public CfgNode getWhere() {
        return where;
    }

    public Set<SourceSet> getSourceSets() {
        return Collections.unmodifiableSet(sourceSets);
    }

    boolean addSourceSet(SourceSet sourceSet) {
        return sourceSets.add(sourceSet);
    }

    @Override
    public String toString() {
        return where.label() + " " + sourceSets;
    }
}
