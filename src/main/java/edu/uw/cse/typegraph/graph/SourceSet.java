package edu.uw.cse.typegraph.graph;

import java.util.*;

/**
 * An immutable set of Bindings that jointly justify one Origin.
 * Members are kept sorted by binding id, so two SourceSets with the same
 * members are equal regardless of construction order.
 */
public final class SourceSet implements Iterable<Binding> {
    public static final SourceSet EMPTY = new SourceSet(new Binding[0]);

    private final Binding[] members;
    private final int hash;

    private SourceSet(Binding[] members) {
        this.members = members;
        this.hash = Arrays.hashCode(members);
    }

    public static SourceSet of(Binding... bindings) {
        return of(Arrays.asList(bindings));
    }

    public static SourceSet of(Collection<Binding> bindings) {
        if (bindings.isEmpty()) return EMPTY;
        TreeSet<Binding> sorted = new TreeSet<>();
        for (Binding b : bindings) {
            sorted.add(Objects.requireNonNull(b, "source binding"));
        }
        return new SourceSet(sorted.toArray(new Binding[0]));
    }

    public SourceSet union(SourceSet other) {
        if (other.isEmpty()) return this;
        if (isEmpty()) return other;
        List<Binding> all = new ArrayList<>(asList());
        all.addAll(other.asList());
        return of(all);
    }

    public SourceSet with(Binding binding) {
        if (contains(binding)) return this;
        List<Binding> all = new ArrayList<>(asList());
        all.add(binding);
        return of(all);
    }

    public boolean contains(Binding binding) {
        for (Binding b : members) {
            if (b == binding) return true;
        }
        return false;
    }

    public boolean isEmpty() {
        return members.length == 0;
    }

    public int size() {
        return members.length;
    }

    public List<Binding> asList() {
        return Collections.unmodifiableList(Arrays.asList(members));
    }

    @Override
    public Iterator<Binding> iterator() {
        return asList().iterator();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceSet other)) return false;
        return hash == other.hash && Arrays.equals(members, other.members);
    }

    @Override
    public int hashCode() {
        return hash;
    }

    @Override
    public String toString() {
        return Arrays.toString(members);
    }
}
