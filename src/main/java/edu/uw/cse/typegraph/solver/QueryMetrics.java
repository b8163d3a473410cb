package edu.uw.cse.typegraph.solver;

/**
 * Counters for one public Solver query.
 */
public class QueryMetrics {
    private final int startNode;
    private int endNode = -1;
    private int nodesVisited;
    private final int initialGoals;
    private int totalGoals;
    private boolean shortCircuited;
    private boolean fromCache;

    public QueryMetrics(int startNode, int initialGoals) {
        this.startNode = startNode;
        this.initialGoals = initialGoals;
    }

    public int getStartNode() {
        return startNode;
    }

    /** Id of the last node the search visited, or -1 if it visited none. */
    public int getEndNode() {
        return endNode;
    }

    public int getNodesVisited() {
        return nodesVisited;
    }

    public int getInitialGoals() {
        return initialGoals;
    }

    /** Sum of goal-set sizes over all visited states. */
    public int getTotalGoals() {
        return totalGoals;
    }

    /** True if a single goal failed on its own and the joint search was skipped. */
    public boolean isShortCircuited() {
        return shortCircuited;
    }

    /** True if at least one state was answered from the memo. */
    public boolean isFromCache() {
        return fromCache;
    }

    void visit(int nodeId, int goalCount) {
        nodesVisited++;
        endNode = nodeId;
        totalGoals += goalCount;
    }

    void markShortCircuited() {
        shortCircuited = true;
    }

    void markFromCache() {
        fromCache = true;
    }

    @Override
    public String toString() {
        return "QueryMetrics{start=" + startNode + ", end=" + endNode + ", visited=" + nodesVisited
            + ", initialGoals=" + initialGoals + ", totalGoals=" + totalGoals
            + ", shortCircuited=" + shortCircuited + ", fromCache=" + fromCache + "}";
    }
}
