package edu.uw.cse.typegraph.solver;

import edu.uw.cse.typegraph.CyclePolicy;
import edu.uw.cse.typegraph.EngineConfig;
import edu.uw.cse.typegraph.graph.Binding;
import edu.uw.cse.typegraph.graph.CfgNode;
import edu.uw.cse.typegraph.graph.Origin;
import edu.uw.cse.typegraph.graph.Program;
import edu.uw.cse.typegraph.graph.Reachability;
import edu.uw.cse.typegraph.solver.GoalResolver.Resolution;

import java.util.*;

/**
 * Decides whether a set of Bindings can all be visible at a CFG node.
 *
 * The search walks backwards from the query node. At each state, goals
 * assigned at the current node are replaced by their sources (one branch per
 * choice of SourceSet), and the search moves to every node where one of the
 * remaining goals is assigned and that can be reached without crossing
 * another assignment to a goal's variable. A branch succeeds once no goals
 * are left. A node with a condition adds that condition to the goals of
 * every state placed on it.
 *
 * Results are memoized per State. The search keeps its own explicit stack,
 * so deep or cyclic graphs do not grow the Java call stack.
 */
public class Solver {
    private final Program program;
    private final EngineConfig config;
    private final Reachability reachability;
    private final SolveListener listener;
    private final boolean conditional;
    private final Map<State, SolveStatus> solvedStates = new HashMap<>();
    private final List<QueryMetrics> queryMetrics = new ArrayList<>();
    private QueryMetrics currentQuery;
    private long cacheHits;
    private long cacheMisses;
    private int sequence;

    public Solver(Program program) {
        this(program, SolveListener.NONE);
    }

    public Solver(Program program, SolveListener listener) {
        this.program = Objects.requireNonNull(program);
        if (!program.isFrozen()) {
            throw new IllegalStateException("A Solver needs a frozen program");
        }
        this.config = program.getConfig();
        this.reachability = new Reachability(config.compress, config.verifyCompression);
        this.listener = Objects.requireNonNull(listener);
        this.conditional = program.hasConditions();
    }

    /** Whether all {@code goals} can hold simultaneously at {@code at}. */
    public boolean solve(Collection<Binding> goals, CfgNode at) {
        checkQuery(goals, at);
        startQuery(at, goals.size());
        return solveState(new State(at, goals));
    }

    /**
     * Like {@link #solve}, but first checks each goal on its own and gives up
     * as soon as one of them is unsatisfiable.
     */
    public boolean hasCombination(Collection<Binding> goals, CfgNode at) {
        checkQuery(goals, at);
        startQuery(at, goals.size());
        Set<Binding> distinct = new TreeSet<>(goals);
        if (distinct.size() > 1) {
            for (Binding goal : distinct) {
                if (!solveState(new State(at, List.of(goal)))) {
                    currentQuery.markShortCircuited();
                    return false;
                }
            }
        }
        return solveState(new State(at, distinct));
    }

    public SolverMetrics calculateMetrics() {
        return new SolverMetrics(queryMetrics, cacheHits, cacheMisses, solvedStates.size());
    }

    public Program getProgram() {
        return program;
    }

    private void checkQuery(Collection<Binding> goals, CfgNode at) {
        Objects.requireNonNull(goals, "goals");
        Objects.requireNonNull(at, "at");
        if (at.getProgram() != program) {
            throw new IllegalArgumentException("Node " + at.label() + " belongs to another program");
        }
        for (Binding goal : goals) {
            if (Objects.requireNonNull(goal, "goal").getProgram() != program) {
                throw new IllegalArgumentException("Goal " + goal + " belongs to another program");
            }
        }
    }

    private void startQuery(CfgNode at, int goalCount) {
        currentQuery = new QueryMetrics(at.getId(), goalCount);
        queryMetrics.add(currentQuery);
    }

    private boolean solveState(State root) {
        if (config.debug) {
            System.out.println("Debug== [solver] query " + root);
        }
        Boolean known = recall(root, 0);
        if (known != null) return known;

        Deque<Frame> stack = new ArrayDeque<>();
        stack.push(enter(root, 0));
        boolean result = false;
        while (!stack.isEmpty()) {
            Frame frame = stack.peek();
            State child = frame.next();
            if (child != null) {
                Boolean recalled = recall(child, frame.depth + 1);
                if (recalled != null) {
                    frame.childFinished(recalled);
                } else {
                    stack.push(enter(child, frame.depth + 1));
                }
                continue;
            }

            stack.pop();
            solvedStates.put(frame.state, frame.answer ? SolveStatus.SOLVABLE : SolveStatus.UNSOLVABLE);
            report(frame.sequenceNumber, frame.state, frame.depth, frame.outcome, frame.answer);
            if (stack.isEmpty()) {
                result = frame.answer;
            } else {
                stack.peek().childFinished(frame.answer);
            }
        }
        return result;
    }

    private Frame enter(State state, int depth) {
        solvedStates.put(state, SolveStatus.IN_PROGRESS);
        currentQuery.visit(state.getPosition().getId(), state.getGoals().size());
        return new Frame(state, depth, sequence++);
    }

    /** The memoized answer for {@code state}, or null if it has to be searched. */
    private Boolean recall(State state, int depth) {
        SolveStatus status = solvedStates.get(state);
        if (status == null) {
            cacheMisses++;
            return null;
        }
        cacheHits++;
        currentQuery.markFromCache();
        boolean answer = switch (status) {
            case SOLVABLE -> true;
            case UNSOLVABLE -> false;
            case IN_PROGRESS -> config.cyclePolicy == CyclePolicy.ASSUME_SOLVABLE;
        };
        Outcome outcome = status == SolveStatus.IN_PROGRESS ? Outcome.CYCLE : Outcome.CACHED;
        report(sequence++, state, depth, outcome, answer);
        return answer;
    }

    private void report(int seq, State state, int depth, Outcome outcome, boolean answer) {
        if (config.debug) {
            System.out.println("Debug== [solver] " + "  ".repeat(depth) + state
                + " -> " + outcome + (answer ? " (solvable)" : " (unsolvable)"));
        }
        listener.onStep(new SearchStep(seq, state.getPosition(), state.getGoals(), depth, outcome, answer));
    }

    /** The state's goals plus the condition of its position, if any. */
    private static Collection<Binding> withCondition(State state) {
        Binding condition = state.getPosition().getCondition();
        if (condition == null || state.getGoals().contains(condition)) return state.getGoals();
        Set<Binding> goals = new TreeSet<>(state.getGoals());
        goals.add(condition);
        return goals;
    }

    /**
     * Nodes the search can move to from {@code position}: where some remaining
     * goal is assigned, reachable backwards without crossing any assignment to
     * a remaining goal's variable. A conditional node on every path to such a
     * place is taken instead, so its condition joins the goals.
     */
    private Collection<CfgNode> successorPositions(CfgNode position, Set<Binding> remaining) {
        Set<CfgNode> blocked = new HashSet<>();
        Set<CfgNode> finishes = new LinkedHashSet<>();
        for (Binding goal : remaining) {
            blocked.addAll(goal.getVariable().getNodes());
            for (Origin origin : goal.getOrigins()) {
                finishes.add(origin.getWhere());
            }
        }
        Set<CfgNode> frozenBlocked = Set.copyOf(blocked);
        Set<CfgNode> result = new LinkedHashSet<>();
        for (CfgNode finish : finishes) {
            if (reachability.canReachBackwards(position, finish, frozenBlocked)) {
                result.add(conditional ? reachability.nextStop(position, finish, frozenBlocked) : finish);
            }
        }
        return result;
    }

    /** One state on the explicit search stack. */
    private final class Frame {
        final State state;
        final int depth;
        final int sequenceNumber;
        Boolean answer;
        Outcome outcome;

        private List<Resolution> resolutions;
        private int resolutionIndex;
        private Resolution current;
        private Iterator<CfgNode> positions;
        private boolean sawSuccessor;
        private boolean sawConflict;

        Frame(State state, int depth, int sequenceNumber) {
            this.state = state;
            this.depth = depth;
            this.sequenceNumber = sequenceNumber;
        }

        /** The next successor to explore, or null once {@link #answer} is set. */
        State next() {
            if (answer != null) return null;
            if (resolutions == null) {
                Collection<Binding> goals = withCondition(state);
                if (goals.isEmpty()) return finish(true, Outcome.SOLVED);
                if (GoalResolver.goalsConflict(goals)) {
                    return finish(false, Outcome.CONFLICTING_GOALS);
                }
                resolutions = GoalResolver.resolveAt(state.getPosition(), goals);
            }
            while (true) {
                if (positions != null && positions.hasNext()) {
                    sawSuccessor = true;
                    return new State(positions.next(), current.remaining());
                }
                if (resolutionIndex >= resolutions.size()) {
                    Outcome failure = sawSuccessor ? Outcome.EXHAUSTED
                        : sawConflict ? Outcome.CONFLICTING_SOURCES
                        : Outcome.NO_REACHABLE_ORIGIN;
                    return finish(false, failure);
                }
                current = resolutions.get(resolutionIndex++);
                positions = null;
                if (GoalResolver.goalsConflict(current.removed())) {
                    sawConflict = true;
                    continue;
                }
                if (current.remaining().isEmpty()) return finish(true, Outcome.SOLVED);
                positions = successorPositions(state.getPosition(), current.remaining()).iterator();
            }
        }

        void childFinished(boolean solved) {
            if (solved) finish(true, Outcome.SOLVED);
        }

        private State finish(boolean solved, Outcome reason) {
            answer = solved;
            outcome = reason;
            return null;
        }
    }
}
