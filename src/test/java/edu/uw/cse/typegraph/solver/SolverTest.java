package edu.uw.cse.typegraph.solver;

import edu.uw.cse.typegraph.CyclePolicy;
import edu.uw.cse.typegraph.EngineConfig;
import edu.uw.cse.typegraph.graph.*;
import org.junit.Test;

import java.util.*;

import static org.junit.Assert.*;

public class SolverTest {

    /** n1 -> n2 -> n4, n1 -> n3 -> n4; x = a at n2, x = b at n3; y depends on x at n4. */
    private static final class Diamond {
        final Program p;
        final CfgNode n1, n2, n3, n4;
        final Binding xa, xb, ya, yb;

        Diamond(EngineConfig config) {
            p = new Program(config);
            n1 = p.newNode("n1");
            n2 = n1.connectNew("n2");
            n3 = n1.connectNew("n3");
            n4 = n2.connectNew("n4");
            n3.connectTo(n4);
            Variable x = p.newVariable("x");
            xa = x.addBinding("a", List.of(), n2);
            xb = x.addBinding("b", List.of(), n3);
            Variable y = p.newVariable("y");
            ya = y.addBinding("ya", List.of(xa), n4);
            yb = y.addBinding("yb", List.of(xb), n4);
            p.freeze(n1);
        }

        List<Binding> all() {
            return List.of(xa, xb, ya, yb);
        }
    }

    // --- Literal scenarios ---

    @Test
    public void testDiamond() {
        Diamond d = new Diamond(EngineConfig.defaults());
        assertTrue(d.n2.hasCombination(List.of(d.xa)));
        assertTrue(d.n4.hasCombination(List.of(d.xa)));
        assertTrue(d.n3.hasCombination(List.of(d.xb)));
        assertTrue(d.n4.hasCombination(List.of(d.xb)));
        assertFalse(d.n2.hasCombination(List.of(d.xb)));
        assertFalse(d.n1.hasCombination(List.of(d.xa)));
        for (CfgNode node : d.p.getNodes()) {
            assertFalse(node.hasCombination(List.of(d.xa, d.xb)));
        }
    }

    @Test
    public void testDependentVariable() {
        Diamond d = new Diamond(EngineConfig.defaults());
        assertTrue(d.n4.hasCombination(List.of(d.ya, d.xa)));
        assertFalse(d.n4.hasCombination(List.of(d.ya, d.xb)));
        assertTrue(d.n4.hasCombination(List.of(d.yb, d.xb)));
        assertFalse(d.n4.hasCombination(List.of(d.yb, d.xa)));
    }

    @Test
    public void testCombinations() {
        // n1 -> n2 -> n4, n1 -> n3 -> n4
        // [n2] x = a; y = a
        // [n3] x = b; y = b
        Program p = new Program();
        CfgNode n1 = p.newNode("n1");
        CfgNode n2 = n1.connectNew("n2");
        CfgNode n3 = n1.connectNew("n3");
        CfgNode n4 = n2.connectNew("n4");
        n3.connectTo(n4);
        Variable x = p.newVariable("x");
        Variable y = p.newVariable("y");
        Binding xa = x.addBinding("a", List.of(), n2);
        Binding ya = y.addBinding("a", List.of(), n2);
        Binding xb = x.addBinding("b", List.of(), n3);
        Binding yb = y.addBinding("b", List.of(), n3);
        p.freeze(n1);

        assertTrue(n4.hasCombination(List.of(xa, ya)));
        assertTrue(n4.hasCombination(List.of(xb, yb)));
        assertFalse(n4.hasCombination(List.of(xa, yb)));
        assertFalse(n4.hasCombination(List.of(xb, ya)));
    }

    @Test
    public void testConflictingAtSameNode() {
        Program p = new Program();
        CfgNode n1 = p.newNode("n1");
        CfgNode n2 = n1.connectNew("n2");
        Variable x = p.newVariable("x");
        Binding a = x.addBinding("a", List.of(), n1);
        Binding b = x.addBinding("b", List.of(), n1);
        p.freeze(n1);

        assertTrue(n1.hasCombination(List.of(a)));
        assertTrue(n1.hasCombination(List.of(b)));
        assertFalse(n1.hasCombination(List.of(a, b)));
        assertFalse(n2.hasCombination(List.of(a, b)));
    }

    @Test
    public void testOneStepSimultaneous() {
        // n1 -> n2
        // [n1] x = a or b
        // [n2] y = x; z = x
        Program p = new Program();
        CfgNode n1 = p.newNode("n1");
        CfgNode n2 = n1.connectNew("n2");
        Variable x = p.newVariable("x");
        Variable y = p.newVariable("y");
        Variable z = p.newVariable("z");
        Binding a = x.addBinding("a", List.of(), n1);
        Binding b = x.addBinding("b", List.of(), n1);
        Binding ya = y.addBinding("ya", List.of(a), n2);
        Binding yb = y.addBinding("yb", List.of(b), n2);
        Binding za = z.addBinding("za", List.of(a), n2);
        Binding zb = z.addBinding("zb", List.of(b), n2);
        p.freeze(n1);

        assertTrue(n2.hasCombination(List.of(ya, za)));
        assertTrue(n2.hasCombination(List.of(yb, zb)));
        assertFalse(n2.hasCombination(List.of(ya, zb)));
        assertFalse(n2.hasCombination(List.of(yb, za)));
    }

    @Test
    public void testMidPoint() {
        Program p = new Program();
        CfgNode n1 = p.newNode("n1");
        Variable x = p.newVariable("x");
        Variable y = p.newVariable("y");
        Binding x1 = x.addBinding("1", List.of(), n1);
        Binding y1 = y.addBinding("1", List.of(x1), n1);
        CfgNode n2 = n1.connectNew("n2");
        Binding x2 = x.addBinding("2", List.of(), n2);
        CfgNode n3 = n2.connectNew("n3");
        p.freeze(n1);

        assertTrue(n3.hasCombination(List.of(y1, x2)));
        assertTrue(n3.hasCombination(List.of(x2, y1)));
        assertFalse(n3.hasCombination(List.of(x1)));
    }

    @Test
    public void testSameNodeOrigin() {
        // [n1] x = a or b; y = x
        Program p = new Program();
        CfgNode n1 = p.newNode("n1");
        Variable x = p.newVariable("x");
        Variable y = p.newVariable("y");
        Binding xa = x.addBinding("xa", List.of(), n1);
        Binding xb = x.addBinding("xb", List.of(), n1);
        Binding ya = y.addBinding("ya", List.of(xa), n1);
        Binding yb = y.addBinding("yb", List.of(xb), n1);
        p.freeze(n1);

        assertTrue(n1.hasCombination(List.of(xa)));
        assertTrue(n1.hasCombination(List.of(xb)));
        assertTrue(n1.hasCombination(List.of(xa, ya)));
        assertTrue(n1.hasCombination(List.of(xb, yb)));
    }

    @Test
    public void testHiddenConflictAcrossBranches() {
        Program p = new Program();
        CfgNode n1 = p.newNode("n1");
        CfgNode n2 = n1.connectNew("n2");
        CfgNode n3 = n1.connectNew("n3");
        Variable x = p.newVariable("x");
        Variable y = p.newVariable("y");
        Variable z = p.newVariable("z");
        Binding xa = x.addBinding("a", List.of(), n1);
        Binding xb = x.addBinding("b", List.of(), n1);
        Binding ya = y.addBinding("a", List.of(xa), n1);
        Binding yb = y.addBinding("b", List.of(xb), n2);
        Binding zab1 = z.addBinding("ab1", List.of(xa, xb), n3);
        Binding zab2 = z.addBinding("ab2", List.of(ya, xb), n3);
        Binding zab3 = z.addBinding("ab3", List.of(yb, xa), n3);
        Binding zab4 = z.addBinding("ab4", List.of(ya, yb), n3);
        p.freeze(n1);

        assertFalse(n2.hasCombination(List.of(ya, xb)));
        assertFalse(n2.hasCombination(List.of(yb, xa)));
        assertFalse(n3.hasCombination(List.of(zab1)));
        assertFalse(n3.hasCombination(List.of(zab2)));
        assertFalse(n3.hasCombination(List.of(zab3)));
        assertFalse(n3.hasCombination(List.of(zab4)));
    }

    @Test
    public void testHiddenConflictInSources() {
        // y = b depends on x = b at the same node, so it cannot coexist with x = a
        Program p = new Program();
        CfgNode n1 = p.newNode("n1");
        CfgNode n2 = n1.connectNew("n2");
        Variable x = p.newVariable("x");
        Variable y = p.newVariable("y");
        Binding xa = x.addBinding("a", List.of(), n1);
        Binding xb = x.addBinding("b", List.of(), n1);
        Binding yb = y.addBinding("b", List.of(xb), n1);
        p.freeze(n1);

        assertTrue(n2.hasCombination(List.of(yb)));
        assertTrue(n2.hasCombination(List.of(xa)));
        assertFalse(n2.hasCombination(List.of(yb, xa)));
    }

    @Test
    public void testAlternativeSourceSets() {
        Program p = new Program();
        CfgNode n1 = p.newNode("n1");
        CfgNode n2 = n1.connectNew("n2");
        Variable x = p.newVariable("x");
        Binding xa = x.addBinding("a", List.of(), n1);
        Binding xb = x.addBinding("b", List.of(), n1);
        Variable y = p.newVariable("y");
        Binding yc = y.addBinding("c", List.of(xa), n2);
        yc.addOrigin(n2, List.of(xb));
        p.freeze(n1);

        assertTrue(n2.hasCombination(List.of(yc, xa)));
        assertTrue(n2.hasCombination(List.of(yc, xb)));
    }

    // --- Conditions ---

    @Test
    public void testConditionOnStartNode() {
        for (boolean conditioned : new boolean[] {false, true}) {
            Program p = new Program();
            CfgNode n1 = p.newNode("n1");
            Variable x = p.newVariable("x");
            Binding xa = x.addBinding("a", List.of(), n1);
            Binding xb = x.addBinding("x", List.of(), n1);
            if (conditioned) n1.setCondition(xb);
            p.freeze(n1);
            assertEquals(!conditioned, n1.hasCombination(List.of(xa)));
        }
    }

    @Test
    public void testConflictingBindingsFromCondition() {
        Program p = new Program();
        CfgNode n1 = p.newNode("n1");
        CfgNode n2 = n1.connectNew("n2");
        CfgNode n3 = n2.connectNew("n3");
        Variable x = p.newVariable("x");
        Binding xa = x.addBinding("a", List.of(), n1);
        Binding xb = x.addBinding("b", List.of(), n1);
        n2.setCondition(xa);
        p.freeze(n1);

        assertFalse(n3.hasCombination(List.of(xb)));
        assertTrue(n3.hasCombination(List.of(xa)));
    }

    /** n1 -> n2 [y = 2] -> n3, n1 -> dead; y = 2 is only assigned on the dead branch. */
    private static Program unsatisfiableCondition(boolean bypass, boolean secondBranch) {
        Program p = new Program();
        CfgNode n1 = p.newNode("n1");
        CfgNode dead = n1.connectNew("dead");
        Binding y2 = p.newVariable("y").addBinding("2", List.of(), dead);
        CfgNode n2 = n1.connectNew("n2", y2);
        CfgNode n3 = n2.connectNew("n3");
        if (secondBranch) {
            n2.connectNew("n4").connectTo(n3);
        }
        if (bypass) {
            n1.connectTo(n3);
        }
        p.newVariable("x").addBinding("1", List.of(), n1);
        p.freeze(n1);
        return p;
    }

    private static boolean xVisibleAt(Program p, String nodeName) {
        Binding x1 = p.getVariables().get(1).getBindings().get(0);
        for (CfgNode node : p.getNodes()) {
            if (nodeName.equals(node.getName())) return node.hasCombination(List.of(x1));
        }
        throw new AssertionError("no node " + nodeName);
    }

    @Test
    public void testConditionsBlock() {
        Program p = unsatisfiableCondition(false, false);
        assertFalse(xVisibleAt(p, "n3"));
        assertFalse(xVisibleAt(p, "n2"));
        assertTrue(xVisibleAt(p, "dead"));
    }

    @Test
    public void testConditionBypassedByOtherPath() {
        Program p = unsatisfiableCondition(true, false);
        assertTrue(xVisibleAt(p, "n3"));
        assertFalse(xVisibleAt(p, "n2"));
    }

    @Test
    public void testConditionsMultiplePaths() {
        Program p = unsatisfiableCondition(false, true);
        assertFalse(xVisibleAt(p, "n3"));
        assertFalse(xVisibleAt(p, "n4"));
        assertFalse(xVisibleAt(p, "n2"));
    }

    @Test
    public void testSatisfiableCondition() {
        Program p = new Program();
        CfgNode n1 = p.newNode("n1");
        Binding x1 = p.newVariable("x").addBinding("1", List.of(), n1);
        CfgNode n2 = n1.connectNew("n2");
        Binding y2 = p.newVariable("y").addBinding("2", List.of(), n2);
        CfgNode n3 = n2.connectNew("n3", y2);
        CfgNode n4 = n3.connectNew("n4");
        p.freeze(n1);

        assertTrue(n4.hasCombination(List.of(x1)));
        assertTrue(n4.hasCombination(List.of(x1, y2)));
    }

    @Test
    public void testUnsatisfiableCondition() {
        Program p = new Program();
        CfgNode n1 = p.newNode("n1");
        Variable x = p.newVariable("x");
        Binding x1 = x.addBinding("1", List.of(), n1);
        CfgNode n2 = n1.connectNew("n2");
        Binding x2 = x.addBinding("2", List.of(), n2);
        CfgNode n3 = n2.connectNew("n3", x2);
        CfgNode n4 = n3.connectNew("n4");
        p.freeze(n1);

        assertFalse(n4.hasCombination(List.of(x1)));
        assertTrue(n4.hasCombination(List.of(x2)));
    }

    @Test
    public void testNoConditionOnAllPaths() {
        // n1 -> n2 [x] -> n3 -> n5, n1 -> n4 [x] -> n5; x is assigned at n3
        Program p = new Program();
        CfgNode n1 = p.newNode("n1");
        CfgNode n2 = n1.connectNew("n2");
        Binding y1 = p.newVariable("y").addBinding("y", List.of(), n1);
        CfgNode n3 = n2.connectNew("n3");
        CfgNode n4 = n1.connectNew("n4");
        CfgNode n5 = n4.connectNew("n5");
        n3.connectTo(n5);
        Binding x1 = p.newVariable("x").addBinding("x", List.of(), n3);
        n2.setCondition(x1);
        n4.setCondition(x1);
        p.freeze(n1);

        assertTrue(n5.hasCombination(List.of(y1)));
    }

    @Test
    public void testConditionsAreTakenInOrder() {
        // each node is guarded by a condition assigned at its predecessor
        for (EngineConfig config : List.of(EngineConfig.defaults(), new EngineConfig(false, false, false))) {
            Program p = new Program(config);
            CfgNode n1 = p.newNode("n1");
            Binding x1 = p.newVariable("x").addBinding("1", List.of(), n1);
            CfgNode n2 = n1.connectNew("n2", p.newVariable("c1").addBinding("1", List.of(), n1));
            CfgNode n3 = n2.connectNew("n3", p.newVariable("c2").addBinding("1", List.of(), n2));
            CfgNode n4 = n3.connectNew("n4", p.newVariable("c3").addBinding("1", List.of(), n3));
            p.freeze(n1);
            assertTrue(n4.hasCombination(List.of(x1)));
        }
    }

    // --- Loops ---

    /** n1 -> n2 -> n3 -> n2, n3 -> n4; y = x at n2, x = y at n3. */
    private static Program loop(EngineConfig config, boolean withInitialValue) {
        Program p = new Program(config);
        CfgNode n1 = p.newNode("n1");
        CfgNode n2 = n1.connectNew("n2");
        CfgNode n3 = n2.connectNew("n3");
        n3.connectTo(n2);
        n3.connectNew("n4");
        Variable x = p.newVariable("x");
        Variable y = p.newVariable("y");
        Binding x1 = x.addBinding("x1");
        Binding y1 = y.addBinding("y1");
        if (withInitialValue) {
            Binding x0 = x.addBinding("x0", List.of(), n1);
            y1.addOrigin(n2, List.of(x0));
        }
        y1.addOrigin(n2, List.of(x1));
        x1.addOrigin(n3, List.of(y1));
        p.freeze(n1);
        return p;
    }

    private static boolean loopResultVisible(Program p) {
        Binding x1 = p.getVariables().get(0).getBindings().get(0);
        CfgNode n4 = p.getNodes().get(3);
        return p.getSolver().solve(List.of(x1), n4);
    }

    @Test
    public void testLoopWithInitialValueTerminates() {
        for (CyclePolicy policy : CyclePolicy.values()) {
            Program p = loop(EngineConfig.defaults().withCyclePolicy(policy), true);
            assertTrue(policy.name(), loopResultVisible(p));
        }
    }

    @Test
    public void testPureCycleFollowsPolicy() {
        assertTrue(loopResultVisible(loop(EngineConfig.defaults(), false)));
        assertFalse(loopResultVisible(
            loop(EngineConfig.defaults().withCyclePolicy(CyclePolicy.ASSUME_UNSOLVABLE), false)));
    }

    @Test
    public void testSelfSourcedLoopVariable() {
        // x = 0 before the loop, x = f(x) inside it; the body runs at least once
        Program p = new Program();
        CfgNode n1 = p.newNode("n1");
        CfgNode n2 = n1.connectNew("n2");
        CfgNode n3 = n2.connectNew("n3");
        n3.connectTo(n2);
        CfgNode n4 = n3.connectNew("n4");
        Variable x = p.newVariable("x");
        Binding x0 = x.addBinding("x0", List.of(), n1);
        Binding x1 = x.addBinding("x1", List.of(x0), n3);
        x1.addOrigin(n3, List.of(x1));
        p.freeze(n1);

        assertTrue(x0.isVisible(n2));
        assertTrue(x1.isVisible(n2));
        assertFalse(x0.isVisible(n4));
        assertTrue(x1.isVisible(n4));
    }

    // --- Properties ---

    @Test
    public void testConflictingGoalsAlwaysFail() {
        Diamond d = new Diamond(EngineConfig.defaults());
        for (CfgNode node : d.p.getNodes()) {
            assertFalse(d.p.getSolver().solve(List.of(d.ya, d.yb), node));
            assertFalse(d.p.getSolver().solve(List.of(d.xa, d.xb, d.ya), node));
        }
    }

    @Test
    public void testSingletonConsistency() {
        Diamond d = new Diamond(EngineConfig.defaults());
        for (CfgNode node : d.p.getNodes()) {
            for (Binding b : d.all()) {
                assertEquals(node + " " + b, node.hasCombination(List.of(b)), b.isVisible(node));
            }
        }
    }

    @Test
    public void testMonotonicCombinationFailure() {
        Diamond d = new Diamond(EngineConfig.defaults());
        List<Binding> pool = d.all();
        for (CfgNode node : d.p.getNodes()) {
            for (Set<Binding> goals : subsets(pool)) {
                if (node.hasCombination(goals)) continue;
                for (Binding extra : pool) {
                    Set<Binding> bigger = new HashSet<>(goals);
                    bigger.add(extra);
                    assertFalse(node + " " + bigger, node.hasCombination(bigger));
                }
            }
        }
    }

    @Test
    public void testCompressionDoesNotChangeAnswers() {
        Diamond compressed = new Diamond(new EngineConfig(true, true, false));
        Diamond plain = new Diamond(new EngineConfig(false, false, false));
        List<CfgNode> nodesC = compressed.p.getNodes();
        List<CfgNode> nodesP = plain.p.getNodes();
        List<Set<Binding>> setsC = subsets(compressed.all());
        List<Set<Binding>> setsP = subsets(plain.all());
        for (int i = 0; i < nodesC.size(); i++) {
            for (int j = 0; j < setsC.size(); j++) {
                assertEquals(nodesC.get(i).hasCombination(setsC.get(j)),
                             nodesP.get(i).hasCombination(setsP.get(j)));
            }
        }
    }

    @Test
    public void testRandomProgramsWithVerifiedCompression() {
        Random random = new Random(31);
        EngineConfig verify = new EngineConfig(true, true, false);
        for (int round = 0; round < 20; round++) {
            Program p = new Program(verify);
            int size = 5 + random.nextInt(12);
            List<CfgNode> nodes = new ArrayList<>();
            nodes.add(p.newNode("n0"));
            for (int i = 1; i < size; i++) {
                CfgNode pred = random.nextInt(3) == 0 ? nodes.get(random.nextInt(i)) : nodes.get(i - 1);
                nodes.add(pred.connectNew("n" + i));
            }
            for (int i = 0; i < size / 3; i++) {
                nodes.get(random.nextInt(size)).connectTo(nodes.get(random.nextInt(size)));
            }
            List<Binding> bindings = new ArrayList<>();
            for (int v = 0; v < 3; v++) {
                Variable var = p.newVariable("v" + v);
                for (int k = 0; k < 2; k++) {
                    List<Binding> sources = bindings.isEmpty() || random.nextBoolean()
                        ? List.of() : List.of(bindings.get(random.nextInt(bindings.size())));
                    bindings.add(var.addBinding("d" + k, sources, nodes.get(random.nextInt(size))));
                }
            }
            p.freeze(nodes.get(0));

            // any mismatch between compressed and plain search throws
            for (CfgNode node : nodes) {
                for (Binding b : bindings) {
                    assertEquals(node.hasCombination(List.of(b)), b.isVisible(node));
                }
                node.hasCombination(List.of(bindings.get(0), bindings.get(bindings.size() - 1)));
            }
        }
    }

    // --- Contract ---

    @Test
    public void testEmptyGoalsAreSolvable() {
        Diamond d = new Diamond(EngineConfig.defaults());
        assertTrue(d.n1.hasCombination(List.of()));
        assertTrue(d.p.getSolver().solve(List.of(), d.n3));
    }

    @Test(expected = IllegalStateException.class)
    public void testSolverNeedsFrozenProgram() {
        Program p = new Program();
        p.newNode("n1");
        new Solver(p);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testForeignGoalRejected() {
        Diamond d = new Diamond(EngineConfig.defaults());
        Diamond other = new Diamond(EngineConfig.defaults());
        d.n4.hasCombination(List.of(other.xa));
    }

    // --- Metrics ---

    @Test
    public void testQueryMetrics() {
        Diamond d = new Diamond(EngineConfig.defaults());
        Solver solver = d.p.getSolver();

        assertFalse(d.n2.hasCombination(List.of(d.xa, d.xb)));
        assertTrue(d.n4.hasCombination(List.of(d.ya, d.xa)));
        assertTrue(d.n4.hasCombination(List.of(d.ya, d.xa)));

        SolverMetrics metrics = solver.calculateMetrics();
        assertEquals(3, metrics.queryMetrics().size());
        QueryMetrics shortCircuited = metrics.queryMetrics().get(0);
        assertTrue(shortCircuited.isShortCircuited());
        assertEquals(d.n2.getId(), shortCircuited.getStartNode());
        assertEquals(2, shortCircuited.getInitialGoals());

        QueryMetrics joint = metrics.queryMetrics().get(1);
        assertFalse(joint.isShortCircuited());
        assertTrue(joint.getNodesVisited() > 0);
        assertTrue(joint.getTotalGoals() >= joint.getInitialGoals());

        QueryMetrics repeat = metrics.queryMetrics().get(2);
        assertTrue(repeat.isFromCache());
        assertEquals(0, repeat.getNodesVisited());
        assertTrue(metrics.cacheHits() > 0);
        assertTrue(metrics.cacheSize() > 0);
    }

    @Test
    public void testListenerSeesEveryStep() {
        Diamond d = new Diamond(EngineConfig.defaults());
        List<SearchStep> steps = new ArrayList<>();
        Solver solver = new Solver(d.p, steps::add);
        assertTrue(solver.solve(List.of(d.ya), d.n4));

        SearchStep root = steps.get(steps.size() - 1);
        assertEquals(0, root.depth());
        assertSame(d.n4, root.position());
        assertEquals(Outcome.SOLVED, root.outcome());
        assertTrue(root.solvable());
        assertTrue(steps.stream().anyMatch(s -> s.position() == d.n2));
    }

    private static List<Set<Binding>> subsets(List<Binding> pool) {
        List<Set<Binding>> result = new ArrayList<>();
        for (int mask = 0; mask < (1 << pool.size()); mask++) {
            Set<Binding> set = new LinkedHashSet<>();
            for (int i = 0; i < pool.size(); i++) {
                if ((mask & (1 << i)) != 0) set.add(pool.get(i));
            }
            result.add(set);
        }
        return result;
    }
}
