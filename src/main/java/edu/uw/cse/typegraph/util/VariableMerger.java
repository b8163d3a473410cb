package edu.uw.cse.typegraph.util;

import edu.uw.cse.typegraph.graph.Binding;
import edu.uw.cse.typegraph.graph.CfgNode;
import edu.uw.cse.typegraph.graph.Program;
import edu.uw.cse.typegraph.graph.Variable;

import java.util.*;

/**
 * Combines several temporary results into one Variable, e.g. the return
 * values of every callee a call site may reach.
 */
public class VariableMerger {

    /**
     * Merge {@code variables} at {@code node}.
     * No input gives a fresh empty Variable. If every input is the same
     * Variable, that Variable is returned unchanged. Otherwise a new Variable
     * receives every binding pasted at {@code node}.
     */
    public static Variable mergeVariables(Program program, CfgNode node, List<Variable> variables) {
        if (variables.isEmpty()) {
            return program.newVariable();
        }
        Variable first = variables.get(0);
        boolean allSame = true;
        for (Variable v : variables) {
            if (v != first) {
                allSame = false;
                break;
            }
        }
        if (allSame) return first;

        Variable merged = program.newVariable();
        for (Variable v : variables) {
            merged.pasteVariable(v, node);
        }
        return merged;
    }

    /**
     * A new Variable holding each of {@code bindings}, pasted at {@code node}.
     */
    public static Variable mergeBindings(Program program, CfgNode node, List<Binding> bindings) {
        Variable merged = program.newVariable();
        for (Binding b : bindings) {
            merged.pasteBinding(b, node);
        }
        return merged;
    }
}
