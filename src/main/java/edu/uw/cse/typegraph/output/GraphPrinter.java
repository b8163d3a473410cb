package edu.uw.cse.typegraph.output;

import edu.uw.cse.typegraph.graph.*;

import java.io.*;
import java.nio.file.Path;
import java.util.*;

/**
 * Prints a Program's CFG and bindings in text and DOT (Graphviz) format.
 *
 * DOT color scheme:
 *   entrypoint         -> double circle
 *   node in a chain    -> filled box, one pastel color per supernode
 *   singleton node     -> plain box
 *   highlighted node   -> thick red border
 *   CFG edge           -> solid arrow
 */
public class GraphPrinter {

    private static final String[] CHAIN_COLORS = {
        "palegreen", "lightblue", "lightsalmon", "khaki", "plum", "lightcyan", "wheat", "thistle"
    };

    /**
     * Print a text summary of the program to stdout.
     */
    public static void printTextSummary(Program program) {
        System.out.print(formatTextSummary(program));
    }

    public static String formatTextSummary(Program program) {
        StringWriter sw = new StringWriter();
        PrintWriter out = new PrintWriter(sw);

        out.println("--- Program (" + (program.isFrozen() ? "frozen" : "mutable") + ") ---");
        if (program.getEntrypoint() != null) {
            out.println("Entrypoint: " + program.getEntrypoint().label());
        }
        out.println();

        out.println("Nodes:");
        if (program.getNodes().isEmpty()) {
            out.println("  (none)");
        }
        for (CfgNode node : program.getNodes()) {
            StringBuilder line = new StringBuilder("  " + node.label());
            if (!node.getOutgoing().isEmpty()) {
                line.append(" -> ").append(labels(node.getOutgoing()));
            }
            if (node.getCondition() != null) {
                line.append("  if ").append(node.getCondition());
            }
            if (node.getSupernode() != null && node.getSupernode().size() > 1) {
                line.append("  [S").append(node.getSupernode().getId())
                    .append(":").append(node.getPosition()).append("]");
            }
            out.println(line);
        }
        out.println();

        out.println("Variables:");
        if (program.getVariables().isEmpty()) {
            out.println("  (none)");
        }
        for (Variable variable : program.getVariables()) {
            out.println("  " + variable.getName() + " (" + variable.size() + " bindings)");
            for (Binding binding : variable.getBindings()) {
                out.println("    " + binding.getId() + ": " + binding.getData());
                for (Origin origin : binding.getOrigins()) {
                    List<String> sets = new ArrayList<>();
                    for (SourceSet sourceSet : origin.getSourceSets()) {
                        sets.add(formatSourceSet(sourceSet));
                    }
                    out.println("      at " + origin.getWhere().label() + " from " + String.join(" | ", sets));
                }
            }
        }
        out.println();
        out.flush();
        return sw.toString();
    }

    private static String formatSourceSet(SourceSet sourceSet) {
        List<String> parts = new ArrayList<>();
        for (Binding b : sourceSet) {
            parts.add(b.getVariable().getName() + "=" + b.getData());
        }
        return "{" + String.join(", ", parts) + "}";
    }

    private static String labels(List<CfgNode> nodes) {
        List<String> result = new ArrayList<>();
        for (CfgNode n : nodes) {
            result.add(n.label());
        }
        return String.join(", ", result);
    }

    public static String generateDotString(Program program, String label) {
        return generateDotString(program, label, Set.of());
    }

    /**
     * Generate a DOT string for the CFG. Nodes in {@code highlight} get a red border.
     */
    public static String generateDotString(Program program, String label, Set<CfgNode> highlight) {
        StringWriter sw = new StringWriter();
        PrintWriter out = new PrintWriter(sw);

        out.println("digraph \"" + escapeDot(label) + "\" {");
        out.println("  node [fontname=\"Helvetica\", fontsize=10];");
        out.println("  edge [fontname=\"Helvetica\", fontsize=9];");
        out.println();

        for (CfgNode node : program.getNodes()) {
            out.println("  n" + node.getId() + " [" + dotNodeAttrs(program, node) + "];");
        }
        out.println();

        for (CfgNode node : program.getNodes()) {
            for (CfgNode succ : node.getOutgoing()) {
                out.println("  n" + node.getId() + " -> n" + succ.getId() + ";");
            }
        }

        for (CfgNode node : highlight) {
            out.println("  n" + node.getId() + " [penwidth=3.0, color=red];");
        }

        out.println("}");
        out.flush();
        return sw.toString();
    }

    public static void writeDotFile(Program program, String label) {
        writeDotFile(program, label, Path.of("dot-graph"));
    }

    /**
     * Write a DOT file for the CFG into {@code dir}, named after the label.
     */
    public static void writeDotFile(Program program, String label, Path dir) {
        String fileName = sanitizeFileName(label) + ".dot";
        File dotDir = dir.toFile();
        if (!dotDir.exists()) {
            dotDir.mkdirs();
        }

        try (PrintWriter out = new PrintWriter(new FileWriter(new File(dotDir, fileName)))) {
            out.print(generateDotString(program, label));
            System.out.println("DOT output written to: " + dir.resolve(fileName));
        } catch (IOException e) {
            System.err.println("Error writing DOT file " + dir.resolve(fileName) + ": " + e.getMessage());
        }
    }

    /**
     * Draw the graph below {@code root} as an ASCII tree, following outgoing
     * edges when {@code forward} is set and incoming edges otherwise.
     * Nodes already drawn are shown in brackets and not expanded again.
     */
    public static String asciiTree(CfgNode root, boolean forward) {
        StringBuilder sb = new StringBuilder();
        Set<CfgNode> seen = new HashSet<>();
        Deque<TreeLine> stack = new ArrayDeque<>();
        stack.push(new TreeLine(root, "", ""));
        while (!stack.isEmpty()) {
            TreeLine line = stack.pop();
            CfgNode node = line.node();
            if (!seen.add(node)) {
                sb.append(line.prefix()).append('[').append(node.label()).append("]\n");
                continue;
            }
            sb.append(line.prefix()).append(node.label()).append('\n');
            List<CfgNode> children = forward ? node.getOutgoing() : node.getIncoming();
            // pushed in reverse so the first child is drawn first
            for (int i = children.size() - 1; i >= 0; i--) {
                boolean last = i == children.size() - 1;
                String connector = line.indent() + "|\n" + line.indent() + "+-";
                stack.push(new TreeLine(children.get(i), connector,
                                        line.indent() + (last ? "  " : "| ")));
            }
        }
        return sb.toString();
    }

    private record TreeLine(CfgNode node, String prefix, String indent) {
    }

    // --- Helpers ---

    private static String dotNodeAttrs(Program program, CfgNode node) {
        String label = "label=\"" + escapeDot(node.label()) + "\"";
        if (node == program.getEntrypoint()) {
            return label + ", shape=doublecircle";
        }
        Supernode chain = node.getSupernode();
        if (chain != null && chain.size() > 1) {
            String color = CHAIN_COLORS[chain.getId() % CHAIN_COLORS.length];
            return label + ", shape=box, style=filled, fillcolor=" + color;
        }
        return label + ", shape=box";
    }

    /**
     * Generate a safe filename base from a label (no extension).
     */
    public static String sanitizeFileName(String label) {
        String name = label.replaceAll("[<>: (),/{}=]", "_")
                           .replaceAll("_+", "_")
                           .replaceAll("^_|_$", "");
        if (name.length() > 80) {
            name = name.substring(0, 80);
        }
        return name.isEmpty() ? "graph" : name;
    }

    static String escapeDot(String s) {
        return s.replace("\\", "\\\\")
                .replace("\"", "\\\"");
    }
}
