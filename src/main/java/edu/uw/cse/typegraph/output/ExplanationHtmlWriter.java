package edu.uw.cse.typegraph.output;

import edu.uw.cse.typegraph.graph.CfgNode;
import edu.uw.cse.typegraph.graph.Program;
import edu.uw.cse.typegraph.solver.Explanation;
import edu.uw.cse.typegraph.solver.SearchStep;

import java.io.*;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;

/**
 * Writes one explained query as a self-contained HTML page: the CFG rendered
 * via viz.js with the blamed node highlighted, the search steps, and the verdict.
 */
public class ExplanationHtmlWriter implements Closeable {

    private final String title;
    private final Path outputPath;

    private String graphDot;
    private Explanation explanation;

    private ExplanationHtmlWriter(String title, Path outputPath) {
        this.title = title;
        this.outputPath = outputPath;
    }

    /**
     * Create a writer for a page under debug/. Creates the directory if needed.
     */
    public static ExplanationHtmlWriter create(String title) throws IOException {
        return create(title, Path.of("debug"));
    }

    public static ExplanationHtmlWriter create(String title, Path dir) throws IOException {
        Files.createDirectories(dir);
        Path filePath = dir.resolve(GraphPrinter.sanitizeFileName(title) + "_explain.html");
        return new ExplanationHtmlWriter(title, filePath);
    }

    public Path getOutputPath() {
        return outputPath;
    }

    /** Record the explanation and render the program's CFG around it. */
    public void setExplanation(Program program, Explanation explanation) {
        this.explanation = explanation;
        Set<CfgNode> highlight = new LinkedHashSet<>();
        explanation.getBlame().ifPresent(step -> highlight.add(step.position()));
        this.graphDot = GraphPrinter.generateDotString(program, title, highlight);
    }

    @Override
    public void close() throws IOException {
        try (PrintWriter out = new PrintWriter(new BufferedWriter(new FileWriter(outputPath.toFile())))) {
            writeHtml(out);
        }
        System.out.println("Explanation HTML written to: " + outputPath);
    }

    private void writeHtml(PrintWriter out) {
        out.println("<!DOCTYPE html>");
        out.println("<html lang=\"en\">");
        out.println("<head>");
        out.println("<meta charset=\"UTF-8\">");
        out.println("<title>Explain: " + escapeHtml(title) + "</title>");
        out.println("<script src=\"https://unpkg.com/@viz-js/viz@3.11.0/lib/viz-standalone.js\"></script>");
        out.println("<style>");
        out.println(CSS);
        out.println("</style>");
        out.println("</head>");
        out.println("<body>");

        out.println("<h1>Combination Query</h1>");
        out.println("<p class=\"query\">" + escapeHtml(title) + "</p>");

        if (explanation == null) {
            out.println("<p class=\"muted\">No explanation recorded.</p>");
            out.println("</body>");
            out.println("</html>");
            return;
        }

        out.println("<h2>Goals</h2>");
        out.println("<p class=\"data\">" + escapeHtml(explanation.getGoals().toString()) + " at "
            + escapeHtml(explanation.getViewpoint().label()) + "</p>");

        out.println("<h2>Control Flow Graph</h2>");
        out.println("<div class=\"graph-container\" id=\"cfg\">");
        out.println("<p class=\"loading\">Rendering graph...</p>");
        out.println("</div>");

        out.println("<h2>Search Steps</h2>");
        if (explanation.getSteps().isEmpty()) {
            out.println("<p class=\"muted\">No states were searched.</p>");
        }
        out.println("<pre class=\"steps\">");
        for (SearchStep step : explanation.getSteps()) {
            String cls = step.solvable() ? "ok" : "fail";
            out.println("<span class=\"" + cls + "\">" + "  ".repeat(step.depth())
                + escapeHtml(step.position().label() + " " + step.goals() + " -> " + step.outcome())
                + "</span>");
        }
        out.println("</pre>");

        out.println("<h2>Verdict</h2>");
        String verdictClass = explanation.isSolvable() ? "possible" : "impossible";
        out.println("<p class=\"verdict " + verdictClass + "\">"
            + (explanation.isSolvable() ? "POSSIBLE" : "IMPOSSIBLE") + "</p>");
        out.println("<pre class=\"data\">" + escapeHtml(explanation.describe()) + "</pre>");

        out.println("<script>");
        out.println("const dot = " + jsStringLiteral(graphDot) + ";");
        out.println("if (typeof Viz !== 'undefined') {");
        out.println("  Viz.instance().then(viz => {");
        out.println("    const container = document.getElementById('cfg');");
        out.println("    try {");
        out.println("      container.innerHTML = '';");
        out.println("      container.appendChild(viz.renderSVGElement(dot));");
        out.println("    } catch (e) {");
        out.println("      container.innerHTML = '<pre class=\"error\">' + e.message + '</pre>';");
        out.println("    }");
        out.println("  });");
        out.println("} else {");
        out.println("  document.getElementById('cfg').innerHTML = '<p class=\"error\">viz.js failed to load. DOT source:</p><pre>' + dot + '</pre>';");
        out.println("}");
        out.println("</script>");

        out.println("</body>");
        out.println("</html>");
    }

    static String escapeHtml(String s) {
        return s.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }

    /**
     * Encode a string as a JavaScript template literal, escaping backticks,
     * backslashes and ${.
     */
    private static String jsStringLiteral(String s) {
        String escaped = s.replace("\\", "\\\\")
                          .replace("`", "\\`")
                          .replace("${", "\\${");
        return "`" + escaped + "`";
    }

    private static final String CSS = """
        body {
            font-family: -apple-system, BlinkMacSystemFont, 'Segoe UI', Roboto, sans-serif;
            max-width: 1200px;
            margin: 0 auto;
            padding: 20px 40px;
            color: #333;
        }
        h1 { border-bottom: 3px solid #16213e; padding-bottom: 10px; }
        h2 { border-bottom: 2px solid #e2e8f0; padding-bottom: 8px; margin-top: 32px; }
        .query, .data {
            font-family: 'JetBrains Mono', monospace;
            font-size: 14px;
            background: #f1f5f9;
            padding: 8px 16px;
            border-radius: 6px;
        }
        .steps {
            background: #1e1e2e;
            color: #cdd6f4;
            padding: 16px 20px;
            border-radius: 8px;
            font-size: 13px;
            line-height: 1.5;
            overflow-x: auto;
        }
        .steps .ok { color: #a6e3a1; }
        .steps .fail { color: #f38ba8; }
        .graph-container {
            border: 1px solid #e2e8f0;
            border-radius: 8px;
            padding: 16px;
            overflow-x: auto;
            min-height: 60px;
        }
        .graph-container svg { max-width: 100%; height: auto; }
        .verdict { font-size: 20px; font-weight: bold; padding: 12px 20px; border-radius: 8px; display: inline-block; }
        .possible { color: #166534; background: #dcfce7; }
        .impossible { color: #991b1b; background: #fee2e2; }
        .loading, .muted { color: #9ca3af; font-style: italic; }
        .error { color: #dc2626; }
        """;
}
