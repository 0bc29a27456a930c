package flowscope.analyzer;

import flowscope.base.constraint.ConstraintLimitException;
import flowscope.base.graph.CallGraph;
import flowscope.base.graph.ControlFlowGraph;
import flowscope.base.graph.MissingLabelException;
import flowscope.base.node.FunctionDefinition;
import flowscope.base.node.UnsupportedStatementException;
import flowscope.parser.SourceParser;
import flowscope.parser.SyntaxNode;
import flowscope.utils.AnalysisOptions;
import flowscope.utils.Logging;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs every analysis over one C source: the call graph across all its
 * function definitions and a CFG with execution paths per function.
 * A function whose CFG cannot be built is reported as failed and does not
 * stop the others.
 */
public class SourceAnalyzer {
    private final AnalysisOptions options;

    public SourceAnalyzer(AnalysisOptions options) {
        this.options = options;
    }

    public AnalysisReport analyze(Path file) throws IOException {
        return analyze(file.toString(), SourceParser.parse(file));
    }

    public AnalysisReport analyze(String sourceName, String source) {
        return analyze(sourceName, SourceParser.parse(source));
    }

    public AnalysisReport analyze(String sourceName, SyntaxNode root) {
        long begin = System.currentTimeMillis();
        var functions = FunctionDefinition.collect(root);
        Logging.info("SourceAnalyzer", String.format("%s: %d function definition(s)", sourceName, functions.size()));

        var report = new AnalysisReport(sourceName, CallGraph.build(functions));
        for (var func : functions) {
            try {
                var cfg = ControlFlowGraph.of(func, options);
                var paths = cfg.getExecutionPaths();
                report.addFunction(func, cfg, paths);
                Logging.debug("SourceAnalyzer", String.format("%s: %d nodes, %d path(s)",
                        func.getName(), cfg.getNumNodes(), paths.size()));
            } catch (UnsupportedStatementException | MissingLabelException | ConstraintLimitException e) {
                Logging.error("SourceAnalyzer", String.format("Cannot build CFG for %s: %s", func.getName(), e.getMessage()));
                report.addFailure(func, e);
            }
        }

        Logging.info("SourceAnalyzer", String.format("Analysis of %s done in %.2fs, %d failed",
                sourceName, (System.currentTimeMillis() - begin) / 1000.00, report.getFailures().size()));
        return report;
    }
}
