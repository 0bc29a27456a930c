package flowscope.analyzer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import flowscope.base.graph.CallGraph;
import flowscope.base.graph.ControlFlowGraph;
import flowscope.base.node.FlowNode;
import flowscope.base.node.FunctionDefinition;
import flowscope.utils.Logging;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.*;

/**
 * Results of one {@link SourceAnalyzer} run and their JSON / DOT dumps.
 */
public class AnalysisReport {
    public static class FunctionResult {
        public final FunctionDefinition function;
        public final String id;
        public final ControlFlowGraph cfg;
        public final List<List<FlowNode>> paths;
        public final String error;

        FunctionResult(FunctionDefinition function, String id, ControlFlowGraph cfg,
                       List<List<FlowNode>> paths, String error) {
            this.function = function;
            this.id = id;
            this.cfg = cfg;
            this.paths = paths;
            this.error = error;
        }

        public boolean isFailed() {
            return error != null;
        }
    }

    private final String sourceName;
    private final CallGraph callGraph;
    private final Map<String, FunctionResult> results = new LinkedHashMap<>();
    private final ObjectMapper mapper = new ObjectMapper();

    public AnalysisReport(String sourceName, CallGraph callGraph) {
        this.sourceName = sourceName;
        this.callGraph = callGraph;
        mapper.enable(SerializationFeature.INDENT_OUTPUT);
    }

    void addFunction(FunctionDefinition function, ControlFlowGraph cfg, List<List<FlowNode>> paths) {
        var id = uniqueId(function);
        results.put(id, new FunctionResult(function, id, cfg, paths, null));
    }

    void addFailure(FunctionDefinition function, RuntimeException error) {
        var id = uniqueId(function);
        results.put(id, new FunctionResult(function, id, null, List.of(), error.getMessage()));
    }

    // Two definitions may share a name, the second one gets its line appended
    private String uniqueId(FunctionDefinition function) {
        var id = function.getName();
        if (results.containsKey(id)) {
            id = id + "_L" + function.getNode().span().startLine;
        }
        return id;
    }

    public String getSourceName() {
        return sourceName;
    }

    public CallGraph getCallGraph() {
        return callGraph;
    }

    public Collection<FunctionResult> getResults() {
        return Collections.unmodifiableCollection(results.values());
    }

    public Optional<FunctionResult> getResult(String id) {
        return Optional.ofNullable(results.get(id));
    }

    public List<FunctionResult> getFailures() {
        List<FunctionResult> failures = new ArrayList<>();
        for (var result : results.values()) {
            if (result.isFailed()) {
                failures.add(result);
            }
        }
        return failures;
    }

    public ObjectNode toJson() {
        var jsonRoot = mapper.createObjectNode();
        jsonRoot.put("source", sourceName);

        var functions = jsonRoot.putArray("functions");
        for (var result : results.values()) {
            functions.add(writeFunction(result));
        }
        jsonRoot.set("callGraph", writeCallGraph());
        return jsonRoot;
    }

    private ObjectNode writeFunction(FunctionResult result) {
        var func = result.function;
        var node = mapper.createObjectNode();
        node.put("name", func.getName());
        node.put("id", result.id);
        node.put("line", func.getNode().span().startLine);
        node.put("variadic", func.isVariadic());
        node.put("fixedParams", func.fixedParamNum());
        if (result.isFailed()) {
            node.put("status", "failed");
            node.put("error", result.error);
            return node;
        }
        node.put("status", "ok");
        node.put("nodes", result.cfg.getNumNodes());
        node.put("edges", result.cfg.getNumEdges());
        node.put("basicBlocks", result.cfg.getBasicBlocks().size());

        var labels = node.putObject("labels");
        for (var entry : result.cfg.getLabels().entrySet()) {
            var targets = labels.putArray(entry.getKey());
            entry.getValue().forEach(target -> targets.add(target.toString()));
        }

        ArrayNode paths = node.putArray("paths");
        for (var path : result.paths) {
            var jsonPath = paths.addArray();
            path.forEach(step -> jsonPath.add(step.toString()));
        }
        return node;
    }

    private ObjectNode writeCallGraph() {
        var node = mapper.createObjectNode();
        var nodes = node.putArray("nodes");
        var edges = node.putArray("edges");
        for (var funcNode : callGraph.functionNodes) {
            nodes.add(funcNode.getName());
            for (var callee : callGraph.getCallees(funcNode)) {
                var edge = edges.addObject();
                edge.put("caller", funcNode.getName());
                edge.put("callee", callee.getName());
            }
        }
        var roots = node.putArray("roots");
        callGraph.roots.forEach(root -> roots.add(root.getName()));
        var leaves = node.putArray("leaves");
        callGraph.leafNodes.forEach(leaf -> leaves.add(leaf.getName()));
        return node;
    }

    /**
     * Dump {@code report.json}, {@code callgraph.dot} and one {@code cfg_<id>.dot}
     * per successfully analysed function into the directory.
     */
    public void writeTo(File outputDir) throws IOException {
        mapper.writeValue(new File(outputDir, "report.json"), toJson());
        Files.writeString(new File(outputDir, "callgraph.dot").toPath(), callGraph.toGraphviz(), StandardCharsets.UTF_8);
        for (var result : results.values()) {
            if (result.isFailed()) {
                continue;
            }
            var graphName = "cfg_" + result.id;
            Files.writeString(new File(outputDir, graphName + ".dot").toPath(),
                    result.cfg.toGraphviz(graphName), StandardCharsets.UTF_8);
        }
        Logging.info("AnalysisReport", "Wrote report of " + sourceName + " to " + outputDir);
    }
}
