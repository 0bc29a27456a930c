package flowscope.base.graph;

import flowscope.base.node.BorderNode;
import flowscope.base.node.FlowNode;
import flowscope.base.node.FunctionDefinition;
import flowscope.parser.SyntaxNode;
import flowscope.utils.AnalysisOptions;
import flowscope.utils.Logging;

import org.jgrapht.Graph;
import org.jgrapht.GraphPath;
import org.jgrapht.Graphs;
import org.jgrapht.alg.shortestpath.AllDirectedPaths;
import org.jgrapht.graph.DefaultEdge;

import java.util.*;

/**
 * The result of {@link CFGBuilder}: flow nodes between a START and an END
 * sentinel. Immutable once built.
 */
public class ControlFlowGraph {
    private final Graph<FlowNode, DefaultEdge> graph;
    private final BorderNode start;
    private final BorderNode end;
    private final FlowNodeArena arena;
    private final LabelTable labels;
    private final AnalysisOptions options;

    ControlFlowGraph(Graph<FlowNode, DefaultEdge> graph, BorderNode start, BorderNode end,
                     FlowNodeArena arena, LabelTable labels, AnalysisOptions options) {
        this.graph = graph;
        this.start = start;
        this.end = end;
        this.arena = arena;
        this.labels = labels;
        this.options = options;
    }

    public static ControlFlowGraph build(List<SyntaxNode> statements) {
        return new CFGBuilder().build(statements);
    }

    public static ControlFlowGraph build(List<SyntaxNode> statements, AnalysisOptions options) {
        return new CFGBuilder(options).build(statements);
    }

    /** CFG of a function body, braces excluded */
    public static ControlFlowGraph of(FunctionDefinition function) {
        return build(function.getBodyStatements());
    }

    public static ControlFlowGraph of(FunctionDefinition function, AnalysisOptions options) {
        return build(function.getBodyStatements(), options);
    }

    public BorderNode getStart() {
        return start;
    }

    public BorderNode getEnd() {
        return end;
    }

    /** Nodes in creation order of the surviving vertices */
    public Set<FlowNode> getNodes() {
        return Collections.unmodifiableSet(graph.vertexSet());
    }

    public int getNumNodes() {
        return graph.vertexSet().size();
    }

    public int getNumEdges() {
        return graph.edgeSet().size();
    }

    public List<FlowNode> getSuccessors(FlowNode node) {
        return Graphs.successorListOf(graph, node);
    }

    public List<FlowNode> getPredecessors(FlowNode node) {
        return Graphs.predecessorListOf(graph, node);
    }

    public boolean hasEdge(FlowNode from, FlowNode to) {
        return graph.containsEdge(from, to);
    }

    public boolean containsNode(FlowNode node) {
        return graph.containsVertex(node);
    }

    /** Final label table: label text to the nodes a goto to it enters */
    public Map<String, List<FlowNode>> getLabels() {
        Map<String, List<FlowNode>> result = new LinkedHashMap<>();
        for (var label : labels.labels()) {
            List<FlowNode> targets = new ArrayList<>();
            for (var handle : labels.targets(label).orElse(Set.of())) {
                targets.add(arena.get(handle));
            }
            result.put(label, Collections.unmodifiableList(targets));
        }
        return Collections.unmodifiableMap(result);
    }

    /**
     * Every simple path from START to END with the sentinels stripped. The
     * number of paths is exponential in the number of branches; with
     * {@code maxPathLength} set, longer paths are not reported.
     */
    public List<List<FlowNode>> getExecutionPaths() {
        var allPaths = new AllDirectedPaths<>(graph)
                .getAllPaths(start, end, true, options.maxPathLength);
        List<List<FlowNode>> result = new ArrayList<>();
        for (GraphPath<FlowNode, DefaultEdge> path : allPaths) {
            var vertices = path.getVertexList();
            result.add(List.copyOf(vertices.subList(1, vertices.size() - 1)));
        }
        Logging.debug("CFG", "Enumerated " + result.size() + " execution path(s)");
        return result;
    }

    /**
     * Coalesce straight-line chains into basic blocks. A node starts a new
     * block unless it has exactly one predecessor whose only successor it is.
     * The graph itself is not modified.
     */
    public List<BasicBlock> getBasicBlocks() {
        List<BasicBlock> blocks = new ArrayList<>();
        Set<FlowNode> assigned = new HashSet<>();
        for (var node : graph.vertexSet()) {
            if (assigned.contains(node) || !isLeader(node)) {
                continue;
            }
            blocks.add(collectBlock(node, blocks.size(), assigned));
        }
        // Cycles of non-leaders can only be entered by a goto into their middle
        for (var node : graph.vertexSet()) {
            if (!assigned.contains(node)) {
                blocks.add(collectBlock(node, blocks.size(), assigned));
            }
        }
        return blocks;
    }

    private boolean isLeader(FlowNode node) {
        if (node == start || node == end || graph.inDegreeOf(node) != 1) {
            return true;
        }
        var pred = Graphs.predecessorListOf(graph, node).get(0);
        return pred == node || graph.outDegreeOf(pred) != 1 || pred == start;
    }

    private BasicBlock collectBlock(FlowNode leader, int id, Set<FlowNode> assigned) {
        List<FlowNode> members = new ArrayList<>();
        FlowNode cur = leader;
        while (true) {
            members.add(cur);
            assigned.add(cur);
            if (cur == end || graph.outDegreeOf(cur) != 1) {
                break;
            }
            var next = Graphs.successorListOf(graph, cur).get(0);
            if (assigned.contains(next) || isLeader(next)) {
                break;
            }
            cur = next;
        }
        return new BasicBlock(id, members);
    }

    public String toGraphviz(String name) {
        Map<FlowNode, String> ids = new HashMap<>();
        StringBuilder builder = new StringBuilder();
        builder.append("digraph ").append(name).append(" {\n");
        for (var node : graph.vertexSet()) {
            String id = "n" + node.handle;
            ids.put(node, id);
            builder.append("  ").append(id).append(" [label=\"").append(escape(node.toString())).append("\"");
            if (node.isSynthetic()) {
                builder.append(", shape=box");
            }
            builder.append("];\n");
        }
        for (var edge : graph.edgeSet()) {
            builder.append("  ").append(ids.get(graph.getEdgeSource(edge)))
                    .append(" -> ").append(ids.get(graph.getEdgeTarget(edge))).append(";\n");
        }
        builder.append("}");
        return builder.toString();
    }

    public String toGraphviz() {
        return toGraphviz("CFG");
    }

    private static String escape(String text) {
        return text.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
