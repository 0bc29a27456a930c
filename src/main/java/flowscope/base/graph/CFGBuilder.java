package flowscope.base.graph;

import flowscope.base.constraint.EntryConstraintExtractor;
import flowscope.base.node.*;
import flowscope.parser.NodeKind;
import flowscope.parser.SyntaxNode;
import flowscope.utils.AnalysisOptions;
import flowscope.utils.Logging;

import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;

import java.util.*;

/**
 * Rewrites a statement sequence into a {@link ControlFlowGraph}.
 * <p>
 * The sequence is first chained between START and END. A sweep then walks
 * the graph breadth-first from START and replaces the first composite
 * statement it meets (block, label, if, switch, loop) by the nodes it stands
 * for; after every replacement the sweep starts over from START, until a
 * full walk finds nothing left to replace. Gotos and returns are wired last.
 * <p>
 * Loops are modelled as "body runs at most once or is skipped": no back
 * edge is ever added. Only gotos can close a cycle.
 */
public class CFGBuilder {
    private final AnalysisOptions options;
    private final EntryConstraintExtractor extractor;

    private Graph<FlowNode, DefaultEdge> graph;
    private FlowNodeArena arena;
    private LabelTable labels;
    private BorderNode start;
    private BorderNode end;
    private int rewrites;

    public CFGBuilder(AnalysisOptions options) {
        this.options = options;
        this.extractor = new EntryConstraintExtractor(options);
    }

    public CFGBuilder() {
        this(AnalysisOptions.defaults());
    }

    /**
     * @throws UnsupportedStatementException if a statement has no rewrite rule
     * @throws MissingLabelException if a goto names an undefined label
     */
    public ControlFlowGraph build(List<SyntaxNode> statements) {
        graph = new DefaultDirectedGraph<>(DefaultEdge.class);
        arena = new FlowNodeArena();
        labels = new LabelTable();
        rewrites = 0;

        start = arena.border(true);
        end = arena.border(false);
        graph.addVertex(start);
        FlowNode prev = start;
        for (var statement : statements) {
            FlowNode cur = arena.statement(statement);
            graph.addVertex(cur);
            graph.addEdge(prev, cur);
            prev = cur;
        }
        graph.addVertex(end);
        graph.addEdge(prev, end);

        while (sweepOnce()) {
            rewrites++;
        }
        resolveGotos();
        rerouteReturns();

        Logging.debug("CFG", String.format("Built CFG: %d statements, %d rewrites, %d nodes, %d edges",
                statements.size(), rewrites, graph.vertexSet().size(), graph.edgeSet().size()));
        return new ControlFlowGraph(graph, start, end, arena, labels, options);
    }

    /**
     * One breadth-first walk from START.
     * @return true if a node was rewritten, meaning the walk has to restart
     */
    private boolean sweepOnce() {
        Deque<FlowNode> workList = new ArrayDeque<>();
        Set<FlowNode> visited = new HashSet<>();
        workList.add(start);
        visited.add(start);

        while (!workList.isEmpty()) {
            FlowNode cur = workList.poll();
            if (cur instanceof StatementNode stmtNode && rewrite(stmtNode)) {
                return true;
            }
            for (var succ : Graphs.successorListOf(graph, cur)) {
                if (visited.add(succ)) {
                    workList.add(succ);
                }
            }
        }
        return false;
    }

    private boolean rewrite(StatementNode node) {
        var kind = node.getStatementKind();
        boolean rewritten = switch (kind) {
            case COMPOUND -> {
                rewriteCompound(node);
                yield true;
            }
            case LABELED -> {
                rewriteLabeled(node);
                yield true;
            }
            case IF -> {
                rewriteIf(node);
                yield true;
            }
            case SWITCH -> {
                rewriteSwitch(node);
                yield true;
            }
            case FOR -> {
                rewriteLoop(node, LoopNode.LoopKind.FOR);
                yield true;
            }
            case WHILE -> {
                rewriteLoop(node, LoopNode.LoopKind.WHILE);
                yield true;
            }
            case DO -> {
                rewriteDo(node);
                yield true;
            }
            case RETURN, GOTO, BREAK, CONTINUE, EXPRESSION, DECLARATION -> false;
        };
        if (!rewritten) {
            return false;
        }
        if (Logging.isTraceEnabled()) {
            Logging.trace("CFG", String.format("Rewrote %s at %s", kind, node.getSpan()));
        }
        return true;
    }

    private void rewriteCompound(StatementNode node) {
        var children = node.statement.children();
        if (children.isEmpty()) {
            bridge(node);
            return;
        }
        var chain = chain(children);
        replace(node, List.of(chain.get(0)), List.of(chain.get(chain.size() - 1)));
    }

    private void rewriteLabeled(StatementNode node) {
        var labelNode = node.statement.childByField("label")
                .orElseThrow(() -> new UnsupportedStatementException(node.statement));
        SyntaxNode inner = null;
        for (var child : node.statement.children()) {
            if (child != labelNode) {
                inner = child;
            }
        }
        if (inner == null) {
            throw new UnsupportedStatementException(node.statement);
        }
        var innerNode = addNode(arena.statement(inner));
        replace(node, List.of(innerNode), List.of(innerNode));
        labels.bind(labelNode.text(), innerNode.handle);
    }

    private void rewriteIf(StatementNode node) {
        var stmt = node.statement;
        var condition = requireField(stmt, "condition");
        var disjuncts = extractor.entryConstraints(condition);
        var yes = addNode(arena.ifCondition(condition, true, disjuncts,
                EntryConstraintExtractor.commonOf(disjuncts)));
        var no = addNode(arena.ifCondition(condition, false, yes.getEntryConstraints(),
                yes.getCommonEntryConstraints()));

        var preds = Graphs.predecessorListOf(graph, node);
        var succs = Graphs.successorListOf(graph, node);
        linkAll(preds, yes);
        linkAll(preds, no);

        var consequence = addNode(arena.statement(requireField(stmt, "consequence")));
        graph.addEdge(yes, consequence);
        linkAll(consequence, succs);

        var alternative = stmt.childByField("alternative");
        if (alternative.isPresent()) {
            var altNode = addNode(arena.statement(alternative.get()));
            graph.addEdge(no, altNode);
            linkAll(altNode, succs);
        } else {
            linkAll(no, succs);
        }
        retire(node, List.of(yes, no));
    }

    /** Cases are dispatched from every predecessor; consecutive cases are not linked */
    private void rewriteSwitch(StatementNode node) {
        var stmt = node.statement;
        var body = requireField(stmt, "body");
        List<SyntaxNode> cases = new ArrayList<>();
        for (var child : body.children()) {
            if (child.is(NodeKind.CASE_STATEMENT)) {
                cases.add(child);
            }
        }
        if (cases.isEmpty()) {
            bridge(node);
            return;
        }

        var preds = Graphs.predecessorListOf(graph, node);
        var succs = Graphs.successorListOf(graph, node);
        List<FlowNode> entries = new ArrayList<>();
        for (var caseStmt : cases) {
            var switchNode = addNode(arena.switchCase(stmt, caseStmt));
            entries.add(switchNode);
            linkAll(preds, switchNode);
            var caseBody = switchNode.getCaseBody();
            if (caseBody.isEmpty()) {
                linkAll(switchNode, succs);
                continue;
            }
            var chain = chain(caseBody);
            graph.addEdge(switchNode, chain.get(0));
            linkAll(chain.get(chain.size() - 1), succs);
        }
        retire(node, entries);
    }

    private void rewriteLoop(StatementNode node, LoopNode.LoopKind loopKind) {
        var stmt = node.statement;
        var yes = addNode(arena.loop(loopKind, stmt, true));
        var no = addNode(arena.loop(loopKind, stmt, false));

        var preds = Graphs.predecessorListOf(graph, node);
        var succs = Graphs.successorListOf(graph, node);
        linkAll(preds, yes);
        linkAll(preds, no);

        var body = stmt.childByField("body");
        if (body.isPresent()) {
            var bodyNode = addNode(arena.statement(body.get()));
            graph.addEdge(yes, bodyNode);
            linkAll(bodyNode, succs);
        } else {
            linkAll(yes, succs);
        }
        linkAll(no, succs);
        retire(node, List.of(yes, no));
    }

    private void rewriteDo(StatementNode node) {
        var stmt = node.statement;
        var bodyNode = addNode(arena.statement(requireField(stmt, "body")));
        var test = addNode(arena.doWhile(stmt));
        graph.addEdge(bodyNode, test);
        replace(node, List.of(bodyNode), List.of(test));
    }

    /** For every goto, drop its sequential edges and jump to the label's current nodes */
    private void resolveGotos() {
        List<StatementNode> gotos = new ArrayList<>();
        for (var node : graph.vertexSet()) {
            if (node instanceof StatementNode stmtNode && stmtNode.getStatementKind() == StatementKind.GOTO) {
                gotos.add(stmtNode);
            }
        }
        for (var gotoNode : gotos) {
            graph.removeAllEdges(new ArrayList<>(graph.outgoingEdgesOf(gotoNode)));
        }
        for (var gotoNode : gotos) {
            String label = requireField(gotoNode.statement, "label").text();
            var targets = labels.targets(label)
                    .orElseThrow(() -> new MissingLabelException(label, gotoNode.toString()));
            for (var handle : targets) {
                graph.addEdge(gotoNode, arena.get(handle));
            }
            Logging.trace("CFG", String.format("goto %s -> %d node(s)", label, targets.size()));
        }
    }

    private void rerouteReturns() {
        List<StatementNode> returns = new ArrayList<>();
        for (var node : graph.vertexSet()) {
            if (node instanceof StatementNode stmtNode && stmtNode.getStatementKind() == StatementKind.RETURN) {
                returns.add(stmtNode);
            }
        }
        for (var returnNode : returns) {
            graph.removeAllEdges(new ArrayList<>(graph.outgoingEdgesOf(returnNode)));
            graph.addEdge(returnNode, end);
        }
    }

    /* ------------------------------------------------------------- helpers */

    private <N extends FlowNode> N addNode(N node) {
        graph.addVertex(node);
        return node;
    }

    private List<FlowNode> chain(List<SyntaxNode> statements) {
        List<FlowNode> chain = new ArrayList<>();
        FlowNode prev = null;
        for (var statement : statements) {
            FlowNode cur = addNode(arena.statement(statement));
            if (prev != null) {
                graph.addEdge(prev, cur);
            }
            chain.add(cur);
            prev = cur;
        }
        return chain;
    }

    private void linkAll(List<FlowNode> preds, FlowNode to) {
        for (var pred : preds) {
            graph.addEdge(pred, to);
        }
    }

    private void linkAll(FlowNode from, List<FlowNode> succs) {
        for (var succ : succs) {
            graph.addEdge(from, succ);
        }
    }

    /** Splice {@code entries..exits} in place of {@code node} */
    private void replace(FlowNode node, List<FlowNode> entries, List<FlowNode> exits) {
        var preds = Graphs.predecessorListOf(graph, node);
        var succs = Graphs.successorListOf(graph, node);
        for (var entry : entries) {
            linkAll(preds, entry);
        }
        for (var exit : exits) {
            linkAll(exit, succs);
        }
        retire(node, entries);
    }

    /** Remove {@code node}, linking its predecessors straight to its successors */
    private void bridge(FlowNode node) {
        var preds = Graphs.predecessorListOf(graph, node);
        var succs = Graphs.successorListOf(graph, node);
        for (var pred : preds) {
            linkAll(pred, succs);
        }
        retire(node, succs);
    }

    private void retire(FlowNode node, List<FlowNode> replacements) {
        List<Integer> handles = new ArrayList<>();
        for (var replacement : replacements) {
            handles.add(replacement.handle);
        }
        labels.replace(node.handle, handles);
        graph.removeVertex(node);
        arena.retire(node);
    }

    private static SyntaxNode requireField(SyntaxNode stmt, String field) {
        return stmt.childByField(field)
                .orElseThrow(() -> new UnsupportedStatementException(stmt));
    }
}
