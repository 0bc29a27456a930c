package flowscope.base.graph;

import flowscope.base.node.*;
import flowscope.parser.Span;
import flowscope.parser.SyntaxNode;

import java.util.*;

/**
 * Owns every flow node of one CFG build and hands out stable integer
 * handles. Statement nodes are deduplicated by span so that the same
 * statement always maps to the same node.
 */
public class FlowNodeArena {
    private final List<FlowNode> nodes = new ArrayList<>();
    private final Map<Span, StatementNode> bySpan = new HashMap<>();
    private final BitSet retired = new BitSet();

    public BorderNode border(boolean isStart) {
        return register(new BorderNode(nodes.size(), isStart));
    }

    public StatementNode statement(SyntaxNode statement) {
        var existing = bySpan.get(statement.span());
        if (existing != null) {
            return existing;
        }
        var node = register(new StatementNode(nodes.size(), statement));
        bySpan.put(statement.span(), node);
        return node;
    }

    public IfConditionNode ifCondition(SyntaxNode condition, boolean taken,
                                       List<List<SyntaxNode>> entryConstraints,
                                       List<SyntaxNode> commonEntryConstraints) {
        return register(new IfConditionNode(nodes.size(), condition, taken,
                entryConstraints, commonEntryConstraints));
    }

    public LoopNode loop(LoopNode.LoopKind kind, SyntaxNode loop, boolean taken) {
        return register(new LoopNode(nodes.size(), kind, loop, taken));
    }

    public DoWhileNode doWhile(SyntaxNode doStatement) {
        return register(new DoWhileNode(nodes.size(), doStatement));
    }

    public SwitchNode switchCase(SyntaxNode switchStatement, SyntaxNode caseStatement) {
        return register(new SwitchNode(nodes.size(), switchStatement, caseStatement));
    }

    private <N extends FlowNode> N register(N node) {
        nodes.add(node);
        return node;
    }

    /** @throws IllegalStateException if the node has been replaced in the graph */
    public FlowNode get(int handle) {
        if (handle < 0 || handle >= nodes.size()) {
            throw new IllegalArgumentException("Unknown flow node handle " + handle);
        }
        if (retired.get(handle)) {
            throw new IllegalStateException("Flow node " + handle + " was replaced: " + nodes.get(handle));
        }
        return nodes.get(handle);
    }

    /** Mark a node as replaced; its handle is never reused */
    public void retire(FlowNode node) {
        retired.set(node.handle);
    }
}
