package flowscope.base.graph;

import flowscope.base.node.FlowNode;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A maximal straight-line chain of flow nodes.
 */
public class BasicBlock {
    public final int id;
    private final List<FlowNode> nodes;

    public BasicBlock(int id, List<FlowNode> nodes) {
        if (nodes.isEmpty()) {
            throw new IllegalArgumentException("Empty basic block");
        }
        this.id = id;
        this.nodes = List.copyOf(nodes);
    }

    public List<FlowNode> getNodes() {
        return nodes;
    }

    public FlowNode getLeader() {
        return nodes.get(0);
    }

    public FlowNode getLast() {
        return nodes.get(nodes.size() - 1);
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(FlowNode node) {
        return nodes.contains(node);
    }

    @Override
    public String toString() {
        return "BB" + id + nodes.stream().map(FlowNode::toString).collect(Collectors.joining(" | ", "[", "]"));
    }
}
