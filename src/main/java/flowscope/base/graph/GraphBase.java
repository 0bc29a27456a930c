package flowscope.base.graph;

import flowscope.base.node.NodeBase;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

public abstract class GraphBase<T> {

    /** Map from node's value to node, in insertion order */
    private final Map<T, NodeBase<T>> valueToNode = new LinkedHashMap<>();

    /** Number of nodes in the graph */
    protected int node_cnt = 0;

    /**
     * Get a Node for the given value from the graph.
     * This may create a new node if needed.
     * @param value The node's value
     * @return the graph node.
     */
    public NodeBase<T> getNode(T value) {
        if (valueToNode.containsKey(value)) {
            return valueToNode.get(value);
        }

        NodeBase<T> res = createNode(value, node_cnt);

        valueToNode.put(value, res);
        node_cnt++;
        return res;
    }

    /** Whether the value has a node, without creating one */
    public boolean hasNode(T value) {
        return valueToNode.containsKey(value);
    }

    protected NodeBase<T> findNode(T value) {
        return valueToNode.get(value);
    }

    public Set<T> getValues() {
        return new LinkedHashSet<>(valueToNode.keySet());
    }

    public int getNumNodes() {
        return node_cnt;
    }

    /**
     * Create a graph edge with source and destination.
     * This also creates the graph node of the given parameters if needed.
     * @param from the source node's value
     * @param to the destination node's value
     */
    public void addEdge(T from, T to) {
        NodeBase<T> src = getNode(from);
        NodeBase<T> dst = getNode(to);
        if (src.succ.add(dst)) {
            dst.pred.add(src);
        }
    }

    public boolean hasEdge(T from, T to) {
        NodeBase<T> src = findNode(from);
        NodeBase<T> dst = findNode(to);
        return src != null && dst != null && src.succ.contains(dst);
    }

    /**
     * Return the value's successors
     * @param value the node value
     * @return the successors, empty if the value has no node
     */
    public Set<T> getSuccs(T value) {
        Set<T> res = new LinkedHashSet<>();
        NodeBase<T> tmp = findNode(value);
        if (tmp == null) {
            return res;
        }
        for (NodeBase<T> node : tmp.succ) {
            res.add(node.value);
        }
        return res;
    }

    /**
     * Return the value's predecessors
     * @param value the node value
     * @return the predecessors, empty if the value has no node
     */
    public Set<T> getPreds(T value) {
        Set<T> res = new LinkedHashSet<>();
        NodeBase<T> tmp = findNode(value);
        if (tmp == null) {
            return res;
        }
        for (NodeBase<T> node : tmp.pred) {
            res.add(node.value);
        }
        return res;
    }

    /**
     * Check if the graph has a path of at least one edge from src to dst
     * @param from The src node
     * @param to The dst node
     * @return True if it has a path from src to dst
     */
    public boolean hasPath(T from, T to) {
        NodeBase<T> src = findNode(from);
        NodeBase<T> dst = findNode(to);
        if (src == null || dst == null) {
            return false;
        }

        Deque<NodeBase<T>> workList = new ArrayDeque<>();
        Set<NodeBase<T>> visited = new HashSet<>();
        workList.add(src);
        while (!workList.isEmpty()) {
            var cur = workList.poll();
            for (var succ : cur.succ) {
                if (succ == dst) {
                    return true;
                }
                if (visited.add(succ)) {
                    workList.add(succ);
                }
            }
        }
        return false;
    }

    /**
     * Create a graph node with the given value.
     * @param value the node's value
     * @return the graph node
     */
    protected abstract NodeBase<T> createNode(T value, int node_id);
}
