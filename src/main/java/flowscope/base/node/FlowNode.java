package flowscope.base.node;

/**
 * A vertex of a {@link flowscope.base.graph.ControlFlowGraph}. Nodes are
 * owned by the arena of the graph that created them; {@link #handle} is their
 * stable index in that arena. Equality does not involve the handle: a
 * statement node is identified by its source span, a synthetic node by its
 * kind and the spans of the syntax it was derived from, so two builds of the
 * same source yield equal nodes.
 */
public abstract class FlowNode {
    public final int handle;

    protected FlowNode(int handle) {
        this.handle = handle;
    }

    /** Whether the node was introduced by the builder rather than taken from the source */
    public abstract boolean isSynthetic();
}
