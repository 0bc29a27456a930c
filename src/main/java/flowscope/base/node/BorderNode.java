package flowscope.base.node;

/**
 * The START and END sentinels.
 */
public class BorderNode extends FlowNode {
    public final boolean isStart;

    public BorderNode(int handle, boolean isStart) {
        super(handle);
        this.isStart = isStart;
    }

    @Override
    public boolean isSynthetic() {
        return true;
    }

    @Override
    public int hashCode() {
        return Boolean.hashCode(isStart);
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof BorderNode other && isStart == other.isStart;
    }

    @Override
    public String toString() {
        return isStart ? "<START>" : "<END>";
    }
}
