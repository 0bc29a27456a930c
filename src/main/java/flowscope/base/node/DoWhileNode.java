package flowscope.base.node;

import flowscope.parser.SyntaxNode;

/**
 * The trailing test of a {@code do ... while}.
 */
public class DoWhileNode extends FlowNode {
    public final SyntaxNode doStatement;

    public DoWhileNode(int handle, SyntaxNode doStatement) {
        super(handle);
        this.doStatement = doStatement;
    }

    public String getCondition() {
        return doStatement.childByField("condition").map(SyntaxNode::text).orElse("");
    }

    @Override
    public boolean isSynthetic() {
        return true;
    }

    @Override
    public int hashCode() {
        return doStatement.span().hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof DoWhileNode other && doStatement.span().equals(other.doStatement.span());
    }

    @Override
    public String toString() {
        return "[do-while][](" + getCondition() + ")";
    }
}
