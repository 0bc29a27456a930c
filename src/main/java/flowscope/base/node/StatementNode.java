package flowscope.base.node;

import flowscope.parser.Span;
import flowscope.parser.SyntaxNode;

/**
 * Wraps a source statement; its identity in the arena is the statement's span.
 */
public class StatementNode extends FlowNode {
    public final SyntaxNode statement;

    public StatementNode(int handle, SyntaxNode statement) {
        super(handle);
        this.statement = statement;
    }

    public Span getSpan() {
        return statement.span();
    }

    /** @throws UnsupportedStatementException for kinds the builder has no rule for */
    public StatementKind getStatementKind() {
        return StatementKind.of(statement);
    }

    @Override
    public boolean isSynthetic() {
        return false;
    }

    @Override
    public int hashCode() {
        return getSpan().hashCode();
    }

    @Override
    public boolean equals(Object obj) {
        return obj instanceof StatementNode other && getSpan().equals(other.getSpan());
    }

    @Override
    public String toString() {
        return statement.text();
    }
}
