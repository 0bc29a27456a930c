package flowscope.base.node;

import flowscope.parser.SyntaxNode;

/**
 * A statement kind the CFG builder has no rewrite rule for.
 */
public class UnsupportedStatementException extends UnsupportedOperationException {
    private final transient SyntaxNode statement;

    public UnsupportedStatementException(SyntaxNode statement) {
        super(String.format("Statement kind %s at %s is not supported yet", statement.kind(), statement.span()));
        this.statement = statement;
    }

    public SyntaxNode getStatement() {
        return statement;
    }
}
