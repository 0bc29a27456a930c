package flowscope.base.node;

import flowscope.parser.SyntaxNode;

/**
 * The statement forms the CFG builder models. Every other parse-tree kind
 * is rejected by {@link #of(SyntaxNode)}.
 */
public enum StatementKind {
    COMPOUND,
    LABELED,
    IF,
    SWITCH,
    FOR,
    WHILE,
    DO,
    RETURN,
    GOTO,
    BREAK,
    CONTINUE,
    EXPRESSION,
    DECLARATION;

    public static StatementKind of(SyntaxNode statement) {
        return switch (statement.kind()) {
            case COMPOUND_STATEMENT -> COMPOUND;
            case LABELED_STATEMENT -> LABELED;
            case IF_STATEMENT -> IF;
            case SWITCH_STATEMENT -> SWITCH;
            case FOR_STATEMENT -> FOR;
            case WHILE_STATEMENT -> WHILE;
            case DO_STATEMENT -> DO;
            case RETURN_STATEMENT -> RETURN;
            case GOTO_STATEMENT -> GOTO;
            case BREAK_STATEMENT -> BREAK;
            case CONTINUE_STATEMENT -> CONTINUE;
            case EXPRESSION_STATEMENT -> EXPRESSION;
            case DECLARATION -> DECLARATION;
            default -> throw new UnsupportedStatementException(statement);
        };
    }
}
