package flowscope.parser;

/**
 * Raised when the source buffer does not conform to the C subset accepted
 * by the grammar.
 */
public class SourceParseException extends RuntimeException {
    private final int line;
    private final int column;

    public SourceParseException(int line, int column, String message) {
        super(String.format("line %d:%d %s", line, column, message));
        this.line = line;
        this.column = column;
    }

    public int getLine() {
        return line;
    }

    public int getColumn() {
        return column;
    }
}
