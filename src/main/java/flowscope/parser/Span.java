package flowscope.parser;

/**
 * Location of a syntax node: character offsets into the source buffer plus
 * the line/column of both ends. Lines start at 1, columns at 0.
 */
public class Span implements Comparable<Span> {
    public final int startOffset;
    public final int endOffset;
    public final int startLine;
    public final int startColumn;
    public final int endLine;
    public final int endColumn;

    public Span(int startOffset, int endOffset,
                int startLine, int startColumn,
                int endLine, int endColumn) {
        if (endOffset < startOffset) {
            throw new IllegalArgumentException(
                    String.format("Span ends before it starts: [%d, %d)", startOffset, endOffset));
        }
        this.startOffset = startOffset;
        this.endOffset = endOffset;
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
    }

    public int length() {
        return endOffset - startOffset;
    }

    /** Whether the other span lies within this one, bounds inclusive */
    public boolean encloses(Span other) {
        return startOffset <= other.startOffset && other.endOffset <= endOffset;
    }

    @Override
    public int compareTo(Span other) {
        if (startOffset != other.startOffset) {
            return Integer.compare(startOffset, other.startOffset);
        }
        return Integer.compare(endOffset, other.endOffset);
    }

    @Override
    public int hashCode() {
        return startOffset * 31 + endOffset;
    }

    @Override
    public boolean equals(Object obj) {
        if (obj == this) {
            return true;
        }
        if (!(obj instanceof Span other)) {
            return false;
        }
        return startOffset == other.startOffset && endOffset == other.endOffset;
    }

    @Override
    public String toString() {
        return String.format("%d:%d-%d:%d", startLine, startColumn, endLine, endColumn);
    }
}
