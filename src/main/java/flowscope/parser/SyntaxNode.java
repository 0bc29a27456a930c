package flowscope.parser;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of a parse-tree node. The analyses only ever navigate the
 * tree through these queries.
 */
public interface SyntaxNode {

    NodeKind kind();

    /** Named children in source order; punctuation and keywords are not children */
    List<SyntaxNode> children();

    /** The child stored under a tree-sitter field name such as {@code condition} or {@code body} */
    Optional<SyntaxNode> childByField(String field);

    /**
     * All nodes of the given kinds in the subtree rooted here, in pre-order.
     * The node itself is included when it matches.
     */
    List<SyntaxNode> descendantsOfKind(NodeKind... kinds);

    Span span();

    /** The exact slice of the source buffer covered by this node */
    String text();

    /** Operator token of binary, unary, update and assignment expressions, empty otherwise */
    Optional<String> operator();

    Optional<SyntaxNode> parent();

    default boolean is(NodeKind kind) {
        return kind() == kind;
    }
}
